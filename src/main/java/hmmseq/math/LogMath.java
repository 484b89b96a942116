/*******************************************************************************
 * HMMSeq - Hidden Markov models for sequences of symbols
 * Copyright 2026 HMMSeq contributors
 *
 * This file is part of HMMSeq.
 *
 *     HMMSeq is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     HMMSeq is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with HMMSeq.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package hmmseq.math;

/**
 * Class with static methods performing basic math operations that receive and
 * return natural logarithms of the values to operate. Zero probabilities are represented
 * as Double.NEGATIVE_INFINITY
 */
public class LogMath {
	public static final double MAXLOGDIFF=46;
	/**
	 * Sum of probabilities, also scalable to small values.
	 * The sum is calculated as p+q = log(p)+log(1+exp(log(q)-log(p)))
	 * @param log1 natural logarithm of the first probability to add
	 * @param log2 natural logarithm of the second probability to add
	 * @return double logarithm of the sum of the probabilities. Minus infinity if both parameters are minus infinity (0+0=0)
	 */
	public static double logSum (double log1, double log2) {
		if(log2==Double.NEGATIVE_INFINITY) return log1;
		if(log1==Double.NEGATIVE_INFINITY) return log2;
		if(log1-log2>MAXLOGDIFF) return log1;
		if(log2-log1>MAXLOGDIFF) return log2;
		return log1 + Math.log1p(Math.exp(log2-log1));
	}

	/**
	 * Product of two probabilities
	 * @param log1 Log of the first probability
	 * @param log2 Log of the second probability
	 * @return double sum of the two logarithms. Minus infinity if either parameter is minus infinity (0*x=0)
	 */
	public static double logProduct (double log1, double log2) {
		if(log1==Double.NEGATIVE_INFINITY || log2==Double.NEGATIVE_INFINITY) return Double.NEGATIVE_INFINITY;
		return log1+log2;
	}
	/**
	 * Takes the natural logarithm of the given value
	 * @param value Value to take the logarithm
	 * @return double log(value). Minus infinity if value is less or equal than zero
	 */
	public static double log (double value) {
		if(value > 0) return Math.log(value);
		return Double.NEGATIVE_INFINITY;
	}
	/**
	 * Exponential of the given logarithm
	 * @param log natural logarithm of a probability
	 * @return double exp(log). Zero if log is minus infinity
	 */
	public static double exp(double log) {
		if(log==Double.NEGATIVE_INFINITY) return 0;
		return Math.exp(log);
	}

	public static double [] logs (double [] values) {
		double [] answer = new double[values.length];
		for(int i=0;i<values.length;i++) answer[i] = log(values[i]);
		return answer;
	}
}
