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

import java.util.Collection;

public class NumberArrays {

	public static final double PROBABILITY_SUM_TOLERANCE = 0.00001;

	public static int [] toIntArray (Collection<Integer> values) {
		int[] ret = new int[values.size()];
	    int i = 0;
	    for (Integer e : values) ret[i++] = e.intValue();
	    return ret;
	}

	/**
	 * Index of the maximum value. Ties are resolved in favor of the first maximum
	 * @param numbers Values to scan
	 * @return int index of the first maximum. -1 if the array is empty
	 */
	public static int getIndexMaximum (double [] numbers) {
		int idxMax = -1;
		for(int i=0;i<numbers.length;i++) {
			if(idxMax==-1 || numbers[idxMax]<numbers[i]) {
				idxMax = i;
			}
		}
		return idxMax;
	}
	public static double getSum (double [] numbers) {
		double sum = 0;
		for(int i=0;i<numbers.length;i++) sum+=numbers[i];
		return sum;
	}
	/**
	 * Counts the occurrences of each value in the range [0,n)
	 * @param values to count. All must be in the range [0,n)
	 * @param n Number of different values
	 * @return int[] Array of size n with the counts
	 */
	public static int [] getCounts (int [] values, int n) {
		int [] counts = new int[n];
		for(int i=0;i<values.length;i++) {
			if(values[i]<0 || values[i]>=n) throw new IllegalArgumentException("Value "+values[i]+" at position "+i+" is out of the range [0,"+n+")");
			counts[values[i]]++;
		}
		return counts;
	}
	/**
	 * Checks that the given values are non negative and sum to one within {@link #PROBABILITY_SUM_TOLERANCE}
	 * @param probs Probabilities to check
	 * @param description Name of the distribution for error reporting
	 * @throws IllegalArgumentException If the values do not make a valid distribution
	 */
	public static void validateDistribution (double [] probs, String description) {
		if(probs.length==0) throw new IllegalArgumentException("Distribution "+description+" is empty");
		for(int i=0;i<probs.length;i++) {
			if(!(probs[i]>=0)) throw new IllegalArgumentException("Invalid probability "+probs[i]+" at position "+i+" of distribution "+description);
		}
		double sum = getSum(probs);
		if(Math.abs(sum-1.0)>=PROBABILITY_SUM_TOLERANCE) throw new IllegalArgumentException("Probabilities of distribution "+description+" sum to "+sum+" instead of 1");
	}
}
