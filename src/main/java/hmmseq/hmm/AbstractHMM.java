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
package hmmseq.hmm;

import java.util.logging.Logger;

import hmmseq.math.LogMath;
import hmmseq.math.NumberArrays;


public abstract class AbstractHMM implements HMM {

	private Logger log = Logger.getLogger(AbstractHMM.class.getName());

	public Logger getLog() {
		return log;
	}

	public void setLog(Logger log) {
		this.log = log;
	}

	/**
	 * Returns the position of the given symbol in the alphabet of this HMM
	 * @param symbol to search
	 * @return int index of the symbol in the alphabet. -1 if the symbol is not part of the alphabet
	 */
	public abstract int getSymbolIndex(char symbol);

	@Override
	public double getLogEmission(int state, char symbol) {
		int idx = getSymbolIndex(symbol);
		if(idx<0) throw new IllegalArgumentException("Symbol "+symbol+" is not part of the alphabet "+getAlphabet());
		return getState(state).getLogEmission(idx);
	}

	@Override
	public double getLogStart(int state) {
		return getState(state).getLogStart();
	}

	@Override
	public int [] encodeObservations(CharSequence observations) {
		int m = observations.length();
		int [] answer = new int[m];
		for(int i=0;i<m;i++) {
			char symbol = observations.charAt(i);
			answer[i] = getSymbolIndex(symbol);
			if(answer[i]<0) throw new IllegalArgumentException("Symbol "+symbol+" at position "+i+" is not part of the alphabet "+getAlphabet());
		}
		return answer;
	}

	@Override
	public double calculateForward(CharSequence observations, double [][] forwardLogs) {
		int m = observations.length();
		int n = getNumStates();
		if(m==0) throw new IllegalArgumentException("The sequence of observations is empty");
		if(forwardLogs.length!=m || forwardLogs[0].length!=n) throw new IllegalArgumentException("Matrix for forward probabilities should have dimensions "+m+" x "+n);
		int [] symbols = encodeObservations(observations);
		for(int i=0;i<m;i++) {
			for(int j=0;j<n;j++) {
				double f;
				if(i==0) f = getLogStart(j);
				else {
					//The sum of probabilities starts with zero which in logarithm is represented as minus infinity
					f = Double.NEGATIVE_INFINITY;
					for(int k=0;k<n;k++) {
						f = LogMath.logSum(f, LogMath.logProduct(forwardLogs[i-1][k], getLogTransition(k, j)));
					}
				}
				forwardLogs[i][j] = LogMath.logProduct(f, getState(j).getLogEmission(symbols[i]));
			}
		}
		//Calculate final probability
		double logProb = Double.NEGATIVE_INFINITY;
		for(int j=0;j<n;j++) {
			logProb = LogMath.logSum(logProb, forwardLogs[m-1][j]);
		}
		return logProb;
	}

	@Override
	public double calculateLogProbability(CharSequence observations, int [] states) {
		int m = observations.length();
		if(m==0) throw new IllegalArgumentException("The sequence of observations is empty");
		if(states.length!=m) throw new IllegalArgumentException("The path of states has length "+states.length+" but the sequence of observations has length "+m);
		validateStates(states);
		int [] symbols = encodeObservations(observations);
		double logProb = LogMath.logProduct(getLogStart(states[0]), getState(states[0]).getLogEmission(symbols[0]));
		for(int i=1;i<m;i++) {
			double t = getLogTransition(states[i-1], states[i]);
			double e = getState(states[i]).getLogEmission(symbols[i]);
			logProb = LogMath.logProduct(LogMath.logProduct(logProb, t), e);
		}
		return logProb;
	}

	@Override
	public double getViterbiPath(CharSequence observations, int[] path) {
		int m = observations.length();
		int n = getNumStates();
		if(m==0) throw new IllegalArgumentException("The sequence of observations is empty");
		if(path.length!=m) throw new IllegalArgumentException("The output path has length "+path.length+" but the sequence of observations has length "+m);
		int [] symbols = encodeObservations(observations);
		log.fine("Creating decoding matrices of dimensions "+m+" x "+n);
		double [][] scores = new double[m][n];
		int [][] backpointers = new int [m][n];
		for(int j=0;j<n;j++) {
			scores[0][j] = LogMath.logProduct(getLogStart(j), getState(j).getLogEmission(symbols[0]));
		}
		for(int i=1;i<m;i++) {
			for(int j=0;j<n;j++) {
				//Strict comparison keeps the lowest predecessor on ties
				int bestK = 0;
				double best = LogMath.logProduct(scores[i-1][0], getLogTransition(0, j));
				for(int k=1;k<n;k++) {
					double next = LogMath.logProduct(scores[i-1][k], getLogTransition(k, j));
					if(next>best) {
						best = next;
						bestK = k;
					}
				}
				scores[i][j] = LogMath.logProduct(best, getState(j).getLogEmission(symbols[i]));
				backpointers[i][j] = bestK;
			}
		}
		path[m-1] = NumberArrays.getIndexMaximum(scores[m-1]);
		for(int i=m-1;i>0;i--) {
			path[i-1] = backpointers[i][path[i]];
		}
		return scores[m-1][path[m-1]];
	}

	/**
	 * Calculates the path of states with the best probability
	 * @param observations Sequence of observed symbols
	 * @return int [] Most likely state for each observation
	 */
	public int [] calculateViterbiPath(CharSequence observations) {
		int [] path = new int[observations.length()];
		getViterbiPath(observations, path);
		return path;
	}

	private void validateStates(int[] states) {
		int n = getNumStates();
		for(int i=0;i<states.length;i++) {
			if(states[i]<0 || states[i]>=n) throw new IllegalArgumentException("State "+states[i]+" at position "+i+" is not valid for an HMM with "+n+" states");
		}
	}
}
