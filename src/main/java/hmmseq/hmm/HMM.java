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

public interface HMM {

	/**
	 * Returns the natural logarithm of the probability of transition between the source and
	 * the dest states
	 * @param source First state
	 * @param dest Second state
	 * @return double log of the transition probability between source and dest.
	 * Minus infinity if the probability is zero
	 */
	public double getLogTransition(int source, int dest);
	/**
	 * Returns the natural logarithm of the emission probability of the given symbol by the given state
	 * @param state From which the symbol is emitted
	 * @param symbol observed symbol
	 * @return double log of the emission probability of the given symbol by the given state
	 * Minus infinity if the probability is zero
	 * @throws IllegalArgumentException If the symbol does not belong to the alphabet
	 */
	public double getLogEmission(int state, char symbol);
	/**
	 * Returns the natural logarithm of the initial probability of the given state
	 * @param state Potential initial state
	 * @return double log of the probability of starting at the given state
	 * Minus infinity if the probability is zero
	 */
	public double getLogStart(int state);
	/**
	 * Returns the state at the given position
	 * @param state Position of the state in the HMM
	 * @return HMMState Object representing the state
	 */
	public HMMState getState(int state);
	/**
	 * Returns the number of states
	 * @return int number of states
	 */
	public int getNumStates();
	/**
	 * Returns the symbols that can be emitted by the states of this model
	 * @return String with one character per symbol
	 */
	public String getAlphabet();
	/**
	 * Translates the given observations to positions in the alphabet
	 * @param observations Sequence of observed symbols
	 * @return int [] Index in the alphabet of each observed symbol
	 * @throws IllegalArgumentException If a symbol does not belong to the alphabet
	 */
	public int [] encodeObservations (CharSequence observations);
	/**
	 * Calculate forward log probabilities for each state at each step
	 * @param observations Sequence of observed symbols
	 * @param forwardLogs Output matrix with as many rows as observations and as many columns as states.
	 * It is designed as a parameter instead of a return value to avoid constant reallocation.
	 * Forward values include the emission probability at each step
	 * @return double log of the probability of the data given the HMM
	 */
	public double calculateForward(CharSequence observations, double [][] forwardLogs);
	/**
	 * Calculates the joint log probability of the given observations and the given path of states
	 * @param observations Sequence of observed symbols
	 * @param states Path of states. Must have the same length of the observations
	 * @return double natural logarithm of the joint probability. Minus infinity if the path is not possible
	 */
	public double calculateLogProbability(CharSequence observations, int [] states);
	/**
	 * Calculates the path of states with the best probability
	 * @param observations to calculate the path with the best probability
	 * @param path Output path. Must have the same length of the observations
	 * @return double Logarithm of the probability of the best path. Minus infinity if all paths have zero probability
	 */
	public double getViterbiPath (CharSequence observations, int [] path );
}
