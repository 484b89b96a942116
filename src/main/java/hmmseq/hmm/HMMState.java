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

import java.util.Map;

public interface HMMState {
	/**
	 * Returns the id of the state
	 * @return String id assigned to the state
	 */
	public String getId();
	/**
	 * Returns the probability of starting at this state
	 * @return double probability of starting at this state
	 */
	public double getStart();
	/**
	 * Returns the natural logarithm of the probability of starting at this state
	 * @return double log of the probability of starting at this state
	 * Minus infinity if the probability is zero
	 */
	public double getLogStart();
	/**
	 * Returns the natural logarithm of the probability of emission of the symbol at the given index of the alphabet
	 * @param symbolIndex Position of the symbol in the alphabet of the state
	 * @return double log of the probability of observing the given symbol
	 * Minus infinity if the probability is zero
	 */
	public double getLogEmission(int symbolIndex);
	/**
	 * Returns the emission distribution of this state keyed by symbol
	 * @return Map<Character,Double> Unmodifiable map with the emission probabilities in alphabet order
	 */
	public Map<Character,Double> getEmissionDistribution();
}
