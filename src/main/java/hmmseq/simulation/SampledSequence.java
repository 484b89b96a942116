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
package hmmseq.simulation;

/**
 * Sequence of symbols together with the path of states that emitted them
 */
public class SampledSequence {
	private final String sequence;
	private final int [] states;

	public SampledSequence(String sequence, int[] states) {
		super();
		if(sequence.length()!=states.length) throw new IllegalArgumentException("Sequence of length "+sequence.length()+" is not consistent with path of "+states.length+" states");
		this.sequence = sequence;
		this.states = states.clone();
	}
	public String getSequence() {
		return sequence;
	}
	public int[] getStates() {
		return states.clone();
	}
	public int length() {
		return states.length;
	}
}
