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

import hmmseq.hmm.ConstantTransitionHMM;
import hmmseq.math.MultinomialSampler;

/**
 * Generates sequences of symbols and paths of states following the parameters of an HMM
 */
public class HMMSequenceSampler {
	private final ConstantTransitionHMM hmm;
	private final MultinomialSampler sampler;
	private final double [][] transitions;

	/**
	 * Creates a sampler for the given model
	 * @param hmm Model to sample from
	 * @param sampler Draws the outcomes of the discrete distributions of the model
	 * @throws IllegalArgumentException If the model or the sampler are null
	 */
	public HMMSequenceSampler(ConstantTransitionHMM hmm, MultinomialSampler sampler) {
		super();
		if(hmm==null) throw new IllegalArgumentException("An HMM is required to sample sequences");
		if(sampler==null) throw new IllegalArgumentException("A multinomial sampler is required to sample sequences");
		this.hmm = hmm;
		this.sampler = sampler;
		int n = hmm.getNumStates();
		transitions = new double[n][];
		for(int j=0;j<n;j++) transitions[j] = hmm.getTransitions(j);
	}

	public ConstantTransitionHMM getHmm() {
		return hmm;
	}

	/**
	 * Walks the HMM starting from a state drawn from the start probabilities. At each step, the
	 * current state emits a symbol and the next state is drawn from the transitions of the current state
	 * @param length Number of symbols to generate
	 * @return SampledSequence with the generated symbols and the states that emitted them
	 */
	public SampledSequence sample(int length) {
		if(length<1) throw new IllegalArgumentException("The length of the simulated sequence must be positive. Value: "+length);
		int [] states = new int[length];
		StringBuilder sequence = new StringBuilder(length);
		int current = sampler.sample(hmm.getStarts());
		for(int i=0;i<length;i++) {
			states[i] = current;
			sequence.append(emit(current));
			current = sampler.sample(transitions[current]);
		}
		return new SampledSequence(sequence.toString(), states);
	}

	/**
	 * Generates independently one symbol for each of the given states
	 * @param states Path of states
	 * @return String Symbols emitted by the given states
	 */
	public String generateSequence(int [] states) {
		int n = hmm.getNumStates();
		StringBuilder sequence = new StringBuilder(states.length);
		for(int i=0;i<states.length;i++) {
			if(states[i]<0 || states[i]>=n) throw new IllegalArgumentException("State "+states[i]+" at position "+i+" is not valid for an HMM with "+n+" states");
			sequence.append(emit(states[i]));
		}
		return sequence.toString();
	}

	private char emit(int state) {
		return sampler.sample(hmm.getState(state).getEmissionDistribution());
	}
}
