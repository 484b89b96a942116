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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import hmmseq.math.LogMath;
import hmmseq.math.NumberArrays;

/**
 * HMM with discrete emissions and a transition matrix that does not change along the sequence.
 * Instances are immutable
 */
public class ConstantTransitionHMM extends AbstractHMM {
	private final List<DiscreteEmissionHMMState> states;
	private final int n;
	private final String alphabet;
	private final int [] symbolIndexes;
	private final double [][] transitions;
	private final double [][] logTransitions;

	/**
	 * Creates a new HMM
	 * @param states List of states. Start probabilities must sum to one and all states must share the same alphabet
	 * @param transitions Square matrix with as many rows as states. Each row must sum to one
	 * @throws IllegalArgumentException If the parameters do not make a valid HMM
	 */
	public ConstantTransitionHMM(List<DiscreteEmissionHMMState> states, double [][] transitions) {
		super();
		n = states.size();
		if(n==0) throw new IllegalArgumentException("The HMM must have at least one state");
		this.states = Collections.unmodifiableList(new ArrayList<DiscreteEmissionHMMState>(states));
		alphabet = states.get(0).getAlphabet();
		double [] starts = new double[n];
		for(int j=0;j<n;j++) {
			DiscreteEmissionHMMState state = states.get(j);
			if(!alphabet.equals(state.getAlphabet())) throw new IllegalArgumentException("Alphabet "+state.getAlphabet()+" of state "+state.getId()+" differs from alphabet "+alphabet+" of state "+states.get(0).getId());
			starts[j] = state.getStart();
		}
		NumberArrays.validateDistribution(starts, "of start probabilities");
		symbolIndexes = buildSymbolIndexes(alphabet);
		if(transitions.length!=n) throw new IllegalArgumentException("Transitions matrix should have the same number of rows as states of the HMM. States: "+n+" rows: "+transitions.length);
		this.transitions = new double[n][];
		this.logTransitions = new double[n][];
		for(int i=0;i<n;i++) {
			if(transitions[i].length!=n) throw new IllegalArgumentException("Transitions matrix should have the same number of columns as states of the HMM. States: "+n+" columns: "+transitions[i].length);
			NumberArrays.validateDistribution(transitions[i], "of transitions from state "+states.get(i).getId());
			this.transitions[i] = transitions[i].clone();
			this.logTransitions[i] = LogMath.logs(transitions[i]);
		}
	}

	private static int [] buildSymbolIndexes(String alphabet) {
		int max = 0;
		for(int i=0;i<alphabet.length();i++) max = Math.max(max, alphabet.charAt(i));
		int [] indexes = new int [max+1];
		Arrays.fill(indexes, -1);
		for(int i=0;i<alphabet.length();i++) {
			indexes[alphabet.charAt(i)] = i;
		}
		return indexes;
	}

	@Override
	public int getSymbolIndex(char symbol) {
		if(symbol>=symbolIndexes.length) return -1;
		return symbolIndexes[symbol];
	}

	@Override
	public double getLogTransition(int source, int dest) {
		return logTransitions[source][dest];
	}

	public double getTransition(int source, int dest) {
		return transitions[source][dest];
	}

	/**
	 * @param source State of origin
	 * @return double [] Copy of the probabilities of moving from the given state to each state
	 */
	public double [] getTransitions(int source) {
		return transitions[source].clone();
	}

	/**
	 * @return double [] Copy of the start probabilities of the states
	 */
	public double [] getStarts() {
		double [] starts = new double[n];
		for(int j=0;j<n;j++) starts[j] = states.get(j).getStart();
		return starts;
	}

	@Override
	public DiscreteEmissionHMMState getState(int state) {
		return states.get(state);
	}

	@Override
	public int getNumStates() {
		return n;
	}

	@Override
	public String getAlphabet() {
		return alphabet;
	}
}
