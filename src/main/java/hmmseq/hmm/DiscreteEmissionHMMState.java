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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import hmmseq.math.LogMath;
import hmmseq.math.NumberArrays;

/**
 * State emitting symbols of a finite alphabet with fixed probabilities
 */
public class DiscreteEmissionHMMState implements HMMState {
	private final String id;
	private final double start;
	private final double logStart;
	private final String alphabet;
	private final double [] emissions;
	private final double [] logEmissions;
	private final Map<Character,Double> emissionDistribution;

	/**
	 * Creates a new state
	 * @param id of the state
	 * @param start Probability of starting at this state
	 * @param alphabet Symbols that can be emitted
	 * @param emissions Probability of emission of each symbol in the alphabet. Must sum to one
	 * @throws IllegalArgumentException If the emissions are not consistent with the alphabet or do not make a distribution
	 */
	public DiscreteEmissionHMMState(String id, double start, String alphabet, double [] emissions) {
		super();
		this.id = id;
		if(!(start>=0 && start<=1)) throw new IllegalArgumentException("Invalid start probability "+start+" for state "+id);
		if(alphabet.length()!=emissions.length) throw new IllegalArgumentException("State "+id+" has "+emissions.length+" emission probabilities for an alphabet of "+alphabet.length()+" symbols");
		NumberArrays.validateDistribution(emissions, "emissions of state "+id);
		this.start = start;
		this.logStart = LogMath.log(start);
		this.alphabet = alphabet;
		this.emissions = emissions.clone();
		this.logEmissions = LogMath.logs(emissions);
		Map<Character,Double> distribution = new LinkedHashMap<Character, Double>();
		for(int i=0;i<alphabet.length();i++) {
			char symbol = alphabet.charAt(i);
			if(distribution.containsKey(symbol)) throw new IllegalArgumentException("Duplicated symbol "+symbol+" in the alphabet of state "+id);
			distribution.put(symbol, emissions[i]);
		}
		emissionDistribution = Collections.unmodifiableMap(distribution);
	}

	@Override
	public String getId() {
		return id;
	}

	@Override
	public double getStart() {
		return start;
	}

	@Override
	public double getLogStart() {
		return logStart;
	}

	@Override
	public double getLogEmission(int symbolIndex) {
		return logEmissions[symbolIndex];
	}

	@Override
	public Map<Character, Double> getEmissionDistribution() {
		return emissionDistribution;
	}

	public String getAlphabet() {
		return alphabet;
	}

	public double [] getEmissions() {
		return emissions.clone();
	}
}
