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
import java.util.Map;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Draws outcomes from discrete distributions using a single uniform draw of the
 * given random number generator per call
 */
public class MultinomialSampler {
	private Logger log = Logger.getLogger(MultinomialSampler.class.getName());
	private final Random random;

	public MultinomialSampler(Random random) {
		super();
		if(random==null) throw new IllegalArgumentException("A random number generator is required");
		this.random = random;
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}

	/**
	 * Samples an index according to the given probabilities
	 * @param probs Probabilities of each index. Must sum to one
	 * @return int First index for which the cumulative probability exceeds a uniform draw.
	 * Zero if rounding errors exhaust the scan
	 */
	public int sample (double [] probs) {
		NumberArrays.validateDistribution(probs, "of "+probs.length+" outcomes");
		double r = random.nextDouble();
		for(int i=0;i<probs.length;i++) {
			if(r<probs[i]) return i;
			r-=probs[i];
		}
		log.fine("Scan exhausted with remainder "+r+". Returning the first outcome");
		return 0;
	}

	/**
	 * Samples a key according to the probabilities of the given map. Keys are scanned in the
	 * iteration order of the map
	 * @param probs Probability of each key. Must sum to one
	 * @return K Selected key. The first key if rounding errors exhaust the scan
	 */
	public <K> K sample (Map<K, Double> probs) {
		NumberArrays.validateDistribution(toArray(probs.values()), "of keys "+probs.keySet());
		double r = random.nextDouble();
		K first = null;
		for(Map.Entry<K, Double> entry:probs.entrySet()) {
			if(first==null) first = entry.getKey();
			double p = entry.getValue();
			if(r<p) return entry.getKey();
			r-=p;
		}
		log.fine("Scan exhausted with remainder "+r+". Returning the first key: "+first);
		return first;
	}

	private double[] toArray(Collection<Double> values) {
		double [] answer = new double[values.size()];
		int i=0;
		for(Double v:values) answer[i++] = (v!=null)?v:Double.NaN;
		return answer;
	}
}
