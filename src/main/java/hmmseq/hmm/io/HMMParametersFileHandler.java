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
package hmmseq.hmm.io;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import hmmseq.hmm.ConstantTransitionHMM;
import hmmseq.hmm.DiscreteEmissionHMMState;

/**
 * Loads and writes the parameters of HMMs with discrete emissions. The format is made of
 * tab separated lines starting with one of the keywords ALPHABET, STATES, PRIOR, TRANSITION
 * or EMISSION. Lines starting with # are comments
 */
public class HMMParametersFileHandler {
	public static final String DEFAULT_HMM_RESOURCE = "hmmseq/hmm/io/GCContentHMM.txt";
	public static final String KEYWORD_ALPHABET = "ALPHABET";
	public static final String KEYWORD_STATES = "STATES";
	public static final String KEYWORD_PRIOR = "PRIOR";
	public static final String KEYWORD_TRANSITION = "TRANSITION";
	public static final String KEYWORD_EMISSION = "EMISSION";

	private Logger log = Logger.getLogger(HMMParametersFileHandler.class.getName());

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}

	/**
	 * Loads the HMM described in the given file or the default model if no file is given
	 * @param parametersFile Path to the parameters file. If null, the default GC content HMM is loaded
	 * @return ConstantTransitionHMM the loaded model
	 * @throws IOException If the file can not be read or if it does not describe a valid HMM
	 */
	public ConstantTransitionHMM loadHMMOrDefault(String parametersFile) throws IOException {
		ConstantTransitionHMM hmm;
		if(parametersFile==null) {
			log.info("Loading default GC content HMM");
			hmm = loadDefaultHMM();
		} else {
			log.info("Loading HMM parameters from: "+parametersFile);
			hmm = loadHMM(parametersFile);
		}
		log.info("Loaded HMM with "+hmm.getNumStates()+" states and alphabet "+hmm.getAlphabet());
		return hmm;
	}

	/**
	 * Loads the two states HMM of low and high GC content distributed as a resource
	 * @return ConstantTransitionHMM Default model
	 * @throws IOException If the resource can not be read
	 */
	public ConstantTransitionHMM loadDefaultHMM() throws IOException {
		try (InputStream in = this.getClass().getClassLoader().getResourceAsStream(DEFAULT_HMM_RESOURCE)) {
			if(in==null) throw new IOException("Resource "+DEFAULT_HMM_RESOURCE+" not found");
			try (InputStreamReader r = new InputStreamReader(in);
				 BufferedReader reader = new BufferedReader(r)) {
				return loadHMM(reader, DEFAULT_HMM_RESOURCE);
			}
		}
	}

	/**
	 * Loads an HMM from the given file
	 * @param filePath Path to the parameters file
	 * @return ConstantTransitionHMM Model with the parameters in the file
	 * @throws IOException If the file can not be read or if it does not describe a valid HMM
	 */
	public ConstantTransitionHMM loadHMM(String filePath) throws IOException {
		try (FileReader fr = new FileReader(filePath);
			 BufferedReader reader = new BufferedReader(fr)) {
			return loadHMM(reader, filePath);
		}
	}

	private ConstantTransitionHMM loadHMM(BufferedReader reader, String source) throws IOException {
		String alphabet = null;
		List<String> stateIds = null;
		double [] prior = null;
		Map<String,double []> transitions = new HashMap<String, double[]>();
		Map<String,double []> emissions = new HashMap<String, double[]>();
		int lineNumber = 0;
		String line = reader.readLine();
		while(line!=null) {
			lineNumber++;
			line = line.trim();
			if(line.length()>0 && !line.startsWith("#")) {
				String [] items = line.split("\t");
				String keyword = items[0];
				if(KEYWORD_ALPHABET.equals(keyword)) {
					if(items.length!=2 || items[1].length()==0) throw new IOException("Line "+lineNumber+" of "+source+" must have only the alphabet after the keyword "+keyword);
					alphabet = items[1];
				} else if(KEYWORD_STATES.equals(keyword)) {
					if(items.length<2) throw new IOException("Line "+lineNumber+" of "+source+" does not have state ids");
					stateIds = new ArrayList<String>();
					for(int i=1;i<items.length;i++) {
						if(stateIds.contains(items[i])) throw new IOException("Duplicated state id "+items[i]+" at line "+lineNumber+" of "+source);
						stateIds.add(items[i]);
					}
				} else if(KEYWORD_PRIOR.equals(keyword)) {
					prior = parseProbabilities(items, 1, lineNumber, source);
				} else if(KEYWORD_TRANSITION.equals(keyword) || KEYWORD_EMISSION.equals(keyword)) {
					if(stateIds==null) throw new IOException("Line "+lineNumber+" of "+source+" describes a state before the "+KEYWORD_STATES+" line");
					if(items.length<2 || !stateIds.contains(items[1])) throw new IOException("Unknown state at line "+lineNumber+" of "+source+": "+line);
					Map<String,double []> values = KEYWORD_TRANSITION.equals(keyword)?transitions:emissions;
					if(values.containsKey(items[1])) throw new IOException("Duplicated "+keyword+" line for state "+items[1]+" at line "+lineNumber+" of "+source);
					values.put(items[1], parseProbabilities(items, 2, lineNumber, source));
				} else {
					throw new IOException("Unrecognized keyword "+keyword+" at line "+lineNumber+" of "+source);
				}
			}
			line = reader.readLine();
		}
		if(alphabet==null) throw new IOException("Missing "+KEYWORD_ALPHABET+" line in "+source);
		if(stateIds==null) throw new IOException("Missing "+KEYWORD_STATES+" line in "+source);
		if(prior==null) throw new IOException("Missing "+KEYWORD_PRIOR+" line in "+source);
		int n = stateIds.size();
		if(prior.length!=n) throw new IOException("The "+KEYWORD_PRIOR+" line of "+source+" has "+prior.length+" values for "+n+" states");
		List<DiscreteEmissionHMMState> states = new ArrayList<DiscreteEmissionHMMState>(n);
		double [][] transitionsMatrix = new double[n][];
		try {
			for(int j=0;j<n;j++) {
				String id = stateIds.get(j);
				if(!emissions.containsKey(id)) throw new IOException("Missing "+KEYWORD_EMISSION+" line for state "+id+" in "+source);
				if(!transitions.containsKey(id)) throw new IOException("Missing "+KEYWORD_TRANSITION+" line for state "+id+" in "+source);
				states.add(new DiscreteEmissionHMMState(id, prior[j], alphabet, emissions.get(id)));
				transitionsMatrix[j] = transitions.get(id);
			}
			return new ConstantTransitionHMM(states, transitionsMatrix);
		} catch (IllegalArgumentException e) {
			throw new IOException("Invalid HMM parameters in "+source+". "+e.getMessage(),e);
		}
	}

	private double [] parseProbabilities(String [] items, int first, int lineNumber, String source) throws IOException {
		if(items.length<=first) throw new IOException("Line "+lineNumber+" of "+source+" does not have probabilities");
		double [] answer = new double[items.length-first];
		for(int i=first;i<items.length;i++) {
			try {
				answer[i-first] = Double.parseDouble(items[i]);
			} catch (NumberFormatException e) {
				throw new IOException("Invalid probability "+items[i]+" at line "+lineNumber+" of "+source,e);
			}
		}
		return answer;
	}

	/**
	 * Writes the parameters of the given HMM in the format read by this handler
	 * @param hmm Model to write
	 * @param out Stream to write the parameters
	 */
	public void printHMM(ConstantTransitionHMM hmm, PrintStream out) {
		int n = hmm.getNumStates();
		out.println(KEYWORD_ALPHABET+"\t"+hmm.getAlphabet());
		out.print(KEYWORD_STATES);
		for(int j=0;j<n;j++) out.print("\t"+hmm.getState(j).getId());
		out.println();
		out.print(KEYWORD_PRIOR);
		for(int j=0;j<n;j++) out.print("\t"+hmm.getState(j).getStart());
		out.println();
		for(int j=0;j<n;j++) {
			out.print(KEYWORD_TRANSITION+"\t"+hmm.getState(j).getId());
			for(int k=0;k<n;k++) out.print("\t"+hmm.getTransition(j, k));
			out.println();
		}
		for(int j=0;j<n;j++) {
			DiscreteEmissionHMMState state = hmm.getState(j);
			out.print(KEYWORD_EMISSION+"\t"+state.getId());
			for(double e:state.getEmissions()) out.print("\t"+e);
			out.println();
		}
	}
}
