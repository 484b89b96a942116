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

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.logging.Logger;

import hmmseq.hmm.io.HMMParametersFileHandler;
import hmmseq.hmm.io.StatePathFileHandler;
import hmmseq.main.CommandsDescriptor;
import hmmseq.sequences.io.ObservationSequenceFileHandler;

/**
 * Calculates the joint probability of a sequence of symbols and a given path of states
 */
public class HMMStatePathScorer {

	private Logger log = Logger.getLogger(HMMStatePathScorer.class.getName());

	private ConstantTransitionHMM hmm = null;
	private String inputFile = null;
	private String statesFile = null;
	private String outputFile = null;

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	public ConstantTransitionHMM getHmm() {
		return hmm;
	}
	public void setHmm(ConstantTransitionHMM hmm) {
		this.hmm = hmm;
	}
	public void setHmm(String parametersFile) throws IOException {
		HMMParametersFileHandler handler = new HMMParametersFileHandler();
		handler.setLog(log);
		setHmm(handler.loadHMMOrDefault(parametersFile));
	}
	public String getInputFile() {
		return inputFile;
	}
	public void setInputFile(String inputFile) {
		this.inputFile = inputFile;
	}
	public String getStatesFile() {
		return statesFile;
	}
	public void setStatesFile(String statesFile) {
		this.statesFile = statesFile;
	}
	public String getOutputFile() {
		return outputFile;
	}
	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}

	public static void main(String[] args) throws Exception {
		HMMStatePathScorer instance = new HMMStatePathScorer();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		if(i<args.length) instance.setInputFile(args[i++]);
		if(i<args.length) instance.setStatesFile(args[i]);
		instance.run();
	}

	public void run() throws IOException {
		if(hmm==null) setHmm((String)null);
		if(inputFile==null) throw new IOException("The file with the sequence is a required parameter");
		if(statesFile==null) throw new IOException("The file with the path of states is a required parameter");
		log.info("Scoring path of states in "+statesFile+" for the sequence in "+inputFile);
		ObservationSequenceFileHandler handler = new ObservationSequenceFileHandler();
		handler.setLog(log);
		String sequence = handler.loadSequence(inputFile);
		int [] path = new StatePathFileHandler().loadStatePath(statesFile);
		if(outputFile==null) {
			score(sequence, path, System.out);
		} else {
			try (PrintStream out = new PrintStream(new FileOutputStream(outputFile))) {
				score(sequence, path, out);
			}
		}
	}

	/**
	 * Calculates the log probability of the given sequence and path and prints it together with
	 * the number of symbols assigned to each state and the path
	 * @param sequence Observed symbols
	 * @param path States assigned to the symbols
	 * @param out Stream to print the results
	 * @return double Natural logarithm of the joint probability of the sequence and the path
	 */
	public double score(CharSequence sequence, int [] path, PrintStream out) {
		double logProb = hmm.calculateLogProbability(sequence, path);
		log.info("Log probability of the path: "+logProb);
		new StatePathFileHandler().printReport(logProb, path, hmm.getNumStates(), out);
		return logProb;
	}
}
