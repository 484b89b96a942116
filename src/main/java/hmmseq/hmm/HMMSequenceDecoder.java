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

import java.io.ByteArrayOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.logging.Logger;

import hmmseq.hmm.io.HMMParametersFileHandler;
import hmmseq.hmm.io.StatePathFileHandler;
import hmmseq.main.CommandsDescriptor;
import hmmseq.math.LogMath;
import hmmseq.math.NumberArrays;
import hmmseq.sequences.io.ObservationSequenceFileHandler;

/**
 * Finds the most likely path of states of an HMM explaining a sequence of symbols
 */
public class HMMSequenceDecoder {

	// Logging and progress
	private Logger log = Logger.getLogger(HMMSequenceDecoder.class.getName());

	// Parameters
	private ConstantTransitionHMM hmm = null;
	private String inputFile = null;
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

	public String getOutputFile() {
		return outputFile;
	}
	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}

	public static void main(String[] args) throws Exception {
		HMMSequenceDecoder instance = new HMMSequenceDecoder();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		if(i<args.length) instance.setInputFile(args[i]);
		instance.run();
	}

	public void run() throws IOException {
		if(hmm==null) setHmm((String)null);
		logParameters();
		if(inputFile==null) throw new IOException("The file with the sequence to decode is a required parameter");
		ObservationSequenceFileHandler handler = new ObservationSequenceFileHandler();
		handler.setLog(log);
		String sequence = handler.loadSequence(inputFile);
		if(outputFile==null) {
			decode(sequence, System.out);
		} else {
			try (PrintStream out = new PrintStream(new FileOutputStream(outputFile))) {
				decode(sequence, out);
			}
		}
	}

	private void logParameters() {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(os);
		out.println("Input file: "+inputFile);
		if(outputFile!=null) out.println("Output file: "+outputFile);
		else out.println("Results written to standard output");
		out.println("HMM parameters:");
		new HMMParametersFileHandler().printHMM(hmm, out);
		out.flush();
		log.info(os.toString());
	}

	/**
	 * Calculates the most likely path of states for the given sequence and prints the log probability
	 * of the path, the number of symbols assigned to each state and the path
	 * @param sequence Symbols to decode
	 * @param out Stream to print the results
	 * @return int [] Most likely path of states
	 */
	public int [] decode(CharSequence sequence, PrintStream out) {
		int m = sequence.length();
		int n = hmm.getNumStates();
		log.info("Decoding sequence of length "+m+" with an HMM of "+n+" states");
		int [] path = new int[m];
		double viterbiScore = hmm.getViterbiPath(sequence, path);
		double logProb = hmm.calculateLogProbability(sequence, path);
		if(Math.abs(logProb-viterbiScore)>0.000001) log.warning("Log probability of the decoded path "+logProb+" differs from the score of the decoding "+viterbiScore);
		logSummary(sequence, path, logProb);
		new StatePathFileHandler().printReport(logProb, path, n, out);
		return path;
	}

	/**
	 * Calculates the probability of the given path conditioned on the sequence, using the forward
	 * algorithm to obtain the probability of the sequence
	 * @param sequence Observed symbols
	 * @param path States assigned to the symbols
	 * @return double Posterior probability of the path. Zero if the sequence has probability zero under the model
	 */
	public double calculatePathPosterior(CharSequence sequence, int [] path) {
		double logProbData = hmm.calculateForward(sequence, new double[sequence.length()][hmm.getNumStates()]);
		if(logProbData==Double.NEGATIVE_INFINITY) return 0;
		return LogMath.exp(hmm.calculateLogProbability(sequence, path)-logProbData);
	}

	private void logSummary(CharSequence sequence, int[] path, double logProb) {
		int m = sequence.length();
		int n = hmm.getNumStates();
		if(logProb==Double.NEGATIVE_INFINITY) {
			log.warning("All paths of states have probability zero for the given sequence");
		} else {
			double posterior = calculatePathPosterior(sequence, path);
			log.info("Log probability of the best path: "+logProb+". Posterior probability of the best path: "+String.format(Locale.ENGLISH, "%.4f", posterior));
		}
		int [] counts = NumberArrays.getCounts(path, n);
		for(int j=0;j<n;j++) {
			double percentage = 100.0*counts[j]/m;
			log.info("State "+hmm.getState(j).getId()+": "+counts[j]+" symbols ("+String.format(Locale.ENGLISH, "%.2f", percentage)+"%)");
		}
	}
}
