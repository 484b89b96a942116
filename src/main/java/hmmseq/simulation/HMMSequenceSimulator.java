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

import java.io.ByteArrayOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Random;
import java.util.logging.Logger;

import hmmseq.hmm.ConstantTransitionHMM;
import hmmseq.hmm.io.HMMParametersFileHandler;
import hmmseq.hmm.io.StatePathFileHandler;
import hmmseq.main.CommandsDescriptor;
import hmmseq.main.OptionType;
import hmmseq.math.MultinomialSampler;
import hmmseq.math.NumberArrays;
import hmmseq.sequences.io.ObservationSequenceFileHandler;

/**
 * Command that samples a sequence and its path of states from an HMM and saves them to files
 */
public class HMMSequenceSimulator {

	// Constants for default values
	public static final int DEF_LENGTH = 1000;
	public static final String SIMULATED_SEQUENCE_NAME = "simulated";

	// Logging and progress
	private Logger log = Logger.getLogger(HMMSequenceSimulator.class.getName());

	// Parameters
	private ConstantTransitionHMM hmm = null;
	private String outputPrefix = null;
	private int length = DEF_LENGTH;
	private Long seed = null;
	private byte outFormat = ObservationSequenceFileHandler.FORMAT_PLAIN;

	// Get and set methods

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

	public String getOutputPrefix() {
		return outputPrefix;
	}
	public void setOutputPrefix(String outputPrefix) {
		this.outputPrefix = outputPrefix;
	}

	public int getLength() {
		return length;
	}
	public void setLength(int length) {
		if(length<1) throw new IllegalArgumentException("The length of the simulated sequence must be positive. Value: "+length);
		this.length = length;
	}
	public void setLength(String value) {
		setLength((Integer) OptionType.INT.decode(value));
	}

	public Long getSeed() {
		return seed;
	}
	public void setSeed(long seed) {
		this.seed = seed;
	}
	public void setSeed(String value) {
		setSeed((Long) OptionType.LONG.decode(value));
	}

	public byte getOutFormat() {
		return outFormat;
	}
	public void setOutFormat(byte outFormat) {
		if(outFormat!=ObservationSequenceFileHandler.FORMAT_PLAIN && outFormat!=ObservationSequenceFileHandler.FORMAT_FASTA) throw new IllegalArgumentException("Unrecognized output format: "+outFormat);
		this.outFormat = outFormat;
	}
	public void setOutFormat(String value) {
		int format = (Integer) OptionType.INT.decode(value);
		if(format<Byte.MIN_VALUE || format>Byte.MAX_VALUE) throw new IllegalArgumentException("Unrecognized output format: "+format);
		setOutFormat((byte) format);
	}

	public static void main(String[] args) throws Exception {
		HMMSequenceSimulator instance = new HMMSequenceSimulator();
		CommandsDescriptor.getInstance().loadOptions(instance, args);
		instance.run();
	}

	public void run() throws IOException {
		if(outputPrefix==null) throw new IOException("The prefix of the output files is a required parameter");
		if(hmm==null) setHmm((String)null);
		logParameters();
		SampledSequence simulated = buildSampler().sample(length);
		logCounts(simulated.getStates());
		String sequenceFile = outputPrefix+((outFormat==ObservationSequenceFileHandler.FORMAT_FASTA)?"_sequence.fa":"_sequence.txt");
		String statesFile = outputPrefix+"_states.txt";
		try (PrintStream out = new PrintStream(new FileOutputStream(sequenceFile))) {
			new ObservationSequenceFileHandler().printSequence(SIMULATED_SEQUENCE_NAME, simulated.getSequence(), outFormat, out);
		}
		try (PrintStream out = new PrintStream(new FileOutputStream(statesFile))) {
			new StatePathFileHandler().printStatePath(simulated.getStates(), hmm.getNumStates(), out);
		}
		log.info("Simulated sequence saved to "+sequenceFile+". Path of states saved to "+statesFile);
	}

	/**
	 * @return HMMSequenceSampler Sampler for the current model, seeded if a seed was given
	 */
	public HMMSequenceSampler buildSampler() {
		Random random = (seed!=null)?new Random(seed):new Random();
		return new HMMSequenceSampler(hmm, new MultinomialSampler(random));
	}

	private void logParameters() {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(os);
		out.println("Output prefix: "+outputPrefix);
		out.println("Length: "+length);
		if(seed!=null) out.println("Seed: "+seed);
		out.println("Output format: "+((outFormat==ObservationSequenceFileHandler.FORMAT_FASTA)?"fasta":"plain"));
		out.println("HMM states: "+hmm.getNumStates()+" alphabet: "+hmm.getAlphabet());
		out.flush();
		log.info(os.toString());
	}

	private void logCounts(int[] states) {
		int [] counts = NumberArrays.getCounts(states, hmm.getNumStates());
		for(int j=0;j<counts.length;j++) {
			log.info("Symbols emitted by state "+hmm.getState(j).getId()+": "+counts[j]);
		}
	}
}
