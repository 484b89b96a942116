package hmmseq.simulation.test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import junit.framework.TestCase;
import hmmseq.hmm.io.StatePathFileHandler;
import hmmseq.sequences.io.ObservationSequenceFileHandler;
import hmmseq.simulation.HMMSequenceSimulator;
import hmmseq.simulation.SampledSequence;

public class HMMSequenceSimulatorTest extends TestCase {

	public void testSetFromStrings() {
		HMMSequenceSimulator simulator = new HMMSequenceSimulator();
		assertEquals(HMMSequenceSimulator.DEF_LENGTH, simulator.getLength());
		simulator.setLength("250");
		simulator.setSeed("99");
		simulator.setOutFormat("1");
		assertEquals(250, simulator.getLength());
		assertEquals(99L, simulator.getSeed().longValue());
		assertEquals(ObservationSequenceFileHandler.FORMAT_FASTA, simulator.getOutFormat());
	}

	public void testInvalidParameters() {
		HMMSequenceSimulator simulator = new HMMSequenceSimulator();
		try {
			simulator.setLength(-3);
			fail("Negative lengths should fail");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			simulator.setLength("many");
			fail("Non numeric lengths should fail");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			simulator.setOutFormat("5");
			fail("Unknown formats should fail");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}

	public void testSamplerRequiresModel() {
		HMMSequenceSimulator simulator = new HMMSequenceSimulator();
		try {
			simulator.buildSampler();
			fail("Sampling without a model should fail");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}

	public void testSeededSampler() throws IOException {
		HMMSequenceSimulator simulator = new HMMSequenceSimulator();
		simulator.setHmm((String)null);
		simulator.setSeed(31);
		SampledSequence s1 = simulator.buildSampler().sample(100);
		SampledSequence s2 = simulator.buildSampler().sample(100);
		assertEquals(s1.getSequence(), s2.getSequence());
	}

	public void testRun() throws IOException {
		File dir = Files.createTempDirectory("hmmseqSimulation").toFile();
		String prefix = new File(dir, "test").getAbsolutePath();
		HMMSequenceSimulator simulator = new HMMSequenceSimulator();
		simulator.setLength(300);
		simulator.setSeed(8);
		simulator.setOutFormat(ObservationSequenceFileHandler.FORMAT_FASTA);
		simulator.setOutputPrefix(prefix);
		simulator.run();
		File sequenceFile = new File(prefix+"_sequence.fa");
		File statesFile = new File(prefix+"_states.txt");
		assertTrue(sequenceFile.exists());
		assertTrue(statesFile.exists());
		String sequence = new ObservationSequenceFileHandler().loadSequence(sequenceFile.getAbsolutePath());
		int [] states = new StatePathFileHandler().loadStatePath(statesFile.getAbsolutePath());
		assertEquals(300, sequence.length());
		assertEquals(300, states.length);
		assertTrue(simulator.getHmm().calculateLogProbability(sequence, states)>Double.NEGATIVE_INFINITY);
		sequenceFile.delete();
		statesFile.delete();
		dir.delete();
	}

	public void testRunWithoutPrefix() {
		HMMSequenceSimulator simulator = new HMMSequenceSimulator();
		try {
			simulator.run();
			fail("Simulation without output prefix should fail");
		} catch (IOException e) {
			//Expected
		}
	}
}
