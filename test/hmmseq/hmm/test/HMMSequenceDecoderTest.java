package hmmseq.hmm.test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;
import hmmseq.hmm.ConstantTransitionHMM;
import hmmseq.hmm.DiscreteEmissionHMMState;
import hmmseq.hmm.HMMSequenceDecoder;
import hmmseq.hmm.HMMStatePathScorer;

public class HMMSequenceDecoderTest extends TestCase {

	private File writeTempFile(String content) throws IOException {
		File file = File.createTempFile("hmmseqDecoder", ".txt");
		file.deleteOnExit();
		Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	public void testDecodeWithDefaultModel() throws IOException {
		File input = writeTempFile(">test\nAATGC\n");
		File output = File.createTempFile("hmmseqDecoded", ".txt");
		output.deleteOnExit();
		HMMSequenceDecoder decoder = new HMMSequenceDecoder();
		decoder.setInputFile(input.getAbsolutePath());
		decoder.setOutputFile(output.getAbsolutePath());
		decoder.run();
		List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
		assertEquals(4, lines.size());
		assertEquals(-7.531287271360865, Double.parseDouble(lines.get(0)), 1e-9);
		assertEquals("5", lines.get(1));
		assertEquals("0", lines.get(2));
		assertEquals("00000", lines.get(3));
	}

	public void testDecodeHighGC() throws IOException {
		HMMSequenceDecoder decoder = new HMMSequenceDecoder();
		decoder.setHmm(ViterbiPathTest.buildGCContentHMM());
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		int [] path;
		try (PrintStream out = new PrintStream(os, true, "UTF-8")) {
			path = decoder.decode("GGCCGCGC", out);
		}
		assertEquals(8, path.length);
		String [] lines = os.toString("UTF-8").split("\r?\n");
		assertEquals(-9.608594760375047, Double.parseDouble(lines[0]), 1e-9);
		assertEquals("0", lines[1]);
		assertEquals("8", lines[2]);
		assertEquals("11111111", lines[3]);
	}

	public void testDecodeInvalidSymbol() throws IOException {
		HMMSequenceDecoder decoder = new HMMSequenceDecoder();
		decoder.setHmm(ViterbiPathTest.buildGCContentHMM());
		try {
			decoder.decode("ACGNT", System.out);
			fail("Decoding symbols out of the alphabet should fail");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}

	public void testDecodeWithoutInput() {
		HMMSequenceDecoder decoder = new HMMSequenceDecoder();
		decoder.setHmm(ViterbiPathTest.buildGCContentHMM());
		try {
			decoder.run();
			fail("Decoding without input file should fail");
		} catch (IOException e) {
			//Expected
		}
	}

	public void testScoreDecodedPath() throws IOException {
		File input = writeTempFile("AATGC\n");
		File states = writeTempFile("00000\n");
		File output = File.createTempFile("hmmseqScore", ".txt");
		output.deleteOnExit();
		HMMStatePathScorer scorer = new HMMStatePathScorer();
		scorer.setInputFile(input.getAbsolutePath());
		scorer.setStatesFile(states.getAbsolutePath());
		scorer.setOutputFile(output.getAbsolutePath());
		scorer.run();
		List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
		assertEquals(4, lines.size());
		assertEquals(-7.531287271360865, Double.parseDouble(lines.get(0)), 1e-9);
		assertEquals("5", lines.get(1));
		assertEquals("0", lines.get(2));
		assertEquals("00000", lines.get(3));
	}

	public void testScoreOtherPath() throws IOException {
		HMMStatePathScorer scorer = new HMMStatePathScorer();
		scorer.setHmm(ViterbiPathTest.buildGCContentHMM());
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		double logProb;
		try (PrintStream out = new PrintStream(os, true, "UTF-8")) {
			logProb = scorer.score("AATGC", new int[] {0,0,1,1,1}, out);
		}
		double expected = Math.log(0.5)+Math.log(0.291)+Math.log(0.999)+Math.log(0.291)+Math.log(0.001)+Math.log(0.169)
				+Math.log(0.99)+Math.log(0.331)+Math.log(0.99)+Math.log(0.331);
		assertEquals(expected, logProb, 1e-9);
		assertTrue(logProb<-7.531287271360865);
		String [] lines = os.toString("UTF-8").split("\r?\n");
		assertEquals("2", lines[1]);
		assertEquals("3", lines[2]);
		assertEquals("00111", lines[3]);
	}

	public void testScoreInconsistentPath() throws IOException {
		HMMStatePathScorer scorer = new HMMStatePathScorer();
		scorer.setHmm(ViterbiPathTest.buildGCContentHMM());
		scorer.setInputFile(writeTempFile("AATGC\n").getAbsolutePath());
		scorer.setStatesFile(writeTempFile("000\n").getAbsolutePath());
		try {
			scorer.run();
			fail("Paths with different length than the sequence should fail");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}

	public void testPathPosterior() {
		HMMSequenceDecoder decoder = new HMMSequenceDecoder();
		decoder.setHmm(ViterbiPathTest.buildGCContentHMM());
		double posterior = decoder.calculatePathPosterior("AATGC", new int[] {0,0,0,0,0});
		assertEquals(Math.exp(-7.531287271360865+7.1295883393379), posterior, 1e-6);
		assertTrue(posterior>0.5 && posterior<1);
	}

	public void testDecodeImpossibleSequence() throws IOException {
		List<DiscreteEmissionHMMState> states = new ArrayList<>();
		states.add(new DiscreteEmissionHMMState("A", 0.5, "ATCG", new double[] {0.5,0.3,0.2,0}));
		states.add(new DiscreteEmissionHMMState("B", 0.5, "ATCG", new double[] {0.2,0.3,0.5,0}));
		HMMSequenceDecoder decoder = new HMMSequenceDecoder();
		decoder.setHmm(new ConstantTransitionHMM(states, new double[][] {{0.9,0.1},{0.1,0.9}}));
		assertEquals(0.0, decoder.calculatePathPosterior("AGA", new int[] {0,0,0}));
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		int [] path;
		try (PrintStream out = new PrintStream(os, true, "UTF-8")) {
			path = decoder.decode("AGA", out);
		}
		assertEquals(3, path.length);
		String [] lines = os.toString("UTF-8").split("\r?\n");
		assertEquals("-Infinity", lines[0]);
	}
}
