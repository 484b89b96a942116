package hmmseq.hmm.io.test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import junit.framework.TestCase;
import hmmseq.hmm.ConstantTransitionHMM;
import hmmseq.hmm.io.HMMParametersFileHandler;

public class HMMParametersFileHandlerTest extends TestCase {

	private static final String THREE_STATES =
			"#Three states model\n"+
			"ALPHABET\tabc\n"+
			"STATES\tS1\tS2\tS3\n"+
			"PRIOR\t0.2\t0.3\t0.5\n"+
			"\n"+
			"TRANSITION\tS3\t0.1\t0.1\t0.8\n"+
			"TRANSITION\tS1\t0.8\t0.1\t0.1\n"+
			"TRANSITION\tS2\t0.1\t0.8\t0.1\n"+
			"EMISSION\tS1\t0.7\t0.2\t0.1\n"+
			"EMISSION\tS2\t0.1\t0.7\t0.2\n"+
			"EMISSION\tS3\t0.2\t0.1\t0.7\n";

	private File writeTempFile(String content) throws IOException {
		File file = File.createTempFile("hmmseqParams", ".txt");
		file.deleteOnExit();
		Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	public void testDefaultHMM() throws IOException {
		ConstantTransitionHMM hmm = new HMMParametersFileHandler().loadDefaultHMM();
		assertEquals(2, hmm.getNumStates());
		assertEquals("ATCG", hmm.getAlphabet());
		assertEquals("L", hmm.getState(0).getId());
		assertEquals("H", hmm.getState(1).getId());
		assertEquals(0.5, hmm.getStarts()[1], 1e-12);
		assertEquals(0.999, hmm.getTransition(0, 0), 1e-12);
		assertEquals(0.01, hmm.getTransition(1, 0), 1e-12);
		assertEquals(0.209, hmm.getState(0).getEmissions()[2], 1e-12);
		assertEquals(0.331, hmm.getState(1).getEmissions()[3], 1e-12);
	}

	public void testLoadThreeStates() throws IOException {
		File file = writeTempFile(THREE_STATES);
		ConstantTransitionHMM hmm = new HMMParametersFileHandler().loadHMM(file.getAbsolutePath());
		assertEquals(3, hmm.getNumStates());
		assertEquals("abc", hmm.getAlphabet());
		assertEquals("S3", hmm.getState(2).getId());
		assertEquals(0.8, hmm.getTransition(2, 2), 1e-12);
		assertEquals(0.8, hmm.getTransition(0, 0), 1e-12);
		assertEquals(0.7, hmm.getState(1).getEmissions()[1], 1e-12);
		int [] path = hmm.calculateViterbiPath("aaabbbccc");
		for(int i=0;i<path.length;i++) assertEquals(i/3, path[i]);
	}

	public void testPrintAndLoad() throws IOException {
		HMMParametersFileHandler handler = new HMMParametersFileHandler();
		ConstantTransitionHMM hmm = handler.loadHMM(writeTempFile(THREE_STATES).getAbsolutePath());
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		try (PrintStream out = new PrintStream(os, true, "UTF-8")) {
			handler.printHMM(hmm, out);
		}
		String printed = os.toString("UTF-8");
		assertTrue(printed.startsWith("ALPHABET\tabc"));
		assertTrue(printed.contains("STATES\tS1\tS2\tS3"));
		ConstantTransitionHMM copy = handler.loadHMM(writeTempFile(printed).getAbsolutePath());
		assertEquals(hmm.getNumStates(), copy.getNumStates());
		for(int j=0;j<hmm.getNumStates();j++) {
			assertEquals(hmm.getState(j).getId(), copy.getState(j).getId());
			assertEquals(hmm.getState(j).getStart(), copy.getState(j).getStart(), 1e-12);
			for(int k=0;k<hmm.getNumStates();k++) assertEquals(hmm.getTransition(j, k), copy.getTransition(j, k), 1e-12);
		}
	}

	public void testMissingLines() throws IOException {
		assertInvalid(THREE_STATES.replace("ALPHABET\tabc\n", ""), "ALPHABET");
		assertInvalid(THREE_STATES.replace("PRIOR\t0.2\t0.3\t0.5\n", ""), "PRIOR");
		assertInvalid(THREE_STATES.replace("EMISSION\tS2\t0.1\t0.7\t0.2\n", ""), "S2");
		assertInvalid(THREE_STATES.replace("TRANSITION\tS1\t0.8\t0.1\t0.1\n", ""), "S1");
	}

	public void testInvalidValues() throws IOException {
		assertInvalid(THREE_STATES.replace("PRIOR\t0.2\t0.3\t0.5", "PRIOR\t0.2\t0.3"), "PRIOR");
		assertInvalid(THREE_STATES.replace("PRIOR\t0.2\t0.3\t0.5", "PRIOR\t0.2\t0.3\t0.6"), "start");
		assertInvalid(THREE_STATES.replace("TRANSITION\tS3\t0.1\t0.1\t0.8", "TRANSITION\tS3\t0.1\t0.1\t0.9"), "S3");
		assertInvalid(THREE_STATES.replace("EMISSION\tS1\t0.7\t0.2\t0.1", "EMISSION\tS1\t0.7\t0.3"), "S1");
		assertInvalid(THREE_STATES.replace("EMISSION\tS1\t0.7", "EMISSION\tS1\tp7"), "p7");
		assertInvalid(THREE_STATES.replace("TRANSITION\tS3", "TRANSITION\tS4"), "S4");
		assertInvalid(THREE_STATES.replace("STATES\tS1\tS2\tS3", "STATES\tS1\tS1\tS3"), "S1");
		assertInvalid(THREE_STATES+"START\t1\n", "START");
	}

	public void testMissingFile() {
		try {
			new HMMParametersFileHandler().loadHMM("nonExistentHMMParameters.txt");
			fail("Loading a missing file should fail");
		} catch (IOException e) {
			//Expected
		}
	}

	private void assertInvalid(String content, String expectedInMessage) throws IOException {
		File file = writeTempFile(content);
		try {
			new HMMParametersFileHandler().loadHMM(file.getAbsolutePath());
			fail("Loading invalid parameters should fail. Expected message with "+expectedInMessage);
		} catch (IOException e) {
			assertTrue("Message: "+e.getMessage()+" does not contain: "+expectedInMessage, e.getMessage().contains(expectedInMessage));
		}
	}
}
