package hmmseq.sequences.io.test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import junit.framework.TestCase;
import hmmseq.sequences.io.ObservationSequenceFileHandler;

public class ObservationSequenceFileHandlerTest extends TestCase {

	private File writeTempFile(String content) throws IOException {
		File file = File.createTempFile("hmmseqSequence", ".txt");
		file.deleteOnExit();
		Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	public void testPlainText() throws IOException {
		File file = writeTempFile("\n#Comment\naatg\n C g\t\n\n");
		String sequence = new ObservationSequenceFileHandler().loadSequence(file.getAbsolutePath());
		assertEquals("AATGCG", sequence);
	}

	public void testKeepLowerCase() throws IOException {
		File file = writeTempFile("aaTg\n");
		ObservationSequenceFileHandler handler = new ObservationSequenceFileHandler();
		handler.setKeepLowerCase(true);
		assertEquals("aaTg", handler.loadSequence(file.getAbsolutePath()));
	}

	public void testFasta() throws IOException {
		File file = writeTempFile(">seq1 description\nACGT\nTTGA\n>seq2\nCCCC\n");
		String sequence = new ObservationSequenceFileHandler().loadSequence(file.getAbsolutePath());
		assertEquals("ACGTTTGA", sequence);
	}

	public void testInvalidFiles() throws IOException {
		ObservationSequenceFileHandler handler = new ObservationSequenceFileHandler();
		try {
			handler.loadSequence(writeTempFile("\n  \n").getAbsolutePath());
			fail("Empty files should fail");
		} catch (IOException e) {
			//Expected
		}
		try {
			handler.loadSequence(writeTempFile(">empty\n").getAbsolutePath());
			fail("Fasta record without sequence should fail");
		} catch (IOException e) {
			//Expected
		}
		try {
			handler.loadSequence(writeTempFile("ACGT\n>seq\nAC\n").getAbsolutePath());
			fail("Fasta header after sequence characters should fail");
		} catch (IOException e) {
			//Expected
		}
	}

	public void testPrintFasta() throws IOException {
		StringBuilder longSequence = new StringBuilder();
		for(int i=0;i<250;i++) longSequence.append("ACGT".charAt(i%4));
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		ObservationSequenceFileHandler handler = new ObservationSequenceFileHandler();
		try (PrintStream out = new PrintStream(os, true, "UTF-8")) {
			handler.printSequence("simulated", longSequence, ObservationSequenceFileHandler.FORMAT_FASTA, out);
		}
		String printed = os.toString("UTF-8");
		String [] lines = printed.split("\r?\n");
		assertEquals(4, lines.length);
		assertEquals(">simulated", lines[0]);
		assertEquals(ObservationSequenceFileHandler.DEF_LINE_LENGTH, lines[1].length());
		assertEquals(50, lines[3].length());
		assertEquals(longSequence.toString(), handler.loadSequence(writeTempFile(printed).getAbsolutePath()));
	}

	public void testPrintPlain() throws IOException {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		try (PrintStream out = new PrintStream(os, true, "UTF-8")) {
			new ObservationSequenceFileHandler().printSequence("ignored", "GATTACA", ObservationSequenceFileHandler.FORMAT_PLAIN, out);
		}
		assertEquals("GATTACA", os.toString("UTF-8").trim());
		try {
			new ObservationSequenceFileHandler().printSequence("x", "A", (byte)7, System.out);
			fail("Unknown formats should fail");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}
}
