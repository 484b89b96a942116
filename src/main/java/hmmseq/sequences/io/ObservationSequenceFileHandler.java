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
package hmmseq.sequences.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.logging.Logger;

/**
 * Loads and writes sequences of observed symbols. Sequences can be stored as plain text or in
 * fasta format. Only the first sequence of a fasta file is loaded. Lines starting with # are ignored
 */
public class ObservationSequenceFileHandler {
	public static final byte FORMAT_PLAIN = 0;
	public static final byte FORMAT_FASTA = 1;
	public static final int DEF_LINE_LENGTH = 100;

	private Logger log = Logger.getLogger(ObservationSequenceFileHandler.class.getName());
	private boolean keepLowerCase = false;

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	public boolean isKeepLowerCase() {
		return keepLowerCase;
	}
	public void setKeepLowerCase(boolean keepLowerCase) {
		this.keepLowerCase = keepLowerCase;
	}

	/**
	 * Loads the sequence stored in the given file. If the first line starts with &gt; the file is
	 * read as fasta and only the first sequence is loaded. Otherwise all lines are concatenated
	 * @param filename Name of the file with the sequence
	 * @return String Sequence of symbols stored in the file
	 * @throws IOException If the file can not be read or it does not have symbols
	 */
	public String loadSequence(String filename) throws IOException {
		StringBuilder buffer = new StringBuilder();
		String name = null;
		boolean fasta = false;
		try (FileInputStream fis = new FileInputStream(filename);
			 BufferedReader in = new BufferedReader(new InputStreamReader (fis))) {
			String line=in.readLine();
			while(line!=null) {
				if(buffer.length()==0 && name==null && line.trim().length()==0) {
					line=in.readLine();
					continue;
				}
				if(line.startsWith(">")) {
					if(fasta) {
						log.warning("File "+filename+" has more than one sequence. Only the sequence "+name+" will be loaded");
						break;
					}
					if(buffer.length()>0) throw new IOException("Fasta header found after sequence characters in file "+filename+": "+line);
					fasta = true;
					String idLine = line.substring(1).trim();
					String [] items = idLine.split(" |\t");
					name = items[0];
				} else if (!line.startsWith("#")) {
					buffer.append(removeSpaces(line));
				}
				line=in.readLine();
			}
		}
		if(buffer.length()==0) throw new IOException("File "+filename+" does not have a sequence");
		String sequence = buffer.toString();
		if(!keepLowerCase) sequence = sequence.toUpperCase();
		if(fasta) log.info("Loaded sequence "+name+" of length "+sequence.length()+" from file "+filename);
		else log.info("Loaded sequence of length "+sequence.length()+" from file "+filename);
		return sequence;
	}

	private String removeSpaces(String line) {
		StringBuilder answer = new StringBuilder();
		for(int i=0;i<line.length();i++) {
			char c = line.charAt(i);
			if(!Character.isWhitespace(c) && !Character.isISOControl(c)) {
				answer.append(c);
			}
		}
		return answer.toString();
	}

	/**
	 * Prints the given sequence in the given format
	 * @param name Name of the sequence. Used only in fasta format
	 * @param sequence Symbols to print
	 * @param format One of FORMAT_PLAIN or FORMAT_FASTA
	 * @param out Stream to print the sequence
	 */
	public void printSequence(String name, CharSequence sequence, byte format, PrintStream out) {
		if(format == FORMAT_FASTA) {
			out.println(">"+name);
			int l = sequence.length();
			for(int j=0;j<l;j+=DEF_LINE_LENGTH) {
				out.println(sequence.subSequence(j, Math.min(l, j+DEF_LINE_LENGTH)));
			}
		} else if (format == FORMAT_PLAIN) {
			out.println(sequence);
		} else {
			throw new IllegalArgumentException("Unrecognized sequence format: "+format);
		}
	}
}
