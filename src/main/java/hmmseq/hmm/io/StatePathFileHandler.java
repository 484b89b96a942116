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
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import hmmseq.math.NumberArrays;

/**
 * Reads and writes paths of HMM states. Paths of models with up to ten states are written
 * as concatenated state indexes. Paths of larger models are written as space separated indexes
 */
public class StatePathFileHandler {
	public static final int MAX_STATES_CONCATENATED_PATH = 10;

	/**
	 * Loads a path of states from the given file. Lines with whitespace are read as separated indexes.
	 * Other lines are read as one digit per state. Lines starting with # are ignored
	 * @param filename Name of the file with the path
	 * @return int [] Path of states loaded from the file
	 * @throws IOException If the file can not be read or has invalid indexes
	 */
	public int [] loadStatePath(String filename) throws IOException {
		List<Integer> path = new ArrayList<Integer>();
		try (FileReader fr = new FileReader(filename);
			 BufferedReader in = new BufferedReader(fr)) {
			int lineNumber = 0;
			String line=in.readLine();
			while(line!=null) {
				lineNumber++;
				line = line.trim();
				if(line.length()>0 && !line.startsWith("#")) {
					if(line.indexOf(' ')>=0 || line.indexOf('\t')>=0) {
						for(String item:line.split("\\s+")) {
							path.add(parseState(item, lineNumber, filename));
						}
					} else {
						for(int i=0;i<line.length();i++) {
							path.add(parseState(line.substring(i, i+1), lineNumber, filename));
						}
					}
				}
				line=in.readLine();
			}
		}
		if(path.size()==0) throw new IOException("File "+filename+" does not contain a path of states");
		return NumberArrays.toIntArray(path);
	}

	private int parseState(String item, int lineNumber, String filename) throws IOException {
		try {
			int state = Integer.parseInt(item);
			if(state<0) throw new IOException("Negative state "+state+" at line "+lineNumber+" of "+filename);
			return state;
		} catch (NumberFormatException e) {
			throw new IOException("Invalid state "+item+" at line "+lineNumber+" of "+filename,e);
		}
	}

	/**
	 * Prints the given path in a single line
	 * @param path to print
	 * @param numStates Number of states of the model that produced the path
	 * @param out Stream to print the path
	 */
	public void printStatePath(int [] path, int numStates, PrintStream out) {
		boolean concatenate = numStates<=MAX_STATES_CONCATENATED_PATH;
		StringBuilder line = new StringBuilder(concatenate?path.length:2*path.length);
		for(int i=0;i<path.length;i++) {
			if(!concatenate && i>0) line.append(' ');
			line.append(path[i]);
		}
		out.println(line.toString());
	}

	/**
	 * Prints the log probability of a path, the number of steps spent in each state and the path
	 * @param logProb Natural logarithm of the joint probability of the path and the observations
	 * @param path Path of states
	 * @param numStates Number of states of the model
	 * @param out Stream to print the report
	 */
	public void printReport(double logProb, int [] path, int numStates, PrintStream out) {
		out.println(logProb);
		int [] counts = NumberArrays.getCounts(path, numStates);
		for(int j=0;j<numStates;j++) {
			out.println(counts[j]);
		}
		printStatePath(path, numStates, out);
	}
}
