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
package hmmseq;

import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

import hmmseq.main.Command;
import hmmseq.main.CommandsDescriptor;

/**
 * Entry point of the executable jar. The first argument selects the command. The remaining
 * arguments are passed to the main method of the class implementing the command
 */
public class HMMSeq {

	private static final Logger log = Logger.getLogger(HMMSeq.class.getName());

	public static void main(String[] args) throws Exception {
		CommandsDescriptor descriptor = CommandsDescriptor.getInstance();
		if(args.length==0 || CommandsDescriptor.HELP_FLAGS.contains(args[0])) {
			descriptor.printUsage(System.err);
			return;
		}
		if(CommandsDescriptor.VERSION_FLAGS.contains(args[0])) {
			descriptor.printVersion(System.err);
			return;
		}
		Command command = descriptor.getCommand(args[0]);
		if(command==null) {
			System.err.println("ERROR: Unrecognized command "+args[0]);
			System.err.println();
			descriptor.printUsage(System.err);
			System.exit(1);
		}
		String [] commandArgs = Arrays.copyOfRange(args, 1, args.length);
		try {
			command.getProgram().getMethod("main", String[].class).invoke(null, (Object)commandArgs);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			log.log(Level.SEVERE, "Command "+command.getId()+" failed: "+cause.getMessage(), cause);
			System.exit(1);
		}
	}
}
