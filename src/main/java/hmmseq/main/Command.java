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
package hmmseq.main;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Description of one of the HMMSeq commands. Binds the options typed in the command line
 * to the class implementing the command and prints the help of the command
 */
public class Command {
	private final String id;
	private final Class<?> program;
	private final String title;
	private final String intro;
	private final String description;
	private final List<String> arguments;
	private final Map<String, CommandOption> options = new LinkedHashMap<String, CommandOption>();

	public Command(String id, Class<?> program, String title, String intro, String description, List<String> arguments, List<CommandOption> options) {
		super();
		this.id = id;
		this.program = program;
		this.title = title;
		this.intro = intro;
		this.description = description;
		this.arguments = Collections.unmodifiableList(new ArrayList<String>(arguments));
		for(CommandOption option:options) {
			if(this.options.put(option.getId(), option)!=null) throw new IllegalArgumentException("Duplicated option -"+option.getId()+" for command "+id);
		}
	}
	public String getId() {
		return id;
	}
	public Class<?> getProgram() {
		return program;
	}
	public String getTitle() {
		return title;
	}
	public String getIntro() {
		return intro;
	}
	public String getDescription() {
		return description;
	}
	public List<String> getArguments() {
		return arguments;
	}
	public CommandOption getOption(String optionId) {
		return options.get(optionId);
	}
	public List<CommandOption> getOptions() {
		return new ArrayList<CommandOption>(options.values());
	}

	/**
	 * Assigns the options at the beginning of the given arguments. Every option is followed by its value.
	 * Processing stops at the first argument that does not start with a dash
	 * @param instance Object of the class implementing this command
	 * @param args Arguments typed after the command id
	 * @return int Index of the first positional argument
	 * @throws IllegalArgumentException If an option is unknown, has no value or has an invalid value
	 */
	public int bindOptions(Object instance, String [] args) {
		if(!program.isInstance(instance)) throw new IllegalArgumentException("Command "+id+" is implemented by "+program.getName()+" not by "+instance.getClass().getName());
		int i = 0;
		while(i<args.length && args[i].length()>1 && args[i].charAt(0)=='-') {
			CommandOption option = options.get(args[i].substring(1));
			if(option==null) throw new IllegalArgumentException("Unrecognized option "+args[i]+" for command "+id);
			if(i+1==args.length) throw new IllegalArgumentException("Missing value for option "+args[i]);
			option.assign(instance, args[i+1]);
			i+=2;
		}
		return i;
	}

	/**
	 * Prints the title, description, usage line and options of this command
	 * @param out Stream to print the help
	 * @param jarName Name of the executable jar
	 */
	public void printHelp(PrintStream out, String jarName) {
		StringBuilder underline = new StringBuilder();
		for(int i=0;i<title.length();i++) underline.append('-');
		out.println(title);
		out.println(underline);
		out.println();
		out.println(description);
		out.println();
		StringBuilder usage = new StringBuilder("USAGE: java -jar "+jarName+" "+id+" <OPTIONS>");
		for(String argument:arguments) usage.append(" <"+argument+">");
		out.println(usage);
		out.println();
		out.println("OPTIONS:");
		for(CommandOption option:options.values()) {
			String line = String.format("  -%-3s%-8s: %s", option.getId(), option.getType(), option.getDescription());
			if(option.getDefaultValue()!=null) line+=" Default: "+option.getDefaultValue();
			out.println(line);
		}
		out.println();
	}
}
