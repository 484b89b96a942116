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

import java.io.InputStream;
import java.io.PrintStream;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.parsers.DocumentBuilderFactory;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Registry of the HMMSeq commands, loaded from the XML descriptor distributed as a resource.
 * Each option of the descriptor names the attribute set through a String setter of the
 * class implementing the command
 */
public class CommandsDescriptor {
	public static final String RESOURCE = "/hmmseq/main/CommandsDescriptor.xml";
	public static final List<String> HELP_FLAGS = Arrays.asList("help", "-h", "--help");
	public static final List<String> VERSION_FLAGS = Arrays.asList("version", "-v", "--version");

	private static final CommandsDescriptor instance = new CommandsDescriptor();

	private String swVersion;
	private String releaseDate;
	private String swTitle;
	private final Map<String, String> groupNames = new LinkedHashMap<String, String>();
	private final Map<String, List<Command>> commandsByGroup = new HashMap<String, List<Command>>();
	private final Map<String, Command> commandsById = new LinkedHashMap<String, Command>();
	private final Map<Class<?>, Command> commandsByProgram = new HashMap<Class<?>, Command>();

	private CommandsDescriptor() {
		Element root = parseDescriptor().getDocumentElement();
		swVersion = root.getAttribute("version");
		releaseDate = root.getAttribute("date");
		swTitle = getChildText(root, "title");
		for(Element groupElem:getChildren(root, "commandgroup")) {
			String groupId = groupElem.getAttribute("id");
			groupNames.put(groupId, normalize(groupElem.getTextContent()));
			commandsByGroup.put(groupId, new ArrayList<Command>());
		}
		for(Element cmdElem:getChildren(root, "command")) {
			Command command = buildCommand(cmdElem);
			List<Command> groupCommands = commandsByGroup.get(cmdElem.getAttribute("groupId"));
			if(groupCommands==null) throw new IllegalStateException("Command "+command.getId()+" belongs to unknown group "+cmdElem.getAttribute("groupId"));
			if(commandsById.put(command.getId(), command)!=null) throw new IllegalStateException("Duplicated command id "+command.getId());
			commandsByProgram.put(command.getProgram(), command);
			groupCommands.add(command);
		}
	}

	public static CommandsDescriptor getInstance() {
		return instance;
	}

	private Document parseDescriptor() {
		try (InputStream in = CommandsDescriptor.class.getResourceAsStream(RESOURCE)) {
			if(in==null) throw new IllegalStateException("Resource "+RESOURCE+" not found");
			return DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(in);
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Can not load commands descriptor "+RESOURCE, e);
		}
	}

	private Command buildCommand(Element cmdElem) {
		String id = cmdElem.getAttribute("id");
		String className = cmdElem.getAttribute("class");
		Class<?> program;
		try {
			program = Class.forName(className);
			Method main = program.getMethod("main", String[].class);
			if(!Modifier.isStatic(main.getModifiers())) throw new IllegalStateException("Method main of "+className+" is not static");
		} catch (ClassNotFoundException | NoSuchMethodException e) {
			throw new IllegalStateException("Class "+className+" can not run command "+id, e);
		}
		List<String> arguments = new ArrayList<String>();
		for(Element argElem:getChildren(cmdElem, "argument")) arguments.add(normalize(argElem.getTextContent()));
		List<CommandOption> options = new ArrayList<CommandOption>();
		for(Element optElem:getChildren(cmdElem, "option")) options.add(buildOption(program, optElem));
		return new Command(id, program, getChildText(cmdElem, "title"), getChildText(cmdElem, "intro"), getChildText(cmdElem, "description"), arguments, options);
	}

	private CommandOption buildOption(Class<?> program, Element optElem) {
		String id = optElem.getAttribute("id");
		OptionType type = OptionType.valueOf(optElem.getAttribute("type"));
		String attribute = optElem.getAttribute("attribute");
		String setterName = "set"+Character.toUpperCase(attribute.charAt(0))+attribute.substring(1);
		Method setter;
		try {
			setter = program.getMethod(setterName, String.class);
		} catch (NoSuchMethodException e) {
			throw new IllegalStateException("Class "+program.getName()+" does not have method "+setterName+"(String) for option -"+id, e);
		}
		String defaultValue = null;
		if(optElem.hasAttribute("default")) {
			defaultValue = optElem.getAttribute("default");
		} else if(optElem.hasAttribute("defaultConstant")) {
			String constant = optElem.getAttribute("defaultConstant");
			try {
				defaultValue = String.valueOf(program.getField(constant).get(null));
			} catch (NoSuchFieldException | IllegalAccessException e) {
				throw new IllegalStateException("Can not read constant "+constant+" of class "+program.getName(), e);
			}
		}
		return new CommandOption(id, type, setter, normalize(optElem.getTextContent()), defaultValue);
	}

	private static List<Element> getChildren(Element parent, String name) {
		List<Element> answer = new ArrayList<Element>();
		NodeList children = parent.getChildNodes();
		for(int i=0;i<children.getLength();i++) {
			Node child = children.item(i);
			if(child.getNodeType()==Node.ELEMENT_NODE && name.equals(child.getNodeName())) answer.add((Element)child);
		}
		return answer;
	}

	private static String getChildText(Element parent, String name) {
		List<Element> children = getChildren(parent, name);
		if(children.isEmpty()) return "";
		return normalize(children.get(0).getTextContent());
	}

	private static String normalize(String text) {
		return text.trim().replaceAll("\\s+", " ");
	}

	public String getSwVersion() {
		return swVersion;
	}
	public String getReleaseDate() {
		return releaseDate;
	}
	public String getJarName() {
		return "HMMSeq_"+swVersion+".jar";
	}
	public Command getCommand(String id) {
		return commandsById.get(id);
	}
	public Command getCommand(Class<?> program) {
		return commandsByProgram.get(program);
	}

	public void printUsage(PrintStream out) {
		printVersionHeader(out);
		out.println();
		out.println("USAGE: java -jar "+getJarName()+" <COMMAND> <OPTIONS> <ARGUMENTS>");
		out.println();
		for(Map.Entry<String, String> group:groupNames.entrySet()) {
			out.println(group.getValue()+":");
			for(Command command:commandsByGroup.get(group.getKey())) {
				out.println(String.format("  %-12s%s", command.getId(), command.getIntro()));
			}
			out.println();
		}
		out.println("Type java -jar "+getJarName()+" <COMMAND> --help to see the options of a command");
	}

	public void printVersion(PrintStream out) {
		printVersionHeader(out);
	}

	private void printVersionHeader(PrintStream out) {
		out.println("HMMSeq - "+swTitle);
		out.println("Version "+swVersion+" ("+releaseDate+")");
	}

	/**
	 * Assigns the options typed in the command line to the given instance of a command class.
	 * Prints the help and terminates the virtual machine if help is requested or the options are invalid
	 * @param program Object implementing one of the commands
	 * @param args Arguments typed after the command id
	 * @return int Index of the first positional argument
	 */
	public int loadOptions(Object program, String [] args) {
		Command command = getCommand(program.getClass());
		if(command==null) throw new IllegalArgumentException("Class "+program.getClass().getName()+" does not implement any command");
		if(args.length==0 || HELP_FLAGS.contains(args[0])) {
			command.printHelp(System.err, getJarName());
			System.exit(1);
		}
		try {
			return command.bindOptions(program, args);
		} catch (IllegalArgumentException e) {
			System.err.println("ERROR: "+e.getMessage());
			System.err.println();
			command.printHelp(System.err, getJarName());
			System.exit(1);
			return args.length;
		}
	}
}
