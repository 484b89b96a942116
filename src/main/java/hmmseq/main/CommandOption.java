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

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * Option of a command bound to a setter of the class implementing the command.
 * Setters receive the raw text of the option and decode it themselves
 */
public class CommandOption {
	private final String id;
	private final OptionType type;
	private final Method setter;
	private final String description;
	private final String defaultValue;

	public CommandOption(String id, OptionType type, Method setter, String description, String defaultValue) {
		super();
		if(setter.getParameterCount()!=1 || !String.class.equals(setter.getParameterTypes()[0])) {
			throw new IllegalArgumentException("Setter "+setter.getName()+" for option -"+id+" must receive a single String");
		}
		this.id = id;
		this.type = type;
		this.setter = setter;
		this.description = description;
		this.defaultValue = defaultValue;
	}
	public String getId() {
		return id;
	}
	public OptionType getType() {
		return type;
	}
	public String getSetterName() {
		return setter.getName();
	}
	public String getDescription() {
		return description;
	}
	/**
	 * @return String Default value as shown in the help. Null if the option does not have a default value
	 */
	public String getDefaultValue() {
		return defaultValue;
	}

	/**
	 * Checks the given value against the type of this option and passes it to the setter
	 * @param program Instance of the class implementing the command
	 * @param value Text typed in the command line
	 * @throws IllegalArgumentException If the value is not valid for this option
	 */
	public void assign(Object program, String value) {
		try {
			type.decode(value);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid value for option -"+id+". "+e.getMessage(), e);
		}
		try {
			setter.invoke(program, value);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if(cause instanceof IllegalArgumentException || cause instanceof IOException) {
				throw new IllegalArgumentException("Invalid value "+value+" for option -"+id+". "+cause.getMessage(), cause);
			}
			throw new IllegalStateException("Unexpected error setting option -"+id, cause);
		} catch (IllegalAccessException e) {
			throw new IllegalStateException("Setter "+setter.getName()+" of option -"+id+" is not accessible", e);
		}
	}
}
