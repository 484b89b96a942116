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

/**
 * Types of the values that can be assigned to command line options
 */
public enum OptionType {
	INT ("integer number"),
	LONG ("integer number"),
	FILE ("file path"),
	STRING ("text");

	private final String valueDescription;

	private OptionType(String valueDescription) {
		this.valueDescription = valueDescription;
	}

	public String getValueDescription() {
		return valueDescription;
	}

	/**
	 * Converts the given text to a value of this type
	 * @param value Text typed in the command line
	 * @return Object Integer, Long or String depending on this type
	 * @throws IllegalArgumentException If the text is empty or it is not a number for numeric types
	 */
	public Object decode(String value) {
		if(value==null || value.trim().length()==0) throw new IllegalArgumentException("Expected a "+valueDescription+" but the value is empty");
		try {
			switch (this) {
			case INT:
				return Integer.valueOf(value.trim());
			case LONG:
				return Long.valueOf(value.trim());
			default:
				return value;
			}
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Expected a "+valueDescription+" but found "+value, e);
		}
	}
}
