package org.metricshub.jbash.runtime;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jbash
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical rules on names and values shared by the parser and the
 * commands.
 */
public final class Variables {

	private static final int MAX_ARG_DIGITS = 19;
	private static final int MAX_NUMBER_DIGITS = 18;

	private Variables() {}

	/**
	 * @param text a name
	 * @return whether {@code text} names a positional argument: 1 to 19
	 *         digits
	 */
	public static boolean isArg(String text) {
		if (text.isEmpty() || text.length() > MAX_ARG_DIGITS) {
			return false;
		}
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c < '0' || c > '9') {
				return false;
			}
		}
		return true;
	}

	/**
	 * @param text a name
	 * @return whether {@code text} is an identifier:
	 *         {@code [A-Za-z_][A-Za-z0-9_]*}
	 */
	public static boolean isVar(String text) {
		if (text.isEmpty()) {
			return false;
		}
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			boolean letter = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
			if (!letter && (i == 0 || c < '0' || c > '9')) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @param text a value
	 * @return whether {@code text} is a decimal integer with an optional
	 *         sign and at most 18 digits, so that it fits a {@code long}
	 */
	public static boolean isNumber(String text) {
		int start = 0;
		if (!text.isEmpty() && (text.charAt(0) == '-' || text.charAt(0) == '+')) {
			start = 1;
		}
		int digits = text.length() - start;
		if (digits < 1 || digits > MAX_NUMBER_DIGITS) {
			return false;
		}
		for (int i = start; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c < '0' || c > '9') {
				return false;
			}
		}
		return true;
	}

	/**
	 * Parses the index of a positional argument.
	 *
	 * @param text a name for which {@link #isArg(String)} holds
	 * @return the index, {@link Integer#MAX_VALUE} when it does not fit an int
	 */
	public static int argIndex(String text) {
		try {
			long value = Long.parseLong(text);
			return value > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) value;
		} catch (NumberFormatException e) {
			return Integer.MAX_VALUE;
		}
	}

	/**
	 * Splits a value into words on blanks and newlines, dropping the
	 * empty ones.
	 *
	 * @param text the value to split
	 * @param words list the words are added to
	 */
	public static void split(String text, List<String> words) {
		int start = -1;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == ' ' || c == '\t' || c == '\n') {
				if (start >= 0) {
					words.add(text.substring(start, i));
					start = -1;
				}
			} else if (start < 0) {
				start = i;
			}
		}
		if (start >= 0) {
			words.add(text.substring(start));
		}
	}

	/**
	 * @param text the value to split
	 * @return the words of {@code text}
	 * @see #split(String, List)
	 */
	public static List<String> split(String text) {
		List<String> words = new ArrayList<String>();
		split(text, words);
		return words;
	}
}
