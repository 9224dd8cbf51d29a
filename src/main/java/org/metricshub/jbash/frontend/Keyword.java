package org.metricshub.jbash.frontend;

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

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reserved words of the language. A word is only read as a keyword when
 * it stands alone, see {@link TokenCursor#keyword()}.
 */
public enum Keyword {
	FUNCTION("function"),
	IF("if"),
	THEN("then"),
	ELSE("else"),
	ELIF("elif"),
	FI("fi"),
	FOR("for"),
	IN("in"),
	WHILE("while"),
	UNTIL("until"),
	DO("do"),
	DONE("done"),
	CONTINUE("continue"),
	BREAK("break");

	/** Keywords ending the body of an {@code if} branch. */
	public static final Set<Keyword> IF_DELIMITER = Collections.unmodifiableSet(EnumSet.of(ELSE, ELIF, FI));

	/** Keyword ending the body of a loop. */
	public static final Set<Keyword> LOOP_DELIMITER = Collections.unmodifiableSet(EnumSet.of(DONE));

	/** Keyword ending an {@code else} branch. */
	public static final Set<Keyword> ELSE_DELIMITER = Collections.unmodifiableSet(EnumSet.of(FI));

	private static final Map<String, Keyword> KEYWORDS = new HashMap<String, Keyword>();

	static {
		for (Keyword keyword : values()) {
			KEYWORDS.put(keyword.word, keyword);
		}
	}

	private final String word;

	Keyword(String word) {
		this.word = word;
	}

	public String getWord() {
		return word;
	}

	/**
	 * @param text a word of the script
	 * @return the keyword spelled {@code text}, {@code null} if none
	 */
	public static Keyword of(String text) {
		return KEYWORDS.get(text);
	}
}
