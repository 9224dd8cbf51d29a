package org.metricshub.jbash.frontend.ast;

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
import java.util.Collections;
import java.util.List;
import org.metricshub.jbash.runtime.Session;

/**
 * The words of a command line.
 * <p>
 * Parts written next to each other are glued into one word; a
 * {@code null} part stands for the blanks separating two words. When a
 * part expands to several words, its first word is glued to what comes
 * before and its last word to what comes after, so that with
 * {@code x="1 2 3"}, {@code a${x}b} expands to {@code a1}, {@code 2} and
 * {@code 3b}.
 */
public class CommandExpressionNode extends Node implements Expandable {

	private final List<Expandable> parts;

	/**
	 * @param parts the parts of the line, {@code null} marking a word
	 *        boundary; the first one must not be {@code null}
	 */
	public CommandExpressionNode(List<Expandable> parts) {
		super(positionOf(parts));
		this.parts = Collections.unmodifiableList(new ArrayList<Expandable>(parts));
	}

	private static int positionOf(List<Expandable> parts) {
		if (parts == null || parts.isEmpty()) {
			throw new IllegalArgumentException("Command expression must not be empty");
		}
		if (!(parts.get(0) instanceof Node)) {
			throw new IllegalArgumentException("Command expression must start with a word");
		}
		return ((Node) parts.get(0)).getPosition();
	}

	public List<Expandable> getParts() {
		return parts;
	}

	@Override
	protected List<?> children() {
		return parts;
	}

	@Override
	public void expand(List<String> words, Session session, boolean split) {
		StringBuilder word = new StringBuilder();
		boolean pending = false;
		List<String> partWords = new ArrayList<String>();
		for (Expandable part : parts) {
			if (part == null) {
				if (pending) {
					words.add(word.toString());
					word.setLength(0);
					pending = false;
				}
				continue;
			}
			partWords.clear();
			part.expand(partWords, session, true);
			int count = partWords.size();
			if (count == 0) {
				continue;
			}
			word.append(partWords.get(0));
			pending = true;
			if (count > 1) {
				words.add(word.toString());
				words.addAll(partWords.subList(1, count - 1));
				word.setLength(0);
				word.append(partWords.get(count - 1));
			}
		}
		if (pending) {
			words.add(word.toString());
		}
	}

	/**
	 * Expands this expression with word splitting.
	 *
	 * @param session session to expand in
	 * @return the words
	 */
	public List<String> expand(Session session) {
		List<String> words = new ArrayList<String>();
		expand(words, session, true);
		return words;
	}
}
