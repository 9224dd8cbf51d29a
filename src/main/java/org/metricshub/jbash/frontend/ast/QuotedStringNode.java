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
 * A quoted string. Its parts are expanded without splitting and joined
 * into a single word, possibly empty.
 */
public abstract class QuotedStringNode extends Node implements Expandable {

	private final List<Expandable> parts;

	protected QuotedStringNode(int position, List<Expandable> parts) {
		super(position);
		requireChild(parts, "String parts");
		for (Expandable part : parts) {
			requireChild(part, "String part");
		}
		this.parts = Collections.unmodifiableList(new ArrayList<Expandable>(parts));
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
		StringBuilder text = new StringBuilder();
		List<String> partWords = new ArrayList<String>();
		for (Expandable part : parts) {
			partWords.clear();
			part.expand(partWords, session, false);
			for (String word : partWords) {
				text.append(word);
			}
		}
		words.add(text.toString());
	}
}
