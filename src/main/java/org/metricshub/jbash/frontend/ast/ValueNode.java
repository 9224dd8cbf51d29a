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

import java.util.List;
import org.metricshub.jbash.runtime.Session;
import org.metricshub.jbash.runtime.Variables;

/**
 * A {@code $} reference whose value is read from the session.
 */
public abstract class ValueNode extends Node implements Expandable {

	protected ValueNode(int position) {
		super(position);
	}

	/**
	 * @param session session to read from
	 * @return the value, {@code ""} when unset
	 */
	public abstract String getValue(Session session);

	@Override
	public void expand(List<String> words, Session session, boolean split) {
		String value = getValue(session);
		if (split) {
			Variables.split(value, words);
		} else {
			words.add(value);
		}
	}

	/**
	 * Dereferences a name read from a variable: an argument index, then a
	 * local variable, then an environment variable.
	 */
	static String dereference(String name, Session session) {
		if (Variables.isArg(name)) {
			return session.getArg(Variables.argIndex(name));
		}
		return session.resolve(name);
	}
}
