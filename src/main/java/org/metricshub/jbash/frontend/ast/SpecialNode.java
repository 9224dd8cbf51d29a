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

/**
 * Special parameters:
 * <ul>
 * <li>{@code $0}: the shell name, {@value #SHELL_NAME}</li>
 * <li>{@code $$}: the process id</li>
 * <li>{@code $?}: status of the last command</li>
 * <li>{@code $#}: number of positional arguments</li>
 * <li>{@code $@}: positional arguments joined with blanks</li>
 * </ul>
 */
public class SpecialNode extends ValueNode {

	public static final String SHELL_NAME = "emptyset";

	private final char name;

	public SpecialNode(int position, char name) {
		super(position);
		this.name = name;
	}

	public char getName() {
		return name;
	}

	@Override
	public String getValue(Session session) {
		switch (name) {
		case '0':
			return SHELL_NAME;
		case '$':
			return Long.toString(ProcessHandle.current().pid());
		case '?':
			return Integer.toString(session.getLastStatus());
		case '#':
			return Integer.toString(Math.max(0, session.getArgs().size() - 1));
		case '@':
			List<String> args = session.getArgs();
			return args.size() > 1 ? String.join(" ", args.subList(1, args.size())) : "";
		default:
			return "$";
		}
	}

	@Override
	public String toString() {
		return "Special $" + name;
	}
}
