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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import org.metricshub.jbash.runtime.Session;
import org.metricshub.jbash.runtime.Variables;

/**
 * Command substitution: the command runs in a subshell and its standard
 * output becomes the value of the node.
 */
public abstract class SubstitutionNode extends Node implements Expandable {

	private final Evaluable command;

	protected SubstitutionNode(int position, Evaluable command) {
		super(position);
		this.command = requireChild(command, "Substituted command");
	}

	public Evaluable getCommand() {
		return command;
	}

	@Override
	protected List<?> children() {
		return Collections.singletonList(command);
	}

	@Override
	public void expand(List<String> words, Session session, boolean split) {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8);
		command.evaluate(session.subshell(session.in(), capture, session.err()));
		capture.flush();
		String output = new String(buffer.toByteArray(), StandardCharsets.UTF_8);
		if (split) {
			Variables.split(output, words);
		} else {
			words.add(output);
		}
	}
}
