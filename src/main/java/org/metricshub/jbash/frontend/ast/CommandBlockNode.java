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
 * A sequence of commands run one after the other in the same session.
 * The status of the block is the status of its last command.
 */
public class CommandBlockNode extends Node implements Evaluable {

	private final List<Evaluable> commands;

	public CommandBlockNode(int position, List<Evaluable> commands) {
		super(position);
		if (commands == null || commands.isEmpty()) {
			throw new IllegalArgumentException("Command block must not be empty");
		}
		for (Evaluable command : commands) {
			requireChild(command, "Block command");
		}
		this.commands = Collections.unmodifiableList(new ArrayList<Evaluable>(commands));
	}

	public List<Evaluable> getCommands() {
		return commands;
	}

	@Override
	protected List<?> children() {
		return commands;
	}

	@Override
	public EvalOutcome evaluate(Session session) {
		for (Evaluable command : commands) {
			EvalOutcome outcome = command.evaluate(session);
			if (outcome.isSignal()) {
				return outcome;
			}
		}
		return EvalOutcome.of(session.getLastStatus());
	}
}
