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

import java.util.Collections;
import java.util.List;
import org.metricshub.jbash.runtime.Session;

/**
 * {@code command &}. Jobs are not supported: the command is kept in the
 * tree but never run, and the node succeeds.
 */
public class BackgroundNode extends Node implements Evaluable {

	private final Evaluable command;

	public BackgroundNode(int position, Evaluable command) {
		super(position);
		this.command = requireChild(command, "Background command");
	}

	public Evaluable getCommand() {
		return command;
	}

	@Override
	protected List<?> children() {
		return Collections.singletonList(command);
	}

	@Override
	public EvalOutcome evaluate(Session session) {
		session.setLastStatus(EvalOutcome.SUCCESS.getStatus());
		return EvalOutcome.SUCCESS;
	}
}
