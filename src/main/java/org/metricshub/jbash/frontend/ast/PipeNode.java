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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.metricshub.jbash.runtime.Session;

/**
 * {@code left | right}. The left command runs to completion first; its
 * output is then the input of the right command.
 */
public class PipeNode extends OperatorNode {

	PipeNode(int position) {
		super(position, PIPE_PRIORITY);
	}

	@Override
	public EvalOutcome evaluate(Session session) {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		PrintStream pipe = new PrintStream(buffer, true, StandardCharsets.UTF_8);
		getLeft().evaluate(session.pipeLeft(pipe));
		pipe.flush();
		Session rightSession = session.pipeRight(new ByteArrayInputStream(buffer.toByteArray()));
		EvalOutcome outcome = getRight().evaluate(rightSession);
		session.setLastStatus(rightSession.getLastStatus());
		return outcome;
	}
}
