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

import java.util.Arrays;
import java.util.List;
import org.metricshub.jbash.runtime.Session;

/**
 * {@code for name in words; do ... done}. The loop variable is a local
 * variable of the session.
 */
public class ForNode extends Node implements Evaluable {

	private final String variable;
	private final CommandExpressionNode sequence;
	private final Evaluable body;

	public ForNode(int position, String variable, CommandExpressionNode sequence, Evaluable body) {
		super(position);
		this.variable = requireChild(variable, "Loop variable");
		this.sequence = requireChild(sequence, "Loop sequence");
		this.body = requireChild(body, "Loop body");
	}

	public String getVariable() {
		return variable;
	}

	public CommandExpressionNode getSequence() {
		return sequence;
	}

	public Evaluable getBody() {
		return body;
	}

	@Override
	protected List<?> children() {
		return Arrays.asList(sequence, body);
	}

	@Override
	public EvalOutcome evaluate(Session session) {
		for (String item : sequence.expand(session)) {
			session.setVar(variable, item);
			if (body.evaluate(session) == EvalOutcome.BREAK) {
				break;
			}
		}
		return EvalOutcome.of(session.getLastStatus());
	}

	@Override
	public String toString() {
		return "ForNode " + variable;
	}
}
