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
import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.runtime.Session;
import org.metricshub.jbash.runtime.Variables;

/**
 * {@code function name { ... }}: defines a function in the session,
 * called later with {@code fcall}.
 * <p>
 * The name is expanded when the definition runs and must then be a
 * single identifier.
 */
public class FunctionNode extends Node implements Evaluable {

	private final CommandExpressionNode name;
	private final Evaluable body;

	public FunctionNode(int position, CommandExpressionNode name, Evaluable body) {
		super(position);
		this.name = requireChild(name, "Function name");
		this.body = requireChild(body, "Function body");
	}

	public CommandExpressionNode getName() {
		return name;
	}

	public Evaluable getBody() {
		return body;
	}

	@Override
	protected List<?> children() {
		return Arrays.asList(name, body);
	}

	@Override
	public EvalOutcome evaluate(Session session) {
		List<String> words = name.expand(session);
		if (words.size() != 1 || !Variables.isVar(words.get(0))) {
			session.getShell().invalidFunctionName(session, String.join(" ", words));
			session.setLastStatus(JbashStatus.INVALID_FUNCTION_NAME);
			return EvalOutcome.of(JbashStatus.INVALID_FUNCTION_NAME);
		}
		session.setFunction(words.get(0), body);
		session.setLastStatus(JbashStatus.SUCCESS);
		return EvalOutcome.SUCCESS;
	}
}
