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
import org.metricshub.jbash.Jbash;
import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.command.Command;
import org.metricshub.jbash.frontend.ParserException;
import org.metricshub.jbash.runtime.Session;

/**
 * A simple command: its words are expanded, the first one names the
 * command and the others are its arguments.
 */
public class CommandNode extends Node implements Evaluable {

	private final CommandExpressionNode expression;

	public CommandNode(CommandExpressionNode expression) {
		super(requireChild(expression, "Command expression").getPosition());
		this.expression = expression;
	}

	public CommandExpressionNode getExpression() {
		return expression;
	}

	@Override
	protected List<?> children() {
		return Collections.singletonList(expression);
	}

	@Override
	public EvalOutcome evaluate(Session session) {
		List<String> words = expression.expand(session);
		if (words.isEmpty()) {
			session.setLastStatus(JbashStatus.SUCCESS);
			return EvalOutcome.SUCCESS;
		}
		Jbash shell = session.getShell();
		String name = words.get(0);
		Command command = shell.getCommand(name);
		int status;
		if (command == null) {
			shell.commandNotFound(session, name);
			status = JbashStatus.COMMAND_NOT_FOUND;
		} else {
			try {
				status = command.run(words.subList(1, words.size()), session);
			} catch (ParserException e) {
				shell.syntaxError(session, e);
				status = e.getStatus();
			}
		}
		session.setLastStatus(status);
		return EvalOutcome.of(status);
	}
}
