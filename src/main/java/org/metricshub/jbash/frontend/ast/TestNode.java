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
import org.metricshub.jbash.command.Command;
import org.metricshub.jbash.command.TestCommand;
import org.metricshub.jbash.frontend.ParserException;
import org.metricshub.jbash.runtime.Session;

/**
 * {@code [ expression ]}: the expanded words are given to the
 * {@code test} command of the shell, or to the built-in one if the shell
 * has none.
 */
public class TestNode extends Node implements Evaluable {

	private static final Command DEFAULT_TEST = new TestCommand();

	private final CommandExpressionNode expression;

	public TestNode(int position, CommandExpressionNode expression) {
		super(position);
		this.expression = requireChild(expression, "Test expression");
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
		Jbash shell = session.getShell();
		Command test = shell.getCommand(TestCommand.NAME);
		if (test == null) {
			test = DEFAULT_TEST;
		}
		int status;
		try {
			status = test.run(words, session);
		} catch (ParserException e) {
			shell.syntaxError(session, e);
			status = e.getStatus();
		}
		session.setLastStatus(status);
		return EvalOutcome.of(status);
	}
}
