package org.metricshub.jbash.command;

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
import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.frontend.ast.EvalOutcome;
import org.metricshub.jbash.frontend.ast.Evaluable;
import org.metricshub.jbash.runtime.Session;

/**
 * {@code fcall NAME args...}: calls a function defined with
 * {@code function NAME { ... }}. In the function body {@code $1}... are
 * the arguments, and argument 0 is the function name.
 */
public class FcallCommand implements Command {

	public static final String NAME = "fcall";

	public static final int PARAM_NUMBER = JbashStatus.CMD_ERROR + 1;
	public static final int FUNCTION_NOT_FOUND = JbashStatus.CMD_ERROR + 2;

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public int run(List<String> args, Session session) {
		if (args.isEmpty()) {
			session.err().print("fcall: takes >=1 parameters, but received 0.\n");
			return PARAM_NUMBER;
		}
		Evaluable function = session.getFunction(args.get(0));
		if (function == null) {
			session.err().print("fcall: " + args.get(0) + ": function not found.\n");
			return FUNCTION_NOT_FOUND;
		}
		if (!session.increaseShellDepth()) {
			session.err().print("Maximum shell depth reached.\n");
			return JbashStatus.MAX_DEPTH_REACHED;
		}
		try {
			Session call = session.functionCall(args);
			EvalOutcome outcome = function.evaluate(call);
			return outcome.isSignal() ? call.getLastStatus() : outcome.getStatus();
		} finally {
			session.decreaseShellDepth();
		}
	}
}
