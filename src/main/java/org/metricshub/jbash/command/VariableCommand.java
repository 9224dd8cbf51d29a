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
import org.metricshub.jbash.runtime.Session;
import org.metricshub.jbash.runtime.Variables;

/**
 * Reads or writes one variable of the session. The first argument is
 * the variable name, checked to be an identifier.
 */
public abstract class VariableCommand implements Command {

	/** Wrong number of arguments. */
	public static final int PARAM_NUMBER = JbashStatus.CMD_ERROR + 1;
	/** The name is not an identifier. */
	public static final int INVALID_NAME = JbashStatus.CMD_ERROR + 2;

	private final String name;
	private final int arity;

	protected VariableCommand(String name, int arity) {
		this.name = name;
		this.arity = arity;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public int run(List<String> args, Session session) {
		if (args.size() != arity) {
			session.err().print(name + ": takes " + arity + (arity == 1 ? " parameter" : " parameters")
					+ ", but received " + args.size() + ".\n");
			return PARAM_NUMBER;
		}
		String variable = args.get(0);
		if (!Variables.isVar(variable)) {
			session.err().print(name + ": “" + variable + "”: not a variable name.\n");
			return INVALID_NAME;
		}
		apply(variable, args, session);
		return JbashStatus.SUCCESS;
	}

	/**
	 * @param variable the checked variable name
	 * @param args all the arguments
	 * @param session session of the caller
	 */
	protected abstract void apply(String variable, List<String> args, Session session);
}
