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

import java.io.PrintStream;
import java.util.List;
import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.runtime.Session;
import org.metricshub.jbash.runtime.Variables;

/**
 * {@code seq FIRST [STEP] LAST}: prints the integers from {@code FIRST}
 * to {@code LAST}, separated by blanks, without trailing newline. With
 * two arguments the step is {@code 1} or {@code -1}.
 */
public class SeqCommand implements Command {

	public static final String NAME = "seq";

	public static final int PARAM_NUMBER = JbashStatus.CMD_ERROR + 1;
	public static final int INVALID_INT_FORMAT = JbashStatus.CMD_ERROR + 2;
	public static final int ITERATION_LOGIC = JbashStatus.CMD_ERROR + 4;

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public int run(List<String> args, Session session) {
		if (args.size() != 2 && args.size() != 3) {
			session.err().print("seq: takes 2-3 parameters, but received " + args.size() + ".\n");
			return PARAM_NUMBER;
		}
		long[] values = new long[3];
		for (int i = 0; i < args.size(); i++) {
			if (!Variables.isNumber(args.get(i))) {
				session.err().print("seq: value “" + args.get(i) + "” is no integer\n");
				return INVALID_INT_FORMAT;
			}
			values[i] = Long.parseLong(args.get(i));
		}
		long first = values[0];
		long step;
		long last;
		if (args.size() == 2) {
			last = values[1];
			step = first > last ? -1 : 1;
		} else {
			step = values[1];
			last = values[2];
			if ((first > last && step >= 0) || (first < last && step <= 0)) {
				session.err().print("seq: can not iterate: [ " + first + " : " + step + " : " + last + " ]\n");
				return ITERATION_LOGIC;
			}
		}

		PrintStream out = session.out();
		out.print(first);
		long current = first;
		while (true) {
			long next = current + step;
			// stop on long overflow as well as past the bound
			boolean overflow = ((current ^ next) & (step ^ next)) < 0;
			if (overflow || (step > 0 ? next > last : next < last) || first == last) {
				break;
			}
			out.print(' ');
			out.print(next);
			current = next;
		}
		return JbashStatus.SUCCESS;
	}
}
