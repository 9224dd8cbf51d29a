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

/**
 * {@code echo [-n] args...}: prints its arguments separated by blanks,
 * followed by a newline unless the first argument is {@code -n}.
 */
public class EchoCommand implements Command {

	public static final String NAME = "echo";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public int run(List<String> args, Session session) {
		boolean newline = true;
		int begin = 0;
		if (!args.isEmpty() && "-n".equals(args.get(0))) {
			newline = false;
			begin = 1;
		}
		StringBuilder line = new StringBuilder();
		for (int i = begin; i < args.size(); i++) {
			if (i > begin) {
				line.append(' ');
			}
			line.append(args.get(i));
		}
		if (newline) {
			line.append('\n');
		}
		session.out().print(line);
		return JbashStatus.SUCCESS;
	}
}
