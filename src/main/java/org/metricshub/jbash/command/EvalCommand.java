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
 * {@code eval args...}: runs its arguments, joined without separator, as a
 * script in the caller's session.
 */
public class EvalCommand implements Command {

	public static final String NAME = "eval";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public int run(List<String> args, Session session) {
		String script = String.join("", args);
		if (!session.increaseShellDepth()) {
			session.err().print("Maximum shell depth reached.\n");
			return JbashStatus.MAX_DEPTH_REACHED;
		}
		try {
			return session.getShell().run(script, session);
		} finally {
			session.decreaseShellDepth();
		}
	}
}
