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
import org.metricshub.jbash.runtime.Session;

/**
 * A command a script can call by name.
 * <p>
 * Commands write their results to {@link Session#out()} and their error
 * messages to {@link Session#err()}, and return a status code:
 * {@code 0} on success, {@code JbashStatus.CMD_ERROR + n} for their own
 * failures.
 */
public interface Command {

	/**
	 * @return the name scripts call the command with
	 */
	String getName();

	/**
	 * Runs the command.
	 *
	 * @param args the arguments, command name excluded
	 * @param session session of the caller
	 * @return the status code
	 */
	int run(List<String> args, Session session);
}
