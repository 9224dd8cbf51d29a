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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import org.metricshub.jbash.JbashException;
import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.runtime.Session;

/** {@code cat}: copies its standard input to its standard output. */
public class CatCommand implements Command {

	public static final String NAME = "cat";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public int run(List<String> args, Session session) {
		InputStream in = session.in();
		if (in == null) {
			return JbashStatus.SUCCESS;
		}
		try {
			byte[] buffer = new byte[4096];
			int read;
			while ((read = in.read(buffer)) >= 0) {
				session.out().write(buffer, 0, read);
			}
			session.out().flush();
		} catch (IOException e) {
			throw new JbashException("Failed to read the standard input of cat", new UncheckedIOException(e));
		}
		return JbashStatus.SUCCESS;
	}
}
