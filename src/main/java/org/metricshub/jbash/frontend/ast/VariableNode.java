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

import org.metricshub.jbash.runtime.Session;

/** {@code $name} or {@code ${name}}: a local, else environment, variable. */
public class VariableNode extends ValueNode {

	private final String name;
	private final boolean braced;

	public VariableNode(int position, String name, boolean braced) {
		super(position);
		this.name = requireChild(name, "Variable name");
		this.braced = braced;
	}

	public String getName() {
		return name;
	}

	public boolean isBraced() {
		return braced;
	}

	@Override
	public String getValue(Session session) {
		return session.resolve(name);
	}

	@Override
	public String toString() {
		return braced ? "Variable ${" + name + "}" : "Variable $" + name;
	}
}
