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

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;

/**
 * Base class of the syntax tree. Every node remembers the byte offset in
 * the script it was read from.
 */
public abstract class Node {

	private final int position;

	protected Node(int position) {
		this.position = position;
	}

	/**
	 * @return byte offset of the node in the script
	 */
	public int getPosition() {
		return position;
	}

	/**
	 * Sub-nodes shown by {@link #dump(PrintStream)}. {@code null} entries
	 * are skipped.
	 *
	 * @return the sub-nodes, in source order
	 */
	protected List<?> children() {
		return Collections.emptyList();
	}

	/**
	 * Prints the tree rooted at this node, one node per line, each level
	 * indented by one space.
	 *
	 * @param ps stream to print to
	 */
	public final void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int level) {
		for (int i = 0; i < level; i++) {
			ps.print(' ');
		}
		ps.println(this);
		for (Object child : children()) {
			if (child instanceof Node) {
				((Node) child).dump(ps, level + 1);
			}
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName();
	}

	static <T> T requireChild(T child, String what) {
		if (child == null) {
			throw new IllegalArgumentException(what + " must not be null");
		}
		return child;
	}
}
