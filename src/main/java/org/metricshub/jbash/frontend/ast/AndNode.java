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

import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.runtime.Session;

/** {@code left && right}: runs the right command only when the left one succeeds. */
public class AndNode extends OperatorNode {

	AndNode(int position) {
		super(position, AND_PRIORITY);
	}

	@Override
	public EvalOutcome evaluate(Session session) {
		EvalOutcome outcome = getLeft().evaluate(session);
		if (outcome.isSignal() || outcome.getStatus() != JbashStatus.SUCCESS) {
			return outcome;
		}
		return getRight().evaluate(session);
	}
}
