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

import java.util.Arrays;
import java.util.List;
import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.runtime.Session;

/**
 * {@code if condition; then ... [elif ...] [else ...] fi}. An
 * {@code elif} is read as an {@code else} branch holding another
 * {@code IfNode}.
 */
public class IfNode extends Node implements Evaluable {

	private final Evaluable condition;
	private final Evaluable thenBranch;
	private final Evaluable elseBranch;

	/**
	 * @param position byte offset of the {@code if} keyword
	 * @param condition the condition
	 * @param thenBranch commands run when the condition succeeds
	 * @param elseBranch commands run otherwise, {@code null} if there is no
	 *        {@code else} branch
	 */
	public IfNode(int position, Evaluable condition, Evaluable thenBranch, Evaluable elseBranch) {
		super(position);
		this.condition = requireChild(condition, "If condition");
		this.thenBranch = requireChild(thenBranch, "If body");
		this.elseBranch = elseBranch;
	}

	public Evaluable getCondition() {
		return condition;
	}

	public Evaluable getThenBranch() {
		return thenBranch;
	}

	public Evaluable getElseBranch() {
		return elseBranch;
	}

	@Override
	protected List<?> children() {
		return Arrays.asList(condition, thenBranch, elseBranch);
	}

	@Override
	public EvalOutcome evaluate(Session session) {
		EvalOutcome outcome = condition.evaluate(session);
		if (outcome.isSignal()) {
			return outcome;
		}
		if (outcome.getStatus() == JbashStatus.SUCCESS) {
			return thenBranch.evaluate(session);
		}
		if (elseBranch != null) {
			return elseBranch.evaluate(session);
		}
		return EvalOutcome.of(session.getLastStatus());
	}
}
