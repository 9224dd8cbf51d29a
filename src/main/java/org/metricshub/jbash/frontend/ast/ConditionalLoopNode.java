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
import org.metricshub.jbash.runtime.Session;

/**
 * A loop that evaluates its condition before each iteration.
 */
public abstract class ConditionalLoopNode extends Node implements Evaluable {

	private final Evaluable condition;
	private final Evaluable body;

	protected ConditionalLoopNode(int position, Evaluable condition, Evaluable body) {
		super(position);
		this.condition = requireChild(condition, "Loop condition");
		this.body = requireChild(body, "Loop body");
	}

	public Evaluable getCondition() {
		return condition;
	}

	public Evaluable getBody() {
		return body;
	}

	@Override
	protected List<?> children() {
		return Arrays.asList(condition, body);
	}

	/**
	 * @param status status of the condition
	 * @return whether to run the body once more
	 */
	protected abstract boolean proceed(int status);

	@Override
	public EvalOutcome evaluate(Session session) {
		while (proceed(condition.evaluate(session).getStatus())) {
			if (body.evaluate(session) == EvalOutcome.BREAK) {
				break;
			}
		}
		return EvalOutcome.of(session.getLastStatus());
	}
}
