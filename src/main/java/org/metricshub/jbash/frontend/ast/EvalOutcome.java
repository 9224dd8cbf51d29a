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

import java.util.Locale;
import org.metricshub.jbash.JbashStatus;

/**
 * Result of evaluating a node: a status code, or a {@code break} or
 * {@code continue} travelling up to the enclosing loop.
 */
public final class EvalOutcome {

	public enum Kind {
		STATUS,
		BREAK,
		CONTINUE
	}

	public static final EvalOutcome SUCCESS = new EvalOutcome(Kind.STATUS, JbashStatus.SUCCESS);
	public static final EvalOutcome BREAK = new EvalOutcome(Kind.BREAK, JbashStatus.SUCCESS);
	public static final EvalOutcome CONTINUE = new EvalOutcome(Kind.CONTINUE, JbashStatus.SUCCESS);

	private final Kind kind;
	private final int status;

	private EvalOutcome(Kind kind, int status) {
		this.kind = kind;
		this.status = status;
	}

	/**
	 * @param status a status code
	 * @return the outcome carrying {@code status}
	 */
	public static EvalOutcome of(int status) {
		return status == JbashStatus.SUCCESS ? SUCCESS : new EvalOutcome(Kind.STATUS, status);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return whether this is a {@code break} or {@code continue}
	 */
	public boolean isSignal() {
		return kind != Kind.STATUS;
	}

	/**
	 * @return the status code, {@link JbashStatus#SUCCESS} for signals
	 */
	public int getStatus() {
		return status;
	}

	@Override
	public String toString() {
		return kind == Kind.STATUS ? "status " + status : kind.name().toLowerCase(Locale.ROOT);
	}
}
