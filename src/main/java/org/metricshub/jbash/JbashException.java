package org.metricshub.jbash;

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

/**
 * A runtime exception thrown by Jbash. It is provided
 * to conveniently distinguish between interpreter
 * failures and other runtime exceptions.
 */
public class JbashException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int status;

	/**
	 * <p>
	 * Constructor for JbashException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public JbashException(String msg) {
		super(msg);
		this.status = JbashStatus.ERROR;
	}

	public JbashException(String msg, Throwable cause) {
		super(msg, cause);
		this.status = JbashStatus.ERROR;
	}

	/**
	 * <p>
	 * Constructor for JbashException.
	 * </p>
	 *
	 * @param status the status code this failure maps to
	 * @param msg a {@link java.lang.String} object
	 */
	public JbashException(int status, String msg) {
		super(msg);
		this.status = status;
	}

	/**
	 * Returns the status code a script reports when it fails with this
	 * exception.
	 *
	 * @return one of the {@link JbashStatus} codes
	 */
	public int getStatus() {
		return status;
	}
}
