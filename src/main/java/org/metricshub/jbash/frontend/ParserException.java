package org.metricshub.jbash.frontend;

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

import org.metricshub.jbash.JbashException;
import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.util.Utf8Positions;

/**
 * Thrown when a script cannot be tokenized or parsed.
 * <p>
 * The message points at the offending byte:
 *
 * <pre>
 * Unclosed double quotes
 * echo "abc
 *      ^~~~
 * Code point: 5
 * Byte: 5
 * </pre>
 */
public class ParserException extends JbashException {

	private static final long serialVersionUID = 1L;

	private final int position;
	private final int codePoint;

	/**
	 * @param status one of the syntax error codes of {@link JbashStatus}
	 * @param source the UTF-8 bytes of the script
	 * @param position byte offset of the failure in {@code source}
	 */
	public ParserException(int status, byte[] source, int position) {
		super(status, buildMessage(status, source, position));
		this.position = position;
		this.codePoint = Utf8Positions.codePointIndex(source, 0, source.length, position);
	}

	/**
	 * @return the byte offset of the failure in the script
	 */
	public int getPosition() {
		return position;
	}

	/**
	 * @return the code point index of the failure in the script
	 */
	public int getCodePoint() {
		return codePoint;
	}

	private static String buildMessage(int status, byte[] source, int position) {
		int column;
		if (position >= source.length) {
			column = position;
		} else {
			int lineStart = Utf8Positions.lineStart(source, position);
			column = Utf8Positions.codePointIndex(source, lineStart, source.length, position);
		}
		StringBuilder message = new StringBuilder();
		message.append(JbashStatus.message(status)).append('\n');
		message.append(Utf8Positions.lineAt(source, position)).append('\n');
		for (int i = 0; i < column; i++) {
			message.append(' ');
		}
		message.append("^~~~\n");
		message.append("Code point: ").append(Utf8Positions.codePointIndex(source, 0, source.length, position)).append('\n');
		message.append("Byte: ").append(position).append('\n');
		return message.toString();
	}
}
