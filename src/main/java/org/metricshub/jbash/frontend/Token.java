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

import java.nio.charset.StandardCharsets;

/**
 * A slice of the script source with its kind.
 * <p>
 * The slice is not copied: the token keeps the source bytes, an offset
 * and a length. Runs of plain characters or blanks are merged by growing
 * the length of the previous token.
 */
public final class Token {

	private final TokenType type;
	private final byte[] source;
	private final int position;
	private int length;

	Token(TokenType type, byte[] source, int position, int length) {
		this.type = type;
		this.source = source;
		this.position = position;
		this.length = length;
	}

	public TokenType getType() {
		return type;
	}

	/**
	 * @return byte offset of the token in the script
	 */
	public int getPosition() {
		return position;
	}

	/**
	 * @return length of the token in bytes
	 */
	public int getLength() {
		return length;
	}

	void extend(int bytes) {
		length += bytes;
	}

	/**
	 * @return the token text, decoded from UTF-8
	 */
	public String getText() {
		int end = Math.min(source.length, position + length);
		return new String(source, position, end - position, StandardCharsets.UTF_8);
	}

	@Override
	public String toString() {
		return type + "<" + getText() + ">@" + position;
	}
}
