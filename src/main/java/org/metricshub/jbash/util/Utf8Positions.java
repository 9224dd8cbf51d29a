package org.metricshub.jbash.util;

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
 * Conversions between byte offsets in UTF-8 encoded source text and the
 * lines and code points a reader sees.
 */
public final class Utf8Positions {

	private Utf8Positions() {}

	/**
	 * Returns the index of the code point that contains the byte at
	 * {@code pos}, counting from {@code start}.
	 * <p>
	 * When {@code pos} is beyond {@code end}, or an invalid lead byte is
	 * met on the way, the byte distance {@code pos - start} is returned.
	 *
	 * @param text UTF-8 bytes
	 * @param start first byte of the range to count in
	 * @param end end (exclusive) of the range to count in
	 * @param pos byte offset to locate
	 * @return the code point index of {@code pos} relative to {@code start}
	 */
	public static int codePointIndex(byte[] text, int start, int end, int pos) {
		if (pos >= end) {
			return pos - start;
		}
		int index = 0;
		int i = start;
		while (i < end) {
			int length = sequenceLength(text[i]);
			if (length == 0) {
				return pos - start;
			}
			if (pos < i + length) {
				return index;
			}
			i += length;
			index++;
		}
		return pos - start;
	}

	/**
	 * @param lead first byte of a UTF-8 sequence
	 * @return the length of the sequence, {@code 0} for an invalid lead byte
	 */
	static int sequenceLength(byte lead) {
		int b = lead & 0xFF;
		if (b < 0x80) {
			return 1;
		}
		if ((b & 0xE0) == 0xC0) {
			return 2;
		}
		if ((b & 0xF0) == 0xE0) {
			return 3;
		}
		if ((b & 0xF8) == 0xF0) {
			return 4;
		}
		return 0;
	}

	/**
	 * Returns the offset of the first byte of the line holding {@code pos}.
	 * A newline byte belongs to the line it terminates.
	 *
	 * @param text UTF-8 bytes
	 * @param pos a byte offset, lower than {@code text.length}
	 * @return the offset where the line starts
	 */
	public static int lineStart(byte[] text, int pos) {
		int i = pos - 1;
		while (i >= 0 && text[i] != '\n') {
			i--;
		}
		return i + 1;
	}

	/**
	 * Returns the offset just after the last byte of the line holding
	 * {@code pos}, newline excluded.
	 *
	 * @param text UTF-8 bytes
	 * @param pos a byte offset, lower than {@code text.length}
	 * @return the offset where the line ends
	 */
	public static int lineEnd(byte[] text, int pos) {
		int i = pos;
		while (i < text.length && text[i] != '\n') {
			i++;
		}
		return i;
	}

	/**
	 * @param text UTF-8 bytes
	 * @param pos a byte offset
	 * @return the line holding {@code pos}, or an empty string when
	 *         {@code pos} is past the end of the text
	 */
	public static String lineAt(byte[] text, int pos) {
		if (pos >= text.length) {
			return "";
		}
		int start = lineStart(text, pos);
		return new String(text, start, lineEnd(text, pos) - start, StandardCharsets.UTF_8);
	}
}
