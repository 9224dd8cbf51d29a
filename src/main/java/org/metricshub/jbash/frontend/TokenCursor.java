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

import java.util.List;

/**
 * Walks through a token list with one token of look-back and look-ahead.
 * <p>
 * The cursor starts before the first token: the first call to
 * {@link #get()} returns it. Moving past either end yields {@code null}.
 */
public class TokenCursor {

	private final List<Token> tokens;
	private final int sourceLength;
	private int index = -1;

	/**
	 * @param tokens the tokens to walk through
	 * @param sourceLength length in bytes of the script, used as the
	 *        position once the tokens are exhausted
	 */
	public TokenCursor(List<Token> tokens, int sourceLength) {
		this.tokens = tokens;
		this.sourceLength = sourceLength;
	}

	private Token at(int i) {
		return i >= 0 && i < tokens.size() ? tokens.get(i) : null;
	}

	/**
	 * Advances to the next token.
	 *
	 * @return the new current token, {@code null} at the end
	 */
	public Token get() {
		index++;
		return at(index);
	}

	/** Moves one token back, so the next {@link #get()} reads the current token again. */
	public void putBack() {
		index--;
	}

	public Token current() {
		return at(index);
	}

	public Token next() {
		return at(index + 1);
	}

	public Token previous() {
		return at(index - 1);
	}

	/**
	 * @return the byte offset of the current token, or the script length
	 *         when there is none
	 */
	public int position() {
		Token current = current();
		return current == null ? sourceLength : current.getPosition();
	}

	public boolean is(TokenType type) {
		Token current = current();
		return current != null && current.getType() == type;
	}

	public boolean isNext(TokenType type) {
		Token next = next();
		return next != null && next.getType() == type;
	}

	/** Advances while the current token is a blank. */
	public void skipSpaces() {
		while (is(TokenType.SPACE)) {
			get();
		}
	}

	/**
	 * Reads the current token as a keyword. A word is a keyword when it is
	 * followed by the end of the script, a blank, a command separator or
	 * a bracket.
	 *
	 * @return the keyword, {@code null} if the current token is not one
	 */
	public Keyword keyword() {
		Token current = current();
		if (current == null || current.getType() != TokenType.WORD) {
			return null;
		}
		Token next = next();
		if (next != null) {
			switch (next.getType()) {
			case SPACE:
			case CMD_SEPARATOR:
			case OPEN_PARENTHESIS:
			case CLOSE_PARENTHESIS:
			case OPEN_BRACKETS:
			case CLOSE_BRACKETS:
			case OPEN_SQR_BRACKETS:
			case CLOSE_SQR_BRACKETS:
				break;
			default:
				return null;
			}
		}
		return Keyword.of(current.getText());
	}

	public boolean isKeyword(Keyword keyword) {
		return keyword() == keyword;
	}
}
