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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.util.JbashLogger;
import org.slf4j.Logger;

/**
 * Splits the UTF-8 bytes of a script into {@link Token}s.
 * <p>
 * The lexer works on bytes: every delimiter of the language is ASCII, and
 * any other byte (including those of multi-byte characters) is merged
 * into the current word. Nested constructs ({@code (..)}, {@code {..}},
 * {@code [..]}, back quotes and {@code $(..)}) are scanned recursively so
 * that an unclosed one is reported at its opening character.
 */
public final class Tokenizer {

	private static final Logger LOG = JbashLogger.getLogger(Tokenizer.class);

	/**
	 * Bound on the recursion of the lexer. The parser applies a tighter
	 * bound on the constructs it builds; this one only keeps pathological
	 * input from exhausting the stack.
	 */
	static final int MAX_NESTING = 64;

	private static final int EOF = -1;

	private final byte[] source;
	private final List<Token> tokens = new ArrayList<Token>();
	private int offset;
	private int nesting;

	private Tokenizer(byte[] source) {
		this.source = source;
	}

	/**
	 * Tokenizes a whole script.
	 *
	 * @param source UTF-8 bytes of the script
	 * @return the tokens, in source order
	 * @throws ParserException on unclosed constructs, stray closing
	 *         characters, bad variable names and malformed escapes
	 */
	public static List<Token> tokenize(byte[] source) {
		Tokenizer tokenizer = new Tokenizer(source);
		tokenizer.scan(EOF, 0);
		if (LOG.isTraceEnabled()) {
			LOG.trace("Tokens: {}", tokenizer.tokens);
		}
		return tokenizer.tokens;
	}

	private int read() {
		if (offset < source.length) {
			return source[offset++] & 0xFF;
		}
		return EOF;
	}

	private int peek() {
		if (offset < source.length) {
			return source[offset] & 0xFF;
		}
		return EOF;
	}

	private void unread(int c) {
		if (c != EOF) {
			offset--;
		}
	}

	private Token last() {
		return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
	}

	private void add(TokenType type, int position, int length) {
		tokens.add(new Token(type, source, position, length));
	}

	/**
	 * Adds one byte to the current word, or starts a new word when the
	 * previous token is not a word, or was emitted before {@code floor}.
	 */
	private void addWord(int position, int floor) {
		Token last = last();
		if (tokens.size() > floor && last != null && last.getType() == TokenType.WORD) {
			last.extend(1);
		} else {
			add(TokenType.WORD, position, 1);
		}
	}

	private void addSpace(int position, int length) {
		Token last = last();
		if (last != null && last.getType() == TokenType.SPACE) {
			last.extend(length);
		} else {
			add(TokenType.SPACE, position, length);
		}
	}

	private ParserException error(int status, int position) {
		return new ParserException(status, source, position);
	}

	/**
	 * Scans until {@code delimiter}, or until the end of the script when
	 * {@code delimiter} is {@link #EOF}.
	 *
	 * @param delimiter closing character to stop at
	 * @param openPosition offset of the opening character, where an
	 *        unclosed construct is reported
	 */
	private void scan(int delimiter, int openPosition) {
		if (++nesting > MAX_NESTING) {
			throw error(JbashStatus.MAX_DEPTH_REACHED, openPosition);
		}
		int floor = tokens.size();
		int c = read();
		while (c != EOF && c != delimiter) {
			int pos = offset - 1;
			switch (c) {
			case '\'':
				quoteSimple(pos);
				break;
			case '"':
				quoteDouble(pos);
				break;
			case '`':
				add(TokenType.QUOTE_BACK, pos, 1);
				scan('`', pos);
				floor = tokens.size();
				break;
			case '\\':
				backslash(pos);
				floor = tokens.size();
				break;
			case '$':
				dollar(pos);
				floor = tokens.size();
				break;
			case ' ':
			case '\t':
				addSpace(pos, 1);
				break;
			case '\n':
			case ';':
				add(TokenType.CMD_SEPARATOR, pos, 1);
				break;
			case '|':
				if (peek() == '|') {
					read();
					add(TokenType.OR, pos, 2);
				} else {
					add(TokenType.PIPE, pos, 1);
				}
				break;
			case '&':
				if (peek() == '&') {
					read();
					add(TokenType.AND, pos, 2);
				} else {
					add(TokenType.BACKGROUND, pos, 1);
				}
				break;
			case '(':
				add(TokenType.OPEN_PARENTHESIS, pos, 1);
				scan(')', pos);
				floor = tokens.size();
				break;
			case '{':
				add(TokenType.OPEN_BRACKETS, pos, 1);
				scan('}', pos);
				floor = tokens.size();
				break;
			case '[':
				add(TokenType.OPEN_SQR_BRACKETS, pos, 1);
				scan(']', pos);
				floor = tokens.size();
				break;
			case ')':
			case '}':
			case ']':
				throw error(JbashStatus.UNEXPECTED_TOKEN, pos);
			default:
				addWord(pos, floor);
			}
			c = read();
		}
		if (delimiter != EOF) {
			if (c != delimiter) {
				throw error(unclosedStatus(delimiter), openPosition);
			}
			add(closingType(delimiter), offset - 1, 1);
		}
		nesting--;
	}

	private static int unclosedStatus(int delimiter) {
		switch (delimiter) {
		case ')':
			return JbashStatus.UNCLOSED_PARENTHESES;
		case '}':
			return JbashStatus.UNCLOSED_BRACKETS;
		case ']':
			return JbashStatus.UNCLOSED_SQR_BRACKETS;
		case '`':
			return JbashStatus.UNCLOSED_BACK_QUOTES;
		default:
			return JbashStatus.SYNTAX_ERROR;
		}
	}

	private static TokenType closingType(int delimiter) {
		switch (delimiter) {
		case ')':
			return TokenType.CLOSE_PARENTHESIS;
		case '}':
			return TokenType.CLOSE_BRACKETS;
		case ']':
			return TokenType.CLOSE_SQR_BRACKETS;
		default:
			return TokenType.QUOTE_BACK;
		}
	}

	private void quoteSimple(int quotePosition) {
		add(TokenType.QUOTE_SIMPLE, quotePosition, 1);
		int floor = tokens.size();
		int c = read();
		while (c != EOF && c != '\'') {
			int pos = offset - 1;
			if (c == '\\') {
				backslash(pos);
				floor = tokens.size();
			} else {
				addWord(pos, floor);
			}
			c = read();
		}
		if (c == EOF) {
			throw error(JbashStatus.UNCLOSED_SIMPLE_QUOTES, quotePosition);
		}
		add(TokenType.QUOTE_SIMPLE, offset - 1, 1);
	}

	private void quoteDouble(int quotePosition) {
		add(TokenType.QUOTE_DOUBLE, quotePosition, 1);
		int floor = tokens.size();
		int c = read();
		while (c != EOF && c != '"') {
			int pos = offset - 1;
			switch (c) {
			case '`':
				add(TokenType.QUOTE_BACK, pos, 1);
				scan('`', pos);
				floor = tokens.size();
				break;
			case '\\':
				backslash(pos);
				floor = tokens.size();
				break;
			case '$':
				dollar(pos);
				floor = tokens.size();
				break;
			default:
				addWord(pos, floor);
			}
			c = read();
		}
		if (c == EOF) {
			throw error(JbashStatus.UNCLOSED_DOUBLE_QUOTES, quotePosition);
		}
		add(TokenType.QUOTE_DOUBLE, offset - 1, 1);
	}

	private void dollar(int dollarPosition) {
		add(TokenType.DOLLAR, dollarPosition, 1);
		int c = read();
		int pos = offset - 1;
		if (c == '0' || c == '$' || c == '#' || c == '@' || c == '?') {
			add(TokenType.DOLLAR_SPECIAL, pos, 1);
		} else if (c >= '1' && c <= '9') {
			add(TokenType.WORD, pos, 1);
		} else if (c == '{') {
			dollarVariable(pos);
		} else if (c == '(') {
			add(TokenType.OPEN_PARENTHESIS, pos, 1);
			scan(')', pos);
		} else if (isIdentifierStart(c)) {
			c = read();
			while (isIdentifierPart(c)) {
				c = read();
			}
			unread(c);
			add(TokenType.WORD, pos, offset - pos);
		} else {
			// a lone '$' is a plain character
			tokens.remove(tokens.size() - 1);
			unread(c);
			add(TokenType.WORD, dollarPosition, 1);
		}
	}

	private void dollarVariable(int bracePosition) {
		add(TokenType.OPEN_BRACKETS, bracePosition, 1);
		int c = read();
		if (c == '!') {
			add(TokenType.EXCLAMATION, offset - 1, 1);
			c = read();
		}
		int nameStart = offset - 1;
		if (c >= '1' && c <= '9') {
			c = read();
			while (c >= '0' && c <= '9') {
				c = read();
			}
		} else if (isIdentifierStart(c)) {
			c = read();
			while (isIdentifierPart(c)) {
				c = read();
			}
		} else {
			throw error(JbashStatus.INVALID_VARIABLE_NAME, bracePosition);
		}
		if (c != '}') {
			throw error(JbashStatus.UNCLOSED_VARIABLE, bracePosition);
		}
		int closePosition = offset - 1;
		add(TokenType.WORD, nameStart, closePosition - nameStart);
		add(TokenType.CLOSE_BRACKETS, closePosition, 1);
	}

	private void backslash(int position) {
		int c = read();
		switch (c) {
		case 'n':
		case 't':
		case ' ':
		case '\\':
		case '\'':
		case '"':
		case '`':
		case '$':
		case '|':
		case '&':
		case '(':
		case ')':
		case '[':
		case ']':
		case '{':
		case '}':
			add(TokenType.ESCAPED, position, 2);
			break;
		case '\n':
			addSpace(position, 2);
			break;
		case 'x':
			int ascii = readHex(2);
			if (ascii < 0 || ascii > 0x7F) {
				throw error(JbashStatus.BAD_ENCODING, position);
			}
			add(TokenType.UNICODE, position, 4);
			break;
		case 'u':
			utf16(position);
			break;
		case 'U':
			int codePoint = readHex(8);
			if (codePoint < 0 || codePoint > Character.MAX_CODE_POINT
					|| (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
				throw error(JbashStatus.BAD_ENCODING, position);
			}
			add(TokenType.UNICODE, position, 10);
			break;
		default:
			// unknown escapes are dropped, with the whole character they escape
			while (c >= 0x80 && isContinuation(peek())) {
				read();
			}
			break;
		}
	}

	private static boolean isContinuation(int b) {
		return b != EOF && (b & 0xC0) == 0x80;
	}

	private void utf16(int position) {
		int unit = readHex(4);
		if (unit < 0 || Character.isLowSurrogate((char) unit)) {
			throw error(JbashStatus.BAD_ENCODING, position);
		}
		if (!Character.isHighSurrogate((char) unit)) {
			add(TokenType.UNICODE, position, 6);
			return;
		}
		if (read() != '\\' || read() != 'u') {
			throw error(JbashStatus.BAD_ENCODING, position);
		}
		int low = readHex(4);
		if (low < 0 || !Character.isLowSurrogate((char) low)) {
			throw error(JbashStatus.BAD_ENCODING, position);
		}
		add(TokenType.UNICODE, position, 12);
	}

	/**
	 * @return the value of the next {@code digits} hexadecimal digits,
	 *         {@code -1} if one of them is not a hexadecimal digit
	 */
	private int readHex(int digits) {
		long value = 0;
		for (int i = 0; i < digits; i++) {
			int digit = Character.digit(read(), 16);
			if (digit < 0) {
				return -1;
			}
			value = (value << 4) | digit;
		}
		return value > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) value;
	}

	private static boolean isIdentifierStart(int c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentifierPart(int c) {
		return isIdentifierStart(c) || (c >= '0' && c <= '9');
	}

	/**
	 * Decodes the text of an {@link TokenType#ESCAPED} or
	 * {@link TokenType#UNICODE} token.
	 *
	 * @param text the token text, starting with a backslash
	 * @return the code point it stands for, {@code -1} if the text is not a
	 *         valid escape
	 */
	public static int decodeEscape(String text) {
		if (text.length() < 2 || text.charAt(0) != '\\') {
			return -1;
		}
		char kind = text.charAt(1);
		try {
			switch (kind) {
			case 'n':
				return '\n';
			case 't':
				return '\t';
			case 'x':
				return text.length() == 4 ? Integer.parseInt(text.substring(2), 16) : -1;
			case 'u':
				if (text.length() == 6) {
					return Integer.parseInt(text.substring(2), 16);
				}
				if (text.length() == 12) {
					char high = (char) Integer.parseInt(text.substring(2, 6), 16);
					char low = (char) Integer.parseInt(text.substring(8, 12), 16);
					if (Character.isSurrogatePair(high, low)) {
						return Character.toCodePoint(high, low);
					}
				}
				return -1;
			case 'U':
				if (text.length() != 10) {
					return -1;
				}
				int codePoint = Integer.parseInt(text.substring(2), 16);
				return Character.isValidCodePoint(codePoint) ? codePoint : -1;
			case ' ':
			case '\\':
			case '\'':
			case '"':
			case '`':
			case '$':
			case '|':
			case '&':
			case '(':
			case ')':
			case '[':
			case ']':
			case '{':
			case '}':
				return text.length() == 2 ? kind : -1;
			default:
				return -1;
			}
		} catch (NumberFormatException e) {
			return -1;
		}
	}
}
