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
 * Status codes returned by the interpreter and its commands.
 * <p>
 * {@code 0} is success. Codes from {@link #SYNTAX_ERROR} to
 * {@link #MAX_DEPTH_REACHED} are raised while reading a script; codes
 * above {@link #CMD_ERROR} belong to individual commands, which number
 * their own failures starting at {@code CMD_ERROR + 1}.
 */
public final class JbashStatus {

	public static final int SUCCESS = 0;
	public static final int ERROR = 1;

	public static final int SYNTAX_ERROR = 2;
	public static final int UNCLOSED_SIMPLE_QUOTES = 3;
	public static final int UNCLOSED_DOUBLE_QUOTES = 4;
	public static final int UNCLOSED_BACK_QUOTES = 5;
	public static final int UNCLOSED_PARENTHESES = 6;
	public static final int UNCLOSED_BRACKETS = 7;
	public static final int UNCLOSED_SQR_BRACKETS = 8;
	public static final int UNCLOSED_SUBCOMMAND = 9;
	public static final int UNCLOSED_VARIABLE = 10;
	public static final int INVALID_VARIABLE_NAME = 11;
	public static final int UNEXPECTED_TOKEN = 12;
	public static final int UNEXPECTED_EOF = 13;
	public static final int ARG_OUT_OF_RANGE = 14;
	public static final int EMPTY_BLOCK = 15;
	public static final int UNFINISHED_KEYWORD_IF = 16;
	public static final int MISSING_KEYWORD_THEN = 17;
	public static final int UNFINISHED_KEYWORD_LOOP = 18;
	public static final int UNFINISHED_KEYWORD_FOR = 19;
	public static final int MISSING_KEYWORD_IN = 20;
	public static final int UNFINISHED_KEYWORD_WHILE = 21;
	public static final int UNFINISHED_KEYWORD_UNTIL = 22;
	public static final int MISSING_KEYWORD_DO = 23;
	public static final int INVALID_FUNCTION_NAME = 24;
	public static final int INVALID_FUNCTION_BODY = 25;
	public static final int BAD_ENCODING = 26;
	public static final int COMMAND_NOT_FOUND = 27;
	public static final int MAX_DEPTH_REACHED = 28;

	/**
	 * Base of the command specific codes. Commands report their own
	 * failures as {@code CMD_ERROR + 1}, {@code CMD_ERROR + 2}, ...
	 */
	public static final int CMD_ERROR = 42;

	private JbashStatus() {}

	/**
	 * @param status a status code
	 * @return whether the code denotes an error detected while reading a script
	 */
	public static boolean isSyntaxError(int status) {
		return status >= SYNTAX_ERROR && status <= MAX_DEPTH_REACHED;
	}

	/**
	 * Returns the human readable message of a status code, as printed
	 * in the first line of a syntax error report.
	 *
	 * @param status a status code
	 * @return the message, {@code "Unknown error"} for codes without one
	 */
	public static String message(int status) {
		switch (status) {
		case SUCCESS:
			return "Success";
		case ERROR:
			return "Generic error";
		case SYNTAX_ERROR:
			return "Syntax error in command";
		case UNCLOSED_SIMPLE_QUOTES:
			return "Unclosed simple quotes";
		case UNCLOSED_DOUBLE_QUOTES:
			return "Unclosed double quotes";
		case UNCLOSED_BACK_QUOTES:
			return "Unclosed back quotes";
		case UNCLOSED_PARENTHESES:
			return "Unclosed parentheses";
		case UNCLOSED_BRACKETS:
			return "Unclosed brackets";
		case UNCLOSED_SQR_BRACKETS:
			return "Unclosed square brackets";
		case UNCLOSED_SUBCOMMAND:
			return "Unclosed subcommand";
		case UNCLOSED_VARIABLE:
			return "Unclosed variable";
		case INVALID_VARIABLE_NAME:
			return "Invalid variable name";
		case UNEXPECTED_TOKEN:
			return "Unexpected token";
		case UNEXPECTED_EOF:
			return "Unexpected end of file";
		case ARG_OUT_OF_RANGE:
			return "Argument out of range";
		case EMPTY_BLOCK:
			return "Empty block";
		case UNFINISHED_KEYWORD_IF:
			return "Syntax error: 'if' keyword is not finished.";
		case MISSING_KEYWORD_THEN:
			return "Syntax error: 'then' keyword is missing.";
		case UNFINISHED_KEYWORD_LOOP:
			return "Syntax error: 'loop' keyword is not finished.";
		case UNFINISHED_KEYWORD_FOR:
			return "Syntax error: 'for' keyword is not finished.";
		case MISSING_KEYWORD_IN:
			return "Syntax error: 'in' keyword is missing.";
		case UNFINISHED_KEYWORD_WHILE:
			return "Syntax error: 'while' keyword is not finished.";
		case UNFINISHED_KEYWORD_UNTIL:
			return "Syntax error: 'until' keyword is not finished.";
		case MISSING_KEYWORD_DO:
			return "Syntax error: 'do' keyword is missing.";
		case INVALID_FUNCTION_NAME:
			return "Invalid function name";
		case INVALID_FUNCTION_BODY:
			return "Invalid function body";
		case BAD_ENCODING:
			return "Bad encoding";
		case COMMAND_NOT_FOUND:
			return "Command not found";
		case MAX_DEPTH_REACHED:
			return "Maximum command nesting depth reached";
		default:
			return "Unknown error";
		}
	}
}
