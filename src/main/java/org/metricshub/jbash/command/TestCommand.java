package org.metricshub.jbash.command;

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
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.runtime.Session;
import org.metricshub.jbash.runtime.Variables;

/**
 * {@code test EXPR...}, also run by {@code [ EXPR ]}: evaluates a boolean
 * expression over its arguments.
 * <p>
 * Grammar, loosest first:
 * <pre>
 * or      := and ( ( -o | || ) and )*
 * and     := primary ( ( -a | &amp;&amp; ) primary )*
 * primary := ( or ) | -z WORD | -n WORD | WORD OP WORD
 * </pre>
 * Binary operators compare as integers when both sides are integers, as
 * strings otherwise. {@code =~} matches the left side against the regular
 * expression on the right side.
 */
public class TestCommand implements Command {

	public static final String NAME = "test";

	public static final int UNCLOSED_PARENTHESIS = JbashStatus.CMD_ERROR + 1;
	public static final int MALFORMED_EXPRESSION = JbashStatus.CMD_ERROR + 2;
	public static final int MALFORMED_REGEX = JbashStatus.CMD_ERROR + 3;
	public static final int FALSE = JbashStatus.CMD_ERROR + 4;
	public static final int NESTED_TOO_DEEPLY = JbashStatus.CMD_ERROR + 5;

	static final int MAX_DEPTH = 512;

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public int run(List<String> args, Session session) {
		if (args.isEmpty()) {
			return JbashStatus.SUCCESS;
		}
		try {
			Evaluator evaluator = new Evaluator(args);
			boolean result = evaluator.or();
			if (!evaluator.atEnd()) {
				throw new TestFailure(MALFORMED_EXPRESSION);
			}
			return result ? JbashStatus.SUCCESS : FALSE;
		} catch (TestFailure e) {
			session.err().print(e.getMessage());
			return e.status;
		}
	}

	private static String messageOf(int status) {
		switch (status) {
		case UNCLOSED_PARENTHESIS:
			return "Error: Unclosed parenthesis in the command.\n";
		case MALFORMED_REGEX:
			return "Error: The regular expression is malformed.\n";
		case NESTED_TOO_DEEPLY:
			return "Error: The expression is nested too deeply.\n";
		default:
			return "Error: The expression provided is malformed.\n";
		}
	}

	/** Aborts the evaluation with a status. */
	private static final class TestFailure extends Exception {

		private static final long serialVersionUID = 1L;

		private final int status;

		TestFailure(int status) {
			super(messageOf(status), null, false, false);
			this.status = status;
		}
	}

	private static final class Evaluator {

		private final List<String> tokens;
		private int pos;
		private int depth;

		Evaluator(List<String> tokens) {
			this.tokens = tokens;
		}

		boolean atEnd() {
			return pos >= tokens.size();
		}

		private boolean peek(String a, String b) {
			if (atEnd()) {
				return false;
			}
			String token = tokens.get(pos);
			return token.equals(a) || token.equals(b);
		}

		boolean or() throws TestFailure {
			if (++depth > MAX_DEPTH) {
				throw new TestFailure(NESTED_TOO_DEEPLY);
			}
			try {
				boolean result = and();
				while (peek("-o", "||")) {
					pos++;
					// both sides are parsed, so that errors on the right are reported
					boolean right = and();
					result = result || right;
				}
				return result;
			} finally {
				depth--;
			}
		}

		private boolean and() throws TestFailure {
			boolean result = primary();
			while (peek("-a", "&&")) {
				pos++;
				boolean right = primary();
				result = result && right;
			}
			return result;
		}

		private boolean primary() throws TestFailure {
			if (atEnd()) {
				throw new TestFailure(MALFORMED_EXPRESSION);
			}
			String token = tokens.get(pos);
			if ("(".equals(token)) {
				pos++;
				boolean result = or();
				if (atEnd() || !")".equals(tokens.get(pos))) {
					throw new TestFailure(UNCLOSED_PARENTHESIS);
				}
				pos++;
				return result;
			}
			if (pos + 1 < tokens.size() && ("-z".equals(token) || "-n".equals(token))) {
				String operand = tokens.get(pos + 1);
				pos += 2;
				return "-z".equals(token) == operand.isEmpty();
			}
			if (pos + 2 >= tokens.size()) {
				throw new TestFailure(MALFORMED_EXPRESSION);
			}
			String operator = tokens.get(pos + 1);
			String right = tokens.get(pos + 2);
			boolean result = compare(token, operator, right);
			pos += 3;
			return result;
		}

		private static boolean compare(String left, String operator, String right) throws TestFailure {
			if ("=~".equals(operator)) {
				try {
					return Pattern.matches(right, left);
				} catch (PatternSyntaxException e) {
					throw new TestFailure(MALFORMED_REGEX);
				}
			}
			int comparison;
			if (Variables.isNumber(left) && Variables.isNumber(right)) {
				comparison = Long.compare(Long.parseLong(left), Long.parseLong(right));
			} else {
				comparison = left.compareTo(right);
			}
			switch (operator) {
			case "-eq":
			case "==":
				return comparison == 0;
			case "-ne":
			case "!=":
				return comparison != 0;
			case "-gt":
			case ">":
				return comparison > 0;
			case "-lt":
			case "<":
				return comparison < 0;
			case "-ge":
			case ">=":
				return comparison >= 0;
			case "-le":
			case "<=":
				return comparison <= 0;
			default:
				throw new TestFailure(MALFORMED_EXPRESSION);
			}
		}
	}
}
