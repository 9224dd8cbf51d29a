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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.runtime.Session;
import org.metricshub.jbash.runtime.Variables;

/**
 * {@code math EXPR...}: evaluates an integer expression and prints the
 * result, without newline.
 * <p>
 * Each argument is one token: numbers, operators, parentheses (which must
 * be escaped or quoted in a script) and the functions {@code factorial},
 * {@code sign}, {@code abs}, {@code sum} and {@code product}. The last two
 * iterate a variable: {@code sum ( i , 1 , 1 , 10 , i * i )}.
 * <p>
 * Arithmetic is on 64-bit signed integers, and overflow is an error.
 */
public class MathCommand implements Command {

	public static final String NAME = "math";

	public static final int NOT_AN_INTEGER = JbashStatus.CMD_ERROR + 1;
	public static final int OVERFLOW = JbashStatus.CMD_ERROR + 2;
	public static final int UNDERFLOW = JbashStatus.CMD_ERROR + 3;
	public static final int DIVISION_BY_ZERO = JbashStatus.CMD_ERROR + 4;
	public static final int UNDEFINED_POWER = JbashStatus.CMD_ERROR + 5;
	public static final int NEGATIVE_FACTORIAL = JbashStatus.CMD_ERROR + 6;
	public static final int MALFORMED_EXPRESSION = JbashStatus.CMD_ERROR + 7;
	public static final int NESTED_TOO_DEEPLY = JbashStatus.CMD_ERROR + 8;
	public static final int INVALID_VARIABLE_NAME = JbashStatus.CMD_ERROR + 9;
	public static final int ITERATION_LOGIC = JbashStatus.CMD_ERROR + 10;

	static final int MAX_DEPTH = 512;

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public int run(List<String> args, Session session) {
		try {
			Evaluator evaluator = new Evaluator(args);
			long result = evaluator.toplevel();
			if (evaluator.pos < args.size()) {
				throw new MathFailure(MALFORMED_EXPRESSION);
			}
			session.out().print(result);
			return JbashStatus.SUCCESS;
		} catch (MathFailure e) {
			session.err().print(e.getMessage());
			return e.status;
		}
	}

	private static String messageOf(int status) {
		switch (status) {
		case NOT_AN_INTEGER:
			return "math: value is not an integer.\n";
		case OVERFLOW:
			return "math: arithmetic overflow.\n";
		case UNDERFLOW:
			return "math: arithmetic underflow.\n";
		case DIVISION_BY_ZERO:
			return "math: division by zero.\n";
		case UNDEFINED_POWER:
			return "math: undefined expression 0^0.\n";
		case NEGATIVE_FACTORIAL:
			return "math: factorial of a negative number.\n";
		case NESTED_TOO_DEEPLY:
			return "math: expression nesting too deep.\n";
		case INVALID_VARIABLE_NAME:
			return "math: invalid variable name.\n";
		case ITERATION_LOGIC:
			return "math: invalid sequence iteration logic.\n";
		default:
			return "math: malformed expression.\n";
		}
	}

	private static final class MathFailure extends Exception {

		private static final long serialVersionUID = 1L;

		private final int status;

		MathFailure(int status) {
			super(messageOf(status), null, false, false);
			this.status = status;
		}
	}

	/** Overflow or underflow, depending on the sign of the operand that went out of range. */
	private static MathFailure outOfRange(long operand) {
		return new MathFailure(operand < 0 ? UNDERFLOW : OVERFLOW);
	}

	private static final class Evaluator {

		private final List<String> tokens;
		private final Map<String, Long> variables = new HashMap<>();
		private int pos;
		private int depth;

		Evaluator(List<String> tokens) {
			this.tokens = tokens;
		}

		private String peek() {
			return pos < tokens.size() ? tokens.get(pos) : null;
		}

		private void expect(String token) throws MathFailure {
			if (!token.equals(peek())) {
				throw new MathFailure(MALFORMED_EXPRESSION);
			}
			pos++;
		}

		long toplevel() throws MathFailure {
			if (++depth > MAX_DEPTH) {
				throw new MathFailure(NESTED_TOO_DEEPLY);
			}
			try {
				return sum();
			} finally {
				depth--;
			}
		}

		private long sum() throws MathFailure {
			long a = mult();
			while (true) {
				String op = peek();
				if ("+".equals(op)) {
					pos++;
					long b = mult();
					try {
						a = Math.addExact(a, b);
					} catch (ArithmeticException e) {
						throw outOfRange(a);
					}
				} else if ("-".equals(op)) {
					pos++;
					long b = mult();
					try {
						a = Math.subtractExact(a, b);
					} catch (ArithmeticException e) {
						throw outOfRange(a);
					}
				} else {
					return a;
				}
			}
		}

		private long mult() throws MathFailure {
			long a = pow();
			while (true) {
				String op = peek();
				if ("*".equals(op) || "×".equals(op)) {
					pos++;
					long b = pow();
					try {
						a = Math.multiplyExact(a, b);
					} catch (ArithmeticException e) {
						throw outOfRange((a < 0) == (b < 0) ? 1 : -1);
					}
				} else if ("/".equals(op) || "÷".equals(op)) {
					pos++;
					long b = pow();
					if (b == 0) {
						throw new MathFailure(DIVISION_BY_ZERO);
					}
					if (a == Long.MIN_VALUE && b == -1) {
						throw new MathFailure(OVERFLOW);
					}
					a = a / b;
				} else if ("%".equals(op)) {
					pos++;
					long b = pow();
					if (b == 0) {
						throw new MathFailure(DIVISION_BY_ZERO);
					}
					a = b == -1 ? 0 : a % b;
				} else {
					return a;
				}
			}
		}

		private long pow() throws MathFailure {
			long a = expr();
			String op = peek();
			if ("^".equals(op) || "**".equals(op)) {
				pos++;
				// right associative
				long b = pow();
				return power(a, b);
			}
			return a;
		}

		private static long power(long base, long exponent) throws MathFailure {
			if (base == 0 && exponent == 0) {
				throw new MathFailure(UNDEFINED_POWER);
			}
			if (exponent < 0) {
				return 0;
			}
			long result = 1;
			long factor = base;
			long e = exponent;
			try {
				while (e > 0) {
					if ((e & 1) == 1) {
						result = Math.multiplyExact(result, factor);
					}
					e >>= 1;
					if (e > 0) {
						factor = Math.multiplyExact(factor, factor);
					}
				}
			} catch (ArithmeticException ex) {
				throw outOfRange(base < 0 && (exponent & 1) == 1 ? -1 : 1);
			}
			return result;
		}

		private long expr() throws MathFailure {
			String token = peek();
			if (token == null) {
				throw new MathFailure(MALFORMED_EXPRESSION);
			}
			if ("-".equals(token)) {
				pos++;
				long value = expr();
				if (value == Long.MIN_VALUE) {
					throw new MathFailure(OVERFLOW);
				}
				return -value;
			}
			if ("+".equals(token)) {
				pos++;
				return expr();
			}
			if ("(".equals(token)) {
				pos++;
				long value = toplevel();
				expect(")");
				return value;
			}
			switch (token) {
			case "factorial":
				pos++;
				return factorial(parenthesized());
			case "sign":
				pos++;
				return Long.signum(parenthesized());
			case "abs":
				pos++;
				long value = parenthesized();
				if (value == Long.MIN_VALUE) {
					throw new MathFailure(OVERFLOW);
				}
				return Math.abs(value);
			case "sum":
				pos++;
				return iterate(false);
			case "product":
				pos++;
				return iterate(true);
			default:
				break;
			}
			pos++;
			Long bound = variables.get(token);
			if (bound != null) {
				return bound.longValue();
			}
			if (!Variables.isNumber(token)) {
				throw new MathFailure(NOT_AN_INTEGER);
			}
			return Long.parseLong(token);
		}

		private long parenthesized() throws MathFailure {
			expect("(");
			long value = toplevel();
			expect(")");
			return value;
		}

		private static long factorial(long n) throws MathFailure {
			if (n < 0) {
				throw new MathFailure(NEGATIVE_FACTORIAL);
			}
			long result = 1;
			try {
				for (long i = 2; i <= n; i++) {
					result = Math.multiplyExact(result, i);
				}
			} catch (ArithmeticException e) {
				throw new MathFailure(OVERFLOW);
			}
			return result;
		}

		/** {@code ( var , start , step , end , expr )}, after the function name. */
		private long iterate(boolean product) throws MathFailure {
			expect("(");
			String variable = peek();
			if (variable == null) {
				throw new MathFailure(MALFORMED_EXPRESSION);
			}
			if (!Variables.isVar(variable)) {
				throw new MathFailure(INVALID_VARIABLE_NAME);
			}
			pos++;
			expect(",");
			long start = toplevel();
			expect(",");
			long step = toplevel();
			expect(",");
			long end = toplevel();
			expect(",");
			if (step == 0 || (end > start && step < 0) || (end < start && step > 0)) {
				throw new MathFailure(ITERATION_LOGIC);
			}

			int body = pos;
			Long shadowed = variables.get(variable);
			long result = product ? 1 : 0;
			try {
				long i = start;
				while (step > 0 ? i <= end : i >= end) {
					variables.put(variable, i);
					pos = body;
					long value = toplevel();
					try {
						result = product ? Math.multiplyExact(result, value) : Math.addExact(result, value);
					} catch (ArithmeticException e) {
						throw outOfRange(product ? ((result < 0) == (value < 0) ? 1 : -1) : result);
					}
					if ((step > 0 && i > Long.MAX_VALUE - step) || (step < 0 && i < Long.MIN_VALUE - step)) {
						break;
					}
					i += step;
				}
			} finally {
				if (shadowed == null) {
					variables.remove(variable);
				} else {
					variables.put(variable, shadowed);
				}
			}
			expect(")");
			return result;
		}
	}
}
