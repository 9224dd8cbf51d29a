package org.metricshub.jbash;

import static org.junit.Assert.assertEquals;
import static org.metricshub.jbash.JbashTestSupport.runCommand;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.jbash.JbashTestSupport.TestResult;
import org.metricshub.jbash.command.MathCommand;

public class MathCommandTest {

	private static String math(String... tokens) {
		TestResult result = runCommand(new MathCommand(), tokens);
		assertEquals("Unexpected error: " + result.error(), JbashStatus.SUCCESS, result.exitCode());
		return result.output();
	}

	private static int failure(int expectedStatus, String... tokens) {
		TestResult result = runCommand(new MathCommand(), tokens);
		assertEquals(expectedStatus, result.exitCode());
		assertEquals("", result.output());
		return result.exitCode();
	}

	@Test
	public void testArithmetic() {
		assertEquals("3", math("1", "+", "2"));
		assertEquals("10", math("2", "*", "3", "+", "4"));
		assertEquals("14", math("2", "+", "3", "*", "4"));
		assertEquals("-4", math("1", "-", "2", "-", "3"));
		assertEquals("42", math("6", "×", "7"));
		assertEquals("4", math("8", "÷", "2"));
	}

	@Test
	public void testDivisionTruncates() {
		assertEquals("3", math("7", "/", "2"));
		assertEquals("-3", math("-7", "/", "2"));
		assertEquals("1", math("7", "%", "3"));
		assertEquals("-1", math("-7", "%", "3"));
	}

	@Test
	public void testPower() {
		assertEquals("1024", math("2", "**", "10"));
		assertEquals("512", math("2", "^", "3", "^", "2"));
		assertEquals("0", math("2", "^", "-1"));
		assertEquals("-8", math("-", "2", "^", "3"));
	}

	@Test
	public void testUnaryAndParentheses() {
		assertEquals("2", math("-", "3", "+", "5"));
		assertEquals("5", math("+", "5"));
		assertEquals("9", math("(", "1", "+", "2", ")", "*", "3"));
		assertEquals("3", math("-", "(", "1", "-", "4", ")"));
	}

	@Test
	public void testFunctions() {
		assertEquals("120", math("factorial", "(", "5", ")"));
		assertEquals("1", math("factorial", "(", "0", ")"));
		assertEquals("-1", math("sign", "(", "-", "4", ")"));
		assertEquals("0", math("sign", "(", "0", ")"));
		assertEquals("4", math("abs", "(", "-4", ")"));
	}

	@Test
	public void testSumAndProduct() {
		assertEquals("30", math("sum", "(", "i", ",", "1", ",", "1", ",", "4", ",", "i", "*", "i", ")"));
		assertEquals("120", math("product", "(", "i", ",", "1", ",", "1", ",", "5", ",", "i", ")"));
		assertEquals("6", math("sum", "(", "i", ",", "3", ",", "-1", ",", "1", ",", "i", ")"));
		assertEquals("9", math("sum", "(", "i", ",", "1", ",", "2", ",", "6", ",", "i", ")"));
		assertEquals("11", math("sum", "(", "i", ",", "1", ",", "1", ",", "1", ",", "i", ")", "+", "10"));
	}

	@Test
	public void testNestedIterationShadowsVariable() {
		// for i in 1..2: sum of j in 1..i
		assertEquals(
				"4",
				math("sum", "(", "i", ",", "1", ",", "1", ",", "2", ",",
						"sum", "(", "i", ",", "1", ",", "1", ",", "i", ",", "i", ")", ")"));
	}

	@Test
	public void testErrors() {
		failure(MathCommand.NOT_AN_INTEGER, "a");
		failure(MathCommand.NOT_AN_INTEGER, "1234567890123456789");
		failure(MathCommand.OVERFLOW, "999999999999999999", "*", "999999999999999999");
		failure(MathCommand.UNDERFLOW, "-999999999999999999", "*", "999999999999999999");
		failure(MathCommand.OVERFLOW, "2", "^", "63");
		failure(MathCommand.DIVISION_BY_ZERO, "1", "/", "0");
		failure(MathCommand.DIVISION_BY_ZERO, "1", "%", "0");
		failure(MathCommand.UNDEFINED_POWER, "0", "^", "0");
		failure(MathCommand.NEGATIVE_FACTORIAL, "factorial", "(", "-1", ")");
		failure(MathCommand.OVERFLOW, "factorial", "(", "21", ")");
		failure(MathCommand.MALFORMED_EXPRESSION);
		failure(MathCommand.MALFORMED_EXPRESSION, "1", "+");
		failure(MathCommand.MALFORMED_EXPRESSION, "1", "2");
		failure(MathCommand.MALFORMED_EXPRESSION, "(", "1");
		failure(MathCommand.MALFORMED_EXPRESSION, "abs", "1");
		failure(MathCommand.INVALID_VARIABLE_NAME, "sum", "(", "1", ",", "1", ",", "1", ",", "2", ",", "1", ")");
		failure(MathCommand.ITERATION_LOGIC, "sum", "(", "i", ",", "1", ",", "0", ",", "3", ",", "i", ")");
		failure(MathCommand.ITERATION_LOGIC, "sum", "(", "i", ",", "1", ",", "-1", ",", "3", ",", "i", ")");
	}

	@Test
	public void testErrorMessage() {
		TestResult result = runCommand(new MathCommand(), "1", "/", "0");
		assertEquals("math: division by zero.\n", result.error());
	}

	@Test
	public void testNestingLimit() {
		List<String> tokens = new ArrayList<String>();
		for (int i = 0; i < 600; i++) {
			tokens.add("(");
		}
		tokens.add("1");
		for (int i = 0; i < 600; i++) {
			tokens.add(")");
		}
		failure(MathCommand.NESTED_TOO_DEEPLY, tokens.toArray(new String[0]));
	}
}
