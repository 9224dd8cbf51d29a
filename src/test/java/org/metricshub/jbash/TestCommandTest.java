package org.metricshub.jbash;

import static org.junit.Assert.assertEquals;
import static org.metricshub.jbash.JbashTestSupport.runCommand;
import static org.metricshub.jbash.JbashTestSupport.shellTest;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.jbash.JbashTestSupport.TestResult;
import org.metricshub.jbash.command.Command;
import org.metricshub.jbash.command.TestCommand;
import org.metricshub.jbash.runtime.Session;

public class TestCommandTest {

	private static int test(String... args) {
		return runCommand(new TestCommand(), args).exitCode();
	}

	@Test
	public void testEmpty() {
		assertEquals(JbashStatus.SUCCESS, test());
	}

	@Test
	public void testStringComparisons() {
		assertEquals(JbashStatus.SUCCESS, test("a", "==", "a"));
		assertEquals(TestCommand.FALSE, test("a", "!=", "a"));
		assertEquals(JbashStatus.SUCCESS, test("b", ">", "a"));
		assertEquals(JbashStatus.SUCCESS, test("10", "<", "9a"));
		assertEquals(JbashStatus.SUCCESS, test("a", "<=", "a"));
		assertEquals(TestCommand.FALSE, test("a", ">=", "b"));
	}

	@Test
	public void testNumericComparisons() {
		assertEquals(JbashStatus.SUCCESS, test("10", "-gt", "9"));
		assertEquals(JbashStatus.SUCCESS, test("10", ">", "9"));
		assertEquals(JbashStatus.SUCCESS, test("-3", "-lt", "2"));
		assertEquals(JbashStatus.SUCCESS, test("007", "-eq", "7"));
		assertEquals(TestCommand.FALSE, test("7", "-ne", "7"));
		assertEquals(JbashStatus.SUCCESS, test("7", "-ge", "7"));
		assertEquals(TestCommand.FALSE, test("8", "-le", "7"));
	}

	@Test
	public void testEmptinessChecks() {
		assertEquals(JbashStatus.SUCCESS, test("-z", ""));
		assertEquals(TestCommand.FALSE, test("-z", "x"));
		assertEquals(JbashStatus.SUCCESS, test("-n", "x"));
		assertEquals(TestCommand.FALSE, test("-n", ""));
	}

	@Test
	public void testRegularExpressions() {
		assertEquals(JbashStatus.SUCCESS, test("abc", "=~", "a.c"));
		assertEquals(TestCommand.FALSE, test("abc", "=~", "b"));
		assertEquals(TestCommand.MALFORMED_REGEX, test("a", "=~", "("));
	}

	@Test
	public void testLogic() {
		assertEquals(JbashStatus.SUCCESS, test("a", "==", "b", "-o", "a", "==", "a"));
		assertEquals(TestCommand.FALSE, test("a", "==", "a", "-a", "a", "==", "b"));
		assertEquals(JbashStatus.SUCCESS, test("a", "==", "b", "||", "a", "==", "a"));
		assertEquals(TestCommand.FALSE, test("a", "==", "a", "&&", "a", "==", "b"));
		// and binds tighter than or
		assertEquals(JbashStatus.SUCCESS, test("a", "==", "a", "-o", "a", "==", "b", "-a", "a", "==", "b"));
		assertEquals(
				TestCommand.FALSE,
				test("(", "a", "==", "a", "-o", "a", "==", "b", ")", "-a", "a", "==", "b"));
	}

	@Test
	public void testErrorsAfterAShortCircuit() {
		assertEquals(TestCommand.MALFORMED_EXPRESSION, test("a", "==", "a", "-o", "b"));
	}

	@Test
	public void testMalformed() {
		assertEquals(TestCommand.UNCLOSED_PARENTHESIS, test("(", "a", "==", "a"));
		assertEquals(TestCommand.MALFORMED_EXPRESSION, test("a", "==", "a", "b"));
		assertEquals(TestCommand.MALFORMED_EXPRESSION, test("a", "~", "b"));
		assertEquals(TestCommand.MALFORMED_EXPRESSION, test("-z"));
		assertEquals(TestCommand.MALFORMED_EXPRESSION, test("a", "-o"));
	}

	@Test
	public void testErrorMessages() {
		TestResult result = runCommand(new TestCommand(), "(", "a", "==", "a");
		assertEquals("Error: Unclosed parenthesis in the command.\n", result.error());
		result = runCommand(new TestCommand(), "a", "==");
		assertEquals("Error: The expression provided is malformed.\n", result.error());
		result = runCommand(new TestCommand(), "a", "==", "b");
		assertEquals("", result.error());
	}

	@Test
	public void testNestingLimit() {
		List<String> args = new ArrayList<String>();
		for (int i = 0; i < 600; i++) {
			args.add("(");
		}
		args.add("a");
		args.add("==");
		args.add("a");
		assertEquals(TestCommand.NESTED_TOO_DEEPLY, test(args.toArray(new String[0])));
	}

	@Test
	public void testSquareBrackets() {
		shellTest("brackets").script("[ 1 -lt 2 ] && echo -n yes").expect("yes").runAndAssert();
		shellTest("test command").script("test 1 -lt 2 && echo -n yes").expect("yes").runAndAssert();
		shellTest("operators in brackets")
				.script("[ ( a == b ) || a == a ] && echo -n yes")
				.expect("yes")
				.runAndAssert();
		shellTest("quoted operands").var("x", "a b").script("[ \"$x\" == \"a b\" ] && echo -n yes").expect("yes").runAndAssert();
	}

	@Test
	public void testBracketsUseTheShellTestCommand() {
		Command alwaysTrue = new Command() {
			@Override
			public String getName() {
				return TestCommand.NAME;
			}

			@Override
			public int run(List<String> args, Session session) {
				return JbashStatus.SUCCESS;
			}
		};
		shellTest("custom test")
				.withCommand(alwaysTrue)
				.script("[ a == b ] && echo -n overridden")
				.expect("overridden")
				.runAndAssert();
	}
}
