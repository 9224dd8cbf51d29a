package org.metricshub.jbash;

import static org.junit.Assert.assertEquals;
import static org.metricshub.jbash.JbashTestSupport.runCommand;
import static org.metricshub.jbash.JbashTestSupport.shellTest;

import org.junit.Test;
import org.metricshub.jbash.JbashTestSupport.TestResult;
import org.metricshub.jbash.command.GetenvCommand;
import org.metricshub.jbash.command.GetvarCommand;
import org.metricshub.jbash.command.SetenvCommand;
import org.metricshub.jbash.command.SetvarCommand;
import org.metricshub.jbash.command.VariableCommand;

/**
 * Tests {@code setvar}, {@code getvar}, {@code setenv} and {@code getenv}.
 */
public class VariableCommandsTest {

	@Test
	public void testLocals() {
		shellTest("setvar and getvar").script("setvar x 'a b'; getvar x").expect("a b").runAndAssert();
		shellTest("getvar of unset").script("getvar x").expect("").runAndAssert();
		shellTest("overwrite").script("setvar x 1; setvar x 2; getvar x").expect("2").runAndAssert();
		shellTest("empty value").var("x", "1").script("setvar x \"\"; echo -n \"<$x>\"").expect("<>").runAndAssert();
	}

	@Test
	public void testEnvironment() {
		shellTest("setenv and getenv").script("setenv x value; getenv x").expect("value").runAndAssert();
		shellTest("environment is not local").script("setenv x value; getvar x").expect("").runAndAssert();
		shellTest("local is not environment").script("setvar x value; getenv x").expect("").runAndAssert();
	}

	@Test
	public void testSessionIsUpdated() {
		TestResult result = runCommand(new SetvarCommand(), "name", "value");
		assertEquals(JbashStatus.SUCCESS, result.exitCode());
		assertEquals("value", result.session().getVar("name"));
		result = runCommand(new SetenvCommand(), "name", "value");
		assertEquals("value", result.session().getEnv("name"));
		assertEquals("", result.session().getVar("name"));
	}

	@Test
	public void testParameterCount() {
		TestResult result = runCommand(new SetvarCommand(), "x");
		assertEquals(VariableCommand.PARAM_NUMBER, result.exitCode());
		assertEquals("setvar: takes 2 parameters, but received 1.\n", result.error());
		result = runCommand(new GetenvCommand(), "x", "y");
		assertEquals(VariableCommand.PARAM_NUMBER, result.exitCode());
		assertEquals("getenv: takes 1 parameter, but received 2.\n", result.error());
		assertEquals(VariableCommand.PARAM_NUMBER, runCommand(new GetvarCommand()).exitCode());
	}

	@Test
	public void testInvalidName() {
		TestResult result = runCommand(new GetvarCommand(), "1x");
		assertEquals(VariableCommand.INVALID_NAME, result.exitCode());
		assertEquals("getvar: “1x”: not a variable name.\n", result.error());
		assertEquals(VariableCommand.INVALID_NAME, runCommand(new SetenvCommand(), "a-b", "c").exitCode());
		assertEquals(VariableCommand.INVALID_NAME, runCommand(new SetvarCommand(), "", "c").exitCode());
	}

	@Test
	public void testSplitValueIsAnError() {
		shellTest("unquoted value with blanks")
				.var("v", "a b")
				.script("setvar x $v")
				.expectError("setvar: takes 2 parameters, but received 3.\n")
				.expectExit(VariableCommand.PARAM_NUMBER)
				.runAndAssert();
	}
}
