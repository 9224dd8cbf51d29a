package org.metricshub.jbash;

import static org.junit.Assert.assertEquals;
import static org.metricshub.jbash.JbashTestSupport.runCommand;
import static org.metricshub.jbash.JbashTestSupport.shellTest;

import org.junit.Test;
import org.metricshub.jbash.JbashTestSupport.TestResult;
import org.metricshub.jbash.command.FcallCommand;

public class FcallCommandTest {

	@Test
	public void testArguments() {
		shellTest("arguments").script("function f { echo -n $1-$2; }; fcall f a b").expect("a-b").runAndAssert();
		shellTest("name and shell name")
				.script("function f { setvar zero 0; echo -n $0 ${!zero}; }; fcall f")
				.expect("emptyset f")
				.runAndAssert();
		shellTest("caller arguments are restored")
				.operand("top")
				.script("function f { echo -n $1; }; fcall f inner; echo -n \" $1\"")
				.expect("inner top")
				.runAndAssert();
	}

	@Test
	public void testRedefinition() {
		shellTest("last definition wins")
				.script("function f { echo -n 1; }; function f { echo -n 2; }; fcall f")
				.expect("2")
				.runAndAssert();
	}

	@Test
	public void testDynamicName() {
		shellTest("name from a variable")
				.var("n", "g")
				.script("function $n { echo -n dynamic; }; fcall g")
				.expect("dynamic")
				.runAndAssert();
	}

	@Test
	public void testFunctionCallsFunction() {
		shellTest("nested calls")
				.script("function a { echo -n a$1; }; function b { fcall a $1$1; }; fcall b x")
				.expect("axx")
				.runAndAssert();
	}

	@Test
	public void testMissingName() {
		TestResult result = runCommand(new FcallCommand());
		assertEquals(FcallCommand.PARAM_NUMBER, result.exitCode());
		assertEquals("fcall: takes >=1 parameters, but received 0.\n", result.error());
	}

	@Test
	public void testUnknownFunction() {
		TestResult result = runCommand(new FcallCommand(), "nope");
		assertEquals(FcallCommand.FUNCTION_NOT_FOUND, result.exitCode());
		assertEquals("fcall: nope: function not found.\n", result.error());
	}
}
