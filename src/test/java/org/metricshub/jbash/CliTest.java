package org.metricshub.jbash;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jbash.JbashTestSupport.cliTest;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.jbash.JbashTestSupport.TestResult;
import org.metricshub.jbash.util.ScriptSource;

public class CliTest {

	private static String normalize(String text) {
		return text.replace("\r\n", "\n");
	}

	@Test
	public void testUsage() {
		TestResult result = cliTest("no arguments").run();
		assertEquals(0, result.exitCode());
		assertTrue(result.output().startsWith("Usage:"));
		result = cliTest("help").argument("-h").run();
		assertTrue(result.output().contains("--list-commands"));
		cliTest("help with other arguments").argument("-h", "-e", "a=b").expectThrow(IllegalArgumentException.class).runAndAssert();
	}

	@Test
	public void testScriptArgument() {
		cliTest("script").script("echo -n hi").expect("hi").runAndAssert();
		cliTest("operands").script("echo -n $1 $#").operand("a", "b").expect("a 2").runAndAssert();
		cliTest("script name")
				.script("setvar zero 0; echo -n ${!zero}")
				.expect(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT)
				.runAndAssert();
		cliTest("end of options").argument("-").script("echo -n ok").expect("ok").runAndAssert();
	}

	@Test
	public void testScriptFile() {
		cliTest("script file").script("echo -n $1\necho -n $2").operand("x", "y").scriptFile().expect("xy").runAndAssert();
		cliTest("missing file")
				.argument("-f", "/nonexistent/jbash/script.sh")
				.expectThrow(IllegalArgumentException.class)
				.runAndAssert();
		cliTest("two files")
				.argument("-f", "a.sh", "-f", "b.sh")
				.expectThrow(IllegalArgumentException.class)
				.runAndAssert();
	}

	@Test
	public void testVariables() {
		cliTest("environment").argument("-e", "x=1").script("getenv x").expect("1").runAndAssert();
		cliTest("local").argument("-v", "x=a=b").script("getvar x").expect("a=b").runAndAssert();
		cliTest("empty value").argument("-v", "x=").script("echo -n \"<$x>\"").expect("<>").runAndAssert();
		cliTest("bad assignment").argument("-e", "1x=2").script("echo").expectThrow(IllegalArgumentException.class).runAndAssert();
		cliTest("missing assignment").argument("-v").expectThrow(IllegalArgumentException.class).runAndAssert();
	}

	@Test
	public void testStandardStreams() {
		cliTest("stdin").stdin("abc").script("cat").expect("abc").runAndAssert();
		cliTest("status")
				.script("[ a == b ]")
				.expectExit(46)
				.runAndAssert();
		cliTest("syntax error")
				.script("echo \"")
				.expectErrorContaining("Unclosed double quotes")
				.expectExit(JbashStatus.UNCLOSED_DOUBLE_QUOTES)
				.runAndAssert();
	}

	@Test
	public void testDumpSyntax() {
		TestResult result = cliTest("dump").argument("--dump-syntax").script("echo $x").run();
		assertNull(result.thrownException());
		assertEquals(
				"CommandNode\n"
						+ " CommandExpressionNode\n"
						+ "  Word \"echo\"\n"
						+ "  Variable $x\n",
				normalize(result.output()));
	}

	@Test
	public void testDumpSyntaxError() {
		cliTest("dump of a malformed script")
				.argument("--dump-syntax")
				.script("echo 'a")
				.expect("")
				.expectErrorContaining("Unclosed simple quotes\necho 'a\n")
				.expectExit(JbashStatus.UNCLOSED_SIMPLE_QUOTES)
				.runAndAssert();
	}

	@Test
	public void testLoadCommand() {
		cliTest("command by class name")
				.argument("-c", CommandRegistryTest.ShoutCommand.class.getName())
				.script("shout a b")
				.expect("SHOUT[a, b]")
				.runAndAssert();
		cliTest("command by name").argument("--command", "ECHO").script("echo -n ok").expect("ok").runAndAssert();
		cliTest("unknown command")
				.argument("-c", "org.metricshub.jbash.NoSuchCommand")
				.script("echo")
				.expectThrow(IllegalArgumentException.class)
				.runAndAssert();
		cliTest("command without default constructor")
				.argument("-c", CommandRegistryTest.NoDefaultConstructorCommand.class.getName())
				.script("echo")
				.expectThrow(IllegalStateException.class)
				.runAndAssert();
	}

	@Test
	public void testListCommands() {
		TestResult result = cliTest("list").argument("-l").run();
		assertEquals(0, result.exitCode());
		assertTrue(normalize(result.output()).contains("echo - org.metricshub.jbash.command.EchoCommand\n"));
		assertTrue(normalize(cliTest("list").argument("--list-commands").run().output()).startsWith("cat - "));
		cliTest("list with a script").argument("-l").script("echo").expectThrow(IllegalArgumentException.class).runAndAssert();
	}

	@Test
	public void testInvalidArguments() {
		TestResult result = cliTest("unknown").argument("-z").script("echo").run();
		assertTrue(result.thrownException() instanceof IllegalArgumentException);
		assertEquals("Unknown parameter: -z", result.thrownException().getMessage());
		result = cliTest("no script").argument("-e", "x=1").run();
		assertEquals("Jbash script not provided.", result.thrownException().getMessage());
		cliTest("empty argument").argument("").expectThrow(IllegalArgumentException.class).runAndAssert();
	}

	@Test
	public void testParseCommandLineArguments() {
		Cli cli = Cli.parseCommandLineArguments(new String[] { "-v", "a=b", "-e", "c=d", "echo", "x", "y" });
		assertEquals(Collections.singletonMap("a", "b"), cli.getSettings().getVariables());
		assertEquals(Collections.singletonMap("c", "d"), cli.getSettings().getEnvironment());
		assertEquals(Arrays.asList("x", "y"), cli.getSettings().getArguments());
		assertEquals("echo", cli.getScriptText());
		assertEquals(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, cli.getSettings().getScriptName());
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-q" }));
	}
}
