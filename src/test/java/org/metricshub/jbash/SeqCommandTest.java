package org.metricshub.jbash;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jbash.JbashTestSupport.runCommand;
import static org.metricshub.jbash.JbashTestSupport.shellTest;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.Test;
import org.metricshub.jbash.JbashTestSupport.TestResult;
import org.metricshub.jbash.command.SeqCommand;
import org.metricshub.jbash.runtime.Session;

public class SeqCommandTest {

	private static String seq(String... args) {
		TestResult result = runCommand(new SeqCommand(), args);
		assertEquals("Unexpected error: " + result.error(), JbashStatus.SUCCESS, result.exitCode());
		return result.output();
	}

	@Test
	public void testImplicitStep() {
		assertEquals("1 2 3 4 5", seq("1", "5"));
		assertEquals("5 4 3 2 1", seq("5", "1"));
		assertEquals("-1 0 1", seq("-1", "1"));
		assertEquals("3", seq("3", "3"));
	}

	@Test
	public void testExplicitStep() {
		assertEquals("1 3 5 7 9", seq("1", "2", "9"));
		assertEquals("1 3 5 7", seq("1", "2", "8"));
		assertEquals("10 7 4 1", seq("10", "-3", "1"));
		assertEquals("4", seq("4", "0", "4"));
	}

	/** Accepts a fixed number of bytes, then refuses more. */
	private static final class BoundedOutputStream extends ByteArrayOutputStream {

		private final int limit;

		BoundedOutputStream(int limit) {
			this.limit = limit;
		}

		@Override
		public synchronized void write(int b) {
			if (size() >= limit) {
				throw new IllegalStateException("Output full");
			}
			super.write(b);
		}

		@Override
		public synchronized void write(byte[] b, int off, int len) {
			for (int i = 0; i < len; i++) {
				write(b[off + i]);
			}
		}
	}

	@Test
	public void testValuesArePrintedAsTheyAreProduced() {
		BoundedOutputStream out = new BoundedOutputStream(64);
		Session session = new Jbash()
				.newSession(
						new ByteArrayInputStream(new byte[0]),
						new PrintStream(out, true, StandardCharsets.UTF_8),
						new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
		assertThrows(
				IllegalStateException.class,
				() -> new SeqCommand().run(Arrays.asList("1", "100000000000"), session));
		String printed = new String(out.toByteArray(), StandardCharsets.UTF_8);
		assertEquals(64, printed.length());
		assertTrue(printed.startsWith("1 2 3 4 5 6 7 8 9 10 "));
	}

	@Test
	public void testParameterCount() {
		TestResult result = runCommand(new SeqCommand(), "1");
		assertEquals(SeqCommand.PARAM_NUMBER, result.exitCode());
		assertEquals("seq: takes 2-3 parameters, but received 1.\n", result.error());
		assertEquals(SeqCommand.PARAM_NUMBER, runCommand(new SeqCommand(), "1", "2", "3", "4").exitCode());
	}

	@Test
	public void testNotAnInteger() {
		TestResult result = runCommand(new SeqCommand(), "a", "3");
		assertEquals(SeqCommand.INVALID_INT_FORMAT, result.exitCode());
		assertEquals("seq: value “a” is no integer\n", result.error());
		assertEquals(SeqCommand.INVALID_INT_FORMAT, runCommand(new SeqCommand(), "1", "1.5").exitCode());
	}

	@Test
	public void testIterationLogic() {
		TestResult result = runCommand(new SeqCommand(), "1", "-1", "5");
		assertEquals(SeqCommand.ITERATION_LOGIC, result.exitCode());
		assertEquals("seq: can not iterate: [ 1 : -1 : 5 ]\n", result.error());
		assertEquals("", result.output());
		assertEquals(SeqCommand.ITERATION_LOGIC, runCommand(new SeqCommand(), "1", "0", "5").exitCode());
		assertEquals(SeqCommand.ITERATION_LOGIC, runCommand(new SeqCommand(), "5", "1", "1").exitCode());
	}

	@Test
	public void testLargeBounds() {
		assertEquals(
				"999999999999999990 999999999999999995",
				seq("999999999999999990", "5", "999999999999999999"));
	}

	@Test
	public void testInLoop() {
		shellTest("seq in for").script("for i in $(seq 3 1); do echo -n $i; done").expect("321").runAndAssert();
	}
}
