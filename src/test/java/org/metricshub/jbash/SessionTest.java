package org.metricshub.jbash;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.jbash.frontend.ast.NullCommandNode;
import org.metricshub.jbash.runtime.Session;

/**
 * Tests what derived sessions share with their parent and what they copy.
 */
public class SessionTest {

	private final InputStream in = new ByteArrayInputStream(new byte[0]);
	private final PrintStream out = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
	private final PrintStream err = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
	private Session session;

	@Before
	public void setUp() {
		session = new Session(new Jbash(), in, out, err);
		session.setEnv("env", "e");
		session.setVar("local", "l");
		session.setArgs(Arrays.asList("a", "b"));
		session.setFunction("f", new NullCommandNode(0));
		session.setLastStatus(3);
	}

	@Test
	public void testTopLevelDefaults() {
		Session fresh = new Session(new Jbash(), in, out, err);
		assertEquals(Collections.singletonList(""), fresh.getArgs());
		assertEquals("", fresh.getVar("x"));
		assertEquals("", fresh.getArg(5));
		assertFalse(fresh.hasFunction("f"));
		assertNull(fresh.getFunction("f"));
		assertTrue(fresh.succeeded());
	}

	@Test
	public void testResolveLocalsFirst() {
		assertEquals("e", session.resolve("env"));
		session.setVar("env", "shadow");
		assertEquals("shadow", session.resolve("env"));
		session.unsetVar("env");
		assertEquals("e", session.resolve("env"));
		session.unsetEnv("env");
		assertEquals("", session.resolve("env"));
		assertFalse(session.hasEnv("env"));
	}

	@Test
	public void testArguments() {
		session.setScriptName("script");
		assertEquals(Arrays.asList("script", "a", "b"), session.getArgs());
		session.setArgs(Collections.singletonList("c"));
		assertEquals(Arrays.asList("script", "c"), session.getArgs());
		assertEquals("", session.getArg(-1));
	}

	@Test
	public void testSubshellCopiesVariablesAndFunctions() {
		Session subshell = session.subshell(in, out, err);
		assertEquals("e", subshell.getEnv("env"));
		assertEquals("l", subshell.getVar("local"));
		assertTrue(subshell.hasFunction("f"));
		assertEquals(3, subshell.getLastStatus());

		subshell.setEnv("env", "changed");
		subshell.setVar("local", "changed");
		subshell.setFunction("g", new NullCommandNode(0));
		assertEquals("e", session.getEnv("env"));
		assertEquals("l", session.getVar("local"));
		assertFalse(session.hasFunction("g"));

		session.setVar("later", "x");
		assertFalse(subshell.hasVar("later"));
	}

	@Test
	public void testSubshellSharesArguments() {
		Session subshell = session.subshell(in, out, err);
		assertEquals("a", subshell.getArg(1));
		subshell.setArgs(Collections.singletonList("z"));
		assertEquals("z", session.getArg(1));
	}

	@Test
	public void testFunctionCall() {
		Session call = session.functionCall(Arrays.asList("f", "x"));
		assertEquals(Arrays.asList("f", "x"), call.getArgs());
		assertEquals("", call.getVar("local"));
		assertEquals("e", call.getEnv("env"));
		assertTrue(call.hasFunction("f"));

		call.setVar("inner", "1");
		call.setEnv("exported", "1");
		call.setFunction("g", new NullCommandNode(0));
		assertFalse(session.hasVar("inner"));
		assertEquals("1", session.getEnv("exported"));
		assertTrue(session.hasFunction("g"));
		assertEquals(Arrays.asList("", "a", "b"), session.getArgs());
	}

	@Test
	public void testPipeSessions() {
		PrintStream pipeOut = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
		Session left = session.pipeLeft(pipeOut);
		assertSame(pipeOut, left.out());
		assertSame(in, left.in());
		assertSame(err, left.err());
		left.setVar("shared", "1");
		assertEquals("1", session.getVar("shared"));

		InputStream pipeIn = new ByteArrayInputStream(new byte[0]);
		Session right = session.pipeRight(pipeIn);
		assertSame(pipeIn, right.in());
		assertSame(out, right.out());
		assertEquals("1", right.getVar("shared"));
	}

	@Test
	public void testShellDepth() {
		for (int i = 0; i < Session.MAX_SHELL_DEPTH; i++) {
			assertTrue(session.increaseShellDepth());
		}
		assertFalse(session.increaseShellDepth());
		assertEquals(Session.MAX_SHELL_DEPTH, session.getShellDepth());
		Session call = session.functionCall(Collections.singletonList("f"));
		assertFalse(call.increaseShellDepth());
		for (int i = 0; i < Session.MAX_SHELL_DEPTH + 2; i++) {
			session.decreaseShellDepth();
		}
		assertEquals(0, session.getShellDepth());
	}
}
