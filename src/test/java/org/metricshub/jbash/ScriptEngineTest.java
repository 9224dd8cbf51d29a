package org.metricshub.jbash;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import javax.script.Bindings;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptEngineManager;
import org.junit.Test;
import org.metricshub.jbash.jsr223.JbashScriptEngine;

public class ScriptEngineTest {

	private static ScriptEngine engine() {
		ScriptEngine engine = new ScriptEngineManager().getEngineByName("jbash");
		assertNotNull("Jbash ScriptEngine not found", engine);
		return engine;
	}

	@Test
	public void testJbashScriptEngine() throws Exception {
		ScriptEngine engine = engine();

		Bindings bindings = engine.createBindings();
		bindings.put("input", new ByteArrayInputStream("hello world".getBytes(StandardCharsets.UTF_8)));

		StringWriter result = new StringWriter();
		engine.getContext().setWriter(new PrintWriter(result));

		Object returned = engine.eval("cat", bindings);

		assertEquals("hello world", result.toString());
		assertEquals("hello world", returned);
		assertEquals(Integer.valueOf(0), bindings.get(JbashScriptEngine.STATUS_ATTRIBUTE));
	}

	@Test
	public void testLookup() {
		ScriptEngineManager manager = new ScriptEngineManager();
		assertNotNull(manager.getEngineByExtension("sh"));
		assertNotNull(manager.getEngineByMimeType("application/x-sh"));
		assertEquals("bash", manager.getEngineByName("Jbash").getFactory().getLanguageName());
	}

	@Test
	public void testBindingsAreEnvironment() throws Exception {
		ScriptEngine engine = engine();
		Bindings bindings = engine.createBindings();
		bindings.put("name", "world");
		bindings.put("input", "data");
		bindings.put("count", Integer.valueOf(3));
		engine.getContext().setWriter(new StringWriter());
		assertEquals("hello world <><>", engine.eval("echo -n \"hello $name <$input><$count>\"", bindings));
	}

	@Test
	public void testStringInput() throws Exception {
		ScriptEngine engine = engine();
		Bindings bindings = engine.createBindings();
		bindings.put(JbashScriptEngine.INPUT_ATTRIBUTE, "line\n");
		engine.getContext().setWriter(new StringWriter());
		assertEquals("line\n", engine.eval("cat | cat", bindings));
	}

	@Test
	public void testStatusAndErrors() throws Exception {
		ScriptEngine engine = engine();
		Bindings bindings = engine.createBindings();
		StringWriter errors = new StringWriter();
		engine.getContext().setWriter(new StringWriter());
		engine.getContext().setErrorWriter(errors);
		engine.eval("nosuch", bindings);
		assertEquals(Integer.valueOf(JbashStatus.COMMAND_NOT_FOUND), bindings.get(JbashScriptEngine.STATUS_ATTRIBUTE));
		assertEquals("shell: “nosuch”: not found.\n", errors.toString());
	}

	@Test
	public void testOutputStatement() throws Exception {
		ScriptEngine engine = engine();
		ScriptEngineFactory factory = engine.getFactory();
		engine.getContext().setWriter(new StringWriter());
		assertEquals("it's", engine.eval(factory.getOutputStatement("it's")));
		assertEquals("ab", engine.eval(factory.getProgram(factory.getOutputStatement("a"), factory.getOutputStatement("b"))));
	}
}
