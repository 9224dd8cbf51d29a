package org.metricshub.jbash;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jbash.JbashTestSupport.shellTest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.metricshub.jbash.command.Command;
import org.metricshub.jbash.command.CommandRegistry;
import org.metricshub.jbash.command.EchoCommand;
import org.metricshub.jbash.command.SeqCommand;
import org.metricshub.jbash.runtime.Session;

public class CommandRegistryTest {

	/** Prints its name and arguments. */
	public static class ShoutCommand implements Command {

		private final String name;

		public ShoutCommand() {
			this("shout");
		}

		ShoutCommand(String name) {
			this.name = name;
		}

		@Override
		public String getName() {
			return name;
		}

		@Override
		public int run(List<String> args, Session session) {
			session.out().print(name.toUpperCase() + args);
			return JbashStatus.SUCCESS;
		}
	}

	/** Cannot be created by class name. */
	public static class NoDefaultConstructorCommand extends ShoutCommand {

		public NoDefaultConstructorCommand(String name) {
			super(name);
		}
	}

	@Test
	public void testBuiltins() {
		Map<String, Command> commands = CommandRegistry.withBuiltins().listCommands();
		assertEquals(
				Arrays.asList("cat", "echo", "eval", "fcall", "getenv", "getvar", "math", "seq", "setenv", "setvar", "test"),
				new ArrayList<String>(commands.keySet()));
		assertTrue(commands.get("echo") instanceof EchoCommand);
	}

	@Test
	public void testListingIsSortedAndImmutable() {
		CommandRegistry registry = new CommandRegistry();
		registry.register("b", new ShoutCommand("b"));
		registry.register("A", new ShoutCommand("A"));
		registry.register("c", new ShoutCommand("c"));
		Map<String, Command> commands = registry.listCommands();
		assertEquals(Arrays.asList("A", "b", "c"), new ArrayList<String>(commands.keySet()));
		assertThrows(UnsupportedOperationException.class, () -> commands.put("d", new ShoutCommand()));
	}

	@Test
	public void testRegisterAndUnregister() {
		CommandRegistry registry = new CommandRegistry();
		Command shout = new ShoutCommand();
		registry.register(shout);
		assertSame(shout, registry.get("shout"));
		registry.register("alias", shout);
		assertSame(shout, registry.get("alias"));
		assertSame(shout, registry.unregister("alias"));
		assertNull(registry.get("alias"));
		assertNull(registry.unregister("alias"));
		assertNull(registry.get(null));
	}

	@Test
	public void testInvalidRegistrations() {
		CommandRegistry registry = new CommandRegistry();
		assertThrows(NullPointerException.class, () -> registry.register(null));
		assertThrows(NullPointerException.class, () -> registry.register("x", null));
		assertThrows(IllegalArgumentException.class, () -> registry.register("", new ShoutCommand()));
	}

	@Test
	public void testGetIsExact() {
		CommandRegistry registry = CommandRegistry.withBuiltins();
		assertNull(registry.get("ECHO"));
		assertNotNull(registry.get("echo"));
	}

	@Test
	public void testResolve() {
		CommandRegistry registry = CommandRegistry.withBuiltins();
		Command echo = registry.get("echo");
		assertSame(echo, registry.resolve("echo"));
		assertSame(echo, registry.resolve("ECHO"));
		assertSame(echo, registry.resolve("EchoCommand"));
		assertSame(echo, registry.resolve("echocommand"));
		assertSame(echo, registry.resolve(EchoCommand.class.getName()));
		assertNull(registry.resolve("nosuch"));
		assertNull(registry.resolve(""));
		assertNull(registry.resolve(null));
	}

	@Test
	public void testResolveLoadsClasses() {
		CommandRegistry registry = new CommandRegistry();
		Command seq = registry.resolve(SeqCommand.class.getName());
		assertTrue(seq instanceof SeqCommand);
		assertSame(seq, registry.get("seq"));
		assertSame(seq, registry.resolve(SeqCommand.class.getName()));
		assertNull(registry.resolve(String.class.getName()));
		assertThrows(
				IllegalStateException.class,
				() -> registry.resolve(NoDefaultConstructorCommand.class.getName()));
	}

	@Test
	public void testShellWithCustomRegistry() {
		CommandRegistry registry = new CommandRegistry();
		registry.register(new EchoCommand());
		registry.register(new ShoutCommand());
		Jbash shell = new Jbash(registry);
		shellTest("custom command").withShell(shell).script("shout a b").expect("SHOUT[a, b]").runAndAssert();
		shellTest("missing builtin")
				.withShell(shell)
				.script("cat")
				.expectExit(JbashStatus.COMMAND_NOT_FOUND)
				.runAndAssert();
	}

	@Test
	public void testShellCommandHidesRegistry() {
		shellTest("local echo")
				.withCommand(new ShoutCommand("echo"))
				.script("echo x")
				.expect("ECHO[x]")
				.runAndAssert();
	}
}
