package org.metricshub.jbash;

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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.metricshub.jbash.command.Command;
import org.metricshub.jbash.command.CommandRegistry;
import org.metricshub.jbash.frontend.JbashParser;
import org.metricshub.jbash.frontend.ParserException;
import org.metricshub.jbash.frontend.ast.EvalOutcome;
import org.metricshub.jbash.frontend.ast.Evaluable;
import org.metricshub.jbash.runtime.Session;
import org.metricshub.jbash.util.JbashLogger;
import org.metricshub.jbash.util.JbashSettings;
import org.metricshub.jbash.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and execution of a Jbash script, when
 * Jbash is used as a library.
 * <p>
 * A shell owns the commands scripts can run. Scripts run in a
 * {@link Session}, which holds their variables and streams; one shell
 * may run many sessions, one after the other or concurrently, as long as
 * each session is used by one thread at a time.
 * <p>
 * Typical use:
 * <pre>
 * Jbash shell = new Jbash();
 * Session session = shell.newSession(System.in, System.out, System.err);
 * int status = shell.run("for i in `seq 1 3`; do echo $i; done", session);
 * </pre>
 * Errors found while running a script are reported to the session's
 * error stream through the methods {@link #commandNotFound},
 * {@link #invalidFunctionName} and {@link #syntaxError}, which
 * subclasses may override.
 */
public class Jbash {

	private static final Logger LOG = JbashLogger.getLogger(Jbash.class);

	private final CommandRegistry registry;
	private final ConcurrentMap<String, Command> localCommands = new ConcurrentHashMap<String, Command>();

	/** Creates a shell with the built-in commands. */
	public Jbash() {
		this(CommandRegistry.withBuiltins());
	}

	/**
	 * Creates a shell using the supplied commands.
	 *
	 * @param registry the commands scripts can run
	 */
	public Jbash(CommandRegistry registry) {
		if (registry == null) {
			throw new IllegalArgumentException("Command registry must not be null");
		}
		this.registry = registry;
	}

	/**
	 * Adds a command to this shell only. It hides a command of the same
	 * name in the registry.
	 *
	 * @param command the command
	 */
	public void register(Command command) {
		if (command == null || command.getName() == null || command.getName().isEmpty()) {
			throw new IllegalArgumentException("Command and its name must not be null or empty");
		}
		localCommands.put(command.getName(), command);
	}

	/**
	 * @param name exact name of a command
	 * @return the command, {@code null} if this shell has none of this name
	 */
	public Command getCommand(String name) {
		Command command = localCommands.get(name);
		return command != null ? command : registry.get(name);
	}

	/**
	 * @return the commands this shell can run, sorted by name
	 */
	public Map<String, Command> getCommands() {
		CommandRegistry all = new CommandRegistry();
		for (Command command : registry.listCommands().values()) {
			all.register(command);
		}
		for (Command command : localCommands.values()) {
			all.register(command);
		}
		return all.listCommands();
	}

	/**
	 * Creates a top-level session bound to this shell.
	 *
	 * @param in standard input of the scripts
	 * @param out standard output of the scripts
	 * @param err standard error of the scripts
	 * @return the new session
	 */
	public Session newSession(InputStream in, PrintStream out, PrintStream err) {
		return new Session(this, in, out, err);
	}

	/**
	 * Creates a top-level session from settings: streams, variables and
	 * positional arguments.
	 *
	 * @param settings the settings
	 * @return the new session
	 */
	public Session newSession(JbashSettings settings) {
		Session session = newSession(settings.getInput(), settings.getOutputStream(), settings.getErrorStream());
		for (Map.Entry<String, String> entry : settings.getEnvironment().entrySet()) {
			session.setEnv(entry.getKey(), entry.getValue());
		}
		for (Map.Entry<String, String> entry : settings.getVariables().entrySet()) {
			session.setVar(entry.getKey(), entry.getValue());
		}
		session.setScriptName(settings.getScriptName());
		session.setArgs(settings.getArguments());
		return session;
	}

	/**
	 * Parses a script without running it.
	 *
	 * @param script the script text
	 * @return the root of the syntax tree
	 * @throws ParserException when the script is malformed
	 */
	public Evaluable parse(String script) {
		return JbashParser.parse(script);
	}

	/**
	 * Runs a script in a session.
	 *
	 * @param script the script text
	 * @param session where the script runs
	 * @return the status of the last command, or the syntax error status
	 */
	public int run(String script, Session session) {
		return run(script.getBytes(StandardCharsets.UTF_8), session);
	}

	/**
	 * Runs a script read from a character stream.
	 *
	 * @param script the script
	 * @param session where the script runs
	 * @return the status of the last command, or the syntax error status
	 * @throws IOException when the script cannot be read
	 */
	public int run(Reader script, Session session) throws IOException {
		return run(ScriptSource.readFully(script), session);
	}

	/**
	 * Runs a script read as UTF-8 bytes.
	 *
	 * @param script the script
	 * @param session where the script runs
	 * @return the status of the last command, or the syntax error status
	 * @throws IOException when the script cannot be read
	 */
	public int run(InputStream script, Session session) throws IOException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		script.transferTo(bytes);
		return run(bytes.toByteArray(), session);
	}

	private int run(byte[] script, Session session) {
		Evaluable root;
		try {
			root = new JbashParser(script).parse();
		} catch (ParserException e) {
			LOG.debug("Syntax error with status {} at byte {}", e.getStatus(), e.getPosition());
			syntaxError(session, e);
			session.setLastStatus(e.getStatus());
			return e.getStatus();
		}
		EvalOutcome outcome = root.evaluate(session);
		int status = outcome.isSignal() ? session.getLastStatus() : outcome.getStatus();
		session.setLastStatus(status);
		return status;
	}

	/**
	 * Runs a script with an empty standard input, discarding errors.
	 *
	 * @param script the script text
	 * @return what the script printed on its standard output
	 */
	public String execute(String script) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		try (PrintStream outStream = new PrintStream(out, true, StandardCharsets.UTF_8);
				PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8)) {
			Session session = newSession(new ByteArrayInputStream(new byte[0]), outStream, errStream);
			run(script, session);
		}
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	/**
	 * Called when a script runs a command this shell does not have.
	 *
	 * @param session session of the script
	 * @param name the command name
	 */
	public void commandNotFound(Session session, String name) {
		session.err().print("shell: “" + name + "”: not found.\n");
	}

	/**
	 * Called when a function definition has a name that is not an
	 * identifier.
	 *
	 * @param session session of the script
	 * @param name the rejected name
	 */
	public void invalidFunctionName(Session session, String name) {
		session.err().print("shell: “" + name + "”: invalid function name.\n");
	}

	/**
	 * Called when a script, or a script given to a command, is malformed.
	 *
	 * @param session session of the script
	 * @param e the error, whose message shows where it was found
	 */
	public void syntaxError(Session session, ParserException e) {
		session.err().print(e.getMessage());
	}
}
