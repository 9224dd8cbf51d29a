package org.metricshub.jbash.runtime;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jbash.Jbash;
import org.metricshub.jbash.JbashStatus;
import org.metricshub.jbash.frontend.ast.Evaluable;

/**
 * Execution context of a script: variables, positional arguments,
 * functions, streams and the status of the last command.
 * <p>
 * Nested constructs run in derived sessions that share some of this
 * state with their parent and copy the rest:
 * <ul>
 * <li>{@link #subshell} copies environment, locals and functions, and shares the arguments</li>
 * <li>{@link #functionCall} shares environment and functions, with fresh locals and arguments</li>
 * <li>{@link #pipeLeft} and {@link #pipeRight} share everything but one stream</li>
 * </ul>
 * A session is not thread-safe.
 */
public class Session {

	/** Maximum nesting of {@code eval} and function calls. */
	public static final int MAX_SHELL_DEPTH = 16;

	private final Jbash shell;
	private final Map<String, String> environment;
	private final Map<String, String> locals;
	private final List<String> args;
	private final Map<String, Evaluable> functions;
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;
	private int lastStatus;
	private int shellDepth;

	/**
	 * Creates a top-level session with empty variables and a single
	 * argument, the script name.
	 *
	 * @param shell interpreter whose commands the session runs
	 * @param in standard input
	 * @param out standard output
	 * @param err standard error
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Session(Jbash shell, InputStream in, PrintStream out, PrintStream err) {
		this(
				shell,
				new HashMap<String, String>(),
				new HashMap<String, String>(),
				new ArrayList<String>(Collections.singletonList("")),
				new HashMap<String, Evaluable>(),
				in,
				out,
				err);
	}

	private Session(
			Jbash shell,
			Map<String, String> environment,
			Map<String, String> locals,
			List<String> args,
			Map<String, Evaluable> functions,
			InputStream in,
			PrintStream out,
			PrintStream err) {
		this.shell = shell;
		this.environment = environment;
		this.locals = locals;
		this.args = args;
		this.functions = functions;
		this.in = in;
		this.out = out;
		this.err = err;
	}

	private Session derive(
			Map<String, String> derivedEnvironment,
			Map<String, String> derivedLocals,
			List<String> derivedArgs,
			Map<String, Evaluable> derivedFunctions,
			InputStream derivedIn,
			PrintStream derivedOut,
			PrintStream derivedErr) {
		Session session = new Session(
				shell,
				derivedEnvironment,
				derivedLocals,
				derivedArgs,
				derivedFunctions,
				derivedIn,
				derivedOut,
				derivedErr);
		session.lastStatus = lastStatus;
		session.shellDepth = shellDepth;
		return session;
	}

	/**
	 * Derives the session of a subshell: changes to variables and
	 * functions made in it are not seen by this session.
	 *
	 * @param subIn standard input of the subshell
	 * @param subOut standard output of the subshell
	 * @param subErr standard error of the subshell
	 * @return the derived session
	 */
	public Session subshell(InputStream subIn, PrintStream subOut, PrintStream subErr) {
		return derive(
				new HashMap<String, String>(environment),
				new HashMap<String, String>(locals),
				args,
				new HashMap<String, Evaluable>(functions),
				subIn,
				subOut,
				subErr);
	}

	/**
	 * Derives the session a function body runs in.
	 *
	 * @param callArgs the arguments, the function name first
	 * @return the derived session
	 */
	public Session functionCall(List<String> callArgs) {
		return derive(
				environment,
				new HashMap<String, String>(),
				new ArrayList<String>(callArgs),
				functions,
				in,
				out,
				err);
	}

	/**
	 * Derives the session of the left side of a pipe.
	 *
	 * @param pipeOut stream feeding the right side
	 * @return the derived session
	 */
	public Session pipeLeft(PrintStream pipeOut) {
		return derive(environment, locals, args, functions, in, pipeOut, err);
	}

	/**
	 * Derives the session of the right side of a pipe.
	 *
	 * @param pipeIn output of the left side
	 * @return the derived session
	 */
	public Session pipeRight(InputStream pipeIn) {
		return derive(environment, locals, args, functions, pipeIn, out, err);
	}

	public Jbash getShell() {
		return shell;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public InputStream in() {
		return in;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream out() {
		return out;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream err() {
		return err;
	}

	public boolean hasEnv(String name) {
		return environment.containsKey(name);
	}

	/**
	 * @param name variable name
	 * @return the value of the environment variable, {@code ""} if unset
	 */
	public String getEnv(String name) {
		String value = environment.get(name);
		return value == null ? "" : value;
	}

	public void setEnv(String name, String value) {
		environment.put(name, value);
	}

	public void unsetEnv(String name) {
		environment.remove(name);
	}

	public boolean hasVar(String name) {
		return locals.containsKey(name);
	}

	/**
	 * @param name variable name
	 * @return the value of the local variable, {@code ""} if unset
	 */
	public String getVar(String name) {
		String value = locals.get(name);
		return value == null ? "" : value;
	}

	public void setVar(String name, String value) {
		locals.put(name, value);
	}

	public void unsetVar(String name) {
		locals.remove(name);
	}

	/**
	 * Looks a variable up in the locals, then in the environment.
	 *
	 * @param name variable name
	 * @return its value, {@code ""} if it is set in neither
	 */
	public String resolve(String name) {
		if (hasVar(name)) {
			return getVar(name);
		}
		return getEnv(name);
	}

	/**
	 * @param index argument index, {@code 0} being the script or function name
	 * @return the argument, {@code ""} when out of range
	 */
	public String getArg(int index) {
		return index >= 0 && index < args.size() ? args.get(index) : "";
	}

	/**
	 * @return the arguments, the script or function name first
	 */
	public List<String> getArgs() {
		return Collections.unmodifiableList(args);
	}

	/**
	 * Replaces the arguments of this session, the name excluded.
	 *
	 * @param values the new positional arguments
	 */
	public void setArgs(List<String> values) {
		String name = getArg(0);
		args.clear();
		args.add(name);
		args.addAll(values);
	}

	/**
	 * @param name the new argument 0, the script name
	 */
	public void setScriptName(String name) {
		args.set(0, name);
	}

	public boolean hasFunction(String name) {
		return functions.containsKey(name);
	}

	/**
	 * @param name function name
	 * @return the function body, {@code null} if no such function is defined
	 */
	public Evaluable getFunction(String name) {
		return functions.get(name);
	}

	public void setFunction(String name, Evaluable body) {
		functions.put(name, body);
	}

	public int getLastStatus() {
		return lastStatus;
	}

	public void setLastStatus(int status) {
		this.lastStatus = status;
	}

	/**
	 * Enters one more level of {@code eval} or function call.
	 *
	 * @return {@code false} when {@link #MAX_SHELL_DEPTH} is reached, in
	 *         which case the depth is unchanged
	 */
	public boolean increaseShellDepth() {
		if (shellDepth >= MAX_SHELL_DEPTH) {
			return false;
		}
		shellDepth++;
		return true;
	}

	public void decreaseShellDepth() {
		if (shellDepth > 0) {
			shellDepth--;
		}
	}

	public int getShellDepth() {
		return shellDepth;
	}

	/**
	 * @return whether the last command succeeded
	 */
	public boolean succeeded() {
		return lastStatus == JbashStatus.SUCCESS;
	}
}
