package org.metricshub.jbash.util;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of a single Jbash invocation: the standard streams, the
 * variables assigned before the script starts, and the positional
 * arguments.
 * <p>
 * These values have defaults, which the command line or the host
 * application may change.
 */
public class JbashSettings {

	/**
	 * Where input is read from.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/** {@code System.out} by default. */
	private PrintStream outputStream = System.out;

	/** {@code System.err} by default. */
	private PrintStream errorStream = System.err;

	/** Environment variables (-e assignments). */
	private final Map<String, String> environment = new LinkedHashMap<String, String>();

	/** Local variables (-v assignments). */
	private final Map<String, String> variables = new LinkedHashMap<String, String>();

	/** Name of the script, argument 0 of the session. */
	private String scriptName = "";

	/** {@code $1}, {@code $2}... */
	private final List<String> arguments = new ArrayList<String>();

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public InputStream getInput() {
		return input;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setInput(InputStream input) {
		this.input = input;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getErrorStream() {
		return errorStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setErrorStream(PrintStream errorStream) {
		this.errorStream = errorStream;
	}

	public Map<String, String> getEnvironment() {
		return Collections.unmodifiableMap(environment);
	}

	public void putEnvironment(String name, String value) {
		environment.put(name, value);
	}

	public Map<String, String> getVariables() {
		return Collections.unmodifiableMap(variables);
	}

	public void putVariable(String name, String value) {
		variables.put(name, value);
	}

	public String getScriptName() {
		return scriptName;
	}

	public void setScriptName(String scriptName) {
		this.scriptName = scriptName == null ? "" : scriptName;
	}

	public List<String> getArguments() {
		return Collections.unmodifiableList(arguments);
	}

	public void addArgument(String argument) {
		arguments.add(argument);
	}

	/**
	 * @return a human readable representation of the parameters values
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();
		final char newLine = '\n';
		desc.append("environment = ").append(environment).append(newLine);
		desc.append("variables = ").append(variables).append(newLine);
		desc.append("scriptName = ").append(scriptName).append(newLine);
		desc.append("arguments = ").append(arguments).append(newLine);
		return desc.toString();
	}
}
