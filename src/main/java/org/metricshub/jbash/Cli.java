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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.jbash.command.Command;
import org.metricshub.jbash.command.CommandRegistry;
import org.metricshub.jbash.frontend.ParserException;
import org.metricshub.jbash.frontend.ast.Evaluable;
import org.metricshub.jbash.frontend.ast.Node;
import org.metricshub.jbash.runtime.Session;
import org.metricshub.jbash.util.JbashSettings;
import org.metricshub.jbash.util.ScriptFileSource;
import org.metricshub.jbash.util.ScriptSource;

/**
 * Command-line interface for Jbash.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "jbash.jar";
		}
		JAR_NAME = myName;
	}

	private final JbashSettings settings = new JbashSettings();
	private final PrintStream out;

	private final List<String> commandSpecs = new ArrayList<String>();
	private ScriptSource scriptSource;
	private String scriptText;
	private boolean dumpSyntaxTree;
	private boolean listCommands;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in standard input of the script
	 * @param out standard output of the script, and of the usage screen
	 * @param err standard error of the script
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.out = out;
		settings.setInput(in);
		settings.setOutputStream(out);
		settings.setErrorStream(err);
	}

	/**
	 * Returns the mutable {@link JbashSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JbashSettings getSettings() {
		return settings;
	}

	/**
	 * @return the script source given with {@code -f}, {@code null} otherwise
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * @return the text of the script to run, known once {@link #parse} succeeded
	 */
	public String getScriptText() {
		return scriptText;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the script, then its arguments
				break;
			} else if (arg.equals("-")) {
				++argIdx;
				break;
			} else if (arg.equals("-e")) {
				// -e name=val : environment variable
				checkParameterHasArgument(args, argIdx);
				String[] assignment = splitAssignment(args[++argIdx]);
				settings.putEnvironment(assignment[0], assignment[1]);
			} else if (arg.equals("-v")) {
				// -v name=val : local variable
				checkParameterHasArgument(args, argIdx);
				String[] assignment = splitAssignment(args[++argIdx]);
				settings.putVariable(assignment[0], assignment[1]);
			} else if (arg.equals("-f")) {
				checkParameterHasArgument(args, argIdx);
				if (scriptSource != null) {
					throw new IllegalArgumentException("Only one script file can be given with -f.");
				}
				scriptSource = new ScriptFileSource(args[++argIdx]);
			} else if (arg.equals("-c") || arg.equals("--command")) {
				// -c/--command command : load a command by name or class name
				checkParameterHasArgument(args, argIdx);
				commandSpecs.add(args[++argIdx]);
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("-l") || arg.equals("--list-commands")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When listing commands, we do not accept other arguments.");
				}
				listCommands = true;
				return;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSource == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Jbash script not provided.");
			}
			scriptSource = new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(args[argIdx++]));
		}
		try {
			scriptText = scriptSource.readText();
		} catch (IOException ex) {
			throw new IllegalArgumentException(
					"Failed to read script '" + scriptSource.getDescription() + "': " + ex.getMessage(),
					ex);
		}
		settings.setScriptName(scriptSource.getDescription());

		while (argIdx < args.length) {
			settings.addArgument(args[argIdx++]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static final Pattern ASSIGNMENT_PATTERN = Pattern.compile("([_a-zA-Z][_0-9a-zA-Z]*)=(.*)", Pattern.DOTALL);

	/**
	 * @param keyValue string of the form {@code name=value}
	 * @return the name and the value
	 */
	private static String[] splitAssignment(String keyValue) {
		Matcher m = ASSIGNMENT_PATTERN.matcher(keyValue);
		if (!m.matches()) {
			throw new IllegalArgumentException("keyValue \"" + keyValue + "\" must be of the form \"name=value\"");
		}
		return new String[] { m.group(1), m.group(2) };
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @return the exit status: the status of the script, {@code 0} when
	 *         nothing was run
	 */
	public int run() {
		if (printUsage) {
			usage(out);
			return JbashStatus.SUCCESS;
		}
		CommandRegistry registry = CommandRegistry.withBuiltins();
		for (String spec : commandSpecs) {
			if (registry.resolve(spec) == null) {
				throw new IllegalArgumentException("Unknown command '" + spec + "'");
			}
		}
		Jbash shell = new Jbash(registry);
		if (listCommands) {
			for (Map.Entry<String, Command> entry : shell.getCommands().entrySet()) {
				out.println(entry.getKey() + " - " + entry.getValue().getClass().getName());
			}
			return JbashStatus.SUCCESS;
		}
		if (dumpSyntaxTree) {
			Evaluable root;
			try {
				root = shell.parse(scriptText);
			} catch (ParserException e) {
				settings.getErrorStream().print(e.getMessage());
				return e.getStatus();
			}
			if (root instanceof Node) {
				((Node) root).dump(out);
			}
			return JbashStatus.SUCCESS;
		}
		Session session = shell.newSession(settings);
		int status = shell.run(scriptText, session);
		settings.getOutputStream().flush();
		return status;
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f script-filename]" +
								" [-e name=val]..." +
								" [-v name=val]..." +
								" [-c command]..." +
								" [--dump-syntax]" +
								" [script]" +
								" [arg]...");
		dest.println();
		dest.println("java -jar " + JAR_NAME + " --list-commands");
		dest.println();
		dest.println(" -f filename = Use contents of filename for script.");
		dest.println(" -e name=val = Initial environment variable assignments.");
		dest.println(" -v name=val = Initial local variable assignments.");
		dest.println(" -c command = Load a command by name or class name.");
		dest.println(" --command command = Same as -c.");
		dest.println(" --dump-syntax = Print the syntax tree instead of running the script.");
		dest.println(" -l, --list-commands = List available commands.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Parses arguments and executes the CLI with the supplied streams.
	 *
	 * @param args command-line arguments
	 * @param is standard input of the script
	 * @param os standard output of the script
	 * @param es standard error of the script
	 * @return the exit status
	 */
	public static int execute(String[] args, InputStream is, PrintStream os, PrintStream es) {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		return cli.run();
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		int status;
		try {
			Cli cli = new Cli();
			cli.parse(args);
			status = cli.run();
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			status = JbashStatus.ERROR;
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			status = JbashStatus.ERROR;
		}
		System.exit(status);
	}
}
