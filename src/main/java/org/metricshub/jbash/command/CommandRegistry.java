package org.metricshub.jbash.command;

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

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.metricshub.jbash.util.JbashLogger;
import org.slf4j.Logger;

/**
 * Name to {@link Command} table consulted when a script runs a command.
 * <p>
 * Scripts look commands up by their exact name with {@link #get(String)}.
 * Hosts and the command line can use {@link #resolve(String)}, which is
 * also case-insensitive, accepts class names, and loads classes that were
 * never registered.
 */
public final class CommandRegistry {

	private static final Logger LOG = JbashLogger.getLogger(CommandRegistry.class);

	private final ConcurrentMap<String, Command> registered = new ConcurrentHashMap<String, Command>();

	/** Creates an empty registry. */
	public CommandRegistry() {}

	/**
	 * @return a new registry holding the built-in commands
	 */
	public static CommandRegistry withBuiltins() {
		CommandRegistry registry = new CommandRegistry();
		registry.registerBuiltin(new EchoCommand());
		registry.registerBuiltin(new CatCommand());
		registry.registerBuiltin(new EvalCommand());
		registry.registerBuiltin(new GetenvCommand());
		registry.registerBuiltin(new SetenvCommand());
		registry.registerBuiltin(new GetvarCommand());
		registry.registerBuiltin(new SetvarCommand());
		registry.registerBuiltin(new SeqCommand());
		registry.registerBuiltin(new MathCommand());
		registry.registerBuiltin(new TestCommand());
		registry.registerBuiltin(new FcallCommand());
		return registry;
	}

	/**
	 * Registers a command under its own name, replacing any command of
	 * the same name.
	 *
	 * @param command command instance
	 */
	public void register(Command command) {
		Objects.requireNonNull(command, "Command instance must not be null");
		register(command.getName(), command);
	}

	/**
	 * Registers a command under the supplied name.
	 *
	 * @param name name scripts use to run the command
	 * @param command command instance
	 */
	public void register(String name, Command command) {
		Objects.requireNonNull(name, "Command name must not be null");
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Command name must not be empty");
		}
		registered.put(name, Objects.requireNonNull(command, "Command instance must not be null"));
		LOG.debug("Registered command '{}' ({})", name, command.getClass().getName());
	}

	private void registerBuiltin(Command command) {
		Command existing = registered.putIfAbsent(command.getName(), command);
		if (existing != null && existing != command) {
			throw new IllegalStateException(
					"Command name '" + command.getName() + "' already mapped to "
							+ existing.getClass().getName());
		}
	}

	/**
	 * Removes a command.
	 *
	 * @param name name of the command
	 * @return the removed command, {@code null} if there was none
	 */
	public Command unregister(String name) {
		return name == null ? null : registered.remove(name);
	}

	/**
	 * @param name exact command name
	 * @return the command, {@code null} if none has this name
	 */
	public Command get(String name) {
		return name == null ? null : registered.get(name);
	}

	/**
	 * Returns a snapshot of all registered commands sorted by name.
	 *
	 * @return immutable view of registered commands
	 */
	public Map<String, Command> listCommands() {
		List<Map.Entry<String, Command>> entries = new ArrayList<Map.Entry<String, Command>>(registered.entrySet());
		Collections.sort(entries, Comparator.comparing(Map.Entry::getKey, String.CASE_INSENSITIVE_ORDER));
		Map<String, Command> snapshot = new LinkedHashMap<String, Command>();
		for (Map.Entry<String, Command> entry : entries) {
			snapshot.put(entry.getKey(), entry.getValue());
		}
		return Collections.unmodifiableMap(snapshot);
	}

	/**
	 * Resolves a command name to a command. The lookup tries the exact
	 * name, then ignores case, then compares class names. When nothing
	 * matches, the name is taken as the name of a {@link Command} class,
	 * which is instantiated and registered.
	 *
	 * @param name name or class name of the command
	 * @return command instance, or {@code null} when the name cannot be resolved
	 */
	public Command resolve(String name) {
		if (name == null || name.isEmpty()) {
			return null;
		}
		Command command = registered.get(name);
		if (command != null) {
			return command;
		}
		command = findCaseInsensitive(name);
		if (command != null) {
			return command;
		}
		command = findByClassName(name);
		if (command != null) {
			return command;
		}
		command = instantiateByClassName(name);
		if (command == null) {
			LOG.debug("Unable to resolve command '{}'", name);
		}
		return command;
	}

	private Command findCaseInsensitive(String name) {
		for (Map.Entry<String, Command> entry : registered.entrySet()) {
			if (entry.getKey().equalsIgnoreCase(name)) {
				return entry.getValue();
			}
		}
		return null;
	}

	private Command findByClassName(String name) {
		for (Command command : registered.values()) {
			Class<? extends Command> type = command.getClass();
			if (type.getName().equals(name) || type.getSimpleName().equalsIgnoreCase(name)) {
				return command;
			}
		}
		return null;
	}

	private Command instantiateByClassName(String name) {
		try {
			Class<?> clazz = Class.forName(name);
			if (!Command.class.isAssignableFrom(clazz)) {
				return null;
			}
			Command created = clazz.asSubclass(Command.class).getDeclaredConstructor().newInstance();
			Command existing = registered.putIfAbsent(created.getName(), created);
			return existing != null ? existing : created;
		} catch (ClassNotFoundException ex) {
			return null;
		} catch (InstantiationException
				| IllegalAccessException
				| InvocationTargetException
				| NoSuchMethodException ex) {
			throw new IllegalStateException("Unable to instantiate command class '" + name + "'", ex);
		}
	}
}
