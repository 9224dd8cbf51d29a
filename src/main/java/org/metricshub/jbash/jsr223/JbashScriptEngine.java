package org.metricshub.jbash.jsr223;

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
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.jbash.Jbash;
import org.metricshub.jbash.runtime.Session;
import org.metricshub.jbash.runtime.Variables;

/**
 * Simple JSR-223 script engine for Jbash.
 * <p>
 * String entries of the engine bindings whose key is a variable name,
 * other than {@code input}, are visible to the script as environment
 * variables. The attribute {@code input}, a String or an InputStream, is
 * the standard input of the script. The status of the script is stored in the {@code status}
 * attribute of the engine scope.
 */
public class JbashScriptEngine extends AbstractScriptEngine {

	/** Engine scope attribute holding the status of the last script. */
	public static final String STATUS_ATTRIBUTE = "status";

	/** Attribute holding the standard input of the script. */
	public static final String INPUT_ATTRIBUTE = "input";

	private final ScriptEngineFactory factory;

	public JbashScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		try {
			InputStream in;
			Object inObj = context.getAttribute(INPUT_ATTRIBUTE);
			if (inObj instanceof InputStream) {
				in = (InputStream) inObj;
			} else if (inObj instanceof String) {
				in = new ByteArrayInputStream(((String) inObj).getBytes(StandardCharsets.UTF_8));
			} else {
				in = new ByteArrayInputStream(new byte[0]);
			}
			ByteArrayOutputStream result = new ByteArrayOutputStream();
			ByteArrayOutputStream errors = new ByteArrayOutputStream();
			Jbash shell = new Jbash();
			int status;
			try (PrintStream out = new PrintStream(result, true, StandardCharsets.UTF_8);
					PrintStream err = new PrintStream(errors, true, StandardCharsets.UTF_8)) {
				Session session = shell.newSession(in, out, err);
				Bindings bindings = context.getBindings(ScriptContext.ENGINE_SCOPE);
				if (bindings != null) {
					for (Map.Entry<String, Object> entry : bindings.entrySet()) {
						if (entry.getValue() instanceof String
								&& Variables.isVar(entry.getKey())
								&& !INPUT_ATTRIBUTE.equals(entry.getKey())) {
							session.setEnv(entry.getKey(), (String) entry.getValue());
						}
					}
				}
				status = shell.run(scriptReader, session);
			}
			String out = result.toString(StandardCharsets.UTF_8);
			Writer writer = context.getWriter();
			if (writer != null) {
				writer.write(out);
				writer.flush();
			}
			Writer errorWriter = context.getErrorWriter();
			if (errorWriter != null && errors.size() > 0) {
				errorWriter.write(errors.toString(StandardCharsets.UTF_8));
				errorWriter.flush();
			}
			context.setAttribute(STATUS_ATTRIBUTE, Integer.valueOf(status), ScriptContext.ENGINE_SCOPE);
			return out;
		} catch (IOException e) {
			throw new ScriptException(e);
		}
	}

	@Override
	public Object eval(String script, ScriptContext context) throws ScriptException {
		return eval(new StringReader(script), context);
	}

	@Override
	public Bindings createBindings() {
		return new SimpleBindings();
	}

	@Override
	public ScriptEngineFactory getFactory() {
		return factory;
	}
}
