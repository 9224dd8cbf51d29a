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

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A Jbash script stored in a UTF-8 file, as given to the "-f" switch.
 */
public class ScriptFileSource extends ScriptSource {

	private final Path path;

	/**
	 * @param filePath path of the script file
	 */
	public ScriptFileSource(String filePath) {
		super(filePath, null);
		this.path = Paths.get(filePath);
	}

	/**
	 * @return the path of the script file
	 */
	public Path getPath() {
		return path;
	}

	/**
	 * Opens a new reader on the script file each time it is called.
	 *
	 * @return a reader over the file content
	 */
	@Override
	public Reader getReader() {
		try {
			return Files.newBufferedReader(path, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to open script source for reading: " + path, ex);
		}
	}

	/** {@inheritDoc} */
	@Override
	public String readText() throws IOException {
		if (!Files.isRegularFile(path)) {
			throw new IOException("Not a regular file: " + path);
		}
		return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
	}
}
