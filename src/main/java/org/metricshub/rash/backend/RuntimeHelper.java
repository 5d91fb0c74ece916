package org.metricshub.rash.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Rash
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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Shell functions of the runtime prelude. A script only carries the helpers
 * it calls, in the order of this enumeration.
 */
public enum RuntimeHelper {
	PRINTLN("rash_println", "printf '%s\\n' \"$1\""),
	EPRINTLN("rash_eprintln", "printf '%s\\n' \"$1\" >&2"),
	WRITE_FILE("rash_write_file", "printf '%s' \"$2\" > \"$1\""),
	READ_FILE("rash_read_file", "cat \"$1\""),
	REQUIRE(
			"rash_require",
			"if ! command -v \"$1\" >/dev/null 2>&1; then",
			"    printf 'rash: required command not found: %s\\n' \"$1\" >&2",
			"    exit 127",
			"fi"),
	SYMLINK("rash_symlink", "rm -f \"$2\"", "ln -s \"$1\" \"$2\"");

	private final String functionName;
	private final List<String> body;

	RuntimeHelper(String functionName, String... body) {
		this.functionName = functionName;
		this.body = Collections.unmodifiableList(Arrays.asList(body));
	}

	public String getFunctionName() {
		return functionName;
	}

	public List<String> getBody() {
		return body;
	}

	/**
	 * @param indent indentation unit
	 * @return the definition of the helper, one line per element, newline terminated
	 */
	public String render(String indent) {
		StringBuilder sb = new StringBuilder();
		sb.append(functionName).append("() {\n");
		for (String line : body) {
			sb.append(indent).append(line).append('\n');
		}
		sb.append("}\n");
		return sb.toString();
	}

	/**
	 * @param name a command name
	 * @return the helper of that name, or <code>null</code>
	 */
	public static RuntimeHelper forCommand(String name) {
		if (name == null) {
			return null;
		}
		for (RuntimeHelper helper : values()) {
			if (helper.functionName.equals(name)) {
				return helper;
			}
		}
		return null;
	}
}
