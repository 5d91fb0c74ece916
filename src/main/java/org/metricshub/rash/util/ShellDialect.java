package org.metricshub.rash.util;

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

import java.util.Locale;

/**
 * Shell dialects a script can be generated for.
 */
public enum ShellDialect {
	/** Plain POSIX sh. */
	POSIX,
	/** GNU bash. */
	BASH,
	/** Debian Almquist shell. */
	DASH,
	/** BusyBox ash. */
	ASH;

	/**
	 * Parses a dialect name, case-insensitively.
	 *
	 * @param name the dialect name, like <code>posix</code> or <code>bash</code>
	 * @return the matching dialect
	 * @throws IllegalArgumentException if the name matches no dialect
	 */
	public static ShellDialect fromString(String name) {
		if (name == null) {
			throw new IllegalArgumentException("Shell dialect must not be null");
		}
		try {
			return valueOf(name.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown shell dialect: " + name, e);
		}
	}
}
