package org.metricshub.rash.verifier;

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

/**
 * Verification tiers, from none to the strictest. Each tier runs the checks
 * of the tiers below it plus its own.
 */
public enum VerificationLevel {
	/** No check at all. */
	NONE,
	/** Command injection. */
	BASIC,
	/** Adds determinism. */
	STRICT,
	/** Adds idempotency and resource safety. */
	PARANOID;

	/**
	 * @param other another level
	 * @return <code>true</code> when this level runs the checks of <code>other</code>
	 */
	public boolean includes(VerificationLevel other) {
		return compareTo(other) >= 0;
	}

	/**
	 * Parses a level name, ignoring case.
	 *
	 * @param name the name
	 * @return the level
	 * @throws IllegalArgumentException for an unknown name
	 */
	public static VerificationLevel fromString(String name) {
		for (VerificationLevel level : values()) {
			if (level.name().equalsIgnoreCase(name)) {
				return level;
			}
		}
		throw new IllegalArgumentException("Unknown verification level: " + name);
	}
}
