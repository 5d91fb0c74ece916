package org.metricshub.rash;

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
 * Pipeline phase a {@link TranspileException} originates from.
 */
public enum ErrorKind {
	/** The source text could not be tokenized or parsed. */
	PARSE("Parse"),
	/** The syntax tree uses a construct outside the restricted subset. */
	VALIDATION("Validation"),
	/** The restricted tree could not be lowered to shell IR. */
	IR_GENERATION("IrGeneration"),
	/** A verification check rejected the IR. */
	VERIFICATION("Verification"),
	/** The IR could not be rendered as shell text. */
	EMISSION("Emission"),
	/** An internal inconsistency; always a bug. */
	INTERNAL("Internal");

	private final String displayName;

	ErrorKind(String displayName) {
		this.displayName = displayName;
	}

	/**
	 * @return the name printed in front of user-facing error messages
	 */
	public String getDisplayName() {
		return displayName;
	}
}
