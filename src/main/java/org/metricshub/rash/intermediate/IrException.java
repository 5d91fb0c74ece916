package org.metricshub.rash.intermediate;

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

import org.metricshub.rash.ErrorKind;
import org.metricshub.rash.TranspileException;

/**
 * Thrown when a restricted program cannot be lowered to shell IR.
 */
public class IrException extends TranspileException {

	private static final long serialVersionUID = 1L;

	/**
	 * <p>
	 * Constructor for IrException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public IrException(String msg) {
		super(ErrorKind.IR_GENERATION, msg, null);
	}

	/**
	 * Builds the error for a construct with no shell translation.
	 *
	 * @param construct description of the construct
	 * @return the exception
	 */
	public static IrException unsupportedConstruct(String construct) {
		return new IrException("Unsupported construct: " + construct);
	}
}
