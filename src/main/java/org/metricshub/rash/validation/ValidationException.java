package org.metricshub.rash.validation;

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
import org.metricshub.rash.frontend.ast.SourceSpan;

/**
 * Thrown when a program uses a construct outside the restricted subset, or
 * when the restricted program breaks one of its structural invariants.
 */
public class ValidationException extends TranspileException {

	private static final long serialVersionUID = 1L;

	/**
	 * <p>
	 * Constructor for ValidationException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public ValidationException(String msg) {
		super(ErrorKind.VALIDATION, msg, null);
	}

	/**
	 * <p>
	 * Constructor for ValidationException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 * @param span location of the offending construct, may be <code>null</code>
	 */
	public ValidationException(String msg, SourceSpan span) {
		super(ErrorKind.VALIDATION, msg, span);
	}
}
