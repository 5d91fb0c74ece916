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

import org.metricshub.rash.ErrorKind;
import org.metricshub.rash.TranspileException;

/**
 * Thrown when a verification check fails. Carries the shell text of the
 * offending node.
 */
public class VerificationException extends TranspileException {

	private static final long serialVersionUID = 1L;

	private final String check;

	private final String shellText;

	/**
	 * <p>
	 * Constructor for VerificationException.
	 * </p>
	 *
	 * @param check name of the failed check
	 * @param msg a {@link java.lang.String} object
	 * @param shellText shell rendering of the offending node
	 */
	public VerificationException(String check, String msg, String shellText) {
		super(ErrorKind.VERIFICATION, check + ": " + msg + " in `" + shellText + "`", null);
		this.check = check;
		this.shellText = shellText;
	}

	public String getCheck() {
		return check;
	}

	public String getShellText() {
		return shellText;
	}
}
