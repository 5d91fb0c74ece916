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

import org.metricshub.rash.frontend.ast.SourceSpan;

/**
 * Base of every error raised by the transpilation pipeline. The
 * {@link ErrorKind} tells callers which phase failed; the optional
 * {@link SourceSpan} points at the offending source construct.
 */
public class TranspileException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;

	private final SourceSpan span;

	/**
	 * <p>
	 * Constructor for TranspileException.
	 * </p>
	 *
	 * @param kind the failing phase
	 * @param msg a {@link java.lang.String} object
	 * @param span location in the source, or <code>null</code>
	 */
	public TranspileException(ErrorKind kind, String msg, SourceSpan span) {
		super(msg);
		this.kind = kind;
		this.span = span;
	}

	/**
	 * <p>
	 * Constructor for TranspileException.
	 * </p>
	 *
	 * @param kind the failing phase
	 * @param msg a {@link java.lang.String} object
	 * @param span location in the source, or <code>null</code>
	 * @param cause underlying cause
	 */
	public TranspileException(ErrorKind kind, String msg, SourceSpan span, Throwable cause) {
		super(msg, cause);
		this.kind = kind;
		this.span = span;
	}

	/**
	 * @return the phase this error belongs to
	 */
	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * @return the source location, or <code>null</code> when unknown
	 */
	public SourceSpan getSpan() {
		return span;
	}

	/**
	 * Renders the error the way the command line prints it:
	 * <code>Kind (source:line:column): message</code>.
	 *
	 * @return the user-facing description
	 */
	public String describe() {
		StringBuilder sb = new StringBuilder(kind.getDisplayName());
		if (span != null) {
			sb.append(" (").append(span).append(')');
		}
		return sb.append(": ").append(getMessage()).toString();
	}
}
