package org.metricshub.rash.frontend.ast;

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

import java.util.Objects;

/**
 * Location of a construct in a Rash source: the source description,
 * a 1-based line and a 1-based column.
 */
public final class SourceSpan {

	private final String sourceDescription;
	private final int line;
	private final int column;

	/**
	 * <p>
	 * Constructor for SourceSpan.
	 * </p>
	 *
	 * @param sourceDescription description of the source, usually a file name
	 * @param line 1-based line number
	 * @param column 1-based column number
	 */
	public SourceSpan(String sourceDescription, int line, int column) {
		this.sourceDescription = sourceDescription;
		this.line = line;
		this.column = column;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SourceSpan)) {
			return false;
		}
		SourceSpan other = (SourceSpan) o;
		return line == other.line && column == other.column
				&& Objects.equals(sourceDescription, other.sourceDescription);
	}

	@Override
	public int hashCode() {
		return Objects.hash(sourceDescription, line, column);
	}

	@Override
	public String toString() {
		return sourceDescription + ":" + line + ":" + column;
	}
}
