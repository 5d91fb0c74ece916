package org.metricshub.rash.ast;

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
 * Binary operators of the restricted language.
 */
public enum BinaryOp {
	ADD("+"),
	SUB("-"),
	MUL("*"),
	DIV("/"),
	REM("%"),
	EQ("=="),
	NE("!="),
	LT("<"),
	LE("<="),
	GT(">"),
	GE(">="),
	AND("&&"),
	OR("||");

	private final String symbol;

	BinaryOp(String symbol) {
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}

	/**
	 * @return <code>true</code> for the arithmetic operators
	 */
	public boolean isArithmetic() {
		return this == ADD || this == SUB || this == MUL || this == DIV || this == REM;
	}

	/**
	 * @return <code>true</code> for the six comparison operators
	 */
	public boolean isComparison() {
		return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
	}

	/**
	 * @return <code>true</code> for <code>&amp;&amp;</code> and <code>||</code>
	 */
	public boolean isLogical() {
		return this == AND || this == OR;
	}

	/**
	 * @param symbol the operator as written in source
	 * @return the operator, or <code>null</code> when it is not supported
	 */
	public static BinaryOp fromSymbol(String symbol) {
		for (BinaryOp op : values()) {
			if (op.symbol.equals(symbol)) {
				return op;
			}
		}
		return null;
	}
}
