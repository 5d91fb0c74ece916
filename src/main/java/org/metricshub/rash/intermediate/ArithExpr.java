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

import java.util.Objects;

/**
 * Integer expressions evaluated by shell arithmetic expansion,
 * <code>$((...))</code>.
 */
public abstract class ArithExpr {

	private ArithExpr() {}

	public abstract <R> R accept(Visitor<R> visitor);

	public interface Visitor<R> {
		R visitNumber(Number expr);

		R visitOperand(Operand expr);

		R visitBinary(Binary expr);

		R visitNegate(Negate expr);
	}

	/**
	 * Arithmetic operators.
	 */
	public enum Op {
		ADD("+"),
		SUB("-"),
		MUL("*"),
		DIV("/"),
		REM("%");

		private final String symbol;

		Op(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	public static final class Number extends ArithExpr {
		private final long value;

		public Number(long value) {
			this.value = value;
		}

		public long getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitNumber(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Number && value == ((Number) o).value;
		}

		@Override
		public int hashCode() {
			return Long.hashCode(value);
		}

		@Override
		public String toString() {
			return Long.toString(value);
		}
	}

	/**
	 * A shell value read as an integer; in practice a variable reference.
	 */
	public static final class Operand extends ArithExpr {
		private final ShellValue value;

		public Operand(ShellValue value) {
			this.value = Objects.requireNonNull(value, "value");
		}

		public ShellValue getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitOperand(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Operand && value.equals(((Operand) o).value);
		}

		@Override
		public int hashCode() {
			return value.hashCode();
		}

		@Override
		public String toString() {
			return value.toString();
		}
	}

	public static final class Binary extends ArithExpr {
		private final Op op;
		private final ArithExpr left;
		private final ArithExpr right;

		public Binary(Op op, ArithExpr left, ArithExpr right) {
			this.op = Objects.requireNonNull(op, "op");
			this.left = Objects.requireNonNull(left, "left");
			this.right = Objects.requireNonNull(right, "right");
		}

		public Op getOp() {
			return op;
		}

		public ArithExpr getLeft() {
			return left;
		}

		public ArithExpr getRight() {
			return right;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBinary(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Binary)) {
				return false;
			}
			Binary other = (Binary) o;
			return op == other.op && left.equals(other.left) && right.equals(other.right);
		}

		@Override
		public int hashCode() {
			return Objects.hash(op, left, right);
		}

		@Override
		public String toString() {
			return "(" + left + " " + op.getSymbol() + " " + right + ")";
		}
	}

	public static final class Negate extends ArithExpr {
		private final ArithExpr operand;

		public Negate(ArithExpr operand) {
			this.operand = Objects.requireNonNull(operand, "operand");
		}

		public ArithExpr getOperand() {
			return operand;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitNegate(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Negate && operand.equals(((Negate) o).operand);
		}

		@Override
		public int hashCode() {
			return 31 * operand.hashCode() + 1;
		}

		@Override
		public String toString() {
			return "-" + operand;
		}
	}
}
