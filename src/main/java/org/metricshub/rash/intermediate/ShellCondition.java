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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Conditions of <code>if</code> and <code>while</code>: constants,
 * <code>test</code> primitives, their boolean combinations and command exit
 * statuses.
 */
public abstract class ShellCondition {

	private ShellCondition() {}

	public abstract <R> R accept(Visitor<R> visitor);

	public interface Visitor<R> {
		R visitConst(Const cond);

		R visitTest(Test cond);

		R visitNot(Not cond);

		R visitAnd(And cond);

		R visitOr(Or cond);

		R visitStatus(Status cond);
	}

	public static final class Const extends ShellCondition {
		public static final Const TRUE = new Const(true);
		public static final Const FALSE = new Const(false);

		private final boolean value;

		private Const(boolean value) {
			this.value = value;
		}

		public static Const of(boolean value) {
			return value ? TRUE : FALSE;
		}

		public boolean getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitConst(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Const && value == ((Const) o).value;
		}

		@Override
		public int hashCode() {
			return Boolean.hashCode(value);
		}

		@Override
		public String toString() {
			return Boolean.toString(value);
		}
	}

	/**
	 * A <code>test</code> primitive. Unary operators (<code>-e</code>,
	 * <code>-z</code>, ...) take one operand, binary ones (<code>=</code>,
	 * <code>-lt</code>, ...) take two.
	 */
	public static final class Test extends ShellCondition {
		private final String op;
		private final List<ShellValue> operands;

		public Test(String op, List<ShellValue> operands) {
			this.op = Objects.requireNonNull(op, "op");
			this.operands = Collections.unmodifiableList(new ArrayList<ShellValue>(operands));
		}

		public static Test unary(String op, ShellValue operand) {
			return new Test(op, Collections.singletonList(operand));
		}

		public static Test binary(String op, ShellValue left, ShellValue right) {
			List<ShellValue> operands = new ArrayList<ShellValue>(2);
			operands.add(left);
			operands.add(right);
			return new Test(op, operands);
		}

		public String getOp() {
			return op;
		}

		public List<ShellValue> getOperands() {
			return operands;
		}

		public boolean isUnary() {
			return operands.size() == 1;
		}

		/**
		 * @return <code>true</code> for the integer comparisons
		 */
		public boolean isNumeric() {
			return op.equals("-eq") || op.equals("-ne") || op.equals("-lt") || op.equals("-le") || op.equals("-gt")
					|| op.equals("-ge");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitTest(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Test)) {
				return false;
			}
			Test other = (Test) o;
			return op.equals(other.op) && operands.equals(other.operands);
		}

		@Override
		public int hashCode() {
			return Objects.hash(op, operands);
		}

		@Override
		public String toString() {
			return isUnary() ? "[ " + op + " " + operands.get(0) + " ]" : "[ " + operands.get(0) + " " + op + " " + operands.get(1) + " ]";
		}
	}

	public static final class Not extends ShellCondition {
		private final ShellCondition operand;

		public Not(ShellCondition operand) {
			this.operand = Objects.requireNonNull(operand, "operand");
		}

		public ShellCondition getOperand() {
			return operand;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitNot(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Not && operand.equals(((Not) o).operand);
		}

		@Override
		public int hashCode() {
			return operand.hashCode() * 3;
		}

		@Override
		public String toString() {
			return "!" + operand;
		}
	}

	public static final class And extends ShellCondition {
		private final ShellCondition left;
		private final ShellCondition right;

		public And(ShellCondition left, ShellCondition right) {
			this.left = Objects.requireNonNull(left, "left");
			this.right = Objects.requireNonNull(right, "right");
		}

		public ShellCondition getLeft() {
			return left;
		}

		public ShellCondition getRight() {
			return right;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAnd(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof And)) {
				return false;
			}
			And other = (And) o;
			return left.equals(other.left) && right.equals(other.right);
		}

		@Override
		public int hashCode() {
			return Objects.hash("and", left, right);
		}

		@Override
		public String toString() {
			return "(" + left + " && " + right + ")";
		}
	}

	public static final class Or extends ShellCondition {
		private final ShellCondition left;
		private final ShellCondition right;

		public Or(ShellCondition left, ShellCondition right) {
			this.left = Objects.requireNonNull(left, "left");
			this.right = Objects.requireNonNull(right, "right");
		}

		public ShellCondition getLeft() {
			return left;
		}

		public ShellCondition getRight() {
			return right;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitOr(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Or)) {
				return false;
			}
			Or other = (Or) o;
			return left.equals(other.left) && right.equals(other.right);
		}

		@Override
		public int hashCode() {
			return Objects.hash("or", left, right);
		}

		@Override
		public String toString() {
			return "(" + left + " || " + right + ")";
		}
	}

	/**
	 * Succeeds when the command exits with status zero.
	 */
	public static final class Status extends ShellCondition {
		private final ShellIR.Exec exec;

		public Status(ShellIR.Exec exec) {
			this.exec = Objects.requireNonNull(exec, "exec");
		}

		public ShellIR.Exec getExec() {
			return exec;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitStatus(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Status && exec.equals(((Status) o).exec);
		}

		@Override
		public int hashCode() {
			return exec.hashCode() * 5;
		}

		@Override
		public String toString() {
			return "status(" + exec + ")";
		}
	}
}
