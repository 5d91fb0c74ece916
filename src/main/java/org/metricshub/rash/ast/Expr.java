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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expressions of the restricted language.
 * <p>
 * The set of expression kinds is closed: the constructor is private and
 * every consumer dispatches through {@link Visitor}, so adding a kind breaks
 * each visitor at compile time. Instances are immutable.
 */
public abstract class Expr {

	private Expr() {}

	/**
	 * Dispatches to the visitor method matching this expression's kind.
	 *
	 * @param visitor the visitor
	 * @param <R> the visitor's result type
	 * @return the visitor's result
	 */
	public abstract <R> R accept(Visitor<R> visitor);

	/**
	 * Visitor over the closed set of expression kinds.
	 *
	 * @param <R> result type
	 */
	public interface Visitor<R> {
		R visitLiteral(Literal expr);

		R visitVariable(Variable expr);

		R visitBinary(Binary expr);

		R visitUnary(Unary expr);

		R visitFunctionCall(FunctionCall expr);

		R visitIndex(Index expr);

		R visitMethodCall(MethodCall expr);

		R visitTest(Test expr);

		R visitIfExpr(IfExpr expr);

		R visitRange(Range expr);

		R visitArrayLiteral(ArrayLiteral expr);
	}

	private static <T> List<T> copy(List<T> list) {
		return Collections.unmodifiableList(new ArrayList<T>(list));
	}

	/**
	 * A string, integer or boolean constant.
	 */
	public static final class Literal extends Expr {
		private final Type type;
		private final String value;

		private Literal(Type type, String value) {
			this.type = type;
			this.value = value;
		}

		public static Literal ofStr(String value) {
			return new Literal(Type.STR, Objects.requireNonNull(value, "value"));
		}

		public static Literal ofI32(int value) {
			return new Literal(Type.I32, Integer.toString(value));
		}

		public static Literal ofBool(boolean value) {
			return new Literal(Type.BOOL, Boolean.toString(value));
		}

		public Type getType() {
			return type;
		}

		/**
		 * @return the value in its string form: the string itself, the decimal
		 *         integer, or <code>true</code>/<code>false</code>
		 */
		public String getValue() {
			return value;
		}

		public int getIntValue() {
			return Integer.parseInt(value);
		}

		public boolean getBoolValue() {
			return Boolean.parseBoolean(value);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLiteral(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Literal)) {
				return false;
			}
			Literal other = (Literal) o;
			return type == other.type && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash(type, value);
		}

		@Override
		public String toString() {
			return type == Type.STR ? '"' + value + '"' : value;
		}
	}

	/**
	 * A reference to a local binding or parameter.
	 */
	public static final class Variable extends Expr {
		private final String name;

		public Variable(String name) {
			this.name = Objects.requireNonNull(name, "name");
		}

		public String getName() {
			return name;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitVariable(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Variable && name.equals(((Variable) o).name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public static final class Binary extends Expr {
		private final BinaryOp op;
		private final Expr left;
		private final Expr right;

		public Binary(BinaryOp op, Expr left, Expr right) {
			this.op = Objects.requireNonNull(op, "op");
			this.left = Objects.requireNonNull(left, "left");
			this.right = Objects.requireNonNull(right, "right");
		}

		public BinaryOp getOp() {
			return op;
		}

		public Expr getLeft() {
			return left;
		}

		public Expr getRight() {
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

	public static final class Unary extends Expr {
		private final UnaryOp op;
		private final Expr operand;

		public Unary(UnaryOp op, Expr operand) {
			this.op = Objects.requireNonNull(op, "op");
			this.operand = Objects.requireNonNull(operand, "operand");
		}

		public UnaryOp getOp() {
			return op;
		}

		public Expr getOperand() {
			return operand;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitUnary(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Unary)) {
				return false;
			}
			Unary other = (Unary) o;
			return op == other.op && operand.equals(other.operand);
		}

		@Override
		public int hashCode() {
			return Objects.hash(op, operand);
		}

		@Override
		public String toString() {
			return op.getSymbol() + operand;
		}
	}

	/**
	 * A call to a user function or to an {@link Intrinsic}.
	 */
	public static final class FunctionCall extends Expr {
		private final String name;
		private final List<Expr> args;

		public FunctionCall(String name, List<Expr> args) {
			this.name = Objects.requireNonNull(name, "name");
			this.args = copy(args);
		}

		public String getName() {
			return name;
		}

		public List<Expr> getArgs() {
			return args;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFunctionCall(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof FunctionCall)) {
				return false;
			}
			FunctionCall other = (FunctionCall) o;
			return name.equals(other.name) && args.equals(other.args);
		}

		@Override
		public int hashCode() {
			return Objects.hash(name, args);
		}

		@Override
		public String toString() {
			return name + args;
		}
	}

	public static final class Index extends Expr {
		private final Expr base;
		private final Expr index;

		public Index(Expr base, Expr index) {
			this.base = Objects.requireNonNull(base, "base");
			this.index = Objects.requireNonNull(index, "index");
		}

		public Expr getBase() {
			return base;
		}

		public Expr getIndex() {
			return index;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIndex(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Index)) {
				return false;
			}
			Index other = (Index) o;
			return base.equals(other.base) && index.equals(other.index);
		}

		@Override
		public int hashCode() {
			return Objects.hash(base, index);
		}

		@Override
		public String toString() {
			return base + "[" + index + "]";
		}
	}

	public static final class MethodCall extends Expr {
		private final Expr receiver;
		private final String method;
		private final List<Expr> args;

		public MethodCall(Expr receiver, String method, List<Expr> args) {
			this.receiver = Objects.requireNonNull(receiver, "receiver");
			this.method = Objects.requireNonNull(method, "method");
			this.args = copy(args);
		}

		public Expr getReceiver() {
			return receiver;
		}

		public String getMethod() {
			return method;
		}

		public List<Expr> getArgs() {
			return args;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitMethodCall(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof MethodCall)) {
				return false;
			}
			MethodCall other = (MethodCall) o;
			return receiver.equals(other.receiver) && method.equals(other.method) && args.equals(other.args);
		}

		@Override
		public int hashCode() {
			return Objects.hash(receiver, method, args);
		}

		@Override
		public String toString() {
			return receiver + "." + method + args;
		}
	}

	public static final class Test extends Expr {
		private final TestExpr test;

		public Test(TestExpr test) {
			this.test = Objects.requireNonNull(test, "test");
		}

		public TestExpr getTest() {
			return test;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitTest(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Test && test.equals(((Test) o).test);
		}

		@Override
		public int hashCode() {
			return test.hashCode();
		}

		@Override
		public String toString() {
			return "[" + test + "]";
		}
	}

	/**
	 * <code>if cond { a } else { b }</code> used as a value.
	 */
	public static final class IfExpr extends Expr {
		private final Expr condition;
		private final Expr thenValue;
		private final Expr elseValue;

		public IfExpr(Expr condition, Expr thenValue, Expr elseValue) {
			this.condition = Objects.requireNonNull(condition, "condition");
			this.thenValue = Objects.requireNonNull(thenValue, "thenValue");
			this.elseValue = Objects.requireNonNull(elseValue, "elseValue");
		}

		public Expr getCondition() {
			return condition;
		}

		public Expr getThenValue() {
			return thenValue;
		}

		public Expr getElseValue() {
			return elseValue;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIfExpr(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof IfExpr)) {
				return false;
			}
			IfExpr other = (IfExpr) o;
			return condition.equals(other.condition) && thenValue.equals(other.thenValue) && elseValue.equals(other.elseValue);
		}

		@Override
		public int hashCode() {
			return Objects.hash(condition, thenValue, elseValue);
		}

		@Override
		public String toString() {
			return "if " + condition + " { " + thenValue + " } else { " + elseValue + " }";
		}
	}

	/**
	 * An integer range, only meaningful as the iterable of a <code>for</code> loop.
	 */
	public static final class Range extends Expr {
		private final Expr start;
		private final Expr end;
		private final boolean inclusive;

		public Range(Expr start, Expr end, boolean inclusive) {
			this.start = Objects.requireNonNull(start, "start");
			this.end = Objects.requireNonNull(end, "end");
			this.inclusive = inclusive;
		}

		public Expr getStart() {
			return start;
		}

		public Expr getEnd() {
			return end;
		}

		public boolean isInclusive() {
			return inclusive;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitRange(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Range)) {
				return false;
			}
			Range other = (Range) o;
			return inclusive == other.inclusive && start.equals(other.start) && end.equals(other.end);
		}

		@Override
		public int hashCode() {
			return Objects.hash(start, end, inclusive);
		}

		@Override
		public String toString() {
			return start + (inclusive ? "..=" : "..") + end;
		}
	}

	/**
	 * A fixed list of values, only meaningful as a <code>for</code> iterable
	 * or bound to a variable that is iterated.
	 */
	public static final class ArrayLiteral extends Expr {
		private final List<Expr> elements;

		public ArrayLiteral(List<Expr> elements) {
			this.elements = copy(elements);
		}

		public List<Expr> getElements() {
			return elements;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitArrayLiteral(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof ArrayLiteral && elements.equals(((ArrayLiteral) o).elements);
		}

		@Override
		public int hashCode() {
			return elements.hashCode();
		}

		@Override
		public String toString() {
			return elements.toString();
		}
	}
}
