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
 * A value as the shell sees it: a word built from literal text and
 * expansions. Every value reaching the emitter is rendered by
 * {@link org.metricshub.rash.backend.ShellEscaper}.
 */
public abstract class ShellValue {

	private ShellValue() {}

	public abstract <R> R accept(Visitor<R> visitor);

	public interface Visitor<R> {
		R visitLiteral(Literal value);

		R visitVarRef(VarRef value);

		R visitConcat(Concat value);

		R visitCommandSubst(CommandSubst value);

		R visitArith(Arith value);

		R visitEnvRef(EnvRef value);

		R visitArgRef(ArgRef value);

		R visitLength(Length value);
	}

	/**
	 * @param text literal text
	 * @return a literal value
	 */
	public static ShellValue literal(String text) {
		return new Literal(text);
	}

	/**
	 * @param name a shell variable name
	 * @return a reference to the variable
	 */
	public static ShellValue var(String name) {
		return new VarRef(name);
	}

	/**
	 * @return <code>true</code> when this value contains a command substitution anywhere
	 */
	public boolean hasCommandSubstitution() {
		return false;
	}

	/**
	 * Literal text, never expanded by the shell.
	 */
	public static final class Literal extends ShellValue {
		private final String text;

		public Literal(String text) {
			this.text = Objects.requireNonNull(text, "text");
		}

		public String getText() {
			return text;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLiteral(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Literal && text.equals(((Literal) o).text);
		}

		@Override
		public int hashCode() {
			return text.hashCode();
		}

		@Override
		public String toString() {
			return "'" + text + "'";
		}
	}

	/**
	 * A reference to a variable owned by the generated script.
	 */
	public static final class VarRef extends ShellValue {
		private final String name;

		public VarRef(String name) {
			this.name = Objects.requireNonNull(name, "name");
		}

		public String getName() {
			return name;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitVarRef(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof VarRef && name.equals(((VarRef) o).name);
		}

		@Override
		public int hashCode() {
			return name.hashCode() * 7;
		}

		@Override
		public String toString() {
			return "$" + name;
		}
	}

	public static final class Concat extends ShellValue {
		private final List<ShellValue> parts;

		public Concat(List<ShellValue> parts) {
			this.parts = Collections.unmodifiableList(new ArrayList<ShellValue>(parts));
		}

		public List<ShellValue> getParts() {
			return parts;
		}

		@Override
		public boolean hasCommandSubstitution() {
			for (ShellValue part : parts) {
				if (part.hasCommandSubstitution()) {
					return true;
				}
			}
			return false;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitConcat(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Concat && parts.equals(((Concat) o).parts);
		}

		@Override
		public int hashCode() {
			return parts.hashCode();
		}

		@Override
		public String toString() {
			return "concat" + parts;
		}
	}

	/**
	 * The standard output of a command, trailing newlines removed.
	 */
	public static final class CommandSubst extends ShellValue {
		private final ShellIR.Exec exec;

		public CommandSubst(ShellIR.Exec exec) {
			this.exec = Objects.requireNonNull(exec, "exec");
		}

		public ShellIR.Exec getExec() {
			return exec;
		}

		@Override
		public boolean hasCommandSubstitution() {
			return true;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCommandSubst(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof CommandSubst && exec.equals(((CommandSubst) o).exec);
		}

		@Override
		public int hashCode() {
			return exec.hashCode() * 11;
		}

		@Override
		public String toString() {
			return "$(" + exec + ")";
		}
	}

	public static final class Arith extends ShellValue {
		private final ArithExpr expr;

		public Arith(ArithExpr expr) {
			this.expr = Objects.requireNonNull(expr, "expr");
		}

		public ArithExpr getExpr() {
			return expr;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitArith(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Arith && expr.equals(((Arith) o).expr);
		}

		@Override
		public int hashCode() {
			return expr.hashCode() * 13;
		}

		@Override
		public String toString() {
			return "$((" + expr + "))";
		}
	}

	/**
	 * A variable inherited from the caller's environment. With
	 * <code>allowUnset</code> the expansion yields the empty string for an
	 * unset variable instead of aborting under <code>set -u</code>.
	 */
	public static final class EnvRef extends ShellValue {
		private final String name;
		private final boolean allowUnset;

		public EnvRef(String name, boolean allowUnset) {
			this.name = Objects.requireNonNull(name, "name");
			this.allowUnset = allowUnset;
		}

		public String getName() {
			return name;
		}

		public boolean isAllowUnset() {
			return allowUnset;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitEnvRef(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof EnvRef)) {
				return false;
			}
			EnvRef other = (EnvRef) o;
			return name.equals(other.name) && allowUnset == other.allowUnset;
		}

		@Override
		public int hashCode() {
			return Objects.hash(name, allowUnset);
		}

		@Override
		public String toString() {
			return "env:" + name;
		}
	}

	/**
	 * A positional parameter, <code>$1</code>, <code>$2</code> and so on.
	 */
	public static final class ArgRef extends ShellValue {
		private final int position;

		public ArgRef(int position) {
			this.position = position;
		}

		public int getPosition() {
			return position;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitArgRef(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof ArgRef && position == ((ArgRef) o).position;
		}

		@Override
		public int hashCode() {
			return position * 17;
		}

		@Override
		public String toString() {
			return "$" + position;
		}
	}

	/**
	 * The length of a variable's value, <code>${#name}</code>.
	 */
	public static final class Length extends ShellValue {
		private final String name;

		public Length(String name) {
			this.name = Objects.requireNonNull(name, "name");
		}

		public String getName() {
			return name;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLength(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Length && name.equals(((Length) o).name);
		}

		@Override
		public int hashCode() {
			return name.hashCode() * 19;
		}

		@Override
		public String toString() {
			return "${#" + name + "}";
		}
	}
}
