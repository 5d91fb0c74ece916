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
 * Statements of the restricted language. A closed set, like {@link Expr}.
 */
public abstract class Stmt {

	private Stmt() {}

	/**
	 * Dispatches to the visitor method matching this statement's kind.
	 *
	 * @param visitor the visitor
	 * @param <R> the visitor's result type
	 * @return the visitor's result
	 */
	public abstract <R> R accept(Visitor<R> visitor);

	/**
	 * Visitor over the closed set of statement kinds.
	 *
	 * @param <R> result type
	 */
	public interface Visitor<R> {
		R visitLet(Let stmt);

		R visitExprStmt(ExprStmt stmt);

		R visitIf(If stmt);

		R visitWhile(While stmt);

		R visitFor(For stmt);

		R visitMatch(Match stmt);

		R visitReturn(Return stmt);

		R visitBreak(Break stmt);

		R visitContinue(Continue stmt);
	}

	private static List<Stmt> copy(List<Stmt> list) {
		return Collections.unmodifiableList(new ArrayList<Stmt>(list));
	}

	/**
	 * A binding. <code>declaration</code> is <code>false</code> for a
	 * re-assignment of an existing binding; <code>exported</code> is set
	 * for variables placed in the environment of child processes.
	 */
	public static final class Let extends Stmt {
		private final String name;
		private final Expr value;
		private final boolean exported;
		private final boolean declaration;

		public Let(String name, Expr value, boolean exported, boolean declaration) {
			this.name = Objects.requireNonNull(name, "name");
			this.value = Objects.requireNonNull(value, "value");
			this.exported = exported;
			this.declaration = declaration;
		}

		/**
		 * A plain local declaration.
		 *
		 * @param name the binding name
		 * @param value the bound value
		 * @return the statement
		 */
		public static Let declare(String name, Expr value) {
			return new Let(name, value, false, true);
		}

		public String getName() {
			return name;
		}

		public Expr getValue() {
			return value;
		}

		public boolean isExported() {
			return exported;
		}

		public boolean isDeclaration() {
			return declaration;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLet(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Let)) {
				return false;
			}
			Let other = (Let) o;
			return exported == other.exported && declaration == other.declaration && name.equals(other.name)
					&& value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash(name, value, exported, declaration);
		}

		@Override
		public String toString() {
			return (declaration ? "let " : "") + (exported ? "export " : "") + name + " = " + value + ";";
		}
	}

	public static final class ExprStmt extends Stmt {
		private final Expr expr;

		public ExprStmt(Expr expr) {
			this.expr = Objects.requireNonNull(expr, "expr");
		}

		public Expr getExpr() {
			return expr;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitExprStmt(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof ExprStmt && expr.equals(((ExprStmt) o).expr);
		}

		@Override
		public int hashCode() {
			return expr.hashCode();
		}

		@Override
		public String toString() {
			return expr + ";";
		}
	}

	/**
	 * One <code>else if</code> arm of an {@link If}.
	 */
	public static final class ElseIf {
		private final Expr condition;
		private final List<Stmt> body;

		public ElseIf(Expr condition, List<Stmt> body) {
			this.condition = Objects.requireNonNull(condition, "condition");
			this.body = copy(body);
		}

		public Expr getCondition() {
			return condition;
		}

		public List<Stmt> getBody() {
			return body;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof ElseIf)) {
				return false;
			}
			ElseIf other = (ElseIf) o;
			return condition.equals(other.condition) && body.equals(other.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(condition, body);
		}
	}

	public static final class If extends Stmt {
		private final Expr condition;
		private final List<Stmt> thenBody;
		private final List<ElseIf> elseIfs;
		private final List<Stmt> elseBody;

		/**
		 * @param condition the condition
		 * @param thenBody statements run when the condition holds
		 * @param elseIfs the <code>else if</code> arms, in order
		 * @param elseBody the final <code>else</code> block, or <code>null</code> when absent
		 */
		public If(Expr condition, List<Stmt> thenBody, List<ElseIf> elseIfs, List<Stmt> elseBody) {
			this.condition = Objects.requireNonNull(condition, "condition");
			this.thenBody = copy(thenBody);
			this.elseIfs = Collections.unmodifiableList(new ArrayList<ElseIf>(elseIfs));
			this.elseBody = elseBody == null ? null : copy(elseBody);
		}

		public Expr getCondition() {
			return condition;
		}

		public List<Stmt> getThenBody() {
			return thenBody;
		}

		public List<ElseIf> getElseIfs() {
			return elseIfs;
		}

		/**
		 * @return the <code>else</code> block, or <code>null</code> when absent
		 */
		public List<Stmt> getElseBody() {
			return elseBody;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIf(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof If)) {
				return false;
			}
			If other = (If) o;
			return condition.equals(other.condition) && thenBody.equals(other.thenBody) && elseIfs.equals(other.elseIfs)
					&& Objects.equals(elseBody, other.elseBody);
		}

		@Override
		public int hashCode() {
			return Objects.hash(condition, thenBody, elseIfs, elseBody);
		}

		@Override
		public String toString() {
			return "if " + condition + " " + thenBody + (elseIfs.isEmpty() ? "" : " elif" + elseIfs.size())
					+ (elseBody == null ? "" : " else " + elseBody);
		}
	}

	public static final class While extends Stmt {
		private final Expr condition;
		private final List<Stmt> body;

		public While(Expr condition, List<Stmt> body) {
			this.condition = Objects.requireNonNull(condition, "condition");
			this.body = copy(body);
		}

		public Expr getCondition() {
			return condition;
		}

		public List<Stmt> getBody() {
			return body;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitWhile(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof While)) {
				return false;
			}
			While other = (While) o;
			return condition.equals(other.condition) && body.equals(other.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(condition, body);
		}

		@Override
		public String toString() {
			return "while " + condition + " " + body;
		}
	}

	public static final class For extends Stmt {
		private final String variable;
		private final Expr iterable;
		private final List<Stmt> body;

		public For(String variable, Expr iterable, List<Stmt> body) {
			this.variable = Objects.requireNonNull(variable, "variable");
			this.iterable = Objects.requireNonNull(iterable, "iterable");
			this.body = copy(body);
		}

		public String getVariable() {
			return variable;
		}

		public Expr getIterable() {
			return iterable;
		}

		public List<Stmt> getBody() {
			return body;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFor(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof For)) {
				return false;
			}
			For other = (For) o;
			return variable.equals(other.variable) && iterable.equals(other.iterable) && body.equals(other.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(variable, iterable, body);
		}

		@Override
		public String toString() {
			return "for " + variable + " in " + iterable + " " + body;
		}
	}

	/**
	 * One arm of a {@link Match}: alternative patterns and the statements run
	 * when any of them accepts the scrutinee.
	 */
	public static final class MatchArm {
		private final List<Pattern> patterns;
		private final List<Stmt> body;

		public MatchArm(List<Pattern> patterns, List<Stmt> body) {
			if (patterns.isEmpty()) {
				throw new IllegalArgumentException("A match arm needs at least one pattern");
			}
			this.patterns = Collections.unmodifiableList(new ArrayList<Pattern>(patterns));
			this.body = copy(body);
		}

		public List<Pattern> getPatterns() {
			return patterns;
		}

		public List<Stmt> getBody() {
			return body;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof MatchArm)) {
				return false;
			}
			MatchArm other = (MatchArm) o;
			return patterns.equals(other.patterns) && body.equals(other.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(patterns, body);
		}

		@Override
		public String toString() {
			StringBuilder sb = new StringBuilder();
			for (Pattern pattern : patterns) {
				if (sb.length() > 0) {
					sb.append(" | ");
				}
				sb.append(pattern);
			}
			return sb.append(" => ").append(body).toString();
		}
	}

	/**
	 * A <code>match</code> statement. Arms are tried in order; the first one
	 * with an accepting pattern runs.
	 */
	public static final class Match extends Stmt {
		private final Expr scrutinee;
		private final List<MatchArm> arms;

		public Match(Expr scrutinee, List<MatchArm> arms) {
			this.scrutinee = Objects.requireNonNull(scrutinee, "scrutinee");
			this.arms = Collections.unmodifiableList(new ArrayList<MatchArm>(arms));
		}

		public Expr getScrutinee() {
			return scrutinee;
		}

		public List<MatchArm> getArms() {
			return arms;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitMatch(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Match)) {
				return false;
			}
			Match other = (Match) o;
			return scrutinee.equals(other.scrutinee) && arms.equals(other.arms);
		}

		@Override
		public int hashCode() {
			return Objects.hash(scrutinee, arms);
		}

		@Override
		public String toString() {
			return "match " + scrutinee + " " + arms;
		}
	}

	public static final class Return extends Stmt {
		private final Expr value;

		/**
		 * @param value the returned value, or <code>null</code> for a bare <code>return</code>
		 */
		public Return(Expr value) {
			this.value = value;
		}

		/**
		 * @return the returned value, or <code>null</code>
		 */
		public Expr getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitReturn(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Return && Objects.equals(value, ((Return) o).value);
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(value);
		}

		@Override
		public String toString() {
			return value == null ? "return;" : "return " + value + ";";
		}
	}

	public static final class Break extends Stmt {
		public static final Break INSTANCE = new Break();

		private Break() {}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBreak(this);
		}

		@Override
		public String toString() {
			return "break;";
		}
	}

	public static final class Continue extends Stmt {
		public static final Continue INSTANCE = new Continue();

		private Continue() {}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitContinue(this);
		}

		@Override
		public String toString() {
			return "continue;";
		}
	}
}
