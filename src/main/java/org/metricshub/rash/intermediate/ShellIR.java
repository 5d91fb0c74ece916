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
 * Statements of the shell intermediate representation.
 * <p>
 * Nodes are immutable and compared structurally, so the optimizer can detect
 * its fixed point with {@link #equals(Object)}.
 */
public abstract class ShellIR {

	private ShellIR() {}

	public abstract <R> R accept(Visitor<R> visitor);

	/**
	 * @return the side effects of this node and everything below it
	 */
	public abstract EffectSet effects();

	public interface Visitor<R> {
		R visitSequence(Sequence node);

		R visitLet(Let node);

		R visitExec(Exec node);

		R visitCapture(Capture node);

		R visitEcho(Echo node);

		R visitStderr(Stderr node);

		R visitIf(If node);

		R visitCase(Case node);

		R visitWhile(While node);

		R visitFor(For node);

		R visitExit(Exit node);

		R visitFunction(Function node);

		R visitReturn(Return node);

		R visitBreak(Break node);

		R visitContinue(Continue node);
	}

	private static <T> List<T> copy(List<T> list) {
		return Collections.unmodifiableList(new ArrayList<T>(list));
	}

	private static EffectSet effectsOf(List<ShellIR> nodes) {
		EffectSet result = EffectSet.pure();
		for (ShellIR node : nodes) {
			result = result.union(node.effects());
		}
		return result;
	}

	public static final class Sequence extends ShellIR {
		private final List<ShellIR> items;

		public Sequence(List<ShellIR> items) {
			this.items = copy(items);
		}

		public static Sequence empty() {
			return new Sequence(Collections.<ShellIR>emptyList());
		}

		public List<ShellIR> getItems() {
			return items;
		}

		@Override
		public EffectSet effects() {
			return effectsOf(items);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSequence(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Sequence && items.equals(((Sequence) o).items);
		}

		@Override
		public int hashCode() {
			return items.hashCode();
		}

		@Override
		public String toString() {
			return "seq" + items;
		}
	}

	/**
	 * Assignment of a shell variable, exported to child processes when
	 * <code>exported</code> is set.
	 */
	public static final class Let extends ShellIR {
		private final String name;
		private final ShellValue value;
		private final boolean exported;

		public Let(String name, ShellValue value, boolean exported) {
			this.name = Objects.requireNonNull(name, "name");
			this.value = Objects.requireNonNull(value, "value");
			this.exported = exported;
		}

		public Let(String name, ShellValue value) {
			this(name, value, false);
		}

		public String getName() {
			return name;
		}

		public ShellValue getValue() {
			return value;
		}

		public boolean isExported() {
			return exported;
		}

		@Override
		public EffectSet effects() {
			return exported ? EffectSet.of(Effect.ENV_WRITE) : EffectSet.pure();
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
			return name.equals(other.name) && value.equals(other.value) && exported == other.exported;
		}

		@Override
		public int hashCode() {
			return Objects.hash(name, value, exported);
		}

		@Override
		public String toString() {
			return (exported ? "export " : "let ") + name + "=" + value;
		}
	}

	/**
	 * Execution of a command. The command word is a value so that a
	 * tainted command name stays visible to the verifier.
	 */
	public static final class Exec extends ShellIR {
		private final ShellValue command;
		private final List<ShellValue> args;
		private final EffectSet commandEffects;

		public Exec(ShellValue command, List<ShellValue> args, EffectSet effects) {
			this.command = Objects.requireNonNull(command, "command");
			this.args = copy(args);
			this.commandEffects = Objects.requireNonNull(effects, "effects");
		}

		/**
		 * @param command a literal command name
		 * @param effects the command's effects
		 * @param args the arguments
		 * @return the command node
		 */
		public static Exec of(String command, EffectSet effects, ShellValue... args) {
			List<ShellValue> list = new ArrayList<ShellValue>();
			Collections.addAll(list, args);
			return new Exec(new ShellValue.Literal(command), list, effects);
		}

		public ShellValue getCommand() {
			return command;
		}

		/**
		 * @return the command name when it is a literal, <code>null</code> otherwise
		 */
		public String getCommandName() {
			return command instanceof ShellValue.Literal ? ((ShellValue.Literal) command).getText() : null;
		}

		public List<ShellValue> getArgs() {
			return args;
		}

		@Override
		public EffectSet effects() {
			return commandEffects;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitExec(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Exec)) {
				return false;
			}
			Exec other = (Exec) o;
			return command.equals(other.command) && args.equals(other.args) && commandEffects.equals(other.commandEffects);
		}

		@Override
		public int hashCode() {
			return Objects.hash(command, args, commandEffects);
		}

		@Override
		public String toString() {
			return "exec " + command + " " + args;
		}
	}

	/**
	 * Stores the standard output of a command in a variable.
	 */
	public static final class Capture extends ShellIR {
		private final Exec exec;
		private final String target;

		public Capture(Exec exec, String target) {
			this.exec = Objects.requireNonNull(exec, "exec");
			this.target = Objects.requireNonNull(target, "target");
		}

		public Exec getExec() {
			return exec;
		}

		public String getTarget() {
			return target;
		}

		@Override
		public EffectSet effects() {
			return exec.effects();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCapture(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Capture)) {
				return false;
			}
			Capture other = (Capture) o;
			return exec.equals(other.exec) && target.equals(other.target);
		}

		@Override
		public int hashCode() {
			return Objects.hash(exec, target);
		}

		@Override
		public String toString() {
			return target + "=$(" + exec + ")";
		}
	}

	/**
	 * Writes a value and a newline to standard output.
	 */
	public static final class Echo extends ShellIR {
		private final ShellValue value;

		public Echo(ShellValue value) {
			this.value = Objects.requireNonNull(value, "value");
		}

		public ShellValue getValue() {
			return value;
		}

		@Override
		public EffectSet effects() {
			return EffectSet.pure();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitEcho(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Echo && value.equals(((Echo) o).value);
		}

		@Override
		public int hashCode() {
			return value.hashCode() * 3;
		}

		@Override
		public String toString() {
			return "echo " + value;
		}
	}

	/**
	 * Writes a value and a newline to standard error.
	 */
	public static final class Stderr extends ShellIR {
		private final ShellValue value;

		public Stderr(ShellValue value) {
			this.value = Objects.requireNonNull(value, "value");
		}

		public ShellValue getValue() {
			return value;
		}

		@Override
		public EffectSet effects() {
			return EffectSet.pure();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitStderr(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Stderr && value.equals(((Stderr) o).value);
		}

		@Override
		public int hashCode() {
			return value.hashCode() * 5;
		}

		@Override
		public String toString() {
			return "stderr " + value;
		}
	}

	public static final class If extends ShellIR {
		private final ShellCondition condition;
		private final ShellIR thenBranch;
		private final ShellIR elseBranch;

		/**
		 * @param condition the condition
		 * @param thenBranch the branch taken when it holds
		 * @param elseBranch the other branch, or <code>null</code>
		 */
		public If(ShellCondition condition, ShellIR thenBranch, ShellIR elseBranch) {
			this.condition = Objects.requireNonNull(condition, "condition");
			this.thenBranch = Objects.requireNonNull(thenBranch, "thenBranch");
			this.elseBranch = elseBranch;
		}

		public ShellCondition getCondition() {
			return condition;
		}

		public ShellIR getThenBranch() {
			return thenBranch;
		}

		public ShellIR getElseBranch() {
			return elseBranch;
		}

		@Override
		public EffectSet effects() {
			EffectSet result = thenBranch.effects();
			return elseBranch == null ? result : result.union(elseBranch.effects());
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
			return condition.equals(other.condition) && thenBranch.equals(other.thenBranch)
					&& Objects.equals(elseBranch, other.elseBranch);
		}

		@Override
		public int hashCode() {
			return Objects.hash(condition, thenBranch, elseBranch);
		}

		@Override
		public String toString() {
			return "if " + condition + " then " + thenBranch + (elseBranch == null ? "" : " else " + elseBranch);
		}
	}

	/**
	 * One arm of a {@link Case}. An arm without patterns is the catch-all
	 * <code>*</code>.
	 */
	public static final class CaseArm {
		private final List<String> patterns;
		private final ShellIR body;

		/**
		 * @param patterns the words this arm accepts, compared literally
		 * @param body the statements run when one of them equals the scrutinee
		 */
		public CaseArm(List<String> patterns, ShellIR body) {
			this.patterns = copy(patterns);
			this.body = Objects.requireNonNull(body, "body");
		}

		public static CaseArm wildcard(ShellIR body) {
			return new CaseArm(Collections.<String>emptyList(), body);
		}

		public List<String> getPatterns() {
			return patterns;
		}

		public ShellIR getBody() {
			return body;
		}

		public boolean isWildcard() {
			return patterns.isEmpty();
		}

		public boolean matches(String value) {
			return isWildcard() || patterns.contains(value);
		}

		public CaseArm withBody(ShellIR newBody) {
			return new CaseArm(patterns, newBody);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof CaseArm)) {
				return false;
			}
			CaseArm other = (CaseArm) o;
			return patterns.equals(other.patterns) && body.equals(other.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(patterns, body);
		}

		@Override
		public String toString() {
			return (isWildcard() ? "*" : String.join("|", patterns)) + ") " + body;
		}
	}

	/**
	 * A <code>case</code> statement: the first arm accepting the scrutinee
	 * runs, or none.
	 */
	public static final class Case extends ShellIR {
		private final ShellValue scrutinee;
		private final List<CaseArm> arms;

		public Case(ShellValue scrutinee, List<CaseArm> arms) {
			this.scrutinee = Objects.requireNonNull(scrutinee, "scrutinee");
			this.arms = copy(arms);
		}

		public ShellValue getScrutinee() {
			return scrutinee;
		}

		public List<CaseArm> getArms() {
			return arms;
		}

		@Override
		public EffectSet effects() {
			EffectSet result = EffectSet.pure();
			for (CaseArm arm : arms) {
				result = result.union(arm.getBody().effects());
			}
			return result;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCase(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Case)) {
				return false;
			}
			Case other = (Case) o;
			return scrutinee.equals(other.scrutinee) && arms.equals(other.arms);
		}

		@Override
		public int hashCode() {
			return Objects.hash(scrutinee, arms);
		}

		@Override
		public String toString() {
			return "case " + scrutinee + " in " + arms + " esac";
		}
	}

	public static final class While extends ShellIR {
		private final ShellCondition condition;
		private final ShellIR body;

		public While(ShellCondition condition, ShellIR body) {
			this.condition = Objects.requireNonNull(condition, "condition");
			this.body = Objects.requireNonNull(body, "body");
		}

		public ShellCondition getCondition() {
			return condition;
		}

		public ShellIR getBody() {
			return body;
		}

		@Override
		public EffectSet effects() {
			return body.effects();
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
			return Objects.hash("while", condition, body);
		}

		@Override
		public String toString() {
			return "while " + condition + " do " + body;
		}
	}

	/**
	 * Iterates over a finite list of words.
	 */
	public static final class For extends ShellIR {
		private final String variable;
		private final List<ShellValue> items;
		private final ShellIR body;

		public For(String variable, List<ShellValue> items, ShellIR body) {
			this.variable = Objects.requireNonNull(variable, "variable");
			this.items = copy(items);
			this.body = Objects.requireNonNull(body, "body");
		}

		public String getVariable() {
			return variable;
		}

		public List<ShellValue> getItems() {
			return items;
		}

		public ShellIR getBody() {
			return body;
		}

		@Override
		public EffectSet effects() {
			return body.effects();
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
			return variable.equals(other.variable) && items.equals(other.items) && body.equals(other.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(variable, items, body);
		}

		@Override
		public String toString() {
			return "for " + variable + " in " + items + " do " + body;
		}
	}

	public static final class Exit extends ShellIR {
		private final ShellValue code;

		public Exit(ShellValue code) {
			this.code = Objects.requireNonNull(code, "code");
		}

		public ShellValue getCode() {
			return code;
		}

		@Override
		public EffectSet effects() {
			return EffectSet.pure();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitExit(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Exit && code.equals(((Exit) o).code);
		}

		@Override
		public int hashCode() {
			return code.hashCode() * 7;
		}

		@Override
		public String toString() {
			return "exit " + code;
		}
	}

	/**
	 * A shell function definition. Parameters are read from the positional
	 * parameters by the body itself.
	 */
	public static final class Function extends ShellIR {
		private final String name;
		private final ShellIR body;

		public Function(String name, ShellIR body) {
			this.name = Objects.requireNonNull(name, "name");
			this.body = Objects.requireNonNull(body, "body");
		}

		public String getName() {
			return name;
		}

		public ShellIR getBody() {
			return body;
		}

		@Override
		public EffectSet effects() {
			return body.effects();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFunction(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Function)) {
				return false;
			}
			Function other = (Function) o;
			return name.equals(other.name) && body.equals(other.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash("fn", name, body);
		}

		@Override
		public String toString() {
			return "fn " + name + " " + body;
		}
	}

	/**
	 * Leaves the current function. A returned value has already been written
	 * to standard output.
	 */
	public static final class Return extends ShellIR {
		public static final Return INSTANCE = new Return();

		private Return() {}

		@Override
		public EffectSet effects() {
			return EffectSet.pure();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitReturn(this);
		}

		@Override
		public String toString() {
			return "return";
		}
	}

	public static final class Break extends ShellIR {
		public static final Break INSTANCE = new Break();

		private Break() {}

		@Override
		public EffectSet effects() {
			return EffectSet.pure();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBreak(this);
		}

		@Override
		public String toString() {
			return "break";
		}
	}

	public static final class Continue extends ShellIR {
		public static final Continue INSTANCE = new Continue();

		private Continue() {}

		@Override
		public EffectSet effects() {
			return EffectSet.pure();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitContinue(this);
		}

		@Override
		public String toString() {
			return "continue";
		}
	}
}
