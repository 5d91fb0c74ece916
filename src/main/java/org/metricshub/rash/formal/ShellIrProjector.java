package org.metricshub.rash.formal;

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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.rash.intermediate.ArithExpr;
import org.metricshub.rash.intermediate.ShellCondition;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;

/**
 * Maps the part of a shell IR program the formal instruction set can express
 * to a {@link TinyAst}.
 * <p>
 * Values are resolved while projecting: variables assigned earlier,
 * concatenations and arithmetic over known numbers become plain text.
 * Conditions must resolve to a constant, so only one branch of an
 * <code>if</code> or arm of a <code>case</code> is kept, and <code>for</code>
 * loops are unrolled. Only
 * exported assignments show up in the result, other assignments only feed
 * the resolution. Shell function definitions have no effect by themselves
 * and are dropped.
 */
public final class ShellIrProjector {

	private ShellIrProjector() {}

	/**
	 * @param ir a program
	 * @return the equivalent formal program
	 * @throws EvalException when the program uses something the formal
	 *         instruction set cannot express
	 */
	public static TinyAst project(ShellIR ir) {
		Projection projection = new Projection();
		ir.accept(projection);
		return new TinyAst.Sequence(projection.commands);
	}

	private static EvalException unsupported(String what) {
		return new EvalException("Cannot project " + what);
	}

	private static final class Projection implements ShellIR.Visitor<Void> {

		private final Map<String, String> values = new HashMap<String, String>();
		private final List<TinyAst> commands = new ArrayList<TinyAst>();

		@Override
		public Void visitSequence(ShellIR.Sequence node) {
			for (ShellIR item : node.getItems()) {
				item.accept(this);
			}
			return null;
		}

		@Override
		public Void visitLet(ShellIR.Let node) {
			String value = resolve(node.getValue());
			values.put(node.getName(), value);
			if (node.isExported()) {
				commands.add(new TinyAst.SetEnvironmentVariable(node.getName(), value));
			}
			return null;
		}

		@Override
		public Void visitExec(ShellIR.Exec node) {
			String name = node.getCommandName();
			List<String> args = new ArrayList<String>();
			for (ShellValue arg : node.getArgs()) {
				args.add(resolve(arg));
			}
			if ("cd".equals(name) && args.size() == 1) {
				commands.add(new TinyAst.ChangeDirectory(args.get(0)));
			} else if (name != null && TinyAst.COMMANDS.contains(name)) {
				commands.add(new TinyAst.ExecuteCommand(name, args));
			} else {
				throw unsupported("command " + node);
			}
			return null;
		}

		@Override
		public Void visitCapture(ShellIR.Capture node) {
			throw unsupported("command output capture");
		}

		@Override
		public Void visitEcho(ShellIR.Echo node) {
			commands.add(new TinyAst.ExecuteCommand("echo", resolve(node.getValue())));
			return null;
		}

		@Override
		public Void visitStderr(ShellIR.Stderr node) {
			// standard error is not part of the state
			resolve(node.getValue());
			return null;
		}

		@Override
		public Void visitIf(ShellIR.If node) {
			if (evaluate(node.getCondition())) {
				node.getThenBranch().accept(this);
			} else if (node.getElseBranch() != null) {
				node.getElseBranch().accept(this);
			}
			return null;
		}

		@Override
		public Void visitCase(ShellIR.Case node) {
			String scrutinee = resolve(node.getScrutinee());
			for (ShellIR.CaseArm arm : node.getArms()) {
				if (arm.matches(scrutinee)) {
					arm.getBody().accept(this);
					return null;
				}
			}
			return null;
		}

		@Override
		public Void visitWhile(ShellIR.While node) {
			if (evaluate(node.getCondition())) {
				throw unsupported("while loop");
			}
			return null;
		}

		@Override
		public Void visitFor(ShellIR.For node) {
			List<String> items = new ArrayList<String>();
			for (ShellValue item : node.getItems()) {
				items.add(resolve(item));
			}
			for (String item : items) {
				values.put(node.getVariable(), item);
				node.getBody().accept(this);
			}
			return null;
		}

		@Override
		public Void visitExit(ShellIR.Exit node) {
			throw unsupported("exit");
		}

		@Override
		public Void visitFunction(ShellIR.Function node) {
			return null;
		}

		@Override
		public Void visitReturn(ShellIR.Return node) {
			throw unsupported("return");
		}

		@Override
		public Void visitBreak(ShellIR.Break node) {
			throw unsupported("break");
		}

		@Override
		public Void visitContinue(ShellIR.Continue node) {
			throw unsupported("continue");
		}

		private String resolve(ShellValue value) {
			if (value instanceof ShellValue.Literal) {
				return ((ShellValue.Literal) value).getText();
			}
			if (value instanceof ShellValue.VarRef) {
				return lookup(((ShellValue.VarRef) value).getName());
			}
			if (value instanceof ShellValue.Length) {
				return Integer.toString(lookup(((ShellValue.Length) value).getName()).length());
			}
			if (value instanceof ShellValue.Concat) {
				StringBuilder sb = new StringBuilder();
				for (ShellValue part : ((ShellValue.Concat) value).getParts()) {
					sb.append(resolve(part));
				}
				return sb.toString();
			}
			if (value instanceof ShellValue.Arith) {
				return Long.toString(arithmetic(((ShellValue.Arith) value).getExpr()));
			}
			throw unsupported("value " + value);
		}

		private String lookup(String name) {
			String value = values.get(name);
			if (value == null) {
				throw unsupported("unknown variable " + name);
			}
			return value;
		}

		private long arithmetic(ArithExpr expr) {
			if (expr instanceof ArithExpr.Number) {
				return ((ArithExpr.Number) expr).getValue();
			}
			if (expr instanceof ArithExpr.Operand) {
				String text = resolve(((ArithExpr.Operand) expr).getValue());
				try {
					return Long.parseLong(text.trim());
				} catch (NumberFormatException e) {
					throw unsupported("non numeric operand '" + text + "'");
				}
			}
			if (expr instanceof ArithExpr.Negate) {
				return -arithmetic(((ArithExpr.Negate) expr).getOperand());
			}
			ArithExpr.Binary binary = (ArithExpr.Binary) expr;
			long left = arithmetic(binary.getLeft());
			long right = arithmetic(binary.getRight());
			switch (binary.getOp()) {
			case ADD:
				return left + right;
			case SUB:
				return left - right;
			case MUL:
				return left * right;
			default:
				if (right == 0) {
					throw unsupported("division by zero");
				}
				return binary.getOp() == ArithExpr.Op.DIV ? left / right : left % right;
			}
		}

		private boolean evaluate(ShellCondition condition) {
			if (condition instanceof ShellCondition.Const) {
				return ((ShellCondition.Const) condition).getValue();
			}
			if (condition instanceof ShellCondition.Not) {
				return !evaluate(((ShellCondition.Not) condition).getOperand());
			}
			if (condition instanceof ShellCondition.And) {
				ShellCondition.And and = (ShellCondition.And) condition;
				return evaluate(and.getLeft()) && evaluate(and.getRight());
			}
			if (condition instanceof ShellCondition.Or) {
				ShellCondition.Or or = (ShellCondition.Or) condition;
				return evaluate(or.getLeft()) || evaluate(or.getRight());
			}
			if (condition instanceof ShellCondition.Test) {
				return test((ShellCondition.Test) condition);
			}
			throw unsupported("condition " + condition);
		}

		private boolean test(ShellCondition.Test test) {
			String op = test.getOp();
			List<ShellValue> operands = test.getOperands();
			if (test.isUnary()) {
				String value = resolve(operands.get(0));
				if ("-z".equals(op)) {
					return value.isEmpty();
				}
				if ("-n".equals(op)) {
					return !value.isEmpty();
				}
				throw unsupported("file test " + op);
			}
			String left = resolve(operands.get(0));
			String right = resolve(operands.get(1));
			if ("=".equals(op)) {
				return left.equals(right);
			}
			if ("!=".equals(op)) {
				return !left.equals(right);
			}
			int comparison;
			try {
				comparison = Long.compare(Long.parseLong(left.trim()), Long.parseLong(right.trim()));
			} catch (NumberFormatException e) {
				throw unsupported("numeric test on '" + left + "' and '" + right + "'");
			}
			switch (op) {
			case "-eq":
				return comparison == 0;
			case "-ne":
				return comparison != 0;
			case "-lt":
				return comparison < 0;
			case "-le":
				return comparison <= 0;
			case "-gt":
				return comparison > 0;
			case "-ge":
				return comparison >= 0;
			default:
				throw unsupported("test " + op);
			}
		}
	}
}
