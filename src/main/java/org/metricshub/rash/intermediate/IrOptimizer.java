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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.rash.InternalException;
import org.metricshub.rash.TranspileException;
import org.metricshub.rash.util.RashLogger;
import org.slf4j.Logger;

/**
 * Semantics-preserving rewrites of {@link ShellIR}.
 * <p>
 * The passes run until the tree stops changing:
 * <ul>
 * <li>constant folding of literal arithmetic, literal concatenations and
 * conditions over literals</li>
 * <li>pruning of branches and loops decided by a constant condition, of
 * <code>case</code> statements over a constant word, and of
 * statements following an unconditional exit, return, break or continue</li>
 * <li>dead-store elimination of unexported assignments whose variable is
 * never read and whose value neither runs a command nor may fail</li>
 * <li>flattening of nested sequences</li>
 * </ul>
 * Since the result is a fixed point, optimizing it again returns an equal
 * tree.
 */
public class IrOptimizer {

	private static final Logger LOG = RashLogger.getLogger(IrOptimizer.class);

	/**
	 * Number of rounds after which the optimizer gives up.
	 */
	public static final int MAX_ITERATIONS = 100;

	/**
	 * Optimizes a tree.
	 *
	 * @param ir the tree
	 * @return the optimized tree
	 * @throws InternalException when the passes fail or do not converge
	 */
	public ShellIR optimize(ShellIR ir) {
		try {
			ShellIR current = ir;
			for (int i = 1; i <= MAX_ITERATIONS; i++) {
				ShellIR folded = current.accept(new Folder());
				ShellIR next = folded.accept(new DeadStoreEliminator(ReadCounter.count(folded)));
				if (next.equals(current)) {
					LOG.debug("Optimizer reached a fixed point after {} round(s)", i);
					return next;
				}
				current = next;
			}
		} catch (TranspileException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new InternalException("Optimizer failed: " + e, e);
		}
		throw new InternalException("Optimizer did not reach a fixed point after " + MAX_ITERATIONS + " rounds");
	}

	private static boolean terminates(ShellIR node) {
		return node instanceof ShellIR.Exit || node instanceof ShellIR.Return || node instanceof ShellIR.Break
				|| node instanceof ShellIR.Continue;
	}

	private static boolean isEmpty(ShellIR node) {
		return node instanceof ShellIR.Sequence && ((ShellIR.Sequence) node).getItems().isEmpty();
	}

	/**
	 * @return <code>true</code> when evaluating the condition runs no command
	 */
	static boolean isPure(ShellCondition condition) {
		if (condition instanceof ShellCondition.Const) {
			return true;
		}
		if (condition instanceof ShellCondition.Status) {
			return false;
		}
		if (condition instanceof ShellCondition.Test) {
			for (ShellValue operand : ((ShellCondition.Test) condition).getOperands()) {
				if (operand.hasCommandSubstitution()) {
					return false;
				}
			}
			return true;
		}
		if (condition instanceof ShellCondition.Not) {
			return isPure(((ShellCondition.Not) condition).getOperand());
		}
		if (condition instanceof ShellCondition.And) {
			return isPure(((ShellCondition.And) condition).getLeft()) && isPure(((ShellCondition.And) condition).getRight());
		}
		ShellCondition.Or or = (ShellCondition.Or) condition;
		return isPure(or.getLeft()) && isPure(or.getRight());
	}

	/**
	 * @return <code>true</code> when expanding the value may abort the
	 *         script, as a division by a divisor that is not a non-zero
	 *         constant does
	 */
	static boolean mayFail(ShellValue value) {
		if (value instanceof ShellValue.Arith) {
			return mayFail(((ShellValue.Arith) value).getExpr());
		}
		if (value instanceof ShellValue.Concat) {
			for (ShellValue part : ((ShellValue.Concat) value).getParts()) {
				if (mayFail(part)) {
					return true;
				}
			}
		}
		return false;
	}

	private static boolean mayFail(ArithExpr expr) {
		if (expr instanceof ArithExpr.Binary) {
			ArithExpr.Binary binary = (ArithExpr.Binary) expr;
			if (binary.getOp() == ArithExpr.Op.DIV || binary.getOp() == ArithExpr.Op.REM) {
				ArithExpr divisor = binary.getRight();
				if (!(divisor instanceof ArithExpr.Number) || ((ArithExpr.Number) divisor).getValue() == 0) {
					return true;
				}
			}
			return mayFail(binary.getLeft()) || mayFail(binary.getRight());
		}
		if (expr instanceof ArithExpr.Negate) {
			return mayFail(((ArithExpr.Negate) expr).getOperand());
		}
		if (expr instanceof ArithExpr.Operand) {
			return mayFail(((ArithExpr.Operand) expr).getValue());
		}
		return false;
	}

	/**
	 * Rebuilds a tree bottom-up; subclasses rewrite single nodes.
	 */
	private abstract static class Rewriter implements ShellIR.Visitor<ShellIR> {

		@Override
		public ShellIR visitSequence(ShellIR.Sequence node) {
			List<ShellIR> items = new ArrayList<ShellIR>();
			for (ShellIR item : node.getItems()) {
				ShellIR rewritten = item.accept(this);
				if (rewritten instanceof ShellIR.Sequence) {
					items.addAll(((ShellIR.Sequence) rewritten).getItems());
				} else {
					items.add(rewritten);
				}
				if (!items.isEmpty() && terminates(items.get(items.size() - 1))) {
					break;
				}
			}
			return new ShellIR.Sequence(items);
		}

		@Override
		public ShellIR visitLet(ShellIR.Let node) {
			return new ShellIR.Let(node.getName(), value(node.getValue()), node.isExported());
		}

		@Override
		public ShellIR visitExec(ShellIR.Exec node) {
			return exec(node);
		}

		@Override
		public ShellIR visitCapture(ShellIR.Capture node) {
			return new ShellIR.Capture(exec(node.getExec()), node.getTarget());
		}

		@Override
		public ShellIR visitEcho(ShellIR.Echo node) {
			return new ShellIR.Echo(value(node.getValue()));
		}

		@Override
		public ShellIR visitStderr(ShellIR.Stderr node) {
			return new ShellIR.Stderr(value(node.getValue()));
		}

		@Override
		public ShellIR visitIf(ShellIR.If node) {
			ShellIR elseBranch = node.getElseBranch() == null ? null : node.getElseBranch().accept(this);
			return new ShellIR.If(condition(node.getCondition()), node.getThenBranch().accept(this), elseBranch);
		}

		@Override
		public ShellIR visitCase(ShellIR.Case node) {
			ShellValue scrutinee = value(node.getScrutinee());
			List<ShellIR.CaseArm> arms = new ArrayList<ShellIR.CaseArm>();
			for (ShellIR.CaseArm arm : node.getArms()) {
				arms.add(arm.withBody(arm.getBody().accept(this)));
			}
			return new ShellIR.Case(scrutinee, arms);
		}

		@Override
		public ShellIR visitWhile(ShellIR.While node) {
			return new ShellIR.While(condition(node.getCondition()), node.getBody().accept(this));
		}

		@Override
		public ShellIR visitFor(ShellIR.For node) {
			List<ShellValue> items = new ArrayList<ShellValue>();
			for (ShellValue item : node.getItems()) {
				items.add(value(item));
			}
			return new ShellIR.For(node.getVariable(), items, node.getBody().accept(this));
		}

		@Override
		public ShellIR visitExit(ShellIR.Exit node) {
			return new ShellIR.Exit(value(node.getCode()));
		}

		@Override
		public ShellIR visitFunction(ShellIR.Function node) {
			return new ShellIR.Function(node.getName(), node.getBody().accept(this));
		}

		@Override
		public ShellIR visitReturn(ShellIR.Return node) {
			return node;
		}

		@Override
		public ShellIR visitBreak(ShellIR.Break node) {
			return node;
		}

		@Override
		public ShellIR visitContinue(ShellIR.Continue node) {
			return node;
		}

		ShellIR.Exec exec(ShellIR.Exec exec) {
			List<ShellValue> args = new ArrayList<ShellValue>();
			for (ShellValue arg : exec.getArgs()) {
				args.add(value(arg));
			}
			return new ShellIR.Exec(value(exec.getCommand()), args, exec.effects());
		}

		ShellValue value(ShellValue value) {
			return value;
		}

		ShellCondition condition(ShellCondition condition) {
			return condition;
		}
	}

	/**
	 * Constant folding and pruning.
	 */
	private static final class Folder extends Rewriter {

		private final ValueFolder valueFolder = new ValueFolder(this);

		@Override
		public ShellIR visitIf(ShellIR.If node) {
			ShellCondition condition = condition(node.getCondition());
			ShellIR thenBranch = node.getThenBranch().accept(this);
			ShellIR elseBranch = node.getElseBranch() == null ? null : node.getElseBranch().accept(this);
			if (elseBranch != null && isEmpty(elseBranch)) {
				elseBranch = null;
			}
			if (condition instanceof ShellCondition.Const) {
				if (((ShellCondition.Const) condition).getValue()) {
					return thenBranch;
				}
				return elseBranch == null ? ShellIR.Sequence.empty() : elseBranch;
			}
			if (isEmpty(thenBranch) && elseBranch == null && isPure(condition)) {
				return ShellIR.Sequence.empty();
			}
			return new ShellIR.If(condition, thenBranch, elseBranch);
		}

		@Override
		public ShellIR visitCase(ShellIR.Case node) {
			ShellIR.Case rewritten = (ShellIR.Case) super.visitCase(node);
			if (!(rewritten.getScrutinee() instanceof ShellValue.Literal)) {
				return rewritten;
			}
			String text = ((ShellValue.Literal) rewritten.getScrutinee()).getText();
			for (ShellIR.CaseArm arm : rewritten.getArms()) {
				if (arm.matches(text)) {
					return arm.getBody();
				}
			}
			return ShellIR.Sequence.empty();
		}

		@Override
		public ShellIR visitWhile(ShellIR.While node) {
			ShellCondition condition = condition(node.getCondition());
			if (condition.equals(ShellCondition.Const.FALSE)) {
				return ShellIR.Sequence.empty();
			}
			return new ShellIR.While(condition, node.getBody().accept(this));
		}

		@Override
		public ShellIR visitFor(ShellIR.For node) {
			if (node.getItems().isEmpty()) {
				return ShellIR.Sequence.empty();
			}
			return super.visitFor(node);
		}

		@Override
		ShellValue value(ShellValue value) {
			return value.accept(valueFolder);
		}

		@Override
		ShellCondition condition(ShellCondition condition) {
			return condition.accept(new ConditionFolder(this));
		}
	}

	private static final class ValueFolder implements ShellValue.Visitor<ShellValue> {

		private final Folder folder;

		ValueFolder(Folder folder) {
			this.folder = folder;
		}

		@Override
		public ShellValue visitLiteral(ShellValue.Literal value) {
			return value;
		}

		@Override
		public ShellValue visitVarRef(ShellValue.VarRef value) {
			return value;
		}

		@Override
		public ShellValue visitConcat(ShellValue.Concat value) {
			List<ShellValue> flat = new ArrayList<ShellValue>();
			for (ShellValue part : value.getParts()) {
				ShellValue folded = part.accept(this);
				if (folded instanceof ShellValue.Concat) {
					flat.addAll(((ShellValue.Concat) folded).getParts());
				} else {
					flat.add(folded);
				}
			}
			List<ShellValue> merged = new ArrayList<ShellValue>();
			for (ShellValue part : flat) {
				if (part instanceof ShellValue.Literal) {
					String text = ((ShellValue.Literal) part).getText();
					if (text.isEmpty()) {
						continue;
					}
					int last = merged.size() - 1;
					if (last >= 0 && merged.get(last) instanceof ShellValue.Literal) {
						merged.set(last, new ShellValue.Literal(((ShellValue.Literal) merged.get(last)).getText() + text));
						continue;
					}
				}
				merged.add(part);
			}
			if (merged.isEmpty()) {
				return new ShellValue.Literal("");
			}
			return merged.size() == 1 ? merged.get(0) : new ShellValue.Concat(merged);
		}

		@Override
		public ShellValue visitCommandSubst(ShellValue.CommandSubst value) {
			return new ShellValue.CommandSubst(folder.exec(value.getExec()));
		}

		@Override
		public ShellValue visitArith(ShellValue.Arith value) {
			ArithExpr folded = value.getExpr().accept(ARITH_FOLDER);
			if (folded instanceof ArithExpr.Number) {
				return new ShellValue.Literal(Long.toString(((ArithExpr.Number) folded).getValue()));
			}
			return new ShellValue.Arith(folded);
		}

		@Override
		public ShellValue visitEnvRef(ShellValue.EnvRef value) {
			return value;
		}

		@Override
		public ShellValue visitArgRef(ShellValue.ArgRef value) {
			return value;
		}

		@Override
		public ShellValue visitLength(ShellValue.Length value) {
			return value;
		}
	}

	private static final ArithExpr.Visitor<ArithExpr> ARITH_FOLDER = new ArithExpr.Visitor<ArithExpr>() {

		@Override
		public ArithExpr visitNumber(ArithExpr.Number expr) {
			return expr;
		}

		@Override
		public ArithExpr visitOperand(ArithExpr.Operand expr) {
			return expr;
		}

		@Override
		public ArithExpr visitBinary(ArithExpr.Binary expr) {
			ArithExpr left = expr.getLeft().accept(this);
			ArithExpr right = expr.getRight().accept(this);
			if (left instanceof ArithExpr.Number && right instanceof ArithExpr.Number) {
				long l = ((ArithExpr.Number) left).getValue();
				long r = ((ArithExpr.Number) right).getValue();
				switch (expr.getOp()) {
				case ADD:
					return new ArithExpr.Number(l + r);
				case SUB:
					return new ArithExpr.Number(l - r);
				case MUL:
					return new ArithExpr.Number(l * r);
				case DIV:
					if (r != 0) {
						return new ArithExpr.Number(l / r);
					}
					break;
				default:
					if (r != 0) {
						return new ArithExpr.Number(l % r);
					}
					break;
				}
			}
			return new ArithExpr.Binary(expr.getOp(), left, right);
		}

		@Override
		public ArithExpr visitNegate(ArithExpr.Negate expr) {
			ArithExpr operand = expr.getOperand().accept(this);
			if (operand instanceof ArithExpr.Number) {
				return new ArithExpr.Number(-((ArithExpr.Number) operand).getValue());
			}
			if (operand instanceof ArithExpr.Negate) {
				return ((ArithExpr.Negate) operand).getOperand();
			}
			return new ArithExpr.Negate(operand);
		}
	};

	private static final class ConditionFolder implements ShellCondition.Visitor<ShellCondition> {

		private final Folder folder;

		ConditionFolder(Folder folder) {
			this.folder = folder;
		}

		@Override
		public ShellCondition visitConst(ShellCondition.Const cond) {
			return cond;
		}

		@Override
		public ShellCondition visitTest(ShellCondition.Test cond) {
			List<ShellValue> operands = new ArrayList<ShellValue>();
			boolean literal = true;
			for (ShellValue operand : cond.getOperands()) {
				ShellValue folded = folder.value(operand);
				literal &= folded instanceof ShellValue.Literal;
				operands.add(folded);
			}
			ShellCondition.Test test = new ShellCondition.Test(cond.getOp(), operands);
			if (!literal) {
				return test;
			}
			Boolean outcome = evaluate(test);
			return outcome == null ? test : ShellCondition.Const.of(outcome.booleanValue());
		}

		@Override
		public ShellCondition visitNot(ShellCondition.Not cond) {
			ShellCondition operand = cond.getOperand().accept(this);
			if (operand instanceof ShellCondition.Const) {
				return ShellCondition.Const.of(!((ShellCondition.Const) operand).getValue());
			}
			if (operand instanceof ShellCondition.Not) {
				return ((ShellCondition.Not) operand).getOperand();
			}
			return new ShellCondition.Not(operand);
		}

		@Override
		public ShellCondition visitAnd(ShellCondition.And cond) {
			ShellCondition left = cond.getLeft().accept(this);
			ShellCondition right = cond.getRight().accept(this);
			if (left.equals(ShellCondition.Const.FALSE)) {
				return left;
			}
			if (left.equals(ShellCondition.Const.TRUE)) {
				return right;
			}
			if (right.equals(ShellCondition.Const.TRUE)) {
				return left;
			}
			if (right.equals(ShellCondition.Const.FALSE) && isPure(left)) {
				return right;
			}
			return new ShellCondition.And(left, right);
		}

		@Override
		public ShellCondition visitOr(ShellCondition.Or cond) {
			ShellCondition left = cond.getLeft().accept(this);
			ShellCondition right = cond.getRight().accept(this);
			if (left.equals(ShellCondition.Const.TRUE)) {
				return left;
			}
			if (left.equals(ShellCondition.Const.FALSE)) {
				return right;
			}
			if (right.equals(ShellCondition.Const.FALSE)) {
				return left;
			}
			if (right.equals(ShellCondition.Const.TRUE) && isPure(left)) {
				return right;
			}
			return new ShellCondition.Or(left, right);
		}

		@Override
		public ShellCondition visitStatus(ShellCondition.Status cond) {
			return new ShellCondition.Status(folder.exec(cond.getExec()));
		}

		/**
		 * @return the outcome of a test over literals, or <code>null</code>
		 *         when it depends on the system
		 */
		private static Boolean evaluate(ShellCondition.Test test) {
			List<String> values = new ArrayList<String>();
			for (ShellValue operand : test.getOperands()) {
				values.add(((ShellValue.Literal) operand).getText());
			}
			String op = test.getOp();
			if (test.isUnary()) {
				if (op.equals("-z")) {
					return values.get(0).isEmpty();
				}
				if (op.equals("-n")) {
					return !values.get(0).isEmpty();
				}
				return null;
			}
			if (op.equals("=")) {
				return values.get(0).equals(values.get(1));
			}
			if (op.equals("!=")) {
				return !values.get(0).equals(values.get(1));
			}
			long l;
			long r;
			try {
				l = Long.parseLong(values.get(0));
				r = Long.parseLong(values.get(1));
			} catch (NumberFormatException e) {
				// the shell reports the error at run time
				return null;
			}
			switch (op) {
			case "-eq":
				return l == r;
			case "-ne":
				return l != r;
			case "-lt":
				return l < r;
			case "-le":
				return l <= r;
			case "-gt":
				return l > r;
			case "-ge":
				return l >= r;
			default:
				return null;
			}
		}
	}

	/**
	 * Counts how often each variable is read anywhere in the tree.
	 */
	private static final class ReadCounter extends Rewriter implements ShellValue.Visitor<Void>, ArithExpr.Visitor<Void>, ShellCondition.Visitor<Void> {

		private final Map<String, Integer> reads = new HashMap<String, Integer>();

		static Map<String, Integer> count(ShellIR ir) {
			ReadCounter counter = new ReadCounter();
			ir.accept(counter);
			return counter.reads;
		}

		private void read(String name) {
			Integer count = reads.get(name);
			reads.put(name, count == null ? 1 : count + 1);
		}

		@Override
		ShellValue value(ShellValue value) {
			value.accept((ShellValue.Visitor<Void>) this);
			return value;
		}

		@Override
		ShellCondition condition(ShellCondition condition) {
			condition.accept((ShellCondition.Visitor<Void>) this);
			return condition;
		}

		@Override
		public Void visitLiteral(ShellValue.Literal value) {
			return null;
		}

		@Override
		public Void visitVarRef(ShellValue.VarRef value) {
			read(value.getName());
			return null;
		}

		@Override
		public Void visitConcat(ShellValue.Concat value) {
			for (ShellValue part : value.getParts()) {
				value(part);
			}
			return null;
		}

		@Override
		public Void visitCommandSubst(ShellValue.CommandSubst value) {
			exec(value.getExec());
			return null;
		}

		@Override
		public Void visitArith(ShellValue.Arith value) {
			value.getExpr().accept((ArithExpr.Visitor<Void>) this);
			return null;
		}

		@Override
		public Void visitEnvRef(ShellValue.EnvRef value) {
			read(value.getName());
			return null;
		}

		@Override
		public Void visitArgRef(ShellValue.ArgRef value) {
			return null;
		}

		@Override
		public Void visitLength(ShellValue.Length value) {
			read(value.getName());
			return null;
		}

		@Override
		public Void visitNumber(ArithExpr.Number expr) {
			return null;
		}

		@Override
		public Void visitOperand(ArithExpr.Operand expr) {
			value(expr.getValue());
			return null;
		}

		@Override
		public Void visitBinary(ArithExpr.Binary expr) {
			expr.getLeft().accept((ArithExpr.Visitor<Void>) this);
			expr.getRight().accept((ArithExpr.Visitor<Void>) this);
			return null;
		}

		@Override
		public Void visitNegate(ArithExpr.Negate expr) {
			expr.getOperand().accept((ArithExpr.Visitor<Void>) this);
			return null;
		}

		@Override
		public Void visitConst(ShellCondition.Const cond) {
			return null;
		}

		@Override
		public Void visitTest(ShellCondition.Test cond) {
			for (ShellValue operand : cond.getOperands()) {
				value(operand);
			}
			return null;
		}

		@Override
		public Void visitNot(ShellCondition.Not cond) {
			condition(cond.getOperand());
			return null;
		}

		@Override
		public Void visitAnd(ShellCondition.And cond) {
			condition(cond.getLeft());
			condition(cond.getRight());
			return null;
		}

		@Override
		public Void visitOr(ShellCondition.Or cond) {
			condition(cond.getLeft());
			condition(cond.getRight());
			return null;
		}

		@Override
		public Void visitStatus(ShellCondition.Status cond) {
			exec(cond.getExec());
			return null;
		}
	}

	/**
	 * Drops unexported assignments nobody reads, unless computing the value
	 * runs a command or may fail.
	 */
	private static final class DeadStoreEliminator extends Rewriter {

		private final Map<String, Integer> reads;

		DeadStoreEliminator(Map<String, Integer> reads) {
			this.reads = reads;
		}

		@Override
		public ShellIR visitLet(ShellIR.Let node) {
			if (!node.isExported() && !reads.containsKey(node.getName()) && !node.getValue().hasCommandSubstitution()
					&& !mayFail(node.getValue())) {
				return ShellIR.Sequence.empty();
			}
			return node;
		}
	}
}
