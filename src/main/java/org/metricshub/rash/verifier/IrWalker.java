package org.metricshub.rash.verifier;

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

import org.metricshub.rash.backend.PosixEmitter;
import org.metricshub.rash.intermediate.ArithExpr;
import org.metricshub.rash.intermediate.ShellCondition;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;

/**
 * Depth-first traversal of a whole program, including the commands nested
 * in values and conditions. Subclasses override the hooks they need; each
 * hook receives the name of the enclosing shell function, <code>null</code>
 * in the entry point.
 */
abstract class IrWalker {

	private ShellIR statement;

	/**
	 * Walks a program.
	 *
	 * @param root the program
	 */
	void walk(ShellIR root) {
		node(root, null);
	}

	/**
	 * Called for every node before its children.
	 */
	protected void onNode(ShellIR node, String function) {}

	/**
	 * Called for every command, wherever it appears.
	 */
	protected void onExec(ShellIR.Exec exec, String function) {}

	/**
	 * Called for every value and every part of a value.
	 */
	protected void onValue(ShellValue value, String function) {}

	/**
	 * @return the first line of the shell text of the statement being walked
	 */
	protected String currentStatementText() {
		return firstLine(statement);
	}

	static String firstLine(ShellIR node) {
		String text = PosixEmitter.render(node);
		int newline = text.indexOf('\n');
		return newline < 0 ? text : text.substring(0, newline);
	}

	private void node(ShellIR node, String function) {
		if (!(node instanceof ShellIR.Sequence)) {
			statement = node;
		}
		onNode(node, function);
		if (node instanceof ShellIR.Sequence) {
			for (ShellIR item : ((ShellIR.Sequence) node).getItems()) {
				node(item, function);
			}
		} else if (node instanceof ShellIR.Let) {
			value(((ShellIR.Let) node).getValue(), function);
		} else if (node instanceof ShellIR.Exec) {
			exec((ShellIR.Exec) node, function);
		} else if (node instanceof ShellIR.Capture) {
			exec(((ShellIR.Capture) node).getExec(), function);
		} else if (node instanceof ShellIR.Echo) {
			value(((ShellIR.Echo) node).getValue(), function);
		} else if (node instanceof ShellIR.Stderr) {
			value(((ShellIR.Stderr) node).getValue(), function);
		} else if (node instanceof ShellIR.If) {
			ShellIR.If ifNode = (ShellIR.If) node;
			condition(ifNode.getCondition(), function);
			node(ifNode.getThenBranch(), function);
			if (ifNode.getElseBranch() != null) {
				node(ifNode.getElseBranch(), function);
			}
		} else if (node instanceof ShellIR.Case) {
			ShellIR.Case caseNode = (ShellIR.Case) node;
			value(caseNode.getScrutinee(), function);
			for (ShellIR.CaseArm arm : caseNode.getArms()) {
				node(arm.getBody(), function);
			}
		} else if (node instanceof ShellIR.While) {
			ShellIR.While whileNode = (ShellIR.While) node;
			condition(whileNode.getCondition(), function);
			node(whileNode.getBody(), function);
		} else if (node instanceof ShellIR.For) {
			ShellIR.For forNode = (ShellIR.For) node;
			for (ShellValue item : forNode.getItems()) {
				value(item, function);
			}
			node(forNode.getBody(), function);
		} else if (node instanceof ShellIR.Exit) {
			value(((ShellIR.Exit) node).getCode(), function);
		} else if (node instanceof ShellIR.Function) {
			ShellIR.Function fn = (ShellIR.Function) node;
			node(fn.getBody(), fn.getName());
		}
		// Return, Break and Continue have no children
	}

	private void exec(ShellIR.Exec exec, String function) {
		onExec(exec, function);
		value(exec.getCommand(), function);
		for (ShellValue arg : exec.getArgs()) {
			value(arg, function);
		}
	}

	private void value(ShellValue value, String function) {
		onValue(value, function);
		if (value instanceof ShellValue.Concat) {
			for (ShellValue part : ((ShellValue.Concat) value).getParts()) {
				value(part, function);
			}
		} else if (value instanceof ShellValue.CommandSubst) {
			exec(((ShellValue.CommandSubst) value).getExec(), function);
		} else if (value instanceof ShellValue.Arith) {
			arith(((ShellValue.Arith) value).getExpr(), function);
		}
	}

	private void arith(ArithExpr expr, String function) {
		if (expr instanceof ArithExpr.Operand) {
			value(((ArithExpr.Operand) expr).getValue(), function);
		} else if (expr instanceof ArithExpr.Binary) {
			arith(((ArithExpr.Binary) expr).getLeft(), function);
			arith(((ArithExpr.Binary) expr).getRight(), function);
		} else if (expr instanceof ArithExpr.Negate) {
			arith(((ArithExpr.Negate) expr).getOperand(), function);
		}
	}

	private void condition(ShellCondition condition, String function) {
		if (condition instanceof ShellCondition.Test) {
			for (ShellValue operand : ((ShellCondition.Test) condition).getOperands()) {
				value(operand, function);
			}
		} else if (condition instanceof ShellCondition.Not) {
			condition(((ShellCondition.Not) condition).getOperand(), function);
		} else if (condition instanceof ShellCondition.And) {
			condition(((ShellCondition.And) condition).getLeft(), function);
			condition(((ShellCondition.And) condition).getRight(), function);
		} else if (condition instanceof ShellCondition.Or) {
			condition(((ShellCondition.Or) condition).getLeft(), function);
			condition(((ShellCondition.Or) condition).getRight(), function);
		} else if (condition instanceof ShellCondition.Status) {
			exec(((ShellCondition.Status) condition).getExec(), function);
		}
	}
}
