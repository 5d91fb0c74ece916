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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.metricshub.rash.intermediate.ArithExpr;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;

/**
 * Tracks which variables may hold text the script does not control:
 * environment variables, command-line arguments and the output of external
 * commands. Taint flows through assignments, loop variables, the arguments
 * of shell functions and what those functions print. The analysis iterates
 * over the whole program until nothing new gets tainted.
 */
public class TaintAnalysis {

	private final Set<String> functions = new HashSet<String>();
	private final Set<String> variables = new HashSet<String>();
	private final Map<String, Set<Integer>> parameters = new HashMap<String, Set<Integer>>();
	private final Set<String> outputs = new HashSet<String>();

	/**
	 * <p>
	 * Constructor for TaintAnalysis.
	 * </p>
	 *
	 * @param program the program to analyze
	 */
	public TaintAnalysis(ShellIR program) {
		if (program instanceof ShellIR.Sequence) {
			for (ShellIR item : ((ShellIR.Sequence) program).getItems()) {
				if (item instanceof ShellIR.Function) {
					functions.add(((ShellIR.Function) item).getName());
				}
			}
		}
		boolean changed = true;
		while (changed) {
			Propagation propagation = new Propagation();
			propagation.walk(program);
			changed = propagation.changed;
		}
	}

	/**
	 * @param name a variable name
	 * @return <code>true</code> when the variable may hold untrusted text
	 */
	public boolean isTaintedVariable(String name) {
		return variables.contains(name);
	}

	/**
	 * @param value a value
	 * @param function the enclosing shell function, <code>null</code> for the entry point
	 * @return <code>true</code> when the value may contain untrusted text
	 */
	public boolean isTainted(ShellValue value, String function) {
		if (value instanceof ShellValue.EnvRef) {
			return true;
		}
		if (value instanceof ShellValue.ArgRef) {
			if (function == null) {
				return true;
			}
			Set<Integer> tainted = parameters.get(function);
			return tainted != null && tainted.contains(((ShellValue.ArgRef) value).getPosition());
		}
		if (value instanceof ShellValue.VarRef) {
			return variables.contains(((ShellValue.VarRef) value).getName());
		}
		if (value instanceof ShellValue.Concat) {
			for (ShellValue part : ((ShellValue.Concat) value).getParts()) {
				if (isTainted(part, function)) {
					return true;
				}
			}
			return false;
		}
		if (value instanceof ShellValue.CommandSubst) {
			return isTaintedOutput(((ShellValue.CommandSubst) value).getExec());
		}
		if (value instanceof ShellValue.Arith) {
			return isTainted(((ShellValue.Arith) value).getExpr(), function);
		}
		// literals and lengths
		return false;
	}

	/**
	 * @param expr an arithmetic expression
	 * @param function the enclosing shell function
	 * @return <code>true</code> when one of its operands is tainted
	 */
	public boolean isTainted(ArithExpr expr, String function) {
		if (expr instanceof ArithExpr.Operand) {
			return isTainted(((ArithExpr.Operand) expr).getValue(), function);
		}
		if (expr instanceof ArithExpr.Binary) {
			return isTainted(((ArithExpr.Binary) expr).getLeft(), function)
					|| isTainted(((ArithExpr.Binary) expr).getRight(), function);
		}
		if (expr instanceof ArithExpr.Negate) {
			return isTainted(((ArithExpr.Negate) expr).getOperand(), function);
		}
		return false;
	}

	/**
	 * @param exec a command whose output is captured
	 * @return <code>true</code> when that output may be untrusted
	 */
	public boolean isTaintedOutput(ShellIR.Exec exec) {
		String name = exec.getCommandName();
		if (name != null && functions.contains(name)) {
			return outputs.contains(name);
		}
		return true;
	}

	private class Propagation extends IrWalker {

		private boolean changed;

		@Override
		protected void onNode(ShellIR node, String function) {
			if (node instanceof ShellIR.Let) {
				ShellIR.Let let = (ShellIR.Let) node;
				if (isTainted(let.getValue(), function)) {
					changed |= variables.add(let.getName());
				}
			} else if (node instanceof ShellIR.Capture) {
				ShellIR.Capture capture = (ShellIR.Capture) node;
				if (isTaintedOutput(capture.getExec())) {
					changed |= variables.add(capture.getTarget());
				}
			} else if (node instanceof ShellIR.For) {
				ShellIR.For forNode = (ShellIR.For) node;
				for (ShellValue item : forNode.getItems()) {
					if (isTainted(item, function)) {
						changed |= variables.add(forNode.getVariable());
					}
				}
			} else if (node instanceof ShellIR.Echo && function != null) {
				if (isTainted(((ShellIR.Echo) node).getValue(), function)) {
					changed |= outputs.add(function);
				}
			}
		}

		@Override
		protected void onExec(ShellIR.Exec exec, String function) {
			String name = exec.getCommandName();
			if (name == null || !functions.contains(name)) {
				return;
			}
			for (int i = 0; i < exec.getArgs().size(); i++) {
				if (isTainted(exec.getArgs().get(i), function)) {
					Set<Integer> tainted = parameters.get(name);
					if (tainted == null) {
						tainted = new HashSet<Integer>();
						parameters.put(name, tainted);
					}
					changed |= tainted.add(i + 1);
				}
			}
		}
	}
}
