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

import org.metricshub.rash.intermediate.ShellCondition;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;

/**
 * Rejects <code>while</code> loops that have no visible way out: a loop
 * passes when its body can reach a <code>break</code> of its own, an
 * <code>exit</code> or a <code>return</code>, or when its condition is a
 * numeric test on a variable the body re-assigns arithmetically.
 */
public class ResourceSafetyCheck implements VerificationCheck {

	public static final String NAME = "resource_safety";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public VerificationLevel getMinimumLevel() {
		return VerificationLevel.PARANOID;
	}

	@Override
	public void check(ShellIR ir) {
		new IrWalker() {

			@Override
			protected void onNode(ShellIR node, String function) {
				if (node instanceof ShellIR.While) {
					ShellIR.While loop = (ShellIR.While) node;
					if (!hasExit(loop.getBody(), false) && !isCounterBound(loop)) {
						throw new VerificationException(NAME, "loop has no reachable break and no counter bound", firstLine(loop));
					}
				}
			}
		}.walk(ir);
	}

	/**
	 * @param nested <code>true</code> inside a loop nested in the one being checked
	 */
	private static boolean hasExit(ShellIR node, boolean nested) {
		if (node instanceof ShellIR.Break) {
			return !nested;
		}
		if (node instanceof ShellIR.Exit || node instanceof ShellIR.Return) {
			return true;
		}
		if (node instanceof ShellIR.Sequence) {
			for (ShellIR item : ((ShellIR.Sequence) node).getItems()) {
				if (hasExit(item, nested)) {
					return true;
				}
			}
			return false;
		}
		if (node instanceof ShellIR.If) {
			ShellIR.If ifNode = (ShellIR.If) node;
			return hasExit(ifNode.getThenBranch(), nested)
					|| ifNode.getElseBranch() != null && hasExit(ifNode.getElseBranch(), nested);
		}
		if (node instanceof ShellIR.Case) {
			for (ShellIR.CaseArm arm : ((ShellIR.Case) node).getArms()) {
				if (hasExit(arm.getBody(), nested)) {
					return true;
				}
			}
			return false;
		}
		if (node instanceof ShellIR.While) {
			return hasExit(((ShellIR.While) node).getBody(), true);
		}
		if (node instanceof ShellIR.For) {
			return hasExit(((ShellIR.For) node).getBody(), true);
		}
		return false;
	}

	private static boolean isCounterBound(ShellIR.While loop) {
		return boundsCounter(loop.getCondition(), loop.getBody());
	}

	private static boolean boundsCounter(ShellCondition condition, ShellIR body) {
		if (condition instanceof ShellCondition.And) {
			ShellCondition.And and = (ShellCondition.And) condition;
			return boundsCounter(and.getLeft(), body) || boundsCounter(and.getRight(), body);
		}
		if (!(condition instanceof ShellCondition.Test)) {
			return false;
		}
		ShellCondition.Test test = (ShellCondition.Test) condition;
		if (!test.isNumeric()) {
			return false;
		}
		for (ShellValue operand : test.getOperands()) {
			if (operand instanceof ShellValue.VarRef && reassignsArithmetically(body, ((ShellValue.VarRef) operand).getName())) {
				return true;
			}
		}
		return false;
	}

	private static boolean reassignsArithmetically(ShellIR node, String name) {
		if (node instanceof ShellIR.Let) {
			ShellIR.Let let = (ShellIR.Let) node;
			return let.getName().equals(name) && let.getValue() instanceof ShellValue.Arith;
		}
		if (node instanceof ShellIR.Sequence) {
			for (ShellIR item : ((ShellIR.Sequence) node).getItems()) {
				if (reassignsArithmetically(item, name)) {
					return true;
				}
			}
			return false;
		}
		if (node instanceof ShellIR.If) {
			ShellIR.If ifNode = (ShellIR.If) node;
			return reassignsArithmetically(ifNode.getThenBranch(), name)
					|| ifNode.getElseBranch() != null && reassignsArithmetically(ifNode.getElseBranch(), name);
		}
		if (node instanceof ShellIR.Case) {
			for (ShellIR.CaseArm arm : ((ShellIR.Case) node).getArms()) {
				if (reassignsArithmetically(arm.getBody(), name)) {
					return true;
				}
			}
		}
		return false;
	}
}
