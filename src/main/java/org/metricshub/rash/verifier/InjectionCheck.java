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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;

/**
 * Rejects programs where external text could be run as shell code: as the
 * name of a command, as the argument of <code>eval</code>, <code>source</code>
 * or <code>.</code>, as the script of <code>sh -c</code>, or inside an
 * arithmetic expansion, which shells evaluate recursively.
 */
public class InjectionCheck implements VerificationCheck {

	public static final String NAME = "no_command_injection";

	private static final Set<String> EVALUATORS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList("eval", "source", ".")));

	private static final Set<String> SHELLS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList("sh", "bash", "dash", "ash", "ksh", "zsh")));

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public VerificationLevel getMinimumLevel() {
		return VerificationLevel.BASIC;
	}

	@Override
	public void check(ShellIR ir) {
		final TaintAnalysis taint = new TaintAnalysis(ir);
		new IrWalker() {

			@Override
			protected void onExec(ShellIR.Exec exec, String function) {
				if (taint.isTainted(exec.getCommand(), function)) {
					throw failure("external value used as command name", exec);
				}
				String name = exec.getCommandName();
				if (name == null) {
					return;
				}
				List<ShellValue> args = exec.getArgs();
				if (EVALUATORS.contains(name)) {
					for (ShellValue arg : args) {
						if (taint.isTainted(arg, function)) {
							throw failure("external value passed to " + name, exec);
						}
					}
				} else if (SHELLS.contains(name)) {
					for (int i = 0; i + 1 < args.size(); i++) {
						if (args.get(i).equals(ShellValue.literal("-c")) && taint.isTainted(args.get(i + 1), function)) {
							throw failure("external value passed to " + name + " -c", exec);
						}
					}
				}
			}

			@Override
			protected void onValue(ShellValue value, String function) {
				if (value instanceof ShellValue.Arith && taint.isTainted(((ShellValue.Arith) value).getExpr(), function)) {
					throw new VerificationException(NAME, "external value inside arithmetic expansion", currentStatementText());
				}
			}
		}.walk(ir);
	}

	private static VerificationException failure(String message, ShellIR.Exec exec) {
		return new VerificationException(NAME, message, IrWalker.firstLine(exec));
	}
}
