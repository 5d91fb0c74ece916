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
import java.util.Set;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;

/**
 * Rejects sources of output that differ between two runs on the same input:
 * random and clock variables, the current date, temporary names, shuffles
 * and directory listings whose order is unspecified.
 */
public class DeterminismCheck implements VerificationCheck {

	public static final String NAME = "deterministic";

	private static final Set<String> VOLATILE_VARIABLES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"RANDOM", "SRANDOM", "SECONDS", "EPOCHSECONDS", "EPOCHREALTIME", "BASHPID")));

	private static final Set<String> RANDOM_COMMANDS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList("mktemp", "shuf", "uuidgen")));

	private static final Set<String> LISTING_COMMANDS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList("ls", "find")));

	private static final String[] RANDOM_DEVICES = { "/dev/random", "/dev/urandom" };

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public VerificationLevel getMinimumLevel() {
		return VerificationLevel.STRICT;
	}

	@Override
	public void check(ShellIR ir) {
		final TaintAnalysis taint = new TaintAnalysis(ir);
		new IrWalker() {

			@Override
			protected void onValue(ShellValue value, String function) {
				String name = null;
				if (value instanceof ShellValue.EnvRef) {
					name = ((ShellValue.EnvRef) value).getName();
				} else if (value instanceof ShellValue.VarRef) {
					name = ((ShellValue.VarRef) value).getName();
				}
				if (name != null && VOLATILE_VARIABLES.contains(name)) {
					throw new VerificationException(NAME, "$" + name + " differs between runs", currentStatementText());
				}
			}

			@Override
			protected void onExec(ShellIR.Exec exec, String function) {
				String name = exec.getCommandName();
				if ("date".equals(name) && !hasTaintedArgument(exec, function)) {
					throw failure("date without an input-derived argument", exec);
				}
				if (RANDOM_COMMANDS.contains(name)) {
					throw failure(name + " produces a different result on each run", exec);
				}
				if (LISTING_COMMANDS.contains(name)) {
					throw failure(name + " lists entries in an unspecified order", exec);
				}
				for (ShellValue arg : exec.getArgs()) {
					if (arg instanceof ShellValue.Literal) {
						String text = ((ShellValue.Literal) arg).getText();
						for (String device : RANDOM_DEVICES) {
							if (text.contains(device)) {
								throw failure("read of " + device, exec);
							}
						}
					}
				}
			}

			private boolean hasTaintedArgument(ShellIR.Exec exec, String function) {
				for (ShellValue arg : exec.getArgs()) {
					if (taint.isTainted(arg, function)) {
						return true;
					}
				}
				return false;
			}
		}.walk(ir);
	}

	private static VerificationException failure(String message, ShellIR.Exec exec) {
		return new VerificationException(NAME, message, IrWalker.firstLine(exec));
	}
}
