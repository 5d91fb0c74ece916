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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;

/**
 * Rejects commands that fail when the script runs a second time:
 * <code>mkdir</code> without <code>-p</code>, <code>rm</code> without
 * <code>-f</code>, and <code>ln -s</code> without <code>-f</code> unless the
 * same sequence removed the link with <code>rm -f</code> before. The long
 * forms <code>--parents</code>, <code>--force</code> and
 * <code>--symbolic</code> count as their short options.
 */
public class IdempotencyCheck implements VerificationCheck {

	public static final String NAME = "idempotent";

	private static final Map<Character, String> LONG_OPTIONS;

	static {
		Map<Character, String> options = new HashMap<Character, String>();
		options.put('p', "--parents");
		options.put('f', "--force");
		options.put('s', "--symbolic");
		LONG_OPTIONS = Collections.unmodifiableMap(options);
	}

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
		final Set<ShellIR.Exec> guardedLinks = Collections.newSetFromMap(new IdentityHashMap<ShellIR.Exec, Boolean>());
		new IrWalker() {

			@Override
			protected void onNode(ShellIR node, String function) {
				if (!(node instanceof ShellIR.Sequence)) {
					return;
				}
				List<ShellValue> removed = new ArrayList<ShellValue>();
				for (ShellIR item : ((ShellIR.Sequence) node).getItems()) {
					if (!(item instanceof ShellIR.Exec)) {
						continue;
					}
					ShellIR.Exec exec = (ShellIR.Exec) item;
					if ("rm".equals(exec.getCommandName()) && hasFlag(exec, 'f')) {
						removed.addAll(operands(exec));
					} else if ("ln".equals(exec.getCommandName())) {
						List<ShellValue> operands = operands(exec);
						if (!operands.isEmpty() && removed.contains(operands.get(operands.size() - 1))) {
							guardedLinks.add(exec);
						}
					}
				}
			}

			@Override
			protected void onExec(ShellIR.Exec exec, String function) {
				String name = exec.getCommandName();
				if ("mkdir".equals(name) && !hasFlag(exec, 'p')) {
					throw failure("mkdir without -p fails when the directory exists", exec);
				}
				if ("rm".equals(name) && !hasFlag(exec, 'f')) {
					throw failure("rm without -f fails when the file is gone", exec);
				}
				if ("ln".equals(name) && hasFlag(exec, 's') && !hasFlag(exec, 'f') && !guardedLinks.contains(exec)) {
					throw failure("ln -s without -f fails when the link exists", exec);
				}
			}
		}.walk(ir);
	}

	/**
	 * @return <code>true</code> when a literal option argument carries the
	 *         flag, either in a group of short options or as its long form
	 */
	static boolean hasFlag(ShellIR.Exec exec, char flag) {
		String longForm = LONG_OPTIONS.get(flag);
		for (ShellValue arg : exec.getArgs()) {
			if (arg instanceof ShellValue.Literal) {
				String text = ((ShellValue.Literal) arg).getText();
				if (text.equals("--")) {
					return false;
				}
				if (text.startsWith("--")) {
					if (text.equals(longForm)) {
						return true;
					}
				} else if (text.length() > 1 && text.charAt(0) == '-' && text.indexOf(flag) > 0) {
					return true;
				}
			}
		}
		return false;
	}

	private static List<ShellValue> operands(ShellIR.Exec exec) {
		List<ShellValue> operands = new ArrayList<ShellValue>();
		for (ShellValue arg : exec.getArgs()) {
			if (!(arg instanceof ShellValue.Literal) || !((ShellValue.Literal) arg).getText().startsWith("-")) {
				operands.add(arg);
			}
		}
		return operands;
	}

	private static VerificationException failure(String message, ShellIR.Exec exec) {
		return new VerificationException(NAME, message, IrWalker.firstLine(exec));
	}
}
