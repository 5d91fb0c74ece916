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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.util.RashLogger;
import org.slf4j.Logger;

/**
 * Runs the verification checks of a level over shell IR, in a fixed order,
 * stopping at the first failure.
 */
public final class Verifier {

	private static final Logger LOG = RashLogger.getLogger(Verifier.class);

	private static final List<VerificationCheck> CHECKS = Collections.unmodifiableList(Arrays.<VerificationCheck>asList(
			new InjectionCheck(),
			new DeterminismCheck(),
			new IdempotencyCheck(),
			new ResourceSafetyCheck()));

	private Verifier() {}

	/**
	 * @return every registered check, in running order
	 */
	public static List<VerificationCheck> getChecks() {
		return CHECKS;
	}

	/**
	 * @param level a verification level
	 * @return the checks that level runs, in running order
	 */
	public static List<VerificationCheck> checksFor(VerificationLevel level) {
		List<VerificationCheck> selected = new ArrayList<VerificationCheck>();
		if (level == VerificationLevel.NONE) {
			return selected;
		}
		for (VerificationCheck check : CHECKS) {
			if (level.includes(check.getMinimumLevel())) {
				selected.add(check);
			}
		}
		return selected;
	}

	/**
	 * Verifies a program.
	 *
	 * @param ir the program
	 * @param level the level to verify at
	 * @throws VerificationException on the first failed check
	 */
	public static void verify(ShellIR ir, VerificationLevel level) {
		for (VerificationCheck check : checksFor(level)) {
			LOG.debug("Running check {}", check.getName());
			check.check(ir);
		}
	}
}
