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
import java.util.List;
import org.metricshub.rash.util.RashLogger;
import org.slf4j.Logger;

/**
 * Checks that the shell text emitted for a {@link TinyAst} behaves like the
 * program itself: runs the program with {@link RashSemantics}, its emitted
 * text with {@link PosixSemantics}, from the same initial state, and compares
 * the final states.
 */
public final class ProofInspector {

	private static final Logger LOG = RashLogger.getLogger(ProofInspector.class);

	private ProofInspector() {}

	/**
	 * @param ast the program
	 * @param initial the initial state, left untouched
	 * @return the report
	 */
	public static ProofReport inspect(TinyAst ast, AbstractState initial) {
		List<String> rashTrace = new ArrayList<String>();
		List<String> posixTrace = new ArrayList<String>();
		if (!ast.isValid()) {
			return new ProofReport(ProofReport.Verdict.ERROR, null, "Invalid program: " + ast, null, null, null, rashTrace, posixTrace);
		}
		String code = FormalEmitter.emit(ast);
		AbstractState rashState;
		try {
			rashState = RashSemantics.eval(ast, initial, rashTrace);
		} catch (EvalException e) {
			LOG.debug("Structured evaluation failed", e);
			return new ProofReport(ProofReport.Verdict.ERROR, null, "Structured evaluation failed: " + e.getMessage(), code, null, null, rashTrace, posixTrace);
		}
		AbstractState posixState;
		try {
			posixState = PosixSemantics.eval(code, initial, posixTrace);
		} catch (EvalException e) {
			LOG.debug("Shell evaluation failed", e);
			return new ProofReport(ProofReport.Verdict.ERROR, null, "Shell evaluation failed: " + e.getMessage(), code, rashState, null, rashTrace, posixTrace);
		}
		StateField divergence = rashState.firstDivergence(posixState);
		ProofReport.Verdict verdict = divergence == null ? ProofReport.Verdict.PASS : ProofReport.Verdict.FAIL;
		LOG.debug("Formal equivalence {} after {} steps", verdict, rashTrace.size());
		return new ProofReport(verdict, divergence, null, code, rashState, posixState, rashTrace, posixTrace);
	}
}
