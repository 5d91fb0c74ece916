package org.metricshub.rash;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.metricshub.rash.formal.ProofReport;
import org.metricshub.rash.intermediate.EffectTracker;
import org.metricshub.rash.intermediate.ShellIR;

/**
 * What a transpilation produced: the script, the IR it was emitted from,
 * the effects recorded while lowering and, when requested, the formal
 * equivalence report.
 */
public class TranspileResult {

	private final String script;
	private final ShellIR ir;
	private final EffectTracker effects;
	private final ProofReport proof;

	/**
	 * <p>
	 * Constructor for TranspileResult.
	 * </p>
	 *
	 * @param script the emitted script
	 * @param ir the IR the script was emitted from
	 * @param effects the effects recorded while lowering
	 * @param proof the formal report, or <code>null</code> when not requested
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public TranspileResult(String script, ShellIR ir, EffectTracker effects, ProofReport proof) {
		this.script = script;
		this.ir = ir;
		this.effects = effects;
		this.proof = proof;
	}

	public String getScript() {
		return script;
	}

	public ShellIR getIr() {
		return ir;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public EffectTracker getEffects() {
		return effects;
	}

	/**
	 * @return the formal report, or <code>null</code> when it was not requested
	 */
	public ProofReport getProof() {
		return proof;
	}
}
