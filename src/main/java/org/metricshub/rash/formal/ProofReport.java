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

import java.util.Collections;
import java.util.List;

/**
 * Outcome of checking one program against the formal semantics: the shell
 * text produced for it, the final states of both evaluators, what each of
 * them did step by step, and the verdict.
 */
public class ProofReport {

	/**
	 * Verdict of a proof.
	 */
	public enum Verdict {
		/** Both evaluators reached equivalent states. */
		PASS,
		/** The final states differ. */
		FAIL,
		/** One of the evaluators could not run the program. */
		ERROR,
		/** The program could not be projected to the formal instruction set. */
		SKIPPED
	}

	private final Verdict verdict;
	private final StateField divergence;
	private final String message;
	private final String emittedCode;
	private final AbstractState rashState;
	private final AbstractState posixState;
	private final List<String> rashTrace;
	private final List<String> posixTrace;

	// CHECKSTYLE.OFF: ParameterNumber
	ProofReport(
			Verdict verdict,
			StateField divergence,
			String message,
			String emittedCode,
			AbstractState rashState,
			AbstractState posixState,
			List<String> rashTrace,
			List<String> posixTrace) {
		this.verdict = verdict;
		this.divergence = divergence;
		this.message = message;
		this.emittedCode = emittedCode;
		this.rashState = rashState;
		this.posixState = posixState;
		this.rashTrace = Collections.unmodifiableList(rashTrace);
		this.posixTrace = Collections.unmodifiableList(posixTrace);
	}
	// CHECKSTYLE.ON: ParameterNumber

	/**
	 * @param reason why no proof was attempted
	 * @return a report with the {@link Verdict#SKIPPED} verdict
	 */
	public static ProofReport skipped(String reason) {
		return new ProofReport(
				Verdict.SKIPPED,
				null,
				reason,
				null,
				null,
				null,
				Collections.<String>emptyList(),
				Collections.<String>emptyList());
	}

	public Verdict getVerdict() {
		return verdict;
	}

	public boolean isPassed() {
		return verdict == Verdict.PASS;
	}

	/**
	 * @return the first diverging field of a failed proof, <code>null</code> otherwise
	 */
	public StateField getDivergence() {
		return divergence;
	}

	/**
	 * @return the error or skip reason, <code>null</code> otherwise
	 */
	public String getMessage() {
		return message;
	}

	public String getEmittedCode() {
		return emittedCode;
	}

	public AbstractState getRashState() {
		return rashState;
	}

	public AbstractState getPosixState() {
		return posixState;
	}

	public List<String> getRashTrace() {
		return rashTrace;
	}

	public List<String> getPosixTrace() {
		return posixTrace;
	}

	/**
	 * @return a human readable report
	 */
	public String render() {
		StringBuilder sb = new StringBuilder();
		sb.append("Formal equivalence: ").append(verdict).append('\n');
		if (divergence != null) {
			sb.append("First divergence: ").append(divergence).append('\n');
		}
		if (message != null) {
			sb.append("Reason: ").append(message).append('\n');
		}
		if (emittedCode != null) {
			sb.append("\n== Emitted code ==\n").append(emittedCode);
		}
		appendTrace(sb, "Structured trace", rashTrace);
		appendTrace(sb, "Shell trace", posixTrace);
		if (rashState != null) {
			sb.append("\n== Structured final state ==\n").append(rashState);
		}
		if (posixState != null) {
			sb.append("\n== Shell final state ==\n").append(posixState);
		}
		return sb.toString();
	}

	private static void appendTrace(StringBuilder sb, String title, List<String> trace) {
		if (trace.isEmpty()) {
			return;
		}
		sb.append("\n== ").append(title).append(" ==\n");
		int step = 1;
		for (String line : trace) {
			sb.append(step++).append(". ").append(line).append('\n');
		}
	}

	@Override
	public String toString() {
		return "ProofReport(" + verdict + (divergence == null ? "" : ", " + divergence) + ")";
	}
}
