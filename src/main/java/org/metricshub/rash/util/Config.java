package org.metricshub.rash.util;

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

import org.metricshub.rash.verifier.VerificationLevel;

/**
 * A simple container for the parameters of a single transpilation.
 * <p>
 * Every field has a sensible default, so a freshly constructed
 * <code>Config</code> can be handed over to the transpiler as is.
 * The command line interface fills it from its arguments; embedders set
 * the fields programmatically.
 */
public class Config {

	/**
	 * Default cap on the nesting depth of the accepted syntax tree.
	 */
	public static final int DEFAULT_MAX_NESTING_DEPTH = 100;

	/**
	 * Shell dialect targeted by the emitter.
	 */
	private ShellDialect target = ShellDialect.POSIX;

	/**
	 * Verification tier run over the IR before emission.
	 */
	private VerificationLevel verify = VerificationLevel.STRICT;

	/**
	 * Whether the formal oracle report is produced.
	 */
	private boolean emitProof = false;

	/**
	 * Whether the IR optimizer runs.
	 */
	private boolean optimize = true;

	/**
	 * Maximum nesting depth accepted by the restrictor.
	 */
	private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

	/**
	 * Provides a description of the settings, one per line.
	 *
	 * @return the description
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("target = ").append(getTarget()).append(newLine);
		desc.append("verify = ").append(getVerify()).append(newLine);
		desc.append("emitProof = ").append(isEmitProof()).append(newLine);
		desc.append("optimize = ").append(isOptimize()).append(newLine);
		desc.append("maxNestingDepth = ").append(getMaxNestingDepth()).append(newLine);

		return desc.toString();
	}

	/**
	 * Shell dialect targeted by the emitter.
	 * By default, this is {@link ShellDialect#POSIX}.
	 *
	 * @return the target
	 */
	public ShellDialect getTarget() {
		return target;
	}

	/**
	 * @param target the target to set
	 */
	public void setTarget(ShellDialect target) {
		if (target == null) {
			throw new IllegalArgumentException("target must not be null");
		}
		this.target = target;
	}

	/**
	 * Verification tier run before emission.
	 * By default, this is {@link VerificationLevel#STRICT}.
	 *
	 * @return the verify
	 */
	public VerificationLevel getVerify() {
		return verify;
	}

	/**
	 * @param verify the verify to set
	 */
	public void setVerify(VerificationLevel verify) {
		if (verify == null) {
			throw new IllegalArgumentException("verify must not be null");
		}
		this.verify = verify;
	}

	/**
	 * @return the emitProof
	 */
	public boolean isEmitProof() {
		return emitProof;
	}

	/**
	 * @param emitProof the emitProof to set
	 */
	public void setEmitProof(boolean emitProof) {
		this.emitProof = emitProof;
	}

	/**
	 * @return the optimize
	 */
	public boolean isOptimize() {
		return optimize;
	}

	/**
	 * @param optimize the optimize to set
	 */
	public void setOptimize(boolean optimize) {
		this.optimize = optimize;
	}

	/**
	 * @return the maxNestingDepth
	 */
	public int getMaxNestingDepth() {
		return maxNestingDepth;
	}

	/**
	 * @param maxNestingDepth the maxNestingDepth to set, at least 1
	 */
	public void setMaxNestingDepth(int maxNestingDepth) {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
		}
		this.maxNestingDepth = maxNestingDepth;
	}
}
