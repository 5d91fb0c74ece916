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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out the SLF4J loggers of the transpiler phases. The parser, the
 * restrictor, the IR lowering and optimizer, the verifier, the emitter and
 * the proof inspector each get theirs here, named after their class, so one
 * logging configuration covers a whole <code>rash build</code> run.
 * <p>
 * SLF4J's own start-up notices are limited to warnings: a run reports what
 * the phases log and nothing about the logging backend being picked.
 */
public final class RashLogger {
	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	private RashLogger() {}

	/**
	 * @param phase the class of the phase, used as the logger name
	 * @return the logger of that phase
	 */
	public static Logger getLogger(Class<?> phase) {
		return LoggerFactory.getLogger(phase);
	}
}
