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

/**
 * The entry point to Rash for the VM.
 * <p>
 * The main method is a simple call to the command line interface:
 * <blockquote>
 *
 * <pre>
 * System.exit(Cli.execute(args, System.out, System.err));
 * </pre>
 *
 * </blockquote>
 */
public final class Main {

	/**
	 * Prohibit the instantiation of this class.
	 */
	private Main() {}

	/**
	 * @param args Command line arguments to the VM.
	 */
	public static void main(String[] args) {
		System.exit(Cli.execute(args, System.out, System.err));
	}
}
