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

/**
 * Operational semantics of {@link TinyAst}, walking the program structure
 * directly. Kept apart from {@link PosixSemantics} on purpose: the two
 * evaluators must agree without sharing code.
 */
public final class RashSemantics {

	private RashSemantics() {}

	/**
	 * Evaluates a program.
	 *
	 * @param ast the program
	 * @param initial the initial state, left untouched
	 * @return the final state
	 * @throws EvalException when the program is invalid or an operation fails
	 */
	public static AbstractState eval(TinyAst ast, AbstractState initial) {
		return eval(ast, initial, null);
	}

	/**
	 * Evaluates a program, recording one line per executed instruction.
	 *
	 * @param ast the program
	 * @param initial the initial state, left untouched
	 * @param trace where the steps are appended, may be <code>null</code>
	 * @return the final state
	 * @throws EvalException when the program is invalid or an operation fails
	 */
	public static AbstractState eval(TinyAst ast, AbstractState initial, List<String> trace) {
		if (!ast.isValid()) {
			throw new EvalException("Invalid program: " + ast);
		}
		final AbstractState state = initial.copy();
		final List<String> steps = trace == null ? new ArrayList<String>() : trace;
		ast.accept(new TinyAst.Visitor<Void>() {

			@Override
			public Void visitSequence(TinyAst.Sequence node) {
				for (TinyAst command : node.getCommands()) {
					command.accept(this);
				}
				return null;
			}

			@Override
			public Void visitSetEnvironmentVariable(TinyAst.SetEnvironmentVariable node) {
				state.setVariable(node.getName(), node.getValue());
				steps.add("set " + node.getName() + "=" + node.getValue());
				return null;
			}

			@Override
			public Void visitExecuteCommand(TinyAst.ExecuteCommand node) {
				execute(state, node.getCommandName(), node.getArgs());
				steps.add("exec " + node.getCommandName() + " " + node.getArgs());
				return null;
			}

			@Override
			public Void visitChangeDirectory(TinyAst.ChangeDirectory node) {
				state.changeDirectory(node.getPath());
				steps.add("cd " + state.getCwd());
				return null;
			}
		});
		return state;
	}

	private static void execute(AbstractState state, String command, List<String> args) {
		if ("echo".equals(command)) {
			// arguments are separated by one space each, empty ones included
			StringBuilder line = new StringBuilder();
			for (int i = 0; i < args.size(); i++) {
				if (i > 0) {
					line.append(' ');
				}
				line.append(args.get(i));
			}
			state.writeStdout(line.toString());
		} else if ("mkdir".equals(command)) {
			boolean parents = false;
			List<String> paths = new ArrayList<String>();
			for (String arg : args) {
				if ("-p".equals(arg)) {
					parents = true;
				} else if (arg.startsWith("-")) {
					throw new EvalException("mkdir: invalid option '" + arg + "'");
				} else {
					paths.add(arg);
				}
			}
			if (paths.isEmpty()) {
				throw new EvalException("mkdir: missing operand");
			}
			for (String path : paths) {
				state.createDirectory(path, parents);
			}
		} else if ("touch".equals(command)) {
			if (args.isEmpty()) {
				throw new EvalException("touch: missing file operand");
			}
			for (String path : args) {
				state.touch(path);
			}
		}
		// true and test leave the state unchanged
	}
}
