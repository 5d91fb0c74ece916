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

import org.metricshub.rash.backend.ShellEscaper;
import org.metricshub.rash.intermediate.EffectSet;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;

/**
 * Turns a {@link TinyAst} into shell text, one command per line, quoting
 * every word with the {@link ShellEscaper} the real emitter uses.
 */
public final class FormalEmitter {

	private FormalEmitter() {}

	/**
	 * @param ast a valid program
	 * @return the shell text
	 * @throws EvalException when the program is not valid
	 */
	public static String emit(TinyAst ast) {
		if (!ast.isValid()) {
			throw new EvalException("Invalid program: " + ast);
		}
		final StringBuilder sb = new StringBuilder();
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
				String name = ShellEscaper.checkName(node.getName());
				sb.append(name).append('=').append(ShellEscaper.escape(ShellValue.literal(node.getValue()))).append('\n');
				sb.append("export ").append(name).append('\n');
				return null;
			}

			@Override
			public Void visitExecuteCommand(TinyAst.ExecuteCommand node) {
				ShellValue[] args = new ShellValue[node.getArgs().size()];
				for (int i = 0; i < args.length; i++) {
					args[i] = ShellValue.literal(node.getArgs().get(i));
				}
				sb.append(ShellEscaper.renderCommand(ShellIR.Exec.of(node.getCommandName(), EffectSet.pure(), args))).append('\n');
				return null;
			}

			@Override
			public Void visitChangeDirectory(TinyAst.ChangeDirectory node) {
				sb.append("cd ").append(ShellEscaper.escape(ShellValue.literal(node.getPath()))).append('\n');
				return null;
			}
		});
		return sb.toString();
	}
}
