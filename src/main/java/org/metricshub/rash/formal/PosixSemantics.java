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
import java.util.regex.Pattern;

/**
 * A minimal POSIX shell interpreter over an {@link AbstractState}.
 * <p>
 * It reads words made of bare characters, single-quoted and double-quoted
 * text and backslash escapes, separated by blanks, commands separated by
 * <code>;</code> or newlines, and skips comments. It runs assignments,
 * <code>export</code>, <code>echo</code>, <code>mkdir [-p]</code>,
 * <code>touch</code>, <code>cd</code>, <code>true</code> and <code>:</code>;
 * any other command name leaves the state unchanged. Expansions, pipes,
 * redirections, subshells and globs are outside of what it models and raise
 * an {@link EvalException}.
 */
public final class PosixSemantics {

	private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private static final String UNSUPPORTED = "$`|&<>()*?";

	private PosixSemantics() {}

	/**
	 * Runs a script.
	 *
	 * @param script the shell text
	 * @param initial the initial state, left untouched
	 * @return the final state
	 * @throws EvalException when the script leaves the modeled fragment or a command fails
	 */
	public static AbstractState eval(String script, AbstractState initial) {
		return eval(script, initial, null);
	}

	/**
	 * Runs a script, recording one line per executed command.
	 *
	 * @param script the shell text
	 * @param initial the initial state, left untouched
	 * @param trace where the steps are appended, may be <code>null</code>
	 * @return the final state
	 * @throws EvalException when the script leaves the modeled fragment or a command fails
	 */
	public static AbstractState eval(String script, AbstractState initial, List<String> trace) {
		AbstractState state = initial.copy();
		for (List<Word> command : parse(script)) {
			String step = run(command, state);
			if (trace != null) {
				trace.add(step);
			}
		}
		return state;
	}

	/**
	 * A word after quote removal. <code>assignment</code> is the position of
	 * the unquoted <code>=</code> following a valid name, or -1.
	 */
	private static final class Word {
		private final StringBuilder text = new StringBuilder();
		private boolean quoted;
		private int assignment = -1;

		private boolean isAssignment() {
			return assignment > 0;
		}

		private String name() {
			return text.substring(0, assignment);
		}

		private String value() {
			return text.substring(assignment + 1);
		}

		@Override
		public String toString() {
			return text.toString();
		}
	}

	// CHECKSTYLE.OFF: CyclomaticComplexity
	private static List<List<Word>> parse(String script) {
		List<List<Word>> commands = new ArrayList<List<Word>>();
		List<Word> command = new ArrayList<Word>();
		Word word = null;
		int length = script.length();
		int i = 0;
		while (i < length) {
			char c = script.charAt(i);
			if (c == '#' && word == null) {
				while (i < length && script.charAt(i) != '\n') {
					i++;
				}
				continue;
			}
			if (c == ' ' || c == '\t' || c == '\n' || c == ';') {
				if (word != null) {
					command.add(word);
					word = null;
				}
				if ((c == '\n' || c == ';') && !command.isEmpty()) {
					commands.add(command);
					command = new ArrayList<Word>();
				}
				i++;
				continue;
			}
			if (word == null) {
				word = new Word();
			}
			if (c == '\'') {
				int close = script.indexOf('\'', i + 1);
				if (close < 0) {
					throw new EvalException("Unterminated single quote");
				}
				word.text.append(script, i + 1, close);
				word.quoted = true;
				i = close + 1;
			} else if (c == '"') {
				i = readDoubleQuoted(script, i + 1, word);
			} else if (c == '\\') {
				if (i + 1 >= length) {
					throw new EvalException("Backslash at end of script");
				}
				if (script.charAt(i + 1) != '\n') {
					word.text.append(script.charAt(i + 1));
					word.quoted = true;
				}
				i += 2;
			} else if (UNSUPPORTED.indexOf(c) >= 0) {
				throw new EvalException("Unsupported shell syntax '" + c + "'");
			} else {
				if (c == '=' && !word.quoted && word.assignment < 0 && NAME.matcher(word.text).matches()) {
					word.assignment = word.text.length();
				}
				word.text.append(c);
				i++;
			}
		}
		if (word != null) {
			command.add(word);
		}
		if (!command.isEmpty()) {
			commands.add(command);
		}
		return commands;
	}
	// CHECKSTYLE.ON: CyclomaticComplexity

	/**
	 * @return the position after the closing quote
	 */
	private static int readDoubleQuoted(String script, int start, Word word) {
		word.quoted = true;
		int i = start;
		while (i < script.length()) {
			char c = script.charAt(i);
			if (c == '"') {
				return i + 1;
			}
			if (c == '\\' && i + 1 < script.length()) {
				char next = script.charAt(i + 1);
				if (next == '$' || next == '`' || next == '"' || next == '\\') {
					word.text.append(next);
				} else if (next != '\n') {
					word.text.append(c).append(next);
				}
				i += 2;
				continue;
			}
			if (c == '$' || c == '`') {
				throw new EvalException("Unsupported expansion in double quotes");
			}
			word.text.append(c);
			i++;
		}
		throw new EvalException("Unterminated double quote");
	}

	private static String run(List<Word> command, AbstractState state) {
		int first = 0;
		while (first < command.size() && command.get(first).isAssignment()) {
			first++;
		}
		if (first == command.size()) {
			StringBuilder step = new StringBuilder();
			for (Word assignment : command) {
				state.setVariable(assignment.name(), assignment.value());
				step.append(step.length() == 0 ? "" : " ").append(assignment);
			}
			return step.toString();
		}
		if (first > 0) {
			throw new EvalException("Assignments before a command are not supported");
		}
		String name = command.get(0).toString();
		List<String> args = new ArrayList<String>();
		for (Word arg : command.subList(1, command.size())) {
			args.add(arg.toString());
		}
		String step = name + (args.isEmpty() ? "" : " " + String.join(" ", args));
		if ("export".equals(name)) {
			export(command.subList(1, command.size()), state);
		} else if ("echo".equals(name)) {
			state.writeStdout(String.join(" ", args));
		} else if ("mkdir".equals(name)) {
			mkdir(args, state);
		} else if ("touch".equals(name)) {
			if (args.isEmpty()) {
				throw new EvalException("touch: missing file operand");
			}
			for (String path : args) {
				state.touch(path);
			}
		} else if ("cd".equals(name)) {
			if (args.size() != 1) {
				throw new EvalException("cd takes exactly one directory");
			}
			state.changeDirectory(args.get(0));
		} else if (!"true".equals(name) && !":".equals(name)) {
			return step + " (not modeled)";
		}
		return step;
	}

	private static void export(List<Word> operands, AbstractState state) {
		for (Word operand : operands) {
			if (operand.isAssignment()) {
				state.setVariable(operand.name(), operand.value());
			} else if (!NAME.matcher(operand.text).matches()) {
				throw new EvalException("export: '" + operand + "': not a valid identifier");
			}
		}
	}

	private static void mkdir(List<String> args, AbstractState state) {
		boolean parents = false;
		int operands = 0;
		for (String arg : args) {
			if (arg.equals("-p")) {
				parents = true;
			} else if (arg.startsWith("-")) {
				throw new EvalException("mkdir: invalid option '" + arg + "'");
			}
		}
		for (String arg : args) {
			if (!arg.startsWith("-")) {
				state.createDirectory(arg, parents);
				operands++;
			}
		}
		if (operands == 0) {
			throw new EvalException("mkdir: missing operand");
		}
	}
}
