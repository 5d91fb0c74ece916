package org.metricshub.rash.backend;

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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Last line of defense on an emitted script: checks its overall shape and
 * that every quote, command substitution, parameter expansion and
 * arithmetic expansion opened is closed again.
 */
public final class OutputValidator {

	private static final char DOUBLE_QUOTE = '"';
	private static final char COMMAND = '(';
	private static final char PARAMETER = '{';
	private static final char ARITHMETIC = 'A';
	private static final char ARITHMETIC_GROUP = 'G';

	private OutputValidator() {}

	/**
	 * Validates a complete script.
	 *
	 * @param script the script text
	 * @throws EmissionException describing the first problem found
	 */
	public static void validate(String script) {
		if (!script.startsWith("#!/bin/sh\n")) {
			throw new EmissionException("Generated script does not start with #!/bin/sh");
		}
		if (script.indexOf('\0') >= 0) {
			throw new EmissionException("Generated script contains a NUL character");
		}
		String[] lines = script.split("\n", -1);
		int invocations = 0;
		for (String line : lines) {
			if (line.equals(PosixEmitter.MAIN_INVOCATION)) {
				invocations++;
			}
		}
		if (invocations != 1) {
			throw new EmissionException("Generated script must invoke " + PosixEmitter.MAIN_FUNCTION + " exactly once, found " + invocations);
		}
		if (!script.endsWith("\n" + PosixEmitter.MAIN_INVOCATION + "\n")) {
			throw new EmissionException("Generated script must end with the invocation of " + PosixEmitter.MAIN_FUNCTION);
		}
		checkBalanced(script);
	}

	// CHECKSTYLE.OFF: CyclomaticComplexity
	private static void checkBalanced(String script) {
		Deque<Character> contexts = new ArrayDeque<Character>();
		int line = 1;
		int length = script.length();
		for (int i = 0; i < length; i++) {
			char c = script.charAt(i);
			char next = i + 1 < length ? script.charAt(i + 1) : 0;
			Character context = contexts.peek();
			if (c == '\n') {
				line++;
			}
			if (context != null && (context == ARITHMETIC || context == ARITHMETIC_GROUP)) {
				if (c == '(') {
					contexts.push(ARITHMETIC_GROUP);
				} else if (c == ')' && context == ARITHMETIC_GROUP) {
					contexts.pop();
				} else if (c == ')' && next == ')') {
					contexts.pop();
					i++;
				} else if (c == ')' || c == '\'' || c == '"' || c == '`') {
					throw unbalanced("unexpected " + c + " in arithmetic expansion", line);
				}
				continue;
			}
			if (context != null && context == PARAMETER) {
				if (c == '}') {
					contexts.pop();
				} else if (c == '$' || c == '\'' || c == '"' || c == '`' || c == '\n') {
					throw unbalanced("unexpected " + c + " in parameter expansion", line);
				}
				continue;
			}
			if (c == '\\') {
				if (next == '\n') {
					line++;
				}
				i++;
				continue;
			}
			if (c == '$' && next == '(') {
				if (i + 2 < length && script.charAt(i + 2) == '(') {
					contexts.push(ARITHMETIC);
					i += 2;
				} else {
					contexts.push(COMMAND);
					i++;
				}
				continue;
			}
			if (c == '$' && next == '{') {
				contexts.push(PARAMETER);
				i++;
				continue;
			}
			if (c == '`') {
				throw unbalanced("unescaped backquote", line);
			}
			if (context != null && context == DOUBLE_QUOTE) {
				if (c == '"') {
					contexts.pop();
				}
				continue;
			}
			if (c == '"') {
				contexts.push(DOUBLE_QUOTE);
			} else if (c == '\'') {
				int close = script.indexOf('\'', i + 1);
				if (close < 0) {
					throw unbalanced("unterminated single quote", line);
				}
				for (int j = i + 1; j < close; j++) {
					if (script.charAt(j) == '\n') {
						line++;
					}
				}
				i = close;
			} else if (c == '#' && (i == 0 || Character.isWhitespace(script.charAt(i - 1)))) {
				int end = script.indexOf('\n', i);
				i = (end < 0 ? length : end) - 1;
			} else if (c == ')' && context != null && context == COMMAND) {
				contexts.pop();
			}
		}
		if (!contexts.isEmpty()) {
			throw unbalanced("unterminated " + describe(contexts.peek()), line);
		}
	}
	// CHECKSTYLE.ON: CyclomaticComplexity

	private static String describe(char context) {
		switch (context) {
		case DOUBLE_QUOTE:
			return "double quote";
		case COMMAND:
			return "command substitution";
		case PARAMETER:
			return "parameter expansion";
		default:
			return "arithmetic expansion";
		}
	}

	private static EmissionException unbalanced(String problem, int line) {
		return new EmissionException("Generated script is malformed at line " + line + ": " + problem);
	}
}
