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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.metricshub.rash.intermediate.ArithExpr;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;

/**
 * Renders values as shell words. This is the only place where text coming
 * from the program is turned into shell source.
 * <p>
 * Literal text is single-quoted, a quote inside becoming <code>'\''</code>.
 * Values holding expansions (variables, command substitutions, arithmetic)
 * are double-quoted, their literal parts having <code>\</code>,
 * <code>"</code>, <code>$</code> and the backquote escaped with a backslash,
 * so the only expansions performed are the ones the IR asked for.
 */
public final class ShellEscaper {

	private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private static final Pattern PLAIN_WORD = Pattern.compile("[A-Za-z0-9_/][A-Za-z0-9_./:@%+,=-]*");

	private static final Set<String> RESERVED_WORDS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"if", "then", "else", "elif", "fi", "do", "done", "case", "esac", "while", "until", "for", "in", "function",
			"select", "time", "!", "{", "}", "[[", "]]")));

	private ShellEscaper() {}

	/**
	 * Renders a value as one shell word.
	 *
	 * @param value the value
	 * @return the quoted word
	 * @throws EmissionException when the value holds a NUL character or an invalid name
	 */
	public static String escape(ShellValue value) {
		String literal = literalText(value);
		if (literal != null) {
			return quote(literal);
		}
		return "\"" + value.accept(DOUBLE_QUOTED) + "\"";
	}

	/**
	 * Renders the command word of a command. A plain literal word is left
	 * bare; anything else is escaped like an argument.
	 *
	 * @param command the command word
	 * @return the rendered word
	 */
	public static String escapeCommand(ShellValue command) {
		if (command instanceof ShellValue.Literal) {
			String text = ((ShellValue.Literal) command).getText();
			if (PLAIN_WORD.matcher(text).matches() && !RESERVED_WORDS.contains(text) && text.indexOf('=') < 0) {
				return text;
			}
		}
		return escape(command);
	}

	/**
	 * Single-quotes a literal text.
	 *
	 * @param text the text
	 * @return the quoted word
	 */
	public static String quote(String text) {
		checkNoNul(text);
		return "'" + text.replace("'", "'\\''") + "'";
	}

	/**
	 * Renders the pattern list of a <code>case</code> arm. Each word is
	 * single-quoted, so it matches itself only; an empty list is the
	 * catch-all <code>*</code>.
	 *
	 * @param patterns the literal words
	 * @return the pattern list, without the closing parenthesis
	 */
	public static String casePatterns(List<String> patterns) {
		if (patterns.isEmpty()) {
			return "*";
		}
		StringBuilder sb = new StringBuilder();
		for (String pattern : patterns) {
			if (sb.length() > 0) {
				sb.append(" | ");
			}
			sb.append(quote(pattern));
		}
		return sb.toString();
	}

	/**
	 * Renders a command and its arguments.
	 *
	 * @param exec the command
	 * @return the command line
	 */
	public static String renderCommand(ShellIR.Exec exec) {
		StringBuilder sb = new StringBuilder(escapeCommand(exec.getCommand()));
		for (ShellValue arg : exec.getArgs()) {
			sb.append(' ').append(escape(arg));
		}
		return sb.toString();
	}

	/**
	 * Renders the inside of an arithmetic expansion.
	 *
	 * @param expr the expression
	 * @return the expression text, without the surrounding <code>$((</code> and <code>))</code>
	 */
	public static String renderArith(ArithExpr expr) {
		return expr.accept(ARITH);
	}

	/**
	 * Checks that a name can be used as a shell variable or function name.
	 *
	 * @param name the name
	 * @return the name
	 * @throws EmissionException when it cannot
	 */
	public static String checkName(String name) {
		if (!NAME.matcher(name).matches()) {
			throw new EmissionException("Invalid shell identifier '" + name.replace('\0', '?') + "'");
		}
		return name;
	}

	private static void checkNoNul(String text) {
		if (text.indexOf('\0') >= 0) {
			throw new EmissionException("Shell values cannot contain a NUL character");
		}
	}

	/**
	 * @return the text of a value made of literals only, or <code>null</code>
	 */
	private static String literalText(ShellValue value) {
		if (value instanceof ShellValue.Literal) {
			return ((ShellValue.Literal) value).getText();
		}
		if (value instanceof ShellValue.Concat) {
			StringBuilder sb = new StringBuilder();
			for (ShellValue part : ((ShellValue.Concat) value).getParts()) {
				String text = literalText(part);
				if (text == null) {
					return null;
				}
				sb.append(text);
			}
			return sb.toString();
		}
		return null;
	}

	private static String escapeDoubleQuoted(String text) {
		checkNoNul(text);
		StringBuilder sb = new StringBuilder(text.length() + 8);
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\\' || c == '"' || c == '$' || c == '`') {
				sb.append('\\');
			}
			sb.append(c);
		}
		return sb.toString();
	}

	private static final ShellValue.Visitor<String> DOUBLE_QUOTED = new ShellValue.Visitor<String>() {

		@Override
		public String visitLiteral(ShellValue.Literal value) {
			return escapeDoubleQuoted(value.getText());
		}

		@Override
		public String visitVarRef(ShellValue.VarRef value) {
			return "${" + checkName(value.getName()) + "}";
		}

		@Override
		public String visitConcat(ShellValue.Concat value) {
			StringBuilder sb = new StringBuilder();
			for (ShellValue part : value.getParts()) {
				sb.append(part.accept(this));
			}
			return sb.toString();
		}

		@Override
		public String visitCommandSubst(ShellValue.CommandSubst value) {
			return "$(" + renderCommand(value.getExec()) + ")";
		}

		@Override
		public String visitArith(ShellValue.Arith value) {
			return "$((" + renderArith(value.getExpr()) + "))";
		}

		@Override
		public String visitEnvRef(ShellValue.EnvRef value) {
			return "${" + checkName(value.getName()) + (value.isAllowUnset() ? ":-}" : "}");
		}

		@Override
		public String visitArgRef(ShellValue.ArgRef value) {
			if (value.getPosition() < 1) {
				throw new EmissionException("Invalid positional parameter " + value.getPosition());
			}
			return "${" + value.getPosition() + "}";
		}

		@Override
		public String visitLength(ShellValue.Length value) {
			return "${#" + checkName(value.getName()) + "}";
		}
	};

	private static final ArithExpr.Visitor<String> ARITH = new ArithExpr.Visitor<String>() {

		@Override
		public String visitNumber(ArithExpr.Number expr) {
			return expr.getValue() < 0 ? "(" + expr.getValue() + ")" : Long.toString(expr.getValue());
		}

		@Override
		public String visitOperand(ArithExpr.Operand expr) {
			if (!(expr.getValue() instanceof ShellValue.VarRef)) {
				throw new EmissionException("Arithmetic operands must be variables, found " + expr.getValue());
			}
			return checkName(((ShellValue.VarRef) expr.getValue()).getName());
		}

		@Override
		public String visitBinary(ArithExpr.Binary expr) {
			return operand(expr.getLeft()) + " " + expr.getOp().getSymbol() + " " + operand(expr.getRight());
		}

		@Override
		public String visitNegate(ArithExpr.Negate expr) {
			ArithExpr operand = expr.getOperand();
			boolean simple = operand instanceof ArithExpr.Operand
					|| operand instanceof ArithExpr.Number && ((ArithExpr.Number) operand).getValue() >= 0;
			return simple ? "-" + operand.accept(this) : "-(" + operand.accept(this) + ")";
		}

		private String operand(ArithExpr operand) {
			String text = operand.accept(this);
			return operand instanceof ArithExpr.Binary ? "(" + text + ")" : text;
		}
	};
}
