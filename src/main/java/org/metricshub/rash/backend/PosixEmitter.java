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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.rash.intermediate.ShellCondition;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;
import org.metricshub.rash.util.Config;
import org.metricshub.rash.util.RashLogger;
import org.metricshub.rash.util.ShellDialect;
import org.slf4j.Logger;

/**
 * Renders {@link ShellIR} as a POSIX shell script.
 * <p>
 * The script is laid out as: the header (shebang and strict mode), the
 * runtime helpers the program calls, the program's functions, the
 * <code>main</code> function holding the entry point's body, and a single
 * invocation of <code>main</code> at the very end. Every value is rendered
 * by {@link ShellEscaper}.
 * <p>
 * All dialects are rendered as POSIX shell.
 */
public class PosixEmitter {

	private static final Logger LOG = RashLogger.getLogger(PosixEmitter.class);

	/**
	 * Name of the shell function holding the entry point's body.
	 */
	public static final String MAIN_FUNCTION = "main";

	/**
	 * The line invoking the entry point; last line of every script.
	 */
	public static final String MAIN_INVOCATION = MAIN_FUNCTION + " \"$@\"";

	static final String INDENT = "    ";

	private static final Set<String> UNARY_TESTS = new HashSet<String>(Arrays.asList("-e", "-f", "-d", "-z", "-n"));

	private static final Set<String> BINARY_TESTS = new HashSet<String>(
			Arrays.asList("=", "!=", "-eq", "-ne", "-lt", "-le", "-gt", "-ge"));

	private static final String HEADER = "#!/bin/sh\n"
			+ "# Generated by Rash\n"
			+ "set -euf\n"
			+ "IFS=' \t\n'\n"
			+ "export LC_ALL=C\n";

	/**
	 * Emits a complete script with the default configuration.
	 *
	 * @param ir the program
	 * @return the script text
	 */
	public String emit(ShellIR ir) {
		return emit(ir, new Config());
	}

	/**
	 * Emits a complete script.
	 *
	 * @param ir the program, as produced by the lowering
	 * @param config the settings; only the target dialect is used
	 * @return the script text
	 * @throws EmissionException when a node cannot be rendered safely
	 */
	public String emit(ShellIR ir, Config config) {
		if (config.getTarget() != ShellDialect.POSIX) {
			LOG.debug("No specific emission for dialect {}, using POSIX", config.getTarget());
		}
		List<ShellIR.Function> functions = new ArrayList<ShellIR.Function>();
		List<ShellIR> mainBody = new ArrayList<ShellIR>();
		split(ir, functions, mainBody);

		Renderer renderer = new Renderer();
		StringBuilder definitions = new StringBuilder();
		for (ShellIR.Function function : functions) {
			definitions.append('\n');
			renderer.reset(definitions);
			renderer.function(function.getName(), function.getBody());
		}
		StringBuilder main = new StringBuilder();
		renderer.reset(main);
		renderer.function(MAIN_FUNCTION, new ShellIR.Sequence(mainBody));

		StringBuilder script = new StringBuilder(HEADER);
		for (RuntimeHelper helper : RuntimeHelper.values()) {
			if (renderer.helpers.contains(helper)) {
				script.append('\n').append(helper.render(INDENT));
			}
		}
		script.append(definitions);
		script.append('\n').append(main);
		script.append('\n').append(MAIN_INVOCATION).append('\n');
		return script.toString();
	}

	/**
	 * Renders a fragment of IR without header nor prelude, as used in
	 * diagnostics.
	 *
	 * @param fragment the node
	 * @return its shell text, without a trailing newline
	 */
	public static String render(ShellIR fragment) {
		StringBuilder sb = new StringBuilder();
		Renderer renderer = new Renderer();
		renderer.reset(sb);
		fragment.accept(renderer);
		return sb.toString().trim();
	}

	/**
	 * Renders a condition as it would appear after <code>if</code>.
	 *
	 * @param condition the condition
	 * @return its shell text
	 */
	public static String render(ShellCondition condition) {
		return new Renderer().condition(condition);
	}

	/**
	 * Separates the top-level function definitions from the statements of the
	 * entry point.
	 */
	private static void split(ShellIR node, List<ShellIR.Function> functions, List<ShellIR> body) {
		if (node instanceof ShellIR.Sequence) {
			for (ShellIR item : ((ShellIR.Sequence) node).getItems()) {
				split(item, functions, body);
			}
		} else if (node instanceof ShellIR.Function) {
			functions.add((ShellIR.Function) node);
		} else {
			body.add(node);
		}
	}

	/**
	 * Writes statements, one per line, and records the helpers they call.
	 */
	private static final class Renderer implements ShellIR.Visitor<Void> {

		private final Set<RuntimeHelper> helpers = EnumSet.noneOf(RuntimeHelper.class);
		private StringBuilder sb;
		private int depth;

		void reset(StringBuilder target) {
			sb = target;
			depth = 0;
		}

		private void line(String text) {
			for (int i = 0; i < depth; i++) {
				sb.append(INDENT);
			}
			sb.append(text).append('\n');
		}

		private void block(ShellIR body) {
			int before = sb.length();
			depth++;
			body.accept(this);
			if (sb.length() == before) {
				line(":");
			}
			depth--;
		}

		void function(String name, ShellIR body) {
			line(ShellEscaper.checkName(name) + "() {");
			block(body);
			line("}");
		}

		private String helper(RuntimeHelper helper) {
			helpers.add(helper);
			return helper.getFunctionName();
		}

		private String command(ShellIR.Exec exec) {
			if (exec.getCommand() instanceof ShellValue.Literal) {
				RuntimeHelper helper = RuntimeHelper.forCommand(((ShellValue.Literal) exec.getCommand()).getText());
				if (helper != null) {
					helpers.add(helper);
				}
			}
			noteSubstitutions(exec.getArgs());
			return ShellEscaper.renderCommand(exec);
		}

		private String value(ShellValue value) {
			noteSubstitutions(Collections.singletonList(value));
			return ShellEscaper.escape(value);
		}

		/**
		 * Records the helpers called from command substitutions.
		 */
		private void noteSubstitutions(List<ShellValue> values) {
			for (ShellValue value : values) {
				if (value instanceof ShellValue.CommandSubst) {
					command(((ShellValue.CommandSubst) value).getExec());
				} else if (value instanceof ShellValue.Concat) {
					noteSubstitutions(((ShellValue.Concat) value).getParts());
				}
			}
		}

		@Override
		public Void visitSequence(ShellIR.Sequence node) {
			for (ShellIR item : node.getItems()) {
				item.accept(this);
			}
			return null;
		}

		@Override
		public Void visitLet(ShellIR.Let node) {
			String name = ShellEscaper.checkName(node.getName());
			line(name + "=" + value(node.getValue()));
			if (node.isExported()) {
				line("export " + name);
			}
			return null;
		}

		@Override
		public Void visitExec(ShellIR.Exec node) {
			line(command(node));
			return null;
		}

		@Override
		public Void visitCapture(ShellIR.Capture node) {
			line(ShellEscaper.checkName(node.getTarget()) + "=" + value(new ShellValue.CommandSubst(node.getExec())));
			return null;
		}

		@Override
		public Void visitEcho(ShellIR.Echo node) {
			ShellValue value = node.getValue();
			if (value instanceof ShellValue.Literal) {
				String text = ((ShellValue.Literal) value).getText();
				if (text.indexOf('\\') < 0 && !text.startsWith("-")) {
					line("echo " + value(value));
					return null;
				}
			}
			line(helper(RuntimeHelper.PRINTLN) + " " + value(value));
			return null;
		}

		@Override
		public Void visitStderr(ShellIR.Stderr node) {
			line(helper(RuntimeHelper.EPRINTLN) + " " + value(node.getValue()));
			return null;
		}

		@Override
		public Void visitIf(ShellIR.If node) {
			line("if " + condition(node.getCondition()) + "; then");
			block(node.getThenBranch());
			ShellIR elseBranch = node.getElseBranch();
			while (elseBranch instanceof ShellIR.If) {
				ShellIR.If elif = (ShellIR.If) elseBranch;
				line("elif " + condition(elif.getCondition()) + "; then");
				block(elif.getThenBranch());
				elseBranch = elif.getElseBranch();
			}
			if (elseBranch != null) {
				line("else");
				block(elseBranch);
			}
			line("fi");
			return null;
		}

		@Override
		public Void visitCase(ShellIR.Case node) {
			line("case " + value(node.getScrutinee()) + " in");
			depth++;
			for (ShellIR.CaseArm arm : node.getArms()) {
				line(ShellEscaper.casePatterns(arm.getPatterns()) + ")");
				block(arm.getBody());
				depth++;
				line(";;");
				depth--;
			}
			depth--;
			line("esac");
			return null;
		}

		@Override
		public Void visitWhile(ShellIR.While node) {
			line("while " + condition(node.getCondition()) + "; do");
			block(node.getBody());
			line("done");
			return null;
		}

		@Override
		public Void visitFor(ShellIR.For node) {
			StringBuilder header = new StringBuilder("for ").append(ShellEscaper.checkName(node.getVariable())).append(" in");
			for (ShellValue item : node.getItems()) {
				header.append(' ').append(value(item));
			}
			line(header.append("; do").toString());
			block(node.getBody());
			line("done");
			return null;
		}

		@Override
		public Void visitExit(ShellIR.Exit node) {
			ShellValue code = node.getCode();
			if (code instanceof ShellValue.Literal) {
				String text = ((ShellValue.Literal) code).getText();
				int status;
				try {
					status = Integer.parseInt(text);
				} catch (NumberFormatException e) {
					throw new EmissionException("Invalid exit code '" + text + "'");
				}
				if (status < 0 || status > 255) {
					throw new EmissionException("Exit code " + status + " is outside 0..255");
				}
				line("exit " + status);
			} else {
				line("exit " + value(code));
			}
			return null;
		}

		@Override
		public Void visitFunction(ShellIR.Function node) {
			throw new EmissionException("Function '" + node.getName() + "' must be defined at the top level");
		}

		@Override
		public Void visitReturn(ShellIR.Return node) {
			line("return 0");
			return null;
		}

		@Override
		public Void visitBreak(ShellIR.Break node) {
			line("break");
			return null;
		}

		@Override
		public Void visitContinue(ShellIR.Continue node) {
			line("continue");
			return null;
		}

		String condition(ShellCondition condition) {
			return condition.accept(conditions);
		}

		private final ShellCondition.Visitor<String> conditions = new ShellCondition.Visitor<String>() {

			@Override
			public String visitConst(ShellCondition.Const cond) {
				return cond.getValue() ? "true" : "false";
			}

			@Override
			public String visitTest(ShellCondition.Test cond) {
				String op = checkTestOperator(cond);
				if (cond.isUnary()) {
					return "[ " + op + " " + value(cond.getOperands().get(0)) + " ]";
				}
				return "[ " + value(cond.getOperands().get(0)) + " " + op + " " + value(cond.getOperands().get(1)) + " ]";
			}

			@Override
			public String visitNot(ShellCondition.Not cond) {
				return "! " + grouped(cond.getOperand(), true);
			}

			@Override
			public String visitAnd(ShellCondition.And cond) {
				return grouped(cond.getLeft(), cond.getLeft() instanceof ShellCondition.Or) + " && "
						+ grouped(cond.getRight(), cond.getRight() instanceof ShellCondition.Or);
			}

			@Override
			public String visitOr(ShellCondition.Or cond) {
				return grouped(cond.getLeft(), cond.getLeft() instanceof ShellCondition.And) + " || "
						+ grouped(cond.getRight(), cond.getRight() instanceof ShellCondition.And);
			}

			@Override
			public String visitStatus(ShellCondition.Status cond) {
				return command(cond.getExec());
			}

			/**
			 * Wraps compound conditions in a brace group when needed.
			 */
			private String grouped(ShellCondition cond, boolean compoundNeedsGroup) {
				String text = cond.accept(this);
				boolean compound = cond instanceof ShellCondition.And || cond instanceof ShellCondition.Or
						|| cond instanceof ShellCondition.Not;
				return compound && compoundNeedsGroup ? "{ " + text + "; }" : text;
			}
		};
	}

	private static String checkTestOperator(ShellCondition.Test cond) {
		Set<String> allowed = cond.isUnary() ? UNARY_TESTS : BINARY_TESTS;
		if (!allowed.contains(cond.getOp()) || cond.getOperands().size() > 2) {
			throw new EmissionException("Unsupported test operator '" + cond.getOp() + "'");
		}
		return cond.getOp();
	}
}
