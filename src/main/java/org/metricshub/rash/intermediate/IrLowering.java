package org.metricshub.rash.intermediate;

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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.rash.ast.AstScanner;
import org.metricshub.rash.ast.BinaryOp;
import org.metricshub.rash.ast.Expr;
import org.metricshub.rash.ast.Function;
import org.metricshub.rash.ast.Intrinsic;
import org.metricshub.rash.ast.Parameter;
import org.metricshub.rash.ast.Pattern;
import org.metricshub.rash.ast.RestrictedAst;
import org.metricshub.rash.ast.Stmt;
import org.metricshub.rash.ast.Type;
import org.metricshub.rash.ast.UnaryOp;
import org.metricshub.rash.util.RashLogger;
import org.slf4j.Logger;

/**
 * Lowers a validated {@link RestrictedAst} to {@link ShellIR}.
 * <p>
 * The result is a top-level {@link ShellIR.Sequence} holding one
 * {@link ShellIR.Function} per function other than the entry point, followed
 * by the body of the entry point.
 * <p>
 * Values are typed while they are lowered: <code>i32</code> arithmetic
 * becomes arithmetic expansion, string additions become concatenations and
 * booleans are the words <code>true</code> and <code>false</code>. Whatever
 * a value needs computed beforehand (the outcome of a condition, an
 * <code>if</code> expression, a command output used in arithmetic) is
 * hoisted into a temporary assigned just before the statement that uses it.
 * <p>
 * Functions run in the shell of their caller. One returning a value stores
 * it in {@link SymbolTable#RETURN_SLOT} before returning, and the caller
 * copies it into a temporary right after the call, so whatever the function
 * prints still goes to the standard output. Since recursion is rejected and
 * every binding has its own shell name, the slot and the function's
 * variables are never clobbered by a call still in progress.
 * <p>
 * An instance lowers one program; it is not thread-safe.
 */
public class IrLowering {

	private static final Logger LOG = RashLogger.getLogger(IrLowering.class);

	/**
	 * Largest number of items a <code>for</code> loop may be unrolled to.
	 */
	public static final int MAX_LOOP_ITEMS = 10000;

	private static final String TRUE_WORD = "true";
	private static final String FALSE_WORD = "false";

	private final EffectTracker effectTracker = new EffectTracker();
	private SymbolTable symbols;
	private Map<String, Function> functions;
	private Map<String, String> functionNames;
	private Function current;
	private int loopDepth;
	private List<ShellIR> out;

	/**
	 * A lowered value and its type.
	 */
	private static final class Value {
		private final ShellValue value;
		private final Type type;

		Value(ShellValue value, Type type) {
			this.value = value;
			this.type = type;
		}
	}

	/**
	 * @return the effects recorded by the last call to {@link #lower(RestrictedAst)}
	 */
	public EffectTracker getEffectTracker() {
		return effectTracker;
	}

	/**
	 * Lowers a program.
	 *
	 * @param ast a program that passed {@link RestrictedAst#validate()}
	 * @return the program as shell IR
	 * @throws IrException when a construct has no shell translation
	 */
	public ShellIR lower(RestrictedAst ast) {
		symbols = new SymbolTable();
		functions = new LinkedHashMap<String, Function>();
		functionNames = new LinkedHashMap<String, String>();
		Set<String> takenFunctionNames = new HashSet<String>();
		takenFunctionNames.add(RestrictedAst.ENTRY_POINT);
		for (Function function : ast.getFunctions()) {
			functions.put(function.getName(), function);
		}
		for (Function function : ast.getFunctions()) {
			if (function.getName().equals(ast.getEntryPoint())) {
				continue;
			}
			String shellName = SymbolTable.functionShellName(function.getName());
			String candidate = shellName;
			int suffix = 1;
			while (!takenFunctionNames.add(candidate) || functions.containsKey(candidate) && !candidate.equals(function.getName())) {
				candidate = shellName + "_" + suffix++;
			}
			functionNames.put(function.getName(), candidate);
			symbols.reserve(candidate);
		}
		new NameReservation().scan(ast);

		List<ShellIR> items = new ArrayList<ShellIR>();
		for (Function function : ast.getFunctions()) {
			if (!function.getName().equals(ast.getEntryPoint())) {
				items.add(new ShellIR.Function(functionNames.get(function.getName()), lowerFunction(function)));
			}
		}
		Function entry = ast.getFunction(ast.getEntryPoint());
		if (entry == null) {
			throw new IrException("No entry point '" + ast.getEntryPoint() + "'");
		}
		items.add(lowerFunction(entry));
		LOG.debug("Lowered {} function(s), {}", ast.getFunctions().size(), effectTracker);
		return new ShellIR.Sequence(items);
	}

	/**
	 * Keeps the names of exported variables and of variables read from the
	 * environment away from the program's own bindings.
	 */
	private final class NameReservation extends AstScanner {
		@Override
		public Void visitLet(Stmt.Let stmt) {
			if (stmt.isExported()) {
				symbols.reserve(stmt.getName());
			}
			return super.visitLet(stmt);
		}

		@Override
		protected void onCall(Expr.FunctionCall call) {
			if (functions.containsKey(call.getName())) {
				return;
			}
			if ((call.getName().equals("env") || call.getName().equals("env_var_or")) && !call.getArgs().isEmpty()
					&& call.getArgs().get(0) instanceof Expr.Literal) {
				symbols.reserve(((Expr.Literal) call.getArgs().get(0)).getValue());
			}
		}
	}

	private ShellIR lowerFunction(Function function) {
		current = function;
		loopDepth = 0;
		symbols.pushScope();
		List<ShellIR> body = new ArrayList<ShellIR>();
		List<Parameter> params = function.getParameters();
		for (int i = 0; i < params.size(); i++) {
			SymbolTable.Binding binding = symbols.declare(params.get(i).getName(), params.get(i).getType());
			body.add(new ShellIR.Let(binding.getShellName(), new ShellValue.ArgRef(i + 1)));
		}
		body.add(lowerBlock(function.getBody()));
		symbols.popScope();
		return new ShellIR.Sequence(body);
	}

	private ShellIR lowerBlock(List<Stmt> block) {
		List<ShellIR> saved = out;
		out = new ArrayList<ShellIR>();
		symbols.pushScope();
		try {
			for (Stmt stmt : block) {
				stmt.accept(statementLowering);
			}
			return new ShellIR.Sequence(out);
		} finally {
			symbols.popScope();
			out = saved;
		}
	}

	/**
	 * Runs a lowering step with a fresh output buffer.
	 *
	 * @return the statements the step emitted
	 */
	private List<ShellIR> buffered(Runnable step) {
		List<ShellIR> saved = out;
		out = new ArrayList<ShellIR>();
		try {
			step.run();
			return out;
		} finally {
			out = saved;
		}
	}

	private static ShellIR sequenceOf(List<ShellIR> items) {
		return items.size() == 1 ? items.get(0) : new ShellIR.Sequence(items);
	}

	private static ShellIR sequenceOf(List<ShellIR> prefix, ShellIR last) {
		List<ShellIR> items = new ArrayList<ShellIR>(prefix);
		items.add(last);
		return sequenceOf(items);
	}

	// Statements

	private final Stmt.Visitor<Void> statementLowering = new Stmt.Visitor<Void>() {

		@Override
		public Void visitLet(Stmt.Let stmt) {
			if (stmt.isExported()) {
				Value value = lowerScalar(stmt.getValue());
				effectTracker.recordIntrinsic(Intrinsic.SET_ENV);
				effectTracker.recordExport(stmt.getName());
				out.add(new ShellIR.Let(stmt.getName(), value.value, true));
				return null;
			}
			if (!stmt.isDeclaration()) {
				SymbolTable.Binding binding = symbols.lookup(stmt.getName());
				if (binding == null) {
					throw new IrException("Unknown variable '" + stmt.getName() + "'");
				}
				if (binding.isArray()) {
					throw IrException.unsupportedConstruct("assignment to array '" + stmt.getName() + "'");
				}
				assign(binding.getShellName(), binding.getType(), stmt.getValue());
				return null;
			}
			Expr value = stmt.getValue();
			if (value instanceof Expr.ArrayLiteral) {
				declareArray(stmt.getName(), (Expr.ArrayLiteral) value);
				return null;
			}
			if (isCapture(value)) {
				ShellIR.Exec exec = commandOf(((Expr.FunctionCall) value).getArgs(), Intrinsic.CAPTURE);
				SymbolTable.Binding binding = symbols.declare(stmt.getName(), Type.STR);
				out.add(new ShellIR.Capture(exec, binding.getShellName()));
				return null;
			}
			Value lowered = lowerScalar(value);
			SymbolTable.Binding binding = symbols.declare(stmt.getName(), lowered.type);
			out.add(new ShellIR.Let(binding.getShellName(), lowered.value));
			return null;
		}

		@Override
		public Void visitExprStmt(Stmt.ExprStmt stmt) {
			Expr expr = stmt.getExpr();
			if (expr instanceof Expr.FunctionCall) {
				lowerCallStatement((Expr.FunctionCall) expr);
				return null;
			}
			Value value = lowerValue(expr);
			if (value.value.hasCommandSubstitution() || IrOptimizer.mayFail(value.value)) {
				out.add(new ShellIR.Let(symbols.allocateTemp(), value.value));
			}
			return null;
		}

		@Override
		public Void visitIf(Stmt.If stmt) {
			ShellCondition condition = lowerCondition(stmt.getCondition());
			ShellIR thenBranch = lowerBlock(stmt.getThenBody());
			List<List<ShellIR>> elifPrefixes = new ArrayList<List<ShellIR>>();
			List<ShellCondition> elifConditions = new ArrayList<ShellCondition>();
			List<ShellIR> elifBodies = new ArrayList<ShellIR>();
			for (final Stmt.ElseIf elseIf : stmt.getElseIfs()) {
				final ShellCondition[] holder = new ShellCondition[1];
				elifPrefixes.add(buffered(new Runnable() {
					@Override
					public void run() {
						holder[0] = lowerCondition(elseIf.getCondition());
					}
				}));
				elifConditions.add(holder[0]);
				elifBodies.add(lowerBlock(elseIf.getBody()));
			}
			ShellIR elseBranch = stmt.getElseBody() == null ? null : lowerBlock(stmt.getElseBody());
			for (int i = elifConditions.size() - 1; i >= 0; i--) {
				ShellIR nested = new ShellIR.If(elifConditions.get(i), elifBodies.get(i), elseBranch);
				elseBranch = elifPrefixes.get(i).isEmpty() ? nested : sequenceOf(elifPrefixes.get(i), nested);
			}
			out.add(new ShellIR.If(condition, thenBranch, elseBranch));
			return null;
		}

		@Override
		public Void visitWhile(final Stmt.While stmt) {
			final ShellCondition[] holder = new ShellCondition[1];
			List<ShellIR> prefix = buffered(new Runnable() {
				@Override
				public void run() {
					holder[0] = lowerCondition(stmt.getCondition());
				}
			});
			loopDepth++;
			ShellIR body = lowerBlock(stmt.getBody());
			loopDepth--;
			if (prefix.isEmpty()) {
				out.add(new ShellIR.While(holder[0], body));
			} else {
				List<ShellIR> items = new ArrayList<ShellIR>(prefix);
				items.add(new ShellIR.If(new ShellCondition.Not(holder[0]), ShellIR.Break.INSTANCE, null));
				items.add(body);
				out.add(new ShellIR.While(ShellCondition.Const.TRUE, new ShellIR.Sequence(items)));
			}
			return null;
		}

		@Override
		public Void visitFor(Stmt.For stmt) {
			List<ShellValue> items = new ArrayList<ShellValue>();
			Type elementType = loopItems(stmt.getIterable(), items);
			symbols.pushScope();
			SymbolTable.Binding binding = symbols.declare(stmt.getVariable(), elementType);
			loopDepth++;
			ShellIR body = lowerBlock(stmt.getBody());
			loopDepth--;
			symbols.popScope();
			out.add(new ShellIR.For(binding.getShellName(), items, body));
			return null;
		}

		@Override
		public Void visitMatch(Stmt.Match stmt) {
			Value scrutinee = lowerScalar(stmt.getScrutinee());
			boolean ranges = false;
			for (Stmt.MatchArm arm : stmt.getArms()) {
				for (Pattern pattern : arm.getPatterns()) {
					checkPattern(pattern, scrutinee.type);
					ranges |= pattern instanceof Pattern.Range;
				}
			}
			if (ranges) {
				out.add(matchChain(stmt, stable(scrutinee.value)));
				return null;
			}
			List<ShellIR.CaseArm> arms = new ArrayList<ShellIR.CaseArm>();
			for (Stmt.MatchArm arm : stmt.getArms()) {
				List<String> words = new ArrayList<String>();
				boolean wildcard = false;
				for (Pattern pattern : arm.getPatterns()) {
					if (pattern instanceof Pattern.Wildcard) {
						wildcard = true;
					} else {
						words.add(((Pattern.Literal) pattern).getValue().getValue());
					}
				}
				ShellIR body = lowerBlock(arm.getBody());
				if (wildcard) {
					// later arms are unreachable
					arms.add(ShellIR.CaseArm.wildcard(body));
					break;
				}
				arms.add(new ShellIR.CaseArm(words, body));
			}
			out.add(new ShellIR.Case(scrutinee.value, arms));
			return null;
		}

		@Override
		public Void visitReturn(Stmt.Return stmt) {
			if (stmt.getValue() == null) {
				if (current.getReturnType() != Type.VOID) {
					throw new IrException("Function '" + current.getName() + "' must return a value");
				}
				out.add(ShellIR.Return.INSTANCE);
				return null;
			}
			if (current.getReturnType() == Type.VOID) {
				throw new IrException("Function '" + current.getName() + "' returns no value");
			}
			Value value = lowerScalar(stmt.getValue());
			if (value.type != current.getReturnType()) {
				throw new IrException("Function '" + current.getName() + "' returns " + current.getReturnType().getSourceName()
						+ " but the value is " + value.type.getSourceName());
			}
			out.add(new ShellIR.Let(SymbolTable.RETURN_SLOT, value.value));
			out.add(ShellIR.Return.INSTANCE);
			return null;
		}

		@Override
		public Void visitBreak(Stmt.Break stmt) {
			if (loopDepth == 0) {
				throw new IrException("break outside of a loop");
			}
			out.add(ShellIR.Break.INSTANCE);
			return null;
		}

		@Override
		public Void visitContinue(Stmt.Continue stmt) {
			if (loopDepth == 0) {
				throw new IrException("continue outside of a loop");
			}
			out.add(ShellIR.Continue.INSTANCE);
			return null;
		}
	};

	private static void checkPattern(Pattern pattern, Type type) {
		if (pattern instanceof Pattern.Literal) {
			Type patternType = ((Pattern.Literal) pattern).getValue().getType();
			if (patternType != type) {
				throw new IrException("Cannot match a " + type.getSourceName() + " value against a " + patternType.getSourceName() + " pattern");
			}
		} else if (pattern instanceof Pattern.Range && type != Type.I32) {
			throw new IrException("Cannot match a " + type.getSourceName() + " value against a range");
		}
	}

	/**
	 * @return the value itself when reading it twice is harmless, otherwise a
	 *         temporary holding it
	 */
	private ShellValue stable(ShellValue value) {
		if (value instanceof ShellValue.Literal || value instanceof ShellValue.VarRef) {
			return value;
		}
		String temp = symbols.allocateTemp();
		out.add(new ShellIR.Let(temp, value));
		return new ShellValue.VarRef(temp);
	}

	/**
	 * Lowers a match with range patterns to an <code>if</code> chain, since
	 * a <code>case</code> pattern cannot express a numeric range.
	 */
	private ShellIR matchChain(Stmt.Match stmt, ShellValue scrutinee) {
		List<ShellCondition> conditions = new ArrayList<ShellCondition>();
		List<ShellIR> bodies = new ArrayList<ShellIR>();
		for (Stmt.MatchArm arm : stmt.getArms()) {
			ShellCondition condition = null;
			for (Pattern pattern : arm.getPatterns()) {
				ShellCondition accepts = patternCondition(pattern, scrutinee);
				condition = condition == null ? accepts : new ShellCondition.Or(condition, accepts);
			}
			conditions.add(condition);
			bodies.add(lowerBlock(arm.getBody()));
		}
		ShellIR chain = null;
		for (int i = conditions.size() - 1; i >= 0; i--) {
			chain = new ShellIR.If(conditions.get(i), bodies.get(i), chain);
		}
		return chain == null ? ShellIR.Sequence.empty() : chain;
	}

	private static ShellCondition patternCondition(Pattern pattern, ShellValue scrutinee) {
		if (pattern instanceof Pattern.Wildcard) {
			return ShellCondition.Const.TRUE;
		}
		if (pattern instanceof Pattern.Literal) {
			return ShellCondition.Test.binary("-eq", scrutinee, ShellValue.literal(((Pattern.Literal) pattern).getValue().getValue()));
		}
		Pattern.Range range = (Pattern.Range) pattern;
		if (range.isEmpty()) {
			return ShellCondition.Const.FALSE;
		}
		ShellCondition low = ShellCondition.Test.binary("-ge", scrutinee, ShellValue.literal(Integer.toString(range.getLow())));
		ShellCondition high = ShellCondition.Test.binary(range.isInclusive() ? "-le" : "-lt", scrutinee,
				ShellValue.literal(Integer.toString(range.getHigh())));
		return new ShellCondition.And(low, high);
	}

	private void assign(String shellName, Type type, Expr value) {
		if (isCapture(value)) {
			if (type != Type.STR) {
				throw new IrException("Cannot assign the output of a command to a " + type.getSourceName() + " variable");
			}
			out.add(new ShellIR.Capture(commandOf(((Expr.FunctionCall) value).getArgs(), Intrinsic.CAPTURE), shellName));
			return;
		}
		Value lowered = lowerScalar(value);
		if (lowered.type != type) {
			throw new IrException("Cannot assign a " + lowered.type.getSourceName() + " value to a " + type.getSourceName() + " variable");
		}
		out.add(new ShellIR.Let(shellName, lowered.value));
	}

	private void declareArray(String name, Expr.ArrayLiteral array) {
		List<Value> elements = new ArrayList<Value>();
		Type elementType = null;
		for (Expr element : array.getElements()) {
			Value value = lowerScalar(element);
			if (elementType != null && value.type != elementType) {
				throw new IrException("Array '" + name + "' mixes " + elementType.getSourceName() + " and " + value.type.getSourceName());
			}
			elementType = value.type;
			elements.add(value);
		}
		SymbolTable.Binding binding = symbols.declareArray(name, elementType == null ? Type.STR : elementType, elements.size());
		for (int i = 0; i < elements.size(); i++) {
			out.add(new ShellIR.Let(binding.getElements().get(i), elements.get(i).value));
		}
	}

	private Type loopItems(Expr iterable, List<ShellValue> items) {
		if (iterable instanceof Expr.Range) {
			Expr.Range range = (Expr.Range) iterable;
			if (!isIntLiteral(range.getStart()) || !isIntLiteral(range.getEnd())) {
				throw IrException.unsupportedConstruct("for loop over a range without literal bounds");
			}
			long start = ((Expr.Literal) range.getStart()).getIntValue();
			long end = ((Expr.Literal) range.getEnd()).getIntValue();
			if (range.isInclusive()) {
				end++;
			}
			if (end - start > MAX_LOOP_ITEMS) {
				throw IrException.unsupportedConstruct("for loop over more than " + MAX_LOOP_ITEMS + " items");
			}
			for (long i = start; i < end; i++) {
				items.add(new ShellValue.Literal(Long.toString(i)));
			}
			return Type.I32;
		}
		if (iterable instanceof Expr.ArrayLiteral) {
			Type elementType = Type.STR;
			boolean first = true;
			for (Expr element : ((Expr.ArrayLiteral) iterable).getElements()) {
				Value value = lowerScalar(element);
				if (!first && value.type != elementType) {
					throw new IrException("Array literal mixes " + elementType.getSourceName() + " and " + value.type.getSourceName());
				}
				elementType = value.type;
				first = false;
				items.add(value.value);
			}
			if (items.size() > MAX_LOOP_ITEMS) {
				throw IrException.unsupportedConstruct("for loop over more than " + MAX_LOOP_ITEMS + " items");
			}
			return elementType;
		}
		if (iterable instanceof Expr.Variable) {
			SymbolTable.Binding binding = lookup(((Expr.Variable) iterable).getName());
			if (binding.isArray()) {
				for (String element : binding.getElements()) {
					items.add(new ShellValue.VarRef(element));
				}
				return binding.getType();
			}
		}
		throw IrException.unsupportedConstruct("for loop over an iterable whose length is not known statically");
	}

	private static boolean isIntLiteral(Expr expr) {
		return expr instanceof Expr.Literal && ((Expr.Literal) expr).getType() == Type.I32;
	}

	private boolean isCapture(Expr expr) {
		return expr instanceof Expr.FunctionCall && ((Expr.FunctionCall) expr).getName().equals(Intrinsic.CAPTURE.getFunctionName())
				&& !functions.containsKey(((Expr.FunctionCall) expr).getName());
	}

	private SymbolTable.Binding lookup(String name) {
		SymbolTable.Binding binding = symbols.lookup(name);
		if (binding == null) {
			throw new IrException("Unknown variable '" + name + "'");
		}
		return binding;
	}

	// Calls

	private void lowerCallStatement(Expr.FunctionCall call) {
		Function target = functions.get(call.getName());
		if (target != null) {
			out.add(userCall(target, call.getArgs()));
			return;
		}
		Intrinsic intrinsic = intrinsicOf(call);
		effectTracker.recordIntrinsic(intrinsic);
		List<Expr> args = call.getArgs();
		switch (intrinsic) {
		case ECHO:
			out.add(new ShellIR.Echo(lowerScalar(args.get(0)).value));
			break;
		case EPRINT:
			out.add(new ShellIR.Stderr(lowerScalar(args.get(0)).value));
			break;
		case MKDIR_P:
			out.add(ShellIR.Exec.of("mkdir", EffectTracker.effectsOf(intrinsic), ShellValue.literal("-p"), lowerString(args.get(0))));
			break;
		case WRITE_FILE:
			out.add(ShellIR.Exec.of("rash_write_file", EffectTracker.effectsOf(intrinsic), lowerString(args.get(0)), lowerString(args.get(1))));
			break;
		case REMOVE_FILE:
			out.add(ShellIR.Exec.of("rm", EffectTracker.effectsOf(intrinsic), ShellValue.literal("-f"), lowerString(args.get(0))));
			break;
		case SYMLINK:
			out.add(ShellIR.Exec.of("rash_symlink", EffectTracker.effectsOf(intrinsic), lowerString(args.get(0)), lowerString(args.get(1))));
			break;
		case SET_ENV:
			if (!(args.get(0) instanceof Expr.Literal)) {
				throw IrException.unsupportedConstruct("set_env with a non-literal variable name");
			}
			String name = ((Expr.Literal) args.get(0)).getValue();
			effectTracker.recordExport(name);
			out.add(new ShellIR.Let(name, lowerScalar(args.get(1)).value, true));
			break;
		case EXEC:
			out.add(commandOf(args, intrinsic));
			break;
		case CAPTURE:
		case READ_FILE:
			out.add(new ShellIR.Capture(commandExec(intrinsic, args), symbols.allocateTemp()));
			break;
		case CD:
			out.add(ShellIR.Exec.of("cd", EffectTracker.effectsOf(intrinsic), lowerString(args.get(0))));
			break;
		case REQUIRE:
			out.add(ShellIR.Exec.of("rash_require", EffectTracker.effectsOf(intrinsic), lowerString(args.get(0))));
			break;
		case EXIT:
			out.add(new ShellIR.Exit(lowerInt(args.get(0))));
			break;
		default:
			// value-returning built-ins evaluated for their effects only
			lowerIntrinsicValue(intrinsic, args);
			break;
		}
	}

	private ShellIR.Exec commandExec(Intrinsic intrinsic, List<Expr> args) {
		if (intrinsic == Intrinsic.READ_FILE) {
			return ShellIR.Exec.of("rash_read_file", EffectTracker.effectsOf(intrinsic), lowerString(args.get(0)));
		}
		return commandOf(args, intrinsic);
	}

	private Intrinsic intrinsicOf(Expr.FunctionCall call) {
		Intrinsic intrinsic = Intrinsic.lookup(call.getName());
		if (intrinsic == null) {
			throw IrException.unsupportedConstruct("call of unknown function '" + call.getName() + "'");
		}
		return intrinsic;
	}

	/**
	 * Builds the command of <code>exec</code> and <code>capture</code>: the
	 * first argument is the command word, the others its arguments.
	 */
	private ShellIR.Exec commandOf(List<Expr> args, Intrinsic intrinsic) {
		effectTracker.recordIntrinsic(intrinsic);
		ShellValue command = lowerString(args.get(0));
		List<ShellValue> rest = new ArrayList<ShellValue>();
		for (Expr arg : args.subList(1, args.size())) {
			rest.add(lowerScalar(arg).value);
		}
		return new ShellIR.Exec(command, rest, EffectTracker.effectsOf(intrinsic));
	}

	private ShellIR.Exec userCall(Function target, List<Expr> args) {
		List<ShellValue> values = new ArrayList<ShellValue>();
		for (int i = 0; i < args.size(); i++) {
			Value value = lowerScalar(args.get(i));
			Type expected = target.getParameters().get(i).getType();
			if (value.type != expected) {
				throw new IrException("Argument " + (i + 1) + " of '" + target.getName() + "' must be " + expected.getSourceName()
						+ " but is " + value.type.getSourceName());
			}
			values.add(value.value);
		}
		return new ShellIR.Exec(new ShellValue.Literal(functionNames.get(target.getName())), values, EffectSet.pure());
	}

	private Value lowerCallValue(Expr.FunctionCall call) {
		Function target = functions.get(call.getName());
		if (target != null) {
			if (target.getReturnType() == Type.VOID) {
				throw new IrException("Function '" + call.getName() + "' returns no value");
			}
			out.add(userCall(target, call.getArgs()));
			String temp = symbols.allocateTemp();
			out.add(new ShellIR.Let(temp, new ShellValue.VarRef(SymbolTable.RETURN_SLOT)));
			return new Value(new ShellValue.VarRef(temp), target.getReturnType());
		}
		Intrinsic intrinsic = intrinsicOf(call);
		effectTracker.recordIntrinsic(intrinsic);
		return lowerIntrinsicValue(intrinsic, call.getArgs());
	}

	private Value lowerIntrinsicValue(Intrinsic intrinsic, List<Expr> args) {
		switch (intrinsic) {
		case READ_FILE:
		case CAPTURE:
			return new Value(new ShellValue.CommandSubst(commandExec(intrinsic, args)), Type.STR);
		case ENV:
			return new Value(new ShellValue.EnvRef(literalName(args.get(0)), false), Type.STR);
		case ENV_VAR_OR: {
			String name = literalName(args.get(0));
			Value fallback = lowerScalar(args.get(1));
			if (fallback.type != Type.STR) {
				throw new IrException("env_var_or default must be a string");
			}
			String temp = symbols.allocateTemp();
			ShellValue env = new ShellValue.EnvRef(name, true);
			out.add(new ShellIR.If(ShellCondition.Test.unary("-n", env), new ShellIR.Let(temp, env), new ShellIR.Let(temp, fallback.value)));
			return new Value(new ShellValue.VarRef(temp), Type.STR);
		}
		case ARG: {
			if (!current.getName().equals(RestrictedAst.ENTRY_POINT)) {
				throw IrException.unsupportedConstruct("arg() outside of " + RestrictedAst.ENTRY_POINT);
			}
			int position = ((Expr.Literal) args.get(0)).getIntValue();
			if (position < 1) {
				throw new IrException("arg() positions start at 1");
			}
			return new Value(new ShellValue.ArgRef(position), Type.STR);
		}
		case FORMAT:
			return new Value(format(args), Type.STR);
		case PATH_EXISTS:
		case IS_FILE:
		case IS_DIR:
			return boolValue(lowerConditionCall(intrinsic, args));
		default:
			throw new IrException("Built-in '" + intrinsic.getFunctionName() + "' returns no value");
		}
	}

	private static String literalName(Expr expr) {
		if (!(expr instanceof Expr.Literal) || ((Expr.Literal) expr).getType() != Type.STR) {
			throw IrException.unsupportedConstruct("environment variable name that is not a string literal");
		}
		return ((Expr.Literal) expr).getValue();
	}

	/**
	 * Lowers <code>format</code>: the first argument is a format string in
	 * which <code>{}</code> stands for the next argument and
	 * <code>{{</code>/<code>}}</code> for literal braces.
	 */
	private ShellValue format(List<Expr> args) {
		if (!(args.get(0) instanceof Expr.Literal)) {
			throw IrException.unsupportedConstruct("format with a non-literal format string");
		}
		String fmt = ((Expr.Literal) args.get(0)).getValue();
		List<ShellValue> parts = new ArrayList<ShellValue>();
		StringBuilder text = new StringBuilder();
		int next = 1;
		for (int i = 0; i < fmt.length(); i++) {
			char c = fmt.charAt(i);
			char following = i + 1 < fmt.length() ? fmt.charAt(i + 1) : 0;
			if (c == '{' && following == '{' || c == '}' && following == '}') {
				text.append(c);
				i++;
			} else if (c == '{' && following == '}') {
				if (next >= args.size()) {
					throw new IrException("format string has more placeholders than arguments");
				}
				if (text.length() > 0) {
					parts.add(new ShellValue.Literal(text.toString()));
					text.setLength(0);
				}
				parts.add(lowerScalar(args.get(next++)).value);
				i++;
			} else {
				text.append(c);
			}
		}
		if (next != args.size()) {
			throw new IrException("format string has fewer placeholders than arguments");
		}
		if (text.length() > 0) {
			parts.add(new ShellValue.Literal(text.toString()));
		}
		return parts.size() == 1 ? parts.get(0) : new ShellValue.Concat(parts);
	}

	// Values

	private Value lowerScalar(Expr expr) {
		Value value = lowerValue(expr);
		if (value.type == Type.VOID) {
			throw new IrException("A value of type () cannot be used as a value");
		}
		return value;
	}

	private ShellValue lowerString(Expr expr) {
		return lowerScalar(expr).value;
	}

	private ShellValue lowerInt(Expr expr) {
		Value value = lowerScalar(expr);
		if (value.type != Type.I32) {
			throw new IrException("Expected an i32 value but found " + value.type.getSourceName());
		}
		return value.value;
	}

	private Value boolValue(ShellCondition condition) {
		String temp = symbols.allocateTemp();
		out.add(new ShellIR.If(condition, new ShellIR.Let(temp, ShellValue.literal(TRUE_WORD)), new ShellIR.Let(temp, ShellValue.literal(FALSE_WORD))));
		return new Value(new ShellValue.VarRef(temp), Type.BOOL);
	}

	private Value lowerValue(Expr expr) {
		return expr.accept(valueLowering);
	}

	private final Expr.Visitor<Value> valueLowering = new Expr.Visitor<Value>() {

		@Override
		public Value visitLiteral(Expr.Literal expr) {
			switch (expr.getType()) {
			case STR:
				return new Value(interpolate(expr.getValue()), Type.STR);
			case BOOL:
				return new Value(ShellValue.literal(expr.getBoolValue() ? TRUE_WORD : FALSE_WORD), Type.BOOL);
			default:
				return new Value(ShellValue.literal(expr.getValue()), expr.getType());
			}
		}

		@Override
		public Value visitVariable(Expr.Variable expr) {
			SymbolTable.Binding binding = lookup(expr.getName());
			if (binding.isArray()) {
				throw IrException.unsupportedConstruct("array '" + expr.getName() + "' used as a value");
			}
			return new Value(new ShellValue.VarRef(binding.getShellName()), binding.getType());
		}

		@Override
		public Value visitBinary(Expr.Binary expr) {
			BinaryOp op = expr.getOp();
			if (!op.isArithmetic()) {
				return boolValue(lowerCondition(expr));
			}
			if (op == BinaryOp.ADD) {
				Type leftType = typeOf(expr.getLeft());
				if (leftType == Type.STR) {
					Value left = lowerScalar(expr.getLeft());
					Value right = lowerScalar(expr.getRight());
					if (right.type != Type.STR) {
						throw new IrException("Cannot add " + right.type.getSourceName() + " to &str");
					}
					List<ShellValue> parts = new ArrayList<ShellValue>();
					parts.add(left.value);
					parts.add(right.value);
					return new Value(new ShellValue.Concat(parts), Type.STR);
				}
			}
			return new Value(new ShellValue.Arith(lowerArith(expr)), Type.I32);
		}

		@Override
		public Value visitUnary(Expr.Unary expr) {
			if (expr.getOp() == UnaryOp.NOT) {
				return boolValue(lowerCondition(expr));
			}
			return new Value(new ShellValue.Arith(lowerArith(expr)), Type.I32);
		}

		@Override
		public Value visitFunctionCall(Expr.FunctionCall expr) {
			return lowerCallValue(expr);
		}

		@Override
		public Value visitIndex(Expr.Index expr) {
			if (!(expr.getBase() instanceof Expr.Variable)) {
				throw IrException.unsupportedConstruct("indexing of a computed value");
			}
			SymbolTable.Binding binding = lookup(((Expr.Variable) expr.getBase()).getName());
			if (!binding.isArray()) {
				throw IrException.unsupportedConstruct("indexing of the non-array '" + binding.getSourceName() + "'");
			}
			if (!isIntLiteral(expr.getIndex())) {
				throw IrException.unsupportedConstruct("dynamic indexing of '" + binding.getSourceName() + "'");
			}
			int index = ((Expr.Literal) expr.getIndex()).getIntValue();
			if (index < 0 || index >= binding.getElements().size()) {
				throw new IrException("Index " + index + " is out of bounds for '" + binding.getSourceName() + "' of length "
						+ binding.getElements().size());
			}
			return new Value(new ShellValue.VarRef(binding.getElements().get(index)), binding.getType());
		}

		@Override
		public Value visitMethodCall(Expr.MethodCall expr) {
			String method = expr.getMethod();
			if (method.equals("to_string") && expr.getArgs().isEmpty()) {
				return new Value(lowerScalar(expr.getReceiver()).value, Type.STR);
			}
			if (method.equals("len") && expr.getArgs().isEmpty() && expr.getReceiver() instanceof Expr.Variable) {
				SymbolTable.Binding binding = lookup(((Expr.Variable) expr.getReceiver()).getName());
				if (binding.isArray()) {
					return new Value(ShellValue.literal(Integer.toString(binding.getElements().size())), Type.I32);
				}
				if (binding.getType() == Type.STR) {
					return new Value(new ShellValue.Length(binding.getShellName()), Type.I32);
				}
			}
			throw IrException.unsupportedConstruct("method '" + method + "'");
		}

		@Override
		public Value visitTest(Expr.Test expr) {
			return boolValue(lowerCondition(expr));
		}

		@Override
		public Value visitIfExpr(final Expr.IfExpr expr) {
			ShellCondition condition = lowerCondition(expr.getCondition());
			final String temp = symbols.allocateTemp();
			final Type[] types = new Type[2];
			List<ShellIR> thenOut = buffered(new Runnable() {
				@Override
				public void run() {
					Value value = lowerScalar(expr.getThenValue());
					types[0] = value.type;
					out.add(new ShellIR.Let(temp, value.value));
				}
			});
			List<ShellIR> elseOut = buffered(new Runnable() {
				@Override
				public void run() {
					Value value = lowerScalar(expr.getElseValue());
					types[1] = value.type;
					out.add(new ShellIR.Let(temp, value.value));
				}
			});
			if (types[0] != types[1]) {
				throw new IrException("if expression branches have different types: " + types[0].getSourceName() + " and "
						+ types[1].getSourceName());
			}
			out.add(new ShellIR.If(condition, sequenceOf(thenOut), sequenceOf(elseOut)));
			return new Value(new ShellValue.VarRef(temp), types[0]);
		}

		@Override
		public Value visitRange(Expr.Range expr) {
			throw IrException.unsupportedConstruct("range used outside of a for loop");
		}

		@Override
		public Value visitArrayLiteral(Expr.ArrayLiteral expr) {
			throw IrException.unsupportedConstruct("array literal used as a value");
		}
	};

	/**
	 * Expands <code>${name}</code> markers naming a bound variable; any other
	 * text, including markers of unknown names, stays literal.
	 */
	private ShellValue interpolate(String text) {
		List<ShellValue> parts = new ArrayList<ShellValue>();
		StringBuilder literal = new StringBuilder();
		int i = 0;
		while (i < text.length()) {
			if (text.startsWith("${", i)) {
				int close = text.indexOf('}', i + 2);
				if (close > 0) {
					String name = text.substring(i + 2, close);
					SymbolTable.Binding binding = name.matches("[A-Za-z_][A-Za-z0-9_]*") ? symbols.lookup(name) : null;
					if (binding != null && !binding.isArray()) {
						if (literal.length() > 0) {
							parts.add(new ShellValue.Literal(literal.toString()));
							literal.setLength(0);
						}
						parts.add(new ShellValue.VarRef(binding.getShellName()));
						i = close + 1;
						continue;
					}
				}
			}
			literal.append(text.charAt(i++));
		}
		if (parts.isEmpty()) {
			return new ShellValue.Literal(literal.toString());
		}
		if (literal.length() > 0) {
			parts.add(new ShellValue.Literal(literal.toString()));
		}
		return parts.size() == 1 ? parts.get(0) : new ShellValue.Concat(parts);
	}

	/**
	 * Determines the type of an expression without lowering it.
	 */
	private Type typeOf(Expr expr) {
		if (expr instanceof Expr.Literal) {
			return ((Expr.Literal) expr).getType();
		}
		if (expr instanceof Expr.Variable) {
			return lookup(((Expr.Variable) expr).getName()).getType();
		}
		if (expr instanceof Expr.Index) {
			Expr base = ((Expr.Index) expr).getBase();
			return base instanceof Expr.Variable ? lookup(((Expr.Variable) base).getName()).getType() : null;
		}
		if (expr instanceof Expr.Binary) {
			Expr.Binary binary = (Expr.Binary) expr;
			if (!binary.getOp().isArithmetic()) {
				return Type.BOOL;
			}
			return binary.getOp() == BinaryOp.ADD ? typeOf(binary.getLeft()) : Type.I32;
		}
		if (expr instanceof Expr.Unary) {
			return ((Expr.Unary) expr).getOp() == UnaryOp.NOT ? Type.BOOL : Type.I32;
		}
		if (expr instanceof Expr.Test) {
			return Type.BOOL;
		}
		if (expr instanceof Expr.MethodCall) {
			return ((Expr.MethodCall) expr).getMethod().equals("len") ? Type.I32 : Type.STR;
		}
		if (expr instanceof Expr.IfExpr) {
			return typeOf(((Expr.IfExpr) expr).getThenValue());
		}
		if (expr instanceof Expr.FunctionCall) {
			Expr.FunctionCall call = (Expr.FunctionCall) expr;
			Function target = functions.get(call.getName());
			if (target != null) {
				return target.getReturnType();
			}
			Intrinsic intrinsic = Intrinsic.lookup(call.getName());
			return intrinsic == null ? null : intrinsic.getReturnType();
		}
		return null;
	}

	// Arithmetic

	private ArithExpr lowerArith(Expr expr) {
		if (expr instanceof Expr.Literal && ((Expr.Literal) expr).getType() == Type.I32) {
			return new ArithExpr.Number(((Expr.Literal) expr).getIntValue());
		}
		if (expr instanceof Expr.Binary && ((Expr.Binary) expr).getOp().isArithmetic()) {
			Expr.Binary binary = (Expr.Binary) expr;
			if (binary.getOp() == BinaryOp.ADD && typeOf(binary.getLeft()) == Type.STR) {
				throw new IrException("Expected an i32 value but found &str");
			}
			return new ArithExpr.Binary(arithOp(binary.getOp()), lowerArith(binary.getLeft()), lowerArith(binary.getRight()));
		}
		if (expr instanceof Expr.Unary && ((Expr.Unary) expr).getOp() == UnaryOp.NEG) {
			return new ArithExpr.Negate(lowerArith(((Expr.Unary) expr).getOperand()));
		}
		Value value = lowerScalar(expr);
		if (value.type != Type.I32) {
			throw new IrException("Expected an i32 value but found " + value.type.getSourceName());
		}
		if (value.value instanceof ShellValue.VarRef) {
			return new ArithExpr.Operand(value.value);
		}
		if (value.value instanceof ShellValue.Arith) {
			return ((ShellValue.Arith) value.value).getExpr();
		}
		if (value.value instanceof ShellValue.Literal) {
			return new ArithExpr.Number(Long.parseLong(((ShellValue.Literal) value.value).getText()));
		}
		String temp = symbols.allocateTemp();
		out.add(new ShellIR.Let(temp, value.value));
		return new ArithExpr.Operand(new ShellValue.VarRef(temp));
	}

	private static ArithExpr.Op arithOp(BinaryOp op) {
		switch (op) {
		case ADD:
			return ArithExpr.Op.ADD;
		case SUB:
			return ArithExpr.Op.SUB;
		case MUL:
			return ArithExpr.Op.MUL;
		case DIV:
			return ArithExpr.Op.DIV;
		case REM:
			return ArithExpr.Op.REM;
		default:
			throw new IrException("Not an arithmetic operator: " + op.getSymbol());
		}
	}

	// Conditions

	private ShellCondition lowerCondition(Expr expr) {
		if (expr instanceof Expr.Literal && ((Expr.Literal) expr).getType() == Type.BOOL) {
			return ShellCondition.Const.of(((Expr.Literal) expr).getBoolValue());
		}
		if (expr instanceof Expr.Unary && ((Expr.Unary) expr).getOp() == UnaryOp.NOT) {
			return new ShellCondition.Not(lowerCondition(((Expr.Unary) expr).getOperand()));
		}
		if (expr instanceof Expr.Test) {
			Expr.Test test = (Expr.Test) expr;
			return ShellCondition.Test.unary(test.getTest().getKind().getFlag(), lowerString(test.getTest().getOperand()));
		}
		if (expr instanceof Expr.Binary) {
			Expr.Binary binary = (Expr.Binary) expr;
			if (binary.getOp().isLogical()) {
				return lowerLogical(binary);
			}
			if (binary.getOp().isComparison()) {
				return lowerComparison(binary);
			}
		}
		if (expr instanceof Expr.FunctionCall && !functions.containsKey(((Expr.FunctionCall) expr).getName())) {
			Expr.FunctionCall call = (Expr.FunctionCall) expr;
			Intrinsic intrinsic = intrinsicOf(call);
			if (intrinsic == Intrinsic.EXEC) {
				return new ShellCondition.Status(commandOf(call.getArgs(), intrinsic));
			}
			if (intrinsic == Intrinsic.PATH_EXISTS || intrinsic == Intrinsic.IS_FILE || intrinsic == Intrinsic.IS_DIR) {
				effectTracker.recordIntrinsic(intrinsic);
				return lowerConditionCall(intrinsic, call.getArgs());
			}
		}
		Value value = lowerScalar(expr);
		if (value.type != Type.BOOL) {
			throw new IrException("Condition must be bool but is " + value.type.getSourceName());
		}
		return ShellCondition.Test.binary("=", value.value, ShellValue.literal(TRUE_WORD));
	}

	private ShellCondition lowerConditionCall(Intrinsic intrinsic, List<Expr> args) {
		String flag = intrinsic == Intrinsic.IS_FILE ? "-f" : intrinsic == Intrinsic.IS_DIR ? "-d" : "-e";
		return ShellCondition.Test.unary(flag, lowerString(args.get(0)));
	}

	private ShellCondition lowerComparison(Expr.Binary binary) {
		Value left = lowerScalar(binary.getLeft());
		Value right = lowerScalar(binary.getRight());
		if (left.type != right.type) {
			throw new IrException("Cannot compare " + left.type.getSourceName() + " with " + right.type.getSourceName());
		}
		String op;
		if (left.type == Type.I32) {
			op = numericOperator(binary.getOp());
		} else if (binary.getOp() == BinaryOp.EQ) {
			op = "=";
		} else if (binary.getOp() == BinaryOp.NE) {
			op = "!=";
		} else {
			throw IrException.unsupportedConstruct("ordering comparison of " + left.type.getSourceName() + " values");
		}
		return ShellCondition.Test.binary(op, left.value, right.value);
	}

	private static String numericOperator(BinaryOp op) {
		switch (op) {
		case EQ:
			return "-eq";
		case NE:
			return "-ne";
		case LT:
			return "-lt";
		case LE:
			return "-le";
		case GT:
			return "-gt";
		default:
			return "-ge";
		}
	}

	/**
	 * Lowers <code>&amp;&amp;</code> and <code>||</code>. When the right
	 * operand needs statements of its own they must only run when the left
	 * operand does not decide the outcome, so the result goes through a
	 * temporary.
	 */
	private ShellCondition lowerLogical(final Expr.Binary binary) {
		boolean and = binary.getOp() == BinaryOp.AND;
		ShellCondition left = lowerCondition(binary.getLeft());
		final ShellCondition[] holder = new ShellCondition[1];
		List<ShellIR> prefix = buffered(new Runnable() {
			@Override
			public void run() {
				holder[0] = lowerCondition(binary.getRight());
			}
		});
		ShellCondition right = holder[0];
		if (prefix.isEmpty()) {
			return and ? new ShellCondition.And(left, right) : new ShellCondition.Or(left, right);
		}
		String temp = symbols.allocateTemp();
		ShellValue decided = ShellValue.literal(and ? FALSE_WORD : TRUE_WORD);
		ShellValue other = ShellValue.literal(and ? TRUE_WORD : FALSE_WORD);
		out.add(new ShellIR.Let(temp, decided));
		ShellIR inner = sequenceOf(prefix, new ShellIR.If(and ? right : new ShellCondition.Not(right), new ShellIR.Let(temp, other), null));
		out.add(new ShellIR.If(and ? left : new ShellCondition.Not(left), inner, null));
		return ShellCondition.Test.binary("=", new ShellValue.VarRef(temp), ShellValue.literal(TRUE_WORD));
	}

	/**
	 * @return the user functions of the last lowered program, by source name,
	 *         mapped to their shell function names
	 */
	public Map<String, String> getFunctionNames() {
		return functionNames == null ? Collections.<String, String>emptyMap() : Collections.unmodifiableMap(functionNames);
	}
}
