package org.metricshub.rash.validation;

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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.rash.ast.BinaryOp;
import org.metricshub.rash.ast.Expr;
import org.metricshub.rash.ast.Function;
import org.metricshub.rash.ast.Parameter;
import org.metricshub.rash.ast.Pattern;
import org.metricshub.rash.ast.RestrictedAst;
import org.metricshub.rash.ast.Stmt;
import org.metricshub.rash.ast.TestExpr;
import org.metricshub.rash.ast.TestKind;
import org.metricshub.rash.ast.Type;
import org.metricshub.rash.ast.UnaryOp;
import org.metricshub.rash.frontend.ast.SyntaxFlag;
import org.metricshub.rash.frontend.ast.SyntaxKind;
import org.metricshub.rash.frontend.ast.SyntaxNode;
import org.metricshub.rash.util.Config;
import org.metricshub.rash.util.RashLogger;
import org.slf4j.Logger;

/**
 * Narrows a generic syntax tree down to a {@link RestrictedAst}.
 * <p>
 * Every node shape with a restricted counterpart is converted; any other
 * shape raises a {@link ValidationException} naming the construct and its
 * location. A handful of convenient host-language forms are rewritten on
 * the way: assignments become non-declaring <code>let</code>s,
 * <code>loop</code> becomes <code>while true</code>, the formatting macros
 * become calls to the <code>echo</code>/<code>eprint</code>/<code>format</code>
 * built-ins, and the tail expression of a function returning a value
 * becomes a <code>return</code>.
 * <p>
 * Each recursive step counts towards a nesting depth capped by
 * {@link Config#getMaxNestingDepth()}, so that deeply nested input fails
 * with a validation error instead of exhausting the stack. A restrictor
 * instance is not thread-safe; use one per call.
 */
public class Restrictor {

	private static final Logger LOG = RashLogger.getLogger(Restrictor.class);

	private static final Set<String> HEAP_TYPES = new HashSet<String>(
			Arrays
					.asList(
							"Vec",
							"Box",
							"HashMap",
							"HashSet",
							"BTreeMap",
							"BTreeSet",
							"VecDeque",
							"LinkedList",
							"BinaryHeap",
							"Rc",
							"Arc",
							"RefCell",
							"Cell",
							"Mutex",
							"RwLock",
							"Option",
							"Result",
							"Cow"));

	/** Methods converting a string to a string without changing it. */
	private static final Set<String> STRING_IDENTITY_METHODS = new HashSet<String>(
			Arrays.asList("to_string", "to_owned", "clone", "as_str", "into", "to_str"));

	private final int maxDepth;
	private int depth;
	private Set<String> userFunctions = Collections.emptySet();

	/**
	 * Creates a restrictor with the default nesting cap.
	 */
	public Restrictor() {
		this(Config.DEFAULT_MAX_NESTING_DEPTH);
	}

	/**
	 * <p>
	 * Constructor for Restrictor.
	 * </p>
	 *
	 * @param maxDepth maximum nesting depth of the accepted tree
	 */
	public Restrictor(int maxDepth) {
		this.maxDepth = maxDepth;
	}

	/**
	 * Converts the given file into a validated restricted program.
	 *
	 * @param file a node of kind {@link SyntaxKind#FILE}
	 * @return the restricted program
	 * @throws ValidationException when the tree uses an unsupported construct
	 *         or breaks a program invariant
	 */
	public RestrictedAst restrict(SyntaxNode file) {
		if (file.getKind() != SyntaxKind.FILE) {
			throw unsupported("a " + file.getKind() + " node where a file was expected", file);
		}
		depth = 0;
		userFunctions = new HashSet<String>();
		for (SyntaxNode item : file.getChildren()) {
			if (item.getKind() == SyntaxKind.FN) {
				userFunctions.add(item.getText());
			}
		}
		List<Function> functions = new ArrayList<Function>();
		for (SyntaxNode item : file.getChildren()) {
			functions.add(restrictItem(item));
		}
		RestrictedAst ast = new RestrictedAst(functions);
		ast.validate();
		LOG.debug("restricted {} function(s)", functions.size());
		return ast;
	}

	private void enter(SyntaxNode node) {
		if (++depth > maxDepth) {
			throw new ValidationException("Nesting depth exceeds the maximum of " + maxDepth, node.getSpan());
		}
	}

	private void leave() {
		depth--;
	}

	private static ValidationException unsupported(String construct, SyntaxNode node) {
		return new ValidationException("Unsupported construct: " + construct, node.getSpan());
	}

	private Function restrictItem(SyntaxNode item) {
		switch (item.getKind()) {
		case FN:
			return restrictFunction(item);
		case STRUCT:
			throw unsupported("struct definition '" + item.getText() + "'", item);
		case ENUM:
			throw unsupported("enum definition '" + item.getText() + "'", item);
		case UNION:
			throw unsupported("union definition", item);
		case IMPL:
			throw unsupported("impl block", item);
		case TRAIT:
			throw unsupported("trait definition", item);
		case USE:
			throw unsupported("use declaration", item);
		case MOD:
			throw unsupported("module declaration", item);
		case CONST:
			throw unsupported("const item", item);
		case STATIC:
			throw unsupported("static item", item);
		case TYPE_ALIAS:
			throw unsupported("type alias", item);
		case EXTERN:
			throw unsupported("extern block", item);
		case MACRO_RULES:
			throw unsupported("macro definition", item);
		default:
			throw unsupported(item.getKind().name().toLowerCase() + " item", item);
		}
	}

	private Function restrictFunction(SyntaxNode fn) {
		String name = fn.getText();
		if (fn.hasFlag(SyntaxFlag.UNSAFE)) {
			throw unsupported("unsafe function '" + name + "'", fn);
		}
		if (fn.hasFlag(SyntaxFlag.ASYNC)) {
			throw unsupported("async function '" + name + "'", fn);
		}
		if (fn.hasFlag(SyntaxFlag.EXTERN_FN)) {
			throw unsupported("extern function '" + name + "'", fn);
		}
		if (fn.hasFlag(SyntaxFlag.GENERIC)) {
			throw unsupported("generic parameters on function '" + name + "'", fn);
		}
		if (fn.hasFlag(SyntaxFlag.WHERE_CLAUSE)) {
			throw unsupported("where clause on function '" + name + "'", fn);
		}
		List<Parameter> parameters = new ArrayList<Parameter>();
		Type returnType = Type.VOID;
		SyntaxNode body = null;
		for (SyntaxNode child : fn.getChildren()) {
			switch (child.getKind()) {
			case PARAM:
				parameters.add(restrictParameter(child));
				break;
			case RET_TYPE:
				returnType = restrictType(child.getChild(0));
				break;
			case BLOCK:
				body = child;
				break;
			default:
				throw unsupported(child.getKind() + " in function signature", child);
			}
		}
		if (body == null) {
			throw new ValidationException("Function '" + name + "' has no body", fn.getSpan());
		}
		List<Stmt> statements = restrictBlock(body, returnType != Type.VOID);
		return new Function(name, parameters, returnType, statements);
	}

	private Parameter restrictParameter(SyntaxNode param) {
		if (param.hasFlag(SyntaxFlag.SELF_PARAM)) {
			throw unsupported("self parameter (methods)", param);
		}
		if (param.hasFlag(SyntaxFlag.PATTERN)) {
			throw unsupported("destructuring parameter pattern", param);
		}
		Type type = restrictType(param.getChild(0));
		if (type == Type.VOID) {
			throw unsupported("parameter '" + param.getText() + "' of type ()", param);
		}
		return new Parameter(param.getText(), type);
	}

	/**
	 * Maps a syntax type onto the closed set of restricted types.
	 */
	private Type restrictType(SyntaxNode type) {
		String text = type.getText();
		if (type.hasFlag(SyntaxFlag.DYN)) {
			throw unsupported("trait object type '" + text + "'", type);
		}
		if (type.hasFlag(SyntaxFlag.IMPL_TRAIT)) {
			throw unsupported("impl Trait type '" + text + "'", type);
		}
		if (type.hasFlag(SyntaxFlag.RAW_POINTER)) {
			throw unsupported("raw pointer type '" + text + "'", type);
		}
		if (type.hasFlag(SyntaxFlag.FN_TYPE)) {
			throw unsupported("function pointer type", type);
		}
		if (type.hasFlag(SyntaxFlag.ARRAY_TYPE)) {
			throw unsupported("array or slice type '" + text + "'", type);
		}
		if (type.hasFlag(SyntaxFlag.TUPLE_TYPE)) {
			if (type.getChildCount() == 0) {
				return Type.VOID;
			}
			throw unsupported("tuple type", type);
		}
		if (type.hasFlag(SyntaxFlag.REF)) {
			if (type.hasFlag(SyntaxFlag.MUT)) {
				throw unsupported("mutable reference type '" + text + "'", type);
			}
			SyntaxNode inner = type.getChild(0);
			if (inner.hasFlag(SyntaxFlag.REF)) {
				throw unsupported("reference type '" + text + "'", type);
			}
			if (inner.getText().equals("str")) {
				return Type.STR;
			}
			Type innerType = restrictType(inner);
			if (innerType != Type.STR) {
				throw unsupported("reference type '" + text + "'", type);
			}
			return Type.STR;
		}
		String last = text.substring(text.lastIndexOf(':') + 1);
		if (HEAP_TYPES.contains(last)) {
			throw unsupported("heap container type '" + last + "'", type);
		}
		if (type.hasFlag(SyntaxFlag.GENERIC)) {
			throw unsupported("generic type '" + text + "'", type);
		}
		if (text.equals("str")) {
			throw unsupported("unsized type 'str' outside a reference", type);
		}
		Type mapped = Type.fromSourceName(text);
		if (mapped == null) {
			throw unsupported("type '" + text + "'", type);
		}
		return mapped;
	}

	/**
	 * Converts a block into statements.
	 *
	 * @param block the block node
	 * @param tailReturns whether a trailing expression is the block's value
	 *        returned from the enclosing function
	 */
	private List<Stmt> restrictBlock(SyntaxNode block, boolean tailReturns) {
		enter(block);
		try {
			checkPlainBlock(block);
			List<Stmt> statements = new ArrayList<Stmt>();
			for (SyntaxNode child : block.getChildren()) {
				boolean tail = child.getKind() == SyntaxKind.EXPR_STMT && child.hasFlag(SyntaxFlag.TAIL);
				statements.add(restrictStatement(child, tail && tailReturns));
			}
			return statements;
		} finally {
			leave();
		}
	}

	private static void checkPlainBlock(SyntaxNode block) {
		if (block.hasFlag(SyntaxFlag.UNSAFE)) {
			throw unsupported("unsafe block", block);
		}
		if (block.hasFlag(SyntaxFlag.ASYNC)) {
			throw unsupported("async block", block);
		}
		if (block.hasFlag(SyntaxFlag.LABELLED)) {
			throw unsupported("labelled block", block);
		}
	}

	private Stmt restrictStatement(SyntaxNode node, boolean returnsValue) {
		enter(node);
		try {
			switch (node.getKind()) {
			case LET:
				return restrictLet(node);
			case EXPR_STMT:
				SyntaxNode expr = node.getChild(0);
				if (returnsValue) {
					if (expr.getKind() == SyntaxKind.IF) {
						return restrictIfStatement(expr, true);
					}
					if (expr.getKind() == SyntaxKind.MATCH) {
						return restrictMatch(expr, true);
					}
					if (expr.getKind() != SyntaxKind.RETURN) {
						return new Stmt.Return(restrictExpr(expr));
					}
				}
				return restrictExpressionStatement(expr);
			case FN:
				throw unsupported("nested function '" + node.getText() + "'", node);
			default:
				// items declared inside a block
				throw unsupported(node.getKind().name().toLowerCase() + " item inside a function", node);
			}
		} finally {
			leave();
		}
	}

	private Stmt restrictLet(SyntaxNode let) {
		if (let.hasFlag(SyntaxFlag.PATTERN)) {
			throw unsupported("destructuring let pattern", let);
		}
		SyntaxNode init = null;
		for (SyntaxNode child : let.getChildren()) {
			if (child.getKind() == SyntaxKind.TYPE) {
				restrictType(child);
			} else {
				init = child;
			}
		}
		if (init == null) {
			throw unsupported("let without initializer for '" + let.getText() + "'", let);
		}
		return Stmt.Let.declare(let.getText(), restrictExpr(init));
	}

	private Stmt restrictExpressionStatement(SyntaxNode expr) {
		switch (expr.getKind()) {
		case ASSIGN:
			return restrictAssignment(expr);
		case IF:
			return restrictIfStatement(expr, false);
		case MATCH:
			return restrictMatch(expr, false);
		case WHILE:
			if (expr.hasFlag(SyntaxFlag.LABELLED)) {
				throw unsupported("labelled loop", expr);
			}
			if (expr.getChild(0).getKind() == SyntaxKind.LET_COND) {
				throw unsupported("while let", expr);
			}
			return new Stmt.While(restrictExpr(expr.getChild(0)), restrictBlock(expr.getChild(1), false));
		case LOOP:
			if (expr.hasFlag(SyntaxFlag.LABELLED)) {
				throw unsupported("labelled loop", expr);
			}
			return new Stmt.While(Expr.Literal.ofBool(true), restrictBlock(expr.getChild(0), false));
		case FOR:
			if (expr.hasFlag(SyntaxFlag.LABELLED)) {
				throw unsupported("labelled loop", expr);
			}
			if (expr.hasFlag(SyntaxFlag.PATTERN)) {
				throw unsupported("destructuring for pattern", expr);
			}
			return new Stmt.For(expr.getText(), restrictIterable(expr.getChild(0)), restrictBlock(expr.getChild(1), false));
		case BREAK:
			if (expr.hasFlag(SyntaxFlag.LABELLED)) {
				throw unsupported("labelled break", expr);
			}
			if (expr.getChildCount() > 0) {
				throw unsupported("break with a value", expr);
			}
			return Stmt.Break.INSTANCE;
		case CONTINUE:
			if (expr.hasFlag(SyntaxFlag.LABELLED)) {
				throw unsupported("labelled continue", expr);
			}
			return Stmt.Continue.INSTANCE;
		case RETURN:
			return new Stmt.Return(expr.getChildCount() == 0 ? null : restrictExpr(expr.getChild(0)));
		case BLOCK:
			checkPlainBlock(expr);
			throw unsupported("bare block statement", expr);
		case CALL:
			if (isIntrinsicCall(expr, "set_env")) {
				return restrictSetEnv(expr);
			}
			return new Stmt.ExprStmt(restrictExpr(expr));
		default:
			return new Stmt.ExprStmt(restrictExpr(expr));
		}
	}

	private Stmt restrictAssignment(SyntaxNode assign) {
		SyntaxNode target = assign.getChild(0);
		if (target.getKind() != SyntaxKind.PATH || target.getText().contains("::")) {
			throw unsupported("assignment to something other than a local variable", assign);
		}
		String name = target.getText();
		Expr value = restrictExpr(assign.getChild(1));
		String op = assign.getText();
		if (op.equals("=")) {
			return new Stmt.Let(name, value, false, false);
		}
		BinaryOp binaryOp = BinaryOp.fromSymbol(op.substring(0, op.length() - 1));
		if (binaryOp == null || !binaryOp.isArithmetic()) {
			throw unsupported("compound assignment '" + op + "'", assign);
		}
		return new Stmt.Let(name, new Expr.Binary(binaryOp, new Expr.Variable(name), value), false, false);
	}

	private Stmt restrictSetEnv(SyntaxNode call) {
		SyntaxNode nameNode = call.getChild(1);
		if (nameNode.getKind() != SyntaxKind.LITERAL_STR) {
			throw unsupported("set_env with a non-literal variable name", call);
		}
		RestrictedAst.checkIdentifier(nameNode.getText(), "environment variable name");
		return new Stmt.Let(nameNode.getText(), restrictExpr(call.getChild(2)), true, true);
	}

	private Stmt restrictIfStatement(SyntaxNode ifNode, boolean tailReturns) {
		Expr condition = restrictCondition(ifNode.getChild(0));
		List<Stmt> thenBody = restrictBlock(ifNode.getChild(1), tailReturns);
		List<Stmt.ElseIf> elseIfs = new ArrayList<Stmt.ElseIf>();
		List<Stmt> elseBody = null;
		SyntaxNode rest = ifNode.getChildCount() > 2 ? ifNode.getChild(2) : null;
		int nested = 0;
		try {
			while (rest != null) {
				if (rest.getKind() == SyntaxKind.IF) {
					enter(rest);
					nested++;
					elseIfs.add(new Stmt.ElseIf(restrictCondition(rest.getChild(0)), restrictBlock(rest.getChild(1), tailReturns)));
					rest = rest.getChildCount() > 2 ? rest.getChild(2) : null;
				} else {
					elseBody = restrictBlock(rest, tailReturns);
					rest = null;
				}
			}
		} finally {
			depth -= nested;
		}
		return new Stmt.If(condition, thenBody, elseIfs, elseBody);
	}

	private Stmt restrictMatch(SyntaxNode match, boolean tailReturns) {
		Expr scrutinee = restrictExpr(match.getChild(0));
		List<Stmt.MatchArm> arms = new ArrayList<Stmt.MatchArm>();
		for (SyntaxNode arm : match.getChildren().subList(1, match.getChildCount())) {
			enter(arm);
			try {
				if (arm.hasFlag(SyntaxFlag.GUARD)) {
					throw unsupported("match guard", arm);
				}
				arms.add(new Stmt.MatchArm(restrictPatterns(arm.getChild(0)), restrictArmBody(arm.getChild(1), tailReturns)));
			} finally {
				leave();
			}
		}
		return new Stmt.Match(scrutinee, arms);
	}

	private List<Stmt> restrictArmBody(SyntaxNode body, boolean tailReturns) {
		if (body.getKind() == SyntaxKind.BLOCK) {
			return restrictBlock(body, tailReturns);
		}
		// a bare arm expression is the tail of a block of its own
		SyntaxNode stmt = new SyntaxNode(SyntaxKind.EXPR_STMT, null, Collections.singletonList(body), EnumSet.of(SyntaxFlag.TAIL),
				body.getSpan());
		return Collections.singletonList(restrictStatement(stmt, tailReturns));
	}

	private List<Pattern> restrictPatterns(SyntaxNode pattern) {
		List<SyntaxNode> alternatives = pattern.getKind() == SyntaxKind.OR_PATTERN ? pattern.getChildren() : Collections.singletonList(pattern);
		List<Pattern> patterns = new ArrayList<Pattern>();
		for (SyntaxNode alternative : alternatives) {
			patterns.add(restrictPattern(alternative));
		}
		return patterns;
	}

	private Pattern restrictPattern(SyntaxNode node) {
		switch (node.getKind()) {
		case WILDCARD:
			return Pattern.Wildcard.INSTANCE;
		case LITERAL_STR:
		case LITERAL_INT:
		case LITERAL_BOOL:
			return new Pattern.Literal((Expr.Literal) restrictExpr(node));
		case UNARY:
			if (node.getText().equals("-") && node.getChild(0).getKind() == SyntaxKind.LITERAL_INT) {
				return new Pattern.Literal((Expr.Literal) restrictExpr(node));
			}
			throw unsupported("match pattern", node);
		case RANGE:
			if (node.hasFlag(SyntaxFlag.OPEN_RANGE)) {
				throw unsupported("open range pattern", node);
			}
			return new Pattern.Range(rangeBound(node.getChild(0)), rangeBound(node.getChild(1)), node.hasFlag(SyntaxFlag.INCLUSIVE));
		case PATH:
			throw unsupported("binding pattern '" + node.getText() + "'", node);
		default:
			throw unsupported("match pattern", node);
		}
	}

	private int rangeBound(SyntaxNode bound) {
		Pattern pattern = restrictPattern(bound);
		if (pattern instanceof Pattern.Literal) {
			Expr.Literal literal = ((Pattern.Literal) pattern).getValue();
			if (literal.getType() == Type.I32) {
				return literal.getIntValue();
			}
		}
		throw unsupported("range pattern bound other than an integer literal", bound);
	}

	private Expr restrictCondition(SyntaxNode cond) {
		if (cond.getKind() == SyntaxKind.LET_COND) {
			throw unsupported("if let", cond);
		}
		return restrictExpr(cond);
	}

	private Expr restrictIterable(SyntaxNode iterable) {
		if (iterable.getKind() == SyntaxKind.METHOD_CALL && iterable.getChildCount() == 1
				&& (iterable.getText().equals("iter") || iterable.getText().equals("into_iter"))) {
			return restrictExpr(iterable.getChild(0));
		}
		return restrictExpr(iterable);
	}

	private boolean isIntrinsicCall(SyntaxNode call, String name) {
		SyntaxNode callee = call.getChild(0);
		return callee.getKind() == SyntaxKind.PATH && callee.getText().equals(name) && !userFunctions.contains(name);
	}

	private Expr restrictExpr(SyntaxNode node) {
		enter(node);
		try {
			return restrictExprInner(node);
		} finally {
			leave();
		}
	}

	private Expr restrictExprInner(SyntaxNode node) {
		switch (node.getKind()) {
		case LITERAL_INT:
			return intLiteral(new BigInteger(node.getText()), node);
		case LITERAL_STR:
			if (node.getText().indexOf('\0') >= 0) {
				throw new ValidationException("String literal contains a NUL byte", node.getSpan());
			}
			return Expr.Literal.ofStr(node.getText());
		case LITERAL_BOOL:
			return Expr.Literal.ofBool(Boolean.parseBoolean(node.getText()));
		case LITERAL_FLOAT:
			throw unsupported("floating-point literal " + node.getText(), node);
		case LITERAL_CHAR:
			throw unsupported("character literal", node);
		case LITERAL_BYTE_STR:
			throw unsupported("byte string literal", node);
		case PATH:
			if (node.getText().contains("::") || node.hasFlag(SyntaxFlag.GENERIC)) {
				throw unsupported("path expression '" + node.getText() + "'", node);
			}
			return new Expr.Variable(node.getText());
		case PAREN:
			return restrictExpr(node.getChild(0));
		case BINARY:
			return restrictBinary(node);
		case UNARY:
			return restrictUnary(node);
		case CALL:
			return restrictCall(node);
		case METHOD_CALL:
			return restrictMethodCall(node);
		case MACRO_CALL:
			return restrictMacro(node);
		case INDEX:
			return new Expr.Index(restrictExpr(node.getChild(0)), restrictExpr(node.getChild(1)));
		case IF:
			return restrictIfValue(node);
		case RANGE:
			if (node.hasFlag(SyntaxFlag.OPEN_RANGE)) {
				throw unsupported("open range", node);
			}
			return new Expr.Range(restrictExpr(node.getChild(0)), restrictExpr(node.getChild(1)), node.hasFlag(SyntaxFlag.INCLUSIVE));
		case ARRAY:
			if (node.hasFlag(SyntaxFlag.REPEAT)) {
				throw unsupported("array repeat expression", node);
			}
			List<Expr> elements = new ArrayList<Expr>();
			for (SyntaxNode element : node.getChildren()) {
				elements.add(restrictExpr(element));
			}
			return new Expr.ArrayLiteral(elements);
		case CLOSURE:
			throw unsupported("closure", node);
		case BLOCK:
			checkPlainBlock(node);
			throw unsupported("block expression", node);
		case CAST:
			throw unsupported("cast ('as')", node);
		case TRY:
			throw unsupported("'?' operator", node);
		case AWAIT:
			throw unsupported("'.await'", node);
		case FIELD:
			throw unsupported("field access '." + node.getText() + "'", node);
		case TUPLE:
			throw unsupported(node.getChildCount() == 0 ? "unit value '()'" : "tuple", node);
		case STRUCT_LIT:
			throw unsupported("struct literal '" + node.getText() + "'", node);
		case MATCH:
			throw unsupported("match used as a value", node);
		case LET_COND:
			throw unsupported("let expression", node);
		case ASSIGN:
			throw unsupported("assignment used as a value", node);
		case WHILE:
		case LOOP:
		case FOR:
			throw unsupported("loop used as a value", node);
		case RETURN:
		case BREAK:
		case CONTINUE:
			throw unsupported(node.getKind().name().toLowerCase() + " used as a value", node);
		default:
			throw unsupported(node.getKind().name().toLowerCase(), node);
		}
	}

	private static Expr intLiteral(BigInteger value, SyntaxNode node) {
		if (value.bitLength() > 31) {
			throw new ValidationException("Integer literal " + value + " is out of the i32 range", node.getSpan());
		}
		return Expr.Literal.ofI32(value.intValue());
	}

	private Expr restrictBinary(SyntaxNode node) {
		BinaryOp op = BinaryOp.fromSymbol(node.getText());
		if (op == null) {
			throw unsupported("bitwise operator '" + node.getText() + "'", node);
		}
		return new Expr.Binary(op, restrictExpr(node.getChild(0)), restrictExpr(node.getChild(1)));
	}

	private Expr restrictUnary(SyntaxNode node) {
		SyntaxNode operand = node.getChild(0);
		switch (node.getText()) {
		case "-":
			if (operand.getKind() == SyntaxKind.LITERAL_INT) {
				return intLiteral(new BigInteger(operand.getText()).negate(), operand);
			}
			return new Expr.Unary(UnaryOp.NEG, restrictExpr(operand));
		case "!":
			return new Expr.Unary(UnaryOp.NOT, restrictExpr(operand));
		case "&":
			// shared borrows carry no meaning once values are shell strings
			return restrictExpr(operand);
		case "&mut":
			throw unsupported("mutable borrow", node);
		case "*":
			throw unsupported("dereference", node);
		default:
			throw unsupported("unary operator '" + node.getText() + "'", node);
		}
	}

	private Expr restrictCall(SyntaxNode call) {
		SyntaxNode callee = call.getChild(0);
		if (callee.getKind() != SyntaxKind.PATH) {
			throw unsupported("call of a computed function value", call);
		}
		if (callee.hasFlag(SyntaxFlag.GENERIC)) {
			throw unsupported("generic function call '" + callee.getText() + "'", call);
		}
		String name = canonicalCallName(callee);
		List<Expr> args = new ArrayList<Expr>();
		for (SyntaxNode arg : call.getChildren().subList(1, call.getChildCount())) {
			args.add(restrictExpr(arg));
		}
		if (!userFunctions.contains(name)) {
			TestKind testKind = testKindOf(name);
			if (testKind != null && args.size() == 1) {
				return new Expr.Test(new TestExpr(testKind, args.get(0)));
			}
			if (name.equals("set_env")) {
				throw unsupported("set_env used as a value", call);
			}
			if ((name.equals("env") || name.equals("env_var_or")) && !args.isEmpty()) {
				SyntaxNode nameNode = call.getChild(1);
				if (nameNode.getKind() != SyntaxKind.LITERAL_STR) {
					throw unsupported(name + " with a non-literal variable name", call);
				}
				RestrictedAst.checkIdentifier(nameNode.getText(), "environment variable name");
			}
			if (name.equals("arg") && args.size() == 1 && !(args.get(0) instanceof Expr.Literal)) {
				throw unsupported("arg with a non-literal position", call);
			}
		}
		return new Expr.FunctionCall(name, args);
	}

	private String canonicalCallName(SyntaxNode callee) {
		String path = callee.getText();
		if (!path.contains("::")) {
			return path;
		}
		switch (path) {
		case "std::env::var":
		case "env::var":
			return "env";
		case "std::process::exit":
		case "process::exit":
			return "exit";
		default:
			throw unsupported("call of path '" + path + "'", callee);
		}
	}

	private static TestKind testKindOf(String name) {
		switch (name) {
		case "path_exists":
			return TestKind.FILE_EXISTS;
		case "is_file":
			return TestKind.IS_FILE;
		case "is_dir":
			return TestKind.IS_DIRECTORY;
		default:
			return null;
		}
	}

	private Expr restrictMethodCall(SyntaxNode call) {
		if (call.hasFlag(SyntaxFlag.GENERIC)) {
			throw unsupported("generic method call '" + call.getText() + "'", call);
		}
		Expr receiver = restrictExpr(call.getChild(0));
		String method = call.getText();
		List<Expr> args = new ArrayList<Expr>();
		for (SyntaxNode arg : call.getChildren().subList(1, call.getChildCount())) {
			args.add(restrictExpr(arg));
		}
		if (args.isEmpty() && method.equals("is_empty")) {
			return new Expr.Test(new TestExpr(TestKind.STRING_EMPTY, receiver));
		}
		if (args.isEmpty() && STRING_IDENTITY_METHODS.contains(method)) {
			return new Expr.MethodCall(receiver, "to_string", args);
		}
		return new Expr.MethodCall(receiver, method, args);
	}

	private Expr restrictMacro(SyntaxNode macro) {
		String name = macro.getText();
		switch (name) {
		case "println":
			return new Expr.FunctionCall("echo", Collections.singletonList(formatArguments(macro, true)));
		case "eprintln":
			return new Expr.FunctionCall("eprint", Collections.singletonList(formatArguments(macro, true)));
		case "format":
			return formatArguments(macro, false);
		case "vec":
			throw unsupported("heap container macro 'vec!'", macro);
		default:
			throw unsupported("macro '" + name + "!'", macro);
		}
	}

	/**
	 * Converts the arguments of a formatting macro into either a plain string
	 * literal or a call of the <code>format</code> built-in whose format string
	 * only holds positional <code>{}</code> placeholders. Inline arguments
	 * such as <code>{name}</code> become variable arguments.
	 */
	private Expr formatArguments(SyntaxNode macro, boolean emptyAllowed) {
		if (macro.getChildCount() == 0) {
			if (emptyAllowed) {
				return Expr.Literal.ofStr("");
			}
			throw new ValidationException("format! requires a format string", macro.getSpan());
		}
		if (macro.hasFlag(SyntaxFlag.REPEAT)) {
			throw unsupported("malformed " + macro.getText() + "! arguments", macro);
		}
		SyntaxNode fmtNode = macro.getChild(0);
		if (fmtNode.getKind() != SyntaxKind.LITERAL_STR) {
			throw new ValidationException(macro.getText() + "! requires a string literal format", macro.getSpan());
		}
		String fmt = fmtNode.getText();
		if (fmt.indexOf('\0') >= 0) {
			throw new ValidationException("String literal contains a NUL byte", fmtNode.getSpan());
		}
		List<SyntaxNode> explicit = macro.getChildren().subList(1, macro.getChildCount());
		List<Expr> args = new ArrayList<Expr>();
		StringBuilder normalized = new StringBuilder();
		int next = 0;
		for (int i = 0; i < fmt.length(); i++) {
			char c = fmt.charAt(i);
			if (c == '{' && i + 1 < fmt.length() && fmt.charAt(i + 1) == '{') {
				normalized.append("{{");
				i++;
			} else if (c == '}' && i + 1 < fmt.length() && fmt.charAt(i + 1) == '}') {
				normalized.append("}}");
				i++;
			} else if (c == '{') {
				int close = fmt.indexOf('}', i);
				if (close < 0) {
					throw new ValidationException("Unterminated placeholder in format string", fmtNode.getSpan());
				}
				String inner = fmt.substring(i + 1, close);
				if (inner.isEmpty()) {
					if (next >= explicit.size()) {
						throw new ValidationException("Format string has more placeholders than arguments", fmtNode.getSpan());
					}
					args.add(restrictExpr(explicit.get(next++)));
				} else if (inner.matches("[A-Za-z_][A-Za-z0-9_]*")) {
					args.add(new Expr.Variable(inner));
				} else {
					throw unsupported("format specifier '{" + inner + "}'", fmtNode);
				}
				normalized.append("{}");
				i = close;
			} else if (c == '}') {
				throw new ValidationException("Unmatched '}' in format string", fmtNode.getSpan());
			} else {
				normalized.append(c);
			}
		}
		if (next != explicit.size()) {
			throw new ValidationException("Format string has " + next + " placeholder(s) but " + explicit.size() + " argument(s)",
					fmtNode.getSpan());
		}
		if (args.isEmpty()) {
			return Expr.Literal.ofStr(normalized.toString().replace("{{", "{").replace("}}", "}"));
		}
		List<Expr> callArgs = new ArrayList<Expr>();
		callArgs.add(Expr.Literal.ofStr(normalized.toString()));
		callArgs.addAll(args);
		return new Expr.FunctionCall("format", callArgs);
	}

	private Expr restrictIfValue(SyntaxNode ifNode) {
		Expr condition = restrictCondition(ifNode.getChild(0));
		Expr thenValue = blockValue(ifNode.getChild(1));
		if (ifNode.getChildCount() < 3) {
			throw unsupported("if expression without else", ifNode);
		}
		SyntaxNode rest = ifNode.getChild(2);
		Expr elseValue = rest.getKind() == SyntaxKind.IF ? restrictExpr(rest) : blockValue(rest);
		return new Expr.IfExpr(condition, thenValue, elseValue);
	}

	private Expr blockValue(SyntaxNode block) {
		checkPlainBlock(block);
		if (block.getChildCount() != 1 || block.getChild(0).getKind() != SyntaxKind.EXPR_STMT
				|| !block.getChild(0).hasFlag(SyntaxFlag.TAIL)) {
			throw unsupported("if expression branch that is not a single value", block);
		}
		return restrictExpr(block.getChild(0).getChild(0));
	}
}
