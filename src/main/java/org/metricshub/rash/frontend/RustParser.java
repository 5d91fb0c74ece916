package org.metricshub.rash.frontend;

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

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.rash.frontend.RustLexer.Token;
import org.metricshub.rash.frontend.RustLexer.TokenType;
import org.metricshub.rash.frontend.ast.ParserException;
import org.metricshub.rash.frontend.ast.SourceSpan;
import org.metricshub.rash.frontend.ast.SyntaxFlag;
import org.metricshub.rash.frontend.ast.SyntaxKind;
import org.metricshub.rash.frontend.ast.SyntaxNode;
import org.metricshub.rash.util.RashLogger;
import org.metricshub.rash.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Converts Rust source text into a generic syntax tree.
 * <p>
 * This is a recursive descent parser over the tokens of {@link RustLexer}.
 * It recognizes a broad slice of the language (items, generics, closures,
 * <code>match</code>, casts and so on) without interpreting it: deciding
 * what the transpiler accepts is left to the restrictor. Grammar rules are
 * implemented by the methods in capital letters, each documented with the
 * production it parses.
 * <p>
 * Expression nesting is capped at {@link #MAX_EXPRESSION_DEPTH} so that
 * pathological input fails with a {@link ParserException} rather than
 * exhausting the stack.
 */
public class RustParser {

	private static final Logger LOG = RashLogger.getLogger(RustParser.class);

	/**
	 * Maximum nesting of expressions and blocks.
	 */
	public static final int MAX_EXPRESSION_DEPTH = 256;

	private static final Set<String> KEYWORDS = new HashSet<String>(
			Arrays
					.asList(
							"as",
							"async",
							"await",
							"break",
							"const",
							"continue",
							"crate",
							"dyn",
							"else",
							"enum",
							"extern",
							"false",
							"fn",
							"for",
							"if",
							"impl",
							"in",
							"let",
							"loop",
							"match",
							"mod",
							"move",
							"mut",
							"pub",
							"ref",
							"return",
							"static",
							"struct",
							"trait",
							"true",
							"type",
							"union",
							"unsafe",
							"use",
							"where",
							"while"));

	private static final Set<String> ASSIGN_OPS = new HashSet<String>(
			Arrays.asList("=", "+=", "-=", "*=", "/=", "%=", "^=", "&=", "|=", "<<=", ">>="));

	private static final Set<String> COMPARISON_OPS = new HashSet<String>(
			Arrays.asList("==", "!=", "<", ">", "<=", ">="));

	private List<Token> tokens;
	private int index;
	private Token token;
	private int depth;

	/**
	 * Parse the given source. Build and return the root of the syntax tree,
	 * a node of kind {@link SyntaxKind#FILE}.
	 *
	 * @param source the source to parse
	 * @return the syntax tree
	 * @throws IOException upon an IO error while reading the source
	 * @throws ParserException when the source is not well-formed
	 */
	public SyntaxNode parse(ScriptSource source) throws IOException {
		if (source == null) {
			throw new IOException("No source supplied");
		}
		String text = readFully(source.getReader());
		LOG.trace("parsing {} ({} chars)", source.getDescription(), text.length());
		tokens = new RustLexer(text, source.getDescription()).tokenize();
		index = 0;
		token = tokens.get(0);
		depth = 0;
		return FILE();
	}

	private static String readFully(Reader reader) throws IOException {
		if (reader == null) {
			throw new IOException("Source has no reader");
		}
		StringBuilder sb = new StringBuilder();
		char[] buf = new char[4096];
		int n;
		while ((n = reader.read(buf)) >= 0) {
			sb.append(buf, 0, n);
		}
		return sb.toString();
	}

	// token helpers

	private void lexer() {
		if (index < tokens.size() - 1) {
			index++;
		}
		token = tokens.get(index);
	}

	private Token peekToken(int offset) {
		int i = Math.min(index + offset, tokens.size() - 1);
		return tokens.get(i);
	}

	private boolean isPunct(String p) {
		return token.is(TokenType.PUNCT, p);
	}

	private boolean isKeyword(String k) {
		return token.is(TokenType.IDENT, k);
	}

	private boolean acceptPunct(String p) {
		if (isPunct(p)) {
			lexer();
			return true;
		}
		return false;
	}

	private boolean acceptKeyword(String k) {
		if (isKeyword(k)) {
			lexer();
			return true;
		}
		return false;
	}

	private void expectPunct(String p) {
		if (!acceptPunct(p)) {
			throw parserException("Expected '" + p + "' but found " + token);
		}
	}

	private void expectKeyword(String k) {
		if (!acceptKeyword(k)) {
			throw parserException("Expected '" + k + "' but found " + token);
		}
	}

	private String expectIdent() {
		if (token.getType() != TokenType.IDENT || KEYWORDS.contains(token.getText())) {
			throw parserException("Expected an identifier but found " + token);
		}
		String name = token.getText();
		lexer();
		return name;
	}

	private boolean isIdent() {
		return token.getType() == TokenType.IDENT && !KEYWORDS.contains(token.getText());
	}

	/**
	 * Consumes a closing angle bracket, splitting <code>&gt;&gt;</code> and
	 * friends when generic argument lists end together.
	 */
	private void expectCloseAngle() {
		String t = token.getText();
		if (token.getType() == TokenType.PUNCT && t.startsWith(">")) {
			if (t.length() == 1) {
				lexer();
			} else {
				List<Token> copy = new ArrayList<Token>(tokens);
				copy.set(index, new Token(TokenType.PUNCT, t.substring(1), token.getSpan()));
				tokens = copy;
				token = tokens.get(index);
			}
			return;
		}
		throw parserException("Expected '>' but found " + token);
	}

	private void enter() {
		if (++depth > MAX_EXPRESSION_DEPTH) {
			throw parserException("Expression nested more than " + MAX_EXPRESSION_DEPTH + " levels deep");
		}
	}

	private void leave() {
		depth--;
	}

	// CHECKSTYLE.OFF: MethodName

	// FILE : ITEM* EOF
	private SyntaxNode FILE() {
		SourceSpan span = token.getSpan();
		List<SyntaxNode> items = new ArrayList<SyntaxNode>();
		while (token.getType() != TokenType.EOF) {
			SyntaxNode item = ITEM();
			if (item != null) {
				items.add(item);
			}
		}
		return new SyntaxNode(SyntaxKind.FILE, null, items, EnumSet.noneOf(SyntaxFlag.class), span);
	}

	// ATTRIBUTE : '#' '!'? '[' ... ']'
	private void skipAttributes() {
		while (isPunct("#")) {
			lexer();
			acceptPunct("!");
			if (!isPunct("[")) {
				throw parserException("Expected '[' after '#' but found " + token);
			}
			skipBalanced();
		}
	}

	// ITEM : ATTRIBUTE* VISIBILITY? (FN | other item)
	private SyntaxNode ITEM() {
		skipAttributes();
		if (token.getType() == TokenType.EOF) {
			return null;
		}
		if (acceptPunct(";")) {
			return null;
		}
		SourceSpan span = token.getSpan();
		EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
		if (acceptKeyword("pub")) {
			flags.add(SyntaxFlag.PUB);
			if (isPunct("(")) {
				skipBalanced();
			}
		}
		// function qualifiers
		while (true) {
			if (isKeyword("const") && peekToken(1).is(TokenType.IDENT, "fn")) {
				lexer();
				flags.add(SyntaxFlag.CONST_FN);
			} else if (isKeyword("async") && !peekToken(1).is(TokenType.PUNCT, "{")) {
				lexer();
				flags.add(SyntaxFlag.ASYNC);
			} else if (isKeyword("unsafe") && !peekToken(1).is(TokenType.PUNCT, "{")) {
				lexer();
				flags.add(SyntaxFlag.UNSAFE);
			} else if (isKeyword("extern") && (peekToken(1).is(TokenType.IDENT, "fn")
					|| (peekToken(1).getType() == TokenType.STRING && peekToken(2).is(TokenType.IDENT, "fn")))) {
				lexer();
				if (token.getType() == TokenType.STRING) {
					lexer();
				}
				flags.add(SyntaxFlag.EXTERN_FN);
			} else {
				break;
			}
		}
		if (isKeyword("fn")) {
			return FN(span, flags);
		}
		if (flags.contains(SyntaxFlag.UNSAFE) && (isKeyword("impl") || isKeyword("trait"))) {
			// unsafe impl / unsafe trait
			SyntaxKind kind = isKeyword("impl") ? SyntaxKind.IMPL : SyntaxKind.TRAIT;
			return OTHER_ITEM(kind, span, flags);
		}
		if (token.getType() == TokenType.IDENT) {
			String keyword = token.getText();
			SyntaxKind kind = itemKind(keyword);
			if (kind != null) {
				return OTHER_ITEM(kind, span, flags);
			}
			if (keyword.equals("macro_rules") && peekToken(1).is(TokenType.PUNCT, "!")) {
				return OTHER_ITEM(SyntaxKind.MACRO_RULES, span, flags);
			}
		}
		throw parserException("Expected an item but found " + token);
	}

	private static SyntaxKind itemKind(String keyword) {
		switch (keyword) {
		case "struct":
			return SyntaxKind.STRUCT;
		case "enum":
			return SyntaxKind.ENUM;
		case "union":
			return SyntaxKind.UNION;
		case "impl":
			return SyntaxKind.IMPL;
		case "trait":
			return SyntaxKind.TRAIT;
		case "use":
			return SyntaxKind.USE;
		case "mod":
			return SyntaxKind.MOD;
		case "const":
			return SyntaxKind.CONST;
		case "static":
			return SyntaxKind.STATIC;
		case "type":
			return SyntaxKind.TYPE_ALIAS;
		case "extern":
			return SyntaxKind.EXTERN;
		default:
			return null;
		}
	}

	// OTHER_ITEM : keyword name? ... (';' | '{' ... '}' ';'?)
	// The body is skipped: none of these items has a shell counterpart.
	private SyntaxNode OTHER_ITEM(SyntaxKind kind, SourceSpan span, EnumSet<SyntaxFlag> flags) {
		lexer();
		if (kind == SyntaxKind.MACRO_RULES) {
			lexer();
		}
		acceptKeyword("mut");
		String name = isIdent() ? token.getText() : null;
		while (true) {
			if (token.getType() == TokenType.EOF) {
				throw parserException("Unterminated " + kind.name().toLowerCase() + " item");
			}
			if (acceptPunct(";")) {
				break;
			}
			if (isPunct("{")) {
				skipBalanced();
				acceptPunct(";");
				break;
			}
			if (isPunct("(") || isPunct("[")) {
				skipBalanced();
			} else {
				lexer();
			}
		}
		return new SyntaxNode(kind, name, new ArrayList<SyntaxNode>(), flags, span);
	}

	/**
	 * Skips a balanced bracket group starting at the current token.
	 */
	private void skipBalanced() {
		int level = 0;
		do {
			if (token.getType() == TokenType.EOF) {
				throw parserException("Unbalanced brackets");
			}
			String t = token.getText();
			if (token.getType() == TokenType.PUNCT) {
				if (t.equals("(") || t.equals("[") || t.equals("{")) {
					level++;
				} else if (t.equals(")") || t.equals("]") || t.equals("}")) {
					level--;
				}
			}
			lexer();
		} while (level > 0);
	}

	/**
	 * Skips a generic parameter or argument list <code>&lt;...&gt;</code>.
	 */
	private void skipGenerics() {
		expectPunct("<");
		int level = 1;
		while (level > 0) {
			if (token.getType() == TokenType.EOF) {
				throw parserException("Unterminated generic parameter list");
			}
			String t = token.getText();
			if (token.getType() == TokenType.PUNCT) {
				if (t.equals("<")) {
					level++;
				} else if (t.startsWith(">") && !t.equals(">=")) {
					level--;
					expectCloseAngle();
					continue;
				} else if (t.equals("->")) {
					lexer();
					continue;
				}
			}
			lexer();
		}
	}

	// FN : 'fn' ID GENERICS? '(' PARAM_LIST ')' ('->' TYPE)? WHERE? BLOCK
	private SyntaxNode FN(SourceSpan span, EnumSet<SyntaxFlag> flags) {
		expectKeyword("fn");
		String name = expectIdent();
		List<SyntaxNode> children = new ArrayList<SyntaxNode>();
		if (isPunct("<")) {
			skipGenerics();
			flags.add(SyntaxFlag.GENERIC);
		}
		expectPunct("(");
		while (!isPunct(")")) {
			children.add(PARAM());
			if (!acceptPunct(",")) {
				break;
			}
		}
		expectPunct(")");
		if (isPunct("->")) {
			SourceSpan retSpan = token.getSpan();
			lexer();
			children.add(SyntaxNode.of(SyntaxKind.RET_TYPE, null, retSpan, TYPE()));
		}
		if (acceptKeyword("where")) {
			flags.add(SyntaxFlag.WHERE_CLAUSE);
			while (!isPunct("{") && !isPunct(";")) {
				if (token.getType() == TokenType.EOF) {
					throw parserException("Unterminated where clause");
				}
				if (isPunct("<")) {
					skipGenerics();
				} else {
					lexer();
				}
			}
		}
		if (isPunct(";")) {
			throw parserException("Function '" + name + "' has no body");
		}
		children.add(BLOCK());
		return new SyntaxNode(SyntaxKind.FN, name, children, flags, span);
	}

	// PARAM : 'mut'? ID ':' TYPE | '&' 'mut'? 'self' | 'mut'? 'self' (':' TYPE)? | PATTERN ':' TYPE
	private SyntaxNode PARAM() {
		skipAttributes();
		SourceSpan span = token.getSpan();
		EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
		List<SyntaxNode> children = new ArrayList<SyntaxNode>();
		if (isPunct("&") || isKeyword("self") || (isKeyword("mut") && peekToken(1).is(TokenType.IDENT, "self"))) {
			while (!isKeyword("self")) {
				lexer();
			}
			lexer();
			flags.add(SyntaxFlag.SELF_PARAM);
			if (acceptPunct(":")) {
				children.add(TYPE());
			}
			return new SyntaxNode(SyntaxKind.PARAM, "self", children, flags, span);
		}
		String name = null;
		if (acceptKeyword("mut")) {
			flags.add(SyntaxFlag.MUT);
		}
		if (isIdent() && peekToken(1).is(TokenType.PUNCT, ":")) {
			name = expectIdent();
		} else {
			flags.add(SyntaxFlag.PATTERN);
			skipPattern();
		}
		expectPunct(":");
		children.add(TYPE());
		return new SyntaxNode(SyntaxKind.PARAM, name, children, flags, span);
	}

	/**
	 * Skips a non-trivial pattern up to a top-level ':', '=', ',' , ')' or 'in'.
	 */
	private void skipPattern() {
		while (true) {
			if (token.getType() == TokenType.EOF) {
				throw parserException("Unterminated pattern");
			}
			if (isPunct(":") || isPunct("=") || isPunct(",") || isPunct(")") || isPunct(";") || isKeyword("in")) {
				return;
			}
			if (isPunct("(") || isPunct("[") || isPunct("{")) {
				skipBalanced();
			} else {
				lexer();
			}
		}
	}

	// TYPE : '&' LIFETIME? 'mut'? TYPE | '*' ('const'|'mut') TYPE | 'dyn' BOUNDS | 'impl' BOUNDS
	// | '(' TYPE_LIST ')' | '[' TYPE (';' EXPR)? ']' | 'fn' '(' ... ')' ('->' TYPE)? | PATH GENERIC_ARGS?
	private SyntaxNode TYPE() {
		SourceSpan span = token.getSpan();
		EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
		List<SyntaxNode> children = new ArrayList<SyntaxNode>();
		if (isPunct("&") || isPunct("&&")) {
			boolean doubleRef = isPunct("&&");
			lexer();
			if (token.getType() == TokenType.LIFETIME) {
				lexer();
			}
			flags.add(SyntaxFlag.REF);
			if (acceptKeyword("mut")) {
				flags.add(SyntaxFlag.MUT);
			}
			SyntaxNode inner = TYPE();
			if (doubleRef) {
				inner = new SyntaxNode(SyntaxKind.TYPE, "&" + inner.getText(), Collections.singletonList(inner), EnumSet.of(SyntaxFlag.REF), span);
			}
			children.add(inner);
			String text = "&" + (flags.contains(SyntaxFlag.MUT) ? "mut " : "") + inner.getText();
			return new SyntaxNode(SyntaxKind.TYPE, text, children, flags, span);
		}
		if (acceptPunct("*")) {
			if (!acceptKeyword("const")) {
				expectKeyword("mut");
			}
			flags.add(SyntaxFlag.RAW_POINTER);
			SyntaxNode inner = TYPE();
			children.add(inner);
			return new SyntaxNode(SyntaxKind.TYPE, "*" + inner.getText(), children, flags, span);
		}
		if (isKeyword("dyn") || isKeyword("impl")) {
			boolean dyn = isKeyword("dyn");
			lexer();
			flags.add(dyn ? SyntaxFlag.DYN : SyntaxFlag.IMPL_TRAIT);
			SyntaxNode bound = TYPE();
			while (acceptPunct("+")) {
				if (token.getType() == TokenType.LIFETIME) {
					lexer();
				} else {
					TYPE();
				}
			}
			children.add(bound);
			return new SyntaxNode(SyntaxKind.TYPE, (dyn ? "dyn " : "impl ") + bound.getText(), children, flags, span);
		}
		if (acceptPunct("(")) {
			flags.add(SyntaxFlag.TUPLE_TYPE);
			while (!isPunct(")")) {
				children.add(TYPE());
				if (!acceptPunct(",")) {
					break;
				}
			}
			expectPunct(")");
			return new SyntaxNode(SyntaxKind.TYPE, children.isEmpty() ? "()" : "(tuple)", children, flags, span);
		}
		if (acceptPunct("[")) {
			flags.add(SyntaxFlag.ARRAY_TYPE);
			children.add(TYPE());
			if (acceptPunct(";")) {
				EXPRESSION(false);
			}
			expectPunct("]");
			return new SyntaxNode(SyntaxKind.TYPE, "[" + children.get(0).getText() + "]", children, flags, span);
		}
		if (isKeyword("fn") || isKeyword("unsafe") || isKeyword("extern")) {
			while (!isKeyword("fn")) {
				lexer();
			}
			lexer();
			flags.add(SyntaxFlag.FN_TYPE);
			expectPunct("(");
			while (!isPunct(")")) {
				children.add(TYPE());
				if (!acceptPunct(",")) {
					break;
				}
			}
			expectPunct(")");
			if (acceptPunct("->")) {
				children.add(TYPE());
			}
			return new SyntaxNode(SyntaxKind.TYPE, "fn", children, flags, span);
		}
		if (acceptPunct("!")) {
			return new SyntaxNode(SyntaxKind.TYPE, "!", children, flags, span);
		}
		StringBuilder path = new StringBuilder();
		acceptPunct("::");
		while (true) {
			if (token.getType() != TokenType.IDENT) {
				throw parserException("Expected a type but found " + token);
			}
			path.append(token.getText());
			lexer();
			if (isPunct("<")) {
				flags.add(SyntaxFlag.GENERIC);
				lexer();
				while (!(token.getType() == TokenType.PUNCT && token.getText().startsWith(">"))) {
					if (token.getType() == TokenType.LIFETIME) {
						lexer();
					} else {
						children.add(TYPE());
						if (acceptPunct("=")) {
							children.add(TYPE());
						}
					}
					if (!acceptPunct(",")) {
						break;
					}
				}
				expectCloseAngle();
			}
			if (isPunct("::") && peekToken(1).getType() == TokenType.IDENT) {
				lexer();
				path.append("::");
			} else {
				break;
			}
		}
		return new SyntaxNode(SyntaxKind.TYPE, path.toString(), children, flags, span);
	}

	// BLOCK : '{' STATEMENT* '}'
	private SyntaxNode BLOCK() {
		return BLOCK(EnumSet.noneOf(SyntaxFlag.class), token.getSpan());
	}

	private SyntaxNode BLOCK(EnumSet<SyntaxFlag> flags, SourceSpan span) {
		enter();
		try {
			expectPunct("{");
			List<SyntaxNode> statements = new ArrayList<SyntaxNode>();
			while (!isPunct("}")) {
				if (token.getType() == TokenType.EOF) {
					throw parserException("Unterminated block, expected '}'");
				}
				SyntaxNode stmt = STATEMENT();
				if (stmt != null) {
					statements.add(stmt);
				}
			}
			expectPunct("}");
			return new SyntaxNode(SyntaxKind.BLOCK, null, statements, flags, span);
		} finally {
			leave();
		}
	}

	// STATEMENT : ';' | LET | ITEM | EXPRESSION ';' | BLOCK_LIKE_EXPRESSION ';'? | EXPRESSION (tail)
	private SyntaxNode STATEMENT() {
		skipAttributes();
		if (acceptPunct(";")) {
			return null;
		}
		if (isKeyword("let")) {
			return LET();
		}
		if (startsItem()) {
			return ITEM();
		}
		SourceSpan span = token.getSpan();
		SyntaxNode expr = EXPRESSION(false);
		EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
		if (acceptPunct(";")) {
			return new SyntaxNode(SyntaxKind.EXPR_STMT, null, single(expr), flags, span);
		}
		if (isPunct("}")) {
			flags.add(SyntaxFlag.TAIL);
			return new SyntaxNode(SyntaxKind.EXPR_STMT, null, single(expr), flags, span);
		}
		if (isBlockLike(expr)) {
			return new SyntaxNode(SyntaxKind.EXPR_STMT, null, single(expr), flags, span);
		}
		throw parserException("Expected ';' but found " + token);
	}

	private boolean startsItem() {
		if (token.getType() != TokenType.IDENT) {
			return isPunct("#");
		}
		String t = token.getText();
		Token next = peekToken(1);
		switch (t) {
		case "fn":
		case "pub":
		case "struct":
		case "enum":
		case "trait":
		case "impl":
		case "use":
		case "mod":
		case "static":
		case "extern":
			return true;
		case "const":
			return !next.is(TokenType.PUNCT, "{");
		case "type":
		case "union":
			return next.getType() == TokenType.IDENT;
		case "unsafe":
			return !next.is(TokenType.PUNCT, "{");
		case "async":
			return next.is(TokenType.IDENT, "fn");
		case "macro_rules":
			return next.is(TokenType.PUNCT, "!");
		default:
			return false;
		}
	}

	private static boolean isBlockLike(SyntaxNode expr) {
		switch (expr.getKind()) {
		case BLOCK:
		case IF:
		case WHILE:
		case LOOP:
		case FOR:
		case MATCH:
			return true;
		default:
			return false;
		}
	}

	private static List<SyntaxNode> single(SyntaxNode node) {
		List<SyntaxNode> list = new ArrayList<SyntaxNode>(1);
		list.add(node);
		return list;
	}

	// LET : 'let' 'mut'? (ID | PATTERN) (':' TYPE)? ('=' EXPRESSION)? ('else' BLOCK)? ';'
	private SyntaxNode LET() {
		SourceSpan span = token.getSpan();
		expectKeyword("let");
		EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
		List<SyntaxNode> children = new ArrayList<SyntaxNode>();
		if (acceptKeyword("mut")) {
			flags.add(SyntaxFlag.MUT);
		}
		String name = null;
		if (isIdent() && (peekToken(1).is(TokenType.PUNCT, ":") || peekToken(1).is(TokenType.PUNCT, "=")
				|| peekToken(1).is(TokenType.PUNCT, ";"))) {
			name = expectIdent();
		} else {
			flags.add(SyntaxFlag.PATTERN);
			skipPattern();
		}
		if (acceptPunct(":")) {
			children.add(TYPE());
		}
		if (acceptPunct("=")) {
			children.add(EXPRESSION(false));
		}
		if (isKeyword("else")) {
			// let-else
			lexer();
			BLOCK();
			flags.add(SyntaxFlag.PATTERN);
		}
		expectPunct(";");
		return new SyntaxNode(SyntaxKind.LET, name, children, flags, span);
	}

	// EXPRESSION : ASSIGNMENT_EXPRESSION
	// noStruct: true in conditions and iterables, where '{' opens the body
	private SyntaxNode EXPRESSION(boolean noStruct) {
		enter();
		try {
			return ASSIGNMENT_EXPRESSION(noStruct);
		} finally {
			leave();
		}
	}

	// ASSIGNMENT_EXPRESSION : RANGE_EXPRESSION (ASSIGN_OP ASSIGNMENT_EXPRESSION)?
	private SyntaxNode ASSIGNMENT_EXPRESSION(boolean noStruct) {
		SyntaxNode lhs = RANGE_EXPRESSION(noStruct);
		if (token.getType() == TokenType.PUNCT && ASSIGN_OPS.contains(token.getText())) {
			String op = token.getText();
			SourceSpan span = token.getSpan();
			lexer();
			SyntaxNode rhs = EXPRESSION(noStruct);
			return SyntaxNode.of(SyntaxKind.ASSIGN, op, span, lhs, rhs);
		}
		return lhs;
	}

	// RANGE_EXPRESSION : OR_EXPRESSION? (('..' | '..=') OR_EXPRESSION?)?
	private SyntaxNode RANGE_EXPRESSION(boolean noStruct) {
		SourceSpan span = token.getSpan();
		SyntaxNode start = null;
		if (!isPunct("..") && !isPunct("..=")) {
			start = OR_EXPRESSION(noStruct);
			if (!isPunct("..") && !isPunct("..=")) {
				return start;
			}
		}
		EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
		String op = token.getText();
		if (op.equals("..=")) {
			flags.add(SyntaxFlag.INCLUSIVE);
		}
		lexer();
		List<SyntaxNode> children = new ArrayList<SyntaxNode>();
		if (start != null) {
			children.add(start);
		}
		if (startsExpression() && !(noStruct && isPunct("{"))) {
			children.add(OR_EXPRESSION(noStruct));
		}
		if (children.size() < 2) {
			flags.add(SyntaxFlag.OPEN_RANGE);
		}
		return new SyntaxNode(SyntaxKind.RANGE, op, children, flags, span);
	}

	private boolean startsExpression() {
		switch (token.getType()) {
		case EOF:
			return false;
		case PUNCT:
			String t = token.getText();
			return t.equals("(") || t.equals("[") || t.equals("{") || t.equals("-") || t.equals("!") || t.equals("*")
					|| t.equals("&") || t.equals("&&") || t.equals("|") || t.equals("||") || t.equals("..");
		case IDENT:
			String k = token.getText();
			return !KEYWORDS.contains(k) || k.equals("true") || k.equals("false") || k.equals("if") || k.equals("match")
					|| k.equals("loop") || k.equals("while") || k.equals("for") || k.equals("unsafe") || k.equals("move")
					|| k.equals("return") || k.equals("break") || k.equals("continue") || k.equals("async")
					|| k.equals("crate");
		default:
			return true;
		}
	}

	// OR_EXPRESSION : AND_EXPRESSION ('||' AND_EXPRESSION)*
	private SyntaxNode OR_EXPRESSION(boolean noStruct) {
		SyntaxNode lhs = AND_EXPRESSION(noStruct);
		while (isPunct("||")) {
			SourceSpan span = token.getSpan();
			lexer();
			lhs = SyntaxNode.of(SyntaxKind.BINARY, "||", span, lhs, AND_EXPRESSION(noStruct));
		}
		return lhs;
	}

	// AND_EXPRESSION : COMPARISON_EXPRESSION ('&&' COMPARISON_EXPRESSION)*
	private SyntaxNode AND_EXPRESSION(boolean noStruct) {
		SyntaxNode lhs = COMPARISON_EXPRESSION(noStruct);
		while (isPunct("&&")) {
			SourceSpan span = token.getSpan();
			lexer();
			lhs = SyntaxNode.of(SyntaxKind.BINARY, "&&", span, lhs, COMPARISON_EXPRESSION(noStruct));
		}
		return lhs;
	}

	// COMPARISON_EXPRESSION : BIT_OR_EXPRESSION (COMPARISON_OP BIT_OR_EXPRESSION)?
	private SyntaxNode COMPARISON_EXPRESSION(boolean noStruct) {
		SyntaxNode lhs = BIT_OR_EXPRESSION(noStruct);
		if (token.getType() == TokenType.PUNCT && COMPARISON_OPS.contains(token.getText())) {
			String op = token.getText();
			SourceSpan span = token.getSpan();
			lexer();
			lhs = SyntaxNode.of(SyntaxKind.BINARY, op, span, lhs, BIT_OR_EXPRESSION(noStruct));
			if (token.getType() == TokenType.PUNCT && COMPARISON_OPS.contains(token.getText())) {
				throw parserException("Comparison operators cannot be chained");
			}
		}
		return lhs;
	}

	// BIT_OR_EXPRESSION : BIT_XOR_EXPRESSION ('|' BIT_XOR_EXPRESSION)*
	private SyntaxNode BIT_OR_EXPRESSION(boolean noStruct) {
		SyntaxNode lhs = BIT_XOR_EXPRESSION(noStruct);
		while (isPunct("|")) {
			SourceSpan span = token.getSpan();
			lexer();
			lhs = SyntaxNode.of(SyntaxKind.BINARY, "|", span, lhs, BIT_XOR_EXPRESSION(noStruct));
		}
		return lhs;
	}

	// BIT_XOR_EXPRESSION : BIT_AND_EXPRESSION ('^' BIT_AND_EXPRESSION)*
	private SyntaxNode BIT_XOR_EXPRESSION(boolean noStruct) {
		SyntaxNode lhs = BIT_AND_EXPRESSION(noStruct);
		while (isPunct("^")) {
			SourceSpan span = token.getSpan();
			lexer();
			lhs = SyntaxNode.of(SyntaxKind.BINARY, "^", span, lhs, BIT_AND_EXPRESSION(noStruct));
		}
		return lhs;
	}

	// BIT_AND_EXPRESSION : SHIFT_EXPRESSION ('&' SHIFT_EXPRESSION)*
	private SyntaxNode BIT_AND_EXPRESSION(boolean noStruct) {
		SyntaxNode lhs = SHIFT_EXPRESSION(noStruct);
		while (isPunct("&")) {
			SourceSpan span = token.getSpan();
			lexer();
			lhs = SyntaxNode.of(SyntaxKind.BINARY, "&", span, lhs, SHIFT_EXPRESSION(noStruct));
		}
		return lhs;
	}

	// SHIFT_EXPRESSION : ADDITIVE_EXPRESSION (('<<' | '>>') ADDITIVE_EXPRESSION)*
	private SyntaxNode SHIFT_EXPRESSION(boolean noStruct) {
		SyntaxNode lhs = ADDITIVE_EXPRESSION(noStruct);
		while (isPunct("<<") || isPunct(">>")) {
			String op = token.getText();
			SourceSpan span = token.getSpan();
			lexer();
			lhs = SyntaxNode.of(SyntaxKind.BINARY, op, span, lhs, ADDITIVE_EXPRESSION(noStruct));
		}
		return lhs;
	}

	// ADDITIVE_EXPRESSION : MULTIPLICATIVE_EXPRESSION (('+' | '-') MULTIPLICATIVE_EXPRESSION)*
	private SyntaxNode ADDITIVE_EXPRESSION(boolean noStruct) {
		SyntaxNode lhs = MULTIPLICATIVE_EXPRESSION(noStruct);
		while (isPunct("+") || isPunct("-")) {
			String op = token.getText();
			SourceSpan span = token.getSpan();
			lexer();
			lhs = SyntaxNode.of(SyntaxKind.BINARY, op, span, lhs, MULTIPLICATIVE_EXPRESSION(noStruct));
		}
		return lhs;
	}

	// MULTIPLICATIVE_EXPRESSION : CAST_EXPRESSION (('*' | '/' | '%') CAST_EXPRESSION)*
	private SyntaxNode MULTIPLICATIVE_EXPRESSION(boolean noStruct) {
		SyntaxNode lhs = CAST_EXPRESSION(noStruct);
		while (isPunct("*") || isPunct("/") || isPunct("%")) {
			String op = token.getText();
			SourceSpan span = token.getSpan();
			lexer();
			lhs = SyntaxNode.of(SyntaxKind.BINARY, op, span, lhs, CAST_EXPRESSION(noStruct));
		}
		return lhs;
	}

	// CAST_EXPRESSION : UNARY_EXPRESSION ('as' TYPE)*
	private SyntaxNode CAST_EXPRESSION(boolean noStruct) {
		SyntaxNode expr = UNARY_EXPRESSION(noStruct);
		while (isKeyword("as")) {
			SourceSpan span = token.getSpan();
			lexer();
			expr = SyntaxNode.of(SyntaxKind.CAST, "as", span, expr, TYPE());
		}
		return expr;
	}

	// UNARY_EXPRESSION : ('-' | '!' | '*' | '&' 'mut'?) UNARY_EXPRESSION | POSTFIX_EXPRESSION
	private SyntaxNode UNARY_EXPRESSION(boolean noStruct) {
		if (isPunct("-") || isPunct("!") || isPunct("*") || isPunct("&") || isPunct("&&")) {
			enter();
			try {
				SourceSpan span = token.getSpan();
				String op = token.getText();
				lexer();
				if (op.equals("&&")) {
					// & &x
					op = "&";
					SyntaxNode inner = SyntaxNode.of(SyntaxKind.UNARY, "&", span, UNARY_EXPRESSION(noStruct));
					return SyntaxNode.of(SyntaxKind.UNARY, op, span, inner);
				}
				if (op.equals("&") && acceptKeyword("mut")) {
					op = "&mut";
				}
				return SyntaxNode.of(SyntaxKind.UNARY, op, span, UNARY_EXPRESSION(noStruct));
			} finally {
				leave();
			}
		}
		return POSTFIX_EXPRESSION(noStruct);
	}

	// POSTFIX_EXPRESSION : PRIMARY ('(' ARGS ')' | '.' ID TURBOFISH? '(' ARGS ')' | '.' ID | '.' INT | '.await'
	// | '[' EXPRESSION ']' | '?')*
	private SyntaxNode POSTFIX_EXPRESSION(boolean noStruct) {
		SyntaxNode expr = PRIMARY(noStruct);
		while (true) {
			SourceSpan span = token.getSpan();
			if (isPunct("(")) {
				List<SyntaxNode> children = new ArrayList<SyntaxNode>();
				children.add(expr);
				children.addAll(ARGUMENTS("(", ")"));
				expr = new SyntaxNode(SyntaxKind.CALL, null, children, EnumSet.noneOf(SyntaxFlag.class), span);
			} else if (isPunct(".")) {
				lexer();
				if (token.getType() == TokenType.INT || token.getType() == TokenType.FLOAT) {
					// tuple field
					String field = token.getText();
					lexer();
					expr = SyntaxNode.of(SyntaxKind.FIELD, field, span, expr);
				} else if (acceptKeyword("await")) {
					expr = SyntaxNode.of(SyntaxKind.AWAIT, null, span, expr);
				} else {
					if (token.getType() != TokenType.IDENT) {
						throw parserException("Expected a field or method name but found " + token);
					}
					String name = token.getText();
					lexer();
					EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
					if (isPunct("::")) {
						lexer();
						skipGenerics();
						flags.add(SyntaxFlag.GENERIC);
					}
					if (isPunct("(")) {
						List<SyntaxNode> children = new ArrayList<SyntaxNode>();
						children.add(expr);
						children.addAll(ARGUMENTS("(", ")"));
						expr = new SyntaxNode(SyntaxKind.METHOD_CALL, name, children, flags, span);
					} else {
						expr = SyntaxNode.of(SyntaxKind.FIELD, name, span, expr);
					}
				}
			} else if (isPunct("[")) {
				lexer();
				SyntaxNode idx = EXPRESSION(false);
				expectPunct("]");
				expr = SyntaxNode.of(SyntaxKind.INDEX, null, span, expr, idx);
			} else if (isPunct("?")) {
				lexer();
				expr = SyntaxNode.of(SyntaxKind.TRY, null, span, expr);
			} else {
				return expr;
			}
		}
	}

	// ARGS : (EXPRESSION (',' EXPRESSION)* ','?)?
	private List<SyntaxNode> ARGUMENTS(String open, String close) {
		expectPunct(open);
		List<SyntaxNode> args = new ArrayList<SyntaxNode>();
		while (!isPunct(close)) {
			args.add(EXPRESSION(false));
			if (!acceptPunct(",")) {
				break;
			}
		}
		expectPunct(close);
		return args;
	}

	// PRIMARY : LITERAL | PATH | MACRO_CALL | STRUCT_LIT | '(' ... ')' | '[' ... ']' | BLOCK | 'unsafe' BLOCK
	// | 'async' BLOCK | IF | WHILE | LOOP | FOR | MATCH | BREAK | CONTINUE | RETURN | CLOSURE | LABEL ':' LOOP_EXPRESSION
	private SyntaxNode PRIMARY(boolean noStruct) {
		SourceSpan span = token.getSpan();
		switch (token.getType()) {
		case INT:
			return literal(SyntaxKind.LITERAL_INT);
		case FLOAT:
			return literal(SyntaxKind.LITERAL_FLOAT);
		case STRING:
			return literal(SyntaxKind.LITERAL_STR);
		case BYTE_STRING:
			return literal(SyntaxKind.LITERAL_BYTE_STR);
		case CHAR:
			return literal(SyntaxKind.LITERAL_CHAR);
		case LIFETIME:
			String label = token.getText();
			lexer();
			expectPunct(":");
			return LOOP_EXPRESSION(label, span);
		case PUNCT:
			return PUNCT_PRIMARY(noStruct, span);
		case IDENT:
			return IDENT_PRIMARY(noStruct, span);
		default:
			throw parserException("Unexpected " + token);
		}
	}

	private SyntaxNode literal(SyntaxKind kind) {
		SyntaxNode node = SyntaxNode.leaf(kind, token.getText(), token.getSpan());
		lexer();
		return node;
	}

	private SyntaxNode PUNCT_PRIMARY(boolean noStruct, SourceSpan span) {
		String t = token.getText();
		if (t.equals("(")) {
			lexer();
			if (acceptPunct(")")) {
				return SyntaxNode.of(SyntaxKind.TUPLE, null, span);
			}
			SyntaxNode first = EXPRESSION(false);
			if (acceptPunct(")")) {
				return SyntaxNode.of(SyntaxKind.PAREN, null, span, first);
			}
			List<SyntaxNode> elements = new ArrayList<SyntaxNode>();
			elements.add(first);
			while (acceptPunct(",")) {
				if (isPunct(")")) {
					break;
				}
				elements.add(EXPRESSION(false));
			}
			expectPunct(")");
			return new SyntaxNode(SyntaxKind.TUPLE, null, elements, EnumSet.noneOf(SyntaxFlag.class), span);
		}
		if (t.equals("[")) {
			lexer();
			List<SyntaxNode> elements = new ArrayList<SyntaxNode>();
			EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
			if (!isPunct("]")) {
				elements.add(EXPRESSION(false));
				if (acceptPunct(";")) {
					flags.add(SyntaxFlag.REPEAT);
					elements.add(EXPRESSION(false));
				} else {
					while (acceptPunct(",")) {
						if (isPunct("]")) {
							break;
						}
						elements.add(EXPRESSION(false));
					}
				}
			}
			expectPunct("]");
			return new SyntaxNode(SyntaxKind.ARRAY, null, elements, flags, span);
		}
		if (t.equals("{")) {
			return BLOCK();
		}
		if (t.equals("|") || t.equals("||")) {
			return CLOSURE(EnumSet.noneOf(SyntaxFlag.class), span);
		}
		if (t.equals("::") || t.equals("<")) {
			return PATH_PRIMARY(noStruct, span);
		}
		throw parserException("Unexpected " + token);
	}

	private SyntaxNode IDENT_PRIMARY(boolean noStruct, SourceSpan span) {
		String t = token.getText();
		switch (t) {
		case "true":
		case "false":
			return literal(SyntaxKind.LITERAL_BOOL);
		case "if":
			return IF();
		case "while":
		case "loop":
		case "for":
			return LOOP_EXPRESSION(null, span);
		case "match":
			return MATCH();
		case "unsafe":
			lexer();
			return BLOCK(EnumSet.of(SyntaxFlag.UNSAFE), span);
		case "async":
			lexer();
			EnumSet<SyntaxFlag> asyncFlags = EnumSet.of(SyntaxFlag.ASYNC);
			if (acceptKeyword("move")) {
				asyncFlags.add(SyntaxFlag.MOVE);
			}
			if (isPunct("|") || isPunct("||")) {
				return CLOSURE(asyncFlags, span);
			}
			return BLOCK(asyncFlags, span);
		case "move":
			lexer();
			return CLOSURE(EnumSet.of(SyntaxFlag.MOVE), span);
		case "const":
			// const block
			lexer();
			return BLOCK();
		case "let":
			return LET_CONDITION();
		case "return": {
			lexer();
			List<SyntaxNode> children = new ArrayList<SyntaxNode>();
			if (startsExpression() && !(noStruct && isPunct("{"))) {
				children.add(EXPRESSION(noStruct));
			}
			return new SyntaxNode(SyntaxKind.RETURN, null, children, EnumSet.noneOf(SyntaxFlag.class), span);
		}
		case "break":
		case "continue": {
			lexer();
			SyntaxKind kind = t.equals("break") ? SyntaxKind.BREAK : SyntaxKind.CONTINUE;
			EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
			String label = null;
			if (token.getType() == TokenType.LIFETIME) {
				label = token.getText();
				flags.add(SyntaxFlag.LABELLED);
				lexer();
			}
			List<SyntaxNode> children = new ArrayList<SyntaxNode>();
			if (kind == SyntaxKind.BREAK && startsExpression() && !(noStruct && isPunct("{"))) {
				children.add(EXPRESSION(noStruct));
			}
			return new SyntaxNode(kind, label, children, flags, span);
		}
		default:
			return PATH_PRIMARY(noStruct, span);
		}
	}

	// PATH_PRIMARY : PATH ('!' MACRO_ARGS | STRUCT_BODY)?
	private SyntaxNode PATH_PRIMARY(boolean noStruct, SourceSpan span) {
		EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
		StringBuilder path = new StringBuilder();
		if (isPunct("<")) {
			// qualified path <T as Trait>::item
			skipGenerics();
			flags.add(SyntaxFlag.GENERIC);
			path.append("<qualified>");
		}
		if (acceptPunct("::")) {
			path.append("::");
		}
		while (true) {
			if (token.getType() != TokenType.IDENT) {
				throw parserException("Expected an identifier but found " + token);
			}
			if (KEYWORDS.contains(token.getText()) && !token.getText().equals("crate")) {
				throw parserException("Unexpected keyword '" + token.getText() + "'");
			}
			path.append(token.getText());
			lexer();
			if (isPunct("::") && peekToken(1).is(TokenType.PUNCT, "<")) {
				lexer();
				skipGenerics();
				flags.add(SyntaxFlag.GENERIC);
			}
			if (isPunct("::") && peekToken(1).getType() == TokenType.IDENT) {
				lexer();
				path.append("::");
			} else {
				break;
			}
		}
		String name = path.toString();
		if (isPunct("!") && (peekToken(1).is(TokenType.PUNCT, "(") || peekToken(1).is(TokenType.PUNCT, "[")
				|| peekToken(1).is(TokenType.PUNCT, "{"))) {
			lexer();
			return MACRO_CALL(name, span);
		}
		if (isPunct("{") && !noStruct && startsWithUpperCase(name)) {
			skipBalanced();
			return new SyntaxNode(SyntaxKind.STRUCT_LIT, name, new ArrayList<SyntaxNode>(), flags, span);
		}
		return new SyntaxNode(SyntaxKind.PATH, name, new ArrayList<SyntaxNode>(), flags, span);
	}

	private static boolean startsWithUpperCase(String path) {
		int i = path.lastIndexOf("::");
		String last = i < 0 ? path : path.substring(i + 2);
		return !last.isEmpty() && Character.isUpperCase(last.charAt(0));
	}

	// MACRO_CALL : ID '!' ('(' ARGS ')' | '[' ARGS ']' | '{' ARGS '}')
	private SyntaxNode MACRO_CALL(String name, SourceSpan span) {
		String open = token.getText();
		String close = open.equals("(") ? ")" : open.equals("[") ? "]" : "}";
		lexer();
		EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
		List<SyntaxNode> args = new ArrayList<SyntaxNode>();
		if (!isPunct(close)) {
			args.add(EXPRESSION(false));
			if (acceptPunct(";")) {
				flags.add(SyntaxFlag.REPEAT);
				args.add(EXPRESSION(false));
			} else {
				while (acceptPunct(",")) {
					if (isPunct(close)) {
						break;
					}
					args.add(EXPRESSION(false));
				}
			}
		}
		expectPunct(close);
		return new SyntaxNode(SyntaxKind.MACRO_CALL, name, args, flags, span);
	}

	// CLOSURE : ('|' PARAMS '|' | '||') ('->' TYPE)? EXPRESSION
	private SyntaxNode CLOSURE(EnumSet<SyntaxFlag> flags, SourceSpan span) {
		List<SyntaxNode> children = new ArrayList<SyntaxNode>();
		if (!acceptPunct("||")) {
			expectPunct("|");
			while (!isPunct("|")) {
				if (token.getType() == TokenType.EOF) {
					throw parserException("Unterminated closure parameter list");
				}
				lexer();
			}
			expectPunct("|");
		}
		if (acceptPunct("->")) {
			TYPE();
		}
		children.add(EXPRESSION(false));
		return new SyntaxNode(SyntaxKind.CLOSURE, null, children, flags, span);
	}

	// LET_CONDITION : 'let' PATTERN '=' EXPRESSION
	private SyntaxNode LET_CONDITION() {
		SourceSpan span = token.getSpan();
		expectKeyword("let");
		skipPattern();
		expectPunct("=");
		return SyntaxNode.of(SyntaxKind.LET_COND, null, span, EXPRESSION(true));
	}

	// IF : 'if' EXPRESSION BLOCK ('else' (IF | BLOCK))?
	private SyntaxNode IF() {
		SourceSpan span = token.getSpan();
		expectKeyword("if");
		List<SyntaxNode> children = new ArrayList<SyntaxNode>();
		children.add(EXPRESSION(true));
		children.add(BLOCK());
		if (acceptKeyword("else")) {
			if (isKeyword("if")) {
				enter();
				try {
					children.add(IF());
				} finally {
					leave();
				}
			} else {
				children.add(BLOCK());
			}
		}
		return new SyntaxNode(SyntaxKind.IF, null, children, EnumSet.noneOf(SyntaxFlag.class), span);
	}

	// LOOP_EXPRESSION : 'while' EXPRESSION BLOCK | 'loop' BLOCK | 'for' PATTERN 'in' EXPRESSION BLOCK
	private SyntaxNode LOOP_EXPRESSION(String label, SourceSpan span) {
		EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
		if (label != null) {
			flags.add(SyntaxFlag.LABELLED);
		}
		if (acceptKeyword("while")) {
			SyntaxNode cond = EXPRESSION(true);
			SyntaxNode body = BLOCK();
			List<SyntaxNode> children = new ArrayList<SyntaxNode>();
			children.add(cond);
			children.add(body);
			return new SyntaxNode(SyntaxKind.WHILE, label, children, flags, span);
		}
		if (acceptKeyword("loop")) {
			return new SyntaxNode(SyntaxKind.LOOP, label, single(BLOCK()), flags, span);
		}
		if (acceptKeyword("for")) {
			String var = null;
			if (isIdent() && peekToken(1).is(TokenType.IDENT, "in")) {
				var = expectIdent();
			} else {
				flags.add(SyntaxFlag.PATTERN);
				skipPattern();
			}
			expectKeyword("in");
			SyntaxNode iterable = EXPRESSION(true);
			SyntaxNode body = BLOCK();
			List<SyntaxNode> children = new ArrayList<SyntaxNode>();
			children.add(iterable);
			children.add(body);
			// the text holds the loop variable, so a label only shows as a flag
			return new SyntaxNode(SyntaxKind.FOR, var, children, flags, span);
		}
		if (isPunct("{")) {
			// labelled block
			return BLOCK(flags, span);
		}
		throw parserException("Expected a loop after label but found " + token);
	}

	// MATCH : 'match' EXPRESSION '{' MATCH_ARM* '}'
	private SyntaxNode MATCH() {
		SourceSpan span = token.getSpan();
		expectKeyword("match");
		List<SyntaxNode> children = new ArrayList<SyntaxNode>();
		children.add(EXPRESSION(true));
		if (!isPunct("{")) {
			throw parserException("Expected '{' after match scrutinee but found " + token);
		}
		enter();
		try {
			expectPunct("{");
			while (!isPunct("}")) {
				if (token.getType() == TokenType.EOF) {
					throw parserException("Unterminated match, expected '}'");
				}
				skipAttributes();
				children.add(MATCH_ARM());
			}
			expectPunct("}");
		} finally {
			leave();
		}
		return new SyntaxNode(SyntaxKind.MATCH, null, children, EnumSet.noneOf(SyntaxFlag.class), span);
	}

	// MATCH_ARM : PATTERN ('if' EXPRESSION)? '=>' (BLOCK ','? | EXPRESSION (',' | &'}'))
	private SyntaxNode MATCH_ARM() {
		SourceSpan span = token.getSpan();
		List<SyntaxNode> children = new ArrayList<SyntaxNode>();
		EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
		children.add(PATTERN());
		if (acceptKeyword("if")) {
			flags.add(SyntaxFlag.GUARD);
			children.add(EXPRESSION(true));
		}
		if (!acceptPunct("=>")) {
			throw parserException("Expected '=>' after match pattern but found " + token);
		}
		SyntaxNode body;
		if (isPunct("{")) {
			body = BLOCK();
			acceptPunct(",");
		} else {
			body = EXPRESSION(false);
			if (!acceptPunct(",") && !isPunct("}") && !isBlockLike(body)) {
				throw parserException("Expected ',' after match arm but found " + token);
			}
		}
		children.add(body);
		return new SyntaxNode(SyntaxKind.MATCH_ARM, null, children, flags, span);
	}

	// PATTERN : '|'? PATTERN_ALTERNATIVE ('|' PATTERN_ALTERNATIVE)*
	private SyntaxNode PATTERN() {
		SourceSpan span = token.getSpan();
		acceptPunct("|");
		List<SyntaxNode> alternatives = new ArrayList<SyntaxNode>();
		alternatives.add(PATTERN_ALTERNATIVE());
		while (acceptPunct("|")) {
			alternatives.add(PATTERN_ALTERNATIVE());
		}
		if (alternatives.size() == 1) {
			return alternatives.get(0);
		}
		return new SyntaxNode(SyntaxKind.OR_PATTERN, null, alternatives, EnumSet.noneOf(SyntaxFlag.class), span);
	}

	// PATTERN_ALTERNATIVE : '_' | BIT_XOR_EXPRESSION (('..' | '..=') BIT_XOR_EXPRESSION?)?
	private SyntaxNode PATTERN_ALTERNATIVE() {
		SourceSpan span = token.getSpan();
		if (token.is(TokenType.IDENT, "_")) {
			lexer();
			return SyntaxNode.leaf(SyntaxKind.WILDCARD, "_", span);
		}
		SyntaxNode start = BIT_XOR_EXPRESSION(true);
		if (!isPunct("..") && !isPunct("..=")) {
			return start;
		}
		EnumSet<SyntaxFlag> flags = EnumSet.noneOf(SyntaxFlag.class);
		String op = token.getText();
		if (op.equals("..=")) {
			flags.add(SyntaxFlag.INCLUSIVE);
		}
		lexer();
		List<SyntaxNode> bounds = new ArrayList<SyntaxNode>();
		bounds.add(start);
		if (startsExpression() && !isPunct("|") && !isPunct("{") && !isKeyword("if")) {
			bounds.add(BIT_XOR_EXPRESSION(true));
		} else {
			flags.add(SyntaxFlag.OPEN_RANGE);
		}
		return new SyntaxNode(SyntaxKind.RANGE, op, bounds, flags, span);
	}

	// CHECKSTYLE.ON: MethodName

	private ParserException parserException(String msg) {
		return new ParserException(msg, token.getSpan());
	}
}
