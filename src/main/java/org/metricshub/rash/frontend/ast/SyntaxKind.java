package org.metricshub.rash.frontend.ast;

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
 * Kinds of nodes in the generic syntax tree. The generic tree accepts more
 * of the host language than the transpiler supports; narrowing it down is
 * the restrictor's job.
 */
public enum SyntaxKind {
	// items
	FILE,
	FN,
	PARAM,
	RET_TYPE,
	TYPE,
	STRUCT,
	ENUM,
	UNION,
	IMPL,
	TRAIT,
	USE,
	MOD,
	CONST,
	STATIC,
	TYPE_ALIAS,
	EXTERN,
	MACRO_RULES,

	// statements
	BLOCK,
	LET,
	EXPR_STMT,

	// expressions
	LITERAL_INT,
	LITERAL_FLOAT,
	LITERAL_STR,
	LITERAL_BYTE_STR,
	LITERAL_CHAR,
	LITERAL_BOOL,
	PATH,
	BINARY,
	UNARY,
	ASSIGN,
	CALL,
	METHOD_CALL,
	MACRO_CALL,
	FIELD,
	INDEX,
	PAREN,
	TUPLE,
	ARRAY,
	RANGE,
	CAST,
	TRY,
	AWAIT,
	CLOSURE,
	IF,
	LET_COND,
	WHILE,
	LOOP,
	FOR,
	MATCH,
	MATCH_ARM,
	// patterns
	OR_PATTERN,
	WILDCARD,
	BREAK,
	CONTINUE,
	RETURN,
	STRUCT_LIT
}
