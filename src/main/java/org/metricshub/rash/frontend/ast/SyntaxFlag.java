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
 * Modifiers attached to a {@link SyntaxNode}.
 */
public enum SyntaxFlag {
	/** <code>mut</code> binding, parameter or reference. */
	MUT,
	/** Visibility modifier present. */
	PUB,
	/** Expression statement without a trailing semicolon, last in its block. */
	TAIL,
	/** <code>..=</code> range. */
	INCLUSIVE,
	/** Range with a missing bound. */
	OPEN_RANGE,
	/** <code>unsafe</code> function or block. */
	UNSAFE,
	/** <code>async</code> function or block. */
	ASYNC,
	/** <code>const fn</code>. */
	CONST_FN,
	/** <code>extern</code> function. */
	EXTERN_FN,
	/** Generic parameters or turbofish arguments. */
	GENERIC,
	/** <code>where</code> clause. */
	WHERE_CLAUSE,
	/** Labelled loop, or <code>break</code>/<code>continue</code> naming a label. */
	LABELLED,
	/** <code>self</code> parameter. */
	SELF_PARAM,
	/** Binding pattern other than a plain identifier. */
	PATTERN,
	/** Array or macro argument list of the form <code>[value; count]</code>. */
	REPEAT,
	/** Reference type. */
	REF,
	/** Trait object type. */
	DYN,
	/** <code>impl Trait</code> type. */
	IMPL_TRAIT,
	/** Raw pointer type. */
	RAW_POINTER,
	/** Tuple or unit type. */
	TUPLE_TYPE,
	/** Array or slice type. */
	ARRAY_TYPE,
	/** Function pointer type. */
	FN_TYPE,
	/** <code>move</code> closure or block. */
	MOVE,
	/** Match arm with an <code>if</code> guard. */
	GUARD
}
