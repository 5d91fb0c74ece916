package org.metricshub.rash.ast;

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
 * The closed set of value types of the restricted language.
 */
public enum Type {
	/** No value. */
	VOID("()"),
	/** A string. */
	STR("&str"),
	/** A 32-bit signed integer. */
	I32("i32"),
	/** A boolean. */
	BOOL("bool");

	private final String sourceName;

	Type(String sourceName) {
		this.sourceName = sourceName;
	}

	/**
	 * @return the name of the type as written in source
	 */
	public String getSourceName() {
		return sourceName;
	}

	/**
	 * Maps a source type name to its restricted type.
	 *
	 * @param name the type as written in source, like <code>&amp;str</code> or <code>u8</code>
	 * @return the restricted type, or <code>null</code> when the type is not supported
	 */
	public static Type fromSourceName(String name) {
		switch (name) {
		case "()":
			return VOID;
		case "&str":
		case "&'static str":
		case "String":
		case "&String":
		case "std::string::String":
			return STR;
		case "i32":
		case "u32":
		case "u16":
		case "u8":
		case "i16":
		case "i8":
		case "usize":
			return I32;
		case "bool":
			return BOOL;
		default:
			return null;
		}
	}
}
