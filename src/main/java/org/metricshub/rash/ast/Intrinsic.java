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
 * The fixed allow-list of built-in functions a program may call besides its
 * own functions. The table is constant; user functions of the same name take
 * precedence.
 */
public enum Intrinsic {
	ECHO("echo", 1, 1, Type.VOID),
	EPRINT("eprint", 1, 1, Type.VOID),
	MKDIR_P("mkdir_p", 1, 1, Type.VOID),
	WRITE_FILE("write_file", 2, 2, Type.VOID),
	READ_FILE("read_file", 1, 1, Type.STR),
	REMOVE_FILE("remove_file", 1, 1, Type.VOID),
	SYMLINK("symlink", 2, 2, Type.VOID),
	PATH_EXISTS("path_exists", 1, 1, Type.BOOL),
	IS_FILE("is_file", 1, 1, Type.BOOL),
	IS_DIR("is_dir", 1, 1, Type.BOOL),
	ENV("env", 1, 1, Type.STR),
	ENV_VAR_OR("env_var_or", 2, 2, Type.STR),
	SET_ENV("set_env", 2, 2, Type.VOID),
	EXEC("exec", 1, -1, Type.VOID),
	CAPTURE("capture", 1, -1, Type.STR),
	CD("cd", 1, 1, Type.VOID),
	REQUIRE("require", 1, 1, Type.VOID),
	EXIT("exit", 1, 1, Type.VOID),
	ARG("arg", 1, 1, Type.STR),
	FORMAT("format", 1, -1, Type.STR);

	private final String functionName;
	private final int minArgs;
	private final int maxArgs;
	private final Type returnType;

	Intrinsic(String functionName, int minArgs, int maxArgs, Type returnType) {
		this.functionName = functionName;
		this.minArgs = minArgs;
		this.maxArgs = maxArgs;
		this.returnType = returnType;
	}

	/**
	 * @return the name a program calls this intrinsic by
	 */
	public String getFunctionName() {
		return functionName;
	}

	public int getMinArgs() {
		return minArgs;
	}

	/**
	 * @return the maximum number of arguments, or <code>-1</code> for variadic intrinsics
	 */
	public int getMaxArgs() {
		return maxArgs;
	}

	public Type getReturnType() {
		return returnType;
	}

	/**
	 * @param argCount number of arguments at a call site
	 * @return whether the call site passes an acceptable number of arguments
	 */
	public boolean acceptsArity(int argCount) {
		return argCount >= minArgs && (maxArgs < 0 || argCount <= maxArgs);
	}

	/**
	 * @param name a function name
	 * @return the intrinsic of that name, or <code>null</code>
	 */
	public static Intrinsic lookup(String name) {
		for (Intrinsic intrinsic : values()) {
			if (intrinsic.functionName.equals(name)) {
				return intrinsic;
			}
		}
		return null;
	}
}
