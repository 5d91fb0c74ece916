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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.rash.ast.Type;

/**
 * Maps (scope, source name) pairs to shell identifiers.
 * <p>
 * The shell has a single flat variable namespace, so every binding of the
 * program receives a shell name no other binding uses: the first binding of
 * a name keeps it, later ones become <code>name_1</code>, <code>name_2</code>
 * and so on. Names owned by the shell itself, by the runtime helpers or by
 * the program's functions are never handed out.
 */
public class SymbolTable {

	/**
	 * Prefix of the temporaries allocated by the lowering.
	 */
	public static final String TEMP_PREFIX = "__rash_tmp_";

	/**
	 * Variable through which a function hands its return value to the caller.
	 */
	public static final String RETURN_SLOT = "__rash_ret";

	/**
	 * Variables with a meaning to the shell or to the utilities it starts.
	 */
	static final Set<String> RESERVED_VARIABLES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"IFS", "PATH", "HOME", "PWD", "OLDPWD", "PS1", "PS2", "PS3", "PS4", "ENV", "LANG", "LC_ALL", "LC_CTYPE",
			"LC_COLLATE", "LC_MESSAGES", "LC_NUMERIC", "NLSPATH", "OPTIND", "OPTARG", "OPTERR", "PPID", "SHELL", "TERM",
			"USER", "LOGNAME", "CDPATH", "MAIL", "MAILCHECK", "MAILPATH", "LINENO", "RANDOM", "SECONDS", "HOSTNAME",
			"UID", "EUID", "TMPDIR", "FCEDIT", "HISTFILE", "HISTSIZE", "POSIXLY_CORRECT", "BASH_ENV", "BASHPID",
			"SRANDOM", "EPOCHSECONDS", "EPOCHREALTIME", "main")));

	/**
	 * Commands, builtins and reserved words a user function must not shadow.
	 */
	static final Set<String> SHELL_WORDS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"echo", "printf", "test", "mkdir", "rm", "ln", "cat", "cd", "command", "exit", "export", "return", "set",
			"unset", "shift", "trap", "eval", "exec", "readonly", "times", "true", "false", "read", "local", "mv", "cp",
			"touch", "date", "sh", "bash", "dash", "ash", "done", "fi", "then", "elif", "else", "do", "case", "esac",
			"until", "select", "function", "if", "while", "for", "in", "break", "continue", "wait", "umask", "ulimit",
			"type", "hash", "alias", "unalias", "getopts", "source", "kill", "jobs", "fg", "bg", "ls", "find", "grep",
			"sed", "awk", "sort", "head", "tail", "chmod", "chown", "env", "main")));

	/**
	 * A binding of a source name.
	 */
	public static final class Binding {
		private final String sourceName;
		private final String shellName;
		private final Type type;
		private final List<String> elements;

		Binding(String sourceName, String shellName, Type type, List<String> elements) {
			this.sourceName = sourceName;
			this.shellName = shellName;
			this.type = type;
			this.elements = elements == null ? null : Collections.unmodifiableList(elements);
		}

		public String getSourceName() {
			return sourceName;
		}

		public String getShellName() {
			return shellName;
		}

		/**
		 * @return the type of the value, or of each element for an array
		 */
		public Type getType() {
			return type;
		}

		public boolean isArray() {
			return elements != null;
		}

		/**
		 * @return the shell names of the elements of an array binding
		 */
		public List<String> getElements() {
			return elements;
		}
	}

	private final Deque<Map<String, Binding>> scopes = new ArrayDeque<Map<String, Binding>>();
	private final Set<String> used = new HashSet<String>();
	private int tempCounter;

	public SymbolTable() {
		pushScope();
	}

	public void pushScope() {
		scopes.push(new HashMap<String, Binding>());
	}

	public void popScope() {
		if (scopes.size() == 1) {
			throw new IllegalStateException("Cannot pop the global scope");
		}
		scopes.pop();
	}

	/**
	 * Keeps a name away from the bindings, for instance a variable the
	 * program exports or reads from its environment.
	 *
	 * @param name shell name to reserve
	 */
	public void reserve(String name) {
		used.add(name);
	}

	/**
	 * Binds a source name in the innermost scope.
	 *
	 * @param sourceName the name in the program
	 * @param type type of the bound value
	 * @return the new binding, with a shell name used by no other binding
	 */
	public Binding declare(String sourceName, Type type) {
		Binding binding = new Binding(sourceName, fresh(sourceName), type, null);
		scopes.peek().put(sourceName, binding);
		return binding;
	}

	/**
	 * Binds a source name to a fixed-size array, each element getting its
	 * own shell variable.
	 *
	 * @param sourceName the name in the program
	 * @param elementType type of the elements
	 * @param size number of elements
	 * @return the new binding
	 */
	public Binding declareArray(String sourceName, Type elementType, int size) {
		String base = fresh(sourceName);
		List<String> elements = new ArrayList<String>(size);
		for (int i = 0; i < size; i++) {
			elements.add(fresh(base + "_" + i));
		}
		Binding binding = new Binding(sourceName, base, elementType, elements);
		scopes.peek().put(sourceName, binding);
		return binding;
	}

	/**
	 * @param sourceName the name in the program
	 * @return the innermost visible binding, or <code>null</code>
	 */
	public Binding lookup(String sourceName) {
		Iterator<Map<String, Binding>> it = scopes.iterator();
		while (it.hasNext()) {
			Binding binding = it.next().get(sourceName);
			if (binding != null) {
				return binding;
			}
		}
		return null;
	}

	/**
	 * @return a fresh temporary variable name
	 */
	public String allocateTemp() {
		String name;
		do {
			name = TEMP_PREFIX + tempCounter++;
		} while (!used.add(name));
		return name;
	}

	private String fresh(String name) {
		String base = name.startsWith("__rash") || name.startsWith("rash_") ? "u" + name : name;
		String candidate = base;
		int suffix = 1;
		while (!isAvailable(candidate)) {
			candidate = base + "_" + suffix++;
		}
		used.add(candidate);
		return candidate;
	}

	private boolean isAvailable(String name) {
		return !used.contains(name) && !RESERVED_VARIABLES.contains(name) && !name.startsWith("__rash")
				&& !name.startsWith("rash_");
	}

	/**
	 * @param name a user function name
	 * @return the name of the shell function implementing it
	 */
	public static String functionShellName(String name) {
		if (SHELL_WORDS.contains(name) || name.startsWith("rash_") || name.startsWith("__rash")) {
			return "fn_" + name;
		}
		return name;
	}
}
