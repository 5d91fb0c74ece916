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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.metricshub.rash.validation.ValidationException;

/**
 * A program of the restricted language: an ordered list of functions and the
 * name of the entry point.
 * <p>
 * {@link #validate()} checks the structural invariants every later phase
 * relies on.
 */
public final class RestrictedAst {

	/**
	 * Name of the entry function.
	 */
	public static final String ENTRY_POINT = "main";

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private final List<Function> functions;
	private final String entryPoint;

	public RestrictedAst(List<Function> functions, String entryPoint) {
		this.functions = Collections.unmodifiableList(new ArrayList<Function>(functions));
		this.entryPoint = Objects.requireNonNull(entryPoint, "entryPoint");
	}

	public RestrictedAst(List<Function> functions) {
		this(functions, ENTRY_POINT);
	}

	public List<Function> getFunctions() {
		return functions;
	}

	public String getEntryPoint() {
		return entryPoint;
	}

	/**
	 * @param name a function name
	 * @return the function of that name, or <code>null</code>
	 */
	public Function getFunction(String name) {
		for (Function function : functions) {
			if (function.getName().equals(name)) {
				return function;
			}
		}
		return null;
	}

	/**
	 * Checks the program invariants:
	 * <ul>
	 * <li>function names are unique and exactly one is the entry point</li>
	 * <li>the entry point takes no parameters and returns nothing</li>
	 * <li>every identifier is a plain shell-safe word</li>
	 * <li>every call resolves to a function or an {@link Intrinsic} with a matching arity</li>
	 * <li>the call graph is acyclic</li>
	 * </ul>
	 *
	 * @throws ValidationException on the first broken invariant
	 */
	public void validate() {
		Map<String, Function> byName = new LinkedHashMap<String, Function>();
		for (Function function : functions) {
			checkIdentifier(function.getName(), "function name");
			if (byName.put(function.getName(), function) != null) {
				throw new ValidationException("Duplicate function '" + function.getName() + "'");
			}
			Set<String> params = new LinkedHashSet<String>();
			for (Parameter p : function.getParameters()) {
				checkIdentifier(p.getName(), "parameter name");
				if (!params.add(p.getName())) {
					throw new ValidationException("Duplicate parameter '" + p.getName() + "' in function '" + function.getName() + "'");
				}
				if (p.getType() == Type.VOID) {
					throw new ValidationException("Parameter '" + p.getName() + "' cannot have type ()");
				}
			}
		}
		Function entry = byName.get(entryPoint);
		if (entry == null) {
			throw new ValidationException("No entry point: function '" + entryPoint + "' is missing");
		}
		if (!entry.getParameters().isEmpty()) {
			throw new ValidationException("Function '" + entryPoint + "' must not take parameters");
		}
		if (entry.getReturnType() != Type.VOID) {
			throw new ValidationException("Function '" + entryPoint + "' must not return a value");
		}

		Map<String, Set<String>> callGraph = new HashMap<String, Set<String>>();
		for (Function function : functions) {
			CallResolver resolver = new CallResolver(function, byName);
			resolver.scanFunction(function);
			callGraph.put(function.getName(), resolver.callees);
		}
		checkAcyclic(callGraph);
	}

	/**
	 * Rejects anything but a plain identifier, naming the offending
	 * character when it is one the shell would interpret.
	 *
	 * @param name the identifier
	 * @param what what the identifier names, for the message
	 * @throws ValidationException when the identifier is unsafe
	 */
	public static void checkIdentifier(String name, String what) {
		if (name.isEmpty()) {
			throw new ValidationException("Empty " + what);
		}
		for (char c : new char[] { '$', '`', '\\', '\0' }) {
			if (name.indexOf(c) >= 0) {
				String shown = c == '\0' ? "NUL" : String.valueOf(c);
				throw new ValidationException("Unsafe character " + shown + " in " + what + " '" + name.replace('\0', '?') + "'");
			}
		}
		if (!IDENTIFIER.matcher(name).matches()) {
			throw new ValidationException("Invalid " + what + " '" + name + "'");
		}
	}

	private static void checkAcyclic(Map<String, Set<String>> callGraph) {
		Set<String> done = new LinkedHashSet<String>();
		for (String root : callGraph.keySet()) {
			visit(root, callGraph, new ArrayList<String>(), done);
		}
	}

	private static void visit(String name, Map<String, Set<String>> callGraph, List<String> path, Set<String> done) {
		if (done.contains(name)) {
			return;
		}
		int onPath = path.indexOf(name);
		if (onPath >= 0) {
			List<String> cycle = new ArrayList<String>(path.subList(onPath, path.size()));
			cycle.add(name);
			throw new ValidationException("Recursion is not supported: " + String.join(" -> ", cycle));
		}
		path.add(name);
		for (String callee : callGraph.get(name)) {
			visit(callee, callGraph, path, done);
		}
		path.remove(path.size() - 1);
		done.add(name);
	}

	/**
	 * Resolves the calls of one function and checks its identifiers.
	 */
	private static final class CallResolver extends AstScanner {
		private final Function function;
		private final Map<String, Function> byName;
		private final Set<String> callees = new LinkedHashSet<String>();

		CallResolver(Function function, Map<String, Function> byName) {
			this.function = function;
			this.byName = byName;
		}

		@Override
		protected void onBinding(String name) {
			checkIdentifier(name, "variable name");
		}

		@Override
		public Void visitVariable(Expr.Variable expr) {
			checkIdentifier(expr.getName(), "variable name");
			return null;
		}

		@Override
		protected void onCall(Expr.FunctionCall call) {
			Function target = byName.get(call.getName());
			if (target != null) {
				if (target.getName().equals(ENTRY_POINT)) {
					throw new ValidationException("Function '" + function.getName() + "' calls the entry point '" + ENTRY_POINT + "'");
				}
				if (target.getParameters().size() != call.getArgs().size()) {
					throw new ValidationException("Function '" + call.getName() + "' expects " + target.getParameters().size()
							+ " argument(s) but is called with " + call.getArgs().size());
				}
				callees.add(target.getName());
				return;
			}
			Intrinsic intrinsic = Intrinsic.lookup(call.getName());
			if (intrinsic == null) {
				throw new ValidationException("Unknown function '" + call.getName() + "' called from '" + function.getName() + "'");
			}
			if (!intrinsic.acceptsArity(call.getArgs().size())) {
				throw new ValidationException("Built-in '" + call.getName() + "' does not accept " + call.getArgs().size() + " argument(s)");
			}
		}
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof RestrictedAst)) {
			return false;
		}
		RestrictedAst other = (RestrictedAst) o;
		return entryPoint.equals(other.entryPoint) && functions.equals(other.functions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(functions, entryPoint);
	}

	@Override
	public String toString() {
		return functions.toString();
	}
}
