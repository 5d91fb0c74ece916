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
import java.util.List;
import java.util.Objects;

/**
 * A function of the restricted program.
 */
public final class Function {

	private final String name;
	private final List<Parameter> parameters;
	private final Type returnType;
	private final List<Stmt> body;

	public Function(String name, List<Parameter> parameters, Type returnType, List<Stmt> body) {
		this.name = Objects.requireNonNull(name, "name");
		this.parameters = Collections.unmodifiableList(new ArrayList<Parameter>(parameters));
		this.returnType = Objects.requireNonNull(returnType, "returnType");
		this.body = Collections.unmodifiableList(new ArrayList<Stmt>(body));
	}

	public String getName() {
		return name;
	}

	public List<Parameter> getParameters() {
		return parameters;
	}

	public Type getReturnType() {
		return returnType;
	}

	public List<Stmt> getBody() {
		return body;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Function)) {
			return false;
		}
		Function other = (Function) o;
		return name.equals(other.name) && parameters.equals(other.parameters) && returnType == other.returnType
				&& body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parameters, returnType, body);
	}

	@Override
	public String toString() {
		return "fn " + name + parameters + " -> " + returnType.getSourceName() + " " + body;
	}
}
