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

import java.util.Objects;

/**
 * A shell test condition applied to one operand.
 */
public final class TestExpr {

	private final TestKind kind;
	private final Expr operand;

	public TestExpr(TestKind kind, Expr operand) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.operand = Objects.requireNonNull(operand, "operand");
	}

	public TestKind getKind() {
		return kind;
	}

	public Expr getOperand() {
		return operand;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof TestExpr)) {
			return false;
		}
		TestExpr other = (TestExpr) o;
		return kind == other.kind && operand.equals(other.operand);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, operand);
	}

	@Override
	public String toString() {
		return "test " + kind.getFlag() + " " + operand;
	}
}
