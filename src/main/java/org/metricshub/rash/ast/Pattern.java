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
 * Patterns of a <code>match</code> arm: a literal, the wildcard
 * <code>_</code>, or an integer range.
 */
public abstract class Pattern {

	private Pattern() {}

	public static final class Literal extends Pattern {
		private final Expr.Literal value;

		public Literal(Expr.Literal value) {
			this.value = Objects.requireNonNull(value, "value");
		}

		public Expr.Literal getValue() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Literal && value.equals(((Literal) o).value);
		}

		@Override
		public int hashCode() {
			return value.hashCode();
		}

		@Override
		public String toString() {
			return value.toString();
		}
	}

	public static final class Wildcard extends Pattern {
		public static final Wildcard INSTANCE = new Wildcard();

		private Wildcard() {}

		@Override
		public String toString() {
			return "_";
		}
	}

	/**
	 * An i32 range, <code>low..high</code> or <code>low..=high</code>.
	 */
	public static final class Range extends Pattern {
		private final int low;
		private final int high;
		private final boolean inclusive;

		public Range(int low, int high, boolean inclusive) {
			this.low = low;
			this.high = high;
			this.inclusive = inclusive;
		}

		public int getLow() {
			return low;
		}

		public int getHigh() {
			return high;
		}

		public boolean isInclusive() {
			return inclusive;
		}

		/**
		 * @return whether no value falls in the range
		 */
		public boolean isEmpty() {
			return inclusive ? low > high : low >= high;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Range)) {
				return false;
			}
			Range other = (Range) o;
			return low == other.low && high == other.high && inclusive == other.inclusive;
		}

		@Override
		public int hashCode() {
			return Objects.hash(low, high, inclusive);
		}

		@Override
		public String toString() {
			return low + (inclusive ? "..=" : "..") + high;
		}
	}
}
