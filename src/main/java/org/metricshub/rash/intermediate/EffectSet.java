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

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * An immutable set of {@link Effect}s.
 */
public final class EffectSet {

	private static final EffectSet EMPTY = new EffectSet(EnumSet.noneOf(Effect.class));

	private final Set<Effect> effects;

	private EffectSet(EnumSet<Effect> effects) {
		this.effects = Collections.unmodifiableSet(effects);
	}

	/**
	 * @return the set without effects
	 */
	public static EffectSet pure() {
		return EMPTY;
	}

	/**
	 * @param first an effect
	 * @param rest more effects
	 * @return the set of the given effects
	 */
	public static EffectSet of(Effect first, Effect... rest) {
		return new EffectSet(EnumSet.of(first, rest));
	}

	/**
	 * @param other another set
	 * @return the union of both sets
	 */
	public EffectSet union(EffectSet other) {
		if (other.effects.isEmpty()) {
			return this;
		}
		EnumSet<Effect> merged = EnumSet.noneOf(Effect.class);
		merged.addAll(effects);
		merged.addAll(other.effects);
		return new EffectSet(merged);
	}

	public boolean contains(Effect effect) {
		return effects.contains(effect);
	}

	public boolean isPure() {
		return effects.isEmpty();
	}

	public Collection<Effect> asCollection() {
		return effects;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof EffectSet && effects.equals(((EffectSet) o).effects);
	}

	@Override
	public int hashCode() {
		return effects.hashCode();
	}

	@Override
	public String toString() {
		return effects.toString();
	}
}
