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

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.metricshub.rash.ast.Intrinsic;

/**
 * Collects the side effects of a program while it is lowered.
 */
public class EffectTracker {

	private static final Map<Intrinsic, EffectSet> INTRINSIC_EFFECTS = new EnumMap<Intrinsic, EffectSet>(Intrinsic.class);

	static {
		INTRINSIC_EFFECTS.put(Intrinsic.MKDIR_P, EffectSet.of(Effect.FILE_WRITE));
		INTRINSIC_EFFECTS.put(Intrinsic.WRITE_FILE, EffectSet.of(Effect.FILE_WRITE));
		INTRINSIC_EFFECTS.put(Intrinsic.READ_FILE, EffectSet.of(Effect.FILE_READ));
		INTRINSIC_EFFECTS.put(Intrinsic.REMOVE_FILE, EffectSet.of(Effect.FILE_WRITE));
		INTRINSIC_EFFECTS.put(Intrinsic.SYMLINK, EffectSet.of(Effect.FILE_WRITE));
		INTRINSIC_EFFECTS.put(Intrinsic.PATH_EXISTS, EffectSet.of(Effect.FILE_READ));
		INTRINSIC_EFFECTS.put(Intrinsic.IS_FILE, EffectSet.of(Effect.FILE_READ));
		INTRINSIC_EFFECTS.put(Intrinsic.IS_DIR, EffectSet.of(Effect.FILE_READ));
		INTRINSIC_EFFECTS.put(Intrinsic.ENV, EffectSet.of(Effect.ENV_READ));
		INTRINSIC_EFFECTS.put(Intrinsic.ENV_VAR_OR, EffectSet.of(Effect.ENV_READ));
		INTRINSIC_EFFECTS.put(Intrinsic.SET_ENV, EffectSet.of(Effect.ENV_WRITE));
		INTRINSIC_EFFECTS.put(Intrinsic.EXEC, EffectSet.of(Effect.PROCESS_EXEC));
		INTRINSIC_EFFECTS.put(Intrinsic.CAPTURE, EffectSet.of(Effect.PROCESS_EXEC));
		INTRINSIC_EFFECTS.put(Intrinsic.CD, EffectSet.of(Effect.SYSTEM_MODIFICATION));
		INTRINSIC_EFFECTS.put(Intrinsic.REQUIRE, EffectSet.of(Effect.PROCESS_EXEC));
	}

	private EffectSet effects = EffectSet.pure();
	private final Set<String> exportedVariables = new LinkedHashSet<String>();
	private final Set<Intrinsic> usedIntrinsics = new LinkedHashSet<Intrinsic>();

	/**
	 * @param intrinsic a built-in
	 * @return the effects of calling it
	 */
	public static EffectSet effectsOf(Intrinsic intrinsic) {
		EffectSet result = INTRINSIC_EFFECTS.get(intrinsic);
		return result == null ? EffectSet.pure() : result;
	}

	public void recordIntrinsic(Intrinsic intrinsic) {
		usedIntrinsics.add(intrinsic);
		effects = effects.union(effectsOf(intrinsic));
	}

	public void recordExport(String name) {
		exportedVariables.add(name);
		effects = effects.union(EffectSet.of(Effect.ENV_WRITE));
	}

	public EffectSet getEffects() {
		return effects;
	}

	public Set<String> getExportedVariables() {
		return Collections.unmodifiableSet(exportedVariables);
	}

	public Set<Intrinsic> getUsedIntrinsics() {
		return Collections.unmodifiableSet(usedIntrinsics);
	}

	@Override
	public String toString() {
		return "effects=" + effects + ", exported=" + exportedVariables;
	}
}
