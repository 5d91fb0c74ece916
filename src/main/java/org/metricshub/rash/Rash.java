package org.metricshub.rash;

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

import java.io.IOException;
import org.metricshub.rash.ast.RestrictedAst;
import org.metricshub.rash.backend.OutputValidator;
import org.metricshub.rash.backend.PosixEmitter;
import org.metricshub.rash.formal.AbstractState;
import org.metricshub.rash.formal.EvalException;
import org.metricshub.rash.formal.ProofInspector;
import org.metricshub.rash.formal.ProofReport;
import org.metricshub.rash.formal.ShellIrProjector;
import org.metricshub.rash.formal.TinyAst;
import org.metricshub.rash.frontend.RustParser;
import org.metricshub.rash.frontend.ast.SyntaxNode;
import org.metricshub.rash.intermediate.IrLowering;
import org.metricshub.rash.intermediate.IrOptimizer;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.util.Config;
import org.metricshub.rash.util.RashLogger;
import org.metricshub.rash.util.ScriptSource;
import org.metricshub.rash.validation.Restrictor;
import org.metricshub.rash.verifier.VerificationLevel;
import org.metricshub.rash.verifier.Verifier;
import org.slf4j.Logger;

/**
 * Entry point into the transpiler.
 * <p>
 * A program goes through these stages:
 * <ol>
 * <li>parsing into a generic syntax tree ({@link RustParser})</li>
 * <li>restriction to the supported subset ({@link Restrictor})</li>
 * <li>lowering to shell IR ({@link IrLowering})</li>
 * <li>optimization, unless disabled ({@link IrOptimizer})</li>
 * <li>verification at the configured level ({@link Verifier})</li>
 * <li>emission of the POSIX script ({@link PosixEmitter}) and a check of its shape ({@link OutputValidator})</li>
 * <li>optionally, the formal equivalence report ({@link ProofInspector})</li>
 * </ol>
 * Each stage fails with its own {@link TranspileException}; nothing is
 * returned for a program that failed any stage.
 * <p>
 * An instance holds no state between calls and can be shared.
 */
public class Rash {

	private static final Logger LOG = RashLogger.getLogger(Rash.class);

	/**
	 * Transpiles a program held in memory.
	 *
	 * @param source the Rust source
	 * @param config the settings
	 * @return the POSIX shell script
	 * @throws TranspileException when any stage fails
	 */
	public String transpile(String source, Config config) {
		try {
			return transpile(ScriptSource.fromString(source), config).getScript();
		} catch (IOException e) {
			throw new InternalException("Failed to read in-memory source", e);
		}
	}

	/**
	 * Transpiles a program.
	 *
	 * @param source the Rust source
	 * @param config the settings
	 * @return the script and what came with it
	 * @throws IOException when the source cannot be read
	 * @throws TranspileException when any stage fails
	 */
	public TranspileResult transpile(ScriptSource source, Config config) throws IOException {
		LOG.debug("Transpiling {} with settings:\n{}", source.getDescription(), config.toDescriptionString());
		IrLowering lowering = new IrLowering();
		ShellIR ir = compile(source, config, lowering);
		if (config.getVerify() != VerificationLevel.NONE) {
			verify(ir, config.getVerify());
		}
		String script = new PosixEmitter().emit(ir, config);
		OutputValidator.validate(script);
		ProofReport proof = config.isEmitProof() ? prove(ir) : null;
		return new TranspileResult(script, ir, lowering.getEffectTracker(), proof);
	}

	/**
	 * Parses and restricts a program without lowering it.
	 *
	 * @param source the Rust source
	 * @return the restricted program
	 * @throws TranspileException when the program is not in the supported subset
	 */
	public RestrictedAst check(String source) {
		try {
			return check(ScriptSource.fromString(source), new Config());
		} catch (IOException e) {
			throw new InternalException("Failed to read in-memory source", e);
		}
	}

	/**
	 * Parses and restricts a program without lowering it.
	 *
	 * @param source the Rust source
	 * @param config the settings; only the nesting cap is used
	 * @return the restricted program
	 * @throws IOException when the source cannot be read
	 * @throws TranspileException when the program is not in the supported subset
	 */
	public RestrictedAst check(ScriptSource source, Config config) throws IOException {
		SyntaxNode tree = new RustParser().parse(source);
		return new Restrictor(config.getMaxNestingDepth()).restrict(tree);
	}

	/**
	 * Parses, restricts, lowers and, unless disabled, optimizes a program.
	 *
	 * @param source the Rust source
	 * @param config the settings
	 * @return the shell IR
	 * @throws IOException when the source cannot be read
	 * @throws TranspileException when any stage fails
	 */
	public ShellIR compile(ScriptSource source, Config config) throws IOException {
		return compile(source, config, new IrLowering());
	}

	private ShellIR compile(ScriptSource source, Config config, IrLowering lowering) throws IOException {
		RestrictedAst ast = check(source, config);
		ShellIR ir = lowering.lower(ast);
		LOG.trace("Lowered IR: {}", ir);
		if (config.isOptimize()) {
			ir = new IrOptimizer().optimize(ir);
			LOG.trace("Optimized IR: {}", ir);
		}
		return ir;
	}

	/**
	 * Runs the checks of a verification level.
	 *
	 * @param ir the program
	 * @param level the level
	 * @throws org.metricshub.rash.verifier.VerificationException on the first failed check
	 */
	public static void verify(ShellIR ir, VerificationLevel level) {
		Verifier.verify(ir, level);
	}

	/**
	 * Builds the formal equivalence report of a program, or a skipped report
	 * when the program uses more than the formal instruction set expresses.
	 *
	 * @param ir the program
	 * @return the report
	 */
	public static ProofReport prove(ShellIR ir) {
		TinyAst program;
		try {
			program = ShellIrProjector.project(ir);
		} catch (EvalException e) {
			LOG.debug("No formal proof: {}", e.getMessage());
			return ProofReport.skipped(e.getMessage());
		}
		ProofReport report = ProofInspector.inspect(program, AbstractState.initial());
		LOG.info("Formal equivalence: {}", report.getVerdict());
		return report;
	}
}
