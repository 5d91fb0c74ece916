package org.metricshub.rash;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import org.junit.Test;
import org.metricshub.rash.ast.RestrictedAst;
import org.metricshub.rash.backend.PosixEmitter;
import org.metricshub.rash.formal.ProofReport;
import org.metricshub.rash.intermediate.Effect;
import org.metricshub.rash.util.Config;
import org.metricshub.rash.verifier.VerificationLevel;

public class RashTest {

	private static final Rash RASH = new Rash();

	@Test
	public void testGreetingThroughUserFunction() throws Exception {
		TranspileResult result = RashTestSupport
				.transpileTest("greeting passed to a user function named echo")
				.source(
						"fn main() {",
						"    let name = \"World\";",
						"    echo(\"Hello, ${name}!\");",
						"}",
						"fn echo(msg: &str) {}")
				.verify(VerificationLevel.BASIC)
				.expectContains("name='World'", "\"Hello, ${name}!\"")
				.runAndAssert();
		String script = result.getScript();
		assertFalse("The interpolation must never be left unquoted", script.contains(" Hello, ${name}!"));
		assertTrue(script.startsWith("#!/bin/sh\n"));
		assertTrue(script.endsWith("\n" + PosixEmitter.MAIN_INVOCATION + "\n"));
	}

	@Test
	public void testDeeplyNestedParentheses() throws Exception {
		StringBuilder expr = new StringBuilder();
		for (int i = 0; i < 50; i++) {
			expr.append('(');
		}
		expr.append('1');
		for (int i = 0; i < 50; i++) {
			expr.append(')');
		}
		String source = RashTestSupport.lines("fn main() {", "    let x = " + expr + ";", "    println!(\"{}\", x);", "}");
		try {
			String script = RASH.transpile(source, new Config());
			assertTrue(script.contains("x="));
		} catch (TranspileException e) {
			assertEquals(ErrorKind.VALIDATION, e.getKind());
		}
	}

	@Test
	public void testAbsurdNestingIsAnError() {
		StringBuilder expr = new StringBuilder();
		for (int i = 0; i < 5000; i++) {
			expr.append('(');
		}
		expr.append('1');
		for (int i = 0; i < 5000; i++) {
			expr.append(')');
		}
		String source = RashTestSupport.lines("fn main() {", "    let x = " + expr + ";", "}");
		try {
			RASH.transpile(source, new Config());
			fail("5000 nested parentheses must be rejected");
		} catch (TranspileException e) {
			assertTrue(e.getKind() == ErrorKind.PARSE || e.getKind() == ErrorKind.VALIDATION);
		}
	}

	@Test
	public void testOutputIsDeterministic() {
		String source = RashTestSupport.lines(
				"fn greet(who: &str) {",
				"    println!(\"Hello, {}\", who);",
				"}",
				"fn main() {",
				"    let prefix = env_var_or(\"PREFIX\", \"/usr/local\");",
				"    mkdir_p(format!(\"{}/bin\", prefix));",
				"    for i in 0..3 {",
				"        greet(\"step\");",
				"    }",
				"}");
		String first = RASH.transpile(source, new Config());
		for (int i = 0; i < 5; i++) {
			assertEquals(first, RASH.transpile(source, new Config()));
		}
	}

	@Test
	public void testRecursionIsRejected() throws Exception {
		RashTestSupport
				.transpileTest("mutually recursive functions")
				.source(
						"fn ping(n: i32) { pong(n); }",
						"fn pong(n: i32) { ping(n); }",
						"fn main() { ping(1); }")
				.expectError(ErrorKind.VALIDATION, "Recursion")
				.runAndAssert();
	}

	@Test
	public void testMissingMainIsRejected() throws Exception {
		RashTestSupport
				.transpileTest("no entry point")
				.source("fn helper() {}")
				.expectError(ErrorKind.VALIDATION, "main")
				.runAndAssert();
	}

	@Test
	public void testUnknownFunctionIsRejected() throws Exception {
		RashTestSupport
				.transpileTest("call of an undefined function")
				.source("fn main() { launch_missiles(); }")
				.expectError(ErrorKind.VALIDATION, "launch_missiles")
				.runAndAssert();
	}

	@Test
	public void testSyntaxErrorIsAParseError() throws Exception {
		RashTestSupport
				.transpileTest("unbalanced braces")
				.source("fn main() { println!(\"x\");")
				.expectError(ErrorKind.PARSE)
				.runAndAssert();
	}

	@Test
	public void testUnsupportedConstructsAreValidationErrors() throws Exception {
		RashTestSupport
				.transpileTest("struct definition")
				.source("struct Point { x: i32 }", "fn main() {}")
				.expectError(ErrorKind.VALIDATION, "struct")
				.runAndAssert();
		RashTestSupport
				.transpileTest("unsafe block")
				.source("fn main() { unsafe { exit(1); } }")
				.expectError(ErrorKind.VALIDATION)
				.runAndAssert();
		RashTestSupport
				.transpileTest("vec! macro")
				.source("fn main() { let v = vec![1, 2]; }")
				.expectError(ErrorKind.VALIDATION, "vec!")
				.runAndAssert();
	}

	@Test
	public void testShadowedBindingsGetDistinctNames() throws Exception {
		RashTestSupport
				.transpileTest("shadowing in one function")
				.source(
						"fn main() {",
						"    let x = \"a\";",
						"    println!(\"{}\", x);",
						"    let x = \"b\";",
						"    println!(\"{}\", x);",
						"}")
				.expectContains("x='a'", "x_1='b'")
				.runAndAssert();
	}

	@Test
	public void testUnusedRuntimeHelpersAreNotEmitted() throws Exception {
		RashTestSupport
				.transpileTest("literal output only")
				.source("fn main() {", "    println!(\"ready\");", "}")
				.expectContains("echo 'ready'")
				.expectNotContains("rash_println()", "rash_eprintln()", "rash_write_file()", "rash_symlink()")
				.runAndAssert();
		RashTestSupport
				.transpileTest("interpolated output")
				.source("fn main() {", "    let who = \"me\";", "    println!(\"hi {}\", who);", "}")
				.expectContains("rash_println()", "rash_println \"hi ${who}\"")
				.expectNotContains("rash_eprintln()")
				.runAndAssert();
	}

	@Test
	public void testVerificationFailuresStopTranspilation() throws Exception {
		RashTestSupport
				.transpileTest("argument used as a command")
				.source("fn main() {", "    let cmd = arg(1);", "    exec(cmd);", "}")
				.verify(VerificationLevel.BASIC)
				.expectError(ErrorKind.VERIFICATION, "no_command_injection")
				.runAndAssert();
		RashTestSupport
				.transpileTest("argument used as a command, unchecked")
				.source("fn main() {", "    let cmd = arg(1);", "    exec(cmd);", "}")
				.verify(VerificationLevel.NONE)
				.expectContains("\"${cmd}\"")
				.runAndAssert();
	}

	@Test
	public void testEffectsAreTracked() throws Exception {
		TranspileResult result = RashTestSupport
				.transpileTest("file system and environment effects")
				.source(
						"fn main() {",
						"    set_env(\"INSTALL_DIR\", \"/opt/app\");",
						"    mkdir_p(\"/opt/app/bin\");",
						"}")
				.expectContains("INSTALL_DIR='/opt/app'", "export INSTALL_DIR", "mkdir '-p' '/opt/app/bin'")
				.runAndAssert();
		assertTrue(result.getEffects().getExportedVariables().contains("INSTALL_DIR"));
		assertTrue(result.getEffects().getEffects().contains(Effect.FILE_WRITE));
		assertNull("No report unless asked for", result.getProof());
	}

	@Test
	public void testProofIsBuiltOnRequest() throws Exception {
		TranspileResult result = RashTestSupport
				.transpileTest("install layout with a formal report")
				.source(
						"fn main() {",
						"    set_env(\"INSTALL_DIR\", \"/opt/rash\");",
						"    mkdir_p(\"/opt/rash/bin\");",
						"    cd(\"/opt/rash\");",
						"}")
				.emitProof()
				.runAndAssert();
		ProofReport proof = result.getProof();
		assertNotNull(proof);
		assertEquals(proof.render(), ProofReport.Verdict.PASS, proof.getVerdict());
	}

	@Test
	public void testProofIsSkippedOutsideTheFormalSubset() throws Exception {
		TranspileResult result = RashTestSupport
				.transpileTest("value read from the environment")
				.source(
						"fn main() {",
						"    let home = env(\"HOME\");",
						"    println!(\"{}\", home);",
						"}")
				.emitProof()
				.runAndAssert();
		assertEquals(ProofReport.Verdict.SKIPPED, result.getProof().getVerdict());
	}

	@Test
	public void testCheckReturnsTheRestrictedProgram() {
		RestrictedAst ast = RASH.check("fn main() { helper(); }\nfn helper() {}\n");
		assertEquals(2, ast.getFunctions().size());
		assertNotNull(ast.getFunction("helper"));
		assertEquals(Collections.emptyList(), ast.getFunction("main").getParameters());
	}

	@Test
	public void testErrorDescriptionNamesTheStage() {
		try {
			RASH.transpile("fn main() { nope(); }\n", new Config());
			fail("nope() is not defined");
		} catch (TranspileException e) {
			assertTrue(e.describe(), e.describe().startsWith(ErrorKind.VALIDATION.getDisplayName()));
		}
	}
}
