package org.metricshub.rash;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.Test;

public class CliTest {

	private static final String[] INSTALLER = {
			"fn main() {",
			"    set_env(\"INSTALL_DIR\", \"/opt/rash\");",
			"    mkdir_p(\"/opt/rash/bin\");",
			"    cd(\"/opt/rash\");",
			"}" };

	private static String execute(int expectedCode, String... args) throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		int code;
		try (PrintStream outStream = new PrintStream(out, true, "UTF-8");
				PrintStream errStream = new PrintStream(err, true, "UTF-8")) {
			code = Cli.execute(args, outStream, errStream);
		}
		assertEquals(new String(err.toByteArray(), StandardCharsets.UTF_8), expectedCode, code);
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testBuild() throws Exception {
		RashTestSupport.CliResult result = RashTestSupport
				.cliTest("build")
				.source("fn main() {", "    println!(\"Hello, World!\");", "}")
				.argument("build", "{source}", "-o", "{out}")
				.runAndAssert();
		String script = result.outputFileContent();
		assertTrue(script, script.startsWith("#!/bin/sh\n"));
		assertTrue(script, script.endsWith("main \"$@\"\n"));
		assertTrue(Files.isExecutable(result.outputFile()));
		assertFalse(Files.exists(result.outputFile().resolveSibling("out.sh" + Cli.PROOF_SUFFIX)));
		assertEquals("", result.output());
		try (Stream<Path> files = Files.list(result.directory())) {
			assertEquals("no temporary file left behind", 2, files.count());
		}
	}

	@Test
	public void testBuildWithProof() throws Exception {
		RashTestSupport.CliResult result = RashTestSupport
				.cliTest("build --emit-proof")
				.source(INSTALLER)
				.argument("build", "{source}", "-o", "{out}", "--emit-proof", "--verify", "paranoid")
				.expectOutputContains("Formal equivalence: PASS")
				.runAndAssert();
		Path proof = result.outputFile().resolveSibling("out.sh" + Cli.PROOF_SUFFIX);
		String report = new String(Files.readAllBytes(proof), StandardCharsets.UTF_8);
		assertTrue(report, report.startsWith("Formal equivalence: PASS\n"));
		assertTrue(result.outputFileContent().contains("mkdir '-p' '/opt/rash/bin'"));
	}

	@Test
	public void testProofIsNotWrittenWhenTheScriptCannotBe() throws Exception {
		Path directory = Files.createTempDirectory("rash-cli");
		Path source = directory.resolve("main.rs");
		Files.write(source, RashTestSupport.lines(INSTALLER).getBytes(StandardCharsets.UTF_8));
		// a non-empty directory cannot be replaced by the script
		Path blocked = directory.resolve("out.sh");
		Files.createDirectory(blocked);
		Files.write(blocked.resolve("keep"), new byte[0]);

		ByteArrayOutputStream err = new ByteArrayOutputStream();
		int code;
		try (PrintStream outStream = new PrintStream(new ByteArrayOutputStream(), true, "UTF-8");
				PrintStream errStream = new PrintStream(err, true, "UTF-8")) {
			code = Cli.execute(new String[] { "build", source.toString(), "-o", blocked.toString(), "--emit-proof" }, outStream, errStream);
		}
		assertEquals(new String(err.toByteArray(), StandardCharsets.UTF_8), 1, code);
		assertFalse(Files.exists(directory.resolve("out.sh" + Cli.PROOF_SUFFIX)));
		assertTrue(Files.isDirectory(blocked));
		try (Stream<Path> files = Files.list(directory)) {
			assertEquals("no temporary file left behind", 2, files.count());
		}
	}

	@Test
	public void testFailedBuildWritesNothing() throws Exception {
		RashTestSupport.CliResult result = RashTestSupport
				.cliTest("recursive build")
				.source("fn again() {", "    again();", "}", "fn main() {", "    again();", "}")
				.argument("build", "{source}", "-o", "{out}")
				.expectExitCode(1)
				.runAndAssert();
		assertTrue(result.error(), result.error().startsWith("Validation"));
		assertTrue(result.error(), result.error().contains("Recursion"));
		assertFalse(Files.exists(result.outputFile()));
	}

	@Test
	public void testParseErrorLocation() throws Exception {
		RashTestSupport.CliResult result = RashTestSupport
				.cliTest("parse error")
				.source("fn main() {", "    let x = ;", "}")
				.argument("build", "{source}", "-o", "{out}")
				.expectExitCode(1)
				.runAndAssert();
		assertTrue(result.error(), result.error().startsWith("Parse ("));
		assertTrue(result.error(), result.error().contains("main.rs:2:"));
	}

	@Test
	public void testCheck() throws Exception {
		RashTestSupport
				.cliTest("check")
				.source(INSTALLER)
				.argument("check", "{source}")
				.expectOutputContains("main.rs: OK")
				.runAndAssert();
		RashTestSupport.CliResult rejected = RashTestSupport
				.cliTest("check of a struct")
				.source("struct P {}", "fn main() {}")
				.argument("check", "{source}")
				.expectExitCode(1)
				.runAndAssert();
		assertTrue(rejected.error(), rejected.error().contains("struct definition"));
	}

	@Test
	public void testVerify() throws Exception {
		RashTestSupport.CliResult built = RashTestSupport
				.cliTest("build before verify")
				.source(INSTALLER)
				.argument("build", "{source}", "-o", "{out}")
				.runAndAssert();
		String source = built.directory().resolve("main.rs").toString();
		String script = built.outputFile().toString();

		String matching = execute(0, "verify", source, script);
		assertTrue(matching, matching.contains(": matches "));

		Files.write(built.outputFile(), (built.outputFileContent() + "# tampered\n").getBytes(StandardCharsets.UTF_8));
		String tampered = execute(1, "verify", source, script);
		assertTrue(tampered, tampered.contains(": does NOT match "));
	}

	@Test
	public void testUsage() throws Exception {
		String help = execute(0, "-h");
		assertTrue(help, help.startsWith("Usage:"));
		assertTrue(help, help.contains("rash build"));
		assertTrue(execute(0).startsWith("Usage:"));
	}

	@Test
	public void testBadArguments() throws Exception {
		RashTestSupport.CliResult missingOutput = RashTestSupport
				.cliTest("build without -o")
				.source(INSTALLER)
				.argument("build", "{source}")
				.expectExitCode(1)
				.runAndAssert();
		assertTrue(missingOutput.error(), missingOutput.error().startsWith("Failed to parse arguments: Output file not provided"));

		execute(1, "deploy", "main.rs");
		execute(1, "-h", "extra");
		execute(1, "check");
		execute(1, "build", "main.rs", "-o");
		execute(1, "build", "main.rs", "-o", "out.sh", "--verify", "extreme");
		execute(1, "build", "main.rs", "-o", "out.sh", "--target", "zsh");
		execute(1, "check", "main.rs", "--unknown");
	}

	@Test
	public void testMissingSourceFile() throws Exception {
		RashTestSupport.CliResult result = RashTestSupport
				.cliTest("missing source")
				.argument("check", "{source}")
				.expectExitCode(1)
				.runAndAssert();
		assertTrue(result.error(), result.error().startsWith("UncheckedIOException: Failed to open Rash source for reading"));
	}
}
