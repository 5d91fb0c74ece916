package org.metricshub.rash;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.rash.RashTestSupport.ShellResult;
import org.metricshub.rash.util.Config;
import org.metricshub.rash.verifier.VerificationLevel;

/**
 * Runs generated scripts with the system's <code>/bin/sh</code>.
 */
public class ShellExecutionTest {

	private static final Rash RASH = new Rash();

	@Before
	public void requireShell() {
		RashTestSupport.assumeShell();
	}

	private static ShellResult run(String source, String... args) throws Exception {
		Config config = new Config();
		config.setVerify(VerificationLevel.PARANOID);
		return RashTestSupport.runScript(RASH.transpile(source, config), args);
	}

	@Test
	public void testHelloWorld() throws Exception {
		ShellResult result = run(RashTestSupport.lines(
				"fn main() {",
				"    let name = \"World\";",
				"    println!(\"Hello, {}!\", name);",
				"}"));
		assertEquals(result.error(), 0, result.exitCode());
		assertEquals(Collections.singletonList("Hello, World!"), result.lines());
	}

	@Test
	public void testHostileArgumentIsPrintedVerbatim() throws Exception {
		String hostile = "$(touch pwned); `touch pwned2` ${HOME} 'x\" \\n *";
		ShellResult result = run(RashTestSupport.lines(
				"fn main() {",
				"    let user = arg(1);",
				"    println!(\"Hello, {}\", user);",
				"}"), hostile);
		assertEquals(result.error(), 0, result.exitCode());
		assertEquals(Collections.singletonList("Hello, " + hostile), result.lines());
		assertFalse(Files.exists(RashTestSupport.sharedTempDirectory().resolve("pwned")));
		assertFalse(Files.exists(RashTestSupport.sharedTempDirectory().resolve("pwned2")));
	}

	@Test
	public void testHostileLiteralIsPrintedVerbatim() throws Exception {
		ShellResult result = run(RashTestSupport.lines(
				"fn main() {",
				"    println!(\"it's $(whoami) and `id`; rm -rf *\");",
				"}"));
		assertEquals(result.error(), 0, result.exitCode());
		assertEquals(Collections.singletonList("it's $(whoami) and `id`; rm -rf *"), result.lines());
	}

	@Test
	public void testForLoopAccumulates() throws Exception {
		ShellResult result = run(RashTestSupport.lines(
				"fn main() {",
				"    let mut total = 0;",
				"    for i in 1..4 {",
				"        total = total + i;",
				"    }",
				"    println!(\"{}\", total);",
				"}"));
		assertEquals(result.error(), 0, result.exitCode());
		assertEquals(Collections.singletonList("6"), result.lines());
	}

	@Test
	public void testBoundedWhileLoop() throws Exception {
		ShellResult result = run(RashTestSupport.lines(
				"fn main() {",
				"    let mut i = 0;",
				"    while i < 3 {",
				"        println!(\"tick {}\", i);",
				"        i = i + 1;",
				"    }",
				"}"));
		assertEquals(result.error(), 0, result.exitCode());
		assertEquals(Arrays.asList("tick 0", "tick 1", "tick 2"), result.lines());
	}

	@Test
	public void testFunctionReturningAValue() throws Exception {
		ShellResult result = run(RashTestSupport.lines(
				"fn double(x: i32) -> i32 {",
				"    x * 2",
				"}",
				"fn main() {",
				"    let y = double(21);",
				"    println!(\"{}\", y);",
				"}"));
		assertEquals(result.error(), 0, result.exitCode());
		assertEquals(Collections.singletonList("42"), result.lines());
	}

	@Test
	public void testValueFunctionOutputIsNotItsResult() throws Exception {
		ShellResult result = run(RashTestSupport.lines(
				"fn f() -> i32 {",
				"    println!(\"hi\");",
				"    return 1;",
				"}",
				"fn label(name: &str) -> String {",
				"    println!(\"labelling {}\", name);",
				"    format!(\"<{}>\", name)",
				"}",
				"fn main() {",
				"    let x = f() + 1;",
				"    println!(\"{}\", x);",
				"    let tag = label(\"core\");",
				"    println!(\"{} {}\", tag, f());",
				"}"));
		assertEquals(result.error(), 0, result.exitCode());
		assertEquals(Arrays.asList("hi", "2", "labelling core", "hi", "<core> 1"), result.lines());
	}

	@Test
	public void testValueFunctionEffectsReachTheCaller() throws Exception {
		ShellResult result = run(RashTestSupport.lines(
				"fn configure() -> bool {",
				"    set_env(\"RASH_TEST_MODE\", \"ready\");",
				"    true",
				"}",
				"fn main() {",
				"    if configure() {",
				"        println!(\"{}\", env(\"RASH_TEST_MODE\"));",
				"    }",
				"}"));
		assertEquals(result.error(), 0, result.exitCode());
		assertEquals(Collections.singletonList("ready"), result.lines());
	}

	@Test
	public void testBranches() throws Exception {
		String source = RashTestSupport.lines(
				"fn main() {",
				"    let mode = arg(1);",
				"    if mode == \"fast\" {",
				"        println!(\"going fast\");",
				"    } else if mode.is_empty() {",
				"        println!(\"no mode\");",
				"    } else {",
				"        println!(\"going slow\");",
				"    }",
				"}");
		assertEquals(Collections.singletonList("going fast"), run(source, "fast").lines());
		assertEquals(Collections.singletonList("no mode"), run(source, "").lines());
		assertEquals(Collections.singletonList("going slow"), run(source, "other").lines());
	}

	@Test
	public void testMatch() throws Exception {
		String source = RashTestSupport.lines(
				"fn describe(word: &str) -> &'static str {",
				"    let n = word.len();",
				"    match n {",
				"        0 => \"empty\",",
				"        1..=3 => \"short\",",
				"        _ => \"long\",",
				"    }",
				"}",
				"fn main() {",
				"    let word = arg(1);",
				"    match word {",
				"        \"*\" => println!(\"star\"),",
				"        \"start\" | \"run\" => println!(\"go {}\", describe(word)),",
				"        _ => println!(\"{} is {}\", word, describe(word)),",
				"    }",
				"}");
		assertEquals(Collections.singletonList("star"), run(source, "*").lines());
		assertEquals(Collections.singletonList("xy is short"), run(source, "xy").lines());
		assertEquals(Collections.singletonList("go short"), run(source, "run").lines());
		assertEquals(Collections.singletonList("abcdef is long"), run(source, "abcdef").lines());
	}

	@Test
	public void testEnvironmentFallback() throws Exception {
		ShellResult result = run(RashTestSupport.lines(
				"fn main() {",
				"    let dir = env_var_or(\"RASH_TEST_SURELY_UNSET\", \"/usr/local\");",
				"    println!(\"{}\", dir);",
				"}"));
		assertEquals(result.error(), 0, result.exitCode());
		assertEquals(Collections.singletonList("/usr/local"), result.lines());
	}

	@Test
	public void testExitCode() throws Exception {
		ShellResult result = run(RashTestSupport.lines("fn main() {", "    eprintln!(\"failing\");", "    exit(3);", "}"));
		assertEquals(3, result.exitCode());
		assertTrue(result.error().contains("failing"));
		assertTrue(result.lines().isEmpty());
	}
}
