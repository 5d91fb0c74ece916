package org.metricshub.rash.formal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class FormalOracleTest {

	private static final TinyAst INSTALL = new TinyAst.Sequence(
			new TinyAst.SetEnvironmentVariable("INSTALL_DIR", "/opt/rash"),
			new TinyAst.ExecuteCommand("mkdir", "-p", "/opt/rash/bin"),
			new TinyAst.ChangeDirectory("/opt/rash"));

	@Test
	public void testInstallLayoutOnBothSides() {
		AbstractState rash = RashSemantics.eval(INSTALL, AbstractState.initial());
		AbstractState posix = PosixSemantics.eval(FormalEmitter.emit(INSTALL), AbstractState.initial());
		for (AbstractState state : new AbstractState[] { rash, posix }) {
			assertEquals("/opt/rash", state.getCwd());
			assertEquals("/opt/rash", state.getEnv().get("INSTALL_DIR"));
			assertTrue(state.getEntry("/opt/rash/bin").isDirectory());
			assertTrue(state.getEntry("/opt").isDirectory());
		}
		assertTrue(rash.isEquivalent(posix));
	}

	@Test
	public void testEmittedText() {
		assertEquals(
				"INSTALL_DIR='/opt/rash'\nexport INSTALL_DIR\nmkdir '-p' '/opt/rash/bin'\ncd '/opt/rash'\n",
				FormalEmitter.emit(INSTALL));
		assertEquals("echo 'it'\\''s'\n", FormalEmitter.emit(new TinyAst.ExecuteCommand("echo", "it's")));
	}

	@Test
	public void testInvalidProgramsAreReportedAsErrors() {
		TinyAst[] invalid = {
				new TinyAst.ExecuteCommand("rm", "-rf", "/"),
				new TinyAst.SetEnvironmentVariable("1BAD", "x"),
				new TinyAst.SetEnvironmentVariable("A-B", "x"),
				new TinyAst.ExecuteCommand("echo", "nul\0byte"),
				new TinyAst.ChangeDirectory(""),
				new TinyAst.Sequence(new TinyAst.ExecuteCommand("echo", "ok"), new TinyAst.ExecuteCommand("curl")) };
		for (TinyAst ast : invalid) {
			assertFalse(ast.toString(), ast.isValid());
			ProofReport report = ProofInspector.inspect(ast, AbstractState.initial());
			assertEquals(ast.toString(), ProofReport.Verdict.ERROR, report.getVerdict());
			assertThrows(EvalException.class, () -> FormalEmitter.emit(ast));
			assertThrows(EvalException.class, () -> RashSemantics.eval(ast, AbstractState.initial()));
		}
	}

	@Test
	public void testFailingCommandIsAnError() {
		TinyAst ast = new TinyAst.Sequence(new TinyAst.ExecuteCommand("echo", "before"), new TinyAst.ChangeDirectory("/missing"));
		ProofReport report = ProofInspector.inspect(ast, AbstractState.initial());
		assertEquals(ProofReport.Verdict.ERROR, report.getVerdict());
		assertTrue(report.getMessage(), report.getMessage().startsWith("Structured evaluation failed"));
		assertTrue(report.render().contains("No such file or directory"));
	}

	@Test
	public void testMkdirWithoutParents() {
		TinyAst ast = new TinyAst.ExecuteCommand("mkdir", "/a/b");
		assertThrows(EvalException.class, () -> RashSemantics.eval(ast, AbstractState.initial()));
		assertThrows(EvalException.class, () -> PosixSemantics.eval(FormalEmitter.emit(ast), AbstractState.initial()));
		AbstractState withParent = AbstractState.initial().with("/a", FileSystemEntry.Directory.INSTANCE);
		assertTrue(RashSemantics.eval(ast, withParent).getEntry("/a/b").isDirectory());
	}

	@Test
	public void testMkdirOnExistingDirectory() {
		AbstractState state = AbstractState.initial().with("/data", FileSystemEntry.Directory.INSTANCE);
		assertThrows(EvalException.class, () -> RashSemantics.eval(new TinyAst.ExecuteCommand("mkdir", "/data"), state));
		RashSemantics.eval(new TinyAst.ExecuteCommand("mkdir", "-p", "/data"), state);
		AbstractState file = AbstractState.initial().with("/data", new FileSystemEntry.File("x"));
		assertThrows(EvalException.class, () -> RashSemantics.eval(new TinyAst.ExecuteCommand("mkdir", "-p", "/data"), file));
		assertThrows(EvalException.class, () -> RashSemantics.eval(new TinyAst.ChangeDirectory("/data"), file));
	}

	@Test
	public void testTraces() {
		List<String> rashTrace = new ArrayList<String>();
		RashSemantics.eval(INSTALL, AbstractState.initial(), rashTrace);
		assertEquals(3, rashTrace.size());
		assertEquals("set INSTALL_DIR=/opt/rash", rashTrace.get(0));
		assertEquals("cd /opt/rash", rashTrace.get(2));

		List<String> posixTrace = new ArrayList<String>();
		PosixSemantics.eval(FormalEmitter.emit(INSTALL), AbstractState.initial(), posixTrace);
		assertEquals(4, posixTrace.size());
		assertEquals("export INSTALL_DIR", posixTrace.get(1));
	}

	@Test
	public void testReportRendering() {
		ProofReport report = ProofInspector.inspect(INSTALL, AbstractState.initial());
		String text = report.render();
		assertTrue(text, text.startsWith("Formal equivalence: PASS\n"));
		assertTrue(text, text.contains("== Emitted code ==\nINSTALL_DIR='/opt/rash'\n"));
		assertTrue(text, text.contains("== Structured trace =="));
		assertTrue(text, text.contains("== Shell final state =="));

		ProofReport skipped = ProofReport.skipped("uses a while loop");
		assertEquals(ProofReport.Verdict.SKIPPED, skipped.getVerdict());
		assertFalse(skipped.isPassed());
		assertTrue(skipped.render().contains("uses a while loop"));
	}

	@Test
	public void testDivergenceOrder() {
		AbstractState base = AbstractState.initial();
		AbstractState other = base.copy();
		assertNull(base.firstDivergence(other));

		other.writeStdout("x");
		assertEquals(StateField.STDOUT, base.firstDivergence(other));
		other.touch("/file");
		assertEquals(StateField.FILESYSTEM, base.firstDivergence(other));
		other.changeDirectory("/");
		assertEquals(StateField.FILESYSTEM, base.firstDivergence(other));
		other.createDirectory("/d", false);
		other.changeDirectory("/d");
		assertEquals(StateField.CWD, base.firstDivergence(other));
		other.setVariable("X", "1");
		assertEquals(StateField.ENV, base.firstDivergence(other));
		assertEquals(Collections.emptyList(), base.getStdout());
	}

	@Test
	public void testPathResolution() {
		AbstractState state = AbstractState.initial().with("/home/user", FileSystemEntry.Directory.INSTANCE);
		state.changeDirectory("/home/user");
		assertEquals("/home/user/a", state.resolve("a"));
		assertEquals("/home", state.resolve(".."));
		assertEquals("/", state.resolve("../../../.."));
		assertEquals("/etc/x", state.resolve("//etc/./x/"));
		assertThrows(EvalException.class, () -> state.resolve(""));
	}

	@Test
	public void testShellSideRejectsWhatItDoesNotModel() {
		String[] unsupported = {
				"echo $HOME\n",
				"echo \"$HOME\"\n",
				"echo `id`\n",
				"echo a | cat\n",
				"echo a > file\n",
				"echo a &\n",
				"echo *\n",
				"echo 'open\n",
				"echo \"open\n",
				"A=1 echo x\n" };
		for (String script : unsupported) {
			assertThrows(script, EvalException.class, () -> PosixSemantics.eval(script, AbstractState.initial()));
		}
	}

	@Test
	public void testShellSideWords() {
		AbstractState state = PosixSemantics.eval(
				"# comment\nA=1; B='two words'\nexport C=\"x\\$y\"\necho a\\ b \"c\"'d' # trailing\n:\ntrue\nls -l\n",
				AbstractState.initial());
		assertEquals("1", state.getVariable("A"));
		assertEquals("two words", state.getVariable("B"));
		assertEquals("x$y", state.getVariable("C"));
		assertEquals(Collections.singletonList("a b cd"), state.getStdout());
	}
}
