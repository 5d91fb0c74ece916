package org.metricshub.rash.formal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

/**
 * Runs the structured and the shell evaluators side by side on a battery of
 * programs that must all be proven equivalent.
 */
@RunWith(Parameterized.class)
public class ProofInspectorTest {

	@Parameter(0)
	public String description;

	@Parameter(1)
	public TinyAst program;

	@Parameters(name = "{0}")
	public static Collection<Object[]> programs() {
		return Arrays.asList(new Object[][] {
				{
						"install layout",
						new TinyAst.Sequence(
								new TinyAst.SetEnvironmentVariable("INSTALL_DIR", "/opt/rash"),
								new TinyAst.ExecuteCommand("mkdir", "-p", "/opt/rash/bin"),
								new TinyAst.ChangeDirectory("/opt/rash")) },
				{ "empty program", new TinyAst.Sequence() },
				{ "plain echo", new TinyAst.ExecuteCommand("echo", "hello", "world") },
				{ "echo with an empty word", new TinyAst.ExecuteCommand("echo", "a", "", "b") },
				{ "echo without argument", new TinyAst.ExecuteCommand("echo") },
				{ "echo with leading empty words", new TinyAst.ExecuteCommand("echo", "", "a") },
				{ "echo of empty words only", new TinyAst.ExecuteCommand("echo", "", "") },
				{
						"shell metacharacters stay text",
						new TinyAst.ExecuteCommand("echo", "$(rm -rf /)", "`id`", "a;b", "x|y", "*", "?", "<in", ">out", "&") },
				{ "quotes", new TinyAst.ExecuteCommand("echo", "it's", "\"double\"", "'''") },
				{ "backslashes and newlines", new TinyAst.ExecuteCommand("echo", "a\\b", "line1\nline2", "tab\there") },
				{ "comment character", new TinyAst.ExecuteCommand("echo", "#not-a-comment", "a#b") },
				{ "variable with metacharacters", new TinyAst.SetEnvironmentVariable("GREETING", "hi $USER; `x` 'y'") },
				{ "variable overwritten", new TinyAst.Sequence(
						new TinyAst.SetEnvironmentVariable("V", "1"),
						new TinyAst.SetEnvironmentVariable("V", "2")) },
				{ "empty variable", new TinyAst.SetEnvironmentVariable("EMPTY", "") },
				{ "assignment lookalike argument", new TinyAst.ExecuteCommand("echo", "A=1", "B=") },
				{
						"relative directories",
						new TinyAst.Sequence(
								new TinyAst.ExecuteCommand("mkdir", "tmp"),
								new TinyAst.ChangeDirectory("tmp"),
								new TinyAst.ExecuteCommand("mkdir", "-p", "a/b/c"),
								new TinyAst.ChangeDirectory("a/./b/../b"),
								new TinyAst.ExecuteCommand("touch", "file.txt")) },
				{ "repeated mkdir -p", new TinyAst.Sequence(
						new TinyAst.ExecuteCommand("mkdir", "-p", "/srv/data"),
						new TinyAst.ExecuteCommand("mkdir", "-p", "/srv/data")) },
				{ "several directories", new TinyAst.ExecuteCommand("mkdir", "/one", "/two", "/three") },
				{ "directory with a space", new TinyAst.Sequence(
						new TinyAst.ExecuteCommand("mkdir", "/with space"),
						new TinyAst.ChangeDirectory("/with space")) },
				{ "touch twice", new TinyAst.Sequence(
						new TinyAst.ExecuteCommand("touch", "/f"),
						new TinyAst.ExecuteCommand("touch", "/f")) },
				{ "no-op commands", new TinyAst.Sequence(
						new TinyAst.ExecuteCommand("true"),
						new TinyAst.ExecuteCommand("test", "-d", "/")) },
				{ "nested sequences", new TinyAst.Sequence(
						new TinyAst.Sequence(new TinyAst.ExecuteCommand("echo", "1")),
						new TinyAst.Sequence(new TinyAst.Sequence(new TinyAst.ExecuteCommand("echo", "2")))) },
				{ "non ascii text", new TinyAst.ExecuteCommand("echo", "héllo", "日本") } });
	}

	@Test
	public void testEquivalence() {
		ProofReport report = ProofInspector.inspect(program, AbstractState.initial());
		assertEquals(report.render(), ProofReport.Verdict.PASS, report.getVerdict());
		assertTrue(report.isPassed());
		assertNull(report.getDivergence());
		assertEquals(report.getRashState(), report.getPosixState());
	}

	@Test
	public void testEmissionIsStable() {
		assertEquals(FormalEmitter.emit(program), FormalEmitter.emit(program));
	}

	@Test
	public void testInitialStateIsUntouched() {
		AbstractState initial = AbstractState.initial();
		ProofInspector.inspect(program, initial);
		assertEquals(AbstractState.initial(), initial);
		assertFalse(initial.getCwd().isEmpty());
	}
}
