package org.metricshub.rash.verifier;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.rash.ErrorKind;
import org.metricshub.rash.intermediate.ArithExpr;
import org.metricshub.rash.intermediate.EffectSet;
import org.metricshub.rash.intermediate.ShellCondition;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;

public class VerifierTest {

	private static ShellValue lit(String text) {
		return ShellValue.literal(text);
	}

	private static ShellValue var(String name) {
		return ShellValue.var(name);
	}

	private static ShellIR.Exec exec(String command, ShellValue... args) {
		return ShellIR.Exec.of(command, EffectSet.pure(), args);
	}

	private static ShellIR seq(ShellIR... items) {
		return new ShellIR.Sequence(Arrays.asList(items));
	}

	private static ShellValue increment(String name) {
		return new ShellValue.Arith(new ArithExpr.Binary(ArithExpr.Op.ADD, new ArithExpr.Operand(var(name)), new ArithExpr.Number(1)));
	}

	/**
	 * @return the name of the failed check, or <code>null</code> when the program passes
	 */
	private static String failedCheck(ShellIR ir, VerificationLevel level) {
		try {
			Verifier.verify(ir, level);
			return null;
		} catch (VerificationException e) {
			assertEquals(ErrorKind.VERIFICATION, e.getKind());
			String message = e.getMessage();
			return message.substring(0, message.indexOf(':'));
		}
	}

	private static void assertPasses(ShellIR ir, VerificationLevel level) {
		String failed = failedCheck(ir, level);
		if (failed != null) {
			fail("Expected " + ir + " to pass " + level + " but " + failed + " failed");
		}
	}

	private static void assertFails(ShellIR ir, VerificationLevel level, String check) {
		assertEquals("Failed check of " + ir + " at " + level, check, failedCheck(ir, level));
	}

	@Test
	public void testLevels() {
		assertTrue(Verifier.checksFor(VerificationLevel.NONE).isEmpty());
		assertEquals(1, Verifier.checksFor(VerificationLevel.BASIC).size());
		assertEquals(2, Verifier.checksFor(VerificationLevel.STRICT).size());
		assertEquals(4, Verifier.checksFor(VerificationLevel.PARANOID).size());
		assertEquals(Verifier.getChecks(), Verifier.checksFor(VerificationLevel.PARANOID));
		assertTrue(VerificationLevel.PARANOID.includes(VerificationLevel.BASIC));
		assertFalse(VerificationLevel.BASIC.includes(VerificationLevel.STRICT));
		assertEquals(VerificationLevel.STRICT, VerificationLevel.fromString("Strict"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownLevel() {
		VerificationLevel.fromString("extreme");
	}

	@Test
	public void testSafeProgramPassesEveryLevel() {
		ShellIR ir = seq(
				new ShellIR.Let("x", lit("a; rm -rf / $(reboot)")),
				exec("printf", lit("%s\\n"), var("x")),
				new ShellIR.Let("user", new ShellValue.ArgRef(1)),
				new ShellIR.Echo(new ShellValue.Concat(Arrays.asList(lit("Hello, "), var("user")))),
				exec("mkdir", lit("-p"), var("user")));
		for (VerificationLevel level : VerificationLevel.values()) {
			assertPasses(ir, level);
		}
	}

	@Test
	public void testArgumentAsCommand() {
		ShellIR ir = seq(new ShellIR.Let("cmd", new ShellValue.ArgRef(1)), new ShellIR.Exec(var("cmd"), new ArrayList<ShellValue>(), EffectSet.pure()));
		assertFails(ir, VerificationLevel.BASIC, InjectionCheck.NAME);
		assertPasses(ir, VerificationLevel.NONE);
	}

	@Test
	public void testFailureMessage() {
		ShellIR ir = seq(new ShellIR.Exec(new ShellValue.EnvRef("EDITOR", false), new ArrayList<ShellValue>(), EffectSet.pure()));
		try {
			Verifier.verify(ir, VerificationLevel.BASIC);
			fail("EDITOR comes from the environment");
		} catch (VerificationException e) {
			assertTrue(e.getMessage(), e.getMessage().startsWith(InjectionCheck.NAME + ": "));
			assertTrue(e.getMessage(), e.getMessage().contains("${EDITOR}"));
		}
	}

	@Test
	public void testEvalAndShellOfInput() {
		assertFails(seq(exec("eval", new ShellValue.EnvRef("INPUT", false))), VerificationLevel.BASIC, InjectionCheck.NAME);
		assertFails(seq(exec("sh", lit("-c"), new ShellValue.ArgRef(1))), VerificationLevel.BASIC, InjectionCheck.NAME);
		assertFails(seq(exec(".", new ShellValue.ArgRef(2))), VerificationLevel.BASIC, InjectionCheck.NAME);
		assertPasses(seq(exec("sh", lit("install.sh"), new ShellValue.ArgRef(1))), VerificationLevel.BASIC);
		assertPasses(seq(exec("sh", lit("-c"), lit("echo fixed"))), VerificationLevel.BASIC);
	}

	@Test
	public void testInputInArithmetic() {
		ShellIR ir = seq(
				new ShellIR.Let("n", new ShellValue.ArgRef(1)),
				new ShellIR.Let("m", new ShellValue.Arith(new ArithExpr.Operand(var("n")))));
		assertFails(ir, VerificationLevel.BASIC, InjectionCheck.NAME);
		ShellIR fixed = seq(
				new ShellIR.Let("n", lit("4")),
				new ShellIR.Let("m", new ShellValue.Arith(new ArithExpr.Operand(var("n")))));
		assertPasses(fixed, VerificationLevel.BASIC);
	}

	@Test
	public void testTaintFlowsThroughFunctionParameters() {
		ShellIR run = new ShellIR.Function("run", seq(
				new ShellIR.Let("p", new ShellValue.ArgRef(1)),
				new ShellIR.Exec(var("p"), new ArrayList<ShellValue>(), EffectSet.pure())));
		assertFails(seq(run, exec("run", new ShellValue.ArgRef(1))), VerificationLevel.BASIC, InjectionCheck.NAME);
		assertPasses(seq(run, exec("run", lit("true"))), VerificationLevel.BASIC);
	}

	@Test
	public void testTaintFlowsThroughCapturedOutput() {
		ShellIR ir = seq(
				new ShellIR.Capture(exec("cat", lit("/etc/hostname")), "host"),
				new ShellIR.Exec(var("host"), new ArrayList<ShellValue>(), EffectSet.pure()));
		assertFails(ir, VerificationLevel.BASIC, InjectionCheck.NAME);
		ShellIR substituted = seq(
				new ShellIR.Let("host", new ShellValue.CommandSubst(exec("hostname"))),
				new ShellIR.Exec(var("host"), new ArrayList<ShellValue>(), EffectSet.pure()));
		assertFails(substituted, VerificationLevel.BASIC, InjectionCheck.NAME);
	}

	@Test
	public void testNondeterministicSources() {
		ShellIR[] programs = {
				seq(new ShellIR.Let("r", new ShellValue.EnvRef("RANDOM", false))),
				seq(new ShellIR.Echo(var("SECONDS"))),
				seq(exec("date")),
				seq(exec("mktemp")),
				seq(exec("ls", lit("/tmp"))),
				seq(exec("head", lit("-c"), lit("8"), lit("/dev/urandom"))) };
		for (ShellIR ir : programs) {
			assertFails(ir, VerificationLevel.STRICT, DeterminismCheck.NAME);
			assertPasses(ir, VerificationLevel.BASIC);
		}
		assertPasses(seq(exec("printf", lit("%s"), lit("today"))), VerificationLevel.STRICT);
	}

	@Test
	public void testNonIdempotentCommands() {
		ShellIR[] programs = {
				seq(exec("mkdir", lit("/opt/app"))),
				seq(exec("rm", lit("/tmp/lock"))),
				seq(exec("ln", lit("-s"), lit("/opt/app"), lit("/usr/local/app"))) };
		for (ShellIR ir : programs) {
			assertFails(ir, VerificationLevel.PARANOID, IdempotencyCheck.NAME);
			assertPasses(ir, VerificationLevel.STRICT);
		}
		assertPasses(seq(exec("mkdir", lit("-p"), lit("/opt/app"))), VerificationLevel.PARANOID);
		assertPasses(seq(exec("rm", lit("-rf"), lit("/tmp/lock"))), VerificationLevel.PARANOID);
		assertPasses(seq(exec("ln", lit("-sf"), lit("/opt/app"), lit("/usr/local/app"))), VerificationLevel.PARANOID);
		assertPasses(
				seq(exec("rm", lit("-f"), lit("/usr/local/app")), exec("ln", lit("-s"), lit("/opt/app"), lit("/usr/local/app"))),
				VerificationLevel.PARANOID);
	}

	@Test
	public void testLongOptionsCountAsFlags() {
		assertPasses(seq(exec("mkdir", lit("--parents"), lit("/opt/app"))), VerificationLevel.PARANOID);
		assertPasses(seq(exec("rm", lit("--force"), lit("/tmp/lock"))), VerificationLevel.PARANOID);
		assertPasses(seq(exec("ln", lit("--symbolic"), lit("--force"), lit("/opt/app"), lit("/usr/local/app"))), VerificationLevel.PARANOID);
		assertFails(seq(exec("ln", lit("--symbolic"), lit("/opt/app"), lit("/usr/local/app"))), VerificationLevel.PARANOID, IdempotencyCheck.NAME);
		assertFails(seq(exec("mkdir", lit("--verbose"), lit("/opt/app"))), VerificationLevel.PARANOID, IdempotencyCheck.NAME);
		assertFails(seq(exec("rm", lit("--"), lit("-f"))), VerificationLevel.PARANOID, IdempotencyCheck.NAME);
	}

	@Test
	public void testUnboundedLoops() {
		ShellIR forever = seq(new ShellIR.While(ShellCondition.Const.TRUE, new ShellIR.Echo(lit("y"))));
		assertFails(forever, VerificationLevel.PARANOID, ResourceSafetyCheck.NAME);
		assertPasses(forever, VerificationLevel.STRICT);

		ShellIR innerBreakOnly = seq(new ShellIR.While(
				ShellCondition.Const.TRUE,
				new ShellIR.While(ShellCondition.Const.TRUE, ShellIR.Break.INSTANCE)));
		assertFails(innerBreakOnly, VerificationLevel.PARANOID, ResourceSafetyCheck.NAME);

		ShellIR withBreak = seq(new ShellIR.While(
				ShellCondition.Const.TRUE,
				seq(new ShellIR.Echo(lit("once")), new ShellIR.If(ShellCondition.Const.TRUE, ShellIR.Break.INSTANCE, null))));
		assertPasses(withBreak, VerificationLevel.PARANOID);

		ShellIR withExit = seq(new ShellIR.While(ShellCondition.Const.TRUE, new ShellIR.Exit(lit("1"))));
		assertPasses(withExit, VerificationLevel.PARANOID);
	}

	@Test
	public void testCounterBoundLoops() {
		ShellCondition bound = ShellCondition.Test.binary("-lt", var("i"), lit("10"));
		ShellIR counted = seq(
				new ShellIR.Let("i", lit("0")),
				new ShellIR.While(bound, seq(new ShellIR.Echo(var("i")), new ShellIR.Let("i", increment("i")))));
		assertPasses(counted, VerificationLevel.PARANOID);

		ShellIR frozen = seq(new ShellIR.Let("i", lit("0")), new ShellIR.While(bound, new ShellIR.Echo(var("i"))));
		assertFails(frozen, VerificationLevel.PARANOID, ResourceSafetyCheck.NAME);

		ShellIR otherCounter = seq(
				new ShellIR.Let("i", lit("0")),
				new ShellIR.While(bound, new ShellIR.Let("j", increment("j"))));
		assertFails(otherCounter, VerificationLevel.PARANOID, ResourceSafetyCheck.NAME);
	}

	@Test
	public void testLevelsAreMonotonic() {
		List<ShellIR> programs = Arrays.asList(
				seq(exec("printf", lit("%s"), lit("x"))),
				seq(exec("mkdir", lit("/x"))),
				seq(exec("date")),
				seq(new ShellIR.While(ShellCondition.Const.TRUE, new ShellIR.Echo(lit("y")))),
				seq(exec("eval", new ShellValue.ArgRef(1))),
				seq(new ShellIR.Let("r", new ShellValue.EnvRef("RANDOM", false)), exec("rm", lit("/x"))));
		VerificationLevel[] levels = VerificationLevel.values();
		for (ShellIR ir : programs) {
			for (int high = 0; high < levels.length; high++) {
				if (failedCheck(ir, levels[high]) != null) {
					continue;
				}
				for (int low = 0; low < high; low++) {
					assertPasses(ir, levels[low]);
				}
			}
		}
	}
}
