package org.metricshub.rash.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Test;
import org.metricshub.rash.intermediate.ArithExpr;
import org.metricshub.rash.intermediate.EffectSet;
import org.metricshub.rash.intermediate.ShellCondition;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;
import org.metricshub.rash.util.Config;
import org.metricshub.rash.util.ShellDialect;

public class PosixEmitterTest {

	private static final PosixEmitter EMITTER = new PosixEmitter();

	private static ShellIR seq(ShellIR... items) {
		return new ShellIR.Sequence(Arrays.asList(items));
	}

	private static ShellIR echo(String text) {
		return new ShellIR.Echo(ShellValue.literal(text));
	}

	@Test
	public void testEmptyProgram() {
		String script = EMITTER.emit(ShellIR.Sequence.empty());
		assertEquals(
				"#!/bin/sh\n"
						+ "# Generated by Rash\n"
						+ "set -euf\n"
						+ "IFS=' \t\n'\n"
						+ "export LC_ALL=C\n"
						+ "\n"
						+ "main() {\n"
						+ "    :\n"
						+ "}\n"
						+ "\n"
						+ "main \"$@\"\n",
				script);
		OutputValidator.validate(script);
	}

	@Test
	public void testFunctionsComeBeforeMain() {
		ShellIR ir = seq(
				new ShellIR.Function("greet", seq(new ShellIR.Let("who", new ShellValue.ArgRef(1)), new ShellIR.Echo(ShellValue.var("who")))),
				ShellIR.Exec.of("greet", EffectSet.pure(), ShellValue.literal("you")));
		String script = EMITTER.emit(ir);
		assertTrue(script, script.contains(
				"\ngreet() {\n"
						+ "    who=\"${1}\"\n"
						+ "    rash_println \"${who}\"\n"
						+ "}\n"
						+ "\n"
						+ "main() {\n"
						+ "    greet 'you'\n"
						+ "}\n"));
		assertTrue(script.indexOf("rash_println() {") < script.indexOf("greet() {"));
		OutputValidator.validate(script);
	}

	@Test
	public void testHelpersAreEmittedOnDemand() {
		String plain = EMITTER.emit(seq(echo("ready")));
		assertTrue(plain, plain.contains("    echo 'ready'\n"));
		assertFalse(plain, plain.contains("rash_"));

		String dashed = EMITTER.emit(seq(echo("-n"), echo("a\\b")));
		assertTrue(dashed, dashed.contains("    rash_println '-n'\n"));
		assertTrue(dashed, dashed.contains("    rash_println 'a\\b'\n"));
		assertTrue(dashed, dashed.contains("rash_println() {\n    printf '%s\\n' \"$1\"\n}\n"));
		assertFalse(dashed, dashed.contains("rash_eprintln"));

		ShellIR read = seq(new ShellIR.Let("conf", new ShellValue.CommandSubst(
				ShellIR.Exec.of("rash_read_file", EffectSet.pure(), ShellValue.literal("/etc/app.conf")))));
		String withRead = EMITTER.emit(read);
		assertTrue(withRead, withRead.contains("rash_read_file() {"));
		assertTrue(withRead, withRead.contains("    conf=\"$(rash_read_file '/etc/app.conf')\"\n"));

		String both = EMITTER.emit(seq(new ShellIR.Stderr(ShellValue.literal("oops")), new ShellIR.Echo(ShellValue.var("x"))));
		assertTrue(both.indexOf("rash_println() {") < both.indexOf("rash_eprintln() {"));
	}

	@Test
	public void testControlFlow() {
		ShellCondition isDir = ShellCondition.Test.unary("-d", ShellValue.literal("/opt"));
		ShellCondition isEmpty = ShellCondition.Test.unary("-z", ShellValue.var("name"));
		ShellIR ir = seq(
				new ShellIR.If(isDir, echo("dir"), new ShellIR.If(isEmpty, echo("empty"), echo("other"))),
				new ShellIR.For("i", Arrays.asList(ShellValue.literal("1"), ShellValue.literal("2")), new ShellIR.Echo(ShellValue.var("i"))),
				new ShellIR.While(
						new ShellCondition.And(ShellCondition.Const.TRUE, new ShellCondition.Or(isDir, new ShellCondition.Not(isEmpty))),
						ShellIR.Break.INSTANCE),
				new ShellIR.Exit(ShellValue.literal("3")));
		String body = PosixEmitter.render(ir);
		assertEquals(
				"if [ -d '/opt' ]; then\n"
						+ "    echo 'dir'\n"
						+ "elif [ -z \"${name}\" ]; then\n"
						+ "    echo 'empty'\n"
						+ "else\n"
						+ "    echo 'other'\n"
						+ "fi\n"
						+ "for i in '1' '2'; do\n"
						+ "    rash_println \"${i}\"\n"
						+ "done\n"
						+ "while true && { [ -d '/opt' ] || ! [ -z \"${name}\" ]; }; do\n"
						+ "    break\n"
						+ "done\n"
						+ "exit 3",
				body);
	}

	@Test
	public void testCaseArmsAreQuotedLiterals() {
		ShellIR ir = new ShellIR.Case(ShellValue.var("word"), Arrays.asList(
				new ShellIR.CaseArm(Arrays.asList("start", "it's", "*"), echo("go")),
				ShellIR.CaseArm.wildcard(ShellIR.Sequence.empty())));
		String script = EMITTER.emit(ir);
		assertTrue(script, script.contains(
				"\n    case \"${word}\" in\n"
						+ "        'start' | 'it'\\''s' | '*')\n"
						+ "            echo 'go'\n"
						+ "            ;;\n"
						+ "        *)\n"
						+ "            :\n"
						+ "            ;;\n"
						+ "    esac\n"));
		OutputValidator.validate(script);
	}

	@Test
	public void testLetAndExport() {
		assertEquals("APP_HOME='/opt/app'\nexport APP_HOME", PosixEmitter.render(new ShellIR.Let("APP_HOME", ShellValue.literal("/opt/app"), true)));
		ArithExpr increment = new ArithExpr.Binary(ArithExpr.Op.ADD, new ArithExpr.Operand(ShellValue.var("n")), new ArithExpr.Number(1));
		assertEquals("n=\"$((n + 1))\"", PosixEmitter.render(new ShellIR.Let("n", new ShellValue.Arith(increment))));
		assertEquals("v=\"$(double '21')\"", PosixEmitter.render(new ShellIR.Capture(
				ShellIR.Exec.of("double", EffectSet.pure(), ShellValue.literal("21")), "v")));
	}

	@Test
	public void testUnsafeNodesAreRejected() {
		assertThrows(EmissionException.class, () -> PosixEmitter.render(new ShellIR.Let("bad name", ShellValue.literal("x"))));
		assertThrows(EmissionException.class, () -> PosixEmitter.render(new ShellIR.Exit(ShellValue.literal("300"))));
		assertThrows(EmissionException.class, () -> PosixEmitter.render(new ShellIR.Exit(ShellValue.literal("one"))));
		assertThrows(EmissionException.class, () -> PosixEmitter.render(ShellCondition.Test.unary("-x", ShellValue.literal("/bin/sh"))));
		ShellIR nested = seq(new ShellIR.If(ShellCondition.Const.TRUE, new ShellIR.Function("inner", echo("x")), null));
		assertThrows(EmissionException.class, () -> EMITTER.emit(nested));
	}

	@Test
	public void testEveryDialectEmitsPosix() {
		ShellIR ir = seq(echo("same"));
		Config config = new Config();
		for (ShellDialect dialect : ShellDialect.values()) {
			config.setTarget(dialect);
			assertEquals(EMITTER.emit(ir), EMITTER.emit(ir, config));
		}
	}
}
