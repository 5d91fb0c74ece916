package org.metricshub.rash.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.util.Arrays;
import org.junit.Test;
import org.metricshub.rash.intermediate.ArithExpr;
import org.metricshub.rash.intermediate.EffectSet;
import org.metricshub.rash.intermediate.ShellIR;
import org.metricshub.rash.intermediate.ShellValue;

public class ShellEscaperTest {

	@Test
	public void testLiteralsAreSingleQuoted() {
		assertEquals("'hello'", ShellEscaper.escape(ShellValue.literal("hello")));
		assertEquals("''", ShellEscaper.escape(ShellValue.literal("")));
		assertEquals("'it'\\''s'", ShellEscaper.escape(ShellValue.literal("it's")));
		assertEquals("'$(rm -rf /) `id` ${HOME} \"x\"'", ShellEscaper.escape(ShellValue.literal("$(rm -rf /) `id` ${HOME} \"x\"")));
		assertEquals("'a\nb'", ShellEscaper.escape(ShellValue.literal("a\nb")));
	}

	@Test
	public void testLiteralConcatenationIsOneQuotedWord() {
		ShellValue value = new ShellValue.Concat(Arrays.asList(ShellValue.literal("a b"), ShellValue.literal("'c")));
		assertEquals("'a b'\\''c'", ShellEscaper.escape(value));
	}

	@Test
	public void testExpansionsAreDoubleQuoted() {
		assertEquals("\"${name}\"", ShellEscaper.escape(ShellValue.var("name")));
		assertEquals("\"${HOME}\"", ShellEscaper.escape(new ShellValue.EnvRef("HOME", false)));
		assertEquals("\"${PREFIX:-}\"", ShellEscaper.escape(new ShellValue.EnvRef("PREFIX", true)));
		assertEquals("\"${2}\"", ShellEscaper.escape(new ShellValue.ArgRef(2)));
		assertEquals("\"${#name}\"", ShellEscaper.escape(new ShellValue.Length("name")));

		ShellValue mixed = new ShellValue.Concat(Arrays.asList(
				ShellValue.literal("cost: $5 \"now\" `x` \\ "),
				ShellValue.var("price")));
		assertEquals("\"cost: \\$5 \\\"now\\\" \\`x\\` \\\\ ${price}\"", ShellEscaper.escape(mixed));
	}

	@Test
	public void testCommandSubstitutionAndArithmetic() {
		ShellIR.Exec exec = ShellIR.Exec.of("rash_read_file", EffectSet.pure(), ShellValue.var("path"));
		assertEquals("\"$(rash_read_file \"${path}\")\"", ShellEscaper.escape(new ShellValue.CommandSubst(exec)));

		ArithExpr sum = new ArithExpr.Binary(
				ArithExpr.Op.ADD,
				new ArithExpr.Operand(ShellValue.var("i")),
				new ArithExpr.Binary(ArithExpr.Op.MUL, new ArithExpr.Number(2), new ArithExpr.Number(-3)));
		assertEquals("i + (2 * (-3))", ShellEscaper.renderArith(sum));
		assertEquals("\"$((i + (2 * (-3))))\"", ShellEscaper.escape(new ShellValue.Arith(sum)));
		assertEquals("-i", ShellEscaper.renderArith(new ArithExpr.Negate(new ArithExpr.Operand(ShellValue.var("i")))));
		assertThrows(EmissionException.class, () -> ShellEscaper.renderArith(new ArithExpr.Operand(ShellValue.literal("1; id"))));
	}

	@Test
	public void testCommandWords() {
		assertEquals("mkdir", ShellEscaper.escapeCommand(ShellValue.literal("mkdir")));
		assertEquals("/usr/bin/env", ShellEscaper.escapeCommand(ShellValue.literal("/usr/bin/env")));
		assertEquals("'if'", ShellEscaper.escapeCommand(ShellValue.literal("if")));
		assertEquals("'A=1'", ShellEscaper.escapeCommand(ShellValue.literal("A=1")));
		assertEquals("'rm -rf'", ShellEscaper.escapeCommand(ShellValue.literal("rm -rf")));
		assertEquals("\"${cmd}\"", ShellEscaper.escapeCommand(ShellValue.var("cmd")));

		ShellIR.Exec exec = ShellIR.Exec.of("cp", EffectSet.pure(), ShellValue.literal("-r"), ShellValue.var("src"), ShellValue.literal("/my dir"));
		assertEquals("cp '-r' \"${src}\" '/my dir'", ShellEscaper.renderCommand(exec));
	}

	@Test
	public void testNulIsRejected() {
		assertThrows(EmissionException.class, () -> ShellEscaper.quote("a\0b"));
		assertThrows(EmissionException.class, () -> ShellEscaper.escape(ShellValue.literal("\0")));
		ShellValue mixed = new ShellValue.Concat(Arrays.asList(ShellValue.literal("x\0"), ShellValue.var("y")));
		assertThrows(EmissionException.class, () -> ShellEscaper.escape(mixed));
	}

	@Test
	public void testNames() {
		assertEquals("valid_Name9", ShellEscaper.checkName("valid_Name9"));
		for (String name : new String[] { "", "9x", "a-b", "a b", "a$", "x;id", "a\0" }) {
			assertThrows(name, EmissionException.class, () -> ShellEscaper.checkName(name));
		}
		assertThrows(EmissionException.class, () -> ShellEscaper.escape(new ShellValue.EnvRef("BAD NAME", false)));
		assertThrows(EmissionException.class, () -> ShellEscaper.escape(new ShellValue.ArgRef(0)));
	}
}
