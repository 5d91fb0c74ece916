package org.metricshub.rash.intermediate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.rash.Rash;
import org.metricshub.rash.RashTestSupport;
import org.metricshub.rash.formal.AbstractState;
import org.metricshub.rash.formal.RashSemantics;
import org.metricshub.rash.formal.ShellIrProjector;

public class IrOptimizerTest {

	private static final Rash RASH = new Rash();

	private static final IrOptimizer OPTIMIZER = new IrOptimizer();

	private static final List<String> PROGRAMS = Arrays.asList(
			RashTestSupport.lines(
					"fn main() {",
					"    let unused = \"dead\";",
					"    let base = \"/opt\";",
					"    let total = 2 * 3 + 1;",
					"    set_env(\"APP_HOME\", format!(\"{}/app\", base));",
					"    mkdir_p(format!(\"{}/app/v{}\", base, total));",
					"    if 1 < 2 {",
					"        println!(\"small\");",
					"    } else {",
					"        println!(\"large\");",
					"    }",
					"}"),
			RashTestSupport.lines(
					"fn main() {",
					"    let mut count = 0;",
					"    for i in 0..4 {",
					"        count = count + i;",
					"        println!(\"step {}\", i);",
					"    }",
					"    println!(\"count={}\", count);",
					"    while false {",
					"        println!(\"never\");",
					"    }",
					"}"),
			RashTestSupport.lines(
					"fn main() {",
					"    let name = \"rash\";",
					"    let dir = format!(\"/srv/{}\", name);",
					"    if name == \"rash\" && dir.len() > 3 {",
					"        mkdir_p(dir);",
					"        cd(dir);",
					"    }",
					"    set_env(\"LEN\", dir.len().to_string());",
					"}"),
			RashTestSupport.lines(
					"fn main() {",
					"    let mode = \"fast\";",
					"    match mode {",
					"        \"slow\" => println!(\"slow\"),",
					"        \"fast\" | \"quick\" => set_env(\"MODE\", mode),",
					"        _ => {}",
					"    }",
					"    let n = 7;",
					"    match n {",
					"        0 => println!(\"zero\"),",
					"        1..=9 => println!(\"digit\"),",
					"        _ => println!(\"many\"),",
					"    }",
					"}"));

	private static ShellIR lower(String source) {
		return new IrLowering().lower(RASH.check(source));
	}

	private static ShellIR seq(ShellIR... items) {
		return new ShellIR.Sequence(Arrays.asList(items));
	}

	@Test
	public void testOptimizationIsIdempotent() {
		for (String source : PROGRAMS) {
			ShellIR once = OPTIMIZER.optimize(lower(source));
			assertEquals(source, once, OPTIMIZER.optimize(once));
		}
	}

	@Test
	public void testOptimizationPreservesTheFormalMeaning() {
		for (String source : PROGRAMS) {
			ShellIR plain = lower(source);
			ShellIR optimized = OPTIMIZER.optimize(plain);
			AbstractState before = RashSemantics.eval(ShellIrProjector.project(plain), AbstractState.initial());
			AbstractState after = RashSemantics.eval(ShellIrProjector.project(optimized), AbstractState.initial());
			assertEquals(source, before, after);
		}
	}

	@Test
	public void testConstantFolding() {
		ShellIR ir = seq(
				new ShellIR.Let("n", new ShellValue.Arith(new ArithExpr.Binary(
						ArithExpr.Op.MUL,
						new ArithExpr.Number(6),
						new ArithExpr.Binary(ArithExpr.Op.SUB, new ArithExpr.Number(10), new ArithExpr.Number(3))))),
				new ShellIR.Echo(new ShellValue.Concat(Arrays.asList(
						ShellValue.literal("n="),
						ShellValue.var("n"),
						ShellValue.literal(""),
						new ShellValue.Concat(Arrays.asList(ShellValue.literal("!"), ShellValue.literal("!")))))));
		ShellIR expected = seq(
				new ShellIR.Let("n", ShellValue.literal("42")),
				new ShellIR.Echo(new ShellValue.Concat(Arrays.asList(ShellValue.literal("n="), ShellValue.var("n"), ShellValue.literal("!!")))));
		assertEquals(expected, OPTIMIZER.optimize(ir));
	}

	@Test
	public void testDivisionByZeroIsNotFolded() {
		ShellValue division = new ShellValue.Arith(new ArithExpr.Binary(ArithExpr.Op.DIV, new ArithExpr.Number(1), new ArithExpr.Number(0)));
		ShellIR ir = seq(new ShellIR.Echo(division));
		assertEquals(ir, OPTIMIZER.optimize(ir));
	}

	@Test
	public void testConstantBranchesArePruned() {
		ShellIR ir = seq(
				new ShellIR.If(ShellCondition.Const.FALSE, new ShellIR.Echo(ShellValue.literal("no")), new ShellIR.Echo(ShellValue.literal("yes"))),
				new ShellIR.If(
						ShellCondition.Test.binary("-lt", ShellValue.literal("1"), ShellValue.literal("2")),
						new ShellIR.Echo(ShellValue.literal("lt")),
						null),
				new ShellIR.While(ShellCondition.Const.FALSE, new ShellIR.Echo(ShellValue.literal("never"))),
				new ShellIR.For("i", Collections.<ShellValue>emptyList(), new ShellIR.Echo(ShellValue.var("i"))));
		assertEquals(
				seq(new ShellIR.Echo(ShellValue.literal("yes")), new ShellIR.Echo(ShellValue.literal("lt"))),
				OPTIMIZER.optimize(ir));
	}

	@Test
	public void testCaseOverAConstantWordIsPruned() {
		List<ShellIR.CaseArm> arms = Arrays.asList(
				new ShellIR.CaseArm(Arrays.asList("a", "b"), new ShellIR.Echo(ShellValue.literal("first"))),
				ShellIR.CaseArm.wildcard(new ShellIR.Echo(ShellValue.literal("other"))));
		ShellValue word = new ShellValue.Concat(Arrays.<ShellValue>asList(ShellValue.literal(""), ShellValue.literal("b")));
		assertEquals(seq(new ShellIR.Echo(ShellValue.literal("first"))), OPTIMIZER.optimize(seq(new ShellIR.Case(word, arms))));
		assertEquals(seq(new ShellIR.Echo(ShellValue.literal("other"))), OPTIMIZER.optimize(seq(new ShellIR.Case(ShellValue.literal("z"), arms))));
		ShellIR unknown = seq(new ShellIR.Case(ShellValue.var("x"), arms));
		assertEquals(unknown, OPTIMIZER.optimize(unknown));
	}

	@Test
	public void testStatementsAfterExitAreDropped() {
		ShellIR ir = seq(
				new ShellIR.Echo(ShellValue.literal("bye")),
				new ShellIR.Exit(ShellValue.literal("1")),
				new ShellIR.Echo(ShellValue.literal("unreachable")));
		assertEquals(seq(new ShellIR.Echo(ShellValue.literal("bye")), new ShellIR.Exit(ShellValue.literal("1"))), OPTIMIZER.optimize(ir));
	}

	@Test
	public void testDeadStores() {
		ShellIR.Exec hostname = ShellIR.Exec.of("hostname", EffectSet.of(Effect.PROCESS_EXEC));
		ShellIR ir = seq(
				new ShellIR.Let("unused", ShellValue.literal("x")),
				new ShellIR.Let("exported", ShellValue.literal("y"), true),
				new ShellIR.Let("side_effect", new ShellValue.CommandSubst(hostname)),
				new ShellIR.Let("read", ShellValue.literal("z")),
				new ShellIR.Echo(ShellValue.var("read")));
		ShellIR optimized = OPTIMIZER.optimize(ir);
		List<ShellIR> items = ((ShellIR.Sequence) optimized).getItems();
		assertEquals(4, items.size());
		assertFalse(items.contains(new ShellIR.Let("unused", ShellValue.literal("x"))));
		assertTrue(items.contains(new ShellIR.Let("exported", ShellValue.literal("y"), true)));
		assertTrue(items.contains(new ShellIR.Let("side_effect", new ShellValue.CommandSubst(hostname))));
	}

	@Test
	public void testUnreadDivisionByAVariableIsKept() {
		ArithExpr n = new ArithExpr.Operand(ShellValue.var("n"));
		ShellIR byVariable = new ShellIR.Let("ratio", new ShellValue.Arith(new ArithExpr.Binary(ArithExpr.Op.DIV, new ArithExpr.Number(10), n)));
		ShellIR remainder = new ShellIR.Let("rest", new ShellValue.Concat(Arrays.<ShellValue>asList(ShellValue.literal("r="),
				new ShellValue.Arith(new ArithExpr.Binary(ArithExpr.Op.REM, n, new ArithExpr.Number(0))))));
		ShellIR byConstant = new ShellIR.Let("half", new ShellValue.Arith(new ArithExpr.Binary(ArithExpr.Op.DIV, n, new ArithExpr.Number(2))));
		ShellIR ir = seq(new ShellIR.Let("n", new ShellValue.ArgRef(1)), byVariable, remainder, byConstant);
		assertEquals(seq(new ShellIR.Let("n", new ShellValue.ArgRef(1)), byVariable, remainder), OPTIMIZER.optimize(ir));

		ShellIR program = lower(RashTestSupport.lines(
				"fn main() {",
				"    let word = arg(1);",
				"    let d = word.len();",
				"    let unused = 100 / d;",
				"}"));
		boolean kept = false;
		for (ShellIR item : ((ShellIR.Sequence) OPTIMIZER.optimize(program)).getItems()) {
			kept |= item.toString().contains("unused");
		}
		assertTrue(program.toString(), kept);
	}

	@Test
	public void testNestedSequencesAreFlattened() {
		ShellIR ir = seq(seq(seq(new ShellIR.Echo(ShellValue.literal("a"))), ShellIR.Sequence.empty()), new ShellIR.Echo(ShellValue.literal("b")));
		assertEquals(seq(new ShellIR.Echo(ShellValue.literal("a")), new ShellIR.Echo(ShellValue.literal("b"))), OPTIMIZER.optimize(ir));
	}
}
