package org.metricshub.rash.intermediate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.rash.ErrorKind;
import org.metricshub.rash.Rash;
import org.metricshub.rash.RashTestSupport;
import org.metricshub.rash.TranspileException;
import org.metricshub.rash.ast.Intrinsic;

public class IrLoweringTest {

	private static final Rash RASH = new Rash();

	private static ShellIR lower(IrLowering lowering, String... lines) {
		return lowering.lower(RASH.check(RashTestSupport.lines(lines)));
	}

	private static ShellIR lower(String... lines) {
		return lower(new IrLowering(), lines);
	}

	/**
	 * @return every statement of the tree, depth first
	 */
	static List<ShellIR> statements(ShellIR root) {
		List<ShellIR> all = new ArrayList<ShellIR>();
		collect(root, all);
		return all;
	}

	private static void collect(ShellIR node, List<ShellIR> all) {
		if (node == null) {
			return;
		}
		all.add(node);
		if (node instanceof ShellIR.Sequence) {
			for (ShellIR item : ((ShellIR.Sequence) node).getItems()) {
				collect(item, all);
			}
		} else if (node instanceof ShellIR.If) {
			collect(((ShellIR.If) node).getThenBranch(), all);
			collect(((ShellIR.If) node).getElseBranch(), all);
		} else if (node instanceof ShellIR.Case) {
			for (ShellIR.CaseArm arm : ((ShellIR.Case) node).getArms()) {
				collect(arm.getBody(), all);
			}
		} else if (node instanceof ShellIR.While) {
			collect(((ShellIR.While) node).getBody(), all);
		} else if (node instanceof ShellIR.For) {
			collect(((ShellIR.For) node).getBody(), all);
		} else if (node instanceof ShellIR.Function) {
			collect(((ShellIR.Function) node).getBody(), all);
		}
	}

	private static <T extends ShellIR> List<T> statements(ShellIR root, Class<T> type) {
		List<T> selected = new ArrayList<T>();
		for (ShellIR node : statements(root)) {
			if (type.isInstance(node)) {
				selected.add(type.cast(node));
			}
		}
		return selected;
	}

	private static void assertRejected(String source) {
		try {
			lower(source);
			fail("Expected an IR generation error for " + source);
		} catch (TranspileException e) {
			assertEquals(e.getMessage(), ErrorKind.IR_GENERATION, e.getKind());
		}
	}

	@Test
	public void testMatchBecomesACase() {
		ShellIR ir = lower(
				"fn main() {",
				"    let word = arg(1);",
				"    match word {",
				"        \"start\" | \"run\" => println!(\"go\"),",
				"        \"stop\" => println!(\"halt\"),",
				"        _ => println!(\"what?\"),",
				"        \"never\" => println!(\"unreachable\"),",
				"    }",
				"}");
		List<ShellIR.Case> cases = statements(ir, ShellIR.Case.class);
		assertEquals(1, cases.size());
		ShellIR.Case match = cases.get(0);
		assertTrue(match.getScrutinee() instanceof ShellValue.VarRef);
		assertEquals(3, match.getArms().size());
		assertEquals(Arrays.asList("start", "run"), match.getArms().get(0).getPatterns());
		assertEquals(Collections.singletonList("stop"), match.getArms().get(1).getPatterns());
		assertTrue(match.getArms().get(2).isWildcard());
		assertEquals(new ShellIR.Echo(ShellValue.literal("what?")), first(match.getArms().get(2).getBody()));
	}

	@Test
	public void testRangeMatchBecomesAnIfChain() {
		ShellIR ir = lower(
				"fn main() {",
				"    let word = arg(1);",
				"    let n = word.len();",
				"    match n {",
				"        0 => println!(\"empty\"),",
				"        1..=3 | 10..20 => println!(\"odd size\"),",
				"        _ => println!(\"other\"),",
				"    }",
				"}");
		assertTrue(statements(ir, ShellIR.Case.class).isEmpty());
		List<ShellIR.If> chain = statements(ir, ShellIR.If.class);
		assertEquals(3, chain.size());
		ShellCondition.Test empty = (ShellCondition.Test) chain.get(0).getCondition();
		assertEquals("-eq", empty.getOp());
		assertEquals(ShellValue.literal("0"), empty.getOperands().get(1));
		ShellCondition.Or ranges = (ShellCondition.Or) chain.get(1).getCondition();
		assertTrue(ranges.getLeft() instanceof ShellCondition.And);
		assertTrue(ranges.getRight().toString(), ranges.getRight().toString().contains("-lt"));
		assertEquals(ShellCondition.Const.TRUE, chain.get(2).getCondition());
	}

	@Test
	public void testMatchPatternTypesAreChecked() {
		assertRejected(RashTestSupport.lines("fn main() {", "    match 1 {", "        \"one\" => {}", "        _ => {}", "    }", "}"));
		assertRejected(RashTestSupport.lines("fn main() {", "    let s = \"a\";", "    match s {", "        1..=2 => {}", "        _ => {}", "    }", "}"));
	}

	private static ShellIR first(ShellIR body) {
		return body instanceof ShellIR.Sequence ? ((ShellIR.Sequence) body).getItems().get(0) : body;
	}

	@Test
	public void testLetBecomesAnAssignment() {
		ShellIR ir = lower("fn main() {", "    let greeting = \"hi\";", "}");
		assertTrue(statements(ir).contains(new ShellIR.Let("greeting", ShellValue.literal("hi"))));
	}

	@Test
	public void testShadowingAcrossScopes() {
		ShellIR ir = lower(
				"fn main() {",
				"    let x = \"outer\";",
				"    if true {",
				"        let x = \"inner\";",
				"        println!(\"{}\", x);",
				"    }",
				"    println!(\"{}\", x);",
				"}");
		List<ShellIR.Let> lets = statements(ir, ShellIR.Let.class);
		assertEquals(new ShellIR.Let("x", ShellValue.literal("outer")), lets.get(0));
		assertEquals(new ShellIR.Let("x_1", ShellValue.literal("inner")), lets.get(1));
		List<ShellIR.Echo> echoes = statements(ir, ShellIR.Echo.class);
		assertEquals(2, echoes.size());
		assertEquals(ShellValue.var("x_1"), echoes.get(0).getValue());
		assertEquals(ShellValue.var("x"), echoes.get(1).getValue());
	}

	@Test
	public void testReassignmentKeepsTheName() {
		ShellIR ir = lower("fn main() {", "    let mut n = 1;", "    n = n + 2;", "    println!(\"{}\", n);", "}");
		List<ShellIR.Let> lets = statements(ir, ShellIR.Let.class);
		assertEquals(2, lets.size());
		assertEquals("n", lets.get(0).getName());
		assertEquals("n", lets.get(1).getName());
		assertTrue(lets.get(1).getValue() instanceof ShellValue.Arith);
	}

	@Test
	public void testFunctionsNamedLikeShellWordsAreRenamed() {
		IrLowering lowering = new IrLowering();
		ShellIR ir = lower(lowering, "fn echo(msg: &str) {}", "fn greet() {}", "fn main() {", "    echo(\"x\");", "    greet();", "}");
		assertEquals("fn_echo", lowering.getFunctionNames().get("echo"));
		assertEquals("greet", lowering.getFunctionNames().get("greet"));
		List<ShellIR.Function> functions = statements(ir, ShellIR.Function.class);
		assertEquals(2, functions.size());
		assertEquals("fn_echo", functions.get(0).getName());
		List<ShellIR.Exec> calls = statements(ir, ShellIR.Exec.class);
		assertEquals("fn_echo", calls.get(0).getCommandName());
		assertEquals(ShellValue.literal("x"), calls.get(0).getArgs().get(0));
		assertEquals("greet", calls.get(1).getCommandName());
	}

	@Test
	public void testParametersAreBoundFromPositions() {
		ShellIR ir = lower("fn show(a: &str, b: i32) {", "    println!(\"{} {}\", a, b);", "}", "fn main() {", "    show(\"x\", 2);", "}");
		ShellIR.Function show = statements(ir, ShellIR.Function.class).get(0);
		List<ShellIR.Let> lets = statements(show, ShellIR.Let.class);
		assertEquals(new ShellValue.ArgRef(1), lets.get(0).getValue());
		assertEquals(new ShellValue.ArgRef(2), lets.get(1).getValue());
	}

	@Test
	public void testStringInterpolationOfBoundNames() {
		ShellIR ir = lower("fn main() {", "    let who = \"you\";", "    echo(\"${who} and ${nobody}\");", "}");
		ShellIR.Echo echo = statements(ir, ShellIR.Echo.class).get(0);
		assertTrue(echo.getValue() instanceof ShellValue.Concat);
		List<ShellValue> parts = ((ShellValue.Concat) echo.getValue()).getParts();
		assertEquals(ShellValue.var("who"), parts.get(0));
		assertEquals(ShellValue.literal(" and ${nobody}"), parts.get(1));
	}

	@Test
	public void testIntrinsics() {
		IrLowering lowering = new IrLowering();
		ShellIR ir = lower(
				lowering,
				"fn main() {",
				"    mkdir_p(\"/opt/app\");",
				"    remove_file(\"/tmp/lock\");",
				"    write_file(\"/opt/app/conf\", \"x=1\");",
				"    set_env(\"APP_HOME\", \"/opt/app\");",
				"    exec(\"systemctl\", \"restart\", \"app\");",
				"}");
		List<ShellIR.Exec> execs = statements(ir, ShellIR.Exec.class);
		assertEquals("mkdir", execs.get(0).getCommandName());
		assertEquals(ShellValue.literal("-p"), execs.get(0).getArgs().get(0));
		assertEquals("rm", execs.get(1).getCommandName());
		assertEquals(ShellValue.literal("-f"), execs.get(1).getArgs().get(0));
		assertEquals("rash_write_file", execs.get(2).getCommandName());
		assertEquals("systemctl", execs.get(3).getCommandName());
		assertEquals(2, execs.get(3).getArgs().size());
		assertTrue(statements(ir).contains(new ShellIR.Let("APP_HOME", ShellValue.literal("/opt/app"), true)));

		EffectTracker tracker = lowering.getEffectTracker();
		assertTrue(tracker.getUsedIntrinsics().contains(Intrinsic.MKDIR_P));
		assertTrue(tracker.getEffects().contains(Effect.FILE_WRITE));
		assertTrue(tracker.getEffects().contains(Effect.PROCESS_EXEC));
		assertTrue(tracker.getExportedVariables().contains("APP_HOME"));
		assertFalse(tracker.getUsedIntrinsics().contains(Intrinsic.READ_FILE));
	}

	@Test
	public void testEnvironmentWithFallback() {
		ShellIR ir = lower("fn main() {", "    let p = env_var_or(\"PREFIX\", \"/usr\");", "    println!(\"{}\", p);", "}");
		ShellIR.If test = statements(ir, ShellIR.If.class).get(0);
		assertEquals(ShellCondition.Test.unary("-n", new ShellValue.EnvRef("PREFIX", true)), test.getCondition());
		assertNotNull(test.getElseBranch());
	}

	@Test
	public void testValueReturningFunctionUsesTheReturnSlot() {
		ShellIR ir = lower(
				"fn twice(n: i32) -> i32 {",
				"    println!(\"doubling\");",
				"    n * 2",
				"}",
				"fn main() {",
				"    let v = twice(4);",
				"    println!(\"{}\", v);",
				"}");
		assertTrue(statements(ir, ShellIR.Capture.class).isEmpty());
		ShellIR.Function twice = statements(ir, ShellIR.Function.class).get(0);
		List<ShellIR> body = statements(twice);
		ShellIR.Let store = statements(twice, ShellIR.Let.class).get(1);
		assertEquals(SymbolTable.RETURN_SLOT, store.getName());
		assertTrue(store.getValue() instanceof ShellValue.Arith);
		assertTrue(body.get(body.indexOf(store) + 1) instanceof ShellIR.Return);
		assertEquals(1, statements(twice, ShellIR.Echo.class).size());

		List<ShellIR> main = ((ShellIR.Sequence) ir).getItems().subList(1, ((ShellIR.Sequence) ir).getItems().size());
		List<ShellIR> calls = new ArrayList<ShellIR>();
		for (ShellIR item : main) {
			calls.addAll(statements(item));
		}
		ShellIR.Exec call = null;
		ShellIR.Let copy = null;
		for (int i = 0; i < calls.size() - 1; i++) {
			if (calls.get(i) instanceof ShellIR.Exec && "twice".equals(((ShellIR.Exec) calls.get(i)).getCommandName())) {
				call = (ShellIR.Exec) calls.get(i);
				copy = (ShellIR.Let) calls.get(i + 1);
			}
		}
		assertNotNull(call);
		assertEquals(ShellValue.literal("4"), call.getArgs().get(0));
		assertEquals(ShellValue.var(SymbolTable.RETURN_SLOT), copy.getValue());
		assertTrue(copy.getName().startsWith(SymbolTable.TEMP_PREFIX));
	}

	@Test
	public void testDiscardedReturnValueIsAPlainCall() {
		ShellIR ir = lower("fn answer() -> i32 {", "    42", "}", "fn main() {", "    answer();", "}");
		List<ShellIR> main = ((ShellIR.Sequence) ir).getItems();
		List<ShellIR.Exec> calls = statements(main.get(main.size() - 1), ShellIR.Exec.class);
		assertEquals(1, calls.size());
		assertEquals("answer", calls.get(0).getCommandName());
		assertTrue(calls.get(0).getArgs().isEmpty());
	}

	@Test
	public void testForRangeHasLiteralItems() {
		ShellIR ir = lower("fn main() {", "    for i in 0..3 {", "        println!(\"{}\", i);", "    }", "}");
		ShellIR.For loop = statements(ir, ShellIR.For.class).get(0);
		assertEquals(3, loop.getItems().size());
		assertEquals(ShellValue.literal("0"), loop.getItems().get(0));
		assertEquals(ShellValue.literal("2"), loop.getItems().get(2));
	}

	@Test
	public void testTypeErrors() {
		assertRejected("fn main() {\n    let s = \"a\";\n    let n = s * 2;\n}\n");
		assertRejected("fn main() {\n    if \"text\" {\n        println!(\"x\");\n    }\n}\n");
	}
}
