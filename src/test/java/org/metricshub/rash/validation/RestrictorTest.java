package org.metricshub.rash.validation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.rash.ErrorKind;
import org.metricshub.rash.RashTestSupport;
import org.metricshub.rash.ast.BinaryOp;
import org.metricshub.rash.ast.Expr;
import org.metricshub.rash.ast.Function;
import org.metricshub.rash.ast.Pattern;
import org.metricshub.rash.ast.RestrictedAst;
import org.metricshub.rash.ast.Stmt;
import org.metricshub.rash.ast.Type;
import org.metricshub.rash.frontend.RustParser;
import org.metricshub.rash.frontend.ast.SyntaxNode;
import org.metricshub.rash.util.ScriptSource;

public class RestrictorTest {

	private static SyntaxNode parse(String... lines) throws IOException {
		return new RustParser().parse(ScriptSource.fromString(RashTestSupport.lines(lines)));
	}

	private static RestrictedAst restrict(String... lines) throws IOException {
		return new Restrictor().restrict(parse(lines));
	}

	private static void assertRejected(String fragment, String... lines) throws IOException {
		SyntaxNode file = parse(lines);
		ValidationException e = assertThrows(ValidationException.class, () -> new Restrictor().restrict(file));
		assertEquals(ErrorKind.VALIDATION, e.getKind());
		assertTrue("'" + e.getMessage() + "' should mention '" + fragment + "'", e.getMessage().contains(fragment));
	}

	private static void assertUnsupported(String fragment, String body) throws IOException {
		assertRejected(fragment, "fn main() {", body, "}");
	}

	@Test
	public void testAcceptedProgram() throws Exception {
		RestrictedAst ast = restrict(
				"fn greet(name: &str, times: u32) -> String {",
				"    format!(\"{}x{}\", name, times)",
				"}",
				"fn main() {",
				"    let mut i = 0;",
				"    while i < 3 {",
				"        let line = greet(\"you\", 2);",
				"        println!(\"{}\", line);",
				"        i = i + 1;",
				"    }",
				"}");
		assertEquals(2, ast.getFunctions().size());
		Function greet = ast.getFunctions().get(0);
		assertEquals("greet", greet.getName());
		assertEquals(Type.STR, greet.getReturnType());
		assertEquals(2, greet.getParameters().size());
		assertEquals(RestrictedAst.ENTRY_POINT, ast.getEntryPoint());
	}

	@Test
	public void testUnsupportedItems() throws Exception {
		assertRejected("struct definition", "struct P { x: i32 }", "fn main() {}");
		assertRejected("enum definition", "enum E { A }", "fn main() {}");
		assertRejected("impl block", "impl P {}", "fn main() {}");
		assertRejected("trait definition", "trait T {}", "fn main() {}");
		assertRejected("use declaration", "use std::fs;", "fn main() {}");
		assertRejected("unsafe function", "unsafe fn f() {}", "fn main() {}");
		assertRejected("async function", "async fn f() {}", "fn main() {}");
		assertRejected("generic parameters", "fn f<T>(t: T) {}", "fn main() {}");
	}

	@Test
	public void testUnsupportedStatementsAndExpressions() throws Exception {
		assertUnsupported("unsafe block", "    unsafe { println!(\"x\"); }");
		assertUnsupported("heap container macro 'vec!'", "    let v = vec![1, 2];");
		assertUnsupported("closure", "    let f = |x: i32| x + 1;");
		assertUnsupported("match used as a value", "    let n = match 1 { _ => 2 };");
		assertUnsupported("floating-point literal", "    let f = 1.5;");
		assertUnsupported("character literal", "    let c = 'c';");
		assertUnsupported("compound assignment '|='", "    let mut n = 1;\n    n |= 1;");
		assertUnsupported("destructuring let pattern", "    let (a, b) = (1, 2);");
		assertUnsupported("labelled loop", "    'outer: loop { break 'outer; }");
		assertUnsupported("'?' operator", "    let n = parse()?;");
		assertUnsupported("macro 'panic!'", "    panic!(\"no\");");
		assertUnsupported("nested function", "    fn inner() {}");
	}

	@Test
	public void testMatchStatement() throws Exception {
		RestrictedAst ast = restrict(
				"fn main() {",
				"    let n = 4;",
				"    match n {",
				"        1 | -1 => println!(\"one\"),",
				"        2..=9 => {",
				"            println!(\"few\");",
				"        }",
				"        _ => {}",
				"    }",
				"}");
		Stmt.Match match = (Stmt.Match) ast.getFunctions().get(0).getBody().get(1);
		assertEquals(new Expr.Variable("n"), match.getScrutinee());
		assertEquals(3, match.getArms().size());
		assertEquals(Arrays.<Pattern>asList(new Pattern.Literal(Expr.Literal.ofI32(1)), new Pattern.Literal(Expr.Literal.ofI32(-1))),
				match.getArms().get(0).getPatterns());
		assertEquals(1, match.getArms().get(0).getBody().size());
		assertEquals(Collections.<Pattern>singletonList(new Pattern.Range(2, 9, true)), match.getArms().get(1).getPatterns());
		assertEquals(Collections.<Pattern>singletonList(Pattern.Wildcard.INSTANCE), match.getArms().get(2).getPatterns());
		assertTrue(match.getArms().get(2).getBody().isEmpty());
	}

	@Test
	public void testMatchArmsReturnTheFunctionValue() throws Exception {
		RestrictedAst ast = restrict(
				"fn name(code: i32) -> &'static str {",
				"    match code {",
				"        0 => \"ok\",",
				"        _ => \"failed\",",
				"    }",
				"}",
				"fn main() {}");
		Stmt.Match match = (Stmt.Match) ast.getFunctions().get(0).getBody().get(0);
		assertEquals(new Stmt.Return(Expr.Literal.ofStr("ok")), match.getArms().get(0).getBody().get(0));
		assertEquals(new Stmt.Return(Expr.Literal.ofStr("failed")), match.getArms().get(1).getBody().get(0));
	}

	@Test
	public void testUnsupportedMatchPatterns() throws Exception {
		assertUnsupported("match guard", "    match 1 { x if x > 0 => {} _ => {} }");
		assertUnsupported("binding pattern 'x'", "    match 1 { x => {} }");
		assertUnsupported("open range pattern", "    match 1 { 5.. => {} _ => {} }");
		assertUnsupported("match pattern", "    match 1 { Some(x) => {} _ => {} }");
		assertUnsupported("range pattern bound", "    match 1 { \"a\"..=\"z\" => {} _ => {} }");
	}

	@Test
	public void testStringReferenceParameters() throws Exception {
		RestrictedAst ast = restrict(
				"fn echo(msg: &str, label: &'static str, owned: &String) {",
				"    println!(\"{}{}{}\", label, msg, owned);",
				"}",
				"fn main() {",
				"    echo(\"hello\", \"> \", \"!\");",
				"}");
		Function echo = ast.getFunctions().get(0);
		for (int i = 0; i < 3; i++) {
			assertEquals(Type.STR, echo.getParameters().get(i).getType());
		}
		assertRejected("unsized type 'str'", "fn f(s: str) {}", "fn main() {}");
		assertRejected("reference type '&&str'", "fn f(s: &&str) {}", "fn main() {}");
	}

	@Test
	public void testCompoundAssignmentIsRewritten() throws Exception {
		RestrictedAst ast = restrict("fn main() {", "    let mut n = 1;", "    n += 2;", "}");
		Stmt.Let update = (Stmt.Let) ast.getFunctions().get(0).getBody().get(1);
		assertFalse(update.isDeclaration());
		assertEquals(new Expr.Binary(BinaryOp.ADD, new Expr.Variable("n"), Expr.Literal.ofI32(2)), update.getValue());
	}

	@Test
	public void testUnsupportedTypes() throws Exception {
		assertRejected("heap container type 'Vec'", "fn f(v: Vec<i32>) {}", "fn main() {}");
		assertRejected("mutable reference type", "fn f(s: &mut String) {}", "fn main() {}");
		assertRejected("trait object type", "fn f(s: &dyn Display) {}", "fn main() {}");
		assertRejected("tuple type", "fn f(t: (i32, i32)) {}", "fn main() {}");
	}

	@Test
	public void testProgramInvariants() throws Exception {
		assertRejected("Duplicate function 'f'", "fn f() {}", "fn f() {}", "fn main() {}");
		assertRejected("Duplicate parameter 'a'", "fn f(a: i32, a: i32) {}", "fn main() {}");
		assertRejected("No entry point", "fn helper() {}");
		assertRejected("must not take parameters", "fn main(x: i32) {}");
		assertRejected("must not return a value", "fn main() -> i32 {", "    0", "}");
		assertRejected("Recursion is not supported", "fn a() { b(); }", "fn b() { a(); }", "fn main() { a(); }");
		assertRejected("calls the entry point 'main'", "fn main() { main(); }");
	}

	@Test
	public void testLiteralLimits() throws Exception {
		assertUnsupported("out of the i32 range", "    let n = 3000000000;");
		assertUnsupported("NUL byte", "    let s = \"a\\0b\";");
		assertUnsupported("Unterminated placeholder", "    println!(\"{\", 1);");
	}

	@Test
	public void testUnsafeIdentifiers() {
		assertThrows(ValidationException.class, () -> RestrictedAst.checkIdentifier("", "variable name"));
		ValidationException dollar = assertThrows(ValidationException.class, () -> RestrictedAst.checkIdentifier("a$b", "variable name"));
		assertTrue(dollar.getMessage(), dollar.getMessage().contains("Unsafe character $"));
		ValidationException nul = assertThrows(ValidationException.class, () -> RestrictedAst.checkIdentifier("a\0", "variable name"));
		assertTrue(nul.getMessage(), nul.getMessage().contains("NUL"));
		assertThrows(ValidationException.class, () -> RestrictedAst.checkIdentifier("9lives", "function name"));
		RestrictedAst.checkIdentifier("_ok_9", "function name");
	}

	@Test
	public void testDepthLimit() throws Exception {
		StringBuilder deep = new StringBuilder("fn main() {\n");
		for (int i = 0; i < 12; i++) {
			deep.append("if true {\n");
		}
		for (int i = 0; i < 12; i++) {
			deep.append("}\n");
		}
		deep.append("}\n");
		SyntaxNode file = new RustParser().parse(ScriptSource.fromString(deep.toString()));
		new Restrictor().restrict(file);
		ValidationException e = assertThrows(ValidationException.class, () -> new Restrictor(10).restrict(file));
		assertTrue(e.getMessage(), e.getMessage().startsWith("Nesting depth exceeds the maximum of 10"));
	}
}
