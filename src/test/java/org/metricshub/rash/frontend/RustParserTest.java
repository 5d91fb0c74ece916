package org.metricshub.rash.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.List;
import org.junit.Test;
import org.metricshub.rash.ErrorKind;
import org.metricshub.rash.RashTestSupport;
import org.metricshub.rash.frontend.ast.LexerException;
import org.metricshub.rash.frontend.ast.ParserException;
import org.metricshub.rash.frontend.ast.SyntaxFlag;
import org.metricshub.rash.frontend.ast.SyntaxKind;
import org.metricshub.rash.frontend.ast.SyntaxNode;
import org.metricshub.rash.util.ScriptSource;

public class RustParserTest {

	private static SyntaxNode parse(String... lines) throws IOException {
		return new RustParser().parse(ScriptSource.fromString(RashTestSupport.lines(lines)));
	}

	private static ParserException parseError(String... lines) {
		return assertThrows(ParserException.class, () -> parse(lines));
	}

	private static String nested(String open, String core, String close, int depth) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < depth; i++) {
			sb.append(open);
		}
		sb.append(core);
		for (int i = 0; i < depth; i++) {
			sb.append(close);
		}
		return sb.toString();
	}

	@Test
	public void testFunctionItems() throws Exception {
		SyntaxNode file = parse(
				"fn add(a: i32, mut b: i32) -> i32 {",
				"    a + b",
				"}",
				"pub fn main() {",
				"    let x = add(1, 2);",
				"}");
		assertEquals(SyntaxKind.FILE, file.getKind());
		List<SyntaxNode> functions = file.findChildren(SyntaxKind.FN);
		assertEquals(2, functions.size());

		SyntaxNode add = functions.get(0);
		assertEquals("add", add.getText());
		List<SyntaxNode> params = add.findChildren(SyntaxKind.PARAM);
		assertEquals(2, params.size());
		assertEquals("b", params.get(1).getText());
		assertTrue(params.get(1).hasFlag(SyntaxFlag.MUT));
		assertNotNull(add.findChild(SyntaxKind.RET_TYPE));
		SyntaxNode tail = add.findChild(SyntaxKind.BLOCK).getChild(0);
		assertTrue(tail.hasFlag(SyntaxFlag.TAIL));

		SyntaxNode main = functions.get(1);
		assertTrue(main.hasFlag(SyntaxFlag.PUB));
		assertEquals(4, main.getSpan().getLine());
	}

	@Test
	public void testOperatorPrecedence() throws Exception {
		SyntaxNode file = parse("fn main() {", "    let v = 1 + 2 * 3 == 7 && true;", "}");
		SyntaxNode let = file.findChild(SyntaxKind.FN).findChild(SyntaxKind.BLOCK).findChild(SyntaxKind.LET);
		assertEquals("v", let.getText());
		SyntaxNode and = let.getChild(0);
		assertEquals(SyntaxKind.BINARY, and.getKind());
		assertEquals("&&", and.getText());
		SyntaxNode eq = and.getChild(0);
		assertEquals("==", eq.getText());
		SyntaxNode plus = eq.getChild(0);
		assertEquals("+", plus.getText());
		assertEquals("*", plus.getChild(1).getText());
	}

	@Test
	public void testStringEscapesAreDecoded() throws Exception {
		SyntaxNode file = parse("fn main() {", "    let s = \"tab\\there\\n\\u{e9}\\\"\";", "}");
		SyntaxNode literal = file.findChild(SyntaxKind.FN).findChild(SyntaxKind.BLOCK).findChild(SyntaxKind.LET).getChild(0);
		assertEquals(SyntaxKind.LITERAL_STR, literal.getKind());
		assertEquals("tab\there\n\u00e9\"", literal.getText());
	}

	@Test
	public void testMacroCall() throws Exception {
		SyntaxNode file = parse("fn main() {", "    println!(\"{} {}\", 1, \"a\");", "}");
		SyntaxNode stmt = file.findChild(SyntaxKind.FN).findChild(SyntaxKind.BLOCK).getChild(0);
		SyntaxNode macro = stmt.getChild(0);
		assertEquals(SyntaxKind.MACRO_CALL, macro.getKind());
		assertEquals("println", macro.getText());
		assertEquals(3, macro.getChildCount());
	}

	@Test
	public void testUnsupportedItemsStillParse() throws Exception {
		SyntaxNode file = parse(
				"use std::fs;",
				"#[derive(Debug)]",
				"struct Point { x: i32, y: i32 }",
				"unsafe fn danger() {}",
				"fn main() {}");
		assertNotNull(file.findChild(SyntaxKind.USE));
		assertNotNull(file.findChild(SyntaxKind.STRUCT));
		SyntaxNode danger = file.findChildren(SyntaxKind.FN).get(0);
		assertTrue(danger.hasFlag(SyntaxFlag.UNSAFE));
	}

	@Test
	public void testMatchArms() throws Exception {
		SyntaxNode file = parse(
				"fn main() {",
				"    match n {",
				"        0 | 1 => println!(\"small\"),",
				"        2..=9 if n > 3 => { go(); }",
				"        10.. => {}",
				"        _ => stop()",
				"    }",
				"}");
		SyntaxNode match = file.findChild(SyntaxKind.FN).findChild(SyntaxKind.BLOCK).getChild(0).getChild(0);
		assertEquals(SyntaxKind.MATCH, match.getKind());
		assertEquals(5, match.getChildCount());
		assertEquals("n", match.getChild(0).getText());

		SyntaxNode alternatives = match.getChild(1).getChild(0);
		assertEquals(SyntaxKind.OR_PATTERN, alternatives.getKind());
		assertEquals(2, alternatives.getChildCount());
		assertEquals(SyntaxKind.MACRO_CALL, match.getChild(1).getChild(1).getKind());

		SyntaxNode guarded = match.getChild(2);
		assertTrue(guarded.hasFlag(SyntaxFlag.GUARD));
		assertEquals(3, guarded.getChildCount());
		assertEquals(SyntaxKind.RANGE, guarded.getChild(0).getKind());
		assertTrue(guarded.getChild(0).hasFlag(SyntaxFlag.INCLUSIVE));
		assertEquals(SyntaxKind.BLOCK, guarded.getChild(2).getKind());

		assertTrue(match.getChild(3).getChild(0).hasFlag(SyntaxFlag.OPEN_RANGE));
		assertEquals(SyntaxKind.WILDCARD, match.getChild(4).getChild(0).getKind());
	}

	@Test
	public void testSyntaxErrors() {
		assertEquals(ErrorKind.PARSE, parseError("fn main() {").getKind());
		parseError("fn main( {}");
		parseError("fn main() { let x = ; }");
		parseError("fn () {}");
		assertTrue(parseError("fn main() { match n { 1 => {} 2 3 } }").getMessage().contains("Expected '=>'"));
		parseError("fn main() { match n { 1 => a() 2 => b() } }");
	}

	@Test
	public void testLexicalErrors() {
		LexerException unterminated = assertThrows(LexerException.class, () -> parse("fn main() {", "    let s = \"open;", "}"));
		assertEquals(ErrorKind.PARSE, unterminated.getKind());
		assertTrue(unterminated.getMessage(), unterminated.getMessage().contains("Unterminated string literal"));
		assertEquals(2, unterminated.getSpan().getLine());

		assertThrows(LexerException.class, () -> parse("fn main() { let s = \"\\q\"; }"));
		assertThrows(LexerException.class, () -> parse("fn main() { /* never closed }"));
		assertThrows(LexerException.class, () -> parse("fn main() { let n = 1 ` 2; }"));
	}

	@Test
	public void testNestingIsCapped() throws Exception {
		String shallow = nested("(", "1", ")", 50);
		parse("fn main() {", "    let v = " + shallow + ";", "}");

		String deep = nested("(", "1", ")", RustParser.MAX_EXPRESSION_DEPTH + 10);
		ParserException e = parseError("fn main() {", "    let v = " + deep + ";", "}");
		assertTrue(e.getMessage(), e.getMessage().contains("nested more than"));

		String blocks = nested("if true {", "", "}", RustParser.MAX_EXPRESSION_DEPTH + 10);
		parseError("fn main() {", blocks, "}");
	}

	@Test(expected = IOException.class)
	public void testNoSource() throws Exception {
		new RustParser().parse(null);
	}
}
