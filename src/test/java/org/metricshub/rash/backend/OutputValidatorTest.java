package org.metricshub.rash.backend;

import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class OutputValidatorTest {

	private static String script(String... body) {
		StringBuilder sb = new StringBuilder("#!/bin/sh\nset -euf\nmain() {\n");
		for (String line : body) {
			sb.append("    ").append(line).append('\n');
		}
		return sb.append("}\n").append(PosixEmitter.MAIN_INVOCATION).append('\n').toString();
	}

	private static void assertInvalid(String script, String fragment) {
		EmissionException e = assertThrows(EmissionException.class, () -> OutputValidator.validate(script));
		assertTrue(e.getMessage(), e.getMessage().contains(fragment));
	}

	@Test
	public void testWellFormedScripts() {
		OutputValidator.validate(script(":"));
		OutputValidator.validate(script(
				"x='it'\\''s ( { \" `'",
				"y=\"${x} $(printf '%s' \"${x}\") $((1 + (2 * 3)))\"",
				"# comment with ' and \" and `",
				"printf '%s\\n' \"a\\\"b\" \\",
				"    'c'",
				"echo a#b"));
	}

	@Test
	public void testShape() {
		assertInvalid("#!/bin/bash\nmain() {\n    :\n}\nmain \"$@\"\n", "#!/bin/sh");
		assertInvalid(script("echo '\0'"), "NUL");
		assertInvalid("#!/bin/sh\nmain() {\n    :\n}\n", "exactly once, found 0");
		assertInvalid(script(":") + PosixEmitter.MAIN_INVOCATION + "\n", "exactly once, found 2");
		assertInvalid("#!/bin/sh\nmain() {\n    :\n}\nmain \"$@\"\necho after\n", "must end with");
	}

	@Test
	public void testUnbalancedText() {
		assertInvalid(script("echo 'open"), "unterminated single quote");
		assertInvalid(script("echo \"open"), "unterminated");
		assertInvalid(script("x=\"$(date\""), "unterminated");
		assertInvalid(script("x=\"${name\""), "parameter expansion");
		assertInvalid(script("x=$((1 + 2)"), "arithmetic expansion");
		assertInvalid(script("x=$((1 + 'a'))"), "arithmetic expansion");
	}

	@Test
	public void testBackquotesAreRejected() {
		assertInvalid(script("x=`id`"), "backquote");
		assertInvalid(script("echo \"`id`\""), "backquote");
		OutputValidator.validate(script("echo \"\\`id\\`\""));
	}
}
