package org.metricshub.rash;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assume.assumeTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.metricshub.rash.util.Config;
import org.metricshub.rash.util.ScriptSource;
import org.metricshub.rash.verifier.VerificationLevel;

/**
 * Reusable helpers for building and executing Rash tests. Tests describe the
 * program, the settings and their expectations through fluent builders
 * ({@link #transpileTest(String)} and {@link #cliTest(String)}) before
 * running them, and can execute the generated scripts with
 * {@link #runScript(String, String...)} where a POSIX shell is available.
 */
public final class RashTestSupport {

	private static final boolean IS_POSIX = !System
			.getProperty("os.name", "")
			.toLowerCase(Locale.ROOT)
			.contains("win");

	private static final File SHELL = new File("/bin/sh");

	private static final Path SHARED_TEMP_DIR;

	static {
		try {
			SHARED_TEMP_DIR = Files.createTempDirectory("rash-shared");
			SHARED_TEMP_DIR.toFile().deleteOnExit();
		} catch (IOException ex) {
			throw new ExceptionInInitializerError(ex);
		}
	}

	private RashTestSupport() {}

	/**
	 * Creates a builder for a test that goes through the {@link Rash} API.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static TranspileTestBuilder transpileTest(String description) {
		return new TranspileTestBuilder(description);
	}

	/**
	 * Creates a builder for a test that goes through the {@link Cli} entry
	 * point, with the source written to a temporary file.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * @return the temporary directory shared by all tests of the run
	 */
	public static Path sharedTempDirectory() {
		return SHARED_TEMP_DIR;
	}

	/**
	 * Joins source lines with newlines.
	 *
	 * @param lines the lines of a program
	 * @return the program text
	 */
	public static String lines(String... lines) {
		return String.join("\n", lines) + "\n";
	}

	/**
	 * Skips the calling test when no POSIX shell can run the scripts.
	 */
	public static void assumeShell() {
		assumeTrue("A POSIX shell is required", IS_POSIX && SHELL.canExecute());
	}

	/**
	 * Runs a script with <code>/bin/sh</code>.
	 *
	 * @param script the script text
	 * @param args the positional parameters
	 * @return what the shell printed and its exit code
	 * @throws Exception when the shell cannot be started or does not end in time
	 */
	public static ShellResult runScript(String script, String... args) throws Exception {
		Path file = Files.createTempFile(SHARED_TEMP_DIR, "script", ".sh");
		try {
			Files.write(file, script.getBytes(StandardCharsets.UTF_8));
			List<String> command = new ArrayList<>();
			command.add(SHELL.getPath());
			command.add(file.toString());
			command.addAll(Arrays.asList(args));
			ProcessBuilder builder = new ProcessBuilder(command);
			builder.directory(SHARED_TEMP_DIR.toFile());
			builder.redirectErrorStream(false);
			Process process = builder.start();
			process.getOutputStream().close();
			String stdout = readFully(process.getInputStream());
			String stderr = readFully(process.getErrorStream());
			if (!process.waitFor(30, TimeUnit.SECONDS)) {
				process.destroyForcibly();
				throw new AssertionError("Script did not finish in time");
			}
			return new ShellResult(stdout, stderr, process.exitValue());
		} finally {
			Files.deleteIfExists(file);
		}
	}

	private static String readFully(InputStream in) throws IOException {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		byte[] chunk = new byte[4096];
		int read;
		while ((read = in.read(chunk)) >= 0) {
			buffer.write(chunk, 0, read);
		}
		return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
	}

	/**
	 * Outcome of a script run by {@link RashTestSupport#runScript(String, String...)}.
	 */
	public static final class ShellResult {
		private final String output;
		private final String error;
		private final int exitCode;

		ShellResult(String output, String error, int exitCode) {
			this.output = output;
			this.error = error;
			this.exitCode = exitCode;
		}

		public String output() {
			return output;
		}

		public String error() {
			return error;
		}

		public int exitCode() {
			return exitCode;
		}

		/**
		 * @return the standard output split into lines, without the trailing newline
		 */
		public List<String> lines() {
			if (output.isEmpty()) {
				return Collections.emptyList();
			}
			String text = output.endsWith("\n") ? output.substring(0, output.length() - 1) : output;
			return Arrays.asList(text.split("\n", -1));
		}
	}

	/**
	 * Fluent builder for tests that call {@link Rash#transpile(ScriptSource, Config)}.
	 */
	public static final class TranspileTestBuilder {
		private final String description;
		private final Config config = new Config();
		private final List<String> expectedFragments = new ArrayList<>();
		private final List<String> unexpectedFragments = new ArrayList<>();
		private String source;
		private ErrorKind expectedError;
		private String expectedMessage;

		private TranspileTestBuilder(String description) {
			this.description = description;
		}

		/**
		 * @param lines the lines of the Rust program
		 * @return this builder for method chaining
		 */
		public TranspileTestBuilder source(String... lines) {
			this.source = RashTestSupport.lines(lines);
			return this;
		}

		/**
		 * @param level the verification level to transpile with
		 * @return this builder for method chaining
		 */
		public TranspileTestBuilder verify(VerificationLevel level) {
			config.setVerify(level);
			return this;
		}

		/**
		 * Skips the optimizer.
		 *
		 * @return this builder for method chaining
		 */
		public TranspileTestBuilder noOptimize() {
			config.setOptimize(false);
			return this;
		}

		/**
		 * Builds the formal equivalence report along with the script.
		 *
		 * @return this builder for method chaining
		 */
		public TranspileTestBuilder emitProof() {
			config.setEmitProof(true);
			return this;
		}

		/**
		 * @param fragments texts the script must contain
		 * @return this builder for method chaining
		 */
		public TranspileTestBuilder expectContains(String... fragments) {
			expectedFragments.addAll(Arrays.asList(fragments));
			return this;
		}

		/**
		 * @param fragments texts the script must not contain
		 * @return this builder for method chaining
		 */
		public TranspileTestBuilder expectNotContains(String... fragments) {
			unexpectedFragments.addAll(Arrays.asList(fragments));
			return this;
		}

		/**
		 * Expects the program to be rejected.
		 *
		 * @param kind the stage expected to reject it
		 * @return this builder for method chaining
		 */
		public TranspileTestBuilder expectError(ErrorKind kind) {
			this.expectedError = kind;
			return this;
		}

		/**
		 * Expects the program to be rejected with a message holding a text.
		 *
		 * @param kind the stage expected to reject it
		 * @param messageFragment text the error message must contain
		 * @return this builder for method chaining
		 */
		public TranspileTestBuilder expectError(ErrorKind kind, String messageFragment) {
			this.expectedError = kind;
			this.expectedMessage = messageFragment;
			return this;
		}

		/**
		 * Transpiles the program without asserting anything.
		 *
		 * @return the result
		 * @throws IOException when the source cannot be read
		 */
		public TranspileResult run() throws IOException {
			assertNotNull("No source for " + description, source);
			return new Rash().transpile(ScriptSource.fromString(source), config);
		}

		/**
		 * Transpiles the program and checks the expectations.
		 *
		 * @return the result, or <code>null</code> when a failure was expected
		 * @throws IOException when the source cannot be read
		 */
		public TranspileResult runAndAssert() throws IOException {
			TranspileResult result;
			try {
				result = run();
			} catch (TranspileException e) {
				if (expectedError == null) {
					throw new AssertionError("Unexpected failure for " + description + ": " + e.describe(), e);
				}
				assertEquals("Unexpected error kind for " + description + ": " + e.getMessage(), expectedError, e.getKind());
				if (expectedMessage != null) {
					assertTrue(
							"Expected '" + expectedMessage + "' in the error of " + description + " but got: " + e.getMessage(),
							e.getMessage().contains(expectedMessage));
				}
				return null;
			}
			if (expectedError != null) {
				throw new AssertionError(
						"Expected a " + expectedError.getDisplayName() + " error for " + description + " but got:\n" + result.getScript());
			}
			String script = result.getScript();
			for (String fragment : expectedFragments) {
				assertTrue("Expected '" + fragment + "' for " + description + " in:\n" + script, script.contains(fragment));
			}
			for (String fragment : unexpectedFragments) {
				assertFalse("Did not expect '" + fragment + "' for " + description + " in:\n" + script, script.contains(fragment));
			}
			return result;
		}
	}

	/**
	 * Fluent builder for tests that run the {@link Cli}. Arguments may use the
	 * placeholders <code>{source}</code> and <code>{out}</code>, replaced with
	 * the path of the source file and of the output file.
	 */
	public static final class CliTestBuilder {
		private final String description;
		private final List<String> arguments = new ArrayList<>();
		private String source;
		private Integer expectedExitCode;
		private final List<String> expectedOutput = new ArrayList<>();

		private CliTestBuilder(String description) {
			this.description = description;
		}

		/**
		 * @param lines the lines of the Rust program written to <code>{source}</code>
		 * @return this builder for method chaining
		 */
		public CliTestBuilder source(String... lines) {
			this.source = RashTestSupport.lines(lines);
			return this;
		}

		/**
		 * @param args command line arguments
		 * @return this builder for method chaining
		 */
		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		/**
		 * @param code the expected exit code
		 * @return this builder for method chaining
		 */
		public CliTestBuilder expectExitCode(int code) {
			this.expectedExitCode = code;
			return this;
		}

		/**
		 * @param fragments texts the standard output must contain
		 * @return this builder for method chaining
		 */
		public CliTestBuilder expectOutputContains(String... fragments) {
			expectedOutput.addAll(Arrays.asList(fragments));
			return this;
		}

		/**
		 * Runs the command line without asserting anything.
		 *
		 * @return what the command line printed and wrote
		 * @throws IOException when the temporary files cannot be written
		 */
		public CliResult run() throws IOException {
			Path dir = Files.createTempDirectory(SHARED_TEMP_DIR, "cli");
			Path sourceFile = dir.resolve("main.rs");
			Path outFile = dir.resolve("out.sh");
			if (source != null) {
				Files.write(sourceFile, source.getBytes(StandardCharsets.UTF_8));
			}
			List<String> args = new ArrayList<>();
			for (String arg : arguments) {
				args.add(arg.replace("{source}", sourceFile.toString()).replace("{out}", outFile.toString()));
			}
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			int code;
			try (PrintStream outStream = new PrintStream(out, true, "UTF-8");
					PrintStream errStream = new PrintStream(err, true, "UTF-8")) {
				code = Cli.execute(args.toArray(new String[0]), outStream, errStream);
			}
			return new CliResult(
					description,
					new String(out.toByteArray(), StandardCharsets.UTF_8),
					new String(err.toByteArray(), StandardCharsets.UTF_8),
					code,
					dir,
					outFile);
		}

		/**
		 * Runs the command line and checks the expectations.
		 *
		 * @return what the command line printed and wrote
		 * @throws IOException when the temporary files cannot be written
		 */
		public CliResult runAndAssert() throws IOException {
			CliResult result = run();
			int expected = expectedExitCode == null ? 0 : expectedExitCode.intValue();
			assertEquals("Unexpected exit code for " + description + ", stderr: " + result.error(), expected, result.exitCode());
			for (String fragment : expectedOutput) {
				assertTrue(
						"Expected '" + fragment + "' in the output of " + description + " but got: " + result.output(),
						result.output().contains(fragment));
			}
			return result;
		}
	}

	/**
	 * Outcome of a {@link CliTestBuilder} run.
	 */
	public static final class CliResult {
		private final String description;
		private final String output;
		private final String error;
		private final int exitCode;
		private final Path directory;
		private final Path outputFile;

		CliResult(String description, String output, String error, int exitCode, Path directory, Path outputFile) {
			this.description = description;
			this.output = output;
			this.error = error;
			this.exitCode = exitCode;
			this.directory = directory;
			this.outputFile = outputFile;
		}

		public String output() {
			return output;
		}

		public String error() {
			return error;
		}

		public int exitCode() {
			return exitCode;
		}

		/**
		 * @return the directory holding the source and output files
		 */
		public Path directory() {
			return directory;
		}

		/**
		 * @return the path substituted for <code>{out}</code>
		 */
		public Path outputFile() {
			return outputFile;
		}

		/**
		 * @return the content of the output file
		 */
		public String outputFileContent() {
			try {
				return new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
			} catch (IOException e) {
				throw new UncheckedIOException("No output file for " + description, e);
			}
		}
	}
}
