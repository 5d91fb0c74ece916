package org.metricshub.rash;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Rash
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import org.metricshub.rash.util.Config;
import org.metricshub.rash.util.RashLogger;
import org.metricshub.rash.util.ScriptFileSource;
import org.metricshub.rash.util.ShellDialect;
import org.metricshub.rash.verifier.VerificationLevel;
import org.slf4j.Logger;

/**
 * Command line interface of the transpiler:
 * <ul>
 * <li><code>build &lt;file&gt; -o &lt;out&gt; [--emit-proof] [--no-optimize] [--target &lt;dialect&gt;] [--verify &lt;level&gt;]</code></li>
 * <li><code>check &lt;file&gt;</code></li>
 * <li><code>verify &lt;source&gt; &lt;shell_script&gt;</code></li>
 * </ul>
 */
public final class Cli {

	private static final Logger LOG = RashLogger.getLogger(Cli.class);

	/** Suffix of the formal report written next to the script. */
	public static final String PROOF_SUFFIX = ".proof";

	private enum Command {
		BUILD,
		CHECK,
		VERIFY
	}

	private final Config config = new Config();
	private final PrintStream out;

	private Command command;
	private String sourceFile;
	private String scriptFile;
	private Path outputFile;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance printing to the supplied stream.
	 *
	 * @param out stream where reports and usage are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
	}

	/**
	 * Returns the {@link Config} configured from the command line.
	 *
	 * @return the settings populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Config getConfig() {
		return config;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException on invalid arguments
	 */
	public void parse(String[] args) {
		if (args.length == 0) {
			printUsage = true;
			return;
		}
		String first = args[0];
		if (first.equals("-h") || first.equals("--help")) {
			if (args.length != 1) {
				throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
			}
			printUsage = true;
			return;
		}
		if (first.equals("build")) {
			command = Command.BUILD;
		} else if (first.equals("check")) {
			command = Command.CHECK;
		} else if (first.equals("verify")) {
			command = Command.VERIFY;
		} else {
			throw new IllegalArgumentException("Unknown command: " + first);
		}

		int argIdx = 1;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.equals("-o") || arg.equals("--output")) {
				// -o file : where the script is written
				checkParameterHasArgument(args, argIdx);
				outputFile = Paths.get(args[++argIdx]);
			} else if (arg.equals("--emit-proof")) {
				config.setEmitProof(true);
			} else if (arg.equals("--no-optimize")) {
				config.setOptimize(false);
			} else if (arg.equals("--target")) {
				checkParameterHasArgument(args, argIdx);
				config.setTarget(ShellDialect.fromString(args[++argIdx]));
			} else if (arg.equals("--verify")) {
				checkParameterHasArgument(args, argIdx);
				config.setVerify(VerificationLevel.fromString(args[++argIdx]));
			} else if (arg.charAt(0) == '-') {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			} else if (sourceFile == null) {
				sourceFile = arg;
			} else if (command == Command.VERIFY && scriptFile == null) {
				scriptFile = arg;
			} else {
				throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
			++argIdx;
		}

		if (sourceFile == null) {
			throw new IllegalArgumentException("Rust source file not provided.");
		}
		if (command == Command.BUILD && outputFile == null) {
			throw new IllegalArgumentException("Output file not provided, use -o <out>.");
		}
		if (command == Command.VERIFY && scriptFile == null) {
			throw new IllegalArgumentException("Shell script to verify not provided.");
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @return the process exit code
	 * @throws IOException when a file cannot be read or written
	 * @throws TranspileException when the program fails a stage
	 */
	public int run() throws IOException {
		if (printUsage) {
			usage(out);
			return 0;
		}
		Rash rash = new Rash();
		switch (command) {
		case CHECK:
			rash.check(new ScriptFileSource(sourceFile), config);
			out.println(sourceFile + ": OK");
			return 0;
		case VERIFY:
			String expected = rash.transpile(new ScriptFileSource(sourceFile), config).getScript();
			byte[] actual = Files.readAllBytes(Paths.get(scriptFile));
			if (Arrays.equals(expected.getBytes(StandardCharsets.UTF_8), actual)) {
				out.println(scriptFile + ": matches " + sourceFile);
				return 0;
			}
			out.println(scriptFile + ": does NOT match " + sourceFile);
			return 1;
		default:
			TranspileResult result = rash.transpile(new ScriptFileSource(sourceFile), config);
			Path script = outputFile.toAbsolutePath();
			Path proof = script.resolveSibling(script.getFileName() + PROOF_SUFFIX);
			Path scriptTemp = null;
			Path proofTemp = null;
			try {
				scriptTemp = stage(script, result.getScript(), true);
				if (result.getProof() != null) {
					proofTemp = stage(proof, result.getProof().render(), false);
				}
				// the report only lands once its script is in place
				moveIntoPlace(scriptTemp, script);
				LOG.debug("Wrote {}", script);
				if (proofTemp != null) {
					moveIntoPlace(proofTemp, proof);
					out.println("Formal equivalence: " + result.getProof().getVerdict());
				}
			} finally {
				deleteTemp(scriptTemp);
				deleteTemp(proofTemp);
			}
			return 0;
		}
	}

	/**
	 * Writes the content of a file to a temporary file of the same directory.
	 *
	 * @return the temporary file
	 */
	private static Path stage(Path target, String content, boolean executable) throws IOException {
		Path temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
		try {
			Files.write(temp, content.getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			deleteTemp(temp);
			throw e;
		}
		if (executable && !temp.toFile().setExecutable(true, false)) {
			LOG.debug("Could not make {} executable", temp);
		}
		return temp;
	}

	private static void moveIntoPlace(Path temp, Path target) throws IOException {
		try {
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private static void deleteTemp(Path temp) throws IOException {
		if (temp != null) {
			Files.deleteIfExists(temp);
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest.println("rash build <file.rs> -o <out.sh> [--emit-proof] [--no-optimize] [--target dialect] [--verify level]");
		dest.println("rash check <file.rs>");
		dest.println("rash verify <file.rs> <script.sh>");
		dest.println();
		dest.println(" build = Transpile a Rust source file into a POSIX shell script.");
		dest.println(" check = Check that a source file stays within the supported subset.");
		dest.println(" verify = Check that a script is exactly what the source transpiles to.");
		dest.println();
		dest.println(" -o, --output file = Where the script is written.");
		dest.println(" --emit-proof = Also write the formal equivalence report to <out>.proof.");
		dest.println(" --no-optimize = Skip the IR optimizer.");
		dest.println(" --target dialect = posix, bash, dash or ash (all emit POSIX sh).");
		dest.println(" --verify level = none, basic, strict (default) or paranoid.");
		dest.println();
		dest.println(" -h, --help = This help screen.");
	}

	/**
	 * Parses the arguments, runs the command and reports errors the way the
	 * command line does.
	 *
	 * @param args command-line arguments
	 * @param out stream for reports
	 * @param err stream for error messages
	 * @return the process exit code
	 */
	public static int execute(String[] args, PrintStream out, PrintStream err) {
		try {
			Cli cli = new Cli(out);
			cli.parse(args);
			return cli.run();
		} catch (TranspileException e) {
			err.println(e.describe());
			return 1;
		} catch (IllegalArgumentException e) {
			err.println("Failed to parse arguments: " + e.getMessage());
			err.println("Please see the help/usage output (cmd line switch '-h').");
			return 1;
		} catch (IOException | UncheckedIOException e) {
			err.println(e.getClass().getSimpleName() + ": " + e.getMessage());
			return 1;
		}
	}
}
