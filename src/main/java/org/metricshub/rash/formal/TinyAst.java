package org.metricshub.rash.formal;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The small instruction set both formal evaluators agree on: variable
 * assignments, a handful of commands, and changes of directory.
 */
public abstract class TinyAst {

	private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	/** Commands a program may execute. */
	public static final Set<String> COMMANDS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"echo", "mkdir", "touch", "true", "test")));

	private TinyAst() {}

	public abstract <R> R accept(Visitor<R> visitor);

	/**
	 * Checks the program is well-formed: valid variable names, known commands,
	 * non-empty paths and no NUL character anywhere.
	 *
	 * @return <code>true</code> when both evaluators can run the program
	 */
	public abstract boolean isValid();

	public interface Visitor<R> {
		R visitSequence(Sequence node);

		R visitSetEnvironmentVariable(SetEnvironmentVariable node);

		R visitExecuteCommand(ExecuteCommand node);

		R visitChangeDirectory(ChangeDirectory node);
	}

	private static boolean isText(String text) {
		return text != null && text.indexOf('\0') < 0;
	}

	/**
	 * Commands run one after the other.
	 */
	public static final class Sequence extends TinyAst {
		private final List<TinyAst> commands;

		public Sequence(List<TinyAst> commands) {
			this.commands = Collections.unmodifiableList(new ArrayList<TinyAst>(commands));
		}

		public Sequence(TinyAst... commands) {
			this(Arrays.asList(commands));
		}

		public List<TinyAst> getCommands() {
			return commands;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSequence(this);
		}

		@Override
		public boolean isValid() {
			for (TinyAst command : commands) {
				if (command == null || !command.isValid()) {
					return false;
				}
			}
			return true;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Sequence && commands.equals(((Sequence) o).commands);
		}

		@Override
		public int hashCode() {
			return commands.hashCode();
		}

		@Override
		public String toString() {
			return "Sequence" + commands;
		}
	}

	/**
	 * Sets and exports a variable.
	 */
	public static final class SetEnvironmentVariable extends TinyAst {
		private final String name;
		private final String value;

		public SetEnvironmentVariable(String name, String value) {
			this.name = name;
			this.value = value;
		}

		public String getName() {
			return name;
		}

		public String getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSetEnvironmentVariable(this);
		}

		@Override
		public boolean isValid() {
			return name != null && NAME.matcher(name).matches() && isText(value);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof SetEnvironmentVariable)) {
				return false;
			}
			SetEnvironmentVariable other = (SetEnvironmentVariable) o;
			return Objects.equals(name, other.name) && Objects.equals(value, other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash(name, value);
		}

		@Override
		public String toString() {
			return "SetEnvironmentVariable(" + name + "=" + value + ")";
		}
	}

	/**
	 * Runs one of the {@link TinyAst#COMMANDS}.
	 */
	public static final class ExecuteCommand extends TinyAst {
		private final String commandName;
		private final List<String> args;

		public ExecuteCommand(String commandName, List<String> args) {
			this.commandName = commandName;
			this.args = Collections.unmodifiableList(new ArrayList<String>(args));
		}

		public ExecuteCommand(String commandName, String... args) {
			this(commandName, Arrays.asList(args));
		}

		public String getCommandName() {
			return commandName;
		}

		public List<String> getArgs() {
			return args;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitExecuteCommand(this);
		}

		@Override
		public boolean isValid() {
			if (!COMMANDS.contains(commandName)) {
				return false;
			}
			for (String arg : args) {
				if (!isText(arg)) {
					return false;
				}
			}
			return true;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof ExecuteCommand)) {
				return false;
			}
			ExecuteCommand other = (ExecuteCommand) o;
			return Objects.equals(commandName, other.commandName) && args.equals(other.args);
		}

		@Override
		public int hashCode() {
			return Objects.hash(commandName, args);
		}

		@Override
		public String toString() {
			return "ExecuteCommand(" + commandName + " " + args + ")";
		}
	}

	/**
	 * Changes the working directory.
	 */
	public static final class ChangeDirectory extends TinyAst {
		private final String path;

		public ChangeDirectory(String path) {
			this.path = path;
		}

		public String getPath() {
			return path;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitChangeDirectory(this);
		}

		@Override
		public boolean isValid() {
			return isText(path) && !path.isEmpty();
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof ChangeDirectory && Objects.equals(path, ((ChangeDirectory) o).path);
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(path);
		}

		@Override
		public String toString() {
			return "ChangeDirectory(" + path + ")";
		}
	}
}
