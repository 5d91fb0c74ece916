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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The state a program observably changes: a file system, the variables, the
 * working directory and the lines printed on standard output.
 * <p>
 * Paths are absolute and normalized. A state is created for one evaluation;
 * both evaluators work on their own copy of the initial state.
 */
public class AbstractState {

	private static final String ROOT = "/";

	private final TreeMap<String, FileSystemEntry> filesystem;
	private final TreeMap<String, String> env;
	private String cwd;
	private final List<String> stdout;

	private AbstractState(TreeMap<String, FileSystemEntry> filesystem, TreeMap<String, String> env, String cwd, List<String> stdout) {
		this.filesystem = filesystem;
		this.env = env;
		this.cwd = cwd;
		this.stdout = stdout;
	}

	/**
	 * @return a state with only the root directory, no variable, no output,
	 *         and <code>/</code> as working directory
	 */
	public static AbstractState initial() {
		TreeMap<String, FileSystemEntry> filesystem = new TreeMap<String, FileSystemEntry>();
		filesystem.put(ROOT, FileSystemEntry.Directory.INSTANCE);
		return new AbstractState(filesystem, new TreeMap<String, String>(), ROOT, new ArrayList<String>());
	}

	/**
	 * @return an independent copy of this state
	 */
	public AbstractState copy() {
		return new AbstractState(
				new TreeMap<String, FileSystemEntry>(filesystem),
				new TreeMap<String, String>(env),
				cwd,
				new ArrayList<String>(stdout));
	}

	public SortedMap<String, FileSystemEntry> getFilesystem() {
		return Collections.unmodifiableSortedMap(filesystem);
	}

	public SortedMap<String, String> getEnv() {
		return Collections.unmodifiableSortedMap(env);
	}

	public String getCwd() {
		return cwd;
	}

	public List<String> getStdout() {
		return Collections.unmodifiableList(stdout);
	}

	/**
	 * @param name a variable name
	 * @return its value, or <code>null</code> when unset
	 */
	public String getVariable(String name) {
		return env.get(name);
	}

	public void setVariable(String name, String value) {
		env.put(name, value);
	}

	public void writeStdout(String line) {
		stdout.add(line);
	}

	/**
	 * @param path a path, absolute or relative to the working directory
	 * @return the entry at that path, or <code>null</code>
	 */
	public FileSystemEntry getEntry(String path) {
		return filesystem.get(resolve(path));
	}

	/**
	 * Adds a file or a directory without any check, for setting up initial
	 * states. Missing parents are created as directories.
	 *
	 * @param path an absolute path
	 * @param entry the entry
	 * @return this state
	 */
	public AbstractState with(String path, FileSystemEntry entry) {
		String resolved = resolve(path);
		String parent = parentOf(resolved);
		while (parent != null && !filesystem.containsKey(parent)) {
			filesystem.put(parent, FileSystemEntry.Directory.INSTANCE);
			parent = parentOf(parent);
		}
		filesystem.put(resolved, entry);
		return this;
	}

	/**
	 * Changes the working directory.
	 *
	 * @param path the new directory
	 * @throws EvalException when it is not an existing directory
	 */
	public void changeDirectory(String path) {
		String resolved = resolve(path);
		FileSystemEntry entry = filesystem.get(resolved);
		if (entry == null) {
			throw new EvalException("cd: " + path + ": No such file or directory");
		}
		if (!entry.isDirectory()) {
			throw new EvalException("cd: " + path + ": Not a directory");
		}
		cwd = resolved;
	}

	/**
	 * Creates a directory.
	 *
	 * @param path the directory
	 * @param parents create missing parents and accept an existing directory, like <code>mkdir -p</code>
	 * @throws EvalException when the directory cannot be created
	 */
	public void createDirectory(String path, boolean parents) {
		String resolved = resolve(path);
		FileSystemEntry existing = filesystem.get(resolved);
		if (existing != null) {
			if (parents && existing.isDirectory()) {
				return;
			}
			throw new EvalException("mkdir: cannot create directory '" + path + "': File exists");
		}
		Deque<String> missing = new ArrayDeque<String>();
		missing.push(resolved);
		String parent = parentOf(resolved);
		while (parent != null && !filesystem.containsKey(parent)) {
			if (!parents) {
				throw new EvalException("mkdir: cannot create directory '" + path + "': No such file or directory");
			}
			missing.push(parent);
			parent = parentOf(parent);
		}
		if (parent != null && !filesystem.get(parent).isDirectory()) {
			throw new EvalException("mkdir: cannot create directory '" + path + "': Not a directory");
		}
		while (!missing.isEmpty()) {
			filesystem.put(missing.pop(), FileSystemEntry.Directory.INSTANCE);
		}
	}

	/**
	 * Creates an empty file unless an entry already exists, like
	 * <code>touch</code>.
	 *
	 * @param path the file
	 * @throws EvalException when the parent is not an existing directory
	 */
	public void touch(String path) {
		String resolved = resolve(path);
		if (filesystem.containsKey(resolved)) {
			return;
		}
		String parent = parentOf(resolved);
		FileSystemEntry parentEntry = parent == null ? null : filesystem.get(parent);
		if (parentEntry == null || !parentEntry.isDirectory()) {
			throw new EvalException("touch: cannot touch '" + path + "': No such file or directory");
		}
		filesystem.put(resolved, new FileSystemEntry.File(""));
	}

	/**
	 * Turns a path into an absolute path without <code>.</code>,
	 * <code>..</code> or repeated slashes.
	 *
	 * @param path a path, absolute or relative to the working directory
	 * @return the normalized absolute path
	 */
	public String resolve(String path) {
		if (path.isEmpty()) {
			throw new EvalException("empty path");
		}
		String full = path.startsWith(ROOT) ? path : cwd + ROOT + path;
		Deque<String> segments = new ArrayDeque<String>();
		for (String segment : full.split("/")) {
			if (segment.isEmpty() || ".".equals(segment)) {
				continue;
			}
			if ("..".equals(segment)) {
				segments.pollLast();
			} else {
				segments.addLast(segment);
			}
		}
		if (segments.isEmpty()) {
			return ROOT;
		}
		StringBuilder sb = new StringBuilder();
		for (String segment : segments) {
			sb.append('/').append(segment);
		}
		return sb.toString();
	}

	private static String parentOf(String path) {
		if (ROOT.equals(path)) {
			return null;
		}
		int slash = path.lastIndexOf('/');
		return slash == 0 ? ROOT : path.substring(0, slash);
	}

	/**
	 * @param other another state
	 * @return <code>true</code> when both states agree on every observable field
	 */
	public boolean isEquivalent(AbstractState other) {
		return firstDivergence(other) == null;
	}

	/**
	 * @param other another state
	 * @return the first field, in {@link StateField} order, on which both
	 *         states differ, or <code>null</code>
	 */
	public StateField firstDivergence(AbstractState other) {
		if (!env.equals(other.env)) {
			return StateField.ENV;
		}
		if (!cwd.equals(other.cwd)) {
			return StateField.CWD;
		}
		if (!filesystem.equals(other.filesystem)) {
			return StateField.FILESYSTEM;
		}
		if (!stdout.equals(other.stdout)) {
			return StateField.STDOUT;
		}
		return null;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof AbstractState && isEquivalent((AbstractState) o);
	}

	@Override
	public int hashCode() {
		return ((filesystem.hashCode() * 31 + env.hashCode()) * 31 + cwd.hashCode()) * 31 + stdout.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append("cwd: ").append(cwd).append('\n');
		sb.append("env:\n");
		for (Map.Entry<String, String> variable : env.entrySet()) {
			sb.append("  ").append(variable.getKey()).append('=').append(variable.getValue()).append('\n');
		}
		sb.append("filesystem:\n");
		for (Map.Entry<String, FileSystemEntry> entry : filesystem.entrySet()) {
			sb.append("  ").append(entry.getKey()).append(' ').append(entry.getValue()).append('\n');
		}
		sb.append("stdout:\n");
		for (String line : stdout) {
			sb.append("  ").append(line).append('\n');
		}
		return sb.toString();
	}
}
