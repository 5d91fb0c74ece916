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

/**
 * An entry of the abstract file system: a directory or a regular file.
 */
public abstract class FileSystemEntry {

	private FileSystemEntry() {}

	/**
	 * @return <code>true</code> for a directory
	 */
	public abstract boolean isDirectory();

	/**
	 * A directory. Its children are the entries whose path it prefixes.
	 */
	public static final class Directory extends FileSystemEntry {
		public static final Directory INSTANCE = new Directory();

		private Directory() {}

		@Override
		public boolean isDirectory() {
			return true;
		}

		@Override
		public String toString() {
			return "Directory";
		}
	}

	/**
	 * A regular file and its content.
	 */
	public static final class File extends FileSystemEntry {
		private final String content;

		public File(String content) {
			this.content = content;
		}

		public String getContent() {
			return content;
		}

		@Override
		public boolean isDirectory() {
			return false;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof File && content.equals(((File) o).content);
		}

		@Override
		public int hashCode() {
			return content.hashCode();
		}

		@Override
		public String toString() {
			return "File(" + content.length() + " bytes)";
		}
	}
}
