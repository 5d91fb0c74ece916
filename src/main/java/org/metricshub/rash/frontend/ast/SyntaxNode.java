package org.metricshub.rash.frontend.ast;

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
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A node of the generic syntax tree produced by
 * {@link org.metricshub.rash.frontend.RustParser}.
 * <p>
 * The tree is shaped loosely: a {@link SyntaxKind}, an optional text
 * (identifier, operator, decoded literal value), ordered children, a
 * set of {@link SyntaxFlag}s and the location of the first token.
 * Nodes are immutable once built.
 */
public final class SyntaxNode {

	private final SyntaxKind kind;
	private final String text;
	private final List<SyntaxNode> children;
	private final Set<SyntaxFlag> flags;
	private final SourceSpan span;

	/**
	 * <p>
	 * Constructor for SyntaxNode.
	 * </p>
	 *
	 * @param kind kind of the node
	 * @param text identifier, operator or literal value; may be <code>null</code>
	 * @param children ordered children
	 * @param flags modifiers
	 * @param span location of the node
	 */
	public SyntaxNode(SyntaxKind kind, String text, List<SyntaxNode> children, Set<SyntaxFlag> flags, SourceSpan span) {
		this.kind = kind;
		this.text = text;
		this.children = Collections.unmodifiableList(new ArrayList<SyntaxNode>(children));
		EnumSet<SyntaxFlag> copy = EnumSet.noneOf(SyntaxFlag.class);
		copy.addAll(flags);
		this.flags = Collections.unmodifiableSet(copy);
		this.span = span;
	}

	/**
	 * Builds a leaf node without flags.
	 *
	 * @param kind kind of the node
	 * @param text text of the node
	 * @param span location of the node
	 * @return the node
	 */
	public static SyntaxNode leaf(SyntaxKind kind, String text, SourceSpan span) {
		return new SyntaxNode(kind, text, Collections.<SyntaxNode>emptyList(), EnumSet.noneOf(SyntaxFlag.class), span);
	}

	/**
	 * Builds a node without flags.
	 *
	 * @param kind kind of the node
	 * @param text text of the node, may be <code>null</code>
	 * @param span location of the node
	 * @param children ordered children
	 * @return the node
	 */
	public static SyntaxNode of(SyntaxKind kind, String text, SourceSpan span, SyntaxNode... children) {
		List<SyntaxNode> list = new ArrayList<SyntaxNode>(children.length);
		Collections.addAll(list, children);
		return new SyntaxNode(kind, text, list, EnumSet.noneOf(SyntaxFlag.class), span);
	}

	public SyntaxKind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	public List<SyntaxNode> getChildren() {
		return children;
	}

	public SyntaxNode getChild(int index) {
		return children.get(index);
	}

	public int getChildCount() {
		return children.size();
	}

	public boolean hasFlag(SyntaxFlag flag) {
		return flags.contains(flag);
	}

	public Set<SyntaxFlag> getFlags() {
		return flags;
	}

	public SourceSpan getSpan() {
		return span;
	}

	/**
	 * @param childKind the kind to look for
	 * @return the first direct child of the given kind, or <code>null</code>
	 */
	public SyntaxNode findChild(SyntaxKind childKind) {
		for (SyntaxNode child : children) {
			if (child.kind == childKind) {
				return child;
			}
		}
		return null;
	}

	/**
	 * @param childKind the kind to look for
	 * @return all direct children of the given kind, in order
	 */
	public List<SyntaxNode> findChildren(SyntaxKind childKind) {
		List<SyntaxNode> result = new ArrayList<SyntaxNode>();
		for (SyntaxNode child : children) {
			if (child.kind == childKind) {
				result.add(child);
			}
		}
		return result;
	}

	/**
	 * Renders the node as an s-expression, mostly for diagnostics and tests.
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append('(').append(kind);
		if (text != null) {
			sb.append(' ').append('"').append(text).append('"');
		}
		if (!flags.isEmpty()) {
			sb.append(' ').append(flags);
		}
		for (SyntaxNode child : children) {
			sb.append(' ').append(child);
		}
		return sb.append(')').toString();
	}
}
