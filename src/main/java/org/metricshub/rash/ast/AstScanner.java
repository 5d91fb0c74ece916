package org.metricshub.rash.ast;

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

import java.util.List;

/**
 * Walks every statement and expression of a restricted program. Subclasses
 * override the hooks they care about; the default traversal visits children
 * left to right.
 */
public class AstScanner implements Stmt.Visitor<Void>, Expr.Visitor<Void> {

	/**
	 * Scans the body of every function of the program.
	 *
	 * @param ast the program
	 */
	public void scan(RestrictedAst ast) {
		for (Function function : ast.getFunctions()) {
			scanFunction(function);
		}
	}

	protected void scanFunction(Function function) {
		scanBlock(function.getBody());
	}

	protected void scanBlock(List<Stmt> block) {
		for (Stmt stmt : block) {
			stmt.accept(this);
		}
	}

	protected void scanExpr(Expr expr) {
		expr.accept(this);
	}

	/**
	 * Called for every binding introduced by a <code>let</code> or a
	 * <code>for</code> loop.
	 *
	 * @param name the bound name
	 */
	protected void onBinding(String name) {}

	/**
	 * Called for every function call, before its arguments are scanned.
	 *
	 * @param call the call
	 */
	protected void onCall(Expr.FunctionCall call) {}

	@Override
	public Void visitLet(Stmt.Let stmt) {
		scanExpr(stmt.getValue());
		if (stmt.isDeclaration()) {
			onBinding(stmt.getName());
		}
		return null;
	}

	@Override
	public Void visitExprStmt(Stmt.ExprStmt stmt) {
		scanExpr(stmt.getExpr());
		return null;
	}

	@Override
	public Void visitIf(Stmt.If stmt) {
		scanExpr(stmt.getCondition());
		scanBlock(stmt.getThenBody());
		for (Stmt.ElseIf elseIf : stmt.getElseIfs()) {
			scanExpr(elseIf.getCondition());
			scanBlock(elseIf.getBody());
		}
		if (stmt.getElseBody() != null) {
			scanBlock(stmt.getElseBody());
		}
		return null;
	}

	@Override
	public Void visitWhile(Stmt.While stmt) {
		scanExpr(stmt.getCondition());
		scanBlock(stmt.getBody());
		return null;
	}

	@Override
	public Void visitFor(Stmt.For stmt) {
		scanExpr(stmt.getIterable());
		onBinding(stmt.getVariable());
		scanBlock(stmt.getBody());
		return null;
	}

	@Override
	public Void visitMatch(Stmt.Match stmt) {
		scanExpr(stmt.getScrutinee());
		for (Stmt.MatchArm arm : stmt.getArms()) {
			scanBlock(arm.getBody());
		}
		return null;
	}

	@Override
	public Void visitReturn(Stmt.Return stmt) {
		if (stmt.getValue() != null) {
			scanExpr(stmt.getValue());
		}
		return null;
	}

	@Override
	public Void visitBreak(Stmt.Break stmt) {
		return null;
	}

	@Override
	public Void visitContinue(Stmt.Continue stmt) {
		return null;
	}

	@Override
	public Void visitLiteral(Expr.Literal expr) {
		return null;
	}

	@Override
	public Void visitVariable(Expr.Variable expr) {
		return null;
	}

	@Override
	public Void visitBinary(Expr.Binary expr) {
		scanExpr(expr.getLeft());
		scanExpr(expr.getRight());
		return null;
	}

	@Override
	public Void visitUnary(Expr.Unary expr) {
		scanExpr(expr.getOperand());
		return null;
	}

	@Override
	public Void visitFunctionCall(Expr.FunctionCall expr) {
		onCall(expr);
		for (Expr arg : expr.getArgs()) {
			scanExpr(arg);
		}
		return null;
	}

	@Override
	public Void visitIndex(Expr.Index expr) {
		scanExpr(expr.getBase());
		scanExpr(expr.getIndex());
		return null;
	}

	@Override
	public Void visitMethodCall(Expr.MethodCall expr) {
		scanExpr(expr.getReceiver());
		for (Expr arg : expr.getArgs()) {
			scanExpr(arg);
		}
		return null;
	}

	@Override
	public Void visitTest(Expr.Test expr) {
		scanExpr(expr.getTest().getOperand());
		return null;
	}

	@Override
	public Void visitIfExpr(Expr.IfExpr expr) {
		scanExpr(expr.getCondition());
		scanExpr(expr.getThenValue());
		scanExpr(expr.getElseValue());
		return null;
	}

	@Override
	public Void visitRange(Expr.Range expr) {
		scanExpr(expr.getStart());
		scanExpr(expr.getEnd());
		return null;
	}

	@Override
	public Void visitArrayLiteral(Expr.ArrayLiteral expr) {
		for (Expr element : expr.getElements()) {
			scanExpr(element);
		}
		return null;
	}
}
