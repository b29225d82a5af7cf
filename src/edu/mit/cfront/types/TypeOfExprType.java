/*
 * Copyright (c) 2013-2014 Massachusetts Institute of Technology
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package edu.mit.cfront.types;

import edu.mit.cfront.ast.Expr;

/**
 * {@code typeof(expression)}, a GCC extension.  Sugar for the
 * expression's type unless the expression is type-dependent, in which case
 * the node is canonical.
 */
public final class TypeOfExprType extends Type {
	private final Expr expr;

	TypeOfExprType(TypeFactory factory, Expr expr, QualType canon) {
		super(factory, TypeClass.TYPE_OF_EXPR, canon, expr.isTypeDependent(), expr.isInstantiationDependent(),
				expr.getType().getTypePtr().isVariablyModifiedType(), expr.containsUnexpandedParameterPack());
		this.expr = expr;
	}

	public Expr getUnderlyingExpr() {
		return expr;
	}

	@Override
	public boolean isSugared() {
		return !expr.isTypeDependent();
	}

	@Override
	public QualType desugar() {
		if (isSugared())
			return expr.getType();
		return asQualType();
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitTypeOfExpr(this);
	}

	static TypeProfile profile(Expr expr) {
		TypeProfile p = new TypeProfile().addValue(TypeClass.TYPE_OF_EXPR);
		expr.profile(p);
		return p;
	}

	@Override
	TypeProfile profile() {
		return profile(expr);
	}

	@Override
	public String toString() {
		return "typeof " + expr;
	}
}
