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
 * An extended vector whose length is a dependent expression.
 */
public final class DependentSizedExtVectorType extends Type {
	private final QualType elementType;
	private final Expr sizeExpr;

	DependentSizedExtVectorType(TypeFactory factory, QualType elementType, QualType canon, Expr sizeExpr) {
		super(factory, TypeClass.DEPENDENT_SIZED_EXT_VECTOR, canon, true, true,
				elementType.getTypePtr().isVariablyModifiedType(),
				elementType.getTypePtr().containsUnexpandedParameterPack()
						|| (sizeExpr != null && sizeExpr.containsUnexpandedParameterPack()));
		this.elementType = elementType;
		this.sizeExpr = sizeExpr;
	}

	public QualType getElementType() {
		return elementType;
	}

	public Expr getSizeExpr() {
		return sizeExpr;
	}

	@Override
	public boolean isSugared() {
		return false;
	}

	@Override
	public QualType desugar() {
		return asQualType();
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitDependentSizedExtVector(this);
	}

	static TypeProfile profile(QualType elementType, Expr sizeExpr) {
		TypeProfile p = new TypeProfile().addValue(TypeClass.DEPENDENT_SIZED_EXT_VECTOR).addQualType(elementType);
		sizeExpr.profile(p);
		return p;
	}

	@Override
	TypeProfile profile() {
		return profile(elementType, sizeExpr);
	}

	@Override
	public String toString() {
		return elementType + " __attribute__((ext_vector_type(" + sizeExpr + ")))";
	}
}
