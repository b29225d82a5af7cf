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
 * A C99 variable-length array ({@code int a[n]}), or an array whose size is
 * {@code *} in a prototype.  VLAs are never uniqued: two VLAs with the same
 * size expression are still different types, so the profile is the node
 * itself.
 */
public final class VariableArrayType extends ArrayType {
	private final Expr sizeExpr;

	VariableArrayType(TypeFactory factory, QualType elementType, QualType canon, Expr sizeExpr,
			ArraySizeModifier sizeModifier, int indexTypeQuals, CheckedArrayKind kind) {
		super(factory, TypeClass.VARIABLE_ARRAY, elementType, canon, sizeModifier, indexTypeQuals, kind,
				sizeExpr != null && sizeExpr.containsUnexpandedParameterPack());
		this.sizeExpr = sizeExpr;
	}

	/**
	 * Returns the size expression, or null for a {@code [*]} array.
	 * @return the size expression, or null
	 */
	public Expr getSizeExpr() {
		return sizeExpr;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitVariableArray(this);
	}

	@Override
	TypeProfile profile() {
		return new TypeProfile().addValue(TypeClass.VARIABLE_ARRAY).addPointer(this);
	}

	@Override
	public String toString() {
		return getElementType() + " [" + bracketPrefix() + (sizeExpr != null ? sizeExpr : "*") + "]";
	}
}
