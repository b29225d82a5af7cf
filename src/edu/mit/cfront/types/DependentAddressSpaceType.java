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
 * A type with an {@code address_space} attribute whose argument is a
 * dependent expression.
 */
public final class DependentAddressSpaceType extends Type {
	private final QualType pointeeType;
	private final Expr addrSpaceExpr;

	DependentAddressSpaceType(TypeFactory factory, QualType pointeeType, QualType canon, Expr addrSpaceExpr) {
		super(factory, TypeClass.DEPENDENT_ADDRESS_SPACE, canon, true, true,
				pointeeType.getTypePtr().isVariablyModifiedType(),
				pointeeType.getTypePtr().containsUnexpandedParameterPack()
						|| (addrSpaceExpr != null && addrSpaceExpr.containsUnexpandedParameterPack()));
		this.pointeeType = pointeeType;
		this.addrSpaceExpr = addrSpaceExpr;
	}

	@Override
	public QualType getPointeeType() {
		return pointeeType;
	}

	public Expr getAddrSpaceExpr() {
		return addrSpaceExpr;
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
		return visitor.visitDependentAddressSpace(this);
	}

	static TypeProfile profile(QualType pointeeType, Expr addrSpaceExpr) {
		TypeProfile p = new TypeProfile().addValue(TypeClass.DEPENDENT_ADDRESS_SPACE).addQualType(pointeeType);
		addrSpaceExpr.profile(p);
		return p;
	}

	@Override
	TypeProfile profile() {
		return profile(pointeeType, addrSpaceExpr);
	}

	@Override
	public String toString() {
		return pointeeType + " __attribute__((address_space(" + addrSpaceExpr + ")))";
	}
}
