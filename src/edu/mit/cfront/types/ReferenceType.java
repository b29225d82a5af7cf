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

/**
 * The base of lvalue and rvalue references.  A reference to a reference
 * (from typedefs or template substitution) collapses: the pointee as
 * written may itself be a reference, but {@link #getPointeeType()} looks
 * through to the innermost referenced type.
 */
public abstract class ReferenceType extends Type {
	private final QualType pointeeType;
	private final boolean spelledAsLValue;
	private final boolean innerRef;

	ReferenceType(TypeFactory factory, TypeClass typeClass, QualType referencee, QualType canon, boolean spelledAsLValue) {
		super(factory, typeClass, canon, false, false, false, false);
		this.pointeeType = referencee;
		this.spelledAsLValue = spelledAsLValue;
		this.innerRef = referencee.getTypePtr().isReferenceType();
		inheritFlags(referencee);
	}

	public boolean isSpelledAsLValue() {
		return spelledAsLValue;
	}

	/**
	 * Returns true if the referenced type as written is itself a reference.
	 * @return true if this reference wraps another reference
	 */
	public boolean isInnerRef() {
		return innerRef;
	}

	public QualType getPointeeTypeAsWritten() {
		return pointeeType;
	}

	@Override
	public QualType getPointeeType() {
		ReferenceType t = this;
		while (t.isInnerRef())
			t = t.pointeeType.getTypePtr().castAs(ReferenceType.class);
		return t.pointeeType;
	}

	@Override
	public final boolean isSugared() {
		return false;
	}

	@Override
	public final QualType desugar() {
		return asQualType();
	}

	static TypeProfile profile(TypeClass typeClass, QualType referencee, boolean spelledAsLValue) {
		return new TypeProfile().addValue(typeClass).addQualType(referencee).addBoolean(spelledAsLValue);
	}

	@Override
	final TypeProfile profile() {
		return profile(getTypeClass(), pointeeType, spelledAsLValue);
	}
}
