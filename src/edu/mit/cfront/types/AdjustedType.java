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
 * A type that was implicitly adjusted from what was written, such as a
 * parameter type adjusted by a calling convention attribute.  Desugars to
 * the adjusted type.
 */
public class AdjustedType extends Type {
	private final QualType originalType;
	private final QualType adjustedType;

	AdjustedType(TypeFactory factory, QualType originalType, QualType adjustedType, QualType canon) {
		this(factory, TypeClass.ADJUSTED, originalType, adjustedType, canon);
	}

	AdjustedType(TypeFactory factory, TypeClass typeClass, QualType originalType, QualType adjustedType, QualType canon) {
		super(factory, typeClass, canon, false, false, false, false);
		this.originalType = originalType;
		this.adjustedType = adjustedType;
		inheritFlags(originalType);
	}

	public QualType getOriginalType() {
		return originalType;
	}

	public QualType getAdjustedType() {
		return adjustedType;
	}

	@Override
	public final boolean isSugared() {
		return true;
	}

	@Override
	public final QualType desugar() {
		return adjustedType;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitAdjusted(this);
	}

	static TypeProfile profile(TypeClass typeClass, QualType originalType, QualType adjustedType) {
		return new TypeProfile().addValue(typeClass).addQualType(originalType).addQualType(adjustedType);
	}

	@Override
	final TypeProfile profile() {
		return profile(getTypeClass(), originalType, adjustedType);
	}

	@Override
	public String toString() {
		return originalType.toString();
	}
}
