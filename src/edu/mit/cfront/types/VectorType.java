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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A GCC generic vector ({@code __attribute__((vector_size(n)))}) or one of
 * the target-specific vector types.
 */
public class VectorType extends Type {
	public enum VectorKind {
		GENERIC, ALTIVEC_VECTOR, ALTIVEC_PIXEL, ALTIVEC_BOOL, NEON, NEON_POLY;
	}

	private final QualType elementType;
	private final int numElements;
	private final VectorKind vectorKind;

	VectorType(TypeFactory factory, QualType elementType, int numElements, VectorKind vectorKind, QualType canon) {
		this(factory, TypeClass.VECTOR, elementType, numElements, vectorKind, canon);
	}

	VectorType(TypeFactory factory, TypeClass typeClass, QualType elementType, int numElements, VectorKind vectorKind, QualType canon) {
		super(factory, typeClass, canon, false, false, false, false);
		checkArgument(numElements > 0, "bad vector length %s", numElements);
		this.elementType = elementType;
		this.numElements = numElements;
		this.vectorKind = vectorKind;
		inheritFlags(elementType);
	}

	public QualType getElementType() {
		return elementType;
	}

	public int getNumElements() {
		return numElements;
	}

	public VectorKind getVectorKind() {
		return vectorKind;
	}

	@Override
	public final boolean isSugared() {
		return false;
	}

	@Override
	public final QualType desugar() {
		return asQualType();
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitVector(this);
	}

	static TypeProfile profile(TypeClass typeClass, QualType elementType, int numElements, VectorKind vectorKind) {
		return new TypeProfile().addValue(typeClass).addQualType(elementType).addInteger(numElements).addValue(vectorKind);
	}

	@Override
	final TypeProfile profile() {
		return profile(getTypeClass(), elementType, numElements, vectorKind);
	}

	@Override
	public String toString() {
		return elementType + " __attribute__((vector_size(" + numElements + " elements)))";
	}
}
