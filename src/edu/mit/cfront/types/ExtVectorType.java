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
 * An OpenCL-style extended vector ({@code ext_vector_type(n)}), which
 * supports swizzle accessors such as {@code v.xyzw} and {@code v.s01}.
 */
public final class ExtVectorType extends VectorType {
	ExtVectorType(TypeFactory factory, QualType elementType, int numElements, QualType canon) {
		super(factory, TypeClass.EXT_VECTOR, elementType, numElements, VectorKind.GENERIC, canon);
	}

	/**
	 * Maps a point accessor letter (x, y, z, w) to its element index.
	 * @param c the accessor character
	 * @return the index, or -1
	 */
	public static int getPointAccessorIdx(char c) {
		switch (c) {
			case 'x': case 'r': return 0;
			case 'y': case 'g': return 1;
			case 'z': case 'b': return 2;
			case 'w': case 'a': return 3;
			default: return -1;
		}
	}

	/**
	 * Maps a numeric accessor ({@code s0}..{@code sF}) digit to its element
	 * index.
	 * @param c the accessor digit
	 * @return the index, or -1
	 */
	public static int getNumericAccessorIdx(char c) {
		if (c >= '0' && c <= '9')
			return c - '0';
		if (c >= 'a' && c <= 'f')
			return c - 'a' + 10;
		if (c >= 'A' && c <= 'F')
			return c - 'A' + 10;
		return -1;
	}

	public static int getAccessorIdx(char c, boolean isNumericAccessor) {
		return isNumericAccessor ? getNumericAccessorIdx(c) : getPointAccessorIdx(c);
	}

	public boolean isAccessorWithinNumElements(char c, boolean isNumericAccessor) {
		int idx = getAccessorIdx(c, isNumericAccessor);
		return idx >= 0 && idx < getNumElements();
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitExtVector(this);
	}

	@Override
	public String toString() {
		return getElementType() + " __attribute__((ext_vector_type(" + getNumElements() + ")))";
	}
}
