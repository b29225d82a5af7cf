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
import java.math.BigInteger;

/**
 * An array with a constant size ({@code int a[10]}).
 */
public final class ConstantArrayType extends ArrayType {
	private final BigInteger size;

	ConstantArrayType(TypeFactory factory, QualType elementType, QualType canon, BigInteger size,
			ArraySizeModifier sizeModifier, int indexTypeQuals, CheckedArrayKind kind) {
		super(factory, TypeClass.CONSTANT_ARRAY, elementType, canon, sizeModifier, indexTypeQuals, kind, false);
		checkArgument(size.signum() >= 0, "negative array size %s", size);
		this.size = size;
	}

	public BigInteger getSize() {
		return size;
	}

	/**
	 * Determines the number of bits needed to address every byte of an array
	 * of the given element type and element count.
	 * @param factory the type factory, for element sizes
	 * @param elementType the element type
	 * @param numElements the number of elements
	 * @return the number of addressing bits
	 */
	public static int getNumAddressingBits(TypeFactory factory, QualType elementType, BigInteger numElements) {
		long elementSize = factory.getTargetLayout().getTypeSizeInChars(elementType);
		if (elementSize > 0 && Long.bitCount(elementSize) == 1)
			return numElements.bitLength() + Long.numberOfTrailingZeros(elementSize);
		return numElements.multiply(BigInteger.valueOf(elementSize)).bitLength();
	}

	/**
	 * Returns the maximum number of bits an array size may need; arrays
	 * larger than this are rejected.
	 * @param factory the type factory
	 * @return the maximum size bits
	 */
	public static int getMaxSizeBits(TypeFactory factory) {
		int bits = factory.getTargetLayout().getSizeTypeWidth();
		//Limit to 61 bits so sizes in bits still fit in 64 bits.
		return Math.min(bits, 61);
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitConstantArray(this);
	}

	static TypeProfile profile(QualType elementType, BigInteger size, ArraySizeModifier sizeModifier,
			int indexTypeQuals, CheckedArrayKind kind) {
		return new TypeProfile().addValue(TypeClass.CONSTANT_ARRAY).addQualType(elementType).addValue(size)
				.addValue(sizeModifier).addInteger(indexTypeQuals & Qualifiers.CVR_MASK).addValue(kind);
	}

	@Override
	TypeProfile profile() {
		return profile(getElementType(), size, getSizeModifier(), getIndexTypeCVRQualifiers(), getKind());
	}

	@Override
	public String toString() {
		return getElementType() + " [" + bracketPrefix() + size + "]";
	}
}
