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
package edu.mit.cfront.basic;

import edu.mit.cfront.ast.FieldDecl;
import edu.mit.cfront.ast.RecordDecl;
import edu.mit.cfront.types.QualType;

/**
 * The target's numeric layout service: sizes and offsets of complete types,
 * as computed by the record layout builder.  All sizes are in bits unless
 * the method name says otherwise.
 */
public interface TargetLayout {
	/**
	 * Returns the width of a char in bits.
	 * @return the char width
	 */
	public int getCharWidth();

	/**
	 * Returns the size of the given complete type, in bits.
	 * @param type a complete, non-dependent type
	 * @return the size in bits
	 */
	public long getTypeSize(QualType type);

	/**
	 * Returns the alignment of the given complete type, in bits.
	 * @param type a complete, non-dependent type
	 * @return the alignment in bits
	 */
	public long getTypeAlign(QualType type);

	/**
	 * Returns the offset of the given field from the start of its record, in
	 * bits.
	 * @param field a field of a complete record
	 * @return the offset in bits
	 */
	public long getFieldOffset(FieldDecl field);

	/**
	 * Returns the offset in bits of the given (non-virtual) base class
	 * subobject within the given derived class.
	 * @param derived the derived class
	 * @param base the base class type
	 * @return the offset in bits
	 */
	public long getBaseClassOffset(RecordDecl derived, QualType base);

	/**
	 * Returns the width of the target's size_t, in bits.
	 * @return the width of size_t
	 */
	public int getSizeTypeWidth();

	/**
	 * Returns true if the target uses the Microsoft C++ ABI.
	 * @return true if the target uses the Microsoft C++ ABI
	 */
	public boolean isMicrosoftABI();

	public default long getTypeSizeInChars(QualType type) {
		return getTypeSize(type) / getCharWidth();
	}
}
