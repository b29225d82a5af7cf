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
package edu.mit.cfront.ast;

import edu.mit.cfront.types.QualType;

/**
 * An enumeration declaration.
 */
public interface EnumDecl extends TagDecl {
	/**
	 * Returns true if this enum has a fixed underlying type, either spelled
	 * out or implied by being scoped.
	 * @return true if the underlying type is fixed
	 */
	public boolean isFixed();

	/**
	 * Returns true if this is a scoped enumeration ({@code enum class}).
	 * @return true if scoped
	 */
	public boolean isScoped();

	/**
	 * Returns the underlying integer type, or null if not yet known.
	 * @return the integer type, or null
	 */
	public QualType getIntegerType();

	/**
	 * Returns the type enumerators promote to, or null if not yet known.
	 * @return the promotion type, or null
	 */
	public QualType getPromotionType();

	/**
	 * Returns true if this enum can be used as a complete type: a fixed
	 * underlying type makes even a forward declaration complete.
	 * @return true if complete
	 */
	public default boolean isComplete() {
		return isCompleteDefinition() || isFixed();
	}
}
