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
 * The base of placeholder types whose type is deduced from an initializer.
 * Once deduced, the node is sugar for the deduced type.
 */
public abstract class DeducedType extends Type {
	DeducedType(TypeFactory factory, TypeClass typeClass, QualType deducedAsType, boolean dependent,
			boolean instantiationDependent, boolean containsUnexpandedParameterPack) {
		super(factory, typeClass, deducedAsType != null ? deducedAsType.getCanonicalType() : null,
				dependent, instantiationDependent, false, containsUnexpandedParameterPack);
		if (deducedAsType != null)
			inheritFlags(deducedAsType);
	}

	@Override
	public final boolean isSugared() {
		return !isCanonicalUnqualified();
	}

	@Override
	public final QualType desugar() {
		return getCanonicalTypeInternal();
	}

	/**
	 * Returns the deduced type.
	 * @return the deduced type, or null if not yet deduced
	 */
	public QualType getDeducedType() {
		return isSugared() ? getCanonicalTypeInternal() : null;
	}

	/**
	 * Returns true if deduction has happened, or deduction produced a
	 * dependent type.
	 * @return true if this type is deduced
	 */
	public boolean isDeduced() {
		return getDeducedType() != null || isDependentType();
	}
}
