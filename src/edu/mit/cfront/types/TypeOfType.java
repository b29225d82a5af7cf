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
 * {@code typeof(type)}, a GCC extension.  Always sugar.
 */
public final class TypeOfType extends Type {
	private final QualType underlyingType;

	TypeOfType(TypeFactory factory, QualType underlyingType, QualType canon) {
		super(factory, TypeClass.TYPE_OF, canon, false, false, false, false);
		this.underlyingType = underlyingType;
		inheritFlags(underlyingType);
	}

	public QualType getUnderlyingType() {
		return underlyingType;
	}

	@Override
	public boolean isSugared() {
		return true;
	}

	@Override
	public QualType desugar() {
		return underlyingType;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitTypeOf(this);
	}

	static TypeProfile profile(QualType underlyingType) {
		return new TypeProfile().addValue(TypeClass.TYPE_OF).addQualType(underlyingType);
	}

	@Override
	TypeProfile profile() {
		return profile(underlyingType);
	}

	@Override
	public String toString() {
		return "typeof(" + underlyingType + ")";
	}
}
