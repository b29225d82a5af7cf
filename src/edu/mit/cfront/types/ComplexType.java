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
 * A C99 complex type ({@code _Complex double}), or the GCC extension
 * complex integer type.
 */
public final class ComplexType extends Type {
	private final QualType elementType;

	ComplexType(TypeFactory factory, QualType elementType, QualType canon) {
		super(factory, TypeClass.COMPLEX, canon, false, false, false, false);
		this.elementType = elementType;
		inheritFlags(elementType);
	}

	public QualType getElementType() {
		return elementType;
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
		return visitor.visitComplex(this);
	}

	static TypeProfile profile(QualType elementType) {
		return new TypeProfile().addValue(TypeClass.COMPLEX).addQualType(elementType);
	}

	@Override
	TypeProfile profile() {
		return profile(elementType);
	}

	@Override
	public String toString() {
		return "_Complex " + elementType;
	}
}
