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
 * A block pointer ({@code int (^)(int)}); the pointee is always a function
 * type.
 */
public final class BlockPointerType extends Type {
	private final QualType pointeeType;

	BlockPointerType(TypeFactory factory, QualType pointeeType, QualType canon) {
		super(factory, TypeClass.BLOCK_POINTER, canon, false, false, false, false);
		this.pointeeType = pointeeType;
		inheritFlags(pointeeType);
	}

	@Override
	public QualType getPointeeType() {
		return pointeeType;
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
		return visitor.visitBlockPointer(this);
	}

	static TypeProfile profile(QualType pointeeType) {
		return new TypeProfile().addValue(TypeClass.BLOCK_POINTER).addQualType(pointeeType);
	}

	@Override
	TypeProfile profile() {
		return profile(pointeeType);
	}

	@Override
	public String toString() {
		return pointeeType + " (^)";
	}
}
