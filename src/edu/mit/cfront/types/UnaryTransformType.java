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
 * A type trait applied to a type, such as {@code __underlying_type(E)}.
 */
public final class UnaryTransformType extends Type {
	public enum UTTKind {
		ENUM_UNDERLYING_TYPE;
	}

	private final QualType baseType;
	private final QualType underlyingType;
	private final UTTKind kind;

	UnaryTransformType(TypeFactory factory, QualType baseType, QualType underlyingType, UTTKind kind, QualType canon) {
		super(factory, TypeClass.UNARY_TRANSFORM, canon, false, false, false, false);
		this.baseType = baseType;
		this.underlyingType = underlyingType;
		this.kind = kind;
		inheritFlags(baseType);
	}

	public QualType getBaseType() {
		return baseType;
	}

	public QualType getUnderlyingType() {
		return underlyingType;
	}

	public UTTKind getUTTKind() {
		return kind;
	}

	@Override
	public boolean isSugared() {
		return !isDependentType();
	}

	@Override
	public QualType desugar() {
		if (isSugared())
			return underlyingType;
		return asQualType();
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitUnaryTransform(this);
	}

	static TypeProfile profile(QualType baseType, UTTKind kind) {
		return new TypeProfile().addValue(TypeClass.UNARY_TRANSFORM).addQualType(baseType).addValue(kind);
	}

	@Override
	TypeProfile profile() {
		return profile(baseType, kind);
	}

	@Override
	public String toString() {
		return "__underlying_type(" + baseType + ")";
	}
}
