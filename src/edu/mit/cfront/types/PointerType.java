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
 * A pointer type.  Checked C pointers are pointer types with a
 * {@link CheckedPointerKind} other than {@link CheckedPointerKind#UNCHECKED}.
 */
public final class PointerType extends Type {
	private final QualType pointeeType;
	private final CheckedPointerKind kind;

	PointerType(TypeFactory factory, QualType pointeeType, QualType canon, CheckedPointerKind kind) {
		super(factory, TypeClass.POINTER, canon, false, false, false, false);
		this.pointeeType = pointeeType;
		this.kind = kind;
		inheritFlags(pointeeType);
	}

	@Override
	public QualType getPointeeType() {
		return pointeeType;
	}

	public CheckedPointerKind getKind() {
		return kind;
	}

	public boolean isChecked() {
		return kind != CheckedPointerKind.UNCHECKED;
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
		return visitor.visitPointer(this);
	}

	static TypeProfile profile(QualType pointeeType, CheckedPointerKind kind) {
		return new TypeProfile().addValue(TypeClass.POINTER).addQualType(pointeeType).addValue(kind);
	}

	@Override
	TypeProfile profile() {
		return profile(pointeeType, kind);
	}

	@Override
	public String toString() {
		switch (kind) {
			case UNCHECKED:
				return pointeeType + " *";
			case PTR:
				return "_Ptr<" + pointeeType + ">";
			case ARRAY:
				return "_Array_ptr<" + pointeeType + ">";
			case NT_ARRAY:
				return "_Nt_array_ptr<" + pointeeType + ">";
			default:
				throw new AssertionError(kind);
		}
	}
}
