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

import edu.mit.cfront.ast.CXXRecordDecl;

/**
 * A pointer to a non-static member of a class ({@code int C::*} or
 * {@code void (C::*)()}).
 */
public final class MemberPointerType extends Type {
	private final QualType pointeeType;
	private final Type cls;

	MemberPointerType(TypeFactory factory, QualType pointeeType, Type cls, QualType canon) {
		super(factory, TypeClass.MEMBER_POINTER, canon,
				cls.isDependentType() || pointeeType.getTypePtr().isDependentType(),
				cls.isInstantiationDependentType() || pointeeType.getTypePtr().isInstantiationDependentType(),
				pointeeType.getTypePtr().isVariablyModifiedType(),
				cls.containsUnexpandedParameterPack() || pointeeType.getTypePtr().containsUnexpandedParameterPack());
		this.pointeeType = pointeeType;
		this.cls = cls;
	}

	@Override
	public QualType getPointeeType() {
		return pointeeType;
	}

	/**
	 * Returns the class whose member this points to.
	 * @return the class type
	 */
	public Type getClassType() {
		return cls;
	}

	public boolean isMemberFunctionPointer() {
		return pointeeType.getTypePtr().isFunctionProtoType();
	}

	public boolean isMemberDataPointer() {
		return !pointeeType.getTypePtr().isFunctionProtoType();
	}

	/**
	 * Returns the most recent declaration of the class, where inheritance
	 * model attributes accumulate.
	 * @return the most recent class declaration, or null
	 */
	public CXXRecordDecl getMostRecentCXXRecordDecl() {
		CXXRecordDecl rd = cls.getAsCXXRecordDecl();
		return rd != null ? rd.getMostRecentDecl() : null;
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
		return visitor.visitMemberPointer(this);
	}

	static TypeProfile profile(QualType pointeeType, Type cls) {
		return new TypeProfile().addValue(TypeClass.MEMBER_POINTER).addQualType(pointeeType).addPointer(cls);
	}

	@Override
	TypeProfile profile() {
		return profile(pointeeType, cls);
	}

	@Override
	public String toString() {
		return pointeeType + " " + cls + "::*";
	}
}
