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
 * The injected class name of a class template or partial specialization,
 * as used inside its own definition.  Always dependent and canonical.
 */
public final class InjectedClassNameType extends Type {
	private final CXXRecordDecl decl;
	private final QualType injectedType;

	InjectedClassNameType(TypeFactory factory, CXXRecordDecl decl, QualType injectedType) {
		super(factory, TypeClass.INJECTED_CLASS_NAME, null, true, true, false, false);
		this.decl = decl;
		this.injectedType = injectedType;
	}

	/**
	 * Returns the class, resolved to its definition if one has been seen.
	 * @return the class declaration
	 */
	public CXXRecordDecl getDecl() {
		return (CXXRecordDecl)TagType.getInterestingTagDecl(decl);
	}

	/**
	 * Returns the specialization type the injected class name stands for,
	 * e.g. {@code vector<T>}.
	 * @return the injected specialization type
	 */
	public QualType getInjectedSpecializationType() {
		return injectedType;
	}

	public TemplateSpecializationType getInjectedTST() {
		return injectedType.getTypePtr().getAs(TemplateSpecializationType.class);
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
		return visitor.visitInjectedClassName(this);
	}

	static TypeProfile profile(CXXRecordDecl decl) {
		return new TypeProfile().addValue(TypeClass.INJECTED_CLASS_NAME).addPointer(decl);
	}

	@Override
	TypeProfile profile() {
		return profile(decl);
	}

	@Override
	public String toString() {
		return getDecl().getName();
	}
}
