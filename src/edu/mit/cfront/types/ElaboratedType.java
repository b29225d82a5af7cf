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

import edu.mit.cfront.ast.NestedNameSpecifier;

/**
 * A type name written with a keyword, a qualifier, or both
 * ({@code struct S}, {@code N::T}).  Always sugar for the named type.
 */
public final class ElaboratedType extends TypeWithKeyword {
	private final NestedNameSpecifier qualifier;
	private final QualType namedType;

	ElaboratedType(TypeFactory factory, ElaboratedTypeKeyword keyword, NestedNameSpecifier qualifier,
			QualType namedType, QualType canon) {
		super(factory, TypeClass.ELABORATED, keyword, canon, false, false, false,
				qualifier != null && qualifier.containsUnexpandedParameterPack());
		this.qualifier = qualifier;
		this.namedType = namedType;
		inheritFlags(namedType);
	}

	/**
	 * Returns the qualifier, or null if none was written.
	 * @return the nested-name-specifier, or null
	 */
	public NestedNameSpecifier getQualifier() {
		return qualifier;
	}

	public QualType getNamedType() {
		return namedType;
	}

	@Override
	public boolean isSugared() {
		return true;
	}

	@Override
	public QualType desugar() {
		return namedType;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitElaborated(this);
	}

	static TypeProfile profile(ElaboratedTypeKeyword keyword, NestedNameSpecifier qualifier, QualType namedType) {
		return new TypeProfile().addValue(TypeClass.ELABORATED).addValue(keyword).addPointer(qualifier).addQualType(namedType);
	}

	@Override
	TypeProfile profile() {
		return profile(getKeyword(), qualifier, namedType);
	}

	@Override
	public String toString() {
		Type named = namedType.getTypePtr();
		String name = named instanceof TagType ? ((TagType)named).getDecl().getName() : namedType.toString();
		return keywordPrefix() + (qualifier != null ? qualifier : "") + name;
	}
}
