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

import static com.google.common.base.Preconditions.checkNotNull;
import edu.mit.cfront.ast.NestedNameSpecifier;

/**
 * A name in a dependent scope that names a type
 * ({@code typename T::type}).
 */
public final class DependentNameType extends TypeWithKeyword {
	private final NestedNameSpecifier qualifier;
	private final String name;

	DependentNameType(TypeFactory factory, ElaboratedTypeKeyword keyword, NestedNameSpecifier qualifier,
			String name, QualType canon) {
		super(factory, TypeClass.DEPENDENT_NAME, keyword, canon, true, true, false,
				qualifier.containsUnexpandedParameterPack());
		this.qualifier = checkNotNull(qualifier);
		this.name = checkNotNull(name);
	}

	public NestedNameSpecifier getQualifier() {
		return qualifier;
	}

	public String getIdentifier() {
		return name;
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
		return visitor.visitDependentName(this);
	}

	static TypeProfile profile(ElaboratedTypeKeyword keyword, NestedNameSpecifier qualifier, String name) {
		return new TypeProfile().addValue(TypeClass.DEPENDENT_NAME).addValue(keyword).addPointer(qualifier).addValue(name);
	}

	@Override
	TypeProfile profile() {
		return profile(getKeyword(), qualifier, name);
	}

	@Override
	public String toString() {
		return keywordPrefix() + qualifier + name;
	}
}
