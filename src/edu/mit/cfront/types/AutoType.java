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
 * {@code auto}, {@code decltype(auto)} or {@code __auto_type}.
 */
public final class AutoType extends DeducedType {
	private final AutoTypeKeyword keyword;

	AutoType(TypeFactory factory, QualType deducedAsType, AutoTypeKeyword keyword, boolean deducedAsDependent) {
		super(factory, TypeClass.AUTO, deducedAsType, deducedAsDependent, deducedAsDependent, false);
		this.keyword = keyword;
	}

	public AutoTypeKeyword getKeyword() {
		return keyword;
	}

	public boolean isDecltypeAuto() {
		return keyword == AutoTypeKeyword.DECLTYPE_AUTO;
	}

	public boolean isGNUAutoType() {
		return keyword == AutoTypeKeyword.GNU_AUTO_TYPE;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitAuto(this);
	}

	static TypeProfile profile(QualType deducedAsType, AutoTypeKeyword keyword, boolean deducedAsDependent) {
		return new TypeProfile().addValue(TypeClass.AUTO).addQualType(deducedAsType).addValue(keyword).addBoolean(deducedAsDependent);
	}

	@Override
	TypeProfile profile() {
		return profile(getDeducedType(), keyword, isDependentType());
	}

	@Override
	public String toString() {
		return keyword.getSpelling();
	}
}
