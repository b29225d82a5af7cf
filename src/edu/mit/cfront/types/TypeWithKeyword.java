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

import edu.mit.cfront.ast.TagTypeKind;

/**
 * The base of type names that may be written with an elaborated type
 * keyword.
 */
public abstract class TypeWithKeyword extends Type {
	private final ElaboratedTypeKeyword keyword;

	TypeWithKeyword(TypeFactory factory, TypeClass typeClass, ElaboratedTypeKeyword keyword, QualType canon,
			boolean dependent, boolean instantiationDependent, boolean variablyModified, boolean containsUnexpandedParameterPack) {
		super(factory, typeClass, canon, dependent, instantiationDependent, variablyModified, containsUnexpandedParameterPack);
		this.keyword = keyword;
	}

	public ElaboratedTypeKeyword getKeyword() {
		return keyword;
	}

	public static ElaboratedTypeKeyword getKeywordForTagTypeKind(TagTypeKind kind) {
		switch (kind) {
			case CLASS: return ElaboratedTypeKeyword.CLASS;
			case STRUCT: return ElaboratedTypeKeyword.STRUCT;
			case INTERFACE: return ElaboratedTypeKeyword.INTERFACE;
			case UNION: return ElaboratedTypeKeyword.UNION;
			case ENUM: return ElaboratedTypeKeyword.ENUM;
			default:
				throw new AssertionError(kind);
		}
	}

	/**
	 * Converts a tag keyword to its tag kind.
	 * @param keyword a tag keyword
	 * @return the tag kind
	 * @throws IllegalArgumentException if the keyword isn't a tag keyword
	 */
	public static TagTypeKind getTagTypeKindForKeyword(ElaboratedTypeKeyword keyword) {
		switch (keyword) {
			case CLASS: return TagTypeKind.CLASS;
			case STRUCT: return TagTypeKind.STRUCT;
			case INTERFACE: return TagTypeKind.INTERFACE;
			case UNION: return TagTypeKind.UNION;
			case ENUM: return TagTypeKind.ENUM;
			default:
				throw new IllegalArgumentException(keyword + " is not a tag keyword");
		}
	}

	public static boolean keywordIsTagTypeKind(ElaboratedTypeKeyword keyword) {
		return keyword != ElaboratedTypeKeyword.NONE && keyword != ElaboratedTypeKeyword.TYPENAME;
	}

	public static String getKeywordName(ElaboratedTypeKeyword keyword) {
		return keyword.getSpelling();
	}

	String keywordPrefix() {
		return keyword == ElaboratedTypeKeyword.NONE ? "" : keyword.getSpelling() + " ";
	}
}
