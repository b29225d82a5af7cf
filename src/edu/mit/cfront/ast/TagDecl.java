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
package edu.mit.cfront.ast;

import java.util.List;

/**
 * A struct, union, class, interface or enum declaration.
 * <p>
 * A tag may be declared several times; {@link #redecls()} returns the whole
 * chain, and each member answers for its own declaration only.
 */
public interface TagDecl extends NamedDecl {
	public TagTypeKind getTagKind();

	/**
	 * Returns true if this declaration is a definition whose body has been
	 * completely parsed.
	 * @return true if this is a complete definition
	 */
	public boolean isCompleteDefinition();

	/**
	 * Returns true if this declaration is a definition currently being
	 * parsed.
	 * @return true if this definition is in progress
	 */
	public boolean isBeingDefined();

	/**
	 * Returns true if this tag is declared within a template and depends on
	 * its parameters.
	 * @return true if this tag is dependent
	 */
	public boolean isDependentType();

	/**
	 * Returns true if this tag has a name usable for linkage purposes, either
	 * its own or one from a typedef naming an anonymous tag.
	 * @return true if this tag has a name for linkage
	 */
	public boolean hasNameForLinkage();

	/**
	 * Returns all declarations of this entity, including this one, in
	 * declaration order.
	 * @return the redeclaration chain
	 */
	public List<? extends TagDecl> redecls();

	public default boolean isStruct() {
		return getTagKind() == TagTypeKind.STRUCT;
	}
	public default boolean isInterface() {
		return getTagKind() == TagTypeKind.INTERFACE;
	}
	public default boolean isClass() {
		return getTagKind() == TagTypeKind.CLASS;
	}
	public default boolean isUnion() {
		return getTagKind() == TagTypeKind.UNION;
	}
	public default boolean isEnum() {
		return getTagKind() == TagTypeKind.ENUM;
	}
}
