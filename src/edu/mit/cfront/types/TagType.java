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

import edu.mit.cfront.ast.TagDecl;

/**
 * The base of record and enum types.  The node holds whichever declaration
 * it was created for; {@link #getDecl()} resolves it to the most useful
 * redeclaration each time it's called, since a definition may appear after
 * the type was first formed.
 */
public abstract class TagType extends Type {
	private final TagDecl decl;

	TagType(TypeFactory factory, TypeClass typeClass, TagDecl decl, QualType canon) {
		super(factory, typeClass, canon, decl.isDependentType(), decl.isDependentType(), false, false);
		this.decl = decl;
	}

	/**
	 * Finds the redeclaration that is a complete definition or is being
	 * defined, falling back to the given declaration.
	 * @param decl a tag declaration
	 * @return the interesting redeclaration
	 */
	static TagDecl getInterestingTagDecl(TagDecl decl) {
		for (TagDecl d : decl.redecls())
			if (d.isCompleteDefinition() || d.isBeingDefined())
				return d;
		return decl;
	}

	public TagDecl getDecl() {
		return getInterestingTagDecl(decl);
	}

	public boolean isBeingDefined() {
		return getDecl().isBeingDefined();
	}

	@Override
	public final boolean isSugared() {
		return false;
	}

	@Override
	public final QualType desugar() {
		return asQualType();
	}

	static TypeProfile profile(TypeClass typeClass, TagDecl decl) {
		return new TypeProfile().addValue(typeClass).addPointer(decl);
	}

	@Override
	final TypeProfile profile() {
		return profile(getTypeClass(), decl);
	}

	@Override
	public String toString() {
		TagDecl d = getDecl();
		String name = d.getName();
		return d.getTagKind().name().toLowerCase() + " " + (name != null && !name.isEmpty() ? name : "(anonymous)");
	}
}
