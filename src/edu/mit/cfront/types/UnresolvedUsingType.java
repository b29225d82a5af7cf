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

import edu.mit.cfront.ast.UnresolvedUsingTypenameDecl;

/**
 * A type named by an unresolved {@code using typename} declaration in a
 * template.
 */
public final class UnresolvedUsingType extends Type {
	private final UnresolvedUsingTypenameDecl decl;

	UnresolvedUsingType(TypeFactory factory, UnresolvedUsingTypenameDecl decl) {
		super(factory, TypeClass.UNRESOLVED_USING, null, true, true, false, false);
		this.decl = decl;
	}

	public UnresolvedUsingTypenameDecl getDecl() {
		return decl;
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
		return visitor.visitUnresolvedUsing(this);
	}

	static TypeProfile profile(UnresolvedUsingTypenameDecl decl) {
		return new TypeProfile().addValue(TypeClass.UNRESOLVED_USING).addPointer(decl);
	}

	@Override
	TypeProfile profile() {
		return profile(decl);
	}

	@Override
	public String toString() {
		return decl.getName();
	}
}
