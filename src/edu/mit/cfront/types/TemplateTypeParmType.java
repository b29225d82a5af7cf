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

import edu.mit.cfront.ast.TemplateTypeParmDecl;

/**
 * A template type parameter ({@code T} in {@code template<typename T>}).
 * The canonical form is identified by depth and index only; sugared forms
 * also carry the declaration, and hence the name.
 */
public final class TemplateTypeParmType extends Type {
	private final int depth;
	private final int index;
	private final boolean parameterPack;
	private final TemplateTypeParmDecl decl;

	TemplateTypeParmType(TypeFactory factory, int depth, int index, boolean parameterPack,
			TemplateTypeParmDecl decl, QualType canon) {
		super(factory, TypeClass.TEMPLATE_TYPE_PARM, canon, true, true, false, parameterPack);
		this.depth = depth;
		this.index = index;
		this.parameterPack = parameterPack;
		this.decl = decl;
		assert (canon == null) == (decl == null) : "canonical parameters have no declaration";
	}

	public int getDepth() {
		return depth;
	}

	public int getIndex() {
		return index;
	}

	public boolean isParameterPack() {
		return parameterPack;
	}

	public TemplateTypeParmDecl getDecl() {
		return decl;
	}

	/**
	 * Returns the parameter's name, or null for the canonical form.
	 * @return the name, or null
	 */
	public String getIdentifier() {
		return isCanonicalUnqualified() ? null : decl.getName();
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
		return visitor.visitTemplateTypeParm(this);
	}

	static TypeProfile profile(int depth, int index, boolean parameterPack, TemplateTypeParmDecl decl) {
		return new TypeProfile().addValue(TypeClass.TEMPLATE_TYPE_PARM).addInteger(depth).addInteger(index)
				.addBoolean(parameterPack).addPointer(decl);
	}

	@Override
	TypeProfile profile() {
		return profile(depth, index, parameterPack, decl);
	}

	@Override
	public String toString() {
		String id = getIdentifier();
		return id != null ? id : "type-parameter-" + depth + "-" + index;
	}
}
