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
 * The result of substituting a template argument for a template type
 * parameter.  Sugar for the replacement type that remembers which
 * parameter it replaced.
 */
public final class SubstTemplateTypeParmType extends Type {
	private final TemplateTypeParmType replaced;
	private final QualType replacement;

	SubstTemplateTypeParmType(TypeFactory factory, TemplateTypeParmType replaced, QualType replacement) {
		super(factory, TypeClass.SUBST_TEMPLATE_TYPE_PARM, replacement.getCanonicalType(),
				replacement.getTypePtr().isDependentType(),
				replacement.getTypePtr().isInstantiationDependentType(),
				replacement.getTypePtr().isVariablyModifiedType(),
				replacement.getTypePtr().containsUnexpandedParameterPack());
		this.replaced = replaced;
		this.replacement = replacement;
	}

	public TemplateTypeParmType getReplacedParameter() {
		return replaced;
	}

	public QualType getReplacementType() {
		return replacement;
	}

	@Override
	public boolean isSugared() {
		return true;
	}

	@Override
	public QualType desugar() {
		return replacement;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitSubstTemplateTypeParm(this);
	}

	static TypeProfile profile(TemplateTypeParmType replaced, QualType replacement) {
		return new TypeProfile().addValue(TypeClass.SUBST_TEMPLATE_TYPE_PARM).addPointer(replaced).addQualType(replacement);
	}

	@Override
	TypeProfile profile() {
		return profile(replaced, replacement);
	}

	@Override
	public String toString() {
		return replacement.toString();
	}
}
