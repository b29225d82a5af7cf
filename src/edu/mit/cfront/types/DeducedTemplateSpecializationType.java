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
 * A C++17 class template name used as a type whose template arguments are
 * deduced from an initializer ({@code std::pair p(1, 2)}).
 */
public final class DeducedTemplateSpecializationType extends DeducedType {
	private final TemplateName template;

	DeducedTemplateSpecializationType(TypeFactory factory, TemplateName template, QualType deducedAsType,
			boolean deducedAsDependent) {
		super(factory, TypeClass.DEDUCED_TEMPLATE_SPECIALIZATION, deducedAsType,
				deducedAsDependent || template.isDependent(),
				deducedAsDependent || template.isInstantiationDependent(),
				template.containsUnexpandedParameterPack());
		this.template = template;
	}

	public TemplateName getTemplateName() {
		return template;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitDeducedTemplateSpecialization(this);
	}

	static TypeProfile profile(TemplateName template, QualType deducedAsType, boolean deducedAsDependent) {
		TypeProfile p = new TypeProfile().addValue(TypeClass.DEDUCED_TEMPLATE_SPECIALIZATION);
		template.profile(p);
		return p.addQualType(deducedAsType).addBoolean(deducedAsDependent);
	}

	@Override
	TypeProfile profile() {
		return profile(template, getDeducedType(), isDependentType());
	}

	@Override
	public String toString() {
		return template.toString();
	}
}
