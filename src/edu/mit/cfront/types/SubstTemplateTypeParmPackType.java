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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A template type parameter pack that has been substituted with an
 * argument pack but not yet expanded.
 */
public final class SubstTemplateTypeParmPackType extends Type {
	private final TemplateTypeParmType replaced;
	private final TemplateArgument argumentPack;

	SubstTemplateTypeParmPackType(TypeFactory factory, TemplateTypeParmType replaced, QualType canon, TemplateArgument argumentPack) {
		super(factory, TypeClass.SUBST_TEMPLATE_TYPE_PARM_PACK, canon, true, true, false, true);
		checkArgument(argumentPack.getKind() == TemplateArgument.Kind.PACK, "not a pack: %s", argumentPack);
		this.replaced = replaced;
		this.argumentPack = argumentPack;
	}

	public TemplateTypeParmType getReplacedParameter() {
		return replaced;
	}

	public TemplateArgument getArgumentPack() {
		return argumentPack;
	}

	public int getNumArgs() {
		return argumentPack.getPackElements().size();
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
		return visitor.visitSubstTemplateTypeParmPack(this);
	}

	static TypeProfile profile(TemplateTypeParmType replaced, TemplateArgument argumentPack) {
		TypeProfile p = new TypeProfile().addValue(TypeClass.SUBST_TEMPLATE_TYPE_PARM_PACK).addPointer(replaced);
		p.addInteger(argumentPack.getPackElements().size());
		for (TemplateArgument a : argumentPack.getPackElements())
			p.addQualType(a.getAsType());
		return p;
	}

	@Override
	TypeProfile profile() {
		return profile(replaced, argumentPack);
	}

	@Override
	public String toString() {
		return replaced.toString();
	}
}
