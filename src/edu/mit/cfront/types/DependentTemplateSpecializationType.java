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
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import edu.mit.cfront.ast.NestedNameSpecifier;
import java.util.List;

/**
 * A template specialization whose template is a name in a dependent scope
 * ({@code typename T::template apply<U>}).
 */
public final class DependentTemplateSpecializationType extends TypeWithKeyword {
	private final NestedNameSpecifier qualifier;
	private final String name;
	private final ImmutableList<TemplateArgument> args;

	DependentTemplateSpecializationType(TypeFactory factory, ElaboratedTypeKeyword keyword,
			NestedNameSpecifier qualifier, String name, List<TemplateArgument> args, QualType canon) {
		super(factory, TypeClass.DEPENDENT_TEMPLATE_SPECIALIZATION, keyword, canon, true, true, false,
				qualifier != null && qualifier.containsUnexpandedParameterPack());
		this.qualifier = qualifier;
		this.name = checkNotNull(name);
		this.args = ImmutableList.copyOf(args);
		for (TemplateArgument arg : this.args)
			if (arg.containsUnexpandedParameterPack())
				setContainsUnexpandedParameterPack();
	}

	public NestedNameSpecifier getQualifier() {
		return qualifier;
	}

	public String getIdentifier() {
		return name;
	}

	public ImmutableList<TemplateArgument> getArgs() {
		return args;
	}

	public int getNumArgs() {
		return args.size();
	}

	public TemplateArgument getArg(int i) {
		return args.get(i);
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
		return visitor.visitDependentTemplateSpecialization(this);
	}

	static TypeProfile profile(ElaboratedTypeKeyword keyword, NestedNameSpecifier qualifier, String name,
			List<TemplateArgument> args) {
		TypeProfile p = new TypeProfile().addValue(TypeClass.DEPENDENT_TEMPLATE_SPECIALIZATION)
				.addValue(keyword).addPointer(qualifier).addValue(name).addInteger(args.size());
		for (TemplateArgument arg : args)
			arg.profile(p);
		return p;
	}

	@Override
	TypeProfile profile() {
		return profile(getKeyword(), qualifier, name, args);
	}

	@Override
	public String toString() {
		return keywordPrefix() + (qualifier != null ? qualifier.toString() : "") + "template " + name
				+ "<" + Joiner.on(", ").join(args) + ">";
	}
}
