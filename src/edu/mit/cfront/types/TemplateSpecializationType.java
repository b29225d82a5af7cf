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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A named template specialization ({@code vector<int>}).  Sugar for the
 * specialized class type, or for the aliased type of an alias template;
 * when the specialization is dependent and not an alias, the node is
 * canonical.
 */
public final class TemplateSpecializationType extends Type {
	private final TemplateName template;
	private final ImmutableList<TemplateArgument> args;
	private final QualType aliasedType;

	/**
	 * Creates a specialization.
	 * @param canon the canonical type, or null if this is a canonical
	 * dependent specialization
	 * @param aliasedType the aliased type for an alias template
	 * specialization, or null
	 */
	TemplateSpecializationType(TypeFactory factory, TemplateName template, List<TemplateArgument> args,
			QualType canon, QualType aliasedType) {
		super(factory, TypeClass.TEMPLATE_SPECIALIZATION, canon,
				canon == null || canon.getTypePtr().isDependentType(),
				canon == null || canon.getTypePtr().isInstantiationDependentType(),
				false,
				template.containsUnexpandedParameterPack());
		this.template = template;
		this.args = ImmutableList.copyOf(args);
		this.aliasedType = aliasedType;
		for (TemplateArgument arg : this.args) {
			//An alias specialization may be non-dependent even if an argument
			//is, but it still involves the argument.
			if (arg.isInstantiationDependent())
				setInstantiationDependent();
			if (arg.getKind() == TemplateArgument.Kind.TYPE && arg.getAsType().getTypePtr().isVariablyModifiedType())
				setVariablyModified();
			if (arg.containsUnexpandedParameterPack())
				setContainsUnexpandedParameterPack();
		}
	}

	/**
	 * Returns true if any of the arguments is dependent.
	 * @param args the arguments
	 * @return true if an argument is dependent
	 */
	public static boolean anyDependentTemplateArguments(List<TemplateArgument> args) {
		for (TemplateArgument arg : args)
			if (arg.isDependent())
				return true;
		return false;
	}

	public static boolean anyInstantiationDependentTemplateArguments(List<TemplateArgument> args) {
		for (TemplateArgument arg : args)
			if (arg.isInstantiationDependent())
				return true;
		return false;
	}

	public TemplateName getTemplateName() {
		return template;
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

	public boolean isTypeAlias() {
		return aliasedType != null;
	}

	/**
	 * Returns the type this alias template specialization names.
	 * @return the aliased type
	 */
	public QualType getAliasedType() {
		assert isTypeAlias() : "not a type alias template specialization";
		return aliasedType;
	}

	/**
	 * Returns true if this names the current instantiation of the class
	 * template it appears in.
	 * @return true if the canonical type is an injected class name
	 */
	public boolean isCurrentInstantiation() {
		return getCanonicalTypeInternal().getTypePtr() instanceof InjectedClassNameType;
	}

	@Override
	public boolean isSugared() {
		return !isDependentType() || isCurrentInstantiation() || isTypeAlias();
	}

	@Override
	public QualType desugar() {
		if (isTypeAlias())
			return aliasedType;
		return getCanonicalTypeInternal();
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitTemplateSpecialization(this);
	}

	static TypeProfile profile(TemplateName template, List<TemplateArgument> args, QualType canon, QualType aliasedType) {
		TypeProfile p = new TypeProfile().addValue(TypeClass.TEMPLATE_SPECIALIZATION);
		template.profile(p);
		p.addInteger(args.size());
		for (TemplateArgument arg : args)
			arg.profile(p);
		return p.addQualType(canon).addQualType(aliasedType);
	}

	@Override
	TypeProfile profile() {
		return profile(template, args, isCanonicalUnqualified() ? null : getCanonicalTypeInternal(), aliasedType);
	}

	@Override
	public String toString() {
		return template + "<" + Joiner.on(", ").join(args) + ">";
	}
}
