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
import static com.google.common.base.Preconditions.checkState;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import edu.mit.cfront.ast.Expr;
import java.math.BigInteger;
import java.util.List;

/**
 * A template argument: a type, an integral value, an expression, a
 * template name, or a pack of arguments.
 */
public final class TemplateArgument {
	public enum Kind {
		TYPE, INTEGRAL, EXPRESSION, TEMPLATE, PACK;
	}

	private final Kind kind;
	private final QualType type;
	private final BigInteger value;
	private final Expr expr;
	private final TemplateName template;
	private final ImmutableList<TemplateArgument> pack;

	private TemplateArgument(Kind kind, QualType type, BigInteger value, Expr expr, TemplateName template, ImmutableList<TemplateArgument> pack) {
		this.kind = kind;
		this.type = type;
		this.value = value;
		this.expr = expr;
		this.template = template;
		this.pack = pack;
	}

	public static TemplateArgument ofType(QualType type) {
		return new TemplateArgument(Kind.TYPE, checkNotNull(type), null, null, null, null);
	}

	/**
	 * Creates an integral argument.
	 * @param value the value
	 * @param type the argument's integral type
	 * @return the argument
	 */
	public static TemplateArgument ofIntegral(BigInteger value, QualType type) {
		return new TemplateArgument(Kind.INTEGRAL, checkNotNull(type), checkNotNull(value), null, null, null);
	}

	public static TemplateArgument ofExpr(Expr expr) {
		return new TemplateArgument(Kind.EXPRESSION, null, null, checkNotNull(expr), null, null);
	}

	public static TemplateArgument ofTemplate(TemplateName template) {
		return new TemplateArgument(Kind.TEMPLATE, null, null, null, checkNotNull(template), null);
	}

	public static TemplateArgument ofPack(List<TemplateArgument> args) {
		return new TemplateArgument(Kind.PACK, null, null, null, null, ImmutableList.copyOf(args));
	}

	public Kind getKind() {
		return kind;
	}

	public QualType getAsType() {
		checkState(kind == Kind.TYPE, "not a type argument: %s", this);
		return type;
	}

	public BigInteger getAsIntegral() {
		checkState(kind == Kind.INTEGRAL, "not an integral argument: %s", this);
		return value;
	}

	public QualType getIntegralType() {
		checkState(kind == Kind.INTEGRAL, "not an integral argument: %s", this);
		return type;
	}

	public Expr getAsExpr() {
		checkState(kind == Kind.EXPRESSION, "not an expression argument: %s", this);
		return expr;
	}

	public TemplateName getAsTemplate() {
		checkState(kind == Kind.TEMPLATE, "not a template argument: %s", this);
		return template;
	}

	public ImmutableList<TemplateArgument> getPackElements() {
		checkState(kind == Kind.PACK, "not a pack: %s", this);
		return pack;
	}

	/**
	 * Returns true if this argument depends on a template parameter.
	 * @return true if this argument is dependent
	 */
	public boolean isDependent() {
		switch (kind) {
			case TYPE:
				return type.getTypePtr().isDependentType() || type.getTypePtr() instanceof PackExpansionType;
			case INTEGRAL:
				return false;
			case EXPRESSION:
				return expr.isTypeDependent() || expr.isValueDependent();
			case TEMPLATE:
				return template.isDependent();
			case PACK:
				for (TemplateArgument a : pack)
					if (a.isDependent())
						return true;
				return false;
			default:
				throw new AssertionError(kind);
		}
	}

	public boolean isInstantiationDependent() {
		switch (kind) {
			case TYPE:
				return type.getTypePtr().isInstantiationDependentType();
			case INTEGRAL:
				return false;
			case EXPRESSION:
				return expr.isInstantiationDependent();
			case TEMPLATE:
				return template.isInstantiationDependent();
			case PACK:
				for (TemplateArgument a : pack)
					if (a.isInstantiationDependent())
						return true;
				return false;
			default:
				throw new AssertionError(kind);
		}
	}

	public boolean containsUnexpandedParameterPack() {
		switch (kind) {
			case TYPE:
				return type.getTypePtr().containsUnexpandedParameterPack();
			case INTEGRAL:
				return false;
			case EXPRESSION:
				return expr.containsUnexpandedParameterPack();
			case TEMPLATE:
				return template.containsUnexpandedParameterPack();
			case PACK:
				for (TemplateArgument a : pack)
					if (a.containsUnexpandedParameterPack())
						return true;
				return false;
			default:
				throw new AssertionError(kind);
		}
	}

	void profile(TypeProfile p) {
		p.addValue(kind);
		switch (kind) {
			case TYPE:
				p.addQualType(type);
				break;
			case INTEGRAL:
				p.addValue(value).addQualType(type);
				break;
			case EXPRESSION:
				expr.profile(p);
				break;
			case TEMPLATE:
				template.profile(p);
				break;
			case PACK:
				p.addInteger(pack.size());
				for (TemplateArgument a : pack)
					a.profile(p);
				break;
			default:
				throw new AssertionError(kind);
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final TemplateArgument other = (TemplateArgument)obj;
		if (kind != other.kind)
			return false;
		if (type == null ? other.type != null : !type.equals(other.type))
			return false;
		if (value == null ? other.value != null : !value.equals(other.value))
			return false;
		if (expr != other.expr)
			return false;
		if (template == null ? other.template != null : !template.equals(other.template))
			return false;
		return pack == null ? other.pack == null : pack.equals(other.pack);
	}

	@Override
	public int hashCode() {
		int hash = 3;
		hash = 79 * hash + kind.hashCode();
		hash = 79 * hash + (type != null ? type.hashCode() : 0);
		hash = 79 * hash + (value != null ? value.hashCode() : 0);
		hash = 79 * hash + System.identityHashCode(expr);
		hash = 79 * hash + (template != null ? template.hashCode() : 0);
		hash = 79 * hash + (pack != null ? pack.hashCode() : 0);
		return hash;
	}

	@Override
	public String toString() {
		switch (kind) {
			case TYPE:
				return type.toString();
			case INTEGRAL:
				return value.toString();
			case EXPRESSION:
				return expr.toString();
			case TEMPLATE:
				return template.toString();
			case PACK:
				return "<" + Joiner.on(", ").join(pack) + ">";
			default:
				throw new AssertionError(kind);
		}
	}
}
