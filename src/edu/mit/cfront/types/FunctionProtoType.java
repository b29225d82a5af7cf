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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import edu.mit.cfront.ast.Expr;
import edu.mit.cfront.ast.FunctionDecl;
import java.math.BigInteger;
import java.util.List;

/**
 * A function type with a prototype: parameter types, variadic-ness, and the
 * C++ parts (method qualifiers, ref-qualifier, exception specification,
 * trailing return) plus Checked C bounds annotations and type variables.
 */
public final class FunctionProtoType extends FunctionType {
	/**
	 * The result of evaluating a {@code noexcept} specification.
	 */
	public enum NoexceptResult {
		/**
		 * There is no noexcept specifier.
		 */
		NO_NOEXCEPT,
		/**
		 * The noexcept expression is missing.
		 */
		BAD_NOEXCEPT,
		/**
		 * The noexcept expression is value-dependent.
		 */
		DEPENDENT,
		/**
		 * The noexcept expression evaluates to false.
		 */
		THROW,
		/**
		 * The specifier is plain noexcept, or the expression evaluates to
		 * true.
		 */
		NOTHROW;
	}

	/**
	 * An exception specification: its kind, plus the exception types, the
	 * noexcept expression or the declarations to resolve it from, as the
	 * kind requires.
	 */
	public static final class ExceptionSpecInfo {
		public static final ExceptionSpecInfo NONE = new ExceptionSpecInfo(ExceptionSpecificationType.NONE, ImmutableList.<QualType>of(), null, null, null);
		private final ExceptionSpecificationType type;
		private final ImmutableList<QualType> exceptions;
		private final Expr noexceptExpr;
		private final FunctionDecl sourceDecl;
		private final FunctionDecl sourceTemplate;

		private ExceptionSpecInfo(ExceptionSpecificationType type, ImmutableList<QualType> exceptions,
				Expr noexceptExpr, FunctionDecl sourceDecl, FunctionDecl sourceTemplate) {
			this.type = type;
			this.exceptions = exceptions;
			this.noexceptExpr = noexceptExpr;
			this.sourceDecl = sourceDecl;
			this.sourceTemplate = sourceTemplate;
		}

		/**
		 * Creates a specification of a kind that carries no payload.
		 * @param type the kind
		 * @return the specification
		 */
		public static ExceptionSpecInfo of(ExceptionSpecificationType type) {
			checkArgument(type != ExceptionSpecificationType.DYNAMIC && type != ExceptionSpecificationType.COMPUTED_NOEXCEPT
					&& type != ExceptionSpecificationType.UNEVALUATED && type != ExceptionSpecificationType.UNINSTANTIATED,
					"%s needs a payload", type);
			if (type == ExceptionSpecificationType.NONE)
				return NONE;
			return new ExceptionSpecInfo(type, ImmutableList.<QualType>of(), null, null, null);
		}
		public static ExceptionSpecInfo dynamic(List<QualType> exceptions) {
			return new ExceptionSpecInfo(ExceptionSpecificationType.DYNAMIC, ImmutableList.copyOf(exceptions), null, null, null);
		}
		public static ExceptionSpecInfo computedNoexcept(Expr noexceptExpr) {
			return new ExceptionSpecInfo(ExceptionSpecificationType.COMPUTED_NOEXCEPT, ImmutableList.<QualType>of(), noexceptExpr, null, null);
		}
		public static ExceptionSpecInfo unevaluated(FunctionDecl sourceDecl) {
			return new ExceptionSpecInfo(ExceptionSpecificationType.UNEVALUATED, ImmutableList.<QualType>of(), null, checkNotNull(sourceDecl), null);
		}
		public static ExceptionSpecInfo uninstantiated(FunctionDecl sourceDecl, FunctionDecl sourceTemplate) {
			return new ExceptionSpecInfo(ExceptionSpecificationType.UNINSTANTIATED, ImmutableList.<QualType>of(), null, checkNotNull(sourceDecl), sourceTemplate);
		}

		public ExceptionSpecificationType getType() {
			return type;
		}
		public ImmutableList<QualType> getExceptions() {
			return exceptions;
		}
		public Expr getNoexceptExpr() {
			return noexceptExpr;
		}
		public FunctionDecl getSourceDecl() {
			return sourceDecl;
		}
		public FunctionDecl getSourceTemplate() {
			return sourceTemplate;
		}

		void profile(TypeProfile p) {
			p.addValue(type);
			switch (type) {
				case DYNAMIC:
					p.addInteger(exceptions.size());
					for (QualType ex : exceptions)
						p.addQualType(ex);
					break;
				case COMPUTED_NOEXCEPT:
					if (noexceptExpr != null)
						noexceptExpr.profile(p);
					else
						p.addPointer(null);
					break;
				case UNINSTANTIATED:
				case UNEVALUATED:
					p.addPointer(sourceDecl);
					break;
				default:
					break;
			}
		}

		@Override
		public boolean equals(Object obj) {
			if (obj == null)
				return false;
			if (getClass() != obj.getClass())
				return false;
			final ExceptionSpecInfo other = (ExceptionSpecInfo)obj;
			if (type != other.type)
				return false;
			if (!exceptions.equals(other.exceptions))
				return false;
			return noexceptExpr == other.noexceptExpr && sourceDecl == other.sourceDecl
					&& sourceTemplate == other.sourceTemplate;
		}

		@Override
		public int hashCode() {
			int hash = 7;
			hash = 53 * hash + type.hashCode();
			hash = 53 * hash + exceptions.hashCode();
			hash = 53 * hash + System.identityHashCode(noexceptExpr);
			hash = 53 * hash + System.identityHashCode(sourceDecl);
			return hash;
		}

		@Override
		public String toString() {
			switch (type) {
				case DYNAMIC_NONE:
					return " throw()";
				case DYNAMIC:
					return " throw(" + Joiner.on(", ").join(exceptions) + ")";
				case MS_ANY:
					return " throw(...)";
				case BASIC_NOEXCEPT:
					return " noexcept";
				case COMPUTED_NOEXCEPT:
					return " noexcept(" + noexceptExpr + ")";
				default:
					return "";
			}
		}
	}

	/**
	 * Everything about a prototype other than its return and parameter
	 * types.
	 */
	public static final class ExtProtoInfo {
		public static final ExtProtoInfo DEFAULT = new ExtProtoInfo(ExtInfo.DEFAULT, false, false, 0,
				RefQualifierKind.NONE, ExceptionSpecInfo.NONE, null, BoundsAnnotations.EMPTY, 0);
		private final ExtInfo extInfo;
		private final boolean variadic;
		private final boolean hasTrailingReturn;
		private final int typeQuals;
		private final RefQualifierKind refQualifier;
		private final ExceptionSpecInfo exceptionSpec;
		private final ImmutableList<BoundsAnnotations> paramAnnots;
		private final BoundsAnnotations returnAnnots;
		private final int numTypeVars;

		private ExtProtoInfo(ExtInfo extInfo, boolean variadic, boolean hasTrailingReturn, int typeQuals,
				RefQualifierKind refQualifier, ExceptionSpecInfo exceptionSpec,
				ImmutableList<BoundsAnnotations> paramAnnots, BoundsAnnotations returnAnnots, int numTypeVars) {
			this.extInfo = checkNotNull(extInfo);
			this.variadic = variadic;
			this.hasTrailingReturn = hasTrailingReturn;
			this.typeQuals = typeQuals;
			this.refQualifier = checkNotNull(refQualifier);
			this.exceptionSpec = checkNotNull(exceptionSpec);
			this.paramAnnots = paramAnnots;
			this.returnAnnots = checkNotNull(returnAnnots);
			this.numTypeVars = numTypeVars;
		}

		public ExtInfo getExtInfo() {
			return extInfo;
		}
		public boolean isVariadic() {
			return variadic;
		}
		public boolean hasTrailingReturn() {
			return hasTrailingReturn;
		}
		public int getTypeQuals() {
			return typeQuals;
		}
		public RefQualifierKind getRefQualifier() {
			return refQualifier;
		}
		public ExceptionSpecInfo getExceptionSpec() {
			return exceptionSpec;
		}
		/**
		 * Returns the per-parameter bounds annotations, or null if no
		 * parameter has any.
		 * @return the parameter annotations, or null
		 */
		public ImmutableList<BoundsAnnotations> getParamAnnots() {
			return paramAnnots;
		}
		public BoundsAnnotations getReturnAnnots() {
			return returnAnnots;
		}
		public int getNumTypeVars() {
			return numTypeVars;
		}

		public ExtProtoInfo withExtInfo(ExtInfo extInfo) {
			return new ExtProtoInfo(extInfo, variadic, hasTrailingReturn, typeQuals, refQualifier, exceptionSpec, paramAnnots, returnAnnots, numTypeVars);
		}
		public ExtProtoInfo withVariadic(boolean variadic) {
			return new ExtProtoInfo(extInfo, variadic, hasTrailingReturn, typeQuals, refQualifier, exceptionSpec, paramAnnots, returnAnnots, numTypeVars);
		}
		public ExtProtoInfo withTrailingReturn(boolean hasTrailingReturn) {
			return new ExtProtoInfo(extInfo, variadic, hasTrailingReturn, typeQuals, refQualifier, exceptionSpec, paramAnnots, returnAnnots, numTypeVars);
		}
		public ExtProtoInfo withTypeQuals(int typeQuals) {
			return new ExtProtoInfo(extInfo, variadic, hasTrailingReturn, typeQuals, refQualifier, exceptionSpec, paramAnnots, returnAnnots, numTypeVars);
		}
		public ExtProtoInfo withRefQualifier(RefQualifierKind refQualifier) {
			return new ExtProtoInfo(extInfo, variadic, hasTrailingReturn, typeQuals, refQualifier, exceptionSpec, paramAnnots, returnAnnots, numTypeVars);
		}
		public ExtProtoInfo withExceptionSpec(ExceptionSpecInfo exceptionSpec) {
			return new ExtProtoInfo(extInfo, variadic, hasTrailingReturn, typeQuals, refQualifier, exceptionSpec, paramAnnots, returnAnnots, numTypeVars);
		}
		public ExtProtoInfo withParamAnnots(List<BoundsAnnotations> paramAnnots) {
			return new ExtProtoInfo(extInfo, variadic, hasTrailingReturn, typeQuals, refQualifier, exceptionSpec,
					paramAnnots != null ? ImmutableList.copyOf(paramAnnots) : null, returnAnnots, numTypeVars);
		}
		public ExtProtoInfo withReturnAnnots(BoundsAnnotations returnAnnots) {
			return new ExtProtoInfo(extInfo, variadic, hasTrailingReturn, typeQuals, refQualifier, exceptionSpec, paramAnnots, returnAnnots, numTypeVars);
		}
		public ExtProtoInfo withNumTypeVars(int numTypeVars) {
			return new ExtProtoInfo(extInfo, variadic, hasTrailingReturn, typeQuals, refQualifier, exceptionSpec, paramAnnots, returnAnnots, numTypeVars);
		}
	}

	private final ImmutableList<QualType> paramTypes;
	private final ExtProtoInfo epi;

	FunctionProtoType(TypeFactory factory, QualType returnType, List<QualType> paramTypes, QualType canon, ExtProtoInfo epi) {
		super(factory, TypeClass.FUNCTION_PROTO, returnType, canon, epi.getExtInfo());
		this.paramTypes = ImmutableList.copyOf(paramTypes);
		this.epi = epi;
		checkArgument(epi.getParamAnnots() == null || epi.getParamAnnots().size() == this.paramTypes.size(),
				"%s parameter annotations for %s parameters", epi.getParamAnnots() == null ? 0 : epi.getParamAnnots().size(), this.paramTypes.size());

		for (QualType p : this.paramTypes) {
			Type t = p.getTypePtr();
			if (t.isDependentType())
				setDependent();
			else if (t.isInstantiationDependentType())
				setInstantiationDependent();
			if (t.containsUnexpandedParameterPack())
				setContainsUnexpandedParameterPack();
		}

		ExceptionSpecInfo esi = epi.getExceptionSpec();
		if (esi.getType() == ExceptionSpecificationType.DYNAMIC) {
			//A dependent dynamic exception specification doesn't make the
			//type dependent before C++17.
			for (QualType ex : esi.getExceptions()) {
				if (ex.getTypePtr().isInstantiationDependentType())
					setInstantiationDependent();
				if (ex.getTypePtr().containsUnexpandedParameterPack())
					setContainsUnexpandedParameterPack();
			}
		} else if (esi.getType() == ExceptionSpecificationType.COMPUTED_NOEXCEPT && esi.getNoexceptExpr() != null) {
			Expr e = esi.getNoexceptExpr();
			if (e.isValueDependent() || e.isInstantiationDependent())
				setInstantiationDependent();
			if (e.containsUnexpandedParameterPack())
				setContainsUnexpandedParameterPack();
		}

		//A canonical prototype only keeps these specifications when they're
		//dependent, and then the type is dependent.
		if (isCanonicalUnqualified()) {
			if (esi.getType() == ExceptionSpecificationType.DYNAMIC
					|| esi.getType() == ExceptionSpecificationType.COMPUTED_NOEXCEPT) {
				assert hasDependentExceptionSpec() : "type should not be canonical";
				setDependent();
			}
		} else if (getCanonicalTypeInternal().getTypePtr().isDependentType())
			setDependent();
	}

	public int getNumParams() {
		return paramTypes.size();
	}

	public QualType getParamType(int i) {
		return paramTypes.get(i);
	}

	public ImmutableList<QualType> getParamTypes() {
		return paramTypes;
	}

	public ExtProtoInfo getExtProtoInfo() {
		return epi;
	}

	public boolean hasParamAnnots() {
		return epi.getParamAnnots() != null;
	}

	/**
	 * Returns the bounds annotations of the given parameter.
	 * @param i the parameter index
	 * @return the annotations, possibly empty
	 */
	public BoundsAnnotations getParamAnnots(int i) {
		if (epi.getParamAnnots() == null)
			return BoundsAnnotations.EMPTY;
		return epi.getParamAnnots().get(i);
	}

	public BoundsAnnotations getReturnAnnots() {
		return epi.getReturnAnnots();
	}

	public int getNumTypeVars() {
		return epi.getNumTypeVars();
	}

	/**
	 * Returns true if this is a Checked C generic function type.
	 * @return true if this function has type variables
	 */
	public boolean isGenericFunction() {
		return epi.getNumTypeVars() > 0;
	}

	public boolean isVariadic() {
		return epi.isVariadic();
	}

	/**
	 * Returns true if the last parameter is a pack expansion, making this a
	 * variadic template function type.
	 * @return true if this is template-variadic
	 */
	public boolean isTemplateVariadic() {
		for (int i = paramTypes.size(); i > 0; --i)
			if (paramTypes.get(i - 1).getTypePtr() instanceof PackExpansionType)
				return true;
		return false;
	}

	public boolean hasTrailingReturn() {
		return epi.hasTrailingReturn();
	}

	public Qualifiers getTypeQuals() {
		return Qualifiers.fromCVRUMask(epi.getTypeQuals());
	}

	public boolean isConst() {
		return (epi.getTypeQuals() & Qualifiers.CONST) != 0;
	}
	public boolean isVolatile() {
		return (epi.getTypeQuals() & Qualifiers.VOLATILE) != 0;
	}
	public boolean isRestrict() {
		return (epi.getTypeQuals() & Qualifiers.RESTRICT) != 0;
	}

	public RefQualifierKind getRefQualifier() {
		return epi.getRefQualifier();
	}

	public ExceptionSpecificationType getExceptionSpecType() {
		return epi.getExceptionSpec().getType();
	}

	public boolean hasExceptionSpec() {
		return getExceptionSpecType() != ExceptionSpecificationType.NONE;
	}

	public boolean hasDynamicExceptionSpec() {
		return getExceptionSpecType().isDynamicExceptionSpec();
	}

	public boolean hasNoexceptExceptionSpec() {
		return getExceptionSpecType().isNoexceptExceptionSpec();
	}

	public int getNumExceptions() {
		return epi.getExceptionSpec().getExceptions().size();
	}

	public QualType getExceptionType(int i) {
		return epi.getExceptionSpec().getExceptions().get(i);
	}

	public ImmutableList<QualType> exceptions() {
		return epi.getExceptionSpec().getExceptions();
	}

	/**
	 * Returns the noexcept expression, if the specification is a computed
	 * noexcept.
	 * @return the expression, or null
	 */
	public Expr getNoexceptExpr() {
		if (getExceptionSpecType() != ExceptionSpecificationType.COMPUTED_NOEXCEPT)
			return null;
		return epi.getExceptionSpec().getNoexceptExpr();
	}

	/**
	 * Returns the function whose exception specification this one will be
	 * resolved from, for unevaluated and uninstantiated specifications.
	 * @return the source declaration, or null
	 */
	public FunctionDecl getExceptionSpecDecl() {
		return getExceptionSpecType().isUnresolvedExceptionSpec() ? epi.getExceptionSpec().getSourceDecl() : null;
	}

	public FunctionDecl getExceptionSpecTemplate() {
		if (getExceptionSpecType() != ExceptionSpecificationType.UNINSTANTIATED)
			return null;
		return epi.getExceptionSpec().getSourceTemplate();
	}

	/**
	 * Returns true if the exception specification depends on a template
	 * parameter, either through a value-dependent noexcept expression or a
	 * dependent (or pack expansion) exception type.
	 * @return true if the exception specification is dependent
	 */
	public boolean hasDependentExceptionSpec() {
		Expr ne = getNoexceptExpr();
		if (ne != null)
			return ne.isValueDependent();
		for (QualType et : exceptions())
			//A pack expansion is dependent even if its pattern isn't, since it
			//might expand to nothing.
			if (et.getTypePtr().isDependentType() || et.getTypePtr().getAs(PackExpansionType.class) != null)
				return true;
		return false;
	}

	public boolean hasInstantiationDependentExceptionSpec() {
		Expr ne = getNoexceptExpr();
		if (ne != null)
			return ne.isInstantiationDependent();
		for (QualType et : exceptions())
			if (et.getTypePtr().isInstantiationDependentType())
				return true;
		return false;
	}

	/**
	 * Evaluates the noexcept specification.
	 * @return the result
	 * @throws IllegalStateException if the noexcept expression is not a
	 * constant
	 */
	public NoexceptResult getNoexceptSpec() {
		ExceptionSpecificationType est = getExceptionSpecType();
		if (est == ExceptionSpecificationType.BASIC_NOEXCEPT)
			return NoexceptResult.NOTHROW;
		if (est != ExceptionSpecificationType.COMPUTED_NOEXCEPT)
			return NoexceptResult.NO_NOEXCEPT;
		Expr noexceptExpr = getNoexceptExpr();
		if (noexceptExpr == null)
			return NoexceptResult.BAD_NOEXCEPT;
		if (noexceptExpr.isValueDependent())
			return NoexceptResult.DEPENDENT;
		BigInteger value = noexceptExpr.evaluateAsInteger();
		checkState(value != null, "noexcept expression %s is not a constant", noexceptExpr);
		return value.signum() != 0 ? NoexceptResult.NOTHROW : NoexceptResult.THROW;
	}

	/**
	 * Determines whether a function of this type can throw.  Unresolved
	 * specifications must be resolved first.
	 * @return whether this function can throw
	 */
	public CanThrowResult canThrow() {
		ExceptionSpecificationType est = getExceptionSpecType();
		assert est != ExceptionSpecificationType.UNEVALUATED && est != ExceptionSpecificationType.UNINSTANTIATED : est;
		if (est == ExceptionSpecificationType.DYNAMIC_NONE || est == ExceptionSpecificationType.BASIC_NOEXCEPT)
			return CanThrowResult.CANNOT;
		if (est == ExceptionSpecificationType.DYNAMIC) {
			//Throwing unless every exception type is a pack expansion.
			for (QualType et : exceptions())
				if (et.getTypePtr().getAs(PackExpansionType.class) == null)
					return CanThrowResult.CAN;
			return CanThrowResult.DEPENDENT;
		}
		if (est != ExceptionSpecificationType.COMPUTED_NOEXCEPT)
			return CanThrowResult.CAN;
		NoexceptResult nr = getNoexceptSpec();
		if (nr == NoexceptResult.DEPENDENT)
			return CanThrowResult.DEPENDENT;
		return nr == NoexceptResult.NOTHROW ? CanThrowResult.CANNOT : CanThrowResult.CAN;
	}

	/**
	 * Returns true if a function of this type cannot throw.
	 * @param resultIfDependent the answer for a dependent specification
	 * @return true if this function is nothrow
	 */
	public boolean isNothrow(boolean resultIfDependent) {
		CanThrowResult ct = canThrow();
		if (ct == CanThrowResult.DEPENDENT)
			return resultIfDependent;
		return ct == CanThrowResult.CANNOT;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitFunctionProto(this);
	}

	static TypeProfile profile(QualType returnType, List<QualType> paramTypes, ExtProtoInfo epi) {
		TypeProfile p = new TypeProfile().addValue(TypeClass.FUNCTION_PROTO).addQualType(returnType);
		p.addInteger(paramTypes.size());
		for (QualType param : paramTypes)
			p.addQualType(param);
		p.addBoolean(epi.isVariadic()).addInteger(epi.getTypeQuals()).addValue(epi.getRefQualifier());
		epi.getExceptionSpec().profile(p);
		p.addBoolean(epi.getParamAnnots() != null);
		if (epi.getParamAnnots() != null)
			for (BoundsAnnotations ba : epi.getParamAnnots())
				ba.profile(p);
		epi.getReturnAnnots().profile(p);
		return p.addValue(epi.getExtInfo()).addBoolean(epi.hasTrailingReturn()).addInteger(epi.getNumTypeVars());
	}

	@Override
	TypeProfile profile() {
		return profile(getReturnType(), paramTypes, epi);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		if (epi.getNumTypeVars() > 0)
			sb.append("_For_any(").append(epi.getNumTypeVars()).append(") ");
		if (hasTrailingReturn())
			sb.append("auto (");
		else
			sb.append(getReturnType()).append(" (");
		sb.append(Joiner.on(", ").join(paramTypes));
		if (isVariadic())
			sb.append(paramTypes.isEmpty() ? "..." : ", ...");
		sb.append(')');
		if (epi.getTypeQuals() != 0)
			sb.append(' ').append(getTypeQuals());
		if (getRefQualifier() == RefQualifierKind.LVALUE)
			sb.append(" &");
		else if (getRefQualifier() == RefQualifierKind.RVALUE)
			sb.append(" &&");
		sb.append(epi.getExceptionSpec());
		if (hasTrailingReturn())
			sb.append(" -> ").append(getReturnType());
		sb.append(getExtInfo());
		return sb.toString();
	}
}
