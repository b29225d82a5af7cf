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
import edu.mit.cfront.ast.AttrKind;
import edu.mit.cfront.ast.CXXRecordDecl;
import edu.mit.cfront.ast.DeclContext;
import edu.mit.cfront.ast.EnumDecl;
import edu.mit.cfront.ast.FieldDecl;
import edu.mit.cfront.ast.ObjCInterfaceDecl;
import edu.mit.cfront.ast.ObjCProtocolDecl;
import edu.mit.cfront.ast.RecordDecl;
import edu.mit.cfront.ast.TagDecl;
import edu.mit.cfront.ast.TemplateDecl;
import edu.mit.cfront.basic.Linkage;
import edu.mit.cfront.basic.LinkageInfo;
import java.util.List;

/**
 * A node in the type graph.  Nodes are created and owned by a
 * {@link TypeFactory}; canonical nodes are interned, so two canonical nodes
 * denote the same type iff they're the same object.
 * <p>
 * Every node has a canonical type, which is itself if the node is canonical.
 * Sugar nodes (typedefs, parens, elaborated names and so on) preserve how a
 * type was written and desugar toward the canonical type.  Most predicates
 * here look at the canonical type and so ignore sugar.
 */
public abstract class Type {
	/**
	 * The broad categories of scalar types, for conversions.
	 */
	public enum ScalarTypeKind {
		CPOINTER, BLOCK_POINTER, OBJC_OBJECT_POINTER, MEMBER_POINTER,
		BOOL, INTEGRAL, FLOATING, INTEGRAL_COMPLEX, FLOATING_COMPLEX;
	}

	private final TypeFactory factory;
	private final TypeClass typeClass;
	private final QualType self;
	private final QualType canonicalType;
	private boolean dependent;
	private boolean instantiationDependent;
	private boolean variablyModified;
	private boolean containsUnexpandedParameterPack;
	private final LinkageCache linkageCache = new LinkageCache();

	/**
	 * Creates a node.
	 * @param factory the owning factory
	 * @param typeClass this node's class
	 * @param canon the canonical type, or null if this node is canonical
	 * @param dependent whether this type depends on a template parameter
	 * @param instantiationDependent whether this type somehow involves a
	 * template parameter (implied by dependent)
	 * @param variablyModified whether this type involves a variable-length
	 * array
	 * @param containsUnexpandedParameterPack whether this type names a
	 * parameter pack outside of a pack expansion
	 */
	Type(TypeFactory factory, TypeClass typeClass, QualType canon, boolean dependent,
			boolean instantiationDependent, boolean variablyModified, boolean containsUnexpandedParameterPack) {
		this.factory = checkNotNull(factory);
		this.typeClass = checkNotNull(typeClass);
		this.self = new QualType(this, Qualifiers.NONE);
		this.canonicalType = canon != null ? canon : self;
		this.dependent = dependent;
		this.instantiationDependent = dependent || instantiationDependent;
		this.variablyModified = variablyModified;
		this.containsUnexpandedParameterPack = containsUnexpandedParameterPack;
	}

	void setDependent() {
		dependent = true;
		instantiationDependent = true;
	}
	void setInstantiationDependent() {
		instantiationDependent = true;
	}
	void setVariablyModified() {
		variablyModified = true;
	}
	void setContainsUnexpandedParameterPack() {
		containsUnexpandedParameterPack = true;
	}

	/**
	 * Propagates the four dependence flags of a component type into this
	 * node.  Dependent components make this node dependent.
	 * @param component a component type
	 */
	void inheritFlags(QualType component) {
		Type t = component.getTypePtr();
		if (t.isDependentType())
			setDependent();
		else if (t.isInstantiationDependentType())
			setInstantiationDependent();
		if (t.isVariablyModifiedType())
			setVariablyModified();
		if (t.containsUnexpandedParameterPack())
			setContainsUnexpandedParameterPack();
	}

	public final TypeFactory getTypeFactory() {
		return factory;
	}

	public final TypeClass getTypeClass() {
		return typeClass;
	}

	public final String getTypeClassName() {
		return typeClass.getName();
	}

	/**
	 * Returns this node with no qualifiers.
	 * @return this node as a QualType
	 */
	public final QualType asQualType() {
		return self;
	}

	/**
	 * Returns the canonical type of this node, which may carry qualifiers
	 * (e.g. the canonical type of a typedef of {@code const int}).
	 * @return the canonical type
	 */
	public final QualType getCanonicalTypeInternal() {
		return canonicalType;
	}

	/**
	 * Returns true if this node is its own canonical type.
	 * @return true if this node is canonical
	 */
	public final boolean isCanonicalUnqualified() {
		return canonicalType.getTypePtr() == this;
	}

	public final boolean isDependentType() {
		return dependent;
	}
	public final boolean isInstantiationDependentType() {
		return instantiationDependent;
	}
	public final boolean isVariablyModifiedType() {
		return variablyModified;
	}
	public final boolean containsUnexpandedParameterPack() {
		return containsUnexpandedParameterPack;
	}

	/**
	 * Returns true if this node is sugar for some other type.
	 * @return true if this node desugars
	 */
	public abstract boolean isSugared();

	/**
	 * Removes one layer of sugar.  Non-sugar nodes return themselves.
	 * @return the desugared type
	 */
	public abstract QualType desugar();

	public abstract <R> R accept(TypeVisitor<R> visitor);

	/**
	 * Returns the structural key under which this node is interned.
	 * @return the profile
	 */
	abstract TypeProfile profile();

	public final QualType getLocallyUnqualifiedSingleStepDesugaredType() {
		if (!isSugared())
			return self;
		return desugar();
	}

	/**
	 * Strips all sugar and qualifiers, returning a node of the same class as
	 * the canonical type.
	 * @return the desugared node
	 */
	public final Type getUnqualifiedDesugaredType() {
		Type cur = this;
		while (cur.isSugared())
			cur = cur.desugar().getTypePtr();
		return cur;
	}

	/**
	 * Views this type as the given node class, looking through sugar.  For
	 * sugar classes ({@link TypedefType}, {@link TemplateSpecializationType}
	 * and {@link AttributedType}) the outermost such sugar node is returned.
	 * @param <T> the node class
	 * @param klass the node class
	 * @return this type as a T, or null if it isn't one
	 */
	public final <T extends Type> T getAs(Class<T> klass) {
		if (klass.isInstance(this))
			return klass.cast(this);
		if (klass == TypedefType.class || klass == TemplateSpecializationType.class || klass == AttributedType.class)
			return getAsSugar(klass);
		if (!klass.isInstance(canonicalType.getTypePtr()))
			return null;
		return klass.cast(getUnqualifiedDesugaredType());
	}

	private <T extends Type> T getAsSugar(Class<T> klass) {
		Type cur = this;
		while (true) {
			if (klass.isInstance(cur))
				return klass.cast(cur);
			if (!cur.isSugared())
				return null;
			cur = cur.desugar().getTypePtr();
		}
	}

	/**
	 * Like {@link #getAs(Class)}, but the caller asserts this type is a T.
	 * @param <T> the node class
	 * @param klass the node class
	 * @return this type as a T
	 * @throws IllegalStateException if this type isn't a T
	 */
	public final <T extends Type> T castAs(Class<T> klass) {
		checkState(klass.isInstance(canonicalType.getTypePtr()), "%s is not a %s", this, klass.getSimpleName());
		if (klass.isInstance(this))
			return klass.cast(this);
		return klass.cast(getUnqualifiedDesugaredType());
	}

	/**
	 * Views this type as an array type, discarding any qualifiers.  Use
	 * {@link TypeFactory#getAsArrayType(QualType)} to keep them.
	 * @return the array type, or null
	 */
	public final ArrayType getAsArrayTypeUnsafe() {
		return getAs(ArrayType.class);
	}

	public final ArrayType castAsArrayTypeUnsafe() {
		return castAs(ArrayType.class);
	}

	/**
	 * Strips array types to the innermost element type, discarding
	 * qualifiers.
	 * @return the base element node
	 */
	public final Type getBaseElementTypeUnsafe() {
		Type type = this;
		ArrayType array;
		while ((array = type.getAsArrayTypeUnsafe()) != null)
			type = array.getElementType().getTypePtr();
		return type;
	}

	public final Type getArrayElementTypeNoTypeQual() {
		ArrayType array = getAsArrayTypeUnsafe();
		return array != null ? array.getElementType().getTypePtr() : null;
	}

	public final Type getPointeeOrArrayElementType() {
		if (isAnyPointerType())
			return getPointeeType().getTypePtr();
		if (isArrayType())
			return getBaseElementTypeUnsafe();
		return this;
	}

	/**
	 * Returns the pointee of a pointer, block pointer, reference, member
	 * pointer, Objective-C object pointer or decayed type.
	 * @return the pointee, or null if this isn't a pointer-like type
	 */
	public QualType getPointeeType() {
		PointerType pt = getAs(PointerType.class);
		if (pt != null)
			return pt.getPointeeType();
		ObjCObjectPointerType opt = getAs(ObjCObjectPointerType.class);
		if (opt != null)
			return opt.getPointeeType();
		BlockPointerType bpt = getAs(BlockPointerType.class);
		if (bpt != null)
			return bpt.getPointeeType();
		ReferenceType rt = getAs(ReferenceType.class);
		if (rt != null)
			return rt.getPointeeType();
		MemberPointerType mpt = getAs(MemberPointerType.class);
		if (mpt != null)
			return mpt.getPointeeType();
		DecayedType dt = getAs(DecayedType.class);
		if (dt != null)
			return dt.getPointeeType();
		return null;
	}

	private Type canon() {
		return canonicalType.getTypePtr();
	}

	private BuiltinType.Kind canonicalBuiltinKind() {
		Type c = canon();
		return c instanceof BuiltinType ? ((BuiltinType)c).getKind() : null;
	}

	private EnumDecl canonicalEnumDecl() {
		Type c = canon();
		return c instanceof EnumType ? ((EnumType)c).getDecl() : null;
	}

	private static boolean inRange(BuiltinType.Kind k, BuiltinType.Kind lo, BuiltinType.Kind hi) {
		return k != null && k.compareTo(lo) >= 0 && k.compareTo(hi) <= 0;
	}

	//<editor-fold defaultstate="collapsed" desc="Builtin families">
	public final boolean isBuiltinType() {
		return canon() instanceof BuiltinType;
	}

	public final boolean isSpecificBuiltinType(BuiltinType.Kind kind) {
		BuiltinType bt = getAs(BuiltinType.class);
		return bt != null && bt.getKind() == kind;
	}

	/**
	 * Returns true if this is a placeholder for an expression whose type
	 * isn't known yet (overload sets, bound members and the like).  Looks at
	 * this node only, not through sugar.
	 * @return true if this is a placeholder type
	 */
	public boolean isPlaceholderType() {
		return this instanceof BuiltinType && ((BuiltinType)this).isPlaceholderType();
	}

	public final BuiltinType getAsPlaceholderType() {
		return isPlaceholderType() ? (BuiltinType)this : null;
	}

	public final boolean isSpecificPlaceholderType(BuiltinType.Kind kind) {
		return isPlaceholderType() && ((BuiltinType)this).getKind() == kind;
	}

	public boolean isNonOverloadPlaceholderType() {
		return this instanceof BuiltinType && ((BuiltinType)this).isNonOverloadPlaceholderType();
	}

	public final boolean isVoidType() {
		return canonicalBuiltinKind() == BuiltinType.Kind.VOID;
	}
	public final boolean isBooleanType() {
		return canonicalBuiltinKind() == BuiltinType.Kind.BOOL;
	}
	public final boolean isNullPtrType() {
		return canonicalBuiltinKind() == BuiltinType.Kind.NULLPTR;
	}
	public final boolean isHalfType() {
		return canonicalBuiltinKind() == BuiltinType.Kind.HALF;
	}
	public final boolean isFloat16Type() {
		return canonicalBuiltinKind() == BuiltinType.Kind.FLOAT16;
	}
	public final boolean isFloat128Type() {
		return canonicalBuiltinKind() == BuiltinType.Kind.FLOAT128;
	}

	public final boolean isCharType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		return k == BuiltinType.Kind.CHAR_U || k == BuiltinType.Kind.UCHAR
				|| k == BuiltinType.Kind.CHAR_S || k == BuiltinType.Kind.SCHAR;
	}
	public final boolean isWideCharType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		return k == BuiltinType.Kind.WCHAR_S || k == BuiltinType.Kind.WCHAR_U;
	}
	public final boolean isChar16Type() {
		return canonicalBuiltinKind() == BuiltinType.Kind.CHAR16;
	}
	public final boolean isChar32Type() {
		return canonicalBuiltinKind() == BuiltinType.Kind.CHAR32;
	}

	/**
	 * Returns true if this is any of the character types, including wide and
	 * Unicode characters.
	 * @return true if this is a character type
	 */
	public final boolean isAnyCharacterType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k == null)
			return false;
		switch (k) {
			case CHAR_U:
			case UCHAR:
			case WCHAR_U:
			case CHAR16:
			case CHAR32:
			case CHAR_S:
			case SCHAR:
			case WCHAR_S:
				return true;
			default:
				return false;
		}
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Integer and floating families">
	/**
	 * Returns true if this is an integer type in the C sense: a builtin
	 * integer type or a complete unscoped enumeration.
	 * @return true if this is an integer type
	 */
	public final boolean isIntegerType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k != null)
			return inRange(k, BuiltinType.Kind.BOOL, BuiltinType.Kind.INT128);
		EnumDecl ed = canonicalEnumDecl();
		return ed != null && ed.isComplete() && !ed.isScoped();
	}

	/**
	 * Returns true if this is an integral type: a builtin integer type, or in
	 * C (where "integer type" includes enumerations) a complete enumeration.
	 * @return true if this is an integral type
	 */
	public final boolean isIntegralType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k != null)
			return inRange(k, BuiltinType.Kind.BOOL, BuiltinType.Kind.INT128);
		if (!factory.getLangOpts().isCPlusPlus()) {
			EnumDecl ed = canonicalEnumDecl();
			if (ed != null)
				return ed.isComplete();
		}
		return false;
	}

	public final boolean isIntegralOrEnumerationType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k != null)
			return inRange(k, BuiltinType.Kind.BOOL, BuiltinType.Kind.INT128);
		EnumDecl ed = canonicalEnumDecl();
		return ed != null && ed.isComplete();
	}

	public final boolean isIntegralOrUnscopedEnumerationType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k != null)
			return inRange(k, BuiltinType.Kind.BOOL, BuiltinType.Kind.INT128);
		EnumDecl ed = canonicalEnumDecl();
		return ed != null && ed.isComplete() && !ed.isScoped();
	}

	public final boolean isEnumeralType() {
		return canon() instanceof EnumType;
	}

	public final boolean isScopedEnumeralType() {
		EnumDecl ed = canonicalEnumDecl();
		return ed != null && ed.isScoped();
	}

	/**
	 * Returns true if this is a signed integer type, or a complete unscoped
	 * enumeration whose underlying type is signed.
	 * @return true if this is a signed integer type
	 */
	public final boolean isSignedIntegerType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k != null)
			return inRange(k, BuiltinType.Kind.CHAR_S, BuiltinType.Kind.INT128);
		EnumDecl ed = canonicalEnumDecl();
		if (ed != null && ed.isComplete() && !ed.isScoped())
			return ed.getIntegerType().getTypePtr().isSignedIntegerType();
		return false;
	}

	public final boolean isSignedIntegerOrEnumerationType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k != null)
			return inRange(k, BuiltinType.Kind.CHAR_S, BuiltinType.Kind.INT128);
		EnumDecl ed = canonicalEnumDecl();
		if (ed != null && ed.isComplete())
			return ed.getIntegerType().getTypePtr().isSignedIntegerType();
		return false;
	}

	/**
	 * Returns true if this is an unsigned integer type (bool included), or a
	 * complete unscoped enumeration whose underlying type is unsigned.
	 * @return true if this is an unsigned integer type
	 */
	public final boolean isUnsignedIntegerType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k != null)
			return inRange(k, BuiltinType.Kind.BOOL, BuiltinType.Kind.UINT128);
		EnumDecl ed = canonicalEnumDecl();
		if (ed != null && ed.isComplete() && !ed.isScoped())
			return ed.getIntegerType().getTypePtr().isUnsignedIntegerType();
		return false;
	}

	public final boolean isUnsignedIntegerOrEnumerationType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k != null)
			return inRange(k, BuiltinType.Kind.BOOL, BuiltinType.Kind.UINT128);
		EnumDecl ed = canonicalEnumDecl();
		if (ed != null && ed.isComplete())
			return ed.getIntegerType().getTypePtr().isUnsignedIntegerType();
		return false;
	}

	public final boolean hasIntegerRepresentation() {
		if (canon() instanceof VectorType)
			return ((VectorType)canon()).getElementType().getTypePtr().isIntegerType();
		return isIntegerType();
	}
	public final boolean hasSignedIntegerRepresentation() {
		if (canon() instanceof VectorType)
			return ((VectorType)canon()).getElementType().getTypePtr().isSignedIntegerOrEnumerationType();
		return isSignedIntegerOrEnumerationType();
	}
	public final boolean hasUnsignedIntegerRepresentation() {
		if (canon() instanceof VectorType)
			return ((VectorType)canon()).getElementType().getTypePtr().isUnsignedIntegerOrEnumerationType();
		return isUnsignedIntegerOrEnumerationType();
	}
	public final boolean hasFloatingRepresentation() {
		if (canon() instanceof VectorType)
			return ((VectorType)canon()).getElementType().getTypePtr().isFloatingType();
		return isFloatingType();
	}

	/**
	 * Returns true if this is a real or complex floating type.
	 * @return true if this is a floating type
	 */
	public final boolean isFloatingType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k != null)
			return inRange(k, BuiltinType.Kind.HALF, BuiltinType.Kind.FLOAT128);
		if (canon() instanceof ComplexType)
			return ((ComplexType)canon()).getElementType().getTypePtr().isFloatingType();
		return false;
	}

	public final boolean isRealFloatingType() {
		return inRange(canonicalBuiltinKind(), BuiltinType.Kind.HALF, BuiltinType.Kind.FLOAT128);
	}

	public final boolean isRealType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k != null)
			return inRange(k, BuiltinType.Kind.BOOL, BuiltinType.Kind.FLOAT128);
		EnumDecl ed = canonicalEnumDecl();
		return ed != null && ed.isComplete() && !ed.isScoped();
	}

	/**
	 * Returns true if this is an arithmetic type: a builtin integer or
	 * floating type, a complete unscoped enumeration, or a complex type.
	 * @return true if this is an arithmetic type
	 */
	public final boolean isArithmeticType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k != null)
			return inRange(k, BuiltinType.Kind.BOOL, BuiltinType.Kind.FLOAT128);
		EnumDecl ed = canonicalEnumDecl();
		if (ed != null)
			return !ed.isScoped() && ed.isComplete();
		return canon() instanceof ComplexType;
	}

	public final boolean isComplexType() {
		if (canon() instanceof ComplexType)
			return ((ComplexType)canon()).getElementType().getTypePtr().isFloatingType();
		return false;
	}

	public final boolean isAnyComplexType() {
		return canon() instanceof ComplexType;
	}

	public final boolean isComplexIntegerType() {
		return getAsComplexIntegerType() != null;
	}

	/**
	 * Returns this type as a complex type with an integer element type (a
	 * GCC extension).
	 * @return the complex type, or null
	 */
	public final ComplexType getAsComplexIntegerType() {
		ComplexType ct = getAs(ComplexType.class);
		if (ct != null && ct.getElementType().getTypePtr().isIntegerType())
			return ct;
		return null;
	}

	/**
	 * Returns true if this is a small integer type that is promoted to int in
	 * arithmetic, or an unscoped enumeration with a known promotion type.
	 * @return true if this type is subject to integer promotion
	 */
	public final boolean isPromotableIntegerType() {
		BuiltinType bt = getAs(BuiltinType.class);
		if (bt != null) {
			switch (bt.getKind()) {
				case BOOL:
				case CHAR_S:
				case CHAR_U:
				case SCHAR:
				case UCHAR:
				case SHORT:
				case USHORT:
				case WCHAR_S:
				case WCHAR_U:
				case CHAR16:
				case CHAR32:
					return true;
				default:
					return false;
			}
		}
		EnumType et = getAs(EnumType.class);
		if (et != null)
			return !isDependentType() && et.getDecl().getPromotionType() != null && !et.getDecl().isScoped();
		return false;
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Scalar, aggregate and object types">
	/**
	 * Returns true if this is a scalar type: an arithmetic type other than a
	 * placeholder, a pointer-like type, or a complete enumeration.
	 * @return true if this is a scalar type
	 */
	public final boolean isScalarType() {
		BuiltinType.Kind k = canonicalBuiltinKind();
		if (k != null)
			return k.compareTo(BuiltinType.Kind.VOID) > 0 && k.compareTo(BuiltinType.Kind.NULLPTR) <= 0;
		EnumDecl ed = canonicalEnumDecl();
		if (ed != null)
			return ed.isComplete();
		Type c = canon();
		return c instanceof PointerType || c instanceof BlockPointerType || c instanceof MemberPointerType
				|| c instanceof ComplexType || c instanceof ObjCObjectPointerType;
	}

	/**
	 * Classifies a scalar type.
	 * @return the scalar type kind
	 */
	public final ScalarTypeKind getScalarTypeKind() {
		assert isScalarType() : this;
		Type t = canon();
		if (t instanceof BuiltinType) {
			BuiltinType bt = (BuiltinType)t;
			if (bt.getKind() == BuiltinType.Kind.BOOL)
				return ScalarTypeKind.BOOL;
			if (bt.getKind() == BuiltinType.Kind.NULLPTR)
				return ScalarTypeKind.CPOINTER;
			if (bt.isInteger())
				return ScalarTypeKind.INTEGRAL;
			if (bt.isFloatingPoint())
				return ScalarTypeKind.FLOATING;
			throw new AssertionError("unknown scalar builtin type " + bt);
		} else if (t instanceof PointerType)
			return ScalarTypeKind.CPOINTER;
		else if (t instanceof BlockPointerType)
			return ScalarTypeKind.BLOCK_POINTER;
		else if (t instanceof ObjCObjectPointerType)
			return ScalarTypeKind.OBJC_OBJECT_POINTER;
		else if (t instanceof MemberPointerType)
			return ScalarTypeKind.MEMBER_POINTER;
		else if (t instanceof EnumType) {
			assert ((EnumType)t).getDecl().isComplete() : t;
			return ScalarTypeKind.INTEGRAL;
		} else if (t instanceof ComplexType) {
			if (((ComplexType)t).getElementType().getTypePtr().isRealFloatingType())
				return ScalarTypeKind.FLOATING_COMPLEX;
			return ScalarTypeKind.INTEGRAL_COMPLEX;
		}
		throw new AssertionError("unknown scalar type " + this);
	}

	/**
	 * Returns true if this is an aggregate: an array, a C struct or union, or
	 * a C++ class the record says is an aggregate.
	 * @return true if this is an aggregate type
	 */
	public final boolean isAggregateType() {
		Type c = canon();
		if (c instanceof RecordType) {
			RecordDecl rd = ((RecordType)c).getDecl();
			if (rd instanceof CXXRecordDecl)
				return ((CXXRecordDecl)rd).isAggregate();
			return true;
		}
		return c instanceof ArrayType;
	}

	/**
	 * Returns true if this type's size is a compile-time constant.  Only
	 * meaningful for complete, non-dependent types.
	 * @return true if this is not a variable-length array
	 */
	public final boolean isConstantSizeType() {
		assert !isIncompleteType() : "incomplete type " + this;
		assert !isDependentType() : "dependent type " + this;
		return !(canon() instanceof VariableArrayType);
	}

	/**
	 * Returns true if this type can describe objects but lacks the
	 * information needed to determine their size: void, forward-declared
	 * tags and interfaces, arrays of unknown bound or of incomplete
	 * elements, and (in the Microsoft ABI) member pointers into classes
	 * without an inheritance model.
	 * @return true if this type is incomplete
	 */
	public final boolean isIncompleteType() {
		Type c = canon();
		switch (c.getTypeClass()) {
			case BUILTIN:
				return isVoidType();
			case TYPE_VARIABLE:
				//Type variables are treated like void.
				return true;
			case ENUM: {
				EnumDecl ed = ((EnumType)c).getDecl();
				if (ed.isFixed())
					return false;
				return !ed.isCompleteDefinition();
			}
			case RECORD:
				return !((RecordType)c).getDecl().isCompleteDefinition();
			case CONSTANT_ARRAY:
				return ((ArrayType)c).getElementType().getTypePtr().isIncompleteType();
			case INCOMPLETE_ARRAY:
				return true;
			case MEMBER_POINTER: {
				Type cls = ((MemberPointerType)c).getClassType();
				if (cls.isDependentType())
					return false;
				if (!factory.getTargetLayout().isMicrosoftABI())
					return false;
				CXXRecordDecl rd = cls.getAsCXXRecordDecl();
				if (rd == null)
					return false;
				//The inheritance attribute might only be on the most recent declaration.
				return !rd.getMostRecentDecl().hasAttr(AttrKind.MS_INHERITANCE);
			}
			case OBJC_OBJECT:
				return ((ObjCObjectType)c).getBaseType().getTypePtr().isIncompleteType();
			case OBJC_INTERFACE:
				return !((ObjCInterfaceType)c).getDecl().hasDefinition();
			default:
				return false;
		}
	}

	public final boolean isIncompleteOrObjectType() {
		return !isFunctionType();
	}

	/**
	 * Returns true if this is an object type: not a function, reference or
	 * void.
	 * @return true if this is an object type
	 */
	public final boolean isObjectType() {
		return !isReferenceType() && !isFunctionType() && !isVoidType();
	}

	public final boolean isLiteralType() {
		return TypeClassifier.isLiteralType(this);
	}

	public final boolean isStandardLayoutType() {
		return TypeClassifier.isStandardLayoutType(this);
	}

	public final boolean isOverloadableType() {
		return isDependentType() || isRecordType() || isEnumeralType();
	}

	public final boolean hasPointerRepresentation() {
		return isPointerType() || isReferenceType() || isBlockPointerType() || isObjCObjectPointerType() || isNullPtrType();
	}

	public final boolean hasObjCPointerRepresentation() {
		return isObjCObjectPointerType();
	}

	/**
	 * Returns true if this node (not its canonical type) is one a type
	 * specifier can name directly.
	 * @return true if this is a specifier type
	 */
	public final boolean isSpecifierType() {
		switch (typeClass) {
			case BUILTIN:
			case RECORD:
			case ENUM:
			case TYPEDEF:
			case COMPLEX:
			case TYPE_OF_EXPR:
			case TYPE_OF:
			case TEMPLATE_TYPE_PARM:
			case SUBST_TEMPLATE_TYPE_PARM:
			case TEMPLATE_SPECIALIZATION:
			case ELABORATED:
			case DEPENDENT_NAME:
			case DEPENDENT_TEMPLATE_SPECIALIZATION:
			case OBJC_INTERFACE:
			case OBJC_OBJECT:
			case OBJC_OBJECT_POINTER:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Returns true if this node was written with a tag keyword
	 * ({@code struct S}, {@code enum E}, ...).
	 * @return true if this is an elaborated type specifier
	 */
	public final boolean isElaboratedTypeSpecifier() {
		if (this instanceof TypeWithKeyword && (this instanceof ElaboratedType
				|| this instanceof DependentNameType || this instanceof DependentTemplateSpecializationType))
			return TypeWithKeyword.keywordIsTagTypeKind(((TypeWithKeyword)this).getKeyword());
		return false;
	}

	public final boolean isAlignValT() {
		EnumType et = getAs(EnumType.class);
		return et != null && "align_val_t".equals(et.getDecl().getName()) && et.getDecl().isInStdNamespace();
	}

	public final boolean isStdByteType() {
		EnumType et = getAs(EnumType.class);
		return et != null && "byte".equals(et.getDecl().getName()) && et.getDecl().isInStdNamespace();
	}

	/**
	 * Returns true if this type contains a variable-length array whose size
	 * expression is known, looking through pointers and references.
	 * @return true if this type has a sized VLA
	 */
	public final boolean hasSizedVLAType() {
		if (!isVariablyModifiedType())
			return false;
		PointerType pt = getAs(PointerType.class);
		if (pt != null)
			return pt.getPointeeType().getTypePtr().hasSizedVLAType();
		ReferenceType rt = getAs(ReferenceType.class);
		if (rt != null)
			return rt.getPointeeType().getTypePtr().hasSizedVLAType();
		ArrayType at = getAsArrayTypeUnsafe();
		if (at != null) {
			if (at instanceof VariableArrayType && ((VariableArrayType)at).getSizeExpr() != null)
				return true;
			return at.getElementType().getTypePtr().hasSizedVLAType();
		}
		return false;
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Kind predicates">
	public final boolean isFunctionType() {
		return canon() instanceof FunctionType;
	}
	public final boolean isFunctionProtoType() {
		return getAs(FunctionProtoType.class) != null;
	}
	public final boolean isFunctionNoProtoType() {
		return getAs(FunctionNoProtoType.class) != null;
	}
	public final boolean isPointerType() {
		return canon() instanceof PointerType;
	}
	public final boolean isAnyPointerType() {
		return isPointerType() || isObjCObjectPointerType();
	}
	public final boolean isBlockPointerType() {
		return canon() instanceof BlockPointerType;
	}
	public final boolean isVoidPointerType() {
		PointerType pt = getAs(PointerType.class);
		return pt != null && pt.getPointeeType().getTypePtr().isVoidType();
	}
	public final boolean isReferenceType() {
		return canon() instanceof ReferenceType;
	}
	public final boolean isLValueReferenceType() {
		return canon() instanceof LValueReferenceType;
	}
	public final boolean isRValueReferenceType() {
		return canon() instanceof RValueReferenceType;
	}
	public final boolean isFunctionPointerType() {
		PointerType pt = getAs(PointerType.class);
		return pt != null && pt.getPointeeType().getTypePtr().isFunctionType();
	}
	public final boolean isMemberPointerType() {
		return canon() instanceof MemberPointerType;
	}
	public final boolean isMemberFunctionPointerType() {
		MemberPointerType mpt = getAs(MemberPointerType.class);
		return mpt != null && mpt.isMemberFunctionPointer();
	}
	public final boolean isMemberDataPointerType() {
		MemberPointerType mpt = getAs(MemberPointerType.class);
		return mpt != null && mpt.isMemberDataPointer();
	}
	public final boolean isArrayType() {
		return canon() instanceof ArrayType;
	}
	public final boolean isConstantArrayType() {
		return canon() instanceof ConstantArrayType;
	}
	public final boolean isIncompleteArrayType() {
		return canon() instanceof IncompleteArrayType;
	}
	public final boolean isVariableArrayType() {
		return canon() instanceof VariableArrayType;
	}
	public final boolean isDependentSizedArrayType() {
		return canon() instanceof DependentSizedArrayType;
	}
	public final boolean isRecordType() {
		return canon() instanceof RecordType;
	}
	public final boolean isVectorType() {
		return canon() instanceof VectorType;
	}
	public final boolean isExtVectorType() {
		return canon() instanceof ExtVectorType;
	}
	public final boolean isAtomicType() {
		return canon() instanceof AtomicType;
	}
	public final boolean isPipeType() {
		return canon() instanceof PipeType;
	}
	public final boolean isTemplateTypeParmType() {
		return canon() instanceof TemplateTypeParmType;
	}
	public final boolean isTypeVariableType() {
		return canon() instanceof TypeVariableType;
	}

	/**
	 * Returns true if this type contains an {@code auto} or deduced template
	 * specialization type that hasn't been deduced yet.
	 * @return true if this type is undeduced
	 */
	public final boolean isUndeducedType() {
		DeducedType dt = getContainedDeducedType();
		return dt != null && !dt.isDeduced();
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Record family">
	private RecordDecl recordDecl() {
		RecordType rt = getAs(RecordType.class);
		return rt != null ? rt.getDecl() : null;
	}

	public final boolean isClassType() {
		RecordDecl rd = recordDecl();
		return rd != null && rd.isClass();
	}
	public final boolean isStructureType() {
		RecordDecl rd = recordDecl();
		return rd != null && rd.isStruct();
	}
	public final boolean isInterfaceType() {
		RecordDecl rd = recordDecl();
		return rd != null && rd.isInterface();
	}
	public final boolean isUnionType() {
		RecordDecl rd = recordDecl();
		return rd != null && rd.isUnion();
	}
	public final boolean isStructureOrClassType() {
		RecordDecl rd = recordDecl();
		return rd != null && (rd.isStruct() || rd.isClass() || rd.isInterface());
	}
	public final boolean isObjCBoxableRecordType() {
		RecordDecl rd = recordDecl();
		return rd != null && rd.hasAttr(AttrKind.OBJC_BOXABLE);
	}

	public final RecordType getAsStructureType() {
		RecordType rt = getAs(RecordType.class);
		return rt != null && rt.getDecl().isStruct() ? rt : null;
	}

	public final RecordType getAsUnionType() {
		RecordType rt = getAs(RecordType.class);
		return rt != null && rt.getDecl().isUnion() ? rt : null;
	}

	/**
	 * Returns the tag declaration this type names, looking through sugar;
	 * injected class names yield their class.
	 * @return the tag declaration, or null
	 */
	public final TagDecl getAsTagDecl() {
		TagType tt = getAs(TagType.class);
		if (tt != null)
			return tt.getDecl();
		InjectedClassNameType ict = getAs(InjectedClassNameType.class);
		if (ict != null)
			return ict.getDecl();
		return null;
	}

	public final CXXRecordDecl getAsCXXRecordDecl() {
		TagDecl td = getAsTagDecl();
		return td instanceof CXXRecordDecl ? (CXXRecordDecl)td : null;
	}

	/**
	 * Returns the C++ class pointed to or referred to by this type.
	 * @return the pointee class, or null
	 */
	public final CXXRecordDecl getPointeeCXXRecordDecl() {
		QualType pointee;
		PointerType pt = getAs(PointerType.class);
		ReferenceType rt;
		if (pt != null)
			pointee = pt.getPointeeType();
		else if ((rt = getAs(ReferenceType.class)) != null)
			pointee = rt.getPointeeType();
		else
			return null;
		RecordType record = pointee.getTypePtr().getAs(RecordType.class);
		if (record != null && record.getDecl() instanceof CXXRecordDecl)
			return (CXXRecordDecl)record.getDecl();
		return null;
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Objective-C">
	public final boolean isObjCObjectPointerType() {
		return canon() instanceof ObjCObjectPointerType;
	}
	public final boolean isObjCObjectType() {
		return canon() instanceof ObjCObjectType;
	}
	public final boolean isObjCObjectOrInterfaceType() {
		return canon() instanceof ObjCObjectType;
	}

	public boolean isObjCIdType() {
		ObjCObjectPointerType opt = getAs(ObjCObjectPointerType.class);
		return opt != null && opt.isObjCIdType();
	}
	public boolean isObjCClassType() {
		ObjCObjectPointerType opt = getAs(ObjCObjectPointerType.class);
		return opt != null && opt.isObjCClassType();
	}
	public final boolean isObjCSelType() {
		PointerType pt = getAs(PointerType.class);
		return pt != null && pt.getPointeeType().getTypePtr().isSpecificBuiltinType(BuiltinType.Kind.OBJC_SEL);
	}
	public final boolean isObjCBuiltinType() {
		return isObjCIdType() || isObjCClassType() || isObjCSelType();
	}
	public boolean isObjCQualifiedIdType() {
		return getAsObjCQualifiedIdType() != null;
	}
	public boolean isObjCQualifiedClassType() {
		return getAsObjCQualifiedClassType() != null;
	}
	public final boolean isObjCQualifiedInterfaceType() {
		return getAsObjCQualifiedInterfaceType() != null;
	}

	public final ObjCObjectType getAsObjCQualifiedInterfaceType() {
		ObjCObjectType ot = getAs(ObjCObjectType.class);
		if (ot != null && ot.getNumProtocols() != 0 && ot.getInterface() != null)
			return ot;
		return null;
	}
	public final ObjCObjectPointerType getAsObjCQualifiedIdType() {
		ObjCObjectPointerType opt = getAs(ObjCObjectPointerType.class);
		return opt != null && opt.isObjCQualifiedIdType() ? opt : null;
	}
	public final ObjCObjectPointerType getAsObjCQualifiedClassType() {
		ObjCObjectPointerType opt = getAs(ObjCObjectPointerType.class);
		return opt != null && opt.isObjCQualifiedClassType() ? opt : null;
	}
	public final ObjCObjectType getAsObjCInterfaceType() {
		ObjCObjectType ot = getAs(ObjCObjectType.class);
		return ot != null && ot.getInterface() != null ? ot : null;
	}
	public final ObjCObjectPointerType getAsObjCInterfacePointerType() {
		ObjCObjectPointerType opt = getAs(ObjCObjectPointerType.class);
		return opt != null && opt.getInterfaceType() != null ? opt : null;
	}

	/**
	 * Returns the bound of an {@code id} or {@code __kindof} object pointer
	 * type.
	 * @return null if this is neither {@code id} nor a {@code __kindof}
	 * object type; the unqualified {@code id} type itself for {@code id};
	 * else the {@code __kindof}-stripped object type
	 */
	public final ObjCObjectType getObjCIdOrObjectKindOfBound() {
		ObjCObjectPointerType opt = getAs(ObjCObjectPointerType.class);
		if (opt == null)
			return null;
		if (opt.isObjCIdType())
			return opt.getObjectType();
		if (!opt.isKindOfType())
			return null;
		if (opt.isObjCClassType() || opt.isObjCQualifiedClassType())
			return null;
		return opt.getObjectType().stripObjCKindOfTypeAndQuals().getTypePtr().getAs(ObjCObjectType.class);
	}

	/**
	 * Returns true if this is {@code id} or a {@code __kindof} object
	 * pointer to something other than {@code Class}.
	 * @return true if this is id or a kindof object type
	 */
	public final boolean isObjCIdOrObjectKindOfType() {
		return getObjCIdOrObjectKindOfBound() != null;
	}

	public final boolean isObjCClassOrClassKindOfType() {
		ObjCObjectPointerType opt = getAs(ObjCObjectPointerType.class);
		if (opt == null)
			return false;
		if (opt.isObjCClassType())
			return true;
		if (!opt.isKindOfType())
			return false;
		return opt.isObjCClassType() || opt.isObjCQualifiedClassType();
	}

	/**
	 * Returns true if this type was written with the inert
	 * {@code __unsafe_unretained} attribute somewhere in its sugar.
	 * @return true if this type is inert unsafe-unretained
	 */
	public final boolean isObjCInertUnsafeUnretainedType() {
		Type cur = this;
		while (true) {
			if (cur instanceof AttributedType
					&& ((AttributedType)cur).getAttrKind() == AttributedType.Kind.OBJC_INERT_UNSAFE_UNRETAINED)
				return true;
			QualType next = cur.getLocallyUnqualifiedSingleStepDesugaredType();
			if (next.getTypePtr() == cur)
				return false;
			cur = next.getTypePtr();
		}
	}

	public final Qualifiers.ObjCLifetime getObjCARCImplicitLifetime() {
		if (isObjCARCImplicitlyUnretainedType())
			return Qualifiers.ObjCLifetime.EXPLICIT_NONE;
		return Qualifiers.ObjCLifetime.STRONG;
	}

	/**
	 * Returns true if objects of this lifetime type are implicitly
	 * unretained under ARC ({@code Class} and arrays of it).
	 * @return true if implicitly unretained
	 */
	public final boolean isObjCARCImplicitlyUnretainedType() {
		assert isObjCLifetimeType() : "cannot query implicit lifetime for " + this;
		Type c = canon();
		while (c instanceof ArrayType)
			c = ((ArrayType)c).getElementType().getTypePtr();
		if (c instanceof ObjCObjectPointerType)
			return ((ObjCObjectPointerType)c).getObjectType().isObjCClass();
		return false;
	}

	public final boolean isObjCNSObjectType() {
		Type cur = this;
		while (true) {
			if (cur instanceof TypedefType)
				return ((TypedefType)cur).getDecl().hasAttr(AttrKind.OBJC_NSOBJECT);
			QualType next = cur.getLocallyUnqualifiedSingleStepDesugaredType();
			if (next.getTypePtr() == cur)
				return false;
			cur = next.getTypePtr();
		}
	}

	public final boolean isObjCIndependentClassType() {
		return this instanceof TypedefType && ((TypedefType)this).getDecl().hasAttr(AttrKind.OBJC_INDEPENDENT_CLASS);
	}

	public final boolean isObjCRetainableType() {
		return isObjCObjectPointerType() || isBlockPointerType() || isObjCNSObjectType();
	}

	/**
	 * Returns true if objects of this type (or arrays of them) have lifetime
	 * semantics under ARC.
	 * @return true if this is a lifetime type
	 */
	public final boolean isObjCLifetimeType() {
		Type type = this;
		ArrayType array;
		while ((array = type.getAsArrayTypeUnsafe()) != null)
			type = array.getElementType().getTypePtr();
		return type.isObjCRetainableType();
	}

	public final boolean isObjCIndirectLifetimeType() {
		if (isObjCLifetimeType())
			return true;
		PointerType pt = getAs(PointerType.class);
		if (pt != null)
			return pt.getPointeeType().getTypePtr().isObjCIndirectLifetimeType();
		ReferenceType rt = getAs(ReferenceType.class);
		if (rt != null)
			return rt.getPointeeType().getTypePtr().isObjCIndirectLifetimeType();
		MemberPointerType mpt = getAs(MemberPointerType.class);
		if (mpt != null)
			return mpt.getPointeeType().getTypePtr().isObjCIndirectLifetimeType();
		return false;
	}

	public final boolean isObjCARCBridgableType() {
		return isObjCObjectPointerType() || isBlockPointerType();
	}

	public final boolean isCARCBridgableType() {
		PointerType pt = getAs(PointerType.class);
		if (pt == null)
			return false;
		Type pointee = pt.getPointeeType().getTypePtr();
		return pointee.isVoidType() || pointee.isRecordType();
	}

	/**
	 * Returns true if a block can be converted to this Objective-C pointer
	 * type: {@code id}, or {@code NSObject} / qualified {@code id} whose
	 * protocols are only {@code NSObject} and {@code NSCopying}.
	 * @return true if blocks are compatible with this type
	 */
	public final boolean isBlockCompatibleObjCPointerType() {
		ObjCObjectPointerType opt = getAs(ObjCObjectPointerType.class);
		if (opt == null)
			return false;
		if (opt.isObjCIdType())
			return true;
		ObjCInterfaceDecl iface = opt.getInterfaceDecl();
		if (iface != null) {
			if (!"NSObject".equals(iface.getName()))
				return false;
		} else if (!opt.isObjCQualifiedIdType())
			return false;
		for (ObjCProtocolDecl proto : opt.getObjectType().getProtocols())
			if (!"NSObject".equals(proto.getName()) && !"NSCopying".equals(proto.getName()))
				return false;
		return true;
	}

	/**
	 * Returns true if this type may be written with Objective-C type
	 * arguments: an unspecialized object type naming a parameterized class.
	 * @return true if this type accepts type arguments
	 */
	public final boolean acceptsObjCTypeParams() {
		return ObjCTypeArgSubstitution.acceptsObjCTypeParams(this);
	}

	/**
	 * Computes the type arguments to substitute into a member declared in
	 * the given context when accessed through an object of this type.
	 * @param dc the member's declaration context
	 * @return the type arguments, an empty list to substitute parameter
	 * bounds, or null if no substitution applies
	 */
	public final List<QualType> getObjCSubstitutions(DeclContext dc) {
		return ObjCTypeArgSubstitution.getObjCSubstitutions(this, dc);
	}

	public final boolean isImageType() {
		BuiltinType bt = getAs(BuiltinType.class);
		return bt != null && bt.getKind().isImage();
	}
	public final boolean isSamplerT() {
		return isSpecificBuiltinType(BuiltinType.Kind.OCL_SAMPLER);
	}
	public final boolean isEventT() {
		return isSpecificBuiltinType(BuiltinType.Kind.OCL_EVENT);
	}
	public final boolean isClkEventT() {
		return isSpecificBuiltinType(BuiltinType.Kind.OCL_CLK_EVENT);
	}
	public final boolean isQueueT() {
		return isSpecificBuiltinType(BuiltinType.Kind.OCL_QUEUE);
	}
	public final boolean isReserveIDT() {
		return isSpecificBuiltinType(BuiltinType.Kind.OCL_RESERVE_ID);
	}
	public final boolean isOpenCLSpecificType() {
		return isSamplerT() || isEventT() || isImageType() || isClkEventT() || isQueueT() || isReserveIDT();
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Nullability">
	/**
	 * Returns the nullability written on this type, looking through sugar
	 * for the first nullability attribute.
	 * @return the nullability, or null if none was written
	 */
	public final NullabilityKind getNullability() {
		QualType type = self;
		while (true) {
			if (type.getTypePtr() instanceof AttributedType) {
				NullabilityKind n = ((AttributedType)type.getTypePtr()).getImmediateNullability();
				if (n != null)
					return n;
			}
			QualType desugared = type.getSingleStepDesugaredType();
			if (desugared.getTypePtr() == type.getTypePtr())
				return null;
			type = desugared;
		}
	}

	/**
	 * Determines whether a nullability attribute may be applied to this
	 * type.
	 * @param resultIfUnknown the answer for dependent types that might
	 * instantiate to pointers
	 * @return true if this type can have nullability
	 */
	public final boolean canHaveNullability(boolean resultIfUnknown) {
		Type type = canon();
		switch (type.getTypeClass()) {
			case POINTER:
			case BLOCK_POINTER:
			case MEMBER_POINTER:
			case OBJC_OBJECT_POINTER:
				return true;
			case UNRESOLVED_USING:
			case TYPE_OF_EXPR:
			case TYPE_OF:
			case DECLTYPE:
			case UNARY_TRANSFORM:
			case TEMPLATE_TYPE_PARM:
			case SUBST_TEMPLATE_TYPE_PARM_PACK:
			case DEPENDENT_NAME:
			case DEPENDENT_TEMPLATE_SPECIALIZATION:
			case AUTO:
				return resultIfUnknown;
			case TEMPLATE_SPECIALIZATION: {
				TemplateDecl td = ((TemplateSpecializationType)type).getTemplateName().getAsTemplateDecl();
				if (td != null && td.isClassTemplate())
					return false;
				return resultIfUnknown;
			}
			case BUILTIN: {
				BuiltinType.Kind k = ((BuiltinType)type).getKind();
				if (inRange(k, BuiltinType.Kind.BOOL, BuiltinType.Kind.FLOAT128))
					return false;
				switch (k) {
					case DEPENDENT:
					case OVERLOAD:
					case BOUND_MEMBER:
					case PSEUDO_OBJECT:
					case UNKNOWN_ANY:
					case ARC_UNBRIDGED_CAST:
						return resultIfUnknown;
					default:
						return false;
				}
			}
			case COMPLEX:
			case LVALUE_REFERENCE:
			case RVALUE_REFERENCE:
			case CONSTANT_ARRAY:
			case INCOMPLETE_ARRAY:
			case VARIABLE_ARRAY:
			case DEPENDENT_SIZED_ARRAY:
			case DEPENDENT_SIZED_EXT_VECTOR:
			case VECTOR:
			case EXT_VECTOR:
			case DEPENDENT_ADDRESS_SPACE:
			case FUNCTION_PROTO:
			case FUNCTION_NO_PROTO:
			case RECORD:
			case DEDUCED_TEMPLATE_SPECIALIZATION:
			case ENUM:
			case INJECTED_CLASS_NAME:
			case PACK_EXPANSION:
			case OBJC_OBJECT:
			case OBJC_INTERFACE:
			case ATOMIC:
			case PIPE:
			case TYPE_VARIABLE:
				return false;
			default:
				throw new AssertionError("non-canonical type " + type);
		}
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Checked C">
	public final boolean isCheckedPointerType() {
		PointerType pt = getAs(PointerType.class);
		return pt != null && pt.isChecked();
	}
	public final boolean isUncheckedPointerType() {
		PointerType pt = getAs(PointerType.class);
		return pt != null && !pt.isChecked();
	}
	public final boolean isCheckedPointerPtrType() {
		PointerType pt = getAs(PointerType.class);
		return pt != null && pt.getKind() == CheckedPointerKind.PTR;
	}
	public final boolean isCheckedPointerArrayType() {
		PointerType pt = getAs(PointerType.class);
		return pt != null && pt.getKind() == CheckedPointerKind.ARRAY;
	}
	public final boolean isCheckedPointerNtArrayType() {
		PointerType pt = getAs(PointerType.class);
		return pt != null && pt.getKind() == CheckedPointerKind.NT_ARRAY;
	}
	public final boolean isCheckedArrayType() {
		return canon() instanceof ArrayType && ((ArrayType)canon()).isChecked();
	}
	public final boolean isUncheckedArrayType() {
		return canon() instanceof ArrayType && !((ArrayType)canon()).isChecked();
	}
	public final boolean isNtCheckedArrayType() {
		return canon() instanceof ArrayType && ((ArrayType)canon()).getKind() == CheckedArrayKind.NT_CHECKED;
	}

	/**
	 * Returns true if this is a checked pointer or array, or a pointer,
	 * array or prototype built from one.
	 * @return true if this type is or contains a checked type
	 */
	public final boolean isOrContainsCheckedType() {
		Type current = canon();
		switch (current.getTypeClass()) {
			case POINTER: {
				PointerType ptr = (PointerType)current;
				if (ptr.isChecked())
					return true;
				return ptr.getPointeeType().getTypePtr().isOrContainsCheckedType();
			}
			case CONSTANT_ARRAY:
			case DEPENDENT_SIZED_ARRAY:
			case INCOMPLETE_ARRAY:
			case VARIABLE_ARRAY: {
				ArrayType arr = (ArrayType)current;
				if (arr.isChecked())
					return true;
				return arr.getElementType().getTypePtr().isOrContainsCheckedType();
			}
			case FUNCTION_PROTO: {
				FunctionProtoType fpt = (FunctionProtoType)current;
				if (fpt.getReturnType().getTypePtr().isOrContainsCheckedType())
					return true;
				for (QualType p : fpt.getParamTypes())
					if (p.getTypePtr().isOrContainsCheckedType())
						return true;
				return false;
			}
			default:
				return false;
		}
	}

	public final boolean isOrContainsUncheckedType() {
		Type current = canon();
		switch (current.getTypeClass()) {
			case POINTER: {
				PointerType ptr = (PointerType)current;
				if (!ptr.isChecked())
					return true;
				return ptr.getPointeeType().getTypePtr().isOrContainsUncheckedType();
			}
			case CONSTANT_ARRAY:
			case DEPENDENT_SIZED_ARRAY:
			case INCOMPLETE_ARRAY:
			case VARIABLE_ARRAY: {
				ArrayType arr = (ArrayType)current;
				if (!arr.isChecked())
					return true;
				return arr.getElementType().getTypePtr().isOrContainsUncheckedType();
			}
			case FUNCTION_PROTO: {
				FunctionProtoType fpt = (FunctionProtoType)current;
				if (fpt.getReturnType().getTypePtr().isOrContainsUncheckedType())
					return true;
				for (QualType p : fpt.getParamTypes())
					if (p.getTypePtr().isOrContainsUncheckedType())
						return true;
				return false;
			}
			default:
				return false;
		}
	}

	/**
	 * Returns true if a value of this type holds a checked pointer or array.
	 * Records count if a nested record does, or if a non-record field both
	 * contains a checked value and declares bounds.
	 * @return true if this type contains a checked value
	 */
	public final boolean containsCheckedValue() {
		Type current = canon();
		switch (current.getTypeClass()) {
			case POINTER: {
				PointerType ptr = (PointerType)current;
				if (ptr.isChecked())
					return true;
				return ptr.getPointeeType().getTypePtr().containsCheckedValue();
			}
			case CONSTANT_ARRAY:
			case DEPENDENT_SIZED_ARRAY:
			case INCOMPLETE_ARRAY:
			case VARIABLE_ARRAY: {
				ArrayType arr = (ArrayType)current;
				if (arr.isChecked())
					return true;
				return arr.getElementType().getTypePtr().containsCheckedValue();
			}
			case FUNCTION_PROTO: {
				FunctionProtoType fpt = (FunctionProtoType)current;
				if (fpt.getReturnType().getTypePtr().containsCheckedValue())
					return true;
				for (QualType p : fpt.getParamTypes())
					if (p.getTypePtr().containsCheckedValue())
						return true;
				return false;
			}
			case RECORD: {
				//the first field that holds a checked value decides; later fields can't undo it
				for (FieldDecl fd : ((RecordType)current).getDecl().fields()) {
					Type ft = fd.getType().getTypePtr();
					if (ft.isRecordType()) {
						if (ft.containsCheckedValue())
							return true;
					} else if (ft.containsCheckedValue() && fd.hasBoundsExpr())
						return true;
				}
				return false;
			}
			default:
				return false;
		}
	}

	/**
	 * Returns true if this is a variadic prototype or a pointer, array or
	 * prototype built from one.
	 * @return true if this type involves variable arguments
	 */
	public final boolean hasVariadicType() {
		Type current = canon();
		switch (current.getTypeClass()) {
			case POINTER:
				return ((PointerType)current).getPointeeType().getTypePtr().hasVariadicType();
			case CONSTANT_ARRAY:
			case DEPENDENT_SIZED_ARRAY:
			case INCOMPLETE_ARRAY:
			case VARIABLE_ARRAY:
				return ((ArrayType)current).getElementType().getTypePtr().hasVariadicType();
			case FUNCTION_PROTO: {
				FunctionProtoType fpt = (FunctionProtoType)current;
				if (fpt.getReturnType().getTypePtr().hasVariadicType())
					return true;
				for (QualType p : fpt.getParamTypes())
					if (p.getTypePtr().hasVariadicType())
						return true;
				return fpt.isVariadic();
			}
			default:
				return false;
		}
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Deduced types">
	/**
	 * Returns the {@code auto} or deduced template specialization type
	 * contained in this type's declarator chain (pointers, references,
	 * arrays, function return types and the like).
	 * @return the deduced type, or null
	 */
	public final DeducedType getContainedDeducedType() {
		Type t = accept(new ContainedDeducedTypeFinder(false));
		return t instanceof DeducedType ? (DeducedType)t : null;
	}

	public final AutoType getContainedAutoType() {
		DeducedType dt = getContainedDeducedType();
		return dt instanceof AutoType ? (AutoType)dt : null;
	}

	/**
	 * Returns true if this type is a function declarator with a trailing
	 * return type whose written return type is {@code auto}.
	 * @return true if this type has auto for a trailing return type
	 */
	public final boolean hasAutoForTrailingReturnType() {
		return accept(new ContainedDeducedTypeFinder(true)) instanceof FunctionType;
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Linkage">
	final LinkageCache getLinkageCache() {
		return linkageCache;
	}

	/**
	 * Returns the linkage of this type: the most restrictive linkage of the
	 * declarations it names.  Computed once and cached.
	 * @return the linkage
	 */
	public final Linkage getLinkage() {
		LinkageComputer.ensure(this);
		return linkageCache.get().getLinkage();
	}

	/**
	 * Returns true if this type names a local or unnamed tag somewhere in
	 * its structure.
	 * @return true if this type involves a local or unnamed type
	 */
	public final boolean hasUnnamedOrLocalType() {
		LinkageComputer.ensure(this);
		return linkageCache.get().hasLocalOrUnnamedType();
	}

	public final LinkageInfo getLinkageAndVisibility() {
		return LinkageComputer.getTypeLinkageAndVisibility(this);
	}

	/**
	 * Returns true if the cached linkage (if any) still agrees with a fresh
	 * computation.
	 * @return false if the cached linkage is stale
	 */
	public final boolean isLinkageValid() {
		return LinkageComputer.isLinkageValid(this);
	}
	//</editor-fold>

	@Override
	public String toString() {
		return getTypeClassName();
	}
}
