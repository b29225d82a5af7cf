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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import edu.mit.cfront.ast.CXXRecordDecl;
import edu.mit.cfront.ast.EnumDecl;
import edu.mit.cfront.ast.Expr;
import edu.mit.cfront.ast.NestedNameSpecifier;
import edu.mit.cfront.ast.ObjCInterfaceDecl;
import edu.mit.cfront.ast.ObjCProtocolDecl;
import edu.mit.cfront.ast.ObjCTypeParamDecl;
import edu.mit.cfront.ast.RecordDecl;
import edu.mit.cfront.ast.TagDecl;
import edu.mit.cfront.ast.TemplateDecl;
import edu.mit.cfront.ast.TemplateTypeParmDecl;
import edu.mit.cfront.ast.TypedefNameDecl;
import edu.mit.cfront.ast.UnresolvedUsingTypenameDecl;
import edu.mit.cfront.basic.LangOptions;
import edu.mit.cfront.basic.Options;
import edu.mit.cfront.basic.TargetLayout;
import edu.mit.cfront.types.ArrayType.ArraySizeModifier;
import edu.mit.cfront.types.FunctionProtoType.ExceptionSpecInfo;
import edu.mit.cfront.types.FunctionProtoType.ExtProtoInfo;
import edu.mit.cfront.types.FunctionType.ExtInfo;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and owns type nodes.  Every uniqued variant is interned by its
 * structural profile, so asking twice for the same structure returns the
 * same node, and each node is given its canonical type on creation.
 * <p>
 * Types that aren't uniqued (variable-length arrays, typeof and similar
 * sugar with expressions, template specializations) get a fresh node per
 * request, still with a uniqued canonical type.
 */
public final class TypeFactory implements Iterable<Type> {
	private static final Logger LOG = LoggerFactory.getLogger(TypeFactory.class);
	private final LangOptions langOpts;
	private final TargetLayout targetLayout;
	private final boolean traceInterning;
	private final Map<TypeProfile, Type> uniqued = new HashMap<>();
	private final List<Type> types = new ArrayList<>();
	private final Map<BuiltinType.Kind, BuiltinType> builtins = new EnumMap<>(BuiltinType.Kind.class);

	public TypeFactory(LangOptions langOpts, TargetLayout targetLayout) {
		this.langOpts = checkNotNull(langOpts);
		this.targetLayout = checkNotNull(targetLayout);
		this.traceInterning = Options.traceInterning;
		for (BuiltinType.Kind kind : BuiltinType.Kind.values())
			builtins.put(kind, intern(new BuiltinType(this, kind)));
	}

	/**
	 * Creates a factory using the language options from the configuration
	 * file.
	 * @param targetLayout the target layout service
	 */
	public TypeFactory(TargetLayout targetLayout) {
		this(Options.langOptions, targetLayout);
	}

	public LangOptions getLangOpts() {
		return langOpts;
	}

	public TargetLayout getTargetLayout() {
		return targetLayout;
	}

	/**
	 * Iterates over every node this factory has created, in creation order.
	 * @return an iterator over the created types
	 */
	@Override
	public Iterator<Type> iterator() {
		return Iterators.unmodifiableIterator(types.iterator());
	}

	public int size() {
		return types.size();
	}

	//<editor-fold defaultstate="collapsed" desc="Interning">
	private <T extends Type> T lookup(TypeProfile profile, Class<T> klass) {
		Type t = uniqued.get(profile);
		return t != null ? klass.cast(t) : null;
	}

	private <T extends Type> T intern(T type) {
		Type old = uniqued.put(type.profile(), type);
		assert old == null : "interned twice: " + type + " and " + old;
		return record(type);
	}

	private <T extends Type> T record(T type) {
		types.add(type);
		if (traceInterning && LOG.isTraceEnabled())
			LOG.trace("new {} #{}: {}", type.getTypeClassName(), types.size(), type);
		return type;
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Qualifiers and canonical forms">
	public QualType getQualifiedType(QualType type, Qualifiers quals) {
		return type.withQualifiers(quals);
	}

	public QualType getQualifiedType(Type type, Qualifiers quals) {
		return new QualType(type, quals);
	}

	public QualType getCanonicalType(QualType type) {
		return type.getCanonicalType();
	}

	public Type getCanonicalType(Type type) {
		return type.getCanonicalTypeInternal().getTypePtr();
	}

	/**
	 * Views a type as an array type, pushing any qualifiers on the array
	 * (including those hidden in sugar) down into the element type.
	 * @param type a type
	 * @return the array type, or null if the type isn't an array
	 */
	public ArrayType getAsArrayType(QualType type) {
		if (!type.hasLocalQualifiers() && type.getTypePtr() instanceof ArrayType)
			return (ArrayType)type.getTypePtr();
		if (!(type.getCanonicalType().getTypePtr() instanceof ArrayType))
			return null;
		SplitQualType split = type.getSplitDesugaredType();
		Qualifiers quals = split.getQualifiers();
		if (!(split.getType() instanceof ArrayType))
			return null;
		ArrayType array = (ArrayType)split.getType();
		if (quals.isEmpty())
			return array;
		QualType newElement = array.getElementType().withQualifiers(quals);
		switch (array.getTypeClass()) {
			case CONSTANT_ARRAY:
				return (ArrayType)getConstantArrayType(newElement, ((ConstantArrayType)array).getSize(),
						array.getSizeModifier(), array.getIndexTypeCVRQualifiers(), array.getKind()).getTypePtr();
			case INCOMPLETE_ARRAY:
				return (ArrayType)getIncompleteArrayType(newElement, array.getSizeModifier(),
						array.getIndexTypeCVRQualifiers(), array.getKind()).getTypePtr();
			case DEPENDENT_SIZED_ARRAY:
				return (ArrayType)getDependentSizedArrayType(newElement, ((DependentSizedArrayType)array).getSizeExpr(),
						array.getSizeModifier(), array.getIndexTypeCVRQualifiers(), array.getKind()).getTypePtr();
			case VARIABLE_ARRAY:
				return (ArrayType)getVariableArrayType(newElement, ((VariableArrayType)array).getSizeExpr(),
						array.getSizeModifier(), array.getIndexTypeCVRQualifiers(), array.getKind()).getTypePtr();
			default:
				throw new AssertionError(array.getTypeClass());
		}
	}

	/**
	 * Strips all array types, returning the innermost element type with the
	 * qualifiers of every array level applied.
	 * @param type a type
	 * @return the base element type
	 */
	public QualType getBaseElementType(QualType type) {
		Qualifiers quals = Qualifiers.NONE;
		while (true) {
			SplitQualType split = type.getSplitDesugaredType();
			ArrayType array = split.getType().getAsArrayTypeUnsafe();
			if (array == null)
				break;
			type = array.getElementType();
			quals = quals.merge(split.getQualifiers());
		}
		return type.withQualifiers(quals);
	}

	/**
	 * Returns the pointer an array decays to.  Qualifiers written in the
	 * brackets move onto the pointer, and checked arrays decay to checked
	 * array pointers.
	 * @param type an array type
	 * @return the decayed pointer type
	 */
	public QualType getArrayDecayedType(QualType type) {
		ArrayType array = getAsArrayType(type);
		checkArgument(array != null, "%s is not an array", type);
		CheckedPointerKind kind = CheckedPointerKind.UNCHECKED;
		if (array.getKind() == CheckedArrayKind.CHECKED)
			kind = CheckedPointerKind.ARRAY;
		else if (array.getKind() == CheckedArrayKind.NT_CHECKED)
			kind = CheckedPointerKind.NT_ARRAY;
		return getPointerType(array.getElementType(), kind).withQualifiers(array.getIndexTypeQualifiers());
	}

	/**
	 * Returns the canonical type of a function parameter of the given type:
	 * canonical, without top-level qualifiers, with arrays and functions
	 * decayed to pointers.
	 * @param type a parameter type as written
	 * @return the canonical parameter type
	 */
	public QualType getCanonicalParamType(QualType type) {
		Type t = type.getCanonicalType().getTypePtr();
		if (t instanceof ArrayType)
			return getArrayDecayedType(t.asQualType());
		if (t instanceof FunctionType)
			return getPointerType(t.asQualType());
		return t.asQualType();
	}

	static boolean isCanonicalAsParam(QualType type) {
		if (!type.isCanonical() || type.hasLocalQualifiers())
			return false;
		Type t = type.getTypePtr();
		if (t.isVariablyModifiedType() && t.hasSizedVLAType())
			return false;
		return !(t instanceof FunctionType) && !(t instanceof ArrayType);
	}

	private static boolean isCanonicalResultType(QualType type) {
		Qualifiers.ObjCLifetime lifetime = type.getObjCLifetime();
		return type.isCanonical()
				&& (lifetime == Qualifiers.ObjCLifetime.NONE || lifetime == Qualifiers.ObjCLifetime.EXPLICIT_NONE);
	}

	/**
	 * Returns the canonical form of a function result type, which drops any
	 * Objective-C lifetime qualifier.
	 * @param type a result type
	 * @return the canonical result type
	 */
	public QualType getCanonicalFunctionResultType(QualType type) {
		QualType canon = type.getCanonicalType();
		Qualifiers quals = canon.getQualifiers();
		if (!quals.hasObjCLifetime())
			return canon;
		return canon.getUnqualifiedType().withQualifiers(quals.withoutObjCLifetime());
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Builtins">
	public QualType getBuiltinType(BuiltinType.Kind kind) {
		return builtins.get(kind).asQualType();
	}

	public QualType getVoidType() {
		return getBuiltinType(BuiltinType.Kind.VOID);
	}

	public QualType getBoolType() {
		return getBuiltinType(BuiltinType.Kind.BOOL);
	}

	public QualType getIntType() {
		return getBuiltinType(BuiltinType.Kind.INT);
	}

	public QualType getDependentType() {
		return getBuiltinType(BuiltinType.Kind.DEPENDENT);
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Pointers, references and complex">
	public QualType getComplexType(QualType element) {
		ComplexType t = lookup(ComplexType.profile(element), ComplexType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!element.isCanonical())
			canon = getComplexType(element.getCanonicalType());
		return intern(new ComplexType(this, element, canon)).asQualType();
	}

	public QualType getPointerType(QualType pointee) {
		return getPointerType(pointee, CheckedPointerKind.UNCHECKED);
	}

	public QualType getPointerType(QualType pointee, CheckedPointerKind kind) {
		PointerType t = lookup(PointerType.profile(pointee, kind), PointerType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!pointee.isCanonical())
			canon = getPointerType(pointee.getCanonicalType(), kind);
		return intern(new PointerType(this, pointee, canon, kind)).asQualType();
	}

	public QualType getBlockPointerType(QualType pointee) {
		BlockPointerType t = lookup(BlockPointerType.profile(pointee), BlockPointerType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!pointee.isCanonical())
			canon = getBlockPointerType(pointee.getCanonicalType());
		return intern(new BlockPointerType(this, pointee, canon)).asQualType();
	}

	public QualType getLValueReferenceType(QualType referencee) {
		return getLValueReferenceType(referencee, true);
	}

	/**
	 * Returns an lvalue reference type.  References to references collapse
	 * in the canonical type.
	 * @param referencee the referenced type
	 * @param spelledAsLValue false if this reference was formed by
	 * collapsing an rvalue reference to an lvalue reference
	 * @return the reference type
	 */
	public QualType getLValueReferenceType(QualType referencee, boolean spelledAsLValue) {
		LValueReferenceType t = lookup(ReferenceType.profile(TypeClass.LVALUE_REFERENCE, referencee, spelledAsLValue),
				LValueReferenceType.class);
		if (t != null)
			return t.asQualType();
		ReferenceType inner = referencee.getTypePtr().getAs(ReferenceType.class);
		QualType canon = null;
		if (!spelledAsLValue || inner != null || !referencee.isCanonical()) {
			QualType pointee = inner != null ? inner.getPointeeType() : referencee;
			canon = getLValueReferenceType(pointee.getCanonicalType());
		}
		return intern(new LValueReferenceType(this, referencee, canon, spelledAsLValue)).asQualType();
	}

	public QualType getRValueReferenceType(QualType referencee) {
		RValueReferenceType t = lookup(ReferenceType.profile(TypeClass.RVALUE_REFERENCE, referencee, false),
				RValueReferenceType.class);
		if (t != null)
			return t.asQualType();
		ReferenceType inner = referencee.getTypePtr().getAs(ReferenceType.class);
		QualType canon = null;
		if (inner != null || !referencee.isCanonical()) {
			QualType pointee = inner != null ? inner.getPointeeType() : referencee;
			canon = getRValueReferenceType(pointee.getCanonicalType());
		}
		return intern(new RValueReferenceType(this, referencee, canon)).asQualType();
	}

	public QualType getMemberPointerType(QualType pointee, Type cls) {
		MemberPointerType t = lookup(MemberPointerType.profile(pointee, cls), MemberPointerType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!pointee.isCanonical() || !cls.isCanonicalUnqualified())
			canon = getMemberPointerType(pointee.getCanonicalType(), getCanonicalType(cls));
		return intern(new MemberPointerType(this, pointee, cls, canon)).asQualType();
	}

	public QualType getObjCObjectPointerType(QualType objectType) {
		ObjCObjectPointerType t = lookup(ObjCObjectPointerType.profile(objectType), ObjCObjectPointerType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!objectType.isCanonical())
			canon = getObjCObjectPointerType(objectType.getCanonicalType());
		return intern(new ObjCObjectPointerType(this, objectType, canon)).asQualType();
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Arrays and vectors">
	public QualType getConstantArrayType(QualType element, long size) {
		return getConstantArrayType(element, BigInteger.valueOf(size), ArraySizeModifier.NORMAL, 0, CheckedArrayKind.UNCHECKED);
	}

	/**
	 * Returns a constant-size array type.  If the element type is qualified
	 * or sugared, the canonical type is the array of the canonical
	 * unqualified element with the element's qualifiers on the array.
	 */
	public QualType getConstantArrayType(QualType element, BigInteger size, ArraySizeModifier sizeModifier,
			int indexTypeQuals, CheckedArrayKind kind) {
		ConstantArrayType t = lookup(ConstantArrayType.profile(element, size, sizeModifier, indexTypeQuals, kind),
				ConstantArrayType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!element.isCanonical() || element.hasLocalQualifiers()) {
			SplitQualType split = element.getCanonicalType().split();
			canon = getConstantArrayType(split.getType().asQualType(), size, sizeModifier, indexTypeQuals, kind)
					.withQualifiers(split.getQualifiers());
		}
		return intern(new ConstantArrayType(this, element, canon, size, sizeModifier, indexTypeQuals, kind)).asQualType();
	}

	public QualType getIncompleteArrayType(QualType element) {
		return getIncompleteArrayType(element, ArraySizeModifier.NORMAL, 0, CheckedArrayKind.UNCHECKED);
	}

	public QualType getIncompleteArrayType(QualType element, ArraySizeModifier sizeModifier,
			int indexTypeQuals, CheckedArrayKind kind) {
		IncompleteArrayType t = lookup(IncompleteArrayType.profile(element, sizeModifier, indexTypeQuals, kind),
				IncompleteArrayType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!element.isCanonical() || element.hasLocalQualifiers()) {
			SplitQualType split = element.getCanonicalType().split();
			canon = getIncompleteArrayType(split.getType().asQualType(), sizeModifier, indexTypeQuals, kind)
					.withQualifiers(split.getQualifiers());
		}
		return intern(new IncompleteArrayType(this, element, canon, sizeModifier, indexTypeQuals, kind)).asQualType();
	}

	/**
	 * Returns a new variable-length array type.  VLAs are never uniqued:
	 * each call returns a distinct node.
	 * @param sizeExpr the size expression, or null for {@code [*]}
	 */
	public QualType getVariableArrayType(QualType element, Expr sizeExpr, ArraySizeModifier sizeModifier,
			int indexTypeQuals, CheckedArrayKind kind) {
		QualType canon = null;
		if (!element.isCanonical() || element.hasLocalQualifiers()) {
			SplitQualType split = element.getCanonicalType().split();
			canon = getVariableArrayType(split.getType().asQualType(), sizeExpr, sizeModifier, indexTypeQuals, kind)
					.withQualifiers(split.getQualifiers());
		}
		return record(new VariableArrayType(this, element, canon, sizeExpr, sizeModifier, indexTypeQuals, kind)).asQualType();
	}

	/**
	 * Returns an array type whose size is a value-dependent expression.
	 * Without a size expression (the size to be deduced from an
	 * initializer), no canonicalization is done.
	 */
	public QualType getDependentSizedArrayType(QualType element, Expr sizeExpr, ArraySizeModifier sizeModifier,
			int indexTypeQuals, CheckedArrayKind kind) {
		if (sizeExpr == null)
			return record(new DependentSizedArrayType(this, element, null, null, sizeModifier, indexTypeQuals, kind)).asQualType();
		SplitQualType canonElement = element.getCanonicalType().split();
		QualType canonElementType = canonElement.getType().asQualType();
		DependentSizedArrayType canonType = lookup(
				DependentSizedArrayType.profile(canonElementType, sizeModifier, indexTypeQuals, kind, sizeExpr),
				DependentSizedArrayType.class);
		if (canonType == null)
			canonType = intern(new DependentSizedArrayType(this, canonElementType, null, sizeExpr, sizeModifier, indexTypeQuals, kind));
		QualType canon = canonType.asQualType().withQualifiers(canonElement.getQualifiers());
		if (canonElementType.equals(element) && canonType.getSizeExpr() == sizeExpr)
			return canon;
		return record(new DependentSizedArrayType(this, element, canon, sizeExpr, sizeModifier, indexTypeQuals, kind)).asQualType();
	}

	public QualType getVectorType(QualType element, int numElements, VectorType.VectorKind vectorKind) {
		VectorType t = lookup(VectorType.profile(TypeClass.VECTOR, element, numElements, vectorKind), VectorType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!element.isCanonical())
			canon = getVectorType(element.getCanonicalType(), numElements, vectorKind);
		return intern(new VectorType(this, element, numElements, vectorKind, canon)).asQualType();
	}

	public QualType getExtVectorType(QualType element, int numElements) {
		ExtVectorType t = lookup(VectorType.profile(TypeClass.EXT_VECTOR, element, numElements, VectorType.VectorKind.GENERIC),
				ExtVectorType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!element.isCanonical())
			canon = getExtVectorType(element.getCanonicalType(), numElements);
		return intern(new ExtVectorType(this, element, numElements, canon)).asQualType();
	}

	public QualType getDependentSizedExtVectorType(QualType element, Expr sizeExpr) {
		QualType canonElement = element.getCanonicalType();
		DependentSizedExtVectorType canon = lookup(DependentSizedExtVectorType.profile(canonElement, sizeExpr),
				DependentSizedExtVectorType.class);
		if (canon != null)
			return record(new DependentSizedExtVectorType(this, element, canon.asQualType(), sizeExpr)).asQualType();
		if (canonElement.equals(element))
			return intern(new DependentSizedExtVectorType(this, element, null, sizeExpr)).asQualType();
		QualType canonType = getDependentSizedExtVectorType(canonElement, sizeExpr);
		return record(new DependentSizedExtVectorType(this, element, canonType, sizeExpr)).asQualType();
	}

	public QualType getDependentAddressSpaceType(QualType pointee, Expr addrSpaceExpr) {
		QualType canonPointee = pointee.getCanonicalType();
		DependentAddressSpaceType canon = lookup(DependentAddressSpaceType.profile(canonPointee, addrSpaceExpr),
				DependentAddressSpaceType.class);
		if (canon != null)
			return record(new DependentAddressSpaceType(this, pointee, canon.asQualType(), addrSpaceExpr)).asQualType();
		if (canonPointee.equals(pointee))
			return intern(new DependentAddressSpaceType(this, pointee, null, addrSpaceExpr)).asQualType();
		QualType canonType = getDependentAddressSpaceType(canonPointee, addrSpaceExpr);
		return record(new DependentAddressSpaceType(this, pointee, canonType, addrSpaceExpr)).asQualType();
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Functions">
	public QualType getFunctionNoProtoType(QualType returnType) {
		return getFunctionNoProtoType(returnType, ExtInfo.DEFAULT);
	}

	public QualType getFunctionNoProtoType(QualType returnType, ExtInfo extInfo) {
		FunctionNoProtoType t = lookup(FunctionNoProtoType.profile(returnType, extInfo), FunctionNoProtoType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!isCanonicalResultType(returnType))
			canon = getFunctionNoProtoType(getCanonicalFunctionResultType(returnType), extInfo);
		return intern(new FunctionNoProtoType(this, returnType, canon, extInfo)).asQualType();
	}

	public QualType getFunctionType(QualType returnType, List<QualType> paramTypes) {
		return getFunctionType(returnType, paramTypes, ExtProtoInfo.DEFAULT);
	}

	/**
	 * Returns a function prototype type.  The canonical prototype has
	 * canonical parameter types, a canonical result type and no trailing
	 * return; its exception specification is dropped before C++17 and
	 * reduced to "can throw or not" from C++17 on, unless it's dependent.
	 * <p>
	 * Prototypes with unresolved exception specifications are never shared,
	 * since each carries its own declaration to resolve against.
	 */
	public QualType getFunctionType(QualType returnType, List<QualType> paramTypes, ExtProtoInfo epi) {
		TypeProfile profile = FunctionProtoType.profile(returnType, paramTypes, epi);
		QualType canon = null;
		boolean unique = false;
		FunctionProtoType existing = lookup(profile, FunctionProtoType.class);
		if (existing != null) {
			if (!epi.getExceptionSpec().getType().isUnresolvedExceptionSpec())
				return existing.asQualType();
			unique = true;
			canon = existing.asQualType().getCanonicalType();
		}

		boolean noexceptInType = langOpts.isCPlusPlus17();
		boolean canonicalExceptionSpec = isCanonicalExceptionSpecification(epi.getExceptionSpec(), noexceptInType);
		boolean isCanonical = !unique && canonicalExceptionSpec && isCanonicalResultType(returnType) && !epi.hasTrailingReturn();
		for (int i = 0; i < paramTypes.size() && isCanonical; ++i)
			if (!isCanonicalAsParam(paramTypes.get(i)))
				isCanonical = false;

		if (!isCanonical && canon == null) {
			List<QualType> canonParams = new ArrayList<>(paramTypes.size());
			for (QualType p : paramTypes)
				canonParams.add(getCanonicalParamType(p));
			ExtProtoInfo canonEpi = epi.withTrailingReturn(false);
			if (!canonicalExceptionSpec)
				canonEpi = canonEpi.withExceptionSpec(getCanonicalExceptionSpec(epi.getExceptionSpec(), noexceptInType));
			canon = getFunctionType(getCanonicalFunctionResultType(returnType), canonParams, canonEpi);
		}

		FunctionProtoType t = new FunctionProtoType(this, returnType, paramTypes, canon, epi);
		return (unique ? record(t) : intern(t)).asQualType();
	}

	private static boolean isCanonicalExceptionSpecification(ExceptionSpecInfo esi, boolean noexceptInType) {
		if (esi.getType() == ExceptionSpecificationType.NONE)
			return true;
		if (!noexceptInType)
			return false;
		if (esi.getType() == ExceptionSpecificationType.BASIC_NOEXCEPT)
			return true;
		//A dynamic specification is canonical only if it contains pack
		//expansions, since they might expand to nothing.
		if (esi.getType() == ExceptionSpecificationType.DYNAMIC) {
			boolean anyPackExpansions = false;
			for (QualType et : esi.getExceptions()) {
				if (!et.isCanonical())
					return false;
				if (et.getTypePtr().getAs(PackExpansionType.class) != null)
					anyPackExpansions = true;
			}
			return anyPackExpansions;
		}
		if (esi.getType() == ExceptionSpecificationType.COMPUTED_NOEXCEPT)
			return esi.getNoexceptExpr() != null && esi.getNoexceptExpr().isValueDependent();
		return false;
	}

	private ExceptionSpecInfo getCanonicalExceptionSpec(ExceptionSpecInfo esi, boolean noexceptInType) {
		if (!noexceptInType)
			return ExceptionSpecInfo.NONE;
		switch (esi.getType()) {
			case UNPARSED:
			case UNEVALUATED:
			case UNINSTANTIATED:
			case NONE:
			case MS_ANY:
				return ExceptionSpecInfo.NONE;
			case DYNAMIC: {
				boolean anyPacks = false;
				List<QualType> canonExceptions = new ArrayList<>(esi.getExceptions().size());
				for (QualType et : esi.getExceptions()) {
					if (et.getTypePtr().getAs(PackExpansionType.class) != null)
						anyPacks = true;
					canonExceptions.add(et.getCanonicalType());
				}
				return anyPacks ? ExceptionSpecInfo.dynamic(canonExceptions) : ExceptionSpecInfo.NONE;
			}
			case DYNAMIC_NONE:
			case BASIC_NOEXCEPT:
				return ExceptionSpecInfo.of(ExceptionSpecificationType.BASIC_NOEXCEPT);
			case COMPUTED_NOEXCEPT: {
				Expr e = esi.getNoexceptExpr();
				if (e == null || e.isValueDependent())
					return ExceptionSpecInfo.NONE;
				BigInteger value = e.evaluateAsInteger();
				if (value == null || value.signum() == 0)
					return ExceptionSpecInfo.NONE;
				return ExceptionSpecInfo.of(ExceptionSpecificationType.BASIC_NOEXCEPT);
			}
			default:
				throw new AssertionError(esi.getType());
		}
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Sugar">
	public QualType getParenType(QualType inner) {
		ParenType t = lookup(ParenType.profile(inner), ParenType.class);
		if (t != null)
			return t.asQualType();
		return intern(new ParenType(this, inner, inner.getCanonicalType())).asQualType();
	}

	public QualType getTypedefType(TypedefNameDecl decl) {
		TypedefType t = lookup(TypedefType.profile(decl), TypedefType.class);
		if (t != null)
			return t.asQualType();
		return intern(new TypedefType(this, decl, decl.getUnderlyingType().getCanonicalType())).asQualType();
	}

	public QualType getAdjustedType(QualType original, QualType adjusted) {
		AdjustedType t = lookup(AdjustedType.profile(TypeClass.ADJUSTED, original, adjusted), AdjustedType.class);
		if (t != null)
			return t.asQualType();
		return intern(new AdjustedType(this, original, adjusted, adjusted.getCanonicalType())).asQualType();
	}

	/**
	 * Returns the sugar recording that an array or function parameter type
	 * was adjusted to a pointer.
	 * @param original an array or function type
	 * @return the decayed type
	 */
	public QualType getDecayedType(QualType original) {
		Type t = original.getTypePtr();
		checkArgument(t.isArrayType() || t.isFunctionType(), "%s does not decay", original);
		QualType decayed = t.isArrayType() ? getArrayDecayedType(original) : getPointerType(original);
		DecayedType existing = lookup(AdjustedType.profile(TypeClass.DECAYED, original, decayed), DecayedType.class);
		if (existing != null)
			return existing.asQualType();
		return intern(new DecayedType(this, original, decayed, decayed.getCanonicalType())).asQualType();
	}

	public QualType getAttributedType(AttributedType.Kind attrKind, QualType modified, QualType equivalent) {
		AttributedType t = lookup(AttributedType.profile(attrKind, modified, equivalent), AttributedType.class);
		if (t != null)
			return t.asQualType();
		return intern(new AttributedType(this, attrKind, modified, equivalent, equivalent.getCanonicalType())).asQualType();
	}

	public QualType getElaboratedType(ElaboratedTypeKeyword keyword, NestedNameSpecifier qualifier, QualType named) {
		ElaboratedType t = lookup(ElaboratedType.profile(keyword, qualifier, named), ElaboratedType.class);
		if (t != null)
			return t.asQualType();
		return intern(new ElaboratedType(this, keyword, qualifier, named, named.getCanonicalType())).asQualType();
	}

	/**
	 * Returns {@code typeof(expr)}.  Type-dependent expressions get a
	 * canonical node shared by all uses of the same expression.
	 */
	public QualType getTypeOfExprType(Expr expr) {
		if (expr.isTypeDependent()) {
			TypeOfExprType canon = lookup(TypeOfExprType.profile(expr), TypeOfExprType.class);
			if (canon != null)
				return record(new TypeOfExprType(this, expr, canon.asQualType())).asQualType();
			return intern(new TypeOfExprType(this, expr, null)).asQualType();
		}
		return record(new TypeOfExprType(this, expr, expr.getType().getCanonicalType())).asQualType();
	}

	public QualType getTypeOfType(QualType underlying) {
		return record(new TypeOfType(this, underlying, underlying.getCanonicalType())).asQualType();
	}

	/**
	 * Returns {@code decltype(expr)}.  Instantiation-dependent expressions
	 * share a canonical node per expression.
	 * @param underlying the type decltype yields, for a non-dependent
	 * expression
	 */
	public QualType getDecltypeType(Expr expr, QualType underlying) {
		if (expr.isInstantiationDependent()) {
			DecltypeType canon = lookup(DecltypeType.profile(expr), DecltypeType.class);
			if (canon == null)
				canon = intern(new DecltypeType(this, expr, getDependentType(), null));
			return record(new DecltypeType(this, expr, underlying, canon.asQualType())).asQualType();
		}
		return record(new DecltypeType(this, expr, underlying, underlying.getCanonicalType())).asQualType();
	}

	public QualType getUnaryTransformType(QualType base, QualType underlying, UnaryTransformType.UTTKind kind) {
		if (base.getTypePtr().isDependentType()) {
			QualType canonBase = base.getCanonicalType();
			UnaryTransformType canon = lookup(UnaryTransformType.profile(canonBase, kind), UnaryTransformType.class);
			if (canon == null)
				canon = intern(new UnaryTransformType(this, canonBase, getDependentType(), kind, null));
			//the written base type is kept; the interned node only serves as the canonical type
			return record(new UnaryTransformType(this, base, underlying, kind, canon.asQualType())).asQualType();
		}
		return record(new UnaryTransformType(this, base, underlying, kind, underlying.getCanonicalType())).asQualType();
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Tags">
	/**
	 * Tag types are keyed by the first declaration of the entity, so every
	 * redeclaration names the same type.
	 */
	private static <T extends TagDecl> T firstDecl(T decl, Class<T> klass) {
		List<? extends TagDecl> redecls = decl.redecls();
		return redecls.isEmpty() ? decl : klass.cast(redecls.get(0));
	}

	public QualType getRecordType(RecordDecl decl) {
		RecordDecl first = firstDecl(decl, RecordDecl.class);
		RecordType t = lookup(TagType.profile(TypeClass.RECORD, first), RecordType.class);
		if (t != null)
			return t.asQualType();
		return intern(new RecordType(this, first)).asQualType();
	}

	public QualType getEnumType(EnumDecl decl) {
		EnumDecl first = firstDecl(decl, EnumDecl.class);
		EnumType t = lookup(TagType.profile(TypeClass.ENUM, first), EnumType.class);
		if (t != null)
			return t.asQualType();
		return intern(new EnumType(this, first)).asQualType();
	}

	public QualType getTagDeclType(TagDecl decl) {
		if (decl instanceof EnumDecl)
			return getEnumType((EnumDecl)decl);
		checkArgument(decl instanceof RecordDecl, "unknown tag declaration %s", decl);
		return getRecordType((RecordDecl)decl);
	}

	public QualType getInjectedClassNameType(CXXRecordDecl decl, QualType injectedSpecialization) {
		InjectedClassNameType t = lookup(InjectedClassNameType.profile(decl), InjectedClassNameType.class);
		if (t != null)
			return t.asQualType();
		return intern(new InjectedClassNameType(this, decl, injectedSpecialization)).asQualType();
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Templates">
	public QualType getUnresolvedUsingType(UnresolvedUsingTypenameDecl decl) {
		UnresolvedUsingType t = lookup(UnresolvedUsingType.profile(decl), UnresolvedUsingType.class);
		if (t != null)
			return t.asQualType();
		return intern(new UnresolvedUsingType(this, decl)).asQualType();
	}

	public QualType getTemplateTypeParmType(int depth, int index, boolean parameterPack) {
		return getTemplateTypeParmType(depth, index, parameterPack, null);
	}

	/**
	 * Returns a template type parameter type.  The canonical type of a named
	 * parameter is the anonymous parameter at the same depth and index.
	 */
	public QualType getTemplateTypeParmType(int depth, int index, boolean parameterPack, TemplateTypeParmDecl decl) {
		TemplateTypeParmType t = lookup(TemplateTypeParmType.profile(depth, index, parameterPack, decl), TemplateTypeParmType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (decl != null)
			canon = getTemplateTypeParmType(depth, index, parameterPack, null);
		return intern(new TemplateTypeParmType(this, depth, index, parameterPack, decl, canon)).asQualType();
	}

	public QualType getSubstTemplateTypeParmType(TemplateTypeParmType replaced, QualType replacement) {
		checkArgument(replacement.isCanonical(), "replacement type %s must be canonical", replacement);
		SubstTemplateTypeParmType t = lookup(SubstTemplateTypeParmType.profile(replaced, replacement), SubstTemplateTypeParmType.class);
		if (t != null)
			return t.asQualType();
		return intern(new SubstTemplateTypeParmType(this, replaced, replacement)).asQualType();
	}

	public QualType getSubstTemplateTypeParmPackType(TemplateTypeParmType replaced, TemplateArgument argumentPack) {
		for (TemplateArgument arg : argumentPack.getPackElements()) {
			checkArgument(arg.getKind() == TemplateArgument.Kind.TYPE, "pack contains non-type %s", arg);
			checkArgument(arg.getAsType().isCanonical(), "pack contains non-canonical type %s", arg);
		}
		SubstTemplateTypeParmPackType t = lookup(SubstTemplateTypeParmPackType.profile(replaced, argumentPack),
				SubstTemplateTypeParmPackType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!replaced.isCanonicalUnqualified())
			canon = getSubstTemplateTypeParmPackType(
					replaced.getCanonicalTypeInternal().getTypePtr().castAs(TemplateTypeParmType.class), argumentPack);
		return intern(new SubstTemplateTypeParmPackType(this, replaced, canon, argumentPack)).asQualType();
	}

	TemplateArgument getCanonicalTemplateArgument(TemplateArgument arg) {
		switch (arg.getKind()) {
			case TYPE:
				return TemplateArgument.ofType(arg.getAsType().getCanonicalType());
			case INTEGRAL:
				return TemplateArgument.ofIntegral(arg.getAsIntegral(), arg.getIntegralType().getCanonicalType());
			case EXPRESSION:
			case TEMPLATE:
				return arg;
			case PACK: {
				List<TemplateArgument> elements = new ArrayList<>(arg.getPackElements().size());
				for (TemplateArgument e : arg.getPackElements())
					elements.add(getCanonicalTemplateArgument(e));
				return TemplateArgument.ofPack(elements);
			}
			default:
				throw new AssertionError(arg.getKind());
		}
	}

	private List<TemplateArgument> getCanonicalTemplateArguments(List<TemplateArgument> args) {
		List<TemplateArgument> canonArgs = new ArrayList<>(args.size());
		for (TemplateArgument arg : args)
			canonArgs.add(getCanonicalTemplateArgument(arg));
		return canonArgs;
	}

	/**
	 * Returns a template specialization type ({@code vector<int>}).
	 * @param template the template
	 * @param args the template arguments
	 * @param underlying the type the specialization denotes (the class
	 * specialization, or for an alias template the aliased type), or null if
	 * the specialization is dependent
	 * @return a new specialization type
	 */
	public QualType getTemplateSpecializationType(TemplateName template, List<TemplateArgument> args, QualType underlying) {
		checkArgument(template.getKind() != TemplateName.Kind.DEPENDENT, "dependent template name %s", template);
		TemplateDecl decl = template.getAsTemplateDecl();
		boolean typeAlias = decl != null && decl.isTypeAliasTemplate();
		QualType canon;
		if (underlying != null)
			canon = underlying.getCanonicalType();
		else {
			checkArgument(template.isDependent() || TemplateSpecializationType.anyDependentTemplateArguments(args),
					"non-dependent specialization of %s needs the type it denotes", template);
			typeAlias = false;
			canon = getCanonicalTemplateSpecializationType(template, args);
		}
		return record(new TemplateSpecializationType(this, template, args, canon, typeAlias ? underlying : null)).asQualType();
	}

	public QualType getCanonicalTemplateSpecializationType(TemplateName template, List<TemplateArgument> args) {
		List<TemplateArgument> canonArgs = getCanonicalTemplateArguments(args);
		TemplateSpecializationType t = lookup(TemplateSpecializationType.profile(template, canonArgs, null, null),
				TemplateSpecializationType.class);
		if (t == null)
			t = intern(new TemplateSpecializationType(this, template, canonArgs, null, null));
		return t.asQualType();
	}

	public QualType getDependentNameType(ElaboratedTypeKeyword keyword, NestedNameSpecifier qualifier, String name) {
		DependentNameType t = lookup(DependentNameType.profile(keyword, qualifier, name), DependentNameType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (keyword == ElaboratedTypeKeyword.NONE)
			canon = getDependentNameType(ElaboratedTypeKeyword.TYPENAME, qualifier, name);
		return intern(new DependentNameType(this, keyword, qualifier, name, canon)).asQualType();
	}

	/**
	 * Returns a dependent template specialization
	 * ({@code typename T::template apply<U>}).  The canonical form spells a
	 * missing keyword as {@code typename} and has canonical arguments.
	 */
	public QualType getDependentTemplateSpecializationType(ElaboratedTypeKeyword keyword, NestedNameSpecifier qualifier,
			String name, List<TemplateArgument> args) {
		DependentTemplateSpecializationType t = lookup(DependentTemplateSpecializationType.profile(keyword, qualifier, name, args),
				DependentTemplateSpecializationType.class);
		if (t != null)
			return t.asQualType();
		ElaboratedTypeKeyword canonKeyword = keyword == ElaboratedTypeKeyword.NONE ? ElaboratedTypeKeyword.TYPENAME : keyword;
		List<TemplateArgument> canonArgs = getCanonicalTemplateArguments(args);
		QualType canon = null;
		if (!canonArgs.equals(args) || canonKeyword != keyword)
			canon = getDependentTemplateSpecializationType(canonKeyword, qualifier, name, canonArgs);
		return intern(new DependentTemplateSpecializationType(this, keyword, qualifier, name, args, canon)).asQualType();
	}

	/**
	 * Returns a pack expansion of the given pattern.  If canonicalizing the
	 * pattern removes every unexpanded pack (an alias template ignoring its
	 * parameter), the canonical type is the canonical pattern itself.
	 * @param numExpansions the number of expansions, if known, else null
	 */
	public QualType getPackExpansionType(QualType pattern, Integer numExpansions) {
		PackExpansionType t = lookup(PackExpansionType.profile(pattern, numExpansions), PackExpansionType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!pattern.isCanonical()) {
			canon = pattern.getCanonicalType();
			if (canon.getTypePtr().containsUnexpandedParameterPack())
				canon = getPackExpansionType(canon, numExpansions);
		}
		return intern(new PackExpansionType(this, pattern, canon, numExpansions)).asQualType();
	}

	public QualType getAutoType(QualType deduced, AutoTypeKeyword keyword, boolean deducedAsDependent) {
		AutoType t = lookup(AutoType.profile(deduced, keyword, deducedAsDependent), AutoType.class);
		if (t != null)
			return t.asQualType();
		return intern(new AutoType(this, deduced, keyword, deducedAsDependent)).asQualType();
	}

	/**
	 * Returns the undeduced {@code auto} type.
	 * @return {@code auto}
	 */
	public QualType getAutoDeductType() {
		return getAutoType(null, AutoTypeKeyword.AUTO, false);
	}

	public QualType getDeducedTemplateSpecializationType(TemplateName template, QualType deduced, boolean deducedAsDependent) {
		DeducedTemplateSpecializationType t = lookup(
				DeducedTemplateSpecializationType.profile(template, deduced, deducedAsDependent),
				DeducedTemplateSpecializationType.class);
		if (t != null)
			return t.asQualType();
		return intern(new DeducedTemplateSpecializationType(this, template, deduced, deducedAsDependent)).asQualType();
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Objective-C">
	public QualType getObjCInterfaceType(ObjCInterfaceDecl decl) {
		ObjCInterfaceType t = lookup(ObjCInterfaceType.profile(decl), ObjCInterfaceType.class);
		if (t != null)
			return t.asQualType();
		return intern(new ObjCInterfaceType(this, decl)).asQualType();
	}

	/**
	 * Returns an Objective-C object type.  The canonical type has the
	 * canonical base, canonical type arguments (taken from the base if none
	 * are written here) and the protocols sorted by name without duplicates.
	 * An interface with nothing added is returned as-is.
	 * @param base the base type: id, Class or an interface
	 * @param typeArgs the type arguments written, possibly empty
	 * @param protocols the protocol qualifiers written, possibly empty
	 * @param kindOf whether {@code __kindof} was written
	 * @return the object type
	 */
	public QualType getObjCObjectType(QualType base, List<QualType> typeArgs, List<ObjCProtocolDecl> protocols, boolean kindOf) {
		if (typeArgs.isEmpty() && protocols.isEmpty() && !kindOf && base.getTypePtr() instanceof ObjCInterfaceType)
			return base;
		ObjCObjectType t = lookup(ObjCObjectType.profile(base, typeArgs, protocols, kindOf), ObjCObjectType.class);
		if (t != null)
			return t.asQualType();

		List<QualType> effectiveTypeArgs = typeArgs;
		if (effectiveTypeArgs.isEmpty()) {
			ObjCObjectType baseObject = base.getTypePtr().getAs(ObjCObjectType.class);
			if (baseObject != null)
				effectiveTypeArgs = baseObject.getTypeArgs();
		}
		boolean typeArgsAreCanonical = true;
		for (QualType arg : effectiveTypeArgs)
			typeArgsAreCanonical &= arg.isCanonical();
		List<ObjCProtocolDecl> canonProtocols = sortAndUniqueProtocols(protocols);
		boolean protocolsSorted = canonProtocols.equals(protocols);

		QualType canon = null;
		if (!typeArgsAreCanonical || !protocolsSorted || !base.isCanonical()) {
			List<QualType> canonTypeArgs = effectiveTypeArgs;
			if (!typeArgsAreCanonical) {
				canonTypeArgs = new ArrayList<>(effectiveTypeArgs.size());
				for (QualType arg : effectiveTypeArgs)
					canonTypeArgs.add(arg.getCanonicalType());
			}
			canon = getObjCObjectType(base.getCanonicalType(), canonTypeArgs, canonProtocols, kindOf);
		}
		return intern(new ObjCObjectType(this, base, typeArgs, protocols, kindOf, canon)).asQualType();
	}

	private static List<ObjCProtocolDecl> sortAndUniqueProtocols(List<ObjCProtocolDecl> protocols) {
		List<ObjCProtocolDecl> sorted = new ArrayList<>(protocols);
		Collections.sort(sorted, (a, b) -> a.getName().compareTo(b.getName()));
		List<ObjCProtocolDecl> unique = new ArrayList<>(sorted.size());
		for (ObjCProtocolDecl p : sorted)
			if (unique.isEmpty() || unique.get(unique.size() - 1) != p)
				unique.add(p);
		return unique;
	}

	/**
	 * Returns a use of an Objective-C type parameter.  Its canonical type is
	 * the parameter's bound with the protocols applied.
	 */
	public QualType getObjCTypeParamType(ObjCTypeParamDecl decl, List<ObjCProtocolDecl> protocols) {
		ObjCTypeParamType t = lookup(ObjCTypeParamType.profile(decl, protocols), ObjCTypeParamType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = decl.getUnderlyingType();
		if (!protocols.isEmpty())
			canon = applyObjCProtocolQualifiers(canon, protocols, true);
		return intern(new ObjCTypeParamType(this, decl, canon.getCanonicalType(), protocols)).asQualType();
	}

	/**
	 * Applies protocol qualifiers to a type parameter, object type,
	 * {@code id} or {@code Class}, replacing any already present (or, for
	 * object pointers when allowed, adding to them).
	 * @param type the type to qualify
	 * @param protocols the protocols
	 * @param allowOnPointerType whether to qualify the pointee of an
	 * object pointer type
	 * @return the qualified type
	 * @throws IllegalArgumentException if protocols can't be applied to the
	 * type
	 */
	public QualType applyObjCProtocolQualifiers(QualType type, List<ObjCProtocolDecl> protocols, boolean allowOnPointerType) {
		Type t = type.getTypePtr();
		if (t instanceof ObjCTypeParamType)
			return getObjCTypeParamType(((ObjCTypeParamType)t).getDecl(), protocols);
		if (allowOnPointerType && t instanceof ObjCObjectPointerType) {
			ObjCObjectType obj = ((ObjCObjectPointerType)t).getObjectType();
			List<ObjCProtocolDecl> merged = ImmutableList.<ObjCProtocolDecl>builder()
					.addAll(obj.getProtocols()).addAll(protocols).build();
			return getObjCObjectPointerType(getObjCObjectType(obj.getBaseType(), obj.getTypeArgsAsWritten(),
					merged, obj.isKindOfTypeAsWritten()));
		}
		if (t instanceof ObjCObjectType) {
			ObjCObjectType obj = (ObjCObjectType)t;
			return getObjCObjectType(obj.getBaseType(), obj.getTypeArgsAsWritten(), protocols, obj.isKindOfTypeAsWritten());
		}
		if (t.isObjCObjectType())
			return getObjCObjectType(type, ImmutableList.<QualType>of(), protocols, false);
		if (t.isObjCIdType() || t.isObjCClassType()) {
			ObjCObjectPointerType ptr = t.castAs(ObjCObjectPointerType.class);
			BuiltinType.Kind kind = t.isObjCIdType() ? BuiltinType.Kind.OBJC_ID : BuiltinType.Kind.OBJC_CLASS;
			return getObjCObjectPointerType(getObjCObjectType(getBuiltinType(kind), ImmutableList.<QualType>of(),
					protocols, ptr.isKindOfType()));
		}
		throw new IllegalArgumentException("can't apply protocol qualifiers to " + type);
	}

	/**
	 * Returns {@code id}: a pointer to the object type based on the builtin
	 * id type.
	 * @return the id type
	 */
	public QualType getObjCIdType() {
		return getObjCObjectPointerType(getObjCObjectType(getBuiltinType(BuiltinType.Kind.OBJC_ID),
				ImmutableList.<QualType>of(), ImmutableList.<ObjCProtocolDecl>of(), false));
	}

	public QualType getObjCClassType() {
		return getObjCObjectPointerType(getObjCObjectType(getBuiltinType(BuiltinType.Kind.OBJC_CLASS),
				ImmutableList.<QualType>of(), ImmutableList.<ObjCProtocolDecl>of(), false));
	}

	public QualType getObjCSelType() {
		return getPointerType(getBuiltinType(BuiltinType.Kind.OBJC_SEL));
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Atomic, pipe and Checked C">
	public QualType getAtomicType(QualType value) {
		AtomicType t = lookup(AtomicType.profile(value), AtomicType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!value.isCanonical())
			canon = getAtomicType(value.getCanonicalType());
		return intern(new AtomicType(this, value, canon)).asQualType();
	}

	public QualType getPipeType(QualType element, boolean readOnly) {
		PipeType t = lookup(PipeType.profile(element, readOnly), PipeType.class);
		if (t != null)
			return t.asQualType();
		QualType canon = null;
		if (!element.isCanonical())
			canon = getPipeType(element.getCanonicalType(), readOnly);
		return intern(new PipeType(this, element, readOnly, canon)).asQualType();
	}

	public QualType getTypeVariableType(int depth, int index, boolean boundsInterface) {
		TypeVariableType t = lookup(TypeVariableType.profile(depth, index, boundsInterface), TypeVariableType.class);
		if (t != null)
			return t.asQualType();
		return intern(new TypeVariableType(this, depth, index, boundsInterface)).asQualType();
	}
	//</editor-fold>
}
