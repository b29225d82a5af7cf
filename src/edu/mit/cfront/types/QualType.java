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
import edu.mit.cfront.ast.CXXRecordDecl;
import edu.mit.cfront.ast.DeclContext;
import edu.mit.cfront.ast.NamedDecl;
import edu.mit.cfront.basic.LangAS;
import java.util.List;

/**
 * A type node together with the qualifiers applied to it at this use.  Two
 * QualTypes denote the same type iff their canonical types are equal, which
 * (because canonical nodes are interned) is an identity comparison on the
 * node plus a value comparison on the qualifiers.
 * <p>
 * QualType instances are immutable.  {@link #equals(Object)} compares the
 * node by identity and the local qualifiers by value; it does not look
 * through sugar.
 */
public final class QualType {
	/**
	 * Kinds of destruction an object of a type requires.
	 */
	public enum DestructionKind {
		NONE, CXX_DESTRUCTOR, OBJC_STRONG_LIFETIME, OBJC_WEAK_LIFETIME;
	}

	private final Type type;
	private final Qualifiers quals;

	public QualType(Type type, Qualifiers quals) {
		this.type = checkNotNull(type);
		this.quals = checkNotNull(quals);
	}

	/**
	 * Returns the given node with no local qualifiers.
	 * @param type a type node
	 * @return an unqualified QualType
	 */
	public static QualType of(Type type) {
		return type.asQualType();
	}

	public Type getTypePtr() {
		return type;
	}

	public TypeFactory getTypeFactory() {
		return type.getTypeFactory();
	}

	public Qualifiers getLocalQualifiers() {
		return quals;
	}

	public boolean hasLocalQualifiers() {
		return !quals.isEmpty();
	}

	public boolean hasLocalNonFastQualifiers() {
		return quals.hasNonFastQualifiers();
	}

	public SplitQualType split() {
		return new SplitQualType(type, quals);
	}

	/**
	 * Returns this type with the given qualifiers added to its local
	 * qualifiers.
	 * @param extra the qualifiers to add
	 * @return the qualified type
	 */
	public QualType withQualifiers(Qualifiers extra) {
		if (extra.isEmpty())
			return this;
		return new QualType(type, quals.merge(extra));
	}

	public QualType withConst() {
		return withQualifiers(Qualifiers.fromCVRUMask(Qualifiers.CONST));
	}
	public QualType withVolatile() {
		return withQualifiers(Qualifiers.fromCVRUMask(Qualifiers.VOLATILE));
	}
	public QualType withRestrict() {
		return withQualifiers(Qualifiers.fromCVRUMask(Qualifiers.RESTRICT));
	}
	public QualType withCVRQualifiers(int mask) {
		return withQualifiers(Qualifiers.fromCVRUMask(mask));
	}

	/**
	 * Returns this node with no local qualifiers.  Qualifiers hidden inside
	 * sugar (such as a typedef of a const type) are not removed; see
	 * {@link #getUnqualifiedType()}.
	 * @return the locally-unqualified type
	 */
	public QualType getLocalUnqualifiedType() {
		return quals.isEmpty() ? this : type.asQualType();
	}

	public boolean isCanonical() {
		return type.isCanonicalUnqualified();
	}

	/**
	 * Returns the canonical form of this type: the canonical node of this
	 * node with the local qualifiers added to the canonical qualifiers.
	 * @return the canonical type
	 */
	public QualType getCanonicalType() {
		QualType canon = type.getCanonicalTypeInternal();
		if (quals.isEmpty())
			return canon;
		return new QualType(canon.type, canon.quals.merge(quals));
	}

	/**
	 * Returns all qualifiers on this type, both local and those hidden in
	 * sugar.
	 * @return the qualifiers
	 */
	public Qualifiers getQualifiers() {
		return quals.merge(type.getCanonicalTypeInternal().quals);
	}

	public boolean isLocalConstQualified() {
		return quals.hasConst();
	}
	public boolean isConstQualified() {
		return quals.hasConst() || type.getCanonicalTypeInternal().quals.hasConst();
	}
	public boolean isVolatileQualified() {
		return quals.hasVolatile() || type.getCanonicalTypeInternal().quals.hasVolatile();
	}
	public boolean isRestrictQualified() {
		return quals.hasRestrict() || type.getCanonicalTypeInternal().quals.hasRestrict();
	}
	public boolean hasQualifiers() {
		return !quals.isEmpty() || !type.getCanonicalTypeInternal().quals.isEmpty();
	}
	public int getAddressSpace() {
		return getQualifiers().getAddressSpace();
	}
	public Qualifiers.GC getObjCGCAttr() {
		return getQualifiers().getObjCGCAttr();
	}
	public Qualifiers.ObjCLifetime getObjCLifetime() {
		return getQualifiers().getObjCLifetime();
	}
	public boolean hasNonTrivialObjCLifetime() {
		return getQualifiers().hasNonTrivialObjCLifetime();
	}
	public boolean hasStrongOrWeakObjCLifetime() {
		return getQualifiers().hasStrongOrWeakObjCLifetime();
	}

	/**
	 * Returns this type with every qualifier removed, including those buried
	 * in sugar.  The result keeps as much sugar as possible: it is the
	 * deepest node at which a qualifier was found.
	 * @return the unqualified type
	 */
	public QualType getUnqualifiedType() {
		if (type.getCanonicalTypeInternal().quals.isEmpty())
			return type.asQualType();
		return getSplitUnqualifiedType().getType().asQualType();
	}

	/**
	 * Strips every layer of sugar that carries qualifiers, collecting the
	 * qualifiers from every layer.
	 * @return the node below the last qualified layer, with all collected
	 * qualifiers
	 */
	public SplitQualType getSplitUnqualifiedType() {
		Type cur = type;
		Qualifiers collected = quals;
		Type lastTypeWithQuals = type;
		while (true) {
			if (!cur.isSugared())
				return new SplitQualType(lastTypeWithQuals, collected);
			QualType next = cur.desugar();
			cur = next.type;
			if (!next.quals.isEmpty()) {
				lastTypeWithQuals = next.type;
				collected = collected.merge(next.quals);
			}
		}
	}

	/**
	 * Removes one layer of sugar, keeping the local qualifiers.
	 * @return the single-step desugared type
	 */
	public QualType getSingleStepDesugaredType() {
		return type.getLocallyUnqualifiedSingleStepDesugaredType().withQualifiers(quals);
	}

	/**
	 * Desugars until reaching a node that isn't sugar, collecting qualifiers
	 * along the way.  Sugar below the first non-sugar node is untouched.
	 * @return the desugared node and the collected qualifiers
	 */
	public SplitQualType getSplitDesugaredType() {
		Qualifiers collected = Qualifiers.NONE;
		QualType cur = this;
		while (true) {
			collected = collected.merge(cur.quals);
			if (!cur.type.isSugared())
				return new SplitQualType(cur.type, collected);
			cur = cur.type.desugar();
		}
	}

	public QualType getDesugaredType() {
		return getSplitDesugaredType().join();
	}

	/**
	 * Strips parentheses sugar from the outside of this type.
	 * @return the type without outer parens
	 */
	public QualType ignoreParens() {
		QualType t = this;
		while (t.type instanceof ParenType)
			t = ((ParenType)t.type).getInnerType();
		return t;
	}

	/**
	 * Returns true if objects of this type are constant: the type is
	 * const-qualified, is an array of constant elements, or is in the OpenCL
	 * constant address space.
	 * @return true if this type is constant
	 */
	public boolean isConstant() {
		if (isConstQualified())
			return true;
		ArrayType at = getTypeFactory().getAsArrayType(this);
		if (at != null)
			return at.getElementType().isConstant();
		return getAddressSpace() == LangAS.OPENCL_CONSTANT;
	}

	/**
	 * Looks through pointers, references and arrays to the named record,
	 * enum or typedef at the bottom, and returns its name.
	 * @return the name, or null if there isn't one
	 */
	public String getBaseTypeIdentifier() {
		NamedDecl nd = null;
		if (type.isPointerType() || type.isReferenceType())
			return type.getPointeeType().getBaseTypeIdentifier();
		else if (type.isRecordType())
			nd = type.getAs(RecordType.class).getDecl();
		else if (type.isEnumeralType())
			nd = type.getAs(EnumType.class).getDecl();
		else if (type.getTypeClass() == TypeClass.TYPEDEF)
			nd = ((TypedefType)type).getDecl();
		else if (type.isArrayType())
			return type.castAsArrayTypeUnsafe().getElementType().getBaseTypeIdentifier();
		return nd != null ? nd.getName() : null;
	}

	/**
	 * Returns the type of a prvalue expression of this type: references are
	 * stripped, and cv-qualifiers are dropped from non-class types (in C,
	 * from all types).
	 * @return the expression type
	 */
	public QualType getNonLValueExprType() {
		ReferenceType ref = type.getAs(ReferenceType.class);
		if (ref != null)
			return ref.getPointeeType();
		if (!getTypeFactory().getLangOpts().isCPlusPlus() || (!type.isDependentType() && !type.isRecordType()))
			return getUnqualifiedType();
		return this;
	}

	public QualType getAtomicUnqualifiedType() {
		AtomicType at = type.getAs(AtomicType.class);
		if (at != null)
			return at.getValueType().getUnqualifiedType();
		return getUnqualifiedType();
	}

	/**
	 * Returns what kind of cleanup an object of this type needs when it goes
	 * out of scope.
	 * @return the destruction kind
	 */
	public DestructionKind isDestructedType() {
		switch (getObjCLifetime()) {
			case NONE:
			case EXPLICIT_NONE:
			case AUTORELEASING:
				break;
			case STRONG:
				return DestructionKind.OBJC_STRONG_LIFETIME;
			case WEAK:
				return DestructionKind.OBJC_WEAK_LIFETIME;
			default:
				throw new AssertionError(getObjCLifetime());
		}
		CXXRecordDecl record = type.getBaseElementTypeUnsafe().getAsCXXRecordDecl();
		if (record != null && record.hasDefinition() && !record.hasTrivialDestructor())
			return DestructionKind.CXX_DESTRUCTOR;
		return DestructionKind.NONE;
	}

	public boolean isPODType() {
		return TypeClassifier.isPODType(this);
	}
	public boolean isCXX98PODType() {
		return TypeClassifier.isCXX98PODType(this);
	}
	public boolean isCXX11PODType() {
		return TypeClassifier.isCXX11PODType(this);
	}
	public boolean isTrivialType() {
		return TypeClassifier.isTrivialType(this);
	}
	public boolean isTriviallyCopyableType() {
		return TypeClassifier.isTriviallyCopyableType(this);
	}
	public boolean hasUniqueObjectRepresentations() {
		return TypeClassifier.hasUniqueObjectRepresentations(this);
	}
	public boolean isNonWeakInMRRWithObjCWeak() {
		return TypeClassifier.isNonWeakInMRRWithObjCWeak(this);
	}

	/**
	 * Substitutes the given type arguments for the Objective-C type
	 * parameters appearing in this type.
	 * @param typeArgs the arguments, indexed by parameter index; empty to
	 * substitute each parameter's bound
	 * @param context the position this type appears in
	 * @return the substituted type
	 */
	public QualType substObjCTypeArgs(List<QualType> typeArgs, ObjCSubstitutionContext context) {
		return ObjCTypeArgSubstitution.substObjCTypeArgs(this, typeArgs, context);
	}

	/**
	 * Substitutes into the type of a member declared in the given context, as
	 * accessed through an object of the given type.
	 * @param objectType the receiver type
	 * @param dc the member's declaration context
	 * @param context the position this type appears in
	 * @return the substituted type
	 */
	public QualType substObjCMemberType(QualType objectType, DeclContext dc, ObjCSubstitutionContext context) {
		return ObjCTypeArgSubstitution.substObjCMemberType(this, objectType, dc, context);
	}

	/**
	 * Removes every {@code __kindof} from this type.
	 * @return the stripped type
	 */
	public QualType stripObjCKindOfType() {
		return ObjCTypeArgSubstitution.stripObjCKindOfType(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final QualType other = (QualType)obj;
		return type == other.type && quals.equals(other.quals);
	}

	@Override
	public int hashCode() {
		int hash = 7;
		hash = 17 * hash + System.identityHashCode(type);
		hash = 17 * hash + quals.hashCode();
		return hash;
	}

	@Override
	public String toString() {
		if (quals.isEmpty())
			return type.toString();
		return quals + " " + type;
	}
}
