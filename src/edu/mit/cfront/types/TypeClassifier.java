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

import edu.mit.cfront.ast.CXXBaseSpecifier;
import edu.mit.cfront.ast.CXXRecordDecl;
import edu.mit.cfront.ast.FieldDecl;
import edu.mit.cfront.ast.RecordDecl;
import edu.mit.cfront.basic.LangOptions;
import edu.mit.cfront.basic.TargetLayout;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The language-standard classifications of types: POD, trivial, trivially
 * copyable, standard-layout, literal, and unique object representations.
 * Incomplete and dependent types classify as false; only incomplete arrays
 * are looked through, as the standard allows.
 */
final class TypeClassifier {
	private TypeClassifier() {}

	static boolean isPODType(QualType type) {
		if (type.getTypeFactory().getLangOpts().isCPlusPlus11())
			return isCXX11PODType(type);
		return isCXX98PODType(type);
	}

	static boolean isCXX98PODType(QualType type) {
		TypeFactory factory = type.getTypeFactory();
		if (type.getTypePtr().isIncompleteArrayType())
			return isCXX98PODType(factory.getBaseElementType(type));
		if (type.getTypePtr().isIncompleteType())
			return false;
		if (type.hasNonTrivialObjCLifetime())
			return false;
		Type canon = type.getTypePtr().getCanonicalTypeInternal().getTypePtr();
		switch (canon.getTypeClass()) {
			case VARIABLE_ARRAY:
			case CONSTANT_ARRAY:
				return isCXX98PODType(factory.getBaseElementType(type));
			case OBJC_OBJECT_POINTER:
			case BLOCK_POINTER:
			case BUILTIN:
			case COMPLEX:
			case POINTER:
			case MEMBER_POINTER:
			case VECTOR:
			case EXT_VECTOR:
			case ENUM:
				return true;
			case RECORD: {
				RecordDecl decl = ((RecordType)canon).getDecl();
				//C structs and unions are POD.
				return !(decl instanceof CXXRecordDecl) || ((CXXRecordDecl)decl).isPOD();
			}
			default:
				return false;
		}
	}

	/**
	 * Returns true if the type is POD under the C++11 definition: both
	 * trivial and standard-layout.
	 */
	static boolean isCXX11PODType(QualType type) {
		Type t = type.getTypePtr();
		if (t.isDependentType())
			return false;
		if (type.hasNonTrivialObjCLifetime())
			return false;
		Type base = t.getBaseElementTypeUnsafe();
		if (base.isIncompleteType())
			return false;
		if (base.isScalarType() || base.isVectorType())
			return true;
		RecordType rt = base.getAs(RecordType.class);
		if (rt != null) {
			if (rt.getDecl() instanceof CXXRecordDecl) {
				CXXRecordDecl decl = (CXXRecordDecl)rt.getDecl();
				return decl.isTrivial() && decl.isStandardLayout();
			}
			return true;
		}
		return false;
	}

	static boolean isTrivialType(QualType type) {
		if (type.getTypePtr().isArrayType())
			return isTrivialType(type.getTypeFactory().getBaseElementType(type));
		if (type.getTypePtr().isIncompleteType())
			return false;
		if (type.hasNonTrivialObjCLifetime())
			return false;
		Type canon = type.getTypePtr().getCanonicalTypeInternal().getTypePtr();
		if (canon.isDependentType())
			return false;
		if (canon.isScalarType() || canon.isVectorType())
			return true;
		RecordType rt = canon.getAs(RecordType.class);
		if (rt != null) {
			if (rt.getDecl() instanceof CXXRecordDecl) {
				CXXRecordDecl decl = (CXXRecordDecl)rt.getDecl();
				return decl.hasDefaultConstructor() && !decl.hasNonTrivialDefaultConstructor()
						&& decl.isTriviallyCopyable();
			}
			return true;
		}
		return false;
	}

	static boolean isTriviallyCopyableType(QualType type) {
		if (type.getTypePtr().isArrayType())
			return isTriviallyCopyableType(type.getTypeFactory().getBaseElementType(type));
		if (type.hasNonTrivialObjCLifetime())
			return false;
		Type canon = type.getCanonicalType().getTypePtr();
		if (canon.isDependentType())
			return false;
		if (canon.isIncompleteType())
			return false;
		if (canon.isScalarType() || canon.isVectorType())
			return true;
		RecordType rt = canon.getAs(RecordType.class);
		if (rt != null)
			return !(rt.getDecl() instanceof CXXRecordDecl) || ((CXXRecordDecl)rt.getDecl()).isTriviallyCopyable();
		return false;
	}

	static boolean isLiteralType(Type type) {
		if (type.isDependentType())
			return false;
		LangOptions opts = type.getTypeFactory().getLangOpts();
		if (opts.isCPlusPlus14() && type.isVoidType())
			return true;
		if (type.isVariableArrayType())
			return false;
		Type base = type.getBaseElementTypeUnsafe();
		if (base.isIncompleteType())
			return false;
		if (base.isScalarType() || base.isVectorType() || base.isAnyComplexType())
			return true;
		if (base.isReferenceType())
			return true;
		RecordType rt = base.getAs(RecordType.class);
		if (rt != null)
			return !(rt.getDecl() instanceof CXXRecordDecl) || ((CXXRecordDecl)rt.getDecl()).isLiteral();
		AtomicType at = base.getAs(AtomicType.class);
		if (at != null)
			return isLiteralType(at.getValueType().getTypePtr());
		//An undeduced auto will probably work out to be a literal type.
		return base.getCanonicalTypeInternal().getTypePtr() instanceof AutoType;
	}

	static boolean isStandardLayoutType(Type type) {
		if (type.isDependentType())
			return false;
		Type base = type.getBaseElementTypeUnsafe();
		if (base.isIncompleteType())
			return false;
		if (base.isScalarType() || base.isVectorType())
			return true;
		RecordType rt = base.getAs(RecordType.class);
		if (rt != null)
			return !(rt.getDecl() instanceof CXXRecordDecl) || ((CXXRecordDecl)rt.getDecl()).isStandardLayout();
		return false;
	}

	static boolean isNonWeakInMRRWithObjCWeak(QualType type) {
		LangOptions opts = type.getTypeFactory().getLangOpts();
		return !opts.isObjCAutoRefCount() && opts.isObjCWeak()
				&& type.getObjCLifetime() != Qualifiers.ObjCLifetime.WEAK;
	}

	//<editor-fold defaultstate="collapsed" desc="Unique object representations">
	/**
	 * Returns true if any two objects of this type with the same value have
	 * the same object representation: trivially copyable, with no padding
	 * bits anywhere.  Records are checked by tiling their bases and fields
	 * against the target's layout.
	 */
	static boolean hasUniqueObjectRepresentations(QualType type) {
		Type t = type.getTypePtr();
		if (t.isArrayType())
			return hasUniqueObjectRepresentations(type.getTypeFactory().getBaseElementType(type));
		if (!isTriviallyCopyableType(type))
			return false;
		if (t.isFunctionType())
			return false;
		if (t.isIntegralOrEnumerationType())
			return true;
		if (t.isPointerType() || t.isMemberPointerType())
			return true;
		if (t.isRecordType()) {
			RecordDecl record = t.getAs(RecordType.class).getDecl();
			if (record.isLambda())
				return false;
			if (record.isUnion())
				return unionHasUniqueObjectRepresentations(type, record);
			return structHasUniqueObjectRepresentations(type, record);
		}
		return false;
	}

	private static boolean unionHasUniqueObjectRepresentations(QualType type, RecordDecl union) {
		TargetLayout layout = type.getTypeFactory().getTargetLayout();
		long unionSize = layout.getTypeSizeInChars(type);
		for (FieldDecl field : union.fields()) {
			if (!hasUniqueObjectRepresentations(field.getType()))
				return false;
			if (layout.getTypeSizeInChars(field.getType()) != unionSize)
				return false;
		}
		return true;
	}

	private static boolean isStructEmpty(QualType type) {
		RecordDecl record = type.getTypePtr().castAs(RecordType.class).getDecl();
		if (!record.fields().isEmpty())
			return false;
		if (record instanceof CXXRecordDecl)
			return ((CXXRecordDecl)record).isEmpty();
		return true;
	}

	private static boolean structHasUniqueObjectRepresentations(QualType type, RecordDecl record) {
		assert type.getTypePtr().isStructureOrClassType() : type;
		if (isStructEmpty(type))
			return false;
		TargetLayout layout = type.getTypeFactory().getTargetLayout();
		int charWidth = layout.getCharWidth();

		long curOffset = 0;
		if (record instanceof CXXRecordDecl) {
			CXXRecordDecl decl = (CXXRecordDecl)record;
			List<CXXBaseSpecifier> bases = new ArrayList<>();
			for (CXXBaseSpecifier base : decl.bases()) {
				if (base.isVirtual())
					return false;
				//Empty bases take no space.
				if (isStructEmpty(base.getType()))
					continue;
				RecordDecl baseDecl = base.getType().getTypePtr().castAs(RecordType.class).getDecl();
				if (!structHasUniqueObjectRepresentations(base.getType(), baseDecl))
					return false;
				bases.add(base);
			}
			bases.sort(Comparator.comparingLong(b -> layout.getBaseClassOffset(decl, b.getType())));
			for (CXXBaseSpecifier base : bases) {
				if (layout.getBaseClassOffset(decl, base.getType()) / charWidth != curOffset)
					return false;
				curOffset += layout.getTypeSizeInChars(base.getType());
			}
		}

		long structSize = layout.getTypeSizeInChars(type);
		for (FieldDecl field : record.fields()) {
			if (!hasUniqueObjectRepresentations(field.getType()))
				return false;
			if (layout.getFieldOffset(field) / charWidth != curOffset)
				return false;
			curOffset += layout.getTypeSizeInChars(field.getType());
		}
		//tail padding
		return curOffset == structSize;
	}
	//</editor-fold>
}
