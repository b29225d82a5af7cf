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
 * A type with a type attribute written on it.  The modified type is the type
 * as written without the attribute; the equivalent type is what the
 * attribute turned it into, and is what this node desugars to.
 */
public final class AttributedType extends Type {
	public enum Kind {
		ADDRESS_SPACE("address_space"),
		REGPARM("regparm"),
		VECTOR_SIZE("vector_size"),
		NEON_VECTOR_TYPE("neon_vector_type"),
		NEON_POLYVECTOR_TYPE("neon_polyvector_type"),
		OBJC_GC("objc_gc"),
		OBJC_OWNERSHIP("objc_ownership"),
		OBJC_INERT_UNSAFE_UNRETAINED("__unsafe_unretained"),
		PCS("pcs"),
		PCS_VFP("pcs_vfp"),
		NONNULL("_Nonnull"),
		NULLABLE("_Nullable"),
		NULL_UNSPECIFIED("_Null_unspecified"),
		OBJC_KINDOF("__kindof"),
		NS_RETURNS_RETAINED("ns_returns_retained"),
		NORETURN("noreturn"),
		CDECL("cdecl"),
		FASTCALL("fastcall"),
		STDCALL("stdcall"),
		THISCALL("thiscall"),
		REGCALL("regcall"),
		PASCAL("pascal"),
		SWIFTCALL("swiftcall"),
		VECTORCALL("vectorcall"),
		INTELOCLBICC("inteloclbicc"),
		MS_ABI("ms_abi"),
		SYSV_ABI("sysv_abi"),
		PRESERVE_MOST("preserve_most"),
		PRESERVE_ALL("preserve_all"),
		PTR32("__ptr32"),
		PTR64("__ptr64"),
		SPTR("__sptr"),
		UPTR("__uptr");

		private final String spelling;
		private Kind(String spelling) {
			this.spelling = spelling;
		}

		public String getSpelling() {
			return spelling;
		}
	}

	private final Kind attrKind;
	private final QualType modifiedType;
	private final QualType equivalentType;

	AttributedType(TypeFactory factory, Kind attrKind, QualType modifiedType, QualType equivalentType, QualType canon) {
		super(factory, TypeClass.ATTRIBUTED, canon,
				equivalentType.getTypePtr().isDependentType(),
				equivalentType.getTypePtr().isInstantiationDependentType(),
				equivalentType.getTypePtr().isVariablyModifiedType(),
				equivalentType.getTypePtr().containsUnexpandedParameterPack());
		this.attrKind = attrKind;
		this.modifiedType = modifiedType;
		this.equivalentType = equivalentType;
	}

	public Kind getAttrKind() {
		return attrKind;
	}

	public QualType getModifiedType() {
		return modifiedType;
	}

	public QualType getEquivalentType() {
		return equivalentType;
	}

	/**
	 * Returns true if this attribute is one of those that act like
	 * qualifiers: address spaces, Objective-C GC and ownership, and
	 * nullability.
	 * @return true if this attribute is qualifier-like
	 */
	public boolean isQualifier() {
		switch (attrKind) {
			case ADDRESS_SPACE:
			case OBJC_GC:
			case OBJC_OWNERSHIP:
			case OBJC_INERT_UNSAFE_UNRETAINED:
			case NONNULL:
			case NULLABLE:
			case NULL_UNSPECIFIED:
				return true;
			default:
				return false;
		}
	}

	public boolean isMSTypeSpec() {
		switch (attrKind) {
			case PTR32:
			case PTR64:
			case SPTR:
			case UPTR:
				return true;
			default:
				return false;
		}
	}

	public boolean isCallingConv() {
		switch (attrKind) {
			case PCS:
			case PCS_VFP:
			case CDECL:
			case FASTCALL:
			case STDCALL:
			case THISCALL:
			case REGCALL:
			case SWIFTCALL:
			case VECTORCALL:
			case PASCAL:
			case MS_ABI:
			case SYSV_ABI:
			case INTELOCLBICC:
			case PRESERVE_MOST:
			case PRESERVE_ALL:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Returns the nullability this attribute spells, if it's a nullability
	 * attribute.
	 * @return the nullability, or null
	 */
	public NullabilityKind getImmediateNullability() {
		switch (attrKind) {
			case NONNULL:
				return NullabilityKind.NON_NULL;
			case NULLABLE:
				return NullabilityKind.NULLABLE;
			case NULL_UNSPECIFIED:
				return NullabilityKind.UNSPECIFIED;
			default:
				return null;
		}
	}

	/**
	 * Removes a nullability attribute from the outside of the given type,
	 * keeping its local qualifiers.
	 * @param type a type
	 * @return the type without its outer nullability attribute
	 */
	public static QualType stripOuterNullability(QualType type) {
		Type t = type.getTypePtr();
		if (t instanceof AttributedType && ((AttributedType)t).getImmediateNullability() != null)
			return ((AttributedType)t).getModifiedType().withQualifiers(type.getLocalQualifiers());
		return type;
	}

	@Override
	public boolean isSugared() {
		return true;
	}

	@Override
	public QualType desugar() {
		return equivalentType;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitAttributed(this);
	}

	static TypeProfile profile(Kind attrKind, QualType modifiedType, QualType equivalentType) {
		return new TypeProfile().addValue(TypeClass.ATTRIBUTED).addValue(attrKind)
				.addQualType(modifiedType).addQualType(equivalentType);
	}

	@Override
	TypeProfile profile() {
		return profile(attrKind, modifiedType, equivalentType);
	}

	@Override
	public String toString() {
		return modifiedType + " " + attrKind.getSpelling();
	}
}
