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
 * A fundamental type: void, the integer and floating types, nullptr_t, the
 * Objective-C and OpenCL builtins, and the placeholder types used for
 * expressions whose type isn't known yet.  Each kind has a single node per
 * factory.
 */
public final class BuiltinType extends Type {
	/**
	 * The builtin kinds.  The declaration order is significant: the integer,
	 * signed, unsigned, floating and placeholder families are contiguous
	 * ranges.
	 */
	public enum Kind {
		VOID("void"),
		//unsigned integers
		BOOL(null),
		CHAR_U("char"),
		UCHAR("unsigned char"),
		WCHAR_U(null),
		CHAR16("char16_t"),
		CHAR32("char32_t"),
		USHORT("unsigned short"),
		UINT("unsigned int"),
		ULONG("unsigned long"),
		ULONGLONG("unsigned long long"),
		UINT128("unsigned __int128"),
		//signed integers
		CHAR_S("char"),
		SCHAR("signed char"),
		WCHAR_S(null),
		SHORT("short"),
		INT("int"),
		LONG("long"),
		LONGLONG("long long"),
		INT128("__int128"),
		//floating
		HALF(null),
		FLOAT("float"),
		DOUBLE("double"),
		LONGDOUBLE("long double"),
		FLOAT16("_Float16"),
		FLOAT128("__float128"),
		NULLPTR("nullptr_t"),
		OBJC_ID("id"),
		OBJC_CLASS("Class"),
		OBJC_SEL("SEL"),
		OCL_IMAGE1D_RO("__read_only image1d_t"),
		OCL_IMAGE2D_RO("__read_only image2d_t"),
		OCL_IMAGE3D_RO("__read_only image3d_t"),
		OCL_IMAGE2D_WO("__write_only image2d_t"),
		OCL_IMAGE2D_RW("__read_write image2d_t"),
		OCL_SAMPLER("sampler_t"),
		OCL_EVENT("event_t"),
		OCL_CLK_EVENT("clk_event_t"),
		OCL_QUEUE("queue_t"),
		OCL_RESERVE_ID("reserve_id_t"),
		DEPENDENT("<dependent type>"),
		//placeholders
		OVERLOAD("<overloaded function type>"),
		BOUND_MEMBER("<bound member function type>"),
		PSEUDO_OBJECT("<pseudo-object type>"),
		UNKNOWN_ANY("<unknown type>"),
		BUILTIN_FN("<builtin fn type>"),
		ARC_UNBRIDGED_CAST("<ARC unbridged cast type>"),
		OMP_ARRAY_SECTION("<OpenMP array section type>");

		private final String spelling;
		private Kind(String spelling) {
			this.spelling = spelling;
		}

		public boolean isImage() {
			return compareTo(OCL_IMAGE1D_RO) >= 0 && compareTo(OCL_IMAGE2D_RW) <= 0;
		}
	}

	private final Kind kind;

	BuiltinType(TypeFactory factory, Kind kind) {
		super(factory, TypeClass.BUILTIN, null, kind == Kind.DEPENDENT, kind == Kind.DEPENDENT, false, false);
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Returns this type's spelling under the given policy.
	 * @param policy the printing policy
	 * @return the name
	 */
	public String getName(PrintingPolicy policy) {
		switch (kind) {
			case BOOL:
				return policy.printsBool() ? "bool" : "_Bool";
			case HALF:
				return policy.printsHalf() ? "half" : "__fp16";
			case WCHAR_S:
			case WCHAR_U:
				return policy.printsMSWChar() ? "__wchar_t" : "wchar_t";
			default:
				assert kind.spelling != null : kind;
				return kind.spelling;
		}
	}

	public boolean isInteger() {
		return kind.compareTo(Kind.BOOL) >= 0 && kind.compareTo(Kind.INT128) <= 0;
	}
	public boolean isSignedInteger() {
		return kind.compareTo(Kind.CHAR_S) >= 0 && kind.compareTo(Kind.INT128) <= 0;
	}
	public boolean isUnsignedInteger() {
		return kind.compareTo(Kind.BOOL) >= 0 && kind.compareTo(Kind.UINT128) <= 0;
	}
	public boolean isFloatingPoint() {
		return kind.compareTo(Kind.HALF) >= 0 && kind.compareTo(Kind.FLOAT128) <= 0;
	}

	/**
	 * Returns true if this is a placeholder type: one of the kinds from
	 * {@link Kind#OVERLOAD} on.
	 * @return true if this is a placeholder
	 */
	@Override
	public boolean isPlaceholderType() {
		return kind.compareTo(Kind.OVERLOAD) >= 0;
	}

	/**
	 * Returns true if this is a placeholder type other than the overload
	 * placeholder.
	 * @return true if this is a non-overload placeholder
	 */
	@Override
	public boolean isNonOverloadPlaceholderType() {
		return kind.compareTo(Kind.OVERLOAD) > 0;
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
		return visitor.visitBuiltin(this);
	}

	@Override
	TypeProfile profile() {
		return new TypeProfile().addValue(TypeClass.BUILTIN).addValue(kind);
	}

	@Override
	public String toString() {
		return getName(PrintingPolicy.of(getTypeFactory().getLangOpts()));
	}
}
