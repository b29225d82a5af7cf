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
import static com.google.common.base.Preconditions.checkState;
import edu.mit.cfront.ast.FieldDecl;
import edu.mit.cfront.ast.RecordDecl;
import edu.mit.cfront.basic.TargetLayout;
import java.util.HashMap;
import java.util.Map;

/**
 * An LP64 target layout.  Builtin and pointer sizes are fixed; record sizes
 * and offsets are whatever {@link #layOut(RecordDecl)} or the test assigned.
 */
final class TestLayout implements TargetLayout {
	private final boolean microsoftABI;
	private final Map<RecordDecl, Long> recordSizes = new HashMap<>();
	private final Map<RecordDecl, Long> recordAligns = new HashMap<>();
	private final Map<FieldDecl, Long> fieldOffsets = new HashMap<>();
	private final Map<RecordDecl, Map<RecordDecl, Long>> baseOffsets = new HashMap<>();

	TestLayout() {
		this(false);
	}

	TestLayout(boolean microsoftABI) {
		this.microsoftABI = microsoftABI;
	}

	/**
	 * Lays out the record's fields in order, each at its natural alignment,
	 * after whatever bases have been placed.  Unions put every field at zero.
	 * @return the record's size in bits
	 */
	long layOut(RecordDecl record) {
		long offset = 0, align = 8;
		Map<RecordDecl, Long> bases = baseOffsets.get(record);
		if (bases != null)
			for (Map.Entry<RecordDecl, Long> e : bases.entrySet()) {
				offset = Math.max(offset, e.getValue() + recordSizes.get(e.getKey()));
				align = Math.max(align, recordAligns.get(e.getKey()));
			}
		long size = offset;
		for (FieldDecl f : record.fields()) {
			long fieldAlign = getTypeAlign(f.getType());
			align = Math.max(align, fieldAlign);
			if (record.isUnion()) {
				fieldOffsets.put(f, 0L);
				size = Math.max(size, getTypeSize(f.getType()));
			} else {
				offset = roundUp(offset, fieldAlign);
				fieldOffsets.put(f, offset);
				offset += getTypeSize(f.getType());
				size = offset;
			}
		}
		size = Math.max(roundUp(size, align), 8);
		recordSizes.put(record, size);
		recordAligns.put(record, align);
		return size;
	}

	void setBaseOffset(RecordDecl derived, RecordDecl base, long bits) {
		Map<RecordDecl, Long> m = baseOffsets.get(derived);
		if (m == null) {
			m = new HashMap<>();
			baseOffsets.put(derived, m);
		}
		m.put(base, bits);
	}

	private static long roundUp(long value, long align) {
		return (value + align - 1) / align * align;
	}

	@Override
	public int getCharWidth() {
		return 8;
	}

	@Override
	public long getTypeSize(QualType type) {
		Type t = type.getCanonicalType().getTypePtr();
		checkArgument(!t.isDependentType(), "dependent type %s", type);
		switch (t.getTypeClass()) {
			case BUILTIN:
				return builtinSize(((BuiltinType)t).getKind());
			case POINTER:
			case BLOCK_POINTER:
			case OBJC_OBJECT_POINTER:
			case LVALUE_REFERENCE:
			case RVALUE_REFERENCE:
				return 64;
			case MEMBER_POINTER:
				return ((MemberPointerType)t).isMemberFunctionPointer() ? 128 : 64;
			case COMPLEX:
				return 2 * getTypeSize(((ComplexType)t).getElementType());
			case CONSTANT_ARRAY: {
				ConstantArrayType array = (ConstantArrayType)t;
				return array.getSize().longValue() * getTypeSize(array.getElementType());
			}
			case VECTOR:
			case EXT_VECTOR: {
				VectorType vector = (VectorType)t;
				return vector.getNumElements() * getTypeSize(vector.getElementType());
			}
			case ENUM:
				return getTypeSize(((EnumType)t).getDecl().getIntegerType());
			case ATOMIC:
				return getTypeSize(((AtomicType)t).getValueType());
			case RECORD: {
				Long size = recordSizes.get(((RecordType)t).getDecl());
				checkState(size != null, "%s has not been laid out", type);
				return size;
			}
			default:
				throw new IllegalArgumentException("no size for " + type);
		}
	}

	private static long builtinSize(BuiltinType.Kind kind) {
		switch (kind) {
			case BOOL:
			case CHAR_U:
			case CHAR_S:
			case UCHAR:
			case SCHAR:
				return 8;
			case SHORT:
			case USHORT:
			case CHAR16:
			case HALF:
			case FLOAT16:
				return 16;
			case INT:
			case UINT:
			case WCHAR_S:
			case WCHAR_U:
			case CHAR32:
			case FLOAT:
				return 32;
			case INT128:
			case UINT128:
			case LONGDOUBLE:
			case FLOAT128:
				return 128;
			default:
				return 64;
		}
	}

	@Override
	public long getTypeAlign(QualType type) {
		Type t = type.getCanonicalType().getTypePtr();
		if (t.isArrayType())
			return getTypeAlign(type.getTypeFactory().getBaseElementType(type));
		if (t.isRecordType()) {
			Long align = recordAligns.get(t.getAs(RecordType.class).getDecl());
			checkState(align != null, "%s has not been laid out", type);
			return align;
		}
		return Math.min(getTypeSize(type), 128);
	}

	@Override
	public long getFieldOffset(FieldDecl field) {
		Long offset = fieldOffsets.get(field);
		checkState(offset != null, "no offset for %s", field);
		return offset;
	}

	@Override
	public long getBaseClassOffset(RecordDecl derived, QualType base) {
		Map<RecordDecl, Long> m = baseOffsets.get(derived);
		RecordDecl baseDecl = base.getTypePtr().getAs(RecordType.class).getDecl();
		checkState(m != null && m.containsKey(baseDecl), "no offset for base %s of %s", base, derived);
		return m.get(baseDecl);
	}

	@Override
	public int getSizeTypeWidth() {
		return 64;
	}

	@Override
	public boolean isMicrosoftABI() {
		return microsoftABI;
	}
}
