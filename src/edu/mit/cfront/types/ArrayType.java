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
 * The base of the array types.  The element type and the qualifiers and
 * size modifier written inside the brackets (as in a C99 array parameter
 * {@code int a[static const 10]}) are common to all array types.
 */
public abstract class ArrayType extends Type {
	/**
	 * Modifiers that can appear inside array brackets.
	 */
	public enum ArraySizeModifier {
		NORMAL, STATIC, STAR;
	}

	private final QualType elementType;
	private final ArraySizeModifier sizeModifier;
	private final int indexTypeQuals;
	private final CheckedArrayKind kind;

	ArrayType(TypeFactory factory, TypeClass typeClass, QualType elementType, QualType canon,
			ArraySizeModifier sizeModifier, int indexTypeQuals, CheckedArrayKind kind, boolean sizeContainsPack) {
		super(factory, typeClass, canon,
				typeClass == TypeClass.DEPENDENT_SIZED_ARRAY,
				typeClass == TypeClass.DEPENDENT_SIZED_ARRAY,
				typeClass == TypeClass.VARIABLE_ARRAY,
				sizeContainsPack);
		this.elementType = elementType;
		this.sizeModifier = sizeModifier;
		this.indexTypeQuals = indexTypeQuals & Qualifiers.CVR_MASK;
		this.kind = kind;
		inheritFlags(elementType);
	}

	public QualType getElementType() {
		return elementType;
	}

	public ArraySizeModifier getSizeModifier() {
		return sizeModifier;
	}

	public Qualifiers getIndexTypeQualifiers() {
		return Qualifiers.fromCVRUMask(indexTypeQuals);
	}

	public int getIndexTypeCVRQualifiers() {
		return indexTypeQuals;
	}

	public CheckedArrayKind getKind() {
		return kind;
	}

	/**
	 * Returns true if this is a Checked C array ({@code _Checked} or
	 * {@code _Nt_checked}).
	 * @return true if this array is checked
	 */
	public boolean isChecked() {
		return kind != CheckedArrayKind.UNCHECKED;
	}

	@Override
	public final boolean isSugared() {
		return false;
	}

	@Override
	public final QualType desugar() {
		return asQualType();
	}

	String bracketPrefix() {
		StringBuilder sb = new StringBuilder();
		if (kind == CheckedArrayKind.CHECKED)
			sb.append("_Checked ");
		else if (kind == CheckedArrayKind.NT_CHECKED)
			sb.append("_Nt_checked ");
		if (sizeModifier == ArraySizeModifier.STATIC)
			sb.append("static ");
		if (indexTypeQuals != 0)
			sb.append(getIndexTypeQualifiers()).append(' ');
		return sb.toString();
	}
}
