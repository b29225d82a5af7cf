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

import edu.mit.cfront.ast.FieldDecl;
import edu.mit.cfront.ast.RecordDecl;

/**
 * A struct, union or class type.
 */
public final class RecordType extends TagType {
	RecordType(TypeFactory factory, RecordDecl decl) {
		super(factory, TypeClass.RECORD, decl, null);
	}

	@Override
	public RecordDecl getDecl() {
		return (RecordDecl)super.getDecl();
	}

	/**
	 * Returns true if this record has a const-qualified field, directly or
	 * in a nested record field.
	 * @return true if this record has const fields
	 */
	public boolean hasConstFields() {
		for (FieldDecl fd : getDecl().fields()) {
			QualType fieldType = fd.getType();
			if (fieldType.isConstQualified())
				return true;
			RecordType nested = fieldType.getCanonicalType().getTypePtr().getAs(RecordType.class);
			if (nested != null && nested.hasConstFields())
				return true;
		}
		return false;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitRecord(this);
	}
}
