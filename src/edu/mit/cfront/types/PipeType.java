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
 * An OpenCL 2.0 pipe.
 */
public final class PipeType extends Type {
	private final QualType elementType;
	private final boolean readOnly;

	PipeType(TypeFactory factory, QualType elementType, boolean readOnly, QualType canon) {
		super(factory, TypeClass.PIPE, canon, false, false, false, false);
		inheritFlags(elementType);
		this.elementType = elementType;
		this.readOnly = readOnly;
	}

	public QualType getElementType() {
		return elementType;
	}

	public boolean isReadOnly() {
		return readOnly;
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
		return visitor.visitPipe(this);
	}

	static TypeProfile profile(QualType elementType, boolean readOnly) {
		return new TypeProfile().addValue(TypeClass.PIPE).addQualType(elementType).addBoolean(readOnly);
	}

	@Override
	TypeProfile profile() {
		return profile(elementType, readOnly);
	}

	@Override
	public String toString() {
		return (readOnly ? "read_only" : "write_only") + " pipe " + elementType;
	}
}
