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
 * A Checked C generic-function type variable, identified by its depth and
 * index in the enclosing type-variable lists.  Type variables behave like
 * {@code void}: incomplete, with external linkage.
 */
public final class TypeVariableType extends Type {
	private final int depth;
	private final int index;
	private final boolean boundsInterface;

	TypeVariableType(TypeFactory factory, int depth, int index, boolean boundsInterface) {
		super(factory, TypeClass.TYPE_VARIABLE, null, false, false, false, false);
		this.depth = depth;
		this.index = index;
		this.boundsInterface = boundsInterface;
	}

	public int getDepth() {
		return depth;
	}

	public int getIndex() {
		return index;
	}

	/**
	 * Returns true if this variable was introduced by a bounds-safe
	 * interface ({@code _Itype_for_any}) rather than {@code _For_any}.
	 * @return true for bounds-safe interface type variables
	 */
	public boolean isBoundsInterfaceType() {
		return boundsInterface;
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
		return visitor.visitTypeVariable(this);
	}

	static TypeProfile profile(int depth, int index, boolean boundsInterface) {
		return new TypeProfile().addValue(TypeClass.TYPE_VARIABLE).addInteger(depth).addInteger(index)
				.addBoolean(boundsInterface);
	}

	@Override
	TypeProfile profile() {
		return profile(depth, index, boundsInterface);
	}

	@Override
	public String toString() {
		return "(" + depth + ", " + index + ")";
	}
}
