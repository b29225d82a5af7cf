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

import com.google.common.base.Equivalence;
import java.util.ArrayList;
import java.util.List;

/**
 * A structural key for interning type nodes.  Nodes, declarations and
 * expressions are added by identity; qualifiers and scalars by value.  Two
 * profiles are equal iff the same sequence of components was added.
 */
public final class TypeProfile {
	private final List<Object> components = new ArrayList<>();

	public TypeProfile addPointer(Object o) {
		components.add(Equivalence.identity().wrap(o));
		return this;
	}

	public TypeProfile addQualType(QualType t) {
		if (t == null) {
			addPointer(null);
			components.add(Qualifiers.NONE);
		} else {
			addPointer(t.getTypePtr());
			components.add(t.getLocalQualifiers());
		}
		return this;
	}

	public TypeProfile addInteger(long i) {
		components.add(i);
		return this;
	}

	public TypeProfile addBoolean(boolean b) {
		components.add(b);
		return this;
	}

	/**
	 * Adds a value-semantic component: an enum constant, a string, a
	 * {@link java.math.BigInteger} or null.
	 * @param o the value
	 * @return this
	 */
	public TypeProfile addValue(Object o) {
		components.add(o);
		return this;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final TypeProfile other = (TypeProfile)obj;
		return components.equals(other.components);
	}

	@Override
	public int hashCode() {
		return components.hashCode();
	}

	@Override
	public String toString() {
		return components.toString();
	}
}
