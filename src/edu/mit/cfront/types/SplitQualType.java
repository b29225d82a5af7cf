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

/**
 * A type node and the qualifiers applied to it, taken apart.
 */
public final class SplitQualType {
	private final Type type;
	private final Qualifiers quals;

	public SplitQualType(Type type, Qualifiers quals) {
		this.type = checkNotNull(type);
		this.quals = checkNotNull(quals);
	}

	public Type getType() {
		return type;
	}

	public Qualifiers getQualifiers() {
		return quals;
	}

	public QualType join() {
		return new QualType(type, quals);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final SplitQualType other = (SplitQualType)obj;
		return type == other.type && quals.equals(other.quals);
	}

	@Override
	public int hashCode() {
		int hash = 3;
		hash = 29 * hash + System.identityHashCode(type);
		hash = 29 * hash + quals.hashCode();
		return hash;
	}

	@Override
	public String toString() {
		return join().toString();
	}
}
