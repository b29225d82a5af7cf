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

import edu.mit.cfront.ast.Expr;
import java.util.Objects;

/**
 * The Checked C bounds expression and interop type annotation attached to
 * a function parameter or return value.  Both are optional; the
 * expressions are opaque here and only hashed by identity.
 */
public final class BoundsAnnotations {
	public static final BoundsAnnotations EMPTY = new BoundsAnnotations(null, null);
	private final Expr boundsExpr;
	private final Expr interopTypeExpr;

	public BoundsAnnotations(Expr boundsExpr, Expr interopTypeExpr) {
		this.boundsExpr = boundsExpr;
		this.interopTypeExpr = interopTypeExpr;
	}

	public Expr getBoundsExpr() {
		return boundsExpr;
	}

	public Expr getInteropTypeExpr() {
		return interopTypeExpr;
	}

	public boolean isEmpty() {
		return boundsExpr == null && interopTypeExpr == null;
	}

	void profile(TypeProfile p) {
		if (boundsExpr != null)
			boundsExpr.profile(p);
		else
			p.addPointer(null);
		if (interopTypeExpr != null)
			interopTypeExpr.profile(p);
		else
			p.addPointer(null);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final BoundsAnnotations other = (BoundsAnnotations)obj;
		return boundsExpr == other.boundsExpr && interopTypeExpr == other.interopTypeExpr;
	}

	@Override
	public int hashCode() {
		int hash = 5;
		hash = 41 * hash + System.identityHashCode(boundsExpr);
		hash = 41 * hash + System.identityHashCode(interopTypeExpr);
		return hash;
	}

	@Override
	public String toString() {
		if (isEmpty())
			return "";
		return Objects.toString(boundsExpr, "") + (interopTypeExpr != null ? " itype(" + interopTypeExpr + ")" : "");
	}
}
