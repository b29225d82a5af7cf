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
package edu.mit.cfront.ast;

import edu.mit.cfront.types.QualType;
import edu.mit.cfront.types.TypeProfile;
import java.math.BigInteger;

/**
 * The expression service: the type engine only asks expressions for their
 * type, their dependence and their constant value.
 */
public interface Expr {
	public QualType getType();
	public boolean isTypeDependent();
	public boolean isValueDependent();
	public boolean isInstantiationDependent();
	public boolean containsUnexpandedParameterPack();

	/**
	 * Evaluates this expression as an integral constant expression.
	 * @return the value, or null if this isn't a constant expression
	 */
	public BigInteger evaluateAsInteger();

	/**
	 * Adds this expression to an interning profile.  Expressions are
	 * profiled by identity unless an implementation knows better.
	 * @param id the profile being built
	 */
	public default void profile(TypeProfile id) {
		id.addPointer(this);
	}
}
