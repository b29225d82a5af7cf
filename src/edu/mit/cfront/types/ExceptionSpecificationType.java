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
 * The kinds of exception specification a function prototype can have.
 */
public enum ExceptionSpecificationType {
	/**
	 * No exception specification.
	 */
	NONE,
	/**
	 * {@code throw()}
	 */
	DYNAMIC_NONE,
	/**
	 * {@code throw(T1, T2)}
	 */
	DYNAMIC,
	/**
	 * Microsoft {@code throw(...)}
	 */
	MS_ANY,
	/**
	 * {@code noexcept}
	 */
	BASIC_NOEXCEPT,
	/**
	 * {@code noexcept(expression)}
	 */
	COMPUTED_NOEXCEPT,
	/**
	 * Not evaluated yet, for special members.
	 */
	UNEVALUATED,
	/**
	 * Not instantiated yet.
	 */
	UNINSTANTIATED,
	/**
	 * Not parsed yet.
	 */
	UNPARSED;

	public boolean isDynamicExceptionSpec() {
		return this == DYNAMIC_NONE || this == DYNAMIC || this == MS_ANY;
	}

	public boolean isNoexceptExceptionSpec() {
		return this == BASIC_NOEXCEPT || this == COMPUTED_NOEXCEPT;
	}

	public boolean isUnresolvedExceptionSpec() {
		return this == UNEVALUATED || this == UNINSTANTIATED || this == UNPARSED;
	}
}
