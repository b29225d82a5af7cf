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

/**
 * Declaration attributes the type engine asks about.
 */
public enum AttrKind {
	/**
	 * {@code __attribute__((objc_boxable))} on a record.
	 */
	OBJC_BOXABLE,
	/**
	 * {@code __attribute__((NSObject))} on a typedef.
	 */
	OBJC_NSOBJECT,
	/**
	 * {@code __attribute__((objc_independent_class))} on a typedef.
	 */
	OBJC_INDEPENDENT_CLASS,
	/**
	 * An explicit or implicit Microsoft inheritance model attribute on a
	 * class ({@code __single_inheritance} and friends).
	 */
	MS_INHERITANCE,
}
