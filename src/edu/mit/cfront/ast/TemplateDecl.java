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
 * A template declaration.
 */
public interface TemplateDecl extends NamedDecl {
	/**
	 * Returns true if this declares a class template (as opposed to an alias,
	 * function or variable template).
	 * @return true for a class template
	 */
	public boolean isClassTemplate();

	/**
	 * Returns true if this is a template template parameter, whose name
	 * is dependent.
	 * @return true for a template template parameter
	 */
	public default boolean isTemplateTemplateParm() {
		return false;
	}

	/**
	 * Returns true if this declares an alias template
	 * ({@code template<class T> using V = vector<T>}).
	 * @return true for alias templates
	 */
	public default boolean isTypeAliasTemplate() {
		return false;
	}
}
