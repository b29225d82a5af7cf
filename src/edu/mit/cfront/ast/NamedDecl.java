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

import edu.mit.cfront.basic.Linkage;
import edu.mit.cfront.basic.LinkageInfo;

/**
 * A declaration with a (possibly empty) name.
 */
public interface NamedDecl {
	/**
	 * Returns the declared identifier, or null if this declaration is
	 * anonymous.
	 * @return the identifier, or null
	 */
	public String getName();

	/**
	 * Returns the declaration's linkage, ignoring visibility.
	 * @return the linkage
	 */
	public Linkage getLinkageInternal();

	public LinkageInfo getLinkageAndVisibility();

	public boolean hasAttr(AttrKind kind);

	/**
	 * Returns true if this declaration is a direct member of namespace std.
	 * @return true if this declaration is in std
	 */
	public default boolean isInStdNamespace() {
		return false;
	}

	/**
	 * Returns the context this declaration appears in, or null at translation
	 * unit scope.
	 * @return the semantic context
	 */
	public default DeclContext getDeclContext() {
		return null;
	}
}
