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

import java.util.List;

/**
 * A C++ class.  The flags answered here are computed by semantic analysis as
 * members are declared.
 */
public interface CXXRecordDecl extends RecordDecl {
	public boolean hasDefinition();
	public List<CXXBaseSpecifier> bases();
	public boolean isPOD();
	public boolean isTrivial();
	public boolean isTriviallyCopyable();
	public boolean isStandardLayout();
	public boolean isLiteral();
	public boolean isAggregate();
	public boolean isEmpty();
	public boolean hasDefaultConstructor();
	public boolean hasNonTrivialDefaultConstructor();
	public boolean hasTrivialDestructor();

	/**
	 * Returns the most recent declaration of this class.
	 * @return the most recent redeclaration
	 */
	public CXXRecordDecl getMostRecentDecl();

	public default int getNumVBases() {
		int n = 0;
		for (CXXBaseSpecifier b : bases())
			if (b.isVirtual())
				++n;
		return n;
	}
}
