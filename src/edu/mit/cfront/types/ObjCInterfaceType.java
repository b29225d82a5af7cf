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

import edu.mit.cfront.ast.ObjCInterfaceDecl;

/**
 * An Objective-C class name used as a type.  This is the object type with
 * no type arguments or protocols whose base type is itself.
 */
public final class ObjCInterfaceType extends ObjCObjectType {
	private final ObjCInterfaceDecl decl;

	ObjCInterfaceType(TypeFactory factory, ObjCInterfaceDecl decl) {
		super(factory, TypeClass.OBJC_INTERFACE);
		this.decl = decl;
	}

	public ObjCInterfaceDecl getDecl() {
		return decl;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitObjCInterface(this);
	}

	static TypeProfile profile(ObjCInterfaceDecl decl) {
		return new TypeProfile().addValue(TypeClass.OBJC_INTERFACE).addPointer(decl);
	}

	@Override
	TypeProfile profile() {
		return profile(decl);
	}

	@Override
	public String toString() {
		return decl.getName();
	}
}
