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

import com.google.common.collect.ImmutableList;
import edu.mit.cfront.ast.ObjCProtocolDecl;
import edu.mit.cfront.ast.ObjCTypeParamDecl;
import java.util.List;

/**
 * A use of an Objective-C type parameter ({@code T} in
 * {@code @interface NSArray<T>}), possibly with protocol qualifiers.  Sugar
 * for the parameter's bound.
 */
public final class ObjCTypeParamType extends Type {
	private final ObjCTypeParamDecl decl;
	private final ImmutableList<ObjCProtocolDecl> protocols;

	ObjCTypeParamType(TypeFactory factory, ObjCTypeParamDecl decl, QualType canon, List<ObjCProtocolDecl> protocols) {
		super(factory, TypeClass.OBJC_TYPE_PARAM, canon,
				canon.getTypePtr().isDependentType(),
				canon.getTypePtr().isInstantiationDependentType(),
				canon.getTypePtr().isVariablyModifiedType(),
				false);
		this.decl = decl;
		this.protocols = ImmutableList.copyOf(protocols);
	}

	public ObjCTypeParamDecl getDecl() {
		return decl;
	}

	public ImmutableList<ObjCProtocolDecl> getProtocols() {
		return protocols;
	}

	public int getNumProtocols() {
		return protocols.size();
	}

	@Override
	public boolean isSugared() {
		return true;
	}

	@Override
	public QualType desugar() {
		return getCanonicalTypeInternal();
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitObjCTypeParam(this);
	}

	static TypeProfile profile(ObjCTypeParamDecl decl, List<ObjCProtocolDecl> protocols) {
		TypeProfile p = new TypeProfile().addValue(TypeClass.OBJC_TYPE_PARAM).addPointer(decl).addInteger(protocols.size());
		for (ObjCProtocolDecl proto : protocols)
			p.addPointer(proto);
		return p;
	}

	@Override
	TypeProfile profile() {
		return profile(decl, protocols);
	}

	@Override
	public String toString() {
		return decl.getName() + ObjCObjectType.protocolSuffix(protocols);
	}
}
