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
import edu.mit.cfront.ast.ObjCInterfaceDecl;
import edu.mit.cfront.ast.ObjCProtocolDecl;

/**
 * A pointer to an Objective-C object type: {@code id}, {@code Class},
 * {@code NSString *}, {@code id<NSCopying>} and so on.
 */
public final class ObjCObjectPointerType extends Type {
	private final QualType pointeeType;

	ObjCObjectPointerType(TypeFactory factory, QualType pointeeType, QualType canon) {
		super(factory, TypeClass.OBJC_OBJECT_POINTER, canon, false, false, false, false);
		inheritFlags(pointeeType);
		this.pointeeType = pointeeType;
	}

	@Override
	public QualType getPointeeType() {
		return pointeeType;
	}

	public ObjCObjectType getObjectType() {
		return pointeeType.getTypePtr().castAs(ObjCObjectType.class);
	}

	/**
	 * Returns the interface type pointed to, if this is a pointer to an
	 * interface (possibly with type arguments or protocols).
	 * @return the interface type, or null
	 */
	public ObjCInterfaceType getInterfaceType() {
		return getObjectType().getBaseType().getTypePtr().getAs(ObjCInterfaceType.class);
	}

	public ObjCInterfaceDecl getInterfaceDecl() {
		return getObjectType().getInterface();
	}

	@Override
	public boolean isObjCIdType() {
		return getObjectType().isObjCUnqualifiedId();
	}
	@Override
	public boolean isObjCClassType() {
		return getObjectType().isObjCUnqualifiedClass();
	}
	public boolean isObjCIdOrClassType() {
		return getObjectType().isObjCUnqualifiedIdOrClass();
	}
	@Override
	public boolean isObjCQualifiedIdType() {
		return getObjectType().isObjCQualifiedId();
	}
	@Override
	public boolean isObjCQualifiedClassType() {
		return getObjectType().isObjCQualifiedClass();
	}
	public boolean isKindOfType() {
		return getObjectType().isKindOfType();
	}
	public boolean isSpecialized() {
		return getObjectType().isSpecialized();
	}
	public boolean isUnspecialized() {
		return getObjectType().isUnspecialized();
	}
	public ImmutableList<QualType> getTypeArgs() {
		return getObjectType().getTypeArgs();
	}
	public ImmutableList<ObjCProtocolDecl> getProtocols() {
		return getObjectType().getProtocols();
	}

	/**
	 * Returns a pointer to the superclass of the pointed-to object type.
	 * @return the superclass pointer type, or null
	 */
	public ObjCObjectPointerType getSuperClassType() {
		ObjCObjectType superObject = getObjectType().getSuperClassType();
		if (superObject == null)
			return null;
		return getTypeFactory().getObjCObjectPointerType(superObject.asQualType()).getTypePtr()
				.castAs(ObjCObjectPointerType.class);
	}

	public ObjCObjectPointerType stripObjCKindOfTypeAndQuals() {
		if (!isKindOfType() && getProtocols().isEmpty())
			return this;
		QualType obj = getObjectType().stripObjCKindOfTypeAndQuals();
		return getTypeFactory().getObjCObjectPointerType(obj).getTypePtr().castAs(ObjCObjectPointerType.class);
	}

	@Override
	public boolean isSugared() {
		return false;
	}

	@Override
	public QualType desugar() {
		return asQualType();
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitObjCObjectPointer(this);
	}

	static TypeProfile profile(QualType pointeeType) {
		return new TypeProfile().addValue(TypeClass.OBJC_OBJECT_POINTER).addQualType(pointeeType);
	}

	@Override
	TypeProfile profile() {
		return profile(pointeeType);
	}

	@Override
	public String toString() {
		ObjCObjectType obj = getObjectType();
		if (obj.isObjCId() || obj.isObjCClass())
			return pointeeType.toString();
		return pointeeType + " *";
	}
}
