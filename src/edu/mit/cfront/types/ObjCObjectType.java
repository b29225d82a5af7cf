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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import edu.mit.cfront.ast.ObjCInterfaceDecl;
import edu.mit.cfront.ast.ObjCProtocolDecl;
import edu.mit.cfront.ast.ObjCTypeParamDecl;
import java.util.List;

/**
 * An Objective-C object type: a base type ({@code id}, {@code Class} or an
 * interface) with optional type arguments, protocol qualifiers and
 * {@code __kindof}.  {@code NSArray<NSString *> <NSCopying>} is an object
 * type whose base is {@code NSArray}.
 * <p>
 * Type arguments and {@code __kindof} written on a base object type are
 * inherited: the accessors without "AsWritten" look through the base.
 */
public class ObjCObjectType extends Type {
	private final QualType baseType;
	private final ImmutableList<QualType> typeArgs;
	private final ImmutableList<ObjCProtocolDecl> protocols;
	private final boolean kindOf;
	private final Supplier<ObjCObjectType> superClassType = Suppliers.memoize(this::computeSuperClassType);

	ObjCObjectType(TypeFactory factory, QualType baseType, List<QualType> typeArgs,
			List<ObjCProtocolDecl> protocols, boolean kindOf, QualType canon) {
		super(factory, TypeClass.OBJC_OBJECT, canon,
				baseType.getTypePtr().isDependentType(),
				baseType.getTypePtr().isInstantiationDependentType(),
				baseType.getTypePtr().isVariablyModifiedType(),
				baseType.getTypePtr().containsUnexpandedParameterPack());
		this.baseType = baseType;
		this.typeArgs = ImmutableList.copyOf(typeArgs);
		this.protocols = ImmutableList.copyOf(protocols);
		this.kindOf = kindOf;
		for (QualType arg : typeArgs) {
			if (arg.getTypePtr().isDependentType())
				setDependent();
			else if (arg.getTypePtr().isInstantiationDependentType())
				setInstantiationDependent();
			if (arg.getTypePtr().containsUnexpandedParameterPack())
				setContainsUnexpandedParameterPack();
		}
	}

	/**
	 * Creates an interface type, whose base type is itself.
	 */
	ObjCObjectType(TypeFactory factory, TypeClass typeClass) {
		super(factory, typeClass, null, false, false, false, false);
		this.baseType = null;
		this.typeArgs = ImmutableList.of();
		this.protocols = ImmutableList.of();
		this.kindOf = false;
	}

	public final QualType getBaseType() {
		return baseType != null ? baseType : asQualType();
	}

	/**
	 * Returns the interface this object type names, looking through base
	 * object types.
	 * @return the interface, or null for id and Class types
	 */
	public final ObjCInterfaceDecl getInterface() {
		QualType base = getBaseType();
		ObjCObjectType obj;
		while ((obj = base.getTypePtr().getAs(ObjCObjectType.class)) != null) {
			if (obj instanceof ObjCInterfaceType)
				return ((ObjCInterfaceType)obj).getDecl();
			base = obj.getBaseType();
		}
		return null;
	}

	public final boolean isObjCId() {
		return getBaseType().getTypePtr().isSpecificBuiltinType(BuiltinType.Kind.OBJC_ID);
	}
	public final boolean isObjCClass() {
		return getBaseType().getTypePtr().isSpecificBuiltinType(BuiltinType.Kind.OBJC_CLASS);
	}
	public final boolean isObjCUnqualifiedId() {
		return protocols.isEmpty() && isObjCId();
	}
	public final boolean isObjCUnqualifiedClass() {
		return protocols.isEmpty() && isObjCClass();
	}
	public final boolean isObjCUnqualifiedIdOrClass() {
		return protocols.isEmpty() && (isObjCId() || isObjCClass());
	}
	public final boolean isObjCQualifiedId() {
		return !protocols.isEmpty() && isObjCId();
	}
	public final boolean isObjCQualifiedClass() {
		return !protocols.isEmpty() && isObjCClass();
	}

	private ObjCObjectType baseObject() {
		ObjCObjectType obj = getBaseType().getTypePtr().getAs(ObjCObjectType.class);
		if (obj == null || obj instanceof ObjCInterfaceType)
			return null;
		return obj;
	}

	/**
	 * Returns true if this type has type arguments, either written here or
	 * on its base type.
	 * @return true if this type is specialized
	 */
	public final boolean isSpecialized() {
		if (!typeArgs.isEmpty())
			return true;
		ObjCObjectType base = baseObject();
		return base != null && base.isSpecialized();
	}

	public final boolean isSpecializedAsWritten() {
		return !typeArgs.isEmpty();
	}

	public final boolean isUnspecialized() {
		return !isSpecialized();
	}

	public final boolean isUnspecializedAsWritten() {
		return !isSpecializedAsWritten();
	}

	/**
	 * Returns the type arguments, either written here or on the base type.
	 * @return the type arguments, empty if this type is unspecialized
	 */
	public final ImmutableList<QualType> getTypeArgs() {
		if (!typeArgs.isEmpty())
			return typeArgs;
		ObjCObjectType base = baseObject();
		return base != null ? base.getTypeArgs() : ImmutableList.<QualType>of();
	}

	public final ImmutableList<QualType> getTypeArgsAsWritten() {
		return typeArgs;
	}

	public final boolean isKindOfTypeAsWritten() {
		return kindOf;
	}

	public final boolean isKindOfType() {
		if (kindOf)
			return true;
		ObjCObjectType base = baseObject();
		return base != null && base.isKindOfType();
	}

	public final ImmutableList<ObjCProtocolDecl> getProtocols() {
		return protocols;
	}

	public final int getNumProtocols() {
		return protocols.size();
	}

	public final ObjCProtocolDecl getProtocol(int i) {
		return protocols.get(i);
	}

	/**
	 * Removes {@code __kindof} and protocol qualifiers, recursively through
	 * base object types, keeping the type arguments.
	 * @return the stripped object type
	 */
	public final QualType stripObjCKindOfTypeAndQuals() {
		if (!isKindOfType() && protocols.isEmpty())
			return asQualType();
		SplitQualType split = getBaseType().split();
		QualType base = split.getType().asQualType();
		ObjCObjectType baseObj = split.getType().getAs(ObjCObjectType.class);
		if (baseObj != null)
			base = baseObj.stripObjCKindOfTypeAndQuals();
		return getTypeFactory().getObjCObjectType(base.withQualifiers(split.getQualifiers()),
				getTypeArgsAsWritten(), ImmutableList.<ObjCProtocolDecl>of(), false);
	}

	/**
	 * Returns the superclass of this object type, with this type's type
	 * arguments substituted into it.
	 * @return the superclass type, or null if there isn't one
	 */
	public final ObjCObjectType getSuperClassType() {
		return superClassType.get();
	}

	private static boolean hasTypeParams(ObjCInterfaceDecl decl) {
		List<? extends ObjCTypeParamDecl> params = decl.getTypeParamList();
		return params != null && !params.isEmpty();
	}

	private ObjCObjectType computeSuperClassType() {
		ObjCInterfaceDecl classDecl = getInterface();
		if (classDecl == null)
			return null;
		ObjCObjectType superClassObjTy = classDecl.getSuperClassType();
		if (superClassObjTy == null)
			return null;
		ObjCInterfaceDecl superClassDecl = superClassObjTy.getInterface();
		if (superClassDecl == null)
			return null;
		//A non-parameterized superclass, or a reference that doesn't
		//specialize it, is used as-is.
		if (!hasTypeParams(superClassDecl) || superClassObjTy.isUnspecialized())
			return superClassObjTy;
		if (!hasTypeParams(classDecl))
			return superClassObjTy;
		if (isUnspecialized())
			return getTypeFactory().getObjCInterfaceType(superClassDecl).getTypePtr().castAs(ObjCObjectType.class);
		List<QualType> args = getTypeArgs();
		assert args.size() == classDecl.getTypeParamList().size() : args + " vs " + classDecl.getTypeParamList();
		return superClassObjTy.asQualType()
				.substObjCTypeArgs(args, ObjCSubstitutionContext.SUPERCLASS)
				.getTypePtr().castAs(ObjCObjectType.class);
	}

	@Override
	public final boolean isSugared() {
		return false;
	}

	@Override
	public final QualType desugar() {
		return asQualType();
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitObjCObject(this);
	}

	static TypeProfile profile(QualType baseType, List<QualType> typeArgs, List<ObjCProtocolDecl> protocols, boolean kindOf) {
		TypeProfile p = new TypeProfile().addValue(TypeClass.OBJC_OBJECT).addQualType(baseType);
		p.addInteger(typeArgs.size());
		for (QualType arg : typeArgs)
			p.addQualType(arg);
		p.addInteger(protocols.size());
		for (ObjCProtocolDecl proto : protocols)
			p.addPointer(proto);
		return p.addBoolean(kindOf);
	}

	@Override
	TypeProfile profile() {
		return profile(baseType, typeArgs, protocols, kindOf);
	}

	static String protocolSuffix(List<ObjCProtocolDecl> protocols) {
		if (protocols.isEmpty())
			return "";
		StringBuilder sb = new StringBuilder("<");
		for (int i = 0; i < protocols.size(); ++i) {
			if (i > 0)
				sb.append(", ");
			sb.append(protocols.get(i).getName());
		}
		return sb.append(">").toString();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		if (kindOf)
			sb.append("__kindof ");
		sb.append(getBaseType());
		if (!typeArgs.isEmpty()) {
			sb.append("<");
			for (int i = 0; i < typeArgs.size(); ++i) {
				if (i > 0)
					sb.append(", ");
				sb.append(typeArgs.get(i));
			}
			sb.append(">");
		}
		return sb.append(protocolSuffix(protocols)).toString();
	}
}
