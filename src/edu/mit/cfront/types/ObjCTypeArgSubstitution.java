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
import edu.mit.cfront.ast.DeclContext;
import edu.mit.cfront.ast.ObjCCategoryDecl;
import edu.mit.cfront.ast.ObjCInterfaceDecl;
import edu.mit.cfront.ast.ObjCMethodDecl;
import edu.mit.cfront.ast.ObjCProtocolDecl;
import edu.mit.cfront.ast.ObjCTypeParamDecl;
import edu.mit.cfront.types.FunctionProtoType.ExceptionSpecInfo;
import edu.mit.cfront.types.FunctionProtoType.ExtProtoInfo;
import java.util.ArrayList;
import java.util.List;

/**
 * Substitution of Objective-C type arguments for uses of a parameterized
 * class's type parameters, and removal of {@code __kindof}.
 */
final class ObjCTypeArgSubstitution {
	private ObjCTypeArgSubstitution() {}

	/**
	 * Replaces each type parameter use with its argument, or with its bound
	 * if there are no arguments.  Function result types are substituted in
	 * the result context and parameters in the parameter context.
	 */
	static QualType substObjCTypeArgs(QualType type, List<QualType> typeArgs, ObjCSubstitutionContext context) {
		return SimpleTransformVisitor.transform(type, t -> substituteOne(t, typeArgs, context));
	}

	private static QualType substituteOne(QualType type, List<QualType> typeArgs, ObjCSubstitutionContext context) {
		SplitQualType split = type.split();
		TypeFactory factory = type.getTypeFactory();

		if (split.getType() instanceof ObjCTypeParamType) {
			ObjCTypeParamType paramType = (ObjCTypeParamType)split.getType();
			ObjCTypeParamDecl param = paramType.getDecl();
			if (!typeArgs.isEmpty()) {
				QualType arg = typeArgs.get(param.getIndex());
				if (paramType.getProtocols().isEmpty())
					return arg.withQualifiers(split.getQualifiers());
				return factory.applyObjCProtocolQualifiers(arg, paramType.getProtocols(), true)
						.withQualifiers(split.getQualifiers());
			}
			switch (context) {
				case ORDINARY:
				case PARAMETER:
				case SUPERCLASS:
					return param.getUnderlyingType().withQualifiers(split.getQualifiers());
				case RESULT:
				case PROPERTY: {
					ObjCObjectPointerType objPtr = param.getUnderlyingType().getTypePtr().castAs(ObjCObjectPointerType.class);
					//__kindof types, id and Class already accept any subclass.
					if (objPtr.isKindOfType() || objPtr.isObjCIdOrClassType())
						return param.getUnderlyingType().withQualifiers(split.getQualifiers());
					ObjCObjectType obj = objPtr.getObjectType();
					QualType kindOf = factory.getObjCObjectType(obj.getBaseType(), obj.getTypeArgsAsWritten(),
							obj.getProtocols(), true);
					return factory.getObjCObjectPointerType(kindOf).withQualifiers(split.getQualifiers());
				}
				default:
					throw new AssertionError(context);
			}
		}

		if (split.getType() instanceof FunctionType)
			return substituteFunction(type, (FunctionType)split.getType(), typeArgs);

		if (split.getType() instanceof ObjCObjectType) {
			ObjCObjectType obj = (ObjCObjectType)split.getType();
			if (!obj.isSpecializedAsWritten())
				return type;
			List<QualType> newTypeArgs = new ArrayList<>();
			boolean anyChanged = false;
			for (QualType arg : obj.getTypeArgsAsWritten()) {
				QualType newArg = substObjCTypeArgs(arg, typeArgs, ObjCSubstitutionContext.ORDINARY);
				if (!newArg.equals(arg)) {
					//Substituting from an unspecialized context type gives an
					//unspecialized type.
					if (typeArgs.isEmpty() && context != ObjCSubstitutionContext.SUPERCLASS)
						return factory.getObjCObjectType(obj.getBaseType(), ImmutableList.<QualType>of(),
								obj.getProtocols(), obj.isKindOfTypeAsWritten());
					anyChanged = true;
				}
				newTypeArgs.add(newArg);
			}
			if (anyChanged)
				return factory.getObjCObjectType(obj.getBaseType(), newTypeArgs, obj.getProtocols(), obj.isKindOfTypeAsWritten());
			return type;
		}
		return type;
	}

	private static QualType substituteFunction(QualType type, FunctionType funcType, List<QualType> typeArgs) {
		TypeFactory factory = type.getTypeFactory();
		QualType returnType = substObjCTypeArgs(funcType.getReturnType(), typeArgs, ObjCSubstitutionContext.RESULT);
		if (funcType instanceof FunctionNoProtoType) {
			if (returnType.equals(funcType.getReturnType()))
				return type;
			return factory.getFunctionNoProtoType(returnType, funcType.getExtInfo());
		}

		FunctionProtoType proto = (FunctionProtoType)funcType;
		List<QualType> params = new ArrayList<>(proto.getNumParams());
		boolean paramChanged = false;
		for (QualType param : proto.getParamTypes()) {
			QualType newParam = substObjCTypeArgs(param, typeArgs, ObjCSubstitutionContext.PARAMETER);
			paramChanged |= !newParam.equals(param);
			params.add(newParam);
		}

		ExtProtoInfo info = proto.getExtProtoInfo();
		boolean exceptionChanged = false;
		if (info.getExceptionSpec().getType() == ExceptionSpecificationType.DYNAMIC) {
			List<QualType> exceptions = new ArrayList<>();
			for (QualType exception : info.getExceptionSpec().getExceptions()) {
				QualType newException = substObjCTypeArgs(exception, typeArgs, ObjCSubstitutionContext.ORDINARY);
				exceptionChanged |= !newException.equals(exception);
				exceptions.add(newException);
			}
			if (exceptionChanged)
				info = info.withExceptionSpec(ExceptionSpecInfo.dynamic(exceptions));
		}

		if (returnType.equals(proto.getReturnType()) && !paramChanged && !exceptionChanged)
			return type;
		return factory.getFunctionType(returnType, params, info);
	}

	static QualType substObjCMemberType(QualType type, QualType objectType, DeclContext dc, ObjCSubstitutionContext context) {
		List<QualType> subs = getObjCSubstitutions(objectType.getTypePtr(), dc);
		if (subs != null)
			return substObjCTypeArgs(type, subs, context);
		return type;
	}

	static QualType stripObjCKindOfType(QualType type) {
		return SimpleTransformVisitor.transform(type, t -> {
			SplitQualType split = t.split();
			ObjCObjectType obj = split.getType().getAs(ObjCObjectType.class);
			if (obj == null || !obj.isKindOfType())
				return t;
			QualType base = stripObjCKindOfType(obj.getBaseType());
			return t.getTypeFactory().getObjCObjectType(base, obj.getTypeArgsAsWritten(), obj.getProtocols(), false)
					.withQualifiers(split.getQualifiers());
		});
	}

	static boolean acceptsObjCTypeParams(Type type) {
		ObjCObjectType iface = type.getAsObjCInterfaceType();
		if (iface == null)
			return false;
		ObjCInterfaceDecl decl = iface.getInterface();
		return decl != null && decl.getTypeParamList() != null;
	}

	/**
	 * Maps a receiver type to the type arguments for members declared in the
	 * given class or category, following the receiver's superclass chain up
	 * to the declaring class.
	 * @return the type arguments, an empty list to substitute bounds, or
	 * null if the context isn't a parameterized class or category
	 */
	static List<QualType> getObjCSubstitutions(Type type, DeclContext dc) {
		if (dc instanceof ObjCMethodDecl)
			dc = ((ObjCMethodDecl)dc).getDeclContext();

		ObjCInterfaceDecl dcClassDecl;
		if (dc instanceof ObjCInterfaceDecl) {
			dcClassDecl = (ObjCInterfaceDecl)dc;
			if (dcClassDecl.getTypeParamList() == null)
				return null;
		} else if (dc instanceof ObjCCategoryDecl) {
			ObjCCategoryDecl category = (ObjCCategoryDecl)dc;
			if (category.getTypeParamList() == null)
				return null;
			dcClassDecl = category.getClassInterface();
			if (dcClassDecl == null)
				return null;
		} else
			return null;

		ObjCObjectType objectType;
		ObjCObjectPointerType objectPointerType = type.getAs(ObjCObjectPointerType.class);
		if (objectPointerType != null)
			objectType = objectPointerType.getObjectType();
		else if (type.getAs(BlockPointerType.class) != null) {
			TypeFactory factory = type.getTypeFactory();
			objectType = factory.getObjCObjectType(factory.getBuiltinType(BuiltinType.Kind.OBJC_ID),
					ImmutableList.<QualType>of(), ImmutableList.<ObjCProtocolDecl>of(), false)
					.getTypePtr().castAs(ObjCObjectType.class);
		} else
			objectType = type.getAs(ObjCObjectType.class);

		ObjCInterfaceDecl curClassDecl = objectType != null ? objectType.getInterface() : null;
		//id or a variant of it: substitute the bounds.
		if (curClassDecl == null)
			return ImmutableList.of();

		while (curClassDecl != dcClassDecl) {
			ObjCObjectType superType = objectType.getSuperClassType();
			if (superType == null) {
				objectType = null;
				break;
			}
			objectType = superType;
			curClassDecl = objectType.getInterface();
		}

		if (objectType == null || objectType.isUnspecialized())
			return ImmutableList.of();
		return objectType.getTypeArgs();
	}
}
