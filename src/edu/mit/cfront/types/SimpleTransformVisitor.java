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

import static com.google.common.base.Preconditions.checkNotNull;
import com.google.common.base.Function;
import edu.mit.cfront.types.FunctionProtoType.ExceptionSpecInfo;
import edu.mit.cfront.types.FunctionProtoType.ExtProtoInfo;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies a rewrite function to a type and, where the function leaves a
 * node alone, to the types structurally inside it, rebuilding only nodes
 * whose components changed.  Unchanged nodes are returned as-is, so callers
 * can compare results by identity.
 * <p>
 * Dependent types are never rewritten, since none of the rewrites occur in
 * dependent contexts.  Records, enums, elaborated names, template
 * specializations and pack expansions are also returned unchanged, even if
 * a type inside them would be rewritten.
 */
final class SimpleTransformVisitor implements TypeVisitor<QualType> {
	private final TypeFactory factory;
	private final Function<QualType, QualType> function;
	private SimpleTransformVisitor(TypeFactory factory, Function<QualType, QualType> function) {
		this.factory = factory;
		this.function = function;
	}

	/**
	 * Transforms the given type.
	 * @param type the type to transform
	 * @param function the rewrite, returning its argument unchanged where it
	 * doesn't apply
	 * @return the transformed type, or the type itself if nothing changed
	 */
	static QualType transform(QualType type, Function<QualType, QualType> function) {
		QualType transformed = checkNotNull(function.apply(type));
		if (!transformed.equals(type))
			return transformed;
		SplitQualType split = type.split();
		QualType result = split.getType().accept(new SimpleTransformVisitor(type.getTypeFactory(), function));
		return result.withQualifiers(split.getQualifiers());
	}

	private QualType recurse(QualType type) {
		return transform(type, function);
	}

	/**
	 * Transforms each type in the list.
	 * @return the transformed list, or null if nothing changed
	 */
	private List<QualType> recurse(List<QualType> types) {
		List<QualType> result = new ArrayList<>(types.size());
		boolean changed = false;
		for (QualType t : types) {
			QualType n = recurse(t);
			changed |= !n.equals(t);
			result.add(n);
		}
		return changed ? result : null;
	}

	//<editor-fold defaultstate="collapsed" desc="Leaves">
	@Override
	public QualType visitBuiltin(BuiltinType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitTypedef(TypedefType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitObjCTypeParam(ObjCTypeParamType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitTypeOfExpr(TypeOfExprType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitTypeOf(TypeOfType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitDecltype(DecltypeType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitUnaryTransform(UnaryTransformType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitRecord(RecordType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitEnum(EnumType t) {
		return t.asQualType();
	}
	//TODO: rewrite the named type and the template arguments
	@Override
	public QualType visitElaborated(ElaboratedType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitTemplateSpecialization(TemplateSpecializationType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitPackExpansion(PackExpansionType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitObjCInterface(ObjCInterfaceType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitTypeVariable(TypeVariableType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitDeducedTemplateSpecialization(DeducedTemplateSpecializationType t) {
		return t.asQualType();
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Dependent types">
	@Override
	public QualType visitDependentSizedArray(DependentSizedArrayType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitDependentSizedExtVector(DependentSizedExtVectorType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitDependentAddressSpace(DependentAddressSpaceType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitUnresolvedUsing(UnresolvedUsingType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitTemplateTypeParm(TemplateTypeParmType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitSubstTemplateTypeParmPack(SubstTemplateTypeParmPackType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitInjectedClassName(InjectedClassNameType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitDependentName(DependentNameType t) {
		return t.asQualType();
	}
	@Override
	public QualType visitDependentTemplateSpecialization(DependentTemplateSpecializationType t) {
		return t.asQualType();
	}
	//</editor-fold>

	@Override
	public QualType visitComplex(ComplexType t) {
		QualType element = recurse(t.getElementType());
		if (element.equals(t.getElementType()))
			return t.asQualType();
		return factory.getComplexType(element);
	}

	@Override
	public QualType visitPointer(PointerType t) {
		QualType pointee = recurse(t.getPointeeType());
		if (pointee.equals(t.getPointeeType()))
			return t.asQualType();
		return factory.getPointerType(pointee, t.getKind());
	}

	@Override
	public QualType visitBlockPointer(BlockPointerType t) {
		QualType pointee = recurse(t.getPointeeType());
		if (pointee.equals(t.getPointeeType()))
			return t.asQualType();
		return factory.getBlockPointerType(pointee);
	}

	@Override
	public QualType visitLValueReference(LValueReferenceType t) {
		QualType pointee = recurse(t.getPointeeTypeAsWritten());
		if (pointee.equals(t.getPointeeTypeAsWritten()))
			return t.asQualType();
		return factory.getLValueReferenceType(pointee, t.isSpelledAsLValue());
	}

	@Override
	public QualType visitRValueReference(RValueReferenceType t) {
		QualType pointee = recurse(t.getPointeeTypeAsWritten());
		if (pointee.equals(t.getPointeeTypeAsWritten()))
			return t.asQualType();
		return factory.getRValueReferenceType(pointee);
	}

	@Override
	public QualType visitMemberPointer(MemberPointerType t) {
		QualType pointee = recurse(t.getPointeeType());
		if (pointee.equals(t.getPointeeType()))
			return t.asQualType();
		return factory.getMemberPointerType(pointee, t.getClassType());
	}

	@Override
	public QualType visitConstantArray(ConstantArrayType t) {
		QualType element = recurse(t.getElementType());
		if (element.equals(t.getElementType()))
			return t.asQualType();
		return factory.getConstantArrayType(element, t.getSize(), t.getSizeModifier(),
				t.getIndexTypeCVRQualifiers(), t.getKind());
	}

	@Override
	public QualType visitVariableArray(VariableArrayType t) {
		QualType element = recurse(t.getElementType());
		if (element.equals(t.getElementType()))
			return t.asQualType();
		return factory.getVariableArrayType(element, t.getSizeExpr(), t.getSizeModifier(),
				t.getIndexTypeCVRQualifiers(), t.getKind());
	}

	@Override
	public QualType visitIncompleteArray(IncompleteArrayType t) {
		QualType element = recurse(t.getElementType());
		if (element.equals(t.getElementType()))
			return t.asQualType();
		return factory.getIncompleteArrayType(element, t.getSizeModifier(),
				t.getIndexTypeCVRQualifiers(), t.getKind());
	}

	@Override
	public QualType visitVector(VectorType t) {
		QualType element = recurse(t.getElementType());
		if (element.equals(t.getElementType()))
			return t.asQualType();
		return factory.getVectorType(element, t.getNumElements(), t.getVectorKind());
	}

	@Override
	public QualType visitExtVector(ExtVectorType t) {
		QualType element = recurse(t.getElementType());
		if (element.equals(t.getElementType()))
			return t.asQualType();
		return factory.getExtVectorType(element, t.getNumElements());
	}

	@Override
	public QualType visitFunctionNoProto(FunctionNoProtoType t) {
		QualType returnType = recurse(t.getReturnType());
		if (returnType.equals(t.getReturnType()))
			return t.asQualType();
		return factory.getFunctionNoProtoType(returnType, t.getExtInfo());
	}

	@Override
	public QualType visitFunctionProto(FunctionProtoType t) {
		QualType returnType = recurse(t.getReturnType());
		List<QualType> params = recurse(t.getParamTypes());
		ExtProtoInfo info = t.getExtProtoInfo();
		List<QualType> exceptions = null;
		if (info.getExceptionSpec().getType() == ExceptionSpecificationType.DYNAMIC)
			exceptions = recurse(info.getExceptionSpec().getExceptions());
		if (returnType.equals(t.getReturnType()) && params == null && exceptions == null)
			return t.asQualType();
		if (exceptions != null)
			info = info.withExceptionSpec(ExceptionSpecInfo.dynamic(exceptions));
		return factory.getFunctionType(returnType, params != null ? params : t.getParamTypes(), info);
	}

	@Override
	public QualType visitParen(ParenType t) {
		QualType inner = recurse(t.getInnerType());
		if (inner.equals(t.getInnerType()))
			return t.asQualType();
		return factory.getParenType(inner);
	}

	@Override
	public QualType visitAdjusted(AdjustedType t) {
		QualType original = recurse(t.getOriginalType());
		QualType adjusted = recurse(t.getAdjustedType());
		if (original.equals(t.getOriginalType()) && adjusted.equals(t.getAdjustedType()))
			return t.asQualType();
		return factory.getAdjustedType(original, adjusted);
	}

	@Override
	public QualType visitDecayed(DecayedType t) {
		QualType original = recurse(t.getOriginalType());
		if (original.equals(t.getOriginalType()))
			return t.asQualType();
		return factory.getDecayedType(original);
	}

	@Override
	public QualType visitAttributed(AttributedType t) {
		QualType modified = recurse(t.getModifiedType());
		QualType equivalent = recurse(t.getEquivalentType());
		if (modified.equals(t.getModifiedType()) && equivalent.equals(t.getEquivalentType()))
			return t.asQualType();
		return factory.getAttributedType(t.getAttrKind(), modified, equivalent);
	}

	@Override
	public QualType visitSubstTemplateTypeParm(SubstTemplateTypeParmType t) {
		QualType replacement = recurse(t.getReplacementType());
		if (replacement.equals(t.getReplacementType()))
			return t.asQualType();
		return factory.getSubstTemplateTypeParmType(t.getReplacedParameter(), replacement);
	}

	@Override
	public QualType visitAuto(AutoType t) {
		if (!t.isDeduced())
			return t.asQualType();
		QualType deduced = recurse(t.getDeducedType());
		if (deduced.equals(t.getDeducedType()))
			return t.asQualType();
		return factory.getAutoType(deduced, t.getKeyword(), t.isDependentType());
	}

	@Override
	public QualType visitObjCObject(ObjCObjectType t) {
		QualType base = recurse(t.getBaseType());
		List<QualType> typeArgs = recurse(t.getTypeArgsAsWritten());
		if (base.equals(t.getBaseType()) && typeArgs == null)
			return t.asQualType();
		return factory.getObjCObjectType(base, typeArgs != null ? typeArgs : t.getTypeArgsAsWritten(),
				t.getProtocols(), t.isKindOfTypeAsWritten());
	}

	@Override
	public QualType visitObjCObjectPointer(ObjCObjectPointerType t) {
		QualType pointee = recurse(t.getPointeeType());
		if (pointee.equals(t.getPointeeType()))
			return t.asQualType();
		return factory.getObjCObjectPointerType(pointee);
	}

	@Override
	public QualType visitAtomic(AtomicType t) {
		QualType value = recurse(t.getValueType());
		if (value.equals(t.getValueType()))
			return t.asQualType();
		return factory.getAtomicType(value);
	}

	@Override
	public QualType visitPipe(PipeType t) {
		QualType element = recurse(t.getElementType());
		if (element.equals(t.getElementType()))
			return t.asQualType();
		return factory.getPipeType(element, t.isReadOnly());
	}
}
