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

/**
 * A {@link TypeVisitor} that routes each concrete variant to its abstract
 * family (references, arrays, functions, tags, deduced types) and from
 * there to {@link #defaultAction(Type)}.  Subclasses override whichever
 * level they care about.
 * @param <R> the result type
 */
public abstract class SimpleTypeVisitor<R> implements TypeVisitor<R> {
	protected abstract R defaultAction(Type t);

	public R visitReferenceType(ReferenceType t) {
		return defaultAction(t);
	}
	public R visitArrayType(ArrayType t) {
		return defaultAction(t);
	}
	public R visitFunctionType(FunctionType t) {
		return defaultAction(t);
	}
	public R visitTagType(TagType t) {
		return defaultAction(t);
	}
	public R visitDeducedType(DeducedType t) {
		return defaultAction(t);
	}

	@Override
	public R visitBuiltin(BuiltinType t) {
		return defaultAction(t);
	}
	@Override
	public R visitComplex(ComplexType t) {
		return defaultAction(t);
	}
	@Override
	public R visitPointer(PointerType t) {
		return defaultAction(t);
	}
	@Override
	public R visitBlockPointer(BlockPointerType t) {
		return defaultAction(t);
	}
	@Override
	public R visitLValueReference(LValueReferenceType t) {
		return visitReferenceType(t);
	}
	@Override
	public R visitRValueReference(RValueReferenceType t) {
		return visitReferenceType(t);
	}
	@Override
	public R visitMemberPointer(MemberPointerType t) {
		return defaultAction(t);
	}
	@Override
	public R visitConstantArray(ConstantArrayType t) {
		return visitArrayType(t);
	}
	@Override
	public R visitIncompleteArray(IncompleteArrayType t) {
		return visitArrayType(t);
	}
	@Override
	public R visitVariableArray(VariableArrayType t) {
		return visitArrayType(t);
	}
	@Override
	public R visitDependentSizedArray(DependentSizedArrayType t) {
		return visitArrayType(t);
	}
	@Override
	public R visitDependentSizedExtVector(DependentSizedExtVectorType t) {
		return defaultAction(t);
	}
	@Override
	public R visitDependentAddressSpace(DependentAddressSpaceType t) {
		return defaultAction(t);
	}
	@Override
	public R visitVector(VectorType t) {
		return defaultAction(t);
	}
	@Override
	public R visitExtVector(ExtVectorType t) {
		return visitVector(t);
	}
	@Override
	public R visitFunctionProto(FunctionProtoType t) {
		return visitFunctionType(t);
	}
	@Override
	public R visitFunctionNoProto(FunctionNoProtoType t) {
		return visitFunctionType(t);
	}
	@Override
	public R visitUnresolvedUsing(UnresolvedUsingType t) {
		return defaultAction(t);
	}
	@Override
	public R visitParen(ParenType t) {
		return defaultAction(t);
	}
	@Override
	public R visitTypedef(TypedefType t) {
		return defaultAction(t);
	}
	@Override
	public R visitAdjusted(AdjustedType t) {
		return defaultAction(t);
	}
	@Override
	public R visitDecayed(DecayedType t) {
		return visitAdjusted(t);
	}
	@Override
	public R visitTypeOfExpr(TypeOfExprType t) {
		return defaultAction(t);
	}
	@Override
	public R visitTypeOf(TypeOfType t) {
		return defaultAction(t);
	}
	@Override
	public R visitDecltype(DecltypeType t) {
		return defaultAction(t);
	}
	@Override
	public R visitUnaryTransform(UnaryTransformType t) {
		return defaultAction(t);
	}
	@Override
	public R visitRecord(RecordType t) {
		return visitTagType(t);
	}
	@Override
	public R visitEnum(EnumType t) {
		return visitTagType(t);
	}
	@Override
	public R visitElaborated(ElaboratedType t) {
		return defaultAction(t);
	}
	@Override
	public R visitAttributed(AttributedType t) {
		return defaultAction(t);
	}
	@Override
	public R visitTemplateTypeParm(TemplateTypeParmType t) {
		return defaultAction(t);
	}
	@Override
	public R visitSubstTemplateTypeParm(SubstTemplateTypeParmType t) {
		return defaultAction(t);
	}
	@Override
	public R visitSubstTemplateTypeParmPack(SubstTemplateTypeParmPackType t) {
		return defaultAction(t);
	}
	@Override
	public R visitTemplateSpecialization(TemplateSpecializationType t) {
		return defaultAction(t);
	}
	@Override
	public R visitAuto(AutoType t) {
		return visitDeducedType(t);
	}
	@Override
	public R visitDeducedTemplateSpecialization(DeducedTemplateSpecializationType t) {
		return visitDeducedType(t);
	}
	@Override
	public R visitInjectedClassName(InjectedClassNameType t) {
		return defaultAction(t);
	}
	@Override
	public R visitDependentName(DependentNameType t) {
		return defaultAction(t);
	}
	@Override
	public R visitDependentTemplateSpecialization(DependentTemplateSpecializationType t) {
		return defaultAction(t);
	}
	@Override
	public R visitPackExpansion(PackExpansionType t) {
		return defaultAction(t);
	}
	@Override
	public R visitObjCTypeParam(ObjCTypeParamType t) {
		return defaultAction(t);
	}
	@Override
	public R visitObjCObject(ObjCObjectType t) {
		return defaultAction(t);
	}
	@Override
	public R visitObjCInterface(ObjCInterfaceType t) {
		return visitObjCObject(t);
	}
	@Override
	public R visitObjCObjectPointer(ObjCObjectPointerType t) {
		return defaultAction(t);
	}
	@Override
	public R visitPipe(PipeType t) {
		return defaultAction(t);
	}
	@Override
	public R visitAtomic(AtomicType t) {
		return defaultAction(t);
	}
	@Override
	public R visitTypeVariable(TypeVariableType t) {
		return defaultAction(t);
	}
}
