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
 * A visitor over the closed set of type node variants, with one method per
 * concrete node class.  Implementing this interface forces a decision for
 * every variant.
 * @param <R> the result type
 * @see Type#accept(TypeVisitor)
 */
public interface TypeVisitor<R> {
	public R visitBuiltin(BuiltinType t);
	public R visitComplex(ComplexType t);
	public R visitPointer(PointerType t);
	public R visitBlockPointer(BlockPointerType t);
	public R visitLValueReference(LValueReferenceType t);
	public R visitRValueReference(RValueReferenceType t);
	public R visitMemberPointer(MemberPointerType t);
	public R visitConstantArray(ConstantArrayType t);
	public R visitIncompleteArray(IncompleteArrayType t);
	public R visitVariableArray(VariableArrayType t);
	public R visitDependentSizedArray(DependentSizedArrayType t);
	public R visitDependentSizedExtVector(DependentSizedExtVectorType t);
	public R visitDependentAddressSpace(DependentAddressSpaceType t);
	public R visitVector(VectorType t);
	public R visitExtVector(ExtVectorType t);
	public R visitFunctionProto(FunctionProtoType t);
	public R visitFunctionNoProto(FunctionNoProtoType t);
	public R visitUnresolvedUsing(UnresolvedUsingType t);
	public R visitParen(ParenType t);
	public R visitTypedef(TypedefType t);
	public R visitAdjusted(AdjustedType t);
	public R visitDecayed(DecayedType t);
	public R visitTypeOfExpr(TypeOfExprType t);
	public R visitTypeOf(TypeOfType t);
	public R visitDecltype(DecltypeType t);
	public R visitUnaryTransform(UnaryTransformType t);
	public R visitRecord(RecordType t);
	public R visitEnum(EnumType t);
	public R visitElaborated(ElaboratedType t);
	public R visitAttributed(AttributedType t);
	public R visitTemplateTypeParm(TemplateTypeParmType t);
	public R visitSubstTemplateTypeParm(SubstTemplateTypeParmType t);
	public R visitSubstTemplateTypeParmPack(SubstTemplateTypeParmPackType t);
	public R visitTemplateSpecialization(TemplateSpecializationType t);
	public R visitAuto(AutoType t);
	public R visitDeducedTemplateSpecialization(DeducedTemplateSpecializationType t);
	public R visitInjectedClassName(InjectedClassNameType t);
	public R visitDependentName(DependentNameType t);
	public R visitDependentTemplateSpecialization(DependentTemplateSpecializationType t);
	public R visitPackExpansion(PackExpansionType t);
	public R visitObjCTypeParam(ObjCTypeParamType t);
	public R visitObjCObject(ObjCObjectType t);
	public R visitObjCInterface(ObjCInterfaceType t);
	public R visitObjCObjectPointer(ObjCObjectPointerType t);
	public R visitPipe(PipeType t);
	public R visitAtomic(AtomicType t);
	public R visitTypeVariable(TypeVariableType t);
}
