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
 * Walks the declarator chain of a type (the parts a declarator can wrap
 * around a type specifier) looking for a deduced type.  In syntactic mode,
 * a function with a trailing return type is returned instead of looking
 * into its return type.
 */
final class ContainedDeducedTypeFinder extends SimpleTypeVisitor<Type> {
	private final boolean syntactic;
	ContainedDeducedTypeFinder(boolean syntactic) {
		this.syntactic = syntactic;
	}

	private Type visit(QualType t) {
		return t == null ? null : t.getTypePtr().accept(this);
	}

	@Override
	protected Type defaultAction(Type t) {
		return null;
	}

	@Override
	public Type visitDeducedType(DeducedType t) {
		return t;
	}
	@Override
	public Type visitElaborated(ElaboratedType t) {
		return visit(t.getNamedType());
	}
	@Override
	public Type visitPointer(PointerType t) {
		return visit(t.getPointeeType());
	}
	@Override
	public Type visitBlockPointer(BlockPointerType t) {
		return visit(t.getPointeeType());
	}
	@Override
	public Type visitReferenceType(ReferenceType t) {
		return visit(t.getPointeeTypeAsWritten());
	}
	@Override
	public Type visitMemberPointer(MemberPointerType t) {
		return visit(t.getPointeeType());
	}
	@Override
	public Type visitArrayType(ArrayType t) {
		return visit(t.getElementType());
	}
	@Override
	public Type visitDependentSizedExtVector(DependentSizedExtVectorType t) {
		return visit(t.getElementType());
	}
	@Override
	public Type visitVector(VectorType t) {
		return visit(t.getElementType());
	}
	@Override
	public Type visitFunctionProto(FunctionProtoType t) {
		if (syntactic && t.hasTrailingReturn())
			return t;
		return visitFunctionType(t);
	}
	@Override
	public Type visitFunctionType(FunctionType t) {
		return visit(t.getReturnType());
	}
	@Override
	public Type visitParen(ParenType t) {
		return visit(t.getInnerType());
	}
	@Override
	public Type visitAttributed(AttributedType t) {
		return visit(t.getModifiedType());
	}
	@Override
	public Type visitAdjusted(AdjustedType t) {
		return visit(t.getOriginalType());
	}
}
