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

import static org.junit.jupiter.api.Assertions.*;
import com.google.common.collect.ImmutableList;
import edu.mit.cfront.ast.ObjCProtocolDecl;
import edu.mit.cfront.ast.TagTypeKind;
import edu.mit.cfront.types.ArrayType.ArraySizeModifier;
import edu.mit.cfront.types.FunctionProtoType.ExceptionSpecInfo;
import edu.mit.cfront.types.FunctionProtoType.ExtProtoInfo;
import edu.mit.cfront.types.FunctionProtoType.NoexceptResult;
import edu.mit.cfront.types.TestDecls.ConstExpr;
import edu.mit.cfront.types.TestDecls.Function;
import edu.mit.cfront.types.TestDecls.ObjCClass;
import edu.mit.cfront.types.TestDecls.Protocol;
import edu.mit.cfront.types.TestDecls.Record;
import edu.mit.cfront.types.TestDecls.Typedef;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TypeFactoryTest {
	private final TypeFactory f = TestFactories.cxx14();
	private final QualType intType = f.getIntType();
	private final QualType charType = f.getBuiltinType(BuiltinType.Kind.CHAR_S);

	@Test
	public void everyTypeClassIsPresent() {
		assertEquals(47, TypeClass.values().length);
	}

	@Test
	public void builtinsAreInternedAtConstruction() {
		assertEquals(BuiltinType.Kind.values().length, f.size());
		assertSame(intType.getTypePtr(), f.getBuiltinType(BuiltinType.Kind.INT).getTypePtr());
		assertTrue(intType.isCanonical());
	}

	@Test
	public void structurallyEqualRequestsShareANode() {
		QualType p1 = f.getPointerType(intType.withConst());
		QualType p2 = f.getPointerType(intType.withConst());
		assertSame(p1.getTypePtr(), p2.getTypePtr());
		assertNotSame(p1.getTypePtr(), f.getPointerType(intType).getTypePtr());
		assertSame(f.getComplexType(f.getBuiltinType(BuiltinType.Kind.DOUBLE)).getTypePtr(),
				f.getComplexType(f.getBuiltinType(BuiltinType.Kind.DOUBLE)).getTypePtr());
		assertSame(f.getVectorType(intType, 4, VectorType.VectorKind.GENERIC).getTypePtr(),
				f.getVectorType(intType, 4, VectorType.VectorKind.GENERIC).getTypePtr());
		assertNotSame(f.getVectorType(intType, 4, VectorType.VectorKind.GENERIC).getTypePtr(),
				f.getExtVectorType(intType, 4).getTypePtr());
	}

	@Test
	public void pointerToQualifiedCanonicalTypeIsCanonical() {
		QualType p = f.getPointerType(intType.withConst());
		assertTrue(p.isCanonical());
		assertEquals(p, p.getCanonicalType());
	}

	@Test
	public void canonicalizationIsIdempotent() {
		Typedef td = new Typedef("myint", intType.withVolatile());
		QualType[] types = {
			f.getTypedefType(td),
			f.getPointerType(f.getTypedefType(td)),
			f.getConstantArrayType(f.getTypedefType(td), 4),
			f.getParenType(f.getPointerType(f.getTypedefType(td))),
			f.getFunctionType(f.getTypedefType(td), ImmutableList.of(f.getTypedefType(td))),
			f.getLValueReferenceType(f.getTypedefType(td)),
		};
		for (QualType t : types) {
			QualType c = t.getCanonicalType();
			assertTrue(c.isCanonical(), t.toString());
			assertEquals(c, c.getCanonicalType(), t.toString());
		}
	}

	@Test
	public void sugarSharesCanonicalTypeWithWhatItNames() {
		Typedef td = new Typedef("myint", intType);
		QualType typedef = f.getTypedefType(td);
		assertFalse(typedef.isCanonical());
		assertEquals(intType, typedef.getCanonicalType());
		assertSame(typedef.getTypePtr(), f.getTypedefType(td).getTypePtr());
		assertEquals(f.getPointerType(intType), f.getPointerType(typedef).getCanonicalType());
		assertEquals(intType, f.getParenType(typedef).getCanonicalType());
		assertEquals(intType, f.getElaboratedType(ElaboratedTypeKeyword.NONE, null, typedef).getCanonicalType());
	}

	@Test
	public void arrayOfQualifiedElementLiftsQualifiersInCanonicalForm() {
		QualType array = f.getConstantArrayType(intType.withConst(), 3);
		assertFalse(array.isCanonical());
		QualType canon = array.getCanonicalType();
		assertTrue(canon.getLocalQualifiers().hasConst());
		ConstantArrayType ca = (ConstantArrayType)canon.getTypePtr();
		assertEquals(intType, ca.getElementType());
		assertSame(f.getConstantArrayType(intType, 3).getTypePtr(), ca);

		QualType incomplete = f.getIncompleteArrayType(intType.withVolatile());
		assertTrue(incomplete.getCanonicalType().isVolatileQualified());
		assertSame(f.getIncompleteArrayType(intType).getTypePtr(), incomplete.getCanonicalType().getTypePtr());
	}

	@Test
	public void getAsArrayTypePushesQualifiersIntoElement() {
		QualType constArray = f.getConstantArrayType(intType, 2).withConst();
		ArrayType at = f.getAsArrayType(constArray);
		assertTrue(at.getElementType().isConstQualified());
		assertNull(f.getAsArrayType(intType));
		assertEquals(intType.withConst(), f.getBaseElementType(f.getConstantArrayType(constArray, 5)));
	}

	@Test
	public void variableLengthArraysAreNeverUniqued() {
		ConstExpr n = new ConstExpr(intType, 0);
		QualType a = f.getVariableArrayType(intType, n, ArraySizeModifier.NORMAL, 0, CheckedArrayKind.UNCHECKED);
		QualType b = f.getVariableArrayType(intType, n, ArraySizeModifier.NORMAL, 0, CheckedArrayKind.UNCHECKED);
		assertNotSame(a.getTypePtr(), b.getTypePtr());
		assertTrue(a.getTypePtr().isVariablyModifiedType());
		assertTrue(a.isCanonical());
	}

	@Test
	public void dependentSizedArrayReusesCanonicalNode() {
		ConstExpr n = ConstExpr.valueDependent(intType);
		QualType a = f.getDependentSizedArrayType(intType, n, ArraySizeModifier.NORMAL, 0, CheckedArrayKind.UNCHECKED);
		QualType b = f.getDependentSizedArrayType(intType, n, ArraySizeModifier.NORMAL, 0, CheckedArrayKind.UNCHECKED);
		assertSame(a.getTypePtr(), b.getTypePtr());
		assertTrue(a.getTypePtr().isDependentType());
		Typedef td = new Typedef("T", intType);
		QualType sugared = f.getDependentSizedArrayType(f.getTypedefType(td), n, ArraySizeModifier.NORMAL, 0,
				CheckedArrayKind.UNCHECKED);
		assertNotSame(a.getTypePtr(), sugared.getTypePtr());
		assertEquals(a, sugared.getCanonicalType());
	}

	@Test
	public void referencesToReferencesCollapseCanonically() {
		QualType lref = f.getLValueReferenceType(intType);
		QualType rref = f.getRValueReferenceType(intType);
		assertTrue(lref.isCanonical());
		assertEquals(lref, f.getLValueReferenceType(rref).getCanonicalType());
		assertEquals(rref, f.getRValueReferenceType(rref).getCanonicalType());
		assertEquals(lref, f.getLValueReferenceType(intType, false).getCanonicalType());
	}

	@Test
	public void functionParametersAreCanonicalizedAndDecayed() {
		QualType arrayParam = f.getConstantArrayType(charType, 10);
		QualType fnParam = f.getFunctionType(intType, ImmutableList.<QualType>of());
		QualType fn = f.getFunctionType(f.getVoidType(), ImmutableList.of(intType.withConst(), arrayParam, fnParam));
		assertFalse(fn.isCanonical());
		FunctionProtoType canon = (FunctionProtoType)fn.getCanonicalType().getTypePtr();
		assertEquals(intType, canon.getParamType(0));
		assertEquals(f.getPointerType(charType), canon.getParamType(1));
		assertEquals(f.getPointerType(fnParam), canon.getParamType(2));
		assertSame(canon, f.getFunctionType(f.getVoidType(),
				ImmutableList.of(intType, f.getPointerType(charType), f.getPointerType(fnParam))).getTypePtr());
	}

	@Test
	public void trailingReturnIsNotCanonical() {
		ExtProtoInfo trailing = ExtProtoInfo.DEFAULT.withTrailingReturn(true);
		QualType fn = f.getFunctionType(intType, ImmutableList.<QualType>of(), trailing);
		assertFalse(fn.isCanonical());
		assertFalse(((FunctionProtoType)fn.getCanonicalType().getTypePtr()).hasTrailingReturn());
		assertEquals(f.getFunctionType(intType, ImmutableList.<QualType>of()), fn.getCanonicalType());
	}

	@Test
	public void exceptionSpecsAreDroppedBeforeCXX17() {
		List<QualType> none = Collections.emptyList();
		QualType plain = f.getFunctionType(intType, none);
		QualType noexcept = f.getFunctionType(intType, none,
				ExtProtoInfo.DEFAULT.withExceptionSpec(ExceptionSpecInfo.of(ExceptionSpecificationType.BASIC_NOEXCEPT)));
		QualType throwing = f.getFunctionType(intType, none,
				ExtProtoInfo.DEFAULT.withExceptionSpec(ExceptionSpecInfo.dynamic(ImmutableList.of(intType))));
		assertNotSame(plain.getTypePtr(), noexcept.getTypePtr());
		assertEquals(plain, noexcept.getCanonicalType());
		assertEquals(plain, throwing.getCanonicalType());
	}

	@Test
	public void noexceptIsPartOfTheTypeFromCXX17() {
		TypeFactory g = TestFactories.cxx17();
		QualType i = g.getIntType();
		List<QualType> none = Collections.emptyList();
		QualType plain = g.getFunctionType(i, none);
		QualType noexcept = g.getFunctionType(i, none,
				ExtProtoInfo.DEFAULT.withExceptionSpec(ExceptionSpecInfo.of(ExceptionSpecificationType.BASIC_NOEXCEPT)));
		QualType throwNothing = g.getFunctionType(i, none,
				ExtProtoInfo.DEFAULT.withExceptionSpec(ExceptionSpecInfo.of(ExceptionSpecificationType.DYNAMIC_NONE)));
		QualType noexceptTrue = g.getFunctionType(i, none,
				ExtProtoInfo.DEFAULT.withExceptionSpec(ExceptionSpecInfo.computedNoexcept(new ConstExpr(g.getBoolType(), 1))));
		QualType noexceptFalse = g.getFunctionType(i, none,
				ExtProtoInfo.DEFAULT.withExceptionSpec(ExceptionSpecInfo.computedNoexcept(new ConstExpr(g.getBoolType(), 0))));
		QualType throwsInt = g.getFunctionType(i, none,
				ExtProtoInfo.DEFAULT.withExceptionSpec(ExceptionSpecInfo.dynamic(ImmutableList.of(i))));

		assertTrue(noexcept.isCanonical());
		assertNotEquals(plain, noexcept);
		assertEquals(noexcept, throwNothing.getCanonicalType());
		assertEquals(noexcept, noexceptTrue.getCanonicalType());
		assertEquals(plain, noexceptFalse.getCanonicalType());
		assertEquals(plain, throwsInt.getCanonicalType());
	}

	@Test
	public void dependentNoexceptStaysInCanonicalType() {
		TypeFactory g = TestFactories.cxx17();
		ConstExpr dependent = ConstExpr.valueDependent(g.getBoolType());
		QualType fn = g.getFunctionType(g.getIntType(), ImmutableList.<QualType>of(),
				ExtProtoInfo.DEFAULT.withExceptionSpec(ExceptionSpecInfo.computedNoexcept(dependent)));
		assertTrue(fn.isCanonical());
		assertTrue(fn.getTypePtr().isDependentType());
		assertTrue(((FunctionProtoType)fn.getTypePtr()).hasDependentExceptionSpec());
	}

	@Test
	public void unresolvedExceptionSpecsGetDistinctNodes() {
		Function decl = new Function("f");
		ExtProtoInfo epi = ExtProtoInfo.DEFAULT.withExceptionSpec(ExceptionSpecInfo.unevaluated(decl));
		QualType a = f.getFunctionType(intType, ImmutableList.<QualType>of(), epi);
		QualType b = f.getFunctionType(intType, ImmutableList.<QualType>of(), epi);
		assertNotSame(a.getTypePtr(), b.getTypePtr());
		assertEquals(a.getCanonicalType(), b.getCanonicalType());
		assertEquals(f.getFunctionType(intType, ImmutableList.<QualType>of()), a.getCanonicalType());
	}

	@Test
	public void decayedTypeRequiresArrayOrFunction() {
		QualType array = f.getConstantArrayType(intType, 3);
		QualType decayed = f.getDecayedType(array);
		assertEquals(f.getPointerType(intType), decayed.getCanonicalType());
		assertEquals(intType, decayed.getTypePtr().getPointeeType());
		assertThrows(IllegalArgumentException.class, () -> f.getDecayedType(intType));
	}

	@Test
	public void tagTypesAreKeyedByFirstDeclaration() {
		Record fwd = new Record("S", TagTypeKind.STRUCT);
		fwd.complete = false;
		Record def = fwd.redeclare();
		def.complete = true;
		QualType a = f.getRecordType(fwd);
		QualType b = f.getRecordType(def);
		assertSame(a.getTypePtr(), b.getTypePtr());
		assertSame(def, ((RecordType)a.getTypePtr()).getDecl());
		assertFalse(a.getTypePtr().isIncompleteType());
		assertSame(a.getTypePtr(), f.getTagDeclType(def).getTypePtr());
	}

	@Test
	public void templateTypeParmCanonicalIsAnonymous() {
		QualType named = f.getTemplateTypeParmType(0, 1, false, new TestDecls.TemplateParm("T"));
		QualType anon = f.getTemplateTypeParmType(0, 1, false);
		assertFalse(named.isCanonical());
		assertEquals(anon, named.getCanonicalType());
		assertTrue(anon.getTypePtr().isDependentType());
		assertNotEquals(anon, f.getTemplateTypeParmType(0, 1, true));
	}

	@Test
	public void substTemplateTypeParmRequiresCanonicalReplacement() {
		TemplateTypeParmType parm = (TemplateTypeParmType)f.getTemplateTypeParmType(0, 0, false).getTypePtr();
		QualType subst = f.getSubstTemplateTypeParmType(parm, intType);
		assertEquals(intType, subst.getCanonicalType());
		assertFalse(subst.getTypePtr().isDependentType());
		Typedef td = new Typedef("I", intType);
		assertThrows(IllegalArgumentException.class, () -> f.getSubstTemplateTypeParmType(parm, f.getTypedefType(td)));
	}

	@Test
	public void dependentNameWithoutKeywordCanonicalizesToTypename() {
		TestDecls.DependentQualifier nns = new TestDecls.DependentQualifier("T");
		QualType bare = f.getDependentNameType(ElaboratedTypeKeyword.NONE, nns, "type");
		QualType typename = f.getDependentNameType(ElaboratedTypeKeyword.TYPENAME, nns, "type");
		assertFalse(bare.isCanonical());
		assertTrue(typename.isCanonical());
		assertEquals(typename, bare.getCanonicalType());
		assertTrue(bare.getTypePtr().isDependentType());
	}

	@Test
	public void nonDependentSpecializationNeedsUnderlyingType() {
		TestDecls.Template vector = new TestDecls.Template("vector");
		List<TemplateArgument> args = ImmutableList.of(TemplateArgument.ofType(intType));
		assertThrows(IllegalArgumentException.class,
				() -> f.getTemplateSpecializationType(TemplateName.of(vector), args, null));
		Record spec = new Record("vector<int>", TagTypeKind.CLASS);
		QualType underlying = f.getRecordType(spec);
		QualType a = f.getTemplateSpecializationType(TemplateName.of(vector), args, underlying);
		QualType b = f.getTemplateSpecializationType(TemplateName.of(vector), args, underlying);
		assertNotSame(a.getTypePtr(), b.getTypePtr());
		assertEquals(underlying, a.getCanonicalType());
	}

	@Test
	public void dependentSpecializationsShareCanonicalNode() {
		TestDecls.Template vector = new TestDecls.Template("vector");
		QualType t = f.getTemplateTypeParmType(0, 0, false);
		List<TemplateArgument> args = ImmutableList.of(TemplateArgument.ofType(t));
		QualType a = f.getTemplateSpecializationType(TemplateName.of(vector), args, null);
		QualType b = f.getTemplateSpecializationType(TemplateName.of(vector), args, null);
		assertNotSame(a.getTypePtr(), b.getTypePtr());
		assertEquals(a.getCanonicalType(), b.getCanonicalType());
		assertTrue(a.getTypePtr().isDependentType());
	}

	@Test
	public void objCProtocolsAreSortedAndDeduplicatedInCanonicalForm() {
		TypeFactory g = TestFactories.objC(false);
		ObjCClass nsObject = new ObjCClass("NSObject");
		QualType iface = g.getObjCInterfaceType(nsObject);
		Protocol copying = new Protocol("NSCopying");
		Protocol coding = new Protocol("NSCoding");
		QualType written = g.getObjCObjectType(iface, ImmutableList.<QualType>of(),
				ImmutableList.<ObjCProtocolDecl>of(copying, coding, copying), false);
		QualType sorted = g.getObjCObjectType(iface, ImmutableList.<QualType>of(),
				ImmutableList.<ObjCProtocolDecl>of(coding, copying), false);
		assertFalse(written.isCanonical());
		assertTrue(sorted.isCanonical());
		assertEquals(sorted, written.getCanonicalType());
		assertEquals(ImmutableList.of(coding, copying),
				((ObjCObjectType)written.getCanonicalType().getTypePtr()).getProtocols());
	}

	@Test
	public void plainInterfaceIsItsOwnObjectType() {
		TypeFactory g = TestFactories.objC(false);
		QualType iface = g.getObjCInterfaceType(new ObjCClass("NSString"));
		assertSame(iface, g.getObjCObjectType(iface, ImmutableList.<QualType>of(),
				ImmutableList.<ObjCProtocolDecl>of(), false));
	}

	@Test
	public void idIsAnObjectPointerToTheBuiltinIdObject() {
		TypeFactory g = TestFactories.objC(false);
		QualType id = g.getObjCIdType();
		assertTrue(id.getTypePtr().isObjCIdType());
		assertTrue(id.getTypePtr().isObjCObjectPointerType());
		assertSame(id.getTypePtr(), g.getObjCIdType().getTypePtr());
		assertFalse(g.getObjCClassType().getTypePtr().isObjCIdType());
		assertTrue(g.getObjCClassType().getTypePtr().isObjCClassType());
	}

	@Test
	public void applyingProtocolsToNonObjectTypeFails() {
		TypeFactory g = TestFactories.objC(false);
		List<ObjCProtocolDecl> protocols = ImmutableList.<ObjCProtocolDecl>of(new Protocol("P"));
		assertThrows(IllegalArgumentException.class, () -> g.applyObjCProtocolQualifiers(g.getIntType(), protocols, true));
		QualType qualifiedId = g.applyObjCProtocolQualifiers(g.getObjCIdType(), protocols, true);
		assertTrue(qualifiedId.getTypePtr().isObjCQualifiedIdType());
	}

	@Test
	public void packExpansionsAreUniquedByExpansionCount() {
		QualType pack = f.getTemplateTypeParmType(0, 0, true);
		QualType expansion = f.getPackExpansionType(pack, null);
		assertTrue(expansion.isCanonical());
		assertFalse(expansion.getTypePtr().containsUnexpandedParameterPack());
		assertSame(expansion.getTypePtr(), f.getPackExpansionType(pack, null).getTypePtr());
		assertNotSame(expansion.getTypePtr(), f.getPackExpansionType(pack, 2).getTypePtr());
	}

	@Test
	public void autoTypes() {
		QualType undeduced = f.getAutoDeductType();
		assertTrue(undeduced.isCanonical());
		assertFalse(((AutoType)undeduced.getTypePtr()).isDeduced());
		QualType deduced = f.getAutoType(intType, AutoTypeKeyword.AUTO, false);
		assertEquals(intType, deduced.getCanonicalType());
		assertTrue(((AutoType)deduced.getTypePtr()).isDeduced());
		assertSame(undeduced.getTypePtr(), f.getPointerType(undeduced).getTypePtr().getContainedAutoType());
		assertTrue(f.getPointerType(undeduced).getTypePtr().isUndeducedType());
	}

	@Test
	public void typeofRecordsButDoesNotUnique() {
		QualType a = f.getTypeOfType(intType);
		QualType b = f.getTypeOfType(intType);
		assertNotSame(a.getTypePtr(), b.getTypePtr());
		assertEquals(intType, a.getCanonicalType());
		ConstExpr e = new ConstExpr(charType, 1);
		assertEquals(charType, f.getTypeOfExprType(e).getCanonicalType());
	}

	@Test
	public void factoryIteratesCreatedTypesInOrder() {
		int before = f.size();
		QualType p = f.getPointerType(intType);
		assertEquals(before + 1, f.size());
		Type last = null;
		for (Type t : f)
			last = t;
		assertSame(p.getTypePtr(), last);
	}

	@Test
	public void atomicPipeAndTypeVariables() {
		Typedef td = new Typedef("I", intType);
		QualType atomic = f.getAtomicType(f.getTypedefType(td));
		assertEquals(f.getAtomicType(intType), atomic.getCanonicalType());
		QualType pipe = f.getPipeType(f.getTypedefType(td), true);
		assertEquals(f.getPipeType(intType, true), pipe.getCanonicalType());
		assertNotEquals(f.getPipeType(intType, true), f.getPipeType(intType, false));
		QualType tv = f.getTypeVariableType(0, 0, false);
		assertSame(tv.getTypePtr(), f.getTypeVariableType(0, 0, false).getTypePtr());
		assertTrue(tv.getTypePtr().isIncompleteType());
	}

	@Test
	public void memberPointerCanonicalizesClass() {
		Record s = new Record("S", TagTypeKind.STRUCT);
		QualType record = f.getRecordType(s);
		Typedef td = new Typedef("SS", record);
		QualType viaTypedef = f.getMemberPointerType(intType, f.getTypedefType(td).getTypePtr());
		QualType direct = f.getMemberPointerType(intType, record.getTypePtr());
		assertFalse(viaTypedef.isCanonical());
		assertEquals(direct, viaTypedef.getCanonicalType());
		assertTrue(direct.getTypePtr().isMemberDataPointerType());
	}

	@Test
	public void dependentUnaryTransformKeepsWrittenBase() {
		QualType parm = f.getTemplateTypeParmType(0, 0, false);
		QualType written = f.getTypedefType(new Typedef("E", parm));
		QualType first = f.getUnaryTransformType(written, f.getDependentType(), UnaryTransformType.UTTKind.ENUM_UNDERLYING_TYPE);
		UnaryTransformType node = first.getTypePtr().castAs(UnaryTransformType.class);
		assertEquals(written, node.getBaseType());
		assertFalse(first.isCanonical());
		QualType canon = first.getCanonicalType();
		assertEquals(parm, canon.getTypePtr().castAs(UnaryTransformType.class).getBaseType());

		QualType second = f.getUnaryTransformType(written, f.getDependentType(), UnaryTransformType.UTTKind.ENUM_UNDERLYING_TYPE);
		assertNotSame(first.getTypePtr(), second.getTypePtr());
		assertEquals(canon, second.getCanonicalType());
		QualType direct = f.getUnaryTransformType(parm, f.getDependentType(), UnaryTransformType.UTTKind.ENUM_UNDERLYING_TYPE);
		assertEquals(canon, direct.getCanonicalType());
	}

	@Test
	public void exceptionSpecsDecideWhetherAFunctionCanThrow() {
		TypeFactory g = TestFactories.cxx17();
		QualType i = g.getIntType();
		QualType pack = g.getPackExpansionType(g.getTemplateTypeParmType(0, 0, true), null);
		Object[][] cases = {
			{ExceptionSpecInfo.NONE, NoexceptResult.NO_NOEXCEPT, CanThrowResult.CAN},
			{ExceptionSpecInfo.of(ExceptionSpecificationType.MS_ANY), NoexceptResult.NO_NOEXCEPT, CanThrowResult.CAN},
			{ExceptionSpecInfo.of(ExceptionSpecificationType.DYNAMIC_NONE), NoexceptResult.NO_NOEXCEPT, CanThrowResult.CANNOT},
			{ExceptionSpecInfo.of(ExceptionSpecificationType.BASIC_NOEXCEPT), NoexceptResult.NOTHROW, CanThrowResult.CANNOT},
			{ExceptionSpecInfo.computedNoexcept(new ConstExpr(g.getBoolType(), 1)), NoexceptResult.NOTHROW, CanThrowResult.CANNOT},
			{ExceptionSpecInfo.computedNoexcept(new ConstExpr(g.getBoolType(), 0)), NoexceptResult.THROW, CanThrowResult.CAN},
			{ExceptionSpecInfo.computedNoexcept(ConstExpr.valueDependent(g.getBoolType())),
				NoexceptResult.DEPENDENT, CanThrowResult.DEPENDENT},
			{ExceptionSpecInfo.dynamic(ImmutableList.of(i)), NoexceptResult.NO_NOEXCEPT, CanThrowResult.CAN},
			{ExceptionSpecInfo.dynamic(ImmutableList.of(pack)), NoexceptResult.NO_NOEXCEPT, CanThrowResult.DEPENDENT},
			{ExceptionSpecInfo.dynamic(ImmutableList.of(pack, i)), NoexceptResult.NO_NOEXCEPT, CanThrowResult.CAN},
		};
		for (Object[] c : cases) {
			ExceptionSpecInfo esi = (ExceptionSpecInfo)c[0];
			FunctionProtoType fpt = (FunctionProtoType)g.getFunctionType(i, ImmutableList.<QualType>of(),
					ExtProtoInfo.DEFAULT.withExceptionSpec(esi)).getTypePtr();
			String what = esi.getType().toString();
			assertEquals(c[1], fpt.getNoexceptSpec(), what);
			assertEquals(c[2], fpt.canThrow(), what);
			if (c[2] == CanThrowResult.DEPENDENT) {
				assertTrue(fpt.isNothrow(true), what);
				assertFalse(fpt.isNothrow(false), what);
			} else {
				assertEquals(c[2] == CanThrowResult.CANNOT, fpt.isNothrow(false), what);
				assertEquals(c[2] == CanThrowResult.CANNOT, fpt.isNothrow(true), what);
			}
		}
	}

	@Test
	public void addressingBitsForArraySizes() {
		//power-of-two element sizes add their log2
		assertEquals(9, ConstantArrayType.getNumAddressingBits(f, intType, BigInteger.valueOf(100)));
		assertEquals(7, ConstantArrayType.getNumAddressingBits(f, charType, BigInteger.valueOf(100)));
		//others need the full product: 3 * 100 = 300, 3 * 200 = 600
		QualType threeChars = f.getConstantArrayType(charType, 3);
		assertEquals(9, ConstantArrayType.getNumAddressingBits(f, threeChars, BigInteger.valueOf(100)));
		assertEquals(10, ConstantArrayType.getNumAddressingBits(f, threeChars, BigInteger.valueOf(200)));
		assertEquals(61, ConstantArrayType.getMaxSizeBits(f));
	}
}
