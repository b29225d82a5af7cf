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
import edu.mit.cfront.ast.CXXBaseSpecifier;
import edu.mit.cfront.ast.TagTypeKind;
import edu.mit.cfront.basic.LangOptions;
import edu.mit.cfront.types.ArrayType.ArraySizeModifier;
import edu.mit.cfront.types.BuiltinType.Kind;
import edu.mit.cfront.types.FunctionProtoType.ExtProtoInfo;
import edu.mit.cfront.types.Qualifiers.ObjCLifetime;
import edu.mit.cfront.types.TestDecls.CXXRecord;
import edu.mit.cfront.types.TestDecls.ConstExpr;
import edu.mit.cfront.types.TestDecls.Enum;
import edu.mit.cfront.types.TestDecls.Record;
import edu.mit.cfront.types.TestDecls.Typedef;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

public class TypeClassifierTest {
	private final TypeFactory f = TestFactories.cxx14();
	private final TestLayout layout = TestFactories.layout(f);
	private final QualType intType = f.getIntType();
	private final QualType charType = f.getBuiltinType(BuiltinType.Kind.CHAR_S);

	private QualType struct(Record r) {
		layout.layOut(r);
		return f.getRecordType(r);
	}

	//<editor-fold defaultstate="collapsed" desc="Unique object representations">
	@Test
	public void interiorPaddingDefeatsUniqueRepresentation() {
		Record r = new Record("Padded", TagTypeKind.STRUCT);
		r.addField("a", intType);
		r.addField("b", f.getConstantArrayType(charType, 3));
		r.addField("c", intType);
		QualType padded = struct(r);
		assertEquals(96, layout.getTypeSize(padded));
		assertEquals(64, layout.getFieldOffset(r.fields.get(2)));
		assertFalse(padded.hasUniqueObjectRepresentations());
	}

	@Test
	public void packedIntegersHaveUniqueRepresentation() {
		QualType int32 = f.getTypedefType(new Typedef("int32_t", intType));
		Record r = new Record("Pair", TagTypeKind.STRUCT);
		r.addField("x", int32);
		r.addField("y", int32);
		QualType pair = struct(r);
		assertEquals(64, layout.getTypeSize(pair));
		assertTrue(pair.hasUniqueObjectRepresentations());
		assertTrue(f.getConstantArrayType(pair, 4).hasUniqueObjectRepresentations());
	}

	@Test
	public void tailPaddingDefeatsUniqueRepresentation() {
		Record r = new Record("Tail", TagTypeKind.STRUCT);
		r.addField("i", intType);
		r.addField("c", charType);
		QualType tail = struct(r);
		assertEquals(64, layout.getTypeSize(tail));
		assertFalse(tail.hasUniqueObjectRepresentations());
	}

	@Test
	public void scalarsAndPointers() {
		assertTrue(intType.hasUniqueObjectRepresentations());
		assertTrue(f.getBoolType().hasUniqueObjectRepresentations());
		assertTrue(f.getPointerType(intType).hasUniqueObjectRepresentations());
		assertTrue(f.getConstantArrayType(intType, 8).hasUniqueObjectRepresentations());
		assertFalse(f.getBuiltinType(BuiltinType.Kind.DOUBLE).hasUniqueObjectRepresentations());
		assertFalse(f.getFunctionType(intType, ImmutableList.<QualType>of()).hasUniqueObjectRepresentations());
		QualType record = struct(new CXXRecord("S"));
		assertTrue(f.getMemberPointerType(intType, record.getTypePtr()).hasUniqueObjectRepresentations());
	}

	@Test
	public void unionsNeedEveryMemberToFillTheUnion() {
		Record same = new Record("Same", TagTypeKind.UNION);
		same.addField("i", intType);
		same.addField("u", f.getBuiltinType(BuiltinType.Kind.UINT));
		assertTrue(struct(same).hasUniqueObjectRepresentations());

		Record mixed = new Record("Mixed", TagTypeKind.UNION);
		mixed.addField("i", intType);
		mixed.addField("c", charType);
		assertFalse(struct(mixed).hasUniqueObjectRepresentations());
	}

	@Test
	public void basesAreTiledBeforeFields() {
		CXXRecord base = new CXXRecord("Base", TagTypeKind.STRUCT);
		base.addField("b", intType);
		QualType baseType = struct(base);
		CXXRecord derived = new CXXRecord("Derived", TagTypeKind.STRUCT);
		derived.bases.add(new CXXBaseSpecifier(baseType, false));
		derived.addField("d", intType);
		layout.setBaseOffset(derived, base, 0);
		QualType derivedType = struct(derived);
		assertEquals(32, layout.getFieldOffset(derived.fields.get(0)));
		assertTrue(derivedType.hasUniqueObjectRepresentations());
	}

	@Test
	public void emptyBasesTakeNoSpace() {
		CXXRecord empty = new CXXRecord("Empty", TagTypeKind.STRUCT);
		QualType emptyType = f.getRecordType(empty);
		CXXRecord derived = new CXXRecord("Derived", TagTypeKind.STRUCT);
		derived.bases.add(new CXXBaseSpecifier(emptyType, false));
		derived.addField("x", intType);
		assertTrue(struct(derived).hasUniqueObjectRepresentations());
		//but an empty struct itself has no unique representation
		assertFalse(emptyType.hasUniqueObjectRepresentations());
	}

	@Test
	public void virtualBasesDefeatUniqueRepresentation() {
		CXXRecord base = new CXXRecord("VBase", TagTypeKind.STRUCT);
		base.addField("b", intType);
		QualType baseType = struct(base);
		CXXRecord derived = new CXXRecord("VDerived", TagTypeKind.STRUCT);
		derived.bases.add(new CXXBaseSpecifier(baseType, true));
		derived.addField("d", intType);
		layout.setBaseOffset(derived, base, 64);
		assertFalse(struct(derived).hasUniqueObjectRepresentations());
	}

	@Test
	public void lambdasAndNonTriviallyCopyableClasses() {
		Record lambda = new Record("lambda", TagTypeKind.CLASS);
		lambda.lambda = true;
		lambda.addField("captured", intType);
		assertFalse(struct(lambda).hasUniqueObjectRepresentations());
		CXXRecord owning = new CXXRecord("Owning").withNonTrivialDestructor();
		owning.addField("p", f.getPointerType(intType));
		assertFalse(struct(owning).hasUniqueObjectRepresentations());
	}
	//</editor-fold>

	@Test
	public void cxx98PODLooksThroughArraysButNotIncompleteTypes() {
		CXXRecord pod = new CXXRecord("Pod");
		QualType podType = f.getRecordType(pod);
		assertTrue(podType.isCXX98PODType());
		assertTrue(f.getIncompleteArrayType(podType).isCXX98PODType());
		assertTrue(f.getConstantArrayType(podType, 2).isCXX98PODType());
		assertFalse(f.getRecordType(new CXXRecord("NonPod").withNonTrivialDestructor()).isCXX98PODType());
		Record fwd = new Record("Fwd", TagTypeKind.STRUCT);
		fwd.complete = false;
		assertFalse(f.getRecordType(fwd).isCXX98PODType());
		assertFalse(f.getVoidType().isCXX98PODType());
		assertTrue(f.getRecordType(new Record("CStruct", TagTypeKind.STRUCT)).isCXX98PODType());
		assertFalse(f.getLValueReferenceType(intType).isCXX98PODType());
	}

	@Test
	public void cxx11PODRequiresTrivialAndStandardLayout() {
		CXXRecord notStandardLayout = new CXXRecord("Mixed");
		notStandardLayout.standardLayout = false;
		QualType t = f.getRecordType(notStandardLayout);
		assertTrue(t.isCXX98PODType());
		assertFalse(t.isCXX11PODType());
		assertFalse(t.isPODType());
		assertTrue(TestFactories.c().getIntType().isPODType());
		assertFalse(f.getTemplateTypeParmType(0, 0, false).isCXX11PODType());
	}

	@Test
	public void trivialTypes() {
		CXXRecord noDefault = new CXXRecord("NoDefault");
		noDefault.defaultConstructor = false;
		assertFalse(f.getRecordType(noDefault).isTrivialType());
		assertTrue(f.getRecordType(noDefault).isTriviallyCopyableType());
		CXXRecord nonTrivialCtor = new CXXRecord("Ctor");
		nonTrivialCtor.nonTrivialDefaultConstructor = true;
		assertFalse(f.getRecordType(nonTrivialCtor).isTrivialType());
		CXXRecord plain = new CXXRecord("Plain");
		assertTrue(f.getConstantArrayType(f.getRecordType(plain), 3).isTrivialType());
		assertTrue(f.getPointerType(intType).isTrivialType());
		assertFalse(f.getRecordType(new CXXRecord("Dtor").withNonTrivialDestructor()).isTriviallyCopyableType());
	}

	@Test
	public void objCLifetimeMakesTypesNonTrivial() {
		TypeFactory objc = TestFactories.objC(true);
		QualType strongId = objc.getObjCIdType().withQualifiers(Qualifiers.NONE.withObjCLifetime(ObjCLifetime.STRONG));
		assertFalse(strongId.isCXX98PODType());
		assertFalse(strongId.isTrivialType());
		assertFalse(strongId.isTriviallyCopyableType());
		QualType unretained = objc.getObjCIdType()
				.withQualifiers(Qualifiers.NONE.withObjCLifetime(ObjCLifetime.EXPLICIT_NONE));
		assertTrue(unretained.isTriviallyCopyableType());
	}

	@Test
	public void literalTypes() {
		assertTrue(f.getVoidType().getTypePtr().isLiteralType());
		assertFalse(TestFactories.c().getVoidType().getTypePtr().isLiteralType());
		assertTrue(intType.getTypePtr().isLiteralType());
		assertTrue(f.getLValueReferenceType(intType).getTypePtr().isLiteralType());
		assertTrue(f.getAtomicType(intType).getTypePtr().isLiteralType());
		assertTrue(f.getAutoDeductType().getTypePtr().isLiteralType());
		CXXRecord nonLiteral = new CXXRecord("NonLiteral");
		nonLiteral.literal = false;
		assertFalse(f.getRecordType(nonLiteral).getTypePtr().isLiteralType());
		ConstExpr n = new ConstExpr(intType, 0);
		assertFalse(f.getVariableArrayType(intType, n, ArrayType.ArraySizeModifier.NORMAL, 0, CheckedArrayKind.UNCHECKED)
				.getTypePtr().isLiteralType());
	}

	@Test
	public void standardLayoutAndAggregates() {
		CXXRecord mixed = new CXXRecord("Mixed");
		mixed.standardLayout = false;
		mixed.aggregate = false;
		assertFalse(f.getRecordType(mixed).getTypePtr().isStandardLayoutType());
		assertFalse(f.getRecordType(mixed).getTypePtr().isAggregateType());
		assertTrue(f.getConstantArrayType(intType, 2).getTypePtr().isStandardLayoutType());
		assertTrue(f.getConstantArrayType(intType, 2).getTypePtr().isAggregateType());
		assertTrue(f.getRecordType(new Record("C", TagTypeKind.STRUCT)).getTypePtr().isAggregateType());
		assertFalse(intType.getTypePtr().isAggregateType());
	}

	@Test
	public void nonWeakInManualRetainRelease() {
		LangOptions mrr = LangOptions.builder().standard(LangOptions.Standard.C).objC(true).objCWeak(true).build();
		TypeFactory g = new TypeFactory(mrr, new TestLayout());
		QualType id = g.getObjCIdType();
		assertTrue(id.isNonWeakInMRRWithObjCWeak());
		assertFalse(id.withQualifiers(Qualifiers.NONE.withObjCLifetime(ObjCLifetime.WEAK)).isNonWeakInMRRWithObjCWeak());
		assertFalse(TestFactories.objC(true).getObjCIdType().isNonWeakInMRRWithObjCWeak());
	}

	@Test
	public void scalarTypeKinds() {
		assertEquals(Type.ScalarTypeKind.INTEGRAL, intType.getTypePtr().getScalarTypeKind());
		assertEquals(Type.ScalarTypeKind.BOOL, f.getBoolType().getTypePtr().getScalarTypeKind());
		assertEquals(Type.ScalarTypeKind.FLOATING, f.getBuiltinType(BuiltinType.Kind.FLOAT).getTypePtr().getScalarTypeKind());
		assertEquals(Type.ScalarTypeKind.CPOINTER, f.getBuiltinType(BuiltinType.Kind.NULLPTR).getTypePtr().getScalarTypeKind());
		assertEquals(Type.ScalarTypeKind.CPOINTER, f.getPointerType(intType).getTypePtr().getScalarTypeKind());
		assertEquals(Type.ScalarTypeKind.FLOATING_COMPLEX,
				f.getComplexType(f.getBuiltinType(BuiltinType.Kind.DOUBLE)).getTypePtr().getScalarTypeKind());
		assertEquals(Type.ScalarTypeKind.INTEGRAL_COMPLEX, f.getComplexType(intType).getTypePtr().getScalarTypeKind());
		assertFalse(f.getVoidType().getTypePtr().isScalarType());
		assertFalse(f.getRecordType(new CXXRecord("S")).getTypePtr().isScalarType());
	}

	//<editor-fold defaultstate="collapsed" desc="Integer and character families">
	private static final Kind[] SIGNED = {Kind.CHAR_S, Kind.SCHAR, Kind.WCHAR_S, Kind.SHORT, Kind.INT, Kind.LONG,
		Kind.LONGLONG, Kind.INT128};
	private static final Kind[] UNSIGNED = {Kind.BOOL, Kind.CHAR_U, Kind.UCHAR, Kind.WCHAR_U, Kind.CHAR16, Kind.CHAR32,
		Kind.USHORT, Kind.UINT, Kind.ULONG, Kind.ULONGLONG, Kind.UINT128};

	private Type builtin(Kind kind) {
		return f.getBuiltinType(kind).getTypePtr();
	}

	@Test
	public void signedAndUnsignedBuiltins() {
		for (Kind k : SIGNED) {
			assertTrue(builtin(k).isSignedIntegerType(), k.name());
			assertFalse(builtin(k).isUnsignedIntegerType(), k.name());
			assertTrue(builtin(k).isIntegralType(), k.name());
		}
		for (Kind k : UNSIGNED) {
			assertTrue(builtin(k).isUnsignedIntegerType(), k.name());
			assertFalse(builtin(k).isSignedIntegerType(), k.name());
			assertTrue(builtin(k).isIntegralType(), k.name());
		}
		for (Kind k : new Kind[]{Kind.VOID, Kind.FLOAT, Kind.DOUBLE, Kind.NULLPTR}) {
			assertFalse(builtin(k).isSignedIntegerType(), k.name());
			assertFalse(builtin(k).isUnsignedIntegerType(), k.name());
			assertFalse(builtin(k).isIntegralType(), k.name());
		}
		//seen through sugar
		QualType int32 = f.getTypedefType(new Typedef("int32_t", intType));
		assertTrue(int32.getTypePtr().isSignedIntegerType());
	}

	@Test
	public void enumsDelegateToTheirUnderlyingType() {
		Enum signed = new Enum("S", intType);
		Enum unsigned = new Enum("U", f.getBuiltinType(Kind.UINT));
		assertTrue(f.getEnumType(signed).getTypePtr().isSignedIntegerType());
		assertFalse(f.getEnumType(signed).getTypePtr().isUnsignedIntegerType());
		assertTrue(f.getEnumType(unsigned).getTypePtr().isUnsignedIntegerType());
		assertFalse(f.getEnumType(unsigned).getTypePtr().isSignedIntegerType());

		Enum scoped = new Enum("Scoped", intType);
		scoped.scoped = true;
		Type t = f.getEnumType(scoped).getTypePtr();
		assertFalse(t.isSignedIntegerType());
		assertTrue(t.isSignedIntegerOrEnumerationType());
		assertFalse(t.isIntegerType());
		assertTrue(t.isIntegralOrEnumerationType());
		assertFalse(t.isIntegralOrUnscopedEnumerationType());

		Enum forward = new Enum("F", null);
		forward.complete = false;
		Type incomplete = f.getEnumType(forward).getTypePtr();
		assertFalse(incomplete.isSignedIntegerType());
		assertFalse(incomplete.isUnsignedIntegerType());
		assertFalse(incomplete.isIntegralOrEnumerationType());
	}

	@Test
	public void enumsAreIntegralOnlyInC() {
		TypeFactory c = TestFactories.c();
		Enum complete = new Enum("E", c.getIntType());
		Enum forward = new Enum("F", null);
		forward.complete = false;
		assertTrue(c.getEnumType(complete).getTypePtr().isIntegralType());
		assertFalse(c.getEnumType(forward).getTypePtr().isIntegralType());

		Enum cxx = new Enum("E", intType);
		Type t = f.getEnumType(cxx).getTypePtr();
		assertFalse(t.isIntegralType());
		assertTrue(t.isIntegerType());
		assertTrue(t.isIntegralOrEnumerationType());
	}

	@Test
	public void characterTypes() {
		for (Kind k : new Kind[]{Kind.CHAR_S, Kind.CHAR_U, Kind.SCHAR, Kind.UCHAR}) {
			assertTrue(builtin(k).isCharType(), k.name());
			assertTrue(builtin(k).isAnyCharacterType(), k.name());
		}
		for (Kind k : new Kind[]{Kind.WCHAR_S, Kind.WCHAR_U, Kind.CHAR16, Kind.CHAR32}) {
			assertFalse(builtin(k).isCharType(), k.name());
			assertTrue(builtin(k).isAnyCharacterType(), k.name());
		}
		for (Kind k : new Kind[]{Kind.BOOL, Kind.SHORT, Kind.USHORT, Kind.INT})
			assertFalse(builtin(k).isAnyCharacterType(), k.name());
		assertTrue(builtin(Kind.WCHAR_S).isWideCharType());
		assertTrue(builtin(Kind.WCHAR_U).isWideCharType());
		assertFalse(builtin(Kind.CHAR16).isWideCharType());
		assertTrue(builtin(Kind.CHAR16).isChar16Type());
		assertFalse(builtin(Kind.CHAR16).isChar32Type());
		assertTrue(builtin(Kind.CHAR32).isChar32Type());
	}

	@Test
	public void promotableIntegers() {
		for (Kind k : new Kind[]{Kind.BOOL, Kind.CHAR_S, Kind.CHAR_U, Kind.SCHAR, Kind.UCHAR, Kind.SHORT, Kind.USHORT,
				Kind.WCHAR_S, Kind.WCHAR_U, Kind.CHAR16, Kind.CHAR32})
			assertTrue(builtin(k).isPromotableIntegerType(), k.name());
		for (Kind k : new Kind[]{Kind.INT, Kind.UINT, Kind.LONG, Kind.INT128, Kind.FLOAT})
			assertFalse(builtin(k).isPromotableIntegerType(), k.name());
		QualType shortType = f.getBuiltinType(Kind.SHORT);
		assertTrue(f.getTypedefType(new Typedef("s16", shortType)).getTypePtr().isPromotableIntegerType());

		assertTrue(f.getEnumType(new Enum("E", intType)).getTypePtr().isPromotableIntegerType());
		Enum scoped = new Enum("S", shortType);
		scoped.scoped = true;
		assertFalse(f.getEnumType(scoped).getTypePtr().isPromotableIntegerType());
		Enum forward = new Enum("F", null);
		forward.complete = false;
		assertFalse(f.getEnumType(forward).getTypePtr().isPromotableIntegerType());
	}
	//</editor-fold>

	//<editor-fold defaultstate="collapsed" desc="Checked C">
	@Test
	public void checkedPointersAndArrays() {
		QualType ptr = f.getPointerType(intType, CheckedPointerKind.PTR);
		assertTrue(ptr.getTypePtr().isOrContainsCheckedType());
		assertTrue(f.getPointerType(ptr).getTypePtr().isOrContainsCheckedType());
		assertTrue(f.getFunctionType(intType, ImmutableList.of(ptr)).getTypePtr().isOrContainsCheckedType());
		assertTrue(f.getFunctionType(ptr, ImmutableList.<QualType>of()).getTypePtr().isOrContainsCheckedType());
		QualType checkedArray = f.getConstantArrayType(intType, BigInteger.valueOf(4), ArraySizeModifier.NORMAL, 0,
				CheckedArrayKind.CHECKED);
		assertTrue(checkedArray.getTypePtr().isOrContainsCheckedType());
		assertTrue(checkedArray.getTypePtr().containsCheckedValue());
		assertFalse(f.getPointerType(intType).getTypePtr().isOrContainsCheckedType());
		assertFalse(f.getConstantArrayType(intType, 4).getTypePtr().isOrContainsCheckedType());
		assertFalse(intType.getTypePtr().isOrContainsCheckedType());
	}

	@Test
	public void recordsHoldCheckedValuesThroughBoundedFields() {
		QualType ptr = f.getPointerType(intType, CheckedPointerKind.PTR);
		Record annotated = new Record("A", TagTypeKind.STRUCT);
		annotated.addField("p", ptr).bounds = true;
		Record bare = new Record("B", TagTypeKind.STRUCT);
		bare.addField("p", ptr);
		QualType a = f.getRecordType(annotated);
		QualType b = f.getRecordType(bare);
		assertTrue(a.getTypePtr().containsCheckedValue());
		assertFalse(b.getTypePtr().containsCheckedValue());
		assertFalse(a.getTypePtr().isOrContainsCheckedType());
		assertTrue(f.getPointerType(a).getTypePtr().containsCheckedValue());

		//a nested record with a checked value is not undone by a later one without
		Record outer = new Record("O", TagTypeKind.STRUCT);
		outer.addField("a", a);
		outer.addField("b", b);
		assertTrue(f.getRecordType(outer).getTypePtr().containsCheckedValue());
		Record plain = new Record("P", TagTypeKind.STRUCT);
		plain.addField("b", b);
		plain.addField("i", intType);
		assertFalse(f.getRecordType(plain).getTypePtr().containsCheckedValue());
	}

	@Test
	public void variadicPrototypesAreFoundThroughDeclarators() {
		QualType variadic = f.getFunctionType(intType, ImmutableList.of(intType), ExtProtoInfo.DEFAULT.withVariadic(true));
		QualType fixed = f.getFunctionType(intType, ImmutableList.of(intType));
		assertTrue(variadic.getTypePtr().hasVariadicType());
		assertTrue(f.getPointerType(variadic).getTypePtr().hasVariadicType());
		assertTrue(f.getConstantArrayType(f.getPointerType(variadic), 2).getTypePtr().hasVariadicType());
		assertTrue(f.getFunctionType(f.getVoidType(), ImmutableList.of(f.getPointerType(variadic))).getTypePtr()
				.hasVariadicType());
		assertFalse(fixed.getTypePtr().hasVariadicType());
		assertFalse(f.getPointerType(fixed).getTypePtr().hasVariadicType());
		assertFalse(intType.getTypePtr().hasVariadicType());
	}
	//</editor-fold>

	@Test
	public void implicitARCLifetimes() {
		TypeFactory arc = TestFactories.objC(true);
		assertEquals(ObjCLifetime.STRONG, arc.getObjCIdType().getTypePtr().getObjCARCImplicitLifetime());
		assertEquals(ObjCLifetime.EXPLICIT_NONE, arc.getObjCClassType().getTypePtr().getObjCARCImplicitLifetime());
		assertEquals(ObjCLifetime.EXPLICIT_NONE,
				arc.getConstantArrayType(arc.getObjCClassType(), 2).getTypePtr().getObjCARCImplicitLifetime());
		QualType block = arc.getBlockPointerType(arc.getFunctionType(arc.getVoidType(), ImmutableList.<QualType>of()));
		assertEquals(ObjCLifetime.STRONG, block.getTypePtr().getObjCARCImplicitLifetime());
	}
}
