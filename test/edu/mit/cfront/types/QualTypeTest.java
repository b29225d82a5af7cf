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
import edu.mit.cfront.ast.TagTypeKind;
import edu.mit.cfront.basic.LangAS;
import edu.mit.cfront.types.Qualifiers.ObjCLifetime;
import edu.mit.cfront.types.TestDecls.CXXRecord;
import edu.mit.cfront.types.TestDecls.Record;
import edu.mit.cfront.types.TestDecls.Typedef;
import org.junit.jupiter.api.Test;

public class QualTypeTest {
	private final TypeFactory f = TestFactories.cxx14();
	private final QualType intType = f.getIntType();
	private final QualType constIntTypedef = f.getTypedefType(new Typedef("cint", intType.withConst()));

	@Test
	public void qualifiersHiddenInSugarAreVisible() {
		assertFalse(constIntTypedef.hasLocalQualifiers());
		assertTrue(constIntTypedef.hasQualifiers());
		assertTrue(constIntTypedef.isConstQualified());
		assertFalse(constIntTypedef.isLocalConstQualified());
		QualType cv = constIntTypedef.withVolatile();
		Qualifiers q = cv.getQualifiers();
		assertTrue(q.hasConst());
		assertTrue(q.hasVolatile());
		assertEquals(Qualifiers.fromCVRUMask(Qualifiers.VOLATILE), cv.getLocalQualifiers());
	}

	@Test
	public void canonicalTypeMergesLocalAndSugarQualifiers() {
		QualType canon = constIntTypedef.withRestrict().getCanonicalType();
		assertSame(intType.getTypePtr(), canon.getTypePtr());
		assertEquals(Qualifiers.fromCVRUMask(Qualifiers.CONST | Qualifiers.RESTRICT), canon.getLocalQualifiers());
	}

	@Test
	public void unqualifiedTypeStripsSugarOnlyAsFarAsNeeded() {
		assertEquals(intType, constIntTypedef.getUnqualifiedType());
		//with no qualifiers hidden in sugar the typedef itself survives
		QualType plainTypedef = f.getTypedefType(new Typedef("myint", intType));
		assertEquals(plainTypedef, plainTypedef.withConst().getUnqualifiedType());
		assertEquals(plainTypedef, plainTypedef.getLocalUnqualifiedType());
	}

	@Test
	public void splitUnqualifiedTypeKeepsDeepestQualifiedNode() {
		QualType outer = f.getTypedefType(new Typedef("outer", constIntTypedef.withVolatile()));
		SplitQualType split = outer.getSplitUnqualifiedType();
		assertSame(intType.getTypePtr(), split.getType());
		assertTrue(split.getQualifiers().hasConst());
		assertTrue(split.getQualifiers().hasVolatile());
	}

	@Test
	public void constantTypes() {
		assertTrue(intType.withConst().isConstant());
		assertTrue(constIntTypedef.isConstant());
		assertTrue(f.getConstantArrayType(constIntTypedef, 4).isConstant());
		assertFalse(f.getConstantArrayType(intType, 4).isConstant());
		assertFalse(f.getPointerType(intType.withConst()).isConstant());
		Qualifiers constantSpace = Qualifiers.NONE.withAddressSpace(LangAS.OPENCL_CONSTANT);
		assertTrue(intType.withQualifiers(constantSpace).isConstant());
		assertFalse(intType.withQualifiers(Qualifiers.NONE.withAddressSpace(LangAS.OPENCL_GLOBAL)).isConstant());
	}

	@Test
	public void nonLValueExprTypeInCXX() {
		assertEquals(intType.withConst(), f.getLValueReferenceType(intType.withConst()).getNonLValueExprType());
		assertEquals(intType, intType.withVolatile().getNonLValueExprType());
		QualType record = f.getRecordType(new CXXRecord("S"));
		assertEquals(record.withConst(), record.withConst().getNonLValueExprType());
		QualType parm = f.getTemplateTypeParmType(0, 0, false).withConst();
		assertEquals(parm, parm.getNonLValueExprType());
	}

	@Test
	public void nonLValueExprTypeInC() {
		TypeFactory c = TestFactories.c();
		QualType record = c.getRecordType(new Record("S", TagTypeKind.STRUCT));
		assertEquals(record, record.withConst().getNonLValueExprType());
	}

	@Test
	public void destructedTypes() {
		assertEquals(QualType.DestructionKind.NONE, intType.isDestructedType());
		CXXRecord trivial = new CXXRecord("Trivial");
		assertEquals(QualType.DestructionKind.NONE, f.getRecordType(trivial).isDestructedType());
		QualType owning = f.getRecordType(new CXXRecord("Owning").withNonTrivialDestructor());
		assertEquals(QualType.DestructionKind.CXX_DESTRUCTOR, owning.isDestructedType());
		assertEquals(QualType.DestructionKind.CXX_DESTRUCTOR, f.getConstantArrayType(owning, 2).isDestructedType());

		TypeFactory objc = TestFactories.objC(true);
		QualType id = objc.getObjCIdType();
		assertEquals(QualType.DestructionKind.OBJC_STRONG_LIFETIME,
				id.withQualifiers(Qualifiers.NONE.withObjCLifetime(ObjCLifetime.STRONG)).isDestructedType());
		assertEquals(QualType.DestructionKind.OBJC_WEAK_LIFETIME,
				id.withQualifiers(Qualifiers.NONE.withObjCLifetime(ObjCLifetime.WEAK)).isDestructedType());
		assertEquals(QualType.DestructionKind.NONE,
				id.withQualifiers(Qualifiers.NONE.withObjCLifetime(ObjCLifetime.AUTORELEASING)).isDestructedType());
	}

	@Test
	public void ignoreParensStripsOnlyParens() {
		QualType parens = f.getParenType(f.getParenType(constIntTypedef));
		assertEquals(constIntTypedef, parens.ignoreParens());
		assertEquals(constIntTypedef, constIntTypedef.ignoreParens());
	}

	@Test
	public void singleStepDesugarKeepsLocalQualifiers() {
		QualType parens = f.getParenType(constIntTypedef).withVolatile();
		assertEquals(constIntTypedef.withVolatile(), parens.getSingleStepDesugaredType());
		assertEquals(intType, intType.getSingleStepDesugaredType());
	}

	@Test
	public void baseTypeIdentifier() {
		QualType record = f.getRecordType(new CXXRecord("Widget"));
		assertEquals("Widget", f.getPointerType(record).getBaseTypeIdentifier());
		assertEquals("Widget", f.getConstantArrayType(record, 3).getBaseTypeIdentifier());
		assertEquals("cint", constIntTypedef.getBaseTypeIdentifier());
		assertNull(intType.getBaseTypeIdentifier());
	}

	@Test
	public void atomicUnqualifiedType() {
		assertEquals(intType, f.getAtomicType(intType.withConst()).getAtomicUnqualifiedType());
		assertEquals(intType, intType.withConst().getAtomicUnqualifiedType());
	}

	@Test
	public void equalityIsNodeIdentityAndQualifiers() {
		assertEquals(intType.withConst(), f.getIntType().withConst());
		assertNotEquals(intType, intType.withConst());
		//same canonical type, different nodes
		assertNotEquals(intType.withConst(), constIntTypedef);
		assertEquals(intType.withConst(), constIntTypedef.getCanonicalType());
	}
}
