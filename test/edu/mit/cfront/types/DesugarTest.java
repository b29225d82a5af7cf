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
import edu.mit.cfront.types.TestDecls.ConstExpr;
import edu.mit.cfront.types.TestDecls.Typedef;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DesugarTest {
	private final TypeFactory f = TestFactories.cxx14();
	private final QualType intType = f.getIntType();

	@Test
	public void pointerToTypedefIsNotItselfSugar() {
		QualType t = f.getTypedefType(new Typedef("T", intType.withConst()));
		QualType p = f.getPointerType(t);
		assertEquals(p, p.getDesugaredType());
		assertFalse(p.isCanonical());
		PointerType canon = (PointerType)p.getCanonicalType().getTypePtr();
		assertNotSame(p.getTypePtr(), canon);
		assertTrue(canon.isCanonicalUnqualified());
		assertEquals(intType.withConst(), canon.getPointeeType());
	}

	@Test
	public void typedefChainDesugarsOneStepAtATime() {
		QualType t = f.getTypedefType(new Typedef("T", intType.withConst()));
		QualType u = f.getTypedefType(new Typedef("U", t));
		QualType v = f.getTypedefType(new Typedef("V", f.getParenType(u).withVolatile()));
		assertEquals(f.getParenType(u).withVolatile(), v.getSingleStepDesugaredType());
		assertEquals(u.withVolatile(), v.getSingleStepDesugaredType().getSingleStepDesugaredType());
		SplitQualType split = v.getSplitDesugaredType();
		assertSame(intType.getTypePtr(), split.getType());
		assertEquals(Qualifiers.fromCVRUMask(Qualifiers.CONST | Qualifiers.VOLATILE), split.getQualifiers());
		assertEquals(v.getCanonicalType(), v.getDesugaredType());
	}

	@Test
	public void sugarOfEveryKindDesugarsToItsCanonicalType() {
		Typedef td = new Typedef("I", intType.withConst());
		QualType typedef = f.getTypedefType(td);
		TemplateTypeParmType parm = (TemplateTypeParmType)f.getTemplateTypeParmType(0, 0, false).getTypePtr();
		QualType array = f.getConstantArrayType(typedef, 3);
		QualType fn = f.getFunctionType(typedef, ImmutableList.of(array));

		List<QualType> sugar = new ArrayList<>();
		sugar.add(typedef);
		sugar.add(f.getParenType(typedef));
		sugar.add(f.getElaboratedType(ElaboratedTypeKeyword.NONE, null, typedef));
		sugar.add(f.getAttributedType(AttributedType.Kind.NONNULL, f.getPointerType(typedef), f.getPointerType(typedef)));
		sugar.add(f.getDecayedType(array));
		sugar.add(f.getDecayedType(fn));
		sugar.add(f.getAdjustedType(typedef, intType));
		sugar.add(f.getSubstTemplateTypeParmType(parm, intType.withConst()));
		sugar.add(f.getTypeOfType(typedef));
		sugar.add(f.getTypeOfExprType(new ConstExpr(typedef, 0)));
		sugar.add(f.getDecltypeType(new ConstExpr(typedef, 0), typedef));
		sugar.add(f.getAutoType(typedef, AutoTypeKeyword.AUTO, false));
		sugar.add(f.getUnaryTransformType(typedef, intType, UnaryTransformType.UTTKind.ENUM_UNDERLYING_TYPE));
		for (QualType s : sugar) {
			assertTrue(s.getTypePtr().isSugared(), s.toString());
			QualType desugared = s.getDesugaredType();
			assertFalse(desugared.getTypePtr().isSugared(), s.toString());
			assertEquals(s.getCanonicalType(), desugared.getCanonicalType(), s.toString());
		}
	}

	@Test
	public void attributedTypeDesugarsToEquivalentType() {
		QualType modified = f.getPointerType(intType);
		QualType equivalent = f.getPointerType(intType.withConst());
		QualType attributed = f.getAttributedType(AttributedType.Kind.NULLABLE, modified, equivalent);
		assertEquals(equivalent, attributed.getSingleStepDesugaredType());
		assertEquals(equivalent, attributed.getCanonicalType());
		assertEquals(NullabilityKind.NULLABLE, attributed.getTypePtr().getNullability());
		assertNull(modified.getTypePtr().getNullability());
	}

	@Test
	public void nullabilityIsFoundThroughOtherSugar() {
		QualType p = f.getPointerType(intType);
		QualType nonnull = f.getAttributedType(AttributedType.Kind.NONNULL, p, p);
		QualType wrapped = f.getTypedefType(new Typedef("P", f.getParenType(nonnull)));
		assertEquals(NullabilityKind.NON_NULL, wrapped.getTypePtr().getNullability());
		assertEquals(p, AttributedType.stripOuterNullability(nonnull));
		assertEquals(wrapped, AttributedType.stripOuterNullability(wrapped));
	}

	@Test
	public void canHaveNullability() {
		assertTrue(f.getPointerType(intType).getTypePtr().canHaveNullability(false));
		assertFalse(intType.getTypePtr().canHaveNullability(true));
		assertTrue(f.getTemplateTypeParmType(0, 0, false).getTypePtr().canHaveNullability(true));
		assertFalse(f.getTemplateTypeParmType(0, 0, false).getTypePtr().canHaveNullability(false));
		assertTrue(f.getDependentType().getTypePtr().canHaveNullability(true));
	}

	@Test
	public void getAsFindsOutermostTypedef() {
		Typedef inner = new Typedef("inner", intType);
		Typedef outer = new Typedef("outer", f.getTypedefType(inner));
		QualType t = f.getParenType(f.getTypedefType(outer));
		assertSame(outer, t.getTypePtr().getAs(TypedefType.class).getDecl());
		assertSame(intType.getTypePtr(), t.getTypePtr().getAs(BuiltinType.class));
		assertNull(t.getTypePtr().getAs(PointerType.class));
		assertThrows(IllegalStateException.class, () -> t.getTypePtr().castAs(PointerType.class));
	}

	@Test
	public void deepSugarTerminates() {
		QualType t = intType;
		for (int i = 0; i < 1000; ++i)
			t = i % 2 == 0 ? f.getParenType(t) : f.getTypedefType(new Typedef("t" + i, t));
		assertEquals(intType, t.getDesugaredType());
		assertEquals(intType, t.getCanonicalType());
		assertEquals(intType, t.getUnqualifiedType().getDesugaredType());
	}
}
