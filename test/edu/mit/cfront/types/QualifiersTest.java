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
import edu.mit.cfront.basic.LangAS;
import edu.mit.cfront.types.Qualifiers.GC;
import edu.mit.cfront.types.Qualifiers.ObjCLifetime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class QualifiersTest {
	private static final Qualifiers C = Qualifiers.fromCVRUMask(Qualifiers.CONST);
	private static final Qualifiers CV = Qualifiers.fromCVRUMask(Qualifiers.CONST | Qualifiers.VOLATILE);

	@Test
	public void fastQualifiersAreShared() {
		assertSame(Qualifiers.NONE, Qualifiers.fromCVRUMask(0));
		assertSame(C, Qualifiers.NONE.withConst());
		assertTrue(Qualifiers.NONE.isEmpty());
		assertFalse(C.hasNonFastQualifiers());
	}

	@Test
	public void rejectsUnknownBits() {
		assertThrows(IllegalArgumentException.class, () -> Qualifiers.fromCVRUMask(0x10));
		assertThrows(IllegalArgumentException.class, () -> Qualifiers.NONE.withAddressSpace(-1));
	}

	@Test
	public void mergeUnionsCVRAndKeepsExtendedQualifiers() {
		Qualifiers global = Qualifiers.NONE.withAddressSpace(LangAS.OPENCL_GLOBAL);
		Qualifiers merged = C.merge(global.withVolatile());
		assertTrue(merged.hasConst());
		assertTrue(merged.hasVolatile());
		assertEquals(LangAS.OPENCL_GLOBAL, merged.getAddressSpace());
		assertSame(C, C.merge(Qualifiers.NONE));
		assertSame(C, Qualifiers.NONE.merge(C));
	}

	@Test
	public void mergeRejectsConflictingExtendedQualifiers() {
		Qualifiers global = Qualifiers.NONE.withAddressSpace(LangAS.OPENCL_GLOBAL);
		Qualifiers local = Qualifiers.NONE.withAddressSpace(LangAS.OPENCL_LOCAL);
		assertThrows(IllegalStateException.class, () -> global.merge(local));
		Qualifiers strong = Qualifiers.NONE.withObjCLifetime(ObjCLifetime.STRONG);
		Qualifiers weak = Qualifiers.NONE.withObjCLifetime(ObjCLifetime.WEAK);
		assertThrows(IllegalStateException.class, () -> strong.merge(weak));
		assertThrows(IllegalStateException.class,
				() -> Qualifiers.NONE.withObjCGCAttr(GC.WEAK).merge(Qualifiers.NONE.withObjCGCAttr(GC.STRONG)));
		assertEquals(strong, strong.merge(strong));
	}

	@Test
	public void removeClearsMatchingQualifiers() {
		Qualifiers q = CV.withObjCLifetime(ObjCLifetime.STRONG);
		Qualifiers r = q.remove(C.withObjCLifetime(ObjCLifetime.STRONG));
		assertFalse(r.hasConst());
		assertTrue(r.hasVolatile());
		assertFalse(r.hasObjCLifetime());
		//a non-matching lifetime stays
		assertTrue(q.remove(Qualifiers.NONE.withObjCLifetime(ObjCLifetime.WEAK)).hasObjCLifetime());
	}

	@Test
	public void supersetOf() {
		assertTrue(CV.isSupersetOf(C));
		assertFalse(C.isSupersetOf(CV));
		assertTrue(C.isSupersetOf(C));
		assertTrue(CV.isStrictSupersetOf(C));
		assertFalse(C.isStrictSupersetOf(C));
		Qualifiers global = C.withAddressSpace(LangAS.OPENCL_GLOBAL);
		assertTrue(global.isSupersetOf(C));
		assertFalse(C.isSupersetOf(global));
		assertFalse(global.isSupersetOf(C.withAddressSpace(LangAS.OPENCL_LOCAL)));
	}

	@Test
	public void supersetIgnoresUnaligned() {
		Qualifiers unalignedConst = C.withUnaligned();
		assertTrue(C.isSupersetOf(unalignedConst));
		assertTrue(unalignedConst.isSupersetOf(C));
		assertTrue(C.isStrictSupersetOf(unalignedConst));
		assertTrue(CV.isStrictSupersetOf(unalignedConst));
		assertFalse(unalignedConst.isStrictSupersetOf(CV));
	}

	@Test
	public void strictSupersetIsAntisymmetric() {
		List<Qualifiers> all = new ArrayList<>();
		for (int mask = 0; mask <= Qualifiers.CVR_MASK; ++mask) {
			Qualifiers q = Qualifiers.fromCVRUMask(mask);
			all.add(q);
			all.add(q.withAddressSpace(LangAS.OPENCL_GLOBAL));
			all.add(q.withObjCLifetime(ObjCLifetime.WEAK));
			all.add(q.withObjCGCAttr(GC.STRONG).withAddressSpace(LangAS.OPENCL_LOCAL));
		}
		for (Qualifiers a : all)
			for (Qualifiers b : all)
				if (a.isStrictSupersetOf(b))
					assertFalse(b.isStrictSupersetOf(a), a + " vs " + b);
	}

	@Test
	public void genericAddressSpaceIncludesNamedSpacesButNotConstant() {
		Qualifiers generic = Qualifiers.NONE.withAddressSpace(LangAS.OPENCL_GENERIC);
		assertTrue(generic.isAddressSpaceSupersetOf(Qualifiers.NONE.withAddressSpace(LangAS.OPENCL_GLOBAL)));
		assertTrue(generic.isAddressSpaceSupersetOf(Qualifiers.NONE.withAddressSpace(LangAS.OPENCL_PRIVATE)));
		assertFalse(generic.isAddressSpaceSupersetOf(Qualifiers.NONE.withAddressSpace(LangAS.OPENCL_CONSTANT)));
		assertFalse(Qualifiers.NONE.withAddressSpace(LangAS.OPENCL_GLOBAL).isAddressSpaceSupersetOf(generic));
	}

	@Test
	public void compatiblyIncludes() {
		assertTrue(CV.compatiblyIncludes(C));
		assertFalse(C.compatiblyIncludes(CV));
		//unaligned may be added, not dropped
		Qualifiers unaligned = C.withUnaligned();
		assertTrue(unaligned.compatiblyIncludes(C));
		assertFalse(C.compatiblyIncludes(unaligned));
		//GC may be added or removed, not changed
		Qualifiers weakGC = Qualifiers.NONE.withObjCGCAttr(GC.WEAK);
		assertTrue(weakGC.compatiblyIncludes(Qualifiers.NONE));
		assertTrue(Qualifiers.NONE.compatiblyIncludes(weakGC));
		assertFalse(weakGC.compatiblyIncludes(Qualifiers.NONE.withObjCGCAttr(GC.STRONG)));
		//lifetimes must match
		assertFalse(Qualifiers.NONE.withObjCLifetime(ObjCLifetime.STRONG).compatiblyIncludes(Qualifiers.NONE));
	}

	@Test
	public void unsafeUnretainedMayBeAddedToUnqualified() {
		Qualifiers unretained = Qualifiers.NONE.withObjCLifetime(ObjCLifetime.EXPLICIT_NONE);
		assertTrue(unretained.compatiblyIncludesObjCLifetime(Qualifiers.NONE));
		assertFalse(Qualifiers.NONE.compatiblyIncludesObjCLifetime(unretained));
		assertFalse(unretained.hasNonTrivialObjCLifetime());
		assertTrue(Qualifiers.NONE.withObjCLifetime(ObjCLifetime.AUTORELEASING).hasNonTrivialObjCLifetime());
	}

	@Test
	public void targetAddressSpaces() {
		int as = LangAS.getLangASFromTargetAS(3);
		Qualifiers q = Qualifiers.NONE.withAddressSpace(as);
		assertTrue(q.hasTargetSpecificAddressSpace());
		assertEquals(3, LangAS.toTargetAddressSpace(q.getAddressSpace()));
		assertFalse(C.withAddressSpace(LangAS.OPENCL_LOCAL).hasTargetSpecificAddressSpace());
	}

	@Test
	public void equalityIsByValue() {
		Qualifiers a = C.withObjCLifetime(ObjCLifetime.WEAK);
		Qualifiers b = Qualifiers.NONE.withObjCLifetime(ObjCLifetime.WEAK).withConst();
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, C);
		assertEquals("const __weak", a.toString());
	}
}
