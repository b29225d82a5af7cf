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
import edu.mit.cfront.ast.TagTypeKind;
import edu.mit.cfront.basic.Linkage;
import edu.mit.cfront.basic.LinkageInfo;
import edu.mit.cfront.basic.Visibility;
import edu.mit.cfront.types.LinkageCache.CachedProperties;
import edu.mit.cfront.types.TestDecls.Function;
import edu.mit.cfront.types.TestDecls.ObjCClass;
import edu.mit.cfront.types.TestDecls.Record;
import edu.mit.cfront.types.TestDecls.Typedef;
import org.junit.jupiter.api.Test;

public class LinkageTest {
	private final TypeFactory f = TestFactories.cxx14();
	private final QualType intType = f.getIntType();

	private Record record(String name, Linkage linkage) {
		Record r = new Record(name, TagTypeKind.STRUCT);
		r.linkage = linkage;
		return r;
	}

	@Test
	public void fundamentalTypesAreExternal() {
		assertEquals(Linkage.EXTERNAL_LINKAGE, intType.getTypePtr().getLinkage());
		assertFalse(intType.getTypePtr().hasUnnamedOrLocalType());
		assertEquals(LinkageInfo.external(), f.getPointerType(intType).getTypePtr().getLinkageAndVisibility());
	}

	@Test
	public void compositesTakeLeastVisibleComponent() {
		QualType external = f.getRecordType(record("E", Linkage.EXTERNAL_LINKAGE));
		QualType internal = f.getRecordType(record("I", Linkage.INTERNAL_LINKAGE));
		assertEquals(Linkage.INTERNAL_LINKAGE, f.getPointerType(internal).getTypePtr().getLinkage());
		assertEquals(Linkage.INTERNAL_LINKAGE, f.getConstantArrayType(internal, 2).getTypePtr().getLinkage());
		assertEquals(Linkage.INTERNAL_LINKAGE,
				f.getFunctionType(external, ImmutableList.of(intType, internal)).getTypePtr().getLinkage());
		assertEquals(Linkage.EXTERNAL_LINKAGE,
				f.getFunctionType(external, ImmutableList.of(intType)).getTypePtr().getLinkage());
		assertEquals(Linkage.INTERNAL_LINKAGE,
				f.getMemberPointerType(external, internal.getTypePtr()).getTypePtr().getLinkage());
		assertEquals(Linkage.INTERNAL_LINKAGE, f.getAtomicType(internal).getTypePtr().getLinkage());
	}

	@Test
	public void visibleNoLinkageWithInternalHasNoLinkage() {
		QualType visibleNone = f.getRecordType(record("V", Linkage.VISIBLE_NO_LINKAGE));
		QualType internal = f.getRecordType(record("I", Linkage.INTERNAL_LINKAGE));
		QualType external = f.getRecordType(record("E", Linkage.EXTERNAL_LINKAGE));
		assertEquals(Linkage.NO_LINKAGE,
				f.getFunctionType(visibleNone, ImmutableList.of(internal)).getTypePtr().getLinkage());
		assertEquals(Linkage.VISIBLE_NO_LINKAGE,
				f.getFunctionType(visibleNone, ImmutableList.of(external)).getTypePtr().getLinkage());
		assertEquals(Linkage.NO_LINKAGE, Linkage.minLinkage(Linkage.UNIQUE_EXTERNAL_LINKAGE, Linkage.VISIBLE_NO_LINKAGE));
		assertEquals(Linkage.MODULE_LINKAGE, Linkage.minLinkage(Linkage.EXTERNAL_LINKAGE, Linkage.MODULE_LINKAGE));
	}

	@Test
	public void localAndUnnamedTypes() {
		Record local = record("L", Linkage.NO_LINKAGE);
		local.context = new Function("f");
		QualType localType = f.getRecordType(local);
		assertTrue(localType.getTypePtr().hasUnnamedOrLocalType());
		assertTrue(f.getPointerType(localType).getTypePtr().hasUnnamedOrLocalType());
		assertTrue(f.getFunctionType(intType, ImmutableList.of(f.getPointerType(localType))).getTypePtr().hasUnnamedOrLocalType());

		Record unnamed = record("", Linkage.EXTERNAL_LINKAGE);
		unnamed.nameForLinkage = false;
		assertTrue(f.getRecordType(unnamed).getTypePtr().hasUnnamedOrLocalType());

		Record namespaceScope = record("N", Linkage.EXTERNAL_LINKAGE);
		assertFalse(f.getRecordType(namespaceScope).getTypePtr().hasUnnamedOrLocalType());
	}

	@Test
	public void sugarSharesCanonicalLinkage() {
		QualType internal = f.getRecordType(record("I", Linkage.INTERNAL_LINKAGE));
		QualType typedef = f.getTypedefType(new Typedef("T", internal));
		QualType parens = f.getParenType(f.getPointerType(typedef));
		assertEquals(Linkage.INTERNAL_LINKAGE, typedef.getTypePtr().getLinkage());
		assertEquals(Linkage.INTERNAL_LINKAGE, parens.getTypePtr().getLinkage());
		assertEquals(parens.getCanonicalType().getTypePtr().getLinkageCache().get(),
				parens.getTypePtr().getLinkageCache().get());
	}

	@Test
	public void dependentTypesAreTreatedAsExternal() {
		QualType parm = f.getTemplateTypeParmType(0, 0, false);
		assertEquals(Linkage.EXTERNAL_LINKAGE, parm.getTypePtr().getLinkage());
		QualType internal = f.getRecordType(record("I", Linkage.INTERNAL_LINKAGE));
		assertEquals(Linkage.INTERNAL_LINKAGE,
				f.getFunctionType(internal, ImmutableList.of(parm)).getTypePtr().getLinkage());
	}

	@Test
	public void visibilityMergesToMostRestrictive() {
		Record hidden = record("H", Linkage.EXTERNAL_LINKAGE);
		hidden.visibility = Visibility.HIDDEN;
		QualType hiddenType = f.getRecordType(hidden);
		LinkageInfo lv = f.getFunctionType(intType, ImmutableList.of(f.getPointerType(hiddenType)))
				.getTypePtr().getLinkageAndVisibility();
		assertEquals(Linkage.EXTERNAL_LINKAGE, lv.getLinkage());
		assertEquals(Visibility.HIDDEN, lv.getVisibility());
		//sugar answers from its canonical type
		QualType typedef = f.getTypedefType(new Typedef("HT", hiddenType));
		assertEquals(Visibility.HIDDEN, typedef.getTypePtr().getLinkageAndVisibility().getVisibility());
	}

	@Test
	public void objCInterfacesTakeTheirDeclarationsLinkage() {
		TypeFactory g = TestFactories.objC(false);
		ObjCClass cls = new ObjCClass("Widget");
		cls.linkage = Linkage.MODULE_LINKAGE;
		QualType ptr = g.getObjCObjectPointerType(g.getObjCInterfaceType(cls));
		assertEquals(Linkage.MODULE_LINKAGE, ptr.getTypePtr().getLinkage());
		assertEquals(Linkage.EXTERNAL_LINKAGE, g.getObjCIdType().getTypePtr().getLinkage());
	}

	@Test
	public void staleCacheIsDetected() {
		Record r = record("R", Linkage.EXTERNAL_LINKAGE);
		QualType pointer = f.getPointerType(f.getRecordType(r));
		QualType untouched = f.getPointerType(f.getPointerType(f.getRecordType(r)));
		assertTrue(pointer.getTypePtr().isLinkageValid());
		assertEquals(Linkage.EXTERNAL_LINKAGE, pointer.getTypePtr().getLinkage());
		assertTrue(pointer.getTypePtr().isLinkageValid());
		r.linkage = Linkage.INTERNAL_LINKAGE;
		assertFalse(pointer.getTypePtr().isLinkageValid());
		//cached, so still the old answer
		assertEquals(Linkage.EXTERNAL_LINKAGE, pointer.getTypePtr().getLinkage());
		//nothing cached yet, so trivially valid
		assertTrue(untouched.getTypePtr().isLinkageValid());
	}

	@Test
	public void cacheIsWrittenOnce() {
		LinkageCache cache = new LinkageCache();
		assertFalse(cache.isValid());
		assertThrows(IllegalStateException.class, cache::get);
		cache.set(CachedProperties.external());
		cache.set(CachedProperties.external());
		assertTrue(cache.isValid());
		assertThrows(IllegalStateException.class,
				() -> cache.set(new CachedProperties(Linkage.INTERNAL_LINKAGE, false)));
		assertEquals(CachedProperties.external(), cache.get());
	}

	@Test
	public void linkageInfoMerge() {
		LinkageInfo hiddenExplicit = new LinkageInfo(Linkage.EXTERNAL_LINKAGE, Visibility.HIDDEN, true);
		LinkageInfo merged = LinkageInfo.external().merge(hiddenExplicit);
		assertEquals(hiddenExplicit, merged);
		assertSame(LinkageInfo.internal(), LinkageInfo.internal().merge(LinkageInfo.external()));
		assertEquals(Linkage.NO_LINKAGE, LinkageInfo.none().merge(LinkageInfo.uniqueExternal()).getLinkage());
		LinkageInfo protectedImplicit = new LinkageInfo(Linkage.EXTERNAL_LINKAGE, Visibility.PROTECTED, false);
		assertFalse(protectedImplicit.merge(LinkageInfo.external()).isVisibilityExplicit());
		assertEquals(Visibility.PROTECTED, protectedImplicit.merge(LinkageInfo.external()).getVisibility());
	}
}
