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
import edu.mit.cfront.types.TestDecls.ObjCCategory;
import edu.mit.cfront.types.TestDecls.ObjCClass;
import edu.mit.cfront.types.TestDecls.ObjCMethod;
import edu.mit.cfront.types.TestDecls.ObjCParam;
import edu.mit.cfront.types.TestDecls.Protocol;
import java.util.List;
import org.junit.jupiter.api.Test;

public class SubstitutionTest {
	private static final List<QualType> NO_ARGS = ImmutableList.of();
	private static final List<ObjCProtocolDecl> NO_PROTOCOLS = ImmutableList.of();
	private final TypeFactory f = TestFactories.objC(false);
	private final ObjCClass nsObject = new ObjCClass("NSObject");
	private final QualType nsObjectPtr = pointerTo(nsObject);
	private final ObjCClass nsString = new ObjCClass("NSString");
	private final QualType nsStringPtr = pointerTo(nsString);

	/** NSArray&lt;ObjectType&gt;, ObjectType bounded by id. */
	private final ObjCClass nsArray = new ObjCClass("NSArray");
	private final ObjCParam element = new ObjCParam("ObjectType", 0, f.getObjCIdType());
	private final QualType elementUse;
	/** Box&lt;T : NSObject *&gt;. */
	private final ObjCClass box = new ObjCClass("Box");
	private final ObjCParam boxed = new ObjCParam("T", 0, nsObjectPtr);
	private final QualType boxedUse;

	public SubstitutionTest() {
		nsArray.typeParams = ImmutableList.of(element);
		elementUse = f.getObjCTypeParamType(element, NO_PROTOCOLS);
		box.typeParams = ImmutableList.of(boxed);
		boxedUse = f.getObjCTypeParamType(boxed, NO_PROTOCOLS);
	}

	private QualType pointerTo(ObjCClass cls) {
		return f.getObjCObjectPointerType(f.getObjCInterfaceType(cls));
	}

	private QualType specialized(ObjCClass cls, QualType... args) {
		return f.getObjCObjectPointerType(f.getObjCObjectType(f.getObjCInterfaceType(cls),
				ImmutableList.copyOf(args), NO_PROTOCOLS, false));
	}

	private static ObjCObjectPointerType objectPointer(QualType t) {
		return t.getTypePtr().castAs(ObjCObjectPointerType.class);
	}

	@Test
	public void resultOfIdBoundedParameterStaysId() {
		QualType result = elementUse.substObjCTypeArgs(NO_ARGS, ObjCSubstitutionContext.RESULT);
		assertEquals(f.getObjCIdType(), result);
		assertFalse(objectPointer(result).isKindOfType());
	}

	@Test
	public void resultOfClassBoundedParameterBecomesKindOf() {
		QualType result = boxedUse.substObjCTypeArgs(NO_ARGS, ObjCSubstitutionContext.RESULT);
		ObjCObjectPointerType ptr = objectPointer(result);
		assertTrue(ptr.isKindOfType());
		assertSame(nsObject, ptr.getInterfaceDecl());
		assertEquals(result, boxedUse.substObjCTypeArgs(NO_ARGS, ObjCSubstitutionContext.PROPERTY));
		//other contexts take the bound as written
		assertEquals(nsObjectPtr, boxedUse.substObjCTypeArgs(NO_ARGS, ObjCSubstitutionContext.PARAMETER));
		assertEquals(nsObjectPtr, boxedUse.substObjCTypeArgs(NO_ARGS, ObjCSubstitutionContext.ORDINARY));
	}

	@Test
	public void explicitArgumentsReplaceParameters() {
		List<QualType> args = ImmutableList.of(nsStringPtr);
		assertEquals(nsStringPtr, elementUse.substObjCTypeArgs(args, ObjCSubstitutionContext.RESULT));
		assertEquals(nsStringPtr.withConst(),
				elementUse.withConst().substObjCTypeArgs(args, ObjCSubstitutionContext.ORDINARY));
		assertEquals(f.getPointerType(nsStringPtr),
				f.getPointerType(elementUse).substObjCTypeArgs(args, ObjCSubstitutionContext.ORDINARY));
	}

	@Test
	public void protocolsOnParameterUseCarryOver() {
		Protocol copying = new Protocol("NSCopying");
		QualType copyableElement = f.getObjCTypeParamType(element, ImmutableList.<ObjCProtocolDecl>of(copying));
		QualType result = copyableElement.substObjCTypeArgs(ImmutableList.of(nsStringPtr), ObjCSubstitutionContext.ORDINARY);
		ObjCObjectPointerType ptr = objectPointer(result);
		assertSame(nsString, ptr.getInterfaceDecl());
		assertEquals(ImmutableList.of(copying), ptr.getProtocols());
	}

	@Test
	public void functionResultAndParametersUseTheirOwnContexts() {
		QualType fn = f.getFunctionType(boxedUse, ImmutableList.of(boxedUse, f.getIntType()));
		QualType result = fn.substObjCTypeArgs(NO_ARGS, ObjCSubstitutionContext.ORDINARY);
		FunctionProtoType proto = result.getTypePtr().castAs(FunctionProtoType.class);
		assertTrue(objectPointer(proto.getReturnType()).isKindOfType());
		assertEquals(nsObjectPtr, proto.getParamType(0));
		assertEquals(f.getIntType(), proto.getParamType(1));

		QualType block = f.getBlockPointerType(fn);
		QualType substituted = block.substObjCTypeArgs(ImmutableList.of(nsStringPtr), ObjCSubstitutionContext.ORDINARY);
		assertEquals(f.getBlockPointerType(f.getFunctionType(nsStringPtr, ImmutableList.of(nsStringPtr, f.getIntType()))),
				substituted);
	}

	@Test
	public void untouchedTypesAreReturnedAsIs() {
		QualType fn = f.getFunctionType(f.getPointerType(f.getIntType()), ImmutableList.of(nsStringPtr));
		QualType result = fn.substObjCTypeArgs(ImmutableList.of(nsObjectPtr), ObjCSubstitutionContext.ORDINARY);
		assertSame(fn.getTypePtr(), result.getTypePtr());
		QualType array = f.getConstantArrayType(f.getIntType().withConst(), 4);
		assertSame(array.getTypePtr(), array.substObjCTypeArgs(NO_ARGS, ObjCSubstitutionContext.RESULT).getTypePtr());
	}

	@Test
	public void specializedObjectTypesAreRewritten() {
		QualType arrayOfElement = specialized(nsArray, elementUse);
		QualType withArgs = arrayOfElement.substObjCTypeArgs(ImmutableList.of(nsStringPtr), ObjCSubstitutionContext.ORDINARY);
		assertEquals(ImmutableList.of(nsStringPtr), objectPointer(withArgs).getTypeArgs());
		//no arguments to substitute: the result is unspecialized
		QualType bare = arrayOfElement.substObjCTypeArgs(NO_ARGS, ObjCSubstitutionContext.ORDINARY);
		assertEquals(pointerTo(nsArray), bare);
		assertTrue(objectPointer(bare).isUnspecialized());
	}

	@Test
	public void stripKindOf() {
		QualType kindOf = boxedUse.substObjCTypeArgs(NO_ARGS, ObjCSubstitutionContext.RESULT);
		assertEquals(nsObjectPtr, kindOf.stripObjCKindOfType());
		QualType fn = f.getFunctionType(kindOf, ImmutableList.of(kindOf));
		assertEquals(f.getFunctionType(nsObjectPtr, ImmutableList.of(nsObjectPtr)), fn.stripObjCKindOfType());
		assertSame(nsStringPtr.getTypePtr(), nsStringPtr.stripObjCKindOfType().getTypePtr());
	}

	//<editor-fold defaultstate="collapsed" desc="Member substitutions">
	@Test
	public void substitutionsForDeclaringClass() {
		assertEquals(ImmutableList.of(nsStringPtr),
				specialized(nsArray, nsStringPtr).getTypePtr().getObjCSubstitutions(nsArray));
		assertEquals(NO_ARGS, pointerTo(nsArray).getTypePtr().getObjCSubstitutions(nsArray));
		assertEquals(NO_ARGS, f.getObjCIdType().getTypePtr().getObjCSubstitutions(nsArray));
		assertNull(nsStringPtr.getTypePtr().getObjCSubstitutions(nsString));
	}

	@Test
	public void substitutionsForMethodsAndCategories() {
		QualType receiver = specialized(nsArray, nsStringPtr);
		ObjCMethod method = new ObjCMethod("firstObject", nsArray);
		assertEquals(ImmutableList.of(nsStringPtr), receiver.getTypePtr().getObjCSubstitutions(method));

		ObjCCategory category = new ObjCCategory("Extras", nsArray);
		assertNull(receiver.getTypePtr().getObjCSubstitutions(category));
		category.typeParams = ImmutableList.of(new ObjCParam("ObjectType", 0, f.getObjCIdType()));
		assertEquals(ImmutableList.of(nsStringPtr), receiver.getTypePtr().getObjCSubstitutions(category));
	}

	@Test
	public void substitutionsFollowTheSuperclassChain() {
		ObjCClass mutable = new ObjCClass("NSMutableArray");
		ObjCParam mutableElement = new ObjCParam("ObjectType", 0, f.getObjCIdType());
		mutable.typeParams = ImmutableList.of(mutableElement);
		mutable.superClass = f.getObjCObjectType(f.getObjCInterfaceType(nsArray),
				ImmutableList.of(f.getObjCTypeParamType(mutableElement, NO_PROTOCOLS)), NO_PROTOCOLS, false)
				.getTypePtr().castAs(ObjCObjectType.class);
		QualType receiver = specialized(mutable, nsStringPtr);
		assertEquals(ImmutableList.of(nsStringPtr), receiver.getTypePtr().getObjCSubstitutions(nsArray));
		assertEquals(NO_ARGS, pointerTo(mutable).getTypePtr().getObjCSubstitutions(nsArray));

		assertEquals(nsStringPtr, elementUse.substObjCMemberType(receiver, nsArray, ObjCSubstitutionContext.RESULT));
		assertEquals(f.getObjCIdType(), elementUse.substObjCMemberType(pointerTo(mutable), nsArray,
				ObjCSubstitutionContext.RESULT));
	}

	@Test
	public void blockReceiversSubstituteBounds() {
		QualType block = f.getBlockPointerType(f.getFunctionType(f.getVoidType(), NO_ARGS));
		assertEquals(NO_ARGS, block.getTypePtr().getObjCSubstitutions(nsArray));
		assertEquals(nsObjectPtr, boxedUse.substObjCMemberType(block, box, ObjCSubstitutionContext.PARAMETER));
	}

	@Test
	public void acceptsTypeParams() {
		assertTrue(f.getObjCInterfaceType(nsArray).getTypePtr().acceptsObjCTypeParams());
		assertFalse(f.getObjCInterfaceType(nsString).getTypePtr().acceptsObjCTypeParams());
		assertFalse(f.getIntType().getTypePtr().acceptsObjCTypeParams());
	}
	//</editor-fold>
}
