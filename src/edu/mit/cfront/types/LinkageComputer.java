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

import edu.mit.cfront.ast.DeclContext;
import edu.mit.cfront.ast.TagDecl;
import edu.mit.cfront.basic.Linkage;
import edu.mit.cfront.basic.LinkageInfo;
import edu.mit.cfront.types.LinkageCache.CachedProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the linkage of types.  A type has the least visible linkage of
 * the declarations it's built from; fundamental types have external
 * linkage.  Linkage is a property of the canonical type, so sugar nodes
 * copy their canonical type's cached result.
 */
final class LinkageComputer {
	private static final Logger LOG = LoggerFactory.getLogger(LinkageComputer.class);
	private LinkageComputer() {}

	/**
	 * Fills in the type's linkage cache if it isn't already.
	 * @param t a type
	 */
	static void ensure(Type t) {
		LinkageCache cache = t.getLinkageCache();
		if (cache.isValid())
			return;
		if (!t.isCanonicalUnqualified()) {
			Type canon = t.getCanonicalTypeInternal().getTypePtr();
			ensure(canon);
			cache.set(canon.getLinkageCache().get());
			return;
		}
		cache.set(computeCachedProperties(t));
	}

	private static CachedProperties get(QualType t) {
		return get(t.getTypePtr());
	}

	private static CachedProperties get(Type t) {
		ensure(t);
		return t.getLinkageCache().get();
	}

	private static CachedProperties computeCachedProperties(Type t) {
		TypeClass tc = t.getTypeClass();
		if (tc.isNonCanonical())
			throw new AssertionError("non-canonical type in linkage computation: " + t);
		if (tc.isDependentOrCanonicalUnlessDependent()) {
			//Treat instantiation-dependent types as external.
			assert t.isInstantiationDependentType() : t;
			return CachedProperties.external();
		}
		switch (tc) {
			case AUTO:
			case DEDUCED_TEMPLATE_SPECIALIZATION:
				//undeduced, only seen in error recovery
			case BUILTIN:
			case TYPE_VARIABLE:
				return CachedProperties.external();
			case RECORD:
			case ENUM: {
				TagDecl tag = ((TagType)t).getDecl();
				DeclContext dc = tag.getDeclContext();
				boolean localOrUnnamed = (dc != null && dc.isFunctionOrMethod()) || !tag.hasNameForLinkage();
				return new CachedProperties(tag.getLinkageInternal(), localOrUnnamed);
			}
			case COMPLEX:
				return get(((ComplexType)t).getElementType());
			case POINTER:
				return get(((PointerType)t).getPointeeType());
			case BLOCK_POINTER:
				return get(((BlockPointerType)t).getPointeeType());
			case LVALUE_REFERENCE:
			case RVALUE_REFERENCE:
				return get(((ReferenceType)t).getPointeeType());
			case MEMBER_POINTER: {
				MemberPointerType mpt = (MemberPointerType)t;
				return get(mpt.getClassType()).merge(get(mpt.getPointeeType()));
			}
			case CONSTANT_ARRAY:
			case INCOMPLETE_ARRAY:
			case VARIABLE_ARRAY:
				return get(((ArrayType)t).getElementType());
			case VECTOR:
			case EXT_VECTOR:
				return get(((VectorType)t).getElementType());
			case FUNCTION_NO_PROTO:
				return get(((FunctionType)t).getReturnType());
			case FUNCTION_PROTO: {
				FunctionProtoType fpt = (FunctionProtoType)t;
				CachedProperties result = get(fpt.getReturnType());
				for (QualType param : fpt.getParamTypes())
					result = result.merge(get(param));
				return result;
			}
			case OBJC_INTERFACE:
				return new CachedProperties(((ObjCInterfaceType)t).getDecl().getLinkageInternal(), false);
			case OBJC_OBJECT:
				return get(((ObjCObjectType)t).getBaseType());
			case OBJC_OBJECT_POINTER:
				return get(((ObjCObjectPointerType)t).getPointeeType());
			case ATOMIC:
				return get(((AtomicType)t).getValueType());
			case PIPE:
				return get(((PipeType)t).getElementType());
			default:
				throw new AssertionError("unhandled type class " + tc);
		}
	}

	private static LinkageInfo computeTypeLinkageInfo(QualType t) {
		return computeTypeLinkageInfo(t.getTypePtr());
	}

	/**
	 * Computes linkage and visibility from scratch, without consulting or
	 * filling the cache.
	 */
	private static LinkageInfo computeTypeLinkageInfo(Type t) {
		TypeClass tc = t.getTypeClass();
		if (tc.isNonCanonical())
			throw new AssertionError("non-canonical type in linkage computation: " + t);
		if (tc.isDependentOrCanonicalUnlessDependent()) {
			assert t.isInstantiationDependentType() : t;
			return LinkageInfo.external();
		}
		switch (tc) {
			case BUILTIN:
			case AUTO:
			case DEDUCED_TEMPLATE_SPECIALIZATION:
			case TYPE_VARIABLE:
				return LinkageInfo.external();
			case RECORD:
			case ENUM:
				return ((TagType)t).getDecl().getLinkageAndVisibility();
			case COMPLEX:
				return computeTypeLinkageInfo(((ComplexType)t).getElementType());
			case POINTER:
				return computeTypeLinkageInfo(((PointerType)t).getPointeeType());
			case BLOCK_POINTER:
				return computeTypeLinkageInfo(((BlockPointerType)t).getPointeeType());
			case LVALUE_REFERENCE:
			case RVALUE_REFERENCE:
				return computeTypeLinkageInfo(((ReferenceType)t).getPointeeType());
			case MEMBER_POINTER: {
				MemberPointerType mpt = (MemberPointerType)t;
				return computeTypeLinkageInfo(mpt.getClassType()).merge(computeTypeLinkageInfo(mpt.getPointeeType()));
			}
			case CONSTANT_ARRAY:
			case INCOMPLETE_ARRAY:
			case VARIABLE_ARRAY:
				return computeTypeLinkageInfo(((ArrayType)t).getElementType());
			case VECTOR:
			case EXT_VECTOR:
				return computeTypeLinkageInfo(((VectorType)t).getElementType());
			case FUNCTION_NO_PROTO:
				return computeTypeLinkageInfo(((FunctionType)t).getReturnType());
			case FUNCTION_PROTO: {
				FunctionProtoType fpt = (FunctionProtoType)t;
				LinkageInfo lv = computeTypeLinkageInfo(fpt.getReturnType());
				for (QualType param : fpt.getParamTypes())
					lv = lv.merge(computeTypeLinkageInfo(param));
				return lv;
			}
			case OBJC_INTERFACE:
				return ((ObjCInterfaceType)t).getDecl().getLinkageAndVisibility();
			case OBJC_OBJECT:
				return computeTypeLinkageInfo(((ObjCObjectType)t).getBaseType());
			case OBJC_OBJECT_POINTER:
				return computeTypeLinkageInfo(((ObjCObjectPointerType)t).getPointeeType());
			case ATOMIC:
				return computeTypeLinkageInfo(((AtomicType)t).getValueType());
			case PIPE:
				return computeTypeLinkageInfo(((PipeType)t).getElementType());
			default:
				throw new AssertionError("unhandled type class " + tc);
		}
	}

	static LinkageInfo getTypeLinkageAndVisibility(Type t) {
		if (!t.isCanonicalUnqualified())
			return computeTypeLinkageInfo(t.getCanonicalTypeInternal());
		LinkageInfo lv = computeTypeLinkageInfo(t);
		assert lv.getLinkage() == t.getLinkage() : lv + " vs cached " + t.getLinkage();
		return lv;
	}

	/**
	 * Recomputes the type's linkage and compares it against the cache.
	 * Types with nothing cached are trivially valid.
	 */
	static boolean isLinkageValid(Type t) {
		LinkageCache cache = t.getLinkageCache();
		if (!cache.isValid())
			return true;
		Linkage fresh = computeTypeLinkageInfo(t.getCanonicalTypeInternal()).getLinkage();
		Linkage cached = cache.get().getLinkage();
		if (fresh != cached)
			LOG.debug("stale linkage for {}: cached {}, computed {}", t, cached, fresh);
		return fresh == cached;
	}
}
