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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import com.google.common.base.Joiner;
import edu.mit.cfront.basic.LangAS;
import java.util.ArrayList;
import java.util.List;

/**
 * An immutable set of type qualifiers: the CVR qualifiers plus
 * {@code __unaligned} (the "fast" qualifiers), an address space, an
 * Objective-C GC attribute and an Objective-C lifetime.
 */
public final class Qualifiers {
	public static final int CONST = 0x1;
	public static final int RESTRICT = 0x2;
	public static final int VOLATILE = 0x4;
	public static final int CVR_MASK = CONST | RESTRICT | VOLATILE;
	public static final int UNALIGNED = 0x8;
	public static final int CVRU_MASK = CVR_MASK | UNALIGNED;

	/**
	 * Objective-C garbage collection attributes.
	 */
	public enum GC {
		NONE, WEAK, STRONG;
	}

	/**
	 * Objective-C ownership qualifiers.
	 */
	public enum ObjCLifetime {
		/**
		 * No lifetime qualification.
		 */
		NONE,
		/**
		 * {@code __unsafe_unretained}: no ownership, no semantics.
		 */
		EXPLICIT_NONE,
		/**
		 * {@code __strong}: retained on assignment, released on destruction.
		 */
		STRONG,
		/**
		 * {@code __weak}: zeroed when the referent is deallocated.
		 */
		WEAK,
		/**
		 * {@code __autoreleasing}: retained and autoreleased on assignment.
		 */
		AUTORELEASING;
	}

	public static final Qualifiers NONE;
	private static final Qualifiers[] FAST;
	static {
		FAST = new Qualifiers[CVRU_MASK + 1];
		for (int i = 0; i < FAST.length; ++i)
			FAST[i] = new Qualifiers(i, GC.NONE, ObjCLifetime.NONE, LangAS.DEFAULT);
		NONE = FAST[0];
	}

	private final int fast;
	private final GC gc;
	private final ObjCLifetime lifetime;
	private final int addressSpace;

	private Qualifiers(int fast, GC gc, ObjCLifetime lifetime, int addressSpace) {
		this.fast = fast;
		this.gc = gc;
		this.lifetime = lifetime;
		this.addressSpace = addressSpace;
	}

	private static Qualifiers make(int fast, GC gc, ObjCLifetime lifetime, int addressSpace) {
		checkArgument((fast & ~CVRU_MASK) == 0, "bad fast qualifier mask %s", fast);
		checkArgument(addressSpace >= 0, "bad address space %s", addressSpace);
		if (gc == GC.NONE && lifetime == ObjCLifetime.NONE && addressSpace == LangAS.DEFAULT)
			return FAST[fast];
		return new Qualifiers(fast, gc, lifetime, addressSpace);
	}

	/**
	 * Returns the qualifiers with exactly the given CVR (and unaligned) bits.
	 * @param mask a mask of {@link #CONST}, {@link #VOLATILE},
	 * {@link #RESTRICT} and {@link #UNALIGNED}
	 * @return the qualifiers
	 */
	public static Qualifiers fromCVRUMask(int mask) {
		return make(mask, GC.NONE, ObjCLifetime.NONE, LangAS.DEFAULT);
	}

	public boolean hasConst() {
		return (fast & CONST) != 0;
	}
	public boolean hasVolatile() {
		return (fast & VOLATILE) != 0;
	}
	public boolean hasRestrict() {
		return (fast & RESTRICT) != 0;
	}
	public boolean hasUnaligned() {
		return (fast & UNALIGNED) != 0;
	}
	public int getCVRQualifiers() {
		return fast & CVR_MASK;
	}
	public int getCVRUQualifiers() {
		return fast;
	}
	public boolean hasCVRQualifiers() {
		return getCVRQualifiers() != 0;
	}
	public GC getObjCGCAttr() {
		return gc;
	}
	public boolean hasObjCGCAttr() {
		return gc != GC.NONE;
	}
	public ObjCLifetime getObjCLifetime() {
		return lifetime;
	}
	public boolean hasObjCLifetime() {
		return lifetime != ObjCLifetime.NONE;
	}

	/**
	 * Returns true if the lifetime qualifier has semantics (i.e., is strong,
	 * weak or autoreleasing).
	 * @return true if the lifetime is nontrivial
	 */
	public boolean hasNonTrivialObjCLifetime() {
		return lifetime.compareTo(ObjCLifetime.EXPLICIT_NONE) > 0;
	}
	public boolean hasStrongOrWeakObjCLifetime() {
		return lifetime == ObjCLifetime.STRONG || lifetime == ObjCLifetime.WEAK;
	}
	public int getAddressSpace() {
		return addressSpace;
	}
	public boolean hasAddressSpace() {
		return addressSpace != LangAS.DEFAULT;
	}
	public boolean hasTargetSpecificAddressSpace() {
		return LangAS.isTargetAddressSpace(addressSpace);
	}

	/**
	 * Returns true if any qualifier beyond CVR and unaligned is present.
	 * @return true if there are extended qualifiers
	 */
	public boolean hasNonFastQualifiers() {
		return gc != GC.NONE || lifetime != ObjCLifetime.NONE || addressSpace != LangAS.DEFAULT;
	}
	public boolean isEmpty() {
		return this == NONE || (fast == 0 && !hasNonFastQualifiers());
	}

	public Qualifiers withConst() {
		return withCVRQualifiers(CONST);
	}
	public Qualifiers withVolatile() {
		return withCVRQualifiers(VOLATILE);
	}
	public Qualifiers withRestrict() {
		return withCVRQualifiers(RESTRICT);
	}
	public Qualifiers withUnaligned() {
		return withCVRQualifiers(UNALIGNED);
	}
	public Qualifiers withCVRQualifiers(int mask) {
		return make(fast | mask, gc, lifetime, addressSpace);
	}
	public Qualifiers withoutConst() {
		return withoutCVRQualifiers(CONST);
	}
	public Qualifiers withoutCVRQualifiers(int mask) {
		return make(fast & ~mask, gc, lifetime, addressSpace);
	}
	public Qualifiers withoutFastQualifiers() {
		return make(0, gc, lifetime, addressSpace);
	}
	public Qualifiers withAddressSpace(int as) {
		return make(fast, gc, lifetime, as);
	}
	public Qualifiers withoutAddressSpace() {
		return make(fast, gc, lifetime, LangAS.DEFAULT);
	}
	public Qualifiers withObjCGCAttr(GC gc) {
		return make(fast, checkNotNull(gc), lifetime, addressSpace);
	}
	public Qualifiers withoutObjCGCAttr() {
		return make(fast, GC.NONE, lifetime, addressSpace);
	}
	public Qualifiers withObjCLifetime(ObjCLifetime lifetime) {
		return make(fast, gc, checkNotNull(lifetime), addressSpace);
	}
	public Qualifiers withoutObjCLifetime() {
		return make(fast, gc, ObjCLifetime.NONE, addressSpace);
	}

	/**
	 * Returns the union of these qualifiers and the given ones.  The extended
	 * qualifiers must agree where both sets have them.
	 * @param other the qualifiers to add
	 * @return the merged qualifiers
	 * @throws IllegalStateException if the extended qualifiers conflict
	 */
	public Qualifiers merge(Qualifiers other) {
		if (other.isEmpty())
			return this;
		if (isEmpty())
			return other;
		checkState(!hasAddressSpace() || !other.hasAddressSpace() || addressSpace == other.addressSpace,
				"conflicting address spaces %s and %s", this, other);
		checkState(!hasObjCGCAttr() || !other.hasObjCGCAttr() || gc == other.gc,
				"conflicting GC attributes %s and %s", this, other);
		checkState(!hasObjCLifetime() || !other.hasObjCLifetime() || lifetime == other.lifetime,
				"conflicting lifetimes %s and %s", this, other);
		return make(fast | other.fast,
				hasObjCGCAttr() ? gc : other.gc,
				hasObjCLifetime() ? lifetime : other.lifetime,
				hasAddressSpace() ? addressSpace : other.addressSpace);
	}

	/**
	 * Removes the given qualifiers: CVR bits are cleared, and each extended
	 * qualifier is dropped if it matches.
	 * @param other the qualifiers to remove
	 * @return the remaining qualifiers
	 */
	public Qualifiers remove(Qualifiers other) {
		return make(fast & ~other.fast,
				gc == other.gc ? GC.NONE : gc,
				lifetime == other.lifetime ? ObjCLifetime.NONE : lifetime,
				addressSpace == other.addressSpace ? LangAS.DEFAULT : addressSpace);
	}

	/**
	 * Returns true if these qualifiers include every qualifier in other: the
	 * CVR bits are a superset, and each of the address space, GC attribute
	 * and lifetime is either equal or present only here.  The unaligned bit
	 * is not compared.
	 * @param other the other qualifiers
	 * @return true if this is a superset of other
	 */
	public boolean isSupersetOf(Qualifiers other) {
		return (getCVRQualifiers() | other.getCVRQualifiers()) == getCVRQualifiers()
				&& (gc == other.gc || !other.hasObjCGCAttr())
				&& (addressSpace == other.addressSpace || !other.hasAddressSpace())
				&& (lifetime == other.lifetime || !other.hasObjCLifetime());
	}

	/**
	 * Returns true if these qualifiers are a superset of, but not equal to,
	 * the given qualifiers.
	 * @param other the other qualifiers
	 * @return true if this is a strict superset of other
	 */
	public boolean isStrictSupersetOf(Qualifiers other) {
		return !equals(other) && isSupersetOf(other);
	}

	/**
	 * Returns true if the address space of these qualifiers encloses the
	 * address space of other.  The OpenCL generic address space encloses
	 * every named space except constant.
	 * @param other the other qualifiers
	 * @return true if this address space is a superset of other's
	 */
	public boolean isAddressSpaceSupersetOf(Qualifiers other) {
		return addressSpace == other.addressSpace
				|| (addressSpace == LangAS.OPENCL_GENERIC
				&& (other.addressSpace == LangAS.OPENCL_GLOBAL || other.addressSpace == LangAS.OPENCL_LOCAL
				|| other.addressSpace == LangAS.OPENCL_PRIVATE));
	}

	/**
	 * Determines if these qualifiers compatibly include other: an object of
	 * type {@code U other} may be referred to through an lvalue of type
	 * {@code U this}.
	 * @param other the other qualifiers
	 * @return true if these qualifiers compatibly include other
	 */
	public boolean compatiblyIncludes(Qualifiers other) {
		return isAddressSpaceSupersetOf(other)
				//GC attributes may match, be added or be removed, but not change.
				&& (gc == other.gc || !hasObjCGCAttr() || !other.hasObjCGCAttr())
				&& lifetime == other.lifetime
				&& (getCVRQualifiers() | other.getCVRQualifiers()) == getCVRQualifiers()
				&& (!other.hasUnaligned() || hasUnaligned());
	}

	/**
	 * Determines if these lifetime qualifiers compatibly include other's.
	 * {@code __unsafe_unretained} may be added to an unqualified type.
	 * @param other the other qualifiers
	 * @return true if the lifetimes are compatible
	 */
	public boolean compatiblyIncludesObjCLifetime(Qualifiers other) {
		if (lifetime == other.lifetime)
			return true;
		return lifetime == ObjCLifetime.EXPLICIT_NONE && other.lifetime == ObjCLifetime.NONE;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final Qualifiers other = (Qualifiers)obj;
		return fast == other.fast && gc == other.gc && lifetime == other.lifetime && addressSpace == other.addressSpace;
	}

	@Override
	public int hashCode() {
		int hash = 5;
		hash = 71 * hash + fast;
		hash = 71 * hash + gc.hashCode();
		hash = 71 * hash + lifetime.hashCode();
		hash = 71 * hash + addressSpace;
		return hash;
	}

	@Override
	public String toString() {
		List<String> parts = new ArrayList<>(6);
		if (hasConst())
			parts.add("const");
		if (hasVolatile())
			parts.add("volatile");
		if (hasRestrict())
			parts.add("restrict");
		if (hasUnaligned())
			parts.add("__unaligned");
		if (hasAddressSpace())
			parts.add(LangAS.toString(addressSpace));
		if (hasObjCGCAttr())
			parts.add(gc == GC.WEAK ? "__weak" : "__strong");
		switch (lifetime) {
			case NONE:
				break;
			case EXPLICIT_NONE:
				parts.add("__unsafe_unretained");
				break;
			case STRONG:
				parts.add("__strong");
				break;
			case WEAK:
				parts.add("__weak");
				break;
			case AUTORELEASING:
				parts.add("__autoreleasing");
				break;
			default:
				throw new AssertionError(lifetime);
		}
		return Joiner.on(' ').join(parts);
	}
}
