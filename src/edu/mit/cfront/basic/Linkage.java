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
package edu.mit.cfront.basic;

/**
 * Describes the different kinds of linkage a declaration (and, derived from
 * the declarations it names, a type) may have.
 * <p>
 * Linkages are ordered by visibility via {@link #visibilityRank()}, with
 * {@link #NO_LINKAGE} the least visible and {@link #EXTERNAL_LINKAGE} the
 * most.  Don't compare constants by ordinal.
 */
public enum Linkage {
	/**
	 * No linkage: the entity can only be referred to from within its scope.
	 */
	NO_LINKAGE(0),
	/**
	 * Internal linkage: the entity can be referred to from within its
	 * translation unit, but not from other translation units.
	 */
	INTERNAL_LINKAGE(1),
	/**
	 * External linkage within a unique namespace: the entity has external
	 * linkage in principle but its name is not visible outside the
	 * translation unit (e.g. members of an anonymous namespace).
	 */
	UNIQUE_EXTERNAL_LINKAGE(2),
	/**
	 * No linkage according to the standard, but visible from other
	 * translation units because of types defined in inline functions.
	 */
	VISIBLE_NO_LINKAGE(3),
	/**
	 * Internal linkage according to the modules TS, but can be referred to
	 * from other translation units indirectly through inline functions and
	 * templates in the module interface.
	 */
	MODULE_INTERNAL_LINKAGE(4),
	/**
	 * Module linkage: can be referred to from other translation units in the
	 * same module.
	 */
	MODULE_LINKAGE(5),
	EXTERNAL_LINKAGE(6);

	private final int visibilityRank;
	private Linkage(int visibilityRank) {
		this.visibilityRank = visibilityRank;
	}

	/**
	 * Returns this linkage's position in the visibility order, where larger
	 * is more visible.
	 * @return the visibility rank
	 */
	public int visibilityRank() {
		return visibilityRank;
	}

	public boolean isExternallyVisible() {
		return getFormalLinkage() == EXTERNAL_LINKAGE || getFormalLinkage() == MODULE_LINKAGE;
	}

	/**
	 * Maps this linkage to the linkage the language standard would assign.
	 * @return the formal linkage
	 */
	public Linkage getFormalLinkage() {
		switch (this) {
			case UNIQUE_EXTERNAL_LINKAGE:
				return EXTERNAL_LINKAGE;
			case VISIBLE_NO_LINKAGE:
				return NO_LINKAGE;
			case MODULE_INTERNAL_LINKAGE:
				return INTERNAL_LINKAGE;
			default:
				return this;
		}
	}

	/**
	 * Returns the less visible of the two linkages.  Combining
	 * {@link #VISIBLE_NO_LINKAGE} with internal or unique-external linkage
	 * yields {@link #NO_LINKAGE}, as the combination is visible nowhere.
	 * @param a a linkage
	 * @param b a linkage
	 * @return the merged linkage, never more visible than either input
	 */
	public static Linkage minLinkage(Linkage a, Linkage b) {
		if (b == VISIBLE_NO_LINKAGE) {
			Linkage t = a;
			a = b;
			b = t;
		}
		if (a == VISIBLE_NO_LINKAGE && (b == INTERNAL_LINKAGE || b == UNIQUE_EXTERNAL_LINKAGE))
			return NO_LINKAGE;
		return a.visibilityRank <= b.visibilityRank ? a : b;
	}
}
