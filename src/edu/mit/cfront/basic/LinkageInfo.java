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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable (linkage, visibility, explicit-visibility) triple.
 */
public final class LinkageInfo {
	private static final LinkageInfo EXTERNAL = new LinkageInfo(Linkage.EXTERNAL_LINKAGE, Visibility.DEFAULT, false);
	private static final LinkageInfo INTERNAL = new LinkageInfo(Linkage.INTERNAL_LINKAGE, Visibility.DEFAULT, false);
	private static final LinkageInfo UNIQUE_EXTERNAL = new LinkageInfo(Linkage.UNIQUE_EXTERNAL_LINKAGE, Visibility.DEFAULT, false);
	private static final LinkageInfo NONE = new LinkageInfo(Linkage.NO_LINKAGE, Visibility.DEFAULT, false);
	private final Linkage linkage;
	private final Visibility visibility;
	private final boolean explicit;

	public LinkageInfo(Linkage linkage, Visibility visibility, boolean explicit) {
		this.linkage = checkNotNull(linkage);
		this.visibility = checkNotNull(visibility);
		this.explicit = explicit;
	}

	public static LinkageInfo external() {
		return EXTERNAL;
	}
	public static LinkageInfo internal() {
		return INTERNAL;
	}
	public static LinkageInfo uniqueExternal() {
		return UNIQUE_EXTERNAL;
	}
	public static LinkageInfo none() {
		return NONE;
	}

	public Linkage getLinkage() {
		return linkage;
	}
	public Visibility getVisibility() {
		return visibility;
	}
	public boolean isVisibilityExplicit() {
		return explicit;
	}

	/**
	 * Merges linkage and visibility: the result has the less visible of the
	 * two linkages, and the less visible of the two visibilities.  If the
	 * visibilities are equal, the result is explicit if either input is.
	 * @param other the info to merge with
	 * @return the merged info
	 */
	public LinkageInfo merge(LinkageInfo other) {
		Linkage l = Linkage.minLinkage(linkage, other.linkage);
		Visibility v = Visibility.minVisibility(visibility, other.visibility);
		boolean e;
		if (visibility == other.visibility)
			e = explicit || other.explicit;
		else
			e = v == visibility ? explicit : other.explicit;
		if (l == linkage && v == visibility && e == explicit)
			return this;
		return new LinkageInfo(l, v, e);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final LinkageInfo other = (LinkageInfo)obj;
		return linkage == other.linkage && visibility == other.visibility && explicit == other.explicit;
	}

	@Override
	public int hashCode() {
		int hash = 7;
		hash = 37 * hash + linkage.hashCode();
		hash = 37 * hash + visibility.hashCode();
		hash = 37 * hash + (explicit ? 1 : 0);
		return hash;
	}

	@Override
	public String toString() {
		return String.format("(%s, %s%s)", linkage, visibility, explicit ? ", explicit" : "");
	}
}
