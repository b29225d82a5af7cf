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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import edu.mit.cfront.basic.Linkage;

/**
 * A per-node cell holding the node's linkage properties once computed.  The
 * cell is written at most once; a second write must agree with the first.
 */
final class LinkageCache {
	/**
	 * A type's linkage and whether it involves a local or unnamed type.
	 */
	static final class CachedProperties {
		private final Linkage linkage;
		private final boolean localOrUnnamed;
		CachedProperties(Linkage linkage, boolean localOrUnnamed) {
			this.linkage = checkNotNull(linkage);
			this.localOrUnnamed = localOrUnnamed;
		}

		static CachedProperties external() {
			return new CachedProperties(Linkage.EXTERNAL_LINKAGE, false);
		}

		Linkage getLinkage() {
			return linkage;
		}

		boolean hasLocalOrUnnamedType() {
			return localOrUnnamed;
		}

		/**
		 * Combines the properties of two component types: the less visible
		 * linkage, and local-or-unnamed if either is.
		 * @param other the other component's properties
		 * @return the merged properties
		 */
		CachedProperties merge(CachedProperties other) {
			return new CachedProperties(Linkage.minLinkage(linkage, other.linkage),
					localOrUnnamed || other.localOrUnnamed);
		}

		@Override
		public boolean equals(Object obj) {
			if (obj == null)
				return false;
			if (getClass() != obj.getClass())
				return false;
			final CachedProperties other = (CachedProperties)obj;
			return linkage == other.linkage && localOrUnnamed == other.localOrUnnamed;
		}

		@Override
		public int hashCode() {
			int hash = 5;
			hash = 59 * hash + linkage.hashCode();
			hash = 59 * hash + (localOrUnnamed ? 1 : 0);
			return hash;
		}

		@Override
		public String toString() {
			return String.format("(%s%s)", linkage, localOrUnnamed ? ", local or unnamed" : "");
		}
	}

	private CachedProperties properties;

	boolean isValid() {
		return properties != null;
	}

	CachedProperties get() {
		checkState(properties != null, "linkage not yet computed");
		return properties;
	}

	void set(CachedProperties properties) {
		checkNotNull(properties);
		checkState(this.properties == null || this.properties.equals(properties),
				"linkage cache already holds %s, not %s", this.properties, properties);
		this.properties = properties;
	}
}
