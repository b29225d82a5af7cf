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

/**
 * A pack expansion ({@code Types...}).  The pattern contains unexpanded
 * packs but the expansion itself does not.
 */
public final class PackExpansionType extends Type {
	private final QualType pattern;
	private final Integer numExpansions;

	PackExpansionType(TypeFactory factory, QualType pattern, QualType canon, Integer numExpansions) {
		super(factory, TypeClass.PACK_EXPANSION, canon, pattern.getTypePtr().isDependentType(), true,
				pattern.getTypePtr().isVariablyModifiedType(), false);
		this.pattern = pattern;
		this.numExpansions = numExpansions;
	}

	public QualType getPattern() {
		return pattern;
	}

	/**
	 * Returns the number of expansions, if known.
	 * @return the number of expansions, or null
	 */
	public Integer getNumExpansions() {
		return numExpansions;
	}

	@Override
	public boolean isSugared() {
		return false;
	}

	@Override
	public QualType desugar() {
		return asQualType();
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitPackExpansion(this);
	}

	static TypeProfile profile(QualType pattern, Integer numExpansions) {
		return new TypeProfile().addValue(TypeClass.PACK_EXPANSION).addQualType(pattern).addValue(numExpansions);
	}

	@Override
	TypeProfile profile() {
		return profile(pattern, numExpansions);
	}

	@Override
	public String toString() {
		return pattern + "...";
	}
}
