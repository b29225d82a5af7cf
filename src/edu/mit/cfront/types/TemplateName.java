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
import edu.mit.cfront.ast.NestedNameSpecifier;
import edu.mit.cfront.ast.TemplateDecl;

/**
 * The name of a template in a template specialization: either a template
 * declaration, or a name in a dependent scope.
 */
public final class TemplateName {
	public enum Kind {
		TEMPLATE, DEPENDENT;
	}

	private final TemplateDecl decl;
	private final NestedNameSpecifier qualifier;
	private final String name;

	private TemplateName(TemplateDecl decl, NestedNameSpecifier qualifier, String name) {
		this.decl = decl;
		this.qualifier = qualifier;
		this.name = name;
	}

	public static TemplateName of(TemplateDecl decl) {
		return new TemplateName(checkNotNull(decl), null, null);
	}

	public static TemplateName dependent(NestedNameSpecifier qualifier, String name) {
		return new TemplateName(null, checkNotNull(qualifier), checkNotNull(name));
	}

	public Kind getKind() {
		return decl != null ? Kind.TEMPLATE : Kind.DEPENDENT;
	}

	/**
	 * Returns the template this name refers to.
	 * @return the template, or null for a dependent name
	 */
	public TemplateDecl getAsTemplateDecl() {
		return decl;
	}

	public boolean isDependent() {
		if (decl != null)
			return decl.isTemplateTemplateParm();
		return true;
	}

	public boolean isInstantiationDependent() {
		return isDependent() || (qualifier != null && qualifier.isInstantiationDependent());
	}

	public boolean containsUnexpandedParameterPack() {
		return qualifier != null && qualifier.containsUnexpandedParameterPack();
	}

	void profile(TypeProfile p) {
		p.addValue(getKind());
		if (decl != null)
			p.addPointer(decl);
		else
			p.addPointer(qualifier).addValue(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final TemplateName other = (TemplateName)obj;
		if (decl != other.decl)
			return false;
		if (qualifier != other.qualifier)
			return false;
		return name == null ? other.name == null : name.equals(other.name);
	}

	@Override
	public int hashCode() {
		int hash = 7;
		hash = 23 * hash + System.identityHashCode(decl);
		hash = 23 * hash + System.identityHashCode(qualifier);
		hash = 23 * hash + (name != null ? name.hashCode() : 0);
		return hash;
	}

	@Override
	public String toString() {
		return decl != null ? decl.getName() : qualifier + "template " + name;
	}
}
