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
 * The discriminant of the closed set of type node variants.  Each variant is
 * categorized by whether it can be canonical:
 * <ul>
 * <li>{@link Category#CANONICAL} nodes may be their own canonical type;
 * <li>{@link Category#DEPENDENT} nodes only exist in dependent contexts;
 * <li>{@link Category#NON_CANONICAL} nodes are always sugar;
 * <li>{@link Category#NON_CANONICAL_UNLESS_DEPENDENT} nodes are sugar unless
 * they're dependent, in which case they're canonical.
 * </ul>
 */
public enum TypeClass {
	BUILTIN("Builtin", Category.CANONICAL),
	COMPLEX("Complex", Category.CANONICAL),
	POINTER("Pointer", Category.CANONICAL),
	BLOCK_POINTER("BlockPointer", Category.CANONICAL),
	LVALUE_REFERENCE("LValueReference", Category.CANONICAL),
	RVALUE_REFERENCE("RValueReference", Category.CANONICAL),
	MEMBER_POINTER("MemberPointer", Category.CANONICAL),
	CONSTANT_ARRAY("ConstantArray", Category.CANONICAL),
	INCOMPLETE_ARRAY("IncompleteArray", Category.CANONICAL),
	VARIABLE_ARRAY("VariableArray", Category.CANONICAL),
	DEPENDENT_SIZED_ARRAY("DependentSizedArray", Category.DEPENDENT),
	DEPENDENT_SIZED_EXT_VECTOR("DependentSizedExtVector", Category.DEPENDENT),
	DEPENDENT_ADDRESS_SPACE("DependentAddressSpace", Category.DEPENDENT),
	VECTOR("Vector", Category.CANONICAL),
	EXT_VECTOR("ExtVector", Category.CANONICAL),
	FUNCTION_PROTO("FunctionProto", Category.CANONICAL),
	FUNCTION_NO_PROTO("FunctionNoProto", Category.CANONICAL),
	UNRESOLVED_USING("UnresolvedUsing", Category.DEPENDENT),
	PAREN("Paren", Category.NON_CANONICAL),
	TYPEDEF("Typedef", Category.NON_CANONICAL),
	ADJUSTED("Adjusted", Category.NON_CANONICAL),
	DECAYED("Decayed", Category.NON_CANONICAL),
	TYPE_OF_EXPR("TypeOfExpr", Category.NON_CANONICAL_UNLESS_DEPENDENT),
	TYPE_OF("TypeOf", Category.NON_CANONICAL_UNLESS_DEPENDENT),
	DECLTYPE("Decltype", Category.NON_CANONICAL_UNLESS_DEPENDENT),
	UNARY_TRANSFORM("UnaryTransform", Category.NON_CANONICAL_UNLESS_DEPENDENT),
	RECORD("Record", Category.CANONICAL),
	ENUM("Enum", Category.CANONICAL),
	ELABORATED("Elaborated", Category.NON_CANONICAL),
	ATTRIBUTED("Attributed", Category.NON_CANONICAL),
	TEMPLATE_TYPE_PARM("TemplateTypeParm", Category.DEPENDENT),
	SUBST_TEMPLATE_TYPE_PARM("SubstTemplateTypeParm", Category.NON_CANONICAL),
	SUBST_TEMPLATE_TYPE_PARM_PACK("SubstTemplateTypeParmPack", Category.DEPENDENT),
	TEMPLATE_SPECIALIZATION("TemplateSpecialization", Category.NON_CANONICAL_UNLESS_DEPENDENT),
	AUTO("Auto", Category.CANONICAL),
	DEDUCED_TEMPLATE_SPECIALIZATION("DeducedTemplateSpecialization", Category.CANONICAL),
	INJECTED_CLASS_NAME("InjectedClassName", Category.DEPENDENT),
	DEPENDENT_NAME("DependentName", Category.DEPENDENT),
	DEPENDENT_TEMPLATE_SPECIALIZATION("DependentTemplateSpecialization", Category.DEPENDENT),
	PACK_EXPANSION("PackExpansion", Category.DEPENDENT),
	OBJC_TYPE_PARAM("ObjCTypeParam", Category.NON_CANONICAL),
	OBJC_OBJECT("ObjCObject", Category.CANONICAL),
	OBJC_INTERFACE("ObjCInterface", Category.CANONICAL),
	OBJC_OBJECT_POINTER("ObjCObjectPointer", Category.CANONICAL),
	PIPE("Pipe", Category.CANONICAL),
	ATOMIC("Atomic", Category.CANONICAL),
	TYPE_VARIABLE("TypeVariable", Category.CANONICAL);

	public enum Category {
		CANONICAL, DEPENDENT, NON_CANONICAL, NON_CANONICAL_UNLESS_DEPENDENT;
	}

	private final String name;
	private final Category category;
	private TypeClass(String name, Category category) {
		this.name = name;
		this.category = category;
	}

	/**
	 * Returns the variant's name, e.g. "ConstantArray".
	 * @return the variant name
	 */
	public String getName() {
		return name;
	}

	public Category getCategory() {
		return category;
	}

	/**
	 * Returns true if nodes of this class are never canonical.
	 * @return true if this class is always sugar
	 */
	public boolean isNonCanonical() {
		return category == Category.NON_CANONICAL;
	}

	/**
	 * Returns true if nodes of this class only occur in dependent contexts or
	 * are canonical only when dependent.
	 * @return true if this class is dependent or non-canonical unless
	 * dependent
	 */
	public boolean isDependentOrCanonicalUnlessDependent() {
		return category == Category.DEPENDENT || category == Category.NON_CANONICAL_UNLESS_DEPENDENT;
	}
}
