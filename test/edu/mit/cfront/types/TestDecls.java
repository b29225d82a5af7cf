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
import edu.mit.cfront.ast.AttrKind;
import edu.mit.cfront.ast.CXXBaseSpecifier;
import edu.mit.cfront.ast.CXXRecordDecl;
import edu.mit.cfront.ast.DeclContext;
import edu.mit.cfront.ast.EnumDecl;
import edu.mit.cfront.ast.Expr;
import edu.mit.cfront.ast.FieldDecl;
import edu.mit.cfront.ast.FunctionDecl;
import edu.mit.cfront.ast.NamedDecl;
import edu.mit.cfront.ast.NestedNameSpecifier;
import edu.mit.cfront.ast.ObjCCategoryDecl;
import edu.mit.cfront.ast.ObjCInterfaceDecl;
import edu.mit.cfront.ast.ObjCMethodDecl;
import edu.mit.cfront.ast.ObjCProtocolDecl;
import edu.mit.cfront.ast.ObjCTypeParamDecl;
import edu.mit.cfront.ast.RecordDecl;
import edu.mit.cfront.ast.TagDecl;
import edu.mit.cfront.ast.TagTypeKind;
import edu.mit.cfront.ast.TemplateDecl;
import edu.mit.cfront.ast.TemplateTypeParmDecl;
import edu.mit.cfront.ast.TypedefNameDecl;
import edu.mit.cfront.basic.Linkage;
import edu.mit.cfront.basic.LinkageInfo;
import edu.mit.cfront.basic.Visibility;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable declarations and expressions standing in for the front end's
 * declaration and expression services.
 */
final class TestDecls {
	private TestDecls() {}

	abstract static class Named implements NamedDecl {
		private final String name;
		Linkage linkage = Linkage.EXTERNAL_LINKAGE;
		Visibility visibility = Visibility.DEFAULT;
		DeclContext context;
		final Set<AttrKind> attrs = EnumSet.noneOf(AttrKind.class);
		Named(String name) {
			this.name = name;
		}
		@Override
		public String getName() {
			return name;
		}
		@Override
		public Linkage getLinkageInternal() {
			return linkage;
		}
		@Override
		public LinkageInfo getLinkageAndVisibility() {
			return new LinkageInfo(linkage, visibility, false);
		}
		@Override
		public boolean hasAttr(AttrKind kind) {
			return attrs.contains(kind);
		}
		@Override
		public DeclContext getDeclContext() {
			return context;
		}
		@Override
		public String toString() {
			return name;
		}
	}

	static class Record extends Named implements RecordDecl {
		private final TagTypeKind kind;
		private final List<Record> chain;
		boolean complete = true;
		boolean beingDefined;
		boolean dependent;
		boolean lambda;
		boolean nameForLinkage = true;
		final List<Field> fields = new ArrayList<>();
		Record(String name, TagTypeKind kind) {
			this(name, kind, new ArrayList<Record>());
		}
		Record(String name, TagTypeKind kind, List<Record> chain) {
			super(name);
			this.kind = kind;
			this.chain = chain;
			chain.add(this);
		}
		/**
		 * Declares this entity again, sharing its redeclaration chain.
		 */
		Record redeclare() {
			return new Record(getName(), kind, chain);
		}
		Field addField(String name, QualType type) {
			Field f = new Field(name, type);
			fields.add(f);
			return f;
		}
		@Override
		public TagTypeKind getTagKind() {
			return kind;
		}
		@Override
		public boolean isCompleteDefinition() {
			return complete;
		}
		@Override
		public boolean isBeingDefined() {
			return beingDefined;
		}
		@Override
		public boolean isDependentType() {
			return dependent;
		}
		@Override
		public boolean hasNameForLinkage() {
			return nameForLinkage;
		}
		@Override
		public List<? extends TagDecl> redecls() {
			return chain;
		}
		@Override
		public List<? extends FieldDecl> fields() {
			return fields;
		}
		@Override
		public boolean isLambda() {
			return lambda;
		}
	}

	static final class CXXRecord extends Record implements CXXRecordDecl {
		final List<CXXBaseSpecifier> bases = new ArrayList<>();
		boolean pod = true, trivial = true, triviallyCopyable = true, standardLayout = true;
		boolean literal = true, aggregate = true, defaultConstructor = true;
		boolean nonTrivialDefaultConstructor, nonTrivialDestructor;
		CXXRecord(String name) {
			super(name, TagTypeKind.CLASS);
		}
		CXXRecord(String name, TagTypeKind kind) {
			super(name, kind);
		}
		/**
		 * Marks this class as having a user-provided destructor, which makes
		 * it neither trivial nor POD.
		 */
		CXXRecord withNonTrivialDestructor() {
			nonTrivialDestructor = true;
			pod = trivial = triviallyCopyable = literal = false;
			return this;
		}
		@Override
		public boolean hasDefinition() {
			return isCompleteDefinition();
		}
		@Override
		public List<CXXBaseSpecifier> bases() {
			return bases;
		}
		@Override
		public boolean isPOD() {
			return pod;
		}
		@Override
		public boolean isTrivial() {
			return trivial;
		}
		@Override
		public boolean isTriviallyCopyable() {
			return triviallyCopyable;
		}
		@Override
		public boolean isStandardLayout() {
			return standardLayout;
		}
		@Override
		public boolean isLiteral() {
			return literal;
		}
		@Override
		public boolean isAggregate() {
			return aggregate;
		}
		@Override
		public boolean isEmpty() {
			if (!fields.isEmpty())
				return false;
			for (CXXBaseSpecifier b : bases)
				if (b.isVirtual() || !b.getType().getTypePtr().getAsCXXRecordDecl().isEmpty())
					return false;
			return true;
		}
		@Override
		public boolean hasDefaultConstructor() {
			return defaultConstructor;
		}
		@Override
		public boolean hasNonTrivialDefaultConstructor() {
			return nonTrivialDefaultConstructor;
		}
		@Override
		public boolean hasTrivialDestructor() {
			return !nonTrivialDestructor;
		}
		@Override
		public CXXRecordDecl getMostRecentDecl() {
			return this;
		}
	}

	static final class Field implements FieldDecl {
		private final String name;
		private final QualType type;
		boolean bounds;
		Field(String name, QualType type) {
			this.name = name;
			this.type = checkNotNull(type);
		}
		@Override
		public String getName() {
			return name;
		}
		@Override
		public QualType getType() {
			return type;
		}
		@Override
		public boolean hasBoundsExpr() {
			return bounds;
		}
		@Override
		public String toString() {
			return type + " " + name;
		}
	}

	static final class Enum extends Named implements EnumDecl {
		private final List<Enum> chain = new ArrayList<>();
		boolean complete = true, fixed, scoped;
		QualType integerType, promotionType;
		Enum(String name, QualType integerType) {
			super(name);
			this.integerType = integerType;
			this.promotionType = integerType;
			chain.add(this);
		}
		@Override
		public boolean isFixed() {
			return fixed;
		}
		@Override
		public boolean isScoped() {
			return scoped;
		}
		@Override
		public QualType getIntegerType() {
			return integerType;
		}
		@Override
		public QualType getPromotionType() {
			return promotionType;
		}
		@Override
		public TagTypeKind getTagKind() {
			return TagTypeKind.ENUM;
		}
		@Override
		public boolean isCompleteDefinition() {
			return complete;
		}
		@Override
		public boolean isBeingDefined() {
			return false;
		}
		@Override
		public boolean isDependentType() {
			return false;
		}
		@Override
		public boolean hasNameForLinkage() {
			return getName() != null;
		}
		@Override
		public List<? extends TagDecl> redecls() {
			return chain;
		}
	}

	static final class Typedef extends Named implements TypedefNameDecl {
		private final QualType underlying;
		Typedef(String name, QualType underlying) {
			super(name);
			this.underlying = checkNotNull(underlying);
		}
		@Override
		public QualType getUnderlyingType() {
			return underlying;
		}
	}

	static final class Function extends Named implements FunctionDecl {
		Function(String name) {
			super(name);
		}
	}

	static final class Template extends Named implements TemplateDecl {
		boolean classTemplate = true, alias;
		Template(String name) {
			super(name);
		}
		@Override
		public boolean isClassTemplate() {
			return classTemplate;
		}
		@Override
		public boolean isTypeAliasTemplate() {
			return alias;
		}
	}

	static final class TemplateParm extends Named implements TemplateTypeParmDecl {
		TemplateParm(String name) {
			super(name);
		}
	}

	/**
	 * A dependent nested-name-specifier such as {@code T::}.
	 */
	static final class DependentQualifier implements NestedNameSpecifier {
		private final String spelling;
		DependentQualifier(String spelling) {
			this.spelling = spelling;
		}
		@Override
		public boolean isDependent() {
			return true;
		}
		@Override
		public boolean isInstantiationDependent() {
			return true;
		}
		@Override
		public boolean containsUnexpandedParameterPack() {
			return false;
		}
		@Override
		public String toString() {
			return spelling + "::";
		}
	}

	static final class Protocol extends Named implements ObjCProtocolDecl {
		Protocol(String name) {
			super(name);
		}
	}

	static final class ObjCParam extends Named implements ObjCTypeParamDecl {
		private final int index;
		private final QualType bound;
		ObjCParam(String name, int index, QualType bound) {
			super(name);
			this.index = index;
			this.bound = checkNotNull(bound);
		}
		@Override
		public int getIndex() {
			return index;
		}
		@Override
		public QualType getUnderlyingType() {
			return bound;
		}
	}

	static final class ObjCClass extends Named implements ObjCInterfaceDecl {
		List<ObjCParam> typeParams;
		ObjCObjectType superClass;
		boolean defined = true;
		ObjCClass(String name) {
			super(name);
		}
		@Override
		public List<? extends ObjCTypeParamDecl> getTypeParamList() {
			return typeParams;
		}
		@Override
		public boolean hasDefinition() {
			return defined;
		}
		@Override
		public ObjCObjectType getSuperClassType() {
			return superClass;
		}
	}

	static final class ObjCCategory extends Named implements ObjCCategoryDecl {
		private final ObjCClass owner;
		List<ObjCParam> typeParams;
		ObjCCategory(String name, ObjCClass owner) {
			super(name);
			this.owner = owner;
		}
		@Override
		public List<? extends ObjCTypeParamDecl> getTypeParamList() {
			return typeParams;
		}
		@Override
		public ObjCInterfaceDecl getClassInterface() {
			return owner;
		}
	}

	static final class ObjCMethod extends Named implements ObjCMethodDecl {
		ObjCMethod(String name, DeclContext container) {
			super(name);
			this.context = container;
		}
	}

	/**
	 * An expression with a fixed type, dependence and constant value.
	 */
	static final class ConstExpr implements Expr {
		private final QualType type;
		private final BigInteger value;
		boolean typeDependent, valueDependent;
		ConstExpr(QualType type, long value) {
			this.type = type;
			this.value = BigInteger.valueOf(value);
		}
		static ConstExpr valueDependent(QualType type) {
			ConstExpr e = new ConstExpr(type, 0);
			e.valueDependent = true;
			return e;
		}
		@Override
		public QualType getType() {
			return type;
		}
		@Override
		public boolean isTypeDependent() {
			return typeDependent;
		}
		@Override
		public boolean isValueDependent() {
			return valueDependent || typeDependent;
		}
		@Override
		public boolean isInstantiationDependent() {
			return isValueDependent();
		}
		@Override
		public boolean containsUnexpandedParameterPack() {
			return false;
		}
		@Override
		public BigInteger evaluateAsInteger() {
			return isValueDependent() ? null : value;
		}
		@Override
		public String toString() {
			return isValueDependent() ? "N" : value.toString();
		}
	}
}
