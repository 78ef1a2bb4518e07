/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.ccfront.cc.ir.type;

import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.compiler.visitors.CInnerVisitor;
import org.ccfront.cc.compiler.visitors.VisitDecision;
import org.ccfront.cc.ir.CDeclaration;
import org.ccfront.cc.ir.CNode;
import org.ccfront.cc.ir.ICNode;
import org.ccfront.cc.ir.expression.CExpression;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A C type as written in the source.
 *
 * <p>Derived types chain through {@link #base}: <code>int *p[3]</code> is an
 * ARRAY of POINTER to INT.  Tagged types and function types own a list of
 * declarations (members, enumerators, or parameters).  The member list of a
 * tagged type stays open so that a forward-declared struct can be completed
 * after its members, which may point back to the struct itself, are built.
 */
public final class CType extends CNode {
    public final CTypeKind kind;
    public final Set<CQualifier> qualifiers;
    @Nullable
    public final CType base;
    /** Struct/union/enum tag, or the typedef name of a NAMED type. */
    @Nullable
    public final String tag;
    final List<CDeclaration> decls;
    /** Array length, if written. */
    @Nullable
    public final CExpression width;
    /** For FUNC types: true if the parameter list ends in <code>...</code>. */
    public final boolean variadic;

    /** Filled by name resolution for NAMED types. */
    @Nullable
    private CDeclaration typedefDeclaration;

    public CType(SourcePositionRange position, CTypeKind kind, Set<CQualifier> qualifiers,
                 @Nullable CType base, @Nullable String tag, List<CDeclaration> decls,
                 @Nullable CExpression width, boolean variadic) {
        super(position);
        this.kind = kind;
        this.qualifiers = qualifiers.isEmpty() ?
                Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(qualifiers));
        this.base = base;
        this.tag = tag;
        this.decls = new ArrayList<>(decls);
        this.width = width;
        this.variadic = variadic;
        if (kind.isDerived() && base == null)
            this.error(kind + " type without a base type");
        if (!kind.isDerived() && base != null)
            this.error(kind + " type cannot have a base type");
        if (kind == CTypeKind.NAMED && tag == null)
            this.error("Typedef name type without a name");
        if (width != null && kind != CTypeKind.ARRAY)
            this.error("Only array types have a length");
        if (variadic && kind != CTypeKind.FUNC)
            this.error("Only function types can be variadic");
        if (!decls.isEmpty() && !kind.isTagged() && kind != CTypeKind.FUNC)
            this.error(kind + " type cannot have declarations");
    }

    public static CType basic(CTypeKind kind) {
        if (!kind.isBasic())
            throw new IllegalArgumentException(kind + " is not a basic type");
        return new CType(SourcePositionRange.INVALID, kind, EnumSet.noneOf(CQualifier.class),
                null, null, Collections.emptyList(), null, false);
    }

    public static CType named(String name) {
        return new CType(SourcePositionRange.INVALID, CTypeKind.NAMED, EnumSet.noneOf(CQualifier.class),
                null, name, Collections.emptyList(), null, false);
    }

    /** A struct, union or enum type; members can be added later. */
    public static CType tagged(CTypeKind kind, @Nullable String tag, CDeclaration... members) {
        if (!kind.isTagged())
            throw new IllegalArgumentException(kind + " is not a tagged type");
        return new CType(SourcePositionRange.INVALID, kind, EnumSet.noneOf(CQualifier.class),
                null, tag, List.of(members), null, false);
    }

    public static CType function(CType result, boolean variadic, CDeclaration... parameters) {
        return new CType(SourcePositionRange.INVALID, CTypeKind.FUNC, EnumSet.noneOf(CQualifier.class),
                result, null, List.of(parameters), null, variadic);
    }

    public CType pointer() {
        return new CType(SourcePositionRange.INVALID, CTypeKind.POINTER, EnumSet.noneOf(CQualifier.class),
                this, null, Collections.emptyList(), null, false);
    }

    /** Array of this type.
     * @param length  Array length; null for <code>[]</code>. */
    public CType array(@Nullable CExpression length) {
        return new CType(SourcePositionRange.INVALID, CTypeKind.ARRAY, EnumSet.noneOf(CQualifier.class),
                this, null, Collections.emptyList(), length, false);
    }

    /** The same type with additional qualifiers. */
    public CType qualified(CQualifier... qualifiers) {
        EnumSet<CQualifier> set = EnumSet.noneOf(CQualifier.class);
        set.addAll(this.qualifiers);
        set.addAll(List.of(qualifiers));
        return new CType(this.position, this.kind, set, this.base, this.tag,
                this.decls, this.width, this.variadic);
    }

    /** Members, enumerators or parameters. */
    public List<CDeclaration> getDeclarations() {
        return Collections.unmodifiableList(this.decls);
    }

    /** Completes a struct, union or enum definition. */
    public void addDeclaration(CDeclaration declaration) {
        if (!this.kind.isTagged())
            this.error("Cannot add members to " + this.kind + " type");
        this.decls.add(declaration);
    }

    @Nullable
    public CDeclaration getTypedefDeclaration() {
        return this.typedefDeclaration;
    }

    public void setTypedefDeclaration(CDeclaration declaration) {
        if (this.kind != CTypeKind.NAMED)
            this.error("Only typedef names resolve to a typedef");
        this.typedefDeclaration = declaration;
    }

    public boolean isConst() {
        return this.qualifiers.contains(CQualifier.CONST);
    }

    @Override
    public List<ICNode> getChildren() {
        List<ICNode> result = children(this.base);
        addAll(result, this.decls);
        if (this.width != null)
            result.add(this.width);
        return result;
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.base != null) {
            visitor.property("base");
            this.base.accept(visitor);
        }
        visitor.startArrayProperty("decls");
        int index = 0;
        for (CDeclaration decl: this.decls) {
            visitor.propertyIndex(index);
            decl.accept(visitor);
            index++;
        }
        visitor.endArrayProperty("decls");
        if (this.width != null) {
            visitor.property("width");
            this.width.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }
}
