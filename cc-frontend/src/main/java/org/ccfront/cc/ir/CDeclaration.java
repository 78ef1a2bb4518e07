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

package org.ccfront.cc.ir;

import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.compiler.visitors.CInnerVisitor;
import org.ccfront.cc.compiler.visitors.VisitDecision;
import org.ccfront.cc.ir.statement.CStatement;
import org.ccfront.cc.ir.statement.CStatementKind;
import org.ccfront.cc.ir.type.CType;
import org.ccfront.cc.ir.type.CTypeKind;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A declared name: variable, function, typedef, parameter, struct member or
 * enumerator.  Function definitions carry a body block.  Enumerators have no
 * type and an optional value in {@link #init}.
 */
public final class CDeclaration extends CNode {
    /** Null for abstract declarators, e.g. unnamed parameters. */
    @Nullable
    public final String name;
    @Nullable
    public final CType type;
    public final Set<CStorageClass> storage;
    @Nullable
    public final CInitializer init;
    @Nullable
    public final CStatement body;

    public CDeclaration(SourcePositionRange position, @Nullable String name, @Nullable CType type,
                        Set<CStorageClass> storage, @Nullable CInitializer init, @Nullable CStatement body) {
        super(position);
        this.name = name;
        this.type = type;
        this.storage = storage.isEmpty() ?
                Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(storage));
        this.init = init;
        this.body = body;
        if (body != null) {
            if (type == null || type.kind != CTypeKind.FUNC)
                this.error("Only functions can have a body");
            if (body.kind != CStatementKind.BLOCK)
                this.error("Function body must be a block");
            if (init != null)
                this.error("Function definition with an initializer");
        }
        if (name != null && name.isEmpty())
            this.error("Empty declaration name");
    }

    public CDeclaration(@Nullable String name, @Nullable CType type) {
        this(SourcePositionRange.INVALID, name, type, EnumSet.noneOf(CStorageClass.class), null, null);
    }

    public CDeclaration(@Nullable String name, @Nullable CType type, @Nullable CInitializer init) {
        this(SourcePositionRange.INVALID, name, type, EnumSet.noneOf(CStorageClass.class), init, null);
    }

    public static CDeclaration function(String name, CType type, CStatement body, CStorageClass... storage) {
        EnumSet<CStorageClass> set = EnumSet.noneOf(CStorageClass.class);
        set.addAll(List.of(storage));
        return new CDeclaration(SourcePositionRange.INVALID, name, type, set, null, body);
    }

    public CDeclaration withStorage(CStorageClass... storage) {
        EnumSet<CStorageClass> set = EnumSet.noneOf(CStorageClass.class);
        set.addAll(this.storage);
        set.addAll(List.of(storage));
        return new CDeclaration(this.position, this.name, this.type, set, this.init, this.body);
    }

    public boolean isTypedef() {
        return this.storage.contains(CStorageClass.TYPEDEF);
    }

    public boolean isKernel() {
        return this.storage.contains(CStorageClass.GLOBAL);
    }

    @Override
    public List<ICNode> getChildren() {
        return children(this.type, this.init, this.body);
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.type != null) {
            visitor.property("type");
            this.type.accept(visitor);
        }
        if (this.init != null) {
            visitor.property("init");
            this.init.accept(visitor);
        }
        if (this.body != null) {
            visitor.property("body");
            this.body.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }
}
