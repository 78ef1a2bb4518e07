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

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** A translation unit: the top-level declarations of one source file, in order. */
public final class CProgram extends CNode {
    public final List<CDeclaration> decls;

    public CProgram(SourcePositionRange position, List<CDeclaration> decls) {
        super(position);
        this.decls = List.copyOf(decls);
    }

    public CProgram(CDeclaration... decls) {
        this(SourcePositionRange.INVALID, List.of(decls));
    }

    /** Declaration with the given name, or null. */
    @Nullable
    public CDeclaration lookup(String name) {
        for (CDeclaration decl: this.decls)
            if (name.equals(decl.name))
                return decl;
        return null;
    }

    @Override
    public List<ICNode> getChildren() {
        return new ArrayList<>(this.decls);
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.startArrayProperty("decls");
        int index = 0;
        for (CDeclaration decl: this.decls) {
            visitor.propertyIndex(index);
            decl.accept(visitor);
            index++;
        }
        visitor.endArrayProperty("decls");
        visitor.pop(this);
        visitor.postorder(this);
    }
}
