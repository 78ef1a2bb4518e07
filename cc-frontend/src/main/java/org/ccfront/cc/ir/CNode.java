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

import org.ccfront.cc.compiler.backend.CRenderOptions;
import org.ccfront.cc.compiler.backend.ToCVisitor;
import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.util.IIndentStream;

import java.util.ArrayList;
import java.util.List;

/** Base class for all C syntax nodes. */
public abstract class CNode implements ICNode {
    public final long id;
    /** Source text this node was parsed from. */
    protected final SourcePositionRange position;
    /** Filled by the parser after construction. */
    private CComments comments;

    protected CNode(SourcePositionRange position) {
        this.id = NodeIds.next();
        this.position = position;
        this.comments = CComments.EMPTY;
    }

    @Override
    public long getId() {
        return this.id;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.position;
    }

    @Override
    public CComments getComments() {
        return this.comments;
    }

    public void setComments(CComments comments) {
        this.comments = comments;
    }

    /** Renders the node without comments. */
    @Override
    public String toString() {
        return ToCVisitor.toCString(this, CRenderOptions.DEBUG);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        ToCVisitor visitor = new ToCVisitor(builder, CRenderOptions.DEBUG);
        visitor.render(this);
        return builder;
    }

    /** Helper for {@link #getChildren()} implementations: appends the non-null nodes. */
    protected static List<ICNode> children(ICNode... nodes) {
        List<ICNode> result = new ArrayList<>(nodes.length);
        for (ICNode node: nodes)
            if (node != null)
                result.add(node);
        return result;
    }

    protected static void addAll(List<ICNode> result, List<? extends ICNode> nodes) {
        for (ICNode node: nodes)
            if (node != null)
                result.add(node);
    }
}
