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

import org.ccfront.cc.compiler.errors.InternalCompilerError;
import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.compiler.visitors.CInnerVisitor;
import org.ccfront.util.ICastable;
import org.ccfront.util.IHasId;
import org.ccfront.util.ToIndentableString;

import javax.annotation.Nullable;
import java.util.List;

/**
 * A node of the C syntax graph.
 *
 * <p>{@link #getChildren()} enumerates the semantic children of a node, in a fixed
 * order that depends on the node kind (for expressions, on the operator).
 * {@link #accept(CInnerVisitor)} visits every node owned by this node, in source order;
 * the children are always a subsequence of the nodes visited by accept.
 * Neither ever follows derived references such as the declaration an
 * expression resolves to. */
public interface ICNode extends ICastable, IHasId, ToIndentableString {
    /** The semantic children of this node; never contains null. */
    List<ICNode> getChildren();

    /** Double dispatch for visitors. */
    void accept(CInnerVisitor visitor);

    SourcePositionRange getPositionRange();

    CComments getComments();

    default <T> T checkNull(@Nullable T value) {
        if (value == null)
            throw new InternalCompilerError("Did not expect a null value", this);
        return value;
    }

    default void error(String message) {
        throw new InternalCompilerError(message, this);
    }
}
