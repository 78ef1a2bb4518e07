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

package org.ccfront.syntax.ast;

import org.ccfront.syntax.codec.SyntaxEncoder;
import org.ccfront.util.ICastable;
import org.ccfront.util.IHasId;

import java.util.List;

/** A node of the kind-tagged syntax tree. */
public interface ISyntax extends IHasId, ICastable {
    /** Discriminant naming the concrete node class; derived, never stored. */
    String getKind();

    List<ISyntax> getChildren();

    /** Write the fields of this node, other than kind and id. */
    void encodeFields(SyntaxEncoder encoder);

    /** Structural equality: same kinds and field values, ignoring ids. */
    boolean equivalent(ISyntax other);

    static boolean equivalent(List<? extends ISyntax> left, List<? extends ISyntax> right) {
        if (left.size() != right.size())
            return false;
        for (int i = 0; i < left.size(); i++)
            if (!left.get(i).equivalent(right.get(i)))
                return false;
        return true;
    }
}
