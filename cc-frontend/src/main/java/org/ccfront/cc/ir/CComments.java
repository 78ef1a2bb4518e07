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

import org.ccfront.util.Linq;

import java.util.Collections;
import java.util.List;

/** Comments attached to a node by the parser.
 * Each comment keeps its delimiters, e.g. <code>// text</code> or <code>/* text *&#47;</code>. */
public final class CComments {
    /** Comments on the lines preceding the node. */
    public final List<String> before;
    /** Comments following the node on the same line. */
    public final List<String> suffix;

    public static final CComments EMPTY = new CComments(Collections.emptyList(), Collections.emptyList());

    public CComments(List<String> before, List<String> suffix) {
        this.before = Collections.unmodifiableList(before);
        this.suffix = Collections.unmodifiableList(suffix);
    }

    public static CComments before(String... comments) {
        return new CComments(Linq.list(comments), Collections.emptyList());
    }

    public static CComments suffix(String... comments) {
        return new CComments(Collections.emptyList(), Linq.list(comments));
    }

    public boolean isEmpty() {
        return this.before.isEmpty() && this.suffix.isEmpty();
    }
}
