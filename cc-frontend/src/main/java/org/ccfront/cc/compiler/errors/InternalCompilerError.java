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

package org.ccfront.cc.compiler.errors;

import org.ccfront.cc.ir.ICNode;

import javax.annotation.Nullable;

/** Signals a bug in the compiler -- some expected invariant doesn't hold.
 * Typically the syntax graph was built with a shape its operator does not allow. */
public final class InternalCompilerError extends BaseCompilerException {
    @Nullable
    public final ICNode cNode;

    InternalCompilerError(String message, SourcePositionRange position,
                          @Nullable ICNode cNode) {
        super(message, position);
        this.cNode = cNode;
    }

    public InternalCompilerError(String message) {
        this(message, SourcePositionRange.INVALID, null);
    }

    public InternalCompilerError(String message, ICNode node) {
        this(message, node.getPositionRange(), node);
    }

    @Override
    public String getErrorKind() {
        return "Compiler error";
    }
}
