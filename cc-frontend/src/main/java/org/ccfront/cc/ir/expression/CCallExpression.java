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

package org.ccfront.cc.ir.expression;

import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.compiler.visitors.CInnerVisitor;
import org.ccfront.cc.compiler.visitors.VisitDecision;
import org.ccfront.cc.ir.ICNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function call <code>f(a, b)</code> or a CUDA kernel launch
 * <code>f&lt;&lt;&lt;grid, block&gt;&gt;&gt;(a, b)</code>.
 * Argument slots may be null when the parser recovered from an error;
 * such slots are skipped by traversal.
 */
public final class CCallExpression extends CExpression {
    public final CExpression function;
    /** Kernel launch configuration; empty for plain calls. */
    public final List<CExpression> launchParams;
    public final List<CExpression> arguments;

    public CCallExpression(SourcePositionRange position, CExprOp op, CExpression function,
                           List<CExpression> launchParams, List<CExpression> arguments) {
        super(position, op, CExprOp.Shape.CALL, CExprOp.Shape.KERNEL_CALL);
        this.function = function;
        this.launchParams = List.copyOf(launchParams);
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        if (op == CExprOp.CALL && !launchParams.isEmpty())
            this.error("Launch parameters on a plain call");
        if (op == CExprOp.CUDA_CALL && launchParams.isEmpty())
            this.error("Kernel launch without launch parameters");
    }

    public CCallExpression(CExpression function, List<CExpression> arguments) {
        this(SourcePositionRange.INVALID, CExprOp.CALL, function, Collections.emptyList(), arguments);
    }

    /** A kernel launch. */
    public static CCallExpression launch(CExpression kernel, List<CExpression> launchParams,
                                         List<CExpression> arguments) {
        return new CCallExpression(SourcePositionRange.INVALID, CExprOp.CUDA_CALL,
                kernel, launchParams, arguments);
    }

    public boolean isKernelLaunch() {
        return this.op == CExprOp.CUDA_CALL;
    }

    /** The function, then the non-null arguments.  Launch parameters are not included. */
    @Override
    public List<ICNode> getChildren() {
        List<ICNode> result = children(this.function);
        addAll(result, this.arguments);
        return result;
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("function");
        this.function.accept(visitor);
        visitor.startArrayProperty("launchParams");
        int index = 0;
        for (CExpression param: this.launchParams) {
            visitor.propertyIndex(index);
            param.accept(visitor);
            index++;
        }
        visitor.endArrayProperty("launchParams");
        visitor.startArrayProperty("arguments");
        index = 0;
        for (CExpression arg: this.arguments) {
            if (arg != null) {
                visitor.propertyIndex(index);
                arg.accept(visitor);
            }
            index++;
        }
        visitor.endArrayProperty("arguments");
        visitor.pop(this);
        visitor.postorder(this);
    }
}
