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

package org.ccfront.cc.compiler.visitors;

import org.ccfront.cc.compiler.errors.InternalCompilerError;
import org.ccfront.cc.ir.CDeclaration;
import org.ccfront.cc.ir.CInitializer;
import org.ccfront.cc.ir.CPrefix;
import org.ccfront.cc.ir.CProgram;
import org.ccfront.cc.ir.ICNode;
import org.ccfront.cc.ir.expression.CBinaryExpression;
import org.ccfront.cc.ir.expression.CCallExpression;
import org.ccfront.cc.ir.expression.CCastExpression;
import org.ccfront.cc.ir.expression.CCommaExpression;
import org.ccfront.cc.ir.expression.CCompoundLiteralExpression;
import org.ccfront.cc.ir.expression.CConditionalExpression;
import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.cc.ir.expression.CIndexExpression;
import org.ccfront.cc.ir.expression.CKernelBracketExpression;
import org.ccfront.cc.ir.expression.CMemberExpression;
import org.ccfront.cc.ir.expression.CNameExpression;
import org.ccfront.cc.ir.expression.CNumberExpression;
import org.ccfront.cc.ir.expression.COffsetofExpression;
import org.ccfront.cc.ir.expression.CSizeofTypeExpression;
import org.ccfront.cc.ir.expression.CStringExpression;
import org.ccfront.cc.ir.expression.CUnaryExpression;
import org.ccfront.cc.ir.expression.CVaArgExpression;
import org.ccfront.cc.ir.literal.CBooleanLiteral;
import org.ccfront.cc.ir.literal.CCharLiteral;
import org.ccfront.cc.ir.literal.CEmptyLiteral;
import org.ccfront.cc.ir.literal.CIntegerLiteral;
import org.ccfront.cc.ir.literal.CKeywordLiteral;
import org.ccfront.cc.ir.literal.CLiteral;
import org.ccfront.cc.ir.literal.CRealLiteral;
import org.ccfront.cc.ir.literal.CStringLiteral;
import org.ccfront.cc.ir.literal.CSymbolLiteral;
import org.ccfront.cc.ir.statement.CLabel;
import org.ccfront.cc.ir.statement.CStatement;
import org.ccfront.cc.ir.type.CType;
import org.ccfront.util.IHasId;
import org.ccfront.util.IWritesLogs;
import org.ccfront.util.Logger;
import org.ccfront.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Depth-first traversal of a C syntax graph.
 * Every node class has a preorder and a postorder method; by default each
 * one delegates to the method for the superclass, ending at {@link ICNode}.
 * The traversal itself is driven by {@link ICNode#accept}. */
@SuppressWarnings({"SameReturnValue", "unused"})
public abstract class CInnerVisitor implements IWritesLogs, IHasId {
    static final AtomicLong crtId = new AtomicLong();
    final long id;
    protected final List<ICNode> context;

    protected CInnerVisitor() {
        this.id = crtId.getAndIncrement();
        this.context = new ArrayList<>();
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(ICNode node) {
        this.context.add(node);
    }

    public void pop(ICNode node) {
        ICNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    /** The node whose child is being visited, or null at the root. */
    @Nullable
    public ICNode getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(ICNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node.getClass().getSimpleName())
                .append("#")
                .append(node.getId())
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /** Called before visiting the node stored in the named slot. */
    public void property(String name) {}

    /** Start a slot that holds a list of nodes. */
    public void startArrayProperty(String property) {}

    public void endArrayProperty(String property) {}

    /** Index of the next node within a list slot. */
    public void propertyIndex(int index) {}

    /************************* PREORDER *****************************/

    public VisitDecision preorder(ICNode ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(CProgram node) {
        return this.preorder((ICNode) node);
    }

    public VisitDecision preorder(CDeclaration node) {
        return this.preorder((ICNode) node);
    }

    public VisitDecision preorder(CInitializer node) {
        return this.preorder((ICNode) node);
    }

    public VisitDecision preorder(CPrefix node) {
        return this.preorder((ICNode) node);
    }

    public VisitDecision preorder(CType node) {
        return this.preorder((ICNode) node);
    }

    public VisitDecision preorder(CStatement node) {
        return this.preorder((ICNode) node);
    }

    public VisitDecision preorder(CLabel node) {
        return this.preorder((ICNode) node);
    }

    public VisitDecision preorder(CLiteral node) {
        return this.preorder((ICNode) node);
    }

    public VisitDecision preorder(CEmptyLiteral node) {
        return this.preorder((CLiteral) node);
    }

    public VisitDecision preorder(CBooleanLiteral node) {
        return this.preorder((CLiteral) node);
    }

    public VisitDecision preorder(CIntegerLiteral node) {
        return this.preorder((CLiteral) node);
    }

    public VisitDecision preorder(CCharLiteral node) {
        return this.preorder((CLiteral) node);
    }

    public VisitDecision preorder(CRealLiteral node) {
        return this.preorder((CLiteral) node);
    }

    public VisitDecision preorder(CStringLiteral node) {
        return this.preorder((CLiteral) node);
    }

    public VisitDecision preorder(CSymbolLiteral node) {
        return this.preorder((CLiteral) node);
    }

    public VisitDecision preorder(CKeywordLiteral node) {
        return this.preorder((CLiteral) node);
    }

    public VisitDecision preorder(CExpression node) {
        return this.preorder((ICNode) node);
    }

    public VisitDecision preorder(CBinaryExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CUnaryExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CCastExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CCompoundLiteralExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CCallExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CCommaExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CConditionalExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CIndexExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CMemberExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(COffsetofExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CSizeofTypeExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CVaArgExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CNameExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CNumberExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CStringExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CKernelBracketExpression node) {
        return this.preorder((CExpression) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(ICNode ignored) {}

    public void postorder(CProgram node) {
        this.postorder((ICNode) node);
    }

    public void postorder(CDeclaration node) {
        this.postorder((ICNode) node);
    }

    public void postorder(CInitializer node) {
        this.postorder((ICNode) node);
    }

    public void postorder(CPrefix node) {
        this.postorder((ICNode) node);
    }

    public void postorder(CType node) {
        this.postorder((ICNode) node);
    }

    public void postorder(CStatement node) {
        this.postorder((ICNode) node);
    }

    public void postorder(CLabel node) {
        this.postorder((ICNode) node);
    }

    public void postorder(CLiteral node) {
        this.postorder((ICNode) node);
    }

    public void postorder(CEmptyLiteral node) {
        this.postorder((CLiteral) node);
    }

    public void postorder(CBooleanLiteral node) {
        this.postorder((CLiteral) node);
    }

    public void postorder(CIntegerLiteral node) {
        this.postorder((CLiteral) node);
    }

    public void postorder(CCharLiteral node) {
        this.postorder((CLiteral) node);
    }

    public void postorder(CRealLiteral node) {
        this.postorder((CLiteral) node);
    }

    public void postorder(CStringLiteral node) {
        this.postorder((CLiteral) node);
    }

    public void postorder(CSymbolLiteral node) {
        this.postorder((CLiteral) node);
    }

    public void postorder(CKeywordLiteral node) {
        this.postorder((CLiteral) node);
    }

    public void postorder(CExpression node) {
        this.postorder((ICNode) node);
    }

    public void postorder(CBinaryExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CUnaryExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CCastExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CCompoundLiteralExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CCallExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CCommaExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CConditionalExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CIndexExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CMemberExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(COffsetofExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CSizeofTypeExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CVaArgExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CNameExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CNumberExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CStringExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CKernelBracketExpression node) {
        this.postorder((CExpression) node);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }

    /** Visit the graph rooted at the node. */
    public ICNode apply(ICNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }
}
