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

import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.ir.CDeclaration;
import org.ccfront.cc.ir.ICNode;
import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.cc.ir.literal.CLiteral;
import org.ccfront.cc.ir.statement.CLabel;
import org.ccfront.cc.ir.statement.CStatement;
import org.ccfront.cc.ir.type.CType;
import org.ccfront.util.IIndentStream;
import org.ccfront.util.IndentStreamBuilder;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.Set;

/**
 * Debugging dump of a syntax graph, one node per line, indented by depth.
 * Each line shows the slot holding the node, its class and id, and a short
 * description of its payload.  A node reached a second time is printed
 * with a back-reference marker and not expanded again.
 */
public class SyntaxTree extends CInnerVisitor {
    final IIndentStream stream;
    final Set<Long> seen;
    @Nullable
    String label;
    @Nullable
    String arrayProperty;

    public SyntaxTree(IIndentStream stream) {
        this.stream = stream;
        this.seen = new HashSet<>();
        this.label = null;
        this.arrayProperty = null;
    }

    @Override
    public void property(String name) {
        this.label = name;
    }

    @Override
    public void startArrayProperty(String property) {
        this.arrayProperty = property;
    }

    @Override
    public void endArrayProperty(String property) {
        this.arrayProperty = null;
    }

    @Override
    public void propertyIndex(int index) {
        this.label = this.arrayProperty + "[" + index + "]";
    }

    VisitDecision header(ICNode node, String description) {
        if (this.label != null)
            this.stream.append(this.label).append(": ");
        this.label = null;
        this.stream.append(node.getClass().getSimpleName())
                .append("#")
                .append(node.getId());
        if (!description.isEmpty())
            this.stream.append(" ").append(description);
        SourcePositionRange range = node.getPositionRange();
        if (range.isValid())
            this.stream.append(" ").append(range.toShortString());
        if (!this.seen.add(node.getId())) {
            this.stream.append(" (see above)").newline();
            return VisitDecision.STOP;
        }
        this.stream.increase();
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(ICNode node) {
        return this.header(node, "");
    }

    @Override
    public VisitDecision preorder(CLiteral node) {
        return this.header(node, node.getText());
    }

    @Override
    public VisitDecision preorder(CExpression node) {
        return this.header(node, node.op.name());
    }

    @Override
    public VisitDecision preorder(CType node) {
        String description = node.kind.name();
        if (node.tag != null)
            description += " " + node.tag;
        return this.header(node, description);
    }

    @Override
    public VisitDecision preorder(CDeclaration node) {
        return this.header(node, node.name != null ? node.name : "");
    }

    @Override
    public VisitDecision preorder(CStatement node) {
        return this.header(node, node.kind.name());
    }

    @Override
    public VisitDecision preorder(CLabel node) {
        return this.header(node, node.kind.name());
    }

    @Override
    public void postorder(ICNode node) {
        this.stream.decrease();
    }

    @CheckReturnValue
    public static String asTree(ICNode node) {
        IndentStreamBuilder builder = new IndentStreamBuilder(2);
        SyntaxTree tree = new SyntaxTree(builder);
        tree.apply(node);
        return builder.toString();
    }
}
