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

package org.ccfront.cc.ir.statement;

import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.compiler.visitors.CInnerVisitor;
import org.ccfront.cc.compiler.visitors.VisitDecision;
import org.ccfront.cc.ir.CDeclaration;
import org.ccfront.cc.ir.CNode;
import org.ccfront.cc.ir.ICNode;
import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.cc.ir.literal.CSymbolLiteral;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;

/**
 * A C statement.  The kind decides which slots are used:
 * <ul>
 *     <li>EXPR, RETURN: {@link #expr}</li>
 *     <li>DECL: {@link #decl}</li>
 *     <li>BLOCK: {@link #block}</li>
 *     <li>IF: {@link #expr}, {@link #body}, {@link #elseBranch}</li>
 *     <li>WHILE, DO, SWITCH: {@link #expr}, {@link #body}</li>
 *     <li>FOR: {@link #pre} or {@link #decl}, {@link #expr}, {@link #post}, {@link #body}</li>
 *     <li>GOTO: {@link #text}</li>
 * </ul>
 * Any statement may carry labels.
 */
public final class CStatement extends CNode {
    public final CStatementKind kind;
    @Nullable
    public final CExpression pre;
    @Nullable
    public final CExpression expr;
    @Nullable
    public final CExpression post;
    @Nullable
    public final CDeclaration decl;
    @Nullable
    public final CStatement body;
    @Nullable
    public final CStatement elseBranch;
    /** Goto target. */
    @Nullable
    public final CSymbolLiteral text;
    public final List<CStatement> block;
    public final List<CLabel> labels;

    public CStatement(SourcePositionRange position, CStatementKind kind,
                      @Nullable CExpression pre, @Nullable CExpression expr, @Nullable CExpression post,
                      @Nullable CDeclaration decl, @Nullable CStatement body, @Nullable CStatement elseBranch,
                      @Nullable CSymbolLiteral text, List<CStatement> block, List<CLabel> labels) {
        super(position);
        this.kind = kind;
        this.pre = pre;
        this.expr = expr;
        this.post = post;
        this.decl = decl;
        this.body = body;
        this.elseBranch = elseBranch;
        this.text = text;
        this.block = List.copyOf(block);
        this.labels = List.copyOf(labels);
        this.validate();
    }

    private void validate() {
        boolean usesExpr = false;
        boolean usesBody = false;
        switch (this.kind) {
            case EMPTY:
            case BREAK:
            case CONTINUE:
                break;
            case EXPR:
                this.checkNull(this.expr);
                usesExpr = true;
                break;
            case RETURN:
                usesExpr = true;
                break;
            case DECL:
                this.checkNull(this.decl);
                break;
            case BLOCK:
                break;
            case IF:
            case WHILE:
            case DO:
            case SWITCH:
                this.checkNull(this.expr);
                this.checkNull(this.body);
                usesExpr = true;
                usesBody = true;
                break;
            case FOR:
                this.checkNull(this.body);
                if (this.pre != null && this.decl != null)
                    this.error("for statement with both an init expression and a declaration");
                usesExpr = true;
                usesBody = true;
                break;
            case GOTO:
                this.checkNull(this.text);
                break;
        }
        if (!usesExpr && this.expr != null)
            this.error(this.kind + " statement has no expression");
        if (!usesBody && this.body != null)
            this.error(this.kind + " statement has no body");
        if (this.kind != CStatementKind.FOR && (this.pre != null || this.post != null))
            this.error(this.kind + " statement has no init or step expression");
        if (this.kind != CStatementKind.FOR && this.kind != CStatementKind.DECL && this.decl != null)
            this.error(this.kind + " statement cannot contain a declaration");
        if (this.kind != CStatementKind.IF && this.elseBranch != null)
            this.error(this.kind + " statement has no else branch");
        if (this.kind != CStatementKind.GOTO && this.text != null)
            this.error(this.kind + " statement has no target");
        if (this.kind != CStatementKind.BLOCK && !this.block.isEmpty())
            this.error(this.kind + " statement cannot contain a block");
    }

    static CStatement make(CStatementKind kind, @Nullable CExpression pre, @Nullable CExpression expr,
                           @Nullable CExpression post, @Nullable CDeclaration decl,
                           @Nullable CStatement body, @Nullable CStatement elseBranch) {
        return new CStatement(SourcePositionRange.INVALID, kind, pre, expr, post, decl, body, elseBranch,
                null, Collections.emptyList(), Collections.emptyList());
    }

    public static CStatement empty() {
        return make(CStatementKind.EMPTY, null, null, null, null, null, null);
    }

    public static CStatement expression(CExpression expr) {
        return make(CStatementKind.EXPR, null, expr, null, null, null, null);
    }

    public static CStatement declaration(CDeclaration decl) {
        return make(CStatementKind.DECL, null, null, null, decl, null, null);
    }

    public static CStatement block(CStatement... statements) {
        return new CStatement(SourcePositionRange.INVALID, CStatementKind.BLOCK, null, null, null, null,
                null, null, null, List.of(statements), Collections.emptyList());
    }

    public static CStatement ifThen(CExpression condition, CStatement then, @Nullable CStatement otherwise) {
        return make(CStatementKind.IF, null, condition, null, null, then, otherwise);
    }

    public static CStatement whileLoop(CExpression condition, CStatement body) {
        return make(CStatementKind.WHILE, null, condition, null, null, body, null);
    }

    public static CStatement doWhile(CStatement body, CExpression condition) {
        return make(CStatementKind.DO, null, condition, null, null, body, null);
    }

    public static CStatement forLoop(@Nullable CExpression pre, @Nullable CExpression condition,
                                     @Nullable CExpression post, CStatement body) {
        return make(CStatementKind.FOR, pre, condition, post, null, body, null);
    }

    /** C99 loop declaring its own variable: <code>for (int i = 0; ...)</code>. */
    public static CStatement forLoop(CDeclaration decl, @Nullable CExpression condition,
                                     @Nullable CExpression post, CStatement body) {
        return make(CStatementKind.FOR, null, condition, post, decl, body, null);
    }

    public static CStatement switchOn(CExpression value, CStatement body) {
        return make(CStatementKind.SWITCH, null, value, null, null, body, null);
    }

    public static CStatement breakStatement() {
        return make(CStatementKind.BREAK, null, null, null, null, null, null);
    }

    public static CStatement continueStatement() {
        return make(CStatementKind.CONTINUE, null, null, null, null, null, null);
    }

    public static CStatement returnStatement(@Nullable CExpression value) {
        return make(CStatementKind.RETURN, null, value, null, null, null, null);
    }

    public static CStatement gotoLabel(String target) {
        return new CStatement(SourcePositionRange.INVALID, CStatementKind.GOTO, null, null, null, null,
                null, null, new CSymbolLiteral(target), Collections.emptyList(), Collections.emptyList());
    }

    /** The same statement preceded by labels. */
    public CStatement labeled(CLabel... labels) {
        return new CStatement(this.position, this.kind, this.pre, this.expr, this.post, this.decl,
                this.body, this.elseBranch, this.text, this.block, List.of(labels));
    }

    @Override
    public List<ICNode> getChildren() {
        List<ICNode> result = children(this.pre, this.expr, this.post, this.decl,
                this.body, this.elseBranch, this.text);
        addAll(result, this.block);
        addAll(result, this.labels);
        return result;
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.pre != null) {
            visitor.property("pre");
            this.pre.accept(visitor);
        }
        if (this.expr != null) {
            visitor.property("expr");
            this.expr.accept(visitor);
        }
        if (this.post != null) {
            visitor.property("post");
            this.post.accept(visitor);
        }
        if (this.decl != null) {
            visitor.property("decl");
            this.decl.accept(visitor);
        }
        if (this.body != null) {
            visitor.property("body");
            this.body.accept(visitor);
        }
        if (this.elseBranch != null) {
            visitor.property("else");
            this.elseBranch.accept(visitor);
        }
        if (this.text != null) {
            visitor.property("text");
            this.text.accept(visitor);
        }
        visitor.startArrayProperty("block");
        int index = 0;
        for (CStatement statement: this.block) {
            visitor.propertyIndex(index);
            statement.accept(visitor);
            index++;
        }
        visitor.endArrayProperty("block");
        visitor.startArrayProperty("labels");
        index = 0;
        for (CLabel label: this.labels) {
            visitor.propertyIndex(index);
            label.accept(visitor);
            index++;
        }
        visitor.endArrayProperty("labels");
        visitor.pop(this);
        visitor.postorder(this);
    }
}
