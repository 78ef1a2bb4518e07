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
import org.ccfront.cc.ir.CDeclaration;
import org.ccfront.cc.ir.CNode;
import org.ccfront.cc.ir.literal.CIntegerLiteral;
import org.ccfront.cc.ir.statement.CStatement;
import org.ccfront.cc.ir.type.CType;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/** Base class for all expressions.  The operator is fixed at construction
 * and must have one of the shapes the concrete class implements. */
public abstract class CExpression extends CNode {
    public final CExprOp op;

    // Derived information, filled in by later passes.  Not children.
    @Nullable
    private CDeclaration declaration;
    @Nullable
    private CType inferredType;

    protected CExpression(SourcePositionRange position, CExprOp op, CExprOp.Shape... shapes) {
        super(position);
        this.op = op;
        if (!Arrays.asList(shapes).contains(op.shape))
            this.error(this.getClass().getSimpleName() + " cannot represent operator " + op.name());
    }

    /** The declaration this expression refers to, if it has been resolved. */
    @Nullable
    public CDeclaration getDeclaration() {
        return this.declaration;
    }

    /** Records the result of name resolution. */
    public void resolve(CDeclaration declaration) {
        this.declaration = declaration;
    }

    @Nullable
    public CType getInferredType() {
        return this.inferredType;
    }

    public void setInferredType(CType type) {
        this.inferredType = type;
    }

    public int getPrecedence() {
        return this.op.precedence;
    }

    public static CNameExpression name(String name) {
        return new CNameExpression(name);
    }

    /** An integer constant; a negative value is the constant's magnitude under unary minus. */
    public static CExpression number(long value) {
        if (value >= 0)
            return new CNumberExpression(value);
        CIntegerLiteral magnitude = new CIntegerLiteral(Long.toUnsignedString(-value));
        return new CNumberExpression(magnitude).unary(CExprOp.MINUS);
    }

    public static CStringExpression string(String value) {
        return new CStringExpression(value);
    }

    public static CCastExpression cast(CType type, CExpression operand) {
        return new CCastExpression(type, operand);
    }

    public static CConditionalExpression conditional(CExpression condition,
                                                     CExpression positive, CExpression negative) {
        return new CConditionalExpression(condition, positive, negative);
    }

    /** The binary expression spans the source text of both operands. */
    public CBinaryExpression binary(CExprOp op, CExpression right) {
        return new CBinaryExpression(this.getPositionRange().merge(right.getPositionRange()), op, this, right);
    }

    public CBinaryExpression assign(CExpression value) {
        return this.binary(CExprOp.EQ, value);
    }

    public CUnaryExpression unary(CExprOp op) {
        return new CUnaryExpression(op, this);
    }

    public CUnaryExpression paren() {
        return this.unary(CExprOp.PAREN);
    }

    public CUnaryExpression deref() {
        return this.unary(CExprOp.INDIR);
    }

    public CUnaryExpression addressOf() {
        return this.unary(CExprOp.ADDR);
    }

    public CUnaryExpression not() {
        return this.unary(CExprOp.NOT);
    }

    public CCallExpression call(CExpression... arguments) {
        return new CCallExpression(this, List.of(arguments));
    }

    public CIndexExpression index(CExpression index) {
        return new CIndexExpression(this.getPositionRange().merge(index.getPositionRange()), this, index);
    }

    public CMemberExpression dot(String member) {
        return new CMemberExpression(CExprOp.DOT, this, member);
    }

    public CMemberExpression arrow(String member) {
        return new CMemberExpression(CExprOp.ARROW, this, member);
    }

    public CStatement toStatement() {
        return CStatement.expression(this);
    }
}
