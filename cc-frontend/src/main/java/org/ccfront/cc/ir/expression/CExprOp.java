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

import static org.ccfront.cc.ir.expression.CExprOp.Shape.*;

/** Expression operators.  Each operator fixes the syntactic shape of
 * its expression, and thus the {@link CExpression} subclass representing it. */
public enum CExprOp {
    ADD("+", BINARY, CPrecedence.ADDITIVE),
    ADD_EQ("+=", ASSIGN, CPrecedence.ASSIGN),
    ADDR("&", UNARY, CPrecedence.UNARY),
    AND("&", BINARY, CPrecedence.AND),
    AND_AND("&&", BINARY, CPrecedence.AND_AND),
    AND_EQ("&=", ASSIGN, CPrecedence.ASSIGN),
    ARROW("->", MEMBER, CPrecedence.POSTFIX),
    CALL("()", Shape.CALL, CPrecedence.POSTFIX),
    CUDA_CALL("<<<>>>()", KERNEL_CALL, CPrecedence.POSTFIX),
    CAST("()", Shape.CAST, CPrecedence.UNARY),
    CAST_INIT("(){}", Shape.CAST_INIT, CPrecedence.POSTFIX),
    COMMA(",", Shape.COMMA, CPrecedence.COMMA),
    COND("?:", Shape.COND, CPrecedence.COND),
    DIV("/", BINARY, CPrecedence.MULTIPLICATIVE),
    DIV_EQ("/=", ASSIGN, CPrecedence.ASSIGN),
    DOT(".", MEMBER, CPrecedence.POSTFIX),
    EQ("=", ASSIGN, CPrecedence.ASSIGN),
    EQ_EQ("==", BINARY, CPrecedence.EQUALITY),
    GT(">", BINARY, CPrecedence.RELATIONAL),
    GT_EQ(">=", BINARY, CPrecedence.RELATIONAL),
    INDEX("[]", Shape.INDEX, CPrecedence.POSTFIX),
    INDIR("*", UNARY, CPrecedence.UNARY),
    LSH("<<", BINARY, CPrecedence.SHIFT),
    LSH_EQ("<<=", ASSIGN, CPrecedence.ASSIGN),
    LCU_BRK_OP("<<<", BINARY, CPrecedence.SHIFT),
    LT("<", BINARY, CPrecedence.RELATIONAL),
    LT_EQ("<=", BINARY, CPrecedence.RELATIONAL),
    RCU_BRK_OP(">>>", BINARY, CPrecedence.SHIFT),
    MINUS("-", UNARY, CPrecedence.UNARY),
    MOD("%", BINARY, CPrecedence.MULTIPLICATIVE),
    MOD_EQ("%=", ASSIGN, CPrecedence.ASSIGN),
    MUL("*", BINARY, CPrecedence.MULTIPLICATIVE),
    MUL_EQ("*=", ASSIGN, CPrecedence.ASSIGN),
    NAME("", Shape.NAME, CPrecedence.PRIMARY),
    NOT("!", UNARY, CPrecedence.UNARY),
    NOT_EQ("!=", BINARY, CPrecedence.EQUALITY),
    NUMBER("", Shape.NUMBER, CPrecedence.PRIMARY),
    // Constant with a spelling that is not a number, e.g. a character or keyword
    LITERAL("", Shape.NUMBER, CPrecedence.PRIMARY),
    OFFSETOF("offsetof", Shape.OFFSETOF, CPrecedence.PRIMARY),
    OR("|", BINARY, CPrecedence.OR),
    OR_EQ("|=", ASSIGN, CPrecedence.ASSIGN),
    OR_OR("||", BINARY, CPrecedence.OR_OR),
    PAREN("()", UNARY, CPrecedence.PRIMARY),
    PLUS("+", UNARY, CPrecedence.UNARY),
    POST_DEC("--", UNARY, CPrecedence.POSTFIX),
    POST_INC("++", UNARY, CPrecedence.POSTFIX),
    PRE_DEC("--", UNARY, CPrecedence.UNARY),
    PRE_INC("++", UNARY, CPrecedence.UNARY),
    RSH(">>", BINARY, CPrecedence.SHIFT),
    RSH_EQ(">>=", ASSIGN, CPrecedence.ASSIGN),
    SIZEOF_EXPR("sizeof", UNARY, CPrecedence.UNARY),
    SIZEOF_TYPE("sizeof", Shape.SIZEOF_TYPE, CPrecedence.UNARY),
    STRING("", Shape.STRING, CPrecedence.PRIMARY),
    SUB("-", BINARY, CPrecedence.ADDITIVE),
    SUB_EQ("-=", ASSIGN, CPrecedence.ASSIGN),
    TWID("~", UNARY, CPrecedence.UNARY),
    VA_ARG("va_arg", Shape.VA_ARG, CPrecedence.PRIMARY),
    XOR("^", BINARY, CPrecedence.XOR),
    XOR_EQ("^=", ASSIGN, CPrecedence.ASSIGN),
    // Kernel launch brackets as standalone tokens
    LCU_BRK("<<<", MARKER, CPrecedence.PRIMARY),
    RCU_BRK(">>>", MARKER, CPrecedence.PRIMARY);

    /** Operand layout of an operator. */
    public enum Shape {
        /** left op right, left associative */
        BINARY,
        /** left op= right, right associative */
        ASSIGN,
        /** a single operand */
        UNARY,
        /** left.name or left->name */
        MEMBER,
        CALL,
        KERNEL_CALL,
        COMMA,
        COND,
        CAST,
        CAST_INIT,
        INDEX,
        OFFSETOF,
        SIZEOF_TYPE,
        VA_ARG,
        NAME,
        NUMBER,
        STRING,
        MARKER
    }

    public final String text;
    public final Shape shape;
    public final int precedence;

    CExprOp(String text, Shape shape, int precedence) {
        this.text = text;
        this.shape = shape;
        this.precedence = precedence;
    }

    public boolean isPostfix() {
        return this == POST_INC || this == POST_DEC;
    }

    /** True for operators that group right to left. */
    public boolean isRightAssociative() {
        return this.shape == ASSIGN || this.shape == Shape.COND ||
                (this.shape == UNARY && this.precedence == CPrecedence.UNARY) ||
                this.shape == Shape.CAST;
    }

    @Override
    public String toString() {
        return this.text.isEmpty() ? this.name() : this.text;
    }
}
