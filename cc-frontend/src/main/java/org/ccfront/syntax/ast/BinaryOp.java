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

/** Binary operators. */
public enum BinaryOp implements IJsonEnum {
    ADD("Add", "+"),
    SUB("Sub", "-"),
    MUL("Mul", "*"),
    DIV("Div", "/"),
    MOD("Mod", "%"),
    AND("And", "&"),
    OR("Or", "|"),
    XOR("Xor", "^"),
    LSH("Lsh", "<<"),
    RSH("Rsh", ">>"),
    AND_AND("AndAnd", "&&"),
    OR_OR("OrOr", "||"),
    EQ_EQ("EqEq", "=="),
    NOT_EQ("NotEq", "!="),
    LT("Lt", "<"),
    LT_EQ("LtEq", "<="),
    GT("Gt", ">"),
    GT_EQ("GtEq", ">=");

    private final String jsonName;
    public final String text;

    BinaryOp(String jsonName, String text) {
        this.jsonName = jsonName;
        this.text = text;
    }

    @Override
    public String getJsonName() {
        return this.jsonName;
    }

    @Override
    public String toString() {
        return this.text;
    }
}
