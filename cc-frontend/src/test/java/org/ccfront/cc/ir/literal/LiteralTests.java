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

package org.ccfront.cc.ir.literal;

import org.ccfront.cc.compiler.errors.InternalCompilerError;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;

public class LiteralTests {
    @Test
    public void testIntegerValues() {
        Assert.assertEquals(BigInteger.valueOf(31), new CIntegerLiteral("0x1f").getValue());
        Assert.assertEquals(BigInteger.valueOf(31), new CIntegerLiteral("0X1FUL").getValue());
        Assert.assertEquals(BigInteger.valueOf(8), new CIntegerLiteral("010").getValue());
        Assert.assertEquals(BigInteger.valueOf(5), new CIntegerLiteral("0b101").getValue());
        Assert.assertEquals(BigInteger.ZERO, new CIntegerLiteral("0").getValue());
        Assert.assertEquals(new BigInteger("18446744073709551615"),
                new CIntegerLiteral("18446744073709551615ULL").getValue());
    }

    @Test
    public void testIntegerSuffix() {
        CIntegerLiteral literal = new CIntegerLiteral("42uL");
        Assert.assertEquals("ul", literal.getSuffix());
        Assert.assertTrue(literal.isUnsigned());
        Assert.assertEquals("42uL", literal.getText());
        Assert.assertFalse(new CIntegerLiteral("7ll").isUnsigned());
        Assert.assertEquals("", new CIntegerLiteral(7).getSuffix());
    }

    @Test
    public void testMalformed() {
        Assert.assertThrows(InternalCompilerError.class, () -> new CIntegerLiteral("x1"));
        Assert.assertThrows(InternalCompilerError.class, () -> new CIntegerLiteral("09").getValue());
        Assert.assertThrows(InternalCompilerError.class, () -> new CRealLiteral("1.2.3").getValue());
        Assert.assertThrows(InternalCompilerError.class, () -> new CCharLiteral("'ab"));
        Assert.assertThrows(InternalCompilerError.class, () -> new CStringLiteral("abc"));
        Assert.assertThrows(InternalCompilerError.class, () -> new CSymbolLiteral(""));
    }

    @Test
    public void testReal() {
        CRealLiteral f = new CRealLiteral("1.5f");
        Assert.assertTrue(f.isFloat());
        Assert.assertEquals(1.5, f.getValue(), 0.0);
        CRealLiteral d = new CRealLiteral("2.5e3");
        Assert.assertFalse(d.isFloat());
        Assert.assertEquals(2500.0, d.getValue(), 0.0);
        Assert.assertEquals(0.25, new CRealLiteral("0.25L").getValue(), 0.0);
        Assert.assertFalse(new CRealLiteral("0x1.0p4").isFloat());
    }

    @Test
    public void testQuotedLiterals() {
        Assert.assertEquals("'\\''", CCharLiteral.of('\'').getText());
        Assert.assertEquals("'a'", CCharLiteral.of('a').getText());
        Assert.assertEquals("\"tab\\there\"", CStringLiteral.of("tab\there").getText());
        Assert.assertTrue(new CStringLiteral("\"x\"").sameText(CStringLiteral.of("x")));
        Assert.assertEquals("true", new CBooleanLiteral(true).getText());
        Assert.assertEquals("", new CEmptyLiteral().getText());
        Assert.assertEquals("nullptr", new CKeywordLiteral("nullptr").getText());
        Assert.assertTrue(new CSymbolLiteral("x").getChildren().isEmpty());
    }
}
