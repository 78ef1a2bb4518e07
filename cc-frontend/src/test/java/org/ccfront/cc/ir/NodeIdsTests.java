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

import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.cc.ir.literal.CIntegerLiteral;
import org.ccfront.cc.ir.type.CQualifier;
import org.ccfront.cc.ir.type.CType;
import org.ccfront.cc.ir.type.CTypeKind;
import org.junit.Assert;
import org.junit.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

public class NodeIdsTests {
    @Test
    public void testFreshIds() {
        long next = NodeIds.peek();
        CIntegerLiteral literal = new CIntegerLiteral(1);
        Assert.assertTrue(literal.getId() >= next);
        CType type = CType.basic(CTypeKind.INT);
        Assert.assertTrue(type.getId() > literal.getId());
        // Derived copies are new nodes
        CType constType = type.qualified(CQualifier.CONST);
        Assert.assertNotEquals(type.getId(), constType.getId());
    }

    @Test
    public void testIdsAreStable() {
        CExpression x = CExpression.name("x");
        long id = x.getId();
        x.setInferredType(CType.basic(CTypeKind.INT));
        x.setComments(CComments.before("// x"));
        Assert.assertEquals(id, x.getId());
    }

    @Test
    public void testConcurrentMinting() {
        Set<Long> ids = ConcurrentHashMap.newKeySet();
        IntStream.range(0, 10_000).parallel().forEach(i -> ids.add(NodeIds.next()));
        Assert.assertEquals(10_000, ids.size());
        Set<Long> more = new HashSet<>();
        for (int i = 0; i < 100; i++)
            more.add(CExpression.number(i).getId());
        Assert.assertEquals(100, more.size());
    }
}
