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
import org.ccfront.cc.ir.expression.CExprOp;
import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.cc.ir.statement.CStatement;
import org.ccfront.cc.ir.type.CType;
import org.ccfront.cc.ir.type.CTypeKind;
import org.ccfront.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class WalkerTests {
    static List<Long> expressionIds(List<ICNode> nodes) {
        return Linq.map(Linq.where(nodes, n -> n instanceof CExpression), ICNode::getId);
    }

    static List<Long> ids(ICNode... nodes) {
        return Linq.map(List.of(nodes), ICNode::getId);
    }

    @Test
    public void testSharedNodeVisitedOnce() {
        CExpression x = CExpression.name("x");
        CBinaryExpression sum = x.binary(CExprOp.ADD, x);
        List<ICNode> entered = new ArrayList<>();
        Walker.walkPreorder(sum, entered::add);
        // sum, x, and the name literal of x
        Assert.assertEquals(3, entered.size());
        Assert.assertEquals(ids(sum, x), expressionIds(entered));
        Set<Long> distinct = new HashSet<>(Linq.map(entered, ICNode::getId));
        Assert.assertEquals(entered.size(), distinct.size());
    }

    @Test
    public void testOrder() {
        CExpression a = CExpression.name("a");
        CExpression b = CExpression.name("b");
        CExpression c = CExpression.name("c");
        CBinaryExpression add = a.binary(CExprOp.ADD, b);
        CBinaryExpression mul = add.binary(CExprOp.MUL, c);

        List<ICNode> pre = new ArrayList<>();
        Walker.walkPreorder(mul, pre::add);
        Assert.assertEquals(ids(mul, add, a, b, c), expressionIds(pre));

        List<ICNode> post = new ArrayList<>();
        Walker.walkPostorder(mul, post::add);
        Assert.assertEquals(ids(a, b, add, c, mul), expressionIds(post));
    }

    @Test
    public void testEnterExitPairing() {
        CExpression i = CExpression.name("i");
        CStatement loop = CStatement.forLoop(
                i.assign(CExpression.number(0)),
                i.binary(CExprOp.LT, CExpression.number(10)),
                i.unary(CExprOp.POST_INC),
                CStatement.block(CExpression.name("f").call(i).toStatement()));
        Deque<ICNode> stack = new ArrayDeque<>();
        int[] counts = new int[2];
        Walker.walk(loop,
                n -> { stack.push(n); counts[0]++; },
                n -> { Assert.assertSame(stack.pop(), n); counts[1]++; });
        Assert.assertTrue(stack.isEmpty());
        Assert.assertEquals(counts[0], counts[1]);
        Assert.assertTrue(counts[0] > 10);
    }

    @Test
    public void testSelfReferentialStruct() {
        // struct node { struct node *next; int value; }
        CType node = CType.tagged(CTypeKind.STRUCT, "node");
        CDeclaration next = new CDeclaration("next", node.pointer());
        CDeclaration value = new CDeclaration("value", CType.basic(CTypeKind.INT));
        node.addDeclaration(next);
        node.addDeclaration(value);

        Walker walker = new Walker(n -> {}, n -> {});
        walker.apply(node);
        // node, next, node *, value, int
        Assert.assertEquals(5, walker.visitedCount());

        List<ICNode> exited = new ArrayList<>();
        Walker.walkPostorder(node, exited::add);
        Assert.assertSame(node, exited.get(exited.size() - 1));
    }

    @Test
    public void testDerivedLinksNotFollowed() {
        CDeclaration decl = new CDeclaration("x", CType.basic(CTypeKind.INT));
        CExpression x = CExpression.name("x");
        x.resolve(decl);
        x.setInferredType(CType.basic(CTypeKind.INT));
        CProgram program = new CProgram(decl);

        List<ICNode> entered = new ArrayList<>();
        Walker.walkPreorder(x, entered::add);
        Assert.assertFalse(entered.contains(decl));
        Assert.assertFalse(entered.contains(x.getInferredType()));
        Assert.assertSame(decl, program.lookup("x"));
    }

    @Test
    public void testMemberDeclarationNotFollowed() {
        CDeclaration member = new CDeclaration("x", CType.basic(CTypeKind.INT));
        CPrefix prefix = CPrefix.dot("x");
        prefix.setDeclaration(member);
        CInitializer init = new CInitializer(CExpression.number(1)).designated(prefix);

        List<ICNode> entered = new ArrayList<>();
        Walker.walkPreorder(init, entered::add);
        Assert.assertTrue(entered.contains(prefix));
        Assert.assertFalse(entered.contains(member));
        Assert.assertSame(member, prefix.getDeclaration());
        Assert.assertThrows(InternalCompilerError.class,
                () -> CPrefix.index(CExpression.number(0)).setDeclaration(member));
    }

    @Test
    public void testBackReferenceCycle() {
        // int x = x + 1, with the use of x resolved to the declaration holding it
        CExpression use = CExpression.name("x");
        CDeclaration decl = new CDeclaration("x", CType.basic(CTypeKind.INT),
                new CInitializer(use.binary(CExprOp.ADD, CExpression.number(1))));
        use.resolve(decl);
        int[] count = new int[1];
        Walker.walkPreorder(decl, n -> count[0]++);
        Walker walker = new Walker(n -> {}, n -> {});
        walker.apply(decl);
        Assert.assertEquals(count[0], walker.visitedCount());
    }

    @Test
    public void testVisitedSetIsPerCall() {
        CExpression e = CExpression.name("a").binary(CExprOp.SUB, CExpression.name("b"));
        int[] first = new int[1];
        int[] second = new int[1];
        Walker.walkPreorder(e, n -> first[0]++);
        Walker.walkPreorder(e, n -> second[0]++);
        Assert.assertEquals(first[0], second[0]);
        Assert.assertTrue(first[0] > 0);
    }

    @Test
    public void testStopWithFlag() {
        CExpression a = CExpression.name("a");
        CExpression b = CExpression.name("b");
        CExpression e = a.binary(CExprOp.ADD, b).binary(CExprOp.MUL, CExpression.name("c"));
        List<ICNode> seen = new ArrayList<>();
        boolean[] done = new boolean[1];
        Walker.walkPreorder(e, n -> {
            if (done[0])
                return;
            seen.add(n);
            if (n == b)
                done[0] = true;
        });
        Assert.assertSame(b, seen.get(seen.size() - 1));
        Assert.assertFalse(seen.contains(e.getChildren().get(1)));
    }
}
