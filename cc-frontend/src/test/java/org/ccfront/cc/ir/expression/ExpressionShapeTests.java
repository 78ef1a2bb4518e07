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

import org.ccfront.cc.compiler.errors.InternalCompilerError;
import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.compiler.visitors.CInnerVisitor;
import org.ccfront.cc.compiler.visitors.VisitDecision;
import org.ccfront.cc.ir.CInitializer;
import org.ccfront.cc.ir.ICNode;
import org.ccfront.cc.ir.literal.CCharLiteral;
import org.ccfront.cc.ir.type.CType;
import org.ccfront.cc.ir.type.CTypeKind;
import org.ccfront.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Checks that every operator has a node class and the expected children. */
public class ExpressionShapeTests {
    final CExpression a = CExpression.name("a");
    final CExpression b = CExpression.name("b");
    final CExpression c = CExpression.name("c");
    final CExpression grid = CExpression.number(1);
    final CExpression block = CExpression.number(32);
    final CType type = CType.basic(CTypeKind.INT);

    CExpression build(CExprOp op) {
        return switch (op.shape) {
            case BINARY, ASSIGN -> new CBinaryExpression(op, this.a, this.b);
            case UNARY -> new CUnaryExpression(op, this.a);
            case MEMBER -> new CMemberExpression(op, this.a, "field");
            case CALL -> new CCallExpression(this.a, Arrays.asList(this.b, null, this.c));
            case KERNEL_CALL -> CCallExpression.launch(this.a, List.of(this.grid, this.block), List.of(this.b));
            case COMMA -> new CCommaExpression(this.a, this.b, this.c);
            case COND -> CExpression.conditional(this.a, this.b, this.c);
            case CAST -> CExpression.cast(this.type, this.a);
            case CAST_INIT -> new CCompoundLiteralExpression(this.type, CInitializer.braced(this.a, this.b));
            case INDEX -> this.a.index(this.b);
            case OFFSETOF -> new COffsetofExpression(this.type, this.a);
            case SIZEOF_TYPE -> new CSizeofTypeExpression(this.type);
            case VA_ARG -> new CVaArgExpression(this.a, this.type);
            case NAME -> CExpression.name("x");
            case NUMBER -> op == CExprOp.NUMBER ? CExpression.number(7) : CNumberExpression.character('c');
            case STRING -> CExpression.string("s");
            case MARKER -> new CKernelBracketExpression(op);
        };
    }

    List<ICNode> expectedChildren(CExprOp op) {
        return switch (op.shape) {
            case BINARY, ASSIGN, INDEX -> List.of(this.a, this.b);
            case UNARY, MEMBER -> List.of(this.a);
            case CALL, COMMA, COND -> List.of(this.a, this.b, this.c);
            case KERNEL_CALL -> List.of(this.a, this.b);
            case CAST, CAST_INIT, SIZEOF_TYPE -> List.of(this.type);
            case OFFSETOF -> List.of(this.type, this.a);
            case VA_ARG -> List.of(this.a, this.type);
            case NAME, NUMBER, STRING, MARKER -> Collections.emptyList();
        };
    }

    static List<Long> ids(List<? extends ICNode> nodes) {
        return Linq.map(nodes, ICNode::getId);
    }

    /** The nodes that accept visits directly below the root, in order. */
    static List<ICNode> acceptSlots(ICNode root) {
        List<ICNode> result = new ArrayList<>();
        CInnerVisitor visitor = new CInnerVisitor() {
            @Override
            public VisitDecision preorder(ICNode node) {
                if (node == root)
                    return VisitDecision.CONTINUE;
                result.add(node);
                return VisitDecision.STOP;
            }
        };
        visitor.apply(root);
        return result;
    }

    static boolean isSubsequence(List<Long> small, List<Long> large) {
        int index = 0;
        for (long id: large) {
            if (index < small.size() && small.get(index) == id)
                index++;
        }
        return index == small.size();
    }

    @Test
    public void testEveryOperatorHasAShape() {
        for (CExprOp op: CExprOp.values()) {
            CExpression expression = this.build(op);
            Assert.assertSame(op, expression.op);
            Assert.assertEquals(op.name(), ids(this.expectedChildren(op)), ids(expression.getChildren()));
            Assert.assertEquals(op.precedence, expression.getPrecedence());
        }
    }

    @Test
    public void testChildrenAreVisitedByAccept() {
        for (CExprOp op: CExprOp.values()) {
            CExpression expression = this.build(op);
            List<Long> children = ids(expression.getChildren());
            List<Long> slots = ids(acceptSlots(expression));
            Assert.assertTrue(op.name() + ": " + children + " not in " + slots,
                    isSubsequence(children, slots));
        }
    }

    @Test
    public void testKernelLaunchSlots() {
        CCallExpression launch = CCallExpression.launch(this.a, List.of(this.grid, this.block), List.of(this.b));
        Assert.assertTrue(launch.isKernelLaunch());
        Assert.assertEquals(ids(List.of(this.a, this.grid, this.block, this.b)), ids(acceptSlots(launch)));
        Assert.assertEquals(ids(List.of(this.a, this.b)), ids(launch.getChildren()));
    }

    @Test
    public void testConditionalChildOrder() {
        CConditionalExpression cond = CExpression.conditional(this.a, this.b, this.c);
        List<ICNode> children = cond.getChildren();
        Assert.assertEquals(3, children.size());
        Assert.assertSame(this.a, children.get(0));
        Assert.assertSame(this.b, children.get(1));
        Assert.assertSame(this.c, children.get(2));
        Assert.assertThrows(InternalCompilerError.class,
                () -> CExpression.conditional(this.a, this.b, null));
    }

    @Test
    public void testNullArgumentsAreSkipped() {
        CCallExpression call = new CCallExpression(this.a, Arrays.asList(null, this.b, null));
        Assert.assertEquals(ids(List.of(this.a, this.b)), ids(call.getChildren()));
        Assert.assertEquals(3, call.arguments.size());
    }

    @Test
    public void testClassesRefuseOtherOperators() {
        Assert.assertThrows(InternalCompilerError.class,
                () -> new CBinaryExpression(CExprOp.NOT, this.a, this.b));
        Assert.assertThrows(InternalCompilerError.class,
                () -> new CUnaryExpression(CExprOp.ADD, this.a));
        Assert.assertThrows(InternalCompilerError.class,
                () -> new CMemberExpression(CExprOp.INDEX, this.a, "f"));
        Assert.assertThrows(InternalCompilerError.class,
                () -> new CKernelBracketExpression(CExprOp.LCU_BRK_OP));
        Assert.assertThrows(InternalCompilerError.class,
                () -> new CNumberExpression(SourcePositionRange.INVALID, CExprOp.STRING, new CCharLiteral("'x'")));
    }

    @Test
    public void testMalformedShapes() {
        Assert.assertThrows(InternalCompilerError.class,
                () -> new CCallExpression(SourcePositionRange.INVALID, CExprOp.CALL,
                        this.a, List.of(this.grid), List.of()));
        Assert.assertThrows(InternalCompilerError.class,
                () -> CCallExpression.launch(this.a, List.of(), List.of(this.b)));
        Assert.assertThrows(InternalCompilerError.class,
                () -> new CNumberExpression(SourcePositionRange.INVALID, CExprOp.NUMBER, new CCharLiteral("'x'")));
        Assert.assertThrows(InternalCompilerError.class,
                () -> new CCommaExpression(this.a));
        Assert.assertThrows(InternalCompilerError.class,
                () -> new CCompoundLiteralExpression(this.type, new CInitializer(this.a)));
        Assert.assertThrows(InternalCompilerError.class,
                () -> new CStringExpression(SourcePositionRange.INVALID, List.of()));
    }

    @Test
    public void testAssociativity() {
        Assert.assertTrue(CExprOp.EQ.isRightAssociative());
        Assert.assertTrue(CExprOp.LSH_EQ.isRightAssociative());
        Assert.assertTrue(CExprOp.COND.isRightAssociative());
        Assert.assertFalse(CExprOp.SUB.isRightAssociative());
        Assert.assertFalse(CExprOp.POST_INC.isRightAssociative());
        Assert.assertTrue(CExprOp.POST_INC.isPostfix());
        Assert.assertEquals("NAME", CExprOp.NAME.toString());
        Assert.assertEquals("<<<", CExprOp.LCU_BRK_OP.toString());
    }
}
