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

package org.ccfront.cc.compiler.backend;

import org.ccfront.cc.compiler.errors.InternalCompilerError;
import org.ccfront.cc.ir.CComments;
import org.ccfront.cc.ir.CDeclaration;
import org.ccfront.cc.ir.CInitializer;
import org.ccfront.cc.ir.CPrefix;
import org.ccfront.cc.ir.CProgram;
import org.ccfront.cc.ir.CStorageClass;
import org.ccfront.cc.ir.ICNode;
import org.ccfront.cc.ir.expression.CCallExpression;
import org.ccfront.cc.ir.expression.CCommaExpression;
import org.ccfront.cc.ir.expression.CCompoundLiteralExpression;
import org.ccfront.cc.ir.expression.CExprOp;
import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.cc.ir.expression.CNumberExpression;
import org.ccfront.cc.ir.expression.COffsetofExpression;
import org.ccfront.cc.ir.expression.CSizeofTypeExpression;
import org.ccfront.cc.ir.expression.CVaArgExpression;
import org.ccfront.cc.ir.literal.CCharLiteral;
import org.ccfront.cc.ir.literal.CIntegerLiteral;
import org.ccfront.cc.ir.literal.CLiteral;
import org.ccfront.cc.ir.literal.CRealLiteral;
import org.ccfront.cc.ir.literal.CStringLiteral;
import org.ccfront.cc.ir.statement.CLabel;
import org.ccfront.cc.ir.statement.CStatement;
import org.ccfront.cc.ir.type.CQualifier;
import org.ccfront.cc.ir.type.CType;
import org.ccfront.cc.ir.type.CTypeKind;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class ToCVisitorTests {
    static final CType INT = CType.basic(CTypeKind.INT);

    static CExpression v(String name) {
        return CExpression.name(name);
    }

    static CExpression n(long value) {
        return CExpression.number(value);
    }

    static String render(ICNode node) {
        return ToCVisitor.toCString(node, CRenderOptions.DEFAULT);
    }

    static String compact(ICNode node) {
        return ToCVisitor.toCString(node, CRenderOptions.COMPACT);
    }

    @Test
    public void testLiterals() {
        List<CLiteral> literals = List.of(
                new CIntegerLiteral("0x1fUL"),
                new CRealLiteral("1.5e-3f"),
                new CCharLiteral("'\\n'"),
                new CStringLiteral("L\"wide\""));
        for (CLiteral literal: literals) {
            Assert.assertEquals(literal.getText(), literal.toString());
            Assert.assertEquals(literal.toString(), literal.toString());
        }
        Assert.assertEquals("'\\n'", CNumberExpression.character('\n').toString());
        Assert.assertEquals("'\"'", CNumberExpression.character('"').toString());
        Assert.assertEquals("\"a\\\"b\"", CExpression.string("a\"b").toString());
        Assert.assertEquals("42", n(42).toString());
    }

    @Test
    public void testBinaryPrecedence() {
        CExpression a = v("a");
        CExpression b = v("b");
        CExpression c = v("c");
        Assert.assertEquals("a + b * c", a.binary(CExprOp.ADD, b.binary(CExprOp.MUL, c)).toString());
        Assert.assertEquals("(a + b) * c", a.binary(CExprOp.ADD, b).binary(CExprOp.MUL, c).toString());
        Assert.assertEquals("a - b - c", a.binary(CExprOp.SUB, b).binary(CExprOp.SUB, c).toString());
        Assert.assertEquals("a - (b - c)", a.binary(CExprOp.SUB, b.binary(CExprOp.SUB, c)).toString());
        Assert.assertEquals("a << 2 < b", a.binary(CExprOp.LSH, n(2)).binary(CExprOp.LT, b).toString());
        Assert.assertEquals("a && (b || c)",
                a.binary(CExprOp.AND_AND, b.binary(CExprOp.OR_OR, c)).toString());
        Assert.assertEquals("(a & b) == c", a.binary(CExprOp.AND, b).binary(CExprOp.EQ_EQ, c).toString());
        Assert.assertEquals("a & b == c", a.binary(CExprOp.AND, b.binary(CExprOp.EQ_EQ, c)).toString());
    }

    @Test
    public void testAssignmentIsRightAssociative() {
        CExpression a = v("a");
        CExpression b = v("b");
        CExpression c = v("c");
        Assert.assertEquals("a = b = c", a.assign(b.assign(c)).toString());
        Assert.assertEquals("(a = b) = c", a.assign(b).assign(c).toString());
        Assert.assertEquals("a += b * 2",
                a.binary(CExprOp.ADD_EQ, b.binary(CExprOp.MUL, n(2))).toString());
    }

    @Test
    public void testConditional() {
        CExpression a = v("a");
        CExpression b = v("b");
        CExpression c = v("c");
        CExpression d = v("d");
        CExpression e = v("e");
        Assert.assertEquals("a ? b : c ? d : e",
                CExpression.conditional(a, b, CExpression.conditional(c, d, e)).toString());
        Assert.assertEquals("(a ? b : c) ? d : e",
                CExpression.conditional(CExpression.conditional(a, b, c), d, e).toString());
        Assert.assertEquals("x = a ? b : c",
                v("x").assign(CExpression.conditional(a, b, c)).toString());
        Assert.assertEquals("a ? b = c : d",
                CExpression.conditional(a, b.assign(c), d).toString());
    }

    @Test
    public void testUnary() {
        CExpression x = v("x");
        CExpression p = v("p");
        Assert.assertEquals("- -x", x.unary(CExprOp.MINUS).unary(CExprOp.MINUS).toString());
        Assert.assertEquals("-x", x.unary(CExprOp.MINUS).toString());
        Assert.assertEquals("!!x", x.not().not().toString());
        Assert.assertEquals("*p++", p.unary(CExprOp.POST_INC).deref().toString());
        Assert.assertEquals("(*p)++", p.deref().unary(CExprOp.POST_INC).toString());
        Assert.assertEquals("&a[1]", v("a").index(n(1)).addressOf().toString());
        Assert.assertEquals("-(a + b)", v("a").binary(CExprOp.ADD, v("b")).unary(CExprOp.MINUS).toString());
        Assert.assertEquals("(x)", x.paren().toString());
        Assert.assertEquals("sizeof(x)", x.unary(CExprOp.SIZEOF_EXPR).toString());
        Assert.assertEquals("sizeof(int)", new CSizeofTypeExpression(INT).toString());
    }

    @Test
    public void testPostfix() {
        CExpression p = v("p");
        Assert.assertEquals("p->next->value", p.arrow("next").arrow("value").toString());
        Assert.assertEquals("(*p).x", p.deref().dot("x").toString());
        Assert.assertEquals("a[i + 1]", v("a").index(v("i").binary(CExprOp.ADD, n(1))).toString());
        Assert.assertEquals("f(a, b + 1)", v("f").call(v("a"), v("b").binary(CExprOp.ADD, n(1))).toString());
        Assert.assertEquals("f((a, b))", v("f").call(new CCommaExpression(v("a"), v("b"))).toString());
        Assert.assertEquals("a, b = c", new CCommaExpression(v("a"), v("b").assign(v("c"))).toString());
        Assert.assertEquals("(*fp)(x)", v("fp").deref().call(v("x")).toString());
    }

    @Test
    public void testKernelLaunch() {
        CCallExpression launch = CCallExpression.launch(v("kernel"),
                List.of(v("grid"), v("block")), List.of(v("data"), v("n")));
        Assert.assertEquals("kernel<<<grid, block>>>(data, n)", launch.toString());
    }

    @Test
    public void testCasts() {
        Assert.assertEquals("(int) x", CExpression.cast(INT, v("x")).toString());
        Assert.assertEquals("(int) (a + b)",
                CExpression.cast(INT, v("a").binary(CExprOp.ADD, v("b"))).toString());
        Assert.assertEquals("(int) (char) c",
                CExpression.cast(INT, CExpression.cast(CType.basic(CTypeKind.CHAR), v("c"))).toString());
        Assert.assertEquals("(float *) q",
                CExpression.cast(CType.basic(CTypeKind.FLOAT).pointer(), v("q")).toString());
        Assert.assertEquals("((int) x)->f", CExpression.cast(INT, v("x")).arrow("f").toString());
        Assert.assertEquals("(unsigned long) sizeof(x)",
                CExpression.cast(CType.basic(CTypeKind.ULONG), v("x").unary(CExprOp.SIZEOF_EXPR)).toString());
    }

    @Test
    public void testCompoundLiteral() {
        CCompoundLiteralExpression point = new CCompoundLiteralExpression(
                CType.named("Point"), CInitializer.braced(n(1), n(2)));
        Assert.assertEquals("(Point){1,2}", point.toString());
        Assert.assertEquals("(Point){1,2}.x", point.dot("x").toString());
        CInitializer designated = CInitializer.braced(
                new CInitializer(n(1)).designated(CPrefix.dot("x")),
                new CInitializer(n(2)).designated(CPrefix.dot("pos"), CPrefix.index(n(0))));
        Assert.assertEquals("{.x = 1,.pos[0] = 2}", designated.toString());
    }

    @Test
    public void testOtherPrimaries() {
        Assert.assertEquals("offsetof(struct S, x)",
                new COffsetofExpression(CType.tagged(CTypeKind.STRUCT, "S"), v("x")).toString());
        Assert.assertEquals("va_arg(ap, int)", new CVaArgExpression(v("ap"), INT).toString());
        Assert.assertEquals("\"hi\"", CExpression.string("hi").toString());
    }

    @Test
    public void testDeclarators() {
        Assert.assertEquals("int *p[3]",
                new CDeclaration("p", INT.pointer().array(n(3))).toString());
        Assert.assertEquals("int (*p)[3]",
                new CDeclaration("p", INT.array(n(3)).pointer()).toString());
        Assert.assertEquals("int a[]", new CDeclaration("a", INT.array(null)).toString());
        Assert.assertEquals("int (*fp)(int x)",
                new CDeclaration("fp", CType.function(INT, false, new CDeclaration("x", INT)).pointer()).toString());
        CType fmt = CType.basic(CTypeKind.CHAR).qualified(CQualifier.CONST).pointer();
        Assert.assertEquals("int printf(const char *fmt, ...)",
                new CDeclaration("printf", CType.function(INT, true, new CDeclaration("fmt", fmt))).toString());
        Assert.assertEquals("int *const p",
                new CDeclaration("p", INT.pointer().qualified(CQualifier.CONST)).toString());
        Assert.assertEquals("static int x = 1",
                new CDeclaration("x", INT, new CInitializer(n(1))).withStorage(CStorageClass.STATIC).toString());
        Assert.assertEquals("int m[2][3]",
                new CDeclaration("m", INT.array(n(3)).array(n(2))).toString());
    }

    @Test
    public void testTaggedTypes() {
        CType point = CType.tagged(CTypeKind.STRUCT, "Point",
                new CDeclaration("x", INT), new CDeclaration("y", INT));
        Assert.assertEquals("struct Point {\n    int x;\n    int y;\n}",
                new CDeclaration(null, point).toString());

        CType node = CType.tagged(CTypeKind.STRUCT, "node");
        node.addDeclaration(new CDeclaration("next", node.pointer()));
        Assert.assertEquals("struct node {\n    struct node *next;\n}", node.toString());

        CType color = CType.tagged(CTypeKind.ENUM, "Color",
                new CDeclaration("RED", null),
                new CDeclaration("GREEN", null, new CInitializer(n(2))));
        Assert.assertEquals("enum Color {\n    RED,\n    GREEN = 2\n}", color.toString());

        Assert.assertThrows(InternalCompilerError.class,
                () -> new CDeclaration(null, CType.tagged(CTypeKind.UNION, null)).toString());
    }

    @Test
    public void testStatements() {
        CExpression x = v("x");
        CStatement ifElse = CStatement.ifThen(x,
                CStatement.block(v("y").assign(n(1)).toStatement()),
                CStatement.block(CStatement.returnStatement(null)));
        Assert.assertEquals("if (x) {\n    y = 1;\n} else {\n    return;\n}", ifElse.toString());

        Assert.assertEquals("if (x)\n    break;",
                CStatement.ifThen(x, CStatement.breakStatement(), null).toString());

        CStatement chain = CStatement.ifThen(v("a"),
                CStatement.block(v("f").call().toStatement()),
                CStatement.ifThen(v("b"),
                        CStatement.block(v("g").call().toStatement()),
                        CStatement.block(v("h").call().toStatement())));
        Assert.assertEquals("if (a) {\n    f();\n} else if (b) {\n    g();\n} else {\n    h();\n}",
                chain.toString());

        CExpression i = v("i");
        CExpression less = i.binary(CExprOp.LT, v("n"));
        CStatement increment = i.unary(CExprOp.POST_INC).toStatement();
        Assert.assertEquals("while (i < n) {\n    i++;\n}",
                CStatement.whileLoop(less, CStatement.block(increment)).toString());
        Assert.assertEquals("do {\n    i++;\n} while (i < n);",
                CStatement.doWhile(CStatement.block(increment), less).toString());

        CStatement loop = CStatement.forLoop(new CDeclaration("i", INT, new CInitializer(n(0))),
                i.binary(CExprOp.LT, n(10)), i.unary(CExprOp.POST_INC),
                CStatement.block(v("f").call(i).toStatement()));
        Assert.assertEquals("for (int i = 0; i < 10; i++) {\n    f(i);\n}", loop.toString());
        Assert.assertEquals("for (;;) {}",
                CStatement.forLoop((CExpression) null, null, null, CStatement.block()).toString());
    }

    @Test
    public void testLabels() {
        CStatement body = CStatement.block(
                v("f").call().toStatement().labeled(CLabel.caseLabel(n(1))),
                CStatement.breakStatement(),
                CStatement.returnStatement(null).labeled(CLabel.defaultLabel()));
        Assert.assertEquals("switch (x) {\n    case 1:\n    f();\n    break;\n    default:\n    return;\n}",
                CStatement.switchOn(v("x"), body).toString());
        Assert.assertEquals("goto done;", CStatement.gotoLabel("done").toString());
        Assert.assertEquals("done:\n;", CStatement.empty().labeled(CLabel.named("done")).toString());
    }

    @Test
    public void testProgram() {
        CDeclaration global = new CDeclaration("x", INT, new CInitializer(n(1)));
        CDeclaration main = CDeclaration.function("main", CType.function(INT, false),
                CStatement.block(CStatement.returnStatement(n(0))));
        CDeclaration kernel = CDeclaration.function("scale",
                CType.function(CType.basic(CTypeKind.VOID), false,
                        new CDeclaration("data", CType.basic(CTypeKind.FLOAT).pointer())),
                CStatement.block(), CStorageClass.GLOBAL);
        Assert.assertTrue(kernel.isKernel());
        CProgram program = new CProgram(global, main, kernel);
        Assert.assertEquals("int x = 1;\nint main() {\n    return 0;\n}\n__global__ void scale(float *data) {}\n",
                program.toString());
        Assert.assertSame(main, program.lookup("main"));
        Assert.assertNull(program.lookup("missing"));
    }

    @Test
    public void testComments() {
        CExpression x = v("x");
        x.setComments(CComments.before("/* a */"));
        Assert.assertEquals("/* a */ x", render(x));
        Assert.assertEquals("x", x.toString());

        CStatement assign = v("y").assign(n(1)).toStatement();
        assign.setComments(new CComments(List.of("// init"), List.of("// done")));
        Assert.assertEquals("// init\ny = 1; // done", render(assign));
        Assert.assertEquals("y = 1;", assign.toString());

        CExpression a = v("a");
        a.setComments(CComments.suffix("// first"));
        Assert.assertEquals("a // first\n+ b", render(a.binary(CExprOp.ADD, v("b"))));
    }

    @Test
    public void testCompact() {
        CExpression a = v("a");
        CExpression b = v("b");
        Assert.assertEquals("a+b*c", compact(a.binary(CExprOp.ADD, b.binary(CExprOp.MUL, v("c")))));
        Assert.assertEquals("a- -b", compact(a.binary(CExprOp.SUB, b.unary(CExprOp.MINUS))));
        Assert.assertEquals("a+ ++b", compact(a.binary(CExprOp.ADD, b.unary(CExprOp.PRE_INC))));
        Assert.assertEquals("a&&b", compact(a.binary(CExprOp.AND_AND, b)));
        Assert.assertEquals("{ x = 1; y = 2; }", compact(CStatement.block(
                v("x").assign(n(1)).toStatement(), v("y").assign(n(2)).toStatement())));
        Assert.assertEquals("if (x) return;",
                compact(CStatement.ifThen(v("x"), CStatement.returnStatement(null), null)));
    }

    @Test
    public void testNegativeNumbers() {
        CExpression minusOne = CExpression.number(-1);
        Assert.assertEquals(CExprOp.MINUS, minusOne.op);
        Assert.assertEquals("-1", minusOne.toString());
        Assert.assertEquals("a- -1", compact(v("a").binary(CExprOp.SUB, minusOne)));
        Assert.assertEquals("-9223372036854775808", CExpression.number(Long.MIN_VALUE).toString());
        Assert.assertEquals("0", CExpression.number(0).toString());
    }

    @Test
    public void testDanglingElse() {
        // if (a) { if (b) x; } else y;
        CStatement inner = CStatement.ifThen(v("b"), v("x").toStatement(), null);
        CStatement outer = CStatement.ifThen(v("a"), inner, v("y").toStatement());
        Assert.assertEquals("if (a) {\n    if (b)\n        x;\n} else\n    y;", outer.toString());
        Assert.assertEquals("if (a) { if (b) x; } else y;", compact(outer));

        // The open if may sit at the end of an else chain or inside a loop
        CStatement chain = CStatement.ifThen(v("b"), v("x").toStatement(),
                CStatement.ifThen(v("c"), v("z").toStatement(), null));
        Assert.assertEquals("if (a) { if (b) x; else if (c) z; } else y;",
                compact(CStatement.ifThen(v("a"), chain, v("y").toStatement())));
        CStatement loop = CStatement.whileLoop(v("c"), inner);
        Assert.assertEquals("if (a) { while (c) if (b) x; } else y;",
                compact(CStatement.ifThen(v("a"), loop, v("y").toStatement())));

        // Closed bodies and an outer if without else need no braces
        CStatement closed = CStatement.ifThen(v("b"), v("x").toStatement(), v("z").toStatement());
        Assert.assertEquals("if (a) if (b) x; else z; else y;",
                compact(CStatement.ifThen(v("a"), closed, v("y").toStatement())));
        Assert.assertEquals("if (a) if (b) x;", compact(CStatement.ifThen(v("a"), inner, null)));
    }

    @Test
    public void testOptions() {
        CRenderOptions options = CRenderOptions.DEFAULT.withIndentAmount(2).withHideComments(true);
        Assert.assertEquals(2, options.indentAmount);
        Assert.assertTrue(options.hideComments);
        CStatement block = CStatement.block(CStatement.breakStatement());
        Assert.assertEquals("{\n  break;\n}", ToCVisitor.toCString(block, options));
        Assert.assertThrows(InternalCompilerError.class, () -> CRenderOptions.DEFAULT.withIndentAmount(-1));
    }
}
