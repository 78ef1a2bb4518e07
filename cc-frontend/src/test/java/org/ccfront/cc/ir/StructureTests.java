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

import org.ccfront.cc.compiler.errors.InternalCompilerError;
import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.ir.expression.CExprOp;
import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.cc.ir.literal.CSymbolLiteral;
import org.ccfront.cc.ir.statement.CLabel;
import org.ccfront.cc.ir.statement.CLabelKind;
import org.ccfront.cc.ir.statement.CStatement;
import org.ccfront.cc.ir.statement.CStatementKind;
import org.ccfront.cc.ir.type.CQualifier;
import org.ccfront.cc.ir.type.CType;
import org.ccfront.cc.ir.type.CTypeKind;
import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

/** Slot layout and validation of declarations, types, statements and initializers. */
public class StructureTests {
    static final CType INT = CType.basic(CTypeKind.INT);

    @Test
    public void testStatementChildren() {
        CExpression cond = CExpression.name("c");
        CStatement then = CStatement.breakStatement();
        CStatement otherwise = CStatement.continueStatement();
        CLabel label = CLabel.named("top");
        CStatement ifThen = CStatement.ifThen(cond, then, otherwise).labeled(label);
        Assert.assertEquals(List.of(cond, then, otherwise, label), ifThen.getChildren());

        CExpression pre = CExpression.name("i").assign(CExpression.number(0));
        CExpression test = CExpression.name("i").binary(CExprOp.LT, CExpression.number(3));
        CExpression post = CExpression.name("i").unary(CExprOp.PRE_INC);
        CStatement body = CStatement.block();
        Assert.assertEquals(List.of(pre, test, post, body), CStatement.forLoop(pre, test, post, body).getChildren());

        CStatement jump = CStatement.gotoLabel("top");
        Assert.assertEquals(1, jump.getChildren().size());
        Assert.assertTrue(jump.getChildren().get(0) instanceof CSymbolLiteral);
    }

    @Test
    public void testStatementValidation() {
        CExpression x = CExpression.name("x");
        Assert.assertThrows(InternalCompilerError.class, () -> new CStatement(SourcePositionRange.INVALID,
                CStatementKind.IF, null, null, null, null, CStatement.empty(), null, null,
                Collections.emptyList(), Collections.emptyList()));
        Assert.assertThrows(InternalCompilerError.class, () -> new CStatement(SourcePositionRange.INVALID,
                CStatementKind.BREAK, null, x, null, null, null, null, null,
                Collections.emptyList(), Collections.emptyList()));
        Assert.assertThrows(InternalCompilerError.class, () -> new CStatement(SourcePositionRange.INVALID,
                CStatementKind.WHILE, null, x, null, null, CStatement.empty(), CStatement.empty(), null,
                Collections.emptyList(), Collections.emptyList()));
        Assert.assertThrows(InternalCompilerError.class, () -> new CStatement(SourcePositionRange.INVALID,
                CStatementKind.EXPR, null, x, null, null, null, null, null,
                List.of(CStatement.empty()), Collections.emptyList()));
        Assert.assertThrows(InternalCompilerError.class, () -> new CStatement(SourcePositionRange.INVALID,
                CStatementKind.FOR, x, null, null, new CDeclaration("i", INT), CStatement.empty(), null, null,
                Collections.emptyList(), Collections.emptyList()));
    }

    @Test
    public void testLabels() {
        CExpression one = CExpression.number(1);
        Assert.assertEquals(List.of(one), CLabel.caseLabel(one).getChildren());
        Assert.assertTrue(CLabel.defaultLabel().getChildren().isEmpty());
        Assert.assertThrows(InternalCompilerError.class, () -> new CLabel(SourcePositionRange.INVALID,
                CLabelKind.CASE, null, null));
        Assert.assertThrows(InternalCompilerError.class, () -> new CLabel(SourcePositionRange.INVALID,
                CLabelKind.DEFAULT, null, one));
        Assert.assertThrows(InternalCompilerError.class, () -> new CLabel(SourcePositionRange.INVALID,
                CLabelKind.NAME, null, null));
    }

    @Test
    public void testTypes() {
        CExpression three = CExpression.number(3);
        CType array = INT.array(three);
        Assert.assertEquals(List.of(INT, three), array.getChildren());
        CDeclaration param = new CDeclaration("x", INT);
        CType function = CType.function(INT, true, param);
        Assert.assertEquals(List.of(INT, param), function.getChildren());
        Assert.assertTrue(CType.named("size_t").getChildren().isEmpty());
        Assert.assertTrue(INT.qualified(CQualifier.CONST).isConst());

        Assert.assertThrows(InternalCompilerError.class, () -> new CType(SourcePositionRange.INVALID,
                CTypeKind.POINTER, EnumSet.noneOf(CQualifier.class), null, null,
                Collections.emptyList(), null, false));
        Assert.assertThrows(InternalCompilerError.class, () -> new CType(SourcePositionRange.INVALID,
                CTypeKind.INT, EnumSet.noneOf(CQualifier.class), null, null,
                Collections.emptyList(), three, false));
        Assert.assertThrows(InternalCompilerError.class, () -> INT.addDeclaration(param));
        Assert.assertThrows(IllegalArgumentException.class, () -> CType.basic(CTypeKind.POINTER));
        Assert.assertThrows(IllegalArgumentException.class, () -> CType.tagged(CTypeKind.INT, "x"));
    }

    @Test
    public void testTypedefResolution() {
        CType name = CType.named("real");
        CDeclaration typedef = new CDeclaration("real", CType.basic(CTypeKind.DOUBLE))
                .withStorage(CStorageClass.TYPEDEF);
        Assert.assertTrue(typedef.isTypedef());
        name.setTypedefDeclaration(typedef);
        Assert.assertSame(typedef, name.getTypedefDeclaration());
        Assert.assertFalse(name.getChildren().contains(typedef));
        Assert.assertThrows(InternalCompilerError.class, () -> INT.setTypedefDeclaration(typedef));
        Assert.assertTrue(CStorageClass.SHARED.isCuda());
        Assert.assertFalse(CStorageClass.STATIC.isCuda());
    }

    @Test
    public void testDeclarations() {
        CInitializer init = new CInitializer(CExpression.number(1));
        CDeclaration x = new CDeclaration("x", INT, init);
        Assert.assertEquals(List.of(INT, init), x.getChildren());
        CType function = CType.function(INT, false);
        CStatement body = CStatement.block();
        Assert.assertEquals(List.of(function, body), CDeclaration.function("f", function, body).getChildren());

        Assert.assertThrows(InternalCompilerError.class, () -> CDeclaration.function("f", INT, body));
        Assert.assertThrows(InternalCompilerError.class,
                () -> CDeclaration.function("f", function, CStatement.empty()));
        Assert.assertThrows(InternalCompilerError.class, () -> new CDeclaration("", INT));
    }

    @Test
    public void testInitializers() {
        CExpression one = CExpression.number(1);
        CPrefix field = CPrefix.dot("x");
        CInitializer designated = new CInitializer(one).designated(field);
        Assert.assertEquals(List.of(field, one), designated.getChildren());
        Assert.assertTrue(field.getChildren().isEmpty());
        CExpression index = CExpression.number(0);
        Assert.assertEquals(List.of(index), CPrefix.index(index).getChildren());
        CInitializer braced = CInitializer.braced(designated);
        Assert.assertTrue(braced.isBraced());
        Assert.assertEquals(List.of(designated), braced.getChildren());

        Assert.assertThrows(InternalCompilerError.class, () -> new CPrefix(SourcePositionRange.INVALID, null, null));
        Assert.assertThrows(InternalCompilerError.class, () -> new CPrefix(SourcePositionRange.INVALID,
                new CSymbolLiteral("x"), index));
        Assert.assertThrows(InternalCompilerError.class, () -> new CInitializer(SourcePositionRange.INVALID,
                Collections.emptyList(), one, List.of()));
    }
}
