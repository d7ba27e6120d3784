/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.astpos.tree;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.astpos.tree.Node.Prop;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testFile() {
    Node func = IR.funcDecl("main", IR.funcType(), IR.block());
    Node file = IR.file("main", func);
    assertThat(file.getFirstChild().getString()).isEqualTo("main");
    assertThat(file.getSecondChild()).isSameInstanceAs(func);
    assertThrows(IllegalStateException.class, () -> IR.file("main", IR.block()));
  }

  @Test
  public void testDeclarationGroups() {
    Node group = IR.group(Token.IMPORT, IR.importSpec("fmt"), IR.importSpec("f", "os"));
    assertThat(group.getBooleanProp(Prop.PARENTHESIZED)).isTrue();
    assertThat(group.getChildCount()).isEqualTo(2);
    assertThat(group.getFirstChild().getFirstChild().isEmpty()).isTrue();
    assertThat(group.getSecondChild().getFirstChild().getString()).isEqualTo("f");

    Node decl = IR.decl(Token.CONST, IR.valueSpec("n", null, IR.number(1)));
    assertThat(decl.getBooleanProp(Prop.PARENTHESIZED)).isFalse();

    assertThrows(
        IllegalStateException.class, () -> IR.decl(Token.TYPE, IR.importSpec("fmt")));
    assertThrows(
        IllegalArgumentException.class,
        () -> IR.decl(Token.FUNC_DECL, IR.typeSpec("T", IR.name("int"))));
  }

  @Test
  public void testValueSpec() {
    Node spec =
        IR.valueSpec(
            ImmutableList.of(IR.name("a"), IR.name("b")),
            IR.name("int"),
            ImmutableList.of(IR.number(1), IR.number(2)));
    assertThat(spec.getFirstChild().getChildCount()).isEqualTo(2);
    assertThat(spec.getSecondChild().getString()).isEqualTo("int");
    assertThat(spec.getLastChild().getChildCount()).isEqualTo(2);

    Node bare = IR.valueSpec("x", IR.name("int"), null);
    assertThat(bare.getLastChild().hasChildren()).isFalse();
    assertThrows(
        IllegalArgumentException.class,
        () -> IR.valueSpec(ImmutableList.<Node>of(), null, ImmutableList.of(IR.number(1))));
  }

  @Test
  public void testFuncDecl() {
    Node recv = IR.fieldList(IR.field("t", IR.star(IR.name("T"))));
    Node type = IR.funcType(IR.fieldList(), IR.bareResult(IR.name("string")));
    Node decl = IR.funcDecl(recv, "String", type, null);
    assertThat(decl.getFirstChild()).isSameInstanceAs(recv);
    assertThat(decl.getChildAtIndex(1).getString()).isEqualTo("String");
    assertThat(decl.getChildAtIndex(2).isFuncType()).isTrue();
    assertThat(decl.getLastChild().isEmpty()).isTrue();

    Node results = decl.getChildAtIndex(2).getLastChild();
    assertThat(results.getBooleanProp(Prop.DELIMITED)).isFalse();
  }

  @Test
  public void testString() {
    assertThat(IR.string("a\"b\\c\n").getString()).isEqualTo("\"a\\\"b\\\\c\\n\"");
    assertThat(IR.number(-3).getString()).isEqualTo("-3");
    assertThrows(IllegalArgumentException.class, () -> IR.literal(""));
    assertThrows(IllegalArgumentException.class, () -> IR.name(""));
  }

  @Test
  public void testQualifiedName() {
    Node n = IR.qualifiedName("a", "b", "c");
    assertThat(n.getToken()).isEqualTo(Token.SELECTOR);
    assertThat(n.getLastChild().getString()).isEqualTo("c");
    assertThat(n.getFirstChild().getToken()).isEqualTo(Token.SELECTOR);
  }

  @Test
  public void testOperatorsChecked() {
    assertThrows(
        IllegalArgumentException.class,
        () -> IR.binary(Operator.NOT, IR.name("a"), IR.name("b")));
    assertThrows(IllegalArgumentException.class, () -> IR.unary(Operator.MUL, IR.name("a")));
    assertThrows(IllegalArgumentException.class, () -> IR.incDec(IR.name("a"), Operator.ADD));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            IR.assign(
                Operator.EQL, ImmutableList.of(IR.name("a")), ImmutableList.of(IR.name("b"))));
    assertThat(IR.define(IR.name("a"), IR.number(1)).getOperator()).isEqualTo(Operator.DEFINE);
  }

  @Test
  public void testOperatorClasses() {
    assertThat(Operator.ADD.isBinary()).isTrue();
    assertThat(Operator.ADD.isUnary()).isTrue();
    assertThat(Operator.ARROW.isBinary()).isFalse();
    assertThat(Operator.ARROW.isUnary()).isTrue();
    assertThat(Operator.GEQ.isBinary()).isTrue();
    assertThat(Operator.ASSIGN.isBinary()).isFalse();
    assertThat(Operator.AND_NOT_ASSIGN.isAssignment()).isTrue();
    assertThat(Operator.INC.isAssignment()).isFalse();
    assertThat(Operator.DEC.isIncDec()).isTrue();
    assertThat(Operator.SHL_ASSIGN.toString()).isEqualTo("<<=");
  }

  @Test
  public void testSlice() {
    Node full = IR.slice(IR.name("s"), IR.number(1), IR.number(2), IR.number(3));
    assertThat(full.getChildCount()).isEqualTo(4);
    Node open = IR.slice(IR.name("s"), null, null);
    assertThat(open.getSecondChild().isEmpty()).isTrue();
    assertThat(open.getLastChild().isEmpty()).isTrue();
    assertThrows(
        IllegalArgumentException.class,
        () -> IR.slice(IR.name("s"), null, null, IR.number(3)));
  }

  @Test
  public void testBranch() {
    assertThat(IR.branch(Token.BREAK, null).getFirstChild().isEmpty()).isTrue();
    assertThat(IR.branch(Token.GOTO, "L").getFirstChild().getString()).isEqualTo("L");
    assertThrows(IllegalArgumentException.class, () -> IR.branch(Token.GOTO, null));
    assertThrows(IllegalArgumentException.class, () -> IR.branch(Token.FALLTHROUGH, "L"));
    assertThrows(IllegalArgumentException.class, () -> IR.branch(Token.RETURN, null));
  }

  @Test
  public void testRange() {
    Node range =
        IR.rangeStmt(IR.name("i"), null, Operator.DEFINE, IR.name("xs"), IR.block());
    assertThat(range.getOperator()).isEqualTo(Operator.DEFINE);
    assertThat(range.getSecondChild().isEmpty()).isTrue();
    assertThat(range.getRequiredSlots()).contains(Slot.OPERATOR);

    Node bare = IR.rangeStmt(null, null, null, IR.name("xs"), IR.block());
    assertThat(bare.getRequiredSlots()).doesNotContain(Slot.OPERATOR);

    assertThrows(
        IllegalArgumentException.class,
        () -> IR.rangeStmt(IR.name("i"), null, null, IR.name("xs"), IR.block()));
    assertThrows(
        IllegalArgumentException.class,
        () -> IR.rangeStmt(IR.name("i"), null, Operator.ADD_ASSIGN, IR.name("xs"), IR.block()));
  }

  @Test
  public void testSwitch() {
    Node sw =
        IR.switchStmt(
            null,
            IR.name("x"),
            IR.caseClause(ImmutableList.of(IR.number(1), IR.number(2)), IR.returnStmt()),
            IR.defaultClause());
    Node body = sw.getLastChild();
    assertThat(body.isBlock()).isTrue();
    assertThat(body.getChildCount()).isEqualTo(2);
    assertThat(body.getFirstChild().getFirstChild().isExprList()).isTrue();
    assertThat(body.getLastChild().getFirstChild().isEmpty()).isTrue();

    assertThrows(IllegalStateException.class, () -> IR.switchStmt(null, null, IR.commDefault()));
    assertThrows(IllegalArgumentException.class, () -> IR.caseClause(ImmutableList.<Node>of()));
  }

  @Test
  public void testStatementsChecked() {
    assertThrows(IllegalStateException.class, () -> IR.block(IR.name("x")));
    assertThrows(IllegalStateException.class, () -> IR.goStmt(IR.name("f")));
    assertThrows(
        IllegalStateException.class, () -> IR.declStmt(IR.decl(Token.IMPORT, IR.importSpec("a"))));
    assertThat(IR.implicitEmptyStmt().getBooleanProp(Prop.IMPLICIT)).isTrue();
  }

  @Test
  public void testShapePredicates() {
    assertThat(IR.mayBeType(IR.mapType(IR.name("string"), IR.name("int")))).isTrue();
    assertThat(IR.mayBeType(IR.number(1))).isFalse();
    assertThat(IR.mayBeExpression(IR.number(1))).isTrue();
    assertThat(IR.mayBeExpression(IR.block())).isFalse();
    assertThat(IR.mayBeStatement(IR.block())).isTrue();
    assertThat(IR.mayBeDeclaration(IR.funcDecl("f", IR.funcType(), IR.block()))).isTrue();
  }
}
