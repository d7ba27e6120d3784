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

package com.google.astpos;

import com.google.astpos.tree.CommentGroup;
import com.google.astpos.tree.IR;
import com.google.astpos.tree.Node;
import com.google.astpos.tree.Operator;
import com.google.astpos.tree.Token;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** Trees shared by the synthesizer tests. Each call returns a fresh, unpositioned tree. */
final class SampleFiles {

  /** The layout preview of {@link #sample()}. */
  static final String SAMPLE_LAYOUT =
      Joiner.on('\n')
          .join(
              "// Package sample shows layout.",
              "package sample",
              "import (",
              "\"fmt\"",
              "\"os\"",
              ")",
              "// Point is a point.",
              "type Point struct {",
              "// X is horizontal.",
              "X int",
              "Y int",
              "}",
              "",
              "const limit 10",
              "var names [ ] string { \"a\" \"b\" \"c\" }",
              "// Main runs.",
              "// It prints.",
              "func main ( ) {",
              "p := Point {",
              "X : 1",
              "Y : 2",
              "}",
              "for i := range names {",
              "fmt Println ( i p )",
              "}",
              "if len ( os Args ) > 1 {",
              "return",
              "}",
              "}",
              "",
              "");

  private SampleFiles() {}

  /** A file using imports, a documented struct, constants, a literal and a function. */
  static Node sample() {
    Node pointDecl =
        IR.decl(
            Token.TYPE,
            IR.typeSpec(
                "Point",
                IR.structType(
                    IR.field("X", IR.name("int")).setDoc(CommentGroup.of("// X is horizontal.")),
                    IR.field("Y", IR.name("int")))));
    pointDecl.setDoc(CommentGroup.of("// Point is a point."));

    Node body =
        IR.block(
            IR.define(
                IR.name("p"),
                IR.compositeLit(
                    IR.name("Point"),
                    IR.keyValue(IR.name("X"), IR.number(1)),
                    IR.keyValue(IR.name("Y"), IR.number(2)))),
            IR.rangeStmt(
                IR.name("i"),
                null,
                Operator.DEFINE,
                IR.name("names"),
                IR.block(
                    IR.exprStmt(
                        IR.call(IR.qualifiedName("fmt", "Println"), IR.name("i"), IR.name("p"))))),
            IR.ifStmt(
                IR.binary(
                    Operator.GTR,
                    IR.call(IR.name("len"), IR.qualifiedName("os", "Args")),
                    IR.number(1)),
                IR.block(IR.returnStmt())));
    Node main = IR.funcDecl("main", IR.funcType(), body);
    main.setDoc(CommentGroup.of("// Main runs.", "// It prints."));

    Node file =
        IR.file(
            "sample",
            IR.group(Token.IMPORT, IR.importSpec("fmt"), IR.importSpec("os")),
            pointDecl,
            IR.decl(Token.CONST, IR.valueSpec("limit", null, IR.number(10))),
            IR.decl(
                Token.VAR,
                IR.valueSpec(
                    "names",
                    null,
                    IR.compositeLit(
                        IR.sliceType(IR.name("string")),
                        IR.string("a"),
                        IR.string("b"),
                        IR.string("c")))),
            main);
    file.setDoc(CommentGroup.of("// Package sample shows layout."));
    return file;
  }

  /** A file holding {@code var x = []int{...}} with the given elements. */
  static Node literalFile(Node... elements) {
    Node lit = IR.compositeLit(IR.sliceType(IR.name("int")), elements);
    return IR.file("p", IR.decl(Token.VAR, IR.valueSpec("x", null, lit)));
  }

  /** A file holding one function with an empty body and the given doc comment lines. */
  static Node documentedFunction(String... doc) {
    Node func = IR.funcDecl("f", IR.funcType(), IR.block());
    func.setDoc(CommentGroup.fromLines(ImmutableList.copyOf(doc)));
    return IR.file("p", func);
  }
}
