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

import static com.google.common.truth.Truth.assertThat;

import com.google.astpos.tree.CommentGroup;
import com.google.astpos.tree.IR;
import com.google.astpos.tree.Node;
import com.google.astpos.tree.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LineLayoutPrinterTest {

  @Test
  public void testSpacesWithinLine() {
    LineLayoutPrinter printer = new LineLayoutPrinter();
    printer.addToken(1, "a");
    printer.addToken(2, ":=");
    printer.addToken(5, "1");
    assertThat(printer.getCode()).isEqualTo("a := 1");
  }

  @Test
  public void testLineBreaks() {
    LineLayoutPrinter printer = new LineLayoutPrinter();
    printer.addToken(1, "{");
    printer.startLine(3);
    printer.startLine(4);
    printer.addToken(4, "}");
    assertThat(printer.getCode()).isEqualTo("{\n\n}");
  }

  @Test
  public void testImportGroup() {
    Node imports = IR.group(Token.IMPORT, IR.importSpec("fmt"), IR.importSpec("o", "os"));
    assertThat(LineLayoutPrinter.print(IR.file("p", imports)))
        .isEqualTo("package p\nimport (\n\"fmt\"\no \"os\"\n)\n");
  }

  @Test
  public void testFileDocComment() {
    assertThat(LineLayoutPrinter.print(IR.file("p").setDoc(CommentGroup.of("// Package p."))))
        .isEqualTo("// Package p.\npackage p\n");
  }
}
