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

import com.google.astpos.tree.Node;

/**
 * Renders the line layout of a synthesized tree: each token in placement order, separated by a
 * single space within a line and broken exactly where line starts were recorded. The output is
 * a preview of the layout a position-driven printer will choose, not compilable source.
 */
public final class LineLayoutPrinter extends TokenConsumer {
  private final StringBuilder code = new StringBuilder();
  private boolean lineEmpty = true;

  @Override
  public void addToken(int position, String text) {
    if (!lineEmpty) {
      code.append(' ');
    }
    code.append(text);
    lineEmpty = false;
  }

  @Override
  public void startLine(int lineStart) {
    code.append('\n');
    lineEmpty = true;
  }

  public String getCode() {
    return code.toString();
  }

  /** Synthesizes positions for a copy of {@code file} and returns its layout preview. */
  public static String print(Node file) {
    LineLayoutPrinter printer = new LineLayoutPrinter();
    new PositionSynthesizer().synthesize(file.cloneTree(), printer);
    return printer.getCode();
  }
}
