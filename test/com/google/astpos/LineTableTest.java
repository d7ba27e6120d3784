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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LineTableTest {

  private static LineTable lines(int... starts) {
    LineTable table = new LineTable();
    for (int start : starts) {
      table.addLine(start);
    }
    return table;
  }

  @Test
  public void testFirstLine() {
    LineTable table = new LineTable();
    assertThat(table.getLineCount()).isEqualTo(1);
    assertThat(table.getLineStart(1)).isEqualTo(1);
    assertThat(table.getLine(1)).isEqualTo(1);
    assertThat(table.getLine(1000)).isEqualTo(1);
  }

  @Test
  public void testGetLine() {
    LineTable table = lines(5, 9, 20);
    assertThat(table.getLine(1)).isEqualTo(1);
    assertThat(table.getLine(4)).isEqualTo(1);
    assertThat(table.getLine(5)).isEqualTo(2);
    assertThat(table.getLine(8)).isEqualTo(2);
    assertThat(table.getLine(9)).isEqualTo(3);
    assertThat(table.getLine(20)).isEqualTo(4);
    assertThat(table.getLine(21)).isEqualTo(4);
    assertThrows(IllegalArgumentException.class, () -> table.getLine(0));
  }

  @Test
  public void testLineStarts() {
    LineTable table = lines(5, 9);
    assertThat(table.isLineStart(1)).isTrue();
    assertThat(table.isLineStart(9)).isTrue();
    assertThat(table.isLineStart(6)).isFalse();
    assertThat(table.getLastLineStart()).isEqualTo(9);
    assertThat(table.toArray().asList()).containsExactly(1, 5, 9).inOrder();
    assertThrows(IllegalArgumentException.class, () -> table.getLineStart(4));
  }

  @Test
  public void testStartsMustIncrease() {
    LineTable table = lines(5);
    assertThrows(IllegalArgumentException.class, () -> table.addLine(5));
    assertThrows(IllegalArgumentException.class, () -> table.addLine(3));
  }

  @Test
  public void testGrows() {
    LineTable table = new LineTable();
    for (int i = 1; i <= 1000; i++) {
      table.addLine(1 + 2 * i);
    }
    assertThat(table.getLineCount()).isEqualTo(1001);
    assertThat(table.getLine(2000)).isEqualTo(1000);
    assertThat(table.getLineStart(1001)).isEqualTo(2001);
  }

  @Test
  public void testFilePosition() {
    LineTable table = lines(5, 9);
    assertThat(table.getFilePosition(1)).isEqualTo(new FilePosition(1, 0));
    assertThat(table.getFilePosition(7)).isEqualTo(new FilePosition(2, 2));
    assertThat(table.getFilePosition(9)).isEqualTo(new FilePosition(3, 0));
  }
}
