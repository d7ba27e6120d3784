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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.primitives.ImmutableIntArray;
import java.util.Arrays;

/**
 * The ordered line-start offsets of a synthetic file. Line numbers are 1-based; line 1 always
 * starts at offset {@link PositionCounter#FIRST_POSITION}.
 */
public final class LineTable {
  private int[] starts = new int[64];
  private int size;

  LineTable() {
    starts[0] = PositionCounter.FIRST_POSITION;
    size = 1;
  }

  /** Records that a new line begins at {@code offset}. Offsets must strictly increase. */
  void addLine(int offset) {
    checkArgument(
        offset > starts[size - 1],
        "Line start %s does not follow previous line start %s",
        offset,
        starts[size - 1]);
    if (size == starts.length) {
      starts = Arrays.copyOf(starts, size * 2);
    }
    starts[size++] = offset;
  }

  public int getLineCount() {
    return size;
  }

  /** Returns the offset where the given 1-based line begins. */
  public int getLineStart(int line) {
    checkArgument(line >= 1 && line <= size, "Invalid line %s of %s", line, size);
    return starts[line - 1];
  }

  /** Returns the offset where the last recorded line begins. */
  public int getLastLineStart() {
    return starts[size - 1];
  }

  /** Returns the 1-based line holding {@code offset}. */
  public int getLine(int offset) {
    checkArgument(offset >= PositionCounter.FIRST_POSITION, "Invalid offset %s", offset);
    int i = Arrays.binarySearch(starts, 0, size, offset);
    // A miss returns -(insertion point) - 1; the line is the one before the insertion point.
    return i >= 0 ? i + 1 : -i - 1;
  }

  public boolean isLineStart(int offset) {
    return Arrays.binarySearch(starts, 0, size, offset) >= 0;
  }

  /** Maps an offset to its line and 0-based column. */
  public FilePosition getFilePosition(int offset) {
    int line = getLine(offset);
    return new FilePosition(line, offset - getLineStart(line));
  }

  public ImmutableIntArray toArray() {
    return ImmutableIntArray.copyOf(Arrays.copyOf(starts, size));
  }

  @Override
  public String toString() {
    return toArray().toString();
  }
}
