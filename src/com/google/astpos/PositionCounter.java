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
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The single cursor of a synthesis run. Every token, comment and line terminator is given the
 * current offset and moves the cursor past itself, so offsets observed by distinct elements never
 * repeat.
 */
final class PositionCounter {
  /** Offset of the first token; 0 means "no position". */
  static final int FIRST_POSITION = 1;

  private final LineTable lineTable = new LineTable();
  private final TokenConsumer consumer;
  private int position = FIRST_POSITION;

  PositionCounter(TokenConsumer consumer) {
    this.consumer = consumer;
  }

  PositionCounter() {
    this(TokenConsumer.NO_OP);
  }

  int current() {
    return position;
  }

  LineTable getLineTable() {
    return lineTable;
  }

  /** Moves the cursor by {@code width} and returns the offset before the move. */
  @CanIgnoreReturnValue
  int advance(int width) {
    checkArgument(width >= 0, "Negative width %s", width);
    checkState(
        position <= Integer.MAX_VALUE - width - 1, "Synthetic file exceeds the offset range");
    int start = position;
    position += width;
    return start;
  }

  /** Places a token at the cursor and moves past it. Returns the token's offset. */
  @CanIgnoreReturnValue
  int token(String text) {
    consumer.addToken(position, text);
    return advance(text.length());
  }

  /** Moves past a line terminator and records the start of the following line. */
  void newline() {
    advance(1);
    lineTable.addLine(position);
    consumer.startLine(position);
  }

  /** Whether the cursor sits on the first offset of a line. */
  boolean isAtLineStart() {
    return lineTable.getLastLineStart() == position;
  }

  /** Starts a new line unless the cursor is already at the start of one. */
  void ensureLineStart() {
    if (!isAtLineStart()) {
      newline();
    }
  }
}
