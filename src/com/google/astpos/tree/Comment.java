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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/** A single line comment, such as {@code // Returns the sum.}, within a {@link CommentGroup}. */
public final class Comment {
  private final String text;
  // Offset of the leading slash, 0 until positioned.
  private int position;

  public Comment(String text) {
    checkArgument(text.startsWith("//"), "Not a line comment: %s", text);
    checkArgument(text.indexOf('\n') == -1, "Line comment spans lines: %s", text);
    this.text = text;
  }

  /** The comment text including the leading {@code //}. */
  public String getText() {
    return text;
  }

  public int getPosition() {
    return position;
  }

  public boolean hasPosition() {
    return position > 0;
  }

  public void setPosition(int position) {
    checkArgument(position > 0, "Invalid position %s", position);
    checkState(this.position == 0, "Comment already positioned: %s", text);
    this.position = position;
  }

  void clearPosition() {
    position = 0;
  }

  @Override
  public String toString() {
    return position > 0 ? text + " @" + position : text;
  }
}
