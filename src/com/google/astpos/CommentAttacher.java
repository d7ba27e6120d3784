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

import com.google.astpos.tree.Comment;
import com.google.astpos.tree.CommentGroup;
import com.google.common.collect.ImmutableList;
import org.jspecify.nullness.Nullable;

/**
 * Positions documentation comment groups as they are reached and remembers them in encounter
 * order. Each comment line starts a line of its own and is followed by a line break, so the group
 * ends directly above the token it documents.
 *
 * <p>Only doc comments are handled. Trailing and free floating comments have no anchor in the tree
 * and are not positioned.
 */
final class CommentAttacher {
  private final PositionCounter counter;
  private final ImmutableList.Builder<CommentGroup> comments = ImmutableList.builder();
  private int count;

  CommentAttacher(PositionCounter counter) {
    this.counter = counter;
  }

  void attach(@Nullable CommentGroup group) {
    if (group == null) {
      return;
    }
    comments.add(group);
    count++;
    counter.ensureLineStart();
    for (Comment comment : group.getComments()) {
      comment.setPosition(counter.token(comment.getText()));
      counter.newline();
    }
  }

  int getCount() {
    return count;
  }

  ImmutableList<CommentGroup> getComments() {
    return comments.build();
  }
}
