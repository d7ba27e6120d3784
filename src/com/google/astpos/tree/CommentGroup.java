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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A sequence of line comments with no other tokens in between, documenting the file, declaration
 * or field that owns it.
 */
public final class CommentGroup {
  private final ImmutableList<Comment> comments;

  private CommentGroup(ImmutableList<Comment> comments) {
    checkArgument(!comments.isEmpty(), "Empty comment group");
    this.comments = comments;
  }

  /** Creates a group from the given comment lines, each starting with {@code //}. */
  public static CommentGroup of(String... lines) {
    return fromLines(ImmutableList.copyOf(lines));
  }

  public static CommentGroup fromLines(List<String> lines) {
    ImmutableList.Builder<Comment> builder = ImmutableList.builder();
    for (String line : lines) {
      builder.add(new Comment(line));
    }
    return new CommentGroup(builder.build());
  }

  public ImmutableList<Comment> getComments() {
    return comments;
  }

  public int size() {
    return comments.size();
  }

  /** Position of the first comment line, 0 until positioned. */
  public int getPosition() {
    return comments.get(0).getPosition();
  }

  void clearPositions() {
    for (Comment comment : comments) {
      comment.clearPosition();
    }
  }

  @Override
  public String toString() {
    return Joiner.on('\n').join(comments);
  }
}
