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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.astpos.tree.CommentGroup;
import com.google.astpos.tree.Node;
import com.google.astpos.tree.Slot;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * The result of positioning one FILE tree: the root itself, the line table recorded while
 * positioning it and its documentation comments in traversal order. A renderer reads the slot
 * offsets of the tree's nodes against this file.
 */
public final class SyntheticFile {
  private final String name;
  private final Node root;
  private final LineTable lineTable;
  private final ImmutableList<CommentGroup> comments;

  SyntheticFile(
      String name, Node root, LineTable lineTable, ImmutableList<CommentGroup> comments) {
    this.name = checkNotNull(name);
    this.root = checkNotNull(root);
    this.lineTable = checkNotNull(lineTable);
    this.comments = checkNotNull(comments);
  }

  public String getName() {
    return name;
  }

  public Node getRoot() {
    return root;
  }

  public LineTable getLineTable() {
    return lineTable;
  }

  public ImmutableList<CommentGroup> getComments() {
    return comments;
  }

  public int getLineCount() {
    return lineTable.getLineCount();
  }

  /** Returns the 1-based line of {@code offset}. */
  public int getLine(int offset) {
    return lineTable.getLine(offset);
  }

  public int getLineStart(int line) {
    return lineTable.getLineStart(line);
  }

  public FilePosition getFilePosition(int offset) {
    return lineTable.getFilePosition(offset);
  }

  /** The offset just past the last token, recorded as the root's END slot. */
  public int getEnd() {
    return root.getPosition(Slot.END);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("lines", getLineCount())
        .add("comments", comments.size())
        .add("end", getEnd())
        .toString();
  }
}
