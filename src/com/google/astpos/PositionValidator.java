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
import com.google.astpos.tree.Node;
import com.google.astpos.tree.Slot;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the positions of a synthesized tree: every mandatory slot is set, spans nest, slots lie
 * inside the span of their node, no two tokens share an offset, and the doc comments are listed
 * in traversal order on consecutive line starts.
 */
public final class PositionValidator {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;

  /** Owner of each offset seen so far, to report both sides of a collision. */
  private final Map<Integer, Node> positionOwners = new HashMap<>();

  public PositionValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  public PositionValidator() {
    this(
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, Node n) {
            throw new IllegalStateException(
                message
                    + ". Reference node:\n"
                    + n.toStringTree()
                    + "\n Parent node:\n"
                    + ((n.getParent() != null) ? n.getParent().toStringTree() : " no parent "));
          }
        });
  }

  public void validate(SyntheticFile file) {
    positionOwners.clear();
    Node root = file.getRoot();
    if (!root.isFile()) {
      violation("Expected a FILE root", root);
    }
    if (root.getPosition(Slot.END) != root.getSourceEnd()) {
      violation("END slot does not close the file span", root);
    }
    List<CommentGroup> docs = new ArrayList<>();
    validateNode(root, docs);
    validateComments(file, docs);
  }

  private void validateNode(Node n, List<CommentGroup> docs) {
    if (n.isEmpty()) {
      if (n.isPositioned()) {
        violation("Placeholder node carries positions", n);
      }
      return;
    }
    if (n.getDoc() != null) {
      docs.add(n.getDoc());
    }

    int start = n.getSourceStart();
    int end = n.getSourceEnd();
    Node parent = n.getParent();
    if (start <= 0) {
      violation("Node has no span", n);
    } else if (parent != null
        && (start < parent.getSourceStart() || end > parent.getSourceEnd())) {
      violation("Span [" + start + ", " + end + "] is outside the span of its parent", n);
    }

    for (Slot slot : n.getRequiredSlots()) {
      if (!n.hasPosition(slot)) {
        violation("Missing position for " + slot, n);
      }
    }
    for (Slot slot : Slot.values()) {
      if (!n.hasPosition(slot)) {
        continue;
      }
      int position = n.getPosition(slot);
      if (position < start || position > end) {
        violation(slot + " at " + position + " is outside [" + start + ", " + end + "]", n);
      }
      claim(position, n);
    }

    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateNode(c, docs);
    }
  }

  private void validateComments(SyntheticFile file, List<CommentGroup> docs) {
    Node root = file.getRoot();
    ImmutableList<CommentGroup> comments = file.getComments();
    if (!root.getComments().equals(comments)) {
      violation("Comment list of the file differs from the synthesized one", root);
    }
    if (comments.size() != docs.size()) {
      violation(
          "Expected " + docs.size() + " comment groups but found " + comments.size(), root);
      return;
    }

    LineTable lines = file.getLineTable();
    int previous = 0;
    for (int i = 0; i < docs.size(); i++) {
      CommentGroup group = comments.get(i);
      if (group != docs.get(i)) {
        violation("Comment group " + i + " is out of traversal order: " + group, root);
      }
      int previousLine = -1;
      for (Comment comment : group.getComments()) {
        int position = comment.getPosition();
        if (position <= previous) {
          violation("Comment " + comment + " does not follow offset " + previous, root);
          continue;
        }
        previous = position;
        if (!lines.isLineStart(position)) {
          violation("Comment " + comment + " does not start a line", root);
        }
        int line = lines.getLine(position);
        if (previousLine != -1 && line != previousLine + 1) {
          violation("Comment " + comment + " is not on the line after its predecessor", root);
        }
        previousLine = line;
        claim(position, root);
      }
    }
  }

  private void claim(int position, Node owner) {
    Node previousOwner = positionOwners.put(position, owner);
    if (previousOwner != null) {
      violation("Offset " + position + " is shared with " + previousOwner, owner);
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }
}
