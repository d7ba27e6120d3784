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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.astpos.tree.CommentGroup;
import com.google.astpos.tree.Node;
import com.google.astpos.tree.Slot;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Logger;

/**
 * Gives a syntax tree that was built without parsing the source positions a parser would have
 * produced, so that a position-driven printer can lay it out across lines and keep its doc
 * comments.
 *
 * <p>Positions are synthetic: they are strictly increasing offsets into an imaginary file, with
 * line starts recorded in a {@link LineTable}. They describe ordering and line grouping only.
 *
 * <p>Synthesis either positions the whole tree or fails with an unchecked exception and leaves
 * the tree unpositioned. An instance holds no per-call state and may be shared.
 */
public final class PositionSynthesizer {

  private static final Logger logger = Logger.getLogger(PositionSynthesizer.class.getName());

  private final PositionOptions options;

  public PositionSynthesizer() {
    this(new PositionOptions());
  }

  public PositionSynthesizer(PositionOptions options) {
    this.options = checkNotNull(options);
  }

  /** Positions {@code file} with default options. */
  public static SyntheticFile rewritePositions(Node file) {
    return new PositionSynthesizer().synthesize(file);
  }

  public SyntheticFile synthesize(Node file) {
    return synthesize(file, TokenConsumer.NO_OP);
  }

  /**
   * Positions every node of {@code file}, reporting each token and line start to {@code consumer}
   * as it is placed.
   *
   * @throws IllegalArgumentException if {@code file} is not a FILE node
   * @throws IllegalStateException if {@code file} already carries positions, or holds a node the
   *     traversal cannot place
   */
  public SyntheticFile synthesize(Node file, TokenConsumer consumer) {
    checkArgument(file.isFile(), "Expected a FILE root: %s", file);
    checkState(!isPositionedTree(file), "Tree is already positioned: %s", file);
    checkNotNull(consumer);

    PositionCounter counter = new PositionCounter(consumer);
    PositionTraversal traversal = new PositionTraversal(counter);
    SyntheticFile result;
    boolean succeeded = false;
    try {
      traversal.traverse(file);
      file.setPosition(Slot.END, counter.current());
      ImmutableList<CommentGroup> comments = traversal.getComments();
      file.setComments(comments);
      result = new SyntheticFile(options.getFileName(), file, counter.getLineTable(), comments);
      if (options.shouldValidatePositions()) {
        new PositionValidator().validate(result);
      }
      succeeded = true;
    } finally {
      // Also covers errors such as StackOverflowError on very deep trees.
      if (!succeeded) {
        file.clearPositions();
      }
    }

    logger.fine(
        "Positioned "
            + options.getFileName()
            + ": "
            + result.getLineCount()
            + " lines, "
            + result.getComments().size()
            + " comment groups, end offset "
            + result.getEnd());
    return result;
  }

  private static boolean isPositionedTree(Node root) {
    Deque<Node> pending = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      Node n = pending.pop();
      if (n.isPositioned()) {
        return true;
      }
      CommentGroup doc = n.getDoc();
      if (doc != null && doc.getComments().get(0).hasPosition()) {
        return true;
      }
      for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
        pending.push(c);
      }
    }
    return false;
  }
}
