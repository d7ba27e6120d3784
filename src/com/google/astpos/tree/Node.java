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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import org.jspecify.nullness.Nullable;

/**
 * This class implements the root of the syntax tree.
 *
 * <p>Children are kept in a doubly linked sibling list. A node can only be attached to one parent,
 * so the tree cannot contain cycles. Position slots start out unset (0) and are assigned exactly
 * once.
 */
public class Node {

  /** Shape flags that decide which optional slots a node requires. */
  public enum Prop {
    // Declaration group written as keyword ( spec... )
    PARENTHESIZED,
    // Field list written with its delimiters; a lone result type has none
    DELIMITED,
    // Call whose last argument is followed by ...
    VARIADIC,
    // Type spec of the form type A = B
    ALIAS,
    // Empty statement for a semicolon that does not appear in the source
    IMPLICIT,
    // chan<- T
    SEND_ONLY,
    // <-chan T
    RECV_ONLY
  }

  private static final int SLOT_COUNT = Slot.values().length;

  private static final class StringNode extends Node {
    private final String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str);
    }
  }

  private final Token token;
  private @Nullable Node next; // next sibling, a linked list
  private @Nullable Node previous; // previous sibling; the first child points at the last
  private @Nullable Node first; // first element of a linked list of children
  private @Nullable Node parent;

  private final EnumSet<Prop> props = EnumSet.noneOf(Prop.class);
  private @Nullable Operator operator;
  private @Nullable CommentGroup doc;
  // Only set on FILE nodes, once synthesis completes.
  private ImmutableList<CommentGroup> comments = ImmutableList.of();

  private final int[] positions = new int[SLOT_COUNT];
  private int sourceStart;
  private int sourceEnd;

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newString(Token token, String str) {
    checkArgument(token == Token.NAME || token == Token.LITERAL, token);
    return new StringNode(token, str);
  }

  public final Token getToken() {
    return token;
  }

  public final String getString() {
    checkState(this instanceof StringNode, "%s has no string", token);
    return ((StringNode) this).str;
  }

  // ==========================================================================
  // Children

  public final boolean hasChildren() {
    return first != null;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      checkArgument(n != null, "Child index out of range");
      n = n.next;
      i--;
    }
    checkArgument(n != null, "Child index out of range");
    return n;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  /** Counts this node and the siblings that follow it. */
  public final int getSiblingCountFromHere() {
    int c = 0;
    for (Node n = this; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);
    checkArgument(child != this && !isDescendantOf(child), "Cannot add an ancestor as a child");

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      // NOTE: child.next remains null
      child.previous = last;
      first.previous = child;
    }

    child.parent = this;
  }

  /** Is this Node the same as {@code node} or a descendant of {@code node}? */
  public final boolean isDescendantOf(Node node) {
    for (Node n = this; n != null; n = n.parent) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  // ==========================================================================
  // Props

  @CanIgnoreReturnValue
  public final Node putBooleanProp(Prop prop, boolean value) {
    if (value) {
      props.add(prop);
    } else {
      props.remove(prop);
    }
    return this;
  }

  public final boolean getBooleanProp(Prop prop) {
    return props.contains(prop);
  }

  public final @Nullable Operator getOperator() {
    return operator;
  }

  @CanIgnoreReturnValue
  public final Node setOperator(@Nullable Operator operator) {
    this.operator = operator;
    return this;
  }

  /** Returns the documentation comment group of this node, if any. */
  public final @Nullable CommentGroup getDoc() {
    return doc;
  }

  @CanIgnoreReturnValue
  public final Node setDoc(@Nullable CommentGroup doc) {
    checkArgument(doc == null || token.isDocumentable(), "%s cannot own a doc comment", token);
    this.doc = doc;
    return this;
  }

  /** All comment groups of a FILE in the order they appear, once positions are synthesized. */
  public final ImmutableList<CommentGroup> getComments() {
    return comments;
  }

  public final void setComments(ImmutableList<CommentGroup> comments) {
    checkState(isFile(), "Only files carry a comment list: %s", token);
    this.comments = checkNotNull(comments);
  }

  // ==========================================================================
  // Positions

  public final int getPosition(Slot slot) {
    return positions[slot.ordinal()];
  }

  public final boolean hasPosition(Slot slot) {
    return positions[slot.ordinal()] > 0;
  }

  /** Assigns a slot. Each slot may only be assigned once. */
  public final void setPosition(Slot slot, int position) {
    checkArgument(position > 0, "Invalid position %s for %s", position, slot);
    checkState(
        positions[slot.ordinal()] == 0,
        "%s of %s already positioned at %s",
        slot,
        token,
        positions[slot.ordinal()]);
    positions[slot.ordinal()] = position;
  }

  /**
   * The slots this node must hold after synthesis: those of its token plus the optional ones its
   * shape asks for.
   */
  public final ImmutableSet<Slot> getRequiredSlots() {
    EnumSet<Slot> slots = EnumSet.noneOf(Slot.class);
    slots.addAll(token.getRequiredSlots());
    if ((token.isDeclarationGroup() && getBooleanProp(Prop.PARENTHESIZED))
        || (token == Token.FIELD_LIST && getBooleanProp(Prop.DELIMITED))) {
      slots.add(Slot.OPEN);
      slots.add(Slot.CLOSE);
    }
    if (token == Token.CALL && getBooleanProp(Prop.VARIADIC)) {
      slots.add(Slot.ELLIPSIS);
    }
    if ((token == Token.TYPE_SPEC && getBooleanProp(Prop.ALIAS))
        || (token == Token.RANGE && operator != null)) {
      slots.add(Slot.OPERATOR);
    }
    if (token == Token.CHAN_TYPE
        && (getBooleanProp(Prop.SEND_ONLY) || getBooleanProp(Prop.RECV_ONLY))) {
      slots.add(Slot.ARROW);
    }
    return Sets.immutableEnumSet(slots);
  }

  /** Offset where this node, including its doc comment, begins. 0 if not yet positioned. */
  public final int getSourceStart() {
    return sourceStart;
  }

  /** Offset just past the last token of this node. 0 if not yet positioned. */
  public final int getSourceEnd() {
    return sourceEnd;
  }

  public final void setSourceSpan(int start, int end) {
    checkArgument(start > 0 && end >= start, "Invalid span [%s, %s]", start, end);
    checkState(sourceStart == 0, "Span of %s already set", token);
    this.sourceStart = start;
    this.sourceEnd = end;
  }

  /** Whether any slot or the span of this node has been assigned. */
  public final boolean isPositioned() {
    if (sourceStart > 0) {
      return true;
    }
    for (int p : positions) {
      if (p > 0) {
        return true;
      }
    }
    return false;
  }

  /**
   * Resets every slot, span and comment position in this subtree to unset, and drops the comment
   * list of a FILE.
   */
  public final void clearPositions() {
    for (Node n = this; n != null; n = nextInPreOrder(n, this)) {
      Arrays.fill(n.positions, 0);
      n.sourceStart = 0;
      n.sourceEnd = 0;
      if (n.doc != null) {
        n.doc.clearPositions();
      }
      if (n.isFile()) {
        n.comments = ImmutableList.of();
      }
    }
  }

  private static @Nullable Node nextInPreOrder(Node n, Node root) {
    if (n.first != null) {
      return n.first;
    }
    while (n != root) {
      if (n.next != null) {
        return n.next;
      }
      n = n.parent;
    }
    return null;
  }

  // ==========================================================================
  // Predicates

  public final boolean isFile() {
    return token == Token.FILE;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isLiteral() {
    return token == Token.LITERAL;
  }

  public final boolean isCompositeLit() {
    return token == Token.COMPOSITE_LIT;
  }

  public final boolean isKeyValue() {
    return token == Token.KEY_VALUE;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isFieldList() {
    return token == Token.FIELD_LIST;
  }

  public final boolean isFuncType() {
    return token == Token.FUNC_TYPE;
  }

  public final boolean isExprList() {
    return token == Token.EXPR_LIST;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  // ==========================================================================
  // Copying and comparison

  /**
   * Returns a deep copy of this subtree with the same shape, strings, operators, props and doc
   * comment text. Positions are not copied; the copy is ready to be synthesized.
   */
  @CheckReturnValue
  public final Node cloneTree() {
    Node copy =
        this instanceof StringNode
            ? new StringNode(token, ((StringNode) this).str)
            : new Node(token);
    copy.props.addAll(props);
    copy.operator = operator;
    if (doc != null) {
      ImmutableList.Builder<String> lines = ImmutableList.builder();
      for (Comment c : doc.getComments()) {
        lines.add(c.getText());
      }
      copy.doc = CommentGroup.fromLines(lines.build());
    }
    for (Node c = first; c != null; c = c.next) {
      copy.addChildToBack(c.cloneTree());
    }
    return copy;
  }

  /** Compares shape, strings, operators, props and doc comment text, ignoring positions. */
  public final boolean isEquivalentTo(Node node) {
    if (token != node.token
        || !props.equals(node.props)
        || operator != node.operator
        || !Objects.equals(docText(), node.docText())) {
      return false;
    }
    if ((this instanceof StringNode) != (node instanceof StringNode)) {
      return false;
    }
    if (this instanceof StringNode
        && !((StringNode) this).str.equals(((StringNode) node).str)) {
      return false;
    }
    Node a = first;
    Node b = node.first;
    while (a != null && b != null) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
      a = a.next;
      b = b.next;
    }
    return a == null && b == null;
  }

  private @Nullable String docText() {
    if (doc == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    for (Comment c : doc.getComments()) {
      sb.append(c.getText()).append('\n');
    }
    return sb.toString();
  }

  // ==========================================================================
  // Debugging

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (this instanceof StringNode) {
      sb.append(' ');
      sb.append(getString());
    }
    if (operator != null) {
      sb.append(' ');
      sb.append(operator.getText());
    }
    if (sourceStart > 0) {
      sb.append(" [");
      sb.append(sourceStart);
      sb.append(", ");
      sb.append(sourceEnd);
      sb.append(']');
    }
    for (Slot slot : Slot.values()) {
      int p = positions[slot.ordinal()];
      if (p > 0) {
        sb.append(" [");
        sb.append(Ascii.toLowerCase(slot.name()));
        sb.append(": ");
        sb.append(p);
        sb.append(']');
      }
    }
    for (Prop prop : props) {
      sb.append(" [");
      sb.append(Ascii.toLowerCase(prop.name()));
      sb.append(']');
    }
    return sb.toString();
  }

  @CheckReturnValue
  public final String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public final void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }
}
