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

import static com.google.astpos.tree.Slot.ARROW;
import static com.google.astpos.tree.Slot.CLOSE;
import static com.google.astpos.tree.Slot.COLON;
import static com.google.astpos.tree.Slot.ELLIPSIS;
import static com.google.astpos.tree.Slot.KEYWORD;
import static com.google.astpos.tree.Slot.OPEN;
import static com.google.astpos.tree.Slot.OPERATOR;
import static com.google.astpos.tree.Slot.RANGE;
import static com.google.astpos.tree.Slot.SEMICOLON;
import static com.google.astpos.tree.Slot.VALUE;

import com.google.astpos.tree.CommentGroup;
import com.google.astpos.tree.Node;
import com.google.astpos.tree.Node.Prop;
import com.google.common.collect.ImmutableList;
import org.jspecify.nullness.Nullable;

/**
 * Walks a syntax tree in pre-order and gives every token a position from a shared {@link
 * PositionCounter}.
 *
 * <p>Each node kind has a layout rule in {@link #shouldTraverse}. A rule places the node's own
 * keywords, operators and delimiters, may descend into some children itself to keep them in
 * source order, and returns whether the remaining work is a plain left-to-right walk of all
 * children. Line breaks are only emitted where a formatter needs them to recover the layout:
 * around blocks, declaration groups, clauses, struct fields, doc comments and long or nested
 * composite literals.
 *
 * <p>Recursion depth follows tree depth; a pathologically deep tree exhausts the Java stack.
 */
final class PositionTraversal {

  /** Composite literals with at least this many elements put one element on each line. */
  static final int MULTI_LINE_ELEMENT_COUNT = 4;

  private final PositionCounter counter;
  private final ListContextStack lists = new ListContextStack();
  private final CommentAttacher commentAttacher;

  PositionTraversal(PositionCounter counter) {
    this.counter = counter;
    this.commentAttacher = new CommentAttacher(counter);
  }

  ImmutableList<CommentGroup> getComments() {
    return commentAttacher.getComments();
  }

  ListContextStack getListContext() {
    return lists;
  }

  void traverse(@Nullable Node n) {
    traverse(n, /* aggregate= */ false);
  }

  /**
   * Positions {@code n} and its subtree. {@code aggregate} is only consulted for field lists and
   * selects the struct layout for them.
   */
  private void traverse(@Nullable Node n, boolean aggregate) {
    if (n == null || n.isEmpty()) {
      return;
    }
    int start = counter.current();
    if (n.getToken().isDocumentable()) {
      commentAttacher.attach(n.getDoc());
    }
    boolean descend = n.isFieldList() ? visitFieldList(n, aggregate) : shouldTraverse(n);
    if (descend) {
      for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
        traverse(c);
      }
    }
    n.setSourceSpan(start, counter.current());
  }

  /**
   * Traverses {@code first} and the siblings that follow it as one list, making its size and the
   * current index visible to the layout rules of the elements.
   *
   * @param lineBreaks whether each element must end its own line
   */
  private void traverseList(@Nullable Node first, boolean lineBreaks) {
    lists.push(first == null ? 0 : first.getSiblingCountFromHere());
    for (Node c = first; c != null; c = c.getNext()) {
      traverse(c);
      if (lineBreaks) {
        counter.ensureLineStart();
      }
      lists.next();
    }
    lists.pop();
  }

  private void keyword(Node n) {
    n.setPosition(KEYWORD, counter.token(n.getToken().getText()));
  }

  /**
   * Sets the position fields of {@code n} and moves the counter past its tokens.
   *
   * @return whether the children of {@code n} still have to be visited in order
   */
  private boolean shouldTraverse(Node n) {
    switch (n.getToken()) {
      case FILE:
        keyword(n);
        counter.advance(1);
        traverse(n.getFirstChild());
        counter.newline();
        traverseList(n.getSecondChild(), /* lineBreaks= */ true);
        return false;

      case IMPORT:
      case CONST:
      case TYPE:
      case VAR:
        {
          keyword(n);
          boolean parenthesized = n.getBooleanProp(Prop.PARENTHESIZED);
          if (parenthesized) {
            n.setPosition(OPEN, counter.token("("));
            counter.newline();
          }
          traverseList(n.getFirstChild(), parenthesized);
          if (parenthesized) {
            n.setPosition(CLOSE, counter.token(")"));
            counter.newline();
          }
          return false;
        }

      case IMPORT_SPEC:
      case VALUE_SPEC:
        return true;

      case TYPE_SPEC:
        if (!n.getBooleanProp(Prop.ALIAS)) {
          return true;
        }
        traverse(n.getFirstChild());
        traverse(n.getSecondChild());
        n.setPosition(OPERATOR, counter.token("="));
        traverse(n.getLastChild());
        return false;

      case FUNC_DECL:
        visitFuncDecl(n);
        return false;

      case FIELD_LIST:
        throw new IllegalStateException("Field lists are visited with their layout mode");

      case FIELD:
        return true;

      case ARRAY_TYPE:
        n.setPosition(OPEN, counter.token("["));
        traverse(n.getFirstChild());
        counter.token("]");
        traverse(n.getLastChild());
        return false;

      case STRUCT_TYPE:
        keyword(n);
        traverse(n.getFirstChild(), /* aggregate= */ true);
        return false;

      case FUNC_TYPE:
      case INTERFACE_TYPE:
      case MAP_TYPE:
        keyword(n);
        return true;

      case CHAN_TYPE:
        if (n.getBooleanProp(Prop.RECV_ONLY)) {
          n.setPosition(ARROW, counter.token("<-"));
        }
        keyword(n);
        if (n.getBooleanProp(Prop.SEND_ONLY)) {
          n.setPosition(ARROW, counter.token("<-"));
        }
        return true;

      case ELLIPSIS:
        n.setPosition(ELLIPSIS, counter.token("..."));
        return true;

      case NAME:
      case LITERAL:
        n.setPosition(VALUE, counter.token(n.getString()));
        return false;

      case COMPOSITE_LIT:
        visitCompositeLit(n);
        return false;

      case FUNC_LIT:
      case SELECTOR:
        return true;

      case PAREN:
        n.setPosition(OPEN, counter.token("("));
        traverse(n.getFirstChild());
        n.setPosition(CLOSE, counter.token(")"));
        return false;

      case INDEX:
        traverse(n.getFirstChild());
        n.setPosition(OPEN, counter.token("["));
        traverse(n.getSecondChild());
        n.setPosition(CLOSE, counter.token("]"));
        return false;

      case INDEX_LIST:
        traverse(n.getFirstChild());
        n.setPosition(OPEN, counter.token("["));
        traverseList(n.getSecondChild(), /* lineBreaks= */ false);
        n.setPosition(CLOSE, counter.token("]"));
        return false;

      case SLICE:
        {
          Node low = n.getSecondChild();
          Node high = low.getNext();
          Node max = high.getNext();
          traverse(n.getFirstChild());
          n.setPosition(OPEN, counter.token("["));
          traverse(low);
          counter.token(":");
          traverse(high);
          if (!max.isEmpty()) {
            counter.token(":");
            traverse(max);
          }
          n.setPosition(CLOSE, counter.token("]"));
          return false;
        }

      case TYPE_ASSERT:
        traverse(n.getFirstChild());
        n.setPosition(OPEN, counter.token("("));
        if (n.getSecondChild().isEmpty()) {
          counter.token("type");
        } else {
          traverse(n.getSecondChild());
        }
        n.setPosition(CLOSE, counter.token(")"));
        return false;

      case CALL:
        traverse(n.getFirstChild());
        n.setPosition(OPEN, counter.token("("));
        traverseList(n.getSecondChild(), /* lineBreaks= */ false);
        if (n.getBooleanProp(Prop.VARIADIC)) {
          n.setPosition(ELLIPSIS, counter.token("..."));
        }
        n.setPosition(CLOSE, counter.token(")"));
        return false;

      case STAR:
        n.setPosition(OPERATOR, counter.token("*"));
        return true;

      case UNARY:
        n.setPosition(OPERATOR, counter.token(n.getOperator().getText()));
        return true;

      case BINARY:
      case ASSIGN:
        traverse(n.getFirstChild());
        n.setPosition(OPERATOR, counter.token(n.getOperator().getText()));
        traverse(n.getSecondChild());
        return false;

      case KEY_VALUE:
        {
          Node value = n.getSecondChild();
          traverse(n.getFirstChild());
          n.setPosition(COLON, counter.token(":"));
          traverse(value);
          if (lists.size() > 1 && !value.isCompositeLit()) {
            counter.newline();
          }
          return false;
        }

      case DECL_STMT:
      case EXPR_STMT:
        return true;

      case EMPTY_STMT:
        if (n.getBooleanProp(Prop.IMPLICIT)) {
          // Occupies an offset but renders as nothing.
          n.setPosition(SEMICOLON, counter.advance(1));
        } else {
          n.setPosition(SEMICOLON, counter.token(";"));
        }
        return false;

      case LABELED:
        traverse(n.getFirstChild());
        n.setPosition(COLON, counter.token(":"));
        traverse(n.getSecondChild());
        return false;

      case SEND:
        traverse(n.getFirstChild());
        n.setPosition(ARROW, counter.token("<-"));
        traverse(n.getSecondChild());
        return false;

      case INC_DEC:
        traverse(n.getFirstChild());
        n.setPosition(OPERATOR, counter.token(n.getOperator().getText()));
        return false;

      case GO:
      case DEFER:
      case RETURN:
      case BREAK:
      case CONTINUE:
      case GOTO:
      case FALLTHROUGH:
      case SWITCH:
      case TYPE_SWITCH:
      case SELECT:
      case FOR:
        keyword(n);
        return true;

      case IF:
        {
          Node init = n.getFirstChild();
          Node cond = init.getNext();
          Node then = cond.getNext();
          Node elseBranch = then.getNext();
          keyword(n);
          traverse(init);
          traverse(cond);
          traverse(then);
          if (!elseBranch.isEmpty()) {
            counter.token("else");
            traverse(elseBranch);
          }
          return false;
        }

      case BLOCK:
        n.setPosition(OPEN, counter.token("{"));
        counter.newline();
        traverseList(n.getFirstChild(), /* lineBreaks= */ true);
        n.setPosition(CLOSE, counter.token("}"));
        counter.newline();
        return false;

      case CASE:
      case COMM:
        {
          Node head = n.getFirstChild();
          n.setPosition(KEYWORD, counter.token(head.isEmpty() ? "default" : "case"));
          traverse(head);
          n.setPosition(COLON, counter.token(":"));
          counter.newline();
          traverseList(head.getNext(), /* lineBreaks= */ true);
          return false;
        }

      case RANGE:
        {
          Node key = n.getFirstChild();
          Node value = key.getNext();
          Node x = value.getNext();
          keyword(n);
          traverse(key);
          traverse(value);
          if (n.getOperator() != null) {
            n.setPosition(OPERATOR, counter.token(n.getOperator().getText()));
          }
          n.setPosition(RANGE, counter.token("range"));
          traverse(x);
          traverse(x.getNext());
          return false;
        }

      case EXPR_LIST:
        traverseList(n.getFirstChild(), /* lineBreaks= */ false);
        return false;

      case EMPTY:
        return false;
    }
    throw new IllegalStateException("Unexpected token " + n.getToken());
  }

  /**
   * Lays out {@code func (recv) Name(params) results {body}}. The signature's {@code func} keyword
   * comes first, so the FUNC_TYPE child is positioned here rather than by its own rule; like a
   * parsed declaration, its span then starts at the keyword.
   */
  private void visitFuncDecl(Node n) {
    Node receiver = n.getFirstChild();
    Node name = receiver.getNext();
    Node type = name.getNext();
    Node body = type.getNext();

    int typeStart = counter.current();
    keyword(type);
    traverse(receiver);
    traverse(name);
    for (Node c = type.getFirstChild(); c != null; c = c.getNext()) {
      traverse(c);
    }
    type.setSourceSpan(typeStart, counter.current());
    traverse(body);
    counter.newline();
  }

  /**
   * Positions the delimiters of a field list. In aggregate (struct) layout the fields start on
   * a new line, each field ends its line, and a blank line follows the closing brace.
   */
  private boolean visitFieldList(Node n, boolean aggregate) {
    boolean delimited = n.getBooleanProp(Prop.DELIMITED);
    String delimiters = delimitersOf(n);
    if (delimited) {
      n.setPosition(OPEN, counter.token(delimiters.substring(0, 1)));
      if (aggregate) {
        counter.newline();
      }
    }
    traverseList(n.getFirstChild(), aggregate);
    if (delimited) {
      n.setPosition(CLOSE, counter.token(delimiters.substring(1)));
      if (aggregate) {
        counter.newline();
        counter.newline();
      }
    }
    return false;
  }

  private static String delimitersOf(Node fieldList) {
    Node parent = fieldList.getParent();
    if (parent == null) {
      return "()";
    }
    switch (parent.getToken()) {
      case STRUCT_TYPE:
      case INTERFACE_TYPE:
        return "{}";
      case TYPE_SPEC:
        return "[]";
      case FUNC_TYPE:
        return fieldList == parent.getFirstChild() ? "[]" : "()";
      default:
        return "()";
    }
  }

  /**
   * Lays out a composite literal. Its elements go one per line when any of them is itself a
   * composite literal (directly or as the value of a key-value pair), when there are {@link
   * #MULTI_LINE_ELEMENT_COUNT} or more of them, or when more than one is a key-value pair with a
   * scalar value. The closing brace ends its line for long literals and for literals sharing a
   * list with other elements.
   */
  private void visitCompositeLit(Node n) {
    Node type = n.getFirstChild();
    Node firstElement = type.getNext();

    int count = 0;
    int keyValues = 0;
    boolean nested = false;
    for (Node e = firstElement; e != null; e = e.getNext()) {
      count++;
      if (e.isCompositeLit() || (e.isKeyValue() && e.getSecondChild().isCompositeLit())) {
        nested = true;
      } else if (e.isKeyValue()) {
        keyValues++;
      }
    }
    boolean multi = count >= MULTI_LINE_ELEMENT_COUNT;
    boolean lineBreaks = nested || multi || keyValues > 1;

    traverse(type);
    n.setPosition(OPEN, counter.token("{"));
    if (lineBreaks) {
      counter.newline();
    }
    traverseList(firstElement, lineBreaks);
    n.setPosition(CLOSE, counter.token("}"));
    if (multi || lists.size() >= 2) {
      counter.newline();
    }
  }
}
