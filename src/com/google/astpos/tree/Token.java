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

import static com.google.astpos.tree.Slot.ARROW;
import static com.google.astpos.tree.Slot.CLOSE;
import static com.google.astpos.tree.Slot.COLON;
import static com.google.astpos.tree.Slot.END;
import static com.google.astpos.tree.Slot.KEYWORD;
import static com.google.astpos.tree.Slot.OPEN;
import static com.google.astpos.tree.Slot.OPERATOR;
import static com.google.astpos.tree.Slot.SEMICOLON;
import static com.google.astpos.tree.Slot.VALUE;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Arrays;
import org.jspecify.nullness.Nullable;

/**
 * The kinds of node in a Go syntax tree, together with the keyword each kind is introduced by
 * (if it has a fixed one) and the position slots every node of the kind must hold.
 *
 * <p>Child layout per kind is documented on the matching {@link IR} factory method.
 */
public enum Token {
  FILE("package", KEYWORD, END), // package name, then declarations

  // Declaration groups
  IMPORT("import", KEYWORD),
  CONST("const", KEYWORD),
  TYPE("type", KEYWORD),
  VAR("var", KEYWORD),

  IMPORT_SPEC(null),
  VALUE_SPEC(null),
  TYPE_SPEC(null),
  FUNC_DECL(null),

  FIELD_LIST(null),
  FIELD(null),

  // Types
  ARRAY_TYPE(null, OPEN),
  STRUCT_TYPE("struct", KEYWORD),
  FUNC_TYPE("func", KEYWORD),
  INTERFACE_TYPE("interface", KEYWORD),
  MAP_TYPE("map", KEYWORD),
  CHAN_TYPE("chan", KEYWORD),
  ELLIPSIS("...", Slot.ELLIPSIS),

  // Expressions
  NAME(null, VALUE),
  LITERAL(null, VALUE),
  COMPOSITE_LIT(null, OPEN, CLOSE),
  FUNC_LIT(null),
  PAREN(null, OPEN, CLOSE),
  SELECTOR(null),
  INDEX(null, OPEN, CLOSE),
  INDEX_LIST(null, OPEN, CLOSE),
  SLICE(null, OPEN, CLOSE),
  TYPE_ASSERT(null, OPEN, CLOSE),
  CALL(null, OPEN, CLOSE),
  STAR("*", OPERATOR),
  UNARY(null, OPERATOR),
  BINARY(null, OPERATOR),
  KEY_VALUE(null, COLON),

  // Statements
  DECL_STMT(null),
  EMPTY_STMT(";", SEMICOLON),
  LABELED(null, COLON),
  EXPR_STMT(null),
  SEND(null, ARROW),
  INC_DEC(null, OPERATOR),
  ASSIGN(null, OPERATOR),
  GO("go", KEYWORD),
  DEFER("defer", KEYWORD),
  RETURN("return", KEYWORD),
  BREAK("break", KEYWORD),
  CONTINUE("continue", KEYWORD),
  GOTO("goto", KEYWORD),
  FALLTHROUGH("fallthrough", KEYWORD),
  BLOCK(null, OPEN, CLOSE),
  IF("if", KEYWORD),
  CASE(null, KEYWORD, COLON), // case or default
  SWITCH("switch", KEYWORD),
  TYPE_SWITCH("switch", KEYWORD),
  COMM(null, KEYWORD, COLON), // case or default of a select
  SELECT("select", KEYWORD),
  FOR("for", KEYWORD),
  RANGE("for", KEYWORD, Slot.RANGE),

  // Holds a sibling list for nodes that own more than one list.
  EXPR_LIST(null),
  // Stands in for an absent child.
  EMPTY(null);

  private final @Nullable String text;
  private final ImmutableSet<Slot> requiredSlots;

  Token(@Nullable String text, Slot... requiredSlots) {
    this.text = text;
    this.requiredSlots = Sets.immutableEnumSet(Arrays.asList(requiredSlots));
  }

  /** The fixed source text that introduces nodes of this kind, or null if there is none. */
  public @Nullable String getText() {
    return text;
  }

  /** The slots every node of this kind holds, whatever its shape. */
  public ImmutableSet<Slot> getRequiredSlots() {
    return requiredSlots;
  }

  /** Whether nodes of this kind may own a documentation comment group. */
  public boolean isDocumentable() {
    switch (this) {
      case FILE:
      case IMPORT:
      case CONST:
      case TYPE:
      case VAR:
      case IMPORT_SPEC:
      case VALUE_SPEC:
      case TYPE_SPEC:
      case FUNC_DECL:
      case FIELD:
        return true;
      default:
        return false;
    }
  }

  /** Whether this kind is a declaration group (import, const, type or var). */
  public boolean isDeclarationGroup() {
    return this == IMPORT || this == CONST || this == TYPE || this == VAR;
  }
}
