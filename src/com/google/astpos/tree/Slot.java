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

/**
 * The position fields a {@link Node} can carry. Which of them a node must hold
 * after synthesis is decided by its {@link Token} and, for the optional ones, by
 * its shape (see {@link Node#getRequiredSlots()}).
 */
public enum Slot {
  // Leading keyword: package, func, if, case, struct, chan, ...
  KEYWORD,
  // Identifier or literal text.
  VALUE,
  // Opening bracket, brace or parenthesis.
  OPEN,
  // Closing bracket, brace or parenthesis.
  CLOSE,
  // Unary, binary, assignment or increment operator; '=' of an alias.
  OPERATOR,
  COLON,
  ELLIPSIS,
  // Send arrow, or the direction arrow of a channel type.
  ARROW,
  // The range keyword of a range loop.
  RANGE,
  SEMICOLON,
  // End of the file.
  END
}
