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

/** Operators carried by UNARY, BINARY, ASSIGN, INC_DEC and RANGE nodes. */
public enum Operator {
  ADD("+"),
  SUB("-"),
  MUL("*"),
  QUO("/"),
  REM("%"),

  AND("&"),
  OR("|"),
  XOR("^"),
  SHL("<<"),
  SHR(">>"),
  AND_NOT("&^"),

  LAND("&&"),
  LOR("||"),
  ARROW("<-"),
  NOT("!"),
  TILDE("~"),

  EQL("=="),
  NEQ("!="),
  LSS("<"),
  LEQ("<="),
  GTR(">"),
  GEQ(">="),

  ASSIGN("="),
  DEFINE(":="),
  ADD_ASSIGN("+="),
  SUB_ASSIGN("-="),
  MUL_ASSIGN("*="),
  QUO_ASSIGN("/="),
  REM_ASSIGN("%="),
  AND_ASSIGN("&="),
  OR_ASSIGN("|="),
  XOR_ASSIGN("^="),
  SHL_ASSIGN("<<="),
  SHR_ASSIGN(">>="),
  AND_NOT_ASSIGN("&^="),

  INC("++"),
  DEC("--");

  private final String text;

  Operator(String text) {
    this.text = text;
  }

  public String getText() {
    return text;
  }

  public boolean isAssignment() {
    return ordinal() >= ASSIGN.ordinal() && ordinal() <= AND_NOT_ASSIGN.ordinal();
  }

  public boolean isIncDec() {
    return this == INC || this == DEC;
  }

  public boolean isUnary() {
    switch (this) {
      case ADD:
      case SUB:
      case XOR:
      case AND:
      case ARROW:
      case NOT:
      case TILDE:
        return true;
      default:
        return false;
    }
  }

  public boolean isBinary() {
    return ordinal() <= GEQ.ordinal() && this != ARROW && this != NOT && this != TILDE;
  }

  @Override
  public String toString() {
    return text;
  }
}
