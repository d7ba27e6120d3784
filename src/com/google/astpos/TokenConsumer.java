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

/**
 * Abstracted consumer of the tokens laid out during position synthesis. Tokens arrive in strictly
 * increasing position order; every line break is reported with the offset of the line it starts.
 *
 * @see LineLayoutPrinter
 */
public abstract class TokenConsumer {

  /** A consumer that ignores everything. */
  static final TokenConsumer NO_OP = new TokenConsumer() {};

  /**
   * Called for each token placed at {@code position}. The text is the token as it would be
   * rendered: a keyword, operator, delimiter, identifier, literal or comment line.
   */
  public void addToken(int position, String text) {}

  /** Called when a new line begins at {@code lineStart}. */
  public void startLine(int lineStart) {}
}
