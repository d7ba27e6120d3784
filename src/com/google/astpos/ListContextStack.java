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
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks the size of, and the current index within, each sibling list being traversed. Lists
 * nest, so frames are stacked; layout rules only ever look at the innermost one.
 */
final class ListContextStack {

  private static final class Frame {
    final int size;
    int index;

    Frame(int size) {
      this.size = size;
    }
  }

  private final Deque<Frame> frames = new ArrayDeque<>();

  void push(int size) {
    checkArgument(size >= 0, "Negative list size %s", size);
    frames.push(new Frame(size));
  }

  /** Moves the innermost list on to its next element. */
  void next() {
    Frame frame = frames.peek();
    checkState(frame != null, "Not inside a list");
    checkState(frame.index < frame.size, "Index past end of list of %s", frame.size);
    frame.index++;
  }

  void pop() {
    checkState(!frames.isEmpty(), "Not inside a list");
    frames.pop();
  }

  /** Size of the innermost list, or -1 if not inside a list. */
  int size() {
    Frame frame = frames.peek();
    return frame == null ? -1 : frame.size;
  }

  /** Index within the innermost list, or -1 if not inside a list. */
  int index() {
    Frame frame = frames.peek();
    return frame == null ? -1 : frame.index;
  }

  int depth() {
    return frames.size();
  }
}
