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

import static com.google.common.truth.Truth.assertThat;

import com.google.astpos.tree.CommentGroup;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CommentAttacherTest {

  @Test
  public void testNullGroupIgnored() {
    PositionCounter counter = new PositionCounter();
    CommentAttacher attacher = new CommentAttacher(counter);
    attacher.attach(null);
    assertThat(attacher.getCount()).isEqualTo(0);
    assertThat(attacher.getComments()).isEmpty();
    assertThat(counter.current()).isEqualTo(1);
  }

  @Test
  public void testLinesOnConsecutiveLineStarts() {
    PositionCounter counter = new PositionCounter();
    CommentAttacher attacher = new CommentAttacher(counter);
    CommentGroup group = CommentGroup.of("// One.", "// Two.");

    attacher.attach(group);

    int first = group.getComments().get(0).getPosition();
    int second = group.getComments().get(1).getPosition();
    LineTable lines = counter.getLineTable();
    assertThat(first).isEqualTo(1);
    assertThat(second).isEqualTo(9);
    assertThat(lines.isLineStart(second)).isTrue();
    assertThat(lines.getLine(second)).isEqualTo(lines.getLine(first) + 1);
    assertThat(counter.isAtLineStart()).isTrue();
  }

  @Test
  public void testBreaksLineBeforeGroup() {
    PositionCounter counter = new PositionCounter();
    CommentAttacher attacher = new CommentAttacher(counter);
    counter.token("var");
    CommentGroup group = CommentGroup.of("// Doc.");

    attacher.attach(group);

    assertThat(group.getPosition()).isEqualTo(5);
    assertThat(counter.getLineTable().isLineStart(5)).isTrue();
  }

  @Test
  public void testKeepsEncounterOrder() {
    PositionCounter counter = new PositionCounter();
    CommentAttacher attacher = new CommentAttacher(counter);
    CommentGroup a = CommentGroup.of("// a");
    CommentGroup b = CommentGroup.of("// b");

    attacher.attach(a);
    attacher.attach(b);

    assertThat(attacher.getCount()).isEqualTo(2);
    assertThat(attacher.getComments()).containsExactly(a, b).inOrder();
    assertThat(b.getPosition()).isGreaterThan(a.getPosition());
  }
}
