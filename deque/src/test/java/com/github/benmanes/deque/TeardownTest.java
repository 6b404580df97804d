/*
 * Copyright 2026 Ben Manes. All Rights Reserved.
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
package com.github.benmanes.deque;

import static com.github.benmanes.deque.LinkedDequeSubject.assertThat;
import static com.google.common.truth.Truth.assertThat;

import java.lang.ref.WeakReference;
import java.util.function.Supplier;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.google.common.testing.GcFinalization;

/**
 * Tests that large deques are released without deep recursion and without retaining their
 * elements. The build runs tests with a reduced thread stack size, so a teardown that recursed
 * once per node would overflow.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class TeardownTest {
  static final int SIZE = 1_000_000;

  @Test(dataProvider = "factories")
  public void clear_fromFront(Supplier<LinkedDeque<Object>> factory) {
    var deque = factory.get();
    var sentinel = populate(deque, /* atFront */ true);
    assertThat(deque.size()).isEqualTo(SIZE + 1);

    deque.clear();
    assertThat(deque).isExhaustivelyEmpty();
    GcFinalization.awaitClear(sentinel);
  }

  @Test(dataProvider = "factories")
  public void clear_fromBack(Supplier<LinkedDeque<Object>> factory) {
    var deque = factory.get();
    var sentinel = populate(deque, /* atFront */ false);
    assertThat(deque.size()).isEqualTo(SIZE + 1);

    deque.clear();
    assertThat(deque).isExhaustivelyEmpty();
    GcFinalization.awaitClear(sentinel);
  }

  @Test(dataProvider = "factories")
  public void drain_fully(Supplier<LinkedDeque<Object>> factory) {
    var deque = factory.get();
    var sentinel = populate(deque, /* atFront */ true);

    int drained = 0;
    for (var drain = deque.drainDescending(); drain.hasNext(); drain.next()) {
      drained++;
    }
    assertThat(drained).isEqualTo(SIZE + 1);
    assertThat(deque).isExhaustivelyEmpty();
    GcFinalization.awaitClear(sentinel);
  }

  @Test(dataProvider = "factories")
  public void unreachable(Supplier<LinkedDeque<Object>> factory) {
    var deque = factory.get();
    var sentinel = populate(deque, /* atFront */ false);
    var reference = new WeakReference<>(deque);

    deque = null;
    GcFinalization.awaitClear(reference);
    GcFinalization.awaitClear(sentinel);
  }

  /** Fills the deque and returns a weak reference to an element that only the deque retains. */
  static WeakReference<Object> populate(LinkedDeque<Object> deque, boolean atFront) {
    var element = new Object();
    var sentinel = new WeakReference<>(element);
    deque.pushBack(element);
    for (int i = 0; i < SIZE; i++) {
      if (atFront) {
        deque.pushFront(i);
      } else {
        deque.pushBack(i);
      }
    }
    return sentinel;
  }

  @DataProvider(name = "factories")
  public Object[][] providesFactories() {
    Supplier<LinkedDeque<Object>> chained = LinkedDeque::chained;
    Supplier<LinkedDeque<Object>> indexed = LinkedDeque::indexed;
    return new Object[][] { { chained }, { indexed } };
  }
}
