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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Arrays;

import org.jspecify.annotations.Nullable;

/**
 * A linked deque whose nodes are slots in a growable table. A node is identified by its index, and
 * the links between nodes are indexes into the parallel {@code next} and {@code prev} arrays, where
 * {@link #NIL} denotes the absence of a neighbor.
 * <p>
 * A slot that leaves the chain is pushed onto a free list, threaded through the {@code next} array,
 * and is reused by a later insertion. Slots at or above the high-water mark have never been used.
 * Clearing the deque discards the table's contents in bulk rather than by walking the chain.
 * Whenever the deque becomes empty, by clearing or by popping its last element, the free list is
 * discarded and a table that had grown is replaced by one of the initial capacity.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 * @param <E> the type of elements held in this deque
 */
final class IndexedDeque<E> extends AbstractLinkedDeque<E> {
  static final Logger logger = System.getLogger(IndexedDeque.class.getName());

  static final int DEFAULT_INITIAL_CAPACITY = 16;
  static final int MAXIMUM_CAPACITY = Integer.MAX_VALUE - 8;
  static final int NIL = -1;

  final int initialCapacity;

  @Nullable Object[] elements;
  int[] next;
  int[] prev;

  /** Index of the first node, or NIL if empty. */
  int first;
  /** Index of the last node, or NIL if empty. */
  int last;
  /** Index of the most recently freed slot, or NIL if none are free. */
  int free;
  /** The number of slots that have been handed out since the table was last cleared. */
  int highWater;

  IndexedDeque(int initialCapacity) {
    requireArgument(initialCapacity >= 0,
        "initialCapacity must not be negative: %s", initialCapacity);
    this.initialCapacity = initialCapacity;
    this.elements = new Object[initialCapacity];
    this.next = new int[initialCapacity];
    this.prev = new int[initialCapacity];
    first = last = free = NIL;
  }

  /** Returns the number of slots in the table. */
  int capacity() {
    return elements.length;
  }

  @Override
  void linkFirst(E e) {
    int f = first;
    int index = allocate(e);
    first = index;

    if (f == NIL) {
      last = index;
    } else {
      prev[f] = index;
      next[index] = f;
    }
  }

  @Override
  void linkLast(E e) {
    int l = last;
    int index = allocate(e);
    last = index;

    if (l == NIL) {
      first = index;
    } else {
      next[l] = index;
      prev[index] = l;
    }
  }

  @Override
  E unlinkFirst() {
    int f = first;
    int n = next[f];
    next[f] = NIL;

    first = n;
    if (n == NIL) {
      last = NIL;
    } else {
      prev[n] = NIL;
    }
    E e = release(f);
    if (n == NIL) {
      reset();
    }
    return e;
  }

  @Override
  E unlinkLast() {
    int l = last;
    int p = prev[l];
    prev[l] = NIL;

    last = p;
    if (p == NIL) {
      first = NIL;
    } else {
      next[p] = NIL;
    }
    E e = release(l);
    if (p == NIL) {
      reset();
    }
    return e;
  }

  @Override
  void unlinkAll() {
    if (capacity() <= initialCapacity) {
      Arrays.fill(elements, 0, highWater, null);
    }
    reset();
  }

  /**
   * Discards the free list of an empty deque and returns an enlarged table to its initial
   * capacity. Every slot's element must already be null or be discarded with the table.
   */
  void reset() {
    if (capacity() > initialCapacity) {
      logger.log(Level.DEBUG, () -> String.format(
          "Shrinking the deque's table from %d to %d slots", capacity(), initialCapacity));
      elements = new Object[initialCapacity];
      next = new int[initialCapacity];
      prev = new int[initialCapacity];
    }
    first = last = free = NIL;
    highWater = 0;
  }

  /** Places the element into an unused slot and returns its index. */
  int allocate(E e) {
    int index;
    if (free == NIL) {
      if (highWater == capacity()) {
        grow();
      }
      index = highWater++;
    } else {
      index = free;
      free = next[index];
    }
    elements[index] = e;
    next[index] = NIL;
    prev[index] = NIL;
    return index;
  }

  /** Returns the slot to the free list and the element that it held. */
  E release(int index) {
    E e = elementAt(index);
    elements[index] = null;
    prev[index] = NIL;
    next[index] = free;
    free = index;
    return e;
  }

  /** Enlarges the table by half of its current capacity. */
  void grow() {
    int oldCapacity = capacity();
    if (oldCapacity == MAXIMUM_CAPACITY) {
      throw new OutOfMemoryError("Required array length too large");
    }
    int newCapacity = (int) Math.min(MAXIMUM_CAPACITY,
        (long) oldCapacity + Math.max(1, oldCapacity >>> 1));
    logger.log(Level.DEBUG, () -> String.format(
        "Growing the deque's table from %d to %d slots", oldCapacity, newCapacity));

    elements = Arrays.copyOf(elements, newCapacity);
    next = Arrays.copyOf(next, newCapacity);
    prev = Arrays.copyOf(prev, newCapacity);
  }

  @SuppressWarnings("unchecked")
  E elementAt(int index) {
    return (E) elements[index];
  }

  @Override
  public @Nullable E peekFront() {
    return (first == NIL) ? null : elementAt(first);
  }

  @Override
  public @Nullable E peekBack() {
    return (last == NIL) ? null : elementAt(last);
  }

  @Override
  public PeekingIterator<E> iterator() {
    return new IndexIterator(first) {
      @Override void advance() {
        cursor = next[cursor];
      }
    };
  }

  @Override
  public PeekingIterator<E> descendingIterator() {
    return new IndexIterator(last) {
      @Override void advance() {
        cursor = prev[cursor];
      }
    };
  }

  abstract class IndexIterator extends AbstractLinkedIterator {
    int cursor;

    IndexIterator(int start) {
      cursor = start;
    }

    @Override
    boolean hasCursor() {
      return (cursor != NIL);
    }

    @Override
    E current() {
      return elementAt(cursor);
    }
  }
}
