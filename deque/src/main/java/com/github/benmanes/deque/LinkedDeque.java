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

import static java.util.Objects.requireNonNull;

import java.util.Iterator;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A double-ended queue backed by a doubly-linked chain of nodes. Elements may be inserted and
 * removed at either end in constant time. Linked deques have no capacity restrictions; they grow
 * as necessary to support usage. They are not thread-safe; in the absence of external
 * synchronization, they do not support concurrent access by multiple threads. Null elements are
 * prohibited, so that a {@code null} result unambiguously indicates that the deque is empty.
 * <p>
 * The deque may be consumed as a sequence in either direction by {@link #drain()} and
 * {@link #drainDescending()}. These views are <em>destructive</em>: each step removes the element
 * that it returns, the sequence is not restartable, and exhausting it empties the deque.
 * <p>
 * The {@link #iterator()} and {@link #descendingIterator()} views traverse without removal and are
 * <i>fail-fast</i>: if the deque is structurally modified after the iterator is created, the
 * iterator throws a {@link java.util.ConcurrentModificationException} on its next use. This is a
 * best-effort check that is intended to detect bugs, not to make the deque safe for concurrent use.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 * @param <E> the type of elements held in this deque
 */
public interface LinkedDeque<E> extends Iterable<E> {

  /** Returns a new, empty deque whose elements are held by individually allocated nodes. */
  static <E> LinkedDeque<E> chained() {
    return new ChainedDeque<>();
  }

  /**
   * Returns a new, empty deque whose nodes are slots in a growable table and whose links are table
   * indexes.
   */
  static <E> LinkedDeque<E> indexed() {
    return new IndexedDeque<>(IndexedDeque.DEFAULT_INITIAL_CAPACITY);
  }

  /**
   * Returns a new, empty deque whose nodes are slots in a growable table and whose links are table
   * indexes.
   *
   * @param initialCapacity the number of slots to allocate up front, and the size that the table is
   *        restored to when the deque is cleared
   * @throws IllegalArgumentException if the initial capacity is negative
   */
  static <E> LinkedDeque<E> indexed(int initialCapacity) {
    return new IndexedDeque<>(initialCapacity);
  }

  /**
   * Returns a new deque containing the elements in the iteration order of the source, so that
   * draining it from the front reproduces that order.
   *
   * @param elements the elements to copy
   * @throws NullPointerException if the source or any of its elements is null
   */
  static <E> LinkedDeque<E> copyOf(Iterable<? extends E> elements) {
    requireNonNull(elements);
    LinkedDeque<E> deque = chained();
    deque.pushAllBack(elements);
    return deque;
  }

  /**
   * Inserts the element at the front of this deque so that it becomes the first element.
   *
   * @param e the element to add
   * @throws NullPointerException if the element is null
   */
  void pushFront(E e);

  /**
   * Inserts the element at the back of this deque so that it becomes the last element.
   *
   * @param e the element to add
   * @throws NullPointerException if the element is null
   */
  void pushBack(E e);

  /**
   * Inserts the elements at the back of this deque, in the iteration order of the source.
   *
   * @param elements the elements to add
   * @throws NullPointerException if the source or any of its elements is null
   */
  default void pushAllBack(Iterable<? extends E> elements) {
    for (E e : elements) {
      pushBack(e);
    }
  }

  /** Removes and returns the first element, or returns {@code null} if this deque is empty. */
  @CanIgnoreReturnValue
  @Nullable E popFront();

  /** Removes and returns the last element, or returns {@code null} if this deque is empty. */
  @CanIgnoreReturnValue
  @Nullable E popBack();

  /** Returns, but does not remove, the first element or {@code null} if this deque is empty. */
  @Nullable E peekFront();

  /** Returns, but does not remove, the last element or {@code null} if this deque is empty. */
  @Nullable E peekBack();

  /** Returns the number of elements in this deque. This is a constant-time operation. */
  int size();

  /** Returns whether this deque contains no elements. */
  boolean isEmpty();

  /**
   * Removes all of the elements from this deque. The chain is released by iteration rather than
   * recursion, so a deque of any length may be cleared regardless of the call stack's depth. The
   * deque remains usable afterwards.
   */
  void clear();

  /**
   * Returns a sequence that removes and returns the elements from front to back. Each call to
   * {@code next()} is equivalent to {@link #popFront()}, and {@code peek()} is equivalent to
   * {@link #peekFront()}.
   */
  PeekingIterator<E> drain();

  /**
   * Returns a sequence that removes and returns the elements from back to front. Each call to
   * {@code next()} is equivalent to {@link #popBack()}, and {@code peek()} is equivalent to
   * {@link #peekBack()}.
   */
  PeekingIterator<E> drainDescending();

  /** Returns a fail-fast iterator over the elements from front to back, without removing them. */
  @Override
  PeekingIterator<E> iterator();

  /** Returns a fail-fast iterator over the elements from back to front, without removing them. */
  PeekingIterator<E> descendingIterator();

  interface PeekingIterator<E> extends Iterator<E> {

    /** Returns the next element in the iteration, without advancing the iteration. */
    @Nullable E peek();
  }
}
