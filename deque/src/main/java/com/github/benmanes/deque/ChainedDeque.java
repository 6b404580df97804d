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

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.Var;

/**
 * A linked deque whose elements are held by individually allocated nodes.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 * @param <E> the type of elements held in this deque
 */
final class ChainedDeque<E> extends AbstractLinkedDeque<E> {

  // The successor link is the owning direction: the chain is reachable from the first node and each
  // node keeps its successor alive. The predecessor link is only used to navigate towards the front
  // and is cleared, along with the successor link, whenever a node leaves the chain. This keeps a
  // discarded node from retaining its former neighbors if they inhabit different generations.

  /**
   * Pointer to first node.
   * Invariant: (first == null && last == null) ||
   *            (first.prev == null)
   */
  @Nullable Node<E> first;

  /**
   * Pointer to last node.
   * Invariant: (first == null && last == null) ||
   *            (last.next == null)
   */
  @Nullable Node<E> last;

  @Override
  void linkFirst(E e) {
    Node<E> f = first;
    Node<E> node = new Node<>(e);
    first = node;

    if (f == null) {
      last = node;
    } else {
      f.prev = node;
      node.next = f;
    }
  }

  @Override
  void linkLast(E e) {
    Node<E> l = last;
    Node<E> node = new Node<>(e);
    last = node;

    if (l == null) {
      first = node;
    } else {
      l.next = node;
      node.prev = l;
    }
  }

  @Override
  @SuppressWarnings("NullAway")
  E unlinkFirst() {
    Node<E> f = first;
    Node<E> next = f.next;
    f.next = null;

    first = next;
    if (next == null) {
      last = null;
    } else {
      next.prev = null;
    }
    return f.element;
  }

  @Override
  @SuppressWarnings("NullAway")
  E unlinkLast() {
    Node<E> l = last;
    Node<E> prev = l.prev;
    l.prev = null;

    last = prev;
    if (prev == null) {
      first = null;
    } else {
      prev.next = null;
    }
    return l.element;
  }

  @Override
  void unlinkAll() {
    @Var Node<E> node = first;
    while (node != null) {
      Node<E> next = node.next;
      node.prev = null;
      node.next = null;
      node = next;
    }
    first = last = null;
  }

  @Override
  public @Nullable E peekFront() {
    Node<E> f = first;
    return (f == null) ? null : f.element;
  }

  @Override
  public @Nullable E peekBack() {
    Node<E> l = last;
    return (l == null) ? null : l.element;
  }

  @Override
  public PeekingIterator<E> iterator() {
    return new NodeIterator(first) {
      @SuppressWarnings("NullAway")
      @Override void advance() {
        cursor = cursor.next;
      }
    };
  }

  @Override
  public PeekingIterator<E> descendingIterator() {
    return new NodeIterator(last) {
      @SuppressWarnings("NullAway")
      @Override void advance() {
        cursor = cursor.prev;
      }
    };
  }

  abstract class NodeIterator extends AbstractLinkedIterator {
    @Nullable Node<E> cursor;

    NodeIterator(@Nullable Node<E> start) {
      cursor = start;
    }

    @Override
    boolean hasCursor() {
      return (cursor != null);
    }

    @Override
    @SuppressWarnings("NullAway")
    E current() {
      return cursor.element;
    }
  }

  /** A storage cell holding one element and the links to its neighbors. */
  static final class Node<E> {
    final E element;

    @Nullable Node<E> prev;
    @Nullable Node<E> next;

    Node(E element) {
      this.element = element;
    }
  }
}
