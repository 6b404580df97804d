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

import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;

import org.jspecify.annotations.Nullable;

/**
 * This class provides a skeletal implementation of the {@link LinkedDeque} interface to minimize
 * the effort required to implement this interface. A subclass supplies the storage of the chain by
 * linking and unlinking at its ends, while this class maintains the element count, the
 * modification count, and the iteration views.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 * @param <E> the type of elements held in this deque
 */
abstract class AbstractLinkedDeque<E> implements LinkedDeque<E> {

  /** The number of elements on the chain. */
  int size;

  /**
   * The number of times this deque has been <i>structurally modified</i>. Structural modifications
   * are those that change the size of the deque, or otherwise perturb it in such a fashion that
   * iterations in progress may yield incorrect results.
   */
  int modCount;

  /**
   * Links the element to the front of the deque so that it becomes the first element.
   *
   * @param e the non-null element
   */
  abstract void linkFirst(E e);

  /**
   * Links the element to the back of the deque so that it becomes the last element.
   *
   * @param e the non-null element
   */
  abstract void linkLast(E e);

  /** Unlinks the first node of a non-empty deque and returns its element. */
  abstract E unlinkFirst();

  /** Unlinks the last node of a non-empty deque and returns its element. */
  abstract E unlinkLast();

  /** Releases every node without recursing along the chain. */
  abstract void unlinkAll();

  @Override
  public void pushFront(E e) {
    requireNonNull(e);
    linkFirst(e);
    size++;
    modCount++;
  }

  @Override
  public void pushBack(E e) {
    requireNonNull(e);
    linkLast(e);
    size++;
    modCount++;
  }

  @Override
  public @Nullable E popFront() {
    if (isEmpty()) {
      return null;
    }
    E e = unlinkFirst();
    size--;
    modCount++;
    return e;
  }

  @Override
  public @Nullable E popBack() {
    if (isEmpty()) {
      return null;
    }
    E e = unlinkLast();
    size--;
    modCount++;
    return e;
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public boolean isEmpty() {
    return (size == 0);
  }

  @Override
  public void clear() {
    unlinkAll();
    size = 0;
    modCount++;
  }

  @Override
  public PeekingIterator<E> drain() {
    return new AbstractDrainingIterator() {
      @Override public @Nullable E peek() {
        return peekFront();
      }
      @Override @Nullable E pop() {
        return popFront();
      }
    };
  }

  @Override
  public PeekingIterator<E> drainDescending() {
    return new AbstractDrainingIterator() {
      @Override public @Nullable E peek() {
        return peekBack();
      }
      @Override @Nullable E pop() {
        return popBack();
      }
    };
  }

  @Override
  public String toString() {
    var iterator = iterator();
    if (!iterator.hasNext()) {
      return "[]";
    }
    var sb = new StringBuilder().append('[');
    for (;;) {
      E e = iterator.next();
      sb.append((e == this) ? "(this Deque)" : e);
      if (!iterator.hasNext()) {
        return sb.append(']').toString();
      }
      sb.append(", ");
    }
  }

  /**
   * Ensures the truth of an expression involving one or more parameters to the calling method.
   *
   * @throws IllegalArgumentException if the expression is false
   */
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(template, args));
    }
  }

  /** A sequence that consumes the deque as it advances. */
  abstract class AbstractDrainingIterator implements PeekingIterator<E> {

    @Override
    public boolean hasNext() {
      return !isEmpty();
    }

    @Override
    public E next() {
      E e = pop();
      if (e == null) {
        throw new NoSuchElementException();
      }
      return e;
    }

    /** Removes the element at the iterator's end of the deque, or returns null if empty. */
    abstract @Nullable E pop();
  }

  /** A traversal that observes the chain without modifying it. */
  abstract class AbstractLinkedIterator implements PeekingIterator<E> {
    final int expectedModCount;

    AbstractLinkedIterator() {
      expectedModCount = modCount;
    }

    @Override
    public boolean hasNext() {
      checkForComodification();
      return hasCursor();
    }

    @Override
    public @Nullable E peek() {
      checkForComodification();
      return hasCursor() ? current() : null;
    }

    @Override
    public E next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      E e = current();
      advance();
      return e;
    }

    /** Returns whether the cursor is positioned on a node. */
    abstract boolean hasCursor();

    /** Returns the element of the node under the cursor. */
    abstract E current();

    /** Moves the cursor to the following node in the direction of traversal. */
    abstract void advance();

    /**
     * If the expected modCount value that the iterator believes that the backing deque should have
     * is violated then the iterator has detected concurrent modification.
     */
    void checkForComodification() {
      if (modCount != expectedModCount) {
        throw new ConcurrentModificationException();
      }
    }
  }
}
