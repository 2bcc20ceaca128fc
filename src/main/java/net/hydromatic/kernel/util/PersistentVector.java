/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.kernel.util;

import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.AbstractList;
import java.util.Arrays;

/**
 * Immutable list that supports efficient appending and replacing of elements
 * by creating a new list that shares most of its structure with the old one.
 *
 * <p>Elements are held in a trie of 32-element arrays. {@link #plus} and
 * {@link #with} copy only the arrays on the path from the root to the
 * affected element, so both are O(log<sub>32</sub> n); so is {@link #get}.
 *
 * <p>The {@link java.util.List} methods that modify the list throw
 * {@link UnsupportedOperationException}.
 *
 * @param <E> Element type
 */
public final class PersistentVector<E> extends AbstractList<E> {
  private static final int BITS = 5;
  private static final int WIDTH = 1 << BITS;
  private static final int MASK = WIDTH - 1;

  @SuppressWarnings("rawtypes")
  private static final PersistentVector EMPTY =
      new PersistentVector<>(0, 0, new Object[0]);

  private final int size;
  /** Number of bits to shift an index to find its slot in {@link #root};
   * 0 if the root is a leaf. */
  private final int shift;
  private final Object[] root;

  private PersistentVector(int size, int shift, Object[] root) {
    this.size = size;
    this.shift = shift;
    this.root = root;
  }

  /** Returns the empty vector. */
  @SuppressWarnings("unchecked")
  public static <E> PersistentVector<E> of() {
    return (PersistentVector<E>) EMPTY;
  }

  @Override
  public int size() {
    return size;
  }

  @SuppressWarnings("unchecked")
  @Override
  public E get(int index) {
    checkElementIndex(index, size);
    Object[] node = root;
    for (int level = shift; level > 0; level -= BITS) {
      node = (Object[]) node[(index >>> level) & MASK];
    }
    return (E) node[index & MASK];
  }

  /** Returns a vector with the same elements as this plus {@code e} at the
   * end. This vector is unchanged. */
  public PersistentVector<E> plus(E e) {
    if (size == 1 << (shift + BITS)) {
      // The trie is full; add a level.
      final Object[] newRoot = {root, path(shift, e)};
      return new PersistentVector<>(size + 1, shift + BITS, newRoot);
    }
    return new PersistentVector<>(size + 1, shift,
        plus(root, shift, size, e));
  }

  /** Returns a vector the same as this but with element {@code index}
   * replaced by {@code e}. This vector is unchanged. */
  public PersistentVector<E> with(int index, E e) {
    checkElementIndex(index, size);
    return new PersistentVector<>(size, shift, with(root, shift, index, e));
  }

  private static Object[] plus(Object[] node, int level, int index,
      Object e) {
    final int slot = (index >>> level) & MASK;
    final Object[] copy = Arrays.copyOf(node, Math.max(node.length, slot + 1));
    if (level == 0) {
      copy[slot] = e;
    } else if (slot < node.length) {
      copy[slot] = plus((Object[]) node[slot], level - BITS, index, e);
    } else {
      copy[slot] = path(level - BITS, e);
    }
    return copy;
  }

  private static Object[] with(Object[] node, int level, int index,
      Object e) {
    final int slot = (index >>> level) & MASK;
    final Object[] copy = node.clone();
    copy[slot] = level == 0
        ? e
        : with((Object[]) node[slot], level - BITS, index, e);
    return copy;
  }

  /** Creates a chain of single-element arrays leading down to {@code e}. */
  private static Object[] path(int level, Object e) {
    return level == 0 ? new Object[] {e} : new Object[] {path(level - BITS, e)};
  }
}

// End PersistentVector.java
