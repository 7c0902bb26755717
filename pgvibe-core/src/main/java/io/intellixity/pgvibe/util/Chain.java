package io.intellixity.pgvibe.util;

import java.util.*;

/**
 * Immutable append-only sequence. {@link #append} is O(1) and shares the existing cells, so builder
 * snapshots that branch from a common prefix never see each other's additions.
 */
public final class Chain<E> {
  private static final Chain<?> EMPTY = new Chain<>(null, null, 0);

  private final Chain<E> prev;
  private final E last;
  private final int size;

  private Chain(Chain<E> prev, E last, int size) {
    this.prev = prev;
    this.last = last;
    this.size = size;
  }

  @SuppressWarnings("unchecked")
  public static <E> Chain<E> empty() { return (Chain<E>) EMPTY; }

  public Chain<E> append(E e) {
    return new Chain<>(this, Objects.requireNonNull(e, "element"), size + 1);
  }

  public Chain<E> appendAll(Collection<? extends E> es) {
    Chain<E> c = this;
    for (E e : es) c = c.append(e);
    return c;
  }

  public int size() { return size; }
  public boolean isEmpty() { return size == 0; }

  /** Elements in append order. */
  public List<E> toList() {
    Object[] out = new Object[size];
    Chain<E> c = this;
    for (int i = size - 1; i >= 0; i--) {
      out[i] = c.last;
      c = c.prev;
    }
    @SuppressWarnings("unchecked")
    List<E> list = (List<E>) List.of(out);
    return list;
  }

  @Override
  public String toString() { return toList().toString(); }
}
