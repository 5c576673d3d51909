package fsa.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Set whose identity depends only on its elements.
 *
 * <p>Iteration is always in ascending order, and {@code equals}, {@code hashCode}
 * and {@code compareTo} are all computed over that canonical order. This makes
 * a set of states usable as a state in its own right (as well as a map key)
 * during subset construction, no matter in which order it was filled.
 *
 * <p>Only {@link #insert} and {@link #insertAll} mutate the receiver. A set
 * returned by {@link #frozen()} refuses both.
 *
 * @param <T> element type, which must have a total order
 */
public final class OrderedSet<T extends Comparable<? super T>>
  implements Iterable<T>, Comparable<OrderedSet<T>> {

  // Sorted and distinct elements
  private final NavigableSet<T> elements;

  private final boolean mutable;

  public OrderedSet() {
    this(new TreeSet<T>(), true);
  }

  private OrderedSet(NavigableSet<T> elements, boolean mutable) {
    this.elements = elements;
    this.mutable = mutable;
  }

  @SafeVarargs
  public static <T extends Comparable<? super T>> OrderedSet<T> of(T... elems) {
    return fromSequence(Arrays.asList(elems));
  }

  /**
   * Collect a sequence into a fresh mutable set.
   *
   * @param elems elements, possibly with duplicates and in any order
   * @return set of the distinct elements
   */
  public static <T extends Comparable<? super T>> OrderedSet<T> fromSequence(Iterable<? extends T> elems) {
    final var set = new OrderedSet<T>();
    for (T elem : elems) {
      set.insert(elem);
    }
    return set;
  }

  /**
   * Add an element.
   *
   * @param value element to add
   * @return whether the element was not already present
   */
  public boolean insert(T value) {
    checkMutable();
    return elements.add(Objects.requireNonNull(value, "value is null"));
  }

  /**
   * Union the elements of another set into this one.
   *
   * @param other set whose elements get added
   * @return always {@code true}
   */
  public boolean insertAll(OrderedSet<? extends T> other) {
    checkMutable();
    elements.addAll(other.elements);
    return true;
  }

  public boolean contains(T value) {
    return elements.contains(value);
  }

  public int len() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  /**
   * Elements of this set which are absent from {@code other}.
   *
   * <p>This is not the symmetric difference: elements only in {@code other} are ignored.
   *
   * @param other elements to remove
   * @return new mutable set
   */
  public OrderedSet<T> difference(OrderedSet<? extends T> other) {
    final var result = new OrderedSet<T>();
    for (T elem : elements) {
      if (!other.elements.contains(elem)) {
        result.elements.add(elem);
      }
    }
    return result;
  }

  /**
   * Check whether the two sets share at least one element.
   *
   * @param other set to test against
   * @return whether the intersection is non-empty
   */
  public boolean intersects(OrderedSet<? extends T> other) {
    final OrderedSet<? extends T> smaller = len() <= other.len() ? this : other;
    final OrderedSet<? extends T> larger = smaller == this ? other : this;
    for (var elem : smaller.elements) {
      if (larger.elements.contains(elem)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Independent mutable copy.
   *
   * <p>Elements are shared, which is fine as long as they are immutable values.
   *
   * @return new mutable set with the same elements
   */
  public OrderedSet<T> copy() {
    return new OrderedSet<T>(new TreeSet<T>(elements), true);
  }

  /**
   * Unmodifiable copy of the set.
   *
   * @return this set if it is already frozen, otherwise a frozen copy
   */
  public OrderedSet<T> frozen() {
    return mutable ? new OrderedSet<T>(new TreeSet<T>(elements), false) : this;
  }

  public boolean isFrozen() {
    return !mutable;
  }

  public Stream<T> stream() {
    return elements.stream();
  }

  @Override
  public Iterator<T> iterator() {
    return Collections.unmodifiableNavigableSet(elements).iterator();
  }

  /**
   * Lexicographic comparison of the ascending element sequences, a strict
   * prefix being smaller.
   */
  @Override
  public int compareTo(OrderedSet<T> other) {
    final Iterator<T> left = elements.iterator();
    final Iterator<T> right = other.elements.iterator();
    while (left.hasNext() && right.hasNext()) {
      final int cmp = left.next().compareTo(right.next());
      if (cmp != 0) {
        return cmp;
      }
    }
    return Boolean.compare(left.hasNext(), right.hasNext());
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof OrderedSet)) {
      return false;
    } else {
      return elements.equals(((OrderedSet<?>) obj).elements);
    }
  }

  @Override
  public String toString() {
    return elements
      .stream()
      .map(Object::toString)
      .collect(Collectors.joining(",", "{", "}"));
  }

  private void checkMutable() {
    if (!mutable) {
      throw new UnsupportedOperationException("set is frozen");
    }
  }
}
