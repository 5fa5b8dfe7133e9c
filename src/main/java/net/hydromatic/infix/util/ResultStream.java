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
package net.hydromatic.infix.util;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Lazy, restartable sequence of values.
 *
 * <p>A stream is either empty or a cell that holds a value and a supplier of
 * the rest of the stream. The supplier is invoked only when a consumer
 * advances past the value. Suppliers are not memoized: each traversal
 * re-runs the generation logic, so a stream that is held onto does not pin
 * every value it has ever produced.
 *
 * <p>Streams compose with {@link #map}, {@link #concat(Supplier)} and
 * {@link #flatMap}. Using {@code flatMap} one can enumerate a Cartesian
 * product while holding only one path through it in memory.
 *
 * <p>Values must not be null.
 *
 * @param <T> Element type
 */
public abstract class ResultStream<T> implements Iterable<T> {
  @SuppressWarnings("rawtypes")
  private static final ResultStream EMPTY = new Empty();

  private ResultStream() {}

  /** Returns an empty stream. */
  @SuppressWarnings("unchecked")
  public static <T> ResultStream<T> empty() {
    return (ResultStream<T>) EMPTY;
  }

  /** Returns a stream with one value. */
  public static <T> ResultStream<T> of(T value) {
    return new Cell<>(value, ResultStream::empty);
  }

  /** Returns a stream whose first value is known, and whose remaining
   * values will be produced by {@code next} when they are needed. */
  public static <T> ResultStream<T> of(T value,
      Supplier<ResultStream<T>> next) {
    return new Cell<>(value, next);
  }

  /** Returns a stream of the given values. */
  @SafeVarargs
  public static <T> ResultStream<T> of(T... values) {
    return from(ImmutableList.copyOf(values));
  }

  /** Returns a stream of the elements of a list. */
  public static <T> ResultStream<T> from(List<T> list) {
    return from(ImmutableList.copyOf(list), 0);
  }

  private static <T> ResultStream<T> from(ImmutableList<T> list, int i) {
    if (i >= list.size()) {
      return empty();
    }
    return of(list.get(i), () -> from(list, i + 1));
  }

  /** Returns whether this stream is empty. Does not force any
   * computation. */
  public abstract boolean isEmpty();

  /** Returns whether this stream has at least one value. */
  public final boolean nonEmpty() {
    return !isEmpty();
  }

  /** Returns the first value.
   *
   * @throws NoSuchElementException if the stream is empty */
  public abstract T head();

  /** Returns the stream after the first value, invoking its supplier.
   *
   * @throws NoSuchElementException if the stream is empty */
  public abstract ResultStream<T> tail();

  /** Returns a stream that applies a function to each value. */
  public <R> ResultStream<R> map(Function<? super T, ? extends R> fn) {
    if (isEmpty()) {
      return empty();
    }
    return of(fn.apply(head()), () -> tail().map(fn));
  }

  /** Returns a stream of this stream's values followed by another
   * stream's. */
  public ResultStream<T> concat(ResultStream<T> next) {
    requireNonNull(next);
    return concat(() -> next);
  }

  /** Returns a stream of this stream's values followed by the values of a
   * stream that is not created until this stream is exhausted. */
  public ResultStream<T> concat(Supplier<ResultStream<T>> next) {
    if (isEmpty()) {
      return next.get();
    }
    return of(head(), () -> tail().concat(next));
  }

  /**
   * Returns a stream that applies a function to each value of this stream
   * and concatenates the resulting streams.
   *
   * <p>Scans forward to the first value whose stream is non-empty; the rest
   * of this stream is not forced until the consumer reaches the end of that
   * stream. Values whose streams are empty are skipped in a loop, so a long
   * run of them does not deepen the call stack.
   */
  public <R> ResultStream<R> flatMap(
      Function<? super T, ResultStream<R>> fn) {
    ResultStream<T> s = this;
    while (s.nonEmpty()) {
      final ResultStream<R> result = fn.apply(s.head());
      if (result.nonEmpty()) {
        final ResultStream<T> cell = s;
        return result.concat(() -> cell.tail().flatMap(fn));
      }
      s = s.tail();
    }
    return empty();
  }

  /** Returns a new traversal of this stream. The iterator invokes a
   * supplier only when the consumer asks for the following value. */
  @Override public Iterator<T> iterator() {
    return new Iterator<T>() {
      ResultStream<T> current = ResultStream.this;
      boolean advance = false;

      @Override public boolean hasNext() {
        if (advance) {
          current = current.tail();
          advance = false;
        }
        return current.nonEmpty();
      }

      @Override public T next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        advance = true;
        return current.head();
      }
    };
  }

  /** Returns a list of all values. The stream must be finite. */
  public ImmutableList<T> toList() {
    return ImmutableList.copyOf(this);
  }

  /** Empty stream. */
  private static class Empty<T> extends ResultStream<T> {
    @Override public boolean isEmpty() {
      return true;
    }

    @Override public T head() {
      throw new NoSuchElementException();
    }

    @Override public ResultStream<T> tail() {
      throw new NoSuchElementException();
    }

    @Override public String toString() {
      return "[]";
    }
  }

  /** Stream with at least one value. */
  private static class Cell<T> extends ResultStream<T> {
    private final T value;
    private final Supplier<ResultStream<T>> next;

    Cell(T value, Supplier<ResultStream<T>> next) {
      this.value = requireNonNull(value);
      this.next = requireNonNull(next);
    }

    @Override public boolean isEmpty() {
      return false;
    }

    @Override public T head() {
      return value;
    }

    @Override public ResultStream<T> tail() {
      return requireNonNull(next.get(), "next");
    }

    @Override public String toString() {
      return "[" + value + ", ...]";
    }
  }
}

// End ResultStream.java
