/*
 * Copyright 2026 Google Inc.
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
package com.google.common.rectlib;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * The arithmetic and ordering that rectangle operations need from a coordinate type. A coordinate
 * type is otherwise opaque: implementations only have to add, subtract and multiply values, supply
 * the identities zero and one, and order values totally.
 *
 * <p>Overflow is the responsibility of the caller. The {@link #integers()} and {@link #longs()}
 * instances wrap around exactly like Java's {@code int} and {@code long} arithmetic.
 *
 * @param <T> the coordinate type
 */
public interface Coordinates<T> extends Comparator<T> {
  /** Returns {@code a + b}. */
  T add(T a, T b);

  /** Returns {@code a - b}. */
  T subtract(T a, T b);

  /** Returns {@code a * b}. */
  T multiply(T a, T b);

  /** Returns the additive identity. */
  T zero();

  /**
   * Returns the multiplicative identity, which is also the distance between two adjacent
   * coordinates. Rectangle edges are inclusive, so the first coordinate after an edge at {@code x}
   * is {@code x + one()}.
   */
  T one();

  /** Returns the smaller of the two values, or {@code a} if they are equal. */
  default T min(T a, T b) {
    return compare(a, b) <= 0 ? a : b;
  }

  /** Returns the larger of the two values, or {@code a} if they are equal. */
  default T max(T a, T b) {
    return compare(a, b) >= 0 ? a : b;
  }

  /** Returns true iff {@code a < b}. */
  default boolean lessThan(T a, T b) {
    return compare(a, b) < 0;
  }

  /** Returns true iff {@code a <= b}. */
  default boolean lessOrEquals(T a, T b) {
    return compare(a, b) <= 0;
  }

  /** Returns true iff {@code a > b}. */
  default boolean greaterThan(T a, T b) {
    return compare(a, b) > 0;
  }

  /** Returns true iff {@code a >= b}. */
  default boolean greaterOrEquals(T a, T b) {
    return compare(a, b) >= 0;
  }

  /** Returns true iff the two values are equal under this ordering. */
  default boolean isEqual(T a, T b) {
    return compare(a, b) == 0;
  }

  /** Returns the coordinates for {@code int} values. */
  static Coordinates<Integer> integers() {
    return StandardCoordinates.INTEGERS;
  }

  /** Returns the coordinates for {@code long} values. */
  static Coordinates<Long> longs() {
    return StandardCoordinates.LONGS;
  }

  /** Returns the coordinates for arbitrary precision integers, which never overflow. */
  static Coordinates<BigInteger> bigIntegers() {
    return StandardCoordinates.BIG_INTEGERS;
  }
}
