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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CheckReturnValue;
import java.util.List;
import java.util.Optional;
import jsinterop.annotations.JsType;

/**
 * Geometric operations over {@link R2Rectangle}s, implemented once for every rectangle type that
 * shares a coordinate type. An R2Rectangles instance binds the {@link Coordinates} used for
 * arithmetic to the {@link R2Rectangle.Factory} used to create results, so the operations accept
 * rectangles of any concrete type and always return rectangles of type {@code R}.
 *
 * <p>All operations are pure. Width and height are differences of sides, {@code right - left} and
 * {@code top - bottom}, and so are negative for degenerate rectangles.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @param <T> the coordinate type
 * @param <R> the rectangle type created by this instance
 */
@CheckReturnValue
@JsType
public final class R2Rectangles<T, R extends R2Rectangle<T>> {
  private final Coordinates<T> coordinates;
  private final R2Rectangle.Factory<T, R> factory;

  private R2Rectangles(Coordinates<T> coordinates, R2Rectangle.Factory<T, R> factory) {
    this.coordinates = coordinates;
    this.factory = factory;
  }

  /** Returns the operations for rectangles created by {@code factory} over {@code coordinates}. */
  public static <T, R extends R2Rectangle<T>> R2Rectangles<T, R> of(
      Coordinates<T> coordinates, R2Rectangle.Factory<T, R> factory) {
    return new R2Rectangles<>(checkNotNull(coordinates), checkNotNull(factory));
  }

  /** Returns the coordinate arithmetic used by these operations. */
  public Coordinates<T> coordinates() {
    return coordinates;
  }

  /** Returns the factory used to create result rectangles. */
  public R2Rectangle.Factory<T, R> factory() {
    return factory;
  }

  /** Returns a new rectangle with the given sides. */
  public R fromSides(T left, T right, T top, T bottom) {
    return factory.fromSides(left, right, top, bottom);
  }

  /** Returns a rectangle of type {@code R} with the same sides as {@code rect}. */
  public R copyOf(R2Rectangle<T> rect) {
    return factory.fromSides(rect.left(), rect.right(), rect.top(), rect.bottom());
  }

  /** Returns true if {@code left <= right} and {@code bottom <= top}. */
  public boolean isValid(R2Rectangle<T> rect) {
    return coordinates.lessOrEquals(rect.left(), rect.right())
        && coordinates.lessOrEquals(rect.bottom(), rect.top());
  }

  /**
   * Returns true if the two rectangles have the same four sides. Unlike {@code equals}, this works
   * across different rectangle implementations.
   */
  public boolean sidesEqual(R2Rectangle<T> a, R2Rectangle<T> b) {
    return coordinates.isEqual(a.left(), b.left())
        && coordinates.isEqual(a.right(), b.right())
        && coordinates.isEqual(a.top(), b.top())
        && coordinates.isEqual(a.bottom(), b.bottom());
  }

  /** Returns {@code right - left}. */
  public T width(R2Rectangle<T> rect) {
    return coordinates.subtract(rect.right(), rect.left());
  }

  /** Returns {@code top - bottom}. */
  public T height(R2Rectangle<T> rect) {
    return coordinates.subtract(rect.top(), rect.bottom());
  }

  /** Returns {@code (width + height) * 2}. */
  public T perimeter(R2Rectangle<T> rect) {
    T two = coordinates.add(coordinates.one(), coordinates.one());
    return coordinates.multiply(coordinates.add(width(rect), height(rect)), two);
  }

  /** Returns {@code width * height}. */
  public T area(R2Rectangle<T> rect) {
    return coordinates.multiply(width(rect), height(rect));
  }

  /** Returns a new rectangle with the x sides moved by {@code dx} and the y sides by {@code dy}. */
  public R translate(R2Rectangle<T> rect, T dx, T dy) {
    return factory.fromSides(
        coordinates.add(rect.left(), dx),
        coordinates.add(rect.right(), dx),
        coordinates.add(rect.top(), dy),
        coordinates.add(rect.bottom(), dy));
  }

  /**
   * Returns true if the point {@code (x, y)} lies in {@code rect}. Rectangles are closed, so points
   * on the boundary are contained.
   */
  public boolean containsPoint(R2Rectangle<T> rect, T x, T y) {
    return coordinates.lessOrEquals(rect.left(), x)
        && coordinates.lessOrEquals(x, rect.right())
        && coordinates.lessOrEquals(rect.bottom(), y)
        && coordinates.lessOrEquals(y, rect.top());
  }

  /** Returns true if every side of {@code rect} is at least as far out as that of {@code other}. */
  public boolean contains(R2Rectangle<T> rect, R2Rectangle<T> other) {
    return coordinates.lessOrEquals(rect.left(), other.left())
        && coordinates.greaterOrEquals(rect.right(), other.right())
        && coordinates.greaterOrEquals(rect.top(), other.top())
        && coordinates.lessOrEquals(rect.bottom(), other.bottom());
  }

  /** Returns true if the two closed rectangles have at least one point in common. */
  public boolean overlaps(R2Rectangle<T> rect, R2Rectangle<T> other) {
    return coordinates.lessOrEquals(rect.left(), other.right())
        && coordinates.greaterOrEquals(rect.right(), other.left())
        && coordinates.greaterOrEquals(rect.top(), other.bottom())
        && coordinates.lessOrEquals(rect.bottom(), other.top());
  }

  /**
   * Returns the rectangle of points common to both rectangles, or {@link Optional#empty()} if they
   * have no point in common. A present result is contained in both inputs.
   */
  public Optional<R> intersection(R2Rectangle<T> rect, R2Rectangle<T> other) {
    T left = coordinates.max(rect.left(), other.left());
    T right = coordinates.min(rect.right(), other.right());
    T top = coordinates.min(rect.top(), other.top());
    T bottom = coordinates.max(rect.bottom(), other.bottom());
    if (coordinates.greaterThan(left, right) || coordinates.greaterThan(bottom, top)) {
      return Optional.empty();
    }
    return Optional.of(factory.fromSides(left, right, top, bottom));
  }

  /**
   * Returns the rectangles that cover the part of {@code region} not covered by any of the
   * {@code obstructions}, using the default {@link R2SweepLineDecomposer.Options}.
   *
   * @see R2SweepLineDecomposer#decompose(R2Rectangle, List)
   */
  public List<R> unobstructedSubrectangles(
      R2Rectangle<T> region, List<? extends R2Rectangle<T>> obstructions) {
    return new R2SweepLineDecomposer<>(this).decompose(region, obstructions);
  }

  @Override
  public String toString() {
    return "R2Rectangles(" + coordinates + ")";
  }
}
