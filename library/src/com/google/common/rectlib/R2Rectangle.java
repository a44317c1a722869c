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

import jsinterop.annotations.JsType;

/**
 * An R2Rectangle is a closed, axis-aligned rectangle in the (x,y) plane, described by its four
 * sides. All sides are inclusive: a rectangle with {@code left == right} and {@code bottom == top}
 * contains exactly one point.
 *
 * <p>The y-axis points up, i.e. {@code top() >= bottom()} for every valid rectangle, and
 * {@code left() <= right()}. Implementations do not enforce this; a rectangle built from inverted
 * sides is degenerate and denotes an empty region, but every derived operation in {@link
 * R2Rectangles} is still well defined for it.
 *
 * <p>Implementations should be immutable. Operations that produce rectangles always create new
 * instances through a {@link Factory}.
 *
 * @param <T> the coordinate type, see {@link Coordinates}
 */
@JsType
public interface R2Rectangle<T> {
  /** Returns the smallest x coordinate contained in this rectangle. */
  T left();

  /** Returns the largest x coordinate contained in this rectangle. */
  T right();

  /** Returns the largest y coordinate contained in this rectangle. */
  T top();

  /** Returns the smallest y coordinate contained in this rectangle. */
  T bottom();

  /**
   * Creates rectangles of one concrete type from their sides. This is the only way the library
   * constructs rectangles, so callers choose the representation of every result.
   *
   * @param <T> the coordinate type
   * @param <R> the concrete rectangle type created
   */
  @FunctionalInterface
  interface Factory<T, R extends R2Rectangle<T>> {
    /** Returns a new rectangle with the given sides. The sides are not validated. */
    R fromSides(T left, T right, T top, T bottom);
  }
}
