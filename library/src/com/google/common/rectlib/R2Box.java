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

import com.google.common.base.Objects;
import com.google.errorprone.annotations.Immutable;
import jsinterop.annotations.JsType;

/**
 * An immutable {@link R2Rectangle} over any coordinate type, for coordinates other than {@code
 * int}. Two boxes are equal if their sides are equal according to {@link Object#equals}.
 *
 * @param <T> the coordinate type, which should itself be immutable
 */
@Immutable(containerOf = "T")
@JsType
public final class R2Box<T> implements R2Rectangle<T> {
  private final T left;
  private final T right;
  private final T top;
  private final T bottom;

  private R2Box(T left, T right, T top, T bottom) {
    this.left = checkNotNull(left, "left");
    this.right = checkNotNull(right, "right");
    this.top = checkNotNull(top, "top");
    this.bottom = checkNotNull(bottom, "bottom");
  }

  /** Returns a box with the given sides. The sides are not validated. */
  public static <T> R2Box<T> fromSides(T left, T right, T top, T bottom) {
    return new R2Box<>(left, right, top, bottom);
  }

  /** Returns a factory creating boxes with coordinate type {@code T}. */
  public static <T> R2Rectangle.Factory<T, R2Box<T>> factory() {
    return R2Box::fromSides;
  }

  /** Returns the rectangle operations producing boxes over {@code coordinates}. */
  public static <T> R2Rectangles<T, R2Box<T>> ops(Coordinates<T> coordinates) {
    return R2Rectangles.of(coordinates, R2Box.<T>factory());
  }

  @Override
  public T left() {
    return left;
  }

  @Override
  public T right() {
    return right;
  }

  @Override
  public T top() {
    return top;
  }

  @Override
  public T bottom() {
    return bottom;
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof R2Box)) {
      return false;
    }
    R2Box<?> thatBox = (R2Box<?>) that;
    return left.equals(thatBox.left)
        && right.equals(thatBox.right)
        && top.equals(thatBox.top)
        && bottom.equals(thatBox.bottom);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(left, right, top, bottom);
  }

  @Override
  public String toString() {
    return "[" + left + ", " + right + "]x[" + bottom + ", " + top + "]";
  }
}
