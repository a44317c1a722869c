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

import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import java.util.List;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * An immutable {@link R2Rectangle} with {@code int} coordinates. Sides are inclusive and the y-axis
 * points up, so {@code top >= bottom} for valid rectangles.
 */
@Immutable
@JsType
public final class R2IntRect implements R2Rectangle<Integer>, Serializable {
  /** Rectangle operations producing R2IntRects. */
  public static final R2Rectangles<Integer, R2IntRect> OPS =
      R2Rectangles.of(Coordinates.integers(), R2IntRect::fromSides);

  private final int left;
  private final int right;
  private final int top;
  private final int bottom;

  private R2IntRect(int left, int right, int top, int bottom) {
    this.left = left;
    this.right = right;
    this.top = top;
    this.bottom = bottom;
  }

  /** Returns a rectangle with the given sides. The sides are not validated. */
  public static R2IntRect fromSides(int left, int right, int top, int bottom) {
    return new R2IntRect(left, right, top, bottom);
  }

  /**
   * Returns the rectangle whose top-left corner is {@code (x, y)} and which covers {@code width}
   * columns and {@code height} rows, i.e. {@code right = x + width - 1} and {@code bottom = y -
   * height + 1}. A width or height of zero yields a degenerate rectangle.
   */
  @JsIgnore
  public static R2IntRect fromCornerAndSize(int x, int y, int width, int height) {
    return new R2IntRect(x, x + width - 1, y, y - height + 1);
  }

  @Override
  public Integer left() {
    return left;
  }

  @Override
  public Integer right() {
    return right;
  }

  @Override
  public Integer top() {
    return top;
  }

  @Override
  public Integer bottom() {
    return bottom;
  }

  /** Returns the number of columns covered, {@code right - left + 1}. */
  public int numColumns() {
    return right - left + 1;
  }

  /** Returns the number of rows covered, {@code top - bottom + 1}. */
  public int numRows() {
    return top - bottom + 1;
  }

  /**
   * Returns the rectangles covering exactly the part of this rectangle not covered by any of the
   * obstructions.
   *
   * @see R2SweepLineDecomposer#decompose(R2Rectangle, List)
   */
  public List<R2IntRect> unobstructedSubrectangles(
      List<? extends R2Rectangle<Integer>> obstructions) {
    return OPS.unobstructedSubrectangles(this, obstructions);
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof R2IntRect)) {
      return false;
    }
    R2IntRect thatRect = (R2IntRect) that;
    return left == thatRect.left
        && right == thatRect.right
        && top == thatRect.top
        && bottom == thatRect.bottom;
  }

  @Override
  public int hashCode() {
    int value = 17;
    value = 37 * value + left;
    value = 37 * value + right;
    value = 37 * value + top;
    value = 37 * value + bottom;
    return value;
  }

  @Override
  public String toString() {
    return Platform.formatString("[%d, %d]x[%d, %d]", left, right, bottom, top);
  }

  private static final long serialVersionUID = 1L;
}
