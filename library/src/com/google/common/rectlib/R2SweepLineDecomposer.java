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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import jsinterop.annotations.JsType;
import org.jspecify.annotations.Nullable;

/**
 * R2SweepLineDecomposer finds the unobstructed sub-rectangles of a region: a set of axis-aligned
 * rectangles whose union is exactly the part of the region that no obstruction covers. Each output
 * rectangle has a constant top and bottom over its whole width, and extends as far to the right as
 * that vertical extent stays free.
 *
 * <p>The algorithm sweeps a vertical line from left to right, stopping only at "event lines" where
 * the free space can change: the left side of the region, the left side of each obstruction, and
 * the column just past the right side of each obstruction. At every event line it computes the free
 * vertical intervals ("gaps") by scanning the obstructions that cross the line in order of
 * decreasing top, like shingles on a roof. A rectangle under construction is kept open while some
 * gap still contains its vertical extent; once it no longer fits it is finished one unit before the
 * event line, and its overlaps with the current gaps continue as new rectangles. Open rectangles
 * never share the same top and bottom, which keeps the output from fragmenting at event lines where
 * nothing changed for them.
 *
 * <p>Rectangles that open at the right side of an obstruction may overlap narrower rectangles that
 * are still open, so the output covers the free area exactly but is not in general a partition of
 * it.
 *
 * <p>Obstructions are only required to share the coordinate type of the region. They may extend
 * beyond the region: only the event lines within the region's x-range are visited. By default their
 * vertical extent is not clipped to the region, so an obstruction lying wholly below the region
 * still splits the free space at its x-range; see {@link Options#clipObstructionsToRegion()}.
 *
 * <p>The running time is O(E * (M + A * G)) for E event lines, M obstructions, A open rectangles
 * and G gaps per line. Instances are immutable and may be shared between threads; all sweep state
 * is local to one call of {@link #decompose}.
 *
 * @param <T> the coordinate type
 * @param <R> the rectangle type of the output
 */
@JsType
public final class R2SweepLineDecomposer<T, R extends R2Rectangle<T>> {
  private static final Logger log = Platform.getLoggerForClass(R2SweepLineDecomposer.class);

  private final R2Rectangles<T, R> rectangles;
  private final Coordinates<T> coords;
  private final Options options;

  /** Creates a decomposer with the default options. */
  public R2SweepLineDecomposer(R2Rectangles<T, R> rectangles) {
    this(rectangles, Options.DEFAULT);
  }

  /** Creates a decomposer that builds its output with {@code rectangles}. */
  public R2SweepLineDecomposer(R2Rectangles<T, R> rectangles, Options options) {
    this.rectangles = checkNotNull(rectangles);
    this.coords = rectangles.coordinates();
    this.options = checkNotNull(options);
  }

  /** Returns the options of this decomposer. */
  public Options options() {
    return options;
  }

  /**
   * Returns new rectangles covering exactly the part of {@code region} not covered by any of the
   * {@code obstructions}. The result is empty if the region is fully covered or degenerate, and is
   * a single copy of the region if nothing obstructs it. The order of the result is unspecified.
   *
   * <p>Neither argument is modified or retained.
   */
  public List<R> decompose(R2Rectangle<T> region, List<? extends R2Rectangle<T>> obstructions) {
    checkNotNull(region, "region");
    checkNotNull(obstructions, "obstructions");
    List<R2Rectangle<T>> shingles = sortedObstructions(region, obstructions);
    List<EventLine<T>> lines = eventLines(region, shingles);

    List<R> result = new ArrayList<>();
    List<UnfinishedRect<T>> active = new ArrayList<>();
    for (EventLine<T> line : lines) {
      List<Gap<T>> gaps = gapsAt(line.x, region, shingles);
      // A line where one obstruction ends and another begins does both, closing first.
      if (line.closes) {
        active = close(line.x, active, gaps, result);
      }
      if (line.opens) {
        open(line.x, active, gaps);
      }
    }

    for (UnfinishedRect<T> rect : active) {
      result.add(rectangles.fromSides(rect.left, region.right(), rect.top, rect.bottom));
    }

    if (log.isLoggable(Level.FINE)) {
      log.fine(
          Platform.formatString(
              "Decomposed [%s, %s]x[%s, %s] around %d obstructions at %d event lines into %d"
                  + " rectangles",
              region.left(),
              region.right(),
              region.bottom(),
              region.top(),
              shingles.size(),
              lines.size(),
              result.size()));
    }
    return result;
  }

  /** Returns a copy of the obstructions ordered by decreasing top, clipped if so configured. */
  private List<R2Rectangle<T>> sortedObstructions(
      R2Rectangle<T> region, List<? extends R2Rectangle<T>> obstructions) {
    List<R2Rectangle<T>> shingles = new ArrayList<>(obstructions.size());
    for (R2Rectangle<T> obstruction : obstructions) {
      checkNotNull(obstruction, "obstruction");
      if (options.clipObstructionsToRegion()) {
        rectangles.intersection(region, obstruction).ifPresent(shingles::add);
      } else {
        shingles.add(obstruction);
      }
    }
    // List.sort is stable, so obstructions with equal tops keep their input order.
    shingles.sort((a, b) -> coords.compare(b.top(), a.top()));
    return shingles;
  }

  /** Returns the event lines within the region's x-range, ordered from left to right. */
  private List<EventLine<T>> eventLines(R2Rectangle<T> region, List<R2Rectangle<T>> shingles) {
    if (coords.greaterThan(region.left(), region.right())) {
      return new ArrayList<>();
    }
    TreeMap<T, EventLine<T>> lines = new TreeMap<>(coords);
    lineAt(lines, region.left()).opens = true;
    for (R2Rectangle<T> shingle : shingles) {
      lineAt(lines, shingle.left()).closes = true;
      lineAt(lines, coords.add(shingle.right(), coords.one())).opens = true;
    }
    return new ArrayList<>(lines.subMap(region.left(), true, region.right(), true).values());
  }

  private static <T> EventLine<T> lineAt(Map<T, EventLine<T>> lines, T x) {
    return lines.computeIfAbsent(x, EventLine::new);
  }

  /**
   * Returns the free vertical intervals of the region at {@code x}, from top to bottom. The
   * obstructions must be ordered by decreasing top.
   */
  private List<Gap<T>> gapsAt(T x, R2Rectangle<T> region, List<R2Rectangle<T>> shingles) {
    List<Gap<T>> gaps = new ArrayList<>();
    // The lowest point covered so far, minus one.
    T cursor = region.top();
    for (R2Rectangle<T> shingle : shingles) {
      if (coords.greaterThan(shingle.left(), x) || coords.lessThan(shingle.right(), x)) {
        continue;
      }
      if (coords.greaterThan(cursor, shingle.top())) {
        gaps.add(new Gap<>(cursor, coords.add(shingle.top(), coords.one())));
      }
      // A shingle nested inside an earlier one must not raise the cursor again.
      cursor = coords.min(cursor, coords.subtract(shingle.bottom(), coords.one()));
    }
    if (coords.greaterOrEquals(cursor, region.bottom())) {
      gaps.add(new Gap<>(cursor, region.bottom()));
    }
    return gaps;
  }

  /**
   * Finishes every active rectangle that no longer fits in a gap at {@code x}, adding it to {@code
   * result}, and returns the rectangles still active afterwards. The parts of a finished rectangle
   * that are still free continue as new rectangles starting at {@code x}.
   */
  private List<UnfinishedRect<T>> close(
      T x, List<UnfinishedRect<T>> active, List<Gap<T>> gaps, List<R> result) {
    List<UnfinishedRect<T>> remaining = new ArrayList<>(active.size());
    List<UnfinishedRect<T>> started = new ArrayList<>();
    T previous = coords.subtract(x, coords.one());
    for (UnfinishedRect<T> rect : active) {
      if (containingGap(rect, gaps) != null) {
        remaining.add(rect);
        continue;
      }
      result.add(rectangles.fromSides(rect.left, previous, rect.top, rect.bottom));

      for (Gap<T> gap : gaps) {
        if (coords.greaterThan(gap.top, rect.top) && coords.greaterThan(rect.bottom, gap.bottom)) {
          continue;
        }
        T top = coords.min(rect.top, gap.top);
        T bottom = coords.max(rect.bottom, gap.bottom);
        if (coords.lessThan(top, bottom)) {
          // Entirely above or below the finished rectangle.
          continue;
        }
        if (!hasShape(active, top, bottom) && !hasShape(started, top, bottom)) {
          started.add(new UnfinishedRect<>(x, top, bottom));
        }
      }
    }
    remaining.addAll(started);
    return remaining;
  }

  /** Starts a rectangle at {@code x} for every gap whose exact shape is not already active. */
  private void open(T x, List<UnfinishedRect<T>> active, List<Gap<T>> gaps) {
    for (Gap<T> gap : gaps) {
      if (!hasShape(active, gap.top, gap.bottom)) {
        active.add(new UnfinishedRect<>(x, gap.top, gap.bottom));
      }
    }
  }

  private @Nullable Gap<T> containingGap(UnfinishedRect<T> rect, List<Gap<T>> gaps) {
    for (Gap<T> gap : gaps) {
      if (coords.greaterOrEquals(gap.top, rect.top)
          && coords.greaterOrEquals(rect.bottom, gap.bottom)) {
        return gap;
      }
    }
    return null;
  }

  private boolean hasShape(List<UnfinishedRect<T>> rects, T top, T bottom) {
    for (UnfinishedRect<T> rect : rects) {
      if (coords.isEqual(rect.top, top) && coords.isEqual(rect.bottom, bottom)) {
        return true;
      }
    }
    return false;
  }

  /** A vertical line where the free space may change. */
  private static final class EventLine<T> {
    final T x;
    // Gaps may open just past the right side of an obstruction.
    boolean opens;
    // Gaps may close at the left side of an obstruction.
    boolean closes;

    EventLine(T x) {
      this.x = x;
    }
  }

  /** A free vertical interval between two obstructions, inclusive at both ends. */
  private static final class Gap<T> {
    final T top;
    final T bottom;

    Gap(T top, T bottom) {
      this.top = top;
      this.bottom = bottom;
    }
  }

  /** A rectangle whose right side is not known yet. */
  private static final class UnfinishedRect<T> {
    final T left;
    final T top;
    final T bottom;

    UnfinishedRect(T left, T top, T bottom) {
      this.left = left;
      this.top = top;
      this.bottom = bottom;
    }
  }

  /** Options for {@link R2SweepLineDecomposer}. Instances are immutable. */
  @JsType
  public static final class Options {
    /** The default options: obstructions are used exactly as given. */
    public static final Options DEFAULT = builder().build();

    private final boolean clipObstructionsToRegion;

    private Options(Builder builder) {
      this.clipObstructionsToRegion = builder.clipObstructionsToRegion;
    }

    /** Returns a new Builder with default values. */
    public static Builder builder() {
      return new Builder();
    }

    /** Returns a new Builder initialized with the values of these options. */
    public Builder toBuilder() {
      return builder().setClipObstructionsToRegion(clipObstructionsToRegion);
    }

    /**
     * If true, each obstruction is replaced by its intersection with the region before the sweep,
     * and obstructions that do not intersect the region are ignored. Then every output rectangle
     * lies inside the region, even when some obstruction lies wholly above or below it.
     *
     * <p>If false, obstructions are used as given and only their x-range is limited by the region.
     *
     * <p>Default: false
     */
    public boolean clipObstructionsToRegion() {
      return clipObstructionsToRegion;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Options
          && clipObstructionsToRegion == ((Options) other).clipObstructionsToRegion;
    }

    @Override
    public int hashCode() {
      return Boolean.hashCode(clipObstructionsToRegion);
    }

    @Override
    public String toString() {
      return "Options{clipObstructionsToRegion=" + clipObstructionsToRegion + "}";
    }

    /** A builder of {@link Options}. */
    @JsType
    public static final class Builder {
      private boolean clipObstructionsToRegion = false;

      private Builder() {}

      /** Sets whether obstructions are clipped to the region. See the Options method. */
      @CanIgnoreReturnValue
      public Builder setClipObstructionsToRegion(boolean clipObstructionsToRegion) {
        this.clipObstructionsToRegion = clipObstructionsToRegion;
        return this;
      }

      /** Returns whether obstructions will be clipped to the region. */
      public boolean clipObstructionsToRegion() {
        return clipObstructionsToRegion;
      }

      /** Returns new Options with the values of this builder. */
      public Options build() {
        return new Options(this);
      }
    }
  }
}
