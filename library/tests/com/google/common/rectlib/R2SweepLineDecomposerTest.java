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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies R2SweepLineDecomposer. */
@RunWith(JUnit4.class)
public class R2SweepLineDecomposerTest extends GeometryTestCase {
  private static final R2SweepLineDecomposer<Integer, R2IntRect> DECOMPOSER =
      new R2SweepLineDecomposer<>(OPS);

  private static final R2SweepLineDecomposer<Integer, R2IntRect> CLIPPING_DECOMPOSER =
      new R2SweepLineDecomposer<>(
          OPS, R2SweepLineDecomposer.Options.builder().setClipObstructionsToRegion(true).build());

  @Test
  public void testNoObstructions() {
    R2IntRect region = rect(0, 1, 2, 0);
    List<R2IntRect> pieces = DECOMPOSER.decompose(region, ImmutableList.of());
    assertThat(pieces).containsExactly(rect(0, 1, 2, 0));
  }

  @Test
  public void testSinglePointRegion() {
    R2IntRect region = rect(4, 4, 7, 7);
    assertThat(DECOMPOSER.decompose(region, ImmutableList.of())).containsExactly(region);
    assertThat(DECOMPOSER.decompose(region, ImmutableList.of(region))).isEmpty();
  }

  @Test
  public void testFullyObstructed() {
    R2IntRect region = rect(0, 1, 2, 0);
    assertThat(DECOMPOSER.decompose(region, ImmutableList.of(region))).isEmpty();
    assertThat(DECOMPOSER.decompose(region, ImmutableList.of(rect(-5, 5, 5, -5)))).isEmpty();
  }

  @Test
  public void testObstructedAlongLeftSide() {
    R2IntRect region = rect(0, 5, 5, 0);
    R2IntRect obstruction = rect(0, 2, 5, 1);
    List<R2IntRect> pieces = DECOMPOSER.decompose(region, ImmutableList.of(obstruction));
    // One piece along the bottom edge and one at the end. They share the point (3, 0).
    assertThat(pieces).containsExactly(rect(0, 5, 0, 0), rect(3, 5, 5, 0));
    assertCoversFreeArea(region, ImmutableList.of(obstruction), pieces);
  }

  @Test
  public void testHoleInTheMiddle() {
    R2IntRect region = rect(0, 5, 5, 0);
    R2IntRect hole = rect(2, 3, 3, 2);
    List<R2IntRect> pieces = DECOMPOSER.decompose(region, ImmutableList.of(hole));
    assertThat(pieces)
        .containsExactly(rect(0, 1, 5, 0), rect(2, 5, 5, 4), rect(2, 5, 1, 0), rect(4, 5, 5, 0));
    assertCoversFreeArea(region, ImmutableList.of(hole), pieces);
  }

  @Test
  public void testObstructedAlongRightSide() {
    R2IntRect region = rect(0, 9, 9, 0);
    R2IntRect obstruction = rect(5, 9, 6, 3);
    List<R2IntRect> pieces = DECOMPOSER.decompose(region, ImmutableList.of(obstruction));
    assertThat(pieces).containsExactly(rect(0, 4, 9, 0), rect(5, 9, 9, 7), rect(5, 9, 2, 0));
  }

  @Test
  public void testObstructionEndsWhereAnotherBegins() {
    // The line at x = 3 both closes (b starts) and opens (a ended at x = 2).
    R2IntRect region = rect(0, 9, 9, 0);
    R2IntRect a = rect(0, 2, 9, 0);
    R2IntRect b = rect(3, 5, 4, 0);
    List<R2IntRect> pieces = DECOMPOSER.decompose(region, ImmutableList.of(a, b));
    assertThat(pieces).containsExactly(rect(3, 9, 9, 5), rect(6, 9, 9, 0));
    assertCoversFreeArea(region, ImmutableList.of(a, b), pieces);
  }

  @Test
  public void testStackedObstructionsWithEqualTops() {
    R2IntRect region = rect(0, 6, 6, 0);
    List<R2IntRect> obstructions = ImmutableList.of(rect(1, 2, 4, 3), rect(4, 5, 4, 1));
    List<R2IntRect> pieces = DECOMPOSER.decompose(region, obstructions);
    assertCoversFreeArea(region, obstructions, pieces);
    assertThat(pieces).contains(rect(0, 0, 6, 0));
    assertThat(pieces).contains(rect(1, 6, 6, 5));
    assertThat(pieces).contains(rect(6, 6, 6, 0));
  }

  @Test
  public void testNestedObstructions() {
    // The inner obstruction lies within the outer one and must not create a fake gap.
    R2IntRect region = rect(0, 4, 8, 0);
    List<R2IntRect> obstructions = ImmutableList.of(rect(0, 4, 6, 2), rect(1, 3, 5, 3));
    List<R2IntRect> pieces = DECOMPOSER.decompose(region, obstructions);
    assertThat(pieces).containsExactly(rect(0, 4, 8, 7), rect(0, 4, 1, 0));
  }

  @Test
  public void testObstructionOutsideRegion() {
    R2IntRect region = rect(0, 4, 4, 0);
    assertThat(DECOMPOSER.decompose(region, ImmutableList.of(rect(10, 12, 4, 0))))
        .containsExactly(region);
    assertThat(DECOMPOSER.decompose(region, ImmutableList.of(rect(-6, -1, 4, 0))))
        .containsExactly(region);
  }

  @Test
  public void testObstructionCrossingLeftSide() {
    R2IntRect region = rect(0, 9, 9, 0);
    R2IntRect obstruction = rect(-5, 3, 9, 5);
    List<R2IntRect> pieces = DECOMPOSER.decompose(region, ImmutableList.of(obstruction));
    assertThat(pieces).containsExactly(rect(0, 9, 4, 0), rect(4, 9, 9, 0));
  }

  @Test
  public void testObstructionAboveRegionIsHarmless() {
    R2IntRect region = rect(0, 9, 9, 0);
    List<R2IntRect> pieces = DECOMPOSER.decompose(region, ImmutableList.of(rect(0, 5, 20, 15)));
    assertThat(pieces).containsExactly(region);
  }

  @Test
  public void testObstructionBelowRegionWithoutClipping() {
    // Only the x-range of an obstruction is limited by the region, so the gap above an obstruction
    // that lies wholly below the region reaches below the region.
    R2IntRect region = rect(0, 9, 9, 0);
    R2IntRect below = rect(0, 5, -5, -8);
    List<R2IntRect> pieces = DECOMPOSER.decompose(region, ImmutableList.of(below));
    assertThat(pieces).containsExactly(rect(0, 9, 9, -4), rect(6, 9, 9, 0));
  }

  @Test
  public void testObstructionBelowRegionWithClipping() {
    R2IntRect region = rect(0, 9, 9, 0);
    R2IntRect below = rect(0, 5, -5, -8);
    assertThat(CLIPPING_DECOMPOSER.decompose(region, ImmutableList.of(below)))
        .containsExactly(region);
  }

  @Test
  public void testClippingKeepsOverlappingPart() {
    R2IntRect region = rect(0, 5, 5, 0);
    R2IntRect obstruction = rect(-3, 2, 9, 1);
    assertThat(CLIPPING_DECOMPOSER.decompose(region, ImmutableList.of(obstruction)))
        .containsExactly(rect(0, 5, 0, 0), rect(3, 5, 5, 0));
  }

  @Test
  public void testDegenerateRegion() {
    assertThat(DECOMPOSER.decompose(rect(5, 0, 5, 0), ImmutableList.of())).isEmpty();
    assertThat(DECOMPOSER.decompose(rect(0, 5, 0, 5), ImmutableList.of())).isEmpty();
    assertThat(DECOMPOSER.decompose(rect(5, 0, 5, 0), ImmutableList.of(rect(0, 5, 5, 0))))
        .isEmpty();
  }

  @Test
  public void testMixedObstructionTypes() {
    R2IntRect region = rect(0, 5, 5, 0);
    List<R2Rectangle<Integer>> obstructions = new ArrayList<>();
    obstructions.add(R2Box.fromSides(0, 2, 5, 1));
    List<R2IntRect> pieces = region.unobstructedSubrectangles(obstructions);
    assertThat(pieces).containsExactly(rect(0, 5, 0, 0), rect(3, 5, 5, 0));
  }

  @Test
  public void testInputIsNotModified() {
    R2IntRect region = rect(0, 9, 9, 0);
    List<R2IntRect> obstructions = new ArrayList<>();
    obstructions.add(rect(1, 2, 3, 1));
    obstructions.add(rect(4, 6, 8, 5));
    obstructions.add(rect(7, 8, 5, 0));
    List<R2IntRect> copy = new ArrayList<>(obstructions);
    List<R2IntRect> pieces = DECOMPOSER.decompose(region, obstructions);
    assertEquals(copy, obstructions);
    assertCoversFreeArea(region, obstructions, pieces);
  }

  @Test
  public void testDeterministic() {
    R2IntRect region = rect(0, 20, 20, 0);
    for (int iter = 0; iter < 20; iter++) {
      List<R2IntRect> obstructions = randomRects(8, -2, 22);
      assertEquals(
          DECOMPOSER.decompose(region, obstructions), DECOMPOSER.decompose(region, obstructions));
    }
  }

  @Test
  public void testResultIsOwnedByCaller() {
    R2IntRect region = rect(0, 3, 3, 0);
    List<R2IntRect> pieces = DECOMPOSER.decompose(region, ImmutableList.of());
    pieces.add(rect(9, 9, 9, 9));
    assertThat(DECOMPOSER.decompose(region, ImmutableList.of())).containsExactly(region);
  }

  @Test
  public void testLongCoordinates() {
    R2Rectangles<Long, R2Box<Long>> ops = R2Box.ops(Coordinates.longs());
    long base = 1L << 40;
    R2Box<Long> region = R2Box.fromSides(base, base + 5, base + 5, base);
    R2Box<Long> obstruction = R2Box.fromSides(base, base + 2, base + 5, base + 1);
    assertThat(ops.unobstructedSubrectangles(region, ImmutableList.of(obstruction)))
        .containsExactly(
            R2Box.fromSides(base, base + 5, base, base),
            R2Box.fromSides(base + 3, base + 5, base + 5, base));
  }

  @Test
  public void testBigIntegerCoordinates() {
    R2Rectangles<BigInteger, R2Box<BigInteger>> ops = R2Box.ops(Coordinates.bigIntegers());
    BigInteger big = BigInteger.TEN.pow(30);
    R2Box<BigInteger> region = R2Box.fromSides(BigInteger.ZERO, big, big, BigInteger.ZERO);
    R2Box<BigInteger> obstruction =
        R2Box.fromSides(BigInteger.ZERO, big, big, BigInteger.ONE);
    assertThat(ops.unobstructedSubrectangles(region, ImmutableList.of(obstruction)))
        .containsExactly(R2Box.fromSides(BigInteger.ZERO, big, BigInteger.ZERO, BigInteger.ZERO));
  }

  @Test
  public void testRandomObstructionsCoverFreeArea() {
    for (int iter = 0; iter < 300; iter++) {
      R2IntRect region = randomRect(0, 12);
      List<R2IntRect> obstructions = new ArrayList<>();
      for (R2IntRect obstruction : randomRects(6, -3, 15)) {
        // Obstructions wholly below the region would widen the gaps below it.
        if (obstruction.top() >= region.bottom()) {
          obstructions.add(obstruction);
        }
      }
      assertCoversFreeArea(region, obstructions, DECOMPOSER.decompose(region, obstructions));
    }
  }

  @Test
  public void testRandomObstructionsWithClipping() {
    for (int iter = 0; iter < 300; iter++) {
      R2IntRect region = randomRect(0, 12);
      List<R2IntRect> obstructions = randomRects(6, -3, 15);
      assertCoversFreeArea(
          region, obstructions, CLIPPING_DECOMPOSER.decompose(region, obstructions));
    }
  }

  @Test
  public void testPiecesAreMaximalToTheRight() {
    // A piece that stops before the region's right side is blocked just past its right side.
    for (int iter = 0; iter < 200; iter++) {
      R2IntRect region = randomRect(0, 12);
      List<R2IntRect> obstructions = randomRects(5, 0, 12);
      for (R2IntRect piece : CLIPPING_DECOMPOSER.decompose(region, obstructions)) {
        if (piece.right() < region.right()) {
          boolean blocked = false;
          for (int y = piece.bottom(); y <= piece.top(); y++) {
            blocked |= anyContains(obstructions, piece.right() + 1, y);
          }
          assertTrue(piece + " could extend to the right", blocked);
        }
      }
    }
  }

  @Test
  public void testOptions() {
    R2SweepLineDecomposer.Options defaults = R2SweepLineDecomposer.Options.DEFAULT;
    assertFalse(defaults.clipObstructionsToRegion());
    assertEquals(defaults, DECOMPOSER.options());
    R2SweepLineDecomposer.Options clipping = CLIPPING_DECOMPOSER.options();
    assertTrue(clipping.clipObstructionsToRegion());
    assertEquals(clipping, clipping.toBuilder().build());
    assertEquals(defaults, clipping.toBuilder().setClipObstructionsToRegion(false).build());
    assertEquals(defaults.hashCode(), R2SweepLineDecomposer.Options.builder().build().hashCode());
  }

  @Test
  public void testNullArguments() {
    R2IntRect region = rect(0, 1, 1, 0);
    assertThrows(NullPointerException.class, () -> DECOMPOSER.decompose(null, ImmutableList.of()));
    assertThrows(NullPointerException.class, () -> DECOMPOSER.decompose(region, null));
    List<R2IntRect> withNull = new ArrayList<>();
    withNull.add(null);
    assertThrows(NullPointerException.class, () -> DECOMPOSER.decompose(region, withNull));
  }
}
