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

/** The {@link Coordinates} instances for the JDK's integral number types. */
final class StandardCoordinates {
  static final Coordinates<Integer> INTEGERS = new IntegerCoordinates();
  static final Coordinates<Long> LONGS = new LongCoordinates();
  static final Coordinates<BigInteger> BIG_INTEGERS = new BigIntegerCoordinates();

  private StandardCoordinates() {}

  private static final class IntegerCoordinates implements Coordinates<Integer> {
    @Override
    public Integer add(Integer a, Integer b) {
      return a + b;
    }

    @Override
    public Integer subtract(Integer a, Integer b) {
      return a - b;
    }

    @Override
    public Integer multiply(Integer a, Integer b) {
      return a * b;
    }

    @Override
    public Integer zero() {
      return 0;
    }

    @Override
    public Integer one() {
      return 1;
    }

    @Override
    public int compare(Integer a, Integer b) {
      return Integer.compare(a, b);
    }

    @Override
    public String toString() {
      return "Coordinates.integers()";
    }
  }

  private static final class LongCoordinates implements Coordinates<Long> {
    @Override
    public Long add(Long a, Long b) {
      return a + b;
    }

    @Override
    public Long subtract(Long a, Long b) {
      return a - b;
    }

    @Override
    public Long multiply(Long a, Long b) {
      return a * b;
    }

    @Override
    public Long zero() {
      return 0L;
    }

    @Override
    public Long one() {
      return 1L;
    }

    @Override
    public int compare(Long a, Long b) {
      return Long.compare(a, b);
    }

    @Override
    public String toString() {
      return "Coordinates.longs()";
    }
  }

  private static final class BigIntegerCoordinates implements Coordinates<BigInteger> {
    @Override
    public BigInteger add(BigInteger a, BigInteger b) {
      return a.add(b);
    }

    @Override
    public BigInteger subtract(BigInteger a, BigInteger b) {
      return a.subtract(b);
    }

    @Override
    public BigInteger multiply(BigInteger a, BigInteger b) {
      return a.multiply(b);
    }

    @Override
    public BigInteger zero() {
      return BigInteger.ZERO;
    }

    @Override
    public BigInteger one() {
      return BigInteger.ONE;
    }

    @Override
    public int compare(BigInteger a, BigInteger b) {
      return a.compareTo(b);
    }

    @Override
    public String toString() {
      return "Coordinates.bigIntegers()";
    }
  }
}
