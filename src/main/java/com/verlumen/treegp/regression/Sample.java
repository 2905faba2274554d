package com.verlumen.treegp.regression;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** One input point of a two-parameter regression target. */
@AutoValue
abstract class Sample {
  /** The points both regression problems are scored on. */
  static final ImmutableList<Sample> DEFAULT_SAMPLES =
      ImmutableList.of(
          create(1, 2),
          create(4, 5),
          create(6, 7),
          create(8, 9),
          create(10, 11),
          create(45, 11),
          create(450, 660),
          create(2017, 13));

  static Sample create(long x, long y) {
    return new AutoValue_Sample(x, y);
  }

  abstract long x();

  abstract long y();
}
