package com.verlumen.treegp.regression;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RegressionFitnessTest {
  private static long sum(Sample sample) {
    return sample.x() + sample.y();
  }

  @Test
  public void score_exactSmallProgram_isOne() {
    double fitness =
        RegressionFitness.score(
            Sample.DEFAULT_SAMPLES, 30, RegressionFitnessTest::sum, RegressionFitnessTest::sum);

    assertThat(fitness).isEqualTo(1.0);
  }

  @Test
  public void score_exactLargeProgram_isPenalized() {
    double fitness =
        RegressionFitness.score(
            Sample.DEFAULT_SAMPLES, 31, RegressionFitnessTest::sum, RegressionFitnessTest::sum);

    assertThat(fitness).isWithin(1e-12).of(1.0 - Math.log10(2));
  }

  @Test
  public void score_averagesErrorsOverSamples() {
    ImmutableList<Sample> samples = ImmutableList.of(Sample.create(0, 0), Sample.create(1, 1));

    double fitness =
        RegressionFitness.score(
            samples, 3, sample -> sample.x() == 1 ? 1001 : 0, sample -> sample.x());

    // Sample one is exact, sample two is off by 1000.
    assertThat(fitness).isWithin(1e-12).of(0.5);
  }

  @Test
  public void score_wrappedAnswer_isFarBelowOne() {
    // 8^21 wraps to Long.MIN_VALUE; adding the expected value keeps the difference at MIN_VALUE.
    Sample sample = Sample.create(8, 9);
    long expected = FunctionSolver.target(sample.x(), sample.y());

    double fitness =
        RegressionFitness.score(
            ImmutableList.of(sample),
            1,
            unused -> Long.MIN_VALUE + expected,
            unused -> expected);

    assertThat(fitness).isAtMost(1.0);
    assertThat(fitness).isLessThan(0.0);
  }

  @Test
  public void sizePenalty_growsPerThirtyNodes() {
    assertThat(RegressionFitness.sizePenalty(1)).isEqualTo(0.0);
    assertThat(RegressionFitness.sizePenalty(30)).isEqualTo(0.0);
    assertThat(RegressionFitness.sizePenalty(61)).isWithin(1e-12).of(Math.log10(3));
  }

  @Test
  public void score_withoutSamples_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> RegressionFitness.score(ImmutableList.of(), 1, sample -> 0, sample -> 0));
  }
}
