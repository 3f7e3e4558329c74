package io.streamcount.sketch;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Compares estimators on synthetic streams of known cardinality.
 *
 * <p>A stream draws random values from {@code [0, cardinality * spread)} until it holds {@code cardinality}
 * distinct values, so it contains duplicates. Every estimator sees the same stream.
 *
 * <p>Arguments: {@code <estimator>.. }, for example {@code hll12 hlldense12 fm-harmonic}.
 */
public class CardinalityEstimatorAccuracy
{
  private static final Logger LOG = LoggerFactory.getLogger(CardinalityEstimatorAccuracy.class);

  static final int[] DEFAULT_CARDINALITIES = {1_000, 10_000, 100_000};
  static final int DEFAULT_SPREAD = 100;

  private final int spread;
  private final Random random;

  public CardinalityEstimatorAccuracy(int spread, long seed)
  {
    Preconditions.checkArgument(spread > 1, "invalid spread [%s] : should be greater than 1", spread);
    this.spread = spread;
    this.random = new Random(seed);
  }

  /**
   * @return values in draw order, duplicates included, holding exactly {@code cardinality} distinct values
   */
  long[] stream(int cardinality)
  {
    Preconditions.checkArgument(cardinality > 0, "invalid cardinality [%s] : should be positive", cardinality);
    final int bound = Math.multiplyExact(cardinality, spread);
    Set<Integer> distinct = new HashSet<>();
    long[] values = new long[cardinality];
    int size = 0;
    while (distinct.size() < cardinality) {
      int value = random.nextInt(bound);
      distinct.add(value);
      if (size == values.length) {
        values = Arrays.copyOf(values, size * 2);
      }
      values[size++] = value;
    }
    return Arrays.copyOf(values, size);
  }

  public List<Comparison> compare(int[] cardinalities, String... estimatorNames)
  {
    List<Comparison> comparisons = new ArrayList<>();
    for (int trueCardinality : cardinalities) {
      final long[] values = stream(trueCardinality);
      for (String name : estimatorNames) {
        CardinalityEstimator estimator = CardinalityEstimators.get(name);
        if (estimator instanceof FlajoletMartin) {
          ((FlajoletMartin) estimator).addAll(values);
        } else {
          for (long value : values) {
            estimator.add(value);
          }
        }
        comparisons.add(new Comparison(name, trueCardinality, values.length, estimator.estimate()));
      }
    }
    return comparisons;
  }

  /**
   * @return signed relative error in percent
   */
  static double relativeError(double estimate, long actual)
  {
    return 100.0 * (estimate - actual) / actual;
  }

  public static void main(String[] args)
  {
    if (args.length < 1) {
      System.err.println("Arguments: <estimator>..");
      System.exit(1);
    }

    CardinalityEstimatorAccuracy accuracy = new CardinalityEstimatorAccuracy(DEFAULT_SPREAD, System.nanoTime());
    for (Comparison comparison : accuracy.compare(DEFAULT_CARDINALITIES, args)) {
      LOG.info(
          "{} stream of {} values: true cardinality {}, estimated {}, relative error {}%",
          comparison.estimator,
          comparison.streamLength,
          comparison.trueCardinality,
          Math.round(comparison.estimate),
          Math.abs(comparison.relativeError())
      );
    }
  }

  static class Comparison
  {
    final String estimator;
    final long trueCardinality;
    final int streamLength;
    final double estimate;

    Comparison(String estimator, long trueCardinality, int streamLength, double estimate)
    {
      this.estimator = estimator;
      this.trueCardinality = trueCardinality;
      this.streamLength = streamLength;
      this.estimate = estimate;
    }

    double relativeError()
    {
      return CardinalityEstimatorAccuracy.relativeError(estimate, trueCardinality);
    }
  }
}
