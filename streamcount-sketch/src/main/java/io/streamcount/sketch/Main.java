package io.streamcount.sketch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Feeds synthetic streams of known cardinality into an {@link AdaptiveHyperLogLog} and logs the relative error.
 *
 * <p>Arguments: [sparse|dense], the initial register mode, sparse by default.
 */
public class Main
{
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private static final int[] CARDINALITIES = {1_000, 10_000, 100_000, 1_000_000, 10_000_000};
  // streams up to this cardinality contain duplicates and are tracked with a set
  private static final int MAX_SET_CARDINALITY = 1_000_000;

  static int precisionForCardinality(long cardinality)
  {
    if (cardinality <= 10_000) {
      return 12;
    }
    if (cardinality <= 1_000_000) {
      return 13;
    }
    return 14;
  }

  static AdaptiveHyperLogLog.Mode parseMode(String[] args)
  {
    if (args.length == 0) {
      return AdaptiveHyperLogLog.Mode.SPARSE;
    }
    return AdaptiveHyperLogLog.Mode.valueOf(args[0].toUpperCase(Locale.ROOT));
  }

  public static void main(String[] args)
  {
    final AdaptiveHyperLogLog.Mode mode;
    try {
      mode = parseMode(args);
    } catch (IllegalArgumentException e) {
      System.err.println("Arguments: [sparse|dense]");
      System.exit(1);
      return;
    }

    for (int trueCardinality : CARDINALITIES) {
      AdaptiveHyperLogLog hll = AdaptiveHyperLogLog.create(precisionForCardinality(trueCardinality), mode);
      final long start = System.currentTimeMillis();

      if (trueCardinality <= MAX_SET_CARDINALITY) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        Set<Integer> set = new HashSet<>();
        while (set.size() < trueCardinality) {
          int value = random.nextInt(trueCardinality * 100);
          hll.add(Integer.toString(value).getBytes(StandardCharsets.UTF_8));
          set.add(value);
        }
      } else {
        FastRandomIdGenerator randomIdGenerator = new FastRandomIdGenerator();
        while (randomIdGenerator.generated() < trueCardinality) {
          hll.add(randomIdGenerator.generate());
        }
      }

      final double estimatedCardinality = hll.estimate();
      final String estimated = String.format("%.2f", estimatedCardinality);
      final String relativeError = String.format(
          "%.2f",
          Math.abs(CardinalityEstimatorAccuracy.relativeError(estimatedCardinality, trueCardinality))
      );
      LOG.info(
          "True Cardinality: {}, Estimated Cardinality: {}, Relative Error: {}%, p={}, sparse={}, {} ms",
          trueCardinality,
          estimated,
          relativeError,
          hll.precision(),
          hll.isSparse(),
          System.currentTimeMillis() - start
      );
    }
  }
}
