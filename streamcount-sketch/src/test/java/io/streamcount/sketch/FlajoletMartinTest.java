package io.streamcount.sketch;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FlajoletMartinTest
{
  private static final long SEED = 20240607L;

  private static long[] stream(int cardinality)
  {
    long[] values = new long[cardinality];
    for (int i = 0; i < cardinality; i++) {
      values[i] = i;
    }
    return values;
  }

  @Test
  public void testHarmonicMeanAccuracy()
  {
    FlajoletMartin fm = new FlajoletMartin(FlajoletMartin.Mean.HARMONIC, 16, 256, SEED);
    fm.addAll(stream(5000));
    assertEquals(5000, fm.estimate(), 5000 * 0.15);
  }

  @Test
  public void testConcurrentAddMatchesSequentialAdd()
  {
    for (FlajoletMartin.Mean mean : FlajoletMartin.Mean.values()) {
      FlajoletMartin sequential = new FlajoletMartin(mean, 8, 64, SEED);
      FlajoletMartin concurrent = new FlajoletMartin(mean, 8, 64, SEED);
      long[] values = stream(3000);
      for (long value : values) {
        sequential.add(value);
      }
      concurrent.addAll(values);
      assertEquals(sequential.estimate(), concurrent.estimate(), "mean=" + mean);
    }
  }

  @Test
  public void testEstimateNeverDecreases()
  {
    for (FlajoletMartin.Mean mean : FlajoletMartin.Mean.values()) {
      FlajoletMartin fm = new FlajoletMartin(mean, 8, 64, SEED);
      double previous = fm.estimate();
      for (int round = 0; round < 5; round++) {
        for (int i = 0; i < 1000; i++) {
          fm.add(("value-" + round + "-" + i).getBytes(StandardCharsets.UTF_8));
        }
        double current = fm.estimate();
        assertTrue(current >= previous, "mean=" + mean + " round=" + round);
        assertTrue(current > 0);
        previous = current;
      }
    }
  }

  @Test
  public void testInvalidParameters()
  {
    assertThrows(IllegalArgumentException.class, () -> new FlajoletMartin(FlajoletMartin.Mean.HARMONIC, 0, 256, SEED));
    assertThrows(IllegalArgumentException.class, () -> new FlajoletMartin(FlajoletMartin.Mean.HARMONIC, 16, 0, SEED));
    assertThrows(NullPointerException.class, () -> new FlajoletMartin(null, 16, 256, SEED));
  }

  @Test
  public void testNameAndFootprint()
  {
    FlajoletMartin arithmetic = new FlajoletMartin(FlajoletMartin.Mean.ARITHMETIC);
    assertEquals("fm-arithmetic", arithmetic.name());
    assertEquals(16 * 256 * 4, arithmetic.memoryFootprint());
    assertEquals("fm-harmonic", new FlajoletMartin(FlajoletMartin.Mean.HARMONIC).name());
  }
}
