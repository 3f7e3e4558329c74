package io.streamcount.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicIntegerArray;

/**
 * Flajolet-Martin estimator used as a comparison baseline.
 *
 * <p>Every register owns a seeded hash function {@code mix(a * x + b)} truncated to 32 bits and keeps the
 * maximum bit pattern observed. Registers are split into groups, each group produces one estimate, and
 * the median of the group estimates is returned.
 *
 * <p>Registers are updated with an atomic max, so {@link #addAll(long[])} may feed every group from its own
 * thread.
 */
public class FlajoletMartin implements CardinalityEstimator
{
  private static final Logger LOG = LoggerFactory.getLogger(FlajoletMartin.class);

  public static final int DEFAULT_GROUPS = 16;
  public static final int DEFAULT_HASHES_PER_GROUP = 256;

  private static final long MASK_32 = (1L << 32) - 1;
  private static final HashFunction BYTES_HASH_FUNCTION = Hashing.murmur3_128();

  public enum Mean
  {
    /**
     * Registers record the trailing ones of each hash, a group estimate is a scaled mean of {@code 2^R}.
     */
    ARITHMETIC,
    /**
     * Registers record the position of the lowest one bit, a group estimate is a harmonic mean of {@code 2^R}.
     */
    HARMONIC
  }

  private final Mean mean;
  private final int groups;
  private final int hashesPerGroup;
  private final double correction;

  // multiplier (odd) and increment of each register's hash function
  private final long[][] multipliers;
  private final long[][] increments;
  private final AtomicIntegerArray[] registers;

  public FlajoletMartin(Mean mean)
  {
    this(mean, DEFAULT_GROUPS, DEFAULT_HASHES_PER_GROUP, new Random().nextLong());
  }

  public FlajoletMartin(Mean mean, int groups, int hashesPerGroup, long seed)
  {
    Preconditions.checkNotNull(mean, "mean");
    Preconditions.checkArgument(groups > 0, "invalid groups [%s] : should be positive", groups);
    Preconditions.checkArgument(
        hashesPerGroup > 0,
        "invalid hashesPerGroup [%s] : should be positive",
        hashesPerGroup
    );
    this.mean = mean;
    this.groups = groups;
    this.hashesPerGroup = hashesPerGroup;
    if (mean == Mean.ARITHMETIC) {
      // empirically tuned instead of the standard 0.7213
      this.correction = 0.2404 / (1 + 1.079 / hashesPerGroup);
    } else {
      this.correction = 0.7213 / (1 + 1.079 / hashesPerGroup);
    }

    Random random = new Random(seed);
    this.multipliers = new long[groups][hashesPerGroup];
    this.increments = new long[groups][hashesPerGroup];
    this.registers = new AtomicIntegerArray[groups];
    for (int g = 0; g < groups; g++) {
      for (int j = 0; j < hashesPerGroup; j++) {
        multipliers[g][j] = random.nextLong() | 1;
        increments[g][j] = random.nextLong();
      }
      registers[g] = new AtomicIntegerArray(hashesPerGroup);
    }
  }

  // MurmurHash3 64-bit finalizer
  private static long fmix64(long k)
  {
    k ^= k >>> 33;
    k *= 0xff51afd7ed558ccdL;
    k ^= k >>> 33;
    k *= 0xc4ceb9fe1a85ec53L;
    k ^= k >>> 33;
    return k;
  }

  // MurmurHash3 32-bit finalizer
  private static int fmix32(int h)
  {
    h ^= h >>> 16;
    h *= 0xcc9e2d51;
    h ^= h >>> 16;
    h *= 0x1b873593;
    h ^= h >>> 16;
    return h;
  }

  private int hash(int group, int j, long value)
  {
    final long x = multipliers[group][j] * value + increments[group][j];
    if (mean == Mean.ARITHMETIC) {
      return fmix32((int) x);
    }
    return (int) (fmix64(x) & MASK_32);
  }

  private int observation(int hash)
  {
    if (mean == Mean.ARITHMETIC) {
      return Integer.numberOfTrailingZeros(~hash); // position of the rightmost zero
    }
    return hash == 0 ? 0 : Integer.numberOfTrailingZeros(hash) + 1;
  }

  private void addToGroup(int group, long value)
  {
    final AtomicIntegerArray groupRegisters = registers[group];
    for (int j = 0; j < hashesPerGroup; j++) {
      final int r = observation(hash(group, j, value));
      if (groupRegisters.get(j) < r) {
        groupRegisters.accumulateAndGet(j, r, Math::max);
      }
    }
  }

  @Override
  public void add(byte[] value)
  {
    add(BYTES_HASH_FUNCTION.hashBytes(value).asLong());
  }

  @Override
  public void add(long value)
  {
    for (int g = 0; g < groups; g++) {
      addToGroup(g, value);
    }
  }

  /**
   * Adds every value of the stream, feeding each group from its own worker thread. The result is the
   * same as calling {@link #add(long)} for every value.
   */
  public void addAll(long[] values)
  {
    Preconditions.checkNotNull(values, "values");
    ExecutorService executor = Executors.newFixedThreadPool(
        groups,
        new ThreadFactoryBuilder().setNameFormat("fm-group-%d").setDaemon(true).build()
    );
    try {
      List<Callable<Void>> tasks = new ArrayList<>(groups);
      for (int g = 0; g < groups; g++) {
        final int group = g;
        tasks.add(() -> {
          for (long value : values) {
            addToGroup(group, value);
          }
          return null;
        });
      }

      for (Future<Void> future : executor.invokeAll(tasks)) {
        future.get();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while adding values", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new IllegalStateException(e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  @Override
  public double estimate()
  {
    double[] estimates = new double[groups];
    for (int g = 0; g < groups; g++) {
      estimates[g] = groupEstimate(registers[g]);
    }
    Arrays.sort(estimates);
    LOG.debug("{} group estimates range from {} to {}", mean, estimates[0], estimates[groups - 1]);
    return estimates[groups / 2];
  }

  private double groupEstimate(AtomicIntegerArray groupRegisters)
  {
    double sum = 0.0;
    if (mean == Mean.ARITHMETIC) {
      for (int j = 0; j < hashesPerGroup; j++) {
        sum += Math.scalb(1.0, groupRegisters.get(j));
      }
      return correction * sum / hashesPerGroup;
    }

    for (int j = 0; j < hashesPerGroup; j++) {
      sum += Math.scalb(1.0, -groupRegisters.get(j));
    }
    // the harmonic mean is less sensitive to large outliers than the arithmetic mean
    return sum > 0 ? correction * hashesPerGroup / sum : 0;
  }

  @Override
  public long memoryFootprint()
  {
    return (long) groups * hashesPerGroup * Integer.BYTES; // registers only, hash parameters are not counted
  }

  @Override
  public String name()
  {
    return mean == Mean.ARITHMETIC ? "fm-arithmetic" : "fm-harmonic";
  }
}
