package io.streamcount.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * HyperLogLog with an adaptive register storage, see http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>While the cardinality is small the registers live in a sparse table keyed by a 25-bits index.
 * Once the sparse table would take as much memory as the dense registers, all entries are folded
 * into a {@code byte[2^p]} and the sparse table is dropped. This transition happens at most once and
 * is never reversed.
 *
 * <p>Instances are not thread-safe. Concurrent {@link #add} calls need external synchronization,
 * {@link #estimate()} may run concurrently with other {@code estimate()} calls only.
 */
public class AdaptiveHyperLogLog implements CardinalityEstimator
{
  private static final Logger LOG = LoggerFactory.getLogger(AdaptiveHyperLogLog.class);

  public static final int MIN_PRECISION = 2;
  public static final int MAX_PRECISION = 18;

  // estimated footprint of one sparse entry: a 32-bits index and an 8-bits rank
  static final int SPARSE_ENTRY_BYTES = Integer.BYTES + Byte.BYTES;
  static final int SPARSE_REGISTER_COUNT = 1 << RegisterIndexing.SPARSE_PRECISION;

  public enum Mode
  {
    SPARSE, DENSE
  }

  /**
   * Arguments fed into linear counting while the registers are sparse.
   */
  public enum SparseEstimation
  {
    /**
     * Occupied entry count against the dense register count, compatible with estimates of earlier releases.
     */
    REFERENCE,
    /**
     * Empty entry count against the size of the 25-bits sparse index space.
     */
    SPARSE_RESOLUTION
  }

  private final int p;
  private final int m;
  private final double alpha;
  private final HashFunction hashFunction;
  private final Mode initialMode;
  private final SparseEstimation sparseEstimation;

  private Representation representation;

  public static AdaptiveHyperLogLog create(int precision, Mode mode)
  {
    return builder().precision(precision).mode(mode).build();
  }

  public static Builder builder()
  {
    return new Builder();
  }

  private AdaptiveHyperLogLog(Builder builder)
  {
    if (builder.precision < MIN_PRECISION || builder.precision > MAX_PRECISION) {
      throw new InvalidPrecisionException(builder.precision, MIN_PRECISION, MAX_PRECISION);
    }
    this.p = builder.precision;
    this.m = 1 << p;
    this.alpha = HllFormulas.biasCorrection(m);
    this.hashFunction = builder.hashFunction;
    this.initialMode = builder.mode;
    this.sparseEstimation = builder.sparseEstimation;
    this.representation = initialMode == Mode.SPARSE ? new SparseRegisters() : new DenseRegisters();
  }

  @Override
  public void add(byte[] value)
  {
    addHash(hashFunction.hashBytes(value).asLong());
  }

  @Override
  public void add(long value)
  {
    addHash(hashFunction.hashLong(value).asLong());
  }

  void addHash(long hash)
  {
    representation.addHash(hash);

    if (representation instanceof SparseRegisters) {
      SparseRegisters sparse = (SparseRegisters) representation;
      if (shouldTransitionToDense(sparse)) {
        representation = sparse.toDense();
      }
    }
  }

  private boolean shouldTransitionToDense(SparseRegisters sparse)
  {
    return (long) sparse.count * SPARSE_ENTRY_BYTES >= (long) m * Byte.BYTES;
  }

  @Override
  public double estimate()
  {
    return representation.estimate();
  }

  @Override
  public long memoryFootprint()
  {
    return representation.memoryFootprint(); // not counting object headers and the sparse table's free slots
  }

  @Override
  public String name()
  {
    if (initialMode == Mode.DENSE) {
      return "hlldense" + p;
    }
    return (sparseEstimation == SparseEstimation.REFERENCE ? "hllref" : "hll") + p;
  }

  public int precision()
  {
    return p;
  }

  public int registerCount()
  {
    return m;
  }

  public double biasCorrection()
  {
    return alpha;
  }

  public boolean isSparse()
  {
    return representation instanceof SparseRegisters;
  }

  int sparseEntryCount()
  {
    return isSparse() ? ((SparseRegisters) representation).count : 0;
  }

  /**
   * @return a copy of the dense registers, or {@code null} while the registers are sparse
   */
  byte[] denseRegisters()
  {
    if (isSparse()) {
      return null;
    }
    return Arrays.copyOf(((DenseRegisters) representation).registers, m);
  }

  /**
   * @return a copy of the sparse entries (index to rank), empty once the registers are dense
   */
  Map<Integer, Integer> sparseRegisters()
  {
    Map<Integer, Integer> entries = new HashMap<>();
    if (isSparse()) {
      SparseRegisters sparse = (SparseRegisters) representation;
      for (int i = 0; i < sparse.keys.length; i++) {
        if (sparse.keys[i] != 0) {
          entries.put(sparse.keys[i] - 1, (int) sparse.ranks[i]);
        }
      }
    }
    return entries;
  }

  private abstract class Representation
  {
    abstract void addHash(long hash);

    abstract double estimate();

    abstract long memoryFootprint();
  }

  /**
   * Open addressing table from a 25-bits register index to its rank. Keys are stored as
   * {@code index + 1} so that 0 marks a free slot.
   */
  private final class SparseRegisters extends Representation
  {
    private static final int INITIAL_SIZE = 16;

    int[] keys; // keys.length should always be power of 2
    byte[] ranks;
    int count;

    SparseRegisters()
    {
      this.keys = new int[INITIAL_SIZE];
      this.ranks = new byte[INITIAL_SIZE];
    }

    @Override
    void addHash(long hash)
    {
      final int key = RegisterIndexing.index(hash, RegisterIndexing.SPARSE_PRECISION) + 1;
      final byte rank = RegisterIndexing.rank(hash, RegisterIndexing.SPARSE_PRECISION);

      int slot = slotOf(keys, key);
      if (keys[slot] == 0) {
        keys[slot] = key;
        ranks[slot] = rank;
        count++;
      } else if (ranks[slot] < rank) {
        ranks[slot] = rank;
      }

      // resize if half-full
      if (count > (keys.length >>> 1)) {
        resize(keys.length << 1);
      }
    }

    private int slotOf(int[] table, int key)
    {
      int slot = key & (table.length - 1);
      while (table[slot] != 0 && table[slot] != key) {
        slot = (slot + 1) & (table.length - 1);
      }
      return slot;
    }

    private void resize(final int newSize)
    {
      int[] newKeys = new int[newSize];
      byte[] newRanks = new byte[newSize];
      for (int i = 0; i < keys.length; i++) {
        if (keys[i] != 0) {
          int slot = slotOf(newKeys, keys[i]);
          newKeys[slot] = keys[i];
          newRanks[slot] = ranks[i];
        }
      }
      keys = newKeys;
      ranks = newRanks;
    }

    @Override
    double estimate()
    {
      if (count == 0) {
        return 0;
      }

      double registerSum = 0.0;
      for (int i = 0; i < keys.length; i++) {
        if (keys[i] != 0) {
          registerSum += Math.scalb(1.0, -ranks[i]);
        }
      }

      final double v = count;
      final double e = alpha * v * v / registerSum;
      if (e > HllFormulas.LINEAR_COUNTING_THRESHOLD * m) {
        return e;
      }

      if (sparseEstimation == SparseEstimation.REFERENCE) {
        return HllFormulas.linearCounting(count, m);
      }
      return HllFormulas.linearCounting(SPARSE_REGISTER_COUNT - count, SPARSE_REGISTER_COUNT);
    }

    @Override
    long memoryFootprint()
    {
      return (long) count * SPARSE_ENTRY_BYTES;
    }

    DenseRegisters toDense()
    {
      LOG.debug("Converting {} sparse entries to {} dense registers", count, m);

      DenseRegisters dense = new DenseRegisters();
      for (int i = 0; i < keys.length; i++) {
        if (keys[i] != 0) {
          dense.mergeRank(RegisterIndexing.sparseToDenseIndex(keys[i] - 1, p), ranks[i]);
        }
      }
      return dense;
    }
  }

  private final class DenseRegisters extends Representation
  {
    // each register actually only needs 7-bits,
    // we use `byte` here to simplify implementation
    final byte[] registers;

    DenseRegisters()
    {
      this.registers = new byte[m];
    }

    @Override
    void addHash(long hash)
    {
      mergeRank(RegisterIndexing.index(hash, p), RegisterIndexing.rank(hash, p));
    }

    void mergeRank(int index, byte rank)
    {
      // note that both operands can never be negative, so we don't need to use unsigned comparison
      if (registers[index] < rank) {
        registers[index] = rank;
      }
    }

    @Override
    double estimate()
    {
      double registerSum = 0.0;
      int zeros = 0;
      for (int i = 0; i < m; i++) {
        registerSum += Math.scalb(1.0, -registers[i]);
        if (registers[i] == 0) {
          zeros++;
        }
      }

      final double e = alpha * m * m / registerSum;
      if (e <= HllFormulas.LINEAR_COUNTING_THRESHOLD * m) { // small range correction
        return HllFormulas.linearCounting(zeros, m);
      }
      if (e <= HllFormulas.HIGH_CORRECTION_THRESHOLD) {
        return e;
      }
      if (e >= HllFormulas.TWO_TO_THE_THIRTY_TWO) { // the 32-bits space is saturated, log(1 - e / 2^32) is undefined
        return e;
      }
      return HllFormulas.largeRangeCorrection(e);
    }

    @Override
    long memoryFootprint()
    {
      return m;
    }
  }

  public static final class Builder
  {
    private int precision = 14;
    private Mode mode = Mode.SPARSE;
    private HashFunction hashFunction = Hashing.murmur3_128();
    private SparseEstimation sparseEstimation = SparseEstimation.SPARSE_RESOLUTION;

    private Builder()
    {
    }

    public Builder precision(int precision)
    {
      this.precision = precision;
      return this;
    }

    public Builder mode(Mode mode)
    {
      this.mode = Preconditions.checkNotNull(mode, "mode");
      return this;
    }

    public Builder hashFunction(HashFunction hashFunction)
    {
      Preconditions.checkNotNull(hashFunction, "hashFunction");
      Preconditions.checkArgument(
          hashFunction.bits() >= Long.SIZE,
          "hash function should produce at least 64 bits, got [%s]",
          hashFunction.bits()
      );
      this.hashFunction = hashFunction;
      return this;
    }

    public Builder sparseEstimation(SparseEstimation sparseEstimation)
    {
      this.sparseEstimation = Preconditions.checkNotNull(sparseEstimation, "sparseEstimation");
      return this;
    }

    public AdaptiveHyperLogLog build()
    {
      return new AdaptiveHyperLogLog(this);
    }
  }
}
