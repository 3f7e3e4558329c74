package io.streamcount.sketch;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;
import java.util.Random;

/**
 * A random id generator based on sha1 that is 5 times faster than UUID#randomUUID().
 * Ids of one generator never repeat in practice, which makes it a source of distinct values for streams
 * too large to deduplicate with a set.
 *
 * <p>see http://antirez.com/news/99
 */
public class FastRandomIdGenerator
{
  private final HashFunction sha1 = Hashing.sha1();
  private final ByteBuffer buffer;
  private long counter = 0;

  public FastRandomIdGenerator()
  {
    this(new Random().nextLong());
  }

  public FastRandomIdGenerator(long seed)
  {
    buffer = ByteBuffer.allocate(16);
    buffer.putLong(8, seed);
  }

  /**
   * @return a 20 bytes random id with a very low collision rate
   */
  public byte[] generate()
  {
    buffer.putLong(0, counter++);
    return sha1.hashBytes(buffer.array()).asBytes();
  }

  public long generated()
  {
    return counter;
  }
}
