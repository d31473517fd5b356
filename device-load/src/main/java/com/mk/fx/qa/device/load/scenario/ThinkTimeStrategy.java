package com.mk.fx.qa.device.load.scenario;

import com.mk.fx.qa.device.load.dto.scenario.ThinkTimeConfig;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/** Wait between two tasks of a device: none, fixed, or uniformly random within bounds. */
public final class ThinkTimeStrategy {

  private static final long SLEEP_CHUNK_MILLIS = 100L;

  private enum Type {
    NONE,
    FIXED,
    RANDOM
  }

  private static final ThinkTimeStrategy NONE = new ThinkTimeStrategy(Type.NONE, 0, 0, 0);

  private final Type type;
  private final long min;
  private final long max;
  private final long fixed;

  private ThinkTimeStrategy(Type type, long min, long max, long fixed) {
    this.type = type;
    this.min = min;
    this.max = max;
    this.fixed = fixed;
  }

  public static ThinkTimeStrategy none() {
    return NONE;
  }

  public static ThinkTimeStrategy fixed(long millis) {
    return new ThinkTimeStrategy(Type.FIXED, 0, 0, Math.max(0, millis));
  }

  public static ThinkTimeStrategy between(long minMillis, long maxMillis) {
    return new ThinkTimeStrategy(Type.RANDOM, minMillis, maxMillis, 0);
  }

  public static ThinkTimeStrategy from(ThinkTimeConfig config) {
    if (config == null) {
      return NONE;
    }
    if (config.getFixedMs() != null) {
      return fixed(config.getFixedMs());
    }
    if (config.getMinMs() != null || config.getMaxMs() != null) {
      long lower = config.getMinMs() != null ? config.getMinMs() : 0;
      long upper = config.getMaxMs() != null ? config.getMaxMs() : lower;
      return between(lower, upper);
    }
    return NONE;
  }

  public boolean isEnabled() {
    return type != Type.NONE;
  }

  public long nextDelayMillis() {
    return switch (type) {
      case NONE -> 0;
      case FIXED -> fixed;
      case RANDOM -> randomBetween(min, max);
    };
  }

  /**
   * Waits for the next think time, waking early when the stop condition turns true.
   *
   * @throws InterruptedException if the thread is interrupted
   */
  public void pause(BooleanSupplier stop) throws InterruptedException {
    sleep(Duration.ofMillis(nextDelayMillis()), stop);
  }

  /** Sleeps in short chunks so a stop is observed within {@value #SLEEP_CHUNK_MILLIS} ms. */
  public static void sleep(Duration duration, BooleanSupplier stop) throws InterruptedException {
    long remaining = duration.toMillis();
    while (remaining > 0 && !stop.getAsBoolean()) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("Interrupted during think time");
      }
      var chunk = Math.min(SLEEP_CHUNK_MILLIS, remaining);
      TimeUnit.MILLISECONDS.sleep(chunk);
      remaining -= chunk;
    }
  }

  static long randomBetween(long min, long max) {
    var lower = Math.max(0, min);
    var upper = Math.max(lower, max);
    if (upper == lower) {
      return lower;
    }
    return ThreadLocalRandom.current().nextLong(lower, upper + 1);
  }
}
