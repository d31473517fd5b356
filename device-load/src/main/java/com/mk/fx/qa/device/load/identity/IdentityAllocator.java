package com.mk.fx.qa.device.load.identity;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands out device profiles to workers, either by generating a random identity from a base id or
 * by checking one out of an {@link IdentityPool}.
 *
 * <p>{@link #configure} and {@link #reset} are only called between runs. During a run
 * {@link #nextIdentity()} is called concurrently; random mode needs no lock, pool mode relies on
 * the pool's own critical section.
 */
@Slf4j
public class IdentityAllocator {

  private static final int MAX_RANDOM_ATTEMPTS = 8;

  private final Set<DeviceIdentity> issued = ConcurrentHashMap.newKeySet();

  private volatile IdentityMode mode = IdentityMode.RANDOM;
  private volatile DeviceProfile template =
      new DeviceProfile(new DeviceIdentity("device"), Map.of());
  private volatile IdentityPool pool;

  /**
   * Selects the allocation strategy for the next run.
   *
   * @param mode random or pooled identities
   * @param base profile whose id is the random-mode prefix and whose requirements are copied to
   *     every random identity
   * @param pool the seeded pool, required in {@link IdentityMode#POOL}
   */
  public void configure(IdentityMode mode, DeviceProfile base, IdentityPool pool) {
    Objects.requireNonNull(mode, "mode");
    if (mode == IdentityMode.POOL && pool == null) {
      throw new ConfigurationException("Pool mode requires a device pool");
    }
    if (mode == IdentityMode.RANDOM && base == null) {
      throw new ConfigurationException("Random mode requires a base device id");
    }
    this.template = base;
    this.pool = mode == IdentityMode.POOL ? pool : null;
    this.mode = mode;
    issued.clear();
    log.info(
        "Identity allocator configured mode={} {}",
        mode,
        mode == IdentityMode.POOL ? "pool=" + pool.getName() : "baseId=" + base.id());
  }

  /** Convenience overload taking the base id only. */
  public void configure(IdentityMode mode, String baseId, IdentityPool pool) {
    configure(
        mode, baseId != null ? new DeviceProfile(new DeviceIdentity(baseId), Map.of()) : null, pool);
  }

  /**
   * Checks that a run with the given number of workers can be served.
   *
   * @throws WorkerCountMismatchException in pool mode when the worker count differs from the pool
   *     size
   */
  public void validate(int expectedWorkerCount) {
    if (mode != IdentityMode.POOL) {
      return;
    }
    var poolSize = pool.size();
    if (poolSize != expectedWorkerCount) {
      throw new WorkerCountMismatchException(poolSize, expectedWorkerCount);
    }
  }

  /**
   * Returns the profile for a starting worker.
   *
   * @throws PoolExhaustedException in pool mode when no entry remains
   */
  public DeviceProfile nextIdentity() {
    if (mode == IdentityMode.POOL) {
      return pool.checkout();
    }
    var base = template;
    for (int attempt = 0; attempt < MAX_RANDOM_ATTEMPTS; attempt++) {
      var candidate = new DeviceIdentity(base.id() + "-" + UUID.randomUUID());
      if (issued.add(candidate)) {
        return base.withIdentity(candidate);
      }
      log.warn("Random device identity {} collided, regenerating", candidate);
    }
    throw new IllegalStateException("Could not generate a unique device identity");
  }

  /** Ends the run: pooled identities become available again, random ids are forgotten. */
  public void reset() {
    if (mode == IdentityMode.POOL) {
      pool.releaseAll();
    }
    issued.clear();
  }
}
