package com.mk.fx.qa.device.load.identity;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed, ordered set of reusable device profiles with at-most-once checkout per run.
 *
 * <p>Threading: {@link #checkout()} may be called concurrently by every worker of a run; a single
 * lock guards a forward scan over the entries so exactly one caller claims a given entry. No lock
 * is held for the lifetime of a checkout. {@link #releaseAll()} is only called once the run's
 * workers have terminated.
 */
@Slf4j
public class IdentityPool {

  private final String name;
  private final ReentrantLock lock = new ReentrantLock();
  private final List<PoolEntry> entries = new ArrayList<>();
  private int checkedOut;

  public IdentityPool(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  /** Creates a pool already seeded with the given profiles. */
  public static IdentityPool seeded(String name, List<DeviceProfile> profiles) {
    var pool = new IdentityPool(name);
    pool.seed(profiles);
    return pool;
  }

  /**
   * Initialises the pool in seed order.
   *
   * @throws IllegalArgumentException if the seed is empty or repeats an identity
   * @throws IllegalStateException if entries are currently checked out
   */
  public void seed(List<DeviceProfile> profiles) {
    Objects.requireNonNull(profiles, "profiles");
    if (profiles.isEmpty()) {
      throw new IllegalArgumentException("Pool " + name + " needs at least one identity");
    }
    var seen = new HashSet<DeviceIdentity>();
    for (DeviceProfile profile : profiles) {
      Objects.requireNonNull(profile, "Pool entry cannot be null");
      if (!seen.add(profile.identity())) {
        throw new IllegalArgumentException(
            "Pool " + name + " contains duplicate identity " + profile.identity());
      }
    }

    lock.lock();
    try {
      if (checkedOut > 0) {
        throw new IllegalStateException(
            "Pool " + name + " cannot be reseeded while " + checkedOut + " entries are checked out");
      }
      entries.clear();
      profiles.forEach(profile -> entries.add(new PoolEntry(profile)));
    } finally {
      lock.unlock();
    }
    log.info("Pool {} seeded with {} identities", name, profiles.size());
  }

  /**
   * Claims the next unclaimed entry in seed order.
   *
   * @throws PoolExhaustedException if every entry is checked out
   */
  public DeviceProfile checkout() {
    lock.lock();
    try {
      for (PoolEntry entry : entries) {
        if (!entry.checkedOut) {
          entry.checkedOut = true;
          checkedOut++;
          log.debug("Pool {} checked out {} ({}/{})", name, entry.profile.id(), checkedOut, entries.size());
          return entry.profile;
        }
      }
      throw new PoolExhaustedException(entries.size());
    } finally {
      lock.unlock();
    }
  }

  /** Makes every entry checkoutable again. Safe to call repeatedly. */
  public void releaseAll() {
    lock.lock();
    try {
      entries.forEach(entry -> entry.checkedOut = false);
      if (checkedOut > 0) {
        log.info("Pool {} released {} identities", name, checkedOut);
      }
      checkedOut = 0;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /** Number of entries that can currently be checked out. */
  public int available() {
    lock.lock();
    try {
      return entries.size() - checkedOut;
    } finally {
      lock.unlock();
    }
  }

  public String getName() {
    return name;
  }

  @VisibleForTesting
  public List<DeviceProfile> profiles() {
    lock.lock();
    try {
      return entries.stream().map(entry -> entry.profile).toList();
    } finally {
      lock.unlock();
    }
  }

  private static final class PoolEntry {
    private final DeviceProfile profile;
    private boolean checkedOut;

    private PoolEntry(DeviceProfile profile) {
      this.profile = profile;
    }
  }
}
