/*
 * Copyright 2026 The Exprpool Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.exprpool.impl;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.function.Function;
import org.exprpool.PoolStats;
import org.exprpool.PruneCadence;

/**
 * An InternPool maps keys to weakly-referenced values, so that repeated requests for the same key
 * return the same value for as long as someone else is holding on to it.
 *
 * <p>The pool never keeps a value alive: each entry is a WeakReference, and must be resolved (which
 * may fail) before the value can be returned. Once every strong reference to a value has been
 * dropped the garbage collector may clear the entry's reference, at which point the entry is stale.
 * A stale entry is never returned; the next request for its key constructs and registers a new
 * value. Stale entries are removed by {@link #prune}, which runs before requests at the frequency
 * selected by the pool's {@link PruneCadence} and may also be called directly.
 *
 * <p>This guarantees that at any instant there is at most one live value per key that was obtained
 * from this pool; it does not guarantee that the same key always maps to the same value over the
 * lifetime of the pool.
 *
 * <p>InternPools are not thread-safe; resolving an entry and replacing it with a newly constructed
 * value is a check-then-act sequence that requires external synchronization.
 */
public class InternPool<K, V> {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Used only in log messages, e.g. "Constant". */
  private final String kind;

  private final Function<? super K, ? extends V> constructor;

  private final PruneCadence cadence;

  private final HashMap<K, WeakReference<V>> entries = new HashMap<>();

  /** If {@code cadence} is AMORTIZED, the next request that finds this many entries will prune. */
  private int scanThreshold = PruneCadence.MIN_SCAN_THRESHOLD;

  private long hits;
  private long misses;
  private long pruned;

  /**
   * Creates a new, empty InternPool. {@code constructor} is called with a key whenever there is no
   * live value for it, and must return a new non-null value.
   */
  public InternPool(
      String kind, Function<? super K, ? extends V> constructor, PruneCadence cadence) {
    this.kind = checkNotNull(kind);
    this.constructor = checkNotNull(constructor);
    this.cadence = checkNotNull(cadence);
  }

  /**
   * Returns the live value for {@code key} if there is one, otherwise constructs a new value and
   * registers it (replacing any stale entry for the key).
   */
  public V get(K key) {
    checkNotNull(key);
    if (cadence == PruneCadence.EVERY_GET || entries.size() >= scanThreshold) {
      prune();
    }
    WeakReference<V> ref = entries.get(key);
    // Hold the resolved value strongly until it is returned.
    V value = (ref == null) ? null : ref.get();
    if (value != null) {
      hits++;
      return value;
    }
    value = checkNotNull(constructor.apply(key), "Constructor returned null for %s", key);
    entries.put(key, new WeakReference<>(value));
    misses++;
    logger.atFine().log("New %s for %s (%s entries)", kind, key, entries.size());
    return value;
  }

  /** Removes every stale entry, and returns the number removed. */
  @CanIgnoreReturnValue
  public int prune() {
    int before = entries.size();
    entries.values().removeIf(ref -> ref.get() == null);
    int removed = before - entries.size();
    pruned += removed;
    scanThreshold = Math.max(PruneCadence.MIN_SCAN_THRESHOLD, 2 * entries.size());
    if (removed != 0) {
      logger.atFine().log("Pruned %s stale %s entries, %s remain", removed, kind, entries.size());
    }
    return removed;
  }

  /** Returns the number of entries, including stale entries that have not yet been pruned. */
  public int size() {
    return entries.size();
  }

  /** Returns the number of entries whose value has not been reclaimed. */
  public int liveCount() {
    return (int) entries.values().stream().filter(ref -> ref.get() != null).count();
  }

  public PoolStats stats() {
    return new PoolStats(entries.size(), liveCount(), hits, misses, pruned);
  }

  @Override
  public String toString() {
    return String.format("%s pool (%s)", kind, stats());
  }
}
