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

package org.exprpool;

/**
 * Determines how often an interning pool scans for stale entries (entries whose node has been
 * reclaimed). The choice never changes which node a request returns; it only changes how long
 * stale entries may linger.
 */
public enum PruneCadence {
  /** Scan the whole pool before every request; each request costs O(pool size). */
  EVERY_GET,

  /**
   * Scan only when the pool has grown to twice the number of entries that survived the previous
   * scan (and to at least {@link #MIN_SCAN_THRESHOLD} entries), so the cost per request is
   * amortized O(1).
   */
  AMORTIZED;

  /** AMORTIZED pools never scan while they hold fewer entries than this. */
  public static final int MIN_SCAN_THRESHOLD = 16;
}
