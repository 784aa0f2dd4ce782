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
 * A snapshot of one interning pool's counters.
 *
 * @param entries the number of entries held, including stale ones
 * @param live the number of entries whose node has not been reclaimed
 * @param hits requests answered with an existing live node
 * @param misses requests that constructed a new node
 * @param pruned stale entries removed so far
 */
public record PoolStats(int entries, int live, long hits, long misses, long pruned) {

  /** The number of entries whose node has been reclaimed but that have not yet been pruned. */
  public int stale() {
    return entries - live;
  }
}
