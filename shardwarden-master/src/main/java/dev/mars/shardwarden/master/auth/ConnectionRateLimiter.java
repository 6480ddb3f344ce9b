/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.shardwarden.master.auth;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Sliding-window limit on connection attempts per source address.
 *
 * <p>Every attempt is recorded, whether it is allowed or not, so a source
 * that keeps hammering the master stays locked out until it backs off for a
 * full window.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public class ConnectionRateLimiter {

    private final Map<String, Deque<Long>> attempts = new HashMap<>();

    /**
     * Records an attempt and tells whether it may proceed.
     *
     * @param source   source address of the attempt
     * @param now      current time in millis
     * @param windowMs length of the sliding window
     * @param maxCount attempts allowed within the window
     * @return false if {@code maxCount} earlier attempts already fall inside the window
     */
    public boolean tryAcquire(String source, long now, long windowMs, int maxCount) {
        Deque<Long> history = attempts.computeIfAbsent(source, key -> new ArrayDeque<>());
        expire(history, now, windowMs);
        int earlier = history.size();
        history.addLast(now);
        return earlier < maxCount;
    }

    /**
     * Drops sources with no attempt inside the window.
     */
    public void prune(long now, long windowMs) {
        Iterator<Deque<Long>> it = attempts.values().iterator();
        while (it.hasNext()) {
            Deque<Long> history = it.next();
            expire(history, now, windowMs);
            if (history.isEmpty()) {
                it.remove();
            }
        }
    }

    public int trackedSources() {
        return attempts.size();
    }

    private static void expire(Deque<Long> history, long now, long windowMs) {
        while (!history.isEmpty() && now - history.peekFirst() >= windowMs) {
            history.removeFirst();
        }
    }
}
