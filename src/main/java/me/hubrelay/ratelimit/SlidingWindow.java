/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.hubrelay.ratelimit;

import me.hubrelay.domain.model.RateLimitResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Thread-safe sliding window of admission timestamps for one chat.
 *
 * <p>
 * On every check, timestamps at or before {@code now - window} are pruned.
 * The request is admitted iff fewer than {@code maxRequests} remain, and an
 * admission appends {@code now}. Pruning, the count check and the append run
 * under the window's monitor, so two callers can never both take the last
 * slot.
 *
 * @since 1.0
 */
public class SlidingWindow {

    private final Deque<Instant> timestamps = new ArrayDeque<>();

    public synchronized RateLimitResult tryAdmit(Instant now, int maxRequests, Duration window) {
        Instant cutoff = now.minus(window);
        timestamps.removeIf(ts -> !ts.isAfter(cutoff));

        if (timestamps.size() >= maxRequests) {
            return RateLimitResult.denied(retryAfter(now, window), "Rate limit exceeded");
        }

        timestamps.addLast(now);
        return RateLimitResult.allowed(maxRequests - timestamps.size());
    }

    public synchronized int size() {
        return timestamps.size();
    }

    private Duration retryAfter(Instant now, Duration window) {
        Instant oldest = null;
        for (Instant ts : timestamps) {
            if (oldest == null || ts.isBefore(oldest)) {
                oldest = ts;
            }
        }
        if (oldest == null) {
            return Duration.ZERO;
        }
        Duration wait = Duration.between(now, oldest.plus(window));
        return wait.isNegative() ? Duration.ZERO : wait;
    }
}
