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

import java.time.Instant;

/**
 * Per-chat admission control consulted before any bot command runs.
 *
 * <p>
 * Each chat identifier gets its own window; chats never affect each other.
 * Implementations must be safe for concurrent use, and the check plus the
 * recording of an admission must be atomic per chat.
 *
 * @since 1.0
 * @see SlidingWindowRateLimiter
 */
public interface ChatRateLimiter {

    /**
     * Check and record a request for a chat using the configured limits and the
     * current time.
     */
    RateLimitResult tryAcquire(long chatId);

    /**
     * Check and record a request for a chat at an explicit instant with explicit
     * limits.
     */
    boolean allow(long chatId, Instant now, int maxRequests, int windowSeconds);
}
