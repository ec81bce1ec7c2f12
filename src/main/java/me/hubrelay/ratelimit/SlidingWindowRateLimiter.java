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
import me.hubrelay.domain.model.RelaySettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding window rate limiter keyed by chat id.
 *
 * <p>
 * A chat may issue at most {@code relay.rate-limit.requests} commands in any
 * trailing {@code relay.rate-limit.window-seconds} interval. Windows are
 * created lazily per chat in a concurrent map and live for the process
 * lifetime; each {@link SlidingWindow} serializes its own check-and-record, so
 * different chats never contend on a shared lock.
 *
 * @since 1.0
 * @see SlidingWindow
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlidingWindowRateLimiter implements ChatRateLimiter {

    private final RelaySettings settings;
    private final Clock clock;

    private final Map<Long, SlidingWindow> windows = new ConcurrentHashMap<>();

    @Override
    public RateLimitResult tryAcquire(long chatId) {
        RateLimitResult result = resolveWindow(chatId).tryAdmit(
                clock.instant(),
                settings.rateLimitRequests(),
                Duration.ofSeconds(settings.rateLimitWindowSeconds()));
        if (!result.isAllowed()) {
            log.debug("[RateLimit] Rate limit exceeded for chat {}, retry after {}", chatId, result.getRetryAfter());
        }
        return result;
    }

    @Override
    public boolean allow(long chatId, Instant now, int maxRequests, int windowSeconds) {
        return resolveWindow(chatId)
                .tryAdmit(now, maxRequests, Duration.ofSeconds(windowSeconds))
                .isAllowed();
    }

    /**
     * Number of admissions currently recorded for a chat (not pruned).
     */
    int recordedRequests(long chatId) {
        SlidingWindow window = windows.get(chatId);
        return window == null ? 0 : window.size();
    }

    private SlidingWindow resolveWindow(long chatId) {
        return windows.computeIfAbsent(chatId, id -> new SlidingWindow());
    }
}
