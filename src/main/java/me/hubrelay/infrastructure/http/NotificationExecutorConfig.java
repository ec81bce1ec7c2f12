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

package me.hubrelay.infrastructure.http;

import me.hubrelay.infrastructure.config.RelayProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool that carries notification fan-out off the webhook request path.
 */
@Configuration
@Slf4j
public class NotificationExecutorConfig {

    public static final String NOTIFICATION_EXECUTOR = "notificationExecutor";

    private static final long SHUTDOWN_AWAIT_SECONDS = 5;

    private volatile ExecutorService executor;

    @Bean(name = NOTIFICATION_EXECUTOR, destroyMethod = "")
    public ExecutorService notificationExecutor(RelayProperties properties) {
        int threads = Math.max(1, properties.getDispatch().getThreads());
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "notify-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return executor;
    }

    @PreDestroy
    public void shutdown() {
        ExecutorService pool = executor;
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_AWAIT_SECONDS, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Dispatch] Notification executor shut down");
    }
}
