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

package me.hubrelay.domain.service;

import me.hubrelay.domain.model.DeliveryReport;
import me.hubrelay.infrastructure.http.NotificationExecutorConfig;
import me.hubrelay.port.outbound.ChatDeliveryException;
import me.hubrelay.port.outbound.ChatMessagePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Delivers a rendered notification to every target chat on the notification
 * worker pool.
 *
 * <p>
 * {@link #dispatch} only submits the work and returns at once, so the webhook
 * response never waits for Telegram. Each target is sent independently with a
 * single attempt: a failure is logged and the remaining targets are still
 * tried. The returned future completes with a {@link DeliveryReport} and never
 * completes exceptionally.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final ChatMessagePort chatMessagePort;
    private final ExecutorService executor;

    public NotificationDispatcher(ChatMessagePort chatMessagePort,
            @Qualifier(NotificationExecutorConfig.NOTIFICATION_EXECUTOR) ExecutorService executor) {
        this.chatMessagePort = chatMessagePort;
        this.executor = executor;
    }

    public CompletableFuture<DeliveryReport> dispatch(String message, Collection<Long> targets) {
        if (message == null || message.isBlank() || targets == null || targets.isEmpty()) {
            return CompletableFuture.completedFuture(DeliveryReport.empty());
        }
        List<Long> snapshot = List.copyOf(targets);
        try {
            return CompletableFuture.supplyAsync(() -> deliver(message, snapshot), executor);
        } catch (RejectedExecutionException e) {
            log.error("[Dispatch] Notification rejected, executor is shut down: {} target(s) skipped",
                    snapshot.size());
            return CompletableFuture.completedFuture(new DeliveryReport(0, snapshot.size()));
        }
    }

    private DeliveryReport deliver(String message, List<Long> targets) {
        int delivered = 0;
        int failed = 0;
        for (Long chatId : targets) {
            try {
                chatMessagePort.sendMessage(chatId, message);
                delivered++;
            } catch (ChatDeliveryException e) {
                failed++;
                log.error("[Dispatch] Failed to send notification to chat {}: {}", chatId, e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                log.error("[Dispatch] Unexpected error sending notification to chat {}", chatId, e);
            }
        }
        log.debug("[Dispatch] Notification delivered to {}/{} chat(s)", delivered, targets.size());
        return new DeliveryReport(delivered, failed);
    }
}
