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

import me.hubrelay.domain.model.RelaySettings;
import me.hubrelay.domain.model.WebhookEvent;
import me.hubrelay.domain.model.WebhookOutcome;
import me.hubrelay.security.WebhookSignatureVerifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Webhook pipeline: verify the signature, parse the body, render the event and
 * hand the notification to the dispatcher.
 *
 * <p>
 * Delivery is fire-and-forget: the dispatcher's future is not awaited, so the
 * HTTP response is decided by verification and parsing alone. Deliveries are
 * not deduplicated; a redelivered event is relayed again.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookEventService {

    private final RelaySettings settings;
    private final WebhookSignatureVerifier signatureVerifier;
    private final GitHubEventFormatter eventFormatter;
    private final NotificationDispatcher notificationDispatcher;
    private final ObjectMapper objectMapper;

    public WebhookOutcome handle(WebhookEvent event) {
        byte[] body = event.rawBody();
        if (!signatureVerifier.verify(settings.webhookSecret(), body, event.signatureHeader())) {
            log.warn("[Webhook] Rejected {} event: invalid signature", event.eventType());
            return WebhookOutcome.INVALID_SIGNATURE;
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (IOException e) {
            log.warn("[Webhook] Rejected {} event: invalid JSON ({})", event.eventType(), e.getMessage());
            return WebhookOutcome.INVALID_JSON;
        }
        if (payload == null || payload.isMissingNode()) {
            log.warn("[Webhook] Rejected {} event: empty body", event.eventType());
            return WebhookOutcome.INVALID_JSON;
        }

        log.info("[Webhook] Received {} event", event.eventType());
        Optional<String> message = eventFormatter.format(event.eventType(), payload, settings.notifyFlags());
        if (message.isEmpty()) {
            return WebhookOutcome.ACCEPTED;
        }

        List<Long> targets = settings.subscribers();
        if (targets.isEmpty()) {
            log.debug("[Webhook] No subscribed chats, {} notification dropped", event.eventType());
            return WebhookOutcome.ACCEPTED;
        }
        notificationDispatcher.dispatch(message.get(), targets);
        return WebhookOutcome.ACCEPTED;
    }
}
