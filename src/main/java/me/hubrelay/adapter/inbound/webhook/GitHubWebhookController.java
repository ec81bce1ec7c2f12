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

package me.hubrelay.adapter.inbound.webhook;

import me.hubrelay.adapter.inbound.webhook.dto.WebhookResponse;
import me.hubrelay.domain.model.RelaySettings;
import me.hubrelay.domain.model.WebhookEvent;
import me.hubrelay.domain.model.WebhookOutcome;
import me.hubrelay.domain.service.WebhookEventService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * GitHub webhook intake (WebFlux).
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>{@code POST /webhook} - signed GitHub delivery, event type in
 * {@code X-GitHub-Event}, signature in {@code X-Hub-Signature-256}</li>
 * <li>{@code GET /health} - liveness check</li>
 * </ul>
 *
 * <p>
 * The body is taken as raw bytes so the signature is computed over exactly what
 * GitHub sent. Notification delivery runs on the dispatcher's pool; the
 * response never waits for it.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class GitHubWebhookController {

    static final String EVENT_HEADER = "X-GitHub-Event";
    static final String SIGNATURE_HEADER = "X-Hub-Signature-256";

    private final WebhookEventService webhookEventService;
    private final RelaySettings settings;

    @PostMapping("/webhook")
    public Mono<ResponseEntity<WebhookResponse>> receive(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = EVENT_HEADER, required = false) String eventType,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {

        return Mono.fromCallable(() -> {
            try {
                WebhookOutcome outcome = webhookEventService.handle(new WebhookEvent(eventType, body, signature));
                return toResponse(outcome);
            } catch (Exception e) {
                log.error("[Webhook] Error processing {} delivery", eventType, e);
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body(WebhookResponse.error("Internal server error"));
            }
        });
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<WebhookResponse>> health() {
        return Mono.just(ResponseEntity.ok(WebhookResponse.healthy(settings.serviceName())));
    }

    private ResponseEntity<WebhookResponse> toResponse(WebhookOutcome outcome) {
        return switch (outcome) {
        case ACCEPTED -> ResponseEntity.ok(WebhookResponse.success());
        case INVALID_SIGNATURE -> ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(WebhookResponse.error("Invalid signature"));
        case INVALID_JSON -> ResponseEntity.badRequest()
                .body(WebhookResponse.error("Invalid JSON"));
        };
    }
}
