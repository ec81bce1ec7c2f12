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

package me.hubrelay.adapter.inbound.web.controller;

import me.hubrelay.adapter.inbound.telegram.TelegramPollingLoop;
import me.hubrelay.domain.model.NotifyFlags;
import me.hubrelay.domain.model.RelaySettings;
import me.hubrelay.port.outbound.GitHubPort;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only status API.
 *
 * <ul>
 * <li>{@code GET /api/status} - polling state, GitHub reachability and quota,
 * configuration summary</li>
 * <li>{@code GET /api/config} - sanitized configuration</li>
 * </ul>
 * Tokens and the webhook secret are never part of a response.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class StatusController {

    private final RelaySettings settings;
    private final GitHubPort gitHubPort;
    private final TelegramPollingLoop pollingLoop;
    private final Clock clock;

    @GetMapping("/status")
    public Mono<ResponseEntity<Map<String, Object>>> status() {
        return Mono.fromCallable(() -> {
            Optional<JsonNode> rateLimit = gitHubPort.getRateLimit();

            Map<String, Object> github = new LinkedHashMap<>();
            github.put("connected", rateLimit.isPresent());
            github.put("rate_limit", rateLimit.map(node -> node.path("rate")).orElse(null));

            Map<String, Object> configuration = new LinkedHashMap<>();
            configuration.put("github_username", settings.githubUsername());
            configuration.put("allowed_chats", settings.allowedChatIds().size());
            configuration.put("rate_limit",
                    settings.rateLimitRequests() + "/" + settings.rateLimitWindowSeconds() + "s");
            configuration.put("notifications", notifications(settings.notifyFlags()));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("bot_running", pollingLoop.isRunning());
            body.put("timestamp", clock.instant().toString());
            body.put("github_api", github);
            body.put("configuration", configuration);
            return ResponseEntity.ok(body);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/config")
    public Mono<ResponseEntity<Map<String, Object>>> config() {
        Map<String, Object> rateLimiting = new LinkedHashMap<>();
        rateLimiting.put("requests", settings.rateLimitRequests());
        rateLimiting.put("window", settings.rateLimitWindowSeconds());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("github_username", settings.githubUsername());
        body.put("webhook_url", settings.webhookUrl());
        body.put("allowed_chats_count", settings.allowedChatIds().size());
        body.put("rate_limiting", rateLimiting);
        body.put("notifications", notifications(settings.notifyFlags()));
        return Mono.just(ResponseEntity.ok(body));
    }

    private static Map<String, Object> notifications(NotifyFlags flags) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("push", flags.push());
        result.put("issues", flags.issues());
        result.put("pull_requests", flags.pullRequests());
        result.put("releases", flags.releases());
        return result;
    }
}
