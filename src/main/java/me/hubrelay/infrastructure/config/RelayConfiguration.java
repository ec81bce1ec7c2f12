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

package me.hubrelay.infrastructure.config;

import me.hubrelay.domain.model.NotifyFlags;
import me.hubrelay.domain.model.RelaySettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates the bound {@link RelayProperties} once at startup and exposes the
 * frozen {@link RelaySettings} snapshot that the core components receive.
 *
 * <p>
 * Missing Telegram token, GitHub token or GitHub username abort startup with a
 * single {@link IllegalStateException} listing every problem. A malformed
 * allow-list is logged and treated as empty.
 *
 * @since 1.0
 */
@Configuration
@Slf4j
public class RelayConfiguration {

    @Bean
    public RelaySettings relaySettings(RelayProperties properties,
            @Value("${server.address:0.0.0.0}") String host,
            @Value("${server.port:8000}") int port) {
        validate(properties);
        RelaySettings settings = toSettings(properties, "http://" + host + ":" + port + "/webhook");
        log.info("[Config] Configuration validated: allowedChats={}, rateLimit={}/{}s, webhookSecret={}",
                settings.allowedChatIds().size(), settings.rateLimitRequests(),
                settings.rateLimitWindowSeconds(), settings.hasWebhookSecret() ? "set" : "not set");
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static void validate(RelayProperties properties) {
        List<String> errors = new ArrayList<>();
        if (isBlank(properties.getTelegram().getToken())) {
            errors.add("TELEGRAM_BOT_TOKEN is required");
        }
        if (isBlank(properties.getGithub().getToken())) {
            errors.add("GITHUB_TOKEN is required");
        }
        if (isBlank(properties.getGithub().getUsername())) {
            errors.add("GITHUB_USERNAME is required");
        }
        if (properties.getRateLimit().getRequests() <= 0) {
            errors.add("relay.rate-limit.requests must be positive");
        }
        if (properties.getRateLimit().getWindowSeconds() <= 0) {
            errors.add("relay.rate-limit.window-seconds must be positive");
        }
        if (!errors.isEmpty()) {
            StringBuilder message = new StringBuilder("Configuration errors:");
            for (String error : errors) {
                message.append("\n- ").append(error);
            }
            log.error("[Config] {}", message);
            throw new IllegalStateException(message.toString());
        }
    }

    static RelaySettings toSettings(RelayProperties properties, String webhookUrl) {
        RelayProperties.NotifyProperties notify = properties.getNotify();
        return RelaySettings.builder()
                .allowedChatIds(parseChatIds(properties.getTelegram().getAllowedChatIds()))
                .webhookSecret(properties.getGithub().getWebhookSecret())
                .rateLimitRequests(properties.getRateLimit().getRequests())
                .rateLimitWindowSeconds(properties.getRateLimit().getWindowSeconds())
                .notifyFlags(new NotifyFlags(notify.isPush(), notify.isIssues(),
                        notify.isPullRequests(), notify.isReleases()))
                .githubUsername(properties.getGithub().getUsername())
                .serviceName(properties.getServiceName())
                .webhookUrl(webhookUrl)
                .build();
    }

    static Set<Long> parseChatIds(String raw) {
        Set<Long> ids = new LinkedHashSet<>();
        if (raw == null || raw.isBlank()) {
            return ids;
        }
        try {
            for (String part : raw.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    ids.add(Long.parseLong(trimmed));
                }
            }
        } catch (NumberFormatException e) {
            log.warn("[Config] Invalid chat ids format in allowed-chat-ids: {}", raw);
            return new LinkedHashSet<>();
        }
        return ids;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
