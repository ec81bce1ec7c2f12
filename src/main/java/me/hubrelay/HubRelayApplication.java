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

package me.hubrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for HubRelay.
 *
 * <p>
 * HubRelay relays GitHub repository events to Telegram chats and answers
 * Telegram commands by querying the GitHub REST API.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters) with two independent intake
 * surfaces sharing the allow-list, the per-chat rate limiter and the
 * notification dispatcher:
 *
 * <pre>
 * Webhook intake     → GitHubWebhookController → WebhookEventService → NotificationDispatcher
 * Command intake     → TelegramPollingLoop → CommandRouter → GitHubPort
 * Outbound           → GitHubApiClient (OkHttp), TelegramMessageAdapter (telegrambots)
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code relay.*} prefix, each key overridable through an environment variable
 * ({@code TELEGRAM_BOT_TOKEN}, {@code GITHUB_TOKEN}, ...).
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class HubRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(HubRelayApplication.class, args);
    }

}
