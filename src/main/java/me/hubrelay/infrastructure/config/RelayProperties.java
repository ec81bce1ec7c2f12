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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Raw configuration properties for the relay, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code relay.*} prefix:
 * <ul>
 * <li>{@link TelegramProperties} - bot token, allow-list, long-poll
 * settings</li>
 * <li>{@link GitHubProperties} - API token, username, webhook secret</li>
 * <li>{@link RateLimitProperties} - per-chat sliding window</li>
 * <li>{@link NotifyProperties} - per-event-type notification switches</li>
 * <li>{@link DispatchProperties} - notification worker pool</li>
 * <li>{@link HttpProperties} - shared OkHttp timeouts</li>
 * </ul>
 *
 * <p>
 * These properties are validated once at startup by
 * {@link RelayConfiguration} and frozen into an immutable
 * {@link me.hubrelay.domain.model.RelaySettings}; core components never read
 * this mutable binding directly.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {

    private String serviceName = "webhook_handler";
    private TelegramProperties telegram = new TelegramProperties();
    private GitHubProperties github = new GitHubProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private NotifyProperties notify = new NotifyProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class TelegramProperties {
        private String token = "";
        /** Comma-separated chat ids. Empty means every chat is allowed. */
        private String allowedChatIds = "";
        private boolean pollingEnabled = true;
        private int pollTimeoutSeconds = 10;
        private long errorBackoffMillis = 5000;
    }

    @Data
    public static class GitHubProperties {
        private String token = "";
        private String username = "";
        private String webhookSecret = "";
        private String apiUrl = "https://api.github.com";
        private int timeoutSeconds = 10;
    }

    @Data
    public static class RateLimitProperties {
        private int requests = 10;
        private int windowSeconds = 60;
    }

    @Data
    public static class NotifyProperties {
        private boolean push = true;
        private boolean issues = true;
        private boolean pullRequests = true;
        private boolean releases = true;
    }

    @Data
    public static class DispatchProperties {
        private int threads = 4;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
