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

package me.hubrelay.adapter.inbound.command;

import me.hubrelay.domain.model.NotifyFlags;
import me.hubrelay.domain.model.RelaySettings;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import static me.hubrelay.domain.service.MarkdownEscaper.escape;
import static me.hubrelay.domain.service.MarkdownEscaper.escapeCode;
import static me.hubrelay.domain.service.MarkdownEscaper.escapeUrl;
import static me.hubrelay.domain.service.MarkdownEscaper.link;

/**
 * Renders GitHub API results as MarkdownV2 command replies.
 */
@Component
@Slf4j
public class GitHubReplyFormatter {

    static final String UNKNOWN_DATE = "Unknown date";
    static final int MAX_DESCRIPTION_LENGTH = 100;

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm 'UTC'")
            .withZone(ZoneOffset.UTC);
    private static final String UNKNOWN = "Unknown";
    private static final String NO_DESCRIPTION = "No description";

    public String formatProfile(JsonNode user) {
        StringBuilder sb = new StringBuilder();
        sb.append("👤 *GitHub Profile: ").append(escape(text(user, "login", UNKNOWN))).append("*\n\n");

        appendIfPresent(sb, "🏷️ *Name:* ", text(user, "name", ""));
        appendIfPresent(sb, "📝 *Bio:* ", text(user, "bio", ""));

        sb.append("📊 *Stats:*\n");
        sb.append("• 📦 Repositories: ").append(user.path("public_repos").asLong(0)).append('\n');
        sb.append("• 👥 Followers: ").append(user.path("followers").asLong(0)).append('\n');
        sb.append("• 👁️ Following: ").append(user.path("following").asLong(0)).append('\n');

        appendIfPresent(sb, "📍 *Location:* ", text(user, "location", ""));
        appendIfPresent(sb, "🏢 *Company:* ", text(user, "company", ""));
        appendIfPresent(sb, "🌐 *Website:* ", text(user, "blog", ""));

        String createdAt = text(user, "created_at", "");
        if (!createdAt.isEmpty()) {
            sb.append("📅 *Joined:* ").append(escape(formatTimestamp(createdAt))).append('\n');
        }

        String url = text(user, "html_url", "");
        if (!url.isEmpty()) {
            sb.append("\n🔗 ").append(link("View Profile", url));
        }
        return sb.toString().stripTrailing();
    }

    public String formatRepositories(JsonNode repositories) {
        StringBuilder sb = new StringBuilder("📚 *Repositories:*\n\n");
        for (JsonNode repo : repositories) {
            sb.append("📦 *").append(escape(text(repo, "name", UNKNOWN))).append("* \\- ⭐ ")
                    .append(repo.path("stargazers_count").asLong(0)).append(" stars\n");
        }
        return sb.toString().stripTrailing();
    }

    public String formatRepository(JsonNode repo) {
        String description = text(repo, "description", NO_DESCRIPTION);

        StringBuilder sb = new StringBuilder();
        sb.append("📦 *Repository: ").append(escape(text(repo, "full_name", UNKNOWN))).append("*\n\n");
        sb.append("📝 *Description:* ").append(escape(description)).append("\n\n");

        sb.append("📊 *Statistics:*\n");
        sb.append("• ⭐ Stars: ").append(repo.path("stargazers_count").asLong(0)).append('\n');
        sb.append("• 🍴 Forks: ").append(repo.path("forks_count").asLong(0)).append('\n');
        sb.append("• 👁️ Watchers: ").append(repo.path("watchers_count").asLong(0)).append('\n');
        sb.append("• 🐛 Open Issues: ").append(repo.path("open_issues_count").asLong(0)).append('\n');
        sb.append("• 📏 Size: ").append(repo.path("size").asLong(0)).append(" KB\n");

        sb.append("\n🔧 *Details:*\n");
        sb.append("• 💻 Language: ").append(escape(text(repo, "language", UNKNOWN))).append('\n');
        sb.append("• 🌿 Default Branch: ").append(escape(text(repo, "default_branch", "main"))).append('\n');
        sb.append("• 🔒 Visibility: ").append(repo.path("private").asBoolean(false) ? "Private" : "Public")
                .append('\n');

        String createdAt = text(repo, "created_at", "");
        if (!createdAt.isEmpty()) {
            sb.append("• 📅 Created: ").append(escape(formatTimestamp(createdAt))).append('\n');
        }
        String updatedAt = text(repo, "updated_at", "");
        if (!updatedAt.isEmpty()) {
            sb.append("• 🔄 Updated: ").append(escape(formatTimestamp(updatedAt))).append('\n');
        }

        String url = text(repo, "html_url", "");
        if (!url.isEmpty()) {
            sb.append("\n🔗 ").append(link("View Repository", url));
        }
        return sb.toString().stripTrailing();
    }

    public String formatCommits(RepositoryRef ref, JsonNode commits) {
        StringBuilder sb = new StringBuilder();
        sb.append("📝 *Recent Commits for ").append(escape(ref.fullName())).append(":*\n\n");
        for (JsonNode commit : commits) {
            JsonNode details = commit.path("commit");
            JsonNode author = details.path("author");
            String date = text(author, "date", "");
            String sha = text(commit, "sha", "");
            sha = sha.length() > 7 ? sha.substring(0, 7) : sha;

            sb.append("🔸 *").append(escape(text(details, "message", "No message"))).append("*\n");
            sb.append("👤 ").append(escape(text(author, "name", UNKNOWN)))
                    .append(" • 🕒 ").append(escape(date.isEmpty() ? UNKNOWN_DATE : formatTimestamp(date)))
                    .append('\n');
            sb.append("🔗 ").append(codeLink(sha, text(commit, "html_url", ""))).append("\n\n");
        }
        return sb.toString().stripTrailing();
    }

    public String formatIssues(RepositoryRef ref, JsonNode issues) {
        StringBuilder sb = new StringBuilder();
        sb.append("🐛 *Issues for ").append(escape(ref.fullName())).append(":*\n\n");
        for (JsonNode issue : issues) {
            String state = text(issue, "state", "unknown");
            sb.append("open".equals(state) ? "🟢" : "🔴")
                    .append(" *\\#").append(issue.path("number").asLong(0)).append(": ")
                    .append(escape(text(issue, "title", "No title"))).append("*\n");
            sb.append("👤 ").append(escape(text(issue.path("user"), "login", UNKNOWN)))
                    .append(" • 📋 ").append(escape(state)).append('\n');
            String url = text(issue, "html_url", "");
            if (!url.isEmpty()) {
                sb.append("🔗 ").append(link("View Issue", url)).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString().stripTrailing();
    }

    public String formatSearchResults(String query, JsonNode repositories) {
        StringBuilder sb = new StringBuilder();
        sb.append("🔍 *Search Results for: ").append(escape(query)).append("*\n\n");
        for (JsonNode repo : repositories) {
            sb.append("📦 *").append(escape(text(repo, "name", UNKNOWN))).append("*\n");
            sb.append("🔗 ").append(escape(text(repo, "full_name", UNKNOWN))).append('\n');
            sb.append("📝 ").append(escape(truncate(text(repo, "description", NO_DESCRIPTION)))).append('\n');
            sb.append("⭐ ").append(repo.path("stargazers_count").asLong(0)).append(" stars");
            String url = text(repo, "html_url", "");
            if (!url.isEmpty()) {
                sb.append(" • ").append(link("View", url));
            }
            sb.append("\n\n");
        }
        return sb.toString().stripTrailing();
    }

    /**
     * Bot status: GitHub quota (when reachable), limiter configuration and
     * notification switches.
     */
    public String formatStatus(Optional<JsonNode> rateLimit, RelaySettings settings) {
        StringBuilder sb = new StringBuilder("📊 *Bot Status*\n\n");
        sb.append("🤖 *Bot:* Running\n");
        Optional<JsonNode> core = rateLimit.map(GitHubReplyFormatter::coreRate);
        sb.append("🔧 *GitHub API:* ").append(core.isPresent() ? "Connected" : "Unavailable").append('\n');

        core.ifPresent(rate -> {
            sb.append("📈 *API Limits:* ")
                    .append(escape(text(rate, "remaining", UNKNOWN))).append('/')
                    .append(escape(text(rate, "limit", UNKNOWN))).append(" remaining\n");
            if (rate.path("reset").canConvertToLong()) {
                sb.append("🔄 *Reset:* ").append(escape(formatEpochSeconds(rate.path("reset").asLong())))
                        .append('\n');
            }
        });

        sb.append("\n⚙️ *Configuration:*\n");
        sb.append("• Rate limit: ").append(settings.rateLimitRequests()).append(" req/")
                .append(settings.rateLimitWindowSeconds()).append("s\n");
        sb.append(formatNotificationSwitches(settings.notifyFlags()));
        return sb.toString().stripTrailing();
    }

    public String formatNotificationSwitches(NotifyFlags flags) {
        return "• Push: " + onOff(flags.push()) + '\n'
                + "• Issues: " + onOff(flags.issues()) + '\n'
                + "• Pull requests: " + onOff(flags.pullRequests()) + '\n'
                + "• Releases: " + onOff(flags.releases()) + '\n';
    }

    /**
     * Format an ISO-8601 timestamp as {@code yyyy-MM-dd HH:mm UTC}. The result
     * is unescaped.
     */
    public static String formatTimestamp(String isoTimestamp) {
        if (isoTimestamp == null || isoTimestamp.isBlank()) {
            return UNKNOWN_DATE;
        }
        try {
            return DISPLAY_FORMAT.format(OffsetDateTime.parse(isoTimestamp).toInstant());
        } catch (DateTimeParseException e) {
            log.warn("Failed to format timestamp {}: {}", isoTimestamp, e.getMessage());
            return UNKNOWN_DATE;
        }
    }

    public static String formatEpochSeconds(long epochSeconds) {
        return DISPLAY_FORMAT.format(Instant.ofEpochSecond(epochSeconds));
    }

    static String truncate(String description) {
        if (description.length() <= MAX_DESCRIPTION_LENGTH) {
            return description;
        }
        return description.substring(0, MAX_DESCRIPTION_LENGTH) + "...";
    }

    // /rate_limit reports the core quota under "rate" and "resources.core"
    private static JsonNode coreRate(JsonNode rateLimit) {
        if (rateLimit.path("rate").isObject()) {
            return rateLimit.path("rate");
        }
        if (rateLimit.path("resources").path("core").isObject()) {
            return rateLimit.path("resources").path("core");
        }
        return rateLimit;
    }

    private static String codeLink(String code, String url) {
        String span = "`" + escapeCode(code) + "`";
        if (url.isEmpty()) {
            return span;
        }
        return "[" + span + "](" + escapeUrl(url) + ")";
    }

    private static void appendIfPresent(StringBuilder sb, String label, String value) {
        if (!value.isBlank()) {
            sb.append(label).append(escape(value)).append('\n');
        }
    }

    private static String onOff(boolean enabled) {
        return enabled ? "Enabled" : "Disabled";
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return defaultValue;
        }
        return value.asText(defaultValue);
    }
}
