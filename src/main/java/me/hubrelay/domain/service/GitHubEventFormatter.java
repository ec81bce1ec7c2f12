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

import me.hubrelay.domain.model.NotifyFlags;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

import static me.hubrelay.domain.service.MarkdownEscaper.escape;
import static me.hubrelay.domain.service.MarkdownEscaper.escapeCode;
import static me.hubrelay.domain.service.MarkdownEscaper.escapeUrl;

/**
 * Classifies GitHub webhook events and renders them as Telegram MarkdownV2
 * notifications.
 *
 * <p>
 * Supported event types:
 * <ul>
 * <li>{@code push} - repository, branch, pusher, commit count and the first
 * three commits; suppressed when the push carries no commits</li>
 * <li>{@code issues} - action, number, title, author and link</li>
 * <li>{@code pull_request} - same shape as issues, merged pull requests get
 * their own icon</li>
 * <li>{@code release} - only {@code published} releases are relayed</li>
 * <li>{@code ping} - configuration confirmation, never gated by
 * {@link NotifyFlags}</li>
 * </ul>
 * Every other event type is ignored. All payload text is escaped before
 * interpolation. Absent fields fall back to defaults, but a payload that is
 * not an object or a nested field of the wrong type drops the event; no
 * exception propagates.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class GitHubEventFormatter {

    public static final String EVENT_PUSH = "push";
    public static final String EVENT_ISSUES = "issues";
    public static final String EVENT_PULL_REQUEST = "pull_request";
    public static final String EVENT_RELEASE = "release";
    public static final String EVENT_PING = "ping";

    static final int MAX_LISTED_COMMITS = 3;
    private static final int SHORT_SHA_LENGTH = 7;
    private static final String UNKNOWN = "Unknown";
    private static final String DEFAULT_ACTION_ICON = "📋";

    private static final Map<String, String> ISSUE_ICONS = Map.of(
            "opened", "🆕",
            "closed", "✅",
            "reopened", "🔄",
            "edited", "✏️");

    private static final Map<String, String> PULL_REQUEST_ICONS = Map.of(
            "opened", "🆕",
            "closed", "✅",
            "merged", "🎉",
            "reopened", "🔄",
            "edited", "✏️");

    /**
     * Render an event, or return empty when it is suppressed, switched off,
     * unknown or malformed.
     *
     * @param eventType
     *            value of the {@code X-GitHub-Event} header
     * @param payload
     *            parsed webhook body
     * @param flags
     *            per-type notification switches
     */
    public Optional<String> format(String eventType, JsonNode payload, NotifyFlags flags) {
        if (eventType == null || payload == null) {
            return Optional.empty();
        }
        if (!payload.isObject()) {
            log.warn("[Webhook] Dropping {} event: payload is not a JSON object", eventType);
            return Optional.empty();
        }
        try {
            return switch (eventType) {
            case EVENT_PUSH -> flags.push() ? formatPush(payload) : Optional.empty();
            case EVENT_ISSUES -> flags.issues() ? Optional.of(formatIssue(payload)) : Optional.empty();
            case EVENT_PULL_REQUEST -> flags.pullRequests()
                    ? Optional.of(formatPullRequest(payload))
                    : Optional.empty();
            case EVENT_RELEASE -> flags.releases() ? formatRelease(payload) : Optional.empty();
            case EVENT_PING -> Optional.of(formatPing(payload));
            default -> {
                log.debug("[Webhook] Ignoring unsupported event type: {}", eventType);
                yield Optional.empty();
            }
            };
        } catch (RuntimeException e) {
            log.warn("[Webhook] Dropping malformed {} event: {}", eventType, e.getMessage());
            return Optional.empty();
        }
    }

    Optional<String> formatPush(JsonNode payload) {
        JsonNode commits = payload.path("commits");
        if (commits.isMissingNode() || commits.isNull() || (commits.isArray() && commits.isEmpty())) {
            return Optional.empty();
        }
        if (!commits.isArray()) {
            throw new IllegalArgumentException("Field 'commits' is not an array");
        }

        JsonNode repository = object(payload, "repository");
        String repoName = text(repository, "full_name", UNKNOWN);
        String pusher = text(object(payload, "pusher"), "name", UNKNOWN);
        String branch = branchName(text(payload, "ref", ""));

        StringBuilder sb = new StringBuilder();
        sb.append("🚀 *Push to ").append(escape(repoName)).append("*\n\n");
        sb.append("🌿 *Branch:* ").append(escape(branch)).append('\n');
        sb.append("👤 *Pusher:* ").append(escape(pusher)).append('\n');
        sb.append("📝 *Commits:* ").append(commits.size()).append("\n\n");

        int shown = Math.min(commits.size(), MAX_LISTED_COMMITS);
        for (int i = 0; i < shown; i++) {
            JsonNode commit = commits.get(i);
            if (!commit.isObject()) {
                throw new IllegalArgumentException("Commit " + i + " is not an object");
            }
            String message = text(commit, "message", "No message");
            String author = text(object(commit, "author"), "name", UNKNOWN);
            String sha = shortSha(text(commit, "id", ""));
            String url = text(commit, "url", "");

            sb.append("🔸 *").append(escape(message)).append("*\n");
            sb.append("👤 ").append(escape(author)).append(" • ");
            String code = "`" + escapeCode(sha) + "`";
            if (url.isEmpty()) {
                sb.append(code);
            } else {
                sb.append('[').append(code).append("](").append(escapeUrl(url)).append(')');
            }
            sb.append("\n\n");
        }

        if (commits.size() > MAX_LISTED_COMMITS) {
            sb.append("\\.\\.\\. and ").append(commits.size() - MAX_LISTED_COMMITS).append(" more commits\n\n");
        }

        appendLink(sb, "View Repository", text(repository, "html_url", ""));
        return Optional.of(trimTrailingNewlines(sb));
    }

    String formatIssue(JsonNode payload) {
        String action = text(payload, "action", "unknown");
        JsonNode issue = object(payload, "issue");
        return formatItem(ISSUE_ICONS.getOrDefault(action, DEFAULT_ACTION_ICON), "Issue", action,
                text(object(payload, "repository"), "full_name", UNKNOWN), "🐛", issue, "View Issue");
    }

    String formatPullRequest(JsonNode payload) {
        String action = text(payload, "action", "unknown");
        JsonNode pullRequest = object(payload, "pull_request");
        if ("closed".equals(action) && pullRequest.path("merged").asBoolean(false)) {
            action = "merged";
        }
        return formatItem(PULL_REQUEST_ICONS.getOrDefault(action, DEFAULT_ACTION_ICON), "Pull Request", action,
                text(object(payload, "repository"), "full_name", UNKNOWN), "🔀", pullRequest, "View Pull Request");
    }

    Optional<String> formatRelease(JsonNode payload) {
        if (!"published".equals(text(payload, "action", ""))) {
            return Optional.empty();
        }
        JsonNode release = object(payload, "release");
        String repoName = text(object(payload, "repository"), "full_name", UNKNOWN);
        String name = text(release, "name", "No name");
        String tag = text(release, "tag_name", UNKNOWN);
        String author = text(object(release, "author"), "login", UNKNOWN);

        StringBuilder sb = new StringBuilder();
        sb.append("🎉 *New Release in ").append(escape(repoName)).append("*\n\n");
        sb.append("🏷️ *").append(escape(name)).append("* \\(").append(escape(tag)).append("\\)\n");
        sb.append("👤 *By:* ").append(escape(author)).append('\n');
        appendLink(sb, "View Release", text(release, "html_url", ""));
        return Optional.of(trimTrailingNewlines(sb));
    }

    String formatPing(JsonNode payload) {
        String repoName = text(object(payload, "repository"), "full_name", UNKNOWN);
        return "🏓 *Webhook configured for " + escape(repoName) + "*\n\nWebhook is working correctly\\!";
    }

    private String formatItem(String icon, String kind, String action, String repoName, String itemIcon,
            JsonNode item, String linkLabel) {
        String title = text(item, "title", "No title");
        long number = item.path("number").asLong(0);
        String user = text(object(item, "user"), "login", UNKNOWN);

        StringBuilder sb = new StringBuilder();
        sb.append(icon).append(" *").append(kind).append(' ').append(escape(action))
                .append(" in ").append(escape(repoName)).append("*\n\n");
        sb.append(itemIcon).append(" *\\#").append(number).append(": ").append(escape(title)).append("*\n");
        sb.append("👤 *By:* ").append(escape(user)).append('\n');
        appendLink(sb, linkLabel, text(item, "html_url", ""));
        return trimTrailingNewlines(sb);
    }

    static String branchName(String ref) {
        if (ref.startsWith("refs/heads/")) {
            return ref.substring(ref.lastIndexOf('/') + 1);
        }
        return ref;
    }

    private static String shortSha(String sha) {
        return sha.length() > SHORT_SHA_LENGTH ? sha.substring(0, SHORT_SHA_LENGTH) : sha;
    }

    private static void appendLink(StringBuilder sb, String label, String url) {
        if (!url.isEmpty()) {
            sb.append("🔗 ").append(MarkdownEscaper.link(label, url));
        }
    }

    private static String trimTrailingNewlines(StringBuilder sb) {
        int end = sb.length();
        while (end > 0 && sb.charAt(end - 1) == '\n') {
            end--;
        }
        return sb.substring(0, end);
    }

    // absent -> missing node (defaults apply), present but not an object -> malformed
    private static JsonNode object(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        if (node.isMissingNode() || node.isObject()) {
            return node;
        }
        throw new IllegalArgumentException("Field '" + field + "' is not an object");
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return defaultValue;
        }
        return value.asText(defaultValue);
    }
}
