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

import me.hubrelay.domain.model.RateLimitResult;
import me.hubrelay.domain.model.RelaySettings;
import me.hubrelay.infrastructure.i18n.MessageService;
import me.hubrelay.port.outbound.GitHubPort;
import me.hubrelay.ratelimit.ChatRateLimiter;
import me.hubrelay.security.ChatAllowlist;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Function;

import static me.hubrelay.domain.service.MarkdownEscaper.escapeCode;

/**
 * Routes one incoming chat message to its command handler.
 *
 * <p>
 * Every message passes the same gates in order: allow-list, then the per-chat
 * rate limiter, then dispatch on {@link BotCommand}. A rejected message never
 * reaches a handler. Unrecognized text gets the unknown-command reply, but only
 * after both gates.
 *
 * <p>
 * Commands:
 * <ul>
 * <li>/start, /help - welcome and command reference</li>
 * <li>/profile [user], /repos [user] - profile and repositories, the
 * configured account when no user is given</li>
 * <li>/repo, /commits, /issues owner/repo - repository details, 5 latest
 * commits, 5 open issues</li>
 * <li>/search query - 8 repositories by stars</li>
 * <li>/status - GitHub quota and relay configuration</li>
 * <li>/watch, /unwatch owner/repo, /watching - explain broadcast delivery</li>
 * </ul>
 *
 * <p>
 * Handler failures are logged and answered with the command's apology; they
 * never escape {@link #route}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandRouter {

    static final int REPOS_LIMIT = 10;
    static final int COMMITS_LIMIT = 5;
    static final int ISSUES_LIMIT = 5;
    static final int SEARCH_LIMIT = 8;

    private static final String MSG_USAGE_REPOSITORY = "command.usage.repository";
    private static final String MSG_INVALID_REPOSITORY = "command.invalid.repository";

    private final ChatAllowlist allowlist;
    private final ChatRateLimiter rateLimiter;
    private final GitHubPort gitHubPort;
    private final GitHubReplyFormatter replyFormatter;
    private final MessageService messageService;
    private final RelaySettings settings;

    /**
     * Handle a message and produce the MarkdownV2 reply.
     */
    public String route(long chatId, String text) {
        if (!allowlist.isAllowed(chatId)) {
            return msg("command.unauthorized");
        }

        RateLimitResult rateLimit = rateLimiter.tryAcquire(chatId);
        if (!rateLimit.isAllowed()) {
            log.info("[Command] Chat {} rate limited, retry after {}s", chatId,
                    rateLimit.getRetryAfter().toSeconds());
            return msg("command.rate-limited");
        }

        BotCommand command = BotCommand.fromText(text);
        log.debug("[Command] Chat {} -> {}", chatId, command);
        try {
            return execute(command, text);
        } catch (RuntimeException e) {
            log.error("[Command] Error in {} command for chat {}", command, chatId, e);
            return msg(command.getErrorKey());
        }
    }

    private String execute(BotCommand command, String text) {
        return switch (command) {
        case START -> msg("command.start");
        case HELP -> msg("command.help",
                String.valueOf(settings.rateLimitRequests()),
                String.valueOf(settings.rateLimitWindowSeconds()));
        case PROFILE -> handleProfile(BotCommand.firstArgument(text));
        case REPOS -> handleRepos(BotCommand.firstArgument(text));
        case REPO -> withRepository(command, text, this::handleRepo);
        case COMMITS -> withRepository(command, text, this::handleCommits);
        case ISSUES -> withRepository(command, text, this::handleIssues);
        case SEARCH -> handleSearch(BotCommand.arguments(text));
        case STATUS -> replyFormatter.formatStatus(gitHubPort.getRateLimit(), settings);
        case WATCH -> withRepository(command, text, this::handleWatch);
        case UNWATCH -> withRepository(command, text,
                ref -> msg("command.unwatch.broadcast", escapeCode(ref.fullName())));
        case WATCHING -> msg("command.watching", replyFormatter.formatNotificationSwitches(settings.notifyFlags()));
        case UNRECOGNIZED -> msg("command.unknown");
        };
    }

    private String handleProfile(String username) {
        return gitHubPort.getUser(username)
                .map(replyFormatter::formatProfile)
                .orElseGet(() -> msg("command.profile.not-found"));
    }

    private String handleRepos(String username) {
        return nonEmptyArray(gitHubPort.getUserRepositories(username, REPOS_LIMIT))
                .map(replyFormatter::formatRepositories)
                .orElseGet(() -> msg("command.repos.not-found"));
    }

    private String handleRepo(RepositoryRef ref) {
        return gitHubPort.getRepository(ref.owner(), ref.repo())
                .map(replyFormatter::formatRepository)
                .orElseGet(() -> msg("command.repo.not-found", escapeCode(ref.fullName())));
    }

    private String handleCommits(RepositoryRef ref) {
        return nonEmptyArray(gitHubPort.getCommits(ref.owner(), ref.repo(), COMMITS_LIMIT))
                .map(commits -> replyFormatter.formatCommits(ref, commits))
                .orElseGet(() -> msg("command.commits.not-found", escapeCode(ref.fullName())));
    }

    private String handleIssues(RepositoryRef ref) {
        return nonEmptyArray(gitHubPort.getOpenIssues(ref.owner(), ref.repo(), ISSUES_LIMIT))
                .map(issues -> replyFormatter.formatIssues(ref, issues))
                .orElseGet(() -> msg("command.issues.not-found", escapeCode(ref.fullName())));
    }

    private String handleSearch(String query) {
        if (query.isEmpty()) {
            return msg("command.search.usage");
        }
        return nonEmptyArray(gitHubPort.searchRepositories(query, SEARCH_LIMIT))
                .map(results -> replyFormatter.formatSearchResults(query, results))
                .orElseGet(() -> msg("command.search.not-found", escapeCode(query)));
    }

    private String handleWatch(RepositoryRef ref) {
        int subscribers = settings.allowedChatIds().size();
        if (subscribers == 0) {
            return msg("command.watch.no-subscribers", escapeCode(ref.fullName()));
        }
        return msg("command.watch.broadcast", escapeCode(ref.fullName()), String.valueOf(subscribers));
    }

    private String withRepository(BotCommand command, String text, Function<RepositoryRef, String> handler) {
        String path = BotCommand.firstArgument(text);
        if (path == null) {
            return msg(MSG_USAGE_REPOSITORY, command.getToken());
        }
        return RepositoryRef.parse(path)
                .map(handler)
                .orElseGet(() -> msg(MSG_INVALID_REPOSITORY, command.getToken()));
    }

    private static Optional<JsonNode> nonEmptyArray(Optional<JsonNode> result) {
        return result.filter(node -> node.isArray() && !node.isEmpty());
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
