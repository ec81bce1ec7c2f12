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

import java.util.Locale;

/**
 * Closed set of bot commands.
 *
 * <p>
 * The command is chosen by the first whitespace-delimited token of a message.
 * A {@code @botname} suffix (as Telegram appends in group chats) is ignored and
 * matching is case-insensitive. Anything else, including plain text, maps to
 * {@link #UNRECOGNIZED}.
 */
public enum BotCommand {

    START("start", "command.error"),
    HELP("help", "command.error"),
    PROFILE("profile", "command.profile.error"),
    REPOS("repos", "command.repos.error"),
    REPO("repo", "command.repo.error"),
    COMMITS("commits", "command.commits.error"),
    ISSUES("issues", "command.issues.error"),
    SEARCH("search", "command.search.error"),
    STATUS("status", "command.status.error"),
    WATCH("watch", "command.error"),
    UNWATCH("unwatch", "command.error"),
    WATCHING("watching", "command.error"),
    UNRECOGNIZED("", "command.error");

    private static final String COMMAND_PREFIX = "/";

    private final String token;
    private final String errorKey;

    BotCommand(String token, String errorKey) {
        this.token = token;
        this.errorKey = errorKey;
    }

    public String getToken() {
        return token;
    }

    /**
     * Message key of the apology sent when the handler fails.
     */
    public String getErrorKey() {
        return errorKey;
    }

    public static BotCommand fromText(String text) {
        return fromToken(firstToken(text));
    }

    /**
     * Resolve a single token such as {@code /repo} or {@code /repo@HubRelayBot}.
     */
    public static BotCommand fromToken(String token) {
        if (token == null || !token.startsWith(COMMAND_PREFIX) || token.length() == 1) {
            return UNRECOGNIZED;
        }
        String name = token.substring(COMMAND_PREFIX.length());
        int mention = name.indexOf('@');
        if (mention >= 0) {
            name = name.substring(0, mention);
        }
        name = name.toLowerCase(Locale.ROOT);
        for (BotCommand command : values()) {
            if (command != UNRECOGNIZED && command.token.equals(name)) {
                return command;
            }
        }
        return UNRECOGNIZED;
    }

    /**
     * Everything after the first token, trimmed. Empty when there is none.
     */
    public static String arguments(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        int space = indexOfWhitespace(trimmed);
        return space < 0 ? "" : trimmed.substring(space).strip();
    }

    /**
     * First whitespace-delimited token of the arguments, or {@code null}.
     */
    public static String firstArgument(String text) {
        String args = arguments(text);
        return args.isEmpty() ? null : firstToken(args);
    }

    private static String firstToken(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        int space = indexOfWhitespace(trimmed);
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    private static int indexOfWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
