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

/**
 * Escaping for Telegram MarkdownV2.
 *
 * <p>
 * Every character from {@code _*[]()~`>#+-=|{}.!} in user-controlled text is
 * prefixed with a single backslash; nothing else is altered. Link targets use
 * the narrower rule MarkdownV2 applies inside {@code (...)}: only {@code )}
 * and {@code \} are escaped.
 */
public final class MarkdownEscaper {

    static final String SPECIAL_CHARS = "_*[]()~`>#+-=|{}.!";

    private MarkdownEscaper() {
    }

    /**
     * Escape text for interpolation into a MarkdownV2 template. {@code null}
     * becomes the empty string.
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (SPECIAL_CHARS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Escape the URL part of an inline link {@code [label](url)}.
     */
    public static String escapeUrl(String url) {
        if (url == null || url.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(url.length() + 4);
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c == ')' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Escape the content of an inline code span: only {@code `} and
     * {@code \}.
     */
    public static String escapeCode(String code) {
        if (code == null || code.isEmpty()) {
            return "";
        }
        return code.replace("\\", "\\\\").replace("`", "\\`");
    }

    /**
     * Render an inline link, or the escaped label alone when the URL is blank.
     */
    public static String link(String label, String url) {
        if (url == null || url.isBlank()) {
            return escape(label);
        }
        return "[" + escape(label) + "](" + escapeUrl(url) + ")";
    }
}
