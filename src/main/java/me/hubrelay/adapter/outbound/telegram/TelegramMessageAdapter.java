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

package me.hubrelay.adapter.outbound.telegram;

import me.hubrelay.port.outbound.ChatDeliveryException;
import me.hubrelay.port.outbound.ChatMessagePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

/**
 * Sends MarkdownV2 messages through the Telegram Bot API.
 *
 * <p>
 * One attempt per call. Messages longer than the Telegram limit are cut,
 * never split, since notifications and replies are short by construction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramMessageAdapter implements ChatMessagePort {

    static final String PARSE_MODE = "MarkdownV2";
    static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    private static final String TRUNCATION_SUFFIX = "\\.\\.\\.";

    private final TelegramClient telegramClient;

    @Override
    public void sendMessage(long chatId, String text) {
        SendMessage sendMessage = SendMessage.builder()
                .chatId(String.valueOf(chatId))
                .text(truncate(text))
                .parseMode(PARSE_MODE)
                .build();
        try {
            telegramClient.execute(sendMessage);
            log.debug("[Telegram] Message sent to chat {}", chatId);
        } catch (TelegramApiException e) {
            throw new ChatDeliveryException(chatId, "Telegram rejected message: " + e.getMessage(), e);
        }
    }

    static String truncate(String text) {
        if (text.length() <= TELEGRAM_MAX_MESSAGE_LENGTH) {
            return text;
        }
        // cut between blocks so no bold or link entity is left open
        int boundary = text.lastIndexOf("\n\n", TELEGRAM_MAX_MESSAGE_LENGTH - TRUNCATION_SUFFIX.length() - 1);
        if (boundary > 0) {
            return text.substring(0, boundary) + "\n" + TRUNCATION_SUFFIX;
        }
        int end = TELEGRAM_MAX_MESSAGE_LENGTH - TRUNCATION_SUFFIX.length();
        // never leave a dangling escape
        int backslashes = 0;
        for (int i = end - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        if (backslashes % 2 == 1) {
            end--;
        }
        return text.substring(0, end) + TRUNCATION_SUFFIX;
    }
}
