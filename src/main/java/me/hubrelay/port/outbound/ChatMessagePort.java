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

package me.hubrelay.port.outbound;

/**
 * Port for sending a text message to one chat.
 *
 * <p>
 * Messages are pre-rendered in Telegram MarkdownV2. A failed send throws
 * {@link ChatDeliveryException}; callers decide whether the failure is fatal.
 */
public interface ChatMessagePort {

    /**
     * Send a message to a chat. Single attempt, no retry.
     *
     * @param chatId
     *            target chat
     * @param text
     *            MarkdownV2 text
     * @throws ChatDeliveryException
     *             if the messaging API rejects the message or cannot be reached
     */
    void sendMessage(long chatId, String text);
}
