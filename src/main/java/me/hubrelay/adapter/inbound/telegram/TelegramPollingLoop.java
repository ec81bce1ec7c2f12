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

package me.hubrelay.adapter.inbound.telegram;

import me.hubrelay.adapter.inbound.command.CommandRouter;
import me.hubrelay.infrastructure.config.RelayProperties;
import me.hubrelay.port.outbound.ChatDeliveryException;
import me.hubrelay.port.outbound.ChatMessagePort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.updates.GetUpdates;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.List;

/**
 * Long-poll command intake.
 *
 * <p>
 * A single dedicated thread calls {@code getUpdates} with the next offset and
 * handles the returned batch sequentially: each text message goes through
 * {@link CommandRouter} and the reply is sent back to the same chat. The
 * offset advances past an update only after it was handled, so a crash
 * re-delivers the unfinished tail (at-least-once).
 *
 * <p>
 * A failed iteration is logged and followed by a backoff sleep; the loop
 * itself only ends when {@link #stop()} clears the running flag.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code relay.telegram.polling-enabled} - start the loop at all</li>
 * <li>{@code relay.telegram.poll-timeout-seconds} - long-poll timeout</li>
 * <li>{@code relay.telegram.error-backoff-millis} - pause after a failure</li>
 * </ul>
 */
@Component
@Slf4j
public class TelegramPollingLoop {

    private static final long STOP_JOIN_MILLIS = 5000;

    private final TelegramClient telegramClient;
    private final CommandRouter commandRouter;
    private final ChatMessagePort chatMessagePort;
    private final RelayProperties properties;

    private volatile boolean running;
    private volatile int nextOffset;
    private Thread pollThread;

    public TelegramPollingLoop(TelegramClient telegramClient, CommandRouter commandRouter,
            ChatMessagePort chatMessagePort, RelayProperties properties) {
        this.telegramClient = telegramClient;
        this.commandRouter = commandRouter;
        this.chatMessagePort = chatMessagePort;
        this.properties = properties;
    }

    @PostConstruct
    public synchronized void start() {
        if (!properties.getTelegram().isPollingEnabled()) {
            log.info("[Telegram] Polling disabled");
            return;
        }
        if (running) {
            return;
        }
        running = true;
        pollThread = new Thread(this::runLoop, "telegram-poll");
        pollThread.setDaemon(true);
        pollThread.start();
        log.info("[Telegram] Polling started (timeout {}s)", properties.getTelegram().getPollTimeoutSeconds());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        Thread thread = pollThread;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(STOP_JOIN_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Telegram] Polling stopped");
    }

    public boolean isRunning() {
        return running;
    }

    int getNextOffset() {
        return nextOffset;
    }

    private void runLoop() {
        while (running) {
            try {
                pollOnce();
            } catch (TelegramApiException | RuntimeException e) {
                if (!running) {
                    break;
                }
                log.error("[Telegram] Error in polling loop: {}", e.getMessage());
                backoff();
            }
        }
    }

    /**
     * Fetch one batch of updates and handle it in order.
     *
     * @return number of updates received
     */
    int pollOnce() throws TelegramApiException {
        GetUpdates request = GetUpdates.builder()
                .offset(nextOffset)
                .timeout(properties.getTelegram().getPollTimeoutSeconds())
                .build();
        List<Update> updates = telegramClient.execute(request);
        if (updates == null || updates.isEmpty()) {
            return 0;
        }
        for (Update update : updates) {
            handleUpdate(update);
            nextOffset = update.getUpdateId() + 1;
        }
        return updates.size();
    }

    void handleUpdate(Update update) {
        if (!update.hasMessage() || !update.getMessage().hasText()) {
            return;
        }
        Message message = update.getMessage();
        long chatId = message.getChatId();
        try {
            String reply = commandRouter.route(chatId, message.getText());
            chatMessagePort.sendMessage(chatId, reply);
        } catch (ChatDeliveryException e) {
            log.error("[Telegram] Failed to reply to chat {}: {}", chatId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Telegram] Error handling update {} from chat {}", update.getUpdateId(), chatId, e);
        }
    }

    private void backoff() {
        try {
            Thread.sleep(properties.getTelegram().getErrorBackoffMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
