package me.hubrelay.adapter.inbound.telegram;

import me.hubrelay.adapter.inbound.command.CommandRouter;
import me.hubrelay.infrastructure.config.RelayProperties;
import me.hubrelay.port.outbound.ChatDeliveryException;
import me.hubrelay.port.outbound.ChatMessagePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.telegram.telegrambots.meta.api.methods.updates.GetUpdates;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TelegramPollingLoopTest {

    private static final long CHAT_ID = 100L;

    private TelegramClient telegramClient;
    private CommandRouter commandRouter;
    private ChatMessagePort chatMessagePort;
    private RelayProperties properties;
    private TelegramPollingLoop loop;

    @BeforeEach
    void setUp() {
        telegramClient = mock(TelegramClient.class);
        commandRouter = mock(CommandRouter.class);
        chatMessagePort = mock(ChatMessagePort.class);
        properties = new RelayProperties();
        properties.getTelegram().setPollingEnabled(false);
        properties.getTelegram().setPollTimeoutSeconds(10);
        properties.getTelegram().setErrorBackoffMillis(10);
        loop = new TelegramPollingLoop(telegramClient, commandRouter, chatMessagePort, properties);
        when(commandRouter.route(anyLong(), anyString())).thenReturn("reply");
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    private static Update textUpdate(int updateId, long chatId, String text) {
        Message message = mock(Message.class);
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn(text);
        when(message.getChatId()).thenReturn(chatId);
        Update update = mock(Update.class);
        when(update.getUpdateId()).thenReturn(updateId);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(message);
        return update;
    }

    // ==================== pollOnce ====================

    @Test
    void shouldHandleBatchInOrderAndAdvanceOffset() throws Exception {
        Update first = textUpdate(41, CHAT_ID, "/start");
        Update second = textUpdate(42, CHAT_ID, "/help");
        when(telegramClient.execute(any(GetUpdates.class))).thenReturn(new ArrayList<>(List.of(first, second)));

        int received = loop.pollOnce();

        assertEquals(2, received);
        assertEquals(43, loop.getNextOffset());
        InOrder inOrder = inOrder(commandRouter);
        inOrder.verify(commandRouter).route(CHAT_ID, "/start");
        inOrder.verify(commandRouter).route(CHAT_ID, "/help");
        verify(chatMessagePort, times(2)).sendMessage(CHAT_ID, "reply");
    }

    @Test
    void shouldRequestUpdatesFromCurrentOffset() throws Exception {
        Update update = textUpdate(7, CHAT_ID, "/status");
        when(telegramClient.execute(any(GetUpdates.class)))
                .thenReturn(new ArrayList<>(List.of(update)))
                .thenReturn(new ArrayList<>());

        loop.pollOnce();
        loop.pollOnce();

        ArgumentCaptor<GetUpdates> captor = ArgumentCaptor.forClass(GetUpdates.class);
        verify(telegramClient, times(2)).execute(captor.capture());
        assertEquals(0, captor.getAllValues().get(0).getOffset());
        assertEquals(8, captor.getAllValues().get(1).getOffset());
        assertEquals(10, captor.getAllValues().get(1).getTimeout());
    }

    @Test
    void shouldKeepOffsetWhenBatchIsEmpty() throws Exception {
        when(telegramClient.execute(any(GetUpdates.class))).thenReturn(new ArrayList<>());

        assertEquals(0, loop.pollOnce());
        assertEquals(0, loop.getNextOffset());
    }

    @Test
    void shouldPropagateFetchFailureWithoutAdvancing() throws Exception {
        when(telegramClient.execute(any(GetUpdates.class))).thenThrow(new TelegramApiException("timeout"));

        assertThrows(TelegramApiException.class, () -> loop.pollOnce());
        assertEquals(0, loop.getNextOffset());
    }

    // ==================== handleUpdate ====================

    @Test
    void shouldSkipUpdatesWithoutText() {
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(false);

        loop.handleUpdate(update);

        verifyNoInteractions(commandRouter, chatMessagePort);
    }

    @Test
    void shouldSkipNonTextMessages() {
        Message photo = mock(Message.class);
        when(photo.hasText()).thenReturn(false);
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(photo);

        loop.handleUpdate(update);

        verifyNoInteractions(commandRouter, chatMessagePort);
    }

    @Test
    void shouldContinueBatchAfterReplyFailure() throws Exception {
        doThrow(new ChatDeliveryException(CHAT_ID, "blocked", null))
                .doNothing()
                .when(chatMessagePort).sendMessage(anyLong(), anyString());
        Update first = textUpdate(1, CHAT_ID, "/start");
        Update second = textUpdate(2, CHAT_ID, "/help");
        when(telegramClient.execute(any(GetUpdates.class))).thenReturn(new ArrayList<>(List.of(first, second)));

        loop.pollOnce();

        assertEquals(3, loop.getNextOffset());
        verify(chatMessagePort, times(2)).sendMessage(CHAT_ID, "reply");
    }

    @Test
    void shouldSwallowRouterFailure() {
        when(commandRouter.route(anyLong(), anyString())).thenThrow(new IllegalStateException("boom"));

        Update update = textUpdate(1, CHAT_ID, "/start");

        assertDoesNotThrow(() -> loop.handleUpdate(update));
        verifyNoInteractions(chatMessagePort);
    }

    // ==================== Lifecycle ====================

    @Test
    void shouldNotStartWhenPollingDisabled() {
        loop.start();

        assertFalse(loop.isRunning());
        verifyNoInteractions(telegramClient);
    }

    @Test
    void shouldPollUntilStopped() throws Exception {
        properties.getTelegram().setPollingEnabled(true);
        when(telegramClient.execute(any(GetUpdates.class))).thenAnswer(invocation -> {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ArrayList<Update>();
        });

        loop.start();
        assertTrue(loop.isRunning());
        verify(telegramClient, timeout(2000).atLeast(2)).execute(any(GetUpdates.class));

        loop.stop();
        assertFalse(loop.isRunning());
    }

    @Test
    void shouldKeepPollingAfterFailure() throws Exception {
        properties.getTelegram().setPollingEnabled(true);
        when(telegramClient.execute(any(GetUpdates.class)))
                .thenThrow(new TelegramApiException("network down"))
                .thenAnswer(invocation -> {
                    try {
                        Thread.sleep(5);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return new ArrayList<Update>();
                });

        loop.start();

        verify(telegramClient, timeout(2000).atLeast(3)).execute(any(GetUpdates.class));
        assertTrue(loop.isRunning());
    }
}
