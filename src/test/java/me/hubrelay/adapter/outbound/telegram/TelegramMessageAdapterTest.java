package me.hubrelay.adapter.outbound.telegram;

import me.hubrelay.port.outbound.ChatDeliveryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TelegramMessageAdapterTest {

    private TelegramClient telegramClient;
    private TelegramMessageAdapter adapter;

    @BeforeEach
    void setUp() {
        telegramClient = mock(TelegramClient.class);
        adapter = new TelegramMessageAdapter(telegramClient);
    }

    @Test
    void shouldSendMarkdownV2Message() throws Exception {
        adapter.sendMessage(-1001234L, "🏓 *Ping*");

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient).execute(captor.capture());
        SendMessage sent = captor.getValue();
        assertEquals("-1001234", sent.getChatId());
        assertEquals("🏓 *Ping*", sent.getText());
        assertEquals("MarkdownV2", sent.getParseMode());
    }

    @Test
    void shouldWrapTelegramFailure() throws Exception {
        when(telegramClient.execute(any(SendMessage.class)))
                .thenThrow(new TelegramApiException("Bad Request: chat not found"));

        ChatDeliveryException error = assertThrows(ChatDeliveryException.class,
                () -> adapter.sendMessage(42L, "hello"));

        assertEquals(42L, error.getChatId());
        assertTrue(error.getMessage().contains("chat not found"));
        assertInstanceOf(TelegramApiException.class, error.getCause());
    }

    @Test
    void shouldAttemptDeliveryOnce() throws Exception {
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(new TelegramApiException("flood"));

        assertThrows(ChatDeliveryException.class, () -> adapter.sendMessage(42L, "hello"));

        verify(telegramClient, times(1)).execute(any(SendMessage.class));
    }

    // ==================== Truncation ====================

    @Test
    void shouldKeepMessagesWithinLimit() {
        String text = "a".repeat(4096);

        assertSame(text, TelegramMessageAdapter.truncate(text));
    }

    @Test
    void shouldTruncateLongMessages() {
        String truncated = TelegramMessageAdapter.truncate("a".repeat(5000));

        assertEquals(4096, truncated.length());
        assertTrue(truncated.endsWith("a\\.\\.\\."));
    }

    @Test
    void shouldNotLeaveDanglingEscapeAtCut() {
        // the cut falls right after the backslash of "\."
        String text = "a".repeat(4089) + "\\." + "b".repeat(100);

        String truncated = TelegramMessageAdapter.truncate(text);

        assertEquals("a".repeat(4089) + "\\.\\.\\.", truncated);
    }

    @Test
    void shouldCutAtLastBlockBoundaryBeforeLimit() {
        String block = "*octo/app* [abc1234](https://github.com/octo/app/commit/abc1234)";
        StringBuilder text = new StringBuilder();
        while (text.length() < 5000) {
            text.append(block).append("\n\n");
        }

        String truncated = TelegramMessageAdapter.truncate(text.toString());

        assertTrue(truncated.length() <= 4096);
        assertTrue(truncated.endsWith(block + "\n\\.\\.\\."));
        String kept = truncated.substring(0, truncated.length() - "\n\\.\\.\\.".length());
        assertEquals(0, kept.chars().filter(c -> c == '*').count() % 2);
        assertEquals(kept.chars().filter(c -> c == '(').count(), kept.chars().filter(c -> c == ')').count());
    }
}
