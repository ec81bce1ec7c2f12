package me.hubrelay.infrastructure.i18n;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageServiceTest {

    private MessageService messageService;

    @BeforeEach
    void setUp() {
        messageService = new MessageService();
    }

    @Test
    void shouldLoadMarkdownV2Text() {
        assertEquals("❌ You are not authorized to use this bot\\.", messageService.getMessage("command.unauthorized"));
    }

    @Test
    void shouldKeepMultilineText() {
        String start = messageService.getMessage("command.start");

        assertTrue(start.startsWith("🎯 *Welcome to HubRelay\\!*\n\n"));
        assertTrue(start.contains("• `/repo owner/repo` \\- repository details\n"));
    }

    @Test
    void shouldFormatArguments() {
        assertEquals("❌ Please specify a repository: `/commits owner/repo`",
                messageService.getMessage("command.usage.repository", "commits"));
    }

    @Test
    void shouldReturnKeyWhenMissing() {
        assertEquals("command.nope", messageService.getMessage("command.nope"));
        assertFalse(messageService.hasMessage("command.nope"));
        assertTrue(messageService.hasMessage("command.help"));
    }
}
