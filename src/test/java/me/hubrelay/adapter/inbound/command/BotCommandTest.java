package me.hubrelay.adapter.inbound.command;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class BotCommandTest {

    // ==================== Command resolution ====================

    @Test
    void shouldResolveEveryCommandToken() {
        for (BotCommand command : BotCommand.values()) {
            if (command == BotCommand.UNRECOGNIZED) {
                continue;
            }
            assertEquals(command, BotCommand.fromText("/" + command.getToken()));
        }
    }

    @Test
    void shouldIgnoreBotMentionAndCase() {
        assertEquals(BotCommand.REPO, BotCommand.fromText("/repo@HubRelayBot octo/app"));
        assertEquals(BotCommand.HELP, BotCommand.fromText("/HELP"));
        assertEquals(BotCommand.STATUS, BotCommand.fromText("  /status  "));
    }

    @ParameterizedTest
    @ValueSource(strings = { "hello", "/", "/unknown", "repo octo/app", "/repository", "" })
    void shouldMapEverythingElseToUnrecognized(String text) {
        assertEquals(BotCommand.UNRECOGNIZED, BotCommand.fromText(text));
    }

    @Test
    void shouldTreatNullAsUnrecognized() {
        assertEquals(BotCommand.UNRECOGNIZED, BotCommand.fromText(null));
    }

    @Test
    void shouldUseSpecificErrorKeysForGitHubCommands() {
        assertEquals("command.repo.error", BotCommand.REPO.getErrorKey());
        assertEquals("command.search.error", BotCommand.SEARCH.getErrorKey());
        assertEquals("command.error", BotCommand.START.getErrorKey());
    }

    // ==================== Arguments ====================

    @Test
    void shouldExtractArgumentsAfterCommand() {
        assertEquals("spring boot  starter", BotCommand.arguments("/search   spring boot  starter "));
        assertEquals("", BotCommand.arguments("/search"));
        assertEquals("", BotCommand.arguments(null));
    }

    @Test
    void shouldExtractFirstArgument() {
        assertEquals("octocat", BotCommand.firstArgument("/profile octocat extra"));
        assertNull(BotCommand.firstArgument("/profile"));
        assertNull(BotCommand.firstArgument("/profile   "));
    }

    // ==================== RepositoryRef ====================

    @Test
    void shouldParseOwnerAndRepo() {
        RepositoryRef ref = RepositoryRef.parse("octo-org/my.repo_1").orElseThrow();

        assertEquals("octo-org", ref.owner());
        assertEquals("my.repo_1", ref.repo());
        assertEquals("octo-org/my.repo_1", ref.fullName());
    }

    @ParameterizedTest
    @ValueSource(strings = { "octo", "/repo", "octo/", "octo/repo/extra", "oc to/repo", "octo/re$po" })
    void shouldRejectInvalidRepositoryPaths(String path) {
        assertTrue(RepositoryRef.parse(path).isEmpty());
    }

    @Test
    void shouldRejectNullRepositoryPath() {
        assertTrue(RepositoryRef.parse(null).isEmpty());
    }
}
