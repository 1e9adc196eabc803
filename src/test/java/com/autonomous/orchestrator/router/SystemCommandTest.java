package com.autonomous.orchestrator.router;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SystemCommandTest {

    @Test
    void shouldSplitNameAndArguments() {
        SystemCommand command = SystemCommand.parse("  /Model   list  openai ");

        assertEquals("model", command.getName());
        assertEquals(List.of("list", "openai"), command.getArgs());
        assertEquals("openai", command.arg(1));
        assertNull(command.arg(2));
    }

    @Test
    void shouldDropBotSuffix() {
        assertEquals("help", SystemCommand.parse("/help@turtle_bot").getName());
    }

    @Test
    void onlySlashPrefixedTextIsCommand() {
        assertTrue(SystemCommand.isCommand("/reset"));
        assertFalse(SystemCommand.isCommand("please /reset"));
        assertFalse(SystemCommand.isCommand(null));
    }
}
