package com.autonomous.orchestrator.router;

import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A {@code /name arg...} line split on whitespace.
 */
@Value
class SystemCommand {

    // wait on a worker reply, a lifecycle lock or the ledger file
    private static final Set<String> BLOCKING = Set.of("context", "restart", "status", "usage");

    String name;
    List<String> args;

    static boolean isCommand(String text) {
        return text != null && text.strip().startsWith("/");
    }

    static SystemCommand parse(String text) {
        String[] words = text.strip().substring(1).split("\\s+");
        String name = words[0].toLowerCase(Locale.ROOT);
        // "/help@botname" addressed form
        int at = name.indexOf('@');
        if (at >= 0) {
            name = name.substring(0, at);
        }
        List<String> args = words.length > 1 ? List.copyOf(Arrays.asList(words).subList(1, words.length)) : List.of();
        return new SystemCommand(name, args);
    }

    /**
     * Blocking commands run off the listener thread. All others only enqueue to the worker or
     * rebind the chat, so they are handled where they arrive and keep their place in the chat's order.
     */
    boolean isBlocking() {
        return BLOCKING.contains(name);
    }

    String arg(int index) {
        return index < args.size() ? args.get(index) : null;
    }
}
