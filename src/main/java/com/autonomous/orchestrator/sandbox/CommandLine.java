package com.autonomous.orchestrator.sandbox;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shell-like split of a command string into pipeline segments and words.
 *
 * <p>Quotes and backslash escapes are honoured; {@code ;}, {@code |}, {@code ||},
 * {@code &&} and {@code &} end a segment, and a redirection such as {@code 2>} or
 * {@code >>} is split off as a word of its own even when glued to its neighbours. This is a
 * policy aid, not a shell: it does not expand variables, globs or command substitutions.
 */
@Getter
public final class CommandLine {

    static final Set<String> WRAPPERS = Set.of(
        "sudo", "doas", "env", "xargs", "nohup", "nice", "time", "timeout", "command", "exec", "builtin",
        "stdbuf", "sh", "bash", "zsh", "dash");

    private static final Pattern REDIRECTION = Pattern.compile("[0-9]*&?[<>][<>|]*(&[0-9]*-?)?");
    private static final Pattern FD_DUPLICATION = Pattern.compile("[0-9]*[<>]&[0-9]*-?");

    private final String raw;
    private final List<List<String>> segments;
    private final boolean background;

    private CommandLine(String raw, List<List<String>> segments, boolean background) {
        this.raw = raw;
        this.segments = segments;
        this.background = background;
    }

    public static CommandLine parse(String command) {
        List<List<String>> segments = new ArrayList<>();
        List<String> words = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        boolean inWord = false;
        boolean background = false;
        char quote = 0;

        String text = command == null ? "" : command;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else if (c == '\\' && quote == '"' && i + 1 < text.length()) {
                    word.append(text.charAt(++i));
                } else {
                    word.append(c);
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
                inWord = true;
            } else if (c == '\\' && i + 1 < text.length()) {
                word.append(text.charAt(++i));
                inWord = true;
            } else if (Character.isWhitespace(c)) {
                inWord = flush(word, words, inWord);
            } else if (c == '<' || c == '>' || (c == '&' && i + 1 < text.length() && text.charAt(i + 1) == '>')) {
                // a redirection is a word of its own so its target is judged like any argument
                StringBuilder operator = new StringBuilder();
                if (inWord && isDigits(word)) {
                    operator.append(word);
                    word.setLength(0);
                    inWord = false;
                } else {
                    inWord = flush(word, words, inWord);
                }
                int end = redirectionEnd(text, i);
                operator.append(text, i, end);
                words.add(operator.toString());
                i = end - 1;
            } else if (c == ';' || c == '|' || c == '&') {
                inWord = flush(word, words, inWord);
                boolean doubled = i + 1 < text.length() && text.charAt(i + 1) == c;
                if (c == '&' && !doubled) {
                    background = true;
                }
                if (doubled) {
                    i++;
                }
                endSegment(words, segments);
                words = new ArrayList<>();
            } else {
                word.append(c);
                inWord = true;
            }
        }
        flush(word, words, inWord);
        endSegment(words, segments);
        return new CommandLine(text, Collections.unmodifiableList(segments), background);
    }

    private static int redirectionEnd(String text, int start) {
        int i = start;
        if (text.charAt(i) == '&') {
            i++;
        }
        i++;
        while (i < text.length() && (text.charAt(i) == '<' || text.charAt(i) == '>' || text.charAt(i) == '|')) {
            i++;
        }
        if (i < text.length() && text.charAt(i) == '&') {
            i++;
            while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '-')) {
                i++;
            }
        }
        return i;
    }

    private static boolean isDigits(CharSequence word) {
        if (word.length() == 0) {
            return false;
        }
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isDigit(word.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean flush(StringBuilder word, List<String> words, boolean inWord) {
        if (inWord) {
            words.add(word.toString());
            word.setLength(0);
        }
        return false;
    }

    private static void endSegment(List<String> words, List<List<String>> segments) {
        if (!words.isEmpty()) {
            segments.add(Collections.unmodifiableList(words));
        }
    }

    public List<String> allWords() {
        List<String> all = new ArrayList<>();
        segments.forEach(all::addAll);
        return all;
    }

    /**
     * Indexes of the words in {@code segment} that run as programs: the first word after any
     * assignments and redirections, every word after a wrapper such as {@code sudo} or
     * {@code xargs}, and every command substitution.
     */
    public static List<Integer> programIndexes(List<String> segment) {
        List<Integer> indexes = new ArrayList<>();
        boolean expectProgram = true;
        boolean wrapped = false;
        boolean redirectTarget = false;
        for (int i = 0; i < segment.size(); i++) {
            String word = segment.get(i);
            boolean substitution = substitutionStart(word) >= 0;
            if (redirectTarget) {
                redirectTarget = false;
                if (substitution) {
                    indexes.add(i);
                }
                continue;
            }
            if (isRedirection(word)) {
                redirectTarget = !FD_DUPLICATION.matcher(word).matches();
                continue;
            }
            boolean program = expectProgram && !isAssignment(word);
            if (wrapped || substitution || program) {
                indexes.add(i);
            }
            if (program) {
                expectProgram = false;
                wrapped = WRAPPERS.contains(programName(word));
            }
        }
        return indexes;
    }

    public static boolean isRedirection(String word) {
        return REDIRECTION.matcher(word).matches();
    }

    private static boolean isAssignment(String word) {
        int eq = word.indexOf('=');
        return eq > 0 && word.substring(0, eq).matches("[A-Za-z_][A-Za-z0-9_]*");
    }

    private static int substitutionStart(String word) {
        if (word.startsWith("(")) {
            return 0;
        }
        int dollar = word.indexOf("$(");
        int tick = word.indexOf('`');
        if (dollar < 0) {
            return tick;
        }
        return tick < 0 ? dollar : Math.min(dollar, tick);
    }

    /**
     * Program name of a word with any leading directory and substitution syntax removed,
     * e.g. {@code /usr/bin/curl}, {@code $(curl} and {@code x=`curl -s} all give {@code curl}.
     */
    public static String programName(String word) {
        String stripped = word;
        int substitution = substitutionStart(stripped);
        if (substitution > 0) {
            stripped = stripped.substring(substitution);
        }
        while (stripped.startsWith("$(") || stripped.startsWith("(") || stripped.startsWith("`")) {
            stripped = stripped.startsWith("$(") ? stripped.substring(2) : stripped.substring(1);
        }
        stripped = stripped.strip();
        int space = stripped.indexOf(' ');
        if (space >= 0) {
            stripped = stripped.substring(0, space);
        }
        while (stripped.endsWith(")") || stripped.endsWith("`")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        int slash = stripped.lastIndexOf('/');
        return slash >= 0 ? stripped.substring(slash + 1) : stripped;
    }

    /**
     * Whitespace-collapsed form used for blocked-pattern matching.
     */
    public static String normalize(String command) {
        return command == null ? "" : command.trim().replaceAll("\\s+", " ");
    }
}
