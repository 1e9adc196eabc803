package com.autonomous.orchestrator.sandbox;

import com.autonomous.orchestrator.config.ShellSettings;
import com.autonomous.orchestrator.exception.BlockedCommandException;
import com.autonomous.orchestrator.exception.CommandTimedOutException;
import com.autonomous.orchestrator.exception.ConfirmationRequiredException;
import com.autonomous.orchestrator.exception.NetworkDeniedException;
import com.autonomous.orchestrator.exception.PathEscapeDeniedException;
import com.autonomous.orchestrator.exception.ProcessControlDeniedException;
import com.autonomous.orchestrator.exception.SandboxViolationException;
import com.autonomous.orchestrator.model.SandboxMode;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Validates and runs shell commands for one agent under its sandbox mode.
 *
 * <p>Checks run in a fixed order and the first failure wins: blocked patterns, network
 * tools (restricted), process management (confined and restricted), workspace confinement
 * of every path argument (confined and restricted), then dangerous commands that need an
 * explicit confirmation. A rejected command never spawns a subprocess.
 */
@Slf4j
public class SandboxEnforcer {

    static final Set<String> NETWORK_TOOLS = Set.of(
        "curl", "wget", "nc", "ncat", "netcat", "ssh", "scp", "sftp", "ftp", "telnet",
        "ping", "traceroute", "nslookup", "dig", "host", "rsync", "socat", "aria2c", "httpie", "http");

    static final Set<String> GIT_NETWORK_SUBCOMMANDS = Set.of("clone", "fetch", "pull", "push", "ls-remote");

    static final Set<String> PROCESS_TOOLS = Set.of(
        "kill", "killall", "pkill", "nohup", "setsid", "disown", "daemonize", "systemctl", "service",
        "launchctl", "renice", "crontab", "screen", "tmux");

    private static final ExecutorService OUTPUT_READERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "shell-output");
        thread.setDaemon(true);
        return thread;
    });

    @Getter
    private final SandboxMode mode;
    @Getter
    private final Path workspaceRoot;
    private final ShellSettings settings;
    private final ShellHistory history;
    private final Set<Process> running = ConcurrentHashMap.newKeySet();

    public SandboxEnforcer(SandboxMode mode, Path workspaceRoot, ShellSettings settings, ShellHistory history) {
        this.mode = mode;
        this.workspaceRoot = realPath(workspaceRoot.toAbsolutePath().normalize());
        this.settings = settings;
        this.history = history;
    }

    /**
     * Runs {@code command} in {@code cwd} (the workspace root when null).
     *
     * @param confirmed true only when the end user explicitly confirmed this command
     */
    public ShellResult execute(String command, Path cwd, boolean confirmed) {
        Path workDir = cwd == null ? workspaceRoot : cwd;
        try {
            check(command, workDir, confirmed);
        } catch (SandboxViolationException e) {
            log.warn("Sandbox ({}) rejected '{}': {}", mode.key(), command, e.getMessage());
            history.record(command, null, statusOf(e), e.getMessage());
            throw e;
        }
        return run(command, workDir);
    }

    public void check(String command, Path cwd, boolean confirmed) {
        String normalized = CommandLine.normalize(command);
        for (String pattern : settings.getBlockedCommands()) {
            if (matchesBlocked(normalized, CommandLine.normalize(pattern))) {
                throw new BlockedCommandException(command, pattern);
            }
        }

        CommandLine line = CommandLine.parse(command);
        if (mode == SandboxMode.RESTRICTED) {
            findNetworkTool(line).ifPresent(tool -> {
                throw new NetworkDeniedException(command, tool);
            });
        }
        if (mode.confinesFilesystem()) {
            findProcessTool(line).ifPresent(tool -> {
                throw new ProcessControlDeniedException(command, tool);
            });
            Path workDir = cwd == null ? workspaceRoot : cwd;
            if (!isInsideWorkspace(workspaceRoot.resolve(workDir).normalize())) {
                throw new PathEscapeDeniedException(command, workDir.toString());
            }
            findEscapingPath(line, workspaceRoot.resolve(workDir).normalize()).ifPresent(path -> {
                throw new PathEscapeDeniedException(command, path);
            });
        }
        if (!confirmed) {
            for (String word : line.allWords()) {
                String program = CommandLine.programName(word);
                if (settings.getDangerousCommands().contains(program)) {
                    throw new ConfirmationRequiredException(command, program);
                }
            }
        }
    }

    /**
     * Kills every subprocess this enforcer still has running, children first.
     */
    public void terminateAll() {
        for (Process process : running) {
            killTree(process);
        }
        running.clear();
    }

    private ShellResult run(String command, Path workDir) {
        ProcessBuilder builder = new ProcessBuilder("/bin/sh", "-c", command);
        builder.directory(workDir.toFile());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            history.record(command, -1, "error", e.getMessage());
            return new ShellResult(command, -1, "", "Execution error: " + e.getMessage(), false);
        }
        running.add(process);

        CompletableFuture<Capture> stdout = CompletableFuture.supplyAsync(() -> capture(process.getInputStream()), OUTPUT_READERS);
        CompletableFuture<Capture> stderr = CompletableFuture.supplyAsync(() -> capture(process.getErrorStream()), OUTPUT_READERS);
        try {
            boolean finished = process.waitFor(settings.getTimeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                killTree(process);
                log.warn("Command timed out after {}s: {}", settings.getTimeoutSeconds(), command);
                history.record(command, null, "timed_out", null);
                throw new CommandTimedOutException(command, settings.getTimeoutSeconds());
            }
            Capture out = stdout.get(5, TimeUnit.SECONDS);
            Capture err = stderr.get(5, TimeUnit.SECONDS);
            ShellResult result = new ShellResult(command, process.exitValue(), out.text, err.text,
                out.truncated || err.truncated);
            history.record(command, result.getExitCode(), "completed", out.text + err.text);
            return result;
        } catch (InterruptedException e) {
            killTree(process);
            Thread.currentThread().interrupt();
            history.record(command, null, "interrupted", null);
            return new ShellResult(command, -1, "", "Execution interrupted", false);
        } catch (ExecutionException | TimeoutException e) {
            history.record(command, process.exitValue(), "output_lost", e.getMessage());
            return new ShellResult(command, process.exitValue(), "", "Failed to capture output: " + e.getMessage(), false);
        } finally {
            running.remove(process);
        }
    }

    private Capture capture(InputStream stream) {
        int max = settings.getMaxOutputChars();
        StringBuilder text = new StringBuilder();
        boolean truncated = false;
        char[] buffer = new char[4096];
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(buffer)) != -1) {
                int room = max - text.length();
                if (room > 0) {
                    text.append(buffer, 0, Math.min(room, read));
                }
                // keep draining so the child never blocks on a full pipe
                if (read > room) {
                    truncated = true;
                }
            }
        } catch (IOException e) {
            log.debug("Output stream closed early: {}", e.getMessage());
        }
        return new Capture(text.toString(), truncated);
    }

    private static void killTree(Process process) {
        // descendants first: once the parent dies they are re-parented and out of reach
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    /**
     * A blocked pattern matches where it starts the command or follows a separator; what comes
     * after it does not matter, so {@code rm -rf /} also blocks {@code rm -rf /*}.
     */
    static boolean matchesBlocked(String normalizedCommand, String pattern) {
        if (pattern.isEmpty()) {
            return false;
        }
        Pattern prefixed = Pattern.compile("(^|[\\s;&|(`])" + Pattern.quote(pattern));
        return prefixed.matcher(normalizedCommand).find();
    }

    private static Optional<String> findNetworkTool(CommandLine line) {
        for (List<String> segment : line.getSegments()) {
            for (int i : CommandLine.programIndexes(segment)) {
                String program = CommandLine.programName(segment.get(i));
                if (NETWORK_TOOLS.contains(program)) {
                    return Optional.of(program);
                }
                if ("git".equals(program) && i + 1 < segment.size()
                    && GIT_NETWORK_SUBCOMMANDS.contains(segment.get(i + 1))) {
                    return Optional.of("git " + segment.get(i + 1));
                }
            }
            for (String word : segment) {
                if (word.contains("://") || word.contains("/dev/tcp/") || word.contains("/dev/udp/")) {
                    return Optional.of(word);
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> findProcessTool(CommandLine line) {
        if (line.isBackground()) {
            return Optional.of("&");
        }
        for (List<String> segment : line.getSegments()) {
            for (int i : CommandLine.programIndexes(segment)) {
                String program = CommandLine.programName(segment.get(i));
                if (PROCESS_TOOLS.contains(program)) {
                    return Optional.of(program);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> findEscapingPath(CommandLine line, Path workDir) {
        for (List<String> segment : line.getSegments()) {
            List<Integer> programs = CommandLine.programIndexes(segment);
            // the program itself may live anywhere, e.g. /bin/ls
            int program = programs.isEmpty() ? -1 : programs.get(0);
            for (int i = 0; i < segment.size(); i++) {
                String word = segment.get(i);
                if (i == program || CommandLine.isRedirection(word)) {
                    continue;
                }
                String candidate = pathCandidate(word);
                if (candidate == null) {
                    continue;
                }
                if (candidate.startsWith("$") || isOtherUsersHome(candidate)) {
                    return Optional.of(candidate);
                }
                if (!isInsideWorkspace(resolve(workDir, candidate))) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    private static String pathCandidate(String word) {
        String value = word;
        int eq = value.indexOf('=');
        if (eq >= 0) {
            value = value.substring(eq + 1);
        }
        if (value.isEmpty() || value.contains("://")) {
            return null;
        }
        boolean pathLike = value.contains("/") || value.startsWith("~") || value.equals("..") || value.equals(".");
        return pathLike ? value : null;
    }

    // ~user and ~+ style expansions
    private static boolean isOtherUsersHome(String candidate) {
        return candidate.startsWith("~") && !candidate.equals("~") && !candidate.startsWith("~/");
    }

    private Path resolve(Path workDir, String candidate) {
        String expanded = candidate;
        if (candidate.equals("~") || candidate.startsWith("~/")) {
            expanded = System.getProperty("user.home") + candidate.substring(1);
        }
        try {
            return realPath(workDir.resolve(expanded).normalize());
        } catch (InvalidPathException e) {
            return Path.of("/");
        }
    }

    private boolean isInsideWorkspace(Path path) {
        return realPath(path).startsWith(workspaceRoot);
    }

    /**
     * Resolves symlinks on the longest existing prefix and re-appends the rest, so paths
     * that do not exist yet are still judged by where they would land.
     */
    static Path realPath(Path path) {
        Path existing = path;
        Path rest = null;
        while (existing != null && !Files.exists(existing)) {
            Path name = existing.getFileName();
            rest = rest == null ? name : name.resolve(rest);
            existing = existing.getParent();
        }
        if (existing == null) {
            return path.normalize();
        }
        try {
            Path real = existing.toRealPath();
            return rest == null ? real : real.resolve(rest).normalize();
        } catch (IOException e) {
            return path.normalize();
        }
    }

    private static String statusOf(SandboxViolationException e) {
        if (e instanceof ConfirmationRequiredException) {
            return "needs_confirmation";
        }
        return "blocked";
    }

    @Value
    private static class Capture {
        String text;
        boolean truncated;
    }
}
