package com.github.stormino.mediabot.service.process;

import com.github.stormino.mediabot.model.SourceProgress;
import com.github.stormino.mediabot.service.parser.ProgressParser;
import com.github.stormino.mediabot.service.progress.OrderedDispatcher;
import com.github.stormino.mediabot.service.progress.ProgressSink;
import com.github.stormino.mediabot.util.DownloadConstants;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external commands under a hard wall-clock timeout. Both output streams are pumped
 * on helper threads so a silent child can never stall the timeout; a timed-out process is
 * killed together with its descendants and reaped before this returns.
 *
 * <p>Parsed progress is handed to the sink through an {@link OrderedDispatcher}, so the pumps
 * keep draining the pipes however slow the sink is.</p>
 */
@Slf4j
@Component
public class ProcessRunner {

    private final Executor pumpExecutor;
    private final Executor progressExecutor;

    // Track running processes so shutdown can kill them
    private final ConcurrentHashMap<Long, Process> runningProcesses = new ConcurrentHashMap<>();

    @Autowired
    public ProcessRunner(@Qualifier("processExecutor") Executor pumpExecutor,
                         @Qualifier("progressExecutor") Executor progressExecutor) {
        this.pumpExecutor = pumpExecutor;
        this.progressExecutor = progressExecutor;
    }

    public ProcessRunner(Executor executor) {
        this(executor, executor);
    }

    public ProcessResult run(@NonNull List<String> command, @NonNull Duration timeout) {
        return run(command, timeout, null, ProgressSink.NOOP);
    }

    /**
     * @param parser progress parser applied to both streams, may be null
     * @param sink   receives parsed progress on a dispatcher thread, in line order
     */
    public ProcessResult run(@NonNull List<String> command, @NonNull Duration timeout,
                             ProgressParser parser, @NonNull ProgressSink sink) {
        log.debug("Executing: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            log.error("Failed to start {}: {}", command.get(0), e.getMessage());
            return ProcessResult.spawnFailure("failed to start " + command.get(0) + ": " + e.getMessage());
        }

        runningProcesses.put(process.pid(), process);
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }

        Deque<String> stdout = new ArrayDeque<>();
        Deque<String> stderr = new ArrayDeque<>();
        Object parseLock = new Object();
        OrderedDispatcher<SourceProgress> dispatcher = parser == null || sink == ProgressSink.NOOP
                ? null
                : new OrderedDispatcher<>("progress of " + command.get(0), sink::accept, progressExecutor);
        ProgressSink delivery = dispatcher != null ? dispatcher::accept : sink;

        CompletableFuture<Void> stdoutPump = CompletableFuture.runAsync(
                () -> pump(process.getInputStream(), stdout, parser, delivery, parseLock), pumpExecutor);
        CompletableFuture<Void> stderrPump = CompletableFuture.runAsync(
                () -> pump(process.getErrorStream(), stderr, parser, delivery, parseLock), pumpExecutor);

        try {
            boolean exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);

            if (!exited) {
                log.warn("Process {} exceeded {}s, killing", process.pid(), timeout.toSeconds());
                kill(process);
                awaitPumps(stdoutPump, stderrPump);
                return ProcessResult.builder()
                        .timedOut(true)
                        .stdoutTail(snapshot(stdout))
                        .stderrTail(snapshot(stderr))
                        .failureMessage("timed out after " + timeout.toSeconds() + "s")
                        .build();
            }

            awaitPumps(stdoutPump, stderrPump);
            flush(dispatcher);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.debug("Process {} exited with code {}", process.pid(), exitCode);
            }
            return ProcessResult.builder()
                    .exitCode(exitCode)
                    .stdoutTail(snapshot(stdout))
                    .stderrTail(snapshot(stderr))
                    .build();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            return ProcessResult.builder()
                    .timedOut(true)
                    .stderrTail(snapshot(stderr))
                    .failureMessage("interrupted while waiting for " + command.get(0))
                    .build();
        } finally {
            runningProcesses.remove(process.pid());
        }
    }

    public int getRunningCount() {
        return runningProcesses.size();
    }

    @PreDestroy
    public void killAll() {
        runningProcesses.values().forEach(this::kill);
        runningProcesses.clear();
    }

    private void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(DownloadConstants.KILL_REAP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.error("Process {} did not exit after SIGKILL", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void pump(InputStream stream, Deque<String> tail, ProgressParser parser,
                      ProgressSink sink, Object parseLock) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (tail) {
                    tail.addLast(line);
                    if (tail.size() > DownloadConstants.STDERR_TAIL_LINES) {
                        tail.removeFirst();
                    }
                }
                if (parser != null) {
                    SourceProgress progress;
                    synchronized (parseLock) {
                        progress = parser.parseLine(line);
                    }
                    if (progress != null) {
                        sink.accept(progress);
                    }
                }
            }
        } catch (IOException e) {
            // stream closes under us when the process is killed
            log.debug("Output stream closed: {}", e.getMessage());
        }
    }

    private void awaitPumps(CompletableFuture<Void> stdoutPump, CompletableFuture<Void> stderrPump) {
        try {
            CompletableFuture.allOf(stdoutPump, stderrPump)
                    .get(DownloadConstants.KILL_REAP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Output pumps still running after process exit");
        } catch (ExecutionException e) {
            log.warn("Output pump failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Give a slow sink a short grace period so the last progress lands before the caller
     * reports a terminal status. A stuck sink is left behind, never waited on.
     */
    private void flush(OrderedDispatcher<SourceProgress> dispatcher) throws InterruptedException {
        if (dispatcher != null
                && !dispatcher.awaitIdle(Duration.ofMillis(DownloadConstants.PROGRESS_FLUSH_TIMEOUT_MS))) {
            log.warn("Progress sink is lagging, {} update(s) still queued", dispatcher.backlog());
        }
    }

    private static List<String> snapshot(Deque<String> tail) {
        synchronized (tail) {
            return new ArrayList<>(tail);
        }
    }
}
