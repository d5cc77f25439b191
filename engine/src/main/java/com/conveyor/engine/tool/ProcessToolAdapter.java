package com.conveyor.engine.tool;

import com.conveyor.engine.exception.LaunchFailureException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools as local processes via {@link ProcessBuilder}.
 *
 * stdout and stderr are drained on separate threads so a chatty tool cannot
 * block on a full pipe while we wait for it to exit.
 */
@Component
public class ProcessToolAdapter implements ToolAdapter {

    private static final Logger log = LoggerFactory.getLogger(ProcessToolAdapter.class);

    private final ExecutorService streamReaders = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "tool-output-reader");
        t.setDaemon(true);
        return t;
    });

    @Override
    public ToolResult invoke(ToolInvocation invocation) {
        String display = invocation.displayCommand();
        log.debug("Invoking '{}' (timeout={}s)", display, invocation.timeout().toSeconds());

        ProcessBuilder builder = new ProcessBuilder(invocation.command());
        if (invocation.workingDirectory() != null) {
            builder.directory(invocation.workingDirectory().toFile());
        }
        builder.environment().putAll(invocation.envOverrides());

        long started = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new LaunchFailureException(display, "could not start: " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout =
                CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), streamReaders);
        CompletableFuture<String> stderr =
                CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), streamReaders);

        try {
            boolean finished = process.waitFor(invocation.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new LaunchFailureException(display,
                        "timed out after " + invocation.timeout().toSeconds() + "s");
            }
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            ToolResult result = new ToolResult(process.exitValue(), stdout.join(), stderr.join(), durationMs);
            log.debug("'{}' exited with {} after {} ms", display, result.exitCode(), durationMs);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new LaunchFailureException(display, "interrupted while waiting for the process", e);
        }
    }

    @PreDestroy
    void shutdown() {
        streamReaders.shutdownNow();
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
