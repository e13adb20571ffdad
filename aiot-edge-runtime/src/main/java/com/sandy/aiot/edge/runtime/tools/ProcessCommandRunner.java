package com.sandy.aiot.edge.runtime.tools;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs short-lived host commands (telemetry queries, power scheme switches) with a hard timeout.
 */
@Component
@Slf4j
public class ProcessCommandRunner {

    private final Duration timeout;

    public ProcessCommandRunner(@Value("${runtime.process-timeout-seconds:8}") long timeoutSeconds) {
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Starts the command and waits at most the configured timeout. A process still running
     * past the bound is killed and reported as timed out.
     *
     * @throws IOException if the process cannot be started
     */
    public CommandResult run(List<String> command) throws IOException {
        long start = System.currentTimeMillis();
        Process process = new ProcessBuilder(command).start();
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Command timed out after {}ms: {}", timeout.toMillis(), command.get(0));
                return CommandResult.timedOut("command timed out after " + timeout.toSeconds() + "s");
            }
            String out = stdout.get(1, TimeUnit.SECONDS);
            String err = stderr.get(1, TimeUnit.SECONDS);
            log.debug("Command finished exit={} cost={}ms cmd={}", process.exitValue(), System.currentTimeMillis() - start, command.get(0));
            return new CommandResult(process.exitValue(), out, err, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return CommandResult.timedOut("interrupted");
        } catch (ExecutionException | TimeoutException e) {
            return new CommandResult(process.exitValue(), "", String.valueOf(e.getMessage()), false);
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public record CommandResult(int exitCode, String stdout, String stderr, boolean timedOut) {

        static CommandResult timedOut(String message) {
            return new CommandResult(-1, "", message, true);
        }

        public boolean isSuccess() {
            return !timedOut && exitCode == 0;
        }
    }
}
