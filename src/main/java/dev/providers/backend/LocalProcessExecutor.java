package dev.providers.backend;

import dev.providers.engine.CostCalculator;
import dev.providers.engine.OutputNormalizer;
import dev.providers.error.ProcessSpawnException;
import dev.providers.error.ProcessTimeoutException;
import dev.providers.error.ProviderException;
import dev.providers.model.Backend;
import dev.providers.model.ProviderDescriptor;
import dev.providers.model.ProviderResult;
import dev.providers.model.RunOptions;
import dev.providers.model.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs a locally installed CLI tool (claude, codex, gemini, ...) once per request.
 * The prompt is passed as the last argument of an argument vector; no shell is involved.
 */
public final class LocalProcessExecutor implements ProviderBackend {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessExecutor.class);

    public static final long DEFAULT_TIMEOUT_MS = 120_000;

    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "local-process-output");
        thread.setDaemon(true);
        return thread;
    });

    /** Starts the child process; replaced in tests. */
    @FunctionalInterface
    public interface ProcessStarter {
        Process start(ProcessBuilder builder) throws IOException;
    }

    private final ProviderDescriptor descriptor;
    private final Backend.Local config;
    private final ProcessStarter starter;

    public LocalProcessExecutor(ProviderDescriptor descriptor, Backend.Local config, ProcessStarter starter) {
        this.descriptor = descriptor;
        this.config = config;
        this.starter = starter;
    }

    @Override
    public String getName() {
        return descriptor.name();
    }

    /**
     * Build the argument vector: command, fixed args, the optional sandbox flag and
     * value, then the prompt as the final positional argument.
     */
    public static List<String> buildCommand(Backend.Local config, String prompt, RunOptions options) {
        var command = new ArrayList<String>();
        command.add(config.command());
        command.addAll(config.args());
        String sandbox = options.sandbox();
        if (config.sandboxFlag() != null && sandbox != null && !sandbox.isBlank()
            && !config.args().contains(config.sandboxFlag())) {
            command.add(config.sandboxFlag());
            command.add(sandbox);
        }
        command.add(prompt);
        return command;
    }

    @Override
    public ProviderResult run(String prompt, RunOptions options) {
        List<String> command = buildCommand(config, prompt, options);
        var builder = new ProcessBuilder(command);
        if (options.cwd() != null) {
            builder.directory(options.cwd().toFile());
        }

        Process process;
        try {
            process = starter.start(builder);
        } catch (IOException e) {
            throw new ProcessSpawnException(config.command(), e);
        }
        log.debug("Started {} (pid {}) with {} args", config.command(), pidOf(process), command.size() - 1);

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", config.command(), e.getMessage());
        }
        Future<String> stdout = STREAM_READERS.submit(() -> readFully(process.getInputStream()));
        Future<String> stderr = STREAM_READERS.submit(() -> readFully(process.getErrorStream()));

        long timeoutMs = options.timeoutOr(DEFAULT_TIMEOUT_MS);
        boolean exited;
        try {
            exited = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroy();
            throw Pauses.cancelled("waiting for " + config.command(), e);
        }

        // Past the deadline the outcome is a timeout, even if the child exits while being signalled.
        if (!exited) {
            log.warn("{} did not finish within {} ms; sending termination signal", config.command(), timeoutMs);
            process.destroy();
            stdout.cancel(true);
            stderr.cancel(true);
            throw new ProcessTimeoutException(config.command(), timeoutMs);
        }

        int exitCode = process.exitValue();
        String raw = await(stdout);
        String errText = await(stderr);
        log.debug("{} exited with code {} ({} chars of output)", config.command(), exitCode, raw.length());

        String error = null;
        if (exitCode != 0) {
            error = errText.isBlank()
                ? "%s exited with code %d".formatted(config.command(), exitCode)
                : errText.trim();
        }

        TokenUsage usage = null;
        Double cost = null;
        String warning = null;
        if (descriptor.pricing() != null) {
            long estimated = CostCalculator.estimateTokens(prompt) + CostCalculator.estimateTokens(raw);
            usage = TokenUsage.splitEvenly(estimated);
            cost = CostCalculator.estimate(estimated, descriptor.pricing());
            warning = "Token usage estimated from prompt and output length";
        }

        return new ProviderResult(raw, OutputNormalizer.parse(raw), exitCode, usage, cost,
            errText.isEmpty() ? null : errText, error, warning);
    }

    private String await(Future<String> output) {
        try {
            return output.get();
        } catch (InterruptedException e) {
            throw Pauses.cancelled("reading output of " + config.command(), e);
        } catch (ExecutionException e) {
            throw new ProviderException("Failed to read output of " + config.command(), e.getCause());
        }
    }

    private static String readFully(InputStream stream) throws IOException {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String pidOf(Process process) {
        try {
            return String.valueOf(process.pid());
        } catch (UnsupportedOperationException e) {
            return "n/a";
        }
    }
}
