package org.rostilos.gitvault.bridge.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ProcessRunner} on top of {@link ProcessBuilder}. Stdout and stderr are
 * drained on background threads so a chatty process cannot block on a full pipe.
 */
public class DefaultProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultProcessRunner.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "gitvault-process-io-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final Map<String, String> systemEnvironment;

    public DefaultProcessRunner() {
        this(System.getenv());
    }

    public DefaultProcessRunner(Map<String, String> systemEnvironment) {
        this.systemEnvironment = Map.copyOf(systemEnvironment);
    }

    @Override
    public ProcessResult run(List<String> command, byte[] stdin, Map<String, String> environment, Duration timeout)
            throws IOException {
        String commandLine = String.join(" ", command);
        ProcessBuilder builder = new ProcessBuilder(command);
        if (environment != null) {
            builder.environment().putAll(environment);
        }

        long started = System.nanoTime();
        Process process = builder.start();
        CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()), STREAM_READERS);
        CompletableFuture<byte[]> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()), STREAM_READERS);

        try {
            try (OutputStream input = process.getOutputStream()) {
                if (stdin != null) {
                    input.write(stdin);
                }
            } catch (IOException e) {
                // The process may exit without reading its input
                log.debug("Could not write stdin of '{}': {}", commandLine, e.getMessage());
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                destroyTree(process);
                throw new ProcessTimeoutException(commandLine, timeout);
            }

            long remaining = Math.max(1, timeout.toMillis() - TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            ProcessResult result = new ProcessResult(process.exitValue(),
                    stdout.get(remaining, TimeUnit.MILLISECONDS),
                    stderr.get(remaining, TimeUnit.MILLISECONDS));
            log.debug("Command '{}' exited with {}", commandLine, result.getExitCode());
            return result;
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for '" + commandLine + "'", e);
        } catch (TimeoutException e) {
            destroyTree(process);
            throw new ProcessTimeoutException(commandLine, timeout);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read output of '" + commandLine + "'", e.getCause());
        }
    }

    @Override
    public boolean isOnPath(String executable) {
        String path = systemEnvironment.get("PATH");
        if (path == null || path.isBlank()) {
            return false;
        }
        for (String directory : path.split(File.pathSeparator)) {
            if (directory.isBlank()) {
                continue;
            }
            Path candidate = Paths.get(directory, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return true;
            }
            Path windowsCandidate = Paths.get(directory, executable + ".exe");
            if (Files.isRegularFile(windowsCandidate) && Files.isExecutable(windowsCandidate)) {
                return true;
            }
        }
        return false;
    }

    // Children first: once the parent dies they are reparented and no longer listed as descendants
    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static byte[] readFully(InputStream stream) {
        try (stream) {
            return stream.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
