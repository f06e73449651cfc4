package io.agentflow.agent;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a child process with stdin input and a hard wall-clock limit. A process that overruns is
 * killed with {@link Process#destroyForcibly()}.
 */
public final class ProcessRunner {
    private static final int MAX_OUTPUT_BYTES = 4 * 1024 * 1024;

    private ProcessRunner() {
    }

    public static Outcome run(List<String> command, String stdin, long timeoutMs) {
        long started = System.nanoTime();
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return Outcome.spawnFailed("process spawn failed: " + e.getMessage(), elapsedMs(started));
        }
        OutputCollector collector = new OutputCollector(process.getInputStream());
        Thread reader = new Thread(collector, "agent-process-reader-" + process.pid());
        reader.setDaemon(true);
        reader.start();
        try {
            byte[] input = stdin == null ? new byte[0] : stdin.getBytes(StandardCharsets.UTF_8);
            process.getOutputStream().write(input);
            process.getOutputStream().flush();
            process.getOutputStream().close();
        } catch (IOException ignored) {
            // The child may exit without reading stdin; its exit status tells the rest.
        }
        try {
            boolean finished = process.waitFor(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return new Outcome(-1, collector.text(), true, elapsedMs(started), null);
            }
            reader.join(1_000L);
            return new Outcome(process.exitValue(), collector.text(), false, elapsedMs(started), null);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return Outcome.spawnFailed("process interrupted", elapsedMs(started));
        }
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    public record Outcome(int exitCode, String output, boolean timedOut, long elapsedMs, String spawnError) {
        static Outcome spawnFailed(String error, long elapsedMs) {
            return new Outcome(-1, "", false, elapsedMs, error);
        }

        public boolean succeeded() {
            return spawnError == null && !timedOut && exitCode == 0;
        }
    }

    private static final class OutputCollector implements Runnable {
        private final InputStream in;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        OutputCollector(InputStream in) {
            this.in = in;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try {
                int n;
                while ((n = in.read(chunk)) >= 0) {
                    synchronized (buffer) {
                        if (buffer.size() < MAX_OUTPUT_BYTES) {
                            buffer.write(chunk, 0, Math.min(n, MAX_OUTPUT_BYTES - buffer.size()));
                        }
                    }
                }
            } catch (IOException ignored) {
                // Stream closes when the process is killed.
            }
        }

        String text() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
