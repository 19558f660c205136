package com.eyelevel.pagepipeline.common.processexec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

@Component
@Slf4j
public class ProcessExecutor {

    /**
     * A safe limit for the amount of stdout/stderr to capture in memory.
     */
    private static final int MAX_CAPTURE_BYTES = 16 * 1024;

    /**
     * Executes a command-line process with a timeout and memory-safe stream handling.
     *
     * @param command        The command and its arguments to execute.
     * @param contextInfo    A string for logging context (e.g., Document ID and page).
     * @param timeoutSeconds The maximum time to wait for the process to complete.
     * @param processName    A descriptive name for the process (e.g., "pdftoppm").
     * @return A ProcessResult containing the exit code and a truncated portion of stdout and stderr.
     * @throws IOException          if the process cannot be started or times out.
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    public ProcessResult execute(List<String> command, String contextInfo, long timeoutSeconds, String processName)
            throws IOException, InterruptedException {

        Process process = new ProcessBuilder(command).start();
        StringBuffer stdoutCapture = new StringBuffer();
        StringBuffer stderrCapture = new StringBuffer();

        ExecutorService executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, processName + "-stream");
            t.setDaemon(true);
            return t;
        });
        try {
            executor.submit(new StreamConsumer(process.getInputStream(), stdoutCapture::append, null));
            executor.submit(new StreamConsumer(process.getErrorStream(), stderrCapture::append,
                    line -> log.debug("[{}] [{}-stderr] {}", contextInfo, processName, line)));

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                throw new IOException(processName + " process timed out after " + timeoutSeconds + " seconds.");
            }
        } finally {
            if (process.isAlive()) {
                // Interrupted or timed out: the child must not outlive the call.
                process.destroyForcibly();
            }
            executor.shutdown();
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }

        return new ProcessResult(process.exitValue(), stdoutCapture.toString().trim(),
                stderrCapture.toString().trim());
    }

    /**
     * Consumes an InputStream, captures its content up to a limit and optionally logs each line.
     * Draining both streams prevents the child process from blocking on a full pipe.
     */
    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final Consumer<String> captureConsumer;
        private final Consumer<String> lineLogger;
        private int bytesCaptured = 0;

        StreamConsumer(InputStream inputStream, Consumer<String> captureConsumer, Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.captureConsumer = captureConsumer;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    if (bytesCaptured < MAX_CAPTURE_BYTES) {
                        String lineWithNewline = line + "\n";
                        captureConsumer.accept(lineWithNewline);
                        bytesCaptured += lineWithNewline.getBytes(StandardCharsets.UTF_8).length;
                    }
                }
            } catch (IOException e) {
                log.error("Error reading process stream.", e);
            }
        }
    }

    /**
     * A record to hold the result of an external process execution.
     *
     * @param exitCode The exit code of the process. 0 typically means success.
     * @param stdout   The captured standard output (truncated to a safe limit).
     * @param stderr   The captured standard error output (truncated to a safe limit).
     */
    public record ProcessResult(int exitCode, String stdout, String stderr) {
    }
}
