package com.phillippitts.strokecoach.service.pose;

import com.phillippitts.strokecoach.config.properties.PoseEstimatorProperties;
import com.phillippitts.strokecoach.domain.FrameSequence;
import com.phillippitts.strokecoach.exception.InvalidVideoException;
import com.phillippitts.strokecoach.exception.PoseEstimatorException;
import com.phillippitts.strokecoach.exception.PoseEstimatorExceptionBuilder;
import com.phillippitts.strokecoach.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Pose source backed by an external estimator process.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} [${script}] --video ${absolute video path}
 * </pre>
 * The process writes one JSON pose track to stdout (see {@link PoseTrackJsonParser}).
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Start the process via {@link ProcessFactory}</li>
 *   <li>Capture stdout and stderr concurrently, capped</li>
 *   <li>Enforce a timeout and terminate runaway processes</li>
 *   <li>Map failures: start failure to {@link PoseEstimatorException}; timeout, non-zero
 *       exit or unparseable output to {@link InvalidVideoException}</li>
 * </ul>
 *
 * <p>All execution state is local to one call, so concurrent analyses are safe.
 */
@Component
public class ProcessPoseSource implements PoseSource {

    private static final Logger LOG = LogManager.getLogger(ProcessPoseSource.class);

    static final String NAME = "pose-estimator";
    static final int STDERR_MAX_BYTES = 64 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 512;

    private final PoseEstimatorProperties properties;
    private final ProcessFactory processFactory;

    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    @Autowired
    public ProcessPoseSource(PoseEstimatorProperties properties) {
        this(properties, new DefaultProcessFactory());
    }

    ProcessPoseSource(PoseEstimatorProperties properties, ProcessFactory processFactory) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FrameSequence estimate(Path video) {
        Objects.requireNonNull(video, "video");
        if (!Files.isRegularFile(video)) {
            throw new InvalidVideoException("video file not found: " + video.getFileName());
        }

        List<String> command = buildCommand(video);
        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = start(command, video);
            waitForCompletion(exec, video, startTime);
            String output = handleResult(exec, video, startTime);
            FrameSequence frames = parse(output, video, startTime);
            LOG.info("Pose track for {}: {} frames ({} with a pose) at {} fps in {} ms",
                    video.getFileName(), frames.size(), frames.validCount(), frames.fps(), elapsedMs(startTime));
            return frames;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw PoseEstimatorExceptionBuilder.create("Interrupted while waiting for pose estimator")
                    .estimator(NAME)
                    .durationMs(elapsedMs(startTime))
                    .cause(e)
                    .buildUnavailable();
        } finally {
            cleanup(exec);
        }
    }

    List<String> buildCommand(Path video) {
        List<String> cmd = new ArrayList<>();
        cmd.add(properties.getBinaryPath());
        String script = properties.getScriptPath();
        if (script != null && !script.isBlank()) {
            cmd.add(resolvePath(script).toString());
        }
        cmd.add("--video");
        cmd.add(video.toAbsolutePath().toString());
        return cmd;
    }

    private ProcessExecution start(List<String> command, Path video) {
        Process process;
        try {
            process = processFactory.start(command, null);
        } catch (IOException e) {
            throw PoseEstimatorExceptionBuilder.create("Cannot start pose estimator")
                    .estimator(NAME)
                    .metadata("binaryPath", properties.getBinaryPath())
                    .cause(e)
                    .buildUnavailable();
        }
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        // start gobblers before waiting so a full pipe cannot block the process
        Thread out = startGobbler(process.getInputStream(), stdout, "pose-out", properties.getMaxStdoutBytes());
        Thread err = startGobbler(process.getErrorStream(), stderr, "pose-err", STDERR_MAX_BYTES);
        LOG.debug("Started pose estimator for {}", video.getFileName());
        return new ProcessExecution(process, out, err, stdout, stderr);
    }

    private void waitForCompletion(ProcessExecution exec, Path video, long startTime) throws InterruptedException {
        boolean finished = exec.process().waitFor(properties.getTimeoutSeconds(), TimeUnit.SECONDS);
        if (!finished) {
            destroyProcess(exec.process());
            throw PoseEstimatorExceptionBuilder.create("Timeout after " + properties.getTimeoutSeconds() + "s")
                    .estimator(NAME)
                    .durationMs(elapsedMs(startTime))
                    .metadata("video", video.getFileName())
                    .metadata("stderr", snippet(exec.stderr()))
                    .buildInvalidVideo();
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private String handleResult(ProcessExecution exec, Path video, long startTime) {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            throw PoseEstimatorExceptionBuilder.create("Non-zero exit: " + exitCode)
                    .estimator(NAME)
                    .exitCode(exitCode)
                    .durationMs(elapsedMs(startTime))
                    .metadata("video", video.getFileName())
                    .metadata("stderr", snippet(exec.stderr()))
                    .buildInvalidVideo();
        }
        String output;
        synchronized (exec.stdout()) {
            output = exec.stdout().toString();
        }
        LOG.debug("Pose estimator stdout size={} bytes", output.length());
        return output;
    }

    private FrameSequence parse(String output, Path video, long startTime) {
        try {
            return PoseTrackJsonParser.parse(output, properties.getExpectedLandmarks());
        } catch (IllegalArgumentException e) {
            throw PoseEstimatorExceptionBuilder.create("Unparseable estimator output: " + e.getMessage())
                    .estimator(NAME)
                    .durationMs(elapsedMs(startTime))
                    .metadata("video", video.getFileName())
                    .cause(e)
                    .buildInvalidVideo();
        }
    }

    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private static Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a capped buffer; after the cap it keeps draining without
     * accumulating so the process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, available);
                            LOG.warn("Stream '{}' reached {}B cap (truncated line)", name, maxBytes);
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec == null) {
            return;
        }
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Pose estimator still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying pose estimator process");
        }
    }

    private static String snippet(StringBuilder sb) {
        synchronized (sb) {
            return sb.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, sb.length()));
        }
    }

    private static long elapsedMs(long startNano) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNano);
    }
}
