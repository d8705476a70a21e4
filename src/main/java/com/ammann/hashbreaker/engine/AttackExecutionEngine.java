/* (C)2026 */
package com.ammann.hashbreaker.engine;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.enumeration.AttackMode;
import com.ammann.hashbreaker.enumeration.ToolErrorKind;
import com.ammann.hashbreaker.exception.CrackingToolException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.jboss.logging.Logger;

/**
 * Runs the external cracking tool against a single target hash.
 *
 * <p>Two modes are supported:
 * <ul>
 *   <li><b>Batch:</b> the tool reads a wordlist or mask from its arguments; the engine waits for
 *   it up to the time budget and force-kills it afterwards.</li>
 *   <li><b>Streaming:</b> candidates are fed to the tool's stdin by a {@link CandidateFeeder}
 *   writer thread while the calling thread checks the deadline, process liveness and the
 *   cancellation signal.</li>
 * </ul>
 *
 * <p>Every invocation gets its own temporary directory holding the hash file, the outfile and
 * the captured stdout/stderr. The directory is removed afterwards. The engine never retries.
 */
@ApplicationScoped
public class AttackExecutionEngine {

    private static final Logger LOG = Logger.getLogger(AttackExecutionEngine.class);

    static final String HASH_FILE = "hashes.txt";
    static final String OUTFILE = "hashcat.out";
    private static final String STDOUT_LOG = "stdout.log";
    private static final String STDERR_LOG = "stderr.log";
    private static final long OFFER_POLL_MILLIS = 50;
    private static final long KILL_GRACE_SECONDS = 5;

    private final HashBreakerSettings settings;

    @Inject
    public AttackExecutionEngine(HashBreakerSettings settings) {
        this.settings = settings;
    }

    /**
     * Batch mode invocation.
     *
     * @param attackArgs wordlist, mask or rules arguments placed after the hash file
     * @param timeoutSeconds wall-clock budget, rounded down to whole seconds (at least one)
     * @throws CrackingToolException if the tool cannot be started or the thread is interrupted
     */
    public EngineResult run(
            String targetHash,
            int hashTypeId,
            AttackMode attackMode,
            List<String> attackArgs,
            double timeoutSeconds) {
        return execute(targetHash, hashTypeId, attackMode, attackArgs, timeoutSeconds, null, CancellationSignal.NONE);
    }

    /**
     * Streaming mode invocation. The tool is started with {@code --stdin} and receives one
     * candidate per line. Empty candidates are skipped.
     *
     * @param candidates lazily produced candidates; consumed only as fast as the tool reads
     * @param cancellation polled every {@code flush-interval} candidates
     * @throws CrackingToolException if the tool cannot be started or the thread is interrupted
     */
    public EngineResult runStreaming(
            String targetHash,
            int hashTypeId,
            AttackMode attackMode,
            List<String> attackArgs,
            double timeoutSeconds,
            Iterator<String> candidates,
            CancellationSignal cancellation) {
        return execute(targetHash, hashTypeId, attackMode, attackArgs, timeoutSeconds, candidates, cancellation);
    }

    private EngineResult execute(
            String targetHash,
            int hashTypeId,
            AttackMode attackMode,
            List<String> attackArgs,
            double timeoutSeconds,
            Iterator<String> candidates,
            CancellationSignal cancellation) {
        long startNanos = System.nanoTime();
        long budgetMillis = ToolCommandBuilder.runtimeSeconds(timeoutSeconds) * 1000L;
        Path workDir = createWorkDir();
        Process process = null;
        try {
            Path hashFile = workDir.resolve(HASH_FILE);
            Path outfile = workDir.resolve(OUTFILE);
            Path stdoutLog = workDir.resolve(STDOUT_LOG);
            Path stderrLog = workDir.resolve(STDERR_LOG);
            Files.writeString(hashFile, targetHash + "\n", StandardCharsets.UTF_8);

            List<String> command = ToolCommandBuilder.build(
                    settings, hashTypeId, attackMode, hashFile, attackArgs, outfile, timeoutSeconds,
                    candidates != null);
            LOG.debugf("Running cracking tool: %s", String.join(" ", command));

            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectOutput(stdoutLog.toFile())
                    .redirectError(stderrLog.toFile())
                    .start();

            StreamOutcome streamed = candidates == null
                    ? closeStdin(process)
                    : stream(process, candidates, cancellation, startNanos, budgetMillis);

            long remainingMillis = Math.max(0L, budgetMillis - elapsedMillis(startNanos));
            boolean finished = process.waitFor(remainingMillis, TimeUnit.MILLISECONDS);
            boolean timedOut = streamed.timedOut() || !finished;
            if (!finished) {
                LOG.debugf("Cracking tool exceeded %d ms budget, killing it", budgetMillis);
                process.destroyForcibly();
                process.waitFor(KILL_GRACE_SECONDS, TimeUnit.SECONDS);
            }
            int exitCode = finished ? process.exitValue() : -1;

            String stdout = readQuietly(stdoutLog);
            String stderr = readQuietly(stderrLog);
            String password = parseOutfile(outfile);
            ToolErrorKind errorKind = ToolErrorClassifier.classify(exitCode, timedOut, stderr);
            if (errorKind == ToolErrorKind.EXECUTION_FAILURE) {
                LOG.warnf("Cracking tool exited with code %d: %s", exitCode, abbreviate(stderr));
            }

            return new EngineResult(
                    password != null && !password.isEmpty(),
                    password,
                    exitCode,
                    stdout,
                    stderr,
                    elapsedMillis(startNanos) / 1000.0,
                    timedOut,
                    errorKind,
                    candidates == null ? null : streamed.attempts(),
                    streamed.cancelled());
        } catch (IOException e) {
            throw new CrackingToolException("Failed to run cracking tool " + settings.toolPath(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrackingToolException("Interrupted while running cracking tool", e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteRecursively(workDir);
        }
    }

    private StreamOutcome closeStdin(Process process) throws IOException {
        process.getOutputStream().close();
        return new StreamOutcome(0L, false, false);
    }

    private StreamOutcome stream(
            Process process,
            Iterator<String> candidates,
            CancellationSignal cancellation,
            long startNanos,
            long budgetMillis)
            throws InterruptedException {
        CandidateFeeder feeder = new CandidateFeeder(
                process.getOutputStream(),
                settings.streamChannelCapacity(),
                settings.streamFlushInterval(),
                "candidate-feeder-" + process.pid());
        feeder.start();

        boolean timedOut = false;
        boolean cancelled = false;
        long offered = 0;
        try {
            feed:
            while (candidates.hasNext()) {
                if (elapsedMillis(startNanos) >= budgetMillis) {
                    timedOut = true;
                    break;
                }
                if (!process.isAlive() || !feeder.isWriterAlive()) {
                    break;
                }
                if (offered % settings.streamFlushInterval() == 0 && cancellation.isCancelled()) {
                    cancelled = true;
                    break;
                }
                String candidate = candidates.next();
                if (candidate == null || candidate.isEmpty()) {
                    continue;
                }
                while (!feeder.offer(candidate, OFFER_POLL_MILLIS)) {
                    if (elapsedMillis(startNanos) >= budgetMillis) {
                        timedOut = true;
                        break feed;
                    }
                    if (!process.isAlive() || !feeder.isWriterAlive()) {
                        break feed;
                    }
                }
                offered++;
            }
            feeder.finish(Math.max(0L, budgetMillis - elapsedMillis(startNanos)));
        } catch (InterruptedException e) {
            feeder.abort();
            throw e;
        }

        if (cancelled) {
            LOG.infof("Candidate streaming stopped by cancellation after %d candidates", feeder.written());
        }
        if (feeder.writeFailure() != null) {
            LOG.debugf("Tool stopped reading stdin after %d of %d candidates: %s",
                    feeder.written(), offered, feeder.writeFailure().getMessage());
        }
        return new StreamOutcome(feeder.written(), timedOut, cancelled);
    }

    static String parseOutfile(Path outfile) {
        if (!Files.exists(outfile)) {
            return null;
        }
        String content = readQuietly(outfile);
        for (String line : content.split("\\R")) {
            String trimmed = line.strip();
            int separator = trimmed.indexOf(':');
            if (trimmed.isEmpty() || separator < 0) {
                continue;
            }
            return trimmed.substring(separator + 1).strip();
        }
        return null;
    }

    private Path createWorkDir() {
        try {
            Files.createDirectories(settings.workDir());
            return Files.createTempDirectory(settings.workDir(), "hashcat_");
        } catch (IOException e) {
            throw new CrackingToolException("Cannot create working directory under " + settings.workDir(), e);
        }
    }

    private static String readQuietly(Path file) {
        try {
            return Files.exists(file) ? new String(Files.readAllBytes(file), StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            LOG.debugf("Could not read %s: %s", file, e.getMessage());
            return "";
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    LOG.warnf("Could not delete %s: %s", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            LOG.warnf("Could not clean up working directory %s: %s", dir, e.getMessage());
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String abbreviate(String text) {
        String trimmed = text == null ? "" : text.strip();
        return trimmed.length() <= 500 ? trimmed : trimmed.substring(0, 500) + "...";
    }

    private record StreamOutcome(long attempts, boolean timedOut, boolean cancelled) {}
}
