/* (C)2026 */
package com.ammann.hashbreaker.phase;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.engine.AttackExecutionEngine;
import com.ammann.hashbreaker.engine.CancellationSignal;
import com.ammann.hashbreaker.engine.EngineResult;
import com.ammann.hashbreaker.enumeration.AttackMode;
import com.ammann.hashbreaker.enumeration.CrackingPhase;
import com.ammann.hashbreaker.exception.CrackingToolException;
import com.ammann.hashbreaker.model.PhaseResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.jboss.logging.Logger;

/**
 * Phase 1: straight attack over the small curated wordlist.
 * <p>
 * When the tool reports that no compute device is available the wordlist is scanned in-process
 * by {@link CpuDictionaryScanner} within what is left of the phase budget.
 */
@ApplicationScoped
public class QuickDictionaryPhase implements PhaseStrategy {

    private static final Logger LOG = Logger.getLogger(QuickDictionaryPhase.class);

    private final AttackExecutionEngine engine;
    private final CpuDictionaryScanner cpuScanner;
    private final HashBreakerSettings settings;
    private volatile Long wordlistSize;

    @Inject
    public QuickDictionaryPhase(AttackExecutionEngine engine, CpuDictionaryScanner cpuScanner, HashBreakerSettings settings) {
        this.engine = engine;
        this.cpuScanner = cpuScanner;
        this.settings = settings;
    }

    @Override
    public CrackingPhase phase() {
        return CrackingPhase.QUICK_DICTIONARY;
    }

    @Override
    public PhaseResult run(String targetHash, int hashTypeId, double timeoutSeconds, CancellationSignal cancellation) {
        Path wordlist = settings.quickWordlist();
        LOG.infof("Quick dictionary attack with %s, budget %.1fs", wordlist, timeoutSeconds);

        EngineResult result;
        try {
            result = engine.run(targetHash, hashTypeId, AttackMode.STRAIGHT, List.of(wordlist.toString()), timeoutSeconds);
        } catch (CrackingToolException e) {
            LOG.warnf("Quick dictionary attack could not run: %s", e.getMessage());
            return PhaseResult.failed(phase(), phase().method(), e.getMessage());
        }

        switch (result.errorKind()) {
            case NO_DEVICE -> {
                double remaining = Math.max(0.0, timeoutSeconds - result.durationSeconds());
                LOG.warnf("No compute device available, falling back to CPU dictionary scan (%.1fs left)", remaining);
                return cpuScanner.scan(wordlist, targetHash, hashTypeId, remaining);
            }
            case EXECUTION_FAILURE -> LOG.warnf("Quick dictionary attack failed with exit code %d", result.exitCode());
            default -> {
                // cracked, exhausted or timed out
            }
        }

        long attempts = wordlistSize(wordlist);
        if (result.cracked()) {
            LOG.info("Quick dictionary attack cracked the hash");
            return PhaseResult.cracked(phase(), phase().method(), result.password(), attempts);
        }
        return PhaseResult.notCracked(phase(), phase().method(), attempts, result.timedOut());
    }

    /**
     * Line count of the wordlist, computed once. Falls back to the configured estimate when the
     * file cannot be read.
     */
    long wordlistSize(Path wordlist) {
        Long size = wordlistSize;
        if (size == null) {
            try (Stream<String> lines = Files.lines(wordlist, StandardCharsets.ISO_8859_1)) {
                size = lines.count();
            } catch (IOException | UncheckedIOException e) {
                LOG.debugf("Cannot count lines of %s, using estimate: %s", wordlist, e.getMessage());
                size = settings.quickDictionaryEstimate();
            }
            wordlistSize = size;
        }
        return size;
    }
}
