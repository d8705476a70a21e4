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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;

/**
 * Phase 4: a fixed list of character-class masks, each tried with length increments 1 to 8.
 * <p>
 * Before each mask the remaining phase time is split evenly over the masks not yet tried, so
 * time a mask does not use goes to the ones after it. The first crack ends the phase.
 */
@ApplicationScoped
public class MaskAttackPhase implements PhaseStrategy {

    private static final Logger LOG = Logger.getLogger(MaskAttackPhase.class);

    static final List<String> MASKS = List.of(
            "?l?l?l?l?l?l?l?l",
            "?u?l?l?l?l?l?l",
            "?l?l?l?l?l?l?d",
            "?l?l?l?l?l?l?l?d",
            "?a?a?a?a?a?a?a");

    private static final List<String> INCREMENT_ARGS =
            List.of("--increment", "--increment-min", "1", "--increment-max", "8");

    private final AttackExecutionEngine engine;
    private final HashBreakerSettings settings;

    @Inject
    public MaskAttackPhase(AttackExecutionEngine engine, HashBreakerSettings settings) {
        this.engine = engine;
        this.settings = settings;
    }

    @Override
    public CrackingPhase phase() {
        return CrackingPhase.MASK_ATTACK;
    }

    @Override
    public PhaseResult run(String targetHash, int hashTypeId, double timeoutSeconds, CancellationSignal cancellation) {
        if (timeoutSeconds <= 0) {
            return PhaseResult.notCracked(phase(), phase().method(), 0L, true);
        }

        long startNanos = System.nanoTime();
        int tried = 0;
        for (int i = 0; i < MASKS.size(); i++) {
            String mask = MASKS.get(i);
            double remaining = timeoutSeconds - elapsedSeconds(startNanos);
            double share = remaining / (MASKS.size() - i);
            if (share <= 0) {
                LOG.debugf("Skipping mask %s, no time left", mask);
                continue;
            }

            LOG.infof("Mask attack %d/%d with %s, budget %.1fs", i + 1, MASKS.size(), mask, share);
            tried++;
            EngineResult result;
            try {
                result = engine.run(targetHash, hashTypeId, AttackMode.MASK, maskArgs(mask), share);
            } catch (CrackingToolException e) {
                if (Thread.currentThread().isInterrupted()) {
                    return PhaseResult.failed(phase(), phase().method(), e.getMessage());
                }
                LOG.warnf("Mask %s could not run: %s", mask, e.getMessage());
                continue;
            }

            if (result.cracked()) {
                LOG.infof("Mask attack cracked the hash with %s", mask);
                return PhaseResult.cracked(phase(), phase().method(), result.password(),
                        settings.maskEstimate() * tried / MASKS.size());
            }
        }

        boolean outOfTime = timeoutSeconds - elapsedSeconds(startNanos) <= 0;
        return PhaseResult.notCracked(phase(), phase().method(), settings.maskEstimate(), outOfTime);
    }

    private static List<String> maskArgs(String mask) {
        List<String> args = new ArrayList<>(INCREMENT_ARGS.size() + 1);
        args.add(mask);
        args.addAll(INCREMENT_ARGS);
        return args;
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / (double) TimeUnit.SECONDS.toNanos(1);
    }
}
