/* (C)2026 */
package com.ammann.hashbreaker.phase;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.engine.AttackExecutionEngine;
import com.ammann.hashbreaker.engine.CancellationSignal;
import com.ammann.hashbreaker.engine.EngineResult;
import com.ammann.hashbreaker.enumeration.AttackMode;
import com.ammann.hashbreaker.enumeration.CrackingPhase;
import com.ammann.hashbreaker.exception.CrackingToolException;
import com.ammann.hashbreaker.generator.CandidateBatchIterator;
import com.ammann.hashbreaker.generator.CandidateGenerator;
import com.ammann.hashbreaker.model.PhaseResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Phase 3: candidates from the generation model streamed into the tool's stdin.
 * <p>
 * Batches are pulled from the generator only as the engine consumes them. Attempts are the
 * engine's measured write count.
 */
@ApplicationScoped
public class AiGenerationPhase implements PhaseStrategy {

    private static final Logger LOG = Logger.getLogger(AiGenerationPhase.class);

    private final AttackExecutionEngine engine;
    private final CandidateGenerator generator;
    private final HashBreakerSettings settings;

    @Inject
    public AiGenerationPhase(AttackExecutionEngine engine, CandidateGenerator generator, HashBreakerSettings settings) {
        this.engine = engine;
        this.generator = generator;
        this.settings = settings;
    }

    @Override
    public CrackingPhase phase() {
        return CrackingPhase.AI_GENERATION;
    }

    @Override
    public PhaseResult run(String targetHash, int hashTypeId, double timeoutSeconds, CancellationSignal cancellation) {
        long total = settings.generatorTotalCandidates();
        CandidateBatchIterator candidates = new CandidateBatchIterator(generator, total, settings.generatorBatchSize());
        LOG.infof("AI generation attack, up to %d candidates in batches of %d, budget %.1fs",
                total, settings.generatorBatchSize(), timeoutSeconds);

        EngineResult result;
        try {
            result = engine.runStreaming(targetHash, hashTypeId, AttackMode.STRAIGHT, List.of(),
                    timeoutSeconds, candidates, cancellation);
        } catch (CrackingToolException e) {
            LOG.warnf("AI generation attack could not run: %s", e.getMessage());
            return PhaseResult.failed(phase(), phase().method(), e.getMessage());
        }

        long attempts = result.attempts() != null ? result.attempts() : total;
        LOG.infof("AI generation attack streamed %d of %d generated candidates (%s)",
                attempts, candidates.produced(), result.errorKind());
        if (result.cracked()) {
            return PhaseResult.cracked(phase(), phase().method(), result.password(), attempts);
        }
        return PhaseResult.notCracked(phase(), phase().method(), attempts, result.timedOut());
    }
}
