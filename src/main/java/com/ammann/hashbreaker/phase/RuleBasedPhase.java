/* (C)2026 */
package com.ammann.hashbreaker.phase;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.engine.AttackExecutionEngine;
import com.ammann.hashbreaker.engine.CancellationSignal;
import com.ammann.hashbreaker.engine.EngineResult;
import com.ammann.hashbreaker.enumeration.AttackMode;
import com.ammann.hashbreaker.enumeration.CrackingPhase;
import com.ammann.hashbreaker.enumeration.ToolErrorKind;
import com.ammann.hashbreaker.exception.CrackingToolException;
import com.ammann.hashbreaker.model.PhaseResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Phase 2: mutation rules applied over the large wordlist.
 * <p>
 * The reported attempt count is the configured estimate, not a measurement.
 */
@ApplicationScoped
public class RuleBasedPhase implements PhaseStrategy {

    private static final Logger LOG = Logger.getLogger(RuleBasedPhase.class);

    private final AttackExecutionEngine engine;
    private final HashBreakerSettings settings;

    @Inject
    public RuleBasedPhase(AttackExecutionEngine engine, HashBreakerSettings settings) {
        this.engine = engine;
        this.settings = settings;
    }

    @Override
    public CrackingPhase phase() {
        return CrackingPhase.RULE_BASED;
    }

    @Override
    public PhaseResult run(String targetHash, int hashTypeId, double timeoutSeconds, CancellationSignal cancellation) {
        List<String> args = List.of(
                "-r", settings.rulesFile().toString(),
                settings.largeWordlist().toString());
        LOG.infof("Rule-based attack with %s over %s, budget %.1fs",
                settings.rulesFile(), settings.largeWordlist(), timeoutSeconds);

        EngineResult result;
        try {
            result = engine.run(targetHash, hashTypeId, AttackMode.STRAIGHT, args, timeoutSeconds);
        } catch (CrackingToolException e) {
            LOG.warnf("Rule-based attack could not run: %s", e.getMessage());
            return PhaseResult.failed(phase(), phase().method(), e.getMessage());
        }

        if (result.errorKind() == ToolErrorKind.NO_DEVICE || result.errorKind() == ToolErrorKind.EXECUTION_FAILURE) {
            LOG.warnf("Rule-based attack ended with %s, treating as not cracked", result.errorKind());
        }
        if (result.cracked()) {
            LOG.info("Rule-based attack cracked the hash");
            return PhaseResult.cracked(phase(), phase().method(), result.password(), settings.ruleBasedEstimate());
        }
        return PhaseResult.notCracked(phase(), phase().method(), settings.ruleBasedEstimate(), result.timedOut());
    }
}
