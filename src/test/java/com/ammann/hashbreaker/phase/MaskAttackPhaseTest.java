/* (C)2026 */
package com.ammann.hashbreaker.phase;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.engine.AttackExecutionEngine;
import com.ammann.hashbreaker.engine.CancellationSignal;
import com.ammann.hashbreaker.enumeration.AttackMode;
import com.ammann.hashbreaker.exception.CrackingToolException;
import com.ammann.hashbreaker.model.PhaseResult;
import com.ammann.hashbreaker.support.EngineResults;
import com.ammann.hashbreaker.support.TestJobs;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class MaskAttackPhaseTest {

    private final AttackExecutionEngine engine = mock(AttackExecutionEngine.class);
    private final MaskAttackPhase phase = new MaskAttackPhase(engine,
            HashBreakerSettings.defaults().toBuilder().maskEstimate(1000).build());

    @Test
    void firstMaskCrackEndsPhase() {
        when(engine.run(anyString(), anyInt(), any(), any(), anyDouble())).thenReturn(EngineResults.cracked("abcdefgh"));

        PhaseResult result = phase.run(TestJobs.MD5_HELLO, 0, 25.0, CancellationSignal.NONE);

        assertThat(result.cracked()).isTrue();
        assertThat(result.password()).isEqualTo("abcdefgh");
        assertThat(result.attempts()).isEqualTo(200);
        verify(engine, times(1)).run(anyString(), anyInt(), any(), any(), anyDouble());
    }

    @Test
    void triesEveryMaskWithIncrementsAndEvenShares() {
        when(engine.run(anyString(), anyInt(), any(), any(), anyDouble())).thenReturn(EngineResults.exhausted());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> args = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<Double> shares = ArgumentCaptor.forClass(Double.class);

        PhaseResult result = phase.run(TestJobs.MD5_HELLO, 0, 25.0, CancellationSignal.NONE);

        verify(engine, times(5)).run(eq(TestJobs.MD5_HELLO), eq(0), eq(AttackMode.MASK), args.capture(), shares.capture());
        assertThat(args.getAllValues()).extracting(list -> list.get(0)).containsExactlyElementsOf(MaskAttackPhase.MASKS);
        assertThat(args.getAllValues().get(0)).containsExactly(
                "?l?l?l?l?l?l?l?l", "--increment", "--increment-min", "1", "--increment-max", "8");
        assertThat(shares.getAllValues().get(0)).isLessThanOrEqualTo(5.0).isGreaterThan(4.5);
        assertThat(result.cracked()).isFalse();
        assertThat(result.attempts()).isEqualTo(1000);
        assertThat(result.timeout()).isFalse();
    }

    @Test
    void noBudgetSkipsAllMasks() {
        PhaseResult result = phase.run(TestJobs.MD5_HELLO, 0, 0.0, CancellationSignal.NONE);

        assertThat(result.cracked()).isFalse();
        assertThat(result.timeout()).isTrue();
        assertThat(result.attempts()).isZero();
        verifyNoInteractions(engine);
    }

    @Test
    void failingMaskDoesNotStopTheOthers() {
        when(engine.run(anyString(), anyInt(), any(), any(), anyDouble()))
                .thenThrow(new CrackingToolException("boom", null))
                .thenReturn(EngineResults.cracked("Password1"));

        PhaseResult result = phase.run(TestJobs.MD5_HELLO, 0, 25.0, CancellationSignal.NONE);

        assertThat(result.cracked()).isTrue();
        assertThat(result.attempts()).isEqualTo(400);
        verify(engine, times(2)).run(anyString(), anyInt(), any(), any(), anyDouble());
    }
}
