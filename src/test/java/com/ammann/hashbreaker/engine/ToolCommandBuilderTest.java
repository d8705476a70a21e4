/* (C)2026 */
package com.ammann.hashbreaker.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.enumeration.AttackMode;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class ToolCommandBuilderTest {

    private static final Path HASHES = Path.of("/tmp/work/hashes.txt");
    private static final Path OUT = Path.of("/tmp/work/hashcat.out");

    @Test
    void buildsStraightAttackWithDefaults() {
        HashBreakerSettings settings = HashBreakerSettings.defaults().toBuilder()
                .toolPath(Path.of("/opt/hashcat"))
                .toolForce(true)
                .potfileDisable(true)
                .build();

        List<String> command = ToolCommandBuilder.build(settings, 0, AttackMode.STRAIGHT, HASHES,
                List.of("wordlists/top100k.txt"), OUT, 12.9, false);

        assertThat(command).containsExactly(
                "/opt/hashcat", "-m", "0", "-a", "0", "/tmp/work/hashes.txt", "wordlists/top100k.txt",
                "--runtime", "12", "--quiet", "--outfile", "/tmp/work/hashcat.out", "--outfile-format", "2",
                "--force", "--potfile-disable");
    }

    @Test
    void streamingAddsStdinFlagAndOmitsDisabledOptions() {
        HashBreakerSettings settings = HashBreakerSettings.defaults().toBuilder()
                .toolForce(false)
                .potfileDisable(false)
                .build();

        List<String> command = ToolCommandBuilder.build(settings, 1400, AttackMode.STRAIGHT, HASHES,
                List.of(), OUT, 30, true);

        assertThat(command).endsWith("--outfile-format", "2", "--stdin");
        assertThat(command).doesNotContain("--force", "--potfile-disable");
        assertThat(command).containsSequence("-m", "1400");
    }

    @Test
    void maskAttackUsesModeThree() {
        List<String> command = ToolCommandBuilder.build(HashBreakerSettings.defaults(), 0, AttackMode.MASK,
                HASHES, List.of("?d?d?d?d", "--increment"), OUT, 5, false);

        assertThat(command).containsSequence("-a", "3", "/tmp/work/hashes.txt", "?d?d?d?d", "--increment");
    }

    @Test
    void runtimeIsAtLeastOneSecond() {
        assertThat(ToolCommandBuilder.runtimeSeconds(0.2)).isEqualTo(1);
        assertThat(ToolCommandBuilder.runtimeSeconds(-3)).isEqualTo(1);
        assertThat(ToolCommandBuilder.runtimeSeconds(59.99)).isEqualTo(59);
    }
}
