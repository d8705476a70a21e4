/* (C)2026 */
package com.ammann.hashbreaker.phase;

import com.ammann.hashbreaker.enumeration.CrackingPhase;
import com.ammann.hashbreaker.enumeration.HashType;
import com.ammann.hashbreaker.model.PhaseResult;
import jakarta.enterprise.context.ApplicationScoped;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;

/**
 * In-process dictionary scan used when the cracking tool has no compute device.
 * <p>
 * Reads the wordlist as ISO-8859-1 so that any byte sequence is a valid line, skips blank
 * lines, and compares the hex digest of each candidate's UTF-8 bytes with the target.
 * Attempt counts here are exact.
 */
@ApplicationScoped
public class CpuDictionaryScanner {

    private static final Logger LOG = Logger.getLogger(CpuDictionaryScanner.class);

    public static final String METHOD = "cpu_dictionary";

    public PhaseResult scan(Path wordlist, String targetHash, int hashTypeId, double timeoutSeconds) {
        Optional<String> algorithm = HashType.fromModeId(hashTypeId).flatMap(HashType::digestAlgorithm);
        if (algorithm.isEmpty()) {
            return PhaseResult.failed(CrackingPhase.QUICK_DICTIONARY, METHOD,
                    "Unsupported hash type for CPU fallback: " + hashTypeId);
        }

        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(algorithm.get());
        } catch (NoSuchAlgorithmException e) {
            return PhaseResult.failed(CrackingPhase.QUICK_DICTIONARY, METHOD,
                    "Digest " + algorithm.get() + " not available: " + e.getMessage());
        }

        String target = targetHash.strip().toLowerCase(Locale.ROOT);
        HexFormat hex = HexFormat.of();
        long deadlineNanos = System.nanoTime() + (long) (Math.max(0.0, timeoutSeconds) * TimeUnit.SECONDS.toNanos(1));
        long attempts = 0;

        try (BufferedReader reader = Files.newBufferedReader(wordlist, StandardCharsets.ISO_8859_1)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (System.nanoTime() >= deadlineNanos) {
                    LOG.infof("CPU dictionary scan timed out after %d candidates", attempts);
                    return PhaseResult.notCracked(CrackingPhase.QUICK_DICTIONARY, METHOD, attempts, true);
                }
                String candidate = line.strip();
                if (candidate.isEmpty()) {
                    continue;
                }
                attempts++;
                byte[] hash = digest.digest(candidate.getBytes(StandardCharsets.UTF_8));
                if (hex.formatHex(hash).equals(target)) {
                    LOG.infof("CPU dictionary scan matched after %d candidates", attempts);
                    return PhaseResult.cracked(CrackingPhase.QUICK_DICTIONARY, METHOD, candidate, attempts);
                }
            }
        } catch (IOException e) {
            LOG.warnf("CPU dictionary scan could not read %s: %s", wordlist, e.getMessage());
            return PhaseResult.failed(CrackingPhase.QUICK_DICTIONARY, METHOD,
                    "Wordlist not readable: " + e.getMessage());
        }

        return PhaseResult.notCracked(CrackingPhase.QUICK_DICTIONARY, METHOD, attempts, false);
    }
}
