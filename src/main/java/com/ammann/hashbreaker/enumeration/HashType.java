/* (C)2026 */
package com.ammann.hashbreaker.enumeration;

import java.util.Optional;

/**
 * Hash families accepted for auditing, keyed by the cracking tool's numeric hash mode.
 * <p>
 * Only families with a JCA digest name can be checked by the in-process CPU dictionary scan.
 */
public enum HashType {
    MD5(0, "MD5"),
    SHA1(100, "SHA-1"),
    SHA256(1400, "SHA-256"),
    SHA512(1800, "SHA-512"),
    NTLM(1000, null),
    BCRYPT(3200, null);

    private final int modeId;
    private final String digestAlgorithm;

    HashType(int modeId, String digestAlgorithm) {
        this.modeId = modeId;
        this.digestAlgorithm = digestAlgorithm;
    }

    public int modeId() {
        return modeId;
    }

    /** JCA {@code MessageDigest} algorithm, empty when the family needs the external tool. */
    public Optional<String> digestAlgorithm() {
        return Optional.ofNullable(digestAlgorithm);
    }

    public static Optional<HashType> fromModeId(int modeId) {
        for (HashType type : values()) {
            if (type.modeId == modeId) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
