/* (C)2026 */
package com.ammann.hashbreaker.enumeration;

/**
 * Attack strategy selector passed to the cracking tool as {@code -a <code>}.
 */
public enum AttackMode {
    /** Wordlist (optionally with rules) or candidates from stdin */
    STRAIGHT(0),
    /** Character-class mask */
    MASK(3);

    private final int code;

    AttackMode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
