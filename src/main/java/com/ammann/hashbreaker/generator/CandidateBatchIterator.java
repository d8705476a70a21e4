/* (C)2026 */
package com.ammann.hashbreaker.generator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy iterator over generator output.
 * <p>
 * A new batch is requested only when the previous one has been consumed, never asking for more
 * than the configured total. A short or empty batch ends the sequence.
 */
public final class CandidateBatchIterator implements Iterator<String> {

    private final CandidateGenerator generator;
    private final int batchSize;
    private final Deque<String> buffer = new ArrayDeque<>();
    private long remaining;
    private boolean exhausted;
    private long produced;

    public CandidateBatchIterator(CandidateGenerator generator, long total, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        this.generator = generator;
        this.batchSize = batchSize;
        this.remaining = Math.max(0L, total);
    }

    @Override
    public boolean hasNext() {
        while (buffer.isEmpty() && !exhausted && remaining > 0) {
            fill();
        }
        return !buffer.isEmpty();
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        produced++;
        return buffer.poll();
    }

    /** Candidates handed out so far. */
    public long produced() {
        return produced;
    }

    private void fill() {
        int request = (int) Math.min(batchSize, remaining);
        List<String> batch = generator.generate(request);
        if (batch == null || batch.isEmpty()) {
            exhausted = true;
            return;
        }
        List<String> accepted = batch.size() > request ? batch.subList(0, request) : batch;
        for (String candidate : accepted) {
            if (candidate != null) {
                buffer.add(candidate);
            }
        }
        remaining -= accepted.size();
        if (accepted.size() < request) {
            exhausted = true;
        }
    }
}
