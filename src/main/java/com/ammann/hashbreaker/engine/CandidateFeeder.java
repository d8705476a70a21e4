/* (C)2026 */
package com.ammann.hashbreaker.engine;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.jboss.logging.Logger;

/**
 * Dedicated writer thread that drains a bounded channel of candidates into a process's stdin.
 * <p>
 * The producer side blocks on {@link #offer(String, long)} while the channel is full, which keeps
 * memory bounded when the tool consumes slower than candidates arrive. Stdin is closed when the
 * channel is finished, when the writer is interrupted, or when the tool closes its end.
 */
final class CandidateFeeder {

    private static final Logger LOG = Logger.getLogger(CandidateFeeder.class);

    private static final String END_OF_STREAM = new String("");

    private final BlockingQueue<String> channel;
    private final OutputStream stdin;
    private final int flushInterval;
    private final AtomicLong written = new AtomicLong();
    private final Thread writer;
    private volatile IOException writeFailure;

    CandidateFeeder(OutputStream stdin, int capacity, int flushInterval, String threadName) {
        this.channel = new ArrayBlockingQueue<>(capacity);
        this.stdin = stdin;
        this.flushInterval = flushInterval;
        this.writer = new Thread(this::drain, threadName);
        this.writer.setDaemon(true);
    }

    void start() {
        writer.start();
    }

    /**
     * Hands one candidate to the writer.
     *
     * @return false when the channel stayed full for {@code timeoutMillis} or the writer stopped
     */
    boolean offer(String candidate, long timeoutMillis) throws InterruptedException {
        if (!writer.isAlive()) {
            return false;
        }
        return channel.offer(candidate, timeoutMillis, TimeUnit.MILLISECONDS);
    }

    boolean isWriterAlive() {
        return writer.isAlive();
    }

    /**
     * Signals end of stream and waits up to {@code timeoutMillis} for the writer to flush and
     * close stdin. A writer that does not finish in time is interrupted.
     */
    void finish(long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + Math.max(0L, timeoutMillis);
        while (writer.isAlive() && !channel.offer(END_OF_STREAM, 50, TimeUnit.MILLISECONDS)) {
            if (System.currentTimeMillis() >= deadline) {
                break;
            }
        }
        writer.join(Math.max(1L, deadline - System.currentTimeMillis()));
        abort();
    }

    /**
     * Stops the writer without draining what is left in the channel.
     */
    void abort() {
        if (writer.isAlive()) {
            writer.interrupt();
        }
    }

    long written() {
        return written.get();
    }

    IOException writeFailure() {
        return writeFailure;
    }

    private void drain() {
        try (BufferedWriter out = new BufferedWriter(new OutputStreamWriter(stdin, StandardCharsets.UTF_8))) {
            while (true) {
                String candidate = channel.take();
                if (candidate == END_OF_STREAM) {
                    break;
                }
                out.write(candidate);
                out.write('\n');
                if (written.incrementAndGet() % flushInterval == 0) {
                    out.flush();
                }
            }
        } catch (IOException e) {
            // Broken pipe: the tool exited or closed stdin.
            writeFailure = e;
            LOG.debugf("Candidate stdin closed after %d candidates: %s", written.get(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
