package io.opaquotes.stream;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link SessionTransport} that records every frame and release call.
 * Writes can be made to fail, or to block until {@link #releaseWrites()}.
 */
public class RecordingTransport implements SessionTransport {

    public record CloseCall(int code, String reason) {}

    private final String address;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private final List<CloseCall> closes = new CopyOnWriteArrayList<>();
    private final AtomicInteger aborts = new AtomicInteger();

    private volatile boolean open = true;
    private volatile boolean failWrites = false;
    private volatile CountDownLatch writeGate;

    public RecordingTransport() {
        this("test-client");
    }

    public RecordingTransport(String address) {
        this.address = address;
    }

    @Override
    public void sendText(String frame, Duration timeout) {
        if (!open) {
            throw new TransportException(address, "closed");
        }
        if (failWrites) {
            throw new TransportException(address, "broken pipe");
        }
        CountDownLatch gate = writeGate;
        if (gate != null) {
            try {
                if (!gate.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new TransportException(address, "write timed out");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException(address, "interrupted", e);
            }
        }
        frames.add(frame);
    }

    @Override
    public void close(int code, String reason) {
        closes.add(new CloseCall(code, reason));
        open = false;
    }

    @Override
    public void abort() {
        aborts.incrementAndGet();
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public String remoteAddress() {
        return address;
    }

    public RecordingTransport failWrites() {
        this.failWrites = true;
        return this;
    }

    public RecordingTransport blockWrites() {
        this.writeGate = new CountDownLatch(1);
        return this;
    }

    public void releaseWrites() {
        CountDownLatch gate = writeGate;
        if (gate != null) {
            gate.countDown();
        }
    }

    public List<String> frames() {
        return frames;
    }

    public List<CloseCall> closes() {
        return closes;
    }

    public int aborts() {
        return aborts.get();
    }

    /** Number of times the transport was released, by close frame or abort. */
    public int releaseCount() {
        return closes.size() + aborts.get();
    }
}
