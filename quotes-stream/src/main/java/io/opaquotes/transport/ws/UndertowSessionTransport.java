package io.opaquotes.transport.ws;

import io.opaquotes.stream.SessionTransport;
import io.opaquotes.stream.TransportException;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link SessionTransport} over an Undertow WebSocket channel.
 * Writes are issued asynchronously and awaited, so the delivery worker sees
 * each frame as written or failed before sending the next.
 */
public final class UndertowSessionTransport implements SessionTransport {
    private static final Logger log = LoggerFactory.getLogger(UndertowSessionTransport.class);

    static final long CLOSE_FLUSH_TIMEOUT_MS = 1000;

    private final WebSocketChannel channel;
    private final String remoteAddress;

    public UndertowSessionTransport(WebSocketChannel channel) {
        this.channel = channel;
        this.remoteAddress = String.valueOf(channel.getSourceAddress());
    }

    @Override
    public void sendText(String frame, Duration timeout) {
        if (!channel.isOpen()) {
            throw new TransportException(remoteAddress, "channel is closed");
        }

        CompletableFuture<Void> written = new CompletableFuture<>();
        WebSockets.sendText(frame, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                written.complete(null);
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                written.completeExceptionally(throwable);
            }
        });

        try {
            written.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TransportException(remoteAddress, "write timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            throw new TransportException(remoteAddress, "write failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(remoteAddress, "write interrupted", e);
        }
    }

    /**
     * Sends a close frame. Off the IO thread this waits (bounded) for the frame
     * to be flushed, so a listener shutdown that follows cannot cut it off.
     */
    @Override
    public void close(int code, String reason) {
        if (!channel.isOpen()) {
            return;
        }
        CompletableFuture<Void> sent = new CompletableFuture<>();
        WebSockets.sendClose(code, reason, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                log.debug("[WS] Close frame {} sent to {}", code, remoteAddress);
                sent.complete(null);
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                log.debug("[WS] Close frame to {} failed: {}", remoteAddress, throwable.getMessage());
                abort();
                sent.complete(null);
            }
        });

        if (Thread.currentThread() == channel.getIoThread()) {
            return;
        }
        try {
            sent.get(CLOSE_FLUSH_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("[WS] Close frame to {} not flushed within {}ms, aborting", remoteAddress, CLOSE_FLUSH_TIMEOUT_MS);
            abort();
        } catch (ExecutionException e) {
            log.debug("[WS] Close frame to {} failed: {}", remoteAddress, e.getCause().getMessage());
            abort();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void abort() {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[WS] Abort of {} failed: {}", remoteAddress, e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameSent();
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }
}
