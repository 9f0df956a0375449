package io.opaquotes.transport.ws;

import io.opaquotes.domain.stream.CloseReason;
import io.opaquotes.stream.Session;
import io.opaquotes.stream.SessionLifecycleController;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * WebSocket quote stream: {@code /ws/quotes?tickers=AAPL,MSFT}.
 *
 * Hands each upgraded channel to the lifecycle controller and routes the
 * channel's close and error events back to it. Text sent by the client is
 * ignored.
 */
public final class QuoteStreamEndpoint implements WebSocketConnectionCallback {
    private static final Logger log = LoggerFactory.getLogger(QuoteStreamEndpoint.class);

    static final String TICKERS_PARAM = "tickers";

    private final SessionLifecycleController controller;

    public QuoteStreamEndpoint(SessionLifecycleController controller) {
        this.controller = controller;
    }

    public WebSocketProtocolHandshakeHandler handler() {
        return new WebSocketProtocolHandshakeHandler(this);
    }

    @Override
    public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        String tickers = parseQuery(exchange.getRequestURI()).get(TICKERS_PARAM);

        Optional<Session> opened = controller.open(tickers, new UndertowSessionTransport(channel));
        if (opened.isEmpty()) {
            return;
        }
        String id = opened.get().getConnectionId();

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                log.trace("[WS] Ignoring client text from {}", id);
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                log.debug("[WS] Client {} sent close {} {}", id, cm.getCode(), cm.getReason());
                controller.close(id, CloseReason.CLIENT_CLOSED);
                super.onCloseMessage(cm, ch);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                log.info("[WS] Channel error for {}: {}", id, error.toString());
                controller.close(id, CloseReason.TRANSPORT_ERROR);
                super.onError(ch, error);
            }
        });
        channel.getCloseSetter().set(c -> controller.close(id, CloseReason.CLIENT_CLOSED));
        channel.resumeReceives();

        // Peer may have gone away before the close setter was installed
        if (!channel.isOpen()) {
            controller.close(id, CloseReason.CLIENT_CLOSED);
        }
    }

    /**
     * Query string of a request URI as a map; later duplicates win.
     * Example: /ws/quotes?tickers=AAPL,MSFT -> {tickers: AAPL,MSFT}
     */
    static Map<String, String> parseQuery(String uri) {
        Map<String, String> m = new HashMap<>();
        if (uri == null) return m;
        int idx = uri.indexOf('?');
        if (idx < 0 || idx == uri.length() - 1) return m;

        for (String part : uri.substring(idx + 1).split("&")) {
            if (part.isBlank()) continue;
            String[] kv = part.split("=", 2);
            String k = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            String v = kv.length > 1 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "";
            m.put(k, v);
        }
        return m;
    }
}
