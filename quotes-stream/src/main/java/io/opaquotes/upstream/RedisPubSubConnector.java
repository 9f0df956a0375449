package io.opaquotes.upstream;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisChannelHandler;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisConnectionStateAdapter;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Redis pub/sub connector on Lettuce.
 *
 * One dedicated pub/sub connection per subscription. Lettuce's auto-reconnect
 * is switched off: a dropped connection is reported through the
 * {@code onDisconnect} callback and the channel adapter decides when to retry.
 */
public final class RedisPubSubConnector implements UpstreamConnector {
    private static final Logger log = LoggerFactory.getLogger(RedisPubSubConnector.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final RedisClient client;
    private final String redactedUrl;
    private final CopyOnWriteArrayList<RedisChannelSubscription> open = new CopyOnWriteArrayList<>();

    public RedisPubSubConnector(String redisUrl) {
        RedisURI uri = RedisURI.create(redisUrl);
        this.redactedUrl = uri.getHost() + ":" + uri.getPort() + "/" + uri.getDatabase();
        this.client = RedisClient.create(uri);
        this.client.setOptions(ClientOptions.builder()
            .autoReconnect(false)
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .socketOptions(SocketOptions.builder().connectTimeout(CONNECT_TIMEOUT).build())
            .build());
    }

    @Override
    public UpstreamSubscription subscribe(String channel, UpstreamMessageHandler handler, Runnable onDisconnect) {
        StatefulRedisPubSubConnection<String, String> connection;
        try {
            connection = client.connectPubSub();
        } catch (RedisException e) {
            throw new UpstreamConnectionException(channel, "Cannot connect to redis at " + redactedUrl, e);
        }

        RedisChannelSubscription subscription = new RedisChannelSubscription(channel, connection, onDisconnect);
        connection.addListener(new RedisPubSubAdapter<>() {
            @Override
            public void message(String ch, String message) {
                handler.onMessage(ch, message);
            }
        });
        client.addListener(subscription.stateListener);

        try {
            connection.sync().subscribe(channel);
        } catch (RedisException e) {
            subscription.close();
            throw new UpstreamConnectionException(channel, "SUBSCRIBE failed", e);
        }

        open.add(subscription);
        log.debug("[UPSTREAM] Redis connection for {} ready ({} open)", channel, open.size());
        return subscription;
    }

    @Override
    public void close() {
        for (RedisChannelSubscription sub : open) {
            sub.close();
        }
        client.shutdown();
    }

    private final class RedisChannelSubscription implements UpstreamSubscription {
        private final String channel;
        private final StatefulRedisPubSubConnection<String, String> connection;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final AtomicBoolean lostSignalled = new AtomicBoolean(false);
        private final RedisConnectionStateAdapter stateListener;

        RedisChannelSubscription(String channel, StatefulRedisPubSubConnection<String, String> connection,
                                 Runnable onDisconnect) {
            this.channel = channel;
            this.connection = connection;
            this.stateListener = new RedisConnectionStateAdapter() {
                @Override
                public void onRedisDisconnected(RedisChannelHandler<?, ?> handler) {
                    if (handler != connection || closed.get()) {
                        return;
                    }
                    if (lostSignalled.compareAndSet(false, true)) {
                        log.warn("[UPSTREAM] Redis connection for {} dropped", channel);
                        onDisconnect.run();
                    }
                }
            };
        }

        @Override
        public boolean isOpen() {
            return !closed.get() && connection.isOpen();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            client.removeListener(stateListener);
            open.remove(this);
            try {
                connection.close();
            } catch (RedisException e) {
                log.debug("[UPSTREAM] Closing redis connection for {} failed: {}", channel, e.getMessage());
            }
        }
    }
}
