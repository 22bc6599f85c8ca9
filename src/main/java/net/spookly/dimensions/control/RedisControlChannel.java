package net.spookly.dimensions.control;

import java.util.Objects;

import io.lettuce.core.RedisChannelHandler;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisConnectionStateListener;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import net.spookly.dimensions.util.DimensionsLog;

/**
 * Subscribes to the Redis control channel and queues every message on the dispatcher.
 *
 * <p>Connection errors are only logged; Lettuce reconnects and re-subscribes on its own.
 */
public final class RedisControlChannel implements AutoCloseable {
    private final RedisClient client;
    private final String channel;
    private final CommandDispatcher dispatcher;
    private final DimensionsLog log;
    private StatefulRedisPubSubConnection<String, String> connection;

    public RedisControlChannel(String redisUri, String channel, CommandDispatcher dispatcher, DimensionsLog log) {
        this.client = RedisClient.create(Objects.requireNonNull(redisUri, "redisUri"));
        this.channel = Objects.requireNonNull(channel, "channel");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.log = log == null ? DimensionsLog.NOOP : log;
    }

    /**
     * Connect and subscribe.
     *
     * @throws io.lettuce.core.RedisException when the first connection cannot be made
     */
    public void start() {
        client.addListener(new RedisConnectionStateListener() {
            @Override
            public void onRedisDisconnected(RedisChannelHandler<?, ?> handler) {
                log.error("RedisError: connection to control channel lost");
            }

            @Override
            public void onRedisExceptionCaught(RedisChannelHandler<?, ?> handler, Throwable cause) {
                log.error("RedisError: " + cause);
            }
        });
        connection = client.connectPubSub();
        connection.addListener(new RedisPubSubAdapter<>() {
            @Override
            public void message(String from, String message) {
                if (channel.equals(from)) {
                    dispatcher.enqueue(message);
                }
            }
        });
        connection.sync().subscribe(channel);
        log.info("Listening for control commands on Redis channel " + channel);
    }

    @Override
    public void close() {
        if (connection != null) {
            connection.close();
            connection = null;
        }
        client.shutdown();
    }
}
