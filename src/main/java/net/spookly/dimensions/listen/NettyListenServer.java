package net.spookly.dimensions.listen;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.dimensions.config.DimensionsConfig;
import net.spookly.dimensions.handler.HandlerRegistry;
import net.spookly.dimensions.protocol.TerrariaPackets;
import net.spookly.dimensions.registry.DestinationRegistry;
import net.spookly.dimensions.registry.GlobalTracking;
import net.spookly.dimensions.registry.RoutingServer;
import net.spookly.dimensions.registry.ServerDetailsRegistry;
import net.spookly.dimensions.util.DimensionsLog;

/**
 * TCP listener that pairs every accepted client with a connection to one destination of its pool.
 */
@Accessors(fluent = true)
public final class NettyListenServer implements ListenServer {
    @Getter
    private final int port;
    @Getter
    private final ServerDetailsRegistry serverDetails;
    @Getter
    private final HandlerRegistry handlers;
    @Getter
    private final DestinationRegistry destinations;
    @Getter
    private final DimensionsConfig.OptionsConfig options;
    @Getter
    private final GlobalTracking globalTracking;
    @Getter
    private final DimensionsLog log;
    private final EventLoopGroup workerGroup;
    private final Set<NettyClientSession> sessions = ConcurrentHashMap.newKeySet();
    private volatile List<RoutingServer> pool;
    private final AtomicBoolean closing = new AtomicBoolean();
    private final Channel serverChannel;

    /**
     * Create the listener and bind its port before returning.
     *
     * @throws IllegalStateException when the port cannot be bound
     */
    public NettyListenServer(DimensionsConfig.ServerConfig entry,
                             ServerDetailsRegistry serverDetails,
                             HandlerRegistry handlers,
                             DestinationRegistry destinations,
                             DimensionsConfig.OptionsConfig options,
                             GlobalTracking globalTracking,
                             EventLoopGroup bossGroup,
                             EventLoopGroup workerGroup,
                             DimensionsLog log) {
        Objects.requireNonNull(entry, "entry");
        this.port = Objects.requireNonNull(entry.listenPort, "entry.listenPort");
        this.serverDetails = Objects.requireNonNull(serverDetails, "serverDetails");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.destinations = Objects.requireNonNull(destinations, "destinations");
        this.options = Objects.requireNonNull(options, "options");
        this.globalTracking = Objects.requireNonNull(globalTracking, "globalTracking");
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
        this.log = log == null ? DimensionsLog.NOOP : log;
        this.pool = toPool(entry);
        this.serverChannel = bind(Objects.requireNonNull(bossGroup, "bossGroup"));
    }

    /**
     * Factory that creates listeners on shared event loops.
     */
    public static ListenServerFactory factory(EventLoopGroup bossGroup, EventLoopGroup workerGroup, DimensionsLog log) {
        return (entry, serverDetails, handlers, destinations, options, globalTracking) -> new NettyListenServer(
                entry, serverDetails, handlers, destinations, options, globalTracking, bossGroup, workerGroup, log);
    }

    private Channel bind(EventLoopGroup bossGroup) {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.AUTO_READ, false)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel channel) {
                        NettyClientSession session = new NettyClientSession(NettyListenServer.this, channel);
                        channel.pipeline()
                                .addLast("frames", TerrariaPackets.newFrameDecoder())
                                .addLast("backpressure", new BackpressureRelayHandler(session::backendChannel))
                                .addLast("session", new ClientFrameHandler(session));
                    }
                });
        Channel channel;
        try {
            channel = bootstrap.bind(new InetSocketAddress(port)).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Listen server bind interrupted on port " + port, e);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to bind listen server on port " + port, e);
        }
        log.info("Listen server bound on port " + port);
        return channel;
    }

    @Override
    public List<RoutingServer> routingServers() {
        return pool;
    }

    @Override
    public void updateInfo(DimensionsConfig.ServerConfig entry) {
        Objects.requireNonNull(entry, "entry");
        if (entry.listenPort == null || entry.listenPort != port) {
            throw new IllegalArgumentException("entry is for port " + entry.listenPort + ", not " + port);
        }
        pool = toPool(entry);
    }

    @Override
    public void shutdown() {
        if (closing.compareAndSet(false, true)) {
            serverChannel.close();
            log.info("Listen server on port " + port + " shut down");
        }
    }

    /**
     * True until the server channel has actually closed, which happens some time after {@link #shutdown()}.
     */
    public boolean isBound() {
        return serverChannel.isOpen();
    }

    /**
     * Completes once the port has been released.
     */
    public ChannelFuture closeFuture() {
        return serverChannel.closeFuture();
    }

    /**
     * Sessions currently open on this listener, including ones still connecting.
     */
    public Set<NettyClientSession> sessions() {
        return Collections.unmodifiableSet(sessions);
    }

    RoutingServer selectDestination() {
        return DestinationSelector.select(pool, serverDetails);
    }

    void sessionOpened(NettyClientSession session) {
        sessions.add(session);
    }

    void sessionClosed(NettyClientSession session) {
        sessions.remove(session);
    }

    private List<RoutingServer> toPool(DimensionsConfig.ServerConfig entry) {
        List<RoutingServer> next = new ArrayList<>();
        if (entry.routingServers != null) {
            for (DimensionsConfig.RoutingServerConfig routingServer : entry.routingServers) {
                RoutingServer server = RoutingServer.fromConfig(routingServer);
                serverDetails.getOrCreate(server.name());
                next.add(server);
            }
        }
        return List.copyOf(next);
    }
}
