package net.spookly.dimensions.listen;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import net.spookly.dimensions.handler.ClientSession;
import net.spookly.dimensions.handler.HandlerRegistry;
import net.spookly.dimensions.protocol.TerrariaPackets;
import net.spookly.dimensions.registry.DestinationRegistry;
import net.spookly.dimensions.registry.GlobalTracking;
import net.spookly.dimensions.registry.RoutingServer;
import net.spookly.dimensions.registry.ServerDetails;
import net.spookly.dimensions.registry.ServerDetailsRegistry;
import net.spookly.dimensions.registry.TrackedPlayer;

/**
 * One client connection and its current destination connection.
 *
 * <p>All state changes run on the client channel's event loop; backend connections are opened on
 * that same loop.
 */
public final class NettyClientSession implements ClientSession {
    private final NettyListenServer server;
    private final Channel clientChannel;
    private volatile Channel backendChannel;
    private volatile RoutingServer destination;
    private volatile TrackedPlayer trackedPlayer;
    private volatile boolean backendAccepted;
    private volatile boolean closed;
    private ByteBuf connectRequest;

    NettyClientSession(NettyListenServer server, Channel clientChannel) {
        this.server = Objects.requireNonNull(server, "server");
        this.clientChannel = Objects.requireNonNull(clientChannel, "clientChannel");
    }

    void open() {
        server.sessionOpened(this);
        if (server.options().logClientConnect()) {
            server.log().info("Client " + remoteAddress() + " connected on port " + server.port());
        }
        RoutingServer target = server.selectDestination();
        if (target == null) {
            disconnect("There are no dimensions available right now.");
            return;
        }
        connect(target, false);
    }

    private void connect(RoutingServer target, boolean moving) {
        Bootstrap bootstrap = new Bootstrap()
                .group(clientChannel.eventLoop())
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, server.options().backendConnectTimeoutMs())
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel channel) {
                        channel.pipeline()
                                .addLast("frames", TerrariaPackets.newFrameDecoder())
                                .addLast("backpressure", new BackpressureRelayHandler(() -> clientChannel))
                                .addLast("session", new BackendFrameHandler(NettyClientSession.this));
                    }
                });
        bootstrap.connect(target.serverIP(), target.serverPort()).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                backendConnected(target, future.channel(), moving);
            } else {
                backendFailed(target, future.cause(), moving);
            }
        });
    }

    private void backendConnected(RoutingServer target, Channel channel, boolean moving) {
        if (closed || !clientChannel.isActive()) {
            channel.close();
            return;
        }
        ServerDetails details = server.serverDetails().getOrCreate(target.name());
        details.recordSuccessfulConnection();
        details.incrementClients();
        channel.closeFuture().addListener(ignored -> details.decrementClients());

        Channel previous = backendChannel;
        backendChannel = channel;
        destination = target;
        backendAccepted = false;
        if (previous != null) {
            previous.close();
        }
        if (!moving) {
            clientChannel.config().setAutoRead(true);
            return;
        }
        if (connectRequest != null) {
            channel.writeAndFlush(connectRequest.retainedDuplicate());
        }
        TrackedPlayer player = trackedPlayer;
        if (player != null) {
            TrackedPlayer moved = server.globalTracking().moveTo(player.name(), target.name());
            if (moved != null) {
                trackedPlayer = moved;
            }
        }
    }

    private void backendFailed(RoutingServer target, Throwable cause, boolean moving) {
        ServerDetails details = server.serverDetails().getOrCreate(target.name());
        int failures = details.recordFailedConnection();
        if (failures >= server.options().maxFailedAttempts() && !details.disabled()) {
            details.setDisabled(true);
            clientChannel.eventLoop().schedule(() -> {
                details.setDisabled(false);
                details.recordSuccessfulConnection();
            }, server.options().disableSeconds(), TimeUnit.SECONDS);
            server.log().error("Dimension " + target.name() + " disabled after " + failures + " failed connections");
        }
        if (server.options().logDestinationErrors()) {
            server.log().error("Failed to connect to " + target.name() + " at "
                    + target.serverIP() + ":" + target.serverPort() + ": " + cause);
        }
        if (moving) {
            sendMessage("Could not reach " + target.name() + ".", 255, 80, 80);
        } else {
            disconnect("Could not connect to " + target.name() + ".");
        }
    }

    void rememberConnectRequest(ByteBuf frame) {
        if (connectRequest != null) {
            connectRequest.release();
        }
        connectRequest = frame.copy();
    }

    void sendToBackend(ByteBuf frame) {
        Channel channel = backendChannel;
        if (channel == null || !channel.isActive()) {
            frame.release();
            return;
        }
        channel.writeAndFlush(frame);
    }

    void sendToClient(ByteBuf frame) {
        clientChannel.writeAndFlush(frame);
    }

    boolean isCurrentBackend(Channel channel) {
        return channel == backendChannel;
    }

    Channel backendChannel() {
        return backendChannel;
    }

    void backendClosed(Channel channel) {
        if (!closed && isCurrentBackend(channel)) {
            clientChannel.close();
        }
    }

    void close() {
        if (closed) {
            return;
        }
        closed = true;
        Channel backend = backendChannel;
        if (backend != null) {
            backend.close();
        }
        TrackedPlayer player = trackedPlayer;
        if (player != null) {
            server.globalTracking().release(player.name(), player);
        }
        if (connectRequest != null) {
            connectRequest.release();
            connectRequest = null;
        }
        server.sessionClosed(this);
        if (server.options().logClientDisconnect()) {
            server.log().info("Client " + remoteAddress() + " disconnected from port " + server.port());
        }
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(clientChannel.remoteAddress());
    }

    @Override
    public int listenPort() {
        return server.port();
    }

    @Override
    public RoutingServer destination() {
        return destination;
    }

    @Override
    public TrackedPlayer trackedPlayer() {
        return trackedPlayer;
    }

    @Override
    public void track(TrackedPlayer player) {
        this.trackedPlayer = player;
    }

    @Override
    public boolean backendAccepted() {
        return backendAccepted;
    }

    @Override
    public void markBackendAccepted() {
        backendAccepted = true;
    }

    @Override
    public HandlerRegistry handlers() {
        return server.handlers();
    }

    @Override
    public DestinationRegistry destinations() {
        return server.destinations();
    }

    @Override
    public ServerDetailsRegistry serverDetails() {
        return server.serverDetails();
    }

    @Override
    public GlobalTracking globalTracking() {
        return server.globalTracking();
    }

    @Override
    public void sendMessage(String text, int red, int green, int blue) {
        clientChannel.writeAndFlush(TerrariaPackets.chatMessage(clientChannel.alloc(), text, red, green, blue));
    }

    @Override
    public void disconnect(String reason) {
        clientChannel.writeAndFlush(TerrariaPackets.disconnect(clientChannel.alloc(), reason))
                .addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void switchDestination(RoutingServer target) {
        Objects.requireNonNull(target, "target");
        if (closed) {
            return;
        }
        connect(target, true);
    }
}
