package net.spookly.dimensions.listen;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import net.spookly.dimensions.util.DimensionsLog;

/**
 * Event loops shared by every listen server and its destination connections.
 */
public final class ListenTransport implements AutoCloseable {
    private final EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final EventLoopGroup workerGroup = new NioEventLoopGroup();

    public ListenServerFactory factory(DimensionsLog log) {
        return NettyListenServer.factory(bossGroup, workerGroup, log);
    }

    @Override
    public void close() {
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }
}
