package net.spookly.dimensions.listen;

import java.util.Objects;
import java.util.function.Supplier;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

/**
 * Pauses reads on the paired channel while this channel cannot accept more writes.
 *
 * <p>The pair is resolved on each event because a session's backend channel changes when the
 * client moves to another destination.
 */
final class BackpressureRelayHandler extends ChannelInboundHandlerAdapter {
    private final Supplier<Channel> pairedChannel;

    BackpressureRelayHandler(Supplier<Channel> pairedChannel) {
        this.pairedChannel = Objects.requireNonNull(pairedChannel, "pairedChannel");
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        Channel paired = pairedChannel.get();
        if (paired != null && paired.isActive()) {
            paired.config().setAutoRead(ctx.channel().isWritable());
        }
        super.channelWritabilityChanged(ctx);
    }
}
