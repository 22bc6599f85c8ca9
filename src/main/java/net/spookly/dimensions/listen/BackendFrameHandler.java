package net.spookly.dimensions.listen;

import java.util.Objects;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import net.spookly.dimensions.protocol.Packet;

/**
 * Runs destination frames through the active backend packet handler and relays them to the client.
 */
final class BackendFrameHandler extends SimpleChannelInboundHandler<ByteBuf> {
    private final NettyClientSession session;

    BackendFrameHandler(NettyClientSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
        if (!session.isCurrentBackend(ctx.channel())) {
            // Left-over traffic from a destination the client already moved away from.
            return;
        }
        boolean consumed = session.handlers().backendPacketHandler().handlePacket(session, new Packet(frame));
        if (!consumed) {
            session.sendToClient(frame.retain());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        session.backendClosed(ctx.channel());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        ctx.close();
    }
}
