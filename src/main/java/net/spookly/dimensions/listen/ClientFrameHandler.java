package net.spookly.dimensions.listen;

import java.util.Objects;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import net.spookly.dimensions.protocol.Packet;
import net.spookly.dimensions.protocol.PacketType;

/**
 * Runs client frames through the active client packet handler and relays what it does not consume.
 */
final class ClientFrameHandler extends SimpleChannelInboundHandler<ByteBuf> {
    private final NettyClientSession session;

    ClientFrameHandler(NettyClientSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        session.open();
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
        Packet packet = new Packet(frame);
        if (packet.type() == PacketType.CONNECT_REQUEST) {
            session.rememberConnectRequest(frame);
        }
        // Looked up per frame so a hot-swapped handler applies from the next packet.
        boolean consumed = session.handlers().clientPacketHandler().handlePacket(session, packet);
        if (!consumed) {
            session.sendToBackend(frame.retain());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        session.close();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        ctx.close();
    }
}
