package net.spookly.dimensions.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * One framed packet. The frame buffer is only valid for the duration of the handler call that
 * receives it; handlers must copy anything they keep.
 */
@Getter
@Accessors(fluent = true)
public final class Packet {
    private final int type;
    private final ByteBuf frame;

    public Packet(ByteBuf frame) {
        if (frame.readableBytes() < TerrariaPackets.HEADER_LENGTH) {
            throw new IllegalArgumentException("frame shorter than header: " + frame.readableBytes());
        }
        this.frame = frame;
        this.type = frame.getUnsignedByte(frame.readerIndex() + 2);
    }

    /**
     * Independent read view of the payload, positioned after the header.
     */
    public ByteBuf payload() {
        int offset = frame.readerIndex() + TerrariaPackets.HEADER_LENGTH;
        return frame.slice(offset, frame.readableBytes() - TerrariaPackets.HEADER_LENGTH);
    }
}
