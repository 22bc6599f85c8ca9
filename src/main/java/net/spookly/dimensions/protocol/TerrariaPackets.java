package net.spookly.dimensions.protocol;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;

/**
 * Framing and field helpers for the Terraria wire format.
 *
 * <p>A frame is a little-endian {@code uint16} length that counts the whole frame, a {@code uint8}
 * type and the payload. Strings are UTF-8 prefixed with a 7-bit encoded length.
 */
public final class TerrariaPackets {
    public static final int HEADER_LENGTH = 3;
    public static final int MAX_FRAME_LENGTH = 0xFFFF;

    private static final int SERVER_AUTHOR_ID = 255;
    private static final int NETWORK_TEXT_LITERAL = 0;
    private static final int MAX_STRING_BYTES = MAX_FRAME_LENGTH;

    private TerrariaPackets() {
    }

    public static LengthFieldBasedFrameDecoder newFrameDecoder() {
        return new LengthFieldBasedFrameDecoder(ByteOrder.LITTLE_ENDIAN, MAX_FRAME_LENGTH, 0, 2, -2, 0, true);
    }

    public static String readString(ByteBuf buf) {
        int length = readVarInt(buf);
        if (length < 0 || length > MAX_STRING_BYTES || length > buf.readableBytes()) {
            throw new CorruptedFrameException("invalid string length: " + length);
        }
        String value = buf.toString(buf.readerIndex(), length, StandardCharsets.UTF_8);
        buf.skipBytes(length);
        return value;
    }

    public static void writeString(ByteBuf buf, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeVarInt(buf, bytes.length);
        buf.writeBytes(bytes);
    }

    static int readVarInt(ByteBuf buf) {
        int value = 0;
        for (int shift = 0; shift < 35; shift += 7) {
            if (!buf.isReadable()) {
                throw new CorruptedFrameException("truncated 7-bit length");
            }
            byte b = buf.readByte();
            value |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
        }
        throw new CorruptedFrameException("7-bit length too long");
    }

    static void writeVarInt(ByteBuf buf, int value) {
        int remaining = value;
        while ((remaining & ~0x7F) != 0) {
            buf.writeByte((remaining & 0x7F) | 0x80);
            remaining >>>= 7;
        }
        buf.writeByte(remaining);
    }

    /**
     * Build a frame, filling in the length header once the body is written.
     */
    public static ByteBuf frame(ByteBufAllocator allocator, int type, Consumer<ByteBuf> body) {
        ByteBuf buf = allocator.buffer();
        buf.writeShortLE(0);
        buf.writeByte(type);
        body.accept(buf);
        int length = buf.readableBytes();
        if (length > MAX_FRAME_LENGTH) {
            buf.release();
            throw new IllegalArgumentException("frame too large: " + length);
        }
        buf.setShortLE(0, length);
        return buf;
    }

    /**
     * Server to client disconnect carrying a literal reason.
     */
    public static ByteBuf disconnect(ByteBufAllocator allocator, String reason) {
        return frame(allocator, PacketType.DISCONNECT, buf -> writeNetworkText(buf, reason));
    }

    /**
     * Server to client chat line from the server author.
     */
    public static ByteBuf chatMessage(ByteBufAllocator allocator, String text, int red, int green, int blue) {
        return frame(allocator, PacketType.NET_MODULES, buf -> {
            buf.writeShortLE(PacketType.CHAT_MODULE);
            buf.writeByte(SERVER_AUTHOR_ID);
            writeNetworkText(buf, text);
            buf.writeByte(red);
            buf.writeByte(green);
            buf.writeByte(blue);
        });
    }

    /**
     * Read the player name from a PlayerInfo payload (player id, skin variant, hair, name).
     */
    public static String readPlayerName(ByteBuf payload) {
        if (payload.readableBytes() < 4) {
            throw new CorruptedFrameException("player info too short");
        }
        payload.skipBytes(3);
        return readString(payload);
    }

    /**
     * Read a client chat submission from a NetModules payload; returns null for other modules.
     */
    public static ChatInput readChatInput(ByteBuf payload) {
        if (payload.readableBytes() < 2) {
            return null;
        }
        int module = payload.readUnsignedShortLE();
        if (module != PacketType.CHAT_MODULE) {
            return null;
        }
        String commandId = readString(payload);
        String text = readString(payload);
        return new ChatInput(commandId, text);
    }

    private static void writeNetworkText(ByteBuf buf, String text) {
        buf.writeByte(NETWORK_TEXT_LITERAL);
        writeString(buf, text);
    }

    /**
     * Chat text typed by a client together with the chat command id it was sent under.
     */
    public record ChatInput(String commandId, String text) {
    }
}
