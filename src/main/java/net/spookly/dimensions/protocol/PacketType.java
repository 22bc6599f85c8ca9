package net.spookly.dimensions.protocol;

/**
 * Terraria packet type ids the proxy inspects; every other type is forwarded untouched.
 */
public final class PacketType {
    public static final int CONNECT_REQUEST = 1;
    public static final int DISCONNECT = 2;
    public static final int SET_USER_SLOT = 3;
    public static final int PLAYER_INFO = 4;
    public static final int NET_MODULES = 82;

    /**
     * NetModules sub-id of the chat module.
     */
    public static final int CHAT_MODULE = 1;

    private PacketType() {
    }
}
