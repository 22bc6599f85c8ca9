package net.spookly.dimensions.handler;

/**
 * Handles slash commands typed into chat by a client.
 */
@FunctionalInterface
public interface CommandHandler {
    /**
     * @param commandLine full chat text including the leading slash
     * @return true when the command was handled by the proxy and must not reach the destination
     */
    boolean handle(ClientSession session, String commandLine);
}
