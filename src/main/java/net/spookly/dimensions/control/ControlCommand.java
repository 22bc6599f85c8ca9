package net.spookly.dimensions.control;

import java.util.List;

/**
 * Commands understood on the control channel. Matching is exact and case-sensitive.
 */
public enum ControlCommand {
    PLAYERS("players"),
    RELOAD("reload"),
    RELOAD_HANDLERS("reloadhandlers"),
    RELOAD_COMMANDS("reloadcmds"),
    RELOAD_EXTENSIONS("reloadextensions", "reloadplugins");

    private final List<String> aliases;

    ControlCommand(String... aliases) {
        this.aliases = List.of(aliases);
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * @return the matching command, or null when the message should go to extensions instead
     */
    public static ControlCommand fromMessage(String message) {
        if (message == null) {
            return null;
        }
        for (ControlCommand command : values()) {
            if (command.aliases.contains(message)) {
                return command;
            }
        }
        return null;
    }
}
