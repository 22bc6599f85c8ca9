package net.spookly.dimensions.util;

/**
 * Default log that writes one line per event to the process console.
 */
public final class ConsoleLog implements DimensionsLog {
    public static final ConsoleLog INSTANCE = new ConsoleLog();

    private static final String YELLOW = "\u001b[33m";
    private static final String RESET = "\u001b[0m";

    private ConsoleLog() {
    }

    @Override
    public void info(String message) {
        System.out.println(message);
    }

    @Override
    public void notice(String message) {
        System.out.println(YELLOW + message + RESET);
    }

    @Override
    public void error(String message) {
        System.err.println(message);
    }
}
