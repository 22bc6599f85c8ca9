package net.spookly.dimensions.util;

/**
 * Line-oriented process log for operator notices and errors.
 */
public interface DimensionsLog {
    DimensionsLog NOOP = new DimensionsLog() {
        @Override
        public void info(String message) {
        }

        @Override
        public void notice(String message) {
        }

        @Override
        public void error(String message) {
        }
    };

    /**
     * Plain informational line.
     */
    void info(String message);

    /**
     * Highlighted operator notice, for example the confirmation of a reload.
     */
    void notice(String message);

    void error(String message);

    default void error(String message, Throwable cause) {
        error(cause == null ? message : message + cause);
    }
}
