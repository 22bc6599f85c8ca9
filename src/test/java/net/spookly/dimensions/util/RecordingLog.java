package net.spookly.dimensions.util;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Log that keeps every line for assertions.
 */
public final class RecordingLog implements DimensionsLog {
    public final List<String> infos = new CopyOnWriteArrayList<>();
    public final List<String> notices = new CopyOnWriteArrayList<>();
    public final List<String> errors = new CopyOnWriteArrayList<>();

    @Override
    public void info(String message) {
        infos.add(message);
    }

    @Override
    public void notice(String message) {
        notices.add(message);
    }

    @Override
    public void error(String message) {
        errors.add(message);
    }
}
