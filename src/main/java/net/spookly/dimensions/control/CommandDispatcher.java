package net.spookly.dimensions.control;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import net.spookly.dimensions.orchestrator.Dimensions;
import net.spookly.dimensions.util.DimensionsLog;

/**
 * Maps control channel messages to orchestrator operations.
 *
 * <p>Queued messages run one at a time on a single thread, in the order they were queued.
 */
public final class CommandDispatcher implements AutoCloseable {
    private final Dimensions dimensions;
    private final DimensionsLog log;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "dimensions-control");
        thread.setDaemon(true);
        return thread;
    });

    public CommandDispatcher(Dimensions dimensions, DimensionsLog log) {
        this.dimensions = Objects.requireNonNull(dimensions, "dimensions");
        this.log = log == null ? DimensionsLog.NOOP : log;
    }

    /**
     * Queue a message behind any that are still running.
     *
     * @return completion of this message, or null when the dispatcher is already closed
     */
    public Future<?> enqueue(String message) {
        try {
            return executor.submit(() -> dispatch(message));
        } catch (RejectedExecutionException e) {
            log.error("Dropped control command after shutdown: " + message);
            return null;
        }
    }

    /**
     * Run one message on the calling thread.
     */
    public void dispatch(String message) {
        if (message == null) {
            return;
        }
        try {
            ControlCommand command = ControlCommand.fromMessage(message);
            if (command == null) {
                dimensions.passOnReloadToExtensions(message);
                return;
            }
            switch (command) {
                case PLAYERS:
                    dimensions.printServerCounts();
                    break;
                case RELOAD:
                    dimensions.reloadServers();
                    break;
                case RELOAD_HANDLERS:
                    boolean client = dimensions.reloadClientHandlers();
                    boolean backend = dimensions.reloadBackendHandlers();
                    if (client && backend) {
                        log.notice("Reloaded Packet Handlers.");
                    }
                    break;
                case RELOAD_COMMANDS:
                    if (dimensions.reloadCommandHandler()) {
                        log.notice("Reloaded Command Handler.");
                    }
                    break;
                case RELOAD_EXTENSIONS:
                    dimensions.reloadExtensions();
                    break;
                default:
                    break;
            }
        } catch (RuntimeException e) {
            log.error("Error handling control command " + message + ": ", e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
