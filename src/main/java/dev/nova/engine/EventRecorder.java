package dev.nova.engine;

import dev.nova.sink.EventReceipt;
import dev.nova.sink.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget lifecycle event recording. Calls return immediately; failures of the
 * underlying sink are logged and never reach the caller.
 */
public final class EventRecorder {

    private static final Logger log = LoggerFactory.getLogger(EventRecorder.class);

    private final EventSink sink;
    private final Executor executor;

    public EventRecorder(EventSink sink, Executor executor) {
        this.sink = sink;
        this.executor = executor;
    }

    /**
     * Record an event in the background.
     *
     * @return completes with the receipt, or empty if recording failed
     */
    public CompletableFuture<Optional<EventReceipt>> record(String eventType, Map<String, Object> details) {
        try {
            return CompletableFuture
                .supplyAsync(() -> Optional.of(sink.record(eventType, details)), executor)
                .exceptionally(ex -> {
                    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                    log.warn("Failed to record event event_type={}: {}", eventType, cause.getMessage());
                    return Optional.empty();
                });
        } catch (RejectedExecutionException e) {
            log.warn("Event recorder is shut down, dropping event event_type={}", eventType);
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }
}
