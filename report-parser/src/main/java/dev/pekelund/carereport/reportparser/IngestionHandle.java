package dev.pekelund.carereport.reportparser;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A running ingestion. Cancelling only takes effect while the report is still being extracted, so a
 * report that has started to be queued is always queued completely.
 */
public class IngestionHandle {

    public enum Phase {
        EXTRACTING,
        PERSISTING,
        DONE,
        CANCELLED
    }

    private final String id;
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.EXTRACTING);
    private volatile Future<IngestionOutcome> future;

    IngestionHandle(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public Phase phase() {
        return phase.get();
    }

    /**
     * Requests cancellation.
     *
     * @return {@code true} when the ingestion was still extracting and has been cancelled
     */
    public boolean cancel() {
        if (!phase.compareAndSet(Phase.EXTRACTING, Phase.CANCELLED)) {
            return false;
        }
        Future<IngestionOutcome> running = future;
        if (running != null) {
            running.cancel(true);
        }
        return true;
    }

    /**
     * Waits for the ingestion to finish. Failures of the pipeline itself, such as an unwritable pending
     * report store, are rethrown.
     */
    public IngestionOutcome await() {
        try {
            return future.get();
        } catch (CancellationException ex) {
            return IngestionOutcome.cancelled();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancel();
            return IngestionOutcome.cancelled();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Ingestion " + id + " failed", cause);
        }
    }

    void attach(Future<IngestionOutcome> runningFuture) {
        this.future = runningFuture;
        if (phase.get() == Phase.CANCELLED) {
            runningFuture.cancel(true);
        }
    }

    boolean beginPersisting() {
        return phase.compareAndSet(Phase.EXTRACTING, Phase.PERSISTING);
    }

    void finish() {
        phase.set(Phase.DONE);
    }
}
