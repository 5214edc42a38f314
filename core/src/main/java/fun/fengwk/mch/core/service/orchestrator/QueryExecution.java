package fun.fengwk.mch.core.service.orchestrator;

import fun.fengwk.mch.core.service.orchestrator.model.ConsensusResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle of a running consensus query.
 *
 * <p>{@link #cancel()} stops the search phase and every in-flight provider task. Sub-calls that already
 * finished keep their usage records.
 *
 * @author fengwk
 */
@Slf4j
public class QueryExecution {

    private final String queryId;
    private final AtomicReference<QueryState> state = new AtomicReference<>(QueryState.PENDING);
    private final CompletableFuture<ConsensusResponse> response = new CompletableFuture<>();
    private final Set<Future<?>> children = ConcurrentHashMap.newKeySet();

    private volatile boolean cancelled;
    private Thread driverThread;

    QueryExecution(String queryId) {
        this.queryId = queryId;
    }

    public String getQueryId() {
        return queryId;
    }

    public QueryState getState() {
        return state.get();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isDone() {
        return response.isDone();
    }

    /**
     * Request cancellation. No effect once the query is aggregated.
     */
    public void cancel() {
        if (response.isDone() || cancelled) {
            return;
        }
        cancelled = true;
        log.info("consensus query cancel requested, queryId={}, state={}", queryId, state.get());
        for (Future<?> child : children) {
            child.cancel(true);
        }
        synchronized (this) {
            if (driverThread != null) {
                driverThread.interrupt();
            }
        }
    }

    /**
     * Wait for the aggregated response.
     */
    public ConsensusResponse await() throws InterruptedException {
        try {
            return response.get();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("consensus query failed, queryId=" + queryId, ex.getCause());
        }
    }

    public ConsensusResponse await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return response.get(timeout, unit);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("consensus query failed, queryId=" + queryId, ex.getCause());
        }
    }

    public CompletableFuture<ConsensusResponse> toCompletableFuture() {
        return response.copy();
    }

    void transition(QueryState next) {
        QueryState previous = state.getAndSet(next);
        log.info("consensus query state changed, queryId={}, from={}, to={}", queryId, previous, next);
    }

    void register(Future<?> child) {
        children.add(child);
        if (cancelled) {
            child.cancel(true);
        }
    }

    synchronized void attachDriver(Thread thread) {
        this.driverThread = thread;
        if (cancelled) {
            thread.interrupt();
        }
    }

    void detachDriver() {
        synchronized (this) {
            this.driverThread = null;
        }
        // A late cancel may have interrupted the driver after its last blocking call.
        Thread.interrupted();
    }

    void complete(ConsensusResponse consensusResponse) {
        response.complete(consensusResponse);
    }

    void fail(Throwable error) {
        response.completeExceptionally(error);
    }

}
