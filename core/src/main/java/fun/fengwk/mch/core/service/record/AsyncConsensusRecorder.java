package fun.fengwk.mch.core.service.record;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Dispatches records to a delegate on a dedicated executor.
 *
 * <p>Delegate failures and rejected submissions are logged and dropped.
 *
 * @author fengwk
 */
@Slf4j
public class AsyncConsensusRecorder implements ConsensusRecorder {

    private final ConsensusRecorder delegate;
    private final Executor executor;

    public AsyncConsensusRecorder(ConsensusRecorder delegate, Executor executor) {
        this.delegate = delegate;
        this.executor = executor;
    }

    @Override
    public void recordQueryStarted(QueryStartedRecord record) {
        dispatch("query started", record.getQueryId(), () -> delegate.recordQueryStarted(record));
    }

    @Override
    public void recordUsage(UsageRecord record) {
        dispatch("usage", record.getQueryId(), () -> delegate.recordUsage(record));
    }

    private void dispatch(String kind, String queryId, Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException ex) {
                    log.error("consensus record failed, kind={}, queryId={}, error={}", kind, queryId,
                        ex.getMessage(), ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.warn("consensus record dropped, kind={}, queryId={}, error={}", kind, queryId, ex.getMessage());
        }
    }

}
