package fun.fengwk.mch.core.service.record;

import org.junit.jupiter.api.Test;

import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * @author fengwk
 */
class AsyncConsensusRecorderTest {

    private final ConsensusRecorder delegate = mock(ConsensusRecorder.class);

    @Test
    void shouldDispatchToDelegate() {
        AsyncConsensusRecorder recorder = new AsyncConsensusRecorder(delegate, Runnable::run);
        UsageRecord usage = UsageRecord.builder().queryId("q1").summaryLabel(UsageRecord.MAIN_RESPONSE_LABEL).build();
        QueryStartedRecord started = QueryStartedRecord.builder().queryId("q1").build();

        recorder.recordQueryStarted(started);
        recorder.recordUsage(usage);

        verify(delegate).recordQueryStarted(started);
        verify(delegate).recordUsage(usage);
    }

    @Test
    void shouldSwallowDelegateFailures() {
        AsyncConsensusRecorder recorder = new AsyncConsensusRecorder(delegate, Runnable::run);
        UsageRecord usage = UsageRecord.builder().queryId("q1").build();
        doThrow(new IllegalStateException("disk full")).when(delegate).recordUsage(usage);

        assertThatCode(() -> recorder.recordUsage(usage)).doesNotThrowAnyException();
    }

    @Test
    void shouldDropRecordsWhenExecutorRejects() {
        AsyncConsensusRecorder recorder = new AsyncConsensusRecorder(delegate, task -> {
            throw new RejectedExecutionException("queue full");
        });

        assertThatCode(() -> recorder.recordUsage(UsageRecord.builder().queryId("q1").build()))
            .doesNotThrowAnyException();
    }

}
