package fun.fengwk.mch.core.service.record;

/**
 * Hand-off point to usage persistence. Implementations must not block the caller for long.
 *
 * @author fengwk
 */
public interface ConsensusRecorder {

    void recordQueryStarted(QueryStartedRecord record);

    void recordUsage(UsageRecord record);

}
