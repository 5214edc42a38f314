package fun.fengwk.mch.core.service.record;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes records to the application log.
 *
 * @author fengwk
 */
@Slf4j
public class LoggingConsensusRecorder implements ConsensusRecorder {

    @Override
    public void recordQueryStarted(QueryStartedRecord record) {
        log.info("consensus query started, queryId={}, conversationId={}, userId={}, providers={}, webSearch={}",
            record.getQueryId(), record.getConversationId(), record.getUserId(), record.getProviderIds(),
            record.isWebSearchEnabled());
    }

    @Override
    public void recordUsage(UsageRecord record) {
        log.info("consensus usage, queryId={}, provider={}, model={}, label={}, success={}, inputTokens={}, "
                + "outputTokens={}, cost={}",
            record.getQueryId(), record.getProviderId(), record.getModel(), record.getSummaryLabel(),
            record.isSuccess(), record.getInputTokens(), record.getOutputTokens(), record.getCost());
    }

}
