package fun.fengwk.mch.core.service.record;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Usage and cost of one provider sub-call.
 *
 * @author fengwk
 */
@Value
@Builder
public class UsageRecord {

    public static final String MAIN_RESPONSE_LABEL = "main response";
    public static final String SYNOPSIS_LABEL = "Synopsis generation call";

    String queryId;
    String conversationId;
    String providerId;
    String model;
    long inputTokens;
    long outputTokens;
    long totalTokens;
    BigDecimal cost;

    /**
     * Generated text, null for failed calls.
     */
    String content;

    /**
     * Which sub-call this record accounts for.
     */
    String summaryLabel;

    boolean success;

}
