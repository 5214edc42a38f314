package fun.fengwk.mch.core.service.token;

import lombok.Value;

/**
 * Normalized token counts of one call.
 *
 * @author fengwk
 */
@Value
public class TokenUsage {

    public static final TokenUsage ZERO = new TokenUsage(0, 0);

    long inputTokens;
    long outputTokens;

    public long getTotalTokens() {
        return inputTokens + outputTokens;
    }

}
