package fun.fengwk.mch.core.service.orchestrator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import fun.fengwk.mch.core.common.ConsensusError;
import fun.fengwk.mch.core.common.ErrorType;
import fun.fengwk.mch.core.facade.provider.ProviderId;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of one provider for one query. Accounting fields are zero when the call failed.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProviderResult {

    String providerId;
    String service;
    String model;
    boolean success;
    String content;
    String synopsis;
    long inputTokens;
    long outputTokens;
    long tokensUsed;
    BigDecimal cost;
    String error;
    ErrorType errorType;
    long responseTimeMs;

    public static ProviderResult failure(ProviderId providerId, String model, ConsensusError error, long responseTimeMs) {
        return ProviderResult.builder()
            .providerId(providerId.getValue())
            .service(providerId.getDisplayName())
            .model(model)
            .success(false)
            .cost(BigDecimal.ZERO)
            .error(error.getMessage())
            .errorType(error.getType())
            .responseTimeMs(responseTimeMs)
            .build();
    }

}
