package fun.fengwk.mch.core.service.orchestrator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import fun.fengwk.mch.core.facade.search.model.SearchSource;
import fun.fengwk.mch.core.service.orchestrator.QueryState;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * Aggregated consensus answer.
 *
 * @author fengwk
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConsensusResponse {

    /**
     * Orchestration completed, independent of individual provider outcomes.
     */
    boolean success;

    String queryId;
    String conversationId;
    String message;
    QueryState state;

    @Builder.Default
    List<ProviderResult> results = Collections.emptyList();

    boolean webSearchEnabled;

    @Builder.Default
    List<SearchSource> webSearchSources = Collections.emptyList();

    String webSearchError;
    int searchCallsMade;
    long totalTokens;
    BigDecimal totalCost;
    String timestamp;

}
