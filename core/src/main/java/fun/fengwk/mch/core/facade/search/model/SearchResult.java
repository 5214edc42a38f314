package fun.fengwk.mch.core.facade.search.model;

import fun.fengwk.mch.core.common.ConsensusError;
import fun.fengwk.mch.core.common.ErrorType;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Normalized web search result, shared read-only by every provider call of a query.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class SearchResult {

    boolean success;

    /**
     * Query as the caller asked it.
     */
    String query;

    /**
     * Cited sources in first-seen order.
     */
    @Builder.Default
    List<SearchSource> sources = Collections.emptyList();

    /**
     * Raw research content returned by the backend.
     */
    String content;

    /**
     * Content prepared for model consumption.
     */
    String formattedContent;

    /**
     * Upstream attempts made to produce this result.
     */
    int searchCallsMade;

    boolean recencyFocused;

    boolean hasRecentContent;

    String timestamp;

    ConsensusError error;

    public static SearchResult failure(String query, ErrorType type, String message, int searchCallsMade) {
        return SearchResult.builder()
            .success(false)
            .query(query)
            .error(ConsensusError.of(type, message))
            .searchCallsMade(searchCallsMade)
            .build();
    }

    public boolean hasSources() {
        return sources != null && !sources.isEmpty();
    }

}
