package fun.fengwk.mch.core.service.orchestrator.model;

import fun.fengwk.mch.core.facade.search.model.SearchLocation;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * One user question fanned out to several providers.
 *
 * @author fengwk
 */
@Value
@Builder
public class ConsensusQuery {

    String message;

    /**
     * Requested provider ids, empty means every provider.
     */
    @Builder.Default
    List<String> services = Collections.emptyList();

    boolean useWebSearch;

    /**
     * Prior conversation as {@code User:} / {@code Assistant:} prefixed lines, or free text.
     */
    String chatHistory;

    String conversationId;

    /**
     * User charged for web searches.
     */
    String userId;

    SearchLocation location;

}
