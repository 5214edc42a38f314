package fun.fengwk.mch.core.facade.provider.model;

import fun.fengwk.mch.core.facade.search.model.SearchResult;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Per-call context handed to a provider client.
 *
 * @author fengwk
 */
@Value
@Builder
public class GenerationContext {

    /**
     * Prior turns, oldest first.
     */
    @Builder.Default
    List<ChatMessage> history = Collections.emptyList();

    String systemPrompt;

    /**
     * Successful search result or null.
     */
    SearchResult searchResult;

    /**
     * Sampling temperature, 0 keeps answers comparable across providers.
     */
    @Builder.Default
    double temperature = 0.0;

    /**
     * Output cap override, null means the provider default.
     */
    Integer maxTokens;

    public static GenerationContext empty() {
        return GenerationContext.builder().build();
    }

    public boolean hasSearchContext() {
        return searchResult != null && searchResult.isSuccess();
    }

}
