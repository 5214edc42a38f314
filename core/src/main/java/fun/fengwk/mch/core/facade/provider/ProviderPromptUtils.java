package fun.fengwk.mch.core.facade.provider;

import fun.fengwk.mch.core.facade.provider.model.GenerationContext;
import fun.fengwk.mch.core.facade.search.model.SearchResult;
import fun.fengwk.mch.core.facade.search.model.SearchSource;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared prompt shaping for provider clients.
 *
 * @author fengwk
 */
public final class ProviderPromptUtils {

    /**
     * Max sources passed as document blocks.
     */
    public static final int MAX_DOCUMENT_SOURCES = 6;

    static final String SEPARATOR = "=".repeat(50);

    static final String INLINE_INSTRUCTION = "Please provide a comprehensive response using both the current web "
        + "information above and your knowledge. Cite sources when referencing specific information from the web "
        + "search results.";

    static final String DOCUMENT_INSTRUCTION = "Please provide a comprehensive response using the provided web "
        + "search results. Use citations to reference specific information from the sources.";

    private ProviderPromptUtils() {
    }

    /**
     * Append formatted search content to the prompt, or return the prompt unchanged without search context.
     */
    public static String inlineSearchPrompt(String prompt, GenerationContext context) {
        if (context == null || !context.hasSearchContext()) {
            return prompt;
        }
        SearchResult searchResult = context.getSearchResult();
        List<String> parts = new ArrayList<>();
        if (StringUtils.hasText(searchResult.getFormattedContent())) {
            parts.add("Current web information:");
            parts.add(searchResult.getFormattedContent());
            parts.add("\n" + SEPARATOR + "\n");
        }
        parts.add("User question:");
        parts.add(prompt);
        parts.add("\n" + INLINE_INSTRUCTION);
        return String.join("\n\n", parts);
    }

    /**
     * Question text that leads the document blocks.
     */
    public static String documentQuestion(String prompt) {
        return "User question: " + prompt + "\n\n" + DOCUMENT_INSTRUCTION;
    }

    /**
     * Plain-text body of a single document block.
     */
    public static String documentText(SearchSource source) {
        List<String> lines = new ArrayList<>();
        lines.add("Title: " + defaultIfBlank(source.getTitle(), "No title"));
        lines.add("Source: " + defaultIfBlank(StringUtils.hasText(source.getUrl()) ? source.getUrl() : source.getSource(),
            "Unknown source"));
        if (StringUtils.hasText(source.getPublishedDate())) {
            lines.add("Published: " + source.getPublishedDate());
        }
        if (StringUtils.hasText(source.getSnippet())) {
            lines.add("Content: " + source.getSnippet());
        }
        if (StringUtils.hasText(source.getRelevanceNote())) {
            lines.add("Relevance: " + source.getRelevanceNote());
        }
        return String.join("\n", lines);
    }

    /**
     * Truncate upstream error bodies for logs and messages.
     */
    public static String abbreviate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        return trimmed.length() <= maxLength ? trimmed : trimmed.substring(0, maxLength) + "...";
    }

    private static String defaultIfBlank(String value, String defaultValue) {
        return StringUtils.hasText(value) ? value : defaultValue;
    }

}
