package fun.fengwk.mch.core.service.search;

import fun.fengwk.mch.core.facade.search.model.SearchResult;
import fun.fengwk.mch.core.facade.search.model.SearchSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Prepares search results for model consumption.
 *
 * @author fengwk
 */
@Component
public class SearchResultFormatter {

    static final int MAX_FORMATTED_SOURCES = 6;

    static final String HIGH_RELEVANCE = "High relevance - query terms in title";
    static final String GOOD_RELEVANCE = "Good relevance - query terms in content";
    static final String RELATED = "Related content";

    /**
     * Attach relevance notes to every source and build the formatted content block.
     */
    public SearchResult decorate(SearchResult result, String query) {
        List<SearchSource> sources = new ArrayList<>();
        for (SearchSource source : result.getSources()) {
            sources.add(source.toBuilder().relevanceNote(relevanceNote(source, query)).build());
        }
        SearchResult annotated = result.toBuilder().sources(sources).build();
        return annotated.toBuilder().formattedContent(format(annotated)).build();
    }

    public String relevanceNote(SearchSource source, String query) {
        Set<String> queryWords = words(query);
        long titleOverlap = words(source.getTitle()).stream().filter(queryWords::contains).count();
        if (titleOverlap >= 2) {
            return HIGH_RELEVANCE;
        }
        long snippetOverlap = words(source.getSnippet()).stream().filter(queryWords::contains).count();
        if (snippetOverlap >= 3) {
            return GOOD_RELEVANCE;
        }
        return RELATED;
    }

    public String format(SearchResult result) {
        if (!result.isSuccess() || !result.hasSources()) {
            return null;
        }
        List<String> lines = new ArrayList<>();
        lines.add("Web Search Results for: " + (StringUtils.hasText(result.getQuery()) ? result.getQuery() : "Unknown query"));
        lines.add("Found " + result.getSources().size() + " relevant sources");
        if (result.isRecencyFocused()) {
            lines.add("Search focused on recent/current information");
        }
        lines.add("\n--- Search Results ---");

        List<SearchSource> sources = result.getSources();
        for (int i = 0; i < Math.min(sources.size(), MAX_FORMATTED_SOURCES); i++) {
            SearchSource source = sources.get(i);
            lines.add("\n" + (i + 1) + ". " + orDefault(source.getTitle(), "No title"));
            lines.add("   Source: " + orDefault(StringUtils.hasText(source.getUrl()) ? source.getUrl() : source.getSource(),
                "Unknown source"));
            if (StringUtils.hasText(source.getPublishedDate())) {
                lines.add("   Published: " + source.getPublishedDate());
            }
            lines.add("   Content: " + orDefault(source.getSnippet(), "No content preview"));
            if (StringUtils.hasText(source.getRelevanceNote())) {
                lines.add("   Relevance: " + source.getRelevanceNote());
            }
        }

        lines.add("\n--- End Search Results ---");
        lines.add("\nPlease use this current web information to enhance your response.");
        return String.join("\n", lines);
    }

    private static Set<String> words(String text) {
        if (!StringUtils.hasText(text)) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\s+"))
            .filter(StringUtils::hasText)
            .collect(Collectors.toSet());
    }

    private static String orDefault(String value, String defaultValue) {
        return StringUtils.hasText(value) ? value : defaultValue;
    }

}
