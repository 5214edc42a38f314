package fun.fengwk.mch.core.service.search;

import fun.fengwk.mch.core.facade.search.model.SearchSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects time sensitive queries and judges how fresh search sources are.
 *
 * @author fengwk
 */
@Component
public class RecencyAnalyzer {

    static final int RECENT_DAYS = 30;
    static final double RECENT_RATIO = 0.4;

    private static final List<String> TIME_SENSITIVE_KEYWORDS = List.of(
        "latest", "recent", "current", "today", "yesterday", "this week",
        "this month", "now", "breaking", "news", "update", "new");

    private static final List<String> TEMPORAL_PHRASES = List.of(
        "what happened", "current status", "latest news", "recent events",
        "today's", "this year", "currently");

    private static final List<String> RECENCY_TOPICS = List.of(
        "news", "weather", "stock", "price", "event", "announcement",
        "release", "update", "version", "status", "election", "covid",
        "pandemic", "war", "conflict", "economy", "market");

    private static final List<Pattern> KEYWORD_PATTERNS = TIME_SENSITIVE_KEYWORDS.stream()
        .map(RecencyAnalyzer::wordStart)
        .toList();

    private static final List<Pattern> TOPIC_PATTERNS = RECENCY_TOPICS.stream()
        .map(RecencyAnalyzer::wordStart)
        .toList();

    private final Clock clock;

    public RecencyAnalyzer(Clock clock) {
        this.clock = clock;
    }

    public boolean needsRecency(String query) {
        if (!StringUtils.hasText(query)) {
            return false;
        }
        String lower = query.toLowerCase(Locale.ROOT);
        if (KEYWORD_PATTERNS.stream().anyMatch(p -> p.matcher(lower).find())) {
            return true;
        }
        if (TEMPORAL_PHRASES.stream().anyMatch(lower::contains)) {
            return true;
        }
        int year = today().getYear();
        if (lower.contains(String.valueOf(year)) || lower.contains(String.valueOf(year - 1))) {
            return true;
        }
        return TOPIC_PATTERNS.stream().anyMatch(p -> p.matcher(lower).find());
    }

    /**
     * Prefix the query with the first temporal modifier it does not already contain.
     */
    public String enhance(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        for (String modifier : List.of("latest", "recent", "current", String.valueOf(today().getYear()))) {
            if (!lower.contains(modifier)) {
                return modifier + " " + query;
            }
        }
        return query;
    }

    /**
     * At least 40% of all sources were published within the last 30 days.
     */
    public boolean hasRecentContent(List<SearchSource> sources) {
        if (sources == null || sources.isEmpty()) {
            return false;
        }
        LocalDate threshold = today().minusDays(RECENT_DAYS);
        long recent = sources.stream()
            .map(SearchSource::getPublishedDate)
            .filter(StringUtils::hasText)
            .filter(date -> isOnOrAfter(date, threshold))
            .count();
        return (double) recent / sources.size() >= RECENT_RATIO;
    }

    private boolean isOnOrAfter(String date, LocalDate threshold) {
        try {
            return !LocalDate.parse(date.length() > 10 ? date.substring(0, 10) : date).isBefore(threshold);
        } catch (DateTimeParseException ex) {
            return false;
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private static Pattern wordStart(String word) {
        return Pattern.compile("\\b" + Pattern.quote(word));
    }

}
