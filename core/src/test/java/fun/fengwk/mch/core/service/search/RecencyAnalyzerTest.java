package fun.fengwk.mch.core.service.search;

import fun.fengwk.mch.core.facade.search.model.SearchSource;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
class RecencyAnalyzerTest {

    private final RecencyAnalyzer analyzer =
        new RecencyAnalyzer(Clock.fixed(Instant.parse("2025-06-01T08:00:00Z"), ZoneOffset.UTC));

    @Test
    void shouldDetectTimeSensitiveQueries() {
        assertThat(analyzer.needsRecency("latest rust release")).isTrue();
        assertThat(analyzer.needsRecency("What is the weather in Paris")).isTrue();
        assertThat(analyzer.needsRecency("what happened at the summit")).isTrue();
        assertThat(analyzer.needsRecency("budget plan for 2025")).isTrue();
        assertThat(analyzer.needsRecency("tax rules 2024")).isTrue();
        assertThat(analyzer.needsRecency("Breaking: stock markets fall")).isTrue();
    }

    @Test
    void shouldMatchKeywordsAtWordStartOnly() {
        assertThat(analyzer.needsRecency("renewable energy basics")).isFalse();
        assertThat(analyzer.needsRecency("software architecture patterns")).isFalse();
        assertThat(analyzer.needsRecency("rust ownership")).isFalse();
        assertThat(analyzer.needsRecency("tax rules 2019")).isFalse();
        assertThat(analyzer.needsRecency(" ")).isFalse();
        assertThat(analyzer.needsRecency(null)).isFalse();
    }

    @Test
    void shouldPrefixFirstMissingModifier() {
        assertThat(analyzer.enhance("rust ownership")).isEqualTo("latest rust ownership");
        assertThat(analyzer.enhance("Latest rust release")).isEqualTo("recent Latest rust release");
        assertThat(analyzer.enhance("latest recent current news")).isEqualTo("2025 latest recent current news");
        assertThat(analyzer.enhance("latest recent current news 2025")).isEqualTo("latest recent current news 2025");
    }

    @Test
    void shouldRequireFortyPercentRecentSources() {
        List<SearchSource> recentEnough = List.of(
            dated("2025-05-20T10:00:00Z"),
            dated("2025-05-02"),
            dated("2024-01-01"),
            dated("not a date"),
            dated(null));
        List<SearchSource> tooOld = List.of(
            dated("2025-05-20"),
            dated("2025-05-01"),
            dated("2024-01-01"),
            dated(null),
            dated(null));

        assertThat(analyzer.hasRecentContent(recentEnough)).isTrue();
        assertThat(analyzer.hasRecentContent(tooOld)).isFalse();
        assertThat(analyzer.hasRecentContent(List.of())).isFalse();
        assertThat(analyzer.hasRecentContent(null)).isFalse();
    }

    private SearchSource dated(String date) {
        return SearchSource.builder().title("t").publishedDate(date).build();
    }

}
