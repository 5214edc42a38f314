package fun.fengwk.mch.core.facade.search.parser;

import fun.fengwk.mch.core.facade.search.model.SearchSource;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts cited sources from markdown research content.
 *
 * @author fengwk
 */
@Component
public class CitationExtractor {

    public static final String SUMMARY_TITLE = "Research summary";

    static final int MAX_SNIPPET_LENGTH = 500;
    static final int MIN_LINE_SNIPPET_LENGTH = 40;
    static final int WINDOW_LENGTH = 300;

    private static final Pattern LINK_PATTERN = Pattern.compile("\\[([^\\]\\n]+)]\\((https?://[^)\\s]+)\\)");
    private static final Pattern NUMERIC_LABEL_PATTERN = Pattern.compile("\\d+");
    private static final Pattern LIST_MARKER_PATTERN = Pattern.compile("^\\s*(?:[-*+>]|#+|\\d+[.)])\\s+");
    private static final Pattern ISO_DATE_PATTERN = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");
    private static final String SUMMARY_SOURCE = "reka.ai";

    /**
     * Parse sources in first-seen order, deduplicated by url.
     *
     * @param content research content, may be null.
     * @return sources, a single summary source when the content has no links, empty for blank content.
     */
    public List<SearchSource> extract(String content) {
        if (!StringUtils.hasText(content)) {
            return Collections.emptyList();
        }

        List<SearchSource> sources = new ArrayList<>();
        Set<String> seenUrls = new LinkedHashSet<>();
        Matcher matcher = LINK_PATTERN.matcher(content);
        while (matcher.find()) {
            String url = matcher.group(2);
            if (!seenUrls.add(url)) {
                continue;
            }
            String snippet = snippetAround(content, matcher.start(), matcher.end());
            String host = hostOf(url);
            String label = cleanText(matcher.group(1));
            sources.add(SearchSource.builder()
                .title(NUMERIC_LABEL_PATTERN.matcher(label).matches() ? host : label)
                .url(url)
                .source(host)
                .snippet(snippet)
                .publishedDate(findIsoDate(snippet))
                .build());
        }

        if (sources.isEmpty()) {
            String snippet = abbreviate(cleanText(reduceLinks(content)));
            sources.add(SearchSource.builder()
                .title(SUMMARY_TITLE)
                .source(SUMMARY_SOURCE)
                .snippet(snippet)
                .publishedDate(findIsoDate(snippet))
                .build());
        }
        return sources;
    }

    private String snippetAround(String content, int linkStart, int linkEnd) {
        int lineStart = content.lastIndexOf('\n', linkStart - 1) + 1;
        int lineEnd = content.indexOf('\n', linkEnd);
        if (lineEnd < 0) {
            lineEnd = content.length();
        }

        String line = cleanText(LIST_MARKER_PATTERN.matcher(reduceLinks(content.substring(lineStart, lineEnd))).replaceFirst(""));
        if (line.length() >= MIN_LINE_SNIPPET_LENGTH) {
            return abbreviate(line);
        }

        // Short lines are usually reference lists, widen to the surrounding text.
        int half = WINDOW_LENGTH / 2;
        int windowStart = Math.max(0, linkStart - half);
        int windowEnd = Math.min(content.length(), linkEnd + half);
        return abbreviate(cleanText(reduceLinks(content.substring(windowStart, windowEnd))));
    }

    private String reduceLinks(String text) {
        return LINK_PATTERN.matcher(text).replaceAll("$1");
    }

    private String cleanText(String text) {
        // Drops stray html and unescapes entities, whitespace is collapsed.
        return Jsoup.parseBodyFragment(text).text().trim();
    }

    private String abbreviate(String text) {
        if (text.length() <= MAX_SNIPPET_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_SNIPPET_LENGTH - 3).trim() + "...";
    }

    private String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            if (host == null) {
                return url;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException ex) {
            return url;
        }
    }

    private String findIsoDate(String snippet) {
        if (snippet == null) {
            return null;
        }
        Matcher matcher = ISO_DATE_PATTERN.matcher(snippet);
        while (matcher.find()) {
            try {
                return LocalDate.parse(matcher.group(1)).toString();
            } catch (DateTimeParseException ex) {
                // Not a calendar date, e.g. 2024-13-45.
                continue;
            }
        }
        return null;
    }

}
