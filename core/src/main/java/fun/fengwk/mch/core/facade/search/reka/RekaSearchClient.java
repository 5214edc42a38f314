package fun.fengwk.mch.core.facade.search.reka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fun.fengwk.mch.core.common.ErrorType;
import fun.fengwk.mch.core.facade.provider.ProviderPromptUtils;
import fun.fengwk.mch.core.facade.search.SearchClient;
import fun.fengwk.mch.core.facade.search.model.SearchLocation;
import fun.fengwk.mch.core.facade.search.model.SearchResult;
import fun.fengwk.mch.core.facade.search.model.SearchSource;
import fun.fengwk.mch.core.facade.search.parser.CitationExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Reka research API client, an OpenAI compatible chat completion with web search enabled.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RekaSearchClient implements SearchClient {

    static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private static final int MAX_ERROR_BODY_LENGTH = 300;

    private final RekaSearchProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CitationExtractor citationExtractor;
    private final Clock clock;

    @Override
    public SearchResult search(String query, SearchLocation location) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            log.warn("reka search skipped, api key not configured");
            return SearchResult.failure(query, ErrorType.INVALID_CREDENTIAL, "Reka API not configured", 0);
        }
        if (!StringUtils.hasText(query)) {
            return SearchResult.failure(query, ErrorType.UNEXPECTED, "Search query is blank", 0);
        }

        SearchLocation sentLocation = SearchLocation.sanitize(location);
        if (location != null && location.getCountry() != null && !SearchLocation.isValidCountry(location.getCountry())) {
            log.warn("invalid search country dropped, country={}", location.getCountry());
        }

        int maxAttempts = Math.max(0, properties.getRetryCount()) + 1;
        int callsMade = 0;
        Attempt attempt = null;
        for (int i = 1; i <= maxAttempts; i++) {
            attempt = execute(query, sentLocation);
            callsMade++;
            if (attempt.result().isSuccess()) {
                return withCalls(attempt.result(), callsMade);
            }
            if (!attempt.retryable() || attempt.cancelled() || i == maxAttempts) {
                break;
            }
            log.info("reka search retrying, attempt={}, error={}", i, attempt.result().getError().getMessage());
            if (!sleepBackoff(i)) {
                return SearchResult.failure(query, ErrorType.CANCELLED, "Reka search cancelled", callsMade);
            }
        }

        if (sentLocation != null && properties.isRetryWithoutLocation() && attempt.locationSensitive()) {
            log.info("reka search retrying without location, query={}", abbreviateQuery(query));
            Attempt fallback = execute(query, null);
            callsMade++;
            return withCalls(fallback.result(), callsMade);
        }
        return withCalls(attempt.result(), callsMade);
    }

    private Attempt execute(String query, SearchLocation location) {
        try {
            HttpRequest request = buildRequest(query, location);
            HttpResponse<String> response = httpClient.send(request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int statusCode = response.statusCode();
            if (statusCode == 429) {
                log.warn("reka search rate limited, status={}", statusCode);
                return Attempt.retryable(failure(query, ErrorType.RATE_LIMITED,
                    "Reka API error 429: " + ProviderPromptUtils.abbreviate(response.body(), MAX_ERROR_BODY_LENGTH)));
            }
            if (statusCode < 200 || statusCode >= 300) {
                log.warn("reka search failed, status={}", statusCode);
                SearchResult result = failure(query, ErrorType.UPSTREAM_HTTP_ERROR,
                    "Reka API error " + statusCode + ": " + ProviderPromptUtils.abbreviate(response.body(), MAX_ERROR_BODY_LENGTH));
                return Attempt.httpError(result, statusCode);
            }
            return Attempt.fatal(parse(query, response.body()));
        } catch (HttpTimeoutException ex) {
            log.warn("reka search timed out, timeoutMs={}", properties.getTimeoutMs());
            return Attempt.retryable(failure(query, ErrorType.TIMEOUT, "Reka search timed out"));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return Attempt.cancelled(failure(query, ErrorType.CANCELLED, "Reka search cancelled"));
        } catch (JsonProcessingException ex) {
            log.warn("reka search response is not valid json, error={}", ex.getOriginalMessage());
            return Attempt.fatal(failure(query, ErrorType.PARSE_ERROR, "Failed to process results: " + ex.getOriginalMessage()));
        } catch (IOException ex) {
            log.warn("reka search network error, error={}", ex.getMessage());
            return Attempt.retryable(failure(query, ErrorType.UPSTREAM_HTTP_ERROR, "Reka search failed: " + ex.getMessage()));
        }
    }

    private HttpRequest buildRequest(String query, SearchLocation location) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", properties.getModel());
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", query);

        ObjectNode webSearch = body.putObject("research").putObject("web_search");
        webSearch.put("max_uses", properties.getMaxUses());
        if (location != null) {
            ObjectNode approximate = webSearch.putObject("user_location").putObject("approximate");
            putIfPresent(approximate, "city", location.getCity());
            putIfPresent(approximate, "region", location.getRegion());
            putIfPresent(approximate, "country", location.getCountry());
        }

        return HttpRequest.newBuilder()
            .uri(URI.create(baseUrl() + COMPLETIONS_PATH))
            .timeout(Duration.ofMillis(Math.max(1L, properties.getTimeoutMs())))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("Authorization", "Bearer " + properties.getApiKey())
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8))
            .build();
    }

    private SearchResult parse(String query, String body) throws JsonProcessingException {
        if (!StringUtils.hasText(body)) {
            return failure(query, ErrorType.PARSE_ERROR, "Failed to process results: empty body");
        }
        JsonNode root = objectMapper.readTree(body);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            return failure(query, ErrorType.PARSE_ERROR, "Failed to process results: no choices returned");
        }

        String text = content.asText();
        List<SearchSource> sources = citationExtractor.extract(text);
        log.info("reka search completed, query={}, sources={}", abbreviateQuery(query), sources.size());
        return SearchResult.builder()
            .success(true)
            .query(query)
            .sources(sources)
            .content(text)
            .timestamp(Instant.now(clock).toString())
            .build();
    }

    private SearchResult failure(String query, ErrorType type, String message) {
        return SearchResult.failure(query, type, message, 0);
    }

    private SearchResult withCalls(SearchResult result, int callsMade) {
        return result.toBuilder().searchCallsMade(callsMade).build();
    }

    private boolean sleepBackoff(int attempt) {
        long delay = Math.max(0L, properties.getBackoffMs()) * (1L << Math.min(attempt - 1, 16));
        if (delay == 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String baseUrl() {
        String baseUrl = StringUtils.hasText(properties.getBaseUrl()) ? properties.getBaseUrl().trim() : "";
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (StringUtils.hasText(value)) {
            node.put(field, value);
        }
    }

    private static String abbreviateQuery(String query) {
        return query.length() <= 50 ? query : query.substring(0, 50) + "...";
    }

    /**
     * {@code locationSensitive} marks failures a rejected or unresolvable location can produce: 400, 422 and 5xx.
     */
    private record Attempt(SearchResult result, boolean retryable, boolean cancelled, boolean locationSensitive) {

        static Attempt retryable(SearchResult result) {
            return new Attempt(result, true, false, false);
        }

        static Attempt fatal(SearchResult result) {
            return new Attempt(result, false, false, false);
        }

        static Attempt cancelled(SearchResult result) {
            return new Attempt(result, false, true, false);
        }

        static Attempt httpError(SearchResult result, int statusCode) {
            boolean serverError = statusCode >= 500;
            return new Attempt(result, serverError, false, serverError || statusCode == 400 || statusCode == 422);
        }

    }

}
