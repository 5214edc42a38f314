package fun.fengwk.mch.core.service.search;

import fun.fengwk.mch.core.common.ErrorType;
import fun.fengwk.mch.core.facade.search.SearchClient;
import fun.fengwk.mch.core.facade.search.model.SearchLocation;
import fun.fengwk.mch.core.facade.search.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps the search client with per-user rate limiting, a result cache and in-flight deduplication.
 *
 * <p>At most one upstream search runs per cache key; concurrent callers for the same key share its result.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class SearchCoordinator {

    static final String CACHE_KEY_PREFIX = "web_search:";

    private final SearchClient searchClient;
    private final SearchCacheStore cacheStore;
    private final SearchRateLimiter rateLimiter;
    private final RecencyAnalyzer recencyAnalyzer;
    private final SearchResultFormatter resultFormatter;
    private final SearchCoordinatorProperties properties;
    private final ExecutorService searchExecutor;
    private final Clock clock;

    private final ConcurrentMap<String, InFlightSearch> inFlight = new ConcurrentHashMap<>();

    public SearchCoordinator(SearchClient searchClient,
                             SearchCacheStore cacheStore,
                             SearchRateLimiter rateLimiter,
                             RecencyAnalyzer recencyAnalyzer,
                             SearchResultFormatter resultFormatter,
                             SearchCoordinatorProperties properties,
                             @Qualifier("mchSearchExecutor") ExecutorService searchExecutor,
                             Clock clock) {
        this.searchClient = searchClient;
        this.cacheStore = cacheStore;
        this.rateLimiter = rateLimiter;
        this.recencyAnalyzer = recencyAnalyzer;
        this.resultFormatter = resultFormatter;
        this.properties = properties;
        this.searchExecutor = searchExecutor;
        this.clock = clock;
    }

    /**
     * Search the web for a user query.
     *
     * @param query user query.
     * @param userId user charged for the search, null or blank skips rate limiting.
     * @param location optional approximate location.
     * @return search result, failures are returned as values.
     */
    public SearchResult searchForQuery(String query, String userId, SearchLocation location) {
        if (!StringUtils.hasText(query)) {
            return SearchResult.failure(query, ErrorType.UNEXPECTED, "Search query is blank", 0);
        }
        boolean attributable = StringUtils.hasText(userId);
        if (attributable && !rateLimiter.isAllowed(userId)) {
            log.warn("web search rate limited, userId={}", userId);
            return SearchResult.failure(query, ErrorType.RATE_LIMITED,
                "Rate limit exceeded. Please try again later.", 0);
        }

        SearchLocation sanitized = SearchLocation.sanitize(location);
        String cacheKey = cacheKey(query, sanitized);
        SearchResult cached = cacheStore.get(cacheKey);
        if (cached != null) {
            log.info("web search cache hit, key={}", cacheKey);
            return cached;
        }

        InFlightSearch search = new InFlightSearch(cacheKey);
        InFlightSearch existing = inFlight.putIfAbsent(cacheKey, search);
        if (existing != null) {
            existing.waiters.incrementAndGet();
            log.info("web search joined in-flight call, key={}", cacheKey);
            return await(query, existing);
        }

        // The previous owner may have cached and deregistered between our cache read and putIfAbsent.
        SearchResult raced = cacheStore.get(cacheKey);
        if (raced != null) {
            inFlight.remove(cacheKey, search);
            search.promise.complete(raced);
            return raced;
        }

        String chargedUser = attributable ? userId : null;
        try {
            search.task = searchExecutor.submit(() -> complete(search, performSearch(query, sanitized), chargedUser));
        } catch (RejectedExecutionException ex) {
            log.error("web search rejected by executor, key={}", cacheKey, ex);
            complete(search,
                SearchResult.failure(query, ErrorType.UNEXPECTED, "Search coordination failed: executor rejected task", 0),
                chargedUser);
        }
        return await(query, search);
    }

    String cacheKey(String query, SearchLocation sanitizedLocation) {
        String normalizedQuery = query.trim().toLowerCase(Locale.ROOT);
        String location = sanitizedLocation == null ? "" : sanitizedLocation.canonicalKey();
        String date = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).toString();
        String raw = normalizedQuery + "|" + location + "|" + date;
        return CACHE_KEY_PREFIX + DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private SearchResult performSearch(String query, SearchLocation location) {
        try {
            boolean recencyFocused = recencyAnalyzer.needsRecency(query);
            String upstreamQuery = recencyFocused ? recencyAnalyzer.enhance(query) : query;
            SearchResult result = searchClient.search(upstreamQuery, location);
            if (result == null) {
                return SearchResult.failure(query, ErrorType.UNEXPECTED, "Search client returned no result", 0);
            }
            if (!result.isSuccess()) {
                return result.toBuilder().query(query).recencyFocused(recencyFocused).build();
            }
            SearchResult focused = result.toBuilder()
                .query(query)
                .recencyFocused(recencyFocused)
                .hasRecentContent(recencyAnalyzer.hasRecentContent(result.getSources()))
                .build();
            return resultFormatter.decorate(focused, query);
        } catch (RuntimeException ex) {
            log.error("web search coordination failed, error={}", ex.getMessage(), ex);
            return SearchResult.failure(query, ErrorType.UNEXPECTED, "Search coordination failed: " + ex.getMessage(), 0);
        }
    }

    private void complete(InFlightSearch search, SearchResult result, String userId) {
        String cacheKey = search.cacheKey;
        try {
            if (result.isSuccess()) {
                cacheStore.put(cacheKey, result, Duration.ofMillis(properties.getCacheTtlMs()));
            }
            if (userId != null) {
                int charge = result.getSearchCallsMade() > 0 ? result.getSearchCallsMade() : (result.isSuccess() ? 1 : 0);
                rateLimiter.record(userId, charge);
            }
        } catch (RuntimeException ex) {
            log.error("web search bookkeeping failed, key={}, error={}", cacheKey, ex.getMessage(), ex);
        } finally {
            inFlight.remove(cacheKey, search);
            search.promise.complete(result);
        }
    }

    /**
     * A timed out caller leaves the search running so it still fills the cache. An interrupted caller cancels the
     * upstream call once no other caller waits for it.
     */
    private SearchResult await(String query, InFlightSearch search) {
        long timeoutMs = properties.getOuterTimeoutMs();
        boolean interrupted = false;
        try {
            return search.promise.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("web search outer deadline elapsed, timeoutMs={}", timeoutMs);
            return SearchResult.failure(query, ErrorType.TIMEOUT, "Web search timed out after " + timeoutMs + "ms", 0);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            interrupted = true;
            return SearchResult.failure(query, ErrorType.CANCELLED, "Web search cancelled", 0);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.error("web search failed, error={}", cause.getMessage(), cause);
            return SearchResult.failure(query, ErrorType.UNEXPECTED, "Search coordination failed: " + cause.getMessage(), 0);
        } finally {
            if (search.leave() && interrupted) {
                abandon(query, search);
            }
        }
    }

    private void abandon(String query, InFlightSearch search) {
        if (search.promise.isDone() || search.waiters.get() > 0) {
            return;
        }
        log.info("web search abandoned by all callers, key={}", search.cacheKey);
        inFlight.remove(search.cacheKey, search);
        search.promise.complete(SearchResult.failure(query, ErrorType.CANCELLED, "Web search cancelled", 0));
        Future<?> task = search.task;
        if (task != null) {
            task.cancel(true);
        }
    }

    /**
     * One upstream search shared by every caller of the same cache key.
     */
    private static class InFlightSearch {

        final String cacheKey;
        final CompletableFuture<SearchResult> promise = new CompletableFuture<>();
        final AtomicInteger waiters = new AtomicInteger(1);
        volatile Future<?> task;

        InFlightSearch(String cacheKey) {
            this.cacheKey = cacheKey;
        }

        /**
         * @return true when this was the last waiter.
         */
        boolean leave() {
            return waiters.decrementAndGet() == 0;
        }

    }

}
