package fun.fengwk.mch.core.service.search;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Search coordination configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mch.search.coordinator")
public class SearchCoordinatorProperties {

    /**
     * Successful result cache ttl in milliseconds.
     */
    private long cacheTtlMs = 15 * 60 * 1000L;

    /**
     * Cached results kept at most, least recently used ones are evicted first.
     */
    private long cacheMaxSize = 10000;

    /**
     * Rate limit window in milliseconds.
     */
    private long rateLimitWindowMs = 60 * 60 * 1000L;

    /**
     * Search calls a user may spend per window.
     */
    private int maxSearchesPerUser = 20;

    /**
     * Deadline a caller waits for a search, independent of the client's own retries.
     */
    private long outerTimeoutMs = 15000;

}
