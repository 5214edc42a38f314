package fun.fengwk.mch.core.service.search;

import fun.fengwk.mch.core.facade.search.model.SearchResult;

import java.time.Duration;

/**
 * Search result cache.
 *
 * @author fengwk
 */
public interface SearchCacheStore {

    /**
     * @return live cached result, or null when absent or expired.
     */
    SearchResult get(String key);

    void put(String key, SearchResult result, Duration ttl);

}
