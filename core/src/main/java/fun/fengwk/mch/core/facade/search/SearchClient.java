package fun.fengwk.mch.core.facade.search;

import fun.fengwk.mch.core.facade.search.model.SearchLocation;
import fun.fengwk.mch.core.facade.search.model.SearchResult;

/**
 * Web search backend.
 *
 * @author fengwk
 */
public interface SearchClient {

    /**
     * Run one search, retrying transient failures internally. Failures are returned, never thrown.
     *
     * @param query search query.
     * @param location optional approximate user location.
     * @return normalized search result.
     */
    SearchResult search(String query, SearchLocation location);

}
