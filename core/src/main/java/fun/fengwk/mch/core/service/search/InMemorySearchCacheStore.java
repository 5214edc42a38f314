package fun.fengwk.mch.core.service.search;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import fun.fengwk.mch.core.facade.search.model.SearchResult;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Process local cache store backed by Caffeine. Each entry expires after its own ttl and the store never holds
 * more than {@code maximumSize} entries.
 *
 * @author fengwk
 */
public class InMemorySearchCacheStore implements SearchCacheStore {

    private final Cache<String, CacheEntry> entries;

    public InMemorySearchCacheStore(Clock clock, long maximumSize) {
        this.entries = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new EntryTtl())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .build();
    }

    @Override
    public SearchResult get(String key) {
        CacheEntry entry = entries.getIfPresent(key);
        return entry == null ? null : entry.result();
    }

    @Override
    public void put(String key, SearchResult result, Duration ttl) {
        if (result == null || ttl == null || ttl.isNegative() || ttl.isZero()) {
            return;
        }
        entries.put(key, new CacheEntry(result, ttl.toNanos()));
    }

    long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    private record CacheEntry(SearchResult result, long ttlNanos) {
    }

    private static class EntryTtl implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

    }

}
