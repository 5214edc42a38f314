package fun.fengwk.mch.core.service.search;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Fixed window rate limiter kept in process memory. Idle windows are evicted once they can no longer count.
 *
 * <p>Check and charge are separate steps, concurrent callers of one user may overshoot the budget slightly.
 *
 * @author fengwk
 */
public class InMemorySearchRateLimiter implements SearchRateLimiter {

    private final Cache<String, Window> windows;
    private final Clock clock;
    private final int maxCalls;
    private final Duration windowSize;

    public InMemorySearchRateLimiter(Clock clock, int maxCalls, Duration windowSize) {
        this.clock = clock;
        this.maxCalls = maxCalls;
        this.windowSize = windowSize;
        this.windows = Caffeine.newBuilder()
            .expireAfterAccess(windowSize)
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .build();
    }

    @Override
    public boolean isAllowed(String userId) {
        Window window = windows.getIfPresent(userId);
        if (window == null || window.isExpired(clock.instant(), windowSize)) {
            return maxCalls > 0;
        }
        return window.count() < maxCalls;
    }

    @Override
    public void record(String userId, int calls) {
        if (calls <= 0) {
            return;
        }
        Instant now = clock.instant();
        windows.asMap().compute(userId, (key, window) -> {
            if (window == null || window.isExpired(now, windowSize)) {
                return new Window(now, calls);
            }
            return new Window(window.start(), window.count() + calls);
        });
    }

    int currentCount(String userId) {
        Window window = windows.getIfPresent(userId);
        return window == null || window.isExpired(clock.instant(), windowSize) ? 0 : window.count();
    }

    long trackedUsers() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    private record Window(Instant start, int count) {

        boolean isExpired(Instant now, Duration windowSize) {
            return !now.isBefore(start.plus(windowSize));
        }

    }

}
