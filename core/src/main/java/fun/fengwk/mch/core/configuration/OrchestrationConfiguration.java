package fun.fengwk.mch.core.configuration;

import fun.fengwk.mch.core.service.orchestrator.OrchestratorProperties;
import fun.fengwk.mch.core.service.record.AsyncConsensusRecorder;
import fun.fengwk.mch.core.service.record.ConsensusRecorder;
import fun.fengwk.mch.core.service.record.LoggingConsensusRecorder;
import fun.fengwk.mch.core.service.search.InMemorySearchCacheStore;
import fun.fengwk.mch.core.service.search.InMemorySearchRateLimiter;
import fun.fengwk.mch.core.service.search.SearchCacheStore;
import fun.fengwk.mch.core.service.search.SearchCoordinatorProperties;
import fun.fengwk.mch.core.service.search.SearchRateLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors, clock, http client and default stores of the consensus engine.
 *
 * @author fengwk
 */
@Configuration
public class OrchestrationConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public HttpClient mchHttpClient(HttpClientProxyProperties proxyProperties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL);
        ProxySelector proxySelector = proxyProperties.toProxySelector();
        if (proxySelector != null) {
            builder.proxy(proxySelector);
        }
        return builder.build();
    }

    @Bean(name = "mchProviderExecutor", destroyMethod = "shutdownNow")
    public ExecutorService mchProviderExecutor(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()),
            daemonThreadFactory("mch-provider-worker-"));
    }

    @Bean(name = "mchSearchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService mchSearchExecutor(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getSearchThreads()),
            daemonThreadFactory("mch-search-worker-"));
    }

    @Bean(name = "mchOrchestrationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService mchOrchestrationExecutor() {
        return Executors.newCachedThreadPool(daemonThreadFactory("mch-query-"));
    }

    @Bean(name = "mchRecordExecutor", destroyMethod = "shutdown")
    public ExecutorService mchRecordExecutor(OrchestratorProperties properties) {
        int threads = Math.max(1, properties.getRecordThreads());
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(Math.max(1, properties.getRecordQueueCapacity())),
            daemonThreadFactory("mch-record-"),
            new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsensusRecorder consensusRecorder(@Qualifier("mchRecordExecutor") ExecutorService recordExecutor) {
        return new AsyncConsensusRecorder(new LoggingConsensusRecorder(), recordExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchCacheStore searchCacheStore(Clock clock, SearchCoordinatorProperties properties) {
        return new InMemorySearchCacheStore(clock, properties.getCacheMaxSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchRateLimiter searchRateLimiter(Clock clock, SearchCoordinatorProperties properties) {
        return new InMemorySearchRateLimiter(clock, properties.getMaxSearchesPerUser(),
            Duration.ofMillis(properties.getRateLimitWindowMs()));
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

}
