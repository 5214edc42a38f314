package fun.fengwk.mch.core.service.orchestrator;

import fun.fengwk.mch.core.common.ConsensusError;
import fun.fengwk.mch.core.common.ConsensusRequestException;
import fun.fengwk.mch.core.common.ErrorType;
import fun.fengwk.mch.core.facade.provider.ProviderClient;
import fun.fengwk.mch.core.facade.provider.ProviderClientFactory;
import fun.fengwk.mch.core.facade.provider.ProviderId;
import fun.fengwk.mch.core.facade.provider.ProviderSettings;
import fun.fengwk.mch.core.facade.provider.model.GenerationContext;
import fun.fengwk.mch.core.facade.provider.model.ProviderResponse;
import fun.fengwk.mch.core.facade.search.model.SearchResult;
import fun.fengwk.mch.core.service.credential.CredentialSource;
import fun.fengwk.mch.core.service.orchestrator.model.ConsensusQuery;
import fun.fengwk.mch.core.service.orchestrator.model.ConsensusResponse;
import fun.fengwk.mch.core.service.orchestrator.model.ProviderResult;
import fun.fengwk.mch.core.service.record.ConsensusRecorder;
import fun.fengwk.mch.core.service.record.QueryStartedRecord;
import fun.fengwk.mch.core.service.record.UsageRecord;
import fun.fengwk.mch.core.service.search.SearchCoordinator;
import fun.fengwk.mch.core.service.synopsis.SynopsisGenerator;
import fun.fengwk.mch.core.service.synopsis.SynopsisResult;
import fun.fengwk.mch.core.service.token.CostCalculator;
import fun.fengwk.mch.core.service.token.TokenAccountant;
import fun.fengwk.mch.core.service.token.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans one question out to the selected providers and aggregates their answers.
 *
 * <p>Query state: {@code PENDING -> SEARCH_PHASE (optional) -> FAN_OUT -> AGGREGATED}, or {@code CANCELLED}.
 * Provider failures never fail the query, each provider result carries its own outcome.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ConsensusOrchestrator {

    private static final long SYNOPSIS_GRACE_MS = 1000;

    private final CredentialSource credentialSource;
    private final ProviderClientFactory clientFactory;
    private final SearchCoordinator searchCoordinator;
    private final SynopsisGenerator synopsisGenerator;
    private final TokenAccountant tokenAccountant;
    private final CostCalculator costCalculator;
    private final ConsensusRecorder recorder;
    private final ChatHistoryParser chatHistoryParser;
    private final OrchestratorProperties properties;
    private final ExecutorService providerExecutor;
    private final ExecutorService orchestrationExecutor;
    private final Clock clock;

    public ConsensusOrchestrator(CredentialSource credentialSource,
                                 ProviderClientFactory clientFactory,
                                 SearchCoordinator searchCoordinator,
                                 SynopsisGenerator synopsisGenerator,
                                 TokenAccountant tokenAccountant,
                                 CostCalculator costCalculator,
                                 ConsensusRecorder recorder,
                                 ChatHistoryParser chatHistoryParser,
                                 OrchestratorProperties properties,
                                 @Qualifier("mchProviderExecutor") ExecutorService providerExecutor,
                                 @Qualifier("mchOrchestrationExecutor") ExecutorService orchestrationExecutor,
                                 Clock clock) {
        this.credentialSource = credentialSource;
        this.clientFactory = clientFactory;
        this.searchCoordinator = searchCoordinator;
        this.synopsisGenerator = synopsisGenerator;
        this.tokenAccountant = tokenAccountant;
        this.costCalculator = costCalculator;
        this.recorder = recorder;
        this.chatHistoryParser = chatHistoryParser;
        this.properties = properties;
        this.providerExecutor = providerExecutor;
        this.orchestrationExecutor = orchestrationExecutor;
        this.clock = clock;
    }

    /**
     * Run a query on the calling thread.
     *
     * @throws ConsensusRequestException when the query is invalid.
     */
    public ConsensusResponse run(ConsensusQuery query) {
        validate(query);
        QueryExecution execution = new QueryExecution(newQueryId());
        ConsensusResponse response = execute(execution, query);
        execution.complete(response);
        return response;
    }

    /**
     * Start a query in the background and return a cancellable handle.
     *
     * @throws ConsensusRequestException when the query is invalid or cannot be scheduled.
     */
    public QueryExecution submit(ConsensusQuery query) {
        validate(query);
        QueryExecution execution = new QueryExecution(newQueryId());
        try {
            orchestrationExecutor.execute(() -> drive(execution, query));
        } catch (RejectedExecutionException ex) {
            log.error("consensus query rejected, queryId={}", execution.getQueryId(), ex);
            throw new ConsensusRequestException("Consensus query could not be scheduled", ex);
        }
        return execution;
    }

    private void drive(QueryExecution execution, ConsensusQuery query) {
        execution.attachDriver(Thread.currentThread());
        try {
            execution.complete(execute(execution, query));
        } catch (RuntimeException ex) {
            log.error("consensus query failed, queryId={}, error={}", execution.getQueryId(), ex.getMessage(), ex);
            execution.fail(ex);
        } finally {
            execution.detachDriver();
        }
    }

    private ConsensusResponse execute(QueryExecution execution, ConsensusQuery query) {
        String queryId = execution.getQueryId();
        List<ResolvedProvider> providers = resolveProviders(queryId, query.getServices());

        recorder.recordQueryStarted(QueryStartedRecord.builder()
            .queryId(queryId)
            .conversationId(query.getConversationId())
            .userId(searchUserId(query))
            .message(query.getMessage())
            .providerIds(providers.stream().map(p -> p.providerId().getValue()).toList())
            .webSearchEnabled(query.isUseWebSearch())
            .timestamp(Instant.now(clock).toString())
            .build());

        SearchResult searchResult = null;
        if (query.isUseWebSearch() && !execution.isCancelled()) {
            execution.transition(QueryState.SEARCH_PHASE);
            searchResult = searchCoordinator.searchForQuery(query.getMessage(), searchUserId(query), query.getLocation());
            if (!searchResult.isSuccess()) {
                log.warn("web search failed, queryId={}, type={}, error={}", queryId,
                    searchResult.getError().getType(), searchResult.getError().getMessage());
            }
        }

        List<ProviderResult> results;
        if (execution.isCancelled()) {
            results = cancelledResults(providers);
        } else {
            execution.transition(QueryState.FAN_OUT);
            results = fanOut(execution, query, providers, searchResult);
        }

        QueryState finalState = execution.isCancelled() ? QueryState.CANCELLED : QueryState.AGGREGATED;
        execution.transition(finalState);
        return aggregate(queryId, query, finalState, results, searchResult);
    }

    private List<ProviderResult> fanOut(QueryExecution execution, ConsensusQuery query,
                                        List<ResolvedProvider> providers, SearchResult searchResult) {
        ChatHistoryParser.ChatHistory history = chatHistoryParser.parse(query.getChatHistory());
        String prompt = history.embed(query.getMessage());
        GenerationContext context = GenerationContext.builder()
            .history(history.getMessages())
            .searchResult(searchResult != null && searchResult.isSuccess() ? searchResult : null)
            .build();

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(properties.getProviderTimeoutMs());
        List<ProviderCall> calls = new ArrayList<>();
        for (ResolvedProvider provider : providers) {
            CompletableFuture<ProviderResult> mainPhase = new CompletableFuture<>();
            ProviderCall call;
            try {
                Future<ProviderResult> task = providerExecutor.submit(
                    () -> runProvider(execution.getQueryId(), query, provider, prompt, context, mainPhase));
                call = new ProviderCall(mainPhase, task);
            } catch (RejectedExecutionException ex) {
                log.error("provider task rejected, queryId={}, provider={}", execution.getQueryId(),
                    provider.providerId().getValue(), ex);
                call = null;
            }
            if (call != null) {
                execution.register(call.task());
                execution.register(call.mainPhase());
            }
            calls.add(call);
        }

        List<ProviderResult> results = new ArrayList<>();
        for (int i = 0; i < providers.size(); i++) {
            results.add(collect(execution, providers.get(i), calls.get(i), deadline));
        }
        return results;
    }

    /**
     * The provider deadline covers the main generation only. A finished generation is kept even when its
     * synopsis does not arrive in time.
     */
    private ProviderResult collect(QueryExecution execution, ResolvedProvider provider, ProviderCall call,
                                   long deadline) {
        ProviderId providerId = provider.providerId();
        String model = provider.settings().getModel();
        if (call == null) {
            return ProviderResult.failure(providerId, model,
                ConsensusError.of(ErrorType.UNEXPECTED, "Provider task could not be scheduled"), 0);
        }
        ProviderResult mainResult;
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            mainResult = call.mainPhase().get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            call.task().cancel(true);
            log.warn("provider task timed out, queryId={}, provider={}, timeoutMs={}", execution.getQueryId(),
                providerId.getValue(), properties.getProviderTimeoutMs());
            return ProviderResult.failure(providerId, model, ConsensusError.of(ErrorType.TIMEOUT,
                providerId.getDisplayName() + " did not respond within " + properties.getProviderTimeoutMs() + "ms"),
                properties.getProviderTimeoutMs());
        } catch (CancellationException ex) {
            call.task().cancel(true);
            return cancelledResult(provider);
        } catch (InterruptedException ex) {
            // Driver interrupted by cancel(), stop waiting and cancel the task.
            Thread.currentThread().interrupt();
            call.task().cancel(true);
            return cancelledResult(provider);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.error("provider task failed unexpectedly, queryId={}, provider={}, error={}", execution.getQueryId(),
                providerId.getValue(), cause.getMessage(), cause);
            return ProviderResult.failure(providerId, model,
                ConsensusError.of(ErrorType.UNEXPECTED, "Unexpected error: " + cause.getMessage()), 0);
        }
        if (!mainResult.isSuccess()) {
            return mainResult;
        }
        return collectSynopsis(execution, provider, call, mainResult);
    }

    private ProviderResult collectSynopsis(QueryExecution execution, ResolvedProvider provider, ProviderCall call,
                                           ProviderResult mainResult) {
        try {
            return call.task().get(properties.getSynopsisTimeoutMs() + SYNOPSIS_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            call.task().cancel(true);
            log.warn("provider synopsis phase timed out, queryId={}, provider={}", execution.getQueryId(),
                provider.providerId().getValue());
            return withFallbackSynopsis(mainResult);
        } catch (CancellationException ex) {
            return withFallbackSynopsis(mainResult);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            call.task().cancel(true);
            return withFallbackSynopsis(mainResult);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.error("provider synopsis phase failed, queryId={}, provider={}, error={}", execution.getQueryId(),
                provider.providerId().getValue(), cause.getMessage(), cause);
            return withFallbackSynopsis(mainResult);
        }
    }

    private ProviderResult runProvider(String queryId, ConsensusQuery query, ResolvedProvider provider,
                                       String prompt, GenerationContext context,
                                       CompletableFuture<ProviderResult> mainPhase) {
        try {
            return generate(queryId, query, provider, prompt, context, mainPhase);
        } catch (RuntimeException ex) {
            mainPhase.completeExceptionally(ex);
            throw ex;
        }
    }

    private ProviderResult generate(String queryId, ConsensusQuery query, ResolvedProvider provider,
                                    String prompt, GenerationContext context,
                                    CompletableFuture<ProviderResult> mainPhase) {
        ProviderId providerId = provider.providerId();
        ProviderSettings settings = provider.settings();
        long start = clock.millis();

        ProviderClient client = clientFactory.create(providerId, settings);
        ProviderResponse response = client.generate(prompt, context);
        if (!response.isSuccess()) {
            log.warn("provider generation failed, queryId={}, provider={}, type={}, error={}", queryId,
                providerId.getValue(), response.getError().getType(), response.getError().getMessage());
            recordUsage(queryId, query, provider, TokenUsage.ZERO, null, UsageRecord.MAIN_RESPONSE_LABEL, false);
            ProviderResult failure = ProviderResult.failure(providerId, settings.getModel(), response.getError(),
                clock.millis() - start);
            mainPhase.complete(failure);
            return failure;
        }

        String content = response.getContent();
        TokenUsage usage = tokenAccountant.extract(response.getMetadata(), providerId);
        recordUsage(queryId, query, provider, usage, content, UsageRecord.MAIN_RESPONSE_LABEL, true);

        ProviderResult mainResult = ProviderResult.builder()
            .providerId(providerId.getValue())
            .service(providerId.getDisplayName())
            .model(settings.getModel())
            .success(true)
            .content(content)
            .synopsis(SynopsisGenerator.UNAVAILABLE)
            .inputTokens(usage.getInputTokens())
            .outputTokens(usage.getOutputTokens())
            .tokensUsed(usage.getTotalTokens())
            .cost(costCalculator.cost(usage, settings))
            .responseTimeMs(clock.millis() - start)
            .build();
        mainPhase.complete(mainResult);

        String synopsis = StringUtils.hasText(content)
            ? awaitSynopsis(queryId, query, provider, content)
            : SynopsisGenerator.UNAVAILABLE;

        long elapsed = clock.millis() - start;
        log.info("provider generation completed, queryId={}, provider={}, tokens={}, elapsedMs={}", queryId,
            providerId.getValue(), usage.getTotalTokens(), elapsed);
        return mainResult.toBuilder()
            .synopsis(synopsis)
            .responseTimeMs(elapsed)
            .build();
    }

    /**
     * Wait at most {@code synopsisTimeoutMs} for the synopsis call, falling back to an extractive synopsis.
     */
    private String awaitSynopsis(String queryId, ConsensusQuery query, ResolvedProvider provider, String content) {
        ProviderId providerId = provider.providerId();
        Future<SynopsisResult> task;
        try {
            task = orchestrationExecutor.submit(() -> synopsisGenerator.summarize(content, providerId, provider.settings()));
        } catch (RejectedExecutionException ex) {
            log.error("synopsis task rejected, queryId={}, provider={}", queryId, providerId.getValue(), ex);
            return SynopsisGenerator.fallbackSynopsis(content);
        }

        SynopsisResult synopsisResult;
        try {
            synopsisResult = task.get(properties.getSynopsisTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            task.cancel(true);
            log.warn("synopsis generation timed out, queryId={}, provider={}, timeoutMs={}", queryId,
                providerId.getValue(), properties.getSynopsisTimeoutMs());
            recordUsage(queryId, query, provider, TokenUsage.ZERO, null, UsageRecord.SYNOPSIS_LABEL, false);
            return SynopsisGenerator.fallbackSynopsis(content);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            return SynopsisGenerator.fallbackSynopsis(content);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.error("synopsis task failed, queryId={}, provider={}, error={}", queryId, providerId.getValue(),
                cause.getMessage(), cause);
            return SynopsisGenerator.fallbackSynopsis(content);
        }

        if (synopsisResult.isCalled()) {
            TokenUsage synopsisUsage = synopsisResult.isSuccess()
                ? tokenAccountant.extract(synopsisResult.getMetadata(), providerId)
                : TokenUsage.ZERO;
            recordUsage(queryId, query, provider, synopsisUsage,
                synopsisResult.isSuccess() ? synopsisResult.getSynopsis() : null,
                UsageRecord.SYNOPSIS_LABEL, synopsisResult.isSuccess());
        }
        return synopsisResult.getSynopsis();
    }

    private ProviderResult withFallbackSynopsis(ProviderResult mainResult) {
        return mainResult.toBuilder()
            .synopsis(SynopsisGenerator.fallbackSynopsis(mainResult.getContent()))
            .build();
    }

    private void recordUsage(String queryId, ConsensusQuery query, ResolvedProvider provider, TokenUsage usage,
                             String content, String label, boolean success) {
        try {
            recorder.recordUsage(UsageRecord.builder()
                .queryId(queryId)
                .conversationId(query.getConversationId())
                .providerId(provider.providerId().getValue())
                .model(provider.settings().getModel())
                .inputTokens(usage.getInputTokens())
                .outputTokens(usage.getOutputTokens())
                .totalTokens(usage.getTotalTokens())
                .cost(costCalculator.cost(usage, provider.settings()))
                .content(content)
                .summaryLabel(label)
                .success(success)
                .build());
        } catch (RuntimeException ex) {
            log.error("usage record hand-off failed, queryId={}, provider={}, error={}", queryId,
                provider.providerId().getValue(), ex.getMessage(), ex);
        }
    }

    private ConsensusResponse aggregate(String queryId, ConsensusQuery query, QueryState state,
                                        List<ProviderResult> results, SearchResult searchResult) {
        long totalTokens = results.stream().mapToLong(ProviderResult::getTokensUsed).sum();
        BigDecimal totalCost = results.stream()
            .map(ProviderResult::getCost)
            .filter(cost -> cost != null)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        boolean searched = searchResult != null;
        return ConsensusResponse.builder()
            .success(true)
            .queryId(queryId)
            .conversationId(query.getConversationId())
            .message(query.getMessage())
            .state(state)
            .results(Collections.unmodifiableList(results))
            .webSearchEnabled(query.isUseWebSearch())
            .webSearchSources(searched && searchResult.isSuccess() ? searchResult.getSources() : Collections.emptyList())
            .webSearchError(searched && !searchResult.isSuccess() ? searchResult.getError().getMessage() : null)
            .searchCallsMade(searched ? searchResult.getSearchCallsMade() : 0)
            .totalTokens(totalTokens)
            .totalCost(totalCost)
            .timestamp(Instant.now(clock).toString())
            .build();
    }

    List<ResolvedProvider> resolveProviders(String queryId, List<String> requested) {
        Set<ProviderId> ids = new LinkedHashSet<>();
        if (requested != null) {
            for (String value : requested) {
                ProviderId providerId = ProviderId.fromValue(value == null ? null : value.trim());
                if (providerId == null) {
                    log.warn("unknown provider ignored, queryId={}, provider={}", queryId, value);
                    continue;
                }
                ids.add(providerId);
            }
        }
        if (ids.isEmpty()) {
            ids.addAll(Arrays.asList(ProviderId.values()));
        }

        List<ResolvedProvider> providers = new ArrayList<>();
        for (ProviderId providerId : ids) {
            Optional<ProviderSettings> settings = credentialSource.find(providerId);
            if (settings.isEmpty()) {
                log.warn("provider skipped without credential, queryId={}, provider={}", queryId, providerId.getValue());
                continue;
            }
            providers.add(new ResolvedProvider(providerId, settings.get()));
        }
        return providers;
    }

    private List<ProviderResult> cancelledResults(List<ResolvedProvider> providers) {
        List<ProviderResult> results = new ArrayList<>();
        for (ResolvedProvider provider : providers) {
            results.add(cancelledResult(provider));
        }
        return results;
    }

    private ProviderResult cancelledResult(ResolvedProvider provider) {
        return ProviderResult.failure(provider.providerId(), provider.settings().getModel(),
            ConsensusError.of(ErrorType.CANCELLED, "Query cancelled"), 0);
    }

    private String searchUserId(ConsensusQuery query) {
        return StringUtils.hasText(query.getUserId()) ? query.getUserId() : properties.getDefaultUserId();
    }

    private void validate(ConsensusQuery query) {
        if (query == null) {
            throw new ConsensusRequestException("Consensus query must not be null");
        }
        if (!StringUtils.hasText(query.getMessage())) {
            throw new ConsensusRequestException("Message must not be blank");
        }
    }

    private static String newQueryId() {
        return UUID.randomUUID().toString();
    }

    record ResolvedProvider(ProviderId providerId, ProviderSettings settings) {
    }

    /**
     * {@code mainPhase} completes when the generation returns, {@code task} once the synopsis is attached.
     */
    private record ProviderCall(CompletableFuture<ProviderResult> mainPhase, Future<ProviderResult> task) {
    }

}
