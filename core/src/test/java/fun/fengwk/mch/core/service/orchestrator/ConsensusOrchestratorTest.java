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
import fun.fengwk.mch.core.facade.search.model.SearchSource;
import fun.fengwk.mch.core.service.credential.CredentialSource;
import fun.fengwk.mch.core.service.orchestrator.model.ConsensusQuery;
import fun.fengwk.mch.core.service.orchestrator.model.ConsensusResponse;
import fun.fengwk.mch.core.service.orchestrator.model.ProviderResult;
import fun.fengwk.mch.core.service.record.ConsensusRecorder;
import fun.fengwk.mch.core.service.record.UsageRecord;
import fun.fengwk.mch.core.service.search.SearchCoordinator;
import fun.fengwk.mch.core.service.synopsis.SynopsisGenerator;
import fun.fengwk.mch.core.service.synopsis.SynopsisResult;
import fun.fengwk.mch.core.service.token.CostCalculator;
import fun.fengwk.mch.core.service.token.TokenAccountant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
class ConsensusOrchestratorTest {

    private CredentialSource credentialSource;
    private ProviderClientFactory clientFactory;
    private SearchCoordinator searchCoordinator;
    private SynopsisGenerator synopsisGenerator;
    private ConsensusRecorder recorder;
    private OrchestratorProperties properties;
    private ExecutorService providerExecutor;
    private ExecutorService orchestrationExecutor;
    private ConsensusOrchestrator orchestrator;

    private final Map<ProviderId, ProviderClient> clients = new EnumMap<>(ProviderId.class);

    @BeforeEach
    void setUp() {
        credentialSource = mock(CredentialSource.class);
        clientFactory = mock(ProviderClientFactory.class);
        searchCoordinator = mock(SearchCoordinator.class);
        synopsisGenerator = mock(SynopsisGenerator.class);
        recorder = mock(ConsensusRecorder.class);
        properties = new OrchestratorProperties();
        providerExecutor = Executors.newCachedThreadPool();
        orchestrationExecutor = Executors.newCachedThreadPool();

        for (ProviderId providerId : ProviderId.values()) {
            ProviderClient client = mock(ProviderClient.class);
            clients.put(providerId, client);
            when(credentialSource.find(providerId)).thenReturn(Optional.of(settings(providerId)));
            when(clientFactory.create(eq(providerId), any(ProviderSettings.class))).thenReturn(client);
        }
        when(clients.get(ProviderId.CLAUDE).generate(anyString(), any(GenerationContext.class)))
            .thenReturn(ProviderResponse.success(ProviderId.CLAUDE, "Claude answer",
                Map.of("usage", Map.of("input_tokens", 100, "output_tokens", 50))));
        when(clients.get(ProviderId.OPENAI).generate(anyString(), any(GenerationContext.class)))
            .thenReturn(ProviderResponse.success(ProviderId.OPENAI, "OpenAI answer",
                Map.of("usage", Map.of("prompt_tokens", 200, "completion_tokens", 100))));
        when(clients.get(ProviderId.GEMINI).generate(anyString(), any(GenerationContext.class)))
            .thenReturn(ProviderResponse.success(ProviderId.GEMINI, "Gemini answer",
                Map.of("usage", Map.of("promptTokenCount", 10, "candidatesTokenCount", 20))));
        when(synopsisGenerator.summarize(anyString(), any(ProviderId.class), any(ProviderSettings.class)))
            .thenReturn(new SynopsisResult("short synopsis", Map.of(), true, true, null));

        orchestrator = new ConsensusOrchestrator(credentialSource, clientFactory, searchCoordinator,
            synopsisGenerator, new TokenAccountant(), new CostCalculator(), recorder, new ChatHistoryParser(),
            properties, providerExecutor, orchestrationExecutor, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        providerExecutor.shutdownNow();
        orchestrationExecutor.shutdownNow();
    }

    @Test
    void shouldAggregateTwoProvidersWithoutSearch() {
        ConsensusResponse response = orchestrator.run(query("What is Rust?", List.of("claude", "openai")));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getState()).isEqualTo(QueryState.AGGREGATED);
        assertThat(response.getQueryId()).isNotBlank();
        assertThat(response.isWebSearchEnabled()).isFalse();
        assertThat(response.getWebSearchSources()).isEmpty();
        assertThat(response.getSearchCallsMade()).isZero();
        assertThat(response.getResults()).extracting(ProviderResult::getProviderId).containsExactly("claude", "openai");

        ProviderResult claude = response.getResults().get(0);
        assertThat(claude.isSuccess()).isTrue();
        assertThat(claude.getService()).isEqualTo("Claude");
        assertThat(claude.getContent()).isEqualTo("Claude answer");
        assertThat(claude.getSynopsis()).isEqualTo("short synopsis");
        assertThat(claude.getTokensUsed()).isEqualTo(150);
        assertThat(claude.getCost()).isEqualByComparingTo("0.00105");

        ProviderResult openai = response.getResults().get(1);
        assertThat(openai.getTokensUsed()).isEqualTo(openai.getInputTokens() + openai.getOutputTokens()).isEqualTo(300);
        assertThat(openai.getCost()).isEqualByComparingTo("0.0025");

        assertThat(response.getTotalTokens()).isEqualTo(450);
        assertThat(response.getTotalCost()).isEqualByComparingTo("0.00355");
        verifyNoInteractions(searchCoordinator);
        verify(recorder).recordQueryStarted(any());
        ArgumentCaptor<UsageRecord> usage = ArgumentCaptor.forClass(UsageRecord.class);
        verify(recorder, times(4)).recordUsage(usage.capture());
        assertThat(usage.getAllValues())
            .filteredOn(record -> UsageRecord.SYNOPSIS_LABEL.equals(record.getSummaryLabel()))
            .hasSize(2);
        assertThat(usage.getAllValues())
            .filteredOn(record -> UsageRecord.MAIN_RESPONSE_LABEL.equals(record.getSummaryLabel()))
            .extracting(UsageRecord::getContent)
            .containsExactlyInAnyOrder("Claude answer", "OpenAI answer");
    }

    @Test
    void shouldIsolateProviderFailures() {
        when(clients.get(ProviderId.GEMINI).generate(anyString(), any(GenerationContext.class)))
            .thenReturn(ProviderResponse.failure(ProviderId.GEMINI, ErrorType.RATE_LIMITED, "Gemini API error 429: quota"));
        when(clients.get(ProviderId.OPENAI).generate(anyString(), any(GenerationContext.class)))
            .thenThrow(new IllegalStateException("socket reset"));

        ConsensusResponse response = orchestrator.run(query("What is Rust?", List.of("claude", "openai", "gemini")));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getResults()).hasSize(3);
        assertThat(response.getResults().get(0).isSuccess()).isTrue();

        ProviderResult openai = response.getResults().get(1);
        assertThat(openai.isSuccess()).isFalse();
        assertThat(openai.getErrorType()).isEqualTo(ErrorType.UNEXPECTED);
        assertThat(openai.getError()).contains("socket reset");

        ProviderResult gemini = response.getResults().get(2);
        assertThat(gemini.isSuccess()).isFalse();
        assertThat(gemini.getErrorType()).isEqualTo(ErrorType.RATE_LIMITED);
        assertThat(gemini.getTokensUsed()).isZero();
        assertThat(response.getTotalTokens()).isEqualTo(150);
        verify(synopsisGenerator, never()).summarize(anyString(), eq(ProviderId.GEMINI), any(ProviderSettings.class));
    }

    @Test
    void shouldKeepProviderSuccessWhenSynopsisFails() {
        when(synopsisGenerator.summarize(anyString(), any(ProviderId.class), any(ProviderSettings.class)))
            .thenReturn(new SynopsisResult("Claude answer", Map.of(), false, true,
                ConsensusError.of(ErrorType.TIMEOUT, "slow")));

        ConsensusResponse response = orchestrator.run(query("What is Rust?", List.of("claude")));

        ProviderResult claude = response.getResults().get(0);
        assertThat(claude.isSuccess()).isTrue();
        assertThat(claude.getSynopsis()).isEqualTo("Claude answer");
        ArgumentCaptor<UsageRecord> usage = ArgumentCaptor.forClass(UsageRecord.class);
        verify(recorder, times(2)).recordUsage(usage.capture());
        UsageRecord synopsisRecord = usage.getAllValues().stream()
            .filter(record -> UsageRecord.SYNOPSIS_LABEL.equals(record.getSummaryLabel()))
            .findFirst()
            .orElseThrow();
        assertThat(synopsisRecord.isSuccess()).isFalse();
        assertThat(synopsisRecord.getTotalTokens()).isZero();
    }

    @Test
    void shouldSkipProvidersWithoutCredential() {
        when(credentialSource.find(ProviderId.GEMINI)).thenReturn(Optional.empty());

        ConsensusResponse response = orchestrator.run(query("What is Rust?", List.of()));

        assertThat(response.getResults()).extracting(ProviderResult::getProviderId).containsExactly("claude", "openai");
        verify(clientFactory, never()).create(eq(ProviderId.GEMINI), any(ProviderSettings.class));
    }

    @Test
    void shouldFallBackToAllProvidersForUnknownIds() {
        ConsensusResponse response = orchestrator.run(query("What is Rust?", List.of("mistral", " ")));

        assertThat(response.getResults()).extracting(ProviderResult::getProviderId)
            .containsExactly("claude", "openai", "gemini");
    }

    @Test
    void shouldIgnoreUnknownIdsNextToKnownOnes() {
        ConsensusResponse response = orchestrator.run(query("What is Rust?", List.of("mistral", " Gemini ", "gemini")));

        assertThat(response.getResults()).extracting(ProviderResult::getProviderId).containsExactly("gemini");
    }

    @Test
    void shouldRejectBlankMessage() {
        assertThatThrownBy(() -> orchestrator.run(query("  ", List.of())))
            .isInstanceOf(ConsensusRequestException.class);
        assertThatThrownBy(() -> orchestrator.run(null))
            .isInstanceOf(ConsensusRequestException.class);
        verifyNoInteractions(recorder);
    }

    @Test
    void shouldShareSearchResultWithProviders() {
        SearchSource source = SearchSource.builder().title("Rust").url("https://www.rust-lang.org").build();
        SearchResult searchResult = SearchResult.builder()
            .success(true)
            .query("What is Rust?")
            .sources(List.of(source))
            .searchCallsMade(1)
            .build();
        when(searchCoordinator.searchForQuery("What is Rust?", "mcp-local", null)).thenReturn(searchResult);

        ConsensusResponse response = orchestrator.run(ConsensusQuery.builder()
            .message("What is Rust?")
            .services(List.of("claude"))
            .useWebSearch(true)
            .build());

        assertThat(response.isWebSearchEnabled()).isTrue();
        assertThat(response.getWebSearchSources()).containsExactly(source);
        assertThat(response.getSearchCallsMade()).isEqualTo(1);
        assertThat(response.getWebSearchError()).isNull();
        ArgumentCaptor<GenerationContext> context = ArgumentCaptor.forClass(GenerationContext.class);
        verify(clients.get(ProviderId.CLAUDE)).generate(eq("What is Rust?"), context.capture());
        assertThat(context.getValue().getSearchResult()).isSameAs(searchResult);
    }

    @Test
    void shouldContinueWithoutSearchContextWhenSearchFails() {
        when(searchCoordinator.searchForQuery(eq("What is Rust?"), eq("alice"), isNull()))
            .thenReturn(SearchResult.failure("What is Rust?", ErrorType.TIMEOUT, "Web search timed out after 15000ms", 0));

        ConsensusResponse response = orchestrator.run(ConsensusQuery.builder()
            .message("What is Rust?")
            .services(List.of("claude"))
            .useWebSearch(true)
            .userId("alice")
            .build());

        assertThat(response.getResults().get(0).isSuccess()).isTrue();
        assertThat(response.getWebSearchSources()).isEmpty();
        assertThat(response.getWebSearchError()).isEqualTo("Web search timed out after 15000ms");
        ArgumentCaptor<GenerationContext> context = ArgumentCaptor.forClass(GenerationContext.class);
        verify(clients.get(ProviderId.CLAUDE)).generate(anyString(), context.capture());
        assertThat(context.getValue().hasSearchContext()).isFalse();
    }

    @Test
    void shouldEmbedHistory() {
        orchestrator.run(ConsensusQuery.builder()
            .message("Which one is fastest?")
            .services(List.of("claude"))
            .chatHistory("we discussed garbage collectors")
            .build());
        orchestrator.run(ConsensusQuery.builder()
            .message("And Go?")
            .services(List.of("openai"))
            .chatHistory("User: What is Rust?\nAssistant: A systems language.")
            .build());

        verify(clients.get(ProviderId.CLAUDE)).generate(
            eq("Previous conversation:\nwe discussed garbage collectors\n\nCurrent question: Which one is fastest?"),
            any(GenerationContext.class));
        ArgumentCaptor<GenerationContext> context = ArgumentCaptor.forClass(GenerationContext.class);
        verify(clients.get(ProviderId.OPENAI)).generate(eq("And Go?"), context.capture());
        assertThat(context.getValue().getHistory()).hasSize(2);
    }

    @Test
    void shouldTimeOutSlowProvider() {
        properties.setProviderTimeoutMs(200);
        when(clients.get(ProviderId.OPENAI).generate(anyString(), any(GenerationContext.class)))
            .thenAnswer(invocation -> sleepUntilInterrupted(ProviderId.OPENAI));

        ConsensusResponse response = orchestrator.run(query("What is Rust?", List.of("claude", "openai")));

        assertThat(response.getResults().get(0).isSuccess()).isTrue();
        ProviderResult openai = response.getResults().get(1);
        assertThat(openai.getErrorType()).isEqualTo(ErrorType.TIMEOUT);
        assertThat(openai.getResponseTimeMs()).isEqualTo(200);
    }

    @Test
    void shouldKeepGenerationWhenSynopsisOutlivesProviderTimeout() {
        properties.setProviderTimeoutMs(500);
        properties.setSynopsisTimeoutMs(300);
        when(synopsisGenerator.summarize(anyString(), eq(ProviderId.CLAUDE), any(ProviderSettings.class)))
            .thenAnswer(invocation -> {
                Thread.sleep(1500);
                return new SynopsisResult("too late", Map.of(), true, true, null);
            });

        ConsensusResponse response = orchestrator.run(query("What is Rust?", List.of("claude")));

        ProviderResult claude = response.getResults().get(0);
        assertThat(claude.isSuccess()).isTrue();
        assertThat(claude.getErrorType()).isNull();
        assertThat(claude.getContent()).isEqualTo("Claude answer");
        assertThat(claude.getTokensUsed()).isEqualTo(150);
        assertThat(claude.getSynopsis()).isEqualTo(SynopsisGenerator.fallbackSynopsis("Claude answer"));
        assertThat(response.getTotalTokens()).isEqualTo(150);
        ArgumentCaptor<UsageRecord> usage = ArgumentCaptor.forClass(UsageRecord.class);
        verify(recorder, times(2)).recordUsage(usage.capture());
        assertThat(usage.getAllValues())
            .filteredOn(record -> UsageRecord.MAIN_RESPONSE_LABEL.equals(record.getSummaryLabel()))
            .singleElement()
            .satisfies(record -> assertThat(record.getTotalTokens()).isEqualTo(150));
        assertThat(usage.getAllValues())
            .filteredOn(record -> UsageRecord.SYNOPSIS_LABEL.equals(record.getSummaryLabel()))
            .singleElement()
            .satisfies(record -> assertThat(record.isSuccess()).isFalse());
    }

    @Test
    void shouldCancelInFlightProviders() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(clients.get(ProviderId.CLAUDE).generate(anyString(), any(GenerationContext.class)))
            .thenAnswer(invocation -> {
                started.countDown();
                return sleepUntilInterrupted(ProviderId.CLAUDE);
            });

        QueryExecution execution = orchestrator.submit(query("What is Rust?", List.of("claude")));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        execution.cancel();
        ConsensusResponse response = execution.await(5, TimeUnit.SECONDS);

        assertThat(execution.isCancelled()).isTrue();
        assertThat(execution.getState()).isEqualTo(QueryState.CANCELLED);
        assertThat(response.getState()).isEqualTo(QueryState.CANCELLED);
        assertThat(response.getResults().get(0).getErrorType()).isEqualTo(ErrorType.CANCELLED);
        verify(synopsisGenerator, never()).summarize(anyString(), any(ProviderId.class), any(ProviderSettings.class));
    }

    @Test
    void shouldCancelDuringSearchPhase() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(searchCoordinator.searchForQuery(anyString(), anyString(), any())).thenAnswer(invocation -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException ex) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return SearchResult.failure("What is Rust?", ErrorType.CANCELLED, "Web search cancelled", 0);
        });

        QueryExecution execution = orchestrator.submit(ConsensusQuery.builder()
            .message("What is Rust?")
            .services(List.of("claude", "openai"))
            .useWebSearch(true)
            .build());
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(execution.getState()).isEqualTo(QueryState.SEARCH_PHASE);
        execution.cancel();
        ConsensusResponse response = execution.await(5, TimeUnit.SECONDS);

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(response.getState()).isEqualTo(QueryState.CANCELLED);
        assertThat(response.getResults()).extracting(ProviderResult::getErrorType)
            .containsOnly(ErrorType.CANCELLED);
        verify(clientFactory, never()).create(any(ProviderId.class), any(ProviderSettings.class));
    }

    @Test
    void shouldCompleteSubmittedQuery() throws Exception {
        QueryExecution execution = orchestrator.submit(query("What is Rust?", List.of("gemini")));

        ConsensusResponse response = execution.await(5, TimeUnit.SECONDS);

        assertThat(execution.isDone()).isTrue();
        assertThat(response.getQueryId()).isEqualTo(execution.getQueryId());
        assertThat(response.getResults().get(0).getTokensUsed()).isEqualTo(30);
        execution.cancel();
        assertThat(execution.isCancelled()).isFalse();
    }

    private ProviderResponse sleepUntilInterrupted(ProviderId providerId) {
        try {
            Thread.sleep(10_000);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        return ProviderResponse.failure(providerId, ErrorType.CANCELLED, "interrupted");
    }

    private ConsensusQuery query(String message, List<String> services) {
        return ConsensusQuery.builder().message(message).services(services).build();
    }

    private ProviderSettings settings(ProviderId providerId) {
        return ProviderSettings.defaults(providerId).toBuilder().apiKey("key-" + providerId.getValue()).build();
    }

}
