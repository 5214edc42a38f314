package fun.fengwk.mch.core.facade.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mch.core.facade.provider.claude.ClaudeClient;
import fun.fengwk.mch.core.facade.provider.gemini.GeminiClient;
import fun.fengwk.mch.core.facade.provider.openai.OpenAiClient;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds provider clients from a static provider to constructor table.
 *
 * @author fengwk
 */
@Component
public class ProviderClientFactory {

    private static final Map<ProviderId, ClientConstructor> CONSTRUCTORS;

    static {
        Map<ProviderId, ClientConstructor> constructors = new EnumMap<>(ProviderId.class);
        constructors.put(ProviderId.CLAUDE, ClaudeClient::new);
        constructors.put(ProviderId.OPENAI, OpenAiClient::new);
        constructors.put(ProviderId.GEMINI, GeminiClient::new);
        CONSTRUCTORS = Collections.unmodifiableMap(constructors);
    }

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ProviderClientFactory(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public ProviderClient create(ProviderId providerId, ProviderSettings settings) {
        ClientConstructor constructor = CONSTRUCTORS.get(Objects.requireNonNull(providerId, "providerId"));
        if (constructor == null) {
            throw new IllegalArgumentException("unsupported provider: " + providerId);
        }
        return constructor.create(settings, httpClient, objectMapper);
    }

    @FunctionalInterface
    interface ClientConstructor {

        ProviderClient create(ProviderSettings settings, HttpClient httpClient, ObjectMapper objectMapper);

    }

}
