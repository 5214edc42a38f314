package fun.fengwk.mch.core.facade.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fun.fengwk.mch.core.common.ErrorType;
import fun.fengwk.mch.core.facade.provider.model.GenerationContext;
import fun.fengwk.mch.core.facade.provider.model.ProviderResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Base provider client: credential check, HTTP round trip and error mapping.
 *
 * <p>Subclasses only build the provider specific request body and parse a successful response body.
 * Every failure is converted into a {@link ProviderResponse} failure, nothing escapes {@link #generate}.
 *
 * @author fengwk
 */
public abstract class AbstractProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(AbstractProviderClient.class);

    private static final int MAX_ERROR_BODY_LENGTH = 300;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    protected final ProviderSettings settings;
    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected AbstractProviderClient(ProviderSettings settings, HttpClient httpClient, ObjectMapper objectMapper) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderResponse generate(String prompt, GenerationContext context) {
        ProviderId providerId = getProviderId();
        if (!isCredentialValid()) {
            log.warn("provider credential rejected before call, provider={}", providerId.getValue());
            return ProviderResponse.failure(providerId, ErrorType.INVALID_CREDENTIAL,
                "Invalid " + providerId.getDisplayName() + " API key");
        }
        GenerationContext actualContext = context == null ? GenerationContext.empty() : context;

        try {
            HttpRequest request = buildRequest(prompt, actualContext);
            HttpResponse<String> response = httpClient.send(request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int statusCode = response.statusCode();
            if (statusCode < 200 || statusCode >= 300) {
                return mapHttpError(statusCode, response.body());
            }
            if (!StringUtils.hasText(response.body())) {
                return ProviderResponse.failure(providerId, ErrorType.PARSE_ERROR,
                    providerId.getDisplayName() + " returned an empty response body");
            }
            return parseResponse(objectMapper.readTree(response.body()));
        } catch (HttpTimeoutException ex) {
            log.warn("provider call timed out, provider={}, timeoutMs={}", providerId.getValue(), settings.getTimeoutMs());
            return ProviderResponse.failure(providerId, ErrorType.TIMEOUT,
                providerId.getDisplayName() + " request timed out after " + settings.getTimeoutMs() + "ms");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("provider call interrupted, provider={}", providerId.getValue());
            return ProviderResponse.failure(providerId, ErrorType.CANCELLED,
                providerId.getDisplayName() + " request cancelled");
        } catch (JsonProcessingException ex) {
            log.warn("provider response is not valid json, provider={}, error={}", providerId.getValue(), ex.getMessage());
            return ProviderResponse.failure(providerId, ErrorType.PARSE_ERROR,
                "Failed to parse " + providerId.getDisplayName() + " response: " + ex.getOriginalMessage());
        } catch (IOException ex) {
            log.warn("provider network error, provider={}, error={}", providerId.getValue(), ex.getMessage());
            return ProviderResponse.failure(providerId, ErrorType.UPSTREAM_HTTP_ERROR,
                "Network error: " + ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("provider call failed unexpectedly, provider={}, error={}", providerId.getValue(), ex.getMessage(), ex);
            return ProviderResponse.failure(providerId, ErrorType.UNEXPECTED,
                "Unexpected error: " + ex.getMessage());
        }
    }

    /**
     * The configured mode when this provider supports it, otherwise {@link #defaultCitationMode()}.
     */
    @Override
    public CitationMode getCitationMode() {
        CitationMode configured = settings.getCitationMode();
        if (configured != null && supportedCitationModes().contains(configured)) {
            return configured;
        }
        return defaultCitationMode();
    }

    protected abstract CitationMode defaultCitationMode();

    protected Set<CitationMode> supportedCitationModes() {
        return EnumSet.of(CitationMode.INLINE_TEXT);
    }

    /**
     * Build the provider specific HTTP request.
     */
    protected abstract HttpRequest buildRequest(String prompt, GenerationContext context) throws JsonProcessingException;

    /**
     * Parse a 2xx response body.
     */
    protected abstract ProviderResponse parseResponse(JsonNode root);

    protected HttpRequest.Builder jsonPost(URI uri, ObjectNode body) throws JsonProcessingException {
        return HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofMillis(Math.max(1L, settings.getTimeoutMs())))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8));
    }

    protected String baseUrl() {
        String baseUrl = settings.getBaseUrl() == null ? "" : settings.getBaseUrl().trim();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl;
    }

    protected int resolveMaxTokens(GenerationContext context) {
        Integer override = context.getMaxTokens();
        return override != null && override > 0 ? override : settings.getMaxTokens();
    }

    /**
     * Raw usage metadata in the shape the token accountant expects.
     */
    protected Map<String, Object> usageMetadata(JsonNode usage, String stopKey, JsonNode stopValue) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("model", settings.getModel());
        metadata.put("usage", usage == null || !usage.isObject()
            ? Collections.emptyMap()
            : objectMapper.convertValue(usage, MAP_TYPE));
        metadata.put(stopKey, stopValue == null || stopValue.isNull() ? null : stopValue.asText());
        return metadata;
    }

    protected static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }

    private ProviderResponse mapHttpError(int statusCode, String body) {
        ProviderId providerId = getProviderId();
        String detail = extractErrorMessage(body);
        log.warn("provider returned error status, provider={}, status={}, error={}",
            providerId.getValue(), statusCode, detail);
        ErrorType type = statusCode == 429 ? ErrorType.RATE_LIMITED : ErrorType.UPSTREAM_HTTP_ERROR;
        return ProviderResponse.failure(providerId, type,
            providerId.getDisplayName() + " API error " + statusCode + ": " + detail);
    }

    private String extractErrorMessage(String body) {
        if (!StringUtils.hasText(body)) {
            return "Unknown error";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode error = root.path("error");
            String message = error.isObject() ? textOrNull(error.get("message")) : textOrNull(error);
            if (StringUtils.hasText(message)) {
                return message;
            }
        } catch (JsonProcessingException ex) {
            log.debug("error body is not json, provider={}", getProviderId().getValue());
        }
        return ProviderPromptUtils.abbreviate(body, MAX_ERROR_BODY_LENGTH);
    }

}
