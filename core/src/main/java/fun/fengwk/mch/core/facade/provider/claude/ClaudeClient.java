package fun.fengwk.mch.core.facade.provider.claude;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fun.fengwk.mch.core.common.ErrorType;
import fun.fengwk.mch.core.facade.provider.AbstractProviderClient;
import fun.fengwk.mch.core.facade.provider.CitationMode;
import fun.fengwk.mch.core.facade.provider.ProviderId;
import fun.fengwk.mch.core.facade.provider.ProviderPromptUtils;
import fun.fengwk.mch.core.facade.provider.ProviderSettings;
import fun.fengwk.mch.core.facade.provider.model.ChatMessage;
import fun.fengwk.mch.core.facade.provider.model.GenerationContext;
import fun.fengwk.mch.core.facade.provider.model.ProviderResponse;
import fun.fengwk.mch.core.facade.search.model.SearchSource;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Anthropic messages API client.
 *
 * <p>Search sources are sent as document blocks with citations enabled unless the settings ask for inline text.
 *
 * @author fengwk
 */
public class ClaudeClient extends AbstractProviderClient {

    static final String MESSAGES_PATH = "/v1/messages";
    static final String API_VERSION = "2023-06-01";

    public ClaudeClient(ProviderSettings settings, HttpClient httpClient, ObjectMapper objectMapper) {
        super(settings, httpClient, objectMapper);
    }

    @Override
    public ProviderId getProviderId() {
        return ProviderId.CLAUDE;
    }

    @Override
    protected CitationMode defaultCitationMode() {
        return CitationMode.DOCUMENT_BLOCKS;
    }

    @Override
    protected Set<CitationMode> supportedCitationModes() {
        return EnumSet.allOf(CitationMode.class);
    }

    @Override
    public boolean isCredentialValid() {
        return settings.getApiKey() != null && settings.getApiKey().startsWith("sk-ant-");
    }

    @Override
    protected HttpRequest buildRequest(String prompt, GenerationContext context) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", settings.getModel());
        body.put("max_tokens", resolveMaxTokens(context));
        body.put("temperature", context.getTemperature());
        if (StringUtils.hasText(context.getSystemPrompt())) {
            body.put("system", context.getSystemPrompt());
        }

        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : context.getHistory()) {
            ObjectNode item = messages.addObject();
            item.put("role", message.isAssistant() ? ChatMessage.ROLE_ASSISTANT : ChatMessage.ROLE_USER);
            item.put("content", message.getContent());
        }

        ObjectNode userMessage = messages.addObject();
        userMessage.put("role", ChatMessage.ROLE_USER);
        if (getCitationMode() == CitationMode.DOCUMENT_BLOCKS
            && context.hasSearchContext() && context.getSearchResult().hasSources()) {
            userMessage.set("content", buildDocumentBlocks(prompt, context.getSearchResult().getSources()));
        } else {
            userMessage.put("content", ProviderPromptUtils.inlineSearchPrompt(prompt, context));
        }

        return jsonPost(URI.create(baseUrl() + MESSAGES_PATH), body)
            .header("x-api-key", settings.getApiKey())
            .header("anthropic-version", API_VERSION)
            .build();
    }

    @Override
    protected ProviderResponse parseResponse(JsonNode root) {
        JsonNode blocks = root.path("content");
        if (!blocks.isArray() || blocks.isEmpty()) {
            return ProviderResponse.failure(ProviderId.CLAUDE, ErrorType.PARSE_ERROR,
                "Failed to parse Claude response: no content blocks");
        }
        StringBuilder content = new StringBuilder();
        for (JsonNode block : blocks) {
            // Citation responses split text into several blocks.
            if ("text".equals(block.path("type").asText("text")) && block.has("text")) {
                content.append(block.get("text").asText());
            }
        }
        return ProviderResponse.success(ProviderId.CLAUDE, content.toString(),
            usageMetadata(root.get("usage"), "stop_reason", root.get("stop_reason")));
    }

    private ArrayNode buildDocumentBlocks(String prompt, List<SearchSource> sources) {
        ArrayNode blocks = objectMapper.createArrayNode();
        ObjectNode question = blocks.addObject();
        question.put("type", "text");
        question.put("text", ProviderPromptUtils.documentQuestion(prompt));

        int limit = Math.min(sources.size(), ProviderPromptUtils.MAX_DOCUMENT_SOURCES);
        for (int i = 0; i < limit; i++) {
            ObjectNode document = blocks.addObject();
            document.put("type", "document");
            ObjectNode source = document.putObject("source");
            source.put("type", "text");
            source.put("media_type", "text/plain");
            source.put("data", ProviderPromptUtils.documentText(sources.get(i)));
            document.putObject("citations").put("enabled", true);
        }
        return blocks;
    }

}
