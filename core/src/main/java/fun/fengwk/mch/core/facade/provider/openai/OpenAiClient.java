package fun.fengwk.mch.core.facade.provider.openai;

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
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;

/**
 * OpenAI chat completions client.
 *
 * @author fengwk
 */
public class OpenAiClient extends AbstractProviderClient {

    static final String COMPLETIONS_PATH = "/v1/chat/completions";

    public OpenAiClient(ProviderSettings settings, HttpClient httpClient, ObjectMapper objectMapper) {
        super(settings, httpClient, objectMapper);
    }

    @Override
    public ProviderId getProviderId() {
        return ProviderId.OPENAI;
    }

    @Override
    protected CitationMode defaultCitationMode() {
        return CitationMode.INLINE_TEXT;
    }

    @Override
    public boolean isCredentialValid() {
        return settings.getApiKey() != null && settings.getApiKey().startsWith("sk-");
    }

    @Override
    protected HttpRequest buildRequest(String prompt, GenerationContext context) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", settings.getModel());
        body.put("max_tokens", resolveMaxTokens(context));
        body.put("temperature", context.getTemperature());

        ArrayNode messages = body.putArray("messages");
        if (StringUtils.hasText(context.getSystemPrompt())) {
            ObjectNode system = messages.addObject();
            system.put("role", "system");
            system.put("content", context.getSystemPrompt());
        }
        for (ChatMessage message : context.getHistory()) {
            ObjectNode item = messages.addObject();
            item.put("role", message.isAssistant() ? ChatMessage.ROLE_ASSISTANT : ChatMessage.ROLE_USER);
            item.put("content", message.getContent());
        }
        ObjectNode userMessage = messages.addObject();
        userMessage.put("role", ChatMessage.ROLE_USER);
        userMessage.put("content", ProviderPromptUtils.inlineSearchPrompt(prompt, context));

        return jsonPost(URI.create(baseUrl() + COMPLETIONS_PATH), body)
            .header("Authorization", "Bearer " + settings.getApiKey())
            .build();
    }

    @Override
    protected ProviderResponse parseResponse(JsonNode root) {
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return ProviderResponse.failure(ProviderId.OPENAI, ErrorType.PARSE_ERROR, "No response choices returned");
        }
        JsonNode firstChoice = choices.get(0);
        JsonNode message = firstChoice.path("message");
        if (!message.isObject()) {
            return ProviderResponse.failure(ProviderId.OPENAI, ErrorType.PARSE_ERROR,
                "Failed to parse OpenAI response: choice has no message");
        }
        String content = textOrNull(message.get("content"));
        return ProviderResponse.success(ProviderId.OPENAI, content == null ? "" : content,
            usageMetadata(root.get("usage"), "finish_reason", firstChoice.get("finish_reason")));
    }

}
