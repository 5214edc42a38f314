package fun.fengwk.mch.core.facade.provider.gemini;

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
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;

/**
 * Google Gemini generateContent client.
 *
 * @author fengwk
 */
public class GeminiClient extends AbstractProviderClient {

    static final String MODELS_PATH = "/v1beta/models/";

    public GeminiClient(ProviderSettings settings, HttpClient httpClient, ObjectMapper objectMapper) {
        super(settings, httpClient, objectMapper);
    }

    @Override
    public ProviderId getProviderId() {
        return ProviderId.GEMINI;
    }

    @Override
    protected CitationMode defaultCitationMode() {
        return CitationMode.INLINE_TEXT;
    }

    @Override
    public boolean isCredentialValid() {
        return settings.getApiKey() != null && settings.getApiKey().length() > 10;
    }

    @Override
    protected HttpRequest buildRequest(String prompt, GenerationContext context) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        if (StringUtils.hasText(context.getSystemPrompt())) {
            body.putObject("systemInstruction").putArray("parts").addObject().put("text", context.getSystemPrompt());
        }

        ArrayNode contents = body.putArray("contents");
        for (ChatMessage message : context.getHistory()) {
            ObjectNode item = contents.addObject();
            item.put("role", message.isAssistant() ? "model" : "user");
            item.putArray("parts").addObject().put("text", message.getContent());
        }
        ObjectNode userTurn = contents.addObject();
        userTurn.put("role", "user");
        userTurn.putArray("parts").addObject().put("text", ProviderPromptUtils.inlineSearchPrompt(prompt, context));

        ObjectNode generationConfig = body.putObject("generationConfig");
        generationConfig.put("temperature", context.getTemperature());
        generationConfig.put("maxOutputTokens", resolveMaxTokens(context));
        generationConfig.put("topP", 0.8);
        generationConfig.put("topK", 10);

        String uri = baseUrl() + MODELS_PATH + settings.getModel() + ":generateContent?key="
            + URLEncoder.encode(settings.getApiKey(), StandardCharsets.UTF_8);
        return jsonPost(URI.create(uri), body).build();
    }

    @Override
    protected ProviderResponse parseResponse(JsonNode root) {
        JsonNode candidate = root.path("candidates").path(0);
        JsonNode text = candidate.path("content").path("parts").path(0).path("text");
        if (candidate.isMissingNode() || text.isMissingNode() || text.isNull()) {
            String blockReason = textOrNull(root.path("promptFeedback").get("blockReason"));
            String reason = blockReason == null ? "no candidate text" : "prompt blocked, reason=" + blockReason;
            return ProviderResponse.failure(ProviderId.GEMINI, ErrorType.PARSE_ERROR,
                "Failed to parse Gemini response: " + reason);
        }
        return ProviderResponse.success(ProviderId.GEMINI, text.asText().trim(),
            usageMetadata(root.get("usageMetadata"), "finish_reason", candidate.get("finishReason")));
    }

}
