package fun.fengwk.mch.core.service.token;

import fun.fengwk.mch.core.facade.provider.ProviderId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Maps provider specific usage metadata onto {@link TokenUsage}.
 *
 * <p>Pure and total: unknown providers, missing or malformed metadata all yield {@link TokenUsage#ZERO}.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class TokenAccountant {

    public TokenUsage extract(Map<String, Object> metadata, String providerId) {
        ProviderId id = ProviderId.fromValue(providerId);
        if (id == null) {
            log.debug("token extraction skipped for unknown provider, provider={}", providerId);
            return TokenUsage.ZERO;
        }
        return extract(metadata, id);
    }

    public TokenUsage extract(Map<String, Object> metadata, ProviderId providerId) {
        if (metadata == null || providerId == null || !(metadata.get("usage") instanceof Map<?, ?> usage)) {
            return TokenUsage.ZERO;
        }
        switch (providerId) {
            case CLAUDE:
                return new TokenUsage(count(usage, "input_tokens"), count(usage, "output_tokens"));
            case OPENAI:
                return new TokenUsage(count(usage, "prompt_tokens"), count(usage, "completion_tokens"));
            case GEMINI:
                return new TokenUsage(
                    count(usage, "promptTokenCount", "prompt_token_count"),
                    count(usage, "candidatesTokenCount", "candidates_token_count"));
            default:
                return TokenUsage.ZERO;
        }
    }

    private long count(Map<?, ?> usage, String key, String fallbackKey) {
        return usage.containsKey(key) ? count(usage, key) : count(usage, fallbackKey);
    }

    private long count(Map<?, ?> usage, String key) {
        Object value = usage.get(key);
        if (value instanceof Number number) {
            return Math.max(0L, number.longValue());
        }
        if (value instanceof String text) {
            try {
                return Math.max(0L, Long.parseLong(text.trim()));
            } catch (NumberFormatException ex) {
                log.debug("non numeric token count ignored, key={}, value={}", key, value);
            }
        }
        return 0L;
    }

}
