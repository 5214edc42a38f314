package fun.fengwk.mch.core.facade.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Connection, model and pricing settings for one provider.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProviderSettings {

    /**
     * API credential, blank means the provider is unavailable.
     */
    private String apiKey;

    /**
     * Default model identifier.
     */
    private String model;

    /**
     * API base url without trailing path.
     */
    private String baseUrl;

    /**
     * Output token cap.
     */
    private int maxTokens;

    /**
     * Per-request timeout in milliseconds.
     */
    private long timeoutMs;

    /**
     * Price per 1k input tokens.
     */
    private BigDecimal inputCostPer1k;

    /**
     * Price per 1k output tokens.
     */
    private BigDecimal outputCostPer1k;

    /**
     * How web search context is sent, null keeps the provider default.
     */
    private CitationMode citationMode;

    public static ProviderSettings defaults(ProviderId providerId) {
        switch (providerId) {
            case CLAUDE:
                return ProviderSettings.builder()
                    .model("claude-3-haiku-20240307")
                    .baseUrl("https://api.anthropic.com")
                    .maxTokens(4096)
                    .timeoutMs(60000)
                    .inputCostPer1k(new BigDecimal("0.003"))
                    .outputCostPer1k(new BigDecimal("0.015"))
                    .build();
            case OPENAI:
                return ProviderSettings.builder()
                    .model("gpt-4o")
                    .baseUrl("https://api.openai.com")
                    .maxTokens(4096)
                    .timeoutMs(60000)
                    .inputCostPer1k(new BigDecimal("0.005"))
                    .outputCostPer1k(new BigDecimal("0.015"))
                    .build();
            case GEMINI:
                return ProviderSettings.builder()
                    .model("gemini-1.5-flash")
                    .baseUrl("https://generativelanguage.googleapis.com")
                    .maxTokens(1000)
                    .timeoutMs(30000)
                    .inputCostPer1k(new BigDecimal("0.001"))
                    .outputCostPer1k(new BigDecimal("0.002"))
                    .build();
            default:
                throw new IllegalArgumentException("unsupported provider: " + providerId);
        }
    }

}
