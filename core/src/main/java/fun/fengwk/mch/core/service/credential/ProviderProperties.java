package fun.fengwk.mch.core.service.credential;

import fun.fengwk.mch.core.facade.provider.ProviderId;
import fun.fengwk.mch.core.facade.provider.ProviderSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Provider credentials, models and pricing.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mch.provider")
public class ProviderProperties {

    private ProviderSettings claude = ProviderSettings.defaults(ProviderId.CLAUDE);

    private ProviderSettings openai = ProviderSettings.defaults(ProviderId.OPENAI);

    private ProviderSettings gemini = ProviderSettings.defaults(ProviderId.GEMINI);

    public ProviderSettings get(ProviderId providerId) {
        switch (providerId) {
            case CLAUDE:
                return claude;
            case OPENAI:
                return openai;
            case GEMINI:
                return gemini;
            default:
                throw new IllegalArgumentException("unsupported provider: " + providerId);
        }
    }

}
