package fun.fengwk.mch.core.service.credential;

import fun.fengwk.mch.core.facade.provider.ProviderId;
import fun.fengwk.mch.core.facade.provider.ProviderSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Credential source backed by {@code mch.provider.*} properties.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class PropertiesCredentialSource implements CredentialSource {

    private final ProviderProperties providerProperties;

    @Override
    public Optional<ProviderSettings> find(ProviderId providerId) {
        ProviderSettings configured = providerProperties.get(providerId);
        if (configured == null || !StringUtils.hasText(configured.getApiKey())) {
            return Optional.empty();
        }
        return Optional.of(withDefaults(providerId, configured));
    }

    private ProviderSettings withDefaults(ProviderId providerId, ProviderSettings configured) {
        ProviderSettings defaults = ProviderSettings.defaults(providerId);
        return configured.toBuilder()
            .apiKey(configured.getApiKey().trim())
            .model(StringUtils.hasText(configured.getModel()) ? configured.getModel() : defaults.getModel())
            .baseUrl(StringUtils.hasText(configured.getBaseUrl()) ? configured.getBaseUrl() : defaults.getBaseUrl())
            .maxTokens(configured.getMaxTokens() > 0 ? configured.getMaxTokens() : defaults.getMaxTokens())
            .timeoutMs(configured.getTimeoutMs() > 0 ? configured.getTimeoutMs() : defaults.getTimeoutMs())
            .inputCostPer1k(configured.getInputCostPer1k() != null
                ? configured.getInputCostPer1k() : defaults.getInputCostPer1k())
            .outputCostPer1k(configured.getOutputCostPer1k() != null
                ? configured.getOutputCostPer1k() : defaults.getOutputCostPer1k())
            .build();
    }

}
