package fun.fengwk.mch.core.service.credential;

import fun.fengwk.mch.core.facade.provider.ProviderId;
import fun.fengwk.mch.core.facade.provider.ProviderSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
class PropertiesCredentialSourceTest {

    @Test
    void shouldSkipProviderWithoutKey() {
        ProviderProperties properties = new ProviderProperties();
        properties.getOpenai().setApiKey(" ");

        PropertiesCredentialSource source = new PropertiesCredentialSource(properties);

        assertThat(source.find(ProviderId.OPENAI)).isEmpty();
        assertThat(source.find(ProviderId.CLAUDE)).isEmpty();
    }

    @Test
    void shouldFillMissingFieldsFromDefaults() {
        ProviderProperties properties = new ProviderProperties();
        properties.setClaude(ProviderSettings.builder().apiKey(" sk-ant-key ").model("claude-3-5-sonnet-20241022").build());

        ProviderSettings settings = new PropertiesCredentialSource(properties).find(ProviderId.CLAUDE).orElseThrow();
        ProviderSettings defaults = ProviderSettings.defaults(ProviderId.CLAUDE);

        assertThat(settings.getApiKey()).isEqualTo("sk-ant-key");
        assertThat(settings.getModel()).isEqualTo("claude-3-5-sonnet-20241022");
        assertThat(settings.getBaseUrl()).isEqualTo(defaults.getBaseUrl());
        assertThat(settings.getMaxTokens()).isEqualTo(defaults.getMaxTokens());
        assertThat(settings.getTimeoutMs()).isEqualTo(defaults.getTimeoutMs());
        assertThat(settings.getInputCostPer1k()).isEqualByComparingTo(defaults.getInputCostPer1k());
    }

}
