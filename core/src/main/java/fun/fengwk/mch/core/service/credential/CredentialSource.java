package fun.fengwk.mch.core.service.credential;

import fun.fengwk.mch.core.facade.provider.ProviderId;
import fun.fengwk.mch.core.facade.provider.ProviderSettings;

import java.util.Optional;

/**
 * Supplies provider credentials and default models.
 *
 * @author fengwk
 */
public interface CredentialSource {

    /**
     * @return settings with a credential, or empty when the provider is unavailable.
     */
    Optional<ProviderSettings> find(ProviderId providerId);

}
