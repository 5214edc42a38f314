package fun.fengwk.mch.core.facade.provider;

import fun.fengwk.mch.core.facade.provider.model.GenerationContext;
import fun.fengwk.mch.core.facade.provider.model.ProviderResponse;

/**
 * Uniform contract over an AI text-generation backend.
 *
 * @author fengwk
 */
public interface ProviderClient {

    ProviderId getProviderId();

    /**
     * How this provider consumes web search context.
     */
    CitationMode getCitationMode();

    /**
     * Local credential format check, never calls the network.
     */
    boolean isCredentialValid();

    /**
     * Generate a completion. Failures are returned, never thrown.
     */
    ProviderResponse generate(String prompt, GenerationContext context);

}
