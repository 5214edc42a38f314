package fun.fengwk.mch.core.facade.provider.model;

import fun.fengwk.mch.core.common.ConsensusError;
import fun.fengwk.mch.core.common.ErrorType;
import fun.fengwk.mch.core.facade.provider.ProviderId;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;

/**
 * Outcome of one generation call: content plus raw usage metadata, or a typed error.
 *
 * @author fengwk
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProviderResponse {

    private final ProviderId providerId;
    private final boolean success;
    private final String content;
    private final Map<String, Object> metadata;
    private final ConsensusError error;

    public static ProviderResponse success(ProviderId providerId, String content, Map<String, Object> metadata) {
        return new ProviderResponse(providerId, true, content,
            metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(metadata), null);
    }

    public static ProviderResponse failure(ProviderId providerId, ErrorType type, String message) {
        return new ProviderResponse(providerId, false, null, Collections.emptyMap(), ConsensusError.of(type, message));
    }

}
