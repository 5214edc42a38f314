package fun.fengwk.mch.core.service.synopsis;

import fun.fengwk.mch.core.common.ConsensusError;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Synopsis text plus the usage metadata of the call that produced it.
 *
 * @author fengwk
 */
@Value
public class SynopsisResult {

    String synopsis;

    /**
     * Raw usage metadata, empty when no call succeeded.
     */
    Map<String, Object> metadata;

    boolean success;

    /**
     * Whether a provider call was made, successful or not.
     */
    boolean called;

    ConsensusError error;

    static SynopsisResult success(String synopsis, Map<String, Object> metadata) {
        return new SynopsisResult(synopsis, metadata == null ? Collections.emptyMap() : metadata, true, true, null);
    }

    static SynopsisResult fallback(String synopsis, boolean called, ConsensusError error) {
        return new SynopsisResult(synopsis, Collections.emptyMap(), false, called, error);
    }

}
