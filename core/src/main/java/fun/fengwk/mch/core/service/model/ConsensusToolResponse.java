package fun.fengwk.mch.core.service.model;

import fun.fengwk.mch.core.service.orchestrator.model.ConsensusResponse;
import lombok.Value;

/**
 * Consensus response or the request-level error that prevented it.
 *
 * @author fengwk
 */
@Value
public class ConsensusToolResponse {

    ConsensusResponse response;

    String error;

    public static ConsensusToolResponse of(ConsensusResponse response) {
        return new ConsensusToolResponse(response, null);
    }

    public static ConsensusToolResponse error(String error) {
        return new ConsensusToolResponse(null, error);
    }

}
