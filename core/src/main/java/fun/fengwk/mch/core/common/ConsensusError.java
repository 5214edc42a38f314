package fun.fengwk.mch.core.common;

import lombok.Value;

/**
 * Typed failure carried inside provider and search results.
 *
 * @author fengwk
 */
@Value
public class ConsensusError {

    ErrorType type;
    String message;

    public static ConsensusError of(ErrorType type, String message) {
        return new ConsensusError(type, message);
    }

}
