package fun.fengwk.mch.core.common;

/**
 * Request-level validation failure, surfaced to the caller instead of a result set.
 *
 * @author fengwk
 */
public class ConsensusRequestException extends RuntimeException {

    public ConsensusRequestException(String message) {
        super(message);
    }

    public ConsensusRequestException(String message, Throwable cause) {
        super(message, cause);
    }

}
