package fun.fengwk.mch.core.common;

/**
 * Failure categories shared by provider and search calls.
 *
 * @author fengwk
 */
public enum ErrorType {

    /**
     * Credential missing or malformed, no network call was made.
     */
    INVALID_CREDENTIAL,

    /**
     * Non-2xx response or network failure talking to an upstream API.
     */
    UPSTREAM_HTTP_ERROR,

    /**
     * Deadline elapsed before the call completed.
     */
    TIMEOUT,

    /**
     * Upstream 429 or the local per-user search budget is exhausted.
     */
    RATE_LIMITED,

    /**
     * Upstream response did not have the expected shape.
     */
    PARSE_ERROR,

    /**
     * The caller cancelled the query.
     */
    CANCELLED,

    /**
     * Anything else raised inside a fan-out task.
     */
    UNEXPECTED

}
