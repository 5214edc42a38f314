package fun.fengwk.mch.core.service.search;

/**
 * Per-user search budget.
 *
 * @author fengwk
 */
public interface SearchRateLimiter {

    /**
     * Whether the user still has budget left in the current window. Does not consume budget.
     */
    boolean isAllowed(String userId);

    /**
     * Charge search calls to the user.
     */
    void record(String userId, int calls);

}
