package fun.fengwk.mch.core.service.orchestrator;

/**
 * @author fengwk
 */
public enum QueryState {

    PENDING,
    SEARCH_PHASE,
    FAN_OUT,
    AGGREGATED,
    CANCELLED

}
