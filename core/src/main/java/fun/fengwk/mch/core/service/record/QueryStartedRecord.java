package fun.fengwk.mch.core.service.record;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Emitted once per query before any provider call.
 *
 * @author fengwk
 */
@Value
@Builder
public class QueryStartedRecord {

    String queryId;
    String conversationId;
    String userId;
    String message;
    List<String> providerIds;
    boolean webSearchEnabled;
    String timestamp;

}
