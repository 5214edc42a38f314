package fun.fengwk.mch.core.service;

import fun.fengwk.mch.core.service.model.ConsensusToolResponse;

/**
 * @author fengwk
 */
public interface ConsensusMcpService {

    ConsensusToolResponse consensus(String message, String services, Boolean useWebSearch, String chatHistory,
                                    String conversationId, String city, String region, String country);

}
