package fun.fengwk.mch.core.service.impl;

import fun.fengwk.mch.core.common.ConsensusRequestException;
import fun.fengwk.mch.core.facade.search.model.SearchLocation;
import fun.fengwk.mch.core.service.ConsensusMcpService;
import fun.fengwk.mch.core.service.model.ConsensusToolResponse;
import fun.fengwk.mch.core.service.orchestrator.ConsensusOrchestrator;
import fun.fengwk.mch.core.service.orchestrator.model.ConsensusQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConsensusMcpServiceImpl implements ConsensusMcpService {

    private final ConsensusOrchestrator consensusOrchestrator;

    @Override
    public ConsensusToolResponse consensus(String message, String services, Boolean useWebSearch, String chatHistory,
                                           String conversationId, String city, String region, String country) {
        ConsensusQuery query = ConsensusQuery.builder()
            .message(message)
            .services(splitServices(services))
            .useWebSearch(Boolean.TRUE.equals(useWebSearch))
            .chatHistory(chatHistory)
            .conversationId(conversationId)
            .location(toLocation(city, region, country))
            .build();
        try {
            return ConsensusToolResponse.of(consensusOrchestrator.run(query));
        } catch (ConsensusRequestException ex) {
            log.warn("consensus request rejected, error={}", ex.getMessage());
            return ConsensusToolResponse.error(ex.getMessage());
        }
    }

    private List<String> splitServices(String services) {
        if (!StringUtils.hasText(services)) {
            return Collections.emptyList();
        }
        return Arrays.stream(services.split(","))
            .map(String::trim)
            .filter(StringUtils::hasText)
            .toList();
    }

    private SearchLocation toLocation(String city, String region, String country) {
        if (!StringUtils.hasText(city) && !StringUtils.hasText(region) && !StringUtils.hasText(country)) {
            return null;
        }
        return SearchLocation.builder()
            .city(city)
            .region(region)
            .country(country)
            .build();
    }

}
