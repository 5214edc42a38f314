package fun.fengwk.mch.core.service.impl;

import fun.fengwk.mch.core.common.ConsensusRequestException;
import fun.fengwk.mch.core.service.model.ConsensusToolResponse;
import fun.fengwk.mch.core.service.orchestrator.ConsensusOrchestrator;
import fun.fengwk.mch.core.service.orchestrator.QueryState;
import fun.fengwk.mch.core.service.orchestrator.model.ConsensusQuery;
import fun.fengwk.mch.core.service.orchestrator.model.ConsensusResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class ConsensusMcpServiceImplTest {

    @Mock
    private ConsensusOrchestrator consensusOrchestrator;

    private ConsensusMcpServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new ConsensusMcpServiceImpl(consensusOrchestrator);
    }

    @Test
    public void testBuildQuery() {
        ConsensusResponse response = ConsensusResponse.builder().success(true).queryId("q-1")
            .state(QueryState.AGGREGATED).build();
        when(consensusOrchestrator.run(any(ConsensusQuery.class))).thenReturn(response);

        ConsensusToolResponse result = service.consensus("what is rust", " claude, ,gemini ", true,
            "User: hi", "c1", null, " ", "us");

        assertThat(result.getResponse()).isSameAs(response);
        assertThat(result.getError()).isNull();
        ArgumentCaptor<ConsensusQuery> query = ArgumentCaptor.forClass(ConsensusQuery.class);
        verify(consensusOrchestrator).run(query.capture());
        assertThat(query.getValue().getServices()).containsExactly("claude", "gemini");
        assertThat(query.getValue().isUseWebSearch()).isTrue();
        assertThat(query.getValue().getChatHistory()).isEqualTo("User: hi");
        assertThat(query.getValue().getConversationId()).isEqualTo("c1");
        assertThat(query.getValue().getLocation().getCountry()).isEqualTo("us");
    }

    @Test
    public void testDefaults() {
        when(consensusOrchestrator.run(any(ConsensusQuery.class)))
            .thenReturn(ConsensusResponse.builder().success(true).build());

        service.consensus("what is rust", null, null, null, null, null, null, null);

        ArgumentCaptor<ConsensusQuery> query = ArgumentCaptor.forClass(ConsensusQuery.class);
        verify(consensusOrchestrator).run(query.capture());
        assertThat(query.getValue().getServices()).isEmpty();
        assertThat(query.getValue().isUseWebSearch()).isFalse();
        assertThat(query.getValue().getLocation()).isNull();
    }

    @Test
    public void testRejectedRequest() {
        when(consensusOrchestrator.run(any(ConsensusQuery.class)))
            .thenThrow(new ConsensusRequestException("Message must not be blank"));

        ConsensusToolResponse result = service.consensus(" ", null, null, null, null, null, null, null);

        assertThat(result.getResponse()).isNull();
        assertThat(result.getError()).isEqualTo("Message must not be blank");
    }

}
