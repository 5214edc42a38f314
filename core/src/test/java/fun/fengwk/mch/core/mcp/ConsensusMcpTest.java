package fun.fengwk.mch.core.mcp;

import fun.fengwk.mch.core.service.ConsensusMcpService;
import fun.fengwk.mch.core.service.model.ConsensusToolResponse;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@Slf4j
@ExtendWith(MockitoExtension.class)
public class ConsensusMcpTest {

    @Mock
    private ConsensusMcpService consensusMcpService;

    @Mock
    private McpFormatter mcpFormatter;

    private ConsensusMcp consensusMcp;

    @BeforeEach
    void setUp() {
        consensusMcp = new ConsensusMcp(consensusMcpService, mcpFormatter);
    }

    @Test
    public void testConsensus() {
        ConsensusToolResponse response = ConsensusToolResponse.error("placeholder");
        when(consensusMcpService.consensus("what is rust", "claude,openai", true, null, "c1", null, null, "US"))
            .thenReturn(response);
        when(mcpFormatter.format("mch_consensus_result.ftl", response)).thenReturn("ok");

        String result = consensusMcp.consensus("what is rust", "claude,openai", true, null, "c1", null, null, "US");
        log.info("consensus result:\n{}", result);

        assertThat(result).isEqualTo("ok");
        verify(consensusMcpService).consensus("what is rust", "claude,openai", true, null, "c1", null, null, "US");
        verify(mcpFormatter).format("mch_consensus_result.ftl", response);
    }

    @Test
    public void testConsensusRejected() {
        ConsensusToolResponse response = ConsensusToolResponse.error("Message must not be blank");
        when(consensusMcpService.consensus(" ", null, null, null, null, null, null, null)).thenReturn(response);
        when(mcpFormatter.format("mch_consensus_result.ftl", response)).thenReturn("Error: Message must not be blank");

        String result = consensusMcp.consensus(" ", null, null, null, null, null, null, null);

        assertThat(result).isEqualTo("Error: Message must not be blank");
    }

}
