package fun.fengwk.mch.core.service.orchestrator;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Consensus orchestration configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mch.orchestrator")
public class OrchestratorProperties {

    /**
     * Deadline of the main generation of one provider, in milliseconds.
     */
    private long providerTimeoutMs = 60000;

    /**
     * Wait for the synopsis call after a successful generation, in milliseconds.
     */
    private long synopsisTimeoutMs = 15000;

    /**
     * Provider worker threads.
     */
    private int workerThreads = 6;

    /**
     * Search worker threads.
     */
    private int searchThreads = 2;

    /**
     * Usage record dispatch threads.
     */
    private int recordThreads = 1;

    /**
     * Pending usage records before new ones are dropped.
     */
    private int recordQueueCapacity = 1000;

    /**
     * Output cap of the synopsis call.
     */
    private int synopsisMaxTokens = 150;

    /**
     * User charged for web searches when the caller does not name one.
     */
    private String defaultUserId = "mcp-local";

}
