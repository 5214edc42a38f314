package fun.fengwk.mch.core.facade.search.reka;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Reka research search configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mch.search.reka")
public class RekaSearchProperties {

    /**
     * API key, blank disables web search.
     */
    private String apiKey = "";

    /**
     * Reka API base url.
     */
    private String baseUrl = "https://api.reka.ai";

    /**
     * Research model.
     */
    private String model = "reka-flash-research";

    /**
     * Per-attempt request timeout in milliseconds.
     */
    private long timeoutMs = 90000;

    /**
     * Retries after the first attempt.
     */
    private int retryCount = 2;

    /**
     * Base backoff in milliseconds, doubled on every retry.
     */
    private long backoffMs = 1000;

    /**
     * Upper bound of web searches the research model may run per request.
     */
    private int maxUses = 2;

    /**
     * Make one more attempt without location after the last located attempt failed.
     */
    private boolean retryWithoutLocation = true;

}
