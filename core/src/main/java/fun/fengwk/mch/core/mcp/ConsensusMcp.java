package fun.fengwk.mch.core.mcp;

import fun.fengwk.mch.core.service.ConsensusMcpService;
import fun.fengwk.mch.core.service.model.ConsensusToolResponse;
import fun.fengwk.mch.core.utils.StringToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class ConsensusMcp {

    static final String RESULT_TEMPLATE = "mch_consensus_result.ftl";

    private final ConsensusMcpService consensusMcpService;
    private final McpFormatter mcpFormatter;

    @Tool(name = "consensus",
        description = """
            Ask the same question to several AI providers (claude, openai, gemini) in parallel and return every answer.
            Each answer comes with a short synopsis, token usage and cost; failed providers are listed with their error.
            Optionally enriches the question with one web search whose sources are listed at the end.""",
        resultConverter = StringToolCallResultConverter.class)
    public String consensus(
        @ToolParam(description = "question to ask") String message,
        @ToolParam(description = "comma separated providers: claude,openai,gemini; default all configured providers",
            required = false) String services,
        @ToolParam(description = "run a web search and share its results with every provider, default false",
            required = false) Boolean useWebSearch,
        @ToolParam(description = """
            prior conversation, one turn per line prefixed with 'User:' or 'Assistant:'; \
            text without prefixes is passed as plain context""", required = false) String chatHistory,
        @ToolParam(description = "conversation id used in usage records", required = false) String conversationId,
        @ToolParam(description = "approximate city for web search", required = false) String city,
        @ToolParam(description = "approximate region or state for web search", required = false) String region,
        @ToolParam(description = "ISO-3166-1 alpha-2 country code for web search, e.g. US", required = false) String country
    ) {
        ConsensusToolResponse response = consensusMcpService.consensus(message, services, useWebSearch, chatHistory,
            conversationId, city, region, country);
        return mcpFormatter.format(RESULT_TEMPLATE, response);
    }

}
