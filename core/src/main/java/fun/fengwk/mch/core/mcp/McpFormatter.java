package fun.fengwk.mch.core.mcp;

import freemarker.template.Template;
import freemarker.template.TemplateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

/**
 * Renders tool results with FreeMarker templates.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class McpFormatter {

    private final freemarker.template.Configuration mcpTemplateConfiguration;

    public McpFormatter(@Qualifier("mcpTemplateConfiguration") freemarker.template.Configuration mcpTemplateConfiguration) {
        this.mcpTemplateConfiguration = mcpTemplateConfiguration;
    }

    /**
     * @param templateName template under {@code /mcp/templates/}.
     * @param model exposed to the template as {@code data}.
     * @return rendered text, or a short error text when rendering fails.
     */
    public String format(String templateName, Object model) {
        if (model == null) {
            return "empty response";
        }
        StringWriter result = new StringWriter(2048);
        try {
            Template template = mcpTemplateConfiguration.getTemplate(templateName);
            template.process(Map.of("data", model), result);
            return result.toString();
        } catch (IOException | TemplateException ex) {
            log.error("mcp result format failed, template={}, error={}", templateName, ex.getMessage(), ex);
            return "format error: " + ex.getMessage();
        }
    }

}
