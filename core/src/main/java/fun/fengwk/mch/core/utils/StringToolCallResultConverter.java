package fun.fengwk.mch.core.utils;

import org.springframework.ai.tool.execution.ToolCallResultConverter;

import java.lang.reflect.Type;

/**
 * Passes formatted tool output through as plain text.
 *
 * @author fengwk
 */
public class StringToolCallResultConverter implements ToolCallResultConverter {

    @Override
    public String convert(Object result, Type returnType) {
        if (result == null) {
            return "";
        }
        if (result instanceof CharSequence text) {
            return text.toString();
        }
        throw new IllegalStateException("tool result is not text, type=" + result.getClass().getName());
    }

}
