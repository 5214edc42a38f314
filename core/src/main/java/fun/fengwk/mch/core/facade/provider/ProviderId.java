package fun.fengwk.mch.core.facade.provider;

import org.springframework.util.StringUtils;

/**
 * Supported AI text-generation providers.
 *
 * @author fengwk
 */
public enum ProviderId {

    CLAUDE("claude", "Claude"),
    OPENAI("openai", "OpenAI"),
    GEMINI("gemini", "Gemini");

    private final String value;
    private final String displayName;

    ProviderId(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve provider by identifier, returns null for unknown values.
     */
    public static ProviderId fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String normalized = value.trim();
        for (ProviderId providerId : values()) {
            if (providerId.value.equalsIgnoreCase(normalized)) {
                return providerId;
            }
        }
        return null;
    }

}
