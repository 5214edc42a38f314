package fun.fengwk.mch.core.facade.provider.model;

import lombok.Value;

/**
 * One prior turn of the conversation.
 *
 * @author fengwk
 */
@Value
public class ChatMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    String role;
    String content;

    public static ChatMessage user(String content) {
        return new ChatMessage(ROLE_USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ROLE_ASSISTANT, content);
    }

    public boolean isAssistant() {
        return ROLE_ASSISTANT.equals(role);
    }

}
