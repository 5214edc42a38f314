package fun.fengwk.mch.core.service.orchestrator;

import fun.fengwk.mch.core.facade.provider.model.ChatMessage;
import lombok.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Parses chat history text into role tagged messages.
 *
 * <p>Lines starting with {@code User:} or {@code Assistant:} open a new message, other lines continue the
 * current one. Text without any prefix is kept as unstructured history.
 *
 * @author fengwk
 */
@Component
public class ChatHistoryParser {

    private static final String USER_PREFIX = "user:";
    private static final String ASSISTANT_PREFIX = "assistant:";

    public ChatHistory parse(String chatHistory) {
        if (!StringUtils.hasText(chatHistory)) {
            return ChatHistory.EMPTY;
        }

        List<ChatMessage> messages = new ArrayList<>();
        String role = null;
        StringBuilder current = new StringBuilder();
        for (String line : chatHistory.split("\\r?\\n")) {
            String trimmed = line.trim();
            String lower = trimmed.toLowerCase(Locale.ROOT);
            String nextRole = null;
            int prefixLength = 0;
            if (lower.startsWith(USER_PREFIX)) {
                nextRole = ChatMessage.ROLE_USER;
                prefixLength = USER_PREFIX.length();
            } else if (lower.startsWith(ASSISTANT_PREFIX)) {
                nextRole = ChatMessage.ROLE_ASSISTANT;
                prefixLength = ASSISTANT_PREFIX.length();
            }

            if (nextRole != null) {
                flush(messages, role, current);
                role = nextRole;
                current.setLength(0);
                current.append(trimmed.substring(prefixLength).trim());
            } else if (role != null) {
                current.append('\n').append(line);
            }
        }
        flush(messages, role, current);

        if (messages.isEmpty()) {
            return new ChatHistory(Collections.emptyList(), chatHistory.trim());
        }
        return new ChatHistory(Collections.unmodifiableList(messages), null);
    }

    private void flush(List<ChatMessage> messages, String role, StringBuilder content) {
        if (role == null) {
            return;
        }
        String text = content.toString().trim();
        if (text.isEmpty()) {
            return;
        }
        messages.add(ChatMessage.ROLE_ASSISTANT.equals(role) ? ChatMessage.assistant(text) : ChatMessage.user(text));
    }

    /**
     * Parsed history, either messages or unstructured text.
     */
    @Value
    public static class ChatHistory {

        static final ChatHistory EMPTY = new ChatHistory(Collections.emptyList(), null);

        List<ChatMessage> messages;

        String unstructured;

        public boolean hasUnstructured() {
            return StringUtils.hasText(unstructured);
        }

        /**
         * Prompt with unstructured history embedded ahead of the question.
         */
        public String embed(String message) {
            if (!hasUnstructured()) {
                return message;
            }
            return "Previous conversation:\n" + unstructured + "\n\nCurrent question: " + message;
        }

    }

}
