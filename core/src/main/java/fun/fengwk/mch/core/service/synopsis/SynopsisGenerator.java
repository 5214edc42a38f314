package fun.fengwk.mch.core.service.synopsis;

import fun.fengwk.mch.core.common.ConsensusError;
import fun.fengwk.mch.core.common.ErrorType;
import fun.fengwk.mch.core.facade.provider.ProviderClient;
import fun.fengwk.mch.core.facade.provider.ProviderClientFactory;
import fun.fengwk.mch.core.facade.provider.ProviderId;
import fun.fengwk.mch.core.facade.provider.ProviderSettings;
import fun.fengwk.mch.core.facade.provider.model.GenerationContext;
import fun.fengwk.mch.core.facade.provider.model.ProviderResponse;
import fun.fengwk.mch.core.service.credential.CredentialSource;
import fun.fengwk.mch.core.service.orchestrator.OrchestratorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compresses a provider's answer into a short synopsis by calling the same provider again.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SynopsisGenerator {

    public static final String UNAVAILABLE = "Synopsis unavailable.";

    static final int MAX_WORDS = 45;

    private static final int CONTEXT_LEAD_MAX_WORDS = 25;
    private static final int CONTEXT_CLOSE_MAX_WORDS = 15;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern SENTENCE_CLOSE = Pattern.compile("[.!?]$");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.!?,:;]+$");
    private static final Pattern DANGLING_PUNCTUATION = Pattern.compile("[,:;]+$");
    private static final Pattern NUMBERED_ITEM = Pattern.compile("(?m)^\\s*\\d+[.)]\\s+\\S");

    private static final Set<String> BACK_REFERENCES = Set.of("this", "these", "it", "that");
    private static final Set<String> TOPIC_MARKERS = Set.of("main", "key", "important", "primary", "essential",
        "core", "fundamental");

    static final String INSTRUCTION = "Summarize the following response in 35 to 45 words. Keep its main conclusion "
        + "and any important caveat. Reply with the summary only, without a preamble.";

    private final ProviderClientFactory clientFactory;
    private final CredentialSource credentialSource;
    private final OrchestratorProperties properties;

    /**
     * Summarize with the given credential and model, other settings come from the credential source or defaults.
     */
    public SynopsisResult summarize(String content, ProviderId providerId, String credential, String model) {
        ProviderSettings base = credentialSource.find(providerId).orElseGet(() -> ProviderSettings.defaults(providerId));
        ProviderSettings settings = base.toBuilder()
            .apiKey(credential)
            .model(StringUtils.hasText(model) ? model : base.getModel())
            .build();
        return summarize(content, providerId, settings);
    }

    /**
     * Summarize with exactly the settings of the main call. Never throws.
     */
    public SynopsisResult summarize(String content, ProviderId providerId, ProviderSettings settings) {
        if (!StringUtils.hasText(content)) {
            return SynopsisResult.fallback(UNAVAILABLE, false,
                ConsensusError.of(ErrorType.UNEXPECTED, "Nothing to summarize"));
        }
        try {
            ProviderClient client = clientFactory.create(providerId, settings);
            GenerationContext context = GenerationContext.builder()
                .maxTokens(properties.getSynopsisMaxTokens())
                .build();
            ProviderResponse response = client.generate(INSTRUCTION + "\n\nResponse:\n" + content, context);
            if (!response.isSuccess()) {
                log.warn("synopsis generation failed, provider={}, type={}, error={}", providerId.getValue(),
                    response.getError().getType(), response.getError().getMessage());
                return SynopsisResult.fallback(fallbackSynopsis(content), true, response.getError());
            }
            if (!StringUtils.hasText(response.getContent())) {
                log.warn("synopsis generation returned blank text, provider={}", providerId.getValue());
                return SynopsisResult.fallback(fallbackSynopsis(content), true,
                    ConsensusError.of(ErrorType.PARSE_ERROR, "Blank synopsis"));
            }
            return SynopsisResult.success(truncateWords(response.getContent().trim(), MAX_WORDS), response.getMetadata());
        } catch (RuntimeException ex) {
            log.error("synopsis generation failed unexpectedly, provider={}, error={}", providerId.getValue(),
                ex.getMessage(), ex);
            return SynopsisResult.fallback(fallbackSynopsis(content), false,
                ConsensusError.of(ErrorType.UNEXPECTED, ex.getMessage()));
        }
    }

    /**
     * Extractive synopsis used when the provider cannot summarize its own answer. Picks the sentence that carries
     * a cause and effect, the intro of a list, or the opening and closing sentences, and keeps the result within
     * {@link #MAX_WORDS} words ending on a full stop.
     */
    public static String fallbackSynopsis(String content) {
        if (!StringUtils.hasText(content)) {
            return UNAVAILABLE;
        }
        List<String> sentences = splitSentences(content);
        if (sentences.isEmpty()) {
            return UNAVAILABLE;
        }

        String lower = content.toLowerCase(Locale.ROOT);
        String summary;
        if (lower.contains("affect") || lower.contains("impact")) {
            summary = causeEffectSummary(sentences);
        } else if (lower.contains("ways") && content.contains(":")) {
            summary = listSummary(content, sentences);
        } else if (sentences.size() >= 3) {
            summary = contextualSummary(sentences);
        } else {
            summary = sentences.get(0);
        }
        return truncateToCompleteSentence(summary, MAX_WORDS);
    }

    static List<String> splitSentences(String content) {
        String normalized = WHITESPACE.matcher(content.trim()).replaceAll(" ");
        List<String> sentences = new ArrayList<>();
        for (String sentence : SENTENCE_END.split(normalized)) {
            if (StringUtils.hasText(sentence)) {
                sentences.add(sentence.trim());
            }
        }
        return sentences;
    }

    private static String causeEffectSummary(List<String> sentences) {
        for (String sentence : sentences) {
            String lower = sentence.toLowerCase(Locale.ROOT);
            if (lower.contains("affect") || lower.contains("impact")) {
                return sentence;
            }
        }
        return sentences.get(0);
    }

    private static String listSummary(String content, List<String> sentences) {
        List<String> introSentences = splitSentences(content.substring(0, content.indexOf(':')));
        Matcher matcher = NUMBERED_ITEM.matcher(content);
        int items = 0;
        while (matcher.find()) {
            items++;
        }
        if (items == 0 || introSentences.isEmpty()) {
            return sentences.get(0);
        }
        return introSentences.get(introSentences.size() - 1) + ", outlined in " + items + " points";
    }

    private static String contextualSummary(List<String> sentences) {
        String first = wordCount(sentences.get(0)) <= MAX_WORDS ? sentences.get(0) : topicSentence(sentences);
        String last = sentences.get(sentences.size() - 1);
        if (first.equals(last)
            || wordCount(first) > CONTEXT_LEAD_MAX_WORDS
            || wordCount(last) > CONTEXT_CLOSE_MAX_WORDS) {
            return first;
        }
        String firstWord = last.split(" ", 2)[0].toLowerCase(Locale.ROOT);
        if (BACK_REFERENCES.contains(firstWord)) {
            return first;
        }
        return first + ". " + last;
    }

    private static String topicSentence(List<String> sentences) {
        for (String sentence : sentences) {
            for (String word : sentence.toLowerCase(Locale.ROOT).split("\\W+")) {
                if (TOPIC_MARKERS.contains(word)) {
                    return sentence;
                }
            }
        }
        return sentences.get(0);
    }

    /**
     * Keep at most {@code maxWords} words. Cuts at the last sentence end inside the limit when there is one,
     * otherwise at the word limit, and always closes with punctuation.
     */
    static String truncateToCompleteSentence(String text, int maxWords) {
        String[] words = text.trim().split("\\s+");
        if (words.length <= maxWords) {
            return closeSentence(text.trim());
        }
        for (int i = maxWords - 1; i > 0; i--) {
            if (SENTENCE_CLOSE.matcher(words[i]).find()) {
                return String.join(" ", Arrays.copyOfRange(words, 0, i + 1));
            }
        }
        String truncated = String.join(" ", Arrays.copyOfRange(words, 0, maxWords));
        return closeSentence(TRAILING_PUNCTUATION.matcher(truncated).replaceAll(""));
    }

    private static String closeSentence(String sentence) {
        String text = DANGLING_PUNCTUATION.matcher(sentence).replaceAll("");
        if (text.endsWith(".") || text.endsWith("!") || text.endsWith("?")) {
            return text;
        }
        return text + ".";
    }

    private static int wordCount(String text) {
        return text.trim().split("\\s+").length;
    }

    static String truncateWords(String text, int maxWords) {
        String[] words = text.trim().split("\\s+");
        if (words.length <= maxWords) {
            return text.trim();
        }
        return String.join(" ", Arrays.copyOfRange(words, 0, maxWords)) + "...";
    }

}
