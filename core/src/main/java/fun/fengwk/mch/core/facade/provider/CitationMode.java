package fun.fengwk.mch.core.facade.provider;

/**
 * How a provider receives web search context.
 *
 * @author fengwk
 */
public enum CitationMode {

    /**
     * Formatted search text appended to the prompt.
     */
    INLINE_TEXT,

    /**
     * Structured document blocks with citations enabled.
     */
    DOCUMENT_BLOCKS

}
