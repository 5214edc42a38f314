package fun.fengwk.mch.core.facade.search.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Single cited web source.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SearchSource {

    /**
     * Source title, falls back to the domain for numeric citation labels.
     */
    String title;

    /**
     * Source URL, empty when the backend returned prose without links.
     */
    String url;

    /**
     * Display domain.
     */
    String source;

    /**
     * Text surrounding the citation.
     */
    String snippet;

    /**
     * ISO date found near the citation, may be null.
     */
    String publishedDate;

    /**
     * Short relevance hint for the model.
     */
    String relevanceNote;

}
