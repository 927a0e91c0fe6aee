package quest.gekko.seo.web.dto;

/**
 * Derived 0-100 scores, see {@code AiReadabilityScorer}.
 */
public record AiReadabilityScore(
        int overall,
        int semanticHtml,
        int schemaOrg,
        int contentClarity,
        int technicalSeo
) {}
