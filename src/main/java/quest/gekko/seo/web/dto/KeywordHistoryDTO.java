package quest.gekko.seo.web.dto;

import quest.gekko.seo.domain.KeywordHistory;

import java.time.LocalDate;

public record KeywordHistoryDTO(
        Long keywordId,
        LocalDate date,
        Double position,
        Long clicks,
        Long impressions,
        Double ctr
) {

    public static KeywordHistoryDTO from(KeywordHistory h) {
        return new KeywordHistoryDTO(h.getKeyword().getId(), h.getSnapshotDate(),
                h.getPosition(), h.getClicks(), h.getImpressions(), h.getCtr());
    }
}
