package quest.gekko.seo.web.dto;

import quest.gekko.seo.domain.DomainHistory;

import java.time.LocalDate;

public record DomainHistoryDTO(
        Long domainId,
        LocalDate date,
        Long totalClicks,
        Long totalImpressions,
        Double avgPosition,
        Double avgCtr
) {

    public static DomainHistoryDTO from(DomainHistory h) {
        return new DomainHistoryDTO(h.getDomain().getId(), h.getSnapshotDate(),
                h.getTotalClicks(), h.getTotalImpressions(), h.getAvgPosition(), h.getAvgCtr());
    }
}
