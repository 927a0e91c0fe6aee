package quest.gekko.seo.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PageSpeedSyncResult(
        boolean success,
        int urlsAnalyzed,
        String error
) {

    public static PageSpeedSyncResult ok(int urlsAnalyzed) {
        return new PageSpeedSyncResult(true, urlsAnalyzed, null);
    }

    public static PageSpeedSyncResult failed(Exception e) {
        return new PageSpeedSyncResult(false, 0, String.valueOf(e));
    }
}
