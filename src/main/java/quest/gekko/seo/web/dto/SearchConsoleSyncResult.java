package quest.gekko.seo.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchConsoleSyncResult(
        boolean success,
        int domainsUpdated,
        int keywordsUpdated,
        String error
) {

    public static SearchConsoleSyncResult ok(int domainsUpdated, int keywordsUpdated) {
        return new SearchConsoleSyncResult(true, domainsUpdated, keywordsUpdated, null);
    }

    public static SearchConsoleSyncResult failed(Exception e) {
        return new SearchConsoleSyncResult(false, 0, 0, String.valueOf(e));
    }
}
