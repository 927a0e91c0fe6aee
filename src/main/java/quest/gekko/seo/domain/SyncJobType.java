package quest.gekko.seo.domain;

public enum SyncJobType {
    SEARCH_CONSOLE,
    PAGESPEED,
    AI_VISIBILITY
}
