package quest.gekko.seo.domain;

public enum SyncJobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
