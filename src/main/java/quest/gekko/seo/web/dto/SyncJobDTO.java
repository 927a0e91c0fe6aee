package quest.gekko.seo.web.dto;

import quest.gekko.seo.domain.SyncJob;
import quest.gekko.seo.domain.SyncJobStatus;
import quest.gekko.seo.domain.SyncJobType;

import java.time.Instant;

public record SyncJobDTO(
        SyncJobType jobType,
        SyncJobStatus status,
        Instant lastRunAt,
        Instant nextRunAt,
        String errorMessage
) {

    public static SyncJobDTO from(SyncJob job) {
        return new SyncJobDTO(job.getJobType(), job.getStatus(), job.getLastRunAt(), job.getNextRunAt(), job.getErrorMessage());
    }
}
