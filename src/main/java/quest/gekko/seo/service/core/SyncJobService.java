package quest.gekko.seo.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.seo.config.SeoProperties;
import quest.gekko.seo.domain.SyncJob;
import quest.gekko.seo.domain.SyncJobStatus;
import quest.gekko.seo.domain.SyncJobType;
import quest.gekko.seo.repository.SyncJobRepository;
import quest.gekko.seo.web.dto.PageSpeedSyncResult;
import quest.gekko.seo.web.dto.SearchConsoleSyncResult;
import quest.gekko.seo.web.dto.SyncJobDTO;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs user-triggered syncs and keeps the per-user sync_jobs row current.
 * Bookkeeping only: nothing here coordinates multiple service instances.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncJobService {
    private static final int MAX_ERROR_LENGTH = 4000;

    private final SyncJobRepository jobRepository;
    private final SearchConsoleSyncService searchConsoleSyncService;
    private final PageSpeedService pageSpeedService;
    private final SeoProperties.Scheduler scheduler;
    private final Clock clock;

    public SearchConsoleSyncResult runSearchConsoleSync(Long userId) {
        return track(userId, SyncJobType.SEARCH_CONSOLE,
                () -> searchConsoleSyncService.syncSearchConsoleData(userId),
                r -> r.success() ? null : r.error(),
                SearchConsoleSyncResult::failed);
    }

    public PageSpeedSyncResult runPageSpeedSync(Long userId) {
        return track(userId, SyncJobType.PAGESPEED,
                () -> pageSpeedService.syncPageSpeedData(userId),
                r -> r.success() ? null : r.error(),
                PageSpeedSyncResult::failed);
    }

    @Transactional(readOnly = true)
    public List<SyncJobDTO> listJobs(Long userId) {
        return jobRepository.findByUserIdOrderByJobTypeAsc(userId).stream()
                .map(SyncJobDTO::from)
                .toList();
    }

    // ---- Helpers ----

    /**
     * Runs one sync between two bookkeeping writes. Nothing thrown here reaches the caller:
     * a job row that cannot be claimed turns into a failed result, and a failing final write
     * is only logged since the sync itself already happened.
     */
    private <R> R track(Long userId, SyncJobType type, Supplier<R> run, Function<R, String> errorOf,
                        Function<Exception, R> failed) {
        Instant started = clock.instant();
        SyncJob job;
        try {
            job = jobRepository.findByUserIdAndJobType(userId, type).orElseGet(() -> {
                SyncJob fresh = new SyncJob();
                fresh.setUserId(userId);
                fresh.setJobType(type);
                fresh.setCreatedAt(started);
                return fresh;
            });
            job.setStatus(SyncJobStatus.RUNNING);
            job.setLastRunAt(started);
            job.setUpdatedAt(started);
            job = jobRepository.save(job);
        } catch (Exception e) {
            log.error("Could not mark {} sync running for user {}", type, userId, e);
            return failed.apply(e);
        }

        R result;
        try {
            result = run.get();
        } catch (Exception e) {
            log.error("{} sync threw for user {}", type, userId, e);
            result = failed.apply(e);
        }
        String error = errorOf.apply(result);

        if (error == null) {
            job.setStatus(SyncJobStatus.COMPLETED);
            job.setErrorMessage(null);
            job.setNextRunAt(started.plus(scheduler.interval()));
        } else {
            job.setStatus(SyncJobStatus.FAILED);
            job.setErrorMessage(error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error);
            log.warn("{} sync failed for user {}: {}", type, userId, error);
        }
        job.setUpdatedAt(clock.instant());
        try {
            jobRepository.save(job);
        } catch (Exception e) {
            log.error("Could not record {} sync outcome for user {}", type, userId, e);
        }
        return result;
    }
}
