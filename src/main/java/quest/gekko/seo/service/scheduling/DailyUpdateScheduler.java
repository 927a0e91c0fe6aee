package quest.gekko.seo.service.scheduling;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import quest.gekko.seo.config.SeoProperties;
import quest.gekko.seo.domain.TrackedDomain;
import quest.gekko.seo.repository.TrackedDomainRepository;
import quest.gekko.seo.service.core.PageSpeedService;
import quest.gekko.seo.web.dto.DomainRefreshResult;
import quest.gekko.seo.web.dto.SchedulerStatusDTO;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Daily PageSpeed refresh of every tracked domain, across all users.
 * <p>
 * One instance per process. The run state lives only in memory, so each replica of the
 * service fires its own schedule.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DailyUpdateScheduler {
    private final TaskScheduler taskScheduler;
    private final TrackedDomainRepository domainRepository;
    private final PageSpeedService pageSpeedService;
    private final SeoProperties.Scheduler props;
    private final Clock clock;

    private boolean running;
    private ScheduledFuture<?> warmup;
    private ScheduledFuture<?> recurring;

    public synchronized void start() {
        if (running) {
            log.info("Scheduler already running");
            return;
        }
        running = true;

        Instant now = clock.instant();
        warmup = taskScheduler.schedule(this::runDailyUpdate, now.plus(props.warmupDelay()));
        recurring = taskScheduler.scheduleAtFixedRate(this::runDailyUpdate, now.plus(props.interval()), props.interval());
        log.info("Scheduler started: warm-up in {}, then every {}", props.warmupDelay(), props.interval());
    }

    /**
     * Cancels future runs only; a run already in progress finishes.
     */
    @PreDestroy
    public synchronized void stop() {
        if (warmup != null) {
            warmup.cancel(false);
            warmup = null;
        }
        if (recurring != null) {
            recurring.cancel(false);
            recurring = null;
        }
        if (running) {
            log.info("Scheduler stopped");
        }
        running = false;
    }

    public void runDailyUpdate() {
        log.info("Starting daily update at {}", clock.instant());
        try {
            List<TrackedDomain> domains = domainRepository.findAll();
            log.info("Found {} domains to update", domains.size());

            int failed = 0;
            for (TrackedDomain domain : domains) {
                try {
                    DomainRefreshResult result = pageSpeedService.refreshDomain(domain);
                    log.info("Updated {} ({} of 2 strategies)", domain.getDomain(), result.analyzed());
                } catch (Exception e) {
                    failed++;
                    log.error("Error updating {}", domain.getDomain(), e);
                }
            }
            log.info("Daily update completed: {} domains, {} failed", domains.size(), failed);
        } catch (Exception e) {
            log.error("Daily update failed", e);
        }
    }

    public DomainRefreshResult manualUpdate(String domain, Long domainId) {
        log.info("Manual update requested for {}", domain);
        return pageSpeedService.refreshDomain(pageSpeedService.requireDomain(domainId));
    }

    public synchronized SchedulerStatusDTO getStatus() {
        Instant nextRun = running ? clock.instant().plus(props.interval()) : null;
        return new SchedulerStatusDTO(running, nextRun);
    }

    public synchronized boolean isRunning() {
        return running;
    }
}
