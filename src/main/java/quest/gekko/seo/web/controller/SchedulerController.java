package quest.gekko.seo.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import quest.gekko.seo.domain.TrackedDomain;
import quest.gekko.seo.service.core.PageSpeedService;
import quest.gekko.seo.service.scheduling.DailyUpdateScheduler;
import quest.gekko.seo.web.dto.DomainRefreshResult;
import quest.gekko.seo.web.dto.SchedulerStatusDTO;

@RestController
@RequestMapping("/api/scheduler")
@RequiredArgsConstructor
public class SchedulerController {
    private final DailyUpdateScheduler scheduler;
    private final PageSpeedService pageSpeedService;

    @GetMapping("/status")
    public SchedulerStatusDTO status() {
        return scheduler.getStatus();
    }

    @PostMapping("/start")
    public SchedulerStatusDTO start() {
        scheduler.start();
        return scheduler.getStatus();
    }

    @PostMapping("/stop")
    public SchedulerStatusDTO stop() {
        scheduler.stop();
        return scheduler.getStatus();
    }

    @PostMapping("/domains/{domainId}/refresh")
    public DomainRefreshResult refresh(@PathVariable Long domainId) {
        TrackedDomain domain = pageSpeedService.requireDomain(domainId);
        return scheduler.manualUpdate(domain.getDomain(), domain.getId());
    }
}
