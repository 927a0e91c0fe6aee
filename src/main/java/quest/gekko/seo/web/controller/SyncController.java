package quest.gekko.seo.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import quest.gekko.seo.service.core.SyncJobService;
import quest.gekko.seo.web.dto.PageSpeedSyncResult;
import quest.gekko.seo.web.dto.SearchConsoleSyncResult;
import quest.gekko.seo.web.dto.SyncJobDTO;

import java.util.List;

/**
 * "Sync now" actions. Results are always 200; failures are reported in the body.
 */
@RestController
@RequestMapping("/api/sync/{userId}")
@RequiredArgsConstructor
public class SyncController {
    private final SyncJobService syncJobService;

    @PostMapping("/search-console")
    public SearchConsoleSyncResult syncSearchConsole(@PathVariable Long userId) {
        return syncJobService.runSearchConsoleSync(userId);
    }

    @PostMapping("/pagespeed")
    public PageSpeedSyncResult syncPageSpeed(@PathVariable Long userId) {
        return syncJobService.runPageSpeedSync(userId);
    }

    @GetMapping("/jobs")
    public List<SyncJobDTO> jobs(@PathVariable Long userId) {
        return syncJobService.listJobs(userId);
    }
}
