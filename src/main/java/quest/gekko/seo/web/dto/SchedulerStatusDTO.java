package quest.gekko.seo.web.dto;

import java.time.Instant;

/**
 * {@code nextRun} is an estimate (now + interval), not the timer's actual fire time.
 */
public record SchedulerStatusDTO(boolean running, Instant nextRun) {}
