package quest.gekko.seo.service.scheduling;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the daily scheduler on boot, in production only. Other environments start it
 * explicitly.
 */
@Component
@Profile("production")
@RequiredArgsConstructor
public class SchedulerAutoStart {
    private final DailyUpdateScheduler scheduler;

    @EventListener(ApplicationReadyEvent.class)
    public void startScheduler() {
        scheduler.start();
    }
}
