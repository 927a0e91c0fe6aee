package quest.gekko.seo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for the Google integrations and the sync schedule
 */
@Configuration
@EnableConfigurationProperties({
        SeoProperties.Google.class,
        SeoProperties.PageSpeed.class,
        SeoProperties.SearchConsole.class,
        SeoProperties.Scheduler.class,
        SeoProperties.Api.class
})
public class SeoProperties {

    @ConfigurationProperties("seo.google")
    public record Google(String clientId,
                         String clientSecret,
                         @DefaultValue("https://accounts.google.com/o/oauth2/v2/auth") String authUrl,
                         @DefaultValue("https://oauth2.googleapis.com/token") String tokenUrl,
                         @DefaultValue("https://searchconsole.googleapis.com/v1") String searchConsoleUrl,
                         @DefaultValue("https://www.googleapis.com/webmasters/v3") String webmastersUrl) {

        public boolean hasClientCredentials() {
            return clientId != null && !clientId.isBlank()
                    && clientSecret != null && !clientSecret.isBlank();
        }
    }

    @ConfigurationProperties("seo.pagespeed")
    public record PageSpeed(@DefaultValue("https://www.googleapis.com/pagespeedonline/v5/runPagespeed") String apiUrl,
                            String apiKey,
                            @DefaultValue("1s") Duration interDomainDelay) {}

    @ConfigurationProperties("seo.search-console")
    public record SearchConsole(@DefaultValue("7") int windowDays,
                                @DefaultValue("500") int keywordRowLimit) {}

    @ConfigurationProperties("seo.scheduler")
    public record Scheduler(@DefaultValue("5m") Duration warmupDelay,
                            @DefaultValue("24h") Duration interval) {}

    @ConfigurationProperties("seo.api")
    public record Api(@DefaultValue("1") int maxConcurrent,
                      @DefaultValue("3") int maxAttempts,
                      @DefaultValue("800ms") Duration backoff) {}
}
