package quest.gekko.seo.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * History read caches. Every snapshot write evicts its cache, so the expiry only
 * bounds how long a range query that nobody rewrites stays resident.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String DOMAIN_HISTORY = "domainHistory";
    public static final String KEYWORD_HISTORY = "keywordHistory";
    public static final String PAGESPEED_HISTORY = "pageSpeedHistory";

    static final long DOMAIN_HISTORY_ENTRIES = 1_000;
    static final long KEYWORD_HISTORY_ENTRIES = 20_000;
    static final long PAGESPEED_HISTORY_ENTRIES = 2_000;

    private static final Duration HISTORY_TTL = Duration.ofHours(6);

    @Bean
    public CacheManager cacheManager() {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        // static names: unknown caches are not created on demand. Must precede the
        // custom registrations, which replace the default caches created here.
        cacheManager.setCacheNames(List.of(DOMAIN_HISTORY, KEYWORD_HISTORY, PAGESPEED_HISTORY));
        cacheManager.registerCustomCache(DOMAIN_HISTORY, historyCache(DOMAIN_HISTORY_ENTRIES));
        // keyed per keyword and range, so far more entries than domains
        cacheManager.registerCustomCache(KEYWORD_HISTORY, historyCache(KEYWORD_HISTORY_ENTRIES));
        cacheManager.registerCustomCache(PAGESPEED_HISTORY, historyCache(PAGESPEED_HISTORY_ENTRIES));
        return cacheManager;
    }

    private static Cache<Object, Object> historyCache(final long maximumSize) {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(HISTORY_TTL)
                .build();
    }
}
