package quest.gekko.seo.service.integration.connector;

import quest.gekko.seo.domain.Strategy;
import quest.gekko.seo.service.integration.dto.PageSpeedMetrics;

public interface PageSpeedConnector {

    PageSpeedMetrics fetch(String url, Strategy strategy);
}
