package quest.gekko.seo.service.integration.connector;

import quest.gekko.seo.service.integration.dto.QueryRow;
import quest.gekko.seo.service.integration.dto.SitePerformance;

import java.time.LocalDate;
import java.util.List;

public interface SearchConsoleConnector {

    List<String> listSites(String accessToken);

    /** Totals for the property; zeros when the report has no rows. */
    SitePerformance fetchSitePerformance(String accessToken, String siteUrl, LocalDate startDate, LocalDate endDate);

    List<QueryRow> fetchQueryRows(String accessToken, String siteUrl, LocalDate startDate, LocalDate endDate, int rowLimit);
}
