package quest.gekko.seo.service.integration.dto;

/** One row of a "query" dimension search analytics report. */
public record QueryRow(String keyword, long clicks, long impressions, double ctr, double position) {}
