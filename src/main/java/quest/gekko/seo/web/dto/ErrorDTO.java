package quest.gekko.seo.web.dto;

public record ErrorDTO(String error, int status) {}
