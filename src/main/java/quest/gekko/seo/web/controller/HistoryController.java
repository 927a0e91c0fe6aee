package quest.gekko.seo.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import quest.gekko.seo.domain.Strategy;
import quest.gekko.seo.service.core.HistoryService;
import quest.gekko.seo.service.core.PageSpeedService;
import quest.gekko.seo.web.dto.DomainHistoryDTO;
import quest.gekko.seo.web.dto.KeywordHistoryDTO;
import quest.gekko.seo.web.dto.PageSpeedAnalysisDTO;
import quest.gekko.seo.web.dto.PageSpeedHistoryDTO;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HistoryController {
    private final HistoryService historyService;
    private final PageSpeedService pageSpeedService;

    @PostMapping("/pagespeed/analyze")
    public PageSpeedAnalysisDTO analyze(@RequestParam String url,
                                        @RequestParam(required = false) Long domainId,
                                        @RequestParam(required = false) Strategy strategy) {
        return pageSpeedService.analyze(url, domainId, strategy);
    }

    @GetMapping("/pagespeed/{domainId}/history")
    public List<PageSpeedHistoryDTO> pageSpeedHistory(@PathVariable Long domainId,
                                                      @RequestParam(defaultValue = "30") int limit) {
        return historyService.getPageSpeedHistory(domainId, limit);
    }

    @GetMapping("/domains/{domainId}/history")
    public List<DomainHistoryDTO> domainHistory(@PathVariable Long domainId) {
        return historyService.getDomainHistory(domainId);
    }

    @GetMapping("/keywords/{keywordId}/history")
    public List<KeywordHistoryDTO> keywordHistory(@PathVariable Long keywordId) {
        return historyService.getKeywordHistory(keywordId);
    }
}
