package com.spiderjobs.crawl.api;

import com.spiderjobs.crawl.model.CrawlMetricsSnapshot;
import com.spiderjobs.crawl.model.CrawlStatusResponse;
import com.spiderjobs.crawl.model.EnqueueResult;
import com.spiderjobs.crawl.service.CrawlMetricsService;
import com.spiderjobs.crawl.service.CrawlPipelineService;
import com.spiderjobs.crawl.service.CrawlStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/crawl")
public class CrawlController {
    private final CrawlPipelineService pipelineService;
    private final CrawlStatusService statusService;
    private final CrawlMetricsService metricsService;

    public CrawlController(
        CrawlPipelineService pipelineService,
        CrawlStatusService statusService,
        CrawlMetricsService metricsService
    ) {
        this.pipelineService = pipelineService;
        this.statusService = statusService;
        this.metricsService = metricsService;
    }

    @PostMapping("/start")
    public CrawlStatusResponse start(@RequestBody(required = false) CrawlStartRequest request) {
        List<String> siteIds = request == null || request.siteIds() == null ? List.of() : request.siteIds();
        pipelineService.start(siteIds);
        return statusService.getStatus();
    }

    @PostMapping("/stop")
    public CrawlStatusResponse stop() {
        pipelineService.stop();
        return statusService.getStatus();
    }

    @PostMapping("/sites/{siteId}/pause")
    public CrawlStatusResponse pause(@PathVariable("siteId") String siteId) {
        pipelineService.pause(siteId);
        return statusService.getStatus();
    }

    @PostMapping("/sites/{siteId}/resume")
    public CrawlStatusResponse resume(@PathVariable("siteId") String siteId) {
        pipelineService.resume(siteId);
        return statusService.getStatus();
    }

    @PostMapping("/sites/{siteId}/seed")
    public Map<String, EnqueueResult> seed(
        @PathVariable("siteId") String siteId,
        @RequestParam(name = "force", required = false, defaultValue = "false") boolean force,
        @RequestBody(required = false) SeedRequest request
    ) {
        List<String> urls = request == null || request.urls() == null ? List.of() : request.urls();
        boolean forced = force || (request != null && Boolean.TRUE.equals(request.force()));
        return pipelineService.seed(siteId, urls, forced);
    }

    @GetMapping("/status")
    public CrawlStatusResponse status() {
        return statusService.getStatus();
    }

    @GetMapping("/metrics")
    public CrawlMetricsSnapshot metrics() {
        return metricsService.snapshot();
    }
}
