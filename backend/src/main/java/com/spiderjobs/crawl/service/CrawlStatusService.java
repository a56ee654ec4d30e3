package com.spiderjobs.crawl.service;

import com.spiderjobs.crawl.frontier.Frontier;
import com.spiderjobs.crawl.governor.PolitenessGovernor;
import com.spiderjobs.crawl.model.CrawlStatusResponse;
import org.springframework.stereotype.Service;

@Service
public class CrawlStatusService {
    private final CrawlPipelineService pipelineService;
    private final Frontier frontier;
    private final PolitenessGovernor governor;
    private final FetchTaskProcessor processor;

    public CrawlStatusService(
        CrawlPipelineService pipelineService,
        Frontier frontier,
        PolitenessGovernor governor,
        FetchTaskProcessor processor
    ) {
        this.pipelineService = pipelineService;
        this.frontier = frontier;
        this.governor = governor;
        this.processor = processor;
    }

    public CrawlStatusResponse getStatus() {
        return new CrawlStatusResponse(
            pipelineService.isRunning(),
            pipelineService.activeWorkerCount(),
            pipelineService.startedAt(),
            processor.isPoolExhausted(),
            frontier.stats(),
            governor.pausedSites()
        );
    }
}
