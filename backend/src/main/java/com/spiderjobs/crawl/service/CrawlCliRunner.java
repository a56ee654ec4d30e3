package com.spiderjobs.crawl.service;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.model.CrawlRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final CrawlPipelineService pipelineService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CrawlPipelineService pipelineService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.pipelineService = pipelineService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<String> sites = Arrays.stream(properties.getCli().getSites().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();

        CrawlRunSummary summary = pipelineService.runToCompletion(
            sites,
            Duration.ofSeconds(properties.getCli().getMaxRunSeconds())
        );
        log.info(
            "Crawl run finished with status {}: written={}, duplicates={}, lost={}, dropped={}, remaining={}",
            summary.status(),
            summary.listingsWritten(),
            summary.listingsDuplicate(),
            summary.listingsLost(),
            summary.tasksDropped(),
            summary.tasksRemaining()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
