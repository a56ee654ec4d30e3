package com.spiderjobs.crawl.model;

import java.time.Instant;
import java.util.List;

public record JobListing(
    String title,
    String canonicalLink,
    String company,
    String location,
    String postedDate,
    String salary,
    String logoUrl,
    List<String> skills,
    String sourceSite,
    Instant fetchTime
) {
    public JobListing {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}
