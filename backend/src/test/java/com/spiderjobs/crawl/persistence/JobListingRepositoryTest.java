package com.spiderjobs.crawl.persistence;

import com.spiderjobs.crawl.model.JobListing;
import com.spiderjobs.crawl.sink.JdbcListingSink;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JobListingRepositoryTest {

    @Autowired
    private JobListingRepository repository;

    @Autowired
    private JdbcListingSink sink;

    @Test
    void storesEachContentFingerprintOnce() {
        JobListing listing = new JobListing(
            "Platform Engineer",
            "https://repo-site.example.com/jobs/1",
            "Umbrella",
            "Hanoi",
            "2026-03-01",
            "Negotiable",
            "https://repo-site.example.com/logo.png",
            List.of("Java", "Kafka"),
            "repo-site",
            Instant.parse("2026-03-01T10:15:30Z")
        );
        JobListing reformatted = new JobListing(
            " platform  ENGINEER ",
            "https://repo-site.example.com/jobs/1",
            "UMBRELLA",
            null, null, null, null, List.of(), "repo-site", Instant.now()
        );

        assertThat(repository.insertIfAbsent(listing)).isTrue();
        assertThat(repository.insertIfAbsent(listing)).isFalse();
        assertThat(repository.insertIfAbsent(reformatted)).isFalse();

        assertThat(repository.countBySite("repo-site")).isEqualTo(1);
        List<JobListing> stored = repository.findBySite("repo-site", 10);
        assertThat(stored).singleElement().satisfies(found -> {
            assertThat(found.title()).isEqualTo("Platform Engineer");
            assertThat(found.company()).isEqualTo("Umbrella");
            assertThat(found.skills()).containsExactly("Java", "Kafka");
            assertThat(found.fetchTime()).isEqualTo(Instant.parse("2026-03-01T10:15:30Z"));
        });
    }

    @Test
    void sinkWritesAreIdempotent() throws Exception {
        JobListing listing = new JobListing(
            "Data Analyst", "https://sink-site.example.com/jobs/2", "Stark", null, null, null, null,
            List.of(), "sink-site", Instant.now()
        );

        sink.write(listing);
        sink.write(listing);

        assertThat(repository.countBySite("sink-site")).isEqualTo(1);
        assertThat(sink.name()).isEqualTo("jdbc");
    }

    @Test
    void overlongFieldsAreTruncated() {
        String longTitle = "T".repeat(600);
        JobListing listing = new JobListing(
            longTitle, "https://long-site.example.com/jobs/3", "Wayne", null, null, null, null,
            List.of(), "long-site", Instant.now()
        );

        assertThat(repository.insertIfAbsent(listing)).isTrue();
        assertThat(repository.findBySite("long-site", 1).get(0).title()).hasSize(512);
    }
}
