package com.spiderjobs.crawl.persistence;

import com.spiderjobs.crawl.model.FetchTask;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JdbcFrontierStoreTest {

    @Autowired
    private JdbcFrontierStore store;

    @Test
    void savedTasksComeBackOnceWithRetryState() {
        Instant enqueued = Instant.parse("2026-03-01T08:00:00Z");
        FetchTask seed = FetchTask.seed("https://store.example.com/jobs", "test-site", 0, enqueued);
        FetchTask retry = FetchTask.discovered("https://store.example.com/jobs?page=2", "test-site", 1, 3, enqueued)
            .nextAttempt(enqueued.plusSeconds(30))
            .nextBlockedAttempt(enqueued.plusSeconds(90));

        store.save(List.of(seed, retry));
        assertThat(store.count()).isEqualTo(2);

        List<FetchTask> restored = store.takeAll();

        assertThat(restored).containsExactly(seed, retry);
        assertThat(restored.get(1).attemptCount()).isEqualTo(1);
        assertThat(restored.get(1).blockedCount()).isEqualTo(1);
        assertThat(restored.get(1).notBefore()).isEqualTo(enqueued.plusSeconds(90));
        assertThat(store.takeAll()).isEmpty();
    }

    @Test
    void saveReplacesThePreviousSnapshot() {
        Instant now = Instant.parse("2026-03-02T08:00:00Z");
        store.save(List.of(FetchTask.seed("https://store.example.com/a", "test-site", 0, now)));
        store.save(List.of(FetchTask.seed("https://store.example.com/b", "test-site", 0, now)));

        assertThat(store.takeAll()).extracting(FetchTask::url).containsExactly("https://store.example.com/b");

        store.save(List.of());
        assertThat(store.count()).isZero();
    }
}
