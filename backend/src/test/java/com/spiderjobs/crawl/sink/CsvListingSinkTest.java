package com.spiderjobs.crawl.sink;

import com.spiderjobs.crawl.model.JobListing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvListingSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void appendsRowsUnderASingleHeader() throws Exception {
        Path file = tempDir.resolve("out/jobs.csv");
        CsvListingSink sink = new CsvListingSink(file);

        sink.write(listing("Backend Engineer, Senior", "https://jobs.example.com/1", List.of("Java", "SQL")));
        new CsvListingSink(file).write(listing("QA \"Lead\"", "https://jobs.example.com/2", List.of()));

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.builder()
                 .setHeader()
                 .setSkipHeaderRecord(true)
                 .build()
                 .parse(reader)) {
            assertThat(parser.getHeaderNames()).containsExactly(CsvListingSink.HEADER);
            List<CSVRecord> records = parser.getRecords();
            assertThat(records).hasSize(2);
            assertThat(records.get(0).get("title")).isEqualTo("Backend Engineer, Senior");
            assertThat(records.get(0).get("skills")).isEqualTo("Java, SQL");
            assertThat(records.get(0).get("fetch_time")).isEqualTo("2026-03-01T00:00:00Z");
            assertThat(records.get(1).get("title")).isEqualTo("QA \"Lead\"");
            assertThat(records.get(1).get("link")).isEqualTo("https://jobs.example.com/2");
        }
    }

    @Test
    void unwritableTargetSurfacesAsSinkException() throws Exception {
        Path directory = Files.createDirectory(tempDir.resolve("taken"));
        CsvListingSink sink = new CsvListingSink(directory);

        assertThatThrownBy(() -> sink.write(listing("X", "https://jobs.example.com/x", List.of())))
            .isInstanceOf(SinkException.class)
            .hasMessageContaining("taken");
    }

    private static JobListing listing(String title, String link, List<String> skills) {
        return new JobListing(
            title, link, "Acme", "Remote", null, null, null, skills, "jobs",
            Instant.parse("2026-03-01T00:00:00Z")
        );
    }
}
