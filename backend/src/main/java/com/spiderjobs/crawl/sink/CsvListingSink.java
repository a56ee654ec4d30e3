package com.spiderjobs.crawl.sink;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.model.JobListing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends listings to a CSV file, writing the header when the file is new.
 */
@Component
@ConditionalOnProperty(prefix = "crawler.sink", name = "type", havingValue = "csv")
public class CsvListingSink implements ListingSink {
    private static final Logger log = LoggerFactory.getLogger(CsvListingSink.class);

    static final String[] HEADER = {
        "title", "link", "company", "location", "posted_date", "salary",
        "logo_url", "skills", "source_site", "fetch_time"
    };

    private final Path path;
    private final CSVFormat format = CSVFormat.DEFAULT.builder().setRecordSeparator('\n').build();

    @Autowired
    public CsvListingSink(CrawlerProperties properties) {
        this(Path.of(properties.getSink().getCsvPath()));
    }

    public CsvListingSink(Path path) {
        this.path = path;
    }

    @Override
    public synchronized void write(JobListing listing) throws SinkException {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            boolean fresh = !Files.exists(path) || Files.size(path) == 0;
            try (Writer writer = Files.newBufferedWriter(
                path,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            ); CSVPrinter printer = new CSVPrinter(writer, format)) {
                if (fresh) {
                    printer.printRecord((Object[]) HEADER);
                }
                printer.printRecord(
                    listing.title(),
                    listing.canonicalLink(),
                    listing.company(),
                    listing.location(),
                    listing.postedDate(),
                    listing.salary(),
                    listing.logoUrl(),
                    String.join(", ", listing.skills()),
                    listing.sourceSite(),
                    listing.fetchTime() == null ? null : listing.fetchTime().toString()
                );
            }
        } catch (IOException e) {
            throw new SinkException("failed to append listing to " + path, e);
        }
        log.debug("Appended {} to {}", listing.canonicalLink(), path);
    }

    @Override
    public String name() {
        return "csv";
    }

    public Path path() {
        return path;
    }
}
