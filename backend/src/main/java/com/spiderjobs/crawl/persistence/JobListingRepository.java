package com.spiderjobs.crawl.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spiderjobs.crawl.model.JobListing;
import com.spiderjobs.crawl.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class JobListingRepository {
    private static final Logger log = LoggerFactory.getLogger(JobListingRepository.class);
    private static final TypeReference<List<String>> SKILLS_TYPE = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public JobListingRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    /**
     * Inserts the listing keyed by its content fingerprint.
     *
     * @return false when a listing with the same fingerprint is already stored
     */
    public boolean insertIfAbsent(JobListing listing) {
        String fingerprint = HashUtils.contentFingerprint(listing.title(), listing.company(), listing.canonicalLink());
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("fingerprint", fingerprint)
            .addValue("title", truncate(listing.title(), 512))
            .addValue("link", truncate(listing.canonicalLink(), 2048))
            .addValue("company", truncate(listing.company(), 512))
            .addValue("location", truncate(listing.location(), 512))
            .addValue("postedDate", truncate(listing.postedDate(), 64))
            .addValue("salary", truncate(listing.salary(), 256))
            .addValue("logoUrl", truncate(listing.logoUrl(), 2048))
            .addValue("skills", toJson(listing.skills()))
            .addValue("sourceSite", listing.sourceSite())
            .addValue("fetchTime", listing.fetchTime() == null ? null : Timestamp.from(listing.fetchTime()))
            .addValue("createdAt", Timestamp.from(Instant.now()));

        Integer existing = jdbc.queryForObject(
            "SELECT COUNT(*) FROM job_listings WHERE content_fingerprint = :fingerprint",
            params,
            Integer.class
        );
        if (existing != null && existing > 0) {
            return false;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO job_listings (
                        content_fingerprint, title, canonical_link, company, location, posted_date,
                        salary, logo_url, skills_json, source_site, fetch_time, created_at
                    ) VALUES (
                        :fingerprint, :title, :link, :company, :location, :postedDate,
                        :salary, :logoUrl, :skills, :sourceSite, :fetchTime, :createdAt
                    )
                    """,
                params
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public long countBySite(String sourceSite) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM job_listings WHERE source_site = :sourceSite",
            new MapSqlParameterSource("sourceSite", sourceSite),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public List<JobListing> findBySite(String sourceSite, int limit) {
        return jdbc.query(
            """
                SELECT title, canonical_link, company, location, posted_date, salary, logo_url,
                       skills_json, source_site, fetch_time
                FROM job_listings
                WHERE source_site = :sourceSite
                ORDER BY id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("sourceSite", sourceSite)
                .addValue("limit", Math.max(1, limit)),
            (rs, rowNum) -> mapListing(rs)
        );
    }

    private JobListing mapListing(ResultSet rs) throws SQLException {
        Timestamp fetchTime = rs.getTimestamp("fetch_time");
        return new JobListing(
            rs.getString("title"),
            rs.getString("canonical_link"),
            rs.getString("company"),
            rs.getString("location"),
            rs.getString("posted_date"),
            rs.getString("salary"),
            rs.getString("logo_url"),
            fromJson(rs.getString("skills_json")),
            rs.getString("source_site"),
            fetchTime == null ? null : fetchTime.toInstant()
        );
    }

    private String toJson(List<String> skills) {
        try {
            return objectMapper.writeValueAsString(skills == null ? List.of() : skills);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize skills {}", skills, e);
            return "[]";
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, SKILLS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable skills column {}", json, e);
            return List.of();
        }
    }

    private String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
