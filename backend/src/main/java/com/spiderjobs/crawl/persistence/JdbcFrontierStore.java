package com.spiderjobs.crawl.persistence;

import com.spiderjobs.crawl.frontier.FrontierStore;
import com.spiderjobs.crawl.model.FetchTask;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class JdbcFrontierStore implements FrontierStore {
    private final NamedParameterJdbcTemplate jdbc;

    public JdbcFrontierStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    @Transactional
    public void save(List<FetchTask> tasks) {
        jdbc.update("DELETE FROM frontier_tasks", new MapSqlParameterSource());
        if (tasks == null || tasks.isEmpty()) {
            return;
        }
        SqlParameterSource[] batch = tasks.stream()
            .map(task -> new MapSqlParameterSource()
                .addValue("url", task.url())
                .addValue("siteId", task.siteId())
                .addValue("depth", task.depth())
                .addValue("priority", task.priority())
                .addValue("enqueueTime", timestamp(task.enqueueTime()))
                .addValue("attemptCount", task.attemptCount())
                .addValue("blockedCount", task.blockedCount())
                .addValue("notBefore", timestamp(task.notBefore())))
            .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO frontier_tasks (
                    url, site_id, depth, priority, enqueue_time, attempt_count, blocked_count, not_before
                ) VALUES (
                    :url, :siteId, :depth, :priority, :enqueueTime, :attemptCount, :blockedCount, :notBefore
                )
                """,
            batch
        );
    }

    @Override
    @Transactional
    public List<FetchTask> takeAll() {
        List<FetchTask> tasks = jdbc.query(
            """
                SELECT url, site_id, depth, priority, enqueue_time, attempt_count, blocked_count, not_before
                FROM frontier_tasks
                ORDER BY id ASC
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new FetchTask(
                rs.getString("url"),
                rs.getString("site_id"),
                rs.getInt("depth"),
                rs.getInt("priority"),
                instant(rs.getTimestamp("enqueue_time")),
                rs.getInt("attempt_count"),
                rs.getInt("blocked_count"),
                instant(rs.getTimestamp("not_before"))
            )
        );
        jdbc.update("DELETE FROM frontier_tasks", new MapSqlParameterSource());
        return tasks;
    }

    public int count() {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM frontier_tasks", new MapSqlParameterSource(), Integer.class);
        return count == null ? 0 : count;
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
