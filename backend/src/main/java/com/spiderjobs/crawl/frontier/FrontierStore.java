package com.spiderjobs.crawl.frontier;

import com.spiderjobs.crawl.model.FetchTask;

import java.util.List;

/**
 * Durable home for frontier tasks between runs.
 */
public interface FrontierStore {

    /**
     * Replaces whatever was stored before with {@code tasks}.
     */
    void save(List<FetchTask> tasks);

    /**
     * Returns the stored tasks and clears the store.
     */
    List<FetchTask> takeAll();
}
