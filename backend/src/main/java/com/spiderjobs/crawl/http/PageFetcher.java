package com.spiderjobs.crawl.http;

import com.spiderjobs.crawl.model.HttpFetchResult;
import com.spiderjobs.crawl.model.ProxyIdentity;

import java.time.Duration;

/**
 * Network fetch primitive. Implementations never throw for network problems; failures come
 * back as a result with an error code.
 */
public interface PageFetcher {
    HttpFetchResult fetch(String url, ProxyIdentity identity, Duration timeout);
}
