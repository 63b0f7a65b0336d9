package com.example.geotagger.gateway;

/**
 * What a crawl lists: one uploader, a category subtree, or an explicit set of ids.
 */
public interface CrawlScope {
    /**
     * Short human-readable description for log lines.
     */
    String describe();
}
