package com.taggernews.ingest.http;

import com.taggernews.ingest.error.PermanentFetchException;
import com.taggernews.ingest.error.TransientFetchException;
import com.taggernews.ingest.model.ContentItem;

import java.util.List;

/**
 * Read-only view of the external item feed. Each call is a single attempt; callers own retries.
 */
public interface ContentSource {

    long maxItemId() throws TransientFetchException, PermanentFetchException;

    /**
     * @throws PermanentFetchException when the item is missing, deleted, dead or unreadable
     * @throws TransientFetchException when the call may succeed later
     */
    ContentItem fetchItem(long id) throws TransientFetchException, PermanentFetchException;

    List<Long> topStoryIds(int limit) throws TransientFetchException, PermanentFetchException;
}
