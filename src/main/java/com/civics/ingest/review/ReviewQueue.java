package com.civics.ingest.review;

import com.civics.ingest.api.Page;
import com.civics.ingest.api.PageRequest;

import java.time.Instant;
import java.util.Optional;

/**
 * Queue of items waiting for a human decision.
 */
public interface ReviewQueue {

    /**
     * Adds an item unless a pending item with the same {@link ReviewItem#dedupKey()} exists.
     *
     * @return the queued item, or the already pending duplicate
     */
    ReviewItem submit(ReviewItem item);

    Page<ReviewItem> getPending(PageRequest page);

    Page<ReviewItem> getPendingByReason(ReviewReason reason, PageRequest page);

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item was already decided
     */
    ReviewItem decide(String reviewId, ReviewStatus decision, String reviewerId, String notes, Instant at);

    Optional<ReviewItem> get(String reviewId);

    long countPending();
}
