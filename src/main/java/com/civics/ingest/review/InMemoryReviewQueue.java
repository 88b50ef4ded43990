package com.civics.ingest.review;

import com.civics.ingest.api.Page;
import com.civics.ingest.api.PageRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Stream;

/**
 * In-memory {@link ReviewQueue}.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> pendingByKey = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        String existingId = pendingByKey.putIfAbsent(item.dedupKey(), item.getId());
        if (existingId != null) {
            log.debug("review.duplicateIgnored reason={} subject={} existing={}",
                    item.getReason(), item.getSubject(), existingId);
            return items.get(existingId);
        }
        items.put(item.getId(), item);
        log.debug("review.queued id={} reason={} subject={} candidates={}",
                item.getId(), item.getReason(), item.getSubject(), item.getCandidateIds());
        return item;
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        return Page.slice(pendingSorted().toList(), page);
    }

    @Override
    public Page<ReviewItem> getPendingByReason(ReviewReason reason, PageRequest page) {
        return Page.slice(pendingSorted().filter(i -> i.getReason() == reason).toList(), page);
    }

    @Override
    public ReviewItem decide(String reviewId, ReviewStatus decision, String reviewerId, String notes, Instant at) {
        if (decision == ReviewStatus.PENDING) {
            throw new IllegalArgumentException("decision must be APPROVED or REJECTED");
        }
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        synchronized (item) {
            if (!item.isPending()) {
                throw new IllegalStateException("Review item is not pending: " + reviewId);
            }
            item.decide(decision, reviewerId, notes, at);
        }
        pendingByKey.remove(item.dedupKey(), reviewId);
        log.info("review.decided id={} decision={} reviewer={}", reviewId, decision, reviewerId);
        return item;
    }

    @Override
    public Optional<ReviewItem> get(String reviewId) {
        return Optional.ofNullable(items.get(reviewId));
    }

    @Override
    public long countPending() {
        return pendingByKey.size();
    }

    private Stream<ReviewItem> pendingSorted() {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt).thenComparing(ReviewItem::getId));
    }
}
