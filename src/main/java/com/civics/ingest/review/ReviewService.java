package com.civics.ingest.review;

import com.civics.ingest.api.Page;
import com.civics.ingest.api.PageRequest;
import com.civics.ingest.audit.AuditAction;
import com.civics.ingest.audit.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Coordinates the review queue with the audit trail and with fuzzy match reversal.
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final AuditService auditService;
    private final FuzzyMatchReverter fuzzyMatchReverter;
    private final Clock clock;

    public ReviewService(ReviewQueue reviewQueue, AuditService auditService,
                         FuzzyMatchReverter fuzzyMatchReverter, Clock clock) {
        this.reviewQueue = reviewQueue;
        this.auditService = auditService;
        this.fuzzyMatchReverter = fuzzyMatchReverter;
        this.clock = clock;
    }

    /**
     * Queues an item and audits the request. A pending duplicate is returned unchanged
     * and not audited again.
     */
    public ReviewItem submitForReview(ReviewItem item) {
        ReviewItem queued = reviewQueue.submit(item);
        if (queued == item) {
            Map<String, Object> details = new HashMap<>();
            details.put("reviewItemId", item.getId());
            details.put("reason", item.getReason().name());
            details.put("subject", item.getSubject());
            details.put("candidates", item.getCandidateIds());
            details.put("score", item.getScore());
            auditService.record(AuditAction.MANUAL_REVIEW_REQUESTED,
                    item.getCandidateIds().isEmpty() ? null : item.getCandidateIds().get(0),
                    item.getRunId(), details);
            log.info("review.submitted reviewItemId={} reason={} subject={} candidates={}",
                    item.getId(), item.getReason(), item.getSubject(), item.getCandidateIds());
        }
        return queued;
    }

    public ReviewItem approve(String reviewId, String reviewerId, String notes) {
        ReviewItem item = reviewQueue.decide(reviewId, ReviewStatus.APPROVED, reviewerId, notes, clock.instant());
        auditDecision(item, reviewerId, notes);
        return item;
    }

    /**
     * Rejects an item. Rejecting a {@link ReviewReason#FUZZY_MATCH} reverts the match.
     */
    public ReviewItem reject(String reviewId, String reviewerId, String notes) {
        ReviewItem item = reviewQueue.decide(reviewId, ReviewStatus.REJECTED, reviewerId, notes, clock.instant());
        if (item.getReason() == ReviewReason.FUZZY_MATCH && item.getReferenceId() != null) {
            fuzzyMatchReverter.revert(item.getReferenceId(), reviewerId);
        }
        auditDecision(item, reviewerId, notes);
        return item;
    }

    public Page<ReviewItem> getPendingReviews(PageRequest page) {
        return reviewQueue.getPending(page);
    }

    public Page<ReviewItem> getPendingReviews(ReviewReason reason, PageRequest page) {
        return reviewQueue.getPendingByReason(reason, page);
    }

    public Optional<ReviewItem> getReviewItem(String reviewId) {
        return reviewQueue.get(reviewId);
    }

    public long getPendingCount() {
        return reviewQueue.countPending();
    }

    private void auditDecision(ReviewItem item, String reviewerId, String notes) {
        auditService.recordByActor(AuditAction.MANUAL_REVIEW_COMPLETED,
                item.getCandidateIds().isEmpty() ? null : item.getCandidateIds().get(0),
                reviewerId, Map.of(
                        "reviewItemId", item.getId(),
                        "reason", item.getReason().name(),
                        "decision", item.getStatus().name(),
                        "notes", notes != null ? notes : ""
                ));
        log.info("review.completed reviewItemId={} reason={} decision={} reviewer={}",
                item.getId(), item.getReason(), item.getStatus(), reviewerId);
    }
}
