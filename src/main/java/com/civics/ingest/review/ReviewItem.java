package com.civics.ingest.review;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * An entry in the manual review queue.
 *
 * <p>The subject is what the decision is about: a crosswalk key such as {@code civic:ocd-division/...}
 * for match decisions, or an office slot for replacement conflicts. Candidates are the canonical
 * ids involved.</p>
 */
public class ReviewItem {

    private final String id;
    private final ReviewReason reason;
    private final String subject;
    private final List<String> candidateIds;
    private final String description;
    private final double score;
    private final String referenceId;
    private final String runId;
    private final Instant submittedAt;
    private ReviewStatus status;
    private Instant reviewedAt;
    private String reviewerId;
    private String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.reason = Objects.requireNonNull(builder.reason, "reason is required");
        this.subject = Objects.requireNonNull(builder.subject, "subject is required");
        this.candidateIds = builder.candidateIds != null ? List.copyOf(builder.candidateIds) : List.of();
        this.description = builder.description;
        this.score = builder.score;
        this.referenceId = builder.referenceId;
        this.runId = builder.runId;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.status = ReviewStatus.PENDING;
    }

    public String getId() {
        return id;
    }

    public ReviewReason getReason() {
        return reason;
    }

    public String getSubject() {
        return subject;
    }

    public List<String> getCandidateIds() {
        return candidateIds;
    }

    public String getDescription() {
        return description;
    }

    public double getScore() {
        return score;
    }

    /**
     * Id of the record this item acts on when decided, e.g. a fuzzy match ledger entry.
     */
    public String getReferenceId() {
        return referenceId;
    }

    public String getRunId() {
        return runId;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public synchronized ReviewStatus getStatus() {
        return status;
    }

    public synchronized Instant getReviewedAt() {
        return reviewedAt;
    }

    public synchronized String getReviewerId() {
        return reviewerId;
    }

    public synchronized String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return getStatus() == ReviewStatus.PENDING;
    }

    /**
     * Two items with the same key describe the same open question.
     */
    public String dedupKey() {
        return reason + "|" + subject + "|" + candidateIds.stream().sorted().toList();
    }

    synchronized void decide(ReviewStatus decision, String reviewerId, String notes, Instant at) {
        this.status = decision;
        this.reviewerId = reviewerId;
        this.notes = notes;
        this.reviewedAt = at;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((ReviewItem) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", reason=" + reason +
                ", subject='" + subject + '\'' +
                ", candidates=" + candidateIds +
                ", score=" + score +
                ", status=" + getStatus() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private ReviewReason reason;
        private String subject;
        private List<String> candidateIds;
        private String description;
        private double score;
        private String referenceId;
        private String runId;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder reason(ReviewReason reason) {
            this.reason = reason;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder candidateIds(List<String> candidateIds) {
            this.candidateIds = candidateIds;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder referenceId(String referenceId) {
            this.referenceId = referenceId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
