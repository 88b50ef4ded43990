package com.civics.ingest.core.model;

/**
 * Read-only view over the social media fields of a representative.
 */
public record SocialHandles(String twitter, String facebook, String youtube, String instagram) {
}
