package com.civics.ingest.core.model;

/**
 * Read-only view over the contact fields of a representative.
 */
public record ContactInfo(String email, String phone, String website, String photoUrl, String officeAddress) {
}
