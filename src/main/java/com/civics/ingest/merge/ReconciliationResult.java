package com.civics.ingest.merge;

import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.CrosswalkKey;
import com.civics.ingest.core.model.FieldKey;

import java.util.List;
import java.util.Set;

/**
 * The merged entity plus what the merge changed.
 *
 * @param created                 whether there was no persisted state before
 * @param changedFields           fields whose value differs from the persisted state
 * @param skippedCrossReferences  cross references not added because another entity owns them
 */
public record ReconciliationResult(
        CanonicalRepresentative representative,
        boolean created,
        Set<FieldKey> changedFields,
        List<CrosswalkKey> skippedCrossReferences
) {
    public ReconciliationResult {
        changedFields = Set.copyOf(changedFields);
        skippedCrossReferences = List.copyOf(skippedCrossReferences);
    }
}
