package com.civics.ingest.lifecycle;

import java.util.List;

/**
 * Status moves planned for one roster provider, and the slots held back for review.
 */
public record TransitionPlan(List<StatusTransition> transitions, List<AmbiguousReplacement> ambiguous) {

    public TransitionPlan {
        transitions = List.copyOf(transitions);
        ambiguous = List.copyOf(ambiguous);
    }

    public static TransitionPlan empty() {
        return new TransitionPlan(List.of(), List.of());
    }

    public boolean isEmpty() {
        return transitions.isEmpty() && ambiguous.isEmpty();
    }

    public long replacements() {
        return transitions.stream().filter(StatusTransition::isReplacement).count();
    }

    public long deactivations() {
        return transitions.size() - replacements();
    }
}
