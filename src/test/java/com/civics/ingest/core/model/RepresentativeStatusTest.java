package com.civics.ingest.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class RepresentativeStatusTest {

    @Test
    @DisplayName("Should allow only forward transitions")
    void testTransitions() {
        assertTrue(RepresentativeStatus.ACTIVE.canTransitionTo(RepresentativeStatus.INACTIVE));
        assertTrue(RepresentativeStatus.ACTIVE.canTransitionTo(RepresentativeStatus.HISTORICAL));
        assertTrue(RepresentativeStatus.INACTIVE.canTransitionTo(RepresentativeStatus.HISTORICAL));

        assertFalse(RepresentativeStatus.INACTIVE.canTransitionTo(RepresentativeStatus.ACTIVE));
        assertFalse(RepresentativeStatus.HISTORICAL.canTransitionTo(RepresentativeStatus.ACTIVE));
        assertFalse(RepresentativeStatus.HISTORICAL.canTransitionTo(RepresentativeStatus.INACTIVE));
        assertTrue(RepresentativeStatus.HISTORICAL.isTerminal());
    }

    @Test
    @DisplayName("Should parse status hints leniently")
    void testHints() {
        assertEquals(StatusReason.DECEASED, StatusReason.fromHint(" Deceased ").orElseThrow());
        assertEquals(StatusReason.TERM_ENDED, StatusReason.fromHint("term-ended").orElseThrow());
        assertTrue(StatusReason.fromHint("resigned").isEmpty());
        assertTrue(StatusReason.fromHint(null).isEmpty());
    }

    @Test
    @DisplayName("Should parse upper-case hints regardless of the default locale")
    void testHintsUnderTurkishLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(StatusReason.RETIRED, StatusReason.fromHint("RETIRED").orElseThrow());
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    @DisplayName("Should only promote for end-of-service reasons")
    void testPromotionReasons() {
        assertTrue(StatusReason.RETIRED.isPromotionReason());
        assertTrue(StatusReason.DECEASED.isPromotionReason());
        assertFalse(StatusReason.REPLACED.isPromotionReason());
        assertFalse(StatusReason.NOT_CURRENT_IN_SOURCE.isPromotionReason());
    }

    @Test
    @DisplayName("Should resolve providers by key")
    void testProviderKeys() {
        assertEquals(Provider.CAMPAIGN_FINANCE, Provider.fromKey("finance"));
        assertTrue(Provider.CAMPAIGN_FINANCE.isEnrichmentOnly());
        assertFalse(Provider.CAMPAIGN_FINANCE.isCurrentRoster());
        assertTrue(Provider.STATE_LEGISLATURE.isGovernmentSource());
        assertFalse(Provider.CIVIC_LOOKUP.isGovernmentSource());
    }
}
