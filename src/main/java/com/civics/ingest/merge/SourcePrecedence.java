package com.civics.ingest.merge;

import com.civics.ingest.core.model.FieldCategory;
import com.civics.ingest.core.model.FieldKey;
import com.civics.ingest.core.model.Provider;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-category ranking of providers. Higher wins; equal ranks fall through to recency.
 *
 * <p>The roster providers are authoritative for identity and term data, campaign finance for
 * financial data. Contact data ranks every provider equally, so the most recently changed
 * value wins.</p>
 */
public final class SourcePrecedence {

    private final Map<FieldCategory, Map<Provider, Integer>> ranks;

    private SourcePrecedence(Map<FieldCategory, Map<Provider, Integer>> ranks) {
        this.ranks = ranks;
    }

    public static SourcePrecedence defaults() {
        Map<FieldCategory, Map<Provider, Integer>> ranks = new EnumMap<>(FieldCategory.class);
        ranks.put(FieldCategory.IDENTITY, ranking(100, 90, 40, 60));
        ranks.put(FieldCategory.TERM, ranking(100, 90, 30, 50));
        ranks.put(FieldCategory.AFFILIATION, ranking(100, 90, 70, 60));
        ranks.put(FieldCategory.FINANCIAL, ranking(50, 40, 100, 30));
        ranks.put(FieldCategory.CONTACT, ranking(0, 0, 0, 0));
        return new SourcePrecedence(ranks);
    }

    public int rank(FieldKey field, Provider provider) {
        return ranks.get(field.category()).getOrDefault(provider, 0);
    }

    private static Map<Provider, Integer> ranking(int federal, int state, int finance, int civic) {
        Map<Provider, Integer> byProvider = new EnumMap<>(Provider.class);
        byProvider.put(Provider.FEDERAL_ROSTER, federal);
        byProvider.put(Provider.STATE_LEGISLATURE, state);
        byProvider.put(Provider.CAMPAIGN_FINANCE, finance);
        byProvider.put(Provider.CIVIC_LOOKUP, civic);
        return byProvider;
    }
}
