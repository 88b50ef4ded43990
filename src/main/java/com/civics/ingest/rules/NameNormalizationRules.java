package com.civics.ingest.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules for officials' names and office titles.
 */
public final class NameNormalizationRules {

    private NameNormalizationRules() {
    }

    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(personRules());
        rules.addAll(officeRules());
        rules.addAll(commonRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Honorifics, generational suffixes and the "Family, Given" inversion.
     */
    public static List<NormalizationRule> personRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("person-honorific")
                        .pattern("^(the\\s+)?(hon|honorable|rep|representative|sen|senator|delegate"
                                + "|mr|mrs|ms|miss|dr|rev|gov|governor|mayor|councilmember|judge)\\.?\\s+")
                        .scope(RuleScope.PERSON_NAME)
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("person-inverted")
                        .pattern("^([^,]+),\\s*([^,]+?)(,\\s*(jr|sr|ii|iii|iv)\\.?)?$")
                        .replacement("$2 $1")
                        .scope(RuleScope.PERSON_NAME)
                        .priority(20)
                        .build(),
                NormalizationRule.builder()
                        .name("person-suffix")
                        .pattern(",?\\s+(jr|sr|junior|senior|ii|iii|iv|md|phd|esq)\\.?$")
                        .scope(RuleScope.PERSON_NAME)
                        .priority(30)
                        .build(),
                NormalizationRule.builder()
                        .name("person-nickname")
                        .pattern("\\s*[\"\u201c(][^\"\u201d)]*[\"\u201d)]\\s*")
                        .replacement(" ")
                        .scope(RuleScope.PERSON_NAME)
                        .priority(40)
                        .build(),
                NormalizationRule.builder()
                        .name("person-initial")
                        .pattern("\\s[a-z]\\.?(?=\\s)")
                        .scope(RuleScope.PERSON_NAME)
                        .priority(60)
                        .build()
        );
    }

    /**
     * Collapses common spellings of the same office.
     */
    public static List<NormalizationRule> officeRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("office-us")
                        .pattern("\\b(u\\.\\s?s\\.|united states)\\s*")
                        .replacement("us ")
                        .scope(RuleScope.OFFICE_TITLE)
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("office-house-member")
                        .pattern("\\b(member of (the )?house of representatives|congressman|congresswoman)\\b")
                        .replacement("representative")
                        .scope(RuleScope.OFFICE_TITLE)
                        .priority(20)
                        .build(),
                NormalizationRule.builder()
                        .name("office-council")
                        .pattern("\\bcouncil\\s?(member|man|woman)\\b")
                        .replacement("councilmember")
                        .scope(RuleScope.OFFICE_TITLE)
                        .priority(20)
                        .build()
        );
    }

    public static List<NormalizationRule> commonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("common-punctuation")
                        .pattern("[^\\p{L}\\p{Nd}\\s]")
                        .replacement(" ")
                        .priority(50)
                        .build()
        );
    }
}
