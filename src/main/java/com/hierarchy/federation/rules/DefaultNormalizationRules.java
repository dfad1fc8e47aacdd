package com.hierarchy.federation.rules;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in name folding rules and title tables.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with the person name rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(getPersonRules());
    }

    /**
     * Rules for folding person names: honorifics, suffixes and punctuation.
     */
    public static List<NormalizationRule> getPersonRules() {
        return List.of(
                // Leading honorifics
                NormalizationRule.builder()
                        .name("person-honorific")
                        .pattern("^\\s*(mr|mrs|ms|miss|mx|dr|prof|sir|dame)\\.?\\s+")
                        .replacement("")
                        .priority(10)
                        .build(),

                // Trailing generational and academic suffixes, possibly chained
                NormalizationRule.builder()
                        .name("person-suffix")
                        .pattern("(,?\\s+(jr|sr|junior|senior|ii|iii|iv|phd|md|esq)\\.?)+\\s*$")
                        .replacement("")
                        .priority(20)
                        .build(),

                // Apostrophes join the surrounding letters (O'Brien -> obrien)
                NormalizationRule.builder()
                        .name("common-apostrophe")
                        .pattern("['’`]")
                        .replacement("")
                        .priority(90)
                        .build(),

                // Any other punctuation separates tokens
                NormalizationRule.builder()
                        .name("common-punctuation")
                        .pattern("[^\\p{L}\\p{Nd}\\s]")
                        .replacement(" ")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }

    /**
     * Title abbreviations and their expansions. Keys and values are folded form.
     */
    public static Map<String, String> getTitleSynonyms() {
        Map<String, String> synonyms = new LinkedHashMap<>();
        synonyms.put("ceo", "chief executive officer");
        synonyms.put("cfo", "chief financial officer");
        synonyms.put("cmo", "chief marketing officer");
        synonyms.put("cto", "chief technology officer");
        synonyms.put("coo", "chief operating officer");
        synonyms.put("vp", "vice president");
        synonyms.put("svp", "senior vice president");
        synonyms.put("evp", "executive vice president");
        synonyms.put("sr", "senior");
        synonyms.put("jr", "junior");
        synonyms.put("mgr", "manager");
        synonyms.put("dir", "director");
        synonyms.put("asst", "assistant");
        synonyms.put("ops", "operations");
        synonyms.put("mktg", "marketing");
        synonyms.put("subagent", "sub agent");
        return synonyms;
    }

    /**
     * Keyword phrases that classify a title as leadership.
     */
    public static Set<String> getLeadershipKeywords() {
        return Set.of("Chief", "VP", "Vice President", "President", "Director", "Head", "CEO", "Master Agent");
    }

    /**
     * Keyword phrases that classify a title as management.
     */
    public static Set<String> getManagerKeywords() {
        return Set.of("Manager", "Lead", "Supervisor");
    }
}
