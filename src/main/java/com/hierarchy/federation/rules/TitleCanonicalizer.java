package com.hierarchy.federation.rules;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rewrites job titles into a canonical token form using a synonym table,
 * so that "Sr. Mgr" and "Senior Manager" compare as the same title.
 *
 * <p>A synonym whose key matches the whole folded title wins; otherwise each
 * token is expanded on its own.</p>
 */
public class TitleCanonicalizer {
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<String, String> synonyms;

    public TitleCanonicalizer(Map<String, String> synonyms) {
        Map<String, String> folded = new LinkedHashMap<>();
        if (synonyms != null) {
            synonyms.forEach((key, value) -> {
                String foldedKey = fold(key);
                if (!foldedKey.isEmpty()) {
                    folded.put(foldedKey, fold(value));
                }
            });
        }
        this.synonyms = Collections.unmodifiableMap(folded);
    }

    public Map<String, String> getSynonyms() {
        return synonyms;
    }

    /**
     * Lower-cases, strips diacritics and punctuation, and collapses whitespace.
     */
    public static String fold(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String stripped = COMBINING_MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
        String spaced = NON_WORD.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(spaced.trim()).replaceAll(" ");
    }

    /**
     * Returns the canonical form of the title as a single space-separated string.
     */
    public String canonicalize(String title) {
        return String.join(" ", canonicalTokens(title));
    }

    /**
     * Returns the canonical tokens of the title, in title order.
     */
    public List<String> canonicalTokens(String title) {
        String folded = fold(title);
        if (folded.isEmpty()) {
            return List.of();
        }
        String whole = synonyms.get(folded);
        if (whole != null) {
            return tokens(whole);
        }
        List<String> result = new ArrayList<>();
        for (String token : tokens(folded)) {
            String expansion = synonyms.get(token);
            if (expansion != null) {
                result.addAll(tokens(expansion));
            } else {
                result.add(token);
            }
        }
        return List.copyOf(result);
    }

    static List<String> tokens(String folded) {
        if (folded.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(folded));
    }
}
