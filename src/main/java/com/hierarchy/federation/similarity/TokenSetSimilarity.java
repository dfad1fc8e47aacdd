package com.hierarchy.federation.similarity;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Token-set similarity for folded person names.
 *
 * <p>Tokens are de-duplicated and sorted, so word order does not matter. The
 * shared tokens ({@code t0}) and each side's full token string ({@code t0}
 * followed by that side's remaining tokens) are compared pairwise with
 * {@link LevenshteinSimilarity}, and the best score wins. Comparisons against
 * {@code t0} alone only count when at least two tokens are shared, so
 * "sarah ann johnson" matches "sarah johnson" fully while a lone shared
 * first name does not.</p>
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_SHARED_TOKENS_FOR_SUBSET = 2;

    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        if (tokens1.equals(tokens2)) {
            return 1.0;
        }

        List<String> shared = new ArrayList<>();
        List<String> rest1 = new ArrayList<>();
        List<String> rest2 = new ArrayList<>();
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                shared.add(token);
            } else {
                rest1.add(token);
            }
        }
        for (String token : tokens2) {
            if (!tokens1.contains(token)) {
                rest2.add(token);
            }
        }

        String t0 = String.join(" ", shared);
        String t1 = join(shared, rest1);
        String t2 = join(shared, rest2);

        double best = levenshtein.compute(t1, t2);
        if (shared.size() >= MIN_SHARED_TOKENS_FOR_SUBSET) {
            best = Math.max(best, Math.max(levenshtein.compute(t0, t1), levenshtein.compute(t0, t2)));
        }
        return best;
    }

    @Override
    public String getName() {
        return "TokenSet";
    }

    private static Set<String> tokenize(String s) {
        Set<String> tokens = new TreeSet<>();
        for (String token : WHITESPACE.split(s.trim())) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String join(List<String> head, List<String> tail) {
        List<String> all = new ArrayList<>(head);
        all.addAll(tail);
        return String.join(" ", all);
    }
}
