package com.hierarchy.federation.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies titles into {@link Role}s through keyword tables.
 *
 * <p>A keyword matches when its tokens appear as a contiguous run of whole
 * tokens, either in the folded title or in its synonym-expanded form
 * ("VP Sales" and "Vice President, Sales" both match the keyword "VP").
 * Classification is advisory and a title may carry both roles.</p>
 */
public class TitleClassifier {

    private final TitleCanonicalizer canonicalizer;
    private final List<List<String>> leadershipPhrases;
    private final List<List<String>> managerPhrases;

    public TitleClassifier(TitleCanonicalizer canonicalizer,
                           Collection<String> leadershipKeywords,
                           Collection<String> managerKeywords) {
        this.canonicalizer = canonicalizer;
        this.leadershipPhrases = compile(leadershipKeywords);
        this.managerPhrases = compile(managerKeywords);
    }

    public Set<Role> classify(String title) {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        List<String> folded = TitleCanonicalizer.tokens(TitleCanonicalizer.fold(title));
        if (folded.isEmpty()) {
            return roles;
        }
        List<String> canonical = canonicalizer.canonicalTokens(title);
        if (matchesAny(leadershipPhrases, folded, canonical)) {
            roles.add(Role.LEADERSHIP);
        }
        if (matchesAny(managerPhrases, folded, canonical)) {
            roles.add(Role.MANAGER);
        }
        return roles;
    }

    public boolean isLeadership(String title) {
        return classify(title).contains(Role.LEADERSHIP);
    }

    public boolean isManager(String title) {
        return classify(title).contains(Role.MANAGER);
    }

    public TitleCanonicalizer getCanonicalizer() {
        return canonicalizer;
    }

    private List<List<String>> compile(Collection<String> keywords) {
        // Each keyword is kept both as typed and synonym-expanded
        Set<List<String>> phrases = new LinkedHashSet<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                List<String> folded = TitleCanonicalizer.tokens(TitleCanonicalizer.fold(keyword));
                if (!folded.isEmpty()) {
                    phrases.add(folded);
                    phrases.add(canonicalizer.canonicalTokens(keyword));
                }
            }
        }
        List<List<String>> ordered = new ArrayList<>(phrases);
        ordered.sort(Comparator.comparing(phrase -> String.join(" ", phrase)));
        return List.copyOf(ordered);
    }

    private static boolean matchesAny(List<List<String>> phrases, List<String> folded, List<String> canonical) {
        for (List<String> phrase : phrases) {
            if (containsRun(folded, phrase) || containsRun(canonical, phrase)) {
                return true;
            }
        }
        return false;
    }

    static boolean containsRun(List<String> tokens, List<String> phrase) {
        if (phrase.isEmpty() || phrase.size() > tokens.size()) {
            return false;
        }
        for (int i = 0; i <= tokens.size() - phrase.size(); i++) {
            if (tokens.subList(i, i + phrase.size()).equals(phrase)) {
                return true;
            }
        }
        return false;
    }
}
