package com.hierarchy.federation.similarity;

import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.rules.Role;
import com.hierarchy.federation.rules.TitleCanonicalizer;

import java.util.EnumSet;
import java.util.Set;

/**
 * Title agreement between two records.
 *
 * <p>Identical canonical titles (after synonym expansion) score 1.0. Otherwise
 * the score is {@code 0.7 * tokenJaccard + 0.3 * roleJaccard}, where the role
 * sets are the records' leadership/manager classifications.</p>
 */
public class TitleSimilarity {

    static final double TOKEN_WEIGHT = 0.7;
    static final double ROLE_WEIGHT = 0.3;

    private final TitleCanonicalizer canonicalizer;

    public TitleSimilarity(TitleCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    public double compute(PersonRecord a, PersonRecord b) {
        String titleA = canonicalizer.canonicalize(a.getTitle());
        String titleB = canonicalizer.canonicalize(b.getTitle());
        if (titleA.isEmpty() || titleB.isEmpty()) {
            return 0.0;
        }
        if (titleA.equals(titleB)) {
            return 1.0;
        }
        double tokenScore = JaccardSimilarity.compute(
                canonicalizer.canonicalTokens(a.getTitle()),
                canonicalizer.canonicalTokens(b.getTitle()));
        double roleScore = JaccardSimilarity.compute(roles(a), roles(b));
        return TOKEN_WEIGHT * tokenScore + ROLE_WEIGHT * roleScore;
    }

    static Set<Role> roles(PersonRecord record) {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        if (record.isLeadership()) {
            roles.add(Role.LEADERSHIP);
        }
        if (record.isManager()) {
            roles.add(Role.MANAGER);
        }
        return roles;
    }
}
