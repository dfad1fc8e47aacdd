package com.hierarchy.federation.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The eight levels of the agent/distributor ladder with their native titles.
 * Level 1 is the top of the ladder.
 */
public enum LadderLevel {
    MASTER_AGENT(1, "Master Agent"),
    SENIOR_MASTER_AGENT(2, "Senior Master Agent"),
    AGENT(3, "Agent"),
    SENIOR_AGENT(4, "Senior Agent"),
    SUB_AGENT(5, "Sub-Agent"),
    SENIOR_SUB_AGENT(6, "Senior Sub-Agent"),
    BASIC_AGENT(7, "Basic Agent"),
    CLERK(8, "Clerk");

    public static final int MIN = 1;
    public static final int MAX = 8;

    private final int ordinalLevel;
    private final String nativeTitle;

    LadderLevel(int ordinalLevel, String nativeTitle) {
        this.ordinalLevel = ordinalLevel;
        this.nativeTitle = nativeTitle;
    }

    public int level() {
        return ordinalLevel;
    }

    public String nativeTitle() {
        return nativeTitle;
    }

    public static boolean isValid(int level) {
        return level >= MIN && level <= MAX;
    }

    public static Optional<LadderLevel> ofLevel(int level) {
        if (!isValid(level)) {
            return Optional.empty();
        }
        return Optional.of(values()[level - 1]);
    }

    /**
     * Finds the level whose native title equals the given title, ignoring case.
     */
    public static Optional<LadderLevel> ofTitle(String title) {
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        String wanted = title.trim().toLowerCase(Locale.ROOT);
        for (LadderLevel level : values()) {
            if (level.nativeTitle.toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
