package com.hierarchy.federation.similarity;

import com.hierarchy.federation.core.model.Departments;
import com.hierarchy.federation.core.model.PersonRecord;

import java.util.Optional;

/**
 * Blocks on the first character of the normalized name key and the
 * case-insensitive department.
 *
 * <p>Matches whose names start differently (nicknames, transliterations) or
 * whose departments are labelled differently in each system are not found.</p>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    @Override
    public Optional<BlockingKey> blockingKey(PersonRecord record) {
        String nameKey = record.getNormalizedNameKey();
        if (nameKey == null || nameKey.isBlank()) {
            return Optional.empty();
        }
        String trimmed = nameKey.trim();
        String prefix = new String(Character.toChars(trimmed.codePointAt(0)));
        return Optional.of(new BlockingKey(prefix, Departments.key(record.getDepartment())));
    }
}
