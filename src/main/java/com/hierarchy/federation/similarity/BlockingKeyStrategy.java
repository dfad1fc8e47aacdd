package com.hierarchy.federation.similarity;

import com.hierarchy.federation.core.model.PersonRecord;

import java.util.Optional;

/**
 * Strategy for assigning records to comparison blocks.
 * Only records that share a block (or a wildcard block with the same prefix)
 * are ever compared, which keeps resolution close to linear in the number of records.
 */
public interface BlockingKeyStrategy {

    /**
     * Returns the block of the record, or empty when the record cannot be blocked
     * (for example because its name folds to an empty key).
     */
    Optional<BlockingKey> blockingKey(PersonRecord record);
}
