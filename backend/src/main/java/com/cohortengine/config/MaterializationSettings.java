package com.cohortengine.config;

/**
 * Sizing for membership writes.
 *
 * @param batchSize persons examined per materialization page
 * @param staticInsertChunkSize person ids inserted per static-membership transaction
 */
public record MaterializationSettings(
    int batchSize,
    int staticInsertChunkSize
) {

    public MaterializationSettings {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (staticInsertChunkSize <= 0) {
            throw new IllegalArgumentException("staticInsertChunkSize must be positive: " + staticInsertChunkSize);
        }
    }
}
