package com.cohortengine.service.materialize;

import com.cohortengine.model.enums.CalculationStatus;

import java.time.Duration;

/**
 * Outcome of one materialization run.
 *
 * @param baseVersion committed version the delta was computed against, null for the first run
 * @param status COMMITTED or SUPERSEDED; failed runs throw instead of returning
 * @param memberCount net members after the run, null when superseded
 */
public record MembershipSnapshotResult(
    long cohortId,
    int version,
    Integer baseVersion,
    CalculationStatus status,
    long added,
    long removed,
    Long memberCount,
    Duration elapsed
) {

    public boolean committed() {
        return status == CalculationStatus.COMMITTED;
    }
}
