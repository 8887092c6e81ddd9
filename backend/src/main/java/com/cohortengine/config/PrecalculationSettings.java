package com.cohortengine.config;

import java.time.Instant;

/**
 * Switches controlling whether readers may use precalculated cohort membership.
 *
 * @param usePrecalculatedMembership global toggle for the precalculated read path
 * @param cutover membership calculated at or before this instant is never trusted
 */
public record PrecalculationSettings(
    boolean usePrecalculatedMembership,
    Instant cutover
) {}
