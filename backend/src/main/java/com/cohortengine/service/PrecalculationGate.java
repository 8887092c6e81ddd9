package com.cohortengine.service;

import com.cohortengine.config.PrecalculationSettings;
import com.cohortengine.model.cohort.Cohort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides whether readers may use the materialized membership of a cohort
 * instead of evaluating its definition live.
 */
@Component
@RequiredArgsConstructor
public class PrecalculationGate {

    private final PrecalculationSettings settings;

    /**
     * True only for a dynamic cohort whose last calculation finished after the cutover,
     * while precalculated membership is enabled.
     */
    public boolean shouldUsePrecalculated(Cohort cohort) {
        if (!settings.usePrecalculatedMembership()) {
            return false;
        }
        if (cohort.isStatic()) {
            return false;
        }
        return cohort.getLastCalculation() != null
            && cohort.getLastCalculation().isAfter(settings.cutover());
    }
}
