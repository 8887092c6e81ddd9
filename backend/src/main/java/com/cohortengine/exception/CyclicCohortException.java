package com.cohortengine.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A chain of cohort references that leads back to a cohort already being expanded.
 * Direct self-references are not cycles and never raise this.
 */
public class CyclicCohortException extends CohortValidationException {

    private final List<Long> path;

    public CyclicCohortException(List<Long> path) {
        super("Cyclic cohort reference: " + path.stream()
            .map(String::valueOf)
            .collect(Collectors.joining(" -> ")));
        this.path = List.copyOf(path);
    }

    public List<Long> getPath() {
        return path;
    }
}
