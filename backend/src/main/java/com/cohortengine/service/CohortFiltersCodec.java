package com.cohortengine.service;

import com.cohortengine.exception.InvalidCohortDefinitionException;
import com.cohortengine.model.cohort.Action;
import com.cohortengine.model.cohort.Cohort;
import com.cohortengine.model.filter.ActionStep;
import com.cohortengine.model.filter.CohortFilters;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads and writes the JSON blobs stored on cohort and action rows.
 * A definition that cannot be parsed is an error, never an empty default.
 */
@Component
public class CohortFiltersCodec {

    private static final TypeReference<List<ActionStep>> STEP_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public CohortFiltersCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CohortFilters read(Cohort cohort) {
        String json = cohort.getFilters();
        if (json == null || json.isBlank()) {
            return CohortFilters.empty();
        }
        try {
            CohortFilters filters = objectMapper.readValue(json, CohortFilters.class);
            return filters != null ? filters : CohortFilters.empty();
        } catch (JsonProcessingException e) {
            throw new InvalidCohortDefinitionException(
                "Cohort " + cohort.getId() + " has malformed filters: " + e.getOriginalMessage(), e);
        }
    }

    public String write(CohortFilters filters) {
        try {
            return objectMapper.writeValueAsString(filters != null ? filters : CohortFilters.empty());
        } catch (JsonProcessingException e) {
            throw new InvalidCohortDefinitionException("Cannot serialize cohort filters: " + e.getOriginalMessage(), e);
        }
    }

    public List<ActionStep> readSteps(Action action) {
        String json = action.getSteps();
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<ActionStep> steps = objectMapper.readValue(json, STEP_LIST);
            return steps != null ? steps : List.of();
        } catch (JsonProcessingException e) {
            throw new InvalidCohortDefinitionException(
                "Action " + action.getId() + " has malformed steps: " + e.getOriginalMessage(), e);
        }
    }

}
