package com.cohortengine.model.filter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One match group of a cohort. A group may carry a behavioral clause
 * ("performed event/action, N times, within a window"), property filters, or
 * both; everything inside a group must hold.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CohortGroup(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("action_id") Long actionId,
    Integer days,
    @JsonProperty("start_date") String startDate,
    @JsonProperty("end_date") String endDate,
    Integer count,
    @JsonProperty("count_operator") String countOperator,
    List<PropertyFilter> properties
) {

    public CohortGroup {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    public static CohortGroup ofProperties(List<PropertyFilter> properties) {
        return new CohortGroup(null, null, null, null, null, null, null, properties);
    }

    public static CohortGroup performedEvent(String eventId, Integer days, Integer count, String countOperator) {
        return new CohortGroup(eventId, null, days, null, null, count, countOperator, null);
    }

    @JsonIgnore
    public boolean hasBehavioralClause() {
        return (eventId != null && !eventId.isBlank()) || actionId != null;
    }

    /**
     * True when behavioral fields are present without an event or action to apply them to.
     */
    @JsonIgnore
    public boolean hasDanglingBehavioralFields() {
        return !hasBehavioralClause()
            && (days != null || startDate != null || endDate != null || count != null || countOperator != null);
    }

    @JsonIgnore
    public boolean hasProperties() {
        return !properties.isEmpty();
    }
}
