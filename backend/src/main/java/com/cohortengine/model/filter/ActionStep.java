package com.cohortengine.model.filter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One alternative of an action: event name, optional URL match and event/element property filters.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionStep(
    String event,
    String url,
    @JsonProperty("url_matching") String urlMatching,
    List<PropertyFilter> properties
) {

    public ActionStep {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }
}
