package com.cohortengine.model.filter;

import com.cohortengine.model.enums.PropertyOperator;
import com.cohortengine.model.enums.PropertyType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A single property filter. {@code value} is kept as raw JSON because it may
 * be a scalar, a list (for exact / is_not) or a cohort id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PropertyFilter(
    String key,
    String operator,
    JsonNode value,
    String type,
    Boolean negation
) {

    public static PropertyFilter person(String key, String operator, String value) {
        return new PropertyFilter(key, operator, value == null ? null : TextNode.valueOf(value), "person", null);
    }

    public static PropertyFilter cohort(long cohortId) {
        return new PropertyFilter("id", null, TextNode.valueOf(String.valueOf(cohortId)), "cohort", null);
    }

    @JsonIgnore
    public PropertyType propertyType() {
        return type == null ? PropertyType.PERSON : PropertyType.fromValue(type);
    }

    @JsonIgnore
    public PropertyOperator propertyOperator() {
        return PropertyOperator.fromValue(operator);
    }

    @JsonIgnore
    public boolean isNegated() {
        return Boolean.TRUE.equals(negation);
    }

    /**
     * Flattens {@code value} into strings; null yields an empty list.
     */
    @JsonIgnore
    public List<String> values() {
        List<String> result = new ArrayList<>();
        if (value == null || value.isNull() || value.isMissingNode()) {
            return result;
        }
        if (value.isArray()) {
            value.forEach(node -> {
                if (!node.isNull()) {
                    result.add(node.asText());
                }
            });
        } else {
            result.add(value.asText());
        }
        return result;
    }

    @JsonIgnore
    public String firstValue() {
        List<String> values = values();
        return values.isEmpty() ? null : values.get(0);
    }
}
