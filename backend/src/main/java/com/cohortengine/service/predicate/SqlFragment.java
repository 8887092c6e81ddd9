package com.cohortengine.service.predicate;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A SQL boolean expression with its named parameters. User-supplied values
 * only ever appear in {@code parameters}, never in {@code sql}.
 */
public record SqlFragment(String sql, Map<String, Object> parameters) {

    public SqlFragment {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public MapSqlParameterSource toParameterSource() {
        return new MapSqlParameterSource(parameters);
    }

    /**
     * Parameters of this fragment plus {@code extra}; names must not collide.
     */
    public MapSqlParameterSource withParameters(Map<String, ?> extra) {
        MapSqlParameterSource source = toParameterSource();
        extra.forEach((name, value) -> {
            if (parameters.containsKey(name)) {
                throw new IllegalArgumentException("Parameter name collision: " + name);
            }
            source.addValue(name, value);
        });
        return source;
    }
}
