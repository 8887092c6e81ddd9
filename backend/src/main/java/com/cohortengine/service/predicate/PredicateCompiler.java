package com.cohortengine.service.predicate;

import com.cohortengine.exception.InvalidCohortDefinitionException;
import com.cohortengine.exception.MissingActionException;
import com.cohortengine.model.cohort.Action;
import com.cohortengine.model.enums.CountOperator;
import com.cohortengine.model.enums.PropertyOperator;
import com.cohortengine.model.enums.PropertyType;
import com.cohortengine.model.enums.UrlMatching;
import com.cohortengine.model.filter.ActionStep;
import com.cohortengine.model.filter.CohortGroup;
import com.cohortengine.model.filter.PropertyFilter;
import com.cohortengine.repository.ActionRepository;
import com.cohortengine.service.CohortFiltersCodec;
import com.cohortengine.service.predicate.PersonPredicate.CountCondition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Predicate Compiler
 *
 * Compiles single cohort clauses into {@link PersonPredicate} trees:
 * - property clauses (person, event, element, static-cohort, precalculated-cohort)
 * - behavioral clauses (event or action, time window, optional count)
 *
 * Cohort-reference properties are expanded by {@code CohortGraphResolver}, not here.
 * Compilation has no side effects; the only lookup it performs is loading an
 * action definition referenced by a behavioral clause.
 */
@Service
@Slf4j
public class PredicateCompiler {

    private static final String CURRENT_URL = "$current_url";

    private static final List<Function<String, Instant>> TIMESTAMP_FORMATS = List.of(
        value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
        value -> OffsetDateTime.parse(value).toInstant(),
        value -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private final ActionRepository actionRepository;
    private final CohortFiltersCodec codec;
    private final SqlPredicateRenderer renderer;
    private final Clock clock;

    public PredicateCompiler(
            ActionRepository actionRepository,
            CohortFiltersCodec codec,
            SqlPredicateRenderer renderer,
            Clock clock) {
        this.actionRepository = actionRepository;
        this.codec = codec;
        this.renderer = renderer;
        this.clock = clock;
    }

    // ========================================================================
    // Public API
    // ========================================================================

    /**
     * Compile a property clause and render it against a {@code person_id} column.
     */
    public SqlFragment compile(PropertyFilter property, long teamId) {
        return renderer.render(compileProperty(property, teamId), "person_id", teamId);
    }

    /**
     * Compile a behavioral clause and render it against a {@code person_id} column.
     */
    public SqlFragment compile(CohortGroup behavioral, long teamId) {
        return renderer.render(compileBehavioral(behavioral, teamId), "person_id", teamId);
    }

    /**
     * Compile one non-cohort property clause.
     *
     * @throws IllegalArgumentException for {@code type=cohort}, which needs graph resolution
     */
    public PersonPredicate compileProperty(PropertyFilter property, long teamId) {
        PropertyType type = parseType(property);
        return switch (type) {
            case PERSON -> personProperty(property);
            case EVENT, ELEMENT -> performed(eventProperty(property));
            case STATIC_COHORT -> negate(property, cohortId(property)
                .<PersonPredicate>map(PersonPredicate.StaticCohortMember::new)
                .orElse(PersonPredicate.NONE));
            case PRECALCULATED_COHORT -> negate(property, cohortId(property)
                .<PersonPredicate>map(PersonPredicate.PrecalculatedCohortMember::new)
                .orElse(PersonPredicate.NONE));
            case COHORT -> throw new IllegalArgumentException(
                "Cohort references must be resolved through the cohort graph");
        };
    }

    /**
     * Compile the behavioral part of a group: events (or action matches) inside
     * the time window, optionally counted.
     */
    public PersonPredicate compileBehavioral(CohortGroup group, long teamId) {
        if (!group.hasBehavioralClause()) {
            throw new InvalidCohortDefinitionException("Cohort query requires action_id or event_id");
        }
        // validated even when no count is given
        CountOperator operator = CountOperator.fromValue(group.countOperator());

        List<EventPredicate> terms = new ArrayList<>();
        if (group.eventId() != null && !group.eventId().isBlank()) {
            terms.add(new EventPredicate.NameIs(group.eventId()));
        } else {
            terms.add(actionMatch(group.actionId(), teamId));
        }
        terms.addAll(timeWindow(group));

        EventPredicate filter = EventPredicate.and(terms);
        if (filter instanceof EventPredicate.Constant constant && !constant.value()) {
            return PersonPredicate.NONE;
        }
        CountCondition count = group.count() != null ? new CountCondition(operator, group.count()) : null;
        return new PersonPredicate.PerformedEvent(filter, count);
    }

    /**
     * Cohort id referenced by a cohort, static-cohort or precalculated-cohort property.
     */
    public Optional<Long> cohortId(PropertyFilter property) {
        String raw = property.firstValue();
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring cohort reference with non-numeric id: {}", raw);
            return Optional.empty();
        }
    }

    // ========================================================================
    // Properties
    // ========================================================================

    private PersonPredicate personProperty(PropertyFilter property) {
        requireKey(property);
        PropertyOperator operator = parseOperator(property);
        Optional<ValueTest> test = valueTest(property, operator);
        if (test.isEmpty()) {
            return PersonPredicate.NONE;
        }
        PersonPredicate predicate = new PersonPredicate.Property(property.key(), test.get());
        return operator.isNegative() ? PersonPredicate.not(predicate) : predicate;
    }

    private EventPredicate eventProperty(PropertyFilter property) {
        PropertyType type = parseType(property);
        if (type == PropertyType.ELEMENT) {
            return elementProperty(property);
        }
        if (type != PropertyType.EVENT) {
            throw new InvalidCohortDefinitionException(
                "Property type '" + property.type() + "' cannot filter events");
        }
        requireKey(property);
        PropertyOperator operator = parseOperator(property);
        Optional<ValueTest> test = valueTest(property, operator);
        if (test.isEmpty()) {
            return EventPredicate.NONE;
        }
        EventPredicate predicate = new EventPredicate.Property(property.key(), test.get());
        return operator.isNegative() ? EventPredicate.not(predicate) : predicate;
    }

    /**
     * Element filters match the autocapture chain: {@code tag_name} against the
     * element tag, {@code text} and {@code href} against the quoted attributes.
     */
    private EventPredicate elementProperty(PropertyFilter property) {
        List<String> values = property.values();
        if (values.isEmpty()) {
            return EventPredicate.NONE;
        }
        List<String> alternatives = new ArrayList<>();
        for (String value : values) {
            String quoted = Pattern.quote(value);
            switch (property.key() == null ? "" : property.key()) {
                case "tag_name" -> alternatives.add("(^|;)" + quoted + "(\\.|$|;|:)");
                case "text" -> alternatives.add("text=\"" + quoted + "\"");
                case "href" -> alternatives.add("href=\"" + quoted + "\"");
                default -> {
                    log.warn("Unsupported element property key '{}', clause matches nothing", property.key());
                    return EventPredicate.NONE;
                }
            }
        }
        EventPredicate predicate = new EventPredicate.ElementsChainMatches(String.join("|", alternatives));
        PropertyOperator operator = parseOperator(property);
        return operator == PropertyOperator.IS_NOT ? EventPredicate.not(predicate) : predicate;
    }

    /**
     * The positive value test for an operator, or empty when the clause must
     * match nobody (bad regex, non-numeric comparison operand, missing value).
     */
    private Optional<ValueTest> valueTest(PropertyFilter property, PropertyOperator operator) {
        List<String> values = property.values();
        return switch (operator) {
            case EXACT, IS_NOT -> values.isEmpty()
                ? Optional.empty()
                : Optional.of(new ValueTest.OneOf(values));
            case ICONTAINS, NOT_ICONTAINS -> values.isEmpty()
                ? Optional.empty()
                : Optional.of(new ValueTest.ContainsIgnoreCase(values.get(0).toLowerCase(Locale.ROOT)));
            case REGEX, NOT_REGEX -> regex(property.key(), property.firstValue());
            case GT -> numeric(property.key(), property.firstValue(), ValueTest.Comparison.GREATER_THAN);
            case LT -> numeric(property.key(), property.firstValue(), ValueTest.Comparison.LESS_THAN);
            case IS_SET, IS_NOT_SET -> Optional.of(new ValueTest.Present());
        };
    }

    private Optional<ValueTest> regex(String key, String pattern) {
        if (pattern == null) {
            return Optional.empty();
        }
        try {
            Pattern.compile(pattern);
            return Optional.of(new ValueTest.Matches(pattern));
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regex for property '{}', clause matches nothing: {}", key, e.getDescription());
            return Optional.empty();
        }
    }

    private Optional<ValueTest> numeric(String key, String operand, ValueTest.Comparison comparison) {
        if (operand == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ValueTest.NumericCompare(comparison, Double.parseDouble(operand.trim())));
        } catch (NumberFormatException e) {
            log.debug("Non-numeric operand '{}' for property '{}', clause matches nothing", operand, key);
            return Optional.empty();
        }
    }

    // ========================================================================
    // Behavioral clauses
    // ========================================================================

    private EventPredicate actionMatch(Long actionId, long teamId) {
        Action action = actionRepository.findByIdAndTeamIdAndDeletedFalse(actionId, teamId)
            .orElseThrow(() -> new MissingActionException(actionId));

        List<EventPredicate> steps = new ArrayList<>();
        for (ActionStep step : codec.readSteps(action)) {
            steps.add(actionStep(step));
        }
        return EventPredicate.or(steps);
    }

    private EventPredicate actionStep(ActionStep step) {
        List<EventPredicate> terms = new ArrayList<>();
        if (step.event() != null && !step.event().isBlank()) {
            terms.add(new EventPredicate.NameIs(step.event()));
        }
        if (step.url() != null && !step.url().isBlank()) {
            terms.add(urlMatch(step));
        }
        for (PropertyFilter property : step.properties()) {
            terms.add(eventProperty(property));
        }
        return EventPredicate.and(terms);
    }

    private EventPredicate urlMatch(ActionStep step) {
        UrlMatching matching;
        try {
            matching = UrlMatching.fromValue(step.urlMatching());
        } catch (IllegalArgumentException e) {
            throw new InvalidCohortDefinitionException(e.getMessage(), e);
        }
        return switch (matching) {
            case EXACT -> new EventPredicate.Property(CURRENT_URL, new ValueTest.OneOf(List.of(step.url())));
            case CONTAINS -> new EventPredicate.Property(CURRENT_URL,
                new ValueTest.ContainsIgnoreCase(step.url().toLowerCase(Locale.ROOT)));
            case REGEX -> regex(CURRENT_URL, step.url())
                .<EventPredicate>map(test -> new EventPredicate.Property(CURRENT_URL, test))
                .orElse(EventPredicate.NONE);
        };
    }

    private List<EventPredicate> timeWindow(CohortGroup group) {
        List<EventPredicate> window = new ArrayList<>();
        if (group.days() != null) {
            Instant now = clock.instant();
            window.add(new EventPredicate.OccurredAtOrAfter(now.minus(Duration.ofDays(group.days()))));
            window.add(new EventPredicate.OccurredAtOrBefore(now));
        } else {
            if (group.startDate() != null && !group.startDate().isBlank()) {
                window.add(new EventPredicate.OccurredAtOrAfter(parseTimestamp(group.startDate())));
            }
            if (group.endDate() != null && !group.endDate().isBlank()) {
                window.add(new EventPredicate.OccurredAtOrBefore(parseTimestamp(group.endDate())));
            }
        }
        return window;
    }

    /**
     * Accepts {@code yyyy-MM-ddTHH:mm:ss} (UTC), an ISO timestamp with offset, or a plain date.
     */
    static Instant parseTimestamp(String raw) {
        String value = raw.trim();
        DateTimeParseException failure = null;
        for (Function<String, Instant> format : TIMESTAMP_FORMATS) {
            try {
                return format.apply(value);
            } catch (DateTimeParseException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        throw new InvalidCohortDefinitionException("Invalid cohort date: " + raw, failure);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static PersonPredicate performed(EventPredicate filter) {
        if (filter instanceof EventPredicate.Constant constant && !constant.value()) {
            return PersonPredicate.NONE;
        }
        return new PersonPredicate.PerformedEvent(filter, null);
    }

    private PersonPredicate negate(PropertyFilter property, PersonPredicate predicate) {
        // a missing cohort stays "matches nobody" even when negated
        if (predicate instanceof PersonPredicate.Constant) {
            return predicate;
        }
        return property.isNegated() ? PersonPredicate.not(predicate) : predicate;
    }

    private static PropertyType parseType(PropertyFilter property) {
        try {
            return property.propertyType();
        } catch (IllegalArgumentException e) {
            throw new InvalidCohortDefinitionException(e.getMessage(), e);
        }
    }

    private static PropertyOperator parseOperator(PropertyFilter property) {
        try {
            return property.propertyOperator();
        } catch (IllegalArgumentException e) {
            throw new InvalidCohortDefinitionException(e.getMessage(), e);
        }
    }

    private static void requireKey(PropertyFilter property) {
        if (property.key() == null || property.key().isBlank()) {
            throw new InvalidCohortDefinitionException("Property filter requires a key");
        }
    }
}
