package com.cohortengine.service.predicate;

import com.cohortengine.exception.InvalidCohortDefinitionException;
import com.cohortengine.exception.InvalidCountOperatorException;
import com.cohortengine.exception.MissingActionException;
import com.cohortengine.model.cohort.Action;
import com.cohortengine.model.enums.CountOperator;
import com.cohortengine.model.filter.CohortGroup;
import com.cohortengine.model.filter.PropertyFilter;
import com.cohortengine.repository.ActionRepository;
import com.cohortengine.service.CohortFiltersCodec;
import com.cohortengine.service.predicate.PersonPredicate.CountCondition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PredicateCompilerTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final long TEAM = 1L;

    @Mock
    private ActionRepository actionRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private PredicateCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new PredicateCompiler(
            actionRepository,
            new CohortFiltersCodec(objectMapper),
            new SqlPredicateRenderer(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private PropertyFilter property(String json) throws Exception {
        return objectMapper.readValue(json, PropertyFilter.class);
    }

    private CohortGroup group(String json) throws Exception {
        return objectMapper.readValue(json, CohortGroup.class);
    }

    // ========================================================================
    // Person properties
    // ========================================================================

    @Test
    void compileProperty_exact_matchesValue() {
        PersonPredicate predicate = compiler.compileProperty(PropertyFilter.person("email", "exact", "a@b.com"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.Property("email", new ValueTest.OneOf(List.of("a@b.com"))));
    }

    @Test
    void compileProperty_absentOperator_defaultsToExact() {
        PersonPredicate predicate = compiler.compileProperty(PropertyFilter.person("plan", null, "pro"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.Property("plan", new ValueTest.OneOf(List.of("pro"))));
    }

    @Test
    void compileProperty_exactList_matchesAnyListedValue() throws Exception {
        PersonPredicate predicate = compiler.compileProperty(
            property("{\"key\":\"plan\",\"value\":[\"pro\",\"team\"],\"type\":\"person\"}"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.Property("plan", new ValueTest.OneOf(List.of("pro", "team"))));
    }

    @Test
    void compileProperty_isNot_negatesExact() {
        PersonPredicate predicate = compiler.compileProperty(PropertyFilter.person("plan", "is_not", "free"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.Not(
            new PersonPredicate.Property("plan", new ValueTest.OneOf(List.of("free")))));
    }

    @Test
    void compileProperty_icontains_lowercasesNeedle() {
        PersonPredicate predicate = compiler.compileProperty(PropertyFilter.person("email", "icontains", "GMail"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.Property("email", new ValueTest.ContainsIgnoreCase("gmail")));
    }

    @Test
    void compileProperty_validRegex_matchesPattern() {
        PersonPredicate predicate = compiler.compileProperty(PropertyFilter.person("email", "regex", ".*@acme\\.com$"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.Property("email", new ValueTest.Matches(".*@acme\\.com$")));
    }

    @Test
    void compileProperty_invalidRegex_matchesNobody() {
        assertThat(compiler.compileProperty(PropertyFilter.person("email", "regex", "("), TEAM))
            .isEqualTo(PersonPredicate.NONE);
        assertThat(compiler.compileProperty(PropertyFilter.person("email", "not_regex", "("), TEAM))
            .isEqualTo(PersonPredicate.NONE);
    }

    @Test
    void compileProperty_numericComparison() {
        assertThat(compiler.compileProperty(PropertyFilter.person("age", "gt", "30"), TEAM))
            .isEqualTo(new PersonPredicate.Property("age",
                new ValueTest.NumericCompare(ValueTest.Comparison.GREATER_THAN, 30.0)));
        assertThat(compiler.compileProperty(PropertyFilter.person("age", "lt", "2.5"), TEAM))
            .isEqualTo(new PersonPredicate.Property("age",
                new ValueTest.NumericCompare(ValueTest.Comparison.LESS_THAN, 2.5)));
    }

    @Test
    void compileProperty_nonNumericComparison_matchesNobody() {
        assertThat(compiler.compileProperty(PropertyFilter.person("age", "gt", "thirty"), TEAM))
            .isEqualTo(PersonPredicate.NONE);
    }

    @Test
    void compileProperty_isSetAndIsNotSet() {
        PersonPredicate isSet = compiler.compileProperty(PropertyFilter.person("email", "is_set", null), TEAM);
        PersonPredicate isNotSet = compiler.compileProperty(PropertyFilter.person("email", "is_not_set", null), TEAM);

        assertThat(isSet).isEqualTo(new PersonPredicate.Property("email", new ValueTest.Present()));
        assertThat(isNotSet).isEqualTo(new PersonPredicate.Not(isSet));
    }

    @Test
    void compileProperty_unknownOperator_throws() {
        assertThatThrownBy(() -> compiler.compileProperty(PropertyFilter.person("email", "startswith", "a"), TEAM))
            .isInstanceOf(InvalidCohortDefinitionException.class);
    }

    @Test
    void compileProperty_cohortReference_requiresGraphResolution() {
        assertThatThrownBy(() -> compiler.compileProperty(PropertyFilter.cohort(4L), TEAM))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========================================================================
    // Event, element and cohort-table properties
    // ========================================================================

    @Test
    void compileProperty_eventProperty_requiresMatchingEvent() throws Exception {
        PersonPredicate predicate = compiler.compileProperty(
            property("{\"key\":\"$browser\",\"value\":\"Chrome\",\"type\":\"event\"}"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.PerformedEvent(
            new EventPredicate.Property("$browser", new ValueTest.OneOf(List.of("Chrome"))), null));
    }

    @Test
    void compileProperty_elementTagName_matchesChain() throws Exception {
        PersonPredicate predicate = compiler.compileProperty(
            property("{\"key\":\"tag_name\",\"value\":\"button\",\"type\":\"element\"}"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.PerformedEvent(
            new EventPredicate.ElementsChainMatches("(^|;)\\Qbutton\\E(\\.|$|;|:)"), null));
    }

    @Test
    void compileProperty_elementHrefIsNot_negatesMatch() throws Exception {
        PersonPredicate predicate = compiler.compileProperty(
            property("{\"key\":\"href\",\"value\":\"/pricing\",\"operator\":\"is_not\",\"type\":\"element\"}"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.PerformedEvent(
            new EventPredicate.Not(new EventPredicate.ElementsChainMatches("href=\"\\Q/pricing\\E\"")), null));
    }

    @Test
    void compileProperty_unknownElementKey_matchesNobody() throws Exception {
        PersonPredicate predicate = compiler.compileProperty(
            property("{\"key\":\"attr_id\",\"value\":\"x\",\"type\":\"element\"}"), TEAM);

        assertThat(predicate).isEqualTo(PersonPredicate.NONE);
    }

    @Test
    void compileProperty_negatedStaticCohort() throws Exception {
        PersonPredicate predicate = compiler.compileProperty(
            property("{\"key\":\"id\",\"value\":3,\"type\":\"static-cohort\",\"negation\":true}"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.Not(new PersonPredicate.StaticCohortMember(3L)));
    }

    @Test
    void compileProperty_precalculatedCohortWithBadId_matchesNobody() throws Exception {
        PersonPredicate predicate = compiler.compileProperty(
            property("{\"key\":\"id\",\"value\":\"abc\",\"type\":\"precalculated-cohort\",\"negation\":true}"), TEAM);

        assertThat(predicate).isEqualTo(PersonPredicate.NONE);
    }

    // ========================================================================
    // Behavioral clauses
    // ========================================================================

    @Test
    void compileBehavioral_daysAndCount() {
        PersonPredicate predicate = compiler.compileBehavioral(CohortGroup.performedEvent("$pageview", 7, 2, "gte"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.PerformedEvent(
            new EventPredicate.AllOf(List.of(
                new EventPredicate.NameIs("$pageview"),
                new EventPredicate.OccurredAtOrAfter(NOW.minus(Duration.ofDays(7))),
                new EventPredicate.OccurredAtOrBefore(NOW))),
            new CountCondition(CountOperator.GTE, 2)));
    }

    @Test
    void compileBehavioral_absentCountOperator_meansEquals() {
        PersonPredicate predicate = compiler.compileBehavioral(CohortGroup.performedEvent("signup", null, 1, null), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.PerformedEvent(
            new EventPredicate.NameIs("signup"), new CountCondition(CountOperator.EQ, 1)));
    }

    @Test
    void compileBehavioral_withoutCount_requiresAnyEvent() {
        PersonPredicate predicate = compiler.compileBehavioral(CohortGroup.performedEvent("signup", null, null, null), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.PerformedEvent(new EventPredicate.NameIs("signup"), null));
    }

    @Test
    void compileBehavioral_bogusCountOperator_throws() {
        assertThatThrownBy(() -> compiler.compileBehavioral(CohortGroup.performedEvent("signup", 7, 1, "bogus"), TEAM))
            .isInstanceOf(InvalidCountOperatorException.class);
        assertThatThrownBy(() -> compiler.compileBehavioral(CohortGroup.performedEvent("signup", 7, 1, "gt"), TEAM))
            .isInstanceOf(InvalidCountOperatorException.class);
    }

    @Test
    void compileBehavioral_explicitDateRange() throws Exception {
        PersonPredicate predicate = compiler.compileBehavioral(
            group("{\"event_id\":\"purchase\",\"start_date\":\"2024-01-01T08:30:00\",\"end_date\":\"2024-02-01\"}"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.PerformedEvent(
            new EventPredicate.AllOf(List.of(
                new EventPredicate.NameIs("purchase"),
                new EventPredicate.OccurredAtOrAfter(Instant.parse("2024-01-01T08:30:00Z")),
                new EventPredicate.OccurredAtOrBefore(Instant.parse("2024-02-01T00:00:00Z")))),
            null));
    }

    @Test
    void compileBehavioral_invalidDate_throws() throws Exception {
        CohortGroup group = group("{\"event_id\":\"purchase\",\"start_date\":\"last tuesday\"}");

        assertThatThrownBy(() -> compiler.compileBehavioral(group, TEAM))
            .isInstanceOf(InvalidCohortDefinitionException.class);
    }

    @Test
    void compileBehavioral_action_matchesAnyStep() throws Exception {
        Action action = Action.builder()
            .id(5L)
            .teamId(TEAM)
            .name("Signed up")
            .steps("[{\"event\":\"$pageview\",\"url\":\"/signup\",\"url_matching\":\"contains\"},"
                + "{\"event\":\"signed_up\"}]")
            .build();
        when(actionRepository.findByIdAndTeamIdAndDeletedFalse(5L, TEAM)).thenReturn(Optional.of(action));

        PersonPredicate predicate = compiler.compileBehavioral(group("{\"action_id\":5}"), TEAM);

        assertThat(predicate).isEqualTo(new PersonPredicate.PerformedEvent(
            new EventPredicate.AnyOf(List.of(
                new EventPredicate.AllOf(List.of(
                    new EventPredicate.NameIs("$pageview"),
                    new EventPredicate.Property("$current_url", new ValueTest.ContainsIgnoreCase("/signup")))),
                new EventPredicate.NameIs("signed_up"))),
            null));
    }

    @Test
    void compileBehavioral_missingAction_throws() throws Exception {
        when(actionRepository.findByIdAndTeamIdAndDeletedFalse(9L, TEAM)).thenReturn(Optional.empty());
        CohortGroup group = group("{\"action_id\":9,\"days\":30}");

        assertThatThrownBy(() -> compiler.compileBehavioral(group, TEAM))
            .isInstanceOf(MissingActionException.class)
            .hasMessageContaining("9");
    }

    @Test
    void compileBehavioral_withoutEventOrAction_throws() {
        assertThatThrownBy(() -> compiler.compileBehavioral(CohortGroup.ofProperties(List.of()), TEAM))
            .isInstanceOf(InvalidCohortDefinitionException.class);
    }

    // ========================================================================
    // Rendering shortcuts
    // ========================================================================

    @Test
    void compile_propertyRendersWithBoundValues() {
        SqlFragment fragment = compiler.compile(PropertyFilter.person("email", "exact", "x'; DROP TABLE person; --"), TEAM);

        assertThat(fragment.sql()).contains("EXISTS").doesNotContain("DROP TABLE");
        assertThat(fragment.parameters()).containsValue(List.of("x'; DROP TABLE person; --"));
    }
}
