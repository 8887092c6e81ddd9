package com.cohortengine.service;

import com.cohortengine.dto.request.CreateCohortRequest;
import com.cohortengine.dto.request.UpdateCohortRequest;
import com.cohortengine.exception.CyclicCohortException;
import com.cohortengine.exception.InvalidCountOperatorException;
import com.cohortengine.model.cohort.Cohort;
import com.cohortengine.model.filter.CohortFilters;
import com.cohortengine.service.materialize.MembershipSnapshotResult;
import com.cohortengine.support.StoreIntegrationTest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class CohortScenarioTest extends StoreIntegrationTest {

    @Autowired
    private CohortService cohortService;

    @Autowired
    private CohortCalculationService calculationService;

    @Autowired
    private CohortMembershipQueryService membershipQueryService;

    @Autowired
    private ObjectMapper objectMapper;

    private Cohort create(String filtersJson) throws Exception {
        CohortFilters filters = objectMapper.readValue(filtersJson, CohortFilters.class);
        return cohortService.create(new CreateCohortRequest(TEAM, "cohort", null, false, filters, null));
    }

    private Cohort createStatic(List<UUID> personIds) {
        return cohortService.create(new CreateCohortRequest(TEAM, "list", null, true, null, personIds));
    }

    private List<UUID> members(Cohort cohort) {
        return membershipQueryService.members(cohort.getId(), 100, 0);
    }

    private static String cohortReference(long id) {
        return "{\"key\":\"id\",\"value\":" + id + ",\"type\":\"cohort\"}";
    }

    @Test
    void pageviewsInWindow_countsOnlyEventsInsideTheWindow() throws Exception {
        Instant now = Instant.now();
        UUID frequent = person(Map.of());
        event(frequent, "$pageview", now.minus(Duration.ofDays(1)));
        event(frequent, "$pageview", now.minus(Duration.ofDays(3)));
        UUID once = person(Map.of());
        event(once, "$pageview", now.minus(Duration.ofDays(2)));
        for (int i = 0; i < 3; i++) {
            event(once, "$pageview", now.minus(Duration.ofDays(20 + i)));
        }
        UUID otherEvents = person(Map.of());
        event(otherEvents, "$autocapture", now.minus(Duration.ofDays(1)));
        event(otherEvents, "$autocapture", now.minus(Duration.ofDays(2)));

        Cohort cohort = create(groups("{\"event_id\":\"$pageview\",\"days\":7,\"count\":2,\"count_operator\":\"gte\"}"));
        MembershipSnapshotResult result = calculationService.recalculate(cohort.getId());

        assertThat(result.committed()).isTrue();
        assertThat(members(cohort)).containsExactly(frequent);
        assertThat(membershipQueryService.isMember(cohort.getId(), frequent)).isTrue();
        assertThat(membershipQueryService.isMember(cohort.getId(), once)).isFalse();
    }

    @Test
    void groupsAreOredAndPropertiesInAGroupAreAnded() throws Exception {
        UUID both = person(Map.of("plan", "pro", "country", "DE"));
        UUID proOnly = person(Map.of("plan", "pro"));
        UUID germanOnly = person(Map.of("country", "DE"));
        person(Map.of("plan", "free", "country", "FR"));

        Cohort either = create(groups(
            propertyGroup(personProperty("plan", "exact", "pro")),
            propertyGroup(personProperty("country", "exact", "DE"))));
        Cohort all = create(groups(
            propertyGroup(personProperty("plan", "exact", "pro"), personProperty("country", "exact", "DE"))));
        calculationService.recalculate(either.getId());
        calculationService.recalculate(all.getId());

        assertThat(members(either)).containsExactlyInAnyOrder(both, proOnly, germanOnly);
        assertThat(members(all)).containsExactly(both);
    }

    @Test
    void invalidRegex_failsClosedWithoutAffectingOtherGroups() throws Exception {
        UUID pro = person(Map.of("plan", "pro", "email", "a@acme.com"));
        person(Map.of("plan", "free", "email", "b@acme.com"));

        Cohort cohort = create(groups(
            propertyGroup(personProperty("email", "regex", "(")),
            propertyGroup(personProperty("plan", "exact", "pro"))));
        Cohort sameGroup = create(groups(
            propertyGroup(personProperty("email", "regex", "("), personProperty("plan", "exact", "pro"))));
        calculationService.recalculate(cohort.getId());
        calculationService.recalculate(sameGroup.getId());

        assertThat(members(cohort)).containsExactly(pro);
        assertThat(members(sameGroup)).isEmpty();
    }

    @Test
    void staticCohort_ignoresEventData_whileDynamicCohortFollowsIt() throws Exception {
        Instant now = Instant.now();
        UUID a = person(Map.of());
        UUID b = person(Map.of());
        UUID c = person(Map.of());
        Cohort staticCohort = createStatic(List.of(a, b));
        Cohort dynamicCohort = create(groups("{\"event_id\":\"signup\",\"days\":30}"));

        calculationService.recalculate(staticCohort.getId());
        calculationService.recalculate(dynamicCohort.getId());
        assertThat(members(staticCohort)).containsExactlyInAnyOrder(a, b);
        assertThat(members(dynamicCohort)).isEmpty();

        event(a, "signup", now.minus(Duration.ofHours(1)));
        event(c, "signup", now.minus(Duration.ofHours(2)));
        calculationService.recalculate(staticCohort.getId());
        calculationService.recalculate(dynamicCohort.getId());

        assertThat(members(staticCohort)).containsExactlyInAnyOrder(a, b);
        assertThat(members(dynamicCohort)).containsExactlyInAnyOrder(a, c);
        assertThat(cohortService.get(staticCohort.getId()).getMemberCount()).isEqualTo(2L);
    }

    @Test
    void cycleIntroducedBehindTheServiceLeavesPriorStateUntouched() throws Exception {
        UUID pro = person(Map.of("plan", "pro"));
        Cohort first = create(groups(propertyGroup(personProperty("plan", "exact", "pro"))));
        calculationService.recalculate(first.getId());
        Cohort second = create(groups(propertyGroup(cohortReference(first.getId()))));
        calculationService.recalculate(second.getId());

        Cohort before = cohortRepository.findById(first.getId()).orElseThrow();
        before.setFilters(groups(propertyGroup(cohortReference(second.getId()))));
        cohortRepository.save(before);

        assertThatThrownBy(() -> calculationService.recalculate(first.getId()))
            .isInstanceOf(CyclicCohortException.class);

        Cohort after = cohortRepository.findById(first.getId()).orElseThrow();
        assertThat(after.getVersion()).isEqualTo(1);
        assertThat(after.getPendingVersion()).isEqualTo(1);
        assertThat(after.getLastCalculation()).isEqualTo(before.getLastCalculation());
        assertThat(after.isCalculating()).isFalse();
        assertThat(members(first)).containsExactly(pro);
    }

    @Test
    void cyclicUpdate_isRejectedAndNotStored() throws Exception {
        Cohort first = create(groups(propertyGroup(personProperty("plan", "exact", "pro"))));
        Cohort second = create(groups(propertyGroup(cohortReference(first.getId()))));
        String original = cohortRepository.findById(first.getId()).orElseThrow().getFilters();
        CohortFilters cyclic = objectMapper.readValue(
            groups(propertyGroup(cohortReference(second.getId()))), CohortFilters.class);

        assertThatThrownBy(() -> cohortService.update(first.getId(), new UpdateCohortRequest(null, null, cyclic)))
            .isInstanceOf(CyclicCohortException.class)
            .hasMessageContaining(first.getId() + " -> " + second.getId() + " -> " + first.getId());

        assertThat(cohortRepository.findById(first.getId()).orElseThrow().getFilters()).isEqualTo(original);
    }

    @Test
    void selfReference_isVacuouslyTrue() throws Exception {
        UUID pro = person(Map.of("plan", "pro"));
        person(Map.of("plan", "free"));
        Cohort cohort = create(groups(propertyGroup(personProperty("plan", "exact", "pro"))));
        CohortFilters selfReferencing = objectMapper.readValue(groups(propertyGroup(
            cohortReference(cohort.getId()), personProperty("plan", "exact", "pro"))), CohortFilters.class);

        cohortService.update(cohort.getId(), new UpdateCohortRequest(null, null, selfReferencing));
        calculationService.recalculate(cohort.getId());

        assertThat(members(cohort)).containsExactly(pro);
    }

    @Test
    void bogusCountOperator_rejectsTheCohort() {
        assertThatThrownBy(() -> create(groups(
            "{\"event_id\":\"$pageview\",\"days\":7,\"count\":2,\"count_operator\":\"bogus\"}")))
            .isInstanceOf(InvalidCountOperatorException.class);

        assertThat(cohortRepository.count()).isZero();
    }

    @Test
    void asyncRecalculation_completesInBackground() throws Exception {
        UUID pro = person(Map.of("plan", "pro"));
        Cohort cohort = create(groups(propertyGroup(personProperty("plan", "exact", "pro"))));

        MembershipSnapshotResult result = calculationService.recalculateAsync(cohort.getId()).get(30, TimeUnit.SECONDS);

        assertThat(result.committed()).isTrue();
        assertThat(members(cohort)).containsExactly(pro);
    }

    @Test
    void recalculateTeam_skipsCyclicCohortsAndComputesTheRest() throws Exception {
        UUID pro = person(Map.of("plan", "pro"));
        Cohort base = create(groups(propertyGroup(personProperty("plan", "exact", "pro"))));
        Cohort dependent = create(groups(propertyGroup(cohortReference(base.getId()))));
        Cohort x = create(groups(propertyGroup(personProperty("plan", "exact", "free"))));
        Cohort y = create(groups(propertyGroup(cohortReference(x.getId()))));
        Cohort loop = cohortRepository.findById(x.getId()).orElseThrow();
        loop.setFilters(groups(propertyGroup(cohortReference(y.getId()))));
        cohortRepository.save(loop);

        List<MembershipSnapshotResult> results = calculationService.recalculateTeam(TEAM);

        assertThat(results).extracting(MembershipSnapshotResult::cohortId)
            .containsExactly(base.getId(), dependent.getId());
        assertThat(members(dependent)).containsExactly(pro);
    }
}
