package com.cohortengine.service.materialize;

import com.cohortengine.model.cohort.Cohort;
import com.cohortengine.model.cohort.CohortMembershipRow;
import com.cohortengine.model.enums.CalculationStatus;
import com.cohortengine.repository.CohortCalculationRepository;
import com.cohortengine.repository.CohortMembershipRepository;
import com.cohortengine.service.CohortMembershipQueryService;
import com.cohortengine.service.EventStoreQueryExecutor;
import com.cohortengine.service.predicate.PersonPredicate;
import com.cohortengine.service.predicate.ValueTest;
import com.cohortengine.support.StoreIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class IncrementalMaterializerFailureTest extends StoreIntegrationTest {

    private static final PersonPredicate PRO = new PersonPredicate.Property("plan", new ValueTest.OneOf(List.of("pro")));

    @SpyBean
    private EventStoreQueryExecutor queryExecutor;

    @Autowired
    private IncrementalMaterializer materializer;

    @Autowired
    private CohortMembershipRepository membershipRepository;

    @Autowired
    private CohortCalculationRepository calculationRepository;

    @Autowired
    private CohortMembershipQueryService membershipQueryService;

    @Autowired
    private NamedParameterJdbcTemplate namedJdbcTemplate;

    @Test
    void failedRun_isRecordedAndItsRowsStayInvisible() {
        UUID a = person(Map.of("plan", "pro"));
        UUID b = person(Map.of("plan", "pro"));
        UUID c = person(Map.of("plan", "pro"));
        Cohort cohort = dynamicCohort(groups(propertyGroup(personProperty("plan", "exact", "pro"))));

        // first page is written, second page fails
        doCallRealMethod()
            .doThrow(new DataAccessResourceFailureException("disk full"))
            .when(queryExecutor).batchUpdate(anyString(), any());

        assertThatThrownBy(() -> materializer.materialize(cohort.getId(), PRO, 1, 2))
            .isInstanceOf(DataAccessResourceFailureException.class);

        Cohort failed = cohortRepository.findById(cohort.getId()).orElseThrow();
        assertThat(failed.getVersion()).isNull();
        assertThat(failed.isCalculating()).isFalse();
        assertThat(failed.getErrorsCalculating()).isEqualTo(1);
        assertThat(calculationRepository.findByCohortIdAndStatus(cohort.getId(), CalculationStatus.FAILED))
            .singleElement()
            .satisfies(calculation -> assertThat(calculation.getError()).contains("disk full"));
        assertThat(membershipRepository.findByCohortIdAndVersion(cohort.getId(), 1)).hasSize(2);
        assertThat(calculationRepository.findCommittedVersions(cohort.getId())).isEmpty();

        reset(queryExecutor);
        MembershipSnapshotResult retry = materializer.materialize(cohort.getId(), PRO, 2, 2);

        assertThat(retry.committed()).isTrue();
        assertThat(retry.added()).isEqualTo(3);
        assertThat(membershipQueryService.members(cohort.getId(), 10, 0)).containsExactlyInAnyOrder(a, b, c);
        assertThat(membershipQueryService.countMembers(cohort.getId())).isEqualTo(3);
    }

    @Test
    void transientFailureMidBatch_rerunsThePageInAFreshTransaction() {
        UUID a = person(Map.of("plan", "pro"));
        UUID b = person(Map.of("plan", "pro"));
        UUID c = person(Map.of("plan", "pro"));
        Cohort cohort = dynamicCohort(groups(propertyGroup(personProperty("plan", "exact", "pro"))));

        // the first row of the first page lands, then the statement times out
        doAnswer(invocation -> {
            String sql = invocation.getArgument(0);
            SqlParameterSource[] batch = invocation.getArgument(1);
            namedJdbcTemplate.batchUpdate(sql, Arrays.copyOf(batch, 1));
            throw new QueryTimeoutException("statement timeout");
        }).doCallRealMethod().when(queryExecutor).batchUpdate(anyString(), any());

        MembershipSnapshotResult result = materializer.materialize(cohort.getId(), PRO, 1, 2);

        assertThat(result.committed()).isTrue();
        assertThat(result.added()).isEqualTo(3);
        assertThat(membershipRepository.findByCohortIdAndVersion(cohort.getId(), 1))
            .extracting(CohortMembershipRow::getPersonId)
            .containsExactlyInAnyOrder(a, b, c);
        verify(queryExecutor, times(3)).batchUpdate(anyString(), any());
    }
}
