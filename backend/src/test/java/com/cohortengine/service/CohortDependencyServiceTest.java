package com.cohortengine.service;

import com.cohortengine.model.cohort.Cohort;
import com.cohortengine.repository.CohortRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CohortDependencyServiceTest {

    private static final long TEAM = 1L;

    @Mock
    private CohortRepository cohortRepository;

    private CohortDependencyService dependencyService;

    // 1 -> 2 -> 3, 4 -> 3 (static-cohort), 5 has no references
    private final Cohort one = referencing(1L, "cohort", 2L);
    private final Cohort two = referencing(2L, "cohort", 3L);
    private final Cohort three = Cohort.builder().id(3L).teamId(TEAM).name("list").isStatic(true).build();
    private final Cohort four = referencing(4L, "static-cohort", 3L);
    private final Cohort five = Cohort.builder().id(5L).teamId(TEAM).filters("{\"groups\":[]}").build();

    @BeforeEach
    void setUp() {
        dependencyService = new CohortDependencyService(cohortRepository, new CohortFiltersCodec(new ObjectMapper()));
    }

    private static Cohort referencing(long id, String type, long referenced) {
        String filters = "{\"groups\":[{\"properties\":[{\"key\":\"id\",\"value\":" + referenced
            + ",\"type\":\"" + type + "\"}]}]}";
        return Cohort.builder().id(id).teamId(TEAM).name("cohort " + id).filters(filters).build();
    }

    @Test
    void referencedCohortIds_ignoresSelfReference() {
        Cohort self = referencing(6L, "cohort", 6L);

        assertThat(dependencyService.referencedCohortIds(one)).containsExactly(2L);
        assertThat(dependencyService.referencedCohortIds(four)).containsExactly(3L);
        assertThat(dependencyService.referencedCohortIds(self)).isEmpty();
    }

    @Test
    void dependencies_areTransitive() {
        when(cohortRepository.findByIdAndDeletedFalse(1L)).thenReturn(Optional.of(one));
        when(cohortRepository.findByIdAndDeletedFalse(2L)).thenReturn(Optional.of(two));
        when(cohortRepository.findByIdAndDeletedFalse(3L)).thenReturn(Optional.of(three));

        assertThat(dependencyService.dependencies(1L)).containsExactlyInAnyOrder(2L, 3L);
    }

    @Test
    void dependents_areTransitive() {
        when(cohortRepository.findByTeamIdAndDeletedFalseOrderById(TEAM))
            .thenReturn(List.of(one, two, three, four, five));

        assertThat(dependencyService.dependents(TEAM, 3L)).containsExactlyInAnyOrder(1L, 2L, 4L);
        assertThat(dependencyService.dependents(TEAM, 1L)).isEmpty();
    }

    @Test
    void sortTopologically_placesDependenciesFirst() {
        List<Cohort> sorted = dependencyService.sortTopologically(List.of(one, four, five, two, three));

        List<Long> ids = sorted.stream().map(Cohort::getId).toList();
        assertThat(ids).containsExactlyInAnyOrder(1L, 2L, 3L, 4L, 5L);
        assertThat(ids.indexOf(3L)).isLessThan(ids.indexOf(2L));
        assertThat(ids.indexOf(2L)).isLessThan(ids.indexOf(1L));
        assertThat(ids.indexOf(3L)).isLessThan(ids.indexOf(4L));
    }

    @Test
    void sortTopologically_toleratesCycles() {
        Cohort a = referencing(10L, "cohort", 11L);
        Cohort b = referencing(11L, "cohort", 10L);

        assertThat(dependencyService.sortTopologically(List.of(a, b))).hasSize(2);
    }
}
