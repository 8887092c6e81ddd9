package com.cohortengine.controller;

import com.cohortengine.dto.mapper.CohortMapper;
import com.cohortengine.dto.request.CreateCohortRequest;
import com.cohortengine.dto.request.InsertStaticMembersRequest;
import com.cohortengine.dto.request.UpdateCohortRequest;
import com.cohortengine.dto.response.CalculationDto;
import com.cohortengine.dto.response.CohortDto;
import com.cohortengine.dto.response.MembershipDto;
import com.cohortengine.dto.response.PredicateDto;
import com.cohortengine.dto.response.RecalculationDto;
import com.cohortengine.exception.CohortValidationException;
import com.cohortengine.exception.CyclicCohortException;
import com.cohortengine.model.cohort.Cohort;
import com.cohortengine.service.CohortCalculationService;
import com.cohortengine.service.CohortMembershipQueryService;
import com.cohortengine.service.CohortService;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for cohorts.
 * Provides CRUD, recalculation, static membership and membership lookups.
 */
@RestController
@RequestMapping("/api/cohorts")
public class CohortController {

    private final CohortService cohortService;
    private final CohortCalculationService calculationService;
    private final CohortMembershipQueryService membershipQueryService;
    private final CohortMapper cohortMapper;

    public CohortController(
            CohortService cohortService,
            CohortCalculationService calculationService,
            CohortMembershipQueryService membershipQueryService,
            CohortMapper cohortMapper) {
        this.cohortService = cohortService;
        this.calculationService = calculationService;
        this.membershipQueryService = membershipQueryService;
        this.cohortMapper = cohortMapper;
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    /**
     * Get all live cohorts of a team.
     */
    @GetMapping
    public ResponseEntity<List<CohortDto>> getCohorts(@RequestParam long teamId) {
        return ResponseEntity.ok(cohortMapper.toDtoList(cohortService.listByTeam(teamId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CohortDto> getCohort(@PathVariable long id) {
        return ResponseEntity.ok(cohortMapper.toDto(cohortService.get(id)));
    }

    /**
     * Calculation history, newest first.
     */
    @GetMapping("/{id}/calculations")
    public ResponseEntity<List<CalculationDto>> getCalculations(@PathVariable long id) {
        return ResponseEntity.ok(cohortMapper.toCalculationDtoList(cohortService.calculations(id)));
    }

    /**
     * SQL condition over {@code person_id} for embedding cohort membership in other queries.
     */
    @GetMapping("/{id}/predicate")
    public ResponseEntity<PredicateDto> getPredicate(@PathVariable long id) {
        return ResponseEntity.ok(cohortMapper.toDto(id, membershipQueryService.resolvePredicateSql(id)));
    }

    @GetMapping("/{id}/members")
    public ResponseEntity<Map<String, Object>> getMembers(
            @PathVariable long id,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        if (limit <= 0 || offset < 0) {
            throw new IllegalArgumentException("limit must be positive and offset non-negative");
        }
        return ResponseEntity.ok(Map.of(
            "count", membershipQueryService.countMembers(id),
            "members", membershipQueryService.members(id, limit, offset)
        ));
    }

    @GetMapping("/{id}/members/{personId}")
    public ResponseEntity<MembershipDto> isMember(@PathVariable long id, @PathVariable UUID personId) {
        return ResponseEntity.ok(new MembershipDto(id, personId, membershipQueryService.isMember(id, personId)));
    }

    /**
     * Cohorts a person belongs to.
     */
    @GetMapping("/person/{personId}")
    public ResponseEntity<List<Long>> getCohortsForPerson(@PathVariable UUID personId, @RequestParam long teamId) {
        return ResponseEntity.ok(membershipQueryService.cohortIdsForPerson(teamId, personId));
    }

    // ========================================================================
    // Write Operations
    // ========================================================================

    @PostMapping
    public ResponseEntity<CohortDto> createCohort(@Valid @RequestBody CreateCohortRequest request) {
        Cohort saved = cohortService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(cohortMapper.toDto(cohortService.get(saved.getId())));
    }

    @PutMapping("/{id}")
    public ResponseEntity<CohortDto> updateCohort(@PathVariable long id, @RequestBody UpdateCohortRequest request) {
        return ResponseEntity.ok(cohortMapper.toDto(cohortService.update(id, request)));
    }

    /**
     * Logical delete.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteCohort(@PathVariable long id) {
        cohortService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // ========================================================================
    // Recalculation
    // ========================================================================

    /**
     * Recalculate membership. With {@code async=true} the definition is
     * validated before the request returns and the work continues in the background.
     */
    @PostMapping("/{id}/recalculate")
    public ResponseEntity<?> recalculate(
            @PathVariable long id,
            @RequestParam(required = false, defaultValue = "false") boolean async) {
        if (async) {
            calculationService.recalculateAsync(id);
            return ResponseEntity.accepted().body(Map.of("cohortId", id, "status", "accepted"));
        }
        RecalculationDto result = cohortMapper.toDto(calculationService.recalculate(id));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/team/{teamId}/recalculate")
    public ResponseEntity<List<RecalculationDto>> recalculateTeam(@PathVariable long teamId) {
        return ResponseEntity.ok(calculationService.recalculateTeam(teamId).stream()
            .map(cohortMapper::toDto)
            .toList());
    }

    // ========================================================================
    // Static Membership
    // ========================================================================

    @PostMapping("/{id}/static-members")
    public ResponseEntity<Map<String, Object>> insertStaticMembers(
            @PathVariable long id,
            @Valid @RequestBody InsertStaticMembersRequest request) {
        int inserted = cohortService.insertStaticMembers(id, request.personIds());
        return ResponseEntity.ok(Map.of(
            "inserted", inserted,
            "memberCount", membershipQueryService.countMembers(id)
        ));
    }

    @DeleteMapping("/{id}/static-members/{personId}")
    public ResponseEntity<Void> removeStaticMember(@PathVariable long id, @PathVariable UUID personId) {
        if (!cohortService.removeStaticMember(id, personId)) {
            throw new EntityNotFoundException("Person " + personId + " is not in cohort " + id);
        }
        return ResponseEntity.noContent().build();
    }

    // ========================================================================
    // Error Handling
    // ========================================================================

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(EntityNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(CyclicCohortException.class)
    public ResponseEntity<Map<String, Object>> handleCycle(CyclicCohortException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", ex.getMessage(), "path", ex.getPath()));
    }

    @ExceptionHandler({CohortValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", ex.getMessage()));
    }
}
