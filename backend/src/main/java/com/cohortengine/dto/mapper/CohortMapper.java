package com.cohortengine.dto.mapper;

import com.cohortengine.dto.response.CalculationDto;
import com.cohortengine.dto.response.CohortDto;
import com.cohortengine.dto.response.PredicateDto;
import com.cohortengine.dto.response.RecalculationDto;
import com.cohortengine.model.cohort.Cohort;
import com.cohortengine.model.cohort.CohortCalculation;
import com.cohortengine.service.CohortFiltersCodec;
import com.cohortengine.service.materialize.MembershipSnapshotResult;
import com.cohortengine.service.predicate.SqlFragment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper for converting cohort entities and results to DTOs.
 */
@Component
public class CohortMapper {

    private final CohortFiltersCodec codec;

    public CohortMapper(CohortFiltersCodec codec) {
        this.codec = codec;
    }

    public CohortDto toDto(Cohort entity) {
        if (entity == null) {
            return null;
        }
        return new CohortDto(
            entity.getId(),
            entity.getTeamId(),
            entity.getName(),
            entity.getDescription(),
            entity.isStatic(),
            entity.isStatic() ? null : codec.read(entity),
            entity.getVersion(),
            entity.getPendingVersion(),
            entity.isCalculating(),
            entity.getLastCalculation(),
            entity.getMemberCount(),
            entity.getErrorsCalculating(),
            entity.getCreatedAt(),
            entity.getUpdatedAt()
        );
    }

    public List<CohortDto> toDtoList(List<Cohort> entities) {
        return entities.stream().map(this::toDto).toList();
    }

    public CalculationDto toDto(CohortCalculation entity) {
        return new CalculationDto(
            entity.getId(),
            entity.getVersion(),
            entity.getBaseVersion(),
            entity.getStatus().getValue(),
            entity.getStartedAt(),
            entity.getFinishedAt(),
            entity.getAddedCount(),
            entity.getRemovedCount(),
            entity.getMemberCount(),
            entity.getError()
        );
    }

    public List<CalculationDto> toCalculationDtoList(List<CohortCalculation> entities) {
        return entities.stream().map(this::toDto).toList();
    }

    public RecalculationDto toDto(MembershipSnapshotResult result) {
        return new RecalculationDto(
            result.cohortId(),
            result.version(),
            result.baseVersion(),
            result.status().getValue(),
            result.added(),
            result.removed(),
            result.memberCount(),
            result.elapsed().toMillis()
        );
    }

    public PredicateDto toDto(long cohortId, SqlFragment fragment) {
        return new PredicateDto(cohortId, fragment.sql(), fragment.parameters());
    }
}
