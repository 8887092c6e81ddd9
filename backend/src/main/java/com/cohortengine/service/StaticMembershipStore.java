package com.cohortengine.service;

import com.cohortengine.config.MaterializationSettings;
import com.cohortengine.model.cohort.StaticCohortPerson;
import com.cohortengine.repository.StaticCohortPersonRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Explicit person lists of static cohorts.
 *
 * Inserts are idempotent: persons already in the cohort are skipped, so
 * repeating an insert leaves membership unchanged. Large inputs are written
 * in chunks, each in its own transaction.
 */
@Service
@Slf4j
public class StaticMembershipStore {

    private final StaticCohortPersonRepository repository;
    private final MaterializationSettings settings;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public StaticMembershipStore(
            StaticCohortPersonRepository repository,
            MaterializationSettings settings,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.repository = repository;
        this.settings = settings;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Add persons to a static cohort.
     *
     * @return number of persons that were not members before
     */
    public int insertMembers(long cohortId, long teamId, Iterable<UUID> personIds) {
        Set<UUID> unique = new LinkedHashSet<>();
        int skipped = 0;
        for (UUID personId : personIds) {
            if (personId == null) {
                skipped++;
            } else {
                unique.add(personId);
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} null person ids for static cohort {}", skipped, cohortId);
        }

        List<UUID> all = new ArrayList<>(unique);
        int chunkSize = settings.staticInsertChunkSize();
        int inserted = 0;
        for (int from = 0; from < all.size(); from += chunkSize) {
            List<UUID> chunk = all.subList(from, Math.min(from + chunkSize, all.size()));
            inserted += insertChunk(cohortId, teamId, chunk);
        }
        log.info("Inserted {} of {} persons into static cohort {}", inserted, unique.size(), cohortId);
        return inserted;
    }

    @Transactional
    public boolean removeMember(long cohortId, long teamId, UUID personId) {
        return repository.deleteMember(cohortId, teamId, personId) > 0;
    }

    public long countMembers(long cohortId, long teamId) {
        return repository.countDistinctMembers(cohortId, teamId);
    }

    public boolean isMember(long cohortId, long teamId, UUID personId) {
        return repository.existsByCohortIdAndTeamIdAndPersonId(cohortId, teamId, personId);
    }

    private int insertChunk(long cohortId, long teamId, List<UUID> chunk) {
        try {
            return writeChunk(cohortId, teamId, chunk);
        } catch (DataIntegrityViolationException e) {
            // a concurrent insert added some of these persons; re-read and write the rest
            log.warn("Concurrent insert into static cohort {}, retrying chunk of {}", cohortId, chunk.size());
            return writeChunk(cohortId, teamId, chunk);
        }
    }

    private int writeChunk(long cohortId, long teamId, List<UUID> chunk) {
        Integer written = transactionTemplate.execute(status -> {
            Set<UUID> existing = new HashSet<>(repository.findExistingPersonIds(cohortId, chunk));
            List<StaticCohortPerson> rows = new ArrayList<>();
            for (UUID personId : chunk) {
                if (!existing.contains(personId)) {
                    rows.add(StaticCohortPerson.builder()
                        .id(UUID.randomUUID())
                        .personId(personId)
                        .cohortId(cohortId)
                        .teamId(teamId)
                        .insertedAt(clock.instant())
                        .build());
                }
            }
            repository.saveAll(rows);
            repository.flush();
            return rows.size();
        });
        return written == null ? 0 : written;
    }
}
