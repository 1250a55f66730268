package com.docstream.shared.repository;

import com.docstream.shared.model.DocumentJob;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for DocumentJob entities.
 */
@Repository
public interface DocumentJobRepository extends JpaRepository<DocumentJob, Long> {

    Optional<DocumentJob> findByJobUuid(UUID jobUuid);

    boolean existsByJobUuid(UUID jobUuid);

    /**
     * Loads a job with a row lock held until the surrounding transaction ends.
     * Every status transition goes through this method so concurrent writers serialize on the row.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM DocumentJob j WHERE j.jobUuid = :jobUuid")
    Optional<DocumentJob> findByJobUuidForUpdate(@Param("jobUuid") UUID jobUuid);

    @Query("SELECT j.sourceLocation FROM DocumentJob j WHERE j.ttlExpiresAt IS NOT NULL AND j.ttlExpiresAt <= :now")
    List<String> findExpiredSourceLocations(@Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM DocumentJob j WHERE j.ttlExpiresAt IS NOT NULL AND j.ttlExpiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);

    /**
     * Counts live (non-expired) jobs grouped by status. Each row is {JobStatus, Long}.
     */
    @Query("SELECT j.status, COUNT(j) FROM DocumentJob j " +
            "WHERE j.ttlExpiresAt IS NULL OR j.ttlExpiresAt > :now GROUP BY j.status")
    List<Object[]> countLiveByStatus(@Param("now") Instant now);
}
