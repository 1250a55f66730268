package com.docstream.shared.repository;

import com.docstream.shared.model.JobStream;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JobStreamRepository extends JpaRepository<JobStream, Long> {

    Optional<JobStream> findByName(String name);

    /**
     * Locks the stream head. Appends serialize here, so positions commit in order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM JobStream s WHERE s.name = :name")
    Optional<JobStream> findByNameForUpdate(@Param("name") String name);

    @Modifying
    @Query(value = "INSERT INTO job_streams (name, last_position, created_at) VALUES (:name, 0, now()) " +
            "ON CONFLICT (name) DO NOTHING", nativeQuery = true)
    int createIfAbsent(@Param("name") String name);
}
