package com.docstream.shared.repository;

import com.docstream.shared.model.StreamEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface StreamEntryRepository extends JpaRepository<StreamEntry, Long> {

    Optional<StreamEntry> findFirstByStreamNameAndPositionGreaterThanOrderByPositionAsc(String streamName, long position);

    Optional<StreamEntry> findByStreamNameAndPosition(String streamName, long position);

    long countByStreamName(String streamName);

    /**
     * Trims the acknowledged tail of a stream: entries at or behind {@code upToPosition}
     * (the slowest group cursor), older than {@code appendedBefore}, with no ownership record left.
     */
    @Modifying
    @Query(value = "DELETE FROM stream_entries e " +
            "WHERE e.stream_name = :streamName AND e.position <= :upToPosition AND e.appended_at < :appendedBefore " +
            "AND NOT EXISTS (SELECT 1 FROM pending_entries p JOIN consumer_groups g ON p.group_id = g.id " +
            "WHERE g.stream_name = e.stream_name AND p.entry_position = e.position)", nativeQuery = true)
    int trimAcknowledged(@Param("streamName") String streamName,
                         @Param("upToPosition") long upToPosition,
                         @Param("appendedBefore") Instant appendedBefore);
}
