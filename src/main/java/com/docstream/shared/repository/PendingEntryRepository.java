package com.docstream.shared.repository;

import com.docstream.shared.model.PendingEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for ownership records of delivered, unacknowledged entries.
 */
@Repository
public interface PendingEntryRepository extends JpaRepository<PendingEntry, Long> {

    /**
     * Oldest released claim of the group, locked with SKIP LOCKED so two consumers never take the same one.
     */
    @Query(value = "SELECT * FROM pending_entries WHERE group_id = :groupId AND consumer_id IS NULL " +
            "ORDER BY entry_position ASC LIMIT 1 FOR UPDATE SKIP LOCKED", nativeQuery = true)
    Optional<PendingEntry> findFirstReleasedForUpdate(@Param("groupId") Long groupId);

    @Query(value = "SELECT id FROM pending_entries WHERE group_id = :groupId AND consumer_id IS NOT NULL " +
            "AND claimed_at < :cutoff ORDER BY entry_position ASC LIMIT :limit", nativeQuery = true)
    List<Long> findStaleClaimIds(@Param("groupId") Long groupId,
                                 @Param("cutoff") Instant cutoff,
                                 @Param("limit") int limit);

    /**
     * Locks one claim if it is still held and older than {@code cutoff}. Empty when it was acknowledged,
     * reclaimed or is locked by another reaper in the meantime.
     */
    @Query(value = "SELECT * FROM pending_entries WHERE id = :id AND consumer_id IS NOT NULL " +
            "AND claimed_at < :cutoff FOR UPDATE SKIP LOCKED", nativeQuery = true)
    Optional<PendingEntry> findStaleClaimForUpdate(@Param("id") Long id, @Param("cutoff") Instant cutoff);

    /**
     * Acknowledges an entry. Matches on the delivery attempt too, so a superseded claim deletes nothing.
     */
    @Modifying
    @Query("DELETE FROM PendingEntry p WHERE p.groupId = :groupId AND p.entryPosition = :position " +
            "AND p.consumerId = :consumerId AND p.deliveryAttempts = :attempt")
    int deleteOwned(@Param("groupId") Long groupId,
                    @Param("position") long position,
                    @Param("consumerId") String consumerId,
                    @Param("attempt") int attempt);

    long countByGroupId(Long groupId);

    /**
     * Pending counts per consumer. Each row is {consumerId, Long}; released claims have a null consumer.
     */
    @Query("SELECT p.consumerId, COUNT(p) FROM PendingEntry p WHERE p.groupId = :groupId GROUP BY p.consumerId")
    List<Object[]> countByConsumer(@Param("groupId") Long groupId);

    @Query("SELECT MIN(p.claimedAt) FROM PendingEntry p WHERE p.groupId = :groupId")
    Instant findOldestClaimedAt(@Param("groupId") Long groupId);
}
