package com.docstream.shared.repository;

import com.docstream.shared.model.ConsumerGroup;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ConsumerGroupRepository extends JpaRepository<ConsumerGroup, Long> {

    Optional<ConsumerGroup> findByStreamNameAndGroupName(String streamName, String groupName);

    /**
     * Looks up the id only, so a later locking read is the first to load the entity in the session.
     */
    @Query("SELECT g.id FROM ConsumerGroup g WHERE g.streamName = :streamName AND g.groupName = :groupName")
    Optional<Long> findIdByName(@Param("streamName") String streamName, @Param("groupName") String groupName);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM ConsumerGroup g WHERE g.id = :id")
    Optional<ConsumerGroup> findByIdForUpdate(@Param("id") Long id);

    /**
     * Creates the group positioned at {@code startPosition}; an existing group is left untouched.
     */
    @Modifying
    @Query(value = "INSERT INTO consumer_groups (stream_name, group_name, last_delivered_position, created_at) " +
            "VALUES (:streamName, :groupName, :startPosition, now()) " +
            "ON CONFLICT (stream_name, group_name) DO NOTHING", nativeQuery = true)
    int createIfAbsent(@Param("streamName") String streamName,
                       @Param("groupName") String groupName,
                       @Param("startPosition") long startPosition);

    @Query("SELECT MIN(g.lastDeliveredPosition) FROM ConsumerGroup g WHERE g.streamName = :streamName")
    Long findSlowestCursor(@Param("streamName") String streamName);
}
