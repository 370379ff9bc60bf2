package com.yerin.syncwatch.repository;

import com.yerin.syncwatch.domain.TrackedRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface TrackedRecordRepository extends JpaRepository<TrackedRecord, Long> {
    Optional<TrackedRecord> findByEntityTypeAndExternalId(String entityType, String externalId);

    @Query("""
       select r.entityType, count(r)
         from TrackedRecord r
        group by r.entityType
       """)
    List<Object[]> countGroupedByEntityType();
}
